package certa.modbuslink.codec;

import static certa.modbuslink.ModbusConstants.*;

import certa.modbuslink.InvalidResponseException;

/**
 * PDU sizes as a function of the function code and, for some codes, an embedded byte count.
 * RTU has no length field, so its reader must first get the header, then compute the rest.
 */
public final class PduLengths {

	private PduLengths() {}

	public static boolean isSupportedRequest(int function) {
		switch (function & 0xFF) {
		case FN_READ_COILS:
		case FN_READ_DISCRETE_INPUTS:
		case FN_READ_HOLDING_REGISTERS:
		case FN_READ_INPUT_REGISTERS:
		case FN_WRITE_SINGLE_COIL:
		case FN_WRITE_SINGLE_REGISTER:
		case FN_WRITE_MULTIPLE_COILS:
		case FN_WRITE_MULTIPLE_REGISTERS:
			return true;
		default:
			return false;
		}
	}

	/**
	 * @return number of PDU bytes (function code included) that must be available before
	 * {@link #pduSize(byte[], int, boolean)} can be called
	 */
	public static int headerSize(int function, boolean request) throws InvalidResponseException {
		function &= 0xFF;
		if (request) {
			switch (function) {
			case FN_READ_COILS:
			case FN_READ_DISCRETE_INPUTS:
			case FN_READ_HOLDING_REGISTERS:
			case FN_READ_INPUT_REGISTERS:
			case FN_WRITE_SINGLE_COIL:
			case FN_WRITE_SINGLE_REGISTER:
				return 1;
			case FN_WRITE_MULTIPLE_COILS:
			case FN_WRITE_MULTIPLE_REGISTERS:
				return 6; // function, address, count, byte count
			default:
				throw new InvalidResponseException("Unsupported request function: " + function);
			}
		}
		if ((function & EXCEPTION_FLAG) != 0)
			return 1;
		switch (function) {
		case FN_READ_COILS:
		case FN_READ_DISCRETE_INPUTS:
		case FN_READ_HOLDING_REGISTERS:
		case FN_READ_INPUT_REGISTERS:
			return 2; // function, byte count
		case FN_WRITE_SINGLE_COIL:
		case FN_WRITE_SINGLE_REGISTER:
		case FN_WRITE_MULTIPLE_COILS:
		case FN_WRITE_MULTIPLE_REGISTERS:
			return 1;
		default:
			throw new InvalidResponseException("Unsupported response function: " + function);
		}
	}

	/**
	 * @param buffer - holds at least {@link #headerSize(int, boolean)} bytes of PDU starting at <b>offset</b>
	 * @return total PDU size
	 */
	public static int pduSize(byte[] buffer, int offset, boolean request) throws InvalidResponseException {
		int function = buffer[offset] & 0xFF;
		int size;
		if (request) {
			if ((function == FN_WRITE_MULTIPLE_COILS) || (function == FN_WRITE_MULTIPLE_REGISTERS))
				size = 6 + (buffer[offset + 5] & 0xFF);
			else {
				headerSize(function, true); // rejects unknown codes
				size = 5;
			}
		} else if ((function & EXCEPTION_FLAG) != 0)
			size = 2; // function + exception code
		else if (function >= FN_READ_COILS && function <= FN_READ_INPUT_REGISTERS)
			size = 2 + (buffer[offset + 1] & 0xFF);
		else {
			headerSize(function, false);
			size = 5; // write responses echo address and value/count
		}
		if (size > MAX_PDU_SIZE)
			throw new InvalidResponseException("PDU too long: " + size);
		return size;
	}

}
