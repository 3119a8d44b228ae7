package certa.modbuslink.server;

import static certa.modbuslink.ModbusConstants.*;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import certa.modbuslink.ModbusExceptionCode;
import certa.modbuslink.ModbusPdu;

/**
 * Serves function codes 1-6, 15 and 16 from a {@link DataStore}.
 * Quantity is checked before the address range; truncated requests get no response.
 */
public class DefaultRequestProcessor implements RequestProcessor {
	private static final Logger log = LoggerFactory.getLogger(DefaultRequestProcessor.class);

	private final DataStore store;

	public DefaultRequestProcessor(DataStore store) {
		this.store = store;
	}

	public DataStore getStore() {
		return store;
	}

	protected ModbusPdu exception(ModbusPdu request, ModbusExceptionCode code) {
		log.debug("Sending exception {} ({})", code.getCode(), code.getDescription());
		return ModbusPdu.exception(request.getFunction(), code.getCode());
	}

	/**
	 * @return null if the range is valid, exception response otherwise
	 */
	private ModbusPdu checkRange(ModbusPdu request, int startAddr, int count, DataKind kind, String name, int maxCount) {
		if ((count < 1) || (count > maxCount)) {
			log.warn("Invalid {} count ({}). Must be 1..{}", name, count, maxCount);
			return exception(request, ModbusExceptionCode.ILLEGAL_DATA_VALUE);
		}
		if (!store.isValidRange(kind, startAddr, count)) {
			log.warn("Invalid {} range ({} - {})", name, startAddr, startAddr + count - 1);
			return exception(request, ModbusExceptionCode.ILLEGAL_DATA_ADDRESS);
		}
		return null;
	}

	private boolean validPduSize(ModbusPdu pdu, int expectedSize) {
		if (pdu.getPduSize() < expectedSize) {
			log.warn("Invalid PDU size ({}). Must be {}", pdu.getPduSize(), expectedSize);
			return false;
		}
		return true;
	}

	private ModbusPdu storeFailed(ModbusPdu request, String what, RuntimeException e) {
		log.warn("{} failed: {}", what, e.toString());
		return exception(request, ModbusExceptionCode.SLAVE_DEVICE_FAILURE);
	}

	private ModbusPdu processReadBits(ModbusPdu request, DataKind kind, String name) {
		int addr = request.readInt16FromPDU(1, true);
		int count = request.readInt16FromPDU(3, true);
		log.debug("Read {}: addr={}, count={}", name, addr, count);
		ModbusPdu error = checkRange(request, addr, count, kind, name, MAX_READ_COILS);
		if (error != null)
			return error;
		boolean[] bits;
		try {
			bits = store.readBits(kind, addr, count);
		} catch (RuntimeException e) {
			return storeFailed(request, "Reading " + name, e);
		}
		int nBytes = ModbusPdu.bytesCount(count);
		ModbusPdu pdu = new ModbusPdu(request.getFunction(), 2 + nBytes);
		pdu.writeByteToPDU(1, (byte)nBytes);
		for (int i = 0; i < count; i++)
			pdu.writeBitToPDU(2, i, bits[i]);
		return pdu;
	}

	private ModbusPdu processReadInts(ModbusPdu request, DataKind kind, String name) {
		int addr = request.readInt16FromPDU(1, true);
		int count = request.readInt16FromPDU(3, true);
		log.debug("Read {}: addr={}, count={}", name, addr, count);
		ModbusPdu error = checkRange(request, addr, count, kind, name, MAX_READ_REGS);
		if (error != null)
			return error;
		int[] regs;
		try {
			regs = store.readRegisters(kind, addr, count);
		} catch (RuntimeException e) {
			return storeFailed(request, "Reading " + name, e);
		}
		int nBytes = count * 2;
		ModbusPdu pdu = new ModbusPdu(request.getFunction(), 2 + nBytes);
		pdu.writeByteToPDU(1, (byte)nBytes);
		for (int i = 0; i < count; i++) {
			pdu.writeInt16ToPDU(2 + i * 2, regs[i]);
		}
		return pdu;
	}

	// response to a successful write is the first 5 bytes of the request
	private static ModbusPdu echo(ModbusPdu request) {
		return new ModbusPdu(request.toByteArray(), 0, 5);
	}

	private ModbusPdu processWriteSingleCoil(ModbusPdu request) {
		int addr = request.readInt16FromPDU(1, true);
		int value = request.readInt16FromPDU(3, true);
		log.debug("Write single coil {}, value: {}", addr, value);
		if ((value != COIL_OFF) && (value != COIL_ON)) {
			log.warn("Invalid write coil value ({}). Must be 0 or 0xFF00 (65280)", value);
			return exception(request, ModbusExceptionCode.ILLEGAL_DATA_VALUE);
		}
		if (!store.isValidRange(DataKind.COIL, addr, 1)) {
			log.warn("Invalid write coil address ({})", addr);
			return exception(request, ModbusExceptionCode.ILLEGAL_DATA_ADDRESS);
		}
		try {
			store.writeBits(DataKind.COIL, addr, new boolean[] { value == COIL_ON });
		} catch (RuntimeException e) {
			return storeFailed(request, "Writing coil " + addr, e);
		}
		return echo(request);
	}

	private ModbusPdu processWriteSingleHReg(ModbusPdu request) {
		int addr = request.readInt16FromPDU(1, true);
		int value = request.readInt16FromPDU(3, true);
		log.debug("Write single register {}, value: {}", addr, value);
		if (!store.isValidRange(DataKind.HOLDING_REGISTER, addr, 1)) {
			log.warn("Invalid write reg address ({})", addr);
			return exception(request, ModbusExceptionCode.ILLEGAL_DATA_ADDRESS);
		}
		try {
			store.writeRegisters(DataKind.HOLDING_REGISTER, addr, new int[] { value });
		} catch (RuntimeException e) {
			return storeFailed(request, "Writing register " + addr, e);
		}
		return echo(request);
	}

	private ModbusPdu processWriteCoils(ModbusPdu request) {
		if (!validPduSize(request, 6))
			return null;
		int addr = request.readInt16FromPDU(1, true);
		int count = request.readInt16FromPDU(3, true);
		int nBytes = request.readByteFromPDU(5, true);
		log.debug("Write multiple coils: addr={}, count={}", addr, count);
		if (!validPduSize(request, 6 + nBytes))
			return null;
		ModbusPdu error = checkRange(request, addr, count, DataKind.COIL, "coils", MAX_WRITE_COILS);
		if (error != null)
			return error;
		int bytesCount = ModbusPdu.bytesCount(count);
		if (nBytes != bytesCount) {
			log.warn("Write byte count (N={}) doesn't match coils count ({}). N must be {}", nBytes, count, bytesCount);
			return exception(request, ModbusExceptionCode.ILLEGAL_DATA_VALUE);
		}
		boolean[] values = new boolean[count];
		for (int i = 0; i < count; i++)
			values[i] = request.readBitFromPDU(6, i);
		try {
			store.writeBits(DataKind.COIL, addr, values);
		} catch (RuntimeException e) {
			return storeFailed(request, "Writing coils at " + addr + ", count " + count, e);
		}
		return echo(request);
	}

	private ModbusPdu processWriteHRegs(ModbusPdu request) {
		if (!validPduSize(request, 6))
			return null;
		int addr = request.readInt16FromPDU(1, true);
		int count = request.readInt16FromPDU(3, true);
		int nBytes = request.readByteFromPDU(5, true);
		log.debug("Write multiple reg-s: addr={}, count={}", addr, count);
		if (!validPduSize(request, 6 + nBytes))
			return null;
		ModbusPdu error = checkRange(request, addr, count, DataKind.HOLDING_REGISTER, "holding reg-s", MAX_WRITE_REGS);
		if (error != null)
			return error;
		if (nBytes != 2 * count) {
			log.warn("Write byte count (N={}) doesn't match reg-s count ({}). N must be {}", nBytes, count, 2 * count);
			return exception(request, ModbusExceptionCode.ILLEGAL_DATA_VALUE);
		}
		int[] values = new int[count];
		for (int i = 0; i < count; i++)
			values[i] = request.readInt16FromPDU(6 + i * 2, true);
		try {
			store.writeRegisters(DataKind.HOLDING_REGISTER, addr, values);
		} catch (RuntimeException e) {
			return storeFailed(request, "Writing reg-s at " + addr + ", count " + count, e);
		}
		return echo(request);
	}

	@Override
	public ModbusPdu processRequest(ModbusPdu request) {
		int func = request.getFunction();
		switch (func) {
		case FN_READ_COILS:
		case FN_READ_DISCRETE_INPUTS:
		case FN_READ_HOLDING_REGISTERS:
		case FN_READ_INPUT_REGISTERS:
		case FN_WRITE_SINGLE_COIL:
		case FN_WRITE_SINGLE_REGISTER:
		case FN_WRITE_MULTIPLE_COILS:
		case FN_WRITE_MULTIPLE_REGISTERS:
			break;
		default:
			log.warn("Unknown function: {}", func);
			return exception(request, ModbusExceptionCode.ILLEGAL_FUNCTION);
		}
		if (!validPduSize(request, 5))
			return null;
		switch (func) {
		case FN_READ_COILS:
			return processReadBits(request, DataKind.COIL, "coils");
		case FN_READ_DISCRETE_INPUTS:
			return processReadBits(request, DataKind.DISCRETE_INPUT, "inputs");
		case FN_READ_HOLDING_REGISTERS:
			return processReadInts(request, DataKind.HOLDING_REGISTER, "holding reg-s");
		case FN_READ_INPUT_REGISTERS:
			return processReadInts(request, DataKind.INPUT_REGISTER, "input reg-s");
		case FN_WRITE_SINGLE_COIL:
			return processWriteSingleCoil(request);
		case FN_WRITE_SINGLE_REGISTER:
			return processWriteSingleHReg(request);
		case FN_WRITE_MULTIPLE_COILS:
			return processWriteCoils(request);
		default:
			return processWriteHRegs(request);
		}
	}

}
