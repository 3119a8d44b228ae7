package certa.modbuslink.codec;

import static certa.modbuslink.ModbusConstants.*;

import certa.modbuslink.InvalidResponseException;
import certa.modbuslink.ModbusByteOrder;
import certa.modbuslink.ModbusPdu;
import certa.modbuslink.ModbusWordOrder;

/**
 * Builds request PDUs for the supported function codes and the decoders of their responses.
 * All arguments are validated here, so an out of range request never reaches the wire.
 */
public final class ModbusRequests {

	private ModbusRequests() {}

	public static void checkAddress(int address) {
		if ((address < 0) || (address > MAX_ADDRESS))
			throw new IllegalArgumentException("Invalid address: " + address + ". Must be 0.." + MAX_ADDRESS);
	}

	public static void checkRange(int address, int count, int maxCount, String name) {
		checkAddress(address);
		if ((count < 1) || (count > maxCount))
			throw new IllegalArgumentException("Invalid " + name + " count (" + count + "). Must be 1.." + maxCount);
		if (address + count - 1 > MAX_ADDRESS)
			throw new IllegalArgumentException("Invalid " + name + " range (" + address + " - " + (address + count - 1) + ")");
	}

	public static void checkRegisterValue(int value) {
		// signed and unsigned 16 bit values are both accepted
		if ((value < Short.MIN_VALUE) || (value > 0xFFFF))
			throw new IllegalArgumentException("Invalid register value: " + value);
	}

	private static ModbusPdu initRequest(int size, byte function, int param1, int param2) {
		ModbusPdu pdu = new ModbusPdu(function, size);
		pdu.writeInt16ToPDU(1, param1);
		pdu.writeInt16ToPDU(3, param2);
		return pdu;
	}

	public static ModbusRequest<boolean[]> readCoils(int startAddress, int count) {
		return readBits(FN_READ_COILS, "coils", startAddress, count);
	}

	public static ModbusRequest<boolean[]> readDiscreteInputs(int startAddress, int count) {
		return readBits(FN_READ_DISCRETE_INPUTS, "discrete inputs", startAddress, count);
	}

	public static ModbusRequest<int[]> readHoldingRegisters(int startAddress, int count) {
		return readRegisters(FN_READ_HOLDING_REGISTERS, "holding reg-s", startAddress, count);
	}

	public static ModbusRequest<int[]> readInputRegisters(int startAddress, int count) {
		return readRegisters(FN_READ_INPUT_REGISTERS, "input reg-s", startAddress, count);
	}

	private static ModbusRequest<boolean[]> readBits(byte function, String name, int startAddress, int count) {
		checkRange(startAddress, count, MAX_READ_COILS, name);
		ModbusPdu pdu = initRequest(5, function, startAddress, count);
		return new ModbusRequest<boolean[]>("read " + name, pdu, false, (req, resp) -> {
			int nBytes = ModbusPdu.bytesCount(count);
			checkByteCount(resp, nBytes);
			boolean[] bits = new boolean[count];
			for (int i = 0; i < count; i++)
				bits[i] = resp.readBitFromPDU(2, i);
			return bits;
		});
	}

	private static ModbusRequest<int[]> readRegisters(byte function, String name, int startAddress, int count) {
		checkRange(startAddress, count, MAX_READ_REGS, name);
		ModbusPdu pdu = initRequest(5, function, startAddress, count);
		return new ModbusRequest<int[]>("read " + name, pdu, false, (req, resp) -> {
			checkByteCount(resp, count * 2);
			int[] regs = new int[count];
			for (int i = 0; i < count; i++)
				regs[i] = resp.readInt16FromPDU(2 + i * 2, true);
			return regs;
		});
	}

	private static void checkByteCount(ModbusPdu resp, int nBytes) throws InvalidResponseException {
		if (resp.getPduSize() < 2)
			throw new InvalidResponseException("Response too short: " + resp);
		int n = resp.readByteFromPDU(1, true);
		if ((n != nBytes) || (resp.getPduSize() != 2 + nBytes))
			throw new InvalidResponseException("Invalid byte count: " + n + " in " + resp.getPduSize()
					+ " bytes PDU (expected: " + nBytes + ")");
	}

	public static ModbusRequest<Void> writeSingleCoil(int address, boolean value) {
		checkAddress(address);
		ModbusPdu pdu = initRequest(5, FN_WRITE_SINGLE_COIL, address, value ? COIL_ON : COIL_OFF);
		return new ModbusRequest<Void>("write single coil", pdu, true, ModbusRequests::checkEcho);
	}

	public static ModbusRequest<Void> writeSingleRegister(int address, int value) {
		checkAddress(address);
		checkRegisterValue(value);
		ModbusPdu pdu = initRequest(5, FN_WRITE_SINGLE_REGISTER, address, value);
		return new ModbusRequest<Void>("write single register", pdu, true, ModbusRequests::checkEcho);
	}

	public static ModbusRequest<Void> writeMultipleCoils(int startAddress, boolean[] values) {
		checkRange(startAddress, values.length, MAX_WRITE_COILS, "coils");
		int bytes = ModbusPdu.bytesCount(values.length);
		ModbusPdu pdu = initRequest(6 + bytes, FN_WRITE_MULTIPLE_COILS, startAddress, values.length);
		pdu.writeByteToPDU(5, (byte)bytes);
		for (int i = 0; i < bytes; i++) {
			byte b = 0;
			for (int j = 0; j < 8; j++) {
				int k = i * 8 + j;
				if ((k < values.length) && values[k])
					b = (byte) (b | (1 << j));
			}
			pdu.writeByteToPDU(6 + i, b);
		}
		return new ModbusRequest<Void>("write multiple coils", pdu, true, ModbusRequests::checkEcho);
	}

	public static ModbusRequest<Void> writeMultipleRegisters(int startAddress, int[] values) {
		checkRange(startAddress, values.length, MAX_WRITE_REGS, "reg-s");
		for (int v : values)
			checkRegisterValue(v);
		int bytes = values.length * 2;
		ModbusPdu pdu = initRequest(6 + bytes, FN_WRITE_MULTIPLE_REGISTERS, startAddress, values.length);
		pdu.writeByteToPDU(5, (byte)bytes);
		for (int i = 0; i < values.length; i++) {
			pdu.writeInt16ToPDU(6 + i * 2, values[i]);
		}
		return new ModbusRequest<Void>("write multiple reg-s", pdu, true, ModbusRequests::checkEcho);
	}

	// Extended types: read with function 3, written with function 16

	public static ModbusRequest<Float> readFloat32(int startAddress, ModbusByteOrder bo, ModbusWordOrder wo) {
		return readHoldingRegisters(startAddress, RegisterCodec.FLOAT32_REGS)
				.map("read float32", regs -> RegisterCodec.decodeFloat32(regs, bo, wo));
	}

	public static ModbusRequest<Void> writeFloat32(int startAddress, float value, ModbusByteOrder bo, ModbusWordOrder wo) {
		return writeMultipleRegisters(startAddress, RegisterCodec.encodeFloat32(value, bo, wo));
	}

	public static ModbusRequest<Double> readFloat64(int startAddress, ModbusByteOrder bo, ModbusWordOrder wo) {
		return readHoldingRegisters(startAddress, RegisterCodec.FLOAT64_REGS)
				.map("read float64", regs -> RegisterCodec.decodeFloat64(regs, bo, wo));
	}

	public static ModbusRequest<Void> writeFloat64(int startAddress, double value, ModbusByteOrder bo, ModbusWordOrder wo) {
		return writeMultipleRegisters(startAddress, RegisterCodec.encodeFloat64(value, bo, wo));
	}

	public static ModbusRequest<Integer> readInt32(int startAddress, ModbusByteOrder bo, ModbusWordOrder wo) {
		return readHoldingRegisters(startAddress, RegisterCodec.INT32_REGS)
				.map("read int32", regs -> RegisterCodec.decodeInt32(regs, bo, wo));
	}

	public static ModbusRequest<Void> writeInt32(int startAddress, int value, ModbusByteOrder bo, ModbusWordOrder wo) {
		return writeMultipleRegisters(startAddress, RegisterCodec.encodeInt32(value, bo, wo));
	}

	public static ModbusRequest<Long> readUInt32(int startAddress, ModbusByteOrder bo, ModbusWordOrder wo) {
		return readHoldingRegisters(startAddress, RegisterCodec.INT32_REGS)
				.map("read uint32", regs -> RegisterCodec.decodeUInt32(regs, bo, wo));
	}

	public static ModbusRequest<Void> writeUInt32(int startAddress, long value, ModbusByteOrder bo, ModbusWordOrder wo) {
		return writeMultipleRegisters(startAddress, RegisterCodec.encodeUInt32(value, bo, wo));
	}

	public static ModbusRequest<Long> readInt64(int startAddress, ModbusByteOrder bo, ModbusWordOrder wo) {
		return readHoldingRegisters(startAddress, RegisterCodec.INT64_REGS)
				.map("read int64", regs -> RegisterCodec.decodeInt64(regs, bo, wo));
	}

	public static ModbusRequest<Void> writeInt64(int startAddress, long value, ModbusByteOrder bo, ModbusWordOrder wo) {
		return writeMultipleRegisters(startAddress, RegisterCodec.encodeInt64(value, bo, wo));
	}

	/**
	 * @param length - string length in bytes (UTF-8)
	 */
	public static ModbusRequest<String> readString(int startAddress, int length) {
		if ((length < 1) || (length > MAX_READ_REGS * 2))
			throw new IllegalArgumentException("Invalid string length (" + length + "). Must be 1.." + (MAX_READ_REGS * 2));
		return readHoldingRegisters(startAddress, RegisterCodec.registersForBytes(length))
				.map("read string", regs -> RegisterCodec.decodeString(regs, length));
	}

	public static ModbusRequest<Void> writeString(int startAddress, String value) {
		if (value.isEmpty())
			throw new IllegalArgumentException("Empty string");
		return writeMultipleRegisters(startAddress, RegisterCodec.encodeString(value));
	}

	// Write responses repeat the first 5 bytes of the request: function, address, value or count
	private static Void checkEcho(ModbusPdu req, ModbusPdu resp) throws InvalidResponseException {
		if (resp.getPduSize() != 5)
			throw new InvalidResponseException("Invalid write response size: " + resp.getPduSize());
		for (int i = 1; i < 5; i++)
			if (resp.readByteFromPDU(i) != req.readByteFromPDU(i))
				throw new InvalidResponseException("Write response doesn't match request: " + resp + " vs " + req);
		return null;
	}

}
