package certa.modbuslink.codec;

import java.nio.ByteBuffer;
import java.nio.charset.StandardCharsets;

import certa.modbuslink.ModbusByteOrder;
import certa.modbuslink.ModbusWordOrder;

/**
 * Values wider than one register and strings, laid out over consecutive 16-bit registers.
 * <p>
 * A value is first written as big-endian bytes, then cut into registers. {@link ModbusByteOrder#LITTLE}
 * swaps the two bytes of every register, {@link ModbusWordOrder#LOW_FIRST} reverses the register order.
 * Both are applied here and nowhere else, so encode and decode are always symmetric.
 * <p>
 * Strings are UTF-8, two bytes per register, first byte in the high half; an odd length is padded
 * with a zero byte. Byte and word order don't apply to strings.
 */
public final class RegisterCodec {

	private RegisterCodec() {}

	public static final int FLOAT32_REGS = 2;
	public static final int INT32_REGS = 2;
	public static final int FLOAT64_REGS = 4;
	public static final int INT64_REGS = 4;
	public static final long MAX_UINT32 = 0xFFFFFFFFL;

	/**
	 * @param bytes - big-endian value, even length
	 * @return unsigned register values
	 */
	public static int[] toRegisters(byte[] bytes, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder) {
		if ((bytes.length % 2) != 0)
			throw new IllegalArgumentException("Odd number of bytes: " + bytes.length);
		int n = bytes.length / 2;
		int[] regs = new int[n];
		for (int i = 0; i < n; i++) {
			int hi = bytes[i * 2] & 0xFF;
			int lo = bytes[i * 2 + 1] & 0xFF;
			int reg = (byteOrder == ModbusByteOrder.LITTLE) ? ((lo << 8) | hi) : ((hi << 8) | lo);
			int index = (wordOrder == ModbusWordOrder.LOW_FIRST) ? (n - 1 - i) : i;
			regs[index] = reg;
		}
		return regs;
	}

	/**
	 * Inverse of {@link #toRegisters(byte[], ModbusByteOrder, ModbusWordOrder)}.
	 */
	public static byte[] fromRegisters(int[] regs, int offset, int count, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder) {
		if ((offset < 0) || (count < 0) || (offset + count > regs.length))
			throw new IllegalArgumentException("Need " + count + " registers at " + offset + ", have " + regs.length);
		byte[] bytes = new byte[count * 2];
		for (int i = 0; i < count; i++) {
			int index = (wordOrder == ModbusWordOrder.LOW_FIRST) ? (count - 1 - i) : i;
			int reg = regs[offset + index];
			byte hi = (byte) (reg >>> 8);
			byte lo = (byte) reg;
			if (byteOrder == ModbusByteOrder.LITTLE) {
				bytes[i * 2] = lo;
				bytes[i * 2 + 1] = hi;
			} else {
				bytes[i * 2] = hi;
				bytes[i * 2 + 1] = lo;
			}
		}
		return bytes;
	}

	public static int[] encodeFloat32(float value, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder) {
		return toRegisters(ByteBuffer.allocate(4).putFloat(value).array(), byteOrder, wordOrder);
	}

	public static float decodeFloat32(int[] regs, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder) {
		return ByteBuffer.wrap(fromRegisters(regs, 0, FLOAT32_REGS, byteOrder, wordOrder)).getFloat();
	}

	public static int[] encodeFloat64(double value, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder) {
		return toRegisters(ByteBuffer.allocate(8).putDouble(value).array(), byteOrder, wordOrder);
	}

	public static double decodeFloat64(int[] regs, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder) {
		return ByteBuffer.wrap(fromRegisters(regs, 0, FLOAT64_REGS, byteOrder, wordOrder)).getDouble();
	}

	public static int[] encodeInt32(int value, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder) {
		return toRegisters(ByteBuffer.allocate(4).putInt(value).array(), byteOrder, wordOrder);
	}

	public static int decodeInt32(int[] regs, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder) {
		return ByteBuffer.wrap(fromRegisters(regs, 0, INT32_REGS, byteOrder, wordOrder)).getInt();
	}

	public static int[] encodeUInt32(long value, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder) {
		if ((value < 0) || (value > MAX_UINT32))
			throw new IllegalArgumentException("Invalid uint32 value: " + value);
		return encodeInt32((int) value, byteOrder, wordOrder);
	}

	public static long decodeUInt32(int[] regs, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder) {
		return decodeInt32(regs, byteOrder, wordOrder) & MAX_UINT32;
	}

	public static int[] encodeInt64(long value, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder) {
		return toRegisters(ByteBuffer.allocate(8).putLong(value).array(), byteOrder, wordOrder);
	}

	public static long decodeInt64(int[] regs, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder) {
		return ByteBuffer.wrap(fromRegisters(regs, 0, INT64_REGS, byteOrder, wordOrder)).getLong();
	}

	public static int registersForBytes(int byteLength) {
		return (byteLength + 1) / 2;
	}

	public static int[] encodeString(String value) {
		byte[] utf8 = value.getBytes(StandardCharsets.UTF_8);
		byte[] padded = new byte[registersForBytes(utf8.length) * 2];
		System.arraycopy(utf8, 0, padded, 0, utf8.length);
		return toRegisters(padded, ModbusByteOrder.BIG, ModbusWordOrder.HIGH_FIRST);
	}

	/**
	 * @param byteLength - declared length in bytes. Everything up to it is kept, zero bytes included.
	 */
	public static String decodeString(int[] regs, int byteLength) {
		int count = registersForBytes(byteLength);
		byte[] bytes = fromRegisters(regs, 0, count, ModbusByteOrder.BIG, ModbusWordOrder.HIGH_FIRST);
		return new String(bytes, 0, byteLength, StandardCharsets.UTF_8);
	}

}
