package certa.modbuslink;

import static certa.modbuslink.ModbusConstants.*;

import java.util.Arrays;

/**
 * Protocol data unit: function code (1 byte) followed by 0..252 data bytes.
 * Binding independent; the unit id and any integrity data live in the frame around it.
 */
public class ModbusPdu {

	protected final byte[] pdu = new byte[MAX_PDU_SIZE]; // function (1 byte), data (0..252 bytes)
	protected int pduSize;

	public ModbusPdu() {
	}

	public ModbusPdu(int function, int size) {
		setPduSize(size);
		setFunction(function);
	}

	/**
	 * Copies function code and data from <b>src</b>.
	 */
	public ModbusPdu(byte[] src, int offset, int size) {
		setPduSize(size);
		writeToPdu(src, offset, size, 0);
	}

	public static ModbusPdu of(byte... bytes) {
		return new ModbusPdu(bytes, 0, bytes.length);
	}

	public static ModbusPdu exception(int function, int exceptionCode) {
		ModbusPdu res = new ModbusPdu(function | EXCEPTION_FLAG, 2);
		res.writeByteToPDU(1, (byte) exceptionCode);
		return res;
	}

	public static final String toHex(byte[] data, int offset, int length) {
		if ((data.length == 0) || (offset >= data.length) || (length <= 0))
			return "";
		length = Math.min(data.length - offset, length);
		StringBuilder buf = new StringBuilder(length * 3);
		for (int i = 0; i < length; i++) {
			int b = data[i + offset] & 0xFF;
			buf.append(Integer.toHexString(b >>> 4));
			buf.append(Integer.toHexString(b & 0xF));
			if (i < length - 1)
				buf.append(" ");
		}
		return buf.toString();
	}

	public static final String byteToHex(byte b) {
		int t = b & 0xFF;
		return Integer.toHexString(t >>> 4) + Integer.toHexString(t & 0xF);
	}

	public static final int bytesToInt16(byte lowByte, byte highByte, boolean unsigned) {
		// returned value is signed
		int i = (((int) highByte) << 8) | (((int) lowByte) & 0xFF);
		if (unsigned)
			return i & 0xFFFF;
		else
			return i;
	}

	public static final byte highByte(int int16) {
		return (byte)(int16 >>> 8);
	}

	public static final byte lowByte(int int16) {
		return (byte)(int16);
	}

	public static final int bytesCount(int bitsCount) {
		int bytes = bitsCount / 8;
		if ((bitsCount % 8) != 0)
			bytes++;
		return bytes;
	}

	public void setPduSize(int size) {
		if ((size < 1) || (size > MAX_PDU_SIZE))
			throw new IllegalArgumentException("Invalid PDU size: " + size);
		pduSize = size;
	}

	public int getPduSize() {
		return pduSize;
	}

	public int getFunction() {
		return readByteFromPDU(0, true);
	}

	public void setFunction(int code) {
		writeByteToPDU(0, (byte) code);
	}

	public boolean isException() {
		return (pduSize > 0) && ((pdu[0] & EXCEPTION_FLAG) != 0);
	}

	public int getExceptionCode() {
		if (!isException() || (getPduSize() < 2))
			return 0;
		else
			return readByteFromPDU(1, true);
	}

	public byte[] toByteArray() {
		return Arrays.copyOf(pdu, pduSize);
	}

	public void readFromPdu(int pduOffset, int size, byte[] dest, int destOffset) {
		System.arraycopy(pdu, pduOffset, dest, destOffset, size);
	}

	public void writeToPdu(byte[] src, int srcOffset, int size, int pduOffset) {
		System.arraycopy(src, srcOffset, pdu, pduOffset, size);
	}

	public void writeByteToPDU(int offset, byte value) {
		if ((offset < 0) || (offset >= pduSize))
			throw new IndexOutOfBoundsException();
		pdu[offset] = value;
	}

	public void writeInt16ToPDU(int offset, int value) {
		// We can only write words starting from offset 1, because there is function code at offset 0.
		if ((offset < 1) || (offset >= pduSize - 1))
			throw new IndexOutOfBoundsException();
		// Modbus uses a "big-Endian" representation (the most significant byte is sent first).
		pdu[offset] = highByte(value);
		pdu[offset + 1] = lowByte(value);
	}

	public void writeBitToPDU(int firstByte, int bitOffset, boolean value) {
		int offset = firstByte + (bitOffset / 8);
		byte b = readByteFromPDU(offset);
		if (value)
			b = (byte)(b | (1 << (bitOffset % 8)));
		else
			b = (byte)(b & ~(1 << (bitOffset % 8)));
		writeByteToPDU(offset, b);
	}

	public int readByteFromPDU(int offset, boolean unsigned) {
		if (unsigned)
			return ((int) readByteFromPDU(offset)) & 0xFF;
		else
			return readByteFromPDU(offset);
	}

	public byte readByteFromPDU(int offset) {
		if ((offset < 0) || (offset >= pduSize))
			throw new IndexOutOfBoundsException();
		return pdu[offset];
	}

	public int readInt16FromPDU(int offset, boolean unsigned) {
		// Integers can be placed only in DATA section of PDU (starting from offset 1)
		if ((offset < 1) || (offset >= pduSize - 1))
			throw new IndexOutOfBoundsException();
		// Big-endian is standard for MODBUS
		return bytesToInt16(pdu[offset + 1], pdu[offset], unsigned);
	}

	public boolean readBitFromPDU(int firstByte, int bitOffset) {
		byte b = readByteFromPDU(firstByte + (bitOffset / 8));
		return (b & (1 << (bitOffset % 8))) != 0;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj)
			return true;
		if (!(obj instanceof ModbusPdu))
			return false;
		ModbusPdu other = (ModbusPdu) obj;
		return Arrays.equals(pdu, 0, pduSize, other.pdu, 0, other.pduSize);
	}

	@Override
	public int hashCode() {
		return Arrays.hashCode(toByteArray());
	}

	@Override
	public String toString() {
		return "PDU[" + toHex(pdu, 0, pduSize) + "]";
	}

}
