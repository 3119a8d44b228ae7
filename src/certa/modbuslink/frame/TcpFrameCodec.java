package certa.modbuslink.frame;

import static certa.modbuslink.ModbusConstants.*;

import certa.modbuslink.InvalidResponseException;
import certa.modbuslink.ModbusLinkException;
import certa.modbuslink.ModbusPdu;

/**
 * Modbus TCP framing: MBAP header [transaction(2), protocol(2) = 0, length(2), ID(1)], then the PDU.
 * The length field counts the unit id and the PDU.
 */
public final class TcpFrameCodec implements FrameCodec {

	public static final TcpFrameCodec INSTANCE = new TcpFrameCodec();

	private static final int MIN_LENGTH = 2; // id, function
	private static final int MAX_LENGTH = MAX_PDU_SIZE + 1;

	@Override
	public String getName() {
		return "TCP";
	}

	@Override
	public int getMaxFrameSize() {
		return MAX_TCP_FRAME;
	}

	@Override
	public int getMaxUnitId() {
		return MAX_TCP_ID;
	}

	@Override
	public byte[] encode(ModbusFrame frame) {
		int unitId = frame.getUnitId();
		if ((unitId < 0) || (unitId > getMaxUnitId()))
			throw new IllegalArgumentException("Invalid unit id: " + unitId + ". Must be 0.." + getMaxUnitId());
		ModbusPdu pdu = frame.getPdu();
		int size = pdu.getPduSize();
		byte[] buffer = new byte[MBAP_SIZE + size];
		int txn = frame.getTransactionId();
		buffer[0] = ModbusPdu.highByte(txn);
		buffer[1] = ModbusPdu.lowByte(txn);
		buffer[2] = 0; // protocol id
		buffer[3] = 0;
		buffer[4] = ModbusPdu.highByte(size + 1);
		buffer[5] = ModbusPdu.lowByte(size + 1);
		buffer[6] = (byte) unitId;
		pdu.readFromPdu(0, size, buffer, MBAP_SIZE);
		return buffer;
	}

	@Override
	public int remaining(byte[] buffer, int length, boolean request) throws InvalidResponseException {
		if (length < MBAP_SIZE)
			return MBAP_SIZE - length;
		int total = 6 + checkHeader(buffer);
		return Math.max(0, total - length);
	}

	/**
	 * @return value of the length field
	 */
	private static int checkHeader(byte[] buffer) throws InvalidResponseException {
		int protocol = ModbusPdu.bytesToInt16(buffer[3], buffer[2], true);
		if (protocol != 0)
			throw new InvalidResponseException("Invalid protocol id: " + protocol);
		int len = ModbusPdu.bytesToInt16(buffer[5], buffer[4], true);
		if ((len < MIN_LENGTH) || (len > MAX_LENGTH))
			throw new InvalidResponseException("Invalid MBAP length: " + len + ". Must be " + MIN_LENGTH + ".." + MAX_LENGTH);
		return len;
	}

	@Override
	public ModbusFrame decode(byte[] buffer, int length) throws ModbusLinkException {
		if (length < MBAP_SIZE + 1)
			throw new InvalidResponseException("TCP frame too short: " + length);
		int len = checkHeader(buffer);
		if (6 + len != length)
			throw new InvalidResponseException("MBAP length " + len + " doesn't match frame size " + length);
		int txn = ModbusPdu.bytesToInt16(buffer[1], buffer[0], true);
		return new ModbusFrame(txn, buffer[6] & 0xFF, new ModbusPdu(buffer, MBAP_SIZE, len - 1));
	}

}
