package certa.modbuslink.frame;

import static certa.modbuslink.ModbusConstants.*;

import certa.modbuslink.InvalidResponseException;
import certa.modbuslink.ModbusChecksum;
import certa.modbuslink.ModbusCrcException;
import certa.modbuslink.ModbusLinkException;
import certa.modbuslink.ModbusPdu;
import certa.modbuslink.codec.PduLengths;

/**
 * RTU framing: [ID(1), PDU(n), CRC(2)], CRC low byte first.
 * There is no length field, the frame size follows from the function code and byte count.
 * A request with a function code this library doesn't implement ends with the line silence.
 */
public final class RtuFrameCodec implements FrameCodec {

	public static final RtuFrameCodec INSTANCE = new RtuFrameCodec();

	@Override
	public String getName() {
		return "RTU";
	}

	@Override
	public int getMaxFrameSize() {
		return MAX_RTU_FRAME;
	}

	@Override
	public int getMaxUnitId() {
		return MAX_SERIAL_ID;
	}

	@Override
	public byte[] encode(ModbusFrame frame) {
		int unitId = frame.getUnitId();
		if ((unitId < 0) || (unitId > getMaxUnitId()))
			throw new IllegalArgumentException("Invalid unit id: " + unitId + ". Must be 0.." + getMaxUnitId());
		ModbusPdu pdu = frame.getPdu();
		int size = pdu.getPduSize() + 1;
		byte[] buffer = new byte[size + 2];
		buffer[0] = (byte) unitId;
		pdu.readFromPdu(0, pdu.getPduSize(), buffer, 1);
		int crc = ModbusChecksum.crc16(buffer, 0, size);
		buffer[size] = ModbusPdu.lowByte(crc);
		buffer[size + 1] = ModbusPdu.highByte(crc);
		return buffer;
	}

	@Override
	public int remaining(byte[] buffer, int length, boolean request) throws InvalidResponseException {
		if (length < 2)
			return 2 - length; // id, function
		if (request && !PduLengths.isSupportedRequest(buffer[1]))
			return UNTIL_SILENCE;
		int header = 1 + PduLengths.headerSize(buffer[1], request);
		if (length < header)
			return header - length;
		int total = 1 + PduLengths.pduSize(buffer, 1, request) + 2;
		return Math.max(0, total - length);
	}

	@Override
	public ModbusFrame decode(byte[] buffer, int length) throws ModbusLinkException {
		if (length < 4)
			throw new InvalidResponseException("RTU frame too short: " + length);
		int size = length - 2;
		int crc = ModbusChecksum.crc16(buffer, 0, size);
		int crc2 = ModbusPdu.bytesToInt16(buffer[size], buffer[size + 1], true);
		if (crc != crc2)
			throw new ModbusCrcException("CRC error", crc, crc2);
		return new ModbusFrame(buffer[0] & 0xFF, new ModbusPdu(buffer, 1, size - 1));
	}

}
