package certa.modbuslink.frame;

import static certa.modbuslink.ModbusConstants.*;

import java.nio.charset.StandardCharsets;

import certa.modbuslink.InvalidResponseException;
import certa.modbuslink.ModbusChecksum;
import certa.modbuslink.ModbusCrcException;
import certa.modbuslink.ModbusLinkException;
import certa.modbuslink.ModbusPdu;

/**
 * ASCII framing: ':' then ID, PDU and LRC as two hex digits per byte, then CR LF.
 * Written in upper case, read in either case. The frame ends at LF, so a reader
 * takes it one character at a time.
 */
public final class AsciiFrameCodec implements FrameCodec {

	public static final AsciiFrameCodec INSTANCE = new AsciiFrameCodec();

	private static final byte START = ':';
	private static final byte CR = '\r';
	private static final byte LF = '\n';
	private static final char[] HEX = "0123456789ABCDEF".toCharArray();

	@Override
	public String getName() {
		return "ASCII";
	}

	@Override
	public int getMaxFrameSize() {
		return MAX_ASCII_FRAME;
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
		byte[] raw = new byte[pdu.getPduSize() + 2];
		raw[0] = (byte) unitId;
		pdu.readFromPdu(0, pdu.getPduSize(), raw, 1);
		raw[raw.length - 1] = (byte) ModbusChecksum.lrc(raw, 0, raw.length - 1);
		StringBuilder sb = new StringBuilder(raw.length * 2 + 3);
		sb.append((char) START);
		for (byte b : raw) {
			sb.append(HEX[(b >>> 4) & 0xF]);
			sb.append(HEX[b & 0xF]);
		}
		sb.append("\r\n");
		return sb.toString().getBytes(StandardCharsets.US_ASCII);
	}

	@Override
	public int remaining(byte[] buffer, int length, boolean request) throws InvalidResponseException {
		if (length == 0)
			return 1;
		if (buffer[0] != START)
			throw new InvalidResponseException("Invalid ASCII frame start: 0x" + ModbusPdu.byteToHex(buffer[0]));
		if (buffer[length - 1] == LF)
			return 0;
		if (length >= MAX_ASCII_FRAME)
			throw new InvalidResponseException("ASCII frame too long");
		return 1;
	}

	@Override
	public ModbusFrame decode(byte[] buffer, int length) throws ModbusLinkException {
		if (length > MAX_ASCII_FRAME)
			throw new InvalidResponseException("ASCII frame too long: " + length);
		if ((length < 1) || (buffer[0] != START))
			throw new InvalidResponseException("ASCII frame doesn't start with ':'");
		if ((length < 3) || (buffer[length - 1] != LF) || (buffer[length - 2] != CR))
			throw new InvalidResponseException("ASCII frame doesn't end with CR LF");
		int digits = length - 3;
		if ((digits % 2) != 0)
			throw new InvalidResponseException("Odd number of hex digits: " + digits);
		int n = digits / 2;
		if (n < 3) // id, function, LRC
			throw new InvalidResponseException("ASCII frame too short: " + n + " bytes");
		byte[] raw = new byte[n];
		for (int i = 0; i < n; i++)
			raw[i] = (byte) ((hexValue(buffer[1 + i * 2]) << 4) | hexValue(buffer[2 + i * 2]));
		int lrc = ModbusChecksum.lrc(raw, 0, n - 1);
		int lrc2 = raw[n - 1] & 0xFF;
		if (lrc != lrc2)
			throw new ModbusCrcException("LRC error", lrc, lrc2);
		return new ModbusFrame(raw[0] & 0xFF, new ModbusPdu(raw, 1, n - 2));
	}

	private static int hexValue(byte c) throws InvalidResponseException {
		int v = Character.digit((char) (c & 0xFF), 16);
		if (v < 0)
			throw new InvalidResponseException("Invalid hex character: 0x" + ModbusPdu.byteToHex(c));
		return v;
	}

}
