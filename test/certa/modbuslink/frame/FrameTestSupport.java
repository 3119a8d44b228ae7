package certa.modbuslink.frame;

import java.nio.charset.StandardCharsets;
import java.util.List;

import certa.modbuslink.ModbusConstants;
import certa.modbuslink.ModbusPdu;

final class FrameTestSupport {

	private FrameTestSupport() {}

	static byte[] bytes(int... values) {
		byte[] b = new byte[values.length];
		for (int i = 0; i < values.length; i++)
			b[i] = (byte) values[i];
		return b;
	}

	/**
	 * Function code only, a read request, an exception and a PDU of maximum size.
	 */
	static List<ModbusPdu> samplePdus() {
		byte[] max = new byte[ModbusConstants.MAX_PDU_SIZE];
		max[0] = 0x17;
		for (int i = 1; i < max.length; i++)
			max[i] = (byte) (i * 7);
		return List.of(
				ModbusPdu.of(bytes(0x07)),
				ModbusPdu.of(bytes(0x03, 0x00, 0x6B, 0x00, 0x03)),
				ModbusPdu.of(bytes(0x83, 0x02)),
				ModbusPdu.of(max));
	}

	static byte[] ascii(String s) {
		return s.getBytes(StandardCharsets.US_ASCII);
	}

}
