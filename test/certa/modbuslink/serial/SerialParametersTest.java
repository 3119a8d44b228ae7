package certa.modbuslink.serial;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

final class SerialParametersTest {

	@Test
	void defaultsTo8N1() {
		SerialParameters p = new SerialParameters("/dev/ttyUSB0", 19200);
		assertEquals(8, p.getDataBits());
		assertEquals(SerialParameters.Parity.NONE, p.getParity());
		assertEquals(1, p.getStopBits());
		assertEquals("/dev/ttyUSB0, 19200, 8-N-1", p.toString());
	}

	@Test
	void rejectsInvalidSettings() {
		assertThrows(IllegalArgumentException.class, () -> new SerialParameters("", 9600));
		assertThrows(IllegalArgumentException.class, () -> new SerialParameters("COM1", 0));
		assertThrows(IllegalArgumentException.class, () -> new SerialParameters("COM1", 9600, 9, SerialParameters.Parity.EVEN, 1));
		assertThrows(IllegalArgumentException.class, () -> new SerialParameters("COM1", 9600, 8, SerialParameters.Parity.EVEN, 3));
		assertEquals("COM1, 9600, 7-E-2", new SerialParameters("COM1", 9600, 7, SerialParameters.Parity.EVEN, 2).toString());
	}

}
