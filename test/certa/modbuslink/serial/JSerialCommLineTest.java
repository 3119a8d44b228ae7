package certa.modbuslink.serial;

import static org.junit.jupiter.api.Assertions.*;

import java.io.IOException;

import org.junit.jupiter.api.Test;

final class JSerialCommLineTest {

	private final JSerialCommLine line = new JSerialCommLine(new SerialParameters("/dev/ttyMODBUS9", 9600));

	@Test
	void reportsConfiguredPortBeforeOpen() {
		assertEquals("/dev/ttyMODBUS9", line.getName());
		assertFalse(line.isOpen());
	}

	@Test
	void closedLineRejectsIo() {
		assertThrows(IOException.class, () -> line.write(new byte[] { 1, 2 }, 0, 2));
		assertThrows(IOException.class, () -> line.read(new byte[4], 0, 4, 10));
		assertThrows(IOException.class, line::clearInput);
	}

	@Test
	void closeAndListenerAreNoOpsWhenClosed() {
		line.setReceiveListener(data -> {});
		line.close();
		line.setReceiveListener(null);
		assertFalse(line.isOpen());
	}

}
