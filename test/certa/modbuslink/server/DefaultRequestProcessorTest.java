package certa.modbuslink.server;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import certa.modbuslink.ModbusPdu;

final class DefaultRequestProcessorTest {

	private final ModbusDataStore store = new ModbusDataStore(20, 20, 20, 20);
	private final DefaultRequestProcessor processor = new DefaultRequestProcessor(store);

	private static ModbusPdu pdu(int... bytes) {
		byte[] b = new byte[bytes.length];
		for (int i = 0; i < bytes.length; i++)
			b[i] = (byte) bytes[i];
		return ModbusPdu.of(b);
	}

	@Test
	void readHoldingRegisters() {
		store.writeRegisters(DataKind.HOLDING_REGISTER, 0, new int[] { 10, 0xFFFF });
		assertEquals(pdu(0x03, 0x04, 0x00, 0x0A, 0xFF, 0xFF), processor.processRequest(pdu(0x03, 0x00, 0x00, 0x00, 0x02)));
	}

	@Test
	void readInputsPacksBits() {
		store.writeBits(DataKind.DISCRETE_INPUT, 0, new boolean[] { true, false, true, true, false, false, true, true, true });
		assertEquals(pdu(0x02, 0x02, 0xCD, 0x01), processor.processRequest(pdu(0x02, 0x00, 0x00, 0x00, 0x09)));
	}

	@Test
	void writesAreEchoedAndApplied() {
		ModbusPdu single = pdu(0x06, 0x00, 0x01, 0x00, 0x03);
		assertEquals(single, processor.processRequest(single));
		assertEquals(3, store.readRegisters(DataKind.HOLDING_REGISTER, 1, 1)[0]);

		ModbusPdu coil = pdu(0x05, 0x00, 0x02, 0xFF, 0x00);
		assertEquals(coil, processor.processRequest(coil));
		assertTrue(store.readBits(DataKind.COIL, 2, 1)[0]);

		assertEquals(pdu(0x0F, 0x00, 0x04, 0x00, 0x0A),
				processor.processRequest(pdu(0x0F, 0x00, 0x04, 0x00, 0x0A, 0x02, 0xCD, 0x01)));
		assertArrayEquals(new boolean[] { true, false, true, true }, store.readBits(DataKind.COIL, 4, 4));

		assertEquals(pdu(0x10, 0x00, 0x05, 0x00, 0x02),
				processor.processRequest(pdu(0x10, 0x00, 0x05, 0x00, 0x02, 0x04, 0x00, 0x0A, 0x01, 0x02)));
		assertArrayEquals(new int[] { 10, 0x0102 }, store.readRegisters(DataKind.HOLDING_REGISTER, 5, 2));
	}

	@Test
	void unknownFunction() {
		assertEquals(pdu(0xAB, 0x01), processor.processRequest(pdu(0x2B, 0x0E, 0x01, 0x00)));
	}

	@Test
	void outOfRangeIsIllegalAddress() {
		assertEquals(pdu(0x83, 0x02), processor.processRequest(pdu(0x03, 0x00, 0x13, 0x00, 0x02)));
		assertEquals(pdu(0x86, 0x02), processor.processRequest(pdu(0x06, 0x00, 0x14, 0x00, 0x01)));
		assertEquals(pdu(0x85, 0x02), processor.processRequest(pdu(0x05, 0x00, 0x14, 0xFF, 0x00)));
	}

	@Test
	void invalidValuesAreIllegalDataValue() {
		assertEquals(pdu(0x83, 0x03), processor.processRequest(pdu(0x03, 0x00, 0x00, 0x00, 0x00)));
		assertEquals(pdu(0x81, 0x03), processor.processRequest(pdu(0x01, 0x00, 0x00, 0x07, 0xD1)));
		assertEquals(pdu(0x85, 0x03), processor.processRequest(pdu(0x05, 0x00, 0x00, 0x12, 0x34)));
		assertEquals(pdu(0x90, 0x03),
				processor.processRequest(pdu(0x10, 0x00, 0x00, 0x00, 0x02, 0x02, 0x00, 0x01)));
		assertEquals(pdu(0x8F, 0x03), processor.processRequest(pdu(0x0F, 0x00, 0x00, 0x00, 0x09, 0x01, 0xFF)));
	}

	@Test
	void truncatedRequestsAreIgnored() {
		assertNull(processor.processRequest(pdu(0x03, 0x00, 0x00)));
		assertNull(processor.processRequest(pdu(0x10, 0x00, 0x00, 0x00, 0x02, 0x04, 0x00)));
	}

	@Test
	void storeFailureIsDeviceFailure() {
		DataStore failing = new ModbusDataStore(0, 0, 10, 0) {
			@Override
			public int[] readRegisters(DataKind kind, int start, int count) {
				throw new IllegalStateException("backend down");
			}
		};
		assertEquals(pdu(0x83, 0x04),
				new DefaultRequestProcessor(failing).processRequest(pdu(0x03, 0x00, 0x00, 0x00, 0x01)));
	}

}
