package certa.modbuslink.server;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

final class ModbusDataStoreTest {

	@Test
	void registersAreUnsigned16Bit() {
		ModbusDataStore store = new ModbusDataStore(0, 0, 10, 0);
		store.writeRegisters(DataKind.HOLDING_REGISTER, 2, new int[] { -1, 0x12345 });
		assertArrayEquals(new int[] { 0, 0xFFFF, 0x2345 }, store.readRegisters(DataKind.HOLDING_REGISTER, 1, 3));
	}

	@Test
	void tablesAreIndependent() {
		ModbusDataStore store = new ModbusDataStore(8, 8, 8, 8);
		store.writeBits(DataKind.COIL, 0, new boolean[] { true });
		store.writeRegisters(DataKind.INPUT_REGISTER, 0, new int[] { 7 });
		assertFalse(store.readBits(DataKind.DISCRETE_INPUT, 0, 1)[0]);
		assertEquals(0, store.readRegisters(DataKind.HOLDING_REGISTER, 0, 1)[0]);
		assertTrue(store.readBits(DataKind.COIL, 0, 1)[0]);
		assertEquals(7, store.readRegisters(DataKind.INPUT_REGISTER, 0, 1)[0]);
	}

	@Test
	void rangeChecks() {
		ModbusDataStore store = new ModbusDataStore(10, 0, 0, 0);
		assertEquals(10, store.capacity(DataKind.COIL));
		assertTrue(store.isValidRange(DataKind.COIL, 0, 10));
		assertFalse(store.isValidRange(DataKind.COIL, 5, 6));
		assertFalse(store.isValidRange(DataKind.DISCRETE_INPUT, 0, 1));
		assertThrows(IndexOutOfBoundsException.class, () -> store.readBits(DataKind.COIL, 9, 2));
		assertThrows(IndexOutOfBoundsException.class, () -> store.writeBits(DataKind.COIL, -1, new boolean[1]));
	}

	@Test
	void kindMismatch() {
		ModbusDataStore store = new ModbusDataStore(10, 10, 10, 10);
		assertThrows(IllegalArgumentException.class, () -> store.readBits(DataKind.HOLDING_REGISTER, 0, 1));
		assertThrows(IllegalArgumentException.class, () -> store.readRegisters(DataKind.COIL, 0, 1));
	}

	@Test
	void tablesWithStartAddress() {
		ModbusDataStore store = new ModbusDataStore(0, 0, 0, 0, 1000, 10, 0, 0);
		assertFalse(store.isValidRange(DataKind.HOLDING_REGISTER, 0, 1));
		assertTrue(store.isValidRange(DataKind.HOLDING_REGISTER, 1000, 10));
		store.writeRegisters(DataKind.HOLDING_REGISTER, 1009, new int[] { 5 });
		assertEquals(5, store.getTable(DataKind.HOLDING_REGISTER).getInt(1009));
		assertThrows(IllegalArgumentException.class, () -> new RegistersTable(65530, 10));
	}

}
