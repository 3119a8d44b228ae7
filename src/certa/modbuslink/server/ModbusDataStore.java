package certa.modbuslink.server;

import java.util.EnumMap;
import java.util.Map;

/**
 * In-memory {@link DataStore} with one {@link RegistersTable} per kind.
 */
public class ModbusDataStore implements DataStore {

	private final Map<DataKind, RegistersTable> tables = new EnumMap<>(DataKind.class);

	/**
	 * Tables starting at address 0.
	 */
	public ModbusDataStore(int coilsCount, int inputsCount, int hregsCount, int iregsCount) {
		this(0, coilsCount, 0, inputsCount, 0, hregsCount, 0, iregsCount);
	}

	public ModbusDataStore(int coilsStart, int coilsCount, int inputsStart, int inputsCount,
			int hregsStart, int hregsCount, int iregsStart, int iregsCount)
	{
		tables.put(DataKind.COIL, new RegistersTable(coilsStart, coilsCount));
		tables.put(DataKind.DISCRETE_INPUT, new RegistersTable(inputsStart, inputsCount));
		tables.put(DataKind.HOLDING_REGISTER, new RegistersTable(hregsStart, hregsCount));
		tables.put(DataKind.INPUT_REGISTER, new RegistersTable(iregsStart, iregsCount));
	}

	public RegistersTable getTable(DataKind kind) {
		return tables.get(kind);
	}

	private RegistersTable bits(DataKind kind) {
		if (!kind.isBit())
			throw new IllegalArgumentException(kind + " is not a bit table");
		return tables.get(kind);
	}

	private RegistersTable registers(DataKind kind) {
		if (kind.isBit())
			throw new IllegalArgumentException(kind + " is not a register table");
		return tables.get(kind);
	}

	@Override
	public boolean[] readBits(DataKind kind, int start, int count) {
		return bits(kind).getBools(start, count);
	}

	@Override
	public void writeBits(DataKind kind, int start, boolean[] values) {
		bits(kind).setBools(start, values);
	}

	@Override
	public int[] readRegisters(DataKind kind, int start, int count) {
		return registers(kind).getInts(start, count);
	}

	@Override
	public void writeRegisters(DataKind kind, int start, int[] values) {
		registers(kind).setInts(start, values);
	}

	@Override
	public int capacity(DataKind kind) {
		return tables.get(kind).count();
	}

	@Override
	public boolean isValidRange(DataKind kind, int start, int count) {
		return tables.get(kind).isValidRange(start, count);
	}

}
