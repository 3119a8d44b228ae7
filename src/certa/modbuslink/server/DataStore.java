package certa.modbuslink.server;

public interface DataStore {

	boolean[] readBits(DataKind kind, int start, int count);

	void writeBits(DataKind kind, int start, boolean[] values);

	int[] readRegisters(DataKind kind, int start, int count);

	void writeRegisters(DataKind kind, int start, int[] values);

	int capacity(DataKind kind);

	/**
	 * Default implementation assumes tables start at address 0.
	 */
	default boolean isValidRange(DataKind kind, int start, int count) {
		return (start >= 0) && (count >= 0) && ((long) start + count <= capacity(kind));
	}

}
