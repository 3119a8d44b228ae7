package certa.modbuslink.server;

public enum DataKind {
	COIL(true, true),
	DISCRETE_INPUT(true, false),
	HOLDING_REGISTER(false, true),
	INPUT_REGISTER(false, false);

	private final boolean bit;
	private final boolean writable;

	DataKind(boolean bit, boolean writable) {
		this.bit = bit;
		this.writable = writable;
	}

	public boolean isBit() {
		return bit;
	}

	public boolean isWritable() {
		return writable;
	}
}
