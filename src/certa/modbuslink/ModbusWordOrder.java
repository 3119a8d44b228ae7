package certa.modbuslink;

public enum ModbusWordOrder {
	/** Most significant register at the lowest address. */
	HIGH_FIRST,
	/** Least significant register at the lowest address ("swapped"). */
	LOW_FIRST
}
