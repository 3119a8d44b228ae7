package certa.modbuslink;

public enum ModbusByteOrder {
	BIG,
	LITTLE
}
