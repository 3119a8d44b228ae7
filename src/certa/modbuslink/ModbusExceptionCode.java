package certa.modbuslink;

public enum ModbusExceptionCode {

	ILLEGAL_FUNCTION(0x01, "illegal function"),
	ILLEGAL_DATA_ADDRESS(0x02, "illegal data address"),
	ILLEGAL_DATA_VALUE(0x03, "illegal data value"),
	SLAVE_DEVICE_FAILURE(0x04, "slave device failure"),
	ACKNOWLEDGE(0x05, "acknowledge"),
	SLAVE_DEVICE_BUSY(0x06, "slave device busy"),
	MEMORY_PARITY_ERROR(0x08, "memory parity error"),
	GATEWAY_PATH_UNAVAILABLE(0x0A, "gateway path unavailable"),
	GATEWAY_TARGET_FAILED(0x0B, "gateway target device failed to respond");

	private final int code;
	private final String description;

	ModbusExceptionCode(int code, String description) {
		this.code = code;
		this.description = description;
	}

	public int getCode() {
		return code;
	}

	public String getDescription() {
		return description;
	}

	public static ModbusExceptionCode valueOf(int code) {
		for (ModbusExceptionCode c : values())
			if (c.code == code)
				return c;
		return null;
	}

	public static String describe(int code) {
		ModbusExceptionCode c = valueOf(code);
		return (c != null) ? c.description : "unknown exception";
	}

}
