package certa.modbuslink;

/**
 * The remote device rejected the request with an exception response.
 * The wire exchange itself succeeded.
 */
public class ModbusException extends ModbusLinkException {

	private static final long serialVersionUID = 1L;

	private final int function;
	private final int exceptionCode;

	public ModbusException(int function, int exceptionCode) {
		super("Exception 0x" + ModbusPdu.byteToHex((byte) exceptionCode) + " (" 
				+ ModbusExceptionCode.describe(exceptionCode) + ") for function " + function);
		this.function = function;
		this.exceptionCode = exceptionCode;
	}

	/**
	 * @return function code of the rejected request (without the exception flag)
	 */
	public int getFunction() {
		return function;
	}

	public int getExceptionCode() {
		return exceptionCode;
	}

	/**
	 * @return known exception code, or null if the device sent a code outside the standard set
	 */
	public ModbusExceptionCode getCode() {
		return ModbusExceptionCode.valueOf(exceptionCode);
	}

	@Override
	public Kind getKind() {
		return Kind.DEVICE_EXCEPTION;
	}

}
