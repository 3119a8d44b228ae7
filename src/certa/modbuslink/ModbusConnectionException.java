package certa.modbuslink;

public class ModbusConnectionException extends ModbusLinkException {

	private static final long serialVersionUID = 1L;

	public ModbusConnectionException(String message) {
		super(message);
	}

	public ModbusConnectionException(String message, Throwable cause) {
		super(message, cause);
	}

	@Override
	public Kind getKind() {
		return Kind.CONNECTION;
	}

}
