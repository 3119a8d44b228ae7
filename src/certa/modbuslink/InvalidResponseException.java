package certa.modbuslink;

public class InvalidResponseException extends ModbusLinkException {

	private static final long serialVersionUID = 1L;

	public InvalidResponseException(String message) {
		super(message);
	}

	@Override
	public Kind getKind() {
		return Kind.INVALID_RESPONSE;
	}

}
