package certa.modbuslink;

public class ModbusTimeoutException extends ModbusLinkException {

	private static final long serialVersionUID = 1L;

	private final int bytesReceived;

	public ModbusTimeoutException(String message, int bytesReceived) {
		super(message);
		this.bytesReceived = bytesReceived;
	}

	/**
	 * @return number of bytes of the incomplete frame that did arrive before the deadline
	 */
	public int getBytesReceived() {
		return bytesReceived;
	}

	@Override
	public Kind getKind() {
		return Kind.TIMEOUT;
	}

}
