package certa.modbuslink;

public class ModbusCrcException extends ModbusLinkException {

	private static final long serialVersionUID = 1L;

	private final int expected;
	private final int received;

	public ModbusCrcException(String message, int expected, int received) {
		super(message + " (calc: " + Integer.toHexString(expected) + ", in frame: " + Integer.toHexString(received) + ")");
		this.expected = expected;
		this.received = received;
	}

	public int getExpected() {
		return expected;
	}

	public int getReceived() {
		return received;
	}

	@Override
	public Kind getKind() {
		return Kind.CHECKSUM;
	}

}
