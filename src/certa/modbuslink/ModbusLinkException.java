package certa.modbuslink;

public abstract class ModbusLinkException extends Exception {

	private static final long serialVersionUID = 1L;

	public enum Kind {
		/** The channel could not be opened or was lost. Fatal to the transport instance. */
		CONNECTION,
		/** No complete frame within the deadline. */
		TIMEOUT,
		/** Frame was structurally parseable but its CRC or LRC did not match. */
		CHECKSUM,
		/** Malformed framing, unexpected transaction id, unit id or function echo. */
		INVALID_RESPONSE,
		/** The device answered with an exception response. */
		DEVICE_EXCEPTION
	}

	protected ModbusLinkException(String message) {
		super(message);
	}

	protected ModbusLinkException(String message, Throwable cause) {
		super(message, cause);
	}

	public abstract Kind getKind();

}
