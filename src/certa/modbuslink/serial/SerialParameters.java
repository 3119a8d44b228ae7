package certa.modbuslink.serial;

public final class SerialParameters {

	public enum Parity {
		NONE("N"), ODD("O"), EVEN("E");

		private final String letter;

		Parity(String letter) {
			this.letter = letter;
		}

		public String getLetter() {
			return letter;
		}
	}

	private final String portName;
	private final int baudRate;
	private final int dataBits;
	private final Parity parity;
	private final int stopBits;

	public SerialParameters(String portName, int baudRate) {
		this(portName, baudRate, 8, Parity.NONE, 1);
	}

	public SerialParameters(String portName, int baudRate, int dataBits, Parity parity, int stopBits) {
		if ((portName == null) || portName.isEmpty())
			throw new IllegalArgumentException("Port name is required");
		if (baudRate <= 0)
			throw new IllegalArgumentException("Invalid baud rate: " + baudRate);
		if ((dataBits < 5) || (dataBits > 8))
			throw new IllegalArgumentException("Invalid data bits: " + dataBits);
		if ((stopBits != 1) && (stopBits != 2))
			throw new IllegalArgumentException("Invalid stop bits: " + stopBits);
		this.portName = portName;
		this.baudRate = baudRate;
		this.dataBits = dataBits;
		this.parity = (parity == null) ? Parity.NONE : parity;
		this.stopBits = stopBits;
	}

	public String getPortName() {
		return portName;
	}

	public int getBaudRate() {
		return baudRate;
	}

	public int getDataBits() {
		return dataBits;
	}

	public Parity getParity() {
		return parity;
	}

	public int getStopBits() {
		return stopBits;
	}

	@Override
	public String toString() {
		return portName + ", " + baudRate + ", " + dataBits + "-" + parity.getLetter() + "-" + stopBits;
	}

}
