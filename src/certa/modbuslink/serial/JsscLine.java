package certa.modbuslink.serial;

import java.io.IOException;
import java.util.Arrays;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import certa.modbuslink.ModbusPdu;
import jssc.SerialPort;
import jssc.SerialPortEvent;
import jssc.SerialPortException;

public class JsscLine implements SerialLine {

	private static final Logger log = LoggerFactory.getLogger(JsscLine.class);

	private static final int POLL_INTERVAL = 20;

	private final SerialParameters params;
	private volatile SerialPort port; // created by open()
	private volatile SerialReceiveListener listener;

	public JsscLine(SerialParameters params) {
		this.params = params;
	}

	private static int parity(SerialParameters.Parity parity) {
		switch (parity) {
		case ODD:
			return SerialPort.PARITY_ODD;
		case EVEN:
			return SerialPort.PARITY_EVEN;
		default:
			return SerialPort.PARITY_NONE;
		}
	}

	@Override
	public String getName() {
		return params.getPortName();
	}

	// this method must be synchronized with close()
	@Override
	synchronized public void open() throws IOException {
		if (isOpen())
			return;
		log.info("Opening port: {}", params);
		if (port == null)
			port = new SerialPort(params.getPortName());
		try {
			port.openPort();
			port.setParams(params.getBaudRate(), params.getDataBits(), params.getStopBits(), parity(params.getParity()));
			if (listener != null)
				addListener();
		} catch (SerialPortException e) {
			close();
			throw new IOException("Error opening port " + params.getPortName(), e);
		}
		log.info("Port opened: {}", port.getPortName());
	}

	@Override
	public boolean isOpen() {
		SerialPort p = port;
		return (p != null) && p.isOpened();
	}

	// this method may be called from other thread
	@Override
	synchronized public void close() {
		if (isOpen()) {
			log.info("Closing port: {}", port.getPortName());
			try {
				port.closePort();
			} catch (SerialPortException e) {
				log.error("Error closing port {}: {}", port.getPortName(), e.toString());
			}
			log.info("Port {} closed", port.getPortName());
		}
	}

	@Override
	public int read(byte[] buffer, int offset, int length, int timeoutMillis) throws IOException, InterruptedException {
		checkOpen();
		long deadline = System.currentTimeMillis() + timeoutMillis;
		boolean lastTry = false;
		try {
			while (true) {
				int avail = Math.min(port.getInputBufferBytesCount(), length);
				if (avail > 0) {
					byte[] buf = port.readBytes(avail);
					System.arraycopy(buf, 0, buffer, offset, buf.length);
					return buf.length;
				}
				// one more attempt after the deadline, data may be sitting in the driver buffer
				if (lastTry)
					return 0;
				Thread.sleep(POLL_INTERVAL);
				if (System.currentTimeMillis() > deadline)
					lastTry = true;
			}
		} catch (SerialPortException e) {
			throw new IOException(e.getMessage(), e);
		}
	}

	@Override
	public void write(byte[] data, int offset, int length) throws IOException {
		checkOpen();
		try {
			if (!port.writeBytes(Arrays.copyOfRange(data, offset, offset + length)))
				throw new IOException("writeBytes() failed on " + getName());
		} catch (SerialPortException e) {
			throw new IOException(e.getMessage(), e);
		}
	}

	@Override
	public int clearInput() throws IOException {
		checkOpen();
		int total = 0;
		try {
			byte[] buf = port.readBytes();
			while (buf != null) {
				if (log.isWarnEnabled())
					log.warn("Unexpected input: " + ModbusPdu.toHex(buf, 0, buf.length));
				total += buf.length;
				buf = port.readBytes();
			}
		} catch (SerialPortException e) {
			throw new IOException(e.getMessage(), e);
		}
		return total;
	}

	@Override
	synchronized public void setReceiveListener(SerialReceiveListener listener) {
		this.listener = listener;
		if (!isOpen())
			return;
		try {
			port.removeEventListener();
			if (listener != null)
				addListener();
		} catch (SerialPortException e) {
			log.error("Error changing listener of port {}: {}", port.getPortName(), e.toString());
		}
	}

	private void addListener() throws SerialPortException {
		port.addEventListener((SerialPortEvent event) -> {
			if (!event.isRXCHAR() || (event.getEventValue() <= 0))
				return;
			try {
				byte[] data = port.readBytes(event.getEventValue());
				SerialReceiveListener l = listener;
				if ((l != null) && (data != null))
					l.bytesReceived(data);
			} catch (SerialPortException e) {
				log.error("Read error on port {}: {}", port.getPortName(), e.toString());
			}
		}, SerialPort.MASK_RXCHAR);
	}

	private void checkOpen() throws IOException {
		if (!isOpen())
			throw new IOException("Port " + getName() + " is not open");
	}

}
