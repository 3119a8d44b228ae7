package certa.modbuslink.serial;

import java.io.IOException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.fazecast.jSerialComm.SerialPort;
import com.fazecast.jSerialComm.SerialPortDataListener;
import com.fazecast.jSerialComm.SerialPortEvent;

import certa.modbuslink.ModbusPdu;

public class JSerialCommLine implements SerialLine {

	private static final Logger log = LoggerFactory.getLogger(JSerialCommLine.class);

	private final SerialParameters params;
	private volatile SerialPort port; // created by open()
	private final byte[] scratch = new byte[256];
	private volatile SerialReceiveListener listener;

	public JSerialCommLine(SerialParameters params) {
		this.params = params;
	}

	private static int parity(SerialParameters.Parity parity) {
		switch (parity) {
		case ODD:
			return SerialPort.ODD_PARITY;
		case EVEN:
			return SerialPort.EVEN_PARITY;
		default:
			return SerialPort.NO_PARITY;
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
		if (log.isInfoEnabled())
			log.info("Opening port: {}", params);
		if (port == null) {
			try {
				port = SerialPort.getCommPort(params.getPortName());
			} catch (RuntimeException e) {
				throw new IOException("Invalid port " + params.getPortName() + ": " + e.getMessage(), e);
			}
		}
		int stopBits = (params.getStopBits() == 1) ? SerialPort.ONE_STOP_BIT : SerialPort.TWO_STOP_BITS;
		if (!port.openPort()) {
			close();
			throw new IOException("openPort() failed: " + params.getPortName());
		}
		if (!port.setComPortParameters(params.getBaudRate(), params.getDataBits(), stopBits, parity(params.getParity()))) {
			close();
			throw new IOException("setComPortParameters() failed: " + params);
		}
		if (listener != null)
			addListener();
		if (log.isInfoEnabled())
			log.info("Port opened: {}", port.getSystemPortName());
	}

	@Override
	public boolean isOpen() {
		SerialPort p = port;
		return (p != null) && p.isOpen();
	}

	// this method may be called from other thread
	@Override
	synchronized public void close() {
		if (isOpen()) {
			if (log.isInfoEnabled())
				log.info("Closing port: {}", port.getSystemPortName());
			try {
				port.removeDataListener();
				port.closePort();
			} catch (RuntimeException e) {
				log.error("Error closing port {}: {}", port.getSystemPortName(), e.toString());
			}
			if (log.isInfoEnabled())
				log.info("Port {} closed", port.getSystemPortName());
		}
	}

	@Override
	public int read(byte[] buffer, int offset, int length, int timeoutMillis) throws IOException, InterruptedException {
		if (Thread.currentThread().isInterrupted())
			throw new InterruptedException();
		checkOpen();
		port.setComPortTimeouts(SerialPort.TIMEOUT_READ_SEMI_BLOCKING | SerialPort.TIMEOUT_WRITE_BLOCKING,
				Math.max(1, timeoutMillis), 0);
		int res = port.readBytes(buffer, length, offset);
		if (res < 0)
			throw new IOException("readBytes() failed on " + getName());
		return res;
	}

	@Override
	public void write(byte[] data, int offset, int length) throws IOException {
		checkOpen();
		int nb = port.writeBytes(data, length, offset);
		if (nb != length)
			throw new IOException("write failed. " + nb + " from " + length + " bytes written");
	}

	@Override
	public int clearInput() throws IOException {
		checkOpen();
		int total = 0;
		int bytes = port.bytesAvailable();
		while (bytes > 0) {
			int rb = port.readBytes(scratch, Math.min(bytes, scratch.length));
			if (rb < 0)
				throw new IOException("readBytes() failed in clearInput()");
			if ((rb > 0) && log.isWarnEnabled())
				log.warn("Unexpected input: " + ModbusPdu.toHex(scratch, 0, rb));
			total += rb;
			bytes = port.bytesAvailable();
		}
		return total;
	}

	@Override
	synchronized public void setReceiveListener(SerialReceiveListener listener) {
		this.listener = listener;
		if (!isOpen())
			return;
		port.removeDataListener();
		if (listener != null)
			addListener();
	}

	private void addListener() {
		port.addDataListener(new SerialPortDataListener() {
			@Override
			public int getListeningEvents() {
				return SerialPort.LISTENING_EVENT_DATA_RECEIVED;
			}

			@Override
			public void serialEvent(SerialPortEvent event) {
				SerialReceiveListener l = listener;
				byte[] data = event.getReceivedData();
				if ((l != null) && (data != null) && (data.length > 0))
					l.bytesReceived(data);
			}
		});
	}

	private void checkOpen() throws IOException {
		if (!isOpen())
			throw new IOException("Port " + getName() + " is not open");
	}

}
