package certa.modbuslink.server;

import java.io.IOException;

import org.slf4j.LoggerFactory;

import certa.modbuslink.InvalidResponseException;
import certa.modbuslink.ModbusConnectionException;
import certa.modbuslink.ModbusDiagnostics;
import certa.modbuslink.ModbusLinkException;
import certa.modbuslink.ModbusPdu;
import certa.modbuslink.Slf4jModbusDiagnostics;
import certa.modbuslink.frame.FrameCodec;
import certa.modbuslink.frame.ModbusFrame;
import certa.modbuslink.serial.SerialLine;

/**
 * Blocking RTU or ASCII server on a serial line, one frame at a time.
 * A partial frame followed by a silence longer than <b>frameTimeout</b> is discarded, except
 * an RTU request with an unsupported function: that one ends with the silence and gets an exception response.
 */
public class ModbusSerialServer extends AModbusServer implements Runnable {

	public static final int DEFAULT_FRAME_TIMEOUT = 100;

	private final SerialLine line;
	private final FrameCodec codec;
	private final int frameTimeout;
	private final byte[] buffer;

	private volatile boolean active;
	private Thread thread;

	public ModbusSerialServer(SerialLine line, FrameCodec codec, int unitId, DataStore store) {
		this(line, codec, DEFAULT_FRAME_TIMEOUT, unitId, store, null, new Slf4jModbusDiagnostics());
	}

	public ModbusSerialServer(SerialLine line, FrameCodec codec, int frameTimeout, int unitId, DataStore store,
			RequestProcessor processor, ModbusDiagnostics diagnostics)
	{
		super(unitId, store, processor, false, diagnostics, LoggerFactory.getLogger(ModbusSerialServer.class));
		if (frameTimeout <= 0)
			throw new IllegalArgumentException("Invalid frame timeout: " + frameTimeout);
		this.line = line;
		this.codec = codec;
		this.frameTimeout = frameTimeout;
		this.buffer = new byte[codec.getMaxFrameSize()];
	}

	@Override
	synchronized public void start() throws ModbusConnectionException {
		if (active)
			return;
		log.info("Starting {} server on {}, unit {}", codec.getName(), line.getName(), unitId);
		try {
			line.open();
		} catch (IOException e) {
			throw new ModbusConnectionException("Can't open " + line.getName() + ": " + e.getMessage(), e);
		}
		active = true;
		thread = new Thread(this, "modbus-serial-server-" + line.getName());
		thread.setDaemon(true);
		thread.start();
	}

	@Override
	synchronized public void stop() {
		if (!active)
			return;
		log.info("Stopping server on {}", line.getName());
		active = false;
		thread.interrupt();
		try {
			thread.join();
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
		}
		thread = null;
		line.close();
	}

	@Override
	public boolean isRunning() {
		return active;
	}

	/**
	 * @return frame size, or 0 if no complete frame arrived
	 */
	private int readRequest() throws IOException, InterruptedException {
		int length = 0;
		while (active) {
			int need;
			try {
				need = codec.remaining(buffer, length, true);
			} catch (InvalidResponseException e) {
				logData("Read (invalid): ", buffer, 0, length);
				diagnostics.onFrameError(line.getName(), e);
				line.clearInput();
				return 0;
			}
			if (need == 0)
				return length;
			boolean untilSilence = (need == FrameCodec.UNTIL_SILENCE);
			if (untilSilence)
				need = buffer.length - length;
			if ((need <= 0) || (length + need > buffer.length)) {
				log.warn("Frame too long, discarded");
				line.clearInput();
				return 0;
			}
			int res = line.read(buffer, length, need, frameTimeout);
			if (res == 0) {
				if (untilSilence)
					return length;
				if (length > 0) {
					logData("Read (incomplete): ", buffer, 0, length);
					log.warn("Incomplete frame discarded ({} bytes)", length);
					return 0;
				}
				continue;
			}
			length += res;
		}
		return 0;
	}

	@Override
	public void run() {
		log.debug("SERVER THREAD START");
		try {
			while (active && !Thread.currentThread().isInterrupted()) {
				int size = readRequest();
				if (size == 0)
					continue;
				diagnostics.onFrameReceived(line.getName(), buffer, size);
				ModbusFrame request;
				try {
					request = codec.decode(buffer, size);
				} catch (ModbusLinkException e) {
					diagnostics.onFrameError(line.getName(), e);
					continue;
				}
				ModbusPdu response = handle(request);
				if (response == null)
					continue;
				byte[] frame = codec.encode(new ModbusFrame(unitId, response));
				line.write(frame, 0, frame.length);
				diagnostics.onFrameSent(line.getName(), frame, frame.length);
			}
		} catch (InterruptedException e) {
			// stopping
		} catch (IOException e) {
			log.error("I/O error on {}, server stopped", line.getName(), e);
			line.close();
		}
		active = false;
		log.debug("SERVER THREAD END");
	}

}
