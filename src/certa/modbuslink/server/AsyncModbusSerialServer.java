package certa.modbuslink.server;

import java.io.IOException;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.LoggerFactory;

import certa.modbuslink.ModbusConnectionException;
import certa.modbuslink.ModbusDiagnostics;
import certa.modbuslink.ModbusLinkException;
import certa.modbuslink.ModbusPdu;
import certa.modbuslink.Slf4jModbusDiagnostics;
import certa.modbuslink.frame.FrameCodec;
import certa.modbuslink.frame.FrameReader;
import certa.modbuslink.frame.ModbusFrame;
import certa.modbuslink.serial.SerialLine;

/**
 * RTU or ASCII server driven by the receive events of a serial line; requests are
 * processed and answered on the driver's thread. A partial frame older than
 * <b>frameTimeout</b> is dropped when the next bytes arrive. An RTU request with an unsupported
 * function is complete after <b>frameTimeout</b> of silence; it is answered from a timer thread.
 */
public class AsyncModbusSerialServer extends AModbusServer {

	private static final ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor(r -> {
		Thread t = new Thread(r, "modbus-serial-silence");
		t.setDaemon(true);
		return t;
	});

	private final SerialLine line;
	private final FrameCodec codec;
	private final int frameTimeout;
	private final FrameReader reader;
	private long lastReceived;
	private ScheduledFuture<?> silenceTask; // guarded by this
	private volatile boolean active;

	public AsyncModbusSerialServer(SerialLine line, FrameCodec codec, int unitId, DataStore store) {
		this(line, codec, ModbusSerialServer.DEFAULT_FRAME_TIMEOUT, unitId, store, null, new Slf4jModbusDiagnostics());
	}

	public AsyncModbusSerialServer(SerialLine line, FrameCodec codec, int frameTimeout, int unitId, DataStore store,
			RequestProcessor processor, ModbusDiagnostics diagnostics)
	{
		super(unitId, store, processor, false, diagnostics, LoggerFactory.getLogger(AsyncModbusSerialServer.class));
		this.line = line;
		this.codec = codec;
		this.frameTimeout = frameTimeout;
		this.reader = new FrameReader(codec, true);
	}

	@Override
	synchronized public void start() throws ModbusConnectionException {
		if (active)
			return;
		log.info("Starting {} server on {}, unit {}", codec.getName(), line.getName(), unitId);
		line.setReceiveListener(this::onReceive);
		try {
			line.open();
		} catch (IOException e) {
			line.setReceiveListener(null);
			throw new ModbusConnectionException("Can't open " + line.getName() + ": " + e.getMessage(), e);
		}
		active = true;
	}

	@Override
	synchronized public void stop() {
		if (!active)
			return;
		log.info("Stopping server on {}", line.getName());
		active = false;
		if (silenceTask != null) {
			silenceTask.cancel(false);
			silenceTask = null;
		}
		reader.reset();
		line.setReceiveListener(null);
		line.close();
	}

	@Override
	public boolean isRunning() {
		return active;
	}

	synchronized void onReceive(byte[] data) {
		if (!active)
			return;
		long now = System.currentTimeMillis();
		try {
			if (!reader.isEmpty() && (now - lastReceived > frameTimeout)) {
				if (reader.isWaitingForSilence())
					process();
				else {
					logData("Read (incomplete): ", reader.getBuffer(), 0, reader.getLength());
					reader.reset();
				}
			}
			lastReceived = now;
			int pos = 0;
			while (pos < data.length) {
				pos += reader.feed(data, pos, data.length - pos);
				if (!reader.isComplete())
					break;
				process();
			}
			if (reader.isWaitingForSilence())
				scheduleSilenceCheck();
		} catch (ModbusLinkException e) {
			// broken framing: drop what we have
			diagnostics.onFrameError(line.getName(), e);
			reader.reset();
		} catch (IOException e) {
			log.error("Write error on {}: {}", line.getName(), e.toString());
		}
	}

	private void scheduleSilenceCheck() {
		if (silenceTask != null)
			silenceTask.cancel(false);
		silenceTask = timer.schedule(this::silenceElapsed, frameTimeout + 1, TimeUnit.MILLISECONDS);
	}

	synchronized void silenceElapsed() {
		silenceTask = null;
		if (!active)
			return;
		try {
			if (!reader.isWaitingForSilence())
				return;
			if (System.currentTimeMillis() - lastReceived < frameTimeout) {
				scheduleSilenceCheck();
				return;
			}
			process();
		} catch (ModbusLinkException e) {
			diagnostics.onFrameError(line.getName(), e);
			reader.reset();
		} catch (IOException e) {
			log.error("Write error on {}: {}", line.getName(), e.toString());
		}
	}

	/**
	 * Decodes the frame held by the reader and answers it.
	 */
	private void process() throws IOException {
		diagnostics.onFrameReceived(line.getName(), reader.getBuffer(), reader.getLength());
		ModbusFrame request;
		try {
			request = reader.decode();
		} catch (ModbusLinkException e) {
			diagnostics.onFrameError(line.getName(), e);
			return;
		}
		ModbusPdu response = handle(request);
		if (response != null) {
			byte[] frame = codec.encode(new ModbusFrame(unitId, response));
			line.write(frame, 0, frame.length);
			diagnostics.onFrameSent(line.getName(), frame, frame.length);
		}
	}

}
