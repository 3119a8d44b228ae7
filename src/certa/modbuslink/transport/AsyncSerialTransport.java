package certa.modbuslink.transport;

import static certa.modbuslink.ModbusConstants.*;

import java.io.IOException;
import java.util.concurrent.CompletableFuture;

import org.slf4j.LoggerFactory;

import certa.modbuslink.ModbusConnectionException;
import certa.modbuslink.ModbusDiagnostics;
import certa.modbuslink.Slf4jModbusDiagnostics;
import certa.modbuslink.frame.AsciiFrameCodec;
import certa.modbuslink.frame.FrameCodec;
import certa.modbuslink.frame.RtuFrameCodec;
import certa.modbuslink.serial.SerialLine;

/**
 * Modbus RTU or ASCII over receive events of a serial line. Bytes arriving while no
 * exchange is in progress are dropped.
 */
public class AsyncSerialTransport extends AbstractAsyncTransport {

	private final SerialLine line;

	public AsyncSerialTransport(SerialLine line, FrameCodec codec, int timeout, ModbusDiagnostics diagnostics) {
		super(codec, timeout, diagnostics, LoggerFactory.getLogger(AsyncSerialTransport.class));
		this.line = line;
	}

	public static AsyncSerialTransport rtu(SerialLine line, int timeout) {
		return new AsyncSerialTransport(line, RtuFrameCodec.INSTANCE, timeout, new Slf4jModbusDiagnostics());
	}

	public static AsyncSerialTransport ascii(SerialLine line, int timeout) {
		return new AsyncSerialTransport(line, AsciiFrameCodec.INSTANCE, timeout, new Slf4jModbusDiagnostics());
	}

	@Override
	public String getName() {
		return line.getName();
	}

	@Override
	public CompletableFuture<Void> open() {
		try {
			line.setReceiveListener(this::onReceive);
			line.open();
			return CompletableFuture.completedFuture(null);
		} catch (IOException e) {
			return CompletableFuture.failedFuture(
					new ModbusConnectionException("Can't open " + line.getName() + ": " + e.getMessage(), e));
		}
	}

	@Override
	public boolean isOpen() {
		return line.isOpen();
	}

	@Override
	public CompletableFuture<Void> close() {
		line.setReceiveListener(null);
		line.close();
		failPending(new ModbusConnectionException("Port " + line.getName() + " closed"));
		return CompletableFuture.completedFuture(null);
	}

	@Override
	protected int nextTransactionId() {
		return 0;
	}

	@Override
	protected boolean isBroadcast(int unitId) {
		return unitId == BROADCAST_ID;
	}

	@Override
	protected CompletableFuture<Void> sendData(byte[] frame) {
		try {
			line.write(frame, 0, frame.length);
			return CompletableFuture.completedFuture(null);
		} catch (IOException e) {
			return CompletableFuture.failedFuture(
					new ModbusConnectionException("Write error on " + line.getName() + ": " + e.getMessage(), e));
		}
	}

}
