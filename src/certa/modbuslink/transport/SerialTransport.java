package certa.modbuslink.transport;

import static certa.modbuslink.ModbusConstants.*;

import java.io.IOException;

import org.slf4j.LoggerFactory;

import certa.modbuslink.ModbusConnectionException;
import certa.modbuslink.ModbusDiagnostics;
import certa.modbuslink.ModbusLinkException;
import certa.modbuslink.Slf4jModbusDiagnostics;
import certa.modbuslink.frame.AsciiFrameCodec;
import certa.modbuslink.frame.FrameCodec;
import certa.modbuslink.frame.RtuFrameCodec;
import certa.modbuslink.serial.SerialLine;

/**
 * Modbus RTU or ASCII over a serial line. The line stays usable after a timeout;
 * stale input is discarded before every request.
 */
public class SerialTransport extends AbstractTransport {

	private final SerialLine line;

	public SerialTransport(SerialLine line, FrameCodec codec, int timeout, int pause, ModbusDiagnostics diagnostics) {
		super(codec, timeout, pause, diagnostics, LoggerFactory.getLogger(SerialTransport.class));
		this.line = line;
	}

	public static SerialTransport rtu(SerialLine line, int timeout, int pause) {
		return new SerialTransport(line, RtuFrameCodec.INSTANCE, timeout, pause, new Slf4jModbusDiagnostics());
	}

	public static SerialTransport ascii(SerialLine line, int timeout, int pause) {
		return new SerialTransport(line, AsciiFrameCodec.INSTANCE, timeout, pause, new Slf4jModbusDiagnostics());
	}

	@Override
	public String getName() {
		return line.getName();
	}

	@Override
	public void open() throws ModbusConnectionException {
		try {
			line.open();
		} catch (IOException e) {
			throw new ModbusConnectionException("Can't open " + line.getName() + ": " + e.getMessage(), e);
		}
	}

	@Override
	public boolean isOpen() {
		return line.isOpen();
	}

	@Override
	public void close() {
		line.close();
	}

	@Override
	protected void prepare() throws ModbusLinkException {
		if (!line.isOpen())
			throw new ModbusConnectionException("Port " + line.getName() + " is not open");
		try {
			line.clearInput();
		} catch (IOException e) {
			throw new ModbusConnectionException("I/O error on " + line.getName() + ": " + e.getMessage(), e);
		}
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
	protected void sendData(byte[] frame) throws ModbusLinkException {
		try {
			line.write(frame, 0, frame.length);
		} catch (IOException e) {
			throw new ModbusConnectionException("Write error on " + line.getName() + ": " + e.getMessage(), e);
		}
	}

	@Override
	protected int readData(int offset, int length, int timeoutMillis) throws ModbusLinkException, InterruptedException {
		try {
			return line.read(buffer, offset, length, timeoutMillis);
		} catch (IOException e) {
			throw new ModbusConnectionException("Read error on " + line.getName() + ": " + e.getMessage(), e);
		}
	}

}
