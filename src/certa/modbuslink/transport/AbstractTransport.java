package certa.modbuslink.transport;

import java.util.concurrent.locks.ReentrantLock;

import org.slf4j.Logger;

import certa.modbuslink.InvalidResponseException;
import certa.modbuslink.ModbusDiagnostics;
import certa.modbuslink.ModbusLinkException;
import certa.modbuslink.ModbusPdu;
import certa.modbuslink.ModbusTimeoutException;
import certa.modbuslink.frame.FrameCodec;
import certa.modbuslink.frame.ModbusFrame;

/**
 * Request/response cycle shared by the blocking transports: encode, write, read the response
 * in as many steps as the codec asks for, decode and match it against the request.
 */
public abstract class AbstractTransport implements ModbusTransport {
	protected final Logger log;
	protected final FrameCodec codec;
	protected final int timeout;
	protected final int pause;
	protected final ModbusDiagnostics diagnostics;
	protected final byte[] buffer;
	private final ReentrantLock lock = new ReentrantLock(true);

	protected AbstractTransport(FrameCodec codec, int timeout, int pause, ModbusDiagnostics diagnostics, Logger log) {
		if (timeout <= 0)
			throw new IllegalArgumentException("Invalid timeout: " + timeout);
		if (pause < 0)
			throw new IllegalArgumentException("Invalid pause: " + pause);
		this.log = log;
		this.codec = codec;
		this.timeout = timeout;
		this.pause = pause;
		this.diagnostics = diagnostics;
		this.buffer = new byte[codec.getMaxFrameSize()];
	}

	/**
	 * Called before each request, with the lock held. Throws if the channel isn't usable.
	 */
	protected abstract void prepare() throws ModbusLinkException;

	protected abstract int nextTransactionId();

	protected abstract void sendData(byte[] frame) throws ModbusLinkException;

	protected abstract int readData(int offset, int length, int timeoutMillis) throws ModbusLinkException, InterruptedException;

	protected boolean isBroadcast(int unitId) {
		return false;
	}

	/**
	 * Called with the lock held after a failed exchange, before the error is thrown.
	 */
	protected void exchangeFailed(ModbusLinkException e) {
	}

	public FrameCodec getCodec() {
		return codec;
	}

	@Override
	public int getMaxUnitId() {
		return codec.getMaxUnitId();
	}

	public int getTimeout() {
		return timeout;
	}

	static void checkUnitId(int unitId, int maxUnitId) {
		if ((unitId < 0) || (unitId > maxUnitId))
			throw new IllegalArgumentException("Invalid unit id: " + unitId + ". Must be 0.." + maxUnitId);
	}

	@Override
	public ModbusPdu exchange(int unitId, ModbusPdu request) throws ModbusLinkException, InterruptedException {
		checkUnitId(unitId, getMaxUnitId());
		lock.lockInterruptibly();
		try {
			if (pause > 0)
				Thread.sleep(pause);
			prepare();
			int transactionId = nextTransactionId();
			byte[] frame = codec.encode(new ModbusFrame(transactionId, unitId, request));
			try {
				sendData(frame);
				diagnostics.onFrameSent(getName(), frame, frame.length);
				if (isBroadcast(unitId))
					return null;
				int size = readFrame(unitId);
				diagnostics.onFrameReceived(getName(), buffer, size);
				ModbusFrame response = codec.decode(buffer, size);
				checkResponse(transactionId, unitId, request, response);
				return response.getPdu();
			} catch (ModbusLinkException e) {
				diagnostics.onFrameError(getName(), e);
				exchangeFailed(e);
				throw e;
			}
		} finally {
			lock.unlock();
		}
	}

	private int readFrame(int unitId) throws ModbusLinkException, InterruptedException {
		long deadline = System.currentTimeMillis() + timeout;
		int length = 0;
		int need = codec.remaining(buffer, length, false);
		while (need > 0) {
			int wait = (int) (deadline - System.currentTimeMillis());
			if (wait <= 0) {
				if ((length > 0) && log.isTraceEnabled())
					log.trace("Read (incomplete): " + ModbusPdu.toHex(buffer, 0, length));
				throw new ModbusTimeoutException("Response from " + unitId + " timeout (" + length + " bytes, need "
						+ (length + need) + ")", length);
			}
			if (length + need > buffer.length)
				throw new InvalidResponseException("Frame exceeds " + buffer.length + " bytes");
			length += readData(length, need, wait);
			need = codec.remaining(buffer, length, false);
		}
		return length;
	}

	protected void checkResponse(int transactionId, int unitId, ModbusPdu request, ModbusFrame response) throws ModbusLinkException {
		if (response.getUnitId() != unitId) {
			log.warn("Invalid id: {} (expected: {})", response.getUnitId(), unitId);
			throw new InvalidResponseException("Invalid unit id: " + response.getUnitId() + " (expected: " + unitId + ")");
		}
		int function = response.getPdu().getFunction();
		if ((function & 0x7F) != request.getFunction()) {
			log.warn("Invalid function: {} (expected: {})", function, request.getFunction());
			throw new InvalidResponseException("Invalid function: " + function + " (expected: " + request.getFunction() + ")");
		}
	}

	@Override
	public String toString() {
		return codec.getName() + " " + getName();
	}

}
