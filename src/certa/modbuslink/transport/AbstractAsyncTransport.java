package certa.modbuslink.transport;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.Executors;
import java.util.concurrent.ScheduledExecutorService;
import java.util.concurrent.ScheduledFuture;
import java.util.concurrent.TimeUnit;

import org.slf4j.Logger;

import certa.modbuslink.InvalidResponseException;
import certa.modbuslink.ModbusConnectionException;
import certa.modbuslink.ModbusDiagnostics;
import certa.modbuslink.ModbusLinkException;
import certa.modbuslink.ModbusPdu;
import certa.modbuslink.ModbusTimeoutException;
import certa.modbuslink.frame.FrameCodec;
import certa.modbuslink.frame.FrameReader;
import certa.modbuslink.frame.ModbusFrame;

/**
 * Exchange queue of the event driven transports. Each exchange starts when the previous one
 * has completed; incoming bytes are handed to {@link #onReceive(byte[])} by the subclass.
 */
public abstract class AbstractAsyncTransport implements AsyncModbusTransport {

	private static final ScheduledExecutorService timer = Executors.newSingleThreadScheduledExecutor(r -> {
		Thread t = new Thread(r, "modbus-timeouts");
		t.setDaemon(true);
		return t;
	});

	protected final Logger log;
	protected final FrameCodec codec;
	protected final int timeout;
	protected final ModbusDiagnostics diagnostics;
	private final FrameReader reader;
	private CompletableFuture<Void> tail = CompletableFuture.completedFuture(null); // guarded by this
	private Pending pending; // guarded by this

	private static final class Pending {
		final int transactionId;
		final int unitId;
		final ModbusPdu request;
		final CompletableFuture<ModbusPdu> result;
		ScheduledFuture<?> timeoutTask;

		Pending(int transactionId, int unitId, ModbusPdu request, CompletableFuture<ModbusPdu> result) {
			this.transactionId = transactionId;
			this.unitId = unitId;
			this.request = request;
			this.result = result;
		}
	}

	protected AbstractAsyncTransport(FrameCodec codec, int timeout, ModbusDiagnostics diagnostics, Logger log) {
		if (timeout <= 0)
			throw new IllegalArgumentException("Invalid timeout: " + timeout);
		this.log = log;
		this.codec = codec;
		this.timeout = timeout;
		this.diagnostics = diagnostics;
		this.reader = new FrameReader(codec, false);
	}

	protected abstract int nextTransactionId();

	/**
	 * @return future completed when the frame was written, or exceptionally with {@link ModbusConnectionException}
	 */
	protected abstract CompletableFuture<Void> sendData(byte[] frame);

	protected boolean isBroadcast(int unitId) {
		return false;
	}

	/**
	 * Called after a failed exchange, before its future completes.
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

	@Override
	public CompletableFuture<ModbusPdu> exchange(int unitId, ModbusPdu request) {
		AbstractTransport.checkUnitId(unitId, getMaxUnitId());
		CompletableFuture<ModbusPdu> result = new CompletableFuture<>();
		CompletableFuture<Void> previous;
		synchronized (this) {
			previous = tail;
			tail = result.handle((r, e) -> null);
		}
		previous.thenRun(() -> {
			try {
				start(unitId, request, result);
			} catch (RuntimeException e) {
				log.error("Exchange failed to start", e);
				failPending(new ModbusConnectionException("Exchange failed: " + e, e));
				result.completeExceptionally(e);
			}
		});
		return result;
	}

	private void start(int unitId, ModbusPdu request, CompletableFuture<ModbusPdu> result) {
		if (!isOpen()) {
			result.completeExceptionally(new ModbusConnectionException(getName() + " is not open"));
			return;
		}
		byte[] encoded;
		Pending p = null;
		synchronized (this) {
			int transactionId = nextTransactionId();
			try {
				encoded = codec.encode(new ModbusFrame(transactionId, unitId, request));
			} catch (IllegalArgumentException e) {
				result.completeExceptionally(e);
				return;
			}
			reader.reset();
			if (!isBroadcast(unitId)) {
				Pending np = new Pending(transactionId, unitId, request, result);
				np.timeoutTask = timer.schedule(() -> timedOut(np), timeout, TimeUnit.MILLISECONDS);
				pending = np;
				p = np;
			}
		}
		Pending sent = p;
		byte[] frame = encoded;
		sendData(frame).whenComplete((v, e) -> {
			if (e != null) {
				ModbusLinkException error = (e instanceof ModbusLinkException) ? (ModbusLinkException) e
						: new ModbusConnectionException("Write error on " + getName() + ": " + e.getMessage(), e);
				if (sent != null)
					fail(sent, error);
				else {
					diagnostics.onFrameError(getName(), error);
					result.completeExceptionally(error);
				}
				return;
			}
			diagnostics.onFrameSent(getName(), frame, frame.length);
			if (sent == null)
				result.complete(null);
		});
	}

	private void timedOut(Pending p) {
		int received;
		synchronized (this) {
			received = reader.getLength();
		}
		fail(p, new ModbusTimeoutException("Response from " + p.unitId + " timeout (" + received + " bytes)", received));
	}

	private void fail(Pending p, ModbusLinkException e) {
		synchronized (this) {
			if (pending != p)
				return;
			pending = null;
			reader.reset();
		}
		p.timeoutTask.cancel(false);
		diagnostics.onFrameError(getName(), e);
		exchangeFailed(e);
		p.result.completeExceptionally(e);
	}

	protected void failPending(ModbusLinkException e) {
		Pending p;
		synchronized (this) {
			p = pending;
		}
		if (p != null)
			fail(p, e);
	}

	protected void onReceive(byte[] data) {
		Pending p;
		ModbusFrame frame = null;
		ModbusLinkException error = null;
		synchronized (this) {
			p = pending;
			if (p == null) {
				if (log.isWarnEnabled())
					log.warn("Unexpected input: " + ModbusPdu.toHex(data, 0, data.length));
				return;
			}
			try {
				int used = reader.feed(data, 0, data.length);
				if (!reader.isComplete())
					return;
				if ((used < data.length) && log.isWarnEnabled())
					log.warn("Unexpected input after frame: " + ModbusPdu.toHex(data, used, data.length - used));
				diagnostics.onFrameReceived(getName(), reader.getBuffer(), reader.getLength());
				frame = reader.decode();
				checkResponse(p.transactionId, p.unitId, p.request, frame);
			} catch (ModbusLinkException e) {
				error = e;
			}
		}
		if (error != null)
			fail(p, error);
		else {
			synchronized (this) {
				if (pending != p)
					return; // timed out meanwhile
				pending = null;
			}
			p.timeoutTask.cancel(false);
			p.result.complete(frame.getPdu());
		}
	}

	protected void checkResponse(int transactionId, int unitId, ModbusPdu request, ModbusFrame response) throws ModbusLinkException {
		if (response.getUnitId() != unitId)
			throw new InvalidResponseException("Invalid unit id: " + response.getUnitId() + " (expected: " + unitId + ")");
		int function = response.getPdu().getFunction();
		if ((function & 0x7F) != request.getFunction())
			throw new InvalidResponseException("Invalid function: " + function + " (expected: " + request.getFunction() + ")");
	}

	@Override
	public String toString() {
		return codec.getName() + " " + getName();
	}

}
