package certa.modbuslink;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

public final class Slf4jModbusDiagnostics implements ModbusDiagnostics {

	private final Logger log;

	public Slf4jModbusDiagnostics() {
		this(LoggerFactory.getLogger(Slf4jModbusDiagnostics.class));
	}

	public Slf4jModbusDiagnostics(Logger log) {
		this.log = log;
	}

	@Override
	public void onFrameSent(String channel, byte[] frame, int length) {
		if (log.isTraceEnabled())
			log.trace("{} write: {}", channel, ModbusPdu.toHex(frame, 0, length));
	}

	@Override
	public void onFrameReceived(String channel, byte[] frame, int length) {
		if (log.isTraceEnabled())
			log.trace("{} read: {}", channel, ModbusPdu.toHex(frame, 0, length));
	}

	@Override
	public void onFrameError(String channel, ModbusLinkException error) {
		if (log.isWarnEnabled())
			log.warn("{}: {} ({})", channel, error.getMessage(), error.getKind());
	}

}
