package certa.modbuslink.transport;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetSocketAddress;
import java.net.Socket;
import java.net.SocketTimeoutException;

import org.slf4j.LoggerFactory;

import certa.modbuslink.InvalidResponseException;
import certa.modbuslink.ModbusConnectionException;
import certa.modbuslink.ModbusDiagnostics;
import certa.modbuslink.ModbusLinkException;
import certa.modbuslink.ModbusPdu;
import certa.modbuslink.Slf4jModbusDiagnostics;
import certa.modbuslink.frame.ModbusFrame;
import certa.modbuslink.frame.TcpFrameCodec;

/**
 * Modbus TCP client side over a plain socket. After a timeout, an I/O error or a malformed or
 * mismatched response (e.g. unexpected transaction id) the socket is closed and must be reopened by the caller.
 */
public class TcpTransport extends AbstractTransport {

	private final String remoteHost;
	private final int remotePort;
	private final int connectTimeout;
	private Socket socket;
	private InputStream in;
	private OutputStream out;
	private int transactionId = 0;

	public TcpTransport(String remoteHost, int remotePort, int connectTimeout, int responseTimeout, int pause) {
		this(remoteHost, remotePort, connectTimeout, responseTimeout, pause, new Slf4jModbusDiagnostics());
	}

	public TcpTransport(String remoteHost, int remotePort, int connectTimeout, int responseTimeout, int pause,
			ModbusDiagnostics diagnostics) {
		super(TcpFrameCodec.INSTANCE, responseTimeout, pause, diagnostics, LoggerFactory.getLogger(TcpTransport.class));
		this.remoteHost = remoteHost;
		this.remotePort = remotePort;
		this.connectTimeout = connectTimeout;
	}

	@Override
	public String getName() {
		return remoteHost + ":" + remotePort;
	}

	// this method must be synchronized with close()
	@Override
	synchronized public void open() throws ModbusConnectionException {
		if ((socket != null) && !socket.isClosed())
			return;
		log.info("Opening socket: {}, respTO: {}, connTO: {}, pause: {}", getName(), timeout, connectTimeout, pause);
		Socket s = new Socket();
		try {
			s.setSoLinger(true, 0); // abortive close with RST
			s.setTcpNoDelay(true);
			s.connect(new InetSocketAddress(remoteHost, remotePort), connectTimeout);
			in = s.getInputStream();
			out = s.getOutputStream();
		} catch (IOException e) {
			try {
				s.close();
			} catch (IOException e2) {
				e.addSuppressed(e2);
			}
			throw new ModbusConnectionException("Can't connect to " + getName() + ": " + e.getMessage(), e);
		}
		socket = s;
		log.info("Socket opened: {} <-> {}", s.getLocalSocketAddress(), s.getRemoteSocketAddress());
	}

	@Override
	synchronized public boolean isOpen() {
		return (socket != null) && !socket.isClosed();
	}

	// this method may be called from other thread
	@Override
	synchronized public void close() {
		if ((socket != null) && !socket.isClosed()) {
			log.info("Closing socket {}", getName());
			try {
				socket.close();
			} catch (IOException e) {
				log.error("Error closing socket {}: {}", socket.getRemoteSocketAddress(), e.toString());
			}
			log.info("Socket closed");
		}
	}

	@Override
	protected void prepare() throws ModbusLinkException {
		if (!isOpen())
			throw new ModbusConnectionException("Socket " + getName() + " is not open");
	}

	@Override
	protected int nextTransactionId() {
		transactionId++;
		if (transactionId > 65535)
			transactionId = 1;
		return transactionId;
	}

	@Override
	protected void sendData(byte[] frame) throws ModbusLinkException {
		try {
			out.write(frame);
			out.flush();
		} catch (IOException e) {
			throw new ModbusConnectionException("Write error on " + getName() + ": " + e.getMessage(), e);
		}
	}

	@Override
	protected int readData(int offset, int length, int timeoutMillis) throws ModbusLinkException {
		try {
			socket.setSoTimeout(timeoutMillis);
			int res = in.read(buffer, offset, length);
			if (res < 0)
				throw new ModbusConnectionException("Connection closed by " + getName());
			return res;
		} catch (SocketTimeoutException e) {
			return 0;
		} catch (IOException e) {
			throw new ModbusConnectionException("Read error on " + getName() + ": " + e.getMessage(), e);
		}
	}

	@Override
	protected void checkResponse(int transactionId, int unitId, ModbusPdu request, ModbusFrame response) throws ModbusLinkException {
		if (response.getTransactionId() != transactionId) {
			log.warn("Invalid transaction id: {} (expected: {})", response.getTransactionId(), transactionId);
			throw new InvalidResponseException("Invalid transaction id: " + response.getTransactionId()
					+ " (expected: " + transactionId + ")");
		}
		super.checkResponse(transactionId, unitId, request, response);
	}

	@Override
	protected void exchangeFailed(ModbusLinkException e) {
		// the position in the stream is unknown now, so the connection can't be reused
		switch (e.getKind()) {
		case TIMEOUT:
		case CONNECTION:
		case INVALID_RESPONSE:
			close();
			break;
		default:
			break;
		}
	}

}
