package certa.modbuslink.server;

import java.io.Closeable;
import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.net.SocketException;
import java.net.SocketTimeoutException;
import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.atomic.AtomicBoolean;

import org.slf4j.LoggerFactory;

import certa.modbuslink.ModbusConnectionException;
import certa.modbuslink.ModbusDiagnostics;
import certa.modbuslink.ModbusLinkException;
import certa.modbuslink.ModbusPdu;
import certa.modbuslink.Slf4jModbusDiagnostics;
import certa.modbuslink.frame.ModbusFrame;
import certa.modbuslink.frame.TcpFrameCodec;

/**
 * Blocking Modbus TCP server, one thread per client connection.
 */
public class ModbusTcpServer extends AModbusServer implements Runnable {

	public static final int MAX_CONNECTIONS = 10;

	private final String localAddressString; // null means any
	private final int localPort; // zero means ephemeral
	private final int clientTimeout; // idle time before disconnect, 0 = never
	private final int maxConnections;

	private final AtomicBoolean active = new AtomicBoolean(false);
	private Thread thread;
	private final List<ModbusTcpServerConnection> connections = new ArrayList<ModbusTcpServerConnection>();
	private volatile ServerSocket serverSocket;

	public ModbusTcpServer(String localIP, int localPort, int clientTimeout, int unitId, DataStore store) {
		this(localIP, localPort, clientTimeout, MAX_CONNECTIONS, unitId, store, null, new Slf4jModbusDiagnostics());
	}

	public ModbusTcpServer(String localIP, int localPort, int clientTimeout, int maxConnections,
			int unitId, DataStore store, RequestProcessor processor, ModbusDiagnostics diagnostics)
	{
		super(unitId, store, processor, true, diagnostics, LoggerFactory.getLogger(ModbusTcpServer.class));
		this.localAddressString = (localIP != null) ? localIP : "0.0.0.0";
		this.localPort = localPort;
		this.clientTimeout = clientTimeout;
		this.maxConnections = maxConnections;
	}

	/**
	 * Binds the listening socket before returning, so {@link #getLocalPort()} is known.
	 */
	@Override
	synchronized public void start() throws ModbusConnectionException {
		if (active.get())
			return;
		log.info("Starting server on {}:{}", localAddressString, localPort);
		try {
			serverSocket = new ServerSocket(localPort, 0, InetAddress.getByName(localAddressString));
		} catch (IOException e) {
			throw new ModbusConnectionException("Can't listen on " + localAddressString + ":" + localPort + ": " + e.getMessage(), e);
		}
		active.set(true);
		thread = new Thread(this, "modbus-tcp-server-" + getLocalPort());
		thread.setDaemon(true);
		thread.start();
	}

	@Override
	synchronized public void stop() {
		if (active.getAndSet(false)) {
			log.info("Stopping server");
			thread.interrupt();
			closeSocket();
			try {
				thread.join();
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
			}
			thread = null; // we must create new thread to restart
		}
	}

	@Override
	public boolean isRunning() {
		return active.get();
	}

	/**
	 * @return bound port, or -1 if the server isn't running
	 */
	public int getLocalPort() {
		ServerSocket s = serverSocket;
		return ((s != null) && !s.isClosed()) ? s.getLocalPort() : -1;
	}

	public int getConnectedClientsCount() {
		synchronized (connections) {
			return connections.size();
		}
	}

	private void closeSocket() {
		try {
			if (serverSocket != null)
				serverSocket.close();
		} catch (IOException e) {
			log.error("Error closing server socket", e);
		}
	}

	@Override
	public void run() {
		log.debug("SERVER THREAD START");
		try {
			while (active.get() && !Thread.currentThread().isInterrupted())
				acceptConnection(serverSocket.accept());
		} catch (SocketException e) {
			if (active.get())
				log.error("SocketException in main cycle: {}", e.getMessage());
		} catch (IOException e) {
			log.error("EXCEPTION in main cycle", e);
		}
		active.set(false);
		closeSocket();
		closeConnections();
		log.debug("SERVER THREAD END");
	}

	private void acceptConnection(Socket socket) throws IOException {
		synchronized (connections) {
			if (connections.size() < maxConnections) {
				socket.setSoTimeout(clientTimeout);
				socket.setTcpNoDelay(true);
				ModbusTcpServerConnection conn = new ModbusTcpServerConnection(this, socket);
				connections.add(conn);
				conn.start();
				return;
			}
		}
		log.warn("Too many connections, rejecting {}", socket.getRemoteSocketAddress());
		socket.close();
	}

	void unregisterConnection(ModbusTcpServerConnection conn) {
		synchronized (connections) {
			connections.remove(conn);
		}
	}

	private void closeConnections() {
		List<ModbusTcpServerConnection> copy;
		synchronized (connections) {
			copy = new ArrayList<ModbusTcpServerConnection>(connections);
		}
		for (ModbusTcpServerConnection c : copy)
			c.close();
	}

}

class ModbusTcpServerConnection implements Runnable, Closeable {

	private final ModbusTcpServer server;
	private final AtomicBoolean active = new AtomicBoolean(true);
	private final Thread thread;
	private final Socket socket;
	private final String name;
	private final TcpFrameCodec codec = TcpFrameCodec.INSTANCE;
	private final byte[] buffer = new byte[TcpFrameCodec.INSTANCE.getMaxFrameSize()];

	ModbusTcpServerConnection(ModbusTcpServer server, Socket socket) {
		this.server = server;
		this.socket = socket;
		this.name = String.valueOf(socket.getRemoteSocketAddress());
		thread = new Thread(this, "modbus-tcp-conn-" + name);
		thread.setDaemon(true);
	}

	void start() {
		thread.start();
	}

	@Override
	public void close() {
		if (active.getAndSet(false)) {
			server.log.debug("Closing connection {}", name);
			thread.interrupt();
			closeSocket();
			if (Thread.currentThread() != thread) {
				try {
					thread.join();
				} catch (InterruptedException e) {
					Thread.currentThread().interrupt();
				}
			}
		}
	}

	private void closeSocket() {
		try {
			socket.close();
		} catch (IOException e) {
			server.log.error("Error closing connection {}", name, e);
		}
	}

	/**
	 * @return frame size, -1 at end of stream
	 */
	private int readRequest(InputStream in) throws IOException, ModbusLinkException {
		int length = 0;
		int need = codec.remaining(buffer, length, true);
		while (need > 0) {
			int res = in.read(buffer, length, need);
			if (res < 0) {
				if (length > 0)
					server.logData("Read (incomplete): ", buffer, 0, length);
				return -1;
			}
			length += res;
			need = codec.remaining(buffer, length, true);
		}
		return length;
	}

	@Override
	public void run() {
		server.log.info("Client connected: {}", name);
		try {
			InputStream in = socket.getInputStream();
			OutputStream out = socket.getOutputStream();
			while (active.get() && !Thread.currentThread().isInterrupted()) {
				int size = readRequest(in);
				if (size < 0)
					break;
				server.diagnostics.onFrameReceived(name, buffer, size);
				ModbusFrame request = codec.decode(buffer, size);
				ModbusPdu response = server.handle(request);
				if (response == null)
					continue;
				byte[] frame = codec.encode(new ModbusFrame(request.getTransactionId(), request.getUnitId(), response));
				out.write(frame);
				out.flush();
				server.diagnostics.onFrameSent(name, frame, frame.length);
			}
		} catch (SocketTimeoutException e) {
			server.log.debug("Client {} idle timeout", name);
		} catch (ModbusLinkException e) {
			server.diagnostics.onFrameError(name, e);
		} catch (IOException e) {
			if (active.get())
				server.log.debug("Connection {} error: {}", name, e.toString());
		}
		active.set(false);
		closeSocket();
		server.unregisterConnection(this);
		server.log.info("Client disconnected: {}", name);
	}

}
