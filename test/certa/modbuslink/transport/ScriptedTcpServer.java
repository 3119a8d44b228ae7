package certa.modbuslink.transport;

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.net.InetAddress;
import java.net.ServerSocket;
import java.net.Socket;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.function.Function;

import certa.modbuslink.ModbusLinkException;
import certa.modbuslink.ModbusPdu;
import certa.modbuslink.frame.FrameReader;
import certa.modbuslink.frame.ModbusFrame;
import certa.modbuslink.frame.TcpFrameCodec;

/**
 * Loopback Modbus TCP peer whose answers come from a script. Accepts connections one after another.
 */
final class ScriptedTcpServer implements AutoCloseable {

	private final ServerSocket serverSocket;
	private final Function<ModbusFrame, byte[]> script;
	private final List<ModbusFrame> requests = new CopyOnWriteArrayList<>();
	private final Thread thread;
	private volatile int connections;

	/**
	 * @param script - gets every request, returns the raw bytes to send back or null for silence
	 */
	ScriptedTcpServer(Function<ModbusFrame, byte[]> script) throws IOException {
		this.script = script;
		this.serverSocket = new ServerSocket(0, 5, InetAddress.getLoopbackAddress());
		this.thread = new Thread(this::run, "scripted-tcp");
		thread.setDaemon(true);
		thread.start();
	}

	int getPort() {
		return serverSocket.getLocalPort();
	}

	List<ModbusFrame> getRequests() {
		return requests;
	}

	int getConnections() {
		return connections;
	}

	static byte[] response(ModbusFrame request, int transactionId, byte... pdu) {
		return TcpFrameCodec.INSTANCE.encode(new ModbusFrame(transactionId, request.getUnitId(),
				ModbusPdu.of(pdu)));
	}

	private void run() {
		while (!serverSocket.isClosed()) {
			try (Socket s = serverSocket.accept()) {
				connections++;
				serve(s.getInputStream(), s.getOutputStream());
			} catch (IOException | ModbusLinkException e) {
				// connection ended
			}
		}
	}

	private void serve(InputStream in, OutputStream out) throws IOException, ModbusLinkException {
		FrameReader reader = new FrameReader(TcpFrameCodec.INSTANCE, true);
		byte[] chunk = new byte[1];
		while (true) {
			int n = in.read(chunk);
			if (n < 0)
				return;
			reader.feed(chunk, 0, n);
			if (reader.isComplete()) {
				ModbusFrame request = reader.decode();
				requests.add(request);
				byte[] answer = script.apply(request);
				if (answer != null) {
					out.write(answer);
					out.flush();
				}
			}
		}
	}

	@Override
	public void close() throws IOException {
		serverSocket.close();
	}

}
