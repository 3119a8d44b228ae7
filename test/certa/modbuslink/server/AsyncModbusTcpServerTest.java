package certa.modbuslink.server;

import static certa.modbuslink.server.ModbusSerialServerTest.await;
import static org.junit.jupiter.api.Assertions.*;

import java.io.DataInputStream;
import java.io.OutputStream;
import java.net.Socket;
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.TimeUnit;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import certa.modbuslink.ModbusPdu;
import certa.modbuslink.ModbusTimeoutException;
import certa.modbuslink.client.AsyncModbusClient;
import certa.modbuslink.client.ModbusClient;
import certa.modbuslink.frame.ModbusFrame;
import certa.modbuslink.frame.TcpFrameCodec;
import certa.modbuslink.transport.AsyncTcpTransport;
import certa.modbuslink.transport.TcpTransport;

final class AsyncModbusTcpServerTest {

	private final ModbusDataStore store = new ModbusDataStore(50, 50, 50, 50);
	private AsyncModbusTcpServer server;

	@BeforeEach
	void setUp() throws Exception {
		server = new AsyncModbusTcpServer("127.0.0.1", 0, 1, store);
		server.start();
	}

	@AfterEach
	void tearDown() {
		server.stop();
	}

	@Test
	void servesAsyncClient() throws Exception {
		AsyncModbusClient client = new AsyncModbusClient(new AsyncTcpTransport("127.0.0.1", server.getLocalPort(), 1000, 1000));
		client.open().get(2, TimeUnit.SECONDS);
		try {
			CompletableFuture<Void> w = client.writeMultipleRegisters(1, 0, new int[] { 4, 5, 6 });
			CompletableFuture<int[]> r = client.readHoldingRegisters(1, 0, 3);
			w.get(2, TimeUnit.SECONDS);
			assertArrayEquals(new int[] { 4, 5, 6 }, r.get(2, TimeUnit.SECONDS));
			assertEquals(1.25, client.writeFloat64(1, 10, 1.25).thenCompose(v -> client.readFloat64(1, 10))
					.get(2, TimeUnit.SECONDS), 0.0);
		} finally {
			client.close().get(2, TimeUnit.SECONDS);
		}
	}

	@Test
	void servesBlockingClient() throws Exception {
		try (ModbusClient client = new ModbusClient(new TcpTransport("127.0.0.1", server.getLocalPort(), 1000, 1000, 0))) {
			client.open();
			client.writeSingleCoil(1, 7, true);
			assertTrue(client.readCoils(1, 7, 1)[0]);
			await(() -> server.getConnectedClientsCount() == 1);
		}
		await(() -> server.getConnectedClientsCount() == 0);
	}

	@Test
	void pipelinedRequestsAreAnsweredInOrder() throws Exception {
		store.writeRegisters(DataKind.INPUT_REGISTER, 0, new int[] { 100, 200 });
		byte[] first = TcpFrameCodec.INSTANCE.encode(new ModbusFrame(7, 1, ModbusPdu.of(new byte[] { 0x04, 0x00, 0x00, 0x00, 0x01 })));
		byte[] second = TcpFrameCodec.INSTANCE.encode(new ModbusFrame(8, 1, ModbusPdu.of(new byte[] { 0x04, 0x00, 0x01, 0x00, 0x01 })));
		byte[] both = new byte[first.length + second.length];
		System.arraycopy(first, 0, both, 0, first.length);
		System.arraycopy(second, 0, both, first.length, second.length);

		try (Socket s = new Socket("127.0.0.1", server.getLocalPort())) {
			s.setSoTimeout(2000);
			OutputStream out = s.getOutputStream();
			out.write(both);
			out.flush();
			DataInputStream in = new DataInputStream(s.getInputStream());
			byte[] resp = new byte[11];
			in.readFully(resp);
			ModbusFrame a = TcpFrameCodec.INSTANCE.decode(resp, resp.length);
			in.readFully(resp);
			ModbusFrame b = TcpFrameCodec.INSTANCE.decode(resp, resp.length);
			assertEquals(7, a.getTransactionId());
			assertEquals(100, a.getPdu().readInt16FromPDU(2, true));
			assertEquals(8, b.getTransactionId());
			assertEquals(200, b.getPdu().readInt16FromPDU(2, true));
		}
	}

	@Test
	void otherUnitIsNotAnswered() throws Exception {
		try (ModbusClient client = new ModbusClient(new TcpTransport("127.0.0.1", server.getLocalPort(), 1000, 300, 0))) {
			client.open();
			assertThrows(ModbusTimeoutException.class, () -> client.readHoldingRegisters(9, 0, 1));
		}
	}

}
