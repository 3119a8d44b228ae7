package certa.modbuslink.server;

import static certa.modbuslink.server.ModbusSerialServerTest.await;
import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import certa.modbuslink.ModbusConnectionException;
import certa.modbuslink.ModbusException;
import certa.modbuslink.ModbusExceptionCode;
import certa.modbuslink.ModbusWordOrder;
import certa.modbuslink.ModbusByteOrder;
import certa.modbuslink.client.ModbusClient;
import certa.modbuslink.transport.TcpTransport;

final class ModbusTcpServerTest {

	private ModbusTcpServer server;
	private ModbusTcpServer other;
	private ModbusClient client;

	@AfterEach
	void tearDown() {
		if (client != null)
			client.close();
		if (server != null)
			server.stop();
		if (other != null)
			other.stop();
	}

	private static ModbusClient connect(ModbusTcpServer server) throws ModbusConnectionException {
		ModbusClient c = new ModbusClient(new TcpTransport("127.0.0.1", server.getLocalPort(), 1000, 1000, 0));
		c.open();
		return c;
	}

	@Test
	void servesRequests() throws Exception {
		ModbusDataStore store = new ModbusDataStore(100, 100, 100, 100);
		server = new ModbusTcpServer("127.0.0.1", 0, 0, 1, store);
		server.start();
		assertTrue(server.isRunning());
		assertTrue(server.getLocalPort() > 0);

		client = connect(server);
		client.writeMultipleRegisters(1, 10, new int[] { 1, 2, 3 });
		assertArrayEquals(new int[] { 1, 2, 3 }, client.readHoldingRegisters(1, 10, 3));
		client.writeInt64(1, 20, -5L, ModbusByteOrder.LITTLE, ModbusWordOrder.LOW_FIRST);
		assertEquals(-5L, client.readInt64(1, 20, ModbusByteOrder.LITTLE, ModbusWordOrder.LOW_FIRST));
		client.writeString(1, 40, "pump-7");
		assertEquals("pump-7", client.readString(1, 40, 6));

		ModbusException e = assertThrows(ModbusException.class, () -> client.readCoils(1, 99, 2));
		assertEquals(ModbusExceptionCode.ILLEGAL_DATA_ADDRESS, e.getCode());
		assertTrue(client.isOpen());
	}

	@Test
	void tcpAnswersBroadcastAndWildcardUnit() throws Exception {
		ModbusDataStore store = new ModbusDataStore(10, 10, 10, 10);
		server = new ModbusTcpServer("127.0.0.1", 0, 0, 3, store);
		server.start();
		client = connect(server);
		store.writeRegisters(DataKind.INPUT_REGISTER, 0, new int[] { 77 });
		assertArrayEquals(new int[] { 77 }, client.readInputRegisters(255, 0, 1));
		client.writeSingleRegister(0, 1, 5);
		assertEquals(5, store.readRegisters(DataKind.HOLDING_REGISTER, 1, 1)[0]);
	}

	@Test
	void instancesAreIndependent() throws Exception {
		ModbusDataStore storeA = new ModbusDataStore(10, 10, 10, 10);
		ModbusDataStore storeB = new ModbusDataStore(10, 10, 10, 10);
		server = new ModbusTcpServer("127.0.0.1", 0, 0, 1, storeA);
		other = new ModbusTcpServer("127.0.0.1", 0, 0, 2, storeB);
		server.start();
		other.start();
		assertNotEquals(server.getLocalPort(), other.getLocalPort());

		client = connect(server);
		try (ModbusClient second = connect(other)) {
			client.writeSingleRegister(1, 0, 11);
			second.writeSingleRegister(2, 0, 22);
		}
		assertEquals(11, storeA.readRegisters(DataKind.HOLDING_REGISTER, 0, 1)[0]);
		assertEquals(22, storeB.readRegisters(DataKind.HOLDING_REGISTER, 0, 1)[0]);
	}

	@Test
	void tracksConnectedClients() throws Exception {
		server = new ModbusTcpServer("127.0.0.1", 0, 0, 1, new ModbusDataStore(1, 1, 1, 1));
		server.start();
		assertEquals(0, server.getConnectedClientsCount());
		client = connect(server);
		await(() -> server.getConnectedClientsCount() == 1);
		client.close();
		await(() -> server.getConnectedClientsCount() == 0);
	}

	@Test
	void stopClosesListener() throws Exception {
		server = new ModbusTcpServer("127.0.0.1", 0, 0, 1, new ModbusDataStore(1, 1, 1, 1));
		server.start();
		int port = server.getLocalPort();
		server.stop();
		assertFalse(server.isRunning());
		assertEquals(-1, server.getLocalPort());
		ModbusClient c = new ModbusClient(new TcpTransport("127.0.0.1", port, 500, 500, 0));
		assertThrows(ModbusConnectionException.class, c::open);
	}

}
