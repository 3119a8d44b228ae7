package certa.modbuslink.server;

import static org.junit.jupiter.api.Assertions.*;

import java.nio.charset.StandardCharsets;
import java.util.Arrays;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.BeforeEach;
import org.junit.jupiter.api.Test;

import certa.modbuslink.ModbusConnectionException;
import certa.modbuslink.ModbusPdu;
import certa.modbuslink.NullModbusDiagnostics;
import certa.modbuslink.client.ModbusClient;
import certa.modbuslink.frame.AsciiFrameCodec;
import certa.modbuslink.frame.ModbusFrame;
import certa.modbuslink.frame.RtuFrameCodec;
import certa.modbuslink.serial.FakeSerialLine;
import certa.modbuslink.transport.SerialTransport;

final class AsyncModbusSerialServerTest {

	private final FakeSerialLine[] lines = FakeSerialLine.pair("master", "slave");
	private final ModbusDataStore store = new ModbusDataStore(16, 16, 16, 16);
	private AsyncModbusSerialServer server;
	private ModbusClient client;

	@BeforeEach
	void setUp() throws Exception {
		server = new AsyncModbusSerialServer(lines[1], AsciiFrameCodec.INSTANCE, 5, store);
		server.start();
		client = new ModbusClient(SerialTransport.ascii(lines[0], 500, 0));
		client.open();
	}

	@AfterEach
	void tearDown() {
		client.close();
		server.stop();
	}

	@Test
	void asciiRequestsAreAnswered() throws Exception {
		store.writeRegisters(DataKind.INPUT_REGISTER, 0, new int[] { 0x1234 });
		assertArrayEquals(new int[] { 0x1234 }, client.readInputRegisters(5, 0, 1));
		client.writeMultipleCoils(5, 0, new boolean[] { true, true, false, true });
		assertArrayEquals(new boolean[] { true, true, false, true }, store.readBits(DataKind.COIL, 0, 4));
		String last = new String(lines[1].getWritten().get(1), StandardCharsets.US_ASCII);
		assertTrue(last.startsWith(":050F") && last.endsWith("\r\n"), last);
	}

	@Test
	void requestSplitAcrossEvents() throws Exception {
		byte[] frame = ":050300000001F7\r\n".getBytes(StandardCharsets.US_ASCII);
		store.writeRegisters(DataKind.HOLDING_REGISTER, 0, new int[] { 9 });
		lines[1].feed(Arrays.copyOfRange(frame, 0, 6));
		lines[1].feed(Arrays.copyOfRange(frame, 6, frame.length));
		assertEquals(":0503020009ED\r\n", new String(lines[1].getWritten().get(0), StandardCharsets.US_ASCII));
	}

	@Test
	void garbageIsDropped() throws Exception {
		lines[1].feed("xyz".getBytes(StandardCharsets.US_ASCII));
		assertTrue(lines[1].getWritten().isEmpty());
		assertArrayEquals(new int[] { 0 }, client.readHoldingRegisters(5, 0, 1));
	}

	@Test
	void stopReleasesLine() throws Exception {
		server.stop();
		assertFalse(server.isRunning());
		assertFalse(lines[1].isOpen());
		lines[1].setFailOpen(true);
		assertThrows(ModbusConnectionException.class, server::start);
		assertFalse(server.isRunning());
	}

	@Test
	void unsupportedRtuFunctionGetsIllegalFunction() throws Exception {
		FakeSerialLine[] rtu = FakeSerialLine.pair("rtu-master", "rtu-slave");
		AsyncModbusSerialServer rtuServer = new AsyncModbusSerialServer(rtu[1], RtuFrameCodec.INSTANCE, 20, 17, store,
				null, NullModbusDiagnostics.INSTANCE);
		rtuServer.start();
		try {
			byte[] request = RtuFrameCodec.INSTANCE.encode(new ModbusFrame(17, ModbusPdu.of(new byte[] { 0x07 })));
			rtu[1].feed(Arrays.copyOfRange(request, 0, 3));
			rtu[1].feed(Arrays.copyOfRange(request, 3, request.length));
			ModbusSerialServerTest.await(() -> !rtu[1].getWritten().isEmpty());
			byte[] answer = rtu[1].getWritten().get(0);
			ModbusFrame frame = RtuFrameCodec.INSTANCE.decode(answer, answer.length);
			assertEquals(17, frame.getUnitId());
			assertEquals(ModbusPdu.of(new byte[] { (byte) 0x87, 0x01 }), frame.getPdu());

			store.writeRegisters(DataKind.HOLDING_REGISTER, 3, new int[] { 33 });
			ModbusClient rtuClient = new ModbusClient(SerialTransport.rtu(rtu[0], 500, 0));
			rtuClient.open();
			try {
				assertArrayEquals(new int[] { 33 }, rtuClient.readHoldingRegisters(17, 3, 1));
			} finally {
				rtuClient.close();
			}
		} finally {
			rtuServer.stop();
		}
	}

}
