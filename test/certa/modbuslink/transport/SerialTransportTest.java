package certa.modbuslink.transport;

import static org.junit.jupiter.api.Assertions.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.Future;

import org.junit.jupiter.api.AfterEach;
import org.junit.jupiter.api.Test;

import certa.modbuslink.InvalidResponseException;
import certa.modbuslink.ModbusConnectionException;
import certa.modbuslink.ModbusCrcException;
import certa.modbuslink.ModbusLinkException;
import certa.modbuslink.ModbusPdu;
import certa.modbuslink.ModbusTimeoutException;
import certa.modbuslink.frame.AsciiFrameCodec;
import certa.modbuslink.frame.FrameCodec;
import certa.modbuslink.frame.ModbusFrame;
import certa.modbuslink.frame.RtuFrameCodec;
import certa.modbuslink.serial.FakeSerialLine;

final class SerialTransportTest {

	private static final ModbusPdu READ_2 = ModbusPdu.of(new byte[] { 0x03, 0x00, 0x00, 0x00, 0x02 });

	private final FakeSerialLine line = new FakeSerialLine("COM1");
	private SerialTransport transport;

	@AfterEach
	void tearDown() {
		if (transport != null)
			transport.close();
	}

	/**
	 * Answers read holding registers with one register per request, holding the start address.
	 */
	private static byte[] echoAddress(FrameCodec codec, byte[] request) {
		try {
			ModbusFrame frame = codec.decode(request, request.length);
			int address = frame.getPdu().readInt16FromPDU(1, true);
			ModbusPdu resp = new ModbusPdu(3, 4);
			resp.writeByteToPDU(1, (byte) 2);
			resp.writeInt16ToPDU(2, address);
			return codec.encode(new ModbusFrame(frame.getUnitId(), resp));
		} catch (ModbusLinkException e) {
			throw new IllegalStateException(e);
		}
	}

	private static byte[] rtu(int unitId, int... pdu) {
		byte[] b = new byte[pdu.length];
		for (int i = 0; i < pdu.length; i++)
			b[i] = (byte) pdu[i];
		return RtuFrameCodec.INSTANCE.encode(new ModbusFrame(unitId, ModbusPdu.of(b)));
	}

	@Test
	void exchangeReturnsResponsePdu() throws Exception {
		line.setResponder(req -> rtu(1, 0x03, 0x04, 0x00, 0x0A, 0x00, 0x0B));
		transport = SerialTransport.rtu(line, 500, 0);
		transport.open();

		ModbusPdu resp = transport.exchange(1, READ_2);
		assertEquals(ModbusPdu.of(new byte[] { 0x03, 0x04, 0x00, 0x0A, 0x00, 0x0B }), resp);
		assertArrayEquals(new byte[] { 0x01, 0x03, 0x00, 0x00, 0x00, 0x02, (byte) 0xC4, 0x0B }, line.getWritten().get(0));
	}

	@Test
	void timeoutKeepsLineOpen() throws Exception {
		transport = SerialTransport.rtu(line, 100, 0);
		transport.open();

		ModbusTimeoutException e = assertThrows(ModbusTimeoutException.class, () -> transport.exchange(1, READ_2));
		assertEquals(0, e.getBytesReceived());
		assertTrue(transport.isOpen());

		line.setResponder(req -> rtu(1, 0x03, 0x04, 0x00, 0x0A, 0x00, 0x0B));
		assertNotNull(transport.exchange(1, READ_2));
	}

	@Test
	void partialResponseTimesOut() throws Exception {
		line.setResponder(req -> Arrays.copyOf(rtu(1, 0x03, 0x04, 0x00, 0x0A, 0x00, 0x0B), 3));
		transport = SerialTransport.rtu(line, 100, 0);
		transport.open();

		ModbusTimeoutException e = assertThrows(ModbusTimeoutException.class, () -> transport.exchange(1, READ_2));
		assertEquals(3, e.getBytesReceived());
		assertEquals(ModbusLinkException.Kind.TIMEOUT, e.getKind());
	}

	@Test
	void crcErrorIsReported() throws Exception {
		line.setResponder(req -> {
			byte[] resp = rtu(1, 0x03, 0x04, 0x00, 0x0A, 0x00, 0x0B);
			resp[resp.length - 1] ^= 0x01;
			return resp;
		});
		transport = SerialTransport.rtu(line, 500, 0);
		transport.open();
		assertThrows(ModbusCrcException.class, () -> transport.exchange(1, READ_2));
	}

	@Test
	void unitMismatchIsInvalid() throws Exception {
		line.setResponder(req -> rtu(2, 0x03, 0x04, 0x00, 0x0A, 0x00, 0x0B));
		transport = SerialTransport.rtu(line, 500, 0);
		transport.open();
		assertThrows(InvalidResponseException.class, () -> transport.exchange(1, READ_2));
	}

	@Test
	void functionMismatchIsInvalid() throws Exception {
		line.setResponder(req -> rtu(1, 0x04, 0x02, 0x00, 0x0A));
		transport = SerialTransport.rtu(line, 500, 0);
		transport.open();
		assertThrows(InvalidResponseException.class, () -> transport.exchange(1, READ_2));
	}

	@Test
	void exceptionResponseIsReturned() throws Exception {
		line.setResponder(req -> rtu(1, 0x83, 0x02));
		transport = SerialTransport.rtu(line, 500, 0);
		transport.open();
		ModbusPdu resp = transport.exchange(1, READ_2);
		assertTrue(resp.isException());
		assertEquals(2, resp.getExceptionCode());
	}

	@Test
	void broadcastIsNotAnswered() throws Exception {
		transport = SerialTransport.rtu(line, 2000, 0);
		transport.open();
		long start = System.currentTimeMillis();
		assertNull(transport.exchange(0, ModbusPdu.of(new byte[] { 0x06, 0x00, 0x01, 0x00, 0x03 })));
		assertTrue(System.currentTimeMillis() - start < 1000);
		assertEquals(1, line.getWritten().size());
	}

	@Test
	void staleInputIsDiscarded() throws Exception {
		transport = SerialTransport.rtu(line, 500, 0);
		transport.open();
		line.feed(new byte[] { 0x01, 0x03, 0x02, 0x00 });
		line.setResponder(req -> rtu(1, 0x03, 0x04, 0x00, 0x0A, 0x00, 0x0B));
		assertEquals(0x0A, transport.exchange(1, READ_2).readInt16FromPDU(2, true));
	}

	@Test
	void invalidUnitIdTouchesNothing() throws Exception {
		transport = SerialTransport.rtu(line, 500, 0);
		transport.open();
		line.feed(new byte[] { 0x01, 0x02 });
		assertEquals(247, transport.getMaxUnitId());
		assertThrows(IllegalArgumentException.class, () -> transport.exchange(248, READ_2));
		assertThrows(IllegalArgumentException.class, () -> transport.exchange(-1, READ_2));
		assertEquals(2, line.getInputSize());
		assertTrue(line.getWritten().isEmpty());
	}

	@Test
	void closedTransportFails() {
		transport = SerialTransport.rtu(line, 500, 0);
		ModbusConnectionException e = assertThrows(ModbusConnectionException.class, () -> transport.exchange(1, READ_2));
		assertEquals(ModbusLinkException.Kind.CONNECTION, e.getKind());
		assertTrue(line.getWritten().isEmpty());
	}

	@Test
	void openFailureIsConnectionError() {
		line.setFailOpen(true);
		transport = SerialTransport.rtu(line, 500, 0);
		assertThrows(ModbusConnectionException.class, transport::open);
		assertFalse(transport.isOpen());
	}

	@Test
	void concurrentCallersAreSerialized() throws Exception {
		line.setResponder(req -> echoAddress(RtuFrameCodec.INSTANCE, req));
		transport = SerialTransport.rtu(line, 1000, 0);
		transport.open();

		ExecutorService pool = Executors.newFixedThreadPool(4);
		try {
			List<Future<Integer>> results = new ArrayList<>();
			for (int i = 0; i < 40; i++) {
				int address = i;
				results.add(pool.submit(() -> {
					ModbusPdu req = new ModbusPdu(3, 5);
					req.writeInt16ToPDU(1, address);
					req.writeInt16ToPDU(3, 1);
					return transport.exchange(1, req).readInt16FromPDU(2, true);
				}));
			}
			for (int i = 0; i < results.size(); i++)
				assertEquals(i, results.get(i).get());
		} finally {
			pool.shutdownNow();
		}
		assertEquals(40, line.getWritten().size());
	}

	@Test
	void asciiExchange() throws Exception {
		line.setResponder(req -> echoAddress(AsciiFrameCodec.INSTANCE, req));
		transport = SerialTransport.ascii(line, 500, 0);
		transport.open();

		ModbusPdu req = ModbusPdu.of(new byte[] { 0x03, 0x00, 0x2A, 0x00, 0x01 });
		assertEquals(42, transport.exchange(17, req).readInt16FromPDU(2, true));
		assertEquals(":1103002A0001C1\r\n", new String(line.getWritten().get(0), "US-ASCII"));
	}

}
