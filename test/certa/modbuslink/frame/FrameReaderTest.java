package certa.modbuslink.frame;

import static certa.modbuslink.frame.FrameTestSupport.bytes;
import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

import certa.modbuslink.ModbusCrcException;
import certa.modbuslink.ModbusPdu;

final class FrameReaderTest {

	@Test
	void assemblesFrameFromSingleBytes() throws Exception {
		FrameReader reader = new FrameReader(RtuFrameCodec.INSTANCE, true);
		byte[] data = bytes(0x01, 0x03, 0x00, 0x00, 0x00, 0x02, 0xC4, 0x0B);
		assertTrue(reader.isEmpty());
		for (int i = 0; i < data.length - 1; i++) {
			assertEquals(1, reader.feed(data, i, 1));
			assertFalse(reader.isComplete());
		}
		reader.feed(data, data.length - 1, 1);
		assertTrue(reader.isComplete());
		ModbusFrame frame = reader.decode();
		assertEquals(ModbusPdu.of(bytes(0x03, 0x00, 0x00, 0x00, 0x02)), frame.getPdu());
		assertTrue(reader.isEmpty());
	}

	@Test
	void stopsAtFrameBoundary() throws Exception {
		FrameReader reader = new FrameReader(TcpFrameCodec.INSTANCE, true);
		byte[] first = TcpFrameCodec.INSTANCE.encode(new ModbusFrame(1, 1, ModbusPdu.of(bytes(0x03, 0, 0, 0, 1))));
		byte[] second = TcpFrameCodec.INSTANCE.encode(new ModbusFrame(2, 1, ModbusPdu.of(bytes(0x04, 0, 5, 0, 2))));
		byte[] both = new byte[first.length + second.length];
		System.arraycopy(first, 0, both, 0, first.length);
		System.arraycopy(second, 0, both, first.length, second.length);

		int used = reader.feed(both, 0, both.length);
		assertEquals(first.length, used);
		assertEquals(1, reader.decode().getTransactionId());

		used += reader.feed(both, used, both.length - used);
		assertEquals(both.length, used);
		ModbusFrame frame = reader.decode();
		assertEquals(2, frame.getTransactionId());
		assertEquals(4, frame.getPdu().getFunction());
	}

	@Test
	void resetsAfterFailedDecode() throws Exception {
		FrameReader reader = new FrameReader(RtuFrameCodec.INSTANCE, false);
		byte[] bad = bytes(0x01, 0x06, 0x00, 0x01, 0x00, 0x03, 0x00, 0x00);
		reader.feed(bad, 0, bad.length);
		assertTrue(reader.isComplete());
		assertThrows(ModbusCrcException.class, reader::decode);
		assertTrue(reader.isEmpty());
	}

	@Test
	void unsupportedRequestTakesAllBytesUntilSilence() throws Exception {
		FrameReader reader = new FrameReader(RtuFrameCodec.INSTANCE, true);
		byte[] data = RtuFrameCodec.INSTANCE.encode(new ModbusFrame(17, ModbusPdu.of(bytes(0x07))));
		assertEquals(2, reader.feed(data, 0, 2));
		assertTrue(reader.isWaitingForSilence());
		assertEquals(data.length - 2, reader.feed(data, 2, data.length - 2));
		assertFalse(reader.isComplete());
		assertTrue(reader.isWaitingForSilence());
		ModbusFrame frame = reader.decode();
		assertEquals(17, frame.getUnitId());
		assertEquals(7, frame.getPdu().getFunction());
		assertFalse(reader.isWaitingForSilence());
	}

}
