package certa.modbuslink;

import static org.junit.jupiter.api.Assertions.*;

import org.junit.jupiter.api.Test;

final class ModbusChecksumTest {

	private static final byte[] READ_REQUEST = { 0x01, 0x03, 0x00, 0x00, 0x00, 0x02 };

	@Test
	void crcOfReadRequest() {
		// sent as C4 0B
		assertEquals(0x0BC4, ModbusChecksum.crc16(READ_REQUEST));
	}

	@Test
	void crcOfEmptyInputIsInitialValue() {
		assertEquals(0xFFFF, ModbusChecksum.crc16(new byte[0]));
	}

	@Test
	void crcUsesOffsetAndLength() {
		byte[] padded = { 0x55, 0x01, 0x03, 0x00, 0x00, 0x00, 0x02, 0x77 };
		assertEquals(ModbusChecksum.crc16(READ_REQUEST), ModbusChecksum.crc16(padded, 1, 6));
	}

	@Test
	void lrcOfReadRequest() {
		assertEquals(0xFA, ModbusChecksum.lrc(READ_REQUEST));
	}

	@Test
	void lrcOfEmptyInputIsZero() {
		assertEquals(0, ModbusChecksum.lrc(new byte[0]));
	}

	@Test
	void lrcMakesByteSumZero() {
		byte[] data = { (byte) 0xF7, 0x10, 0x00, 0x13, 0x7E, (byte) 0x80 };
		int sum = ModbusChecksum.lrc(data);
		for (byte b : data)
			sum += b & 0xFF;
		assertEquals(0, sum & 0xFF);
	}

	@Test
	void everySingleBitFlipChangesBothChecksums() {
		int crc = ModbusChecksum.crc16(READ_REQUEST);
		int lrc = ModbusChecksum.lrc(READ_REQUEST);
		for (int i = 0; i < READ_REQUEST.length * 8; i++) {
			byte[] corrupted = READ_REQUEST.clone();
			corrupted[i / 8] ^= (byte) (1 << (i % 8));
			assertNotEquals(crc, ModbusChecksum.crc16(corrupted), "CRC missed bit " + i);
			assertNotEquals(lrc, ModbusChecksum.lrc(corrupted), "LRC missed bit " + i);
		}
	}

}
