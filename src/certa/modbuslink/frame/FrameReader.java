package certa.modbuslink.frame;

import certa.modbuslink.InvalidResponseException;
import certa.modbuslink.ModbusLinkException;

public final class FrameReader {

	private final FrameCodec codec;
	private final boolean request;
	private final byte[] buffer;
	private int length;

	public FrameReader(FrameCodec codec, boolean request) {
		this.codec = codec;
		this.request = request;
		this.buffer = new byte[codec.getMaxFrameSize()];
	}

	/**
	 * @return number of bytes taken from <b>data</b>; less than <b>count</b> when the frame got complete
	 */
	public int feed(byte[] data, int offset, int count) throws InvalidResponseException {
		int pos = offset;
		int end = offset + count;
		while (pos < end) {
			int need = codec.remaining(buffer, length, request);
			if (need == 0)
				break;
			int n = (need == FrameCodec.UNTIL_SILENCE) ? end - pos : Math.min(need, end - pos);
			if (length + n > buffer.length)
				throw new InvalidResponseException("Frame exceeds " + buffer.length + " bytes");
			System.arraycopy(data, pos, buffer, length, n);
			length += n;
			pos += n;
		}
		return pos - offset;
	}

	public boolean isComplete() throws InvalidResponseException {
		return codec.remaining(buffer, length, request) == 0;
	}

	/**
	 * @return true if the frame size is unknown and only a silence on the line completes it
	 */
	public boolean isWaitingForSilence() throws InvalidResponseException {
		return (length > 0) && (codec.remaining(buffer, length, request) == FrameCodec.UNTIL_SILENCE);
	}

	public boolean isEmpty() {
		return length == 0;
	}

	public byte[] getBuffer() {
		return buffer;
	}

	public int getLength() {
		return length;
	}

	/**
	 * Decodes the complete frame and gets ready for the next one, also when decoding fails.
	 */
	public ModbusFrame decode() throws ModbusLinkException {
		try {
			return codec.decode(buffer, length);
		} finally {
			length = 0;
		}
	}

	public void reset() {
		length = 0;
	}

}
