package certa.modbuslink.frame;

import certa.modbuslink.InvalidResponseException;
import certa.modbuslink.ModbusLinkException;

/**
 * Wire format of one binding. Codecs are stateless and shared by the sync and async transports
 * and by the servers: a reader accumulates bytes and asks {@link #remaining(byte[], int, boolean)}
 * how many more it needs, then hands the complete frame to {@link #decode(byte[], int)}.
 */
public interface FrameCodec {

	/**
	 * Returned by {@link #remaining(byte[], int, boolean)} when only a silence on the line ends the frame.
	 */
	int UNTIL_SILENCE = -1;

	String getName();

	/**
	 * Largest frame this binding can produce; a reader never needs a bigger buffer.
	 */
	int getMaxFrameSize();

	int getMaxUnitId();

	byte[] encode(ModbusFrame frame);

	/**
	 * @param buffer - bytes received so far, starting at the first byte of the frame
	 * @param length - number of valid bytes in <b>buffer</b>
	 * @param request - true when the frame is a request (server side), false for a response
	 * @return number of bytes still missing (a lower bound while the header is incomplete), 0 when complete,
	 * {@link #UNTIL_SILENCE} when the size can't be known
	 * @throws InvalidResponseException if the bytes received so far can't start a valid frame
	 */
	int remaining(byte[] buffer, int length, boolean request) throws InvalidResponseException;

	ModbusFrame decode(byte[] buffer, int length) throws ModbusLinkException;

}
