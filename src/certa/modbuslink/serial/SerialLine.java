package certa.modbuslink.serial;

import java.io.Closeable;
import java.io.IOException;

/**
 * Byte stream of a serial port, independent of the driver library.
 * A line is used either by blocking {@link #read(byte[], int, int, int)} calls or by a
 * {@link SerialReceiveListener}, not both at the same time.
 */
public interface SerialLine extends Closeable {

	String getName();

	void open() throws IOException;

	boolean isOpen();

	/**
	 * May be called from any thread. Never throws; errors are logged.
	 */
	@Override
	void close();

	/**
	 * Waits until at least one byte is available or <b>timeoutMillis</b> elapsed.
	 * @return number of bytes read, 0 on timeout
	 */
	int read(byte[] buffer, int offset, int length, int timeoutMillis) throws IOException, InterruptedException;

	void write(byte[] data, int offset, int length) throws IOException;

	int clearInput() throws IOException;

	void setReceiveListener(SerialReceiveListener listener);

}
