package certa.modbuslink;

/**
 * Receives frame boundary events from transports and servers.
 * Implementations can provide logging, capture or counters. Called on the I/O thread,
 * so implementations must not block.
 */
public interface ModbusDiagnostics {

	/**
	 * Called after a complete frame was written to the channel.
	 * @param channel - human readable name of the channel (port name, remote address)
	 */
	void onFrameSent(String channel, byte[] frame, int length);

	void onFrameReceived(String channel, byte[] frame, int length);

	void onFrameError(String channel, ModbusLinkException error);

}
