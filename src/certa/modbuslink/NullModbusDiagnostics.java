package certa.modbuslink;

public final class NullModbusDiagnostics implements ModbusDiagnostics {

	public static final NullModbusDiagnostics INSTANCE = new NullModbusDiagnostics();

	private NullModbusDiagnostics() {}

	@Override
	public void onFrameSent(String channel, byte[] frame, int length) {}

	@Override
	public void onFrameReceived(String channel, byte[] frame, int length) {}

	@Override
	public void onFrameError(String channel, ModbusLinkException error) {}

}
