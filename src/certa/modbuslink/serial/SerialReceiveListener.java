package certa.modbuslink.serial;

@FunctionalInterface
public interface SerialReceiveListener {

	void bytesReceived(byte[] data);

}
