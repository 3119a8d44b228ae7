package certa.modbuslink.client;

import java.io.Closeable;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import certa.modbuslink.ModbusByteOrder;
import certa.modbuslink.ModbusConnectionException;
import certa.modbuslink.ModbusLinkException;
import certa.modbuslink.ModbusPdu;
import certa.modbuslink.ModbusWordOrder;
import certa.modbuslink.codec.ModbusRequest;
import certa.modbuslink.codec.ModbusRequests;
import certa.modbuslink.transport.ModbusTransport;

/**
 * Blocking Modbus master. Arguments are validated before anything is sent; errors of the exchange
 * are thrown as they come from the transport, without retries.
 * <p>
 * Values wider than a register are read from holding registers and written with function 16.
 * Byte and word order default to {@link ModbusByteOrder#BIG} and {@link ModbusWordOrder#HIGH_FIRST}.
 * Unit id 0 is broadcast: writes only, nothing is returned.
 */
public class ModbusClient implements Closeable {
	private static final Logger log = LoggerFactory.getLogger(ModbusClient.class);

	private final ModbusTransport transport;

	public ModbusClient(ModbusTransport transport) {
		this.transport = transport;
	}

	public ModbusTransport getTransport() {
		return transport;
	}

	public void open() throws ModbusConnectionException {
		transport.open();
	}

	public boolean isOpen() {
		return transport.isOpen();
	}

	@Override
	public void close() {
		transport.close();
	}

	/**
	 * Runs any prepared request.
	 * @return decoded response, null for a broadcast
	 */
	public <T> T execute(int unitId, ModbusRequest<T> request, ModbusCallback<? super T> callback)
			throws ModbusLinkException, InterruptedException {
		Callbacks.checkUnit(unitId, transport.getMaxUnitId(), request);
		if (log.isDebugEnabled())
			log.debug("{} -> {}: {}", transport.getName(), unitId, request);
		ModbusPdu response = transport.exchange(unitId, request.getPdu());
		T value = (response == null) ? null : request.decode(response);
		Callbacks.notify(log, callback, value, request);
		return value;
	}

	public boolean[] readCoils(int unitId, int startAddress, int count)
			throws ModbusLinkException, InterruptedException {
		return readCoils(unitId, startAddress, count, null);
	}

	public boolean[] readCoils(int unitId, int startAddress, int count, ModbusCallback<? super boolean[]> callback)
			throws ModbusLinkException, InterruptedException {
		return execute(unitId, ModbusRequests.readCoils(startAddress, count), callback);
	}

	public boolean[] readDiscreteInputs(int unitId, int startAddress, int count)
			throws ModbusLinkException, InterruptedException {
		return readDiscreteInputs(unitId, startAddress, count, null);
	}

	public boolean[] readDiscreteInputs(int unitId, int startAddress, int count, ModbusCallback<? super boolean[]> callback)
			throws ModbusLinkException, InterruptedException {
		return execute(unitId, ModbusRequests.readDiscreteInputs(startAddress, count), callback);
	}

	public int[] readHoldingRegisters(int unitId, int startAddress, int count)
			throws ModbusLinkException, InterruptedException {
		return readHoldingRegisters(unitId, startAddress, count, null);
	}

	public int[] readHoldingRegisters(int unitId, int startAddress, int count, ModbusCallback<? super int[]> callback)
			throws ModbusLinkException, InterruptedException {
		return execute(unitId, ModbusRequests.readHoldingRegisters(startAddress, count), callback);
	}

	public int[] readInputRegisters(int unitId, int startAddress, int count)
			throws ModbusLinkException, InterruptedException {
		return readInputRegisters(unitId, startAddress, count, null);
	}

	public int[] readInputRegisters(int unitId, int startAddress, int count, ModbusCallback<? super int[]> callback)
			throws ModbusLinkException, InterruptedException {
		return execute(unitId, ModbusRequests.readInputRegisters(startAddress, count), callback);
	}

	public void writeSingleCoil(int unitId, int address, boolean value)
			throws ModbusLinkException, InterruptedException {
		writeSingleCoil(unitId, address, value, null);
	}

	public void writeSingleCoil(int unitId, int address, boolean value, ModbusCallback<? super Void> callback)
			throws ModbusLinkException, InterruptedException {
		execute(unitId, ModbusRequests.writeSingleCoil(address, value), callback);
	}

	public void writeSingleRegister(int unitId, int address, int value)
			throws ModbusLinkException, InterruptedException {
		writeSingleRegister(unitId, address, value, null);
	}

	public void writeSingleRegister(int unitId, int address, int value, ModbusCallback<? super Void> callback)
			throws ModbusLinkException, InterruptedException {
		execute(unitId, ModbusRequests.writeSingleRegister(address, value), callback);
	}

	public void writeMultipleCoils(int unitId, int startAddress, boolean[] values)
			throws ModbusLinkException, InterruptedException {
		writeMultipleCoils(unitId, startAddress, values, null);
	}

	public void writeMultipleCoils(int unitId, int startAddress, boolean[] values, ModbusCallback<? super Void> callback)
			throws ModbusLinkException, InterruptedException {
		execute(unitId, ModbusRequests.writeMultipleCoils(startAddress, values), callback);
	}

	public void writeMultipleRegisters(int unitId, int startAddress, int[] values)
			throws ModbusLinkException, InterruptedException {
		writeMultipleRegisters(unitId, startAddress, values, null);
	}

	public void writeMultipleRegisters(int unitId, int startAddress, int[] values, ModbusCallback<? super Void> callback)
			throws ModbusLinkException, InterruptedException {
		execute(unitId, ModbusRequests.writeMultipleRegisters(startAddress, values), callback);
	}

	public float readFloat32(int unitId, int startAddress) throws ModbusLinkException, InterruptedException {
		return readFloat32(unitId, startAddress, ModbusByteOrder.BIG, ModbusWordOrder.HIGH_FIRST, null);
	}

	public float readFloat32(int unitId, int startAddress, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder)
			throws ModbusLinkException, InterruptedException {
		return readFloat32(unitId, startAddress, byteOrder, wordOrder, null);
	}

	public float readFloat32(int unitId, int startAddress, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder,
			ModbusCallback<? super Float> callback) throws ModbusLinkException, InterruptedException {
		return execute(unitId, ModbusRequests.readFloat32(startAddress, byteOrder, wordOrder), callback);
	}

	public void writeFloat32(int unitId, int startAddress, float value)
			throws ModbusLinkException, InterruptedException {
		writeFloat32(unitId, startAddress, value, ModbusByteOrder.BIG, ModbusWordOrder.HIGH_FIRST, null);
	}

	public void writeFloat32(int unitId, int startAddress, float value, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder)
			throws ModbusLinkException, InterruptedException {
		writeFloat32(unitId, startAddress, value, byteOrder, wordOrder, null);
	}

	public void writeFloat32(int unitId, int startAddress, float value, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder,
			ModbusCallback<? super Void> callback) throws ModbusLinkException, InterruptedException {
		execute(unitId, ModbusRequests.writeFloat32(startAddress, value, byteOrder, wordOrder), callback);
	}

	public double readFloat64(int unitId, int startAddress) throws ModbusLinkException, InterruptedException {
		return readFloat64(unitId, startAddress, ModbusByteOrder.BIG, ModbusWordOrder.HIGH_FIRST, null);
	}

	public double readFloat64(int unitId, int startAddress, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder)
			throws ModbusLinkException, InterruptedException {
		return readFloat64(unitId, startAddress, byteOrder, wordOrder, null);
	}

	public double readFloat64(int unitId, int startAddress, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder,
			ModbusCallback<? super Double> callback) throws ModbusLinkException, InterruptedException {
		return execute(unitId, ModbusRequests.readFloat64(startAddress, byteOrder, wordOrder), callback);
	}

	public void writeFloat64(int unitId, int startAddress, double value)
			throws ModbusLinkException, InterruptedException {
		writeFloat64(unitId, startAddress, value, ModbusByteOrder.BIG, ModbusWordOrder.HIGH_FIRST, null);
	}

	public void writeFloat64(int unitId, int startAddress, double value, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder)
			throws ModbusLinkException, InterruptedException {
		writeFloat64(unitId, startAddress, value, byteOrder, wordOrder, null);
	}

	public void writeFloat64(int unitId, int startAddress, double value, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder,
			ModbusCallback<? super Void> callback) throws ModbusLinkException, InterruptedException {
		execute(unitId, ModbusRequests.writeFloat64(startAddress, value, byteOrder, wordOrder), callback);
	}

	public int readInt32(int unitId, int startAddress) throws ModbusLinkException, InterruptedException {
		return readInt32(unitId, startAddress, ModbusByteOrder.BIG, ModbusWordOrder.HIGH_FIRST, null);
	}

	public int readInt32(int unitId, int startAddress, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder)
			throws ModbusLinkException, InterruptedException {
		return readInt32(unitId, startAddress, byteOrder, wordOrder, null);
	}

	public int readInt32(int unitId, int startAddress, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder,
			ModbusCallback<? super Integer> callback) throws ModbusLinkException, InterruptedException {
		return execute(unitId, ModbusRequests.readInt32(startAddress, byteOrder, wordOrder), callback);
	}

	public void writeInt32(int unitId, int startAddress, int value) throws ModbusLinkException, InterruptedException {
		writeInt32(unitId, startAddress, value, ModbusByteOrder.BIG, ModbusWordOrder.HIGH_FIRST, null);
	}

	public void writeInt32(int unitId, int startAddress, int value, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder)
			throws ModbusLinkException, InterruptedException {
		writeInt32(unitId, startAddress, value, byteOrder, wordOrder, null);
	}

	public void writeInt32(int unitId, int startAddress, int value, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder,
			ModbusCallback<? super Void> callback) throws ModbusLinkException, InterruptedException {
		execute(unitId, ModbusRequests.writeInt32(startAddress, value, byteOrder, wordOrder), callback);
	}

	public long readUInt32(int unitId, int startAddress) throws ModbusLinkException, InterruptedException {
		return readUInt32(unitId, startAddress, ModbusByteOrder.BIG, ModbusWordOrder.HIGH_FIRST, null);
	}

	public long readUInt32(int unitId, int startAddress, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder)
			throws ModbusLinkException, InterruptedException {
		return readUInt32(unitId, startAddress, byteOrder, wordOrder, null);
	}

	public long readUInt32(int unitId, int startAddress, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder,
			ModbusCallback<? super Long> callback) throws ModbusLinkException, InterruptedException {
		return execute(unitId, ModbusRequests.readUInt32(startAddress, byteOrder, wordOrder), callback);
	}

	public void writeUInt32(int unitId, int startAddress, long value) throws ModbusLinkException, InterruptedException {
		writeUInt32(unitId, startAddress, value, ModbusByteOrder.BIG, ModbusWordOrder.HIGH_FIRST, null);
	}

	public void writeUInt32(int unitId, int startAddress, long value, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder)
			throws ModbusLinkException, InterruptedException {
		writeUInt32(unitId, startAddress, value, byteOrder, wordOrder, null);
	}

	public void writeUInt32(int unitId, int startAddress, long value, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder,
			ModbusCallback<? super Void> callback) throws ModbusLinkException, InterruptedException {
		execute(unitId, ModbusRequests.writeUInt32(startAddress, value, byteOrder, wordOrder), callback);
	}

	public long readInt64(int unitId, int startAddress) throws ModbusLinkException, InterruptedException {
		return readInt64(unitId, startAddress, ModbusByteOrder.BIG, ModbusWordOrder.HIGH_FIRST, null);
	}

	public long readInt64(int unitId, int startAddress, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder)
			throws ModbusLinkException, InterruptedException {
		return readInt64(unitId, startAddress, byteOrder, wordOrder, null);
	}

	public long readInt64(int unitId, int startAddress, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder,
			ModbusCallback<? super Long> callback) throws ModbusLinkException, InterruptedException {
		return execute(unitId, ModbusRequests.readInt64(startAddress, byteOrder, wordOrder), callback);
	}

	public void writeInt64(int unitId, int startAddress, long value) throws ModbusLinkException, InterruptedException {
		writeInt64(unitId, startAddress, value, ModbusByteOrder.BIG, ModbusWordOrder.HIGH_FIRST, null);
	}

	public void writeInt64(int unitId, int startAddress, long value, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder)
			throws ModbusLinkException, InterruptedException {
		writeInt64(unitId, startAddress, value, byteOrder, wordOrder, null);
	}

	public void writeInt64(int unitId, int startAddress, long value, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder,
			ModbusCallback<? super Void> callback) throws ModbusLinkException, InterruptedException {
		execute(unitId, ModbusRequests.writeInt64(startAddress, value, byteOrder, wordOrder), callback);
	}

	public String readString(int unitId, int startAddress, int length)
			throws ModbusLinkException, InterruptedException {
		return readString(unitId, startAddress, length, null);
	}

	public String readString(int unitId, int startAddress, int length, ModbusCallback<? super String> callback)
			throws ModbusLinkException, InterruptedException {
		return execute(unitId, ModbusRequests.readString(startAddress, length), callback);
	}

	public void writeString(int unitId, int startAddress, String value)
			throws ModbusLinkException, InterruptedException {
		writeString(unitId, startAddress, value, null);
	}

	public void writeString(int unitId, int startAddress, String value, ModbusCallback<? super Void> callback)
			throws ModbusLinkException, InterruptedException {
		execute(unitId, ModbusRequests.writeString(startAddress, value), callback);
	}

}
