package certa.modbuslink.client;

import java.util.concurrent.CompletableFuture;
import java.util.concurrent.CompletionException;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import certa.modbuslink.ModbusByteOrder;
import certa.modbuslink.ModbusLinkException;
import certa.modbuslink.ModbusWordOrder;
import certa.modbuslink.codec.ModbusRequest;
import certa.modbuslink.codec.ModbusRequests;
import certa.modbuslink.transport.AsyncModbusTransport;

/**
 * Non-blocking Modbus master with the operations of {@link ModbusClient}.
 * Invalid arguments throw {@link IllegalArgumentException} right away, including a unit id the
 * binding can't address; exchange errors complete the returned future exceptionally.
 * The callback runs on the transport's I/O thread.
 */
public class AsyncModbusClient {
	private static final Logger log = LoggerFactory.getLogger(AsyncModbusClient.class);

	private final AsyncModbusTransport transport;

	public AsyncModbusClient(AsyncModbusTransport transport) {
		this.transport = transport;
	}

	public AsyncModbusTransport getTransport() {
		return transport;
	}

	public CompletableFuture<Void> open() {
		return transport.open();
	}

	public boolean isOpen() {
		return transport.isOpen();
	}

	public CompletableFuture<Void> close() {
		return transport.close();
	}

	public <T> CompletableFuture<T> execute(int unitId, ModbusRequest<T> request, ModbusCallback<? super T> callback) {
		Callbacks.checkUnit(unitId, transport.getMaxUnitId(), request);
		if (log.isDebugEnabled())
			log.debug("{} -> {}: {}", transport.getName(), unitId, request);
		CompletableFuture<T> result = new CompletableFuture<>();
		transport.exchange(unitId, request.getPdu()).whenComplete((response, e) -> {
			if (e != null) {
				result.completeExceptionally((e instanceof CompletionException) && (e.getCause() != null) ? e.getCause() : e);
				return;
			}
			T value;
			try {
				value = (response == null) ? null : request.decode(response);
			} catch (ModbusLinkException ex) {
				result.completeExceptionally(ex);
				return;
			}
			Callbacks.notify(log, callback, value, request);
			result.complete(value);
		});
		return result;
	}

	public CompletableFuture<boolean[]> readCoils(int unitId, int startAddress, int count) {
		return readCoils(unitId, startAddress, count, null);
	}

	public CompletableFuture<boolean[]> readCoils(int unitId, int startAddress, int count,
			ModbusCallback<? super boolean[]> callback) {
		return execute(unitId, ModbusRequests.readCoils(startAddress, count), callback);
	}

	public CompletableFuture<boolean[]> readDiscreteInputs(int unitId, int startAddress, int count) {
		return readDiscreteInputs(unitId, startAddress, count, null);
	}

	public CompletableFuture<boolean[]> readDiscreteInputs(int unitId, int startAddress, int count,
			ModbusCallback<? super boolean[]> callback) {
		return execute(unitId, ModbusRequests.readDiscreteInputs(startAddress, count), callback);
	}

	public CompletableFuture<int[]> readHoldingRegisters(int unitId, int startAddress, int count) {
		return readHoldingRegisters(unitId, startAddress, count, null);
	}

	public CompletableFuture<int[]> readHoldingRegisters(int unitId, int startAddress, int count,
			ModbusCallback<? super int[]> callback) {
		return execute(unitId, ModbusRequests.readHoldingRegisters(startAddress, count), callback);
	}

	public CompletableFuture<int[]> readInputRegisters(int unitId, int startAddress, int count) {
		return readInputRegisters(unitId, startAddress, count, null);
	}

	public CompletableFuture<int[]> readInputRegisters(int unitId, int startAddress, int count,
			ModbusCallback<? super int[]> callback) {
		return execute(unitId, ModbusRequests.readInputRegisters(startAddress, count), callback);
	}

	public CompletableFuture<Void> writeSingleCoil(int unitId, int address, boolean value) {
		return writeSingleCoil(unitId, address, value, null);
	}

	public CompletableFuture<Void> writeSingleCoil(int unitId, int address, boolean value,
			ModbusCallback<? super Void> callback) {
		return execute(unitId, ModbusRequests.writeSingleCoil(address, value), callback);
	}

	public CompletableFuture<Void> writeSingleRegister(int unitId, int address, int value) {
		return writeSingleRegister(unitId, address, value, null);
	}

	public CompletableFuture<Void> writeSingleRegister(int unitId, int address, int value,
			ModbusCallback<? super Void> callback) {
		return execute(unitId, ModbusRequests.writeSingleRegister(address, value), callback);
	}

	public CompletableFuture<Void> writeMultipleCoils(int unitId, int startAddress, boolean[] values) {
		return writeMultipleCoils(unitId, startAddress, values, null);
	}

	public CompletableFuture<Void> writeMultipleCoils(int unitId, int startAddress, boolean[] values,
			ModbusCallback<? super Void> callback) {
		return execute(unitId, ModbusRequests.writeMultipleCoils(startAddress, values), callback);
	}

	public CompletableFuture<Void> writeMultipleRegisters(int unitId, int startAddress, int[] values) {
		return writeMultipleRegisters(unitId, startAddress, values, null);
	}

	public CompletableFuture<Void> writeMultipleRegisters(int unitId, int startAddress, int[] values,
			ModbusCallback<? super Void> callback) {
		return execute(unitId, ModbusRequests.writeMultipleRegisters(startAddress, values), callback);
	}

	public CompletableFuture<Float> readFloat32(int unitId, int startAddress) {
		return readFloat32(unitId, startAddress, ModbusByteOrder.BIG, ModbusWordOrder.HIGH_FIRST, null);
	}

	public CompletableFuture<Float> readFloat32(int unitId, int startAddress, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder) {
		return readFloat32(unitId, startAddress, byteOrder, wordOrder, null);
	}

	public CompletableFuture<Float> readFloat32(int unitId, int startAddress, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder,
			ModbusCallback<? super Float> callback) {
		return execute(unitId, ModbusRequests.readFloat32(startAddress, byteOrder, wordOrder), callback);
	}

	public CompletableFuture<Void> writeFloat32(int unitId, int startAddress, float value) {
		return writeFloat32(unitId, startAddress, value, ModbusByteOrder.BIG, ModbusWordOrder.HIGH_FIRST, null);
	}

	public CompletableFuture<Void> writeFloat32(int unitId, int startAddress, float value, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder) {
		return writeFloat32(unitId, startAddress, value, byteOrder, wordOrder, null);
	}

	public CompletableFuture<Void> writeFloat32(int unitId, int startAddress, float value, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder,
			ModbusCallback<? super Void> callback) {
		return execute(unitId, ModbusRequests.writeFloat32(startAddress, value, byteOrder, wordOrder), callback);
	}

	public CompletableFuture<Double> readFloat64(int unitId, int startAddress) {
		return readFloat64(unitId, startAddress, ModbusByteOrder.BIG, ModbusWordOrder.HIGH_FIRST, null);
	}

	public CompletableFuture<Double> readFloat64(int unitId, int startAddress, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder) {
		return readFloat64(unitId, startAddress, byteOrder, wordOrder, null);
	}

	public CompletableFuture<Double> readFloat64(int unitId, int startAddress, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder,
			ModbusCallback<? super Double> callback) {
		return execute(unitId, ModbusRequests.readFloat64(startAddress, byteOrder, wordOrder), callback);
	}

	public CompletableFuture<Void> writeFloat64(int unitId, int startAddress, double value) {
		return writeFloat64(unitId, startAddress, value, ModbusByteOrder.BIG, ModbusWordOrder.HIGH_FIRST, null);
	}

	public CompletableFuture<Void> writeFloat64(int unitId, int startAddress, double value, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder) {
		return writeFloat64(unitId, startAddress, value, byteOrder, wordOrder, null);
	}

	public CompletableFuture<Void> writeFloat64(int unitId, int startAddress, double value, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder,
			ModbusCallback<? super Void> callback) {
		return execute(unitId, ModbusRequests.writeFloat64(startAddress, value, byteOrder, wordOrder), callback);
	}

	public CompletableFuture<Integer> readInt32(int unitId, int startAddress) {
		return readInt32(unitId, startAddress, ModbusByteOrder.BIG, ModbusWordOrder.HIGH_FIRST, null);
	}

	public CompletableFuture<Integer> readInt32(int unitId, int startAddress, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder) {
		return readInt32(unitId, startAddress, byteOrder, wordOrder, null);
	}

	public CompletableFuture<Integer> readInt32(int unitId, int startAddress, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder,
			ModbusCallback<? super Integer> callback) {
		return execute(unitId, ModbusRequests.readInt32(startAddress, byteOrder, wordOrder), callback);
	}

	public CompletableFuture<Void> writeInt32(int unitId, int startAddress, int value) {
		return writeInt32(unitId, startAddress, value, ModbusByteOrder.BIG, ModbusWordOrder.HIGH_FIRST, null);
	}

	public CompletableFuture<Void> writeInt32(int unitId, int startAddress, int value, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder) {
		return writeInt32(unitId, startAddress, value, byteOrder, wordOrder, null);
	}

	public CompletableFuture<Void> writeInt32(int unitId, int startAddress, int value, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder,
			ModbusCallback<? super Void> callback) {
		return execute(unitId, ModbusRequests.writeInt32(startAddress, value, byteOrder, wordOrder), callback);
	}

	public CompletableFuture<Long> readUInt32(int unitId, int startAddress) {
		return readUInt32(unitId, startAddress, ModbusByteOrder.BIG, ModbusWordOrder.HIGH_FIRST, null);
	}

	public CompletableFuture<Long> readUInt32(int unitId, int startAddress, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder) {
		return readUInt32(unitId, startAddress, byteOrder, wordOrder, null);
	}

	public CompletableFuture<Long> readUInt32(int unitId, int startAddress, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder,
			ModbusCallback<? super Long> callback) {
		return execute(unitId, ModbusRequests.readUInt32(startAddress, byteOrder, wordOrder), callback);
	}

	public CompletableFuture<Void> writeUInt32(int unitId, int startAddress, long value) {
		return writeUInt32(unitId, startAddress, value, ModbusByteOrder.BIG, ModbusWordOrder.HIGH_FIRST, null);
	}

	public CompletableFuture<Void> writeUInt32(int unitId, int startAddress, long value, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder) {
		return writeUInt32(unitId, startAddress, value, byteOrder, wordOrder, null);
	}

	public CompletableFuture<Void> writeUInt32(int unitId, int startAddress, long value, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder,
			ModbusCallback<? super Void> callback) {
		return execute(unitId, ModbusRequests.writeUInt32(startAddress, value, byteOrder, wordOrder), callback);
	}

	public CompletableFuture<Long> readInt64(int unitId, int startAddress) {
		return readInt64(unitId, startAddress, ModbusByteOrder.BIG, ModbusWordOrder.HIGH_FIRST, null);
	}

	public CompletableFuture<Long> readInt64(int unitId, int startAddress, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder) {
		return readInt64(unitId, startAddress, byteOrder, wordOrder, null);
	}

	public CompletableFuture<Long> readInt64(int unitId, int startAddress, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder,
			ModbusCallback<? super Long> callback) {
		return execute(unitId, ModbusRequests.readInt64(startAddress, byteOrder, wordOrder), callback);
	}

	public CompletableFuture<Void> writeInt64(int unitId, int startAddress, long value) {
		return writeInt64(unitId, startAddress, value, ModbusByteOrder.BIG, ModbusWordOrder.HIGH_FIRST, null);
	}

	public CompletableFuture<Void> writeInt64(int unitId, int startAddress, long value, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder) {
		return writeInt64(unitId, startAddress, value, byteOrder, wordOrder, null);
	}

	public CompletableFuture<Void> writeInt64(int unitId, int startAddress, long value, ModbusByteOrder byteOrder, ModbusWordOrder wordOrder,
			ModbusCallback<? super Void> callback) {
		return execute(unitId, ModbusRequests.writeInt64(startAddress, value, byteOrder, wordOrder), callback);
	}

	public CompletableFuture<String> readString(int unitId, int startAddress, int length) {
		return readString(unitId, startAddress, length, null);
	}

	public CompletableFuture<String> readString(int unitId, int startAddress, int length,
			ModbusCallback<? super String> callback) {
		return execute(unitId, ModbusRequests.readString(startAddress, length), callback);
	}

	public CompletableFuture<Void> writeString(int unitId, int startAddress, String value) {
		return writeString(unitId, startAddress, value, null);
	}

	public CompletableFuture<Void> writeString(int unitId, int startAddress, String value,
			ModbusCallback<? super Void> callback) {
		return execute(unitId, ModbusRequests.writeString(startAddress, value), callback);
	}

}
