package certa.modbuslink.transport;

import java.util.concurrent.CompletableFuture;

import certa.modbuslink.ModbusPdu;

/**
 * Non-blocking counterpart of {@link ModbusTransport}. Futures complete exceptionally with
 * the same {@link certa.modbuslink.ModbusLinkException} subclasses the blocking transports throw.
 */
public interface AsyncModbusTransport {

	String getName();

	int getMaxUnitId();

	CompletableFuture<Void> open();

	boolean isOpen();

	/**
	 * Fails the exchange in progress and the queued ones with a connection error.
	 */
	CompletableFuture<Void> close();

	/**
	 * Queues one request. Exchanges run one at a time, in the order of the calls.
	 * @return future of the response PDU, completed with null for a broadcast request
	 * @throws IllegalArgumentException if <b>unitId</b> is outside 0..{@link #getMaxUnitId()}
	 */
	CompletableFuture<ModbusPdu> exchange(int unitId, ModbusPdu request);

}
