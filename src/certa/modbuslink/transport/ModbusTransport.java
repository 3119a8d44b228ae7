package certa.modbuslink.transport;

import java.io.Closeable;

import certa.modbuslink.ModbusConnectionException;
import certa.modbuslink.ModbusLinkException;
import certa.modbuslink.ModbusPdu;

/**
 * Blocking request/response channel to one or more Modbus devices.
 * Exchanges from several threads are executed one at a time, in arrival order.
 */
public interface ModbusTransport extends Closeable {

	String getName();

	/**
	 * @return largest unit id the binding can address
	 */
	int getMaxUnitId();

	void open() throws ModbusConnectionException;

	boolean isOpen();

	/**
	 * May be called from any thread.
	 */
	@Override
	void close();

	/**
	 * Sends one request and waits for the matching response. Exactly one attempt is made.
	 * @throws IllegalArgumentException if <b>unitId</b> is outside 0..{@link #getMaxUnitId()}; nothing is sent
	 * @return response PDU (possibly an exception response), or null for a broadcast request
	 */
	ModbusPdu exchange(int unitId, ModbusPdu request) throws ModbusLinkException, InterruptedException;

}
