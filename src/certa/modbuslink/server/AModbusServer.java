package certa.modbuslink.server;

import static certa.modbuslink.ModbusConstants.*;

import org.slf4j.Logger;

import certa.modbuslink.ModbusConnectionException;
import certa.modbuslink.ModbusDiagnostics;
import certa.modbuslink.ModbusPdu;
import certa.modbuslink.frame.ModbusFrame;

/**
 * Common part of the servers: unit id filtering and dispatch to the {@link RequestProcessor}.
 * Several servers may run in one JVM, each with its own store.
 */
public abstract class AModbusServer {

	protected final Logger log;
	protected final int unitId;
	protected final DataStore store;
	protected final RequestProcessor processor; // cannot be null
	protected final ModbusDiagnostics diagnostics;
	private final boolean tcp;

	/**
	 * @param tcp - TCP servers also accept unit id 0xFF and answer broadcast requests
	 * @param processor - null for {@link DefaultRequestProcessor} over <b>store</b>
	 */
	protected AModbusServer(int unitId, DataStore store, RequestProcessor processor, boolean tcp,
			ModbusDiagnostics diagnostics, Logger log)
	{
		int maxId = tcp ? MAX_TCP_ID : MAX_SERIAL_ID;
		if ((unitId < 1) || (unitId > maxId))
			throw new IllegalArgumentException("Invalid unit id: " + unitId + ". Must be 1.." + maxId);
		this.log = log;
		this.unitId = unitId;
		this.store = store;
		this.processor = (processor != null) ? processor : new DefaultRequestProcessor(store);
		this.tcp = tcp;
		this.diagnostics = diagnostics;
	}

	public int getUnitId() {
		return unitId;
	}

	public DataStore getStore() {
		return store;
	}

	public boolean acceptsUnit(int requestUnitId) {
		return (requestUnitId == unitId) || (requestUnitId == BROADCAST_ID) || (tcp && (requestUnitId == MAX_TCP_ID));
	}

	protected ModbusPdu handle(ModbusFrame request) {
		int id = request.getUnitId();
		if (!acceptsUnit(id)) {
			log.debug("Request for unit {} ignored", id);
			return null;
		}
		ModbusPdu response = processor.processRequest(request.getPdu());
		if ((id == BROADCAST_ID) && !tcp) {
			log.debug("Broadcast request processed, no response");
			return null;
		}
		return response;
	}

	public void logData(String prefix, byte[] buffer, int start, int length) {
		if (log.isTraceEnabled())
			log.trace(prefix + ModbusPdu.toHex(buffer, start, length));
	}

	public abstract void start() throws ModbusConnectionException;

	public abstract void stop();

	public abstract boolean isRunning();

}
