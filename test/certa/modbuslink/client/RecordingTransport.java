package certa.modbuslink.client;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;

import certa.modbuslink.ModbusConstants;
import certa.modbuslink.ModbusLinkException;
import certa.modbuslink.ModbusPdu;
import certa.modbuslink.transport.ModbusTransport;

/**
 * Transport stub that records requests and plays back queued responses or errors.
 */
final class RecordingTransport implements ModbusTransport {

	final List<Integer> units = new ArrayList<>();
	final List<ModbusPdu> requests = new ArrayList<>();
	private final Deque<Object> answers = new ArrayDeque<>();
	private boolean open;
	private int maxUnitId = ModbusConstants.MAX_TCP_ID;

	RecordingTransport maxUnitId(int maxUnitId) {
		this.maxUnitId = maxUnitId;
		return this;
	}

	RecordingTransport answer(int... pdu) {
		byte[] b = new byte[pdu.length];
		for (int i = 0; i < pdu.length; i++)
			b[i] = (byte) pdu[i];
		answers.add(ModbusPdu.of(b));
		return this;
	}

	RecordingTransport fail(ModbusLinkException e) {
		answers.add(e);
		return this;
	}

	@Override
	public String getName() {
		return "recording";
	}

	@Override
	public int getMaxUnitId() {
		return maxUnitId;
	}

	@Override
	public void open() {
		open = true;
	}

	@Override
	public boolean isOpen() {
		return open;
	}

	@Override
	public void close() {
		open = false;
	}

	@Override
	public ModbusPdu exchange(int unitId, ModbusPdu request) throws ModbusLinkException {
		units.add(unitId);
		requests.add(request);
		if (unitId == 0)
			return null;
		Object a = answers.poll();
		if (a instanceof ModbusLinkException)
			throw (ModbusLinkException) a;
		if (a == null)
			throw new IllegalStateException("No answer queued for " + request);
		return (ModbusPdu) a;
	}

}
