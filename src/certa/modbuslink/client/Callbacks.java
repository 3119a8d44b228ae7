package certa.modbuslink.client;

import static certa.modbuslink.ModbusConstants.*;

import org.slf4j.Logger;

import certa.modbuslink.codec.ModbusRequest;

final class Callbacks {

	private Callbacks() {}

	static void checkUnit(int unitId, int maxUnitId, ModbusRequest<?> request) {
		if ((unitId < 0) || (unitId > maxUnitId))
			throw new IllegalArgumentException("Invalid unit id: " + unitId + ". Must be 0.." + maxUnitId);
		if ((unitId == BROADCAST_ID) && !request.isWrite())
			throw new IllegalArgumentException("Broadcast is allowed for writes only: " + request.getName());
	}

	static <T> void notify(Logger log, ModbusCallback<? super T> callback, T value, ModbusRequest<T> request) {
		if (callback == null)
			return;
		try {
			callback.onResponse(value);
		} catch (RuntimeException e) {
			log.warn("Callback of {} failed", request.getName(), e);
		}
	}

}
