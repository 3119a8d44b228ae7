package certa.modbuslink.client;

/**
 * Optional notification of a successful request. Called once with the decoded value
 * (null for writes), before the client call returns or its future completes.
 * Exceptions thrown by the callback are logged and don't affect the result.
 */
@FunctionalInterface
public interface ModbusCallback<T> {

	void onResponse(T value);

}
