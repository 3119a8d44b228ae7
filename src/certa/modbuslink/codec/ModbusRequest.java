package certa.modbuslink.codec;

import static certa.modbuslink.ModbusConstants.*;

import java.util.function.Function;

import certa.modbuslink.InvalidResponseException;
import certa.modbuslink.ModbusException;
import certa.modbuslink.ModbusLinkException;
import certa.modbuslink.ModbusPdu;

/**
 * Encoded request PDU together with the decoder of its typed response.
 * Instances are built by {@link ModbusRequests} and live for a single exchange.
 * @param <T> type of the decoded response value
 */
public final class ModbusRequest<T> {

	@FunctionalInterface
	public interface ResponseDecoder<T> {
		T decode(ModbusPdu request, ModbusPdu response) throws ModbusLinkException;
	}

	private final String name;
	private final ModbusPdu pdu;
	private final ResponseDecoder<T> decoder;
	private final boolean write;

	ModbusRequest(String name, ModbusPdu pdu, boolean write, ResponseDecoder<T> decoder) {
		this.name = name;
		this.pdu = pdu;
		this.write = write;
		this.decoder = decoder;
	}

	public String getName() {
		return name;
	}

	public ModbusPdu getPdu() {
		return pdu;
	}

	public int getFunction() {
		return pdu.getFunction();
	}

	public boolean isWrite() {
		return write;
	}

	/**
	 * Checks the echoed function code, turns exception responses into {@link ModbusException}
	 * and decodes a normal response.
	 */
	public T decode(ModbusPdu response) throws ModbusLinkException {
		int function = response.getFunction();
		if ((function & 0x7F) != pdu.getFunction())
			throw new InvalidResponseException("Invalid function: " + function + " (expected: " + pdu.getFunction() + ")");
		if ((function & EXCEPTION_FLAG) != 0) {
			if (response.getPduSize() != 2)
				throw new InvalidResponseException("Invalid exception response size: " + response.getPduSize());
			throw new ModbusException(pdu.getFunction(), response.getExceptionCode());
		}
		return decoder.decode(pdu, response);
	}

	public <R> ModbusRequest<R> map(String newName, Function<? super T, ? extends R> mapper) {
		ResponseDecoder<T> inner = decoder;
		return new ModbusRequest<R>(newName, pdu, write, (req, resp) -> mapper.apply(inner.decode(req, resp)));
	}

	@Override
	public String toString() {
		return name + " " + pdu;
	}

}
