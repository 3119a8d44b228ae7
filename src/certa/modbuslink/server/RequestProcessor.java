package certa.modbuslink.server;

import certa.modbuslink.ModbusPdu;

public interface RequestProcessor {

	/**
	 * @param request - request PDU as received. It is not modified.
	 * @return response PDU (normal or exception), or <b>null</b> if the request must not be answered
	 */
	ModbusPdu processRequest(ModbusPdu request);

}
