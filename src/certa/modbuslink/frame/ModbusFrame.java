package certa.modbuslink.frame;

import certa.modbuslink.ModbusPdu;

public final class ModbusFrame {

	private final int transactionId;
	private final int unitId;
	private final ModbusPdu pdu;

	public ModbusFrame(int unitId, ModbusPdu pdu) {
		this(0, unitId, pdu);
	}

	public ModbusFrame(int transactionId, int unitId, ModbusPdu pdu) {
		this.transactionId = transactionId;
		this.unitId = unitId;
		this.pdu = pdu;
	}

	public int getTransactionId() {
		return transactionId;
	}

	public int getUnitId() {
		return unitId;
	}

	public ModbusPdu getPdu() {
		return pdu;
	}

	@Override
	public String toString() {
		return "Frame[txn=" + transactionId + ", unit=" + unitId + ", " + pdu + "]";
	}

}
