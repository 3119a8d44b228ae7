package certa.modbuslink;

public final class ModbusConstants {

	private ModbusConstants() {}
	
	public static final int MAX_PDU_SIZE = 253;
	public static final int MAX_READ_COILS = 2000;
	public static final int MAX_READ_REGS = 125;
	public static final int MAX_WRITE_COILS = 1968;
	public static final int MAX_WRITE_REGS = 123;
	public static final int MAX_ADDRESS = 0xFFFF;

	public static final int BROADCAST_ID = 0;
	public static final int MAX_SERIAL_ID = 247;
	public static final int MAX_TCP_ID = 255;
	public static final int DEFAULT_TCP_PORT = 502;

	public static final int MBAP_SIZE = 7;
	public static final int MAX_RTU_FRAME = MAX_PDU_SIZE + 3; // id(1), PDU(n), CRC(2)
	public static final int MAX_ASCII_FRAME = 1 + (MAX_PDU_SIZE + 2) * 2 + 2; // ':', hex(id, PDU, LRC), CR LF
	public static final int MAX_TCP_FRAME = MAX_PDU_SIZE + MBAP_SIZE;

	public static final byte FN_READ_COILS = 1;
	public static final byte FN_READ_DISCRETE_INPUTS = 2;
	public static final byte FN_READ_HOLDING_REGISTERS = 3;
	public static final byte FN_READ_INPUT_REGISTERS = 4;
	public static final byte FN_WRITE_SINGLE_COIL = 5;
	public static final byte FN_WRITE_SINGLE_REGISTER = 6;
	public static final byte FN_WRITE_MULTIPLE_COILS = 15;
	public static final byte FN_WRITE_MULTIPLE_REGISTERS = 16;

	public static final int EXCEPTION_FLAG = 0x80;
	public static final int COIL_ON = 0xFF00;
	public static final int COIL_OFF = 0x0000;
	
}
