package certa.modbuslink.server;

/**
 * Fixed size table of bits or 16-bit registers starting at an arbitrary address.
 * Ranged reads and writes are synchronized, so a multi-value request is never torn.
 */
public class RegistersTable {

	private final int[] values;
	protected final int start;

	public RegistersTable(int startAddress, int count) {
		if ((startAddress < 0) || (count < 0) || (startAddress + count > 0x10000))
			throw new IllegalArgumentException("Invalid table: start " + startAddress + ", count " + count);
		this.start = startAddress;
		this.values = new int[count];
	}

	public boolean isValidAddress(int address) {
		return (address >= firstAddress()) && (address <= lastAddress());
	}

	public boolean isValidRange(int address, int count) {
		return (count >= 0) && isValidAddress(address) && ((count == 0) || isValidAddress(address + count - 1));
	}

	public int firstAddress() {
		return start;
	}

	public int lastAddress() {
		return start + count() - 1;
	}

	public int count() {
		return values.length;
	}

	private void checkRange(int address, int count) {
		if (!isValidRange(address, count))
			throw new IndexOutOfBoundsException("Range " + address + " - " + (address + count - 1)
					+ " is outside " + firstAddress() + " - " + lastAddress());
	}

	synchronized public int getInt(int address) {
		checkRange(address, 1);
		return values[address - start];
	}

	synchronized public int[] getInts(int address, int count) {
		checkRange(address, count);
		int[] res = new int[count];
		System.arraycopy(values, address - start, res, 0, count);
		return res;
	}

	synchronized public void setInts(int address, int[] src) {
		checkRange(address, src.length);
		for (int i = 0; i < src.length; i++)
			values[address - start + i] = src[i] & 0xFFFF;
	}

	synchronized public boolean[] getBools(int address, int count) {
		checkRange(address, count);
		boolean[] res = new boolean[count];
		for (int i = 0; i < count; i++)
			res[i] = values[address - start + i] != 0;
		return res;
	}

	synchronized public void setBools(int address, boolean[] src) {
		checkRange(address, src.length);
		for (int i = 0; i < src.length; i++)
			values[address - start + i] = src[i] ? 1 : 0;
	}

}
