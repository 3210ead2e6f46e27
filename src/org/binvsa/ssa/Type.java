package org.binvsa.ssa;

/**
 * Type of an IL value: either a register of a fixed bit width or a memory mapping
 * addresses of one width to values of another.
 */
public final class Type {

	public enum Kind { REGISTER, MEMORY }

	private final Kind kind;
	private final int bitWidth;
	private final int indexWidth;
	private final int valueWidth;

	private Type(Kind kind, int bitWidth, int indexWidth, int valueWidth) {
		this.kind = kind;
		this.bitWidth = bitWidth;
		this.indexWidth = indexWidth;
		this.valueWidth = valueWidth;
	}

	/**
	 * Create a register type.
	 *
	 * @param bitWidth Width in bits, between 1 and 64.
	 * @return The type.
	 */
	public static Type reg(int bitWidth) {
		if (bitWidth < 1 || bitWidth > 64) {
			throw new IllegalArgumentException("Unsupported register width: " + bitWidth);
		}
		return new Type(Kind.REGISTER, bitWidth, 0, 0);
	}

	/**
	 * Create a memory type.
	 *
	 * @param indexWidth Width of addresses.
	 * @param valueWidth Width of stored values.
	 * @return The type.
	 */
	public static Type mem(int indexWidth, int valueWidth) {
		if (indexWidth < 1 || indexWidth > 64 || valueWidth < 1 || valueWidth > 64) {
			throw new IllegalArgumentException("Unsupported memory type: " + indexWidth + " -> " + valueWidth);
		}
		return new Type(Kind.MEMORY, 0, indexWidth, valueWidth);
	}

	public Kind getKind() {
		return kind;
	}

	public boolean isRegister() {
		return kind == Kind.REGISTER;
	}

	public boolean isMemory() {
		return kind == Kind.MEMORY;
	}

	public int getBitWidth() {
		if (!isRegister()) {
			throw new IllegalStateException("Memory type " + this + " has no bit width");
		}
		return bitWidth;
	}

	public int getIndexWidth() {
		if (!isMemory()) {
			throw new IllegalStateException("Register type " + this + " has no index width");
		}
		return indexWidth;
	}

	public int getValueWidth() {
		if (!isMemory()) {
			throw new IllegalStateException("Register type " + this + " has no value width");
		}
		return valueWidth;
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof Type)) {
			return false;
		}
		Type other = (Type) obj;
		return kind == other.kind && bitWidth == other.bitWidth && indexWidth == other.indexWidth && valueWidth == other.valueWidth;
	}

	@Override
	public int hashCode() {
		return ((kind.hashCode() * 31 + bitWidth) * 31 + indexWidth) * 31 + valueWidth;
	}

	@Override
	public String toString() {
		if (isRegister()) {
			return "u" + bitWidth;
		}
		return "?u" + indexWidth + (valueWidth == 8 ? "" : "->u" + valueWidth);
	}
}
