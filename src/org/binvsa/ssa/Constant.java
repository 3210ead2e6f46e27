package org.binvsa.ssa;

/**
 * An integer constant. The value is stored sign-extended from its bit width.
 */
public final class Constant extends Expression {

	private final long value;
	private final Type type;

	public Constant(long value, int bitWidth) {
		this.type = Type.reg(bitWidth);
		this.value = bitWidth == 64 ? value : (value << (64 - bitWidth)) >> (64 - bitWidth);
	}

	/**
	 * @return The value as a signed number of this constant's width.
	 */
	public long longValue() {
		return value;
	}

	/**
	 * @return The value zero-extended from this constant's width.
	 */
	public long unsignedLongValue() {
		int bits = type.getBitWidth();
		return bits == 64 ? value : value & ((1L << bits) - 1L);
	}

	@Override
	public Type getType() {
		return type;
	}

	@Override
	public <T> T accept(ExpressionVisitor<T> visitor) {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (this == obj) {
			return true;
		}
		if (!(obj instanceof Constant)) {
			return false;
		}
		Constant other = (Constant) obj;
		return value == other.value && type.equals(other.type);
	}

	@Override
	public int hashCode() {
		return Long.hashCode(value) * 31 + type.hashCode();
	}

	@Override
	public String toString() {
		return value + ":" + type;
	}
}
