package org.binvsa.ssa;

/**
 * Bit concatenation, the high part occupying the most significant bits.
 */
public final class Concat extends Expression {

	private final Expression high;
	private final Expression low;

	public Concat(Expression high, Expression low) {
		assert high != null && low != null;
		if (high.getBitWidth() + low.getBitWidth() > 64) {
			throw new IllegalArgumentException("Concatenation wider than 64 bits: " + high + " @ " + low);
		}
		this.high = high;
		this.low = low;
	}

	public Expression getHigh() {
		return high;
	}

	public Expression getLow() {
		return low;
	}

	@Override
	public Type getType() {
		return Type.reg(high.getBitWidth() + low.getBitWidth());
	}

	@Override
	public <T> T accept(ExpressionVisitor<T> visitor) {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Concat)) {
			return false;
		}
		Concat other = (Concat) obj;
		return high.equals(other.high) && low.equals(other.low);
	}

	@Override
	public int hashCode() {
		return high.hashCode() * 31 + low.hashCode();
	}

	@Override
	public String toString() {
		return "(" + high + " @ " + low + ")";
	}
}
