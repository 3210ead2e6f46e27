package org.binvsa.ssa;

/**
 * Extraction of the bits {@code high} down to {@code low}, both inclusive.
 */
public final class Extract extends Expression {

	private final int high;
	private final int low;
	private final Expression operand;

	public Extract(int high, int low, Expression operand) {
		assert operand != null;
		if (low < 0 || high < low || high >= operand.getBitWidth()) {
			throw new IllegalArgumentException("Invalid bit range " + high + ":" + low + " of " + operand);
		}
		this.high = high;
		this.low = low;
		this.operand = operand;
	}

	public int getHigh() {
		return high;
	}

	public int getLow() {
		return low;
	}

	public Expression getOperand() {
		return operand;
	}

	@Override
	public Type getType() {
		return Type.reg(high - low + 1);
	}

	@Override
	public <T> T accept(ExpressionVisitor<T> visitor) {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Extract)) {
			return false;
		}
		Extract other = (Extract) obj;
		return high == other.high && low == other.low && operand.equals(other.operand);
	}

	@Override
	public int hashCode() {
		return (high * 31 + low) * 31 + operand.hashCode();
	}

	@Override
	public String toString() {
		return "extract:" + high + ":" + low + "(" + operand + ")";
	}
}
