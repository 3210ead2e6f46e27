package org.binvsa.ssa;

public final class Cast extends Expression {

	private final CastType castType;
	private final Type type;
	private final Expression operand;

	public Cast(CastType castType, int bitWidth, Expression operand) {
		assert castType != null && operand != null;
		this.castType = castType;
		this.type = Type.reg(bitWidth);
		this.operand = operand;
	}

	public CastType getCastType() {
		return castType;
	}

	public Expression getOperand() {
		return operand;
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
		if (!(obj instanceof Cast)) {
			return false;
		}
		Cast other = (Cast) obj;
		return castType == other.castType && type.equals(other.type) && operand.equals(other.operand);
	}

	@Override
	public int hashCode() {
		return (castType.hashCode() * 31 + type.hashCode()) * 31 + operand.hashCode();
	}

	@Override
	public String toString() {
		return castType + ":" + type + "(" + operand + ")";
	}
}
