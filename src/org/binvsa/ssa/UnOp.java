package org.binvsa.ssa;

public final class UnOp extends Expression {

	private final UnaryOperator operator;
	private final Expression operand;

	public UnOp(UnaryOperator operator, Expression operand) {
		assert operator != null && operand != null;
		this.operator = operator;
		this.operand = operand;
	}

	public UnaryOperator getOperator() {
		return operator;
	}

	public Expression getOperand() {
		return operand;
	}

	@Override
	public Type getType() {
		return operand.getType();
	}

	@Override
	public <T> T accept(ExpressionVisitor<T> visitor) {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof UnOp)) {
			return false;
		}
		UnOp other = (UnOp) obj;
		return operator == other.operator && operand.equals(other.operand);
	}

	@Override
	public int hashCode() {
		return operator.hashCode() * 31 + operand.hashCode();
	}

	@Override
	public String toString() {
		return operator.toString() + operand;
	}
}
