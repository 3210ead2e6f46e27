package org.binvsa.ssa;

public final class BinOp extends Expression {

	private final BinaryOperator operator;
	private final Expression left;
	private final Expression right;

	public BinOp(BinaryOperator operator, Expression left, Expression right) {
		assert operator != null && left != null && right != null;
		this.operator = operator;
		this.left = left;
		this.right = right;
	}

	public BinaryOperator getOperator() {
		return operator;
	}

	public Expression getLeft() {
		return left;
	}

	public Expression getRight() {
		return right;
	}

	@Override
	public Type getType() {
		if (operator.isComparison()) {
			return Type.reg(1);
		}
		return left.getType();
	}

	@Override
	public <T> T accept(ExpressionVisitor<T> visitor) {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof BinOp)) {
			return false;
		}
		BinOp other = (BinOp) obj;
		return operator == other.operator && left.equals(other.left) && right.equals(other.right);
	}

	@Override
	public int hashCode() {
		return (operator.hashCode() * 31 + left.hashCode()) * 31 + right.hashCode();
	}

	@Override
	public String toString() {
		return "(" + left + " " + operator + " " + right + ")";
	}
}
