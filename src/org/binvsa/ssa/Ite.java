package org.binvsa.ssa;

/**
 * If-then-else expression over a one bit condition.
 */
public final class Ite extends Expression {

	private final Expression condition;
	private final Expression trueExpression;
	private final Expression falseExpression;

	public Ite(Expression condition, Expression trueExpression, Expression falseExpression) {
		assert condition != null && trueExpression != null && falseExpression != null;
		this.condition = condition;
		this.trueExpression = trueExpression;
		this.falseExpression = falseExpression;
	}

	public Expression getCondition() {
		return condition;
	}

	public Expression getTrueExpression() {
		return trueExpression;
	}

	public Expression getFalseExpression() {
		return falseExpression;
	}

	@Override
	public Type getType() {
		return trueExpression.getType();
	}

	@Override
	public <T> T accept(ExpressionVisitor<T> visitor) {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object obj) {
		if (!(obj instanceof Ite)) {
			return false;
		}
		Ite other = (Ite) obj;
		return condition.equals(other.condition) && trueExpression.equals(other.trueExpression)
				&& falseExpression.equals(other.falseExpression);
	}

	@Override
	public int hashCode() {
		return (condition.hashCode() * 31 + trueExpression.hashCode()) * 31 + falseExpression.hashCode();
	}

	@Override
	public String toString() {
		return "if " + condition + " then " + trueExpression + " else " + falseExpression;
	}
}
