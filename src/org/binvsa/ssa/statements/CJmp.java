package org.binvsa.ssa.statements;

import org.binvsa.ssa.Expression;

public final class CJmp extends Statement {

	private final Expression condition;
	private final Expression trueTarget;
	private final Expression falseTarget;

	public CJmp(Expression condition, Expression trueTarget, Expression falseTarget) {
		assert condition != null && trueTarget != null && falseTarget != null;
		this.condition = condition;
		this.trueTarget = trueTarget;
		this.falseTarget = falseTarget;
	}

	public Expression getCondition() {
		return condition;
	}

	public Expression getTrueTarget() {
		return trueTarget;
	}

	public Expression getFalseTarget() {
		return falseTarget;
	}

	@Override
	public <T> T accept(StatementVisitor<T> visitor) {
		return visitor.visit(this);
	}

	@Override
	public String toString() {
		return "cjmp " + condition + ", " + trueTarget + ", " + falseTarget;
	}
}
