package org.binvsa.ssa.statements;

import org.binvsa.ssa.Expression;

public final class Assume extends Statement {

	private final Expression condition;

	public Assume(Expression condition) {
		assert condition != null;
		this.condition = condition;
	}

	public Expression getCondition() {
		return condition;
	}

	@Override
	public <T> T accept(StatementVisitor<T> visitor) {
		return visitor.visit(this);
	}

	@Override
	public String toString() {
		return "assume " + condition;
	}
}
