package org.binvsa.ssa.statements;

import org.binvsa.ssa.Expression;

public final class Halt extends Statement {

	private final Expression value;

	public Halt(Expression value) {
		assert value != null;
		this.value = value;
	}

	public Expression getValue() {
		return value;
	}

	@Override
	public <T> T accept(StatementVisitor<T> visitor) {
		return visitor.visit(this);
	}

	@Override
	public String toString() {
		return "halt " + value;
	}
}
