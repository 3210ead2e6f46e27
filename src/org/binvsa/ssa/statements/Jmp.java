package org.binvsa.ssa.statements;

import org.binvsa.ssa.Expression;

public final class Jmp extends Statement {

	private final Expression target;

	public Jmp(Expression target) {
		assert target != null;
		this.target = target;
	}

	public Expression getTarget() {
		return target;
	}

	@Override
	public <T> T accept(StatementVisitor<T> visitor) {
		return visitor.visit(this);
	}

	@Override
	public String toString() {
		return "jmp " + target;
	}
}
