package org.binvsa.cfa;

import org.binvsa.ssa.Expression;

/**
 * Label of a conditional edge. The expression holds whenever control flows along the
 * edge; {@code branch} tells whether the edge is the taken or the fall-through side of
 * the jump.
 */
public final class EdgeCondition {

	private final boolean branch;
	private final Expression condition;

	public EdgeCondition(boolean branch, Expression condition) {
		assert condition != null;
		this.branch = branch;
		this.condition = condition;
	}

	public boolean getBranch() {
		return branch;
	}

	public Expression getCondition() {
		return condition;
	}

	@Override
	public String toString() {
		return branch + ": " + condition;
	}
}
