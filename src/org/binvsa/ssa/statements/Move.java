package org.binvsa.ssa.statements;

import org.binvsa.ssa.Expression;
import org.binvsa.ssa.Variable;

/**
 * Assignment of an expression to an SSA variable.
 */
public final class Move extends Statement {

	private final Variable variable;
	private final Expression expression;

	public Move(Variable variable, Expression expression) {
		assert variable != null && expression != null;
		this.variable = variable;
		this.expression = expression;
	}

	public Variable getVariable() {
		return variable;
	}

	public Expression getExpression() {
		return expression;
	}

	@Override
	public <T> T accept(StatementVisitor<T> visitor) {
		return visitor.visit(this);
	}

	@Override
	public String toString() {
		return variable + " = " + expression;
	}
}
