package org.binvsa.ssa;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * SSA phi node selecting among the incoming definitions of a variable.
 */
public final class Phi extends Expression {

	private final List<Variable> operands;

	public Phi(List<Variable> operands) {
		if (operands.isEmpty()) {
			throw new IllegalArgumentException("Phi without operands");
		}
		this.operands = Collections.unmodifiableList(new ArrayList<>(operands));
	}

	public List<Variable> getOperands() {
		return operands;
	}

	@Override
	public Type getType() {
		return operands.get(0).getType();
	}

	@Override
	public <T> T accept(ExpressionVisitor<T> visitor) {
		return visitor.visit(this);
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof Phi && operands.equals(((Phi) obj).operands);
	}

	@Override
	public int hashCode() {
		return operands.hashCode();
	}

	@Override
	public String toString() {
		StringBuilder res = new StringBuilder("phi(");
		for (int i = 0; i < operands.size(); i++) {
			if (i > 0) {
				res.append(", ");
			}
			res.append(operands.get(i));
		}
		return res.append(')').toString();
	}
}
