package org.binvsa.ssa.statements;

import org.binvsa.ssa.Variable;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * An operation the IL does not model, such as a system call or an unknown procedure.
 * Only the variables it defines and uses are known.
 */
public final class Special extends Statement {

	private final String name;
	private final List<Variable> defs;
	private final List<Variable> uses;

	public Special(String name, List<Variable> defs, List<Variable> uses) {
		assert name != null && defs != null && uses != null;
		this.name = name;
		this.defs = Collections.unmodifiableList(new ArrayList<>(defs));
		this.uses = Collections.unmodifiableList(new ArrayList<>(uses));
	}

	public String getName() {
		return name;
	}

	public List<Variable> getDefinedVariables() {
		return defs;
	}

	public List<Variable> getUsedVariables() {
		return uses;
	}

	@Override
	public <T> T accept(StatementVisitor<T> visitor) {
		return visitor.visit(this);
	}

	@Override
	public String toString() {
		return "special \"" + name + "\" defs " + defs + " uses " + uses;
	}
}
