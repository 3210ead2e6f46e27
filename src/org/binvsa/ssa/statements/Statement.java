package org.binvsa.ssa.statements;

/**
 * Base class of SSA statements.
 */
public abstract class Statement {

	public abstract <T> T accept(StatementVisitor<T> visitor);
}
