package org.binvsa.ssa.statements;

/**
 * Statement visitor that forwards every statement not overridden to
 * {@link #visitDefault(Statement)}.
 */
public abstract class DefaultStatementVisitor<T> implements StatementVisitor<T> {

	protected abstract T visitDefault(Statement stmt);

	@Override
	public T visit(Move stmt) {
		return visitDefault(stmt);
	}

	@Override
	public T visit(Jmp stmt) {
		return visitDefault(stmt);
	}

	@Override
	public T visit(CJmp stmt) {
		return visitDefault(stmt);
	}

	@Override
	public T visit(Label stmt) {
		return visitDefault(stmt);
	}

	@Override
	public T visit(Halt stmt) {
		return visitDefault(stmt);
	}

	@Override
	public T visit(Assert stmt) {
		return visitDefault(stmt);
	}

	@Override
	public T visit(Assume stmt) {
		return visitDefault(stmt);
	}

	@Override
	public T visit(Comment stmt) {
		return visitDefault(stmt);
	}

	@Override
	public T visit(Special stmt) {
		return visitDefault(stmt);
	}
}
