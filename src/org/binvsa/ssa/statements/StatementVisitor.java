package org.binvsa.ssa.statements;

public interface StatementVisitor<T> {

	T visit(Move stmt);

	T visit(Jmp stmt);

	T visit(CJmp stmt);

	T visit(Label stmt);

	T visit(Halt stmt);

	T visit(Assert stmt);

	T visit(Assume stmt);

	T visit(Comment stmt);

	T visit(Special stmt);
}
