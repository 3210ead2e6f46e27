package org.binvsa.ssa;

/**
 * Visitor over all expression types.
 */
public interface ExpressionVisitor<T> {

	T visit(Constant e);

	T visit(Variable e);

	T visit(Phi e);

	T visit(BinOp e);

	T visit(UnOp e);

	T visit(Load e);

	T visit(Store e);

	T visit(Cast e);

	T visit(Concat e);

	T visit(Extract e);

	T visit(Ite e);

	T visit(Unknown e);

	T visit(LabelRef e);
}
