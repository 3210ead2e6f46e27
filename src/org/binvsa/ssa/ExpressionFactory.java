package org.binvsa.ssa;

import java.util.Arrays;

/**
 * Static helpers to build SSA expressions.
 */
public final class ExpressionFactory {

	private ExpressionFactory() {
	}

	public static Constant createNumber(long value, int bitWidth) {
		return new Constant(value, bitWidth);
	}

	public static final Constant TRUE = createNumber(1L, 1);
	public static final Constant FALSE = createNumber(0L, 1);

	public static Variable createRegister(String name, int bitWidth) {
		return new Variable(name, Type.reg(bitWidth));
	}

	public static Variable createMemory(String name, int indexWidth) {
		return new Variable(name, Type.mem(indexWidth, 8));
	}

	public static Phi createPhi(Variable... operands) {
		return new Phi(Arrays.asList(operands));
	}

	public static BinOp createBinOp(BinaryOperator op, Expression left, Expression right) {
		return new BinOp(op, left, right);
	}

	public static BinOp createPlus(Expression left, Expression right) {
		return new BinOp(BinaryOperator.PLUS, left, right);
	}

	public static BinOp createMinus(Expression left, Expression right) {
		return new BinOp(BinaryOperator.MINUS, left, right);
	}

	public static BinOp createAnd(Expression left, Expression right) {
		return new BinOp(BinaryOperator.AND, left, right);
	}

	public static BinOp createOr(Expression left, Expression right) {
		return new BinOp(BinaryOperator.OR, left, right);
	}

	public static BinOp createEqual(Expression left, Expression right) {
		return new BinOp(BinaryOperator.EQ, left, right);
	}

	public static BinOp createLessThan(Expression left, Expression right) {
		return new BinOp(BinaryOperator.SLT, left, right);
	}

	public static BinOp createLessOrEqual(Expression left, Expression right) {
		return new BinOp(BinaryOperator.SLE, left, right);
	}

	public static UnOp createNot(Expression operand) {
		return new UnOp(UnaryOperator.NOT, operand);
	}

	public static UnOp createNeg(Expression operand) {
		return new UnOp(UnaryOperator.NEG, operand);
	}

	public static Load createLoad(Expression memory, Expression index, int bitWidth) {
		return new Load(memory, index, Type.reg(bitWidth));
	}

	public static Store createStore(Expression memory, Expression index, Expression value) {
		return new Store(memory, index, value);
	}

	public static Cast createCast(CastType castType, int bitWidth, Expression operand) {
		return new Cast(castType, bitWidth, operand);
	}

	public static Ite createConditionalExpression(Expression condition, Expression trueExpression, Expression falseExpression) {
		return new Ite(condition, trueExpression, falseExpression);
	}

	/**
	 * Create an edge condition stating that the given comparison evaluates to the
	 * given truth value.
	 *
	 * @param comparison A one bit expression.
	 * @param holds The truth value of the comparison on the edge.
	 * @return {@code comparison == holds}.
	 */
	public static BinOp createCondition(Expression comparison, boolean holds) {
		return createEqual(comparison, holds ? TRUE : FALSE);
	}
}
