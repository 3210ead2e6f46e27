package org.binvsa.ssa;

/**
 * Base class of all SSA expressions.
 */
public abstract class Expression {

	/**
	 * @return The statically known type of this expression.
	 */
	public abstract Type getType();

	public abstract <T> T accept(ExpressionVisitor<T> visitor);

	/**
	 * Width of a register-typed expression.
	 *
	 * @return bits.
	 */
	public int getBitWidth() {
		return getType().getBitWidth();
	}
}
