package org.binvsa.ssa;

public enum BinaryOperator {
	PLUS("+"), MINUS("-"), TIMES("*"), DIVIDE("/"), SDIVIDE("$/"), MOD("%"), SMOD("$%"),
	LSHIFT("<<"), RSHIFT(">>"), ARSHIFT("$>>"), AND("&"), OR("|"), XOR("^"),
	EQ("=="), NEQ("<>"), LT("<"), LE("<="), SLT("$<"), SLE("$<=");

	private final String symbol;

	BinaryOperator(String symbol) {
		this.symbol = symbol;
	}

	/**
	 * @return True if the operator yields a single truth bit.
	 */
	public boolean isComparison() {
		switch (this) {
		case EQ:
		case NEQ:
		case LT:
		case LE:
		case SLT:
		case SLE:
			return true;
		default:
			return false;
		}
	}

	@Override
	public String toString() {
		return symbol;
	}
}
