package org.binvsa.ssa;

public enum UnaryOperator {
	NEG("-"), NOT("~");

	private final String symbol;

	UnaryOperator(String symbol) {
		this.symbol = symbol;
	}

	@Override
	public String toString() {
		return symbol;
	}
}
