package org.binvsa.ssa.statements;

public final class Label extends Statement {

	private final String name;

	public Label(String name) {
		assert name != null;
		this.name = name;
	}

	public String getName() {
		return name;
	}

	@Override
	public <T> T accept(StatementVisitor<T> visitor) {
		return visitor.visit(this);
	}

	@Override
	public String toString() {
		return "label " + name;
	}
}
