package org.binvsa.ssa.statements;

public final class Comment extends Statement {

	private final String text;

	public Comment(String text) {
		assert text != null;
		this.text = text;
	}

	public String getText() {
		return text;
	}

	@Override
	public <T> T accept(StatementVisitor<T> visitor) {
		return visitor.visit(this);
	}

	@Override
	public String toString() {
		return "/* " + text + " */";
	}
}
