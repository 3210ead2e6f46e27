package org.binvsa.cfa;

import org.binvsa.ssa.statements.Statement;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * A node of the control flow graph: a straight-line sequence of SSA statements.
 * Blocks are identified by their id, which is unique within one graph.
 */
public final class BasicBlock implements Comparable<BasicBlock> {

	private final int id;
	private final String label;
	private final List<Statement> statements;

	BasicBlock(int id, String label, List<Statement> statements) {
		assert label != null && statements != null;
		this.id = id;
		this.label = label;
		this.statements = Collections.unmodifiableList(new ArrayList<>(statements));
	}

	public int getId() {
		return id;
	}

	public String getLabel() {
		return label;
	}

	public List<Statement> getStatements() {
		return statements;
	}

	public int size() {
		return statements.size();
	}

	@Override
	public int compareTo(BasicBlock o) {
		return Integer.compare(id, o.id);
	}

	@Override
	public boolean equals(Object obj) {
		return obj instanceof BasicBlock && ((BasicBlock) obj).id == id;
	}

	@Override
	public int hashCode() {
		return id;
	}

	@Override
	public String toString() {
		return label + "#" + id;
	}
}
