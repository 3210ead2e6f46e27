package org.binvsa.cfa;

import org.binvsa.util.Optional;

/**
 * A directed edge between two basic blocks, optionally labeled with a condition.
 */
public final class CFAEdge {

	private final BasicBlock source;
	private final BasicBlock target;
	private final Optional<EdgeCondition> condition;

	CFAEdge(BasicBlock source, BasicBlock target, Optional<EdgeCondition> condition) {
		assert source != null && target != null && condition != null;
		this.source = source;
		this.target = target;
		this.condition = condition;
	}

	public BasicBlock getSource() {
		return source;
	}

	public BasicBlock getTarget() {
		return target;
	}

	public Optional<EdgeCondition> getCondition() {
		return condition;
	}

	@Override
	public String toString() {
		return source + " -> " + target + (condition.hasValue() ? " [" + condition.getValue() + "]" : "");
	}
}
