package org.binvsa.analysis.dataflow;

import org.binvsa.cfa.BasicBlock;
import org.binvsa.cfa.CFAEdge;
import org.binvsa.cfa.ProgramPoint;

import java.util.Collections;
import java.util.Map;

/**
 * The fixpoint computed by a {@link WorklistSolver}. States of blocks and edges never
 * reached are the problem's unreached element.
 *
 * @param <L> The lattice of abstract states.
 */
public final class DataflowResult<L> {

	private final DataflowProblem<L> problem;
	private final Map<BasicBlock, L> in;
	private final Map<BasicBlock, L> out;
	private final Map<CFAEdge, L> edgeStates;
	private final int iterations;
	private final long joins;
	private final long widenings;

	DataflowResult(DataflowProblem<L> problem, Map<BasicBlock, L> in, Map<BasicBlock, L> out,
			Map<CFAEdge, L> edgeStates, int iterations, long joins, long widenings) {
		this.problem = problem;
		this.in = Collections.unmodifiableMap(in);
		this.out = Collections.unmodifiableMap(out);
		this.edgeStates = Collections.unmodifiableMap(edgeStates);
		this.iterations = iterations;
		this.joins = joins;
		this.widenings = widenings;
	}

	/**
	 * @return The state before the first statement of the block.
	 */
	public L getIn(BasicBlock block) {
		L state = in.get(block);
		return state == null ? problem.unreached() : state;
	}

	/**
	 * @return The state after the last statement of the block.
	 */
	public L getOut(BasicBlock block) {
		L state = out.get(block);
		return state == null ? problem.unreached() : state;
	}

	/**
	 * @return The state after taking the edge, i.e. the contribution of the edge to the
	 * input of its target.
	 */
	public L getEdgeState(CFAEdge edge) {
		L state = edgeStates.get(edge);
		return state == null ? problem.unreached() : state;
	}

	/**
	 * Compute the state before statement {@code point.getIndex()} of a block by replaying
	 * the statements from the block's input.
	 */
	public L getState(ProgramPoint point) {
		if (point.isLast()) {
			return getOut(point.getBlock());
		}
		L state = getIn(point.getBlock());
		for (int i = 0; i < point.getIndex(); i++) {
			state = problem.transferStatement(point.getBlock().getStatements().get(i), state);
		}
		return state;
	}

	public ProgramPoint lastLocation(BasicBlock block) {
		return new ProgramPoint(block, block.size());
	}

	/**
	 * @return Number of block visits until the fixpoint was reached.
	 */
	public int getIterations() {
		return iterations;
	}

	public long getJoinCount() {
		return joins;
	}

	public long getWideningCount() {
		return widenings;
	}
}
