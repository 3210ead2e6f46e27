package org.binvsa.analysis.dataflow;

import org.binvsa.cfa.CFAEdge;
import org.binvsa.cfa.ControlFlowGraph;
import org.binvsa.ssa.statements.Statement;

/**
 * A forward dataflow problem over a lattice of states {@code L}, solved by
 * {@link WorklistSolver}. States must implement {@link Object#equals(Object)} by value.
 *
 * @param <L> The lattice of abstract states.
 */
public interface DataflowProblem<L> {

	/**
	 * @return The state at the entry of the graph.
	 */
	L initialState(ControlFlowGraph cfg);

	/**
	 * @return The bottom element. It is the identity of {@link #join(Object, Object)}.
	 */
	L unreached();

	boolean isUnreached(L state);

	L join(L a, L b);

	/**
	 * Widen an older state by a newer one. The result must be an upper bound of both, and
	 * every sequence of widenings must stabilize.
	 */
	L widen(L older, L newer);

	L transferStatement(Statement statement, L state);

	/**
	 * Compute the state after taking an edge, e.g. by assuming its condition.
	 */
	L transferEdge(CFAEdge edge, L state);
}
