package org.binvsa.analysis.dataflow;

import org.binvsa.cfa.BasicBlock;
import org.binvsa.cfa.CFAEdge;
import org.binvsa.cfa.ControlFlowGraph;
import org.binvsa.ssa.statements.Statement;
import org.binvsa.util.Logger;

import java.util.HashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.TreeMap;

/**
 * Forward worklist fixpoint iteration. The worklist always yields the block that comes
 * first in reverse postorder, so inner loops stabilize before their successors are
 * processed. Widening is applied at the targets of back edges once the number of joins
 * there exceeds the widening delay.
 *
 * @param <L> The lattice of abstract states.
 */
public class WorklistSolver<L> {

	private static final Logger logger = Logger.getLogger(WorklistSolver.class);

	private final DataflowProblem<L> problem;
	private final boolean widening;
	private final int wideningDelay;
	private final int maxIterations;

	public WorklistSolver(DataflowProblem<L> problem, boolean widening, int wideningDelay, int maxIterations) {
		assert problem != null;
		assert wideningDelay >= 0 && maxIterations > 0;
		this.problem = problem;
		this.widening = widening;
		this.wideningDelay = wideningDelay;
		this.maxIterations = maxIterations;
	}

	/**
	 * Compute the fixpoint of the problem on the graph.
	 *
	 * @throws FixpointNotReachedException if more than the maximum number of block visits
	 * are needed.
	 */
	public DataflowResult<L> solve(ControlFlowGraph cfg) {
		List<BasicBlock> order = cfg.getReversePostorder();
		Map<BasicBlock, Integer> index = new HashMap<>();
		for (int i = 0; i < order.size(); i++) {
			index.put(order.get(i), i);
		}
		Set<BasicBlock> loopHeads = cfg.getLoopHeads();

		Map<BasicBlock, L> in = new HashMap<>();
		Map<BasicBlock, L> out = new HashMap<>();
		Map<CFAEdge, L> edgeStates = new HashMap<>();
		Map<BasicBlock, Integer> joinCounts = new HashMap<>();
		int iterations = 0;
		long joins = 0;
		long widenings = 0;

		BasicBlock entry = cfg.getEntry();
		in.put(entry, problem.initialState(cfg));
		TreeMap<Integer, BasicBlock> workList = new TreeMap<>();
		workList.put(index.get(entry), entry);

		while (!workList.isEmpty()) {
			BasicBlock block = workList.pollFirstEntry().getValue();
			if (++iterations > maxIterations) {
				logger.error("Giving up after " + maxIterations + " block visits, last visited " + block);
				logger.printLastLog();
				throw new FixpointNotReachedException(maxIterations);
			}
			logger.verbose("Visiting " + block);

			L state = in.get(block);
			for (Statement s : block.getStatements()) {
				state = problem.transferStatement(s, state);
			}
			out.put(block, state);

			for (CFAEdge edge : cfg.getOutEdges(block)) {
				L edgeState = problem.transferEdge(edge, state);
				edgeStates.put(edge, edgeState);
				BasicBlock succ = edge.getTarget();
				L old = in.get(succ);
				L newIn;
				if (old == null) {
					if (problem.isUnreached(edgeState)) {
						continue;
					}
					newIn = edgeState;
				} else {
					newIn = problem.join(old, edgeState);
					joins++;
					Integer count = joinCounts.get(succ);
					count = count == null ? 1 : count + 1;
					joinCounts.put(succ, count);
					if (widening && loopHeads.contains(succ) && count > wideningDelay && !newIn.equals(old)) {
						newIn = problem.widen(old, newIn);
						widenings++;
						if (logger.isDebugEnabled()) {
							logger.debug("Widened input of " + succ + " to " + newIn);
						}
					}
					if (newIn.equals(old)) {
						continue;
					}
				}
				in.put(succ, newIn);
				workList.put(index.get(succ), succ);
			}
		}

		logger.verbose("Fixpoint reached after " + iterations + " iterations");
		return new DataflowResult<>(problem, in, out, edgeStates, iterations, joins, widenings);
	}
}
