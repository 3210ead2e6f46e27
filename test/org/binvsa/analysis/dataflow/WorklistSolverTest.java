package org.binvsa.analysis.dataflow;

import org.binvsa.cfa.BasicBlock;
import org.binvsa.cfa.CFAEdge;
import org.binvsa.cfa.ControlFlowGraph;
import org.binvsa.cfa.EdgeCondition;
import org.binvsa.cfa.ProgramPoint;
import org.binvsa.ssa.ExpressionFactory;
import org.binvsa.ssa.Variable;
import org.binvsa.ssa.statements.Move;
import org.binvsa.ssa.statements.Statement;
import org.junit.Test;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertTrue;
import static org.junit.Assert.fail;

public class WorklistSolverTest {

	private static final Variable x = ExpressionFactory.createRegister("x", 32);
	private static final Statement move = new Move(x, ExpressionFactory.createNumber(0L, 32));

	/**
	 * Longest number of assignments on any path to a point, saturating at
	 * {@link Integer#MAX_VALUE}. Fall-through edges of conditional jumps are never taken.
	 */
	private static class AssignmentCount implements DataflowProblem<Integer> {

		@Override
		public Integer initialState(ControlFlowGraph cfg) {
			return 0;
		}

		@Override
		public Integer unreached() {
			return -1;
		}

		@Override
		public boolean isUnreached(Integer state) {
			return state < 0;
		}

		@Override
		public Integer join(Integer a, Integer b) {
			return Math.max(a, b);
		}

		@Override
		public Integer widen(Integer older, Integer newer) {
			return newer > older ? Integer.MAX_VALUE : older;
		}

		@Override
		public Integer transferStatement(Statement statement, Integer state) {
			if (isUnreached(state) || state == Integer.MAX_VALUE || !(statement instanceof Move)) {
				return state;
			}
			return state + 1;
		}

		@Override
		public Integer transferEdge(CFAEdge edge, Integer state) {
			if (edge.getCondition().hasValue() && !edge.getCondition().getValue().getBranch()) {
				return unreached();
			}
			return state;
		}
	}

	private static DataflowResult<Integer> solve(ControlFlowGraph cfg, boolean widening, int maxIterations) {
		return new WorklistSolver<>(new AssignmentCount(), widening, 0, maxIterations).solve(cfg);
	}

	@Test
	public void testStraightLine() {
		ControlFlowGraph cfg = new ControlFlowGraph();
		BasicBlock a = cfg.createBlock("a", move, move);
		BasicBlock b = cfg.createBlock("b", move);
		cfg.addEdge(a, b);
		DataflowResult<Integer> result = solve(cfg, true, 10);
		assertEquals(Integer.valueOf(0), result.getIn(a));
		assertEquals(Integer.valueOf(2), result.getIn(b));
		assertEquals(Integer.valueOf(3), result.getOut(b));
		assertEquals(2, result.getIterations());
		assertEquals(0L, result.getJoinCount());
	}

	@Test
	public void testDiamond() {
		ControlFlowGraph cfg = new ControlFlowGraph();
		BasicBlock entry = cfg.createBlock("entry", move);
		BasicBlock left = cfg.createBlock("left", move, move);
		BasicBlock right = cfg.createBlock("right");
		BasicBlock join = cfg.createBlock("join");
		cfg.addEdge(entry, left);
		cfg.addEdge(entry, right);
		cfg.addEdge(left, join);
		cfg.addEdge(right, join);
		DataflowResult<Integer> result = solve(cfg, true, 10);
		assertEquals(Integer.valueOf(3), result.getIn(join));
		// reverse postorder visits the join point once
		assertEquals(4, result.getIterations());
		assertEquals(Integer.valueOf(2), result.getState(new ProgramPoint(left, 1)));
		assertEquals(Integer.valueOf(3), result.getState(result.lastLocation(left)));
	}

	@Test
	public void testUntakenEdge() {
		ControlFlowGraph cfg = new ControlFlowGraph();
		BasicBlock entry = cfg.createBlock("entry", move);
		BasicBlock taken = cfg.createBlock("taken", move);
		BasicBlock untaken = cfg.createBlock("untaken", move);
		cfg.addEdge(entry, taken, new EdgeCondition(true, ExpressionFactory.TRUE));
		CFAEdge edge = cfg.addEdge(entry, untaken, new EdgeCondition(false, ExpressionFactory.FALSE));
		DataflowResult<Integer> result = solve(cfg, true, 10);
		assertEquals(Integer.valueOf(2), result.getOut(taken));
		assertEquals(Integer.valueOf(-1), result.getIn(untaken));
		assertEquals(Integer.valueOf(-1), result.getOut(untaken));
		assertEquals(Integer.valueOf(-1), result.getEdgeState(edge));
	}

	private static ControlFlowGraph loop() {
		ControlFlowGraph cfg = new ControlFlowGraph();
		BasicBlock entry = cfg.createBlock("entry", move);
		BasicBlock head = cfg.createBlock("head", move);
		BasicBlock body = cfg.createBlock("body", move);
		BasicBlock exit = cfg.createBlock("exit");
		cfg.addEdge(entry, head);
		cfg.addEdge(head, body);
		cfg.addEdge(head, exit);
		cfg.addEdge(body, head);
		return cfg;
	}

	@Test
	public void testLoopWithWidening() {
		ControlFlowGraph cfg = loop();
		DataflowResult<Integer> result = solve(cfg, true, 100);
		BasicBlock head = cfg.getBlocks().get(1);
		BasicBlock exit = cfg.getBlocks().get(3);
		assertEquals(Integer.valueOf(Integer.MAX_VALUE), result.getIn(head));
		assertEquals(Integer.valueOf(Integer.MAX_VALUE), result.getIn(exit));
		assertTrue(result.getWideningCount() > 0L);
	}

	@Test
	public void testLoopWithoutWidening() {
		try {
			solve(loop(), false, 50);
			fail("Expected the iteration limit to be hit");
		} catch (FixpointNotReachedException e) {
			assertEquals(50, e.getIterations());
		}
	}

	@Test
	public void testWideningDelay() {
		ControlFlowGraph cfg = loop();
		DataflowResult<Integer> eager = solve(cfg, true, 100);
		DataflowResult<Integer> delayed = new WorklistSolver<>(new AssignmentCount(), true, 5, 100).solve(cfg);
		assertEquals(eager.getIn(cfg.getBlocks().get(1)), delayed.getIn(cfg.getBlocks().get(1)));
		assertTrue(delayed.getIterations() > eager.getIterations());
		assertTrue(delayed.getJoinCount() > eager.getJoinCount());
	}
}
