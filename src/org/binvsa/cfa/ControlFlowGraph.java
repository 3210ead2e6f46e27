package org.binvsa.cfa;

import org.binvsa.ssa.statements.Statement;
import org.binvsa.util.Logger;
import org.binvsa.util.Optional;

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.HashSet;
import java.util.Iterator;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * Control flow graph over SSA basic blocks. The first block created is the entry
 * unless another one is selected with {@link #setEntry(BasicBlock)}.
 */
public class ControlFlowGraph {

	private static final Logger logger = Logger.getLogger(ControlFlowGraph.class);

	private final List<BasicBlock> blocks = new ArrayList<>();
	private final Map<BasicBlock, List<CFAEdge>> outEdges = new HashMap<>();
	private final Map<BasicBlock, List<CFAEdge>> inEdges = new HashMap<>();
	private BasicBlock entry;

	public BasicBlock createBlock(String label, Statement... statements) {
		return createBlock(label, Arrays.asList(statements));
	}

	public BasicBlock createBlock(String label, List<Statement> statements) {
		BasicBlock block = new BasicBlock(blocks.size(), label, statements);
		blocks.add(block);
		outEdges.put(block, new ArrayList<CFAEdge>());
		inEdges.put(block, new ArrayList<CFAEdge>());
		if (entry == null) {
			entry = block;
		}
		return block;
	}

	public void setEntry(BasicBlock block) {
		checkMember(block);
		entry = block;
	}

	public BasicBlock getEntry() {
		if (entry == null) {
			throw new IllegalStateException("Empty control flow graph has no entry");
		}
		return entry;
	}

	public CFAEdge addEdge(BasicBlock source, BasicBlock target) {
		return addEdge(source, target, Optional.<EdgeCondition>none());
	}

	public CFAEdge addEdge(BasicBlock source, BasicBlock target, EdgeCondition condition) {
		return addEdge(source, target, new Optional<>(condition));
	}

	private CFAEdge addEdge(BasicBlock source, BasicBlock target, Optional<EdgeCondition> condition) {
		checkMember(source);
		checkMember(target);
		CFAEdge edge = new CFAEdge(source, target, condition);
		outEdges.get(source).add(edge);
		inEdges.get(target).add(edge);
		return edge;
	}

	private void checkMember(BasicBlock block) {
		if (block.getId() >= blocks.size() || blocks.get(block.getId()) != block) {
			throw new IllegalArgumentException("Block " + block + " does not belong to this graph");
		}
	}

	public List<BasicBlock> getBlocks() {
		return Collections.unmodifiableList(blocks);
	}

	public List<CFAEdge> getOutEdges(BasicBlock block) {
		return Collections.unmodifiableList(outEdges.get(block));
	}

	public List<CFAEdge> getInEdges(BasicBlock block) {
		return Collections.unmodifiableList(inEdges.get(block));
	}

	/**
	 * @return The blocks not reachable from the entry, in creation order.
	 */
	public List<BasicBlock> getUnreachableBlocks() {
		Set<BasicBlock> reached = new HashSet<>(getReversePostorder());
		List<BasicBlock> unreachable = new ArrayList<>();
		for (BasicBlock b : blocks) {
			if (!reached.contains(b)) {
				unreachable.add(b);
			}
		}
		return unreachable;
	}

	public boolean isConnected() {
		return getUnreachableBlocks().isEmpty();
	}

	/**
	 * Compute the reverse postorder of a depth first search from the entry. Only reachable
	 * blocks are contained.
	 *
	 * @return Blocks in reverse postorder.
	 */
	public List<BasicBlock> getReversePostorder() {
		List<BasicBlock> postorder = new ArrayList<>();
		Set<BasicBlock> visited = new HashSet<>();
		// explicit stack of (block, remaining successors) to survive deep graphs
		Deque<BasicBlock> stack = new ArrayDeque<>();
		Deque<Iterator<CFAEdge>> iterators = new ArrayDeque<>();
		BasicBlock start = getEntry();
		visited.add(start);
		stack.push(start);
		iterators.push(outEdges.get(start).iterator());
		while (!stack.isEmpty()) {
			Iterator<CFAEdge> it = iterators.peek();
			if (it.hasNext()) {
				BasicBlock succ = it.next().getTarget();
				if (visited.add(succ)) {
					stack.push(succ);
					iterators.push(outEdges.get(succ).iterator());
				}
			} else {
				postorder.add(stack.pop());
				iterators.pop();
			}
		}
		Collections.reverse(postorder);
		return postorder;
	}

	/**
	 * Compute the targets of back edges of a depth first search from the entry, i.e. the
	 * heads of all loops. Widening is applied at these blocks.
	 *
	 * @return Loop heads.
	 */
	public Set<BasicBlock> getLoopHeads() {
		Set<BasicBlock> heads = new LinkedHashSet<>();
		Set<BasicBlock> visited = new HashSet<>();
		Set<BasicBlock> onStack = new HashSet<>();
		Deque<BasicBlock> stack = new ArrayDeque<>();
		Deque<Iterator<CFAEdge>> iterators = new ArrayDeque<>();
		BasicBlock start = getEntry();
		visited.add(start);
		onStack.add(start);
		stack.push(start);
		iterators.push(outEdges.get(start).iterator());
		while (!stack.isEmpty()) {
			Iterator<CFAEdge> it = iterators.peek();
			if (it.hasNext()) {
				BasicBlock succ = it.next().getTarget();
				if (onStack.contains(succ)) {
					heads.add(succ);
				} else if (visited.add(succ)) {
					onStack.add(succ);
					stack.push(succ);
					iterators.push(outEdges.get(succ).iterator());
				}
			} else {
				onStack.remove(stack.pop());
				iterators.pop();
			}
		}
		if (logger.isDebugEnabled()) {
			logger.debug("Loop heads: " + heads);
		}
		return heads;
	}

	@Override
	public String toString() {
		StringBuilder res = new StringBuilder();
		for (BasicBlock b : blocks) {
			res.append(b).append(":\n");
			for (Statement s : b.getStatements()) {
				res.append('\t').append(s).append('\n');
			}
			for (CFAEdge e : outEdges.get(b)) {
				res.append("\t-> ").append(e).append('\n');
			}
		}
		return res.toString();
	}
}
