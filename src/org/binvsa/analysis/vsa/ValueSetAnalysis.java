package org.binvsa.analysis.vsa;

import org.binvsa.analysis.InvalidConfigurationException;
import org.binvsa.analysis.dataflow.DataflowResult;
import org.binvsa.analysis.dataflow.WorklistSolver;
import org.binvsa.analysis.vsa.statistic.Statistic;
import org.binvsa.cfa.BasicBlock;
import org.binvsa.cfa.ControlFlowGraph;
import org.binvsa.ssa.Expression;
import org.binvsa.ssa.Variable;
import org.binvsa.util.Logger;
import org.binvsa.util.Optional;
import org.binvsa.util.Pair;

import java.util.List;

/**
 * Value-set analysis of an SSA control flow graph. The stack pointer starts as offset 0
 * of its own region; memory starts as top except for the configured initial bytes.
 *
 * <p>An instance keeps its region table and statistic across runs.</p>
 */
public class ValueSetAnalysis {

	private static final Logger logger = Logger.getLogger(ValueSetAnalysis.class);

	private final VsaOptions options;
	private final RegionTable regionTable = new RegionTable();
	private final Statistic statistic = new Statistic();

	/**
	 * @throws InvalidConfigurationException if the options are not usable.
	 */
	public ValueSetAnalysis(VsaOptions options) throws InvalidConfigurationException {
		options.validate();
		this.options = options;
		logger.verbose("Created analysis with " + options);
	}

	public VsaOptions getOptions() {
		return options;
	}

	public RegionTable getRegionTable() {
		return regionTable;
	}

	public Statistic getStatistic() {
		return statistic;
	}

	/**
	 * Run the analysis to a fixpoint.
	 *
	 * @param cfg The graph, every block of which must be reachable from the entry.
	 * @return The abstract environment at every block, edge and program point.
	 * @throws InvalidConfigurationException if the graph has unreachable blocks.
	 */
	public DataflowResult<Optional<AbstractEnvironment>> run(ControlFlowGraph cfg) throws InvalidConfigurationException {
		List<BasicBlock> unreachable = cfg.getUnreachableBlocks();
		if (!unreachable.isEmpty()) {
			throw new InvalidConfigurationException("Control flow graph is not connected, unreachable blocks: " + unreachable);
		}
		logger.info("Starting value-set analysis of " + cfg.getBlocks().size() + " blocks");
		long startTime = System.currentTimeMillis();

		VsaTransferFunction transfer = new VsaTransferFunction(initialEnvironment(), options, statistic);
		WorklistSolver<Optional<AbstractEnvironment>> solver = new WorklistSolver<>(transfer, options.isWidening(),
				options.getWideningDelay(), options.getMaxIterations());
		DataflowResult<Optional<AbstractEnvironment>> result = solver.solve(cfg);

		statistic.recordFixpoint(result.getIterations(), result.getJoinCount(), result.getWideningCount());
		logger.info("Value-set analysis finished after " + result.getIterations() + " iterations in "
				+ (System.currentTimeMillis() - startTime) + "ms");
		statistic.printStatistic();
		return result;
	}

	/**
	 * The state at the entry of the graph.
	 */
	public AbstractEnvironment initialEnvironment() {
		Variable sp = options.getStackPointer();
		MemoryRegion stack = regionTable.getRegion(sp.getName());
		AbstractEnvironment env = AbstractEnvironment.EMPTY.bind(sp, ValueSet.of(stack, StridedInterval.zero(sp.getBitWidth())));

		List<Pair<Long, Byte>> bytes = options.getInitialMemory();
		if (!bytes.isEmpty()) {
			Variable mem = options.getMemory();
			int indexWidth = mem.getType().getIndexWidth();
			AbstractMemory memory = AbstractMemory.TOP;
			for (Pair<Long, Byte> b : bytes) {
				memory = memory.write(ValueSet.single(indexWidth, b.getLeft()), ValueSet.single(8, b.getRight()),
						options.getRegionLimit(), statistic);
			}
			env = env.bind(mem, memory);
			logger.verbose("Initialized " + memory.size() + " bytes of memory");
		}
		return env;
	}

	/**
	 * Evaluate an expression in an environment of this analysis.
	 */
	public AbstractValue evaluate(Expression e, AbstractEnvironment env) {
		return new AbstractEvaluator(env, options.getRegionLimit(), statistic).evalExpression(e);
	}
}
