package org.binvsa.analysis.vsa.statistic;

import org.binvsa.util.Logger;

/**
 * Counters recorded during one value-set analysis run.
 */
public class Statistic {

	private static final Logger logger = Logger.getLogger(Statistic.class);

	private long blockVisitCount = 0L;
	private long joinCount = 0L;
	private long wideningCount = 0L;

	private long strongUpdateCount = 0L;
	private long weakUpdateCount = 0L;
	private long memoryCollapseCount = 0L;

	private long degradedExpressionCount = 0L;
	private long narrowedEdgeCount = 0L;

	/**
	 * Record the counters of a finished fixpoint iteration.
	 */
	public void recordFixpoint(long blockVisits, long joins, long widenings) {
		blockVisitCount += blockVisits;
		joinCount += joins;
		wideningCount += widenings;
	}

	/**
	 * Count the number of writes to a single memory location.
	 */
	public void countStrongUpdate() {
		strongUpdateCount++;
	}

	/**
	 * Count the number of writes to several memory locations.
	 */
	public void countWeakUpdate() {
		weakUpdateCount++;
	}

	/**
	 * Count the number of times a memory region or all of memory was set to top.
	 */
	public void countMemoryCollapse() {
		memoryCollapseCount++;
	}

	/**
	 * Count the number of expressions evaluated to top because of a missing or failing
	 * operation.
	 */
	public void countDegradedExpression() {
		degradedExpressionCount++;
	}

	/**
	 * Count the number of edge conditions used to narrow a value.
	 */
	public void countNarrowedEdge() {
		narrowedEdgeCount++;
	}

	public long getBlockVisitCount() {
		return blockVisitCount;
	}

	public long getJoinCount() {
		return joinCount;
	}

	public long getWideningCount() {
		return wideningCount;
	}

	public long getStrongUpdateCount() {
		return strongUpdateCount;
	}

	public long getWeakUpdateCount() {
		return weakUpdateCount;
	}

	public long getMemoryCollapseCount() {
		return memoryCollapseCount;
	}

	public long getDegradedExpressionCount() {
		return degradedExpressionCount;
	}

	public long getNarrowedEdgeCount() {
		return narrowedEdgeCount;
	}

	/**
	 * Output the recorded statistic.
	 */
	public void printStatistic() {
		if (!logger.isInfoEnabled()) {
			return;
		}
		logger.info("*** Fixpoint ***");
		logger.info("Block visits: " + blockVisitCount);
		logger.info("Joins: " + joinCount);
		logger.info("Widenings: " + wideningCount);
		logger.info("");

		logger.info("*** Memory ***");
		logger.info("Strong updates: " + strongUpdateCount);
		logger.info("Weak updates: " + weakUpdateCount);
		logger.info("Collapsed to top: " + memoryCollapseCount);
		logger.info("");

		logger.info("*** Evaluation ***");
		logger.info("Degraded to top: " + degradedExpressionCount);
		logger.info("Narrowing edges: " + narrowedEdgeCount);
		logger.info("");
	}
}
