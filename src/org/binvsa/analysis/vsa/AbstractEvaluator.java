package org.binvsa.analysis.vsa;

import org.binvsa.analysis.vsa.statistic.Statistic;
import org.binvsa.ssa.BinOp;
import org.binvsa.ssa.Cast;
import org.binvsa.ssa.Concat;
import org.binvsa.ssa.Constant;
import org.binvsa.ssa.Expression;
import org.binvsa.ssa.ExpressionVisitor;
import org.binvsa.ssa.Extract;
import org.binvsa.ssa.Ite;
import org.binvsa.ssa.LabelRef;
import org.binvsa.ssa.Load;
import org.binvsa.ssa.Phi;
import org.binvsa.ssa.Store;
import org.binvsa.ssa.Type;
import org.binvsa.ssa.UnOp;
import org.binvsa.ssa.Unknown;
import org.binvsa.ssa.Variable;
import org.binvsa.util.Logger;
import org.binvsa.util.Optional;

/**
 * Evaluates SSA expressions to abstract values in an environment. Sub-expressions whose
 * operation is not supported by the domain evaluate to top.
 */
public final class AbstractEvaluator {

	private static final Logger logger = Logger.getLogger(AbstractEvaluator.class);

	private final AbstractEnvironment env;
	private final Optional<Integer> regionLimit;
	private final Statistic statistic;

	public AbstractEvaluator(AbstractEnvironment env, Optional<Integer> regionLimit, Statistic statistic) {
		assert env != null;
		assert regionLimit != null;
		assert statistic != null;
		this.env = env;
		this.regionLimit = regionLimit;
		this.statistic = statistic;
	}

	public ValueSet evalValueSet(Expression e) {
		return evalExpression(e).getValueSet();
	}

	public AbstractMemory evalMemory(Expression e) {
		return evalExpression(e).getMemory();
	}

	public AbstractValue evalExpression(Expression e) {
		logger.verbose("Evaluating " + e);
		AbstractValue result;
		try {
			result = e.accept(visitor);
		} catch (UnimplementedOperationException | BitWidthMismatchException ex) {
			logger.debug("Evaluating " + e + " to top", ex);
			statistic.countDegradedExpression();
			result = top(e.getType());
		}
		logger.verbose("evalExpression returned: " + result + " for " + e);
		return result;
	}

	private static AbstractValue top(Type type) {
		if (type.isMemory()) {
			return AbstractValue.array(AbstractMemory.TOP);
		}
		return AbstractValue.scalar(ValueSet.top(type.getBitWidth()));
	}

	private final ExpressionVisitor<AbstractValue> visitor = new ExpressionVisitor<AbstractValue>() {

		@Override
		public AbstractValue visit(Constant e) {
			return AbstractValue.scalar(ValueSet.single(e.getBitWidth(), e.longValue()));
		}

		@Override
		public AbstractValue visit(Variable e) {
			Optional<AbstractValue> v = env.lookup(e);
			return v.hasValue() ? v.getValue() : top(e.getType());
		}

		@Override
		public AbstractValue visit(Phi e) {
			AbstractValue result = null;
			for (Variable operand : e.getOperands()) {
				Optional<AbstractValue> v = env.lookup(operand);
				if (!v.hasValue()) {
					// not yet reached on this path
					continue;
				}
				result = result == null ? v.getValue() : result.union(v.getValue());
			}
			return result == null ? top(e.getType()) : result;
		}

		@Override
		public AbstractValue visit(BinOp e) {
			ValueSet left = evalValueSet(e.getLeft());
			ValueSet right = evalValueSet(e.getRight());
			return AbstractValue.scalar(left.binop(e.getOperator(), right));
		}

		@Override
		public AbstractValue visit(UnOp e) {
			return AbstractValue.scalar(evalValueSet(e.getOperand()).unop(e.getOperator()));
		}

		@Override
		public AbstractValue visit(Load e) {
			AbstractMemory memory = evalMemory(e.getMemory());
			ValueSet address = evalValueSet(e.getIndex());
			return AbstractValue.scalar(memory.read(e.getBitWidth(), address));
		}

		@Override
		public AbstractValue visit(Store e) {
			AbstractMemory memory = evalMemory(e.getMemory());
			ValueSet address = evalValueSet(e.getIndex());
			ValueSet value = evalValueSet(e.getValue());
			return AbstractValue.array(memory.write(address, value, regionLimit, statistic));
		}

		@Override
		public AbstractValue visit(Cast e) {
			ValueSet operand = evalValueSet(e.getOperand());
			return AbstractValue.scalar(operand.cast(e.getCastType(), e.getBitWidth()));
		}

		@Override
		public AbstractValue visit(Concat e) {
			ValueSet high = evalValueSet(e.getHigh());
			ValueSet low = evalValueSet(e.getLow());
			return AbstractValue.scalar(high.concat(low));
		}

		@Override
		public AbstractValue visit(Extract e) {
			return AbstractValue.scalar(evalValueSet(e.getOperand()).extract(e.getHigh(), e.getLow()));
		}

		@Override
		public AbstractValue visit(Ite e) {
			ValueSet cond = evalValueSet(e.getCondition());
			if (cond.isGlobal()) {
				StridedInterval c = cond.getGlobalInterval();
				if (c.equals(StridedInterval.YES)) {
					return evalExpression(e.getTrueExpression());
				}
				if (c.equals(StridedInterval.NO)) {
					return evalExpression(e.getFalseExpression());
				}
			}
			AbstractValue t = evalExpression(e.getTrueExpression());
			AbstractValue f = evalExpression(e.getFalseExpression());
			return t.union(f);
		}

		@Override
		public AbstractValue visit(Unknown e) {
			return top(e.getType());
		}

		@Override
		public AbstractValue visit(LabelRef e) {
			return top(e.getType());
		}
	};

	@Override
	public String toString() {
		return env.toString();
	}
}
