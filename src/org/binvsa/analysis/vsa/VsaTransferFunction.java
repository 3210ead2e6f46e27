package org.binvsa.analysis.vsa;

import org.binvsa.analysis.dataflow.DataflowProblem;
import org.binvsa.analysis.vsa.statistic.Statistic;
import org.binvsa.cfa.CFAEdge;
import org.binvsa.cfa.ControlFlowGraph;
import org.binvsa.cfa.EdgeCondition;
import org.binvsa.ssa.BinOp;
import org.binvsa.ssa.BinaryOperator;
import org.binvsa.ssa.Constant;
import org.binvsa.ssa.Expression;
import org.binvsa.ssa.Load;
import org.binvsa.ssa.Variable;
import org.binvsa.ssa.statements.DefaultStatementVisitor;
import org.binvsa.ssa.statements.Move;
import org.binvsa.ssa.statements.Special;
import org.binvsa.ssa.statements.Statement;
import org.binvsa.util.Logger;
import org.binvsa.util.Optional;

/**
 * Statement and edge transfer functions of the value-set analysis. The lattice is
 * {@code Optional<AbstractEnvironment>}, where no environment means unreached.
 *
 * <p>Edges labeled with a comparison against a constant narrow the compared variable or
 * memory location. An edge whose narrowed value becomes empty cannot be taken and yields
 * the unreached state.</p>
 */
public class VsaTransferFunction implements DataflowProblem<Optional<AbstractEnvironment>> {

	private static final Logger logger = Logger.getLogger(VsaTransferFunction.class);

	private final AbstractEnvironment initialEnvironment;
	private final VsaOptions options;
	private final Statistic statistic;

	public VsaTransferFunction(AbstractEnvironment initialEnvironment, VsaOptions options, Statistic statistic) {
		assert initialEnvironment != null && options != null && statistic != null;
		this.initialEnvironment = initialEnvironment;
		this.options = options;
		this.statistic = statistic;
	}

	@Override
	public Optional<AbstractEnvironment> initialState(ControlFlowGraph cfg) {
		return new Optional<>(initialEnvironment);
	}

	@Override
	public Optional<AbstractEnvironment> unreached() {
		return Optional.none();
	}

	@Override
	public boolean isUnreached(Optional<AbstractEnvironment> state) {
		return !state.hasValue();
	}

	@Override
	public Optional<AbstractEnvironment> join(Optional<AbstractEnvironment> a, Optional<AbstractEnvironment> b) {
		if (!a.hasValue()) {
			return b;
		}
		if (!b.hasValue()) {
			return a;
		}
		return new Optional<>(a.getValue().join(b.getValue()));
	}

	@Override
	public Optional<AbstractEnvironment> widen(Optional<AbstractEnvironment> older, Optional<AbstractEnvironment> newer) {
		if (!older.hasValue()) {
			return newer;
		}
		if (!newer.hasValue()) {
			return older;
		}
		return new Optional<>(older.getValue().widen(newer.getValue()));
	}

	public AbstractEvaluator evaluator(AbstractEnvironment env) {
		return new AbstractEvaluator(env, options.getRegionLimit(), statistic);
	}

	@Override
	public Optional<AbstractEnvironment> transferStatement(final Statement statement, Optional<AbstractEnvironment> state) {
		if (!state.hasValue()) {
			return state;
		}
		final AbstractEnvironment env = state.getValue();
		AbstractEnvironment result = statement.accept(new DefaultStatementVisitor<AbstractEnvironment>() {

			@Override
			public AbstractEnvironment visit(Move stmt) {
				Variable v = stmt.getVariable();
				AbstractValue value = evaluator(env).evalExpression(stmt.getExpression());
				if (value.isScalar() != v.getType().isRegister()
						|| (value.isScalar() && value.getValueSet().getBitWidth() != v.getBitWidth())) {
					logger.warn("Ignoring assignment of " + value + " to " + v + " of type " + v.getType());
					return env;
				}
				logger.verbose("Set " + v + " = " + value);
				return env.bind(v, value);
			}

			@Override
			public AbstractEnvironment visit(Special stmt) {
				logger.verbose("Found special " + stmt.getName() + ", setting its outputs to top");
				AbstractEnvironment result = env;
				for (Variable v : stmt.getDefinedVariables()) {
					if (v.getType().isRegister()) {
						result = result.bind(v, ValueSet.top(v.getBitWidth()));
					}
				}
				return result;
			}

			@Override
			protected AbstractEnvironment visitDefault(Statement stmt) {
				return env;
			}
		});
		return new Optional<>(result);
	}

	@Override
	public Optional<AbstractEnvironment> transferEdge(CFAEdge edge, Optional<AbstractEnvironment> state) {
		if (!state.hasValue() || !edge.getCondition().hasValue()) {
			return state;
		}
		EdgeCondition condition = edge.getCondition().getValue();
		Optional<AbstractEnvironment> result = assume(condition.getCondition(), state.getValue());
		if (!result.hasValue()) {
			logger.debug("Edge " + edge + " cannot be taken");
		}
		return result;
	}

	/**
	 * Narrow an environment by a condition known to hold.
	 *
	 * @return The narrowed environment, or nothing if the condition cannot hold.
	 */
	Optional<AbstractEnvironment> assume(Expression e, AbstractEnvironment env) {
		if (!(e instanceof BinOp)) {
			logger.debug("No narrowing for condition " + e);
			return new Optional<>(env);
		}
		BinOp b = (BinOp) e;
		if (b.getOperator() == BinaryOperator.EQ && b.getLeft() instanceof BinOp && b.getRight() instanceof Constant) {
			BinOp cmp = (BinOp) b.getLeft();
			boolean holds = ((Constant) b.getRight()).longValue() != 0L;
			switch (cmp.getOperator()) {
			case SLT:
			case SLE:
				return assumeInequality(cmp, holds, env);
			case LT:
			case LE:
				if (options.isUnsignedComparisons()) {
					return assumeInequality(cmp, holds, env);
				}
				break;
			case EQ:
			case NEQ:
				return assumeEquality(cmp, holds, env);
			default:
				break;
			}
		} else if ((b.getOperator() == BinaryOperator.SLT || b.getOperator() == BinaryOperator.SLE)
				&& isRegister(b.getLeft()) && isRegister(b.getRight())) {
			return assumeOrdered((Variable) b.getLeft(), (Variable) b.getRight(), env);
		}
		logger.debug("No narrowing for condition " + e);
		return new Optional<>(env);
	}

	private static boolean isRegister(Expression e) {
		return e instanceof Variable && e.getType().isRegister();
	}

	private static boolean isNarrowable(Expression e) {
		return isRegister(e) || (e instanceof Load && ((Load) e).getMemory() instanceof Variable);
	}

	private Optional<AbstractEnvironment> assumeInequality(BinOp cmp, boolean holds, AbstractEnvironment env) {
		Expression subject;
		Constant c;
		boolean below;
		if (cmp.getRight() instanceof Constant && isNarrowable(cmp.getLeft())) {
			subject = cmp.getLeft();
			c = (Constant) cmp.getRight();
			below = true;
		} else if (cmp.getLeft() instanceof Constant && isNarrowable(cmp.getRight())) {
			subject = cmp.getRight();
			c = (Constant) cmp.getLeft();
			below = false;
		} else {
			logger.debug("No narrowing for comparison " + cmp);
			return new Optional<>(env);
		}
		BinaryOperator op = cmp.getOperator();
		if (!holds) {
			// !(v < c) is c <= v, !(c <= v) is v < c
			op = flipStrictness(op);
			below = !below;
		}
		if (subject.getBitWidth() != c.getBitWidth()) {
			logger.debug("Width mismatch in comparison " + cmp);
			return new Optional<>(env);
		}
		StridedInterval bound = bound(op, below, c);
		if (bound == null) {
			return new Optional<>(env);
		}
		return narrow(subject, ValueSet.ofInterval(bound), env);
	}

	private static BinaryOperator flipStrictness(BinaryOperator op) {
		switch (op) {
		case SLT:
			return BinaryOperator.SLE;
		case SLE:
			return BinaryOperator.SLT;
		case LT:
			return BinaryOperator.LE;
		case LE:
			return BinaryOperator.LT;
		default:
			throw new IllegalArgumentException("Not an inequality: " + op);
		}
	}

	/**
	 * @return The values v with {@code v op c} if below, or {@code c op v} otherwise.
	 * Null if the bound cannot be expressed.
	 */
	private static StridedInterval bound(BinaryOperator op, boolean below, Constant c) {
		int k = c.getBitWidth();
		long x = c.longValue();
		switch (op) {
		case SLT:
			return below ? StridedInterval.below(k, x) : StridedInterval.above(k, x);
		case SLE:
			return below ? StridedInterval.belowEq(k, x) : StridedInterval.aboveEq(k, x);
		case LT:
		case LE:
			if (x < 0L) {
				logger.debug("Not converting unsigned comparison with " + c);
				return null;
			}
			if (op == BinaryOperator.LT) {
				return below ? StridedInterval.belowUnsigned(k, x) : StridedInterval.aboveUnsigned(k, x);
			}
			return below ? StridedInterval.belowEqUnsigned(k, x) : StridedInterval.aboveEqUnsigned(k, x);
		default:
			throw new IllegalArgumentException("Not an inequality: " + op);
		}
	}

	private Optional<AbstractEnvironment> assumeEquality(BinOp cmp, boolean holds, AbstractEnvironment env) {
		Variable v;
		Constant c;
		if (cmp.getRight() instanceof Constant && isRegister(cmp.getLeft())) {
			v = (Variable) cmp.getLeft();
			c = (Constant) cmp.getRight();
		} else if (cmp.getLeft() instanceof Constant && isRegister(cmp.getRight())) {
			v = (Variable) cmp.getRight();
			c = (Constant) cmp.getLeft();
		} else {
			logger.debug("No narrowing for comparison " + cmp);
			return new Optional<>(env);
		}
		boolean equal = (cmp.getOperator() == BinaryOperator.EQ) == holds;
		if (!equal || v.getBitWidth() != c.getBitWidth()) {
			// inequality to a constant is not expressible
			return new Optional<>(env);
		}
		return narrow(v, ValueSet.single(c.getBitWidth(), c.longValue()), env);
	}

	/**
	 * Narrow both sides of {@code v2 < v1} or {@code v2 <= v1}: v1 is at least the lower
	 * bound of v2, and v2 at most the upper bound of v1.
	 */
	private Optional<AbstractEnvironment> assumeOrdered(Variable v2, Variable v1, AbstractEnvironment env) {
		if (v1.getBitWidth() != v2.getBitWidth()) {
			return new Optional<>(env);
		}
		ValueSet vs1 = env.lookupScalar(v1);
		ValueSet vs2 = env.lookupScalar(v2);
		ValueSet narrowed1 = vs1.intersection(vs2.removeUpperBound());
		ValueSet narrowed2 = vs2.intersection(vs1.removeLowerBound());
		statistic.countNarrowedEdge();
		if (narrowed1.isEmpty() || narrowed2.isEmpty()) {
			return Optional.none();
		}
		return new Optional<>(env.bind(v1, narrowed1).bind(v2, narrowed2));
	}

	private Optional<AbstractEnvironment> narrow(Expression subject, ValueSet constraint, AbstractEnvironment env) {
		AbstractEvaluator eval = evaluator(env);
		ValueSet old = eval.evalValueSet(subject);
		ValueSet narrowed = old.intersection(constraint);
		if (logger.isDebugEnabled()) {
			logger.debug("Narrowing " + subject + " from " + old + " with " + constraint + " to " + narrowed);
		}
		statistic.countNarrowedEdge();
		if (narrowed.isEmpty()) {
			return Optional.none();
		}
		if (subject instanceof Variable) {
			return new Optional<>(env.bind((Variable) subject, narrowed));
		}
		Load load = (Load) subject;
		Variable memory = (Variable) load.getMemory();
		ValueSet address = eval.evalValueSet(load.getIndex());
		AbstractMemory updated = env.lookupMemory(memory).writeIntersection(address, narrowed);
		return new Optional<>(env.bind(memory, updated));
	}
}
