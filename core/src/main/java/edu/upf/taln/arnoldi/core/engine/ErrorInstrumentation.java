package edu.upf.taln.arnoldi.core.engine;

import Jama.Matrix;
import edu.upf.taln.arnoldi.core.chain.TransitionMatrix;
import edu.upf.taln.arnoldi.core.krylov.ArnoldiResiduals;
import edu.upf.taln.arnoldi.core.sizing.Aggregation;
import edu.upf.taln.arnoldi.core.sizing.AggregationAlgorithm;
import edu.upf.taln.arnoldi.core.utils.DebugUtils;
import edu.upf.taln.arnoldi.core.utils.LinearAlgebra;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.Optional;

/**
 * Runs an aggregation and the exact chain side by side to measure the approximation error.
 * Made to observe the behaviour of aggregations, not for speed: the exact transient distribution p_t costs
 * a full step of the chain per step.
 *
 * Static metrics, computed once:
 * <ul>
 *     <li>Diff = |AΠ − MA|, with M = Pᵀ</li>
 *     <li>err = ‖Diff‖₁, largest column sum</li>
 *     <li>err_st = ‖p̃_st − M p̃_st‖₁ where p̃_st = A·π_st</li>
 *     <li>err_π_st = Σ_i |π_st[i]| · colsum(Diff)_i</li>
 * </ul>
 * err_st and err_π_st are NaN when the aggregation has no stationary distribution.
 *
 * Dynamic metrics: err_k = ‖A·π_t − p_t‖₁, set by {@link #measureDynamicError()}, and the bound err_k_bnd,
 * accumulated by every {@link #stepAll()}. The bound holds only if all steps were taken through
 * {@link #stepAll()} or {@link #measureDynamicError()} in order, starting from the initial state.
 *
 * Not thread-safe.
 */
public class ErrorInstrumentation
{
	private final AggregationEngine engine;
	private final TransitionMatrix chain;
	private double[] exact;
	private double[] exact_scratch;
	private final double[] approximate; // A·π_t, scratch for err_k
	private final double[] approximate_stationary; // null if not available
	private final Matrix diff;
	private final double[] diff_column_sums;
	private final double err;
	private final double err_st;
	private final double err_pi_st;
	private double err_k = 0.0;
	private double err_k_bnd = 0.0;
	private long steps = 0;
	private final static Logger log = LogManager.getLogger();

	public ErrorInstrumentation(TransitionMatrix p, double[] p0, AggregationAlgorithm algorithm)
	{
		this(p, p0, algorithm.aggregate(p, p0));
	}

	public ErrorInstrumentation(TransitionMatrix p, double[] p0, Aggregation aggregation)
	{
		this(new AggregationEngine(p, aggregation), p0);
	}

	/**
	 * @param engine engine to instrument, reset to its initial state
	 * @param p0     initial distribution of the exact chain
	 */
	public ErrorInstrumentation(AggregationEngine engine, double[] p0)
	{
		this.engine = engine;
		this.chain = engine.getChain();
		chain.checkDimension(p0, "Initial distribution");
		engine.reset(); // π_0 must pair with p0
		final int n = chain.dimension();
		this.exact = p0.clone();
		this.exact_scratch = new double[n];
		this.approximate = new double[n];

		final Aggregation aggregation = engine.getAggregation();
		this.diff = ArnoldiResiduals.difference(chain, engine.basis(), aggregation.getStepMatrix());
		this.diff_column_sums = ArnoldiResiduals.columnSums(diff);
		this.err = diff.norm1();

		final Optional<double[]> stationary = aggregation.getStationary();
		if (stationary.isPresent())
		{
			approximate_stationary = new double[n];
			LinearAlgebra.disaggregate(engine.basis(), stationary.get(), approximate_stationary);
			final double[] image = new double[n];
			chain.step(approximate_stationary, image);
			err_st = LinearAlgebra.distance1(approximate_stationary, image);
			err_pi_st = ArnoldiResiduals.criterion(stationary.get(), diff_column_sums);
		}
		else
		{
			approximate_stationary = null;
			err_st = Double.NaN;
			err_pi_st = Double.NaN;
		}

		log.info("Static errors of aggregation of size " + engine.size() + ": err = " + DebugUtils.printError(err) +
				", err_st = " + DebugUtils.printError(err_st) + ", err_π_st = " + DebugUtils.printError(err_pi_st));
	}

	/**
	 * Advances only the aggregated distribution. Steps taken this way invalidate err_k and err_k_bnd.
	 */
	public void step()
	{
		engine.step();
	}

	/**
	 * Advances both the aggregated and the exact transient distribution and adds the contribution of the current
	 * aggregated state, Σ_i |π_t[i]| · colsum(Diff)_i, to err_k_bnd.
	 */
	public void stepAll()
	{
		err_k_bnd += ArnoldiResiduals.criterion(engine.state(), diff_column_sums);
		engine.step();
		chain.step(exact, exact_scratch);
		final double[] tmp = exact;
		exact = exact_scratch;
		exact_scratch = tmp;
		++steps;
	}

	/**
	 * Sets err_k to the L1 distance between A·π_t and p_t for the current, pre-step state, then calls
	 * {@link #stepAll()}. Use it exclusively, not mixed with {@link #stepAll()}, to get a per-step error trace.
	 *
	 * @return err_k
	 */
	public double measureDynamicError()
	{
		engine.disaggregate(approximate);
		err_k = LinearAlgebra.distance1(approximate, exact);
		stepAll();
		return err_k;
	}

	public AggregationEngine getEngine()
	{
		return engine;
	}

	/**
	 * @return copy of the exact transient distribution p_t
	 */
	public double[] getExact()
	{
		return exact.clone();
	}

	/**
	 * @return p̃_st = A·π_st, empty if the aggregation has no stationary distribution
	 */
	public Optional<double[]> getApproximateStationary()
	{
		return Optional.ofNullable(approximate_stationary).map(double[]::clone);
	}

	public Matrix getDiff()
	{
		return diff.copy();
	}

	public double getErr()
	{
		return err;
	}

	public double getErrSt()
	{
		return err_st;
	}

	public double getErrPiSt()
	{
		return err_pi_st;
	}

	public double getErrK()
	{
		return err_k;
	}

	public double getErrKBound()
	{
		return err_k_bnd;
	}

	public long steps()
	{
		return steps;
	}
}
