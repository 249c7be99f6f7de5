package edu.upf.taln.arnoldi.core.sizing;

import com.google.common.base.Stopwatch;
import edu.upf.taln.arnoldi.core.Options;
import edu.upf.taln.arnoldi.core.chain.TransitionMatrix;
import edu.upf.taln.arnoldi.core.krylov.ArnoldiResiduals;
import edu.upf.taln.arnoldi.core.krylov.BreakdownException;
import edu.upf.taln.arnoldi.core.krylov.KrylovBasisBuilder;
import edu.upf.taln.arnoldi.core.krylov.KrylovFactorization;
import edu.upf.taln.arnoldi.core.stationary.NotConvergedException;
import edu.upf.taln.arnoldi.core.stationary.StationaryEstimator;
import edu.upf.taln.arnoldi.core.utils.DebugUtils;
import edu.upf.taln.arnoldi.core.utils.LinearAlgebra;
import org.apache.commons.lang3.tuple.Pair;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Finds the smallest Arnoldi aggregation, among an ascending schedule of checkpoint sizes, whose stationary-weighted
 * residual Σ_i |π_st[i]| · Σ_j |(AΠ − MA)[j][i]| is at most a tolerance ε.
 *
 * A single factorization is grown across all checkpoints; its arena is allocated once at the size cap, so reaching
 * a larger checkpoint never rebuilds or reallocates the basis. At each checkpoint the stationary distribution is
 * estimated and the criterion evaluated. Checkpoints with a complex dominant eigenpair are skipped.
 *
 * If the Krylov subspace saturates, the size reached is final. If no checkpoint meets ε, the aggregation at the
 * largest size reached is returned as {@link SizingOutcome#UNCERTIFIED} rather than failing.
 *
 * Bisection between the last two checkpoints to shrink the accepted size is not performed.
 */
public class AdaptiveSizeSelector implements AggregationAlgorithm
{
	private final double tolerance;
	private final int[] checkpoints;
	private final int max_size;
	private final KrylovBasisBuilder builder = new KrylovBasisBuilder();
	private final StationaryEstimator estimator = new StationaryEstimator();
	private final static Logger log = LogManager.getLogger();

	public AdaptiveSizeSelector(Options o)
	{
		this(o.tolerance, o.checkpoints, o.max_size);
	}

	public AdaptiveSizeSelector(double tolerance, int[] checkpoints)
	{
		this(tolerance, checkpoints, KrylovBasisBuilder.DEFAULT_CAPACITY);
	}

	/**
	 * @param tolerance   ε > 0, may be infinite
	 * @param checkpoints strictly ascending positive sizes at which the criterion is evaluated
	 * @param max_size    cap on the aggregation size, must exceed the largest checkpoint
	 */
	public AdaptiveSizeSelector(double tolerance, int[] checkpoints, int max_size)
	{
		if (!(tolerance > 0.0))
			throw new IllegalArgumentException("Tolerance must be greater than 0: " + tolerance);
		if (checkpoints == null || checkpoints.length == 0)
			throw new IllegalArgumentException("At least one checkpoint is required");
		if (checkpoints[0] < 1)
			throw new IllegalArgumentException("Checkpoints must be greater than 0: " + checkpoints[0]);
		for (int i = 1; i < checkpoints.length; ++i)
			if (checkpoints[i] <= checkpoints[i - 1])
				throw new IllegalArgumentException("Checkpoints must be strictly ascending: " + Arrays.toString(checkpoints));
		if (max_size <= checkpoints[checkpoints.length - 1])
			throw new IllegalArgumentException("Maximum size " + max_size + " must exceed the largest checkpoint " +
					checkpoints[checkpoints.length - 1]);

		this.tolerance = tolerance;
		this.checkpoints = checkpoints.clone();
		this.max_size = max_size;
	}

	@Override
	public Aggregation aggregate(TransitionMatrix p, double[] p0)
	{
		log.info("*Sizing aggregation of " + DebugUtils.printInteger(p.dimension()) + " states, ε = " + tolerance + "*");
		Stopwatch timer = Stopwatch.createStarted();

		final KrylovFactorization f = builder.initialize(p, p0, max_size);
		final List<Pair<Integer, Double>> trace = new ArrayList<>();
		double[] stationary = null;
		double criterion = Double.NaN;
		boolean certified = false;

		for (int checkpoint : checkpoints)
		{
			boolean saturated = false;
			try
			{
				while (f.size() < checkpoint)
					builder.expand(f);
			}
			catch (BreakdownException e)
			{
				log.info(e.getMessage() + ", size " + e.getSize() + " is final");
				saturated = true;
			}

			final int k = f.size();
			if (!trace.isEmpty() && trace.get(trace.size() - 1).getLeft() == k)
				break; // saturated right after the previous checkpoint, already evaluated

			try
			{
				stationary = estimator.estimate(f, k);
				criterion = ArnoldiResiduals.criterion(stationary, ArnoldiResiduals.columnSums(f, k));
				trace.add(Pair.of(k, criterion));
				log.debug("Checkpoint k = " + k + ": criterion = " + DebugUtils.printError(criterion));
				if (criterion <= tolerance)
				{
					certified = true;
					break;
				}
			}
			catch (NotConvergedException e)
			{
				stationary = null;
				criterion = Double.NaN;
				trace.add(Pair.of(k, Double.NaN));
				log.debug("Checkpoint k = " + k + ": " + e.getMessage());
			}

			if (saturated)
				break;
		}

		final SizingOutcome outcome = certified ? SizingOutcome.CERTIFIED : SizingOutcome.UNCERTIFIED;
		if (!certified)
			log.warn("No checkpoint met tolerance " + tolerance + ", using uncertified aggregation of size " + f.size());
		log.debug("Sizing trace:\n" + DebugUtils.printTrace(trace));
		log.info("Aggregation of size " + f.size() + " (" + outcome + ") found in " + timer.stop());

		return Aggregation.freeze(f, LinearAlgebra.norm2(p0), stationary, outcome, criterion, trace);
	}

	public double getTolerance()
	{
		return tolerance;
	}

	public int[] getCheckpoints()
	{
		return checkpoints.clone();
	}

	public int getMaxSize()
	{
		return max_size;
	}
}
