package edu.upf.taln.arnoldi.core.sizing;

import edu.upf.taln.arnoldi.core.chain.TransitionMatrix;
import edu.upf.taln.arnoldi.core.krylov.KrylovFactorization;
import edu.upf.taln.arnoldi.core.stationary.NotConvergedException;
import edu.upf.taln.arnoldi.core.stationary.StationaryEstimator;
import edu.upf.taln.arnoldi.core.utils.LinearAlgebra;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Arnoldi aggregation of a fixed size k, followed by estimation of its stationary distribution.
 */
public class ArnoldiWithStationary extends NaiveArnoldi
{
	private final StationaryEstimator estimator = new StationaryEstimator();
	private final static Logger log = LogManager.getLogger();

	public ArnoldiWithStationary(int size)
	{
		super(size);
	}

	@Override
	public Aggregation aggregate(TransitionMatrix p, double[] p0)
	{
		final KrylovFactorization f = factorize(p, p0);
		double[] stationary = null;
		try
		{
			stationary = estimator.estimate(f);
		}
		catch (NotConvergedException e)
		{
			log.warn("Bad convergence of eigenpair at aggregation size " + f.size() + ": " + e.getMessage());
		}
		return Aggregation.freeze(f, LinearAlgebra.norm2(p0), stationary, SizingOutcome.FIXED, Double.NaN, List.of());
	}
}
