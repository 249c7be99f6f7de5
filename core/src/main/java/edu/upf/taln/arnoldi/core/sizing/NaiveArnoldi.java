package edu.upf.taln.arnoldi.core.sizing;

import edu.upf.taln.arnoldi.core.chain.TransitionMatrix;
import edu.upf.taln.arnoldi.core.krylov.BreakdownException;
import edu.upf.taln.arnoldi.core.krylov.KrylovBasisBuilder;
import edu.upf.taln.arnoldi.core.krylov.KrylovFactorization;
import edu.upf.taln.arnoldi.core.utils.LinearAlgebra;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.util.List;

/**
 * Arnoldi aggregation of a fixed size k, without stationary distribution.
 * Stops early, at the saturated size, if the Krylov subspace breaks down before reaching k.
 */
public class NaiveArnoldi implements AggregationAlgorithm
{
	protected final int size;
	protected final KrylovBasisBuilder builder = new KrylovBasisBuilder();
	private final static Logger log = LogManager.getLogger();

	public NaiveArnoldi(int size)
	{
		if (size < 1)
			throw new IllegalArgumentException("Aggregation size must be greater than 0: " + size);
		this.size = size;
	}

	@Override
	public Aggregation aggregate(TransitionMatrix p, double[] p0)
	{
		final KrylovFactorization f = factorize(p, p0);
		return Aggregation.freeze(f, LinearAlgebra.norm2(p0), null, SizingOutcome.FIXED, Double.NaN, List.of());
	}

	protected KrylovFactorization factorize(TransitionMatrix p, double[] p0)
	{
		final KrylovFactorization f = builder.initialize(p, p0, size);
		try
		{
			while (f.size() < size)
				builder.expand(f);
		}
		catch (BreakdownException e)
		{
			log.warn(e.getMessage() + ", aggregation of size " + f.size() + " instead of " + size);
		}
		return f;
	}
}
