package edu.upf.taln.arnoldi.core.engine;

import Jama.Matrix;
import edu.upf.taln.arnoldi.core.chain.DimensionException;
import edu.upf.taln.arnoldi.core.chain.TransitionMatrix;
import edu.upf.taln.arnoldi.core.sizing.Aggregation;
import edu.upf.taln.arnoldi.core.sizing.AggregationAlgorithm;
import edu.upf.taln.arnoldi.core.utils.LinearAlgebra;

/**
 * Evolves an aggregated transient distribution π_t under a frozen aggregation, π_{t+1} = Π·π_t.
 *
 * Two buffers of length k alternate as current state and scratch space, so {@link #step()} costs O(k²) and allocates
 * nothing. Transient distributions are overwritten in place: no history is kept.
 *
 * Not thread-safe, an instance is for exclusive use by one caller.
 */
public class AggregationEngine
{
	private final TransitionMatrix chain;
	private final Aggregation aggregation;
	private final double[][] step_matrix;
	private final Matrix basis;
	private final double[] initial;
	private final double[] first;
	private final double[] second;
	private boolean flipped = false; // true when second holds the current state

	public AggregationEngine(TransitionMatrix p, double[] p0, AggregationAlgorithm algorithm)
	{
		this(p, algorithm.aggregate(p, p0));
	}

	public AggregationEngine(TransitionMatrix p, Aggregation aggregation)
	{
		if (aggregation.dimension() != p.dimension())
			throw new DimensionException("Aggregation of " + aggregation.dimension() + " states cannot drive a chain of " +
					p.dimension() + " states");
		this.chain = p;
		this.aggregation = aggregation;
		this.step_matrix = aggregation.getStepMatrix().getArray();
		this.basis = aggregation.getBasis();
		this.initial = aggregation.getInitial();
		this.first = initial.clone();
		this.second = new double[initial.length];
	}

	/**
	 * Moves to the next aggregated transient distribution.
	 */
	public void step()
	{
		if (flipped)
			LinearAlgebra.multiply(step_matrix, second, first, first.length);
		else
			LinearAlgebra.multiply(step_matrix, first, second, first.length);
		flipped = !flipped;
	}

	/**
	 * Restores π_0
	 */
	public void reset()
	{
		System.arraycopy(initial, 0, first, 0, initial.length);
		flipped = false;
	}

	/**
	 * @return copy of π_t
	 */
	public double[] current()
	{
		return state().clone();
	}

	public void currentInto(double[] out)
	{
		System.arraycopy(state(), 0, out, 0, first.length);
	}

	/**
	 * Writes the disaggregated transient distribution A·π_t, of length n, into out.
	 */
	public void disaggregate(double[] out)
	{
		LinearAlgebra.disaggregate(basis, state(), out);
	}

	// live buffer holding π_t, must not be modified
	double[] state()
	{
		return flipped ? second : first;
	}

	Matrix basis()
	{
		return basis;
	}

	public int size()
	{
		return first.length;
	}

	public TransitionMatrix getChain()
	{
		return chain;
	}

	public Aggregation getAggregation()
	{
		return aggregation;
	}
}
