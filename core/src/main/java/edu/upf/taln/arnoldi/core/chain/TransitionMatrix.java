package edu.upf.taln.arnoldi.core.chain;

/**
 * Transition matrix P of a discrete-time Markov chain.
 *
 * P is row-stochastic: entry (i, j) is the probability of moving from state i to state j, and every row sums to 1.
 * Distributions are column vectors evolving as p(t+1) = Pᵀ p(t), so the operator all Krylov quantities are built on
 * is Pᵀ and {@link #step(double[], double[])} is the only way the aggregation code touches the chain.
 *
 * Implementations are immutable.
 */
public interface TransitionMatrix
{
	/**
	 * @return number of states n
	 */
	int dimension();

	/**
	 * Advances a distribution by one step: out = Pᵀ·in.
	 * in and out must be distinct arrays of length n; out is overwritten.
	 */
	void step(double[] in, double[] out);

	/**
	 * @return probability of moving from state from to state to
	 */
	double get(int from, int to);

	/**
	 * @return sum of the outgoing probabilities of a state
	 */
	double rowSum(int state);

	/**
	 * Checks that the matrix is square-compatible with a vector
	 */
	default void checkDimension(double[] v, String name)
	{
		if (v == null || v.length != dimension())
			throw new DimensionException(name + " has length " + (v == null ? "null" : String.valueOf(v.length)) +
					", expected " + dimension());
	}
}
