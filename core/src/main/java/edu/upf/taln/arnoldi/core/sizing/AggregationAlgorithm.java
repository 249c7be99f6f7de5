package edu.upf.taln.arnoldi.core.sizing;

import edu.upf.taln.arnoldi.core.chain.TransitionMatrix;

/**
 * Computes an aggregation of a chain P for an initial distribution p0.
 */
@FunctionalInterface
public interface AggregationAlgorithm
{
	Aggregation aggregate(TransitionMatrix p, double[] p0);
}
