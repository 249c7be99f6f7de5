package edu.upf.taln.arnoldi.tools;

import edu.upf.taln.arnoldi.core.Options;
import edu.upf.taln.arnoldi.core.sizing.AdaptiveSizeSelector;
import edu.upf.taln.arnoldi.core.sizing.AggregationAlgorithm;
import edu.upf.taln.arnoldi.core.sizing.ArnoldiWithStationary;
import edu.upf.taln.arnoldi.core.sizing.NaiveArnoldi;

/**
 * Aggregation algorithms selectable from the command line
 */
public final class Algorithms
{
	public enum Type
	{
		ADAPTIVE,   // smallest checkpoint meeting the tolerance
		NAIVE,      // fixed size, no stationary distribution
		STATIONARY  // fixed size with stationary distribution
	}

	private Algorithms() {}

	/**
	 * @param size aggregation size of fixed-size algorithms, ignored by {@link Type#ADAPTIVE}
	 */
	public static AggregationAlgorithm create(Type type, Options o, int size)
	{
		switch (type)
		{
			case NAIVE:
				return new NaiveArnoldi(size);
			case STATIONARY:
				return new ArnoldiWithStationary(size);
			case ADAPTIVE:
			default:
				return new AdaptiveSizeSelector(o);
		}
	}
}
