package edu.upf.taln.arnoldi.tools;

import java.util.Arrays;
import java.util.Random;

/**
 * Initial distributions p0 for experiments on chains read from file
 */
public final class InitialDistributions
{
	public enum Type
	{
		UNIFORM, // 1/n everywhere
		RANDOM,  // uniform random entries, normalized to sum 1
		POINT    // all mass on a single state
	}

	private InitialDistributions() {}

	public static double[] create(Type type, int n, int state, long seed)
	{
		if (n < 1)
			throw new IllegalArgumentException("Cannot create a distribution over " + n + " states");
		final double[] p0 = new double[n];
		switch (type)
		{
			case POINT:
				if (state < 0 || state >= n)
					throw new IllegalArgumentException("Initial state " + state + " outside of a chain with " + n + " states");
				p0[state] = 1.0;
				break;
			case RANDOM:
			{
				final Random random = new Random(seed);
				double sum = 0.0;
				for (int i = 0; i < n; ++i)
				{
					p0[i] = random.nextDouble();
					sum += p0[i];
				}
				for (int i = 0; i < n; ++i)
					p0[i] /= sum;
				break;
			}
			case UNIFORM:
			default:
				Arrays.fill(p0, 1.0 / n);
		}
		return p0;
	}
}
