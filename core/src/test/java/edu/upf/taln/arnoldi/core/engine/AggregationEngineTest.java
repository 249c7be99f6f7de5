package edu.upf.taln.arnoldi.core.engine;

import Jama.Matrix;
import edu.upf.taln.arnoldi.core.ChainFixtures;
import edu.upf.taln.arnoldi.core.chain.DenseTransitionMatrix;
import edu.upf.taln.arnoldi.core.chain.DimensionException;
import edu.upf.taln.arnoldi.core.sizing.Aggregation;
import edu.upf.taln.arnoldi.core.sizing.NaiveArnoldi;
import org.junit.Assert;
import org.junit.Test;

public class AggregationEngineTest
{
	private static final int N = 30;
	private final DenseTransitionMatrix chain = ChainFixtures.random(N, 17);
	private final double[] p0 = ChainFixtures.randomDistribution(N, 18);

	@Test
	public void stepAppliesStepMatrix()
	{
		final AggregationEngine engine = new AggregationEngine(chain, p0, new NaiveArnoldi(5));
		final Aggregation aggregation = engine.getAggregation();
		final Matrix pi = aggregation.getStepMatrix();
		Matrix expected = new Matrix(aggregation.getInitial(), aggregation.size());

		Assert.assertArrayEquals(expected.getColumnPackedCopy(), engine.current(), 0.0);
		for (int t = 0; t < 25; ++t)
		{
			engine.step();
			expected = pi.times(expected);
			Assert.assertArrayEquals(expected.getColumnPackedCopy(), engine.current(), 1e-12);
		}
	}

	@Test
	public void fullSizeAggregationReproducesChain()
	{
		final DenseTransitionMatrix p = ChainFixtures.random(6, 3);
		final double[] start = ChainFixtures.randomDistribution(6, 4);
		final AggregationEngine engine = new AggregationEngine(p, start, new NaiveArnoldi(6));
		final double[] lifted = new double[6];
		for (int t = 1; t <= 20; ++t)
		{
			engine.step();
			engine.disaggregate(lifted);
			Assert.assertArrayEquals(ChainFixtures.evolve(p, start, t), lifted, 1e-10);
		}
	}

	@Test
	public void resetRestoresInitialDistribution()
	{
		final AggregationEngine engine = new AggregationEngine(chain, p0, new NaiveArnoldi(4));
		final double[] initial = engine.current();
		engine.step();
		engine.step();
		engine.step();
		engine.reset();
		Assert.assertArrayEquals(initial, engine.current(), 0.0);

		// same trajectory after reset
		engine.step();
		final double[] once = engine.current();
		engine.reset();
		engine.step();
		Assert.assertArrayEquals(once, engine.current(), 0.0);
	}

	@Test
	public void currentReturnsCopy()
	{
		final AggregationEngine engine = new AggregationEngine(chain, p0, new NaiveArnoldi(4));
		final double[] current = engine.current();
		current[0] = 42.0;
		Assert.assertNotEquals(42.0, engine.current()[0], 0.0);

		final double[] out = new double[4];
		engine.currentInto(out);
		Assert.assertArrayEquals(engine.current(), out, 0.0);
	}

	@Test
	public void initialStateLiftsToInitialDistribution()
	{
		final AggregationEngine engine = new AggregationEngine(chain, p0, new NaiveArnoldi(3));
		final double[] lifted = new double[N];
		engine.disaggregate(lifted);
		Assert.assertArrayEquals(p0, lifted, 1e-15);
	}

	@Test(expected = DimensionException.class)
	public void aggregationMustMatchChain()
	{
		final Aggregation aggregation = new NaiveArnoldi(2).aggregate(chain, p0);
		new AggregationEngine(ChainFixtures.random(N + 1, 1), aggregation);
	}
}
