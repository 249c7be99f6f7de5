package edu.upf.taln.arnoldi.core.sizing;

import edu.upf.taln.arnoldi.core.ChainFixtures;
import edu.upf.taln.arnoldi.core.chain.DenseTransitionMatrix;
import org.junit.Assert;
import org.junit.Test;

public class FixedSizeAlgorithmsTest
{
	private final DenseTransitionMatrix chain = ChainFixtures.random(30, 8);
	private final double[] p0 = ChainFixtures.randomDistribution(30, 9);

	@Test
	public void naiveArnoldiHasNoStationaryDistribution()
	{
		final Aggregation aggregation = new NaiveArnoldi(5).aggregate(chain, p0);
		Assert.assertEquals(5, aggregation.size());
		Assert.assertEquals(30, aggregation.dimension());
		Assert.assertEquals(SizingOutcome.FIXED, aggregation.getOutcome());
		Assert.assertFalse(aggregation.isCertified());
		Assert.assertFalse(aggregation.getStationary().isPresent());
		Assert.assertTrue(Double.isNaN(aggregation.getCriterion()));
		Assert.assertTrue(aggregation.getTrace().isEmpty());
	}

	@Test
	public void arnoldiWithStationaryEstimatesStationaryDistribution()
	{
		final Aggregation aggregation = new ArnoldiWithStationary(2).aggregate(ChainFixtures.twoState(), new double[]{1.0, 0.0});
		Assert.assertEquals(SizingOutcome.FIXED, aggregation.getOutcome());
		Assert.assertArrayEquals(new double[]{5.0 / 6.0, 1.0 / 6.0}, aggregation.getStationary().orElseThrow(), 1e-12);
	}

	@Test
	public void breakdownStopsAtSaturatedSize()
	{
		final Aggregation aggregation = new NaiveArnoldi(4).aggregate(ChainFixtures.absorbing(), ChainFixtures.point(3, 0));
		Assert.assertEquals(1, aggregation.size());
	}

	@Test
	public void sameSizeGivesSameStepMatrix()
	{
		final Aggregation naive = new NaiveArnoldi(6).aggregate(chain, p0);
		final Aggregation stationary = new ArnoldiWithStationary(6).aggregate(chain, p0);
		Assert.assertArrayEquals(naive.getStepMatrix().getColumnPackedCopy(),
				stationary.getStepMatrix().getColumnPackedCopy(), 0.0);
	}

	@Test(expected = IllegalArgumentException.class)
	public void sizeMustBePositive()
	{
		new NaiveArnoldi(0);
	}
}
