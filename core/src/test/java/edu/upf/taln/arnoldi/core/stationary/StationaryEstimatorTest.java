package edu.upf.taln.arnoldi.core.stationary;

import Jama.Matrix;
import edu.upf.taln.arnoldi.core.ChainFixtures;
import edu.upf.taln.arnoldi.core.chain.DenseTransitionMatrix;
import edu.upf.taln.arnoldi.core.chain.DimensionException;
import edu.upf.taln.arnoldi.core.krylov.BreakdownException;
import edu.upf.taln.arnoldi.core.krylov.KrylovBasisBuilder;
import edu.upf.taln.arnoldi.core.krylov.KrylovFactorization;
import edu.upf.taln.arnoldi.core.utils.LinearAlgebra;
import org.junit.Assert;
import org.junit.Test;

public class StationaryEstimatorTest
{
	private final KrylovBasisBuilder builder = new KrylovBasisBuilder();
	private final StationaryEstimator estimator = new StationaryEstimator();

	@Test
	public void twoStateChain() throws Exception
	{
		final KrylovFactorization f = builder.initialize(ChainFixtures.twoState(), new double[]{1.0, 0.0});
		builder.expand(f);

		final double[] pi = estimator.estimate(f);
		final double[] lifted = new double[2];
		f.lift(pi, lifted);
		Assert.assertArrayEquals(new double[]{5.0 / 6.0, 1.0 / 6.0}, lifted, 1e-12);

		final double[] same = estimator.estimate(f.rayleighQuotient(), f.basis());
		Assert.assertArrayEquals(pi, same, 1e-15);
	}

	@Test
	public void sizeOneAggregationIsItsOwnStationaryDistribution() throws NotConvergedException
	{
		final KrylovFactorization f = builder.initialize(ChainFixtures.twoState(), new double[]{1.0, 0.0});
		Assert.assertArrayEquals(new double[]{1.0}, estimator.estimate(f), 1e-15);
	}

	@Test
	public void complexEigenpairIsNotConverged()
	{
		final Matrix rotation = new Matrix(new double[][]{{0.0, -1.0}, {1.0, 0.0}});
		final Matrix basis = Matrix.identity(2, 2);
		final Matrix rotation_before = rotation.copy();
		final Matrix basis_before = basis.copy();
		try
		{
			estimator.estimate(rotation, basis);
			Assert.fail("Eigenvalues ±i must not be cast to real");
		}
		catch (NotConvergedException e)
		{
			Assert.assertEquals(2, e.getSize());
			Assert.assertEquals(1.0, Math.abs(e.getImaginary()), 1e-12);
		}
		Assert.assertArrayEquals(rotation_before.getColumnPackedCopy(), rotation.getColumnPackedCopy(), 0.0);
		Assert.assertArrayEquals(basis_before.getColumnPackedCopy(), basis.getColumnPackedCopy(), 0.0);
	}

	@Test
	public void realEigenvalueOnUnitCircleWinsTies() throws NotConvergedException
	{
		// 3-cycle: eigenvalues 1, e^{±2πi/3}
		final Matrix cycle = new Matrix(new double[][]{{0, 0, 1}, {1, 0, 0}, {0, 1, 0}});
		final double[] pi = estimator.estimate(cycle, Matrix.identity(3, 3));
		Assert.assertArrayEquals(new double[]{1.0 / 3, 1.0 / 3, 1.0 / 3}, pi, 1e-12);
	}

	@Test
	public void fullKrylovSpaceRecoversStationaryDistribution() throws NotConvergedException
	{
		final int n = 12;
		final DenseTransitionMatrix p = ChainFixtures.random(n, 21);
		final KrylovFactorization f = builder.initialize(p, ChainFixtures.randomDistribution(n, 22));
		try
		{
			while (true)
				builder.expand(f);
		}
		catch (BreakdownException e)
		{
			// whole reachable subspace built
		}

		final double[] pi = estimator.estimate(f);
		final double[] lifted = new double[n];
		f.lift(pi, lifted);
		Assert.assertEquals(1.0, LinearAlgebra.norm1(lifted), 1e-12);
		Assert.assertEquals(1.0, LinearAlgebra.sum(lifted), 1e-9);

		// stationary distribution is a fixed point of the chain
		final double[] image = new double[n];
		p.step(lifted, image);
		Assert.assertArrayEquals(lifted, image, 1e-9);

		final double[] reference = ChainFixtures.evolve(p, ChainFixtures.point(n, 0), 2000);
		Assert.assertArrayEquals(reference, lifted, 1e-8);
	}

	@Test(expected = DimensionException.class)
	public void basisMustMatchStepMatrix() throws NotConvergedException
	{
		estimator.estimate(Matrix.identity(2, 2), Matrix.identity(3, 3));
	}
}
