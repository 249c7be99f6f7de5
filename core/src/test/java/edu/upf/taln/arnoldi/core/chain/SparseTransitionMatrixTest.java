package edu.upf.taln.arnoldi.core.chain;

import edu.upf.taln.arnoldi.core.ChainFixtures;
import org.junit.Assert;
import org.junit.Test;

public class SparseTransitionMatrixTest
{
	@Test
	public void stepMovesMassAlongRows()
	{
		final SparseTransitionMatrix p = SparseTransitionMatrix.builder(2)
				.add(0, 0, 0.9).add(0, 1, 0.1)
				.add(1, 0, 0.5).add(1, 1, 0.5)
				.build();
		final double[] out = new double[2];
		p.step(new double[]{1.0, 0.0}, out);
		Assert.assertArrayEquals(new double[]{0.9, 0.1}, out, 1e-15);
		p.step(new double[]{0.0, 1.0}, out);
		Assert.assertArrayEquals(new double[]{0.5, 0.5}, out, 1e-15);
	}

	@Test
	public void agreesWithDenseMatrix()
	{
		final int n = 20;
		final DenseTransitionMatrix dense = ChainFixtures.random(n, 12);
		final SparseTransitionMatrix.Builder builder = SparseTransitionMatrix.builder(n);
		for (int i = n - 1; i >= 0; --i)
			for (int j = 0; j < n; ++j)
				builder.add(i, j, dense.get(i, j));
		final SparseTransitionMatrix sparse = builder.build();

		final double[] in = ChainFixtures.randomDistribution(n, 13);
		final double[] dense_out = new double[n];
		final double[] sparse_out = new double[n];
		dense.step(in, dense_out);
		sparse.step(in, sparse_out);
		Assert.assertArrayEquals(dense_out, sparse_out, 1e-15);
		for (int i = 0; i < n; ++i)
		{
			Assert.assertEquals(dense.rowSum(i), sparse.rowSum(i), 1e-15);
			Assert.assertArrayEquals(dense.toMatrix().getArray()[i], sparse.toArray()[i], 0.0);
		}
	}

	@Test
	public void repeatedTransitionsAreSummedAndZerosDropped()
	{
		final SparseTransitionMatrix p = SparseTransitionMatrix.builder(3)
				.add(1, 2, 0.25).add(0, 0, 1.0).add(1, 2, 0.25).add(1, 0, 0.5).add(2, 1, 0.0).add(2, 2, 1.0)
				.build();
		Assert.assertEquals(4, p.numTransitions());
		Assert.assertEquals(0.5, p.get(1, 2), 0.0);
		Assert.assertEquals(0.0, p.get(2, 1), 0.0);
		Assert.assertEquals(1.0, p.rowSum(1), 1e-15);
	}

	@Test
	public void statesWithoutTransitionsAreEmptyRows()
	{
		final SparseTransitionMatrix p = SparseTransitionMatrix.builder(3).add(0, 2, 1.0).build();
		Assert.assertEquals(3, p.dimension());
		Assert.assertEquals(0.0, p.rowSum(1), 0.0);
		final double[] out = new double[3];
		p.step(new double[]{0.5, 0.5, 0.0}, out);
		Assert.assertArrayEquals(new double[]{0.0, 0.0, 0.5}, out, 0.0);
	}

	@Test(expected = DimensionException.class)
	public void transitionOutsideChainIsRejected()
	{
		SparseTransitionMatrix.builder(2).add(0, 2, 1.0);
	}

	@Test(expected = IllegalArgumentException.class)
	public void negativeProbabilityIsRejected()
	{
		SparseTransitionMatrix.builder(2).add(0, 1, -0.1);
	}

	@Test(expected = DimensionException.class)
	public void vectorLengthIsChecked()
	{
		SparseTransitionMatrix.builder(2).add(0, 1, 1.0).build().checkDimension(new double[3], "Distribution");
	}

	@Test(expected = DimensionException.class)
	public void denseMatrixMustBeSquare()
	{
		new DenseTransitionMatrix(new double[][]{{0.5, 0.5}});
	}
}
