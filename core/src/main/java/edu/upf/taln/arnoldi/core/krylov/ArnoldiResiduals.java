package edu.upf.taln.arnoldi.core.krylov;

import Jama.Matrix;
import edu.upf.taln.arnoldi.core.chain.DimensionException;
import edu.upf.taln.arnoldi.core.chain.TransitionMatrix;
import edu.upf.taln.arnoldi.core.utils.LinearAlgebra;

import java.util.Arrays;

/**
 * Measures how far Π fails to commute with the chain through A, i.e. the residual AΠ − MA with M = Pᵀ.
 *
 * The residual is evaluated explicitly rather than read off the Arnoldi relation, so loss of orthogonality in
 * A shows up in the measure.
 */
public final class ArnoldiResiduals
{
	private ArnoldiResiduals() {}

	/**
	 * Column sums of |AΠ − MA| over the leading k vectors of a running factorization.
	 * Uses two scratch vectors of length n, never the full n×k residual.
	 */
	public static double[] columnSums(KrylovFactorization f, int k)
	{
		if (k < 1 || k > f.size())
			throw new IndexOutOfBoundsException("Prefix " + k + " out of a factorization of size " + f.size());
		final int n = f.dimension();
		final double[] image = new double[n];
		final double[] projected = new double[n];
		final double[] sums = new double[k];
		for (int i = 0; i < k; ++i)
		{
			f.chain.step(f.vectors[i], image); // column i of MA
			Arrays.fill(projected, 0.0);       // column i of AΠ
			for (int l = 0; l < k; ++l)
			{
				final double h = f.hessenberg[l][i];
				if (h != 0.0)
					LinearAlgebra.axpy(h, f.vectors[l], projected);
			}
			sums[i] = LinearAlgebra.distance1(projected, image);
		}
		return sums;
	}

	/**
	 * @return Diff = |AΠ − MA| as an n×k matrix
	 */
	public static Matrix difference(TransitionMatrix p, Matrix a, Matrix pi)
	{
		final int n = p.dimension();
		final int k = a.getColumnDimension();
		if (a.getRowDimension() != n || pi.getRowDimension() != k || pi.getColumnDimension() != k)
			throw new DimensionException("Cannot compare a " + a.getRowDimension() + "x" + k + " basis and a " +
					pi.getRowDimension() + "x" + pi.getColumnDimension() + " step matrix with a chain of " + n + " states");

		final Matrix diff = a.times(pi);
		final double[][] d = diff.getArray();
		final double[][] rows = a.getArray();
		final double[] column = new double[n];
		final double[] image = new double[n];
		for (int i = 0; i < k; ++i)
		{
			for (int row = 0; row < n; ++row)
				column[row] = rows[row][i];
			p.step(column, image);
			for (int row = 0; row < n; ++row)
				d[row][i] = Math.abs(d[row][i] - image[row]);
		}
		return diff;
	}

	public static double[] columnSums(Matrix m)
	{
		final double[] sums = new double[m.getColumnDimension()];
		Arrays.stream(m.getArray()).forEach(row ->
		{
			for (int j = 0; j < row.length; ++j)
				sums[j] += row[j];
		});
		return sums;
	}

	/**
	 * Stationary-weighted residual Σ_i |π[i]| · Σ_j |(AΠ − MA)[j][i]|
	 */
	public static double criterion(double[] pi, double[] column_sums)
	{
		if (pi.length != column_sums.length)
			throw new DimensionException("Vector of length " + pi.length + " cannot weight " + column_sums.length + " columns");
		double s = 0.0;
		for (int i = 0; i < pi.length; ++i)
			s += Math.abs(pi[i]) * column_sums[i];
		return s;
	}
}
