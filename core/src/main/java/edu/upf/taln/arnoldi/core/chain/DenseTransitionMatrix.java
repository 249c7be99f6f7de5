package edu.upf.taln.arnoldi.core.chain;

import Jama.Matrix;

import java.util.Arrays;

/**
 * Transition matrix held as a dense Jama matrix. Meant for small chains and tests.
 */
public final class DenseTransitionMatrix implements TransitionMatrix
{
	private final double[][] p;

	public DenseTransitionMatrix(double[][] p)
	{
		this(new Matrix(p));
	}

	public DenseTransitionMatrix(Matrix m)
	{
		if (m.getRowDimension() != m.getColumnDimension())
			throw new DimensionException("Transition matrix must be square, got " + m.getRowDimension() + "x" +
					m.getColumnDimension());
		this.p = m.getArrayCopy();
		for (int i = 0; i < p.length; ++i)
			for (int j = 0; j < p.length; ++j)
				if (!(p[i][j] >= 0.0) || Double.isInfinite(p[i][j]))
					throw new IllegalArgumentException("Invalid transition probability " + p[i][j] + " at " + i + "-" + j);
	}

	@Override
	public int dimension()
	{
		return p.length;
	}

	@Override
	public void step(double[] in, double[] out)
	{
		Arrays.fill(out, 0.0);
		for (int i = 0; i < p.length; ++i)
		{
			final double xi = in[i];
			if (xi == 0.0)
				continue;
			final double[] row = p[i];
			for (int j = 0; j < row.length; ++j)
				out[j] += row[j] * xi;
		}
	}

	@Override
	public double get(int from, int to)
	{
		return p[from][to];
	}

	@Override
	public double rowSum(int state)
	{
		return Arrays.stream(p[state]).sum();
	}

	public Matrix toMatrix()
	{
		return new Matrix(p).copy();
	}
}
