package edu.upf.taln.arnoldi.core.utils;

import Jama.Matrix;

/**
 * Vector primitives on plain arrays, used where Jama would allocate a new matrix per call.
 * Methods taking an explicit length operate on the prefix of their arguments.
 */
public final class LinearAlgebra
{
	private LinearAlgebra() {}

	public static double dot(double[] a, double[] b)
	{
		double s = 0.0;
		for (int i = 0; i < a.length; ++i)
			s += a[i] * b[i];
		return s;
	}

	public static double norm1(double[] v)
	{
		return norm1(v, v.length);
	}

	public static double norm1(double[] v, int length)
	{
		double s = 0.0;
		for (int i = 0; i < length; ++i)
			s += Math.abs(v[i]);
		return s;
	}

	public static double norm2(double[] v)
	{
		double s = 0.0;
		for (double x : v)
			s += x * x;
		return Math.sqrt(s);
	}

	public static double sum(double[] v)
	{
		double s = 0.0;
		for (double x : v)
			s += x;
		return s;
	}

	// L1 distance between two vectors of the same length
	public static double distance1(double[] a, double[] b)
	{
		double s = 0.0;
		for (int i = 0; i < a.length; ++i)
			s += Math.abs(a[i] - b[i]);
		return s;
	}

	// y += alpha * x
	public static void axpy(double alpha, double[] x, double[] y)
	{
		for (int i = 0; i < y.length; ++i)
			y[i] += alpha * x[i];
	}

	public static void scale(double alpha, double[] v)
	{
		for (int i = 0; i < v.length; ++i)
			v[i] *= alpha;
	}

	/**
	 * out = m[0..k, 0..k] · x[0..k]. x and out must be distinct.
	 */
	public static void multiply(double[][] m, double[] x, double[] out, int k)
	{
		for (int i = 0; i < k; ++i)
		{
			final double[] row = m[i];
			double s = 0.0;
			for (int j = 0; j < k; ++j)
				s += row[j] * x[j];
			out[i] = s;
		}
	}

	/**
	 * Lifts an aggregated vector back to the full space: out = A·x, with A stored as n×k.
	 */
	public static void disaggregate(Matrix a, double[] x, double[] out)
	{
		final double[][] rows = a.getArray();
		final int k = a.getColumnDimension();
		for (int i = 0; i < rows.length; ++i)
		{
			final double[] row = rows[i];
			double s = 0.0;
			for (int j = 0; j < k; ++j)
				s += row[j] * x[j];
			out[i] = s;
		}
	}
}
