package edu.upf.taln.arnoldi.core.krylov;

import Jama.Matrix;
import edu.upf.taln.arnoldi.core.chain.TransitionMatrix;
import edu.upf.taln.arnoldi.core.utils.LinearAlgebra;

import java.util.Arrays;

/**
 * Running Arnoldi factorization M·A = A·Π + r·e_kᵀ for the step operator M = Pᵀ of a chain.
 *
 * Storage is an arena allocated once at full capacity: basis vectors are kept as contiguous rows of
 * {@code vectors} and Π as the leading block of {@code hessenberg}. Growing the factorization only moves the
 * {@code size} bound. Views returned by {@link #basis()} and {@link #rayleighQuotient()} are copies.
 *
 * Mutated in place by {@link KrylovBasisBuilder}; not thread-safe.
 */
public final class KrylovFactorization
{
	final TransitionMatrix chain;
	final double[][] vectors;    // capacity x n, row i is basis vector i
	final double[][] hessenberg; // capacity x capacity
	final double[] residual;     // n
	double residual_norm;
	double image_norm;           // norm of M·v_k before orthogonalization
	int size;

	KrylovFactorization(TransitionMatrix chain, int capacity)
	{
		final int n = chain.dimension();
		this.chain = chain;
		this.vectors = new double[capacity][n];
		this.hessenberg = new double[capacity][capacity];
		this.residual = new double[n];
	}

	public TransitionMatrix getChain()
	{
		return chain;
	}

	public int size()
	{
		return size;
	}

	public int capacity()
	{
		return vectors.length;
	}

	public int dimension()
	{
		return chain.dimension();
	}

	/**
	 * @return norm of the residual r, i.e. the would-be next subdiagonal entry of Π
	 */
	public double residualNorm()
	{
		return residual_norm;
	}

	public double[] residual()
	{
		return residual.clone();
	}

	public double[] basisVector(int i)
	{
		checkIndex(i);
		return vectors[i].clone();
	}

	/**
	 * Disaggregates a vector over the leading x.length basis vectors: out = A_k·x
	 */
	public void lift(double[] x, double[] out)
	{
		checkPrefix(x.length);
		Arrays.fill(out, 0.0);
		for (int j = 0; j < x.length; ++j)
			if (x[j] != 0.0)
				LinearAlgebra.axpy(x[j], vectors[j], out);
	}

	/**
	 * @return A as an n×k matrix with orthonormal columns
	 */
	public Matrix basis()
	{
		return basis(size);
	}

	/**
	 * @return leading k columns of A, k <= size()
	 */
	public Matrix basis(int k)
	{
		checkPrefix(k);
		final int n = dimension();
		final Matrix a = new Matrix(n, k);
		final double[][] rows = a.getArray();
		for (int j = 0; j < k; ++j)
		{
			final double[] v = vectors[j];
			for (int i = 0; i < n; ++i)
				rows[i][j] = v[i];
		}
		return a;
	}

	/**
	 * @return Π = AᵀMA as a k×k upper Hessenberg matrix
	 */
	public Matrix rayleighQuotient()
	{
		return rayleighQuotient(size);
	}

	public Matrix rayleighQuotient(int k)
	{
		checkPrefix(k);
		return new Matrix(hessenberg).getMatrix(0, k - 1, 0, k - 1);
	}

	private void checkIndex(int i)
	{
		if (i < 0 || i >= size)
			throw new IndexOutOfBoundsException("Basis vector " + i + " out of a factorization of size " + size);
	}

	private void checkPrefix(int k)
	{
		if (k < 1 || k > size)
			throw new IndexOutOfBoundsException("Prefix " + k + " out of a factorization of size " + size);
	}
}
