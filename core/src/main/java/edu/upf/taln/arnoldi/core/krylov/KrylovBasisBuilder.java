package edu.upf.taln.arnoldi.core.krylov;

import edu.upf.taln.arnoldi.core.chain.DegenerateInputException;
import edu.upf.taln.arnoldi.core.chain.TransitionMatrix;
import edu.upf.taln.arnoldi.core.utils.LinearAlgebra;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Arnoldi process building an orthonormal basis of the Krylov subspace span{p0, M p0, M² p0, ...} of the step
 * operator M = Pᵀ, one vector at a time, together with the projection Π = AᵀMA.
 *
 * Each new image M·v_k is orthogonalized with modified Gram-Schmidt followed by a second, re-orthogonalization pass.
 * Coefficients of both passes are accumulated into Π.
 */
public class KrylovBasisBuilder
{
	public static final int DEFAULT_CAPACITY = 2000;
	public static final double DEFAULT_BREAKDOWN_TOLERANCE = 1e-12;
	private static final int ORTHOGONALIZATION_PASSES = 2;

	private final double breakdown_tolerance;
	private final static Logger log = LogManager.getLogger();

	public KrylovBasisBuilder()
	{
		this(DEFAULT_BREAKDOWN_TOLERANCE);
	}

	/**
	 * @param breakdown_tolerance residual norm, relative to the norm of the last image M·v_k, below which the
	 *                            subspace is considered saturated
	 */
	public KrylovBasisBuilder(double breakdown_tolerance)
	{
		if (!(breakdown_tolerance > 0.0))
			throw new IllegalArgumentException("Breakdown tolerance must be greater than 0: " + breakdown_tolerance);
		this.breakdown_tolerance = breakdown_tolerance;
	}

	public KrylovFactorization initialize(TransitionMatrix p, double[] p0)
	{
		return initialize(p, p0, DEFAULT_CAPACITY);
	}

	/**
	 * Seeds a factorization of size 1 with v1 = p0/‖p0‖₂.
	 *
	 * @param capacity maximum number of basis vectors. The arena is allocated at min(capacity, n) since a Krylov
	 *                 subspace cannot outgrow the state space.
	 */
	public KrylovFactorization initialize(TransitionMatrix p, double[] p0, int capacity)
	{
		p.checkDimension(p0, "Initial distribution");
		if (capacity < 1)
			throw new IllegalArgumentException("Capacity must be greater than 0: " + capacity);
		for (int i = 0; i < p0.length; ++i)
			if (!Double.isFinite(p0[i]))
				throw new DegenerateInputException("Non-finite value " + p0[i] + " at position " + i + " of initial distribution");
		final double norm = LinearAlgebra.norm2(p0);
		if (norm == 0.0)
			throw new DegenerateInputException("Initial distribution has zero norm");

		final KrylovFactorization f = new KrylovFactorization(p, Math.min(capacity, p.dimension()));
		final double[] v = f.vectors[0];
		for (int i = 0; i < v.length; ++i)
			v[i] = p0[i] / norm;
		f.size = 1;
		extendLastColumn(f);

		log.debug("Krylov factorization initialized for " + p.dimension() + " states, arena of " + f.capacity() + " vectors");
		return f;
	}

	/**
	 * Appends one basis vector to the factorization and the corresponding row and column to Π.
	 *
	 * @throws BreakdownException if the residual is numerically zero or the basis already spans the whole state
	 *                            space. The factorization is not modified in that case.
	 * @throws IllegalStateException if the arena is full before the subspace saturates
	 */
	public void expand(KrylovFactorization f) throws BreakdownException
	{
		final int k = f.size;
		if (f.residual_norm <= breakdown_tolerance * Math.max(1.0, f.image_norm))
			throw new BreakdownException(k, "Krylov subspace saturated at size " + k + ", residual norm " + f.residual_norm);
		if (k == f.capacity())
		{
			if (k == f.dimension())
				throw new BreakdownException(k, "Krylov basis spans the whole state space at size " + k);
			throw new IllegalStateException("Krylov factorization reached its capacity of " + k + " vectors");
		}

		final double beta = f.residual_norm;
		final double[] v = f.vectors[k];
		final double[] r = f.residual;
		for (int i = 0; i < v.length; ++i)
			v[i] = r[i] / beta;
		f.hessenberg[k][k - 1] = beta;
		f.size = k + 1;
		extendLastColumn(f);
	}

	// Computes M·v_k, orthogonalizes it against v_1..v_k into column k of Π and keeps the remainder as residual
	private static void extendLastColumn(KrylovFactorization f)
	{
		final int k = f.size - 1;
		final double[] w = f.residual;
		f.chain.step(f.vectors[k], w);
		f.image_norm = LinearAlgebra.norm2(w);

		for (int pass = 0; pass < ORTHOGONALIZATION_PASSES; ++pass)
		{
			for (int j = 0; j <= k; ++j)
			{
				final double[] vj = f.vectors[j];
				final double h = LinearAlgebra.dot(vj, w);
				f.hessenberg[j][k] += h;
				LinearAlgebra.axpy(-h, vj, w);
			}
		}
		f.residual_norm = LinearAlgebra.norm2(w);
	}
}
