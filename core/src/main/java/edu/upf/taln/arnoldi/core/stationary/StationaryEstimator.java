package edu.upf.taln.arnoldi.core.stationary;

import Jama.EigenvalueDecomposition;
import Jama.Matrix;
import edu.upf.taln.arnoldi.core.chain.DimensionException;
import edu.upf.taln.arnoldi.core.krylov.KrylovFactorization;
import edu.upf.taln.arnoldi.core.utils.LinearAlgebra;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Extracts the aggregated stationary distribution π_st from an aggregated step matrix Π.
 *
 * π_st is the eigenvector of Π whose eigenvalue is nearest to 1 in magnitude, scaled so that its lift A·π_st has
 * an L1 norm of 1 and a positive sum. A complex eigenpair is reported as {@link NotConvergedException}: it is never
 * cast to real.
 *
 * Eigenpairs are computed by Jama's dense {@link EigenvalueDecomposition}, so this is meant for k up to a few
 * thousand.
 */
public class StationaryEstimator
{
	// eigenvalue magnitudes closer than this are considered tied
	private static final double TIE_TOLERANCE = 1e-10;
	private final static Logger log = LogManager.getLogger();

	/**
	 * @param pi k×k aggregated step matrix, not modified
	 * @param a  n×k disaggregation matrix, not modified
	 * @return π_st of length k
	 */
	public double[] estimate(Matrix pi, Matrix a) throws NotConvergedException
	{
		final int k = pi.getRowDimension();
		if (pi.getColumnDimension() != k || a.getColumnDimension() != k)
			throw new DimensionException("Cannot estimate stationary distribution of a " + k + "x" +
					pi.getColumnDimension() + " step matrix with a basis of " + a.getColumnDimension() + " vectors");

		final double[] v = dominantEigenvector(pi);
		final double[] lifted = new double[a.getRowDimension()];
		LinearAlgebra.disaggregate(a, v, lifted);
		return normalize(v, lifted);
	}

	/**
	 * Estimates π_st on the leading k×k block of a running factorization, without materializing A.
	 */
	public double[] estimate(KrylovFactorization f, int k) throws NotConvergedException
	{
		final double[] v = dominantEigenvector(f.rayleighQuotient(k));
		final double[] lifted = new double[f.dimension()];
		f.lift(v, lifted);
		return normalize(v, lifted);
	}

	public double[] estimate(KrylovFactorization f) throws NotConvergedException
	{
		return estimate(f, f.size());
	}

	private static double[] dominantEigenvector(Matrix pi) throws NotConvergedException
	{
		final int k = pi.getRowDimension();
		final EigenvalueDecomposition eig = new EigenvalueDecomposition(pi);
		final double[] re = eig.getRealEigenvalues();
		final double[] im = eig.getImagEigenvalues();

		int best = 0;
		for (int i = 1; i < k; ++i)
			if (isCloserToOne(re[i], im[i], re[best], im[best]))
				best = i;

		if (im[best] != 0.0)
			throw new NotConvergedException(k, re[best], im[best]);

		// for a real eigenvalue, column best of V is its eigenvector
		final double[][] vectors = eig.getV().getArray();
		final double[] v = new double[k];
		for (int i = 0; i < k; ++i)
			v[i] = vectors[i][best];

		log.debug("Dominant eigenvalue of aggregation of size " + k + " is " + re[best]);
		return v;
	}

	private static boolean isCloserToOne(double re1, double im1, double re2, double im2)
	{
		final double d1 = Math.abs(Math.hypot(re1, im1) - 1.0);
		final double d2 = Math.abs(Math.hypot(re2, im2) - 1.0);
		if (Math.abs(d1 - d2) > TIE_TOLERANCE)
			return d1 < d2;
		if (Math.abs(im1) != Math.abs(im2))
			return Math.abs(im1) < Math.abs(im2);
		return re1 > re2;
	}

	private static double[] normalize(double[] v, double[] lifted) throws NotConvergedException
	{
		final double norm = LinearAlgebra.norm1(lifted);
		if (norm == 0.0 || !Double.isFinite(norm))
			throw new NotConvergedException(v.length, "Stationary eigenvector of aggregation of size " + v.length +
					" lifts to a vector of norm " + norm);
		final double sign = LinearAlgebra.sum(lifted) < 0.0 ? -1.0 : 1.0;
		LinearAlgebra.scale(sign / norm, v);
		return v;
	}
}
