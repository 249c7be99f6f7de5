package edu.upf.taln.arnoldi.core.sizing;

import Jama.Matrix;
import edu.upf.taln.arnoldi.core.chain.DimensionException;
import edu.upf.taln.arnoldi.core.krylov.KrylovFactorization;
import org.apache.commons.lang3.tuple.Pair;

import java.util.List;
import java.util.Optional;

/**
 * Frozen aggregation of a chain: step matrix Π (k×k), disaggregation matrix A (n×k), aggregated initial
 * distribution π0 and, when it could be estimated, the aggregated stationary distribution π_st.
 * Immutable, getters return copies.
 */
public final class Aggregation
{
	private final Matrix step_matrix;
	private final Matrix basis;
	private final double[] stationary; // null if not available
	private final double[] initial;
	private final SizingOutcome outcome;
	private final double criterion;
	private final List<Pair<Integer, Double>> trace;

	public Aggregation(Matrix step_matrix, Matrix basis, double[] stationary, double[] initial,
	                   SizingOutcome outcome, double criterion, List<Pair<Integer, Double>> trace)
	{
		final int k = step_matrix.getRowDimension();
		if (step_matrix.getColumnDimension() != k || basis.getColumnDimension() != k || initial.length != k ||
				(stationary != null && stationary.length != k))
			throw new DimensionException("Inconsistent aggregation: " + k + "x" + step_matrix.getColumnDimension() +
					" step matrix, " + basis.getColumnDimension() + " basis vectors, initial distribution of length " +
					initial.length);
		this.step_matrix = step_matrix.copy();
		this.basis = basis.copy();
		this.stationary = stationary == null ? null : stationary.clone();
		this.initial = initial.clone();
		this.outcome = outcome;
		this.criterion = criterion;
		this.trace = List.copyOf(trace);
	}

	/**
	 * Freezes the current state of a factorization, with π0 = [‖p0‖₂, 0, ..., 0].
	 */
	static Aggregation freeze(KrylovFactorization f, double p0_norm, double[] stationary, SizingOutcome outcome,
	                          double criterion, List<Pair<Integer, Double>> trace)
	{
		final double[] initial = new double[f.size()];
		initial[0] = p0_norm;
		return new Aggregation(f.rayleighQuotient(), f.basis(), stationary, initial, outcome, criterion, trace);
	}

	public int size()
	{
		return step_matrix.getRowDimension();
	}

	public int dimension()
	{
		return basis.getRowDimension();
	}

	/**
	 * @return Π
	 */
	public Matrix getStepMatrix()
	{
		return step_matrix.copy();
	}

	/**
	 * @return A
	 */
	public Matrix getBasis()
	{
		return basis.copy();
	}

	/**
	 * @return π_st, empty if its eigenpair was complex at this size or it was not computed
	 */
	public Optional<double[]> getStationary()
	{
		return Optional.ofNullable(stationary).map(double[]::clone);
	}

	/**
	 * @return π0
	 */
	public double[] getInitial()
	{
		return initial.clone();
	}

	public SizingOutcome getOutcome()
	{
		return outcome;
	}

	public boolean isCertified()
	{
		return outcome == SizingOutcome.CERTIFIED;
	}

	/**
	 * @return criterion at the accepted size, NaN if not evaluated
	 */
	public double getCriterion()
	{
		return criterion;
	}

	/**
	 * @return (size, criterion) for each checkpoint evaluated while sizing; NaN criterion for complex eigenpairs
	 */
	public List<Pair<Integer, Double>> getTrace()
	{
		return trace;
	}

	@Override
	public String toString()
	{
		return "Aggregation of " + dimension() + " states into " + size() + " (" + outcome + ", criterion " + criterion + ")";
	}
}
