package edu.upf.taln.arnoldi.core.chain;

import java.util.Arrays;
import java.util.stream.IntStream;

/**
 * Transition matrix in compressed sparse row format, one row per source state.
 * Zero entries are never stored and duplicate entries are summed.
 */
public final class SparseTransitionMatrix implements TransitionMatrix
{
	private final int n;
	private final int[] row_offsets; // length n + 1
	private final int[] targets;
	private final double[] values;

	private SparseTransitionMatrix(int n, int[] row_offsets, int[] targets, double[] values)
	{
		this.n = n;
		this.row_offsets = row_offsets;
		this.targets = targets;
		this.values = values;
	}

	public static Builder builder(int n)
	{
		return new Builder(n);
	}

	@Override
	public int dimension()
	{
		return n;
	}

	@Override
	public void step(double[] in, double[] out)
	{
		Arrays.fill(out, 0.0);
		for (int i = 0; i < n; ++i)
		{
			final double xi = in[i];
			if (xi == 0.0)
				continue;
			for (int e = row_offsets[i]; e < row_offsets[i + 1]; ++e)
				out[targets[e]] += values[e] * xi;
		}
	}

	@Override
	public double get(int from, int to)
	{
		final int pos = Arrays.binarySearch(targets, row_offsets[from], row_offsets[from + 1], to);
		return pos >= 0 ? values[pos] : 0.0;
	}

	@Override
	public double rowSum(int state)
	{
		double sum = 0.0;
		for (int e = row_offsets[state]; e < row_offsets[state + 1]; ++e)
			sum += values[e];
		return sum;
	}

	public int numTransitions()
	{
		return values.length;
	}

	public double[][] toArray()
	{
		double[][] m = new double[n][n];
		IntStream.range(0, n).forEach(i ->
		{
			for (int e = row_offsets[i]; e < row_offsets[i + 1]; ++e)
				m[i][targets[e]] = values[e];
		});
		return m;
	}

	/**
	 * Accumulates (from, to, probability) triples and compresses them into a matrix.
	 * Not thread-safe.
	 */
	public static final class Builder
	{
		private final int n;
		private int size = 0;
		private int[] from = new int[16];
		private int[] to = new int[16];
		private double[] probabilities = new double[16];

		private Builder(int n)
		{
			if (n <= 0)
				throw new DimensionException("Chain must have at least one state, got " + n);
			this.n = n;
		}

		public Builder add(int from_state, int to_state, double probability)
		{
			if (from_state < 0 || from_state >= n || to_state < 0 || to_state >= n)
				throw new DimensionException("Transition " + from_state + "->" + to_state + " outside of a chain with " +
						n + " states");
			if (!(probability >= 0.0) || Double.isInfinite(probability))
				throw new IllegalArgumentException("Invalid transition probability " + probability + " for " +
						from_state + "->" + to_state);
			if (probability == 0.0)
				return this;

			if (size == from.length)
			{
				final int capacity = size * 2;
				from = Arrays.copyOf(from, capacity);
				to = Arrays.copyOf(to, capacity);
				probabilities = Arrays.copyOf(probabilities, capacity);
			}
			from[size] = from_state;
			to[size] = to_state;
			probabilities[size] = probability;
			++size;
			return this;
		}

		public SparseTransitionMatrix build()
		{
			// sort entries by (from, to) and merge duplicates
			final Integer[] order = IntStream.range(0, size).boxed().toArray(Integer[]::new);
			Arrays.sort(order, (a, b) -> from[a] != from[b] ? Integer.compare(from[a], from[b]) : Integer.compare(to[a], to[b]));

			final int[] row_offsets = new int[n + 1];
			final int[] targets = new int[size];
			final double[] values = new double[size];
			int nnz = 0;
			int last_from = -1, last_to = -1;
			for (int idx : order)
			{
				if (from[idx] == last_from && to[idx] == last_to)
				{
					values[nnz - 1] += probabilities[idx];
					continue;
				}
				targets[nnz] = to[idx];
				values[nnz] = probabilities[idx];
				++row_offsets[from[idx] + 1];
				++nnz;
				last_from = from[idx];
				last_to = to[idx];
			}
			for (int i = 0; i < n; ++i)
				row_offsets[i + 1] += row_offsets[i];

			return new SparseTransitionMatrix(n, row_offsets, Arrays.copyOf(targets, nnz), Arrays.copyOf(values, nnz));
		}
	}
}
