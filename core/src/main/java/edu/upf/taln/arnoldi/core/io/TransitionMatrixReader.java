package edu.upf.taln.arnoldi.core.io;

import edu.upf.taln.arnoldi.core.chain.SparseTransitionMatrix;
import edu.upf.taln.arnoldi.core.chain.TransitionMatrix;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

/**
 * Reads transition matrices in the coordinate .tra format:
 * <pre>
 *     num_states num_transitions
 *     src dst probability
 *     ...
 * </pre>
 * with 0-based state indices and exactly num_transitions transition lines. Zero probabilities are dropped and
 * repeated (src, dst) pairs summed. The number of states is 1 + the largest index found; the header state count
 * is not read.
 */
public class TransitionMatrixReader
{
	public static final double STOCHASTIC_TOLERANCE = 1e-9;
	private final static Logger log = LogManager.getLogger();

	public static SparseTransitionMatrix read(Path file) throws IOException
	{
		log.info("Reading transition matrix from " + file);
		try (BufferedReader reader = Files.newBufferedReader(file, StandardCharsets.UTF_8))
		{
			final SparseTransitionMatrix p = read(reader);
			log.info("Read chain with " + p.dimension() + " states and " + p.numTransitions() + " transitions");
			return p;
		}
	}

	public static SparseTransitionMatrix read(Reader input) throws IOException
	{
		final BufferedReader reader = input instanceof BufferedReader ? (BufferedReader) input : new BufferedReader(input);
		final String header = reader.readLine();
		if (header == null)
			throw new IOException("Empty transition matrix file");
		final String[] header_fields = header.trim().split("\\s+");
		if (header_fields.length != 2)
			throw new IOException("Cannot parse header, expected 2 columns: " + header);

		final int num_transitions;
		try
		{
			num_transitions = Integer.parseInt(header_fields[1]);
		}
		catch (NumberFormatException e)
		{
			throw new IOException("Cannot parse header: " + header, e);
		}
		if (num_transitions < 0)
			throw new IOException("Negative number of transitions in header: " + header);

		final int[] sources = new int[num_transitions];
		final int[] targets = new int[num_transitions];
		final double[] values = new double[num_transitions];
		int max_index = -1;
		for (int t = 0; t < num_transitions; ++t)
		{
			final int line_number = t + 2;
			final String line = reader.readLine();
			if (line == null)
				throw new IOException("Expected " + num_transitions + " transitions, file ends at line " + line_number);
			final String[] fields = line.trim().split("\\s+");
			if (fields.length != 3)
				throw new IOException("Cannot parse line " + line_number + ", wrong number of columns: " + line);
			try
			{
				sources[t] = Integer.parseInt(fields[0]);
				targets[t] = Integer.parseInt(fields[1]);
				values[t] = Double.parseDouble(fields[2]);
			}
			catch (NumberFormatException e)
			{
				throw new IOException("Cannot parse line " + line_number + ": " + line, e);
			}
			if (sources[t] < 0 || targets[t] < 0)
				throw new IOException("Negative state index at line " + line_number + ": " + line);
			if (!(values[t] >= 0.0) || Double.isInfinite(values[t]))
				throw new IOException("Invalid probability at line " + line_number + ": " + line);
			max_index = Math.max(max_index, Math.max(sources[t], targets[t]));
		}

		final int n = max_index + 1;
		if (n == 0)
			throw new IOException("Transition matrix has no states");
		final SparseTransitionMatrix.Builder builder = SparseTransitionMatrix.builder(n);
		for (int t = 0; t < num_transitions; ++t)
			builder.add(sources[t], targets[t], values[t]);
		final SparseTransitionMatrix p = builder.build();
		checkStochastic(p);
		return p;
	}

	/**
	 * Logs states whose outgoing probabilities do not sum to 1
	 *
	 * @return number of such states
	 */
	public static int checkStochastic(TransitionMatrix p)
	{
		int num_invalid = 0;
		for (int i = 0; i < p.dimension(); ++i)
		{
			final double sum = p.rowSum(i);
			if (Math.abs(sum - 1.0) > STOCHASTIC_TOLERANCE)
			{
				if (num_invalid == 0)
					log.warn("Outgoing probabilities of state " + i + " sum to " + sum);
				++num_invalid;
			}
		}
		if (num_invalid > 0)
			log.warn(num_invalid + " states out of " + p.dimension() + " are not stochastic");
		return num_invalid;
	}
}
