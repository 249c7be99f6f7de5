package edu.upf.taln.arnoldi.tools;

import com.google.common.base.Enums;
import com.google.common.base.Optional;
import edu.upf.taln.arnoldi.core.Options;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.io.InputStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Locale;
import java.util.Properties;
import java.util.stream.IntStream;

/**
 * Experiment settings read from a properties file. Keys left out take the defaults of {@link Options}.
 * <pre>
 *     ap.tolerance = 1e-12
 *     ap.checkpoints = 1:10:1001        (first:step:last, or a comma-separated list)
 *     ap.max_size = 2000
 *     ap.num_steps = 100000
 *     ap.initial.distribution = RANDOM  (UNIFORM, RANDOM or POINT)
 *     ap.initial.state = 0              (POINT only)
 *     ap.initial.seed = 42              (RANDOM only)
 * </pre>
 */
public class AggregationProperties
{
	private final Options options = new Options();
	private InitialDistributions.Type initialDistribution = InitialDistributions.Type.RANDOM;
	private int initialState = 0;
	private long seed = 42L;

	private final static Logger log = LogManager.getLogger();

	/**
	 * Loads config.properties from the classpath
	 */
	public AggregationProperties()
	{
		Properties prop = new Properties();
		try (InputStream input = AggregationProperties.class.getClassLoader().getResourceAsStream("config.properties"))
		{
			if (input == null)
			{
				log.error("Sorry, unable to find config.properties, using default settings");
				return;
			}
			prop.load(input);
		}
		catch (IOException e)
		{
			throw new RuntimeException("Failed to load config.properties: " + e, e);
		}
		load(prop);
	}

	public AggregationProperties(Path file)
	{
		Properties prop = new Properties();
		try (InputStream input = Files.newInputStream(file))
		{
			prop.load(input);
		}
		catch (IOException e)
		{
			throw new RuntimeException("Failed to load properties from " + file + ": " + e, e);
		}
		load(prop);
	}

	private void load(Properties prop)
	{
		final String tolerance = prop.getProperty("ap.tolerance");
		if (tolerance != null)
			options.tolerance = Double.parseDouble(tolerance.trim());
		final String checkpoints = prop.getProperty("ap.checkpoints");
		if (checkpoints != null)
			options.checkpoints = parseCheckpoints(checkpoints);
		final String max_size = prop.getProperty("ap.max_size");
		if (max_size != null)
			options.max_size = Integer.parseInt(max_size.trim());
		final String num_steps = prop.getProperty("ap.num_steps");
		if (num_steps != null)
			options.num_steps = Integer.parseInt(num_steps.trim());

		final String distribution = prop.getProperty("ap.initial.distribution");
		if (distribution != null)
		{
			final Optional<InitialDistributions.Type> type =
					Enums.getIfPresent(InitialDistributions.Type.class, distribution.trim().toUpperCase(Locale.ROOT));
			if (!type.isPresent())
				throw new RuntimeException(distribution + " is not a valid initial distribution, expected one of " +
						Arrays.toString(InitialDistributions.Type.values()));
			initialDistribution = type.get();
		}
		final String state = prop.getProperty("ap.initial.state");
		if (state != null)
			initialState = Integer.parseInt(state.trim());
		final String seed_value = prop.getProperty("ap.initial.seed");
		if (seed_value != null)
			seed = Long.parseLong(seed_value.trim());
	}

	/**
	 * Parses a checkpoint schedule, either a range first:step:last or a comma-separated list of sizes.
	 * Does not check that sizes ascend.
	 */
	public static int[] parseCheckpoints(String value)
	{
		final String trimmed = value.trim();
		if (trimmed.isEmpty())
			throw new IllegalArgumentException("Empty checkpoint schedule");

		if (trimmed.contains(":"))
		{
			final String[] parts = trimmed.split(":");
			if (parts.length != 3)
				throw new IllegalArgumentException("Checkpoint range must be first:step:last, got " + value);
			final int first = Integer.parseInt(parts[0].trim());
			final int step = Integer.parseInt(parts[1].trim());
			final int last = Integer.parseInt(parts[2].trim());
			if (step < 1 || last < first)
				throw new IllegalArgumentException("Invalid checkpoint range " + value);
			return IntStream.iterate(first, i -> i <= last, i -> i + step).toArray();
		}

		return Arrays.stream(trimmed.split(","))
				.map(String::trim)
				.mapToInt(Integer::parseInt)
				.toArray();
	}

	/**
	 * @return copy of the aggregation options
	 */
	public Options getOptions()
	{
		return new Options(options);
	}

	public InitialDistributions.Type getInitialDistribution()
	{
		return initialDistribution;
	}

	public int getInitialState()
	{
		return initialState;
	}

	public long getSeed()
	{
		return seed;
	}

	public double[] createInitialDistribution(int n)
	{
		return InitialDistributions.create(initialDistribution, n, initialState, seed);
	}
}
