package edu.upf.taln.arnoldi.tools;

import com.google.common.base.Joiner;

import java.io.BufferedWriter;
import java.io.Closeable;
import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;

/**
 * Appends data points to a text file, one line of space-separated values per data point.
 * Existing contents are kept, so repeated runs accumulate in the same file.
 */
public class DataPointWriter implements Closeable
{
	private static final Joiner joiner = Joiner.on(' ').useForNull("NaN");
	private final BufferedWriter writer;

	public DataPointWriter(Path file) throws IOException
	{
		writer = Files.newBufferedWriter(file, StandardCharsets.UTF_8, StandardOpenOption.CREATE, StandardOpenOption.APPEND);
	}

	public void write(Object... datapoints) throws IOException
	{
		writer.write(joiner.join(datapoints));
		writer.newLine();
	}

	@Override
	public void close() throws IOException
	{
		writer.close();
	}

	/**
	 * Appends a single data point, opening and closing the file
	 */
	public static void append(Path file, Object... datapoints) throws IOException
	{
		try (DataPointWriter writer = new DataPointWriter(file))
		{
			writer.write(datapoints);
		}
	}
}
