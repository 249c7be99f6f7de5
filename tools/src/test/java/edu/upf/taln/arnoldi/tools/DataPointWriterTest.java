package edu.upf.taln.arnoldi.tools;

import org.junit.Assert;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;

public class DataPointWriterTest
{
	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	@Test
	public void appendsOneLinePerDataPoint() throws IOException
	{
		final Path file = folder.getRoot().toPath().resolve("data.txt");
		DataPointWriter.append(file, 1, 2.5, "CERTIFIED");
		DataPointWriter.append(file, 2, Double.NaN, null);

		final List<String> lines = Files.readAllLines(file, StandardCharsets.UTF_8);
		Assert.assertEquals(List.of("1 2.5 CERTIFIED", "2 NaN NaN"), lines);
	}

	@Test
	public void keepsExistingContents() throws IOException
	{
		final Path file = folder.newFile("existing.txt").toPath();
		Files.write(file, "0 0.0\n".getBytes(StandardCharsets.UTF_8));
		try (DataPointWriter writer = new DataPointWriter(file))
		{
			writer.write(1, 1e-12);
			writer.write(2, 3L);
		}
		Assert.assertEquals(List.of("0 0.0", "1 1.0E-12", "2 3"), Files.readAllLines(file, StandardCharsets.UTF_8));
	}
}
