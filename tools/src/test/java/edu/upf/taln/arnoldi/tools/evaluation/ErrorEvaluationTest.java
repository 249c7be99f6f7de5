package edu.upf.taln.arnoldi.tools.evaluation;

import edu.upf.taln.arnoldi.core.chain.SparseTransitionMatrix;
import edu.upf.taln.arnoldi.core.engine.ErrorInstrumentation;
import edu.upf.taln.arnoldi.core.io.TransitionMatrixReader;
import edu.upf.taln.arnoldi.core.sizing.ArnoldiWithStationary;
import edu.upf.taln.arnoldi.core.sizing.NaiveArnoldi;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.List;

public class ErrorEvaluationTest
{
	@Rule
	public TemporaryFolder folder = new TemporaryFolder();
	private SparseTransitionMatrix ring;
	private final double[] p0 = {0.0, 0.0, 1.0, 0.0};

	@Before
	public void setUp() throws Exception
	{
		ring = TransitionMatrixReader.read(Paths.get(getClass().getResource("/chains/ring.tra").toURI()));
	}

	@Test
	public void writesStaticErrorsThenSampledSteps() throws Exception
	{
		final Path output = folder.getRoot().toPath().resolve("errors.txt");
		final ErrorInstrumentation instrumentation = ErrorEvaluation.run(ring, p0, new NaiveArnoldi(2), 20, 5, output);
		Assert.assertEquals(20, instrumentation.steps());

		final List<String> lines = Files.readAllLines(output, StandardCharsets.UTF_8);
		Assert.assertEquals(5, lines.size());

		final String[] static_errors = lines.get(0).split(" ");
		Assert.assertEquals(4, static_errors.length);
		Assert.assertEquals("2", static_errors[0]);
		Assert.assertEquals("NaN", static_errors[2]);

		Assert.assertTrue(lines.get(1).startsWith("0 "));
		Assert.assertTrue(lines.get(4).startsWith("15 "));
		for (String line : lines.subList(1, lines.size()))
		{
			final String[] fields = line.split(" ");
			Assert.assertTrue(Double.parseDouble(fields[1]) <= Double.parseDouble(fields[2]) + 1e-12);
		}
	}

	@Test
	public void fullSizeAggregationIsExact() throws Exception
	{
		final ErrorInstrumentation instrumentation = ErrorEvaluation.run(ring, p0, new ArnoldiWithStationary(4), 30, 1, null);
		Assert.assertEquals(0.0, instrumentation.getErrK(), 1e-12);
		Assert.assertEquals(0.0, instrumentation.getErrSt(), 1e-12);
		Assert.assertArrayEquals(new double[]{0.25, 0.25, 0.25, 0.25},
				instrumentation.getApproximateStationary().orElseThrow(), 1e-12);
	}

	@Test(expected = IllegalArgumentException.class)
	public void intervalMustBePositive() throws Exception
	{
		ErrorEvaluation.run(ring, p0, new NaiveArnoldi(2), 10, 0, null);
	}
}
