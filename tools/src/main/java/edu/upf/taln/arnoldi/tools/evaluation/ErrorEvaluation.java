package edu.upf.taln.arnoldi.tools.evaluation;

import com.google.common.base.Stopwatch;
import edu.upf.taln.arnoldi.core.chain.TransitionMatrix;
import edu.upf.taln.arnoldi.core.engine.ErrorInstrumentation;
import edu.upf.taln.arnoldi.core.sizing.AggregationAlgorithm;
import edu.upf.taln.arnoldi.core.utils.DebugUtils;
import edu.upf.taln.arnoldi.tools.DataPointWriter;
import org.apache.commons.math3.stat.descriptive.DescriptiveStatistics;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.io.IOException;
import java.nio.file.Path;

/**
 * Runs an aggregation side by side with its exact chain and reports the transient error over time.
 */
public class ErrorEvaluation
{
	private final static Logger log = LogManager.getLogger();

	/**
	 * Measures err_k at every step. If output is not null, appends a data point "t err_k err_k_bnd" every interval
	 * steps, preceded by one with the static errors "size err err_st err_π_st".
	 *
	 * @return instrumentation after num_steps steps
	 */
	public static ErrorInstrumentation run(TransitionMatrix p, double[] p0, AggregationAlgorithm algorithm,
	                                       int num_steps, int interval, Path output) throws IOException
	{
		if (interval < 1)
			throw new IllegalArgumentException("Data point interval must be greater than 0: " + interval);

		final ErrorInstrumentation instrumentation = new ErrorInstrumentation(p, p0, algorithm);
		final DescriptiveStatistics stats = new DescriptiveStatistics();

		log.info("*Measuring error over " + DebugUtils.printInteger(num_steps) + " steps*");
		Stopwatch timer = Stopwatch.createStarted();
		try (DataPointWriter writer = output != null ? new DataPointWriter(output) : null)
		{
			if (writer != null)
				writer.write(instrumentation.getEngine().size(), instrumentation.getErr(), instrumentation.getErrSt(),
						instrumentation.getErrPiSt());

			for (int t = 0; t < num_steps; ++t)
			{
				final double err_k = instrumentation.measureDynamicError();
				stats.addValue(err_k);
				if (writer != null && t % interval == 0)
					writer.write(t, err_k, instrumentation.getErrKBound());
			}
		}
		log.info("Error measured in " + timer.stop());

		if (stats.getN() > 0)
		{
			log.info("err_k over " + stats.getN() + " steps: mean = " + DebugUtils.printError(stats.getMean()) +
					" max = " + DebugUtils.printError(stats.getMax()) +
					" p95 = " + DebugUtils.printError(stats.getPercentile(95.0)) +
					" last = " + DebugUtils.printError(instrumentation.getErrK()));
			log.info("err_k_bnd = " + DebugUtils.printError(instrumentation.getErrKBound()));
		}
		return instrumentation;
	}
}
