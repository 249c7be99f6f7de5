package edu.upf.taln.arnoldi.core;

import com.google.common.base.Stopwatch;
import edu.upf.taln.arnoldi.core.chain.TransitionMatrix;
import edu.upf.taln.arnoldi.core.engine.AggregationEngine;
import edu.upf.taln.arnoldi.core.engine.ErrorInstrumentation;
import edu.upf.taln.arnoldi.core.sizing.AdaptiveSizeSelector;
import edu.upf.taln.arnoldi.core.sizing.Aggregation;
import edu.upf.taln.arnoldi.core.utils.DebugUtils;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

/**
 * Entry point to the aggregation of Markov chains. Given a chain P and an initial distribution p0, finds a small
 * Arnoldi aggregation approximating the transient and stationary behaviour of the chain, and runs it.
 */
public final class ArnoldiAggregator
{
	private final static Logger log = LogManager.getLogger();

	private ArnoldiAggregator() {}

	/**
	 * Finds the smallest aggregation meeting the tolerance in the options
	 */
	public static Aggregation aggregate(TransitionMatrix p, double[] p0, Options o)
	{
		return new AdaptiveSizeSelector(o).aggregate(p, p0);
	}

	/**
	 * Aggregates a chain and advances the aggregated distribution by o.num_steps steps
	 *
	 * @return engine holding the last aggregated transient distribution
	 */
	public static AggregationEngine run(TransitionMatrix p, double[] p0, Options o)
	{
		final AggregationEngine engine = new AggregationEngine(p, aggregate(p, p0, o));
		log.info("*Running " + DebugUtils.printInteger(o.num_steps) + " aggregated steps*");
		Stopwatch timer = Stopwatch.createStarted();
		for (int i = 0; i < o.num_steps; ++i)
			engine.step();
		log.info("Steps completed in " + timer.stop());
		return engine;
	}

	/**
	 * Aggregates a chain and wraps the result for error measurement, in its initial state
	 */
	public static ErrorInstrumentation instrument(TransitionMatrix p, double[] p0, Options o)
	{
		return new ErrorInstrumentation(p, p0, aggregate(p, p0, o));
	}
}
