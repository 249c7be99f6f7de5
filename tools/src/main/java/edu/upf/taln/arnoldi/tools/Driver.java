package edu.upf.taln.arnoldi.tools;

import com.beust.jcommander.JCommander;
import com.beust.jcommander.Parameter;
import com.beust.jcommander.Parameters;
import com.google.common.base.Stopwatch;
import edu.upf.taln.arnoldi.core.ArnoldiAggregator;
import edu.upf.taln.arnoldi.core.Options;
import edu.upf.taln.arnoldi.core.chain.SparseTransitionMatrix;
import edu.upf.taln.arnoldi.core.engine.AggregationEngine;
import edu.upf.taln.arnoldi.core.io.TransitionMatrixReader;
import edu.upf.taln.arnoldi.core.sizing.Aggregation;
import edu.upf.taln.arnoldi.core.utils.DebugUtils;
import edu.upf.taln.arnoldi.tools.evaluation.ErrorEvaluation;
import org.apache.logging.log4j.LogManager;
import org.apache.logging.log4j.Logger;

import java.nio.file.Path;
import java.text.DateFormat;
import java.text.SimpleDateFormat;
import java.util.Date;

public class Driver
{
	private static final String aggregate_command = "aggregate";
	private static final String evaluate_command = "evaluate";
	private final static Logger log = LogManager.getLogger();

	private static abstract class BaseCommand
	{
		@Parameter(names = {"-p", "-properties"}, description = "Path to properties file, config.properties in the classpath if not set", arity = 1,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.PathToExistingFile.class)
		protected Path properties;
		@Parameter(names = {"-i", "-input"}, description = "Path to .tra transition matrix file", arity = 1, required = true,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.PathToExistingFile.class)
		protected Path input;
		@Parameter(names = {"-o", "-output"}, description = "Path to file where data points are appended", arity = 1,
				converter = CMLCheckers.PathConverter.class, validateWith = CMLCheckers.ValidPathToFile.class)
		protected Path output;
		@Parameter(names = {"-t", "-tolerance"}, description = "Tolerance of the sizing criterion, overrides properties", arity = 1,
				converter = CMLCheckers.DoubleConverter.class, validateWith = CMLCheckers.DoubleGreaterThanZero.class)
		protected Double tolerance;
		@Parameter(names = {"-c", "-checkpoints"}, description = "Checkpoint sizes, first:step:last or comma-separated, overrides properties", arity = 1,
				validateWith = CMLCheckers.CheckpointsValidator.class)
		protected String checkpoints;
		@Parameter(names = {"-m", "-max_size"}, description = "Cap on the aggregation size, overrides properties", arity = 1,
				converter = CMLCheckers.IntegerConverter.class, validateWith = CMLCheckers.IntegerGreaterThanZero.class)
		protected Integer max_size;
		@Parameter(names = {"-s", "-steps"}, description = "Number of steps, overrides properties", arity = 1,
				converter = CMLCheckers.IntegerConverter.class, validateWith = CMLCheckers.IntegerGreaterOrEqualThanZero.class)
		protected Integer steps;

		Options createOptions(AggregationProperties properties)
		{
			final Options options = properties.getOptions();
			if (tolerance != null)
				options.tolerance = tolerance;
			if (checkpoints != null)
				options.checkpoints = AggregationProperties.parseCheckpoints(checkpoints);
			if (max_size != null)
				options.max_size = max_size;
			if (steps != null)
				options.num_steps = steps;
			return options;
		}
	}

	@Parameters(commandDescription = "Aggregate a chain and run the aggregated transient distribution")
	private static class AggregateCommand extends BaseCommand
	{
	}

	@SuppressWarnings("unused")
	@Parameters(commandDescription = "Measure the error of an aggregation against the exact chain")
	private static class EvaluateCommand extends BaseCommand
	{
		@Parameter(names = {"-a", "-algorithm"}, description = "Aggregation algorithm: adaptive, naive or stationary", arity = 1,
				converter = CMLCheckers.AlgorithmConverter.class, validateWith = CMLCheckers.AlgorithmValidator.class)
		private Algorithms.Type algorithm = Algorithms.Type.ADAPTIVE;
		@Parameter(names = {"-k", "-size"}, description = "Size of fixed-size aggregations", arity = 1,
				converter = CMLCheckers.IntegerConverter.class, validateWith = CMLCheckers.IntegerGreaterThanZero.class)
		private int size = 10;
		@Parameter(names = {"-r", "-interval"}, description = "Steps between data points", arity = 1,
				converter = CMLCheckers.IntegerConverter.class, validateWith = CMLCheckers.IntegerGreaterThanZero.class)
		private int interval = 1;
	}

	public static void main(String[] args) throws Exception
	{
		AggregateCommand aggregate = new AggregateCommand();
		EvaluateCommand evaluate = new EvaluateCommand();

		JCommander jc = new JCommander();
		jc.addCommand(aggregate_command, aggregate);
		jc.addCommand(evaluate_command, evaluate);
		jc.parse(args);

		DateFormat dateFormat = new SimpleDateFormat("dd/MM/yyyy HH:mm:ss");
		Date date = new Date();
		log.info(dateFormat.format(date) + " running \n\t" + String.join("\n\t", args));
		log.info("\n*********************************************************");

		if (jc.getParsedCommand() == null)
		{
			jc.usage();
			return;
		}

		switch (jc.getParsedCommand())
		{
			case aggregate_command:
			{
				AggregationProperties properties = loadProperties(aggregate);
				Options options = aggregate.createOptions(properties);
				log.info("***\n" + options + "\n***");
				SparseTransitionMatrix p = TransitionMatrixReader.read(aggregate.input);
				double[] p0 = properties.createInitialDistribution(p.dimension());

				Stopwatch timer = Stopwatch.createStarted();
				AggregationEngine engine = ArnoldiAggregator.run(p, p0, options);
				timer.stop();
				Aggregation aggregation = engine.getAggregation();
				log.info(aggregation);
				log.info("Aggregated distribution after " + DebugUtils.printInteger(options.num_steps) + " steps: " +
						DebugUtils.printVector(engine.current(), 10));

				if (aggregate.output != null)
					DataPointWriter.append(aggregate.output, aggregation.dimension(), aggregation.size(),
							aggregation.getOutcome(), aggregation.getCriterion(), options.num_steps,
							timer.elapsed().toMillis());
				break;
			}
			case evaluate_command:
			{
				AggregationProperties properties = loadProperties(evaluate);
				Options options = evaluate.createOptions(properties);
				log.info("***\n" + options + "\n***");
				SparseTransitionMatrix p = TransitionMatrixReader.read(evaluate.input);
				double[] p0 = properties.createInitialDistribution(p.dimension());

				ErrorEvaluation.run(p, p0, Algorithms.create(evaluate.algorithm, options, evaluate.size),
						options.num_steps, evaluate.interval, evaluate.output);
				break;
			}
			default:
				jc.usage();
				break;
		}

		log.debug("\n\n");
	}

	private static AggregationProperties loadProperties(BaseCommand command)
	{
		return command.properties != null ? new AggregationProperties(command.properties) : new AggregationProperties();
	}
}
