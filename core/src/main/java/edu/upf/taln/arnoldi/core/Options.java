package edu.upf.taln.arnoldi.core;

import edu.upf.taln.arnoldi.core.krylov.KrylovBasisBuilder;
import edu.upf.taln.arnoldi.core.utils.DebugUtils;

import java.util.Arrays;
import java.util.stream.IntStream;

public class Options
{
	public double tolerance = 1e-12; // maximum stationary-weighted residual of an accepted aggregation. Values > 0, may be infinite
	public int[] checkpoints = IntStream.rangeClosed(0, 100).map(i -> 1 + 10 * i).toArray(); // ascending sizes at which the criterion is evaluated
	public int max_size = KrylovBasisBuilder.DEFAULT_CAPACITY; // cap on the aggregation size, must exceed the largest checkpoint
	public int num_steps = 100000; // number of transient steps taken after aggregating

	public Options() {}

	public Options(Options o)
	{
		this.tolerance = o.tolerance;
		this.checkpoints = o.checkpoints.clone();
		this.max_size = o.max_size;
		this.num_steps = o.num_steps;
	}

	@Override
	public String toString()
	{
		return  "Options:" +
				"\n\ttolerance = " + DebugUtils.printError(tolerance) +
				"\n\tcheckpoints = " + (checkpoints.length > 10 ?
						Arrays.toString(Arrays.copyOf(checkpoints, 5)) + " ... " + checkpoints[checkpoints.length - 1] :
						Arrays.toString(checkpoints)) +
				"\n\tmax_size = " + max_size +
				"\n\tnum_steps = " + num_steps;
	}
}
