package edu.upf.taln.arnoldi.core.stationary;

/**
 * Signals that the dominant eigenpair of an aggregated step matrix is complex, so no real stationary
 * distribution can be read from it yet. Recoverable by estimating on a larger aggregation.
 */
public class NotConvergedException extends Exception
{
	private final int size;
	private final double real;
	private final double imaginary;

	public NotConvergedException(int size, double real, double imaginary)
	{
		super("Dominant eigenvalue " + real + (imaginary < 0 ? " - " : " + ") + Math.abs(imaginary) +
				"i of aggregation of size " + size + " is complex");
		this.size = size;
		this.real = real;
		this.imaginary = imaginary;
	}

	public NotConvergedException(int size, String message)
	{
		super(message);
		this.size = size;
		this.real = Double.NaN;
		this.imaginary = Double.NaN;
	}

	public int getSize()
	{
		return size;
	}

	public double getReal()
	{
		return real;
	}

	public double getImaginary()
	{
		return imaginary;
	}
}
