package edu.upf.taln.arnoldi.core.chain;

/**
 * Raised when the shapes of a chain, a distribution or an aggregation do not match.
 */
public class DimensionException extends IllegalArgumentException
{
	public DimensionException(String message)
	{
		super(message);
	}
}
