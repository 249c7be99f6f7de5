package edu.upf.taln.arnoldi.core.chain;

/**
 * Raised when an input vector cannot seed a Krylov basis, e.g. it has zero norm or non-finite entries.
 */
public class DegenerateInputException extends IllegalArgumentException
{
	public DegenerateInputException(String message)
	{
		super(message);
	}
}
