package edu.upf.taln.arnoldi.core.krylov;

/**
 * Signals that the Krylov subspace is saturated: the next basis vector would be numerically zero.
 * The factorization is left as it was and its current size has to be treated as final.
 */
public class BreakdownException extends Exception
{
	private final int size;

	public BreakdownException(int size, String message)
	{
		super(message);
		this.size = size;
	}

	/**
	 * @return size of the factorization when the breakdown happened
	 */
	public int getSize()
	{
		return size;
	}
}
