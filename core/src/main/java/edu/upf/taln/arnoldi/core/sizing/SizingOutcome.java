package edu.upf.taln.arnoldi.core.sizing;

public enum SizingOutcome
{
	/** criterion met at the accepted size with a real stationary distribution */
	CERTIFIED,
	/** no checkpoint met the tolerance, aggregation at the largest size reached. Usable but not certified. */
	UNCERTIFIED,
	/** size chosen by the caller, criterion not evaluated */
	FIXED
}
