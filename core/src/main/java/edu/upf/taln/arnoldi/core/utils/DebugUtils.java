package edu.upf.taln.arnoldi.core.utils;

import org.apache.commons.lang3.tuple.Pair;

import java.math.RoundingMode;
import java.text.DecimalFormat;
import java.text.NumberFormat;
import java.util.Arrays;
import java.util.List;
import java.util.stream.Collectors;

public class DebugUtils
{
	private final static NumberFormat double_format = NumberFormat.getInstance();
	static {
		double_format.setRoundingMode(RoundingMode.UP);
		double_format.setMaximumFractionDigits(4);
		double_format.setMinimumFractionDigits(4);
	}
	private final static NumberFormat int_format = new DecimalFormat("#,###");
	private final static NumberFormat scientific_format = new DecimalFormat("0.###E0");

	public static String printInteger(int i)
	{
		return int_format.format(i);
	}

	public static String printDouble(double w) { return double_format.format(w); }

	// errors span many orders of magnitude
	public static String printError(double e)
	{
		if (Double.isNaN(e))
			return "n/a";
		return scientific_format.format(e);
	}

	public static String printVector(double[] v, int max_items)
	{
		final String items = Arrays.stream(v)
				.limit(max_items)
				.mapToObj(DebugUtils::printDouble)
				.collect(Collectors.joining(", "));
		return "[" + items + (v.length > max_items ? ", ... (" + v.length + " items)" : "") + "]";
	}

	/**
	 * Prints the (size, criterion) pairs evaluated while sizing an aggregation
	 */
	public static String printTrace(List<Pair<Integer, Double>> trace)
	{
		return trace.stream()
				.map(p -> "\tk = " + printInteger(p.getLeft()) + "\tcriterion = " + printError(p.getRight()))
				.collect(Collectors.joining("\n"));
	}
}
