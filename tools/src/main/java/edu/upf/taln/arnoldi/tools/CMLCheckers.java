package edu.upf.taln.arnoldi.tools;

import com.beust.jcommander.IParameterValidator;
import com.beust.jcommander.IStringConverter;
import com.beust.jcommander.ParameterException;

import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Locale;

public class CMLCheckers
{
	public static class PathConverter implements IStringConverter<Path>
	{
		@Override
		public Path convert(String value)
		{
			return Paths.get(value);
		}
	}

	public static class IntegerConverter implements IStringConverter<Integer>
	{
		@Override
		public Integer convert(String value) { return Integer.parseInt(value); }
	}

	public static class DoubleConverter implements IStringConverter<Double>
	{
		@Override
		public Double convert(String value) { return Double.parseDouble(value); }
	}

	public static class AlgorithmConverter implements IStringConverter<Algorithms.Type>
	{
		@Override
		public Algorithms.Type convert(String value)
		{
			return Algorithms.Type.valueOf(value.toUpperCase(Locale.ROOT));
		}
	}

	public static class ValidPathToFile implements IParameterValidator
	{
		@Override
		public void validate(String name, String value) throws ParameterException
		{
			Path path = Paths.get(value).toAbsolutePath();
			if ((Files.exists(path) && Files.isDirectory(path)) || !Files.exists(path.getParent()))
			{
				throw new ParameterException("Cannot write to file " + name + " = " + value);
			}
		}
	}

	public static class PathToExistingFile implements IParameterValidator
	{
		@Override
		public void validate(String name, String value) throws ParameterException
		{
			Path path = Paths.get(value);
			if (!Files.exists(path) || !Files.isRegularFile(path))
			{
				throw new ParameterException("Cannot open file " + name + " = " + value);
			}
		}
	}

	public static class IntegerGreaterOrEqualThanZero implements IParameterValidator
	{

		@Override
		public void validate(String name, String value) throws ParameterException
		{
			int n = Integer.parseInt(value);
			if (n < 0)
				throw new ParameterException("Value must be greater or equal to 0: " + value);
		}
	}

	public static class IntegerGreaterThanZero implements IParameterValidator
	{

		@Override
		public void validate(String name, String value) throws ParameterException
		{
			int n = Integer.parseInt(value);
			if (n < 1)
				throw new ParameterException("Value must be greater than 0: " + value);
		}
	}

	public static class DoubleGreaterThanZero implements IParameterValidator
	{

		@Override
		public void validate(String name, String value) throws ParameterException
		{
			double n = Double.parseDouble(value);
			if (!(n > 0.0))
				throw new ParameterException("Value must be greater than 0.0: " + value);
		}
	}

	public static class CheckpointsValidator implements IParameterValidator
	{
		@Override
		public void validate(String name, String value) throws ParameterException
		{
			try { AggregationProperties.parseCheckpoints(value); }
			catch (Exception e)
			{
				throw new ParameterException("Parameter " + name + " has invalid value " + value + ": " + e.getMessage());
			}
		}
	}

	public static class AlgorithmValidator implements IParameterValidator
	{
		@Override
		public void validate(String name, String value) throws ParameterException
		{
			try { Algorithms.Type.valueOf(value.toUpperCase(Locale.ROOT)); }
			catch (Exception e)
			{
				throw new ParameterException("Parameter " + name + " has invalid value " + value);
			}
		}
	}
}
