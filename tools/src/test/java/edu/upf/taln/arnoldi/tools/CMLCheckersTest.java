package edu.upf.taln.arnoldi.tools;

import com.beust.jcommander.ParameterException;
import org.junit.After;
import org.junit.Assert;
import org.junit.Before;
import org.junit.Test;

import java.util.Locale;

public class CMLCheckersTest
{
	private Locale locale;

	@Before
	public void setUp()
	{
		locale = Locale.getDefault();
		Locale.setDefault(new Locale("tr", "TR"));
	}

	@After
	public void tearDown()
	{
		Locale.setDefault(locale);
	}

	@Test
	public void algorithmNamesIgnoreDefaultLocale()
	{
		final CMLCheckers.AlgorithmConverter converter = new CMLCheckers.AlgorithmConverter();
		Assert.assertEquals(Algorithms.Type.NAIVE, converter.convert("naive"));
		Assert.assertEquals(Algorithms.Type.STATIONARY, converter.convert("stationary"));
		Assert.assertEquals(Algorithms.Type.ADAPTIVE, converter.convert("Adaptive"));
		new CMLCheckers.AlgorithmValidator().validate("-a", "naive");
	}

	@Test(expected = ParameterException.class)
	public void unknownAlgorithmIsRejected()
	{
		new CMLCheckers.AlgorithmValidator().validate("-a", "lanczos");
	}
}
