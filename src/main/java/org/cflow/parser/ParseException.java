package org.cflow.parser;

import org.cflow.util.CompilationException;

public class ParseException extends CompilationException
{
	private final String expected;
	private final String found;

	public ParseException(String expected, String found, int position, int line, int column)
	{
		super("Expected '" + expected + "' but found " + found, position, line, column);
		this.expected = expected;
		this.found = found;
	}

	public String getExpected()
	{
		return expected;
	}

	/**
	 * @return The quoted offending token text, or {@code end of input}.
	 */
	public String getFound()
	{
		return found;
	}

	@Override
	public String getCategory()
	{
		return "Syntax Error";
	}
}
