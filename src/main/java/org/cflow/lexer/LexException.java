package org.cflow.lexer;

import org.cflow.util.CompilationException;

public class LexException extends CompilationException
{
	private final char offendingCharacter;

	public LexException(String message, char offendingCharacter, int position, int line, int column)
	{
		super(message, position, line, column);
		this.offendingCharacter = offendingCharacter;
	}

	public char getOffendingCharacter()
	{
		return offendingCharacter;
	}

	@Override
	public String getCategory()
	{
		return "Lexical Error";
	}
}
