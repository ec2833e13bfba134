package org.cflow.util;

/**
 * Base class of the fatal front-end errors. Either one aborts the request it was
 * raised in; no AST exists afterwards.
 */
public abstract class CompilationException extends Exception
{
	private final int position;
	private final int line;
	private final int column;

	protected CompilationException(String message, int position, int line, int column)
	{
		super(message);
		this.position = position;
		this.line = line;
		this.column = column;
	}

	/**
	 * @return Zero-based character offset into the source text.
	 */
	public int getPosition()
	{
		return position;
	}

	public int getLine()
	{
		return line;
	}

	public int getColumn()
	{
		return column;
	}

	/**
	 * @return The category tag used when the error is printed, e.g. "Syntax Error".
	 */
	public abstract String getCategory();

	public String format()
	{
		return String.format("[%s] line %d:%d - %s", getCategory(), line, column, getMessage());
	}
}
