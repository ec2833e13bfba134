package org.cflow.semantic;

import org.cflow.lexer.Token;

/**
 * A non-fatal semantic finding.
 *
 * @param subject The identifier the finding is about.
 */
public record Diagnostic(
		Severity severity,
		String message,
		String subject,
		int position,
		int line,
		int column
)
{
	public static Diagnostic error(String message, Token subject)
	{
		return new Diagnostic(Severity.ERROR, message, subject.text(), subject.position(), subject.line(), subject.column());
	}

	public String format()
	{
		return String.format("[Semantic Error] line %d:%d - %s", line, column, message);
	}

	@Override
	public String toString()
	{
		return format();
	}
}
