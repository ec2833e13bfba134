package org.cflow.ast;

import org.cflow.lexer.Token;

import java.util.List;

/**
 * Verbatim source text captured between two delimiters, e.g. an if-condition or the
 * right-hand side of an assignment. The text is never parsed into an expression tree;
 * the tokens are kept so later passes can look for identifier references.
 * <p>
 * Runs of whitespace (including newlines) between tokens collapse into one space.
 */
public record SourceSpan(String text, List<Token> tokens)
{
	public static final SourceSpan EMPTY = new SourceSpan("", List.of());

	public SourceSpan
	{
		tokens = List.copyOf(tokens);
	}

	public static SourceSpan of(List<Token> tokens)
	{
		if (tokens.isEmpty())
		{
			return EMPTY;
		}
		StringBuilder text = new StringBuilder();
		Token previous = null;
		for (Token token : tokens)
		{
			if (previous != null && token.position() > previous.end())
			{
				text.append(' ');
			}
			text.append(token.text());
			previous = token;
		}
		return new SourceSpan(text.toString(), tokens);
	}

	public boolean isEmpty()
	{
		return tokens.isEmpty();
	}

	@Override
	public String toString()
	{
		return text;
	}
}
