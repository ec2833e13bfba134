package org.cflow.lexer;

/**
 * A single lexical unit.
 *
 * @param kind     Token category.
 * @param text     Exact source text of the token (string literals keep their quotes).
 * @param position Zero-based character offset of the first character.
 * @param line     1-based source line.
 * @param column   1-based source column.
 */
public record Token(
		TokenKind kind,
		String text,
		int position,
		int line,
		int column
)
{
	/**
	 * @return Offset one past the last character of this token.
	 */
	public int end()
	{
		return position + text.length();
	}

	public boolean is(TokenKind expectedKind, String expectedText)
	{
		return kind == expectedKind && text.equals(expectedText);
	}

	public boolean isKeyword(String keyword)
	{
		return is(TokenKind.KEYWORD, keyword);
	}

	public boolean isPunctuation(String punctuation)
	{
		return is(TokenKind.PUNCTUATION, punctuation);
	}

	public boolean isOperator(String operator)
	{
		return is(TokenKind.OPERATOR, operator);
	}

	@Override
	public String toString()
	{
		return kind + ":" + text;
	}
}
