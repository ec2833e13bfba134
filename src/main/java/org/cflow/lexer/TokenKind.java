package org.cflow.lexer;

public enum TokenKind
{
	KEYWORD,
	IDENTIFIER,
	NUMBER,
	STRING_LIT,
	OPERATOR,
	PUNCTUATION
}
