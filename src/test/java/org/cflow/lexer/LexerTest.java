package org.cflow.lexer;

import org.junit.jupiter.api.Test;

import java.util.List;

import static org.junit.jupiter.api.Assertions.*;

class LexerTest
{
	private static List<Token> lex(String source) throws LexException
	{
		return new Lexer(source).tokenize();
	}

	@Test
	void twoCharacterOperatorWinsOverSingleCharacter() throws LexException
	{
		List<Token> tokens = lex("a == b");

		assertEquals(3, tokens.size());
		assertEquals(new Token(TokenKind.OPERATOR, "==", 2, 1, 3), tokens.get(1));
	}

	@Test
	void allCompoundOperatorsAreSingleTokens() throws LexException
	{
		List<Token> tokens = lex("!= <= >= << >> && || ++ -- += -=");

		assertEquals(11, tokens.size());
		assertTrue(tokens.stream().allMatch(t -> t.kind() == TokenKind.OPERATOR && t.text().length() == 2));
	}

	@Test
	void adjacentOperatorsSplitLongestFirst() throws LexException
	{
		List<Token> tokens = lex("x<=-1");

		assertEquals(List.of("x", "<=", "-", "1"), tokens.stream().map(Token::text).toList());
	}

	@Test
	void keywordsAreSeparatedFromIdentifiers() throws LexException
	{
		List<Token> tokens = lex("int main integer returned return");

		assertEquals(TokenKind.KEYWORD, tokens.get(0).kind());
		assertEquals(TokenKind.KEYWORD, tokens.get(1).kind());
		assertEquals(TokenKind.IDENTIFIER, tokens.get(2).kind());
		assertEquals(TokenKind.IDENTIFIER, tokens.get(3).kind());
		assertEquals(TokenKind.KEYWORD, tokens.get(4).kind());
	}

	@Test
	void numbersStringsAndPunctuation() throws LexException
	{
		List<Token> tokens = lex("f(42, \"a b\");");

		assertEquals(TokenKind.IDENTIFIER, tokens.get(0).kind());
		assertEquals(TokenKind.PUNCTUATION, tokens.get(1).kind());
		assertEquals(new Token(TokenKind.NUMBER, "42", 2, 1, 3), tokens.get(2));
		assertEquals(TokenKind.PUNCTUATION, tokens.get(3).kind());
		assertEquals(new Token(TokenKind.STRING_LIT, "\"a b\"", 6, 1, 7), tokens.get(4));
		assertTrue(tokens.get(5).isPunctuation(")"));
		assertTrue(tokens.get(6).isPunctuation(";"));
	}

	@Test
	void whitespaceAndCommentsAreSkipped() throws LexException
	{
		List<Token> tokens = lex("x // trailing comment\n/* block\ncomment */ y");

		assertEquals(2, tokens.size());
		Token y = tokens.get(1);
		assertEquals("y", y.text());
		assertEquals(3, y.line());
		assertEquals(12, y.column());
	}

	@Test
	void tracksLinesAndColumns() throws LexException
	{
		List<Token> tokens = lex("int x;\n  y = 1;");

		Token y = tokens.get(3);
		assertEquals("y", y.text());
		assertEquals(9, y.position());
		assertEquals(2, y.line());
		assertEquals(3, y.column());
	}

	@Test
	void unknownCharacterAbortsWithPosition()
	{
		LexException e = assertThrows(LexException.class, () -> lex("int x;\nx = 1 @ 2;"));

		assertEquals('@', e.getOffendingCharacter());
		assertEquals(13, e.getPosition());
		assertEquals(2, e.getLine());
		assertEquals(7, e.getColumn());
	}

	@Test
	void unterminatedStringIsAnError()
	{
		LexException e = assertThrows(LexException.class, () -> lex("s = \"abc;"));

		assertEquals('"', e.getOffendingCharacter());
		assertEquals(4, e.getPosition());
	}

	@Test
	void unterminatedBlockCommentIsAnError()
	{
		assertThrows(LexException.class, () -> lex("x = 1; /* never closed"));
	}

	@Test
	void emptySourceHasNoTokens() throws LexException
	{
		assertTrue(lex("  \n\t ").isEmpty());
	}
}
