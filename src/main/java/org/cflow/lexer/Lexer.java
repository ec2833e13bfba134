package org.cflow.lexer;

import org.cflow.util.Debug;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Hand-written scanner for the C-style subset accepted by the flowchart compiler.
 * <p>
 * The scan runs left to right over the source with one character of lookahead.
 * Whitespace and comments are skipped; the first character that belongs to no
 * token class aborts the pass with a {@link LexException}.
 */
public class Lexer
{
	private static final Set<String> KEYWORDS = Set.of(
			"int", "main", "if", "else", "while", "for", "do", "return",
			"void", "char", "float", "double", "break", "continue"
	);

	// Tried before SINGLE_CHAR_OPERATORS, otherwise "==" would lex as two "=".
	private static final Set<String> TWO_CHAR_OPERATORS = Set.of(
			"==", "!=", "<=", ">=", "<<", ">>", "&&", "||",
			"++", "--", "+=", "-=", "*=", "/=", "%="
	);

	private static final String SINGLE_CHAR_OPERATORS = "+-*/%=<>!&|^~";
	private static final String PUNCTUATION = "{}();,";

	private final String source;
	private int curPos = 0;
	private int line = 1;
	private int lineStart = 0;

	public Lexer(String source)
	{
		this.source = source;
	}

	public List<Token> tokenize() throws LexException
	{
		List<Token> tokens = new ArrayList<>();
		skipWhitespaceAndComments();
		while (!reachEnd())
		{
			tokens.add(nextToken());
			skipWhitespaceAndComments();
		}
		Debug.logDebug("Tokenized " + tokens.size() + " tokens.");
		return tokens;
	}

	private Token nextToken() throws LexException
	{
		int start = curPos;
		int column = start - lineStart + 1;
		char c = nowChar();

		if (isDigit(c))
		{
			while (!reachEnd() && isDigit(nowChar()))
			{
				curPos++;
			}
			return new Token(TokenKind.NUMBER, source.substring(start, curPos), start, line, column);
		}

		if (isIdentifierHead(c))
		{
			while (!reachEnd() && (isIdentifierHead(nowChar()) || isDigit(nowChar())))
			{
				curPos++;
			}
			String text = source.substring(start, curPos);
			TokenKind kind = KEYWORDS.contains(text) ? TokenKind.KEYWORD : TokenKind.IDENTIFIER;
			return new Token(kind, text, start, line, column);
		}

		if (c == '"')
		{
			curPos++;
			while (!reachEnd() && nowChar() != '"' && nowChar() != '\n')
			{
				curPos++;
			}
			if (reachEnd() || nowChar() != '"')
			{
				throw new LexException("Unterminated string literal", c, start, line, column);
			}
			curPos++;
			return new Token(TokenKind.STRING_LIT, source.substring(start, curPos), start, line, column);
		}

		if (curPos + 1 < source.length())
		{
			String pair = source.substring(curPos, curPos + 2);
			if (TWO_CHAR_OPERATORS.contains(pair))
			{
				curPos += 2;
				return new Token(TokenKind.OPERATOR, pair, start, line, column);
			}
		}

		if (SINGLE_CHAR_OPERATORS.indexOf(c) >= 0)
		{
			curPos++;
			return new Token(TokenKind.OPERATOR, String.valueOf(c), start, line, column);
		}

		if (PUNCTUATION.indexOf(c) >= 0)
		{
			curPos++;
			return new Token(TokenKind.PUNCTUATION, String.valueOf(c), start, line, column);
		}

		throw new LexException("Unexpected character '" + c + "' at position " + start, c, start, line, column);
	}

	private void skipWhitespaceAndComments() throws LexException
	{
		while (!reachEnd())
		{
			char c = nowChar();
			if (c == '\n')
			{
				curPos++;
				line++;
				lineStart = curPos;
			}
			else if (Character.isWhitespace(c))
			{
				curPos++;
			}
			else if (c == '/' && peekChar() == '/')
			{
				while (!reachEnd() && nowChar() != '\n')
				{
					curPos++;
				}
			}
			else if (c == '/' && peekChar() == '*')
			{
				skipBlockComment();
			}
			else
			{
				return;
			}
		}
	}

	private void skipBlockComment() throws LexException
	{
		int start = curPos;
		int startLine = line;
		int startColumn = start - lineStart + 1;
		curPos += 2;
		while (curPos + 1 < source.length())
		{
			if (nowChar() == '*' && peekChar() == '/')
			{
				curPos += 2;
				return;
			}
			if (nowChar() == '\n')
			{
				line++;
				lineStart = curPos + 1;
			}
			curPos++;
		}
		throw new LexException("Unterminated block comment", '/', start, startLine, startColumn);
	}

	private boolean isIdentifierHead(char c)
	{
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
	}

	private boolean isDigit(char c)
	{
		return c >= '0' && c <= '9';
	}

	private boolean reachEnd()
	{
		return curPos >= source.length();
	}

	private char nowChar()
	{
		return source.charAt(curPos);
	}

	private char peekChar()
	{
		return curPos + 1 < source.length() ? source.charAt(curPos + 1) : '\0';
	}
}
