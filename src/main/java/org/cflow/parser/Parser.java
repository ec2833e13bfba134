package org.cflow.parser;

import org.cflow.ast.*;
import org.cflow.lexer.Token;
import org.cflow.lexer.TokenKind;
import org.cflow.util.Debug;

import java.util.ArrayList;
import java.util.List;
import java.util.Set;

/**
 * Recursive-descent parser producing the statement-level AST of a {@code main} body.
 * <p>
 * Expressions are never decomposed: conditions, initializers and return values are
 * captured as {@link SourceSpan}s. Only missing structural delimiters are fatal; any
 * semicolon-terminated statement that is not modeled becomes an {@link OpaqueStatement}.
 * <p>
 * Input that does not start with {@code int main (} is parsed as a bare statement list.
 */
public class Parser
{
	private static final Set<String> TYPE_KEYWORDS = Set.of("int", "char", "float", "double");
	private static final String END_OF_INPUT = "end of input";

	private final List<Token> tokens;
	private int pos = 0;

	public Parser(List<Token> tokens)
	{
		this.tokens = tokens;
	}

	public Program parse() throws ParseException
	{
		Block body = startsWithMain() ? parseMainFunction() : parseFragment();
		Debug.logDebug("Parsed " + body.statements().size() + " top-level statements.");
		return new Program(body);
	}

	// --- Program structure ---

	private boolean startsWithMain()
	{
		return tokens.size() >= 3
				&& tokens.get(0).isKeyword("int")
				&& tokens.get(1).isKeyword("main")
				&& tokens.get(2).isPunctuation("(");
	}

	/**
	 * Program → 'int' 'main' '(' ')' '{' StatementList '}'
	 */
	private Block parseMainFunction() throws ParseException
	{
		expectKeyword("int");
		expectKeyword("main");
		expectPunctuation("(");
		expectPunctuation(")");
		Block body = parseBracedBlock();
		if (!reachEnd())
		{
			throw error(END_OF_INPUT);
		}
		return body;
	}

	private Block parseFragment() throws ParseException
	{
		List<Statement> statements = new ArrayList<>();
		while (!reachEnd())
		{
			statements.add(parseStatement());
		}
		return new Block(statements);
	}

	/**
	 * Block → '{' Statement* '}'
	 */
	private Block parseBracedBlock() throws ParseException
	{
		expectPunctuation("{");
		List<Statement> statements = new ArrayList<>();
		while (true)
		{
			if (reachEnd())
			{
				throw error("}");
			}
			if (current().isPunctuation("}"))
			{
				break;
			}
			statements.add(parseStatement());
		}
		expectPunctuation("}");
		return new Block(statements);
	}

	// --- Statements ---

	private Statement parseStatement() throws ParseException
	{
		if (reachEnd() || current().isPunctuation("}"))
		{
			throw error("statement");
		}

		Token token = current();
		if (token.isPunctuation("{"))
		{
			return parseBracedBlock();
		}
		if (token.kind() == TokenKind.KEYWORD)
		{
			switch (token.text())
			{
				case "if" ->
				{
					return parseIf();
				}
				case "while" ->
				{
					return parseWhile();
				}
				case "for" ->
				{
					return parseFor();
				}
				case "do" ->
				{
					return parseDoWhile();
				}
				case "return" ->
				{
					return parseReturn();
				}
				default ->
				{
					// declarations and unmodeled keywords are handled below
				}
			}
		}

		List<Token> span = collectUntilSemicolon();
		expectPunctuation(";");
		return classifySimpleStatement(span);
	}

	/**
	 * If → 'if' '(' cond ')' Statement [ 'else' Statement ]
	 */
	private IfStatement parseIf() throws ParseException
	{
		expectKeyword("if");
		SourceSpan condition = parseParenthesizedCondition();
		Block thenBranch = Block.of(parseStatement());
		Block elseBranch = null;
		if (!reachEnd() && current().isKeyword("else"))
		{
			advance();
			elseBranch = Block.of(parseStatement());
		}
		return new IfStatement(condition, thenBranch, elseBranch);
	}

	/**
	 * While → 'while' '(' cond ')' Statement
	 */
	private WhileStatement parseWhile() throws ParseException
	{
		expectKeyword("while");
		SourceSpan condition = parseParenthesizedCondition();
		return new WhileStatement(condition, Block.of(parseStatement()));
	}

	/**
	 * For → 'for' '(' init? ';' cond? ';' update? ')' Statement
	 */
	private ForStatement parseFor() throws ParseException
	{
		expectKeyword("for");
		expectPunctuation("(");

		List<Token> initTokens = collectUntilSemicolon();
		expectPunctuation(";");
		SourceSpan condition = SourceSpan.of(collectUntilSemicolon());
		expectPunctuation(";");
		List<Token> updateTokens = collectUntilClosingParenthesis();
		expectPunctuation(")");

		Block body = Block.of(parseStatement());
		Statement init = initTokens.isEmpty() ? null : classifySimpleStatement(initTokens);
		Statement update = updateTokens.isEmpty() ? null : classifySimpleStatement(updateTokens);
		return new ForStatement(init, condition, update, body);
	}

	/**
	 * DoWhile → 'do' Statement 'while' '(' cond ')' ';'
	 */
	private DoWhileStatement parseDoWhile() throws ParseException
	{
		expectKeyword("do");
		Block body = Block.of(parseStatement());
		expectKeyword("while");
		SourceSpan condition = parseParenthesizedCondition();
		expectPunctuation(";");
		return new DoWhileStatement(body, condition);
	}

	/**
	 * Return → 'return' rest? ';'
	 */
	private ReturnStatement parseReturn() throws ParseException
	{
		expectKeyword("return");
		SourceSpan value = SourceSpan.of(collectUntilSemicolon());
		expectPunctuation(";");
		return new ReturnStatement(value);
	}

	/**
	 * Classifies the tokens of a semicolon-terminated statement (without the
	 * semicolon) as a declaration, an assignment, or opaque text.
	 */
	private Statement classifySimpleStatement(List<Token> span)
	{
		int size = span.size();
		if (size >= 2 && span.get(0).kind() == TokenKind.KEYWORD && TYPE_KEYWORDS.contains(span.get(0).text())
				&& span.get(1).kind() == TokenKind.IDENTIFIER)
		{
			if (size == 2)
			{
				return new VarDecl(span.get(0).text(), span.get(1), null);
			}
			if (size > 3 && span.get(2).isOperator("="))
			{
				return new VarDecl(span.get(0).text(), span.get(1), SourceSpan.of(span.subList(3, size)));
			}
		}
		else if (size > 2 && span.get(0).kind() == TokenKind.IDENTIFIER && span.get(1).isOperator("="))
		{
			return new Assign(span.get(0), SourceSpan.of(span.subList(2, size)));
		}
		return new OpaqueStatement(SourceSpan.of(span));
	}

	// --- Text capture ---

	private SourceSpan parseParenthesizedCondition() throws ParseException
	{
		expectPunctuation("(");
		SourceSpan condition = SourceSpan.of(collectUntilClosingParenthesis());
		expectPunctuation(")");
		return condition;
	}

	/**
	 * Collects tokens up to (not including) the next ';' outside parentheses.
	 * A brace or an unbalanced ')' before it means the ';' is missing.
	 */
	private List<Token> collectUntilSemicolon() throws ParseException
	{
		List<Token> span = new ArrayList<>();
		int depth = 0;
		while (!reachEnd())
		{
			Token token = current();
			if (depth == 0 && token.isPunctuation(";"))
			{
				return span;
			}
			if (token.isPunctuation("{") || token.isPunctuation("}"))
			{
				break;
			}
			if (token.isPunctuation("("))
			{
				depth++;
			}
			else if (token.isPunctuation(")"))
			{
				if (depth == 0)
				{
					break;
				}
				depth--;
			}
			span.add(token);
			advance();
		}
		throw error(depth > 0 ? ")" : ";");
	}

	/**
	 * Collects tokens up to (not including) the ')' matching an already consumed '('.
	 */
	private List<Token> collectUntilClosingParenthesis() throws ParseException
	{
		List<Token> span = new ArrayList<>();
		int depth = 0;
		while (!reachEnd())
		{
			Token token = current();
			if (token.isPunctuation(")"))
			{
				if (depth == 0)
				{
					return span;
				}
				depth--;
			}
			else if (token.isPunctuation("("))
			{
				depth++;
			}
			else if (token.isPunctuation(";") || token.isPunctuation("{") || token.isPunctuation("}"))
			{
				break;
			}
			span.add(token);
			advance();
		}
		throw error(")");
	}

	// --- Cursor helpers ---

	private boolean reachEnd()
	{
		return pos >= tokens.size();
	}

	private Token current()
	{
		return tokens.get(pos);
	}

	private void advance()
	{
		pos++;
	}

	private void expectKeyword(String keyword) throws ParseException
	{
		if (reachEnd() || !current().isKeyword(keyword))
		{
			throw error(keyword);
		}
		advance();
	}

	private void expectPunctuation(String punctuation) throws ParseException
	{
		if (reachEnd() || !current().isPunctuation(punctuation))
		{
			throw error(punctuation);
		}
		advance();
	}

	private ParseException error(String expected)
	{
		if (!reachEnd())
		{
			Token found = current();
			return new ParseException(expected, "'" + found.text() + "'", found.position(), found.line(), found.column());
		}
		if (tokens.isEmpty())
		{
			return new ParseException(expected, END_OF_INPUT, 0, 1, 1);
		}
		Token last = tokens.get(tokens.size() - 1);
		return new ParseException(expected, END_OF_INPUT, last.end(), last.line(), last.column() + last.text().length());
	}
}
