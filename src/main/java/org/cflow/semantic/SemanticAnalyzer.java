package org.cflow.semantic;

import org.cflow.ast.*;
import org.cflow.lexer.Token;
import org.cflow.lexer.TokenKind;
import org.cflow.util.Debug;
import org.cflow.util.ErrorHandler;

import java.util.ArrayList;
import java.util.HashSet;
import java.util.List;
import java.util.Set;

/**
 * Declaration/use checks over a {@code main} body, in one pre-order walk with a
 * single {@link FlatScope}.
 * <p>
 * Rules:
 * <ul>
 *     <li>declaring a name that is already in scope reports a redeclaration;</li>
 *     <li>assigning to, or mentioning in a condition, initializer or return value, a name
 *     not yet declared reports a use before declaration (once per name);</li>
 *     <li>an identifier directly followed by '(' is a call target and is not checked;</li>
 *     <li>opaque statements are not inspected.</li>
 * </ul>
 * Findings are collected; the walk never stops early and the AST is not modified.
 */
public class SemanticAnalyzer implements StatementVisitor<Void>
{
	private final ErrorHandler errorHandler;
	private FlatScope scope;
	private Set<String> reportedUndeclared;
	private List<Diagnostic> diagnostics;

	public SemanticAnalyzer(ErrorHandler errorHandler)
	{
		this.errorHandler = errorHandler;
	}

	/**
	 * Analyzes one program with a fresh scope.
	 *
	 * @return The findings of this run, in source traversal order.
	 */
	public List<Diagnostic> analyze(Program program)
	{
		scope = new FlatScope();
		reportedUndeclared = new HashSet<>();
		diagnostics = new ArrayList<>();

		program.body().accept(this);

		Debug.logDebug("Semantic analysis finished: " + scope.getSymbols().size() + " variable(s), "
				+ diagnostics.size() + " diagnostic(s).");
		return List.copyOf(diagnostics);
	}

	/**
	 * @return The scope of the last run.
	 */
	public FlatScope getScope()
	{
		return scope;
	}

	@Override
	public Void visitBlock(Block block)
	{
		for (Statement statement : block.statements())
		{
			statement.accept(this);
		}
		return null;
	}

	@Override
	public Void visitVarDecl(VarDecl varDecl)
	{
		if (scope.isDeclared(varDecl.name()))
		{
			report(Diagnostic.error("Redeclared variable '" + varDecl.name() + "'", varDecl.nameToken()));
		}
		else
		{
			scope.define(new VariableSymbol(varDecl.typeName(), varDecl.nameToken()));
		}

		// the declared name is already visible inside its own initializer
		if (varDecl.hasInitializer())
		{
			checkReferences(varDecl.initializer());
		}
		return null;
	}

	@Override
	public Void visitAssign(Assign assign)
	{
		checkUse(assign.targetToken());
		checkReferences(assign.value());
		return null;
	}

	@Override
	public Void visitIf(IfStatement ifStatement)
	{
		checkReferences(ifStatement.condition());
		ifStatement.thenBranch().accept(this);
		if (ifStatement.hasElse())
		{
			ifStatement.elseBranch().accept(this);
		}
		return null;
	}

	@Override
	public Void visitWhile(WhileStatement whileStatement)
	{
		checkReferences(whileStatement.condition());
		whileStatement.body().accept(this);
		return null;
	}

	@Override
	public Void visitFor(ForStatement forStatement)
	{
		if (forStatement.hasInit())
		{
			forStatement.init().accept(this);
		}
		checkReferences(forStatement.condition());
		if (forStatement.hasUpdate())
		{
			forStatement.update().accept(this);
		}
		forStatement.body().accept(this);
		return null;
	}

	@Override
	public Void visitDoWhile(DoWhileStatement doWhile)
	{
		doWhile.body().accept(this);
		checkReferences(doWhile.condition());
		return null;
	}

	@Override
	public Void visitReturn(ReturnStatement returnStatement)
	{
		checkReferences(returnStatement.value());
		return null;
	}

	@Override
	public Void visitOpaque(OpaqueStatement opaqueStatement)
	{
		return null;
	}

	private void checkReferences(SourceSpan span)
	{
		List<Token> tokens = span.tokens();
		for (int i = 0; i < tokens.size(); i++)
		{
			Token token = tokens.get(i);
			if (token.kind() != TokenKind.IDENTIFIER)
			{
				continue;
			}
			boolean isCallTarget = i + 1 < tokens.size() && tokens.get(i + 1).isPunctuation("(");
			if (!isCallTarget)
			{
				checkUse(token);
			}
		}
	}

	private void checkUse(Token identifier)
	{
		String name = identifier.text();
		if (!scope.isDeclared(name) && reportedUndeclared.add(name))
		{
			report(Diagnostic.error("Variable '" + name + "' used before declaration", identifier));
		}
	}

	private void report(Diagnostic diagnostic)
	{
		diagnostics.add(diagnostic);
		errorHandler.logError(diagnostic);
	}
}
