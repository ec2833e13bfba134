package org.cflow.ast;

import org.cflow.lexer.Token;

/**
 * {@code int x;} or {@code int x = <initializer>;}
 *
 * @param typeName    The declared type keyword.
 * @param nameToken   The declared identifier.
 * @param initializer The initializer text, null when there is none.
 */
public record VarDecl(String typeName, Token nameToken, SourceSpan initializer) implements Statement
{
	public String name()
	{
		return nameToken.text();
	}

	public boolean hasInitializer()
	{
		return initializer != null;
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor)
	{
		return visitor.visitVarDecl(this);
	}
}
