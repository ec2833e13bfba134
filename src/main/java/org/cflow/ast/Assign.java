package org.cflow.ast;

import org.cflow.lexer.Token;

public record Assign(Token targetToken, SourceSpan value) implements Statement
{
	public String target()
	{
		return targetToken.text();
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor)
	{
		return visitor.visitAssign(this);
	}
}
