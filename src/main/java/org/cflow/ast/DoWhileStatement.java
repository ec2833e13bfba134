package org.cflow.ast;

public record DoWhileStatement(Block body, SourceSpan condition) implements Statement
{
	@Override
	public <R> R accept(StatementVisitor<R> visitor)
	{
		return visitor.visitDoWhile(this);
	}
}
