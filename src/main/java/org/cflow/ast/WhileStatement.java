package org.cflow.ast;

public record WhileStatement(SourceSpan condition, Block body) implements Statement
{
	@Override
	public <R> R accept(StatementVisitor<R> visitor)
	{
		return visitor.visitWhile(this);
	}
}
