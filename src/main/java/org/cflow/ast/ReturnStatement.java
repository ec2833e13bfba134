package org.cflow.ast;

/**
 * @param value Returned expression text; empty for a bare {@code return;}.
 */
public record ReturnStatement(SourceSpan value) implements Statement
{
	@Override
	public <R> R accept(StatementVisitor<R> visitor)
	{
		return visitor.visitReturn(this);
	}
}
