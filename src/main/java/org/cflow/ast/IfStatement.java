package org.cflow.ast;

/**
 * @param elseBranch Null when the statement has no else clause.
 */
public record IfStatement(SourceSpan condition, Block thenBranch, Block elseBranch) implements Statement
{
	public boolean hasElse()
	{
		return elseBranch != null;
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor)
	{
		return visitor.visitIf(this);
	}
}
