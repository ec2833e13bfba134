package org.cflow.ast;

/**
 * A C-style for loop. The init and update clauses are simple statements
 * ({@link VarDecl}, {@link Assign} or {@link OpaqueStatement}); either may be null
 * when omitted in the source. An omitted condition is an empty span.
 */
public record ForStatement(
		Statement init,
		SourceSpan condition,
		Statement update,
		Block body
) implements Statement
{
	public boolean hasInit()
	{
		return init != null;
	}

	public boolean hasUpdate()
	{
		return update != null;
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor)
	{
		return visitor.visitFor(this);
	}
}
