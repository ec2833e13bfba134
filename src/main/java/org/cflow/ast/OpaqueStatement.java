package org.cflow.ast;

/**
 * Any semicolon-terminated statement the parser does not model, e.g. {@code cin >> x;}.
 * The text excludes the terminating semicolon.
 */
public record OpaqueStatement(SourceSpan text) implements Statement
{
	@Override
	public <R> R accept(StatementVisitor<R> visitor)
	{
		return visitor.visitOpaque(this);
	}
}
