package org.cflow.ast;

import java.util.List;

/**
 * An ordered statement list: the main body, a braced block, or the single statement
 * of an unbraced if/else/loop body.
 */
public record Block(List<Statement> statements) implements Statement
{
	public Block
	{
		statements = List.copyOf(statements);
	}

	public static Block of(Statement statement)
	{
		if (statement instanceof Block block)
		{
			return block;
		}
		return new Block(List.of(statement));
	}

	public boolean isEmpty()
	{
		return statements.isEmpty();
	}

	@Override
	public <R> R accept(StatementVisitor<R> visitor)
	{
		return visitor.visitBlock(this);
	}
}
