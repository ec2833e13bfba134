package org.cflow.ast;

import java.util.Objects;

/**
 * Root of the AST. Holds exactly one child: the body of {@code main}.
 */
public record Program(Block body)
{
	public Program
	{
		Objects.requireNonNull(body, "body");
	}
}
