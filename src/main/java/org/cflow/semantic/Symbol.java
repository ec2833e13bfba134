package org.cflow.semantic;

import org.cflow.lexer.Token;

public interface Symbol
{
	String getName();

	/**
	 * @return The token that introduced the symbol.
	 */
	Token getDeclaration();
}
