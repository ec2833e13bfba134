package org.cflow.semantic;

import org.cflow.lexer.Token;

public class VariableSymbol implements Symbol
{
	private final String typeName;
	private final Token declaration;

	public VariableSymbol(String typeName, Token declaration)
	{
		this.typeName = typeName;
		this.declaration = declaration;
	}

	@Override
	public String getName()
	{
		return declaration.text();
	}

	@Override
	public Token getDeclaration()
	{
		return declaration;
	}

	public String getTypeName()
	{
		return typeName;
	}

	@Override
	public String toString()
	{
		return typeName + " " + getName();
	}
}
