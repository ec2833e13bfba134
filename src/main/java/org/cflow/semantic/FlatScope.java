package org.cflow.semantic;

import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

/**
 * The single namespace of a {@code main} body.
 * <p>
 * There is no block scoping and no shadowing: a variable declared inside an if-branch
 * or loop body stays visible for the rest of the body.
 */
public class FlatScope
{
	private final Map<String, Symbol> symbols = new LinkedHashMap<>();

	public void define(Symbol sym)
	{
		symbols.put(sym.getName(), sym);
	}

	public Optional<Symbol> resolve(String name)
	{
		return Optional.ofNullable(symbols.get(name));
	}

	public boolean isDeclared(String name)
	{
		return symbols.containsKey(name);
	}

	public Map<String, Symbol> getSymbols()
	{
		return symbols;
	}
}
