package org.cflow.util;

import org.cflow.semantic.Diagnostic;

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

public class ErrorHandler
{
	private final List<Diagnostic> diagnostics = new ArrayList<>();

	public void logError(Diagnostic diagnostic)
	{
		diagnostics.add(diagnostic);
		Debug.logError(diagnostic.format());
	}

	public boolean hasErrors()
	{
		return !diagnostics.isEmpty();
	}

	public List<Diagnostic> getDiagnostics()
	{
		return Collections.unmodifiableList(diagnostics);
	}
}
