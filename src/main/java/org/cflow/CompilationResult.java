package org.cflow;

import org.cflow.ast.Program;
import org.cflow.flowchart.FlowGraph;
import org.cflow.lexer.Token;
import org.cflow.semantic.Diagnostic;

import java.util.List;

/**
 * Everything one pipeline run produced.
 *
 * @param graph Null when the run stopped after semantic analysis.
 */
public record CompilationResult(
		List<Token> tokens,
		Program program,
		List<Diagnostic> diagnostics,
		FlowGraph graph
)
{
	public boolean hasDiagnostics()
	{
		return !diagnostics.isEmpty();
	}

	public boolean hasGraph()
	{
		return graph != null;
	}
}
