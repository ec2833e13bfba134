package org.cflow;

import org.cflow.ast.Program;
import org.cflow.flowchart.FlowGraph;
import org.cflow.flowchart.FlowchartBuilder;
import org.cflow.lexer.LexException;
import org.cflow.lexer.Lexer;
import org.cflow.lexer.Token;
import org.cflow.parser.ParseException;
import org.cflow.parser.Parser;
import org.cflow.semantic.Diagnostic;
import org.cflow.semantic.SemanticAnalyzer;
import org.cflow.util.Debug;
import org.cflow.util.ErrorHandler;

import java.util.List;

/**
 * Runs tokenize → parse → analyze → flowchart over one source text.
 * <p>
 * Lexical and syntax errors propagate and stop the run. Semantic diagnostics do not:
 * the flowchart is built from the same AST whether or not analysis found anything.
 * Every call builds fresh stage objects; only the diagnostics collected by the
 * {@link ErrorHandler} carry over from one call to the next.
 */
public class FlowchartCompiler
{
	private final ErrorHandler errorHandler;

	public FlowchartCompiler(ErrorHandler errorHandler)
	{
		this.errorHandler = errorHandler;
	}

	public CompilationResult compile(String source) throws LexException, ParseException
	{
		return run(source, true);
	}

	/**
	 * Same as {@link #compile(String)} without building the flowchart.
	 */
	public CompilationResult check(String source) throws LexException, ParseException
	{
		return run(source, false);
	}

	private CompilationResult run(String source, boolean buildGraph) throws LexException, ParseException
	{
		Debug.logDebug("Tokenizing " + source.length() + " characters...");
		List<Token> tokens = new Lexer(source).tokenize();

		Debug.logDebug("Parsing...");
		Program program = new Parser(tokens).parse();

		Debug.logDebug("Starting semantic analysis...");
		List<Diagnostic> diagnostics = new SemanticAnalyzer(errorHandler).analyze(program);

		FlowGraph graph = null;
		if (buildGraph)
		{
			Debug.logDebug("Generating flowchart...");
			graph = new FlowchartBuilder().generate(program);
		}
		return new CompilationResult(tokens, program, diagnostics, graph);
	}
}
