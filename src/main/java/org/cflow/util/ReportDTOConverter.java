package org.cflow.util;

import org.cflow.CompilationResult;
import org.cflow.ast.AstPrinter;
import org.cflow.dto.*;
import org.cflow.flowchart.DotWriter;
import org.cflow.flowchart.FlowGraph;
import org.cflow.flowchart.GraphEdge;
import org.cflow.flowchart.GraphNode;
import org.cflow.lexer.Token;
import org.cflow.semantic.Diagnostic;

public class ReportDTOConverter
{
	public static ReportDTO toReport(String sourceName, CompilationResult result)
	{
		ReportDTO dto = new ReportDTO();
		dto.source = sourceName;
		for (Token token : result.tokens())
		{
			dto.tokens.add(tokenToDTO(token));
		}
		dto.ast = AstPrinter.print(result.program());
		for (Diagnostic diagnostic : result.diagnostics())
		{
			dto.diagnostics.add(diagnosticToDTO(diagnostic));
		}
		if (result.hasGraph())
		{
			dto.graph = graphToDTO(result.graph());
		}
		return dto;
	}

	private static TokenDTO tokenToDTO(Token token)
	{
		TokenDTO dto = new TokenDTO();
		dto.kind = token.kind().name();
		dto.text = token.text();
		dto.position = token.position();
		dto.line = token.line();
		dto.column = token.column();
		return dto;
	}

	private static DiagnosticDTO diagnosticToDTO(Diagnostic diagnostic)
	{
		DiagnosticDTO dto = new DiagnosticDTO();
		dto.severity = diagnostic.severity().name();
		dto.message = diagnostic.message();
		dto.subject = diagnostic.subject();
		dto.line = diagnostic.line();
		dto.column = diagnostic.column();
		return dto;
	}

	private static GraphDTO graphToDTO(FlowGraph graph)
	{
		GraphDTO dto = new GraphDTO();
		dto.start = graph.getStart().id();
		dto.end = graph.getEnd().id();
		for (GraphNode node : graph.getNodes())
		{
			NodeDTO nd = new NodeDTO();
			nd.id = node.id();
			nd.shape = node.shape().name();
			nd.label = node.label();
			dto.nodes.add(nd);
		}
		for (GraphEdge edge : graph.getEdges())
		{
			EdgeDTO ed = new EdgeDTO();
			ed.from = edge.from();
			ed.to = edge.to();
			ed.label = edge.label();
			dto.edges.add(ed);
		}
		dto.dot = DotWriter.write(graph);
		return dto;
	}
}
