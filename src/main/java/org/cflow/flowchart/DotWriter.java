package org.cflow.flowchart;

/**
 * Serializes a {@link FlowGraph} to the Graphviz DOT language, top-to-bottom layout.
 */
public class DotWriter
{
	private static final String GRAPH_NAME = "flowchart";

	public static String write(FlowGraph graph)
	{
		StringBuilder dot = new StringBuilder();
		dot.append("digraph ").append(GRAPH_NAME).append(" {\n");
		dot.append("\trankdir=TB;\n");

		for (GraphNode node : graph.getNodes())
		{
			dot.append('\t').append(node.id()).append(" [label=\"").append(escape(node.label()))
					.append("\", shape=").append(node.shape().getDotShape());
			if (node.shape() == NodeShape.INVISIBLE)
			{
				dot.append(", width=0.01, style=invis");
			}
			dot.append("];\n");
		}

		for (GraphEdge edge : graph.getEdges())
		{
			dot.append('\t').append(edge.from()).append(" -> ").append(edge.to());
			if (edge.hasLabel())
			{
				dot.append(" [label=\"").append(escape(edge.label())).append("\"]");
			}
			dot.append(";\n");
		}

		dot.append("}\n");
		return dot.toString();
	}

	static String escape(String label)
	{
		StringBuilder escaped = new StringBuilder(label.length());
		for (char c : label.toCharArray())
		{
			switch (c)
			{
				case '\\' -> escaped.append("\\\\");
				case '"' -> escaped.append("\\\"");
				case '\n' -> escaped.append("\\n");
				default -> escaped.append(c);
			}
		}
		return escaped.toString();
	}
}
