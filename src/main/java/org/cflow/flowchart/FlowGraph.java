package org.cflow.flowchart;

import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

/**
 * Directed control-flow graph of one {@code main} body: shaped, labeled nodes and
 * optionally labeled edges. It has exactly one Start oval without inbound edges and
 * one End oval without outbound edges.
 */
public class FlowGraph
{
	private final Map<String, GraphNode> nodesById = new LinkedHashMap<>();
	private final List<GraphEdge> edges;
	private final String startId;
	private final String endId;

	public FlowGraph(List<GraphNode> nodes, List<GraphEdge> edges, String startId, String endId)
	{
		for (GraphNode node : nodes)
		{
			nodesById.put(node.id(), node);
		}
		this.edges = List.copyOf(edges);
		this.startId = startId;
		this.endId = endId;
	}

	public List<GraphNode> getNodes()
	{
		return List.copyOf(nodesById.values());
	}

	public List<GraphEdge> getEdges()
	{
		return edges;
	}

	public Optional<GraphNode> getNode(String id)
	{
		return Optional.ofNullable(nodesById.get(id));
	}

	public GraphNode getStart()
	{
		return nodesById.get(startId);
	}

	public GraphNode getEnd()
	{
		return nodesById.get(endId);
	}

	public List<GraphEdge> outgoing(String id)
	{
		return edges.stream().filter(e -> e.from().equals(id)).toList();
	}

	public List<GraphEdge> incoming(String id)
	{
		return edges.stream().filter(e -> e.to().equals(id)).toList();
	}
}
