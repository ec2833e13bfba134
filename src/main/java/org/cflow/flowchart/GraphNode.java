package org.cflow.flowchart;

/**
 * @param id Unique within one graph, e.g. {@code node3}.
 */
public record GraphNode(String id, NodeShape shape, String label)
{
}
