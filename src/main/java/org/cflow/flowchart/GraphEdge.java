package org.cflow.flowchart;

/**
 * @param label "true"/"false" on decision exits, null otherwise.
 */
public record GraphEdge(String from, String to, String label)
{
	public boolean hasLabel()
	{
		return label != null;
	}
}
