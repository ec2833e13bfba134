package org.cflow.flowchart;

public enum NodeShape
{
	OVAL("oval"),
	BOX("box"),
	DIAMOND("diamond"),
	INVISIBLE("point");

	private final String dotShape;

	NodeShape(String dotShape)
	{
		this.dotShape = dotShape;
	}

	/**
	 * @return The Graphviz {@code shape} attribute value.
	 */
	public String getDotShape()
	{
		return dotShape;
	}
}
