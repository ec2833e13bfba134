package org.cflow.flowchart;

/**
 * The external Graphviz renderer could not produce an image. The DOT text of the graph
 * is still valid and can be shown instead.
 */
public class RenderException extends Exception
{
	public RenderException(String message, Throwable cause)
	{
		super(message, cause);
	}
}
