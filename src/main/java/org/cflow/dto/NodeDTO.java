package org.cflow.dto;

public class NodeDTO
{
	public String id;
	public String shape;
	public String label;
}
