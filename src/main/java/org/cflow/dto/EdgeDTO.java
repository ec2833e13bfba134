package org.cflow.dto;

public class EdgeDTO
{
	public String from;
	public String to;
	public String label;
}
