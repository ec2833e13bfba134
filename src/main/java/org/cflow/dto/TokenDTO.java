package org.cflow.dto;

public class TokenDTO
{
	public String kind;
	public String text;
	public int position;
	public int line;
	public int column;
}
