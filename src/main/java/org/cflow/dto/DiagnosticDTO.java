package org.cflow.dto;

public class DiagnosticDTO
{
	public String severity;
	public String message;
	public String subject;
	public int line;
	public int column;
}
