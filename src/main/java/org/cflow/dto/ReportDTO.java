package org.cflow.dto;

import java.util.ArrayList;
import java.util.List;

/**
 * Root of the JSON report written by {@code --json}.
 */
public class ReportDTO
{
	public String source;
	public List<TokenDTO> tokens = new ArrayList<>();
	public String ast;
	public List<DiagnosticDTO> diagnostics = new ArrayList<>();
	public GraphDTO graph;
}
