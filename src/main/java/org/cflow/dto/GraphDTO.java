package org.cflow.dto;

import java.util.ArrayList;
import java.util.List;

public class GraphDTO
{
	public String start;
	public String end;
	public List<NodeDTO> nodes = new ArrayList<>();
	public List<EdgeDTO> edges = new ArrayList<>();
	public String dot;
}
