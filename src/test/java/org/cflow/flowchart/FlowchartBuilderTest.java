package org.cflow.flowchart;

import org.cflow.ast.Program;
import org.cflow.lexer.Lexer;
import org.cflow.parser.Parser;
import org.junit.jupiter.api.Test;
import org.junit.jupiter.params.ParameterizedTest;
import org.junit.jupiter.params.provider.ValueSource;

import java.util.Comparator;
import java.util.List;

import static org.cflow.flowchart.GraphAssertions.*;
import static org.junit.jupiter.api.Assertions.*;

class FlowchartBuilderTest
{
	private static Program parse(String source) throws Exception
	{
		return new Parser(new Lexer(source).tokenize()).parse();
	}

	private static FlowGraph generate(String source) throws Exception
	{
		return new FlowchartBuilder().generate(parse(source));
	}

	@Test
	void ifWithReturnInThenBranch() throws Exception
	{
		FlowGraph graph = generate("int main(){ int x; x = 5; if(x==5){ return x; } }");

		GraphNode decl = node(graph, NodeShape.BOX, "int x");
		GraphNode assign = node(graph, NodeShape.BOX, "x = 5");
		GraphNode decision = node(graph, NodeShape.DIAMOND, "x==5");
		GraphNode ret = node(graph, NodeShape.BOX, "return x");

		assertEdge(graph, graph.getStart(), decl, null);
		assertEdge(graph, decl, assign, null);
		assertEdge(graph, assign, decision, null);
		assertEdge(graph, decision, ret, "true");
		assertEdge(graph, ret, graph.getEnd(), null);

		GraphNode merge = target(graph, decision, "false");
		assertEquals(NodeShape.INVISIBLE, merge.shape());
		assertEdge(graph, merge, graph.getEnd(), null);

		assertEquals(7, graph.getNodes().size());
		assertEquals(7, graph.getEdges().size());
		assertWellFormed(graph);
	}

	@Test
	void emptyProgramConnectsStartToEnd() throws Exception
	{
		FlowGraph graph = generate("int main() { }");

		assertEquals(2, graph.getNodes().size());
		assertEdge(graph, graph.getStart(), graph.getEnd(), null);
		assertWellFormed(graph);
	}

	@Test
	void ifElseMergesBothBranches() throws Exception
	{
		FlowGraph graph = generate("int main(){ int x; if (x > 0) x = 1; else x = 2; return x; }");

		GraphNode decision = node(graph, NodeShape.DIAMOND, "x > 0");
		GraphNode thenBox = node(graph, NodeShape.BOX, "x = 1");
		GraphNode elseBox = node(graph, NodeShape.BOX, "x = 2");
		assertEdge(graph, decision, thenBox, "true");
		assertEdge(graph, decision, elseBox, "false");

		GraphNode merge = graph.getNode(graph.outgoing(thenBox.id()).get(0).to()).orElseThrow();
		assertEquals(NodeShape.INVISIBLE, merge.shape());
		assertEdge(graph, elseBox, merge, null);
		assertEdge(graph, merge, node(graph, NodeShape.BOX, "return x"), null);
		assertWellFormed(graph);
	}

	@Test
	void ifWhoseBranchesAllReturnHasNoMerge() throws Exception
	{
		FlowGraph graph = generate("int main(){ int x; if (x) { return 1; } else { return 2; } x = 3; }");

		assertTrue(graph.getNodes().stream().noneMatch(n -> n.shape() == NodeShape.INVISIBLE));
		assertTrue(graph.getNodes().stream().noneMatch(n -> n.label().equals("x = 3")));
		assertEquals(6, graph.getNodes().size());
		assertEquals(2, graph.incoming(graph.getEnd().id()).size());
		assertWellFormed(graph);
	}

	@Test
	void statementsAfterReturnAreLeftOut() throws Exception
	{
		FlowGraph graph = generate("int main(){ return 0; cout << \"never\"; }");

		assertEquals(3, graph.getNodes().size());
		assertWellFormed(graph);
	}

	@Test
	void whileLoopsBackToCondition() throws Exception
	{
		FlowGraph graph = generate("int main(){ int i = 0; while (i < 3) { i = i + 1; } return i; }");

		GraphNode decision = node(graph, NodeShape.DIAMOND, "i < 3");
		GraphNode body = node(graph, NodeShape.BOX, "i = i + 1");
		assertEdge(graph, node(graph, NodeShape.BOX, "int i = 0"), decision, null);
		assertEdge(graph, decision, body, "true");
		assertEdge(graph, body, decision, null);

		GraphNode merge = target(graph, decision, "false");
		assertEquals(NodeShape.INVISIBLE, merge.shape());
		assertEdge(graph, merge, node(graph, NodeShape.BOX, "return i"), null);
		assertWellFormed(graph);
	}

	@Test
	void emptyWhileBodyLoopsOnCondition() throws Exception
	{
		FlowGraph graph = generate("int main(){ int x; while (x) { } }");

		GraphNode decision = node(graph, NodeShape.DIAMOND, "x");
		assertEdge(graph, decision, decision, "true");
		assertWellFormed(graph);
	}

	@Test
	void forLoopRendersInitAndUpdate() throws Exception
	{
		FlowGraph graph = generate("int main(){ int s = 0; for (int i = 0; i < 10; i = i + 1) { s = s + i; } return s; }");

		GraphNode init = node(graph, NodeShape.BOX, "int i = 0");
		GraphNode decision = node(graph, NodeShape.DIAMOND, "i < 10");
		GraphNode body = node(graph, NodeShape.BOX, "s = s + i");
		GraphNode update = node(graph, NodeShape.BOX, "i = i + 1");

		assertEdge(graph, node(graph, NodeShape.BOX, "int s = 0"), init, null);
		assertEdge(graph, init, decision, null);
		assertEdge(graph, decision, body, "true");
		assertEdge(graph, body, update, null);
		assertEdge(graph, update, decision, null);
		assertEdge(graph, target(graph, decision, "false"), node(graph, NodeShape.BOX, "return s"), null);
		assertWellFormed(graph);
	}

	@Test
	void forWithoutConditionIsAlwaysTrue() throws Exception
	{
		FlowGraph graph = generate("int main(){ for (;;) { } }");

		GraphNode decision = node(graph, NodeShape.DIAMOND, "true");
		assertEdge(graph, decision, decision, "true");
		assertWellFormed(graph);
	}

	@Test
	void doWhileLoopsBackToBodyEntry() throws Exception
	{
		FlowGraph graph = generate("int main(){ int n = 0; do { n = n + 1; cout << n; } while (n < 5); }");

		GraphNode first = node(graph, NodeShape.BOX, "n = n + 1");
		GraphNode last = node(graph, NodeShape.BOX, "cout << n");
		GraphNode decision = node(graph, NodeShape.DIAMOND, "n < 5");

		assertEdge(graph, node(graph, NodeShape.BOX, "int n = 0"), first, null);
		assertEdge(graph, last, decision, null);
		assertEdge(graph, decision, first, "true");
		assertEdge(graph, target(graph, decision, "false"), graph.getEnd(), null);
		assertWellFormed(graph);
	}

	@Test
	void doWhileWithReturningBodyHasNoCondition() throws Exception
	{
		FlowGraph graph = generate("int main(){ do { return 1; } while (x); }");

		assertTrue(graph.getNodes().stream().noneMatch(n -> n.shape() == NodeShape.DIAMOND));
		assertWellFormed(graph);
	}

	@Test
	void returnInsideLoopSkipsLoopBack() throws Exception
	{
		FlowGraph graph = generate("int main(){ int i; while (i) { return i; } }");

		GraphNode decision = node(graph, NodeShape.DIAMOND, "i");
		GraphNode ret = node(graph, NodeShape.BOX, "return i");
		assertEquals(List.of(graph.getEnd().id()), graph.outgoing(ret.id()).stream().map(GraphEdge::to).toList());
		assertEdge(graph, decision, ret, "true");
		assertWellFormed(graph);
	}

	@ParameterizedTest
	@ValueSource(strings = {
			"int main() {\n int x;\n cin >> x;\n if (x >= 10) {\n if ((x / 2) * 2 == x)\n cout << \"A\";\n else\n cout << \"B\";\n } else {\n cout << \"C\";\n }\n return 0;\n}",
			"int main(){ int i; for (i = 0; i < 3; i = i + 1) { if (i == 1) { return i; } else { } } }",
			"int main(){ int a; while (a) { do { if (a) return 1; } while (a); a = a - 1; } }",
			"int main(){ { } if (1) { } else { } while (0) ; }",
			"int main(){ int k; for (k = 0; k < 2; k = k + 1) { for (;;) { return k; } } return 9; }",
			"int x; if (x) { if (x) { return 1; } else { return 2; } } else { x = 1; }"
	})
	void everyGraphIsWellFormed(String source) throws Exception
	{
		assertWellFormed(generate(source));
	}

	@Test
	void generatingTwiceGivesTheSameGraph() throws Exception
	{
		Program program = parse("int main(){ int x; while (x < 3) { if (x) x = 1; } return x; }");
		FlowchartBuilder builder = new FlowchartBuilder();

		FlowGraph first = builder.generate(program);
		FlowGraph second = builder.generate(program);

		assertEquals(first.getNodes(), second.getNodes());
		assertEquals(first.getEdges(), second.getEdges());
		assertEquals(sortedLabels(first), sortedLabels(new FlowchartBuilder().generate(program)));
	}

	private static List<String> sortedLabels(FlowGraph graph)
	{
		return graph.getNodes().stream()
				.map(n -> n.shape() + ":" + n.label())
				.sorted(Comparator.naturalOrder())
				.toList();
	}
}
