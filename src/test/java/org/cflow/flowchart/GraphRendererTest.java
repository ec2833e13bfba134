package org.cflow.flowchart;

import org.junit.jupiter.api.Test;
import org.junit.jupiter.api.io.TempDir;

import java.nio.file.Files;
import java.nio.file.Path;

import static org.junit.jupiter.api.Assertions.*;

class GraphRendererTest
{
	private static final String DOT = "digraph flowchart {\n}\n";

	@TempDir
	Path tempDir;

	@Test
	void missingGraphvizBinaryRaisesRenderException()
	{
		GraphRenderer renderer = new GraphRenderer(tempDir.resolve("no-such-dot").toString());
		Path output = tempDir.resolve("out").resolve("chart.png");

		RenderException e = assertThrows(RenderException.class, () -> renderer.render(DOT, output, "png"));

		assertTrue(e.getMessage().contains("no-such-dot"));
		assertFalse(Files.exists(output));
	}

	@Test
	void dotSourceIsWrittenBeforeRendering() throws Exception
	{
		GraphRenderer renderer = new GraphRenderer(tempDir.resolve("no-such-dot").toString());
		Path output = tempDir.resolve("chart.svg");

		assertThrows(RenderException.class, () -> renderer.render(DOT, output, "svg"));

		assertEquals(DOT, Files.readString(tempDir.resolve("chart.dot")));
	}

	@Test
	void dotOutputDoesNotOverwriteItsOwnSource()
	{
		GraphRenderer renderer = new GraphRenderer(tempDir.resolve("no-such-dot").toString());
		Path output = tempDir.resolve("chart.dot");

		assertThrows(RenderException.class, () -> renderer.render(DOT, output, "dot"));

		assertTrue(Files.exists(tempDir.resolve("chart.gv")));
	}
}
