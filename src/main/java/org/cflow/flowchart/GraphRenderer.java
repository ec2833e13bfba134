package org.cflow.flowchart;

import org.cflow.util.Debug;
import org.cflow.util.FileUtils;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;

import static org.cflow.util.ProcessUtils.executeCommand;

/**
 * Rasterizes a flowchart by handing its DOT description to the Graphviz {@code dot}
 * executable. The DOT text is kept next to the image ({@code flowchart.png} gets a
 * {@code flowchart.dot}).
 */
public class GraphRenderer
{
	public static final String DEFAULT_COMMAND = "dot";

	private final String dotCommand;

	public GraphRenderer(String dotCommand)
	{
		this.dotCommand = dotCommand;
	}

	/**
	 * @param format Graphviz output format, e.g. {@code png} or {@code svg}.
	 * @return The path of the written DOT file.
	 */
	public Path render(String dotSource, Path output, String format) throws RenderException
	{
		Path dotFile = FileUtils.withExtension(output, ".dot");
		if (dotFile.equals(output))
		{
			dotFile = FileUtils.withExtension(output, ".gv");
		}
		try
		{
			Path parent = output.toAbsolutePath().getParent();
			if (parent != null)
			{
				Files.createDirectories(parent);
			}
			Files.writeString(dotFile, dotSource, StandardCharsets.UTF_8);
			Debug.logDebug("Wrote graph description to " + dotFile);

			ProcessBuilder pb = new ProcessBuilder(
					dotCommand,
					"-T" + format,
					dotFile.toAbsolutePath().toString(),
					"-o",
					output.toAbsolutePath().toString()
			);
			executeCommand(pb);
		}
		catch (IOException e)
		{
			throw new RenderException("Failed to render flowchart with '" + dotCommand + "': " + e.getMessage(), e);
		}
		catch (InterruptedException e)
		{
			Thread.currentThread().interrupt();
			throw new RenderException("Interrupted while rendering flowchart", e);
		}
		return dotFile;
	}
}
