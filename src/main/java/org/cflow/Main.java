package org.cflow;

import com.google.gson.Gson;
import com.google.gson.GsonBuilder;
import org.cflow.ast.AstPrinter;
import org.cflow.dto.ReportDTO;
import org.cflow.flowchart.DotWriter;
import org.cflow.flowchart.GraphRenderer;
import org.cflow.flowchart.RenderException;
import org.cflow.lexer.Token;
import org.cflow.util.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.StandardOpenOption;
import java.util.stream.Collectors;

/**
 * Command-line host of the flowchart compiler: reads one source file, prints the
 * requested views and renders the flowchart.
 */
public class Main
{
	public static final String VERSION = "0.1.0";

	public static final int EXIT_OK = 0;
	public static final int EXIT_FAILURE = 1;
	public static final int EXIT_SEMANTIC_ERRORS = 2;

	public static void main(String[] args)
	{
		System.exit(run(args));
	}

	public static int run(String[] args)
	{
		try
		{
			CompilerArguments arguments = CompilerArguments.parse(args);

			if (!arguments.isValid())
			{
				CompilerArguments.printUsage();
				return EXIT_FAILURE;
			}
			if (arguments.isHelpFlag())
			{
				CompilerArguments.printUsage();
				return EXIT_OK;
			}
			if (arguments.isVersionFlag())
			{
				Debug.log("cflow version " + VERSION);
				return EXIT_OK;
			}

			if (arguments.getInputFile() == null)
			{
				throw new IllegalArgumentException("No input file provided. Use -h for help.");
			}
			if (!Files.exists(arguments.getInputFile()))
			{
				Debug.logError("Input file not found: " + arguments.getInputFile());
				return EXIT_FAILURE;
			}

			return compileFile(arguments);
		}
		catch (IllegalArgumentException e)
		{
			Debug.logError("Initialization failed: " + e.getMessage());
		}
		catch (IOException e)
		{
			Debug.logError("I/O error: " + e.getMessage());
		}
		catch (Exception e)
		{
			Debug.logError("An unexpected error occurred: " + e.getMessage());
			e.printStackTrace();
		}
		return EXIT_FAILURE;
	}

	private static int compileFile(CompilerArguments args) throws IOException
	{
		Path inputFile = args.getInputFile();
		String source = FileUtils.load(inputFile);
		ErrorHandler errorHandler = new ErrorHandler();
		FlowchartCompiler compiler = new FlowchartCompiler(errorHandler);

		CompilationResult result;
		try
		{
			result = args.isCheckOnly() ? compiler.check(source) : compiler.compile(source);
		}
		catch (CompilationException e)
		{
			Debug.logError(e.format());
			Debug.logError("Compilation of " + inputFile + " failed.");
			return EXIT_FAILURE;
		}

		if (args.isPrintTokens())
		{
			Debug.log("Tokens:");
			Debug.log(result.tokens().stream().map(Token::toString).collect(Collectors.joining(" ")));
		}
		if (args.isPrintAst())
		{
			Debug.log("AST:");
			Debug.log(AstPrinter.print(result.program()));
		}

		if (errorHandler.hasErrors())
		{
			Debug.logError(result.diagnostics().size() + " semantic error(s) found.");
		}
		else
		{
			Debug.logInfo("No semantic errors detected.");
		}

		if (result.hasGraph())
		{
			String dot = DotWriter.write(result.graph());
			boolean writtenToFile = args.getOutputPath() != null || args.getJsonPath() != null;
			boolean printDot = args.isPrintDot() || !writtenToFile;
			if (printDot)
			{
				Debug.log(dot);
			}
			if (args.getOutputPath() != null)
			{
				renderFlowchart(args, dot, printDot);
			}
		}

		if (args.getJsonPath() != null)
		{
			writeReport(ReportDTOConverter.toReport(inputFile.toString(), result), args.getJsonPath());
		}

		return errorHandler.hasErrors() ? EXIT_SEMANTIC_ERRORS : EXIT_OK;
	}

	/**
	 * Renders the image; when Graphviz is unavailable or fails the DOT text is printed instead.
	 */
	private static void renderFlowchart(CompilerArguments args, String dot, boolean dotAlreadyPrinted)
	{
		GraphRenderer renderer = new GraphRenderer(args.getDotCommand());
		try
		{
			renderer.render(dot, args.getOutputPath(), args.getFormat());
			Debug.logInfo("Flowchart written to: " + args.getOutputPath());
		}
		catch (RenderException e)
		{
			Debug.logWarning(e.getMessage());
			Debug.logWarning("Make sure Graphviz is installed: https://graphviz.org/download/");
			if (!dotAlreadyPrinted)
			{
				Debug.log("Flowchart DOT source:");
				Debug.log(dot);
			}
		}
	}

	private static void writeReport(ReportDTO report, Path outPath) throws IOException
	{
		Gson gson = new GsonBuilder().setPrettyPrinting().disableHtmlEscaping().create();
		Path parent = outPath.toAbsolutePath().getParent();
		if (parent != null)
		{
			Files.createDirectories(parent);
		}
		Files.writeString(outPath, gson.toJson(report), StandardCharsets.UTF_8,
				StandardOpenOption.CREATE, StandardOpenOption.TRUNCATE_EXISTING);
		Debug.logInfo("Wrote report to: " + outPath);
	}
}
