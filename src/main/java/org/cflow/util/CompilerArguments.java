package org.cflow.util;

import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * Parses and holds the command-line arguments of the flowchart compiler.
 */
public class CompilerArguments
{
	private Path inputFile = null;
	private Path outputPath = null;
	private Path jsonPath = null;
	private String format = null; // Default: inferred from the output extension
	private String dotCommand = "dot";
	private boolean helpFlag = false;
	private boolean versionFlag = false;
	private boolean verboseFlag = false;
	private boolean checkOnly = false;
	private boolean printTokens = false;
	private boolean printAst = false;
	private boolean printDot = false;
	private boolean valid = true;

	// Private constructor, use parse()
	private CompilerArguments()
	{
	}

	public static CompilerArguments parse(String[] args)
	{
		CompilerArguments parsedArgs = new CompilerArguments();

		if (args.length < 1)
		{
			parsedArgs.helpFlag = true; // No args, show help
			return parsedArgs;
		}

		try
		{
			for (int i = 0; i < args.length; i++)
			{
				String arg = args[i];

				// --- Flags with no argument ---
				switch (arg)
				{
					case "-h", "--help" ->
					{
						parsedArgs.helpFlag = true;
						return parsedArgs; // Help flag overrides all else
					}
					case "--version" ->
					{
						parsedArgs.versionFlag = true;
						return parsedArgs;
					}
					case "-v", "--verbose" ->
					{
						parsedArgs.verboseFlag = true;
						Debug.ENABLE_DEBUG = true; // Set debug flag immediately
					}
					case "--no-color" -> Debug.ENABLE_COLOR = false;
					case "-k", "--check" -> parsedArgs.checkOnly = true;
					case "-t", "--tokens" -> parsedArgs.printTokens = true;
					case "-a", "--ast" -> parsedArgs.printAst = true;
					case "-d", "--dot" -> parsedArgs.printDot = true;

					// --- Flags with one argument ---
					case "-o", "--output" -> parsedArgs.outputPath = Paths.get(getNextArg(args, ++i, arg));
					case "-j", "--json" -> parsedArgs.jsonPath = Paths.get(getNextArg(args, ++i, arg));
					case "-f", "--format" -> parsedArgs.format = getNextArg(args, ++i, arg);
					case "--dot-command" -> parsedArgs.dotCommand = getNextArg(args, ++i, arg);

					default ->
					{
						if (arg.startsWith("-"))
						{
							throw new IllegalArgumentException("Unknown option: " + arg);
						}
						if (parsedArgs.inputFile != null)
						{
							throw new IllegalArgumentException("Only one input file is supported, got '"
									+ parsedArgs.inputFile + "' and '" + arg + "'");
						}
						parsedArgs.inputFile = Paths.get(arg);
					}
				}
			}
		}
		catch (IllegalArgumentException e)
		{
			Debug.logError(e.getMessage());
			parsedArgs.helpFlag = true; // Show help on bad parse
			parsedArgs.valid = false;
		}

		return parsedArgs;
	}

	private static String getNextArg(String[] args, int i, String flag)
	{
		if (i >= args.length || args[i].startsWith("-"))
		{
			throw new IllegalArgumentException("Missing argument after " + flag);
		}
		return args[i];
	}

	public static void printUsage()
	{
		Debug.log("OVERVIEW: Builds a flowchart from the main function of a C-style source file.");
		Debug.log("\nUSAGE: cflow [options] file");
		Debug.log("\nOPTIONS:");
		Debug.log("  -h, --help                Show this help message and exit.");
		Debug.log("  --version                 Show version and exit.");
		Debug.log("  -v, --verbose             Enable verbose debug logging.");
		Debug.log("  --no-color                Disable colored log output.");
		Debug.log("  -k, --check               Run lexing, parsing and semantic analysis only.");
		Debug.log("  -t, --tokens              Print the token list.");
		Debug.log("  -a, --ast                 Print the syntax tree.");
		Debug.log("  -d, --dot                 Print the flowchart as Graphviz DOT.");
		Debug.log("  -o, --output <file>       Render the flowchart image to <file> using Graphviz.");
		Debug.log("  -f, --format <fmt>        Image format (png, svg, pdf, ...). Default: from the output extension.");
		Debug.log("  --dot-command <path>      Graphviz executable to use (default: dot).");
		Debug.log("  -j, --json <file>         Write tokens, syntax tree, diagnostics and flowchart as JSON.");
	}

	/**
	 * @return The Graphviz output format: the explicit --format value, else the output
	 * file extension, else png.
	 */
	public String getFormat()
	{
		if (format != null)
		{
			return format;
		}
		if (outputPath != null)
		{
			String extension = FileUtils.getFileExtension(outputPath);
			if (extension != null && extension.length() > 1)
			{
				return extension.substring(1);
			}
		}
		return "png";
	}

	// --- Getters ---

	public Path getInputFile()
	{
		return inputFile;
	}

	public Path getOutputPath()
	{
		return outputPath;
	}

	public Path getJsonPath()
	{
		return jsonPath;
	}

	public String getDotCommand()
	{
		return dotCommand;
	}

	public boolean isHelpFlag()
	{
		return helpFlag;
	}

	public boolean isVersionFlag()
	{
		return versionFlag;
	}

	public boolean isVerboseFlag()
	{
		return verboseFlag;
	}

	public boolean isCheckOnly()
	{
		return checkOnly;
	}

	public boolean isPrintTokens()
	{
		return printTokens;
	}

	public boolean isPrintAst()
	{
		return printAst;
	}

	public boolean isPrintDot()
	{
		return printDot;
	}

	public boolean isValid()
	{
		return valid;
	}
}
