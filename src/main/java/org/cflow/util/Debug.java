package org.cflow.util;

import java.io.PrintStream;

public class Debug
{
	// ANSI escape codes for colors
	public static final String ANSI_RESET = "\u001B[0m";
	public static final String ANSI_YELLOW = "\u001B[33m";
	public static final String ANSI_RED = "\u001B[31m";
	public static final String ANSI_GREEN = "\u001B[32m";

	// Set by -v/--verbose. When false, logDebug prints nothing.
	public static boolean ENABLE_DEBUG = false;

	// Cleared by --no-color so logs stay readable when piped to a file.
	public static boolean ENABLE_COLOR = true;

	private static PrintStream out = System.out;
	private static PrintStream err = System.err;

	/**
	 * Redirects all log output. Used by the command-line tests to capture what the
	 * compiler prints.
	 */
	public static void redirect(PrintStream newOut, PrintStream newErr)
	{
		out = newOut;
		err = newErr;
	}

	public static void reset()
	{
		out = System.out;
		err = System.err;
		ENABLE_DEBUG = false;
		ENABLE_COLOR = true;
	}

	public static void log(String log)
	{
		out.println(log);
	}

	public static void logInfo(String log)
	{
		out.println(colored(ANSI_GREEN, log));
	}

	public static void logDebug(String log)
	{
		if (ENABLE_DEBUG)
		{
			out.println(log);
		}
	}

	public static void logWarning(String log)
	{
		out.println(colored(ANSI_YELLOW, log));
	}

	public static void logError(String log)
	{
		err.println(colored(ANSI_RED, log));
	}

	private static String colored(String color, String log)
	{
		return ENABLE_COLOR ? color + log + ANSI_RESET : log;
	}
}
