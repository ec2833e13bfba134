package org.cflow.util;

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.StandardCharsets;

public class ProcessUtils
{
	/**
	 * Runs an external command to completion. Standard output is logged at debug
	 * level, standard error at error level.
	 *
	 * @return The captured standard error text, empty when the command printed nothing.
	 * @throws IOException if the command cannot be started or exits with a non-zero code.
	 */
	public static String executeCommand(ProcessBuilder pb) throws IOException, InterruptedException
	{
		Debug.logDebug("Executing: " + String.join(" ", pb.command()));
		Process process = pb.start();

		StringBuilder errors = new StringBuilder();
		try (BufferedReader stdInput = new BufferedReader(new InputStreamReader(process.getInputStream(), StandardCharsets.UTF_8));
		     BufferedReader stdError = new BufferedReader(new InputStreamReader(process.getErrorStream(), StandardCharsets.UTF_8)))
		{
			String s;
			while ((s = stdInput.readLine()) != null)
			{
				Debug.logDebug(s);
			}
			while ((s = stdError.readLine()) != null)
			{
				Debug.logError(s);
				errors.append(s).append('\n');
			}
		}

		int exitCode = process.waitFor();
		if (exitCode != 0)
		{
			throw new IOException("Command failed with exit code " + exitCode + " for: " + String.join(" ", pb.command()));
		}
		return errors.toString();
	}
}
