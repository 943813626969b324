package org.metricshub.rawk;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Rawk
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.FileInputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.metricshub.rawk.frontend.ast.ParserException;
import org.metricshub.rawk.frontend.ast.Program;
import org.metricshub.rawk.util.AwkLogger;
import org.metricshub.rawk.util.AwkSettings;
import org.metricshub.rawk.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Command-line interface for Rawk.
 * <p>
 * <pre>
 * rawk [-F fs] [-v name=val]... 'script' [input-file]
 * rawk [-F fs] [-v name=val]... -f script-file [input-file]
 * </pre>
 * Records are read from standard input when no input file is given.
 * Exit code 2 reports a script or input file that cannot be read, or a
 * script that does not parse.
 */
public final class Cli {

	private static final Logger LOG = AwkLogger.getLogger(Cli.class);

	/**
	 * Exit code when the script or the input cannot be used.
	 */
	public static final int EXIT_ERROR = 2;

	private static final Pattern INITIAL_VAR_PATTERN = Pattern.compile("([_a-zA-Z][_0-9a-zA-Z]*)=(.*)");

	private final AwkSettings settings = new AwkSettings();
	private final PrintStream out;
	private final PrintStream err;

	private String script;
	private String scriptFile;
	private String inputFile;
	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard input and output streams.
	 */
	public Cli() {
		this(System.in, System.out, System.err);
	}

	/**
	 * Creates a CLI instance using the supplied streams.
	 *
	 * @param in stream from which records are read when there is no input file
	 * @param out stream where program output and usage are written
	 * @param err stream where error messages are written
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(InputStream in, PrintStream out, PrintStream err) {
		this.out = out;
		this.err = err;
		// Configure AWK settings with provided streams
		settings.setInput(in);
		settings.setOutputStream(out);
	}

	/**
	 * Returns the mutable {@link AwkSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public AwkSettings getSettings() {
		return settings;
	}

	/**
	 * @return the script given on the command line, null with {@code -f}
	 */
	public String getScript() {
		return script;
	}

	/**
	 * @return the file given with {@code -f}, null otherwise
	 */
	public String getScriptFile() {
		return scriptFile;
	}

	public String getInputFile() {
		return inputFile;
	}

	public boolean isPrintUsage() {
		return printUsage;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 * @throws IllegalArgumentException when the arguments are malformed
	 */
	public void parse(String[] args) {

		// Special case: no arguments
		if (args.length == 0) {
			printUsage = true;
			return;
		}

		// Parse the arguments
		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0 || arg.charAt(0) != '-') {
				// end of options: remaining args are the script and the input file
				break;
			} else if (arg.equals("--")) {
				++argIdx;
				break;
			} else if (arg.equals("-v")) {
				// -v name=val : assign AWK variable before execution
				checkParameterHasArgument(args, argIdx);
				addVariable(settings, args[++argIdx]);
			} else if (arg.equals("-f")) {
				// -f filename : load script from file
				checkParameterHasArgument(args, argIdx);
				if (scriptFile != null) {
					throw new IllegalArgumentException("Only one script file is supported");
				}
				scriptFile = args[++argIdx];
			} else if (arg.equals("-F")) {
				// -F fs : set field separator
				checkParameterHasArgument(args, argIdx);
				settings.setFieldSeparator(args[++argIdx]);
			} else if (arg.equals("-h") || arg.equals("-?")) {
				// -h/-? : display usage information and exit
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			}
			++argIdx;
		}

		if (scriptFile == null) {
			if (argIdx >= args.length) {
				throw new IllegalArgumentException("Awk script not provided.");
			}
			script = args[argIdx++];
		}

		if (argIdx < args.length) {
			inputFile = args[argIdx++];
		}
		if (argIdx < args.length) {
			throw new IllegalArgumentException("Only one input file is supported, got: " + args[argIdx]);
		}
	}

	/**
	 * Ensures that the current command-line option is followed by a value.
	 *
	 * @param args full array of arguments
	 * @param argIdx index of the option that requires a value
	 */
	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Need additional argument for " + args[argIdx]);
		}
	}

	/**
	 * Parses a variable assignment passed via <code>-v</code> and stores it in the
	 * provided settings instance.
	 *
	 * @param settings settings to mutate
	 * @param keyValue string of the form {@code name=value}
	 */
	private static void addVariable(AwkSettings settings, String keyValue) {
		Matcher m = INITIAL_VAR_PATTERN.matcher(keyValue);
		if (!m.matches()) {
			throw new IllegalArgumentException(
					"keyValue \"" + keyValue + "\" must be of the form \"name=value\"");
		}
		settings.putVariable(m.group(1), m.group(2));
	}

	/**
	 * Executes the CLI based on the previously parsed arguments.
	 *
	 * @throws ExitException when the script or the input cannot be used
	 */
	public void run() throws ExitException {
		if (printUsage) {
			usage(out);
			return;
		}

		ScriptSource source;
		if (scriptFile == null) {
			source = ScriptSource.fromString(script);
		} else {
			try {
				source = ScriptSource.fromFile(scriptFile);
			} catch (IOException e) {
				err.println("rawk: cannot read script " + scriptFile + ": " + e.getMessage());
				throw new ExitException(EXIT_ERROR, e.getMessage(), e);
			}
		}

		Program program;
		try {
			program = Awk.compile(source);
		} catch (ParserException e) {
			err.println("rawk: syntax error: " + e.getMessage());
			throw new ExitException(EXIT_ERROR, e.getMessage(), e);
		}

		Awk awk = new Awk(program);
		if (inputFile == null) {
			invoke(awk);
			return;
		}

		try (InputStream input = new FileInputStream(inputFile)) {
			settings.setInput(input);
			settings.setFilename(inputFile);
			invoke(awk);
		} catch (IOException e) {
			err.println("rawk: cannot open " + inputFile + ": " + e.getMessage());
			throw new ExitException(EXIT_ERROR, e.getMessage(), e);
		}
	}

	private void invoke(Awk awk) throws ExitException {
		try {
			awk.invoke(settings);
		} catch (IOException e) {
			err.println("rawk: cannot read input: " + e.getMessage());
			throw new ExitException(EXIT_ERROR, e.getMessage(), e);
		}
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest.println("rawk [-F fs_val] [-v name=val]... script [input_filename]");
		dest.println("rawk [-F fs_val] [-v name=val]... -f script-filename [input_filename]");
		dest.println();
		dest.println(" -F fs_val = Use fs_val for FS.");
		dest.println(" -f filename = Use contents of filename for script.");
		dest.println(" -v name=val = Initial awk variable assignments.");
		dest.println(" -h or -? = This help screen.");
		dest.println();
		dest.println("Records are read from the standard input when no input file is given.");
	}

	/**
	 * Parses the arguments and runs them. Malformed arguments print the usage.
	 *
	 * @param args command-line arguments
	 * @param is input stream for program input
	 * @param os output stream for program output
	 * @param es error stream for diagnostic messages
	 * @return the exit code
	 */
	public static int execute(String[] args, InputStream is, PrintStream os, PrintStream es) {
		Cli cli = new Cli(is, os, es);
		try {
			cli.parse(args);
		} catch (IllegalArgumentException e) {
			LOG.debug("Invalid arguments: {}", e.getMessage());
			es.println(e.getMessage());
			usage(os);
			return 0;
		}
		try {
			cli.run();
		} catch (ExitException e) {
			return e.getCode();
		}
		return 0;
	}

	/**
	 * Entry point for the command-line interface.
	 *
	 * @param args command-line arguments
	 */
	public static void main(String[] args) {
		int code = execute(args, System.in, System.out, System.err);
		if (code != 0) {
			System.exit(code);
		}
	}
}
