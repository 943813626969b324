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
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.util.ArrayList;
import java.util.List;
import org.metricshub.rawk.backend.Evaluator;
import org.metricshub.rawk.frontend.AwkParser;
import org.metricshub.rawk.frontend.ast.ParserException;
import org.metricshub.rawk.frontend.ast.Program;
import org.metricshub.rawk.jrt.RecordReader;
import org.metricshub.rawk.util.AwkLogger;
import org.metricshub.rawk.util.AwkSettings;
import org.metricshub.rawk.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Entry point into the parsing and execution of a Rawk script.
 * This entry point is used both when Rawk is executed as a library and when
 * invoked from the command line.
 * <p>
 * The overall process to execute a Rawk script is as follows:
 * <ul>
 * <li>Parse the Rawk script, producing an abstract syntax tree.
 * <li>Walk the abstract syntax tree for each input record, collecting
 * the printed lines.
 * </ul>
 * The parsed {@link Program} is immutable. Each run creates its own
 * {@link Evaluator}, so a compiled {@code Awk} may be run many times.
 *
 * @see org.metricshub.rawk.backend.Evaluator
 * @author Danny Daglas
 */
public class Awk {

	private static final Logger LOG = AwkLogger.getLogger(Awk.class);

	private final Program program;

	/**
	 * Compiles the specified script.
	 *
	 * @param script AWK script
	 * @throws ParserException when the script is not valid
	 */
	public Awk(String script) throws ParserException {
		this(compile(script));
	}

	/**
	 * @param program an already parsed program
	 */
	public Awk(Program program) {
		if (program == null) {
			throw new IllegalArgumentException("program must not be null");
		}
		this.program = program;
	}

	/**
	 * Parses a script given as a string.
	 *
	 * @param script AWK script
	 * @return the parsed program
	 * @throws ParserException when the script is not valid
	 */
	public static Program compile(String script) throws ParserException {
		if (script == null) {
			throw new IllegalArgumentException("script must not be null");
		}
		return new AwkParser(script).parseProgram();
	}

	/**
	 * Parses a script whose errors are reported against its description,
	 * typically a file name.
	 *
	 * @param source the script and where it comes from
	 * @return the parsed program
	 * @throws ParserException when the script is not valid
	 */
	public static Program compile(ScriptSource source) throws ParserException {
		LOG.debug("Compiling {}", source.getDescription());
		return new AwkParser(source.getScript(), source.getDescription()).parseProgram();
	}

	/**
	 * Compiles and runs a script over a list of records.
	 *
	 * @param script AWK script
	 * @param records input records
	 * @return the printed lines
	 * @throws ParserException when the script is not valid
	 */
	public static List<String> execute(String script, List<String> records) throws ParserException {
		return new Awk(script).run(records);
	}

	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "Program is immutable")
	public Program getProgram() {
		return program;
	}

	/**
	 * Runs the program over a list of records.
	 *
	 * @param records input records
	 * @return the printed lines
	 */
	public List<String> run(List<String> records) {
		return Evaluator.eval(program, records);
	}

	/**
	 * Runs the program over a text, one record per line.
	 *
	 * @param input text to process
	 * @return the printed lines, each followed by a newline
	 */
	public String run(String input) {
		List<String> records = new ArrayList<String>();
		RecordReader reader = new RecordReader(new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8)));
		while (reader.hasNext()) {
			records.add(reader.next());
		}
		StringBuilder out = new StringBuilder();
		for (String line : run(records)) {
			out.append(line).append('\n');
		}
		return out.toString();
	}

	/**
	 * Runs the program, streaming records from {@code settings.getInput()}
	 * and printing each output line to {@code settings.getOutputStream()}.
	 * Records are processed as they are read.
	 *
	 * @param settings This tells AWK what to do
	 *        (where to get input from, where to write it to, initial
	 *        variables, ...)
	 * @throws IOException upon an IO error.
	 */
	public void invoke(AwkSettings settings) throws IOException {
		LOG.debug("Invoking with settings:\n{}", settings.toDescriptionString());
		PrintStream out = settings.getOutputStream();
		String lineTerminator = settings.getLineTerminator();
		Evaluator evaluator = new Evaluator(program, line -> {
			out.print(line);
			out.print(lineTerminator);
		}, settings);
		try {
			evaluator.interpret(new RecordReader(settings.getInput()));
		} catch (UncheckedIOException e) {
			throw e.getCause();
		} finally {
			out.flush();
		}
	}
}
