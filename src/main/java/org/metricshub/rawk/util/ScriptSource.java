package org.metricshub.rawk.util;

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

import java.io.BufferedReader;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Paths;

/**
 * The text of an AWK script and where it comes from.
 * The script is either given on the command line or read from a file
 * named with the "-f" switch. The description is used in parser error
 * messages.
 *
 * @author Danny Daglas
 */
public final class ScriptSource {

	/** Constant <code>DESCRIPTION_COMMAND_LINE_SCRIPT="&lt;command-line-supplied-script&gt;"</code> */
	public static final String DESCRIPTION_COMMAND_LINE_SCRIPT = "<command-line-supplied-script>";

	private final String description;
	private final String script;

	private ScriptSource(String description, String script) {
		this.description = description;
		this.script = script;
	}

	/**
	 * A script given as a string on the command line.
	 *
	 * @param script the script text
	 * @return a source serving this text
	 */
	public static ScriptSource fromString(String script) {
		if (script == null) {
			throw new IllegalArgumentException("script must not be null");
		}
		return new ScriptSource(DESCRIPTION_COMMAND_LINE_SCRIPT, script);
	}

	/**
	 * Reads a script file, as UTF-8.
	 *
	 * @param path path of the script file, also used as the description
	 * @return a source serving the contents of the file
	 * @throws IOException when the file cannot be read or is not valid UTF-8
	 */
	public static ScriptSource fromFile(String path) throws IOException {
		StringBuilder sb = new StringBuilder();
		char[] buffer = new char[4096];
		try (BufferedReader reader = Files.newBufferedReader(Paths.get(path))) {
			int count;
			while ((count = reader.read(buffer)) >= 0) {
				sb.append(buffer, 0, count);
			}
		}
		return new ScriptSource(path, sb.toString());
	}

	public String getDescription() {
		return description;
	}

	public String getScript() {
		return script;
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return getDescription();
	}
}
