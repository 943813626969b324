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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Single entry point to SLF4J for the interpreter classes.
 * <p>
 * Loading this class lowers SLF4J's own diagnostic output, so an application
 * embedding the interpreter without a logging binding does not get the
 * "no providers" banner on its console. A verbosity already chosen by the
 * application is left untouched.
 */
public final class AwkLogger {

	/**
	 * System property read by SLF4J for its internal messages.
	 */
	public static final String SLF4J_VERBOSITY_PROPERTY = "slf4j.internal.verbosity";

	static {
		if (System.getProperty(SLF4J_VERBOSITY_PROPERTY) == null) {
			System.setProperty(SLF4J_VERBOSITY_PROPERTY, "WARN");
		}
	}

	private AwkLogger() {}

	/**
	 * @param clazz class that owns the logger
	 * @return the SLF4J logger named after the class
	 */
	public static Logger getLogger(Class<?> clazz) {
		return LoggerFactory.getLogger(clazz);
	}
}
