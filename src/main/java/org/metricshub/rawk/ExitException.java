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

/**
 * Requests the termination of the application with a given exit code.
 */
public class ExitException extends Exception {

	private static final long serialVersionUID = 1L;

	/** The exit code for the application */
	private final int code;

	/**
	 * Create a new ExitException with the specified code
	 *
	 * @param code Exit code
	 */
	public ExitException(int code) {
		this(code, "Your Rawk program requested an exit with code " + code);
	}

	/**
	 * Create a new ExitException with the specified code and message
	 *
	 * @param code Exit code
	 * @param message Message explaining the exit
	 */
	public ExitException(int code, String message) {
		super(message);
		this.code = code;
	}

	/**
	 * Create a new ExitException with the specified code, message and cause
	 *
	 * @param code Exit code
	 * @param message Message explaining the exit
	 * @param cause Problem that caused the exit
	 */
	public ExitException(int code, String message, Throwable cause) {
		super(message, cause);
		this.code = code;
	}

	/**
	 * @return the exit code
	 */
	public int getCode() {
		return code;
	}
}
