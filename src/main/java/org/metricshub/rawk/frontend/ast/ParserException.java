package org.metricshub.rawk.frontend.ast;

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

import org.metricshub.rawk.frontend.Token;

/**
 * Thrown when the parser meets a construct it does not accept: a syntax
 * error, an illegal character sequence, or an AWK feature this interpreter
 * does not implement.
 */
public class ParserException extends Exception {

	private static final long serialVersionUID = 1L;

	private final String description;
	private final int offset;
	private final transient Token token;

	/**
	 * @param msg what went wrong
	 * @param description description of the script source (file name, or
	 *        "script" for inline programs)
	 * @param offset offset in the script of the offending token
	 * @param token the offending token
	 */
	public ParserException(String msg, String description, int offset, Token token) {
		super(msg + " (" + description + " at offset " + offset + ")");
		this.description = description;
		this.offset = offset;
		this.token = token;
	}

	public String getDescription() {
		return description;
	}

	public int getOffset() {
		return offset;
	}

	/**
	 * @return the token at which parsing failed
	 */
	public Token getToken() {
		return token;
	}
}
