package org.metricshub.rawk.frontend;

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

import java.util.Objects;

/**
 * A single lexeme produced by the {@link Lexer}.
 * <p>
 * Tokens own their text: the literal is copied out of the script so the
 * resulting syntax tree does not keep the source alive.
 */
public final class Token {

	private final TokenKind kind;
	private final String literal;
	private final int offset;

	/**
	 * @param kind kind of token
	 * @param literal text of the token (for strings and regular expressions,
	 *        the body without delimiters and with escapes left unexpanded)
	 * @param offset offset of the first character of the token in the script
	 */
	public Token(TokenKind kind, String literal, int offset) {
		this.kind = Objects.requireNonNull(kind, "kind");
		this.literal = literal == null ? "" : literal;
		this.offset = offset;
	}

	public TokenKind getKind() {
		return kind;
	}

	public String getLiteral() {
		return literal;
	}

	public int getOffset() {
		return offset;
	}

	/**
	 * Convenience to check the kind of this token.
	 *
	 * @param other kind to compare with
	 * @return true if this token is of the specified kind
	 */
	public boolean is(TokenKind other) {
		return kind == other;
	}

	@Override
	public String toString() {
		return kind + "(" + literal + ")@" + offset;
	}
}
