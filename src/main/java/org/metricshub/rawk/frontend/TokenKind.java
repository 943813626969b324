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

/**
 * Lexer token values.
 */
public enum TokenKind {
	EOF,
	ILLEGAL,
	NEWLINE,

	// literals
	NUMBER,
	STRING,
	REGEX,
	IDENTIFIER,

	// punctuation
	LEFT_BRACE,
	RIGHT_BRACE,
	LEFT_PAREN,
	RIGHT_PAREN,
	LEFT_BRACKET,
	RIGHT_BRACKET,
	COMMA,
	SEMICOLON,
	DOLLAR,
	QUESTION_MARK,
	COLON,

	// operators
	ASSIGN,
	PLUS,
	MINUS,
	MULT,
	DIVIDE,
	MOD,
	POW,
	NOT,
	MATCHES,
	NOT_MATCHES,
	EQ,
	NE,
	LT,
	LE,
	GT,
	GE,
	AND,
	OR,
	INC,
	DEC,
	APPEND,
	PIPE,

	// compound assignments
	PLUS_EQ,
	MINUS_EQ,
	MULT_EQ,
	DIV_EQ,
	MOD_EQ,
	POW_EQ,

	// keywords
	KW_BEGIN,
	KW_END,
	KW_FUNCTION,
	KW_IF,
	KW_ELSE,
	KW_WHILE,
	KW_FOR,
	KW_DO,
	KW_IN,
	KW_BREAK,
	KW_CONTINUE,
	KW_NEXT,
	KW_EXIT,
	KW_RETURN,
	KW_DELETE,
	KW_GETLINE,
	KW_PRINT,
	KW_PRINTF,

	// built-in functions
	FUNC_LENGTH,
	FUNC_SUBSTR,
	FUNC_GSUB,
	FUNC_SUB,
	FUNC_INDEX,
	FUNC_SPLIT,
	FUNC_SPRINTF,
	FUNC_INT,
	FUNC_TOLOWER,
	FUNC_TOUPPER,
	FUNC_MATCH;

	/**
	 * @return whether this token is the name of a built-in function
	 */
	public boolean isBuiltinFunction() {
		return name().startsWith("FUNC_");
	}
}
