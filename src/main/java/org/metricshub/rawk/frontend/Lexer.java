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

import java.util.HashMap;
import java.util.Map;

/**
 * Converts the text of an AWK script into a stream of {@link Token}s.
 * <p>
 * The lexer never throws: anything it cannot make sense of is returned as an
 * {@link TokenKind#ILLEGAL} token and left to the parser to report. Once the
 * input is exhausted, {@link #next()} keeps returning {@link TokenKind#EOF}.
 * <p>
 * A slash is either a division or the start of a regular expression
 * literal. The lexer cannot tell them apart on its own, so the parser
 * calls {@link #setRegexAllowed(boolean)} before fetching a token in a position
 * where a regular expression is grammatically valid.
 */
public class Lexer {

	/**
	 * Contains a mapping of AWK keywords to their token values.
	 * <p>
	 * <strong>Note:</strong> built-in function names are not stored in this map.
	 * They are separated into {@link #BUILTIN_FUNC_NAMES}.
	 */
	private static final Map<String, TokenKind> KEYWORDS = new HashMap<String, TokenKind>();

	static {
		// special keywords
		KEYWORDS.put("function", TokenKind.KW_FUNCTION);
		KEYWORDS.put("BEGIN", TokenKind.KW_BEGIN);
		KEYWORDS.put("END", TokenKind.KW_END);
		KEYWORDS.put("in", TokenKind.KW_IN);

		// statements
		KEYWORDS.put("if", TokenKind.KW_IF);
		KEYWORDS.put("else", TokenKind.KW_ELSE);
		KEYWORDS.put("while", TokenKind.KW_WHILE);
		KEYWORDS.put("for", TokenKind.KW_FOR);
		KEYWORDS.put("do", TokenKind.KW_DO);
		KEYWORDS.put("return", TokenKind.KW_RETURN);
		KEYWORDS.put("exit", TokenKind.KW_EXIT);
		KEYWORDS.put("next", TokenKind.KW_NEXT);
		KEYWORDS.put("continue", TokenKind.KW_CONTINUE);
		KEYWORDS.put("delete", TokenKind.KW_DELETE);
		KEYWORDS.put("break", TokenKind.KW_BREAK);

		// special-form functions
		KEYWORDS.put("print", TokenKind.KW_PRINT);
		KEYWORDS.put("printf", TokenKind.KW_PRINTF);
		KEYWORDS.put("getline", TokenKind.KW_GETLINE);
	}

	/**
	 * A mapping of built-in function names to their token values.
	 */
	private static final Map<String, TokenKind> BUILTIN_FUNC_NAMES = new HashMap<String, TokenKind>();

	static {
		BUILTIN_FUNC_NAMES.put("length", TokenKind.FUNC_LENGTH);
		BUILTIN_FUNC_NAMES.put("substr", TokenKind.FUNC_SUBSTR);
		BUILTIN_FUNC_NAMES.put("gsub", TokenKind.FUNC_GSUB);
		BUILTIN_FUNC_NAMES.put("sub", TokenKind.FUNC_SUB);
		BUILTIN_FUNC_NAMES.put("index", TokenKind.FUNC_INDEX);
		BUILTIN_FUNC_NAMES.put("split", TokenKind.FUNC_SPLIT);
		BUILTIN_FUNC_NAMES.put("sprintf", TokenKind.FUNC_SPRINTF);
		BUILTIN_FUNC_NAMES.put("int", TokenKind.FUNC_INT);
		BUILTIN_FUNC_NAMES.put("tolower", TokenKind.FUNC_TOLOWER);
		BUILTIN_FUNC_NAMES.put("toupper", TokenKind.FUNC_TOUPPER);
		BUILTIN_FUNC_NAMES.put("match", TokenKind.FUNC_MATCH);
	}

	private final String input;
	private int position;
	private boolean regexAllowed;

	/**
	 * @param input the text of the AWK script
	 */
	public Lexer(String input) {
		this.input = input == null ? "" : input;
		this.position = 0;
	}

	/**
	 * Specifies whether a slash read by the next call to {@link #next()} opens
	 * a regular expression literal (true) or is a division operator (false).
	 *
	 * @param allowed whether regular expression literals are allowed
	 */
	public void setRegexAllowed(boolean allowed) {
		this.regexAllowed = allowed;
	}

	/**
	 * @return the current offset of the cursor in the script
	 */
	public int getPosition() {
		return position;
	}

	/**
	 * Reads the next token and advances the cursor past it.
	 *
	 * @return the next token, or {@link TokenKind#EOF} when the input is
	 *         exhausted
	 */
	public Token next() {
		skipBlanksAndComments();

		int start = position;
		if (position >= input.length()) {
			return new Token(TokenKind.EOF, "", input.length());
		}

		char c = input.charAt(position);
		switch (c) {
		case '\n':
			position++;
			return new Token(TokenKind.NEWLINE, "\n", start);
		case '\\':
			// line continuation, re-emitted as a newline
			if (peek(1) == '\n') {
				position += 2;
				return new Token(TokenKind.NEWLINE, "\n", start);
			}
			if (peek(1) == '\r' && peek(2) == '\n') {
				position += 3;
				return new Token(TokenKind.NEWLINE, "\n", start);
			}
			position++;
			return new Token(TokenKind.ILLEGAL, "\\", start);
		case '{':
			return single(TokenKind.LEFT_BRACE, start);
		case '}':
			return single(TokenKind.RIGHT_BRACE, start);
		case '(':
			return single(TokenKind.LEFT_PAREN, start);
		case ')':
			return single(TokenKind.RIGHT_PAREN, start);
		case '[':
			return single(TokenKind.LEFT_BRACKET, start);
		case ']':
			return single(TokenKind.RIGHT_BRACKET, start);
		case ',':
			return single(TokenKind.COMMA, start);
		case ';':
			return single(TokenKind.SEMICOLON, start);
		case '$':
			return single(TokenKind.DOLLAR, start);
		case '?':
			return single(TokenKind.QUESTION_MARK, start);
		case ':':
			return single(TokenKind.COLON, start);
		case '~':
			return single(TokenKind.MATCHES, start);
		case '+':
			if (peek(1) == '=') {
				return pair(TokenKind.PLUS_EQ, start);
			} else if (peek(1) == '+') {
				return pair(TokenKind.INC, start);
			}
			return single(TokenKind.PLUS, start);
		case '-':
			if (peek(1) == '=') {
				return pair(TokenKind.MINUS_EQ, start);
			} else if (peek(1) == '-') {
				return pair(TokenKind.DEC, start);
			}
			return single(TokenKind.MINUS, start);
		case '*':
			if (peek(1) == '=') {
				return pair(TokenKind.MULT_EQ, start);
			} else if (peek(1) == '*') {
				// ** and **= are synonyms for ^ and ^=
				if (peek(2) == '=') {
					position += 3;
					return new Token(TokenKind.POW_EQ, "**=", start);
				}
				return pair(TokenKind.POW, start);
			}
			return single(TokenKind.MULT, start);
		case '/':
			if (regexAllowed) {
				return readRegex(start);
			}
			if (peek(1) == '=') {
				return pair(TokenKind.DIV_EQ, start);
			}
			return single(TokenKind.DIVIDE, start);
		case '%':
			if (peek(1) == '=') {
				return pair(TokenKind.MOD_EQ, start);
			}
			return single(TokenKind.MOD, start);
		case '^':
			if (peek(1) == '=') {
				return pair(TokenKind.POW_EQ, start);
			}
			return single(TokenKind.POW, start);
		case '!':
			if (peek(1) == '=') {
				return pair(TokenKind.NE, start);
			} else if (peek(1) == '~') {
				return pair(TokenKind.NOT_MATCHES, start);
			}
			return single(TokenKind.NOT, start);
		case '>':
			if (peek(1) == '=') {
				return pair(TokenKind.GE, start);
			} else if (peek(1) == '>') {
				return pair(TokenKind.APPEND, start);
			}
			return single(TokenKind.GT, start);
		case '<':
			if (peek(1) == '=') {
				return pair(TokenKind.LE, start);
			}
			return single(TokenKind.LT, start);
		case '=':
			if (peek(1) == '=') {
				return pair(TokenKind.EQ, start);
			}
			return single(TokenKind.ASSIGN, start);
		case '|':
			if (peek(1) == '|') {
				return pair(TokenKind.OR, start);
			}
			return single(TokenKind.PIPE, start);
		case '&':
			if (peek(1) == '&') {
				return pair(TokenKind.AND, start);
			}
			// use && for logical and
			return single(TokenKind.ILLEGAL, start);
		case '"':
			return readString(start);
		default:
			break;
		}

		if (isDigit(c) || (c == '.' && isDigit(peek(1)))) {
			return readNumber(start);
		}
		if (isIdentifierStart(c)) {
			return readIdentifier(start);
		}
		return single(TokenKind.ILLEGAL, start);
	}

	/**
	 * Skip blanks and comments, but not newlines which are significant.
	 */
	private void skipBlanksAndComments() {
		while (position < input.length()) {
			char c = input.charAt(position);
			if (c == ' ' || c == '\t' || c == '\r') {
				position++;
			} else if (c == '#') {
				// kill comment
				while (position < input.length() && input.charAt(position) != '\n') {
					position++;
				}
			} else {
				return;
			}
		}
	}

	private char peek(int distance) {
		int index = position + distance;
		return index < input.length() ? input.charAt(index) : '\0';
	}

	private Token single(TokenKind kind, int start) {
		position++;
		return new Token(kind, input.substring(start, position), start);
	}

	private Token pair(TokenKind kind, int start) {
		position += 2;
		return new Token(kind, input.substring(start, position), start);
	}

	/**
	 * Reads a string literal. Escape sequences are kept as they are, their
	 * expansion is left to the places where the string is used.
	 */
	private Token readString(int start) {
		// skip the opening quote
		position++;
		int bodyStart = position;
		while (position < input.length()) {
			char c = input.charAt(position);
			if (c == '"') {
				String body = input.substring(bodyStart, position);
				position++;
				return new Token(TokenKind.STRING, body, start);
			}
			if (c == '\n') {
				break;
			}
			if (c == '\\' && position + 1 < input.length() && input.charAt(position + 1) != '\n') {
				position++;
			}
			position++;
		}
		// Unterminated string
		return new Token(TokenKind.ILLEGAL, input.substring(start, position), start);
	}

	/**
	 * Reads the regular expression (between slashes '/') and handle '\/'.
	 */
	private Token readRegex(int start) {
		// skip the opening slash
		position++;
		StringBuilder regexp = new StringBuilder();
		while (position < input.length()) {
			char c = input.charAt(position);
			if (c == '/') {
				position++;
				return new Token(TokenKind.REGEX, regexp.toString(), start);
			}
			if (c == '\n') {
				break;
			}
			if (c == '\\' && position + 1 < input.length() && input.charAt(position + 1) != '\n') {
				position++;
				if (input.charAt(position) != '/') {
					regexp.append('\\');
				}
				c = input.charAt(position);
			}
			regexp.append(c);
			position++;
		}
		// Unterminated regular expression
		return new Token(TokenKind.ILLEGAL, input.substring(start, position), start);
	}

	private Token readNumber(int start) {
		char c = input.charAt(position);

		// hexadecimal
		if (c == '0' && (peek(1) == 'x' || peek(1) == 'X')) {
			position += 2;
			while (position < input.length() && isHexDigit(input.charAt(position))) {
				position++;
			}
			String literal = input.substring(start, position);
			try {
				Long.parseLong(literal.substring(2), 16);
			} catch (NumberFormatException e) {
				return new Token(TokenKind.ILLEGAL, literal, start);
			}
			return new Token(TokenKind.NUMBER, literal, start);
		}

		while (position < input.length() && isDigit(input.charAt(position))) {
			position++;
		}
		if (position < input.length() && input.charAt(position) == '.') {
			position++;
			while (position < input.length() && isDigit(input.charAt(position))) {
				position++;
			}
		}

		// optional exponent, only when digits follow
		if (position < input.length() && (input.charAt(position) == 'e' || input.charAt(position) == 'E')) {
			int exponentStart = position + 1;
			if (exponentStart < input.length() && (input.charAt(exponentStart) == '+' || input.charAt(exponentStart) == '-')) {
				exponentStart++;
			}
			if (exponentStart < input.length() && isDigit(input.charAt(exponentStart))) {
				position = exponentStart;
				while (position < input.length() && isDigit(input.charAt(position))) {
					position++;
				}
			}
		}

		return new Token(TokenKind.NUMBER, input.substring(start, position), start);
	}

	private Token readIdentifier(int start) {
		while (position < input.length() && isIdentifierPart(input.charAt(position))) {
			position++;
		}
		String text = input.substring(start, position);

		TokenKind keyword = KEYWORDS.get(text);
		if (keyword != null) {
			return new Token(keyword, text, start);
		}
		TokenKind builtin = BUILTIN_FUNC_NAMES.get(text);
		if (builtin != null) {
			return new Token(builtin, text, start);
		}
		return new Token(TokenKind.IDENTIFIER, text, start);
	}

	private static boolean isDigit(char c) {
		return c >= '0' && c <= '9';
	}

	private static boolean isHexDigit(char c) {
		return isDigit(c) || (c >= 'a' && c <= 'f') || (c >= 'A' && c <= 'F');
	}

	private static boolean isIdentifierStart(char c) {
		return (c >= 'a' && c <= 'z') || (c >= 'A' && c <= 'Z') || c == '_';
	}

	private static boolean isIdentifierPart(char c) {
		return isIdentifierStart(c) || isDigit(c);
	}
}
