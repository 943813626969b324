package org.metricshub.rawk.jrt;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * The reduced regular expression matcher used by patterns, the match
 * operators and {@code gsub}.
 * <p>
 * Only these forms are understood, each with an optional leading {@code ^}
 * and an optional trailing {@code $}:
 * <ul>
 * <li>a literal text, where {@code \x} stands for the character {@code x};
 * <li>{@code [0-9]+}, a run of digits;
 * <li>a flat alternation of literals, {@code (a|b|c)}.
 * </ul>
 * Anything else is taken literally. Matching is leftmost, and longest at
 * that position.
 */
public final class AwkRegex {

	private enum Kind {
		LITERAL, DIGITS, ALTERNATION
	}

	private final String pattern;
	private final boolean anchoredStart;
	private final boolean anchoredEnd;
	private final Kind kind;
	private final List<String> alternatives;

	/**
	 * @param pattern the regular expression, as written between slashes or
	 *        computed at runtime
	 */
	public AwkRegex(String pattern) {
		this.pattern = pattern;

		String body = pattern;
		anchoredStart = body.startsWith("^");
		if (anchoredStart) {
			body = body.substring(1);
		}
		anchoredEnd = body.endsWith("$") && !isEscaped(body, body.length() - 1);
		if (anchoredEnd) {
			body = body.substring(0, body.length() - 1);
		}

		List<String> parts = new ArrayList<String>();
		if ("[0-9]+".equals(body)) {
			kind = Kind.DIGITS;
		} else if (isFlatGroup(body)) {
			kind = Kind.ALTERNATION;
			for (String alternative : splitAlternatives(body.substring(1, body.length() - 1))) {
				parts.add(unescape(alternative));
			}
		} else {
			kind = Kind.LITERAL;
			parts.add(unescape(body));
		}
		alternatives = Collections.unmodifiableList(parts);
	}

	private static boolean isEscaped(String s, int index) {
		int backslashes = 0;
		for (int i = index - 1; i >= 0 && s.charAt(i) == '\\'; i--) {
			backslashes++;
		}
		return backslashes % 2 == 1;
	}

	private static boolean isFlatGroup(String body) {
		if (body.length() < 2 || body.charAt(0) != '(' || body.charAt(body.length() - 1) != ')'
				|| isEscaped(body, body.length() - 1)) {
			return false;
		}
		for (int i = 1; i < body.length() - 1; i++) {
			char c = body.charAt(i);
			if ((c == '(' || c == ')') && !isEscaped(body, i)) {
				return false;
			}
		}
		return true;
	}

	private static List<String> splitAlternatives(String group) {
		List<String> result = new ArrayList<String>();
		int start = 0;
		for (int i = 0; i < group.length(); i++) {
			if (group.charAt(i) == '|' && !isEscaped(group, i)) {
				result.add(group.substring(start, i));
				start = i + 1;
			}
		}
		result.add(group.substring(start));
		return result;
	}

	private static String unescape(String s) {
		if (s.indexOf('\\') < 0) {
			return s;
		}
		StringBuilder sb = new StringBuilder(s.length());
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			if (c == '\\' && i + 1 < s.length()) {
				c = s.charAt(++i);
			}
			sb.append(c);
		}
		return sb.toString();
	}

	public String getPattern() {
		return pattern;
	}

	public boolean isAnchoredStart() {
		return anchoredStart;
	}

	public boolean isAnchoredEnd() {
		return anchoredEnd;
	}

	/**
	 * @param text text to search
	 * @return true if the expression matches anywhere in the text
	 */
	public boolean matches(String text) {
		return find(text, 0) != null;
	}

	/**
	 * Finds the leftmost match at or after {@code from}.
	 *
	 * @param text text to search
	 * @param from position to start searching at
	 * @return {@code {start, end}} of the match, or null if there is none
	 */
	public int[] find(String text, int from) {
		int last = anchoredStart ? 0 : text.length();
		for (int position = from; position <= last; position++) {
			int end = longestMatchAt(text, position);
			if (end >= 0) {
				return new int[] { position, end };
			}
		}
		return null;
	}

	/**
	 * @return the end of the longest match starting at position, or -1
	 */
	private int longestMatchAt(String text, int position) {
		int end = -1;
		if (kind == Kind.DIGITS) {
			int i = position;
			while (i < text.length() && text.charAt(i) >= '0' && text.charAt(i) <= '9') {
				i++;
			}
			if (i > position) {
				end = i;
			}
		} else {
			for (String alternative : alternatives) {
				if (text.startsWith(alternative, position)) {
					int candidate = position + alternative.length();
					if (anchoredEnd && candidate != text.length()) {
						continue;
					}
					end = Math.max(end, candidate);
				}
			}
		}
		if (anchoredEnd && end != text.length()) {
			return -1;
		}
		return end;
	}

	/**
	 * Replaces every non-overlapping match, scanning from left to right. An
	 * empty match replaces nothing between characters and moves on by one
	 * character. An expression anchored at the start replaces at most once.
	 *
	 * @param text text to process
	 * @param replacement plain replacement text
	 * @return the text with all matches replaced
	 */
	public String replaceAll(String text, String replacement) {
		StringBuilder sb = new StringBuilder(text.length());
		int position = 0;
		int[] match;
		while (position <= text.length() && (match = find(text, position)) != null) {
			sb.append(text, position, match[0]);
			sb.append(replacement);
			if (match[1] == match[0]) {
				// empty match, keep the next character and move past it
				if (match[0] < text.length()) {
					sb.append(text.charAt(match[0]));
				}
				position = match[0] + 1;
			} else {
				position = match[1];
			}
			if (anchoredStart) {
				break;
			}
		}
		if (position < text.length()) {
			sb.append(text, position, text.length());
		}
		return sb.toString();
	}

	@Override
	public String toString() {
		return "/" + pattern + "/";
	}
}
