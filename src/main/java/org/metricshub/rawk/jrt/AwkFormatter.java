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

import java.util.List;
import java.util.Locale;

/**
 * Renders {@code printf} output.
 * <p>
 * Conversions: {@code %s}, {@code %d}, {@code %f} and {@code %%}, with the
 * {@code -} and {@code 0} flags, a field width and a precision. Any other
 * conversion is copied to the output as written. Missing arguments are
 * uninitialized values.
 */
public final class AwkFormatter {

	/**
	 * Columns between two tab stops in rendered lines.
	 */
	private static final int TAB_WIDTH = 4;

	private AwkFormatter() {}

	/**
	 * Formats the arguments according to an AWK format string.
	 *
	 * @param format format string, with escape sequences already expanded
	 * @param arguments values for the conversions, in order
	 * @return the formatted text
	 */
	public static String sprintf(String format, List<AwkValue> arguments) {
		StringBuilder out = new StringBuilder();
		int argIdx = 0;
		int i = 0;
		while (i < format.length()) {
			char c = format.charAt(i);
			if (c != '%') {
				out.append(c);
				i++;
				continue;
			}

			int start = i++;
			if (i < format.length() && format.charAt(i) == '%') {
				out.append('%');
				i++;
				continue;
			}

			// flags
			boolean leftJustify = false;
			boolean zeroPad = false;
			while (i < format.length() && (format.charAt(i) == '-' || format.charAt(i) == '0')) {
				if (format.charAt(i) == '-') {
					leftJustify = true;
				} else {
					zeroPad = true;
				}
				i++;
			}
			// width
			int width = 0;
			while (i < format.length() && Character.isDigit(format.charAt(i))) {
				width = width * 10 + (format.charAt(i) - '0');
				i++;
			}
			// precision
			int precision = -1;
			if (i < format.length() && format.charAt(i) == '.') {
				i++;
				precision = 0;
				while (i < format.length() && Character.isDigit(format.charAt(i))) {
					precision = precision * 10 + (format.charAt(i) - '0');
					i++;
				}
			}

			if (i == format.length()) {
				// dangling conversion
				out.append(format, start, i);
				break;
			}

			char conversion = format.charAt(i++);
			String rendered;
			boolean numeric;
			switch (conversion) {
			case 's':
				rendered = JRT.toAwkString(argument(arguments, argIdx++));
				if (precision >= 0 && precision < rendered.length()) {
					rendered = rendered.substring(0, precision);
				}
				numeric = false;
				break;
			case 'd':
				rendered = Long.toString((long) JRT.toDouble(argument(arguments, argIdx++)));
				numeric = true;
				break;
			case 'f':
				double d = JRT.toDouble(argument(arguments, argIdx++));
				rendered = String.format(Locale.US, "%." + (precision < 0 ? 6 : precision) + "f", d);
				numeric = !Double.isNaN(d) && !Double.isInfinite(d);
				break;
			default:
				// unsupported conversion, keep it as written
				out.append(format, start, i);
				continue;
			}

			out.append(pad(rendered, width, leftJustify, zeroPad && numeric && !leftJustify));
		}
		return out.toString();
	}

	private static AwkValue argument(List<AwkValue> arguments, int index) {
		return index < arguments.size() ? arguments.get(index) : AwkValue.UNINITIALIZED;
	}

	private static String pad(String s, int width, boolean leftJustify, boolean zeroPad) {
		if (s.length() >= width) {
			return s;
		}
		StringBuilder sb = new StringBuilder(width);
		int padding = width - s.length();
		if (leftJustify) {
			sb.append(s);
			appendRepeated(sb, ' ', padding);
		} else if (zeroPad) {
			// zeroes go after the sign
			int signLength = s.startsWith("-") || s.startsWith("+") ? 1 : 0;
			sb.append(s, 0, signLength);
			appendRepeated(sb, '0', padding);
			sb.append(s, signLength, s.length());
		} else {
			appendRepeated(sb, ' ', padding);
			sb.append(s);
		}
		return sb.toString();
	}

	private static void appendRepeated(StringBuilder sb, char c, int count) {
		for (int i = 0; i < count; i++) {
			sb.append(c);
		}
	}

	/**
	 * Replaces each tab with the spaces up to the next tab stop. A tab always
	 * produces at least one space. Columns restart after a newline.
	 *
	 * @param s text to process
	 * @return the text without tabs
	 */
	public static String expandTabs(String s) {
		if (s.indexOf('\t') < 0) {
			return s;
		}
		StringBuilder sb = new StringBuilder(s.length() + TAB_WIDTH);
		int column = 0;
		for (int i = 0; i < s.length(); i++) {
			char c = s.charAt(i);
			if (c == '\t') {
				do {
					sb.append(' ');
					column++;
				} while (column % TAB_WIDTH != 0);
			} else {
				sb.append(c);
				column = c == '\n' ? 0 : column + 1;
			}
		}
		return sb.toString();
	}

	/**
	 * Removes one trailing line terminator: {@code \r\n}, {@code \n} or
	 * {@code \r}.
	 *
	 * @param s text to process
	 * @return the text without its line terminator
	 */
	public static String stripLineTerminator(String s) {
		if (s.endsWith("\r\n")) {
			return s.substring(0, s.length() - 2);
		}
		if (s.endsWith("\n") || s.endsWith("\r")) {
			return s.substring(0, s.length() - 1);
		}
		return s;
	}
}
