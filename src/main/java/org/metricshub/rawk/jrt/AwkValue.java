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

import java.util.Objects;

/**
 * A value manipulated by an AWK program.
 * <p>
 * AWK is dynamically typed: a value is either a string, a number, or the
 * value of a variable that was never assigned, which behaves as both
 * {@code ""} and {@code 0}. All conversions between these forms live in
 * {@link JRT}.
 */
public abstract class AwkValue {

	/**
	 * The value of variables, fields and array elements that were never assigned.
	 */
	public static final AwkValue UNINITIALIZED = new Uninitialized();

	private AwkValue() {}

	/**
	 * @param value string value
	 * @return a text value
	 */
	public static AwkValue of(String value) {
		return new Text(value);
	}

	/**
	 * @param value numeric value
	 * @return a number value
	 */
	public static AwkValue of(double value) {
		return new Number(value);
	}

	/**
	 * Convenience for the results of comparisons and logical operators.
	 *
	 * @param value boolean value
	 * @return 1 for true, 0 for false
	 */
	public static AwkValue of(boolean value) {
		return new Number(value ? 1 : 0);
	}

	/**
	 * A string, as read from input or written in the script.
	 */
	public static final class Text extends AwkValue {
		private final String value;

		Text(String value) {
			this.value = Objects.requireNonNull(value, "value");
		}

		public String getValue() {
			return value;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Text && ((Text) o).value.equals(value);
		}

		@Override
		public int hashCode() {
			return value.hashCode();
		}

		@Override
		public String toString() {
			return value;
		}
	}

	/**
	 * The result of an arithmetic operation or a numeric literal.
	 */
	public static final class Number extends AwkValue {
		private final double value;

		Number(double value) {
			this.value = value;
		}

		public double getValue() {
			return value;
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Number && Double.compare(((Number) o).value, value) == 0;
		}

		@Override
		public int hashCode() {
			return Double.hashCode(value);
		}

		@Override
		public String toString() {
			return JRT.toAwkString(value);
		}
	}

	/**
	 * Never assigned.
	 */
	public static final class Uninitialized extends AwkValue {
		Uninitialized() {}

		@Override
		public String toString() {
			return "";
		}
	}
}
