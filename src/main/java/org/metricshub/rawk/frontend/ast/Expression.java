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

import java.math.BigDecimal;
import java.util.Objects;
import org.metricshub.rawk.frontend.Token;
import org.metricshub.rawk.frontend.TokenKind;

/**
 * Expression nodes of the syntax tree.
 * <p>
 * Nodes are immutable and compare structurally. Their {@link #toString()}
 * renders AWK source that parses back into an equal node; operators are
 * fully parenthesized so the rendering does not depend on precedence.
 */
public abstract class Expression {

	/**
	 * Visitor over the expression variants.
	 *
	 * @param <R> result type
	 */
	public interface Visitor<R> {
		R visitNumberLiteral(NumberLiteral expr);

		R visitStringLiteral(StringLiteral expr);

		R visitRegexLiteral(RegexLiteral expr);

		R visitField(Field expr);

		R visitIdentifier(Identifier expr);

		R visitArrayAccess(ArrayAccess expr);

		R visitLength(Length expr);

		R visitSubstr(Substr expr);

		R visitConcatenation(Concatenation expr);

		R visitInfix(Infix expr);

		R visitUnary(Unary expr);

		R visitAssignment(Assignment expr);
	}

	public abstract <R> R accept(Visitor<R> visitor);

	/**
	 * Numeric literal. Hexadecimal literals are stored by value.
	 */
	public static final class NumberLiteral extends Expression {
		private final double value;

		public NumberLiteral(double value) {
			this.value = value;
		}

		public double getValue() {
			return value;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitNumberLiteral(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof NumberLiteral && Double.compare(((NumberLiteral) o).value, value) == 0;
		}

		@Override
		public int hashCode() {
			return Double.hashCode(value);
		}

		@Override
		public String toString() {
			if (value == Math.rint(value) && Math.abs(value) < 1e15) {
				return Long.toString((long) value);
			}
			return BigDecimal.valueOf(value).toPlainString();
		}
	}

	/**
	 * String literal, kept with its escape sequences unexpanded.
	 */
	public static final class StringLiteral extends Expression {
		private final String raw;

		public StringLiteral(String raw) {
			this.raw = Objects.requireNonNull(raw, "raw");
		}

		public String getRaw() {
			return raw;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitStringLiteral(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof StringLiteral && ((StringLiteral) o).raw.equals(raw);
		}

		@Override
		public int hashCode() {
			return raw.hashCode();
		}

		@Override
		public String toString() {
			return "\"" + raw + "\"";
		}
	}

	/**
	 * Regular expression literal ({@code /pattern/}).
	 */
	public static final class RegexLiteral extends Expression {
		private final String pattern;

		public RegexLiteral(String pattern) {
			this.pattern = Objects.requireNonNull(pattern, "pattern");
		}

		public String getPattern() {
			return pattern;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitRegexLiteral(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof RegexLiteral && ((RegexLiteral) o).pattern.equals(pattern);
		}

		@Override
		public int hashCode() {
			return pattern.hashCode();
		}

		@Override
		public String toString() {
			return "/" + pattern.replace("/", "\\/") + "/";
		}
	}

	/**
	 * Field reference: {@code $index}.
	 */
	public static final class Field extends Expression {
		private final Expression index;

		public Field(Expression index) {
			this.index = Objects.requireNonNull(index, "index");
		}

		public Expression getIndex() {
			return index;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitField(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Field && ((Field) o).index.equals(index);
		}

		@Override
		public int hashCode() {
			return 31 * index.hashCode() + 1;
		}

		@Override
		public String toString() {
			if (index instanceof NumberLiteral
					|| index instanceof Identifier
					|| index instanceof Field
					|| index instanceof ArrayAccess
					|| index instanceof Infix
					|| index instanceof Concatenation
					|| index instanceof Unary) {
				return "$" + index;
			}
			return "$(" + index + ")";
		}
	}

	/**
	 * Reference to a scalar variable (user variable or special variable such as NR).
	 */
	public static final class Identifier extends Expression {
		private final String name;

		public Identifier(String name) {
			this.name = Objects.requireNonNull(name, "name");
		}

		public String getName() {
			return name;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitIdentifier(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Identifier && ((Identifier) o).name.equals(name);
		}

		@Override
		public int hashCode() {
			return name.hashCode();
		}

		@Override
		public String toString() {
			return name;
		}
	}

	/**
	 * Associative array element: {@code identifier[index]}.
	 */
	public static final class ArrayAccess extends Expression {
		private final String identifier;
		private final Expression index;

		public ArrayAccess(String identifier, Expression index) {
			this.identifier = Objects.requireNonNull(identifier, "identifier");
			this.index = Objects.requireNonNull(index, "index");
		}

		public String getIdentifier() {
			return identifier;
		}

		public Expression getIndex() {
			return index;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitArrayAccess(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof ArrayAccess)) {
				return false;
			}
			ArrayAccess other = (ArrayAccess) o;
			return identifier.equals(other.identifier) && index.equals(other.index);
		}

		@Override
		public int hashCode() {
			return Objects.hash(identifier, index);
		}

		@Override
		public String toString() {
			return identifier + "[" + index + "]";
		}
	}

	/**
	 * {@code length} or {@code length(expr)}. Without an argument, the length
	 * of {@code $0} is taken at evaluation time.
	 */
	public static final class Length extends Expression {
		private final Expression argument;

		public Length(Expression argument) {
			this.argument = argument;
		}

		/**
		 * @return the argument, or null for a bare {@code length}
		 */
		public Expression getArgument() {
			return argument;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitLength(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Length && Objects.equals(((Length) o).argument, argument);
		}

		@Override
		public int hashCode() {
			return Objects.hash("length", argument);
		}

		@Override
		public String toString() {
			return argument == null ? "length" : "length(" + argument + ")";
		}
	}

	/**
	 * {@code substr(string, start[, length])}.
	 */
	public static final class Substr extends Expression {
		private final Expression string;
		private final Expression start;
		private final Expression length;

		public Substr(Expression string, Expression start, Expression length) {
			this.string = Objects.requireNonNull(string, "string");
			this.start = Objects.requireNonNull(start, "start");
			this.length = length;
		}

		public Expression getString() {
			return string;
		}

		public Expression getStart() {
			return start;
		}

		/**
		 * @return the length argument, or null when absent
		 */
		public Expression getLength() {
			return length;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitSubstr(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Substr)) {
				return false;
			}
			Substr other = (Substr) o;
			return string.equals(other.string) && start.equals(other.start) && Objects.equals(length, other.length);
		}

		@Override
		public int hashCode() {
			return Objects.hash(string, start, length);
		}

		@Override
		public String toString() {
			if (length == null) {
				return "substr(" + string + ", " + start + ")";
			}
			return "substr(" + string + ", " + start + ", " + length + ")";
		}
	}

	/**
	 * Implicit string concatenation of two adjacent expressions.
	 */
	public static final class Concatenation extends Expression {
		private final Expression left;
		private final Expression right;

		public Concatenation(Expression left, Expression right) {
			this.left = Objects.requireNonNull(left, "left");
			this.right = Objects.requireNonNull(right, "right");
		}

		public Expression getLeft() {
			return left;
		}

		public Expression getRight() {
			return right;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitConcatenation(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Concatenation)) {
				return false;
			}
			Concatenation other = (Concatenation) o;
			return left.equals(other.left) && right.equals(other.right);
		}

		@Override
		public int hashCode() {
			return Objects.hash("concat", left, right);
		}

		@Override
		public String toString() {
			return "(" + left + " " + right + ")";
		}
	}

	/**
	 * Binary operator application. The operator is kept as the token that
	 * produced it; a {@link TokenKind#COMMA} operator denotes a range pattern.
	 */
	public static final class Infix extends Expression {
		private final Expression left;
		private final Token operator;
		private final Expression right;

		public Infix(Expression left, Token operator, Expression right) {
			this.left = Objects.requireNonNull(left, "left");
			this.operator = Objects.requireNonNull(operator, "operator");
			this.right = Objects.requireNonNull(right, "right");
		}

		public Expression getLeft() {
			return left;
		}

		public Token getOperator() {
			return operator;
		}

		public Expression getRight() {
			return right;
		}

		/**
		 * @return whether this node is a range pattern ({@code start, end})
		 */
		public boolean isRange() {
			return operator.is(TokenKind.COMMA);
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitInfix(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Infix)) {
				return false;
			}
			Infix other = (Infix) o;
			// source offsets are not part of the structure
			return operator.getKind() == other.operator.getKind() && left.equals(other.left) && right.equals(other.right);
		}

		@Override
		public int hashCode() {
			return Objects.hash(left, operator.getKind(), right);
		}

		@Override
		public String toString() {
			if (isRange()) {
				return left + ", " + right;
			}
			return "(" + left + " " + operator.getLiteral() + " " + right + ")";
		}
	}

	/**
	 * Prefix operator application: {@code -x}, {@code +x} or {@code !x}.
	 */
	public static final class Unary extends Expression {
		private final Token operator;
		private final Expression operand;

		public Unary(Token operator, Expression operand) {
			this.operator = Objects.requireNonNull(operator, "operator");
			this.operand = Objects.requireNonNull(operand, "operand");
		}

		public Token getOperator() {
			return operator;
		}

		public Expression getOperand() {
			return operand;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitUnary(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Unary)) {
				return false;
			}
			Unary other = (Unary) o;
			return operator.getKind() == other.operator.getKind() && operand.equals(other.operand);
		}

		@Override
		public int hashCode() {
			return Objects.hash(operator.getKind(), operand);
		}

		@Override
		public String toString() {
			return "(" + operator.getLiteral() + operand + ")";
		}
	}

	/**
	 * Nested assignment, as found on the right-hand side of a chained
	 * assignment such as {@code FS = OFS = "\t"}. Evaluates to the assigned
	 * value.
	 */
	public static final class Assignment extends Expression {
		private final String identifier;
		private final Expression value;

		public Assignment(String identifier, Expression value) {
			this.identifier = Objects.requireNonNull(identifier, "identifier");
			this.value = Objects.requireNonNull(value, "value");
		}

		public String getIdentifier() {
			return identifier;
		}

		public Expression getValue() {
			return value;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitAssignment(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Assignment)) {
				return false;
			}
			Assignment other = (Assignment) o;
			return identifier.equals(other.identifier) && value.equals(other.value);
		}

		@Override
		public int hashCode() {
			return Objects.hash("=", identifier, value);
		}

		@Override
		public String toString() {
			return identifier + " = " + value;
		}
	}
}
