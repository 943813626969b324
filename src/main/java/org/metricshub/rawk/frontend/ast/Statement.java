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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Statement nodes of the syntax tree.
 * <p>
 * Compound assignment operators other than {@code +=} are flattened by the
 * parser into plain assignments of an {@link Expression.Infix}, so the
 * variants below are all the evaluator has to support.
 */
public abstract class Statement {

	/**
	 * Visitor over the statement variants.
	 *
	 * @param <R> result type
	 */
	public interface Visitor<R> {
		R visitPrint(Print stmt);

		R visitPrintf(Printf stmt);

		R visitGsub(Gsub stmt);

		R visitAssignment(Assignment stmt);

		R visitFieldAssignment(FieldAssignment stmt);

		R visitAddAssignment(AddAssignment stmt);

		R visitPreIncrement(PreIncrement stmt);

		R visitPostIncrement(PostIncrement stmt);

		R visitIf(If stmt);

		R visitWhile(While stmt);

		R visitFor(For stmt);

		R visitBlock(Block stmt);

		R visitExit(Exit stmt);

		R visitNext(Next stmt);

		R visitArrayAssignment(ArrayAssignment stmt);

		R visitArrayAddAssignment(ArrayAddAssignment stmt);
	}

	public abstract <R> R accept(Visitor<R> visitor);

	private static List<Expression> copyOf(List<Expression> expressions) {
		return Collections.unmodifiableList(new ArrayList<Expression>(expressions));
	}

	private static String join(List<?> items, String separator) {
		StringBuilder sb = new StringBuilder();
		for (Object item : items) {
			if (sb.length() > 0) {
				sb.append(separator);
			}
			sb.append(item);
		}
		return sb.toString();
	}

	/**
	 * {@code print expr, expr, ...}.
	 * <p>
	 * The argument list holds the printed expressions interleaved with the
	 * separators inserted for each comma (references to {@code OFS}), so the
	 * evaluator only concatenates. An empty list prints {@code $0}.
	 */
	public static final class Print extends Statement {
		private final List<Expression> expressions;

		public Print(List<Expression> expressions) {
			this.expressions = copyOf(expressions);
		}

		public List<Expression> getExpressions() {
			return expressions;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitPrint(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Print && ((Print) o).expressions.equals(expressions);
		}

		@Override
		public int hashCode() {
			return Objects.hash("print", expressions);
		}

		@Override
		public String toString() {
			if (expressions.isEmpty()) {
				return "print";
			}
			StringBuilder sb = new StringBuilder("print ");
			for (int i = 0; i < expressions.size(); i++) {
				// odd positions are the separators inserted for commas
				sb.append(i % 2 == 0 ? expressions.get(i).toString() : ", ");
			}
			return sb.toString();
		}
	}

	/**
	 * {@code printf format, expr, ...}.
	 */
	public static final class Printf extends Statement {
		private final List<Expression> expressions;

		public Printf(List<Expression> expressions) {
			this.expressions = copyOf(expressions);
		}

		/**
		 * @return the format expression followed by the arguments
		 */
		public List<Expression> getExpressions() {
			return expressions;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitPrintf(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Printf && ((Printf) o).expressions.equals(expressions);
		}

		@Override
		public int hashCode() {
			return Objects.hash("printf", expressions);
		}

		@Override
		public String toString() {
			return "printf " + join(expressions, ", ");
		}
	}

	/**
	 * {@code gsub(pattern, replacement)} applied to the current record.
	 */
	public static final class Gsub extends Statement {
		private final Expression pattern;
		private final Expression replacement;

		public Gsub(Expression pattern, Expression replacement) {
			this.pattern = Objects.requireNonNull(pattern, "pattern");
			this.replacement = Objects.requireNonNull(replacement, "replacement");
		}

		public Expression getPattern() {
			return pattern;
		}

		public Expression getReplacement() {
			return replacement;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitGsub(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof Gsub)) {
				return false;
			}
			Gsub other = (Gsub) o;
			return pattern.equals(other.pattern) && replacement.equals(other.replacement);
		}

		@Override
		public int hashCode() {
			return Objects.hash("gsub", pattern, replacement);
		}

		@Override
		public String toString() {
			return "gsub(" + pattern + ", " + replacement + ")";
		}
	}

	/**
	 * {@code identifier = value}. The value may itself be an
	 * {@link Expression.Assignment} for chained assignments.
	 */
	public static final class Assignment extends Statement {
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

	/**
	 * {@code $index = value}.
	 */
	public static final class FieldAssignment extends Statement {
		private final Expression index;
		private final Expression value;

		public FieldAssignment(Expression index, Expression value) {
			this.index = Objects.requireNonNull(index, "index");
			this.value = Objects.requireNonNull(value, "value");
		}

		public Expression getIndex() {
			return index;
		}

		public Expression getValue() {
			return value;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitFieldAssignment(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof FieldAssignment)) {
				return false;
			}
			FieldAssignment other = (FieldAssignment) o;
			return index.equals(other.index) && value.equals(other.value);
		}

		@Override
		public int hashCode() {
			return Objects.hash("$=", index, value);
		}

		@Override
		public String toString() {
			return new Expression.Field(index) + " = " + value;
		}
	}

	/**
	 * {@code identifier += value}.
	 */
	public static final class AddAssignment extends Statement {
		private final String identifier;
		private final Expression value;

		public AddAssignment(String identifier, Expression value) {
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
			return visitor.visitAddAssignment(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof AddAssignment)) {
				return false;
			}
			AddAssignment other = (AddAssignment) o;
			return identifier.equals(other.identifier) && value.equals(other.value);
		}

		@Override
		public int hashCode() {
			return Objects.hash("+=", identifier, value);
		}

		@Override
		public String toString() {
			return identifier + " += " + value;
		}
	}

	/**
	 * {@code ++identifier}.
	 */
	public static final class PreIncrement extends Statement {
		private final String identifier;

		public PreIncrement(String identifier) {
			this.identifier = Objects.requireNonNull(identifier, "identifier");
		}

		public String getIdentifier() {
			return identifier;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitPreIncrement(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof PreIncrement && ((PreIncrement) o).identifier.equals(identifier);
		}

		@Override
		public int hashCode() {
			return Objects.hash("++x", identifier);
		}

		@Override
		public String toString() {
			return "++" + identifier;
		}
	}

	/**
	 * {@code identifier++}.
	 */
	public static final class PostIncrement extends Statement {
		private final String identifier;

		public PostIncrement(String identifier) {
			this.identifier = Objects.requireNonNull(identifier, "identifier");
		}

		public String getIdentifier() {
			return identifier;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitPostIncrement(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof PostIncrement && ((PostIncrement) o).identifier.equals(identifier);
		}

		@Override
		public int hashCode() {
			return Objects.hash("x++", identifier);
		}

		@Override
		public String toString() {
			return identifier + "++";
		}
	}

	/**
	 * {@code if (condition) then [else otherwise]}.
	 */
	public static final class If extends Statement {
		private final Expression condition;
		private final Statement then;
		private final Statement otherwise;

		public If(Expression condition, Statement then, Statement otherwise) {
			this.condition = Objects.requireNonNull(condition, "condition");
			this.then = Objects.requireNonNull(then, "then");
			this.otherwise = otherwise;
		}

		public Expression getCondition() {
			return condition;
		}

		public Statement getThen() {
			return then;
		}

		/**
		 * @return the else branch, or null
		 */
		public Statement getOtherwise() {
			return otherwise;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitIf(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof If)) {
				return false;
			}
			If other = (If) o;
			return condition.equals(other.condition) && then.equals(other.then) && Objects.equals(otherwise, other.otherwise);
		}

		@Override
		public int hashCode() {
			return Objects.hash("if", condition, then, otherwise);
		}

		@Override
		public String toString() {
			String s = "if (" + condition + ") " + then;
			if (otherwise != null) {
				s += "\nelse " + otherwise;
			}
			return s;
		}
	}

	/**
	 * {@code while (condition) body}.
	 */
	public static final class While extends Statement {
		private final Expression condition;
		private final Statement body;

		public While(Expression condition, Statement body) {
			this.condition = Objects.requireNonNull(condition, "condition");
			this.body = Objects.requireNonNull(body, "body");
		}

		public Expression getCondition() {
			return condition;
		}

		public Statement getBody() {
			return body;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitWhile(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof While)) {
				return false;
			}
			While other = (While) o;
			return condition.equals(other.condition) && body.equals(other.body);
		}

		@Override
		public int hashCode() {
			return Objects.hash("while", condition, body);
		}

		@Override
		public String toString() {
			return "while (" + condition + ") " + body;
		}
	}

	/**
	 * {@code for (init; condition; update) body}. Each clause may be absent
	 * (null); an absent condition is always true.
	 */
	public static final class For extends Statement {
		private final Statement init;
		private final Expression condition;
		private final Statement update;
		private final Statement body;

		public For(Statement init, Expression condition, Statement update, Statement body) {
			this.init = init;
			this.condition = condition;
			this.update = update;
			this.body = Objects.requireNonNull(body, "body");
		}

		public Statement getInit() {
			return init;
		}

		public Expression getCondition() {
			return condition;
		}

		public Statement getUpdate() {
			return update;
		}

		public Statement getBody() {
			return body;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitFor(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof For)) {
				return false;
			}
			For other = (For) o;
			return Objects.equals(init, other.init)
					&& Objects.equals(condition, other.condition)
					&& Objects.equals(update, other.update)
					&& body.equals(other.body);
		}

		@Override
		public int hashCode() {
			return Objects.hash("for", init, condition, update, body);
		}

		@Override
		public String toString() {
			return "for ("
					+ (init == null ? "" : init.toString())
					+ "; "
					+ (condition == null ? "" : condition.toString())
					+ "; "
					+ (update == null ? "" : update.toString())
					+ ") "
					+ body;
		}
	}

	/**
	 * <code>{ statement ... }</code>.
	 */
	public static final class Block extends Statement {
		private final List<Statement> statements;

		public Block(List<Statement> statements) {
			this.statements = Collections.unmodifiableList(new ArrayList<Statement>(statements));
		}

		public List<Statement> getStatements() {
			return statements;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitBlock(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Block && ((Block) o).statements.equals(statements);
		}

		@Override
		public int hashCode() {
			return Objects.hash("block", statements);
		}

		@Override
		public String toString() {
			return "{\n" + join(statements, "\n") + "\n}";
		}
	}

	public static final class Exit extends Statement {
		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitExit(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Exit;
		}

		@Override
		public int hashCode() {
			return Exit.class.hashCode();
		}

		@Override
		public String toString() {
			return "exit";
		}
	}

	public static final class Next extends Statement {
		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitNext(this);
		}

		@Override
		public boolean equals(Object o) {
			return o instanceof Next;
		}

		@Override
		public int hashCode() {
			return Next.class.hashCode();
		}

		@Override
		public String toString() {
			return "next";
		}
	}

	/**
	 * {@code identifier[index] = value}.
	 */
	public static final class ArrayAssignment extends Statement {
		private final String identifier;
		private final Expression index;
		private final Expression value;

		public ArrayAssignment(String identifier, Expression index, Expression value) {
			this.identifier = Objects.requireNonNull(identifier, "identifier");
			this.index = Objects.requireNonNull(index, "index");
			this.value = Objects.requireNonNull(value, "value");
		}

		public String getIdentifier() {
			return identifier;
		}

		public Expression getIndex() {
			return index;
		}

		public Expression getValue() {
			return value;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitArrayAssignment(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof ArrayAssignment)) {
				return false;
			}
			ArrayAssignment other = (ArrayAssignment) o;
			return identifier.equals(other.identifier) && index.equals(other.index) && value.equals(other.value);
		}

		@Override
		public int hashCode() {
			return Objects.hash("[]=", identifier, index, value);
		}

		@Override
		public String toString() {
			return identifier + "[" + index + "] = " + value;
		}
	}

	/**
	 * {@code identifier[index] += value}; {@code a[i]++} is represented with a
	 * value of 1.
	 */
	public static final class ArrayAddAssignment extends Statement {
		private final String identifier;
		private final Expression index;
		private final Expression value;

		public ArrayAddAssignment(String identifier, Expression index, Expression value) {
			this.identifier = Objects.requireNonNull(identifier, "identifier");
			this.index = Objects.requireNonNull(index, "index");
			this.value = Objects.requireNonNull(value, "value");
		}

		public String getIdentifier() {
			return identifier;
		}

		public Expression getIndex() {
			return index;
		}

		public Expression getValue() {
			return value;
		}

		@Override
		public <R> R accept(Visitor<R> visitor) {
			return visitor.visitArrayAddAssignment(this);
		}

		@Override
		public boolean equals(Object o) {
			if (!(o instanceof ArrayAddAssignment)) {
				return false;
			}
			ArrayAddAssignment other = (ArrayAddAssignment) o;
			return identifier.equals(other.identifier) && index.equals(other.index) && value.equals(other.value);
		}

		@Override
		public int hashCode() {
			return Objects.hash("[]+=", identifier, index, value);
		}

		@Override
		public String toString() {
			return identifier + "[" + index + "] += " + value;
		}
	}
}
