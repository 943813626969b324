package org.metricshub.rawk.backend;

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
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.function.Consumer;
import org.metricshub.rawk.frontend.TokenKind;
import org.metricshub.rawk.frontend.ast.Action;
import org.metricshub.rawk.frontend.ast.Expression;
import org.metricshub.rawk.frontend.ast.Program;
import org.metricshub.rawk.frontend.ast.Rule;
import org.metricshub.rawk.frontend.ast.Statement;
import org.metricshub.rawk.jrt.AwkFormatter;
import org.metricshub.rawk.jrt.AwkRegex;
import org.metricshub.rawk.jrt.AwkValue;
import org.metricshub.rawk.jrt.ConditionPair;
import org.metricshub.rawk.jrt.JRT;
import org.metricshub.rawk.util.AwkLogger;
import org.metricshub.rawk.util.AwkSettings;
import org.slf4j.Logger;

/**
 * Tree-walking interpreter of a parsed {@link Program}.
 * <p>
 * One instance runs the program once: it owns the {@link JRT} holding the
 * record, the fields, the variables and the range states. Every line
 * produced by {@code print} and {@code printf} is handed to the output
 * consumer, without line terminator.
 * <p>
 * AWK-level problems never raise an exception: invalid numbers are 0,
 * missing fields and unset variables are empty.
 */
public class Evaluator implements AwkInterpreter {

	private static final Logger LOG = AwkLogger.getLogger(Evaluator.class);

	private enum Phase {
		BEGIN, MAIN, END
	}

	private final Program program;
	private final Consumer<String> output;
	private final JRT jrt;
	private final Map<String, AwkRegex> regexCache = new HashMap<String, AwkRegex>();
	private final ExpressionEvaluator expressionEvaluator = new ExpressionEvaluator();
	private final StatementExecutor statementExecutor = new StatementExecutor();

	private Phase phase = Phase.BEGIN;
	// set by exit, checked after each statement
	private boolean exitRequested;
	// set by next, checked after each statement
	private boolean nextRequested;
	private boolean used;

	/**
	 * @param program the program to run
	 * @param output receives each output line
	 */
	public Evaluator(Program program, Consumer<String> output) {
		this(program, output, null);
	}

	/**
	 * @param program the program to run
	 * @param output receives each output line
	 * @param settings initial FS, FILENAME and variables, may be null
	 */
	public Evaluator(Program program, Consumer<String> output, AwkSettings settings) {
		this.program = program;
		this.output = output;
		this.jrt = new JRT(program.getRules().size());

		if (settings != null) {
			if (settings.getFieldSeparator() != null) {
				jrt.setFS(JRT.unescape(settings.getFieldSeparator()));
			}
			jrt.setFILENAME(settings.getFilename());
			for (Map.Entry<String, String> variable : settings.getVariables().entrySet()) {
				jrt.setVariable(variable.getKey(), AwkValue.of(JRT.unescape(variable.getValue())));
			}
		}
	}

	/**
	 * Runs a program over a list of records.
	 *
	 * @param program the program to run
	 * @param records the input records
	 * @return the output lines
	 */
	public static List<String> eval(Program program, List<String> records) {
		List<String> lines = new ArrayList<String>();
		new Evaluator(program, lines::add).interpret(records.iterator());
		return lines;
	}

	/** {@inheritDoc} */
	@Override
	public void interpret(Iterator<String> records) {
		if (used) {
			throw new IllegalStateException("An Evaluator can only run once");
		}
		used = true;

		LOG.debug("Running {} BEGIN blocks", program.getBeginBlocks().size());
		phase = Phase.BEGIN;
		runBlocks(program.getBeginBlocks());

		phase = Phase.MAIN;
		if (!exitRequested && !program.getRules().isEmpty()) {
			while (records.hasNext()) {
				jrt.consumeRecord(records.next());
				processRecord();
				if (exitRequested) {
					LOG.debug("exit requested at record {}", jrt.getNR());
					break;
				}
			}
		} else if (!exitRequested && !program.getEndBlocks().isEmpty()) {
			// no main rule, but END may still use NR
			while (records.hasNext()) {
				jrt.consumeRecord(records.next());
			}
		}

		LOG.debug("Running {} END blocks after {} records", program.getEndBlocks().size(), jrt.getNR());
		phase = Phase.END;
		exitRequested = false;
		jrt.setInputLine("");
		runBlocks(program.getEndBlocks());
	}

	private void runBlocks(List<Rule> blocks) {
		for (Rule block : blocks) {
			execute(block.getAction());
			if (exitRequested) {
				return;
			}
		}
	}

	/**
	 * Runs every main rule, in order, against the current record.
	 */
	private void processRecord() {
		nextRequested = false;
		List<Rule> rules = program.getRules();
		for (int i = 0; i < rules.size(); i++) {
			Rule rule = rules.get(i);
			if (rule instanceof Rule.PatternAction) {
				Expression pattern = ((Rule.PatternAction) rule).getPattern();
				if (pattern != null && !condition(pattern, i)) {
					continue;
				}
				if (rule.getAction() == null) {
					output.accept(jrt.getInputLine());
					continue;
				}
			}
			execute(rule.getAction());
			if (exitRequested || nextRequested) {
				return;
			}
		}
	}

	private void execute(Action action) {
		execute(action.getStatements());
	}

	private void execute(List<Statement> statements) {
		for (Statement statement : statements) {
			statement.accept(statementExecutor);
			if (isInterrupted()) {
				return;
			}
		}
	}

	private void execute(Statement statement) {
		if (statement != null) {
			statement.accept(statementExecutor);
		}
	}

	private boolean isInterrupted() {
		return exitRequested || nextRequested;
	}

	// CONDITIONS

	/**
	 * Evaluates an expression used as a pattern or a condition.
	 *
	 * @param expression the condition
	 * @param ruleIndex index of the main rule whose pattern is evaluated, or
	 *        -1 outside of a pattern
	 * @return the truth value
	 */
	private boolean condition(Expression expression, int ruleIndex) {
		if (expression instanceof Expression.RegexLiteral) {
			return regex(((Expression.RegexLiteral) expression).getPattern()).matches(jrt.getInputLine());
		}
		if (expression instanceof Expression.Infix) {
			Expression.Infix infix = (Expression.Infix) expression;
			switch (infix.getOperator().getKind()) {
			case COMMA:
				return range(infix, ruleIndex);
			case AND:
				return condition(infix.getLeft(), ruleIndex) && condition(infix.getRight(), ruleIndex);
			case OR:
				return condition(infix.getLeft(), ruleIndex) || condition(infix.getRight(), ruleIndex);
			case MATCHES:
				return match(infix);
			case NOT_MATCHES:
				return !match(infix);
			case EQ:
				return JRT.compare(evaluate(infix.getLeft()), evaluate(infix.getRight()), 0);
			case NE:
				return !JRT.compare(evaluate(infix.getLeft()), evaluate(infix.getRight()), 0);
			case LT:
				return JRT.compare(evaluate(infix.getLeft()), evaluate(infix.getRight()), -1);
			case LE:
				return !JRT.compare(evaluate(infix.getLeft()), evaluate(infix.getRight()), 1);
			case GT:
				return JRT.compare(evaluate(infix.getLeft()), evaluate(infix.getRight()), 1);
			case GE:
				return !JRT.compare(evaluate(infix.getLeft()), evaluate(infix.getRight()), -1);
			default:
				break;
			}
		}
		return JRT.toBoolean(evaluate(expression));
	}

	/**
	 * A range pattern includes the records from a match of its left side
	 * through the next match of its right side, which may be the same record.
	 */
	private boolean range(Expression.Infix range, int ruleIndex) {
		if (ruleIndex < 0) {
			LOG.warn("Range {} used outside of a pattern is always false", range);
			return false;
		}
		ConditionPair pair = jrt.getConditionPair(ruleIndex);
		if (pair.isActive()) {
			return pair.update(false, condition(range.getRight(), -1));
		}
		if (!condition(range.getLeft(), -1)) {
			return false;
		}
		return pair.update(true, condition(range.getRight(), -1));
	}

	/**
	 * {@code text ~ regex}: the right side is a regex literal or an expression
	 * whose string value is used as the regular expression.
	 */
	private boolean match(Expression.Infix infix) {
		String text = JRT.toAwkString(evaluate(infix.getLeft()));
		return regexOf(infix.getRight()).matches(text);
	}

	private AwkRegex regexOf(Expression expression) {
		if (expression instanceof Expression.RegexLiteral) {
			return regex(((Expression.RegexLiteral) expression).getPattern());
		}
		return regex(JRT.toAwkString(evaluate(expression)));
	}

	private AwkRegex regex(String pattern) {
		AwkRegex regex = regexCache.get(pattern);
		if (regex == null) {
			regex = new AwkRegex(pattern);
			regexCache.put(pattern, regex);
		}
		return regex;
	}

	// VALUES

	private AwkValue evaluate(Expression expression) {
		return expression.accept(expressionEvaluator);
	}

	private String evaluateString(Expression expression) {
		return JRT.toAwkString(evaluate(expression));
	}

	private double evaluateNumber(Expression expression) {
		return JRT.toDouble(evaluate(expression));
	}

	private long fieldIndex(Expression index) {
		double d = evaluateNumber(index);
		return Double.isNaN(d) ? -1 : (long) d;
	}

	private static String substr(String s, double start, double length) {
		// positions are rounded to the nearest integer, then clamped to the string
		double first = Math.rint(start);
		double last = first + Math.rint(length); // exclusive
		if (Double.isNaN(first) || Double.isNaN(last)) {
			return "";
		}
		double from = Math.max(1, first);
		double to = Math.min(s.length() + 1, last);
		if (to <= from) {
			return "";
		}
		return s.substring((int) from - 1, (int) to - 1);
	}

	private static AwkValue arithmetic(TokenKind operator, double left, double right) {
		switch (operator) {
		case PLUS:
			return AwkValue.of(left + right);
		case MINUS:
			return AwkValue.of(left - right);
		case MULT:
			return AwkValue.of(left * right);
		case DIVIDE:
			if (right == 0) {
				LOG.warn("Division by zero: {} / {}", JRT.toAwkString(left), JRT.toAwkString(right));
			}
			return AwkValue.of(left / right);
		case MOD:
			if (right == 0) {
				LOG.warn("Division by zero in modulo: {} % {}", JRT.toAwkString(left), JRT.toAwkString(right));
			}
			return AwkValue.of(left % right);
		case POW:
			return AwkValue.of(Math.pow(left, right));
		default:
			throw new IllegalArgumentException("Not an arithmetic operator: " + operator);
		}
	}

	/**
	 * Computes the value of expressions.
	 */
	private final class ExpressionEvaluator implements Expression.Visitor<AwkValue> {

		@Override
		public AwkValue visitNumberLiteral(Expression.NumberLiteral expr) {
			return AwkValue.of(expr.getValue());
		}

		@Override
		public AwkValue visitStringLiteral(Expression.StringLiteral expr) {
			return AwkValue.of(JRT.unescape(expr.getRaw()));
		}

		@Override
		public AwkValue visitRegexLiteral(Expression.RegexLiteral expr) {
			// a regex alone matches against $0
			return AwkValue.of(condition(expr, -1));
		}

		@Override
		public AwkValue visitField(Expression.Field expr) {
			return AwkValue.of(jrt.jrtGetInputField(fieldIndex(expr.getIndex())));
		}

		@Override
		public AwkValue visitIdentifier(Expression.Identifier expr) {
			return jrt.getVariable(expr.getName());
		}

		@Override
		public AwkValue visitArrayAccess(Expression.ArrayAccess expr) {
			return jrt.getArrayElement(expr.getIdentifier(), evaluateString(expr.getIndex()));
		}

		@Override
		public AwkValue visitLength(Expression.Length expr) {
			String s = expr.getArgument() == null ? jrt.getInputLine() : evaluateString(expr.getArgument());
			return AwkValue.of((double) s.length());
		}

		@Override
		public AwkValue visitSubstr(Expression.Substr expr) {
			String s = evaluateString(expr.getString());
			double start = evaluateNumber(expr.getStart());
			double length = expr.getLength() == null ? Double.POSITIVE_INFINITY : evaluateNumber(expr.getLength());
			return AwkValue.of(substr(s, start, length));
		}

		@Override
		public AwkValue visitConcatenation(Expression.Concatenation expr) {
			return AwkValue.of(evaluateString(expr.getLeft()) + evaluateString(expr.getRight()));
		}

		@Override
		public AwkValue visitInfix(Expression.Infix expr) {
			TokenKind operator = expr.getOperator().getKind();
			switch (operator) {
			case PLUS:
			case MINUS:
			case MULT:
			case DIVIDE:
			case MOD:
			case POW:
				return arithmetic(operator, evaluateNumber(expr.getLeft()), evaluateNumber(expr.getRight()));
			case AND:
			case OR:
			case MATCHES:
			case NOT_MATCHES:
			case EQ:
			case NE:
			case LT:
			case LE:
			case GT:
			case GE:
				return AwkValue.of(condition(expr, -1));
			default:
				throw new IllegalArgumentException("Not a binary operator: " + expr.getOperator());
			}
		}

		@Override
		public AwkValue visitUnary(Expression.Unary expr) {
			switch (expr.getOperator().getKind()) {
			case MINUS:
				return AwkValue.of(-evaluateNumber(expr.getOperand()));
			case PLUS:
				return AwkValue.of(evaluateNumber(expr.getOperand()));
			case NOT:
				return AwkValue.of(!condition(expr.getOperand(), -1));
			default:
				throw new IllegalArgumentException("Not a unary operator: " + expr.getOperator());
			}
		}

		@Override
		public AwkValue visitAssignment(Expression.Assignment expr) {
			AwkValue value = evaluate(expr.getValue());
			jrt.setVariable(expr.getIdentifier(), value);
			return value;
		}
	}

	/**
	 * Executes statements.
	 */
	private final class StatementExecutor implements Statement.Visitor<Void> {

		@Override
		public Void visitPrint(Statement.Print stmt) {
			if (stmt.getExpressions().isEmpty()) {
				output.accept(jrt.getInputLine());
				return null;
			}
			StringBuilder line = new StringBuilder();
			for (Expression expression : stmt.getExpressions()) {
				line.append(evaluateString(expression));
			}
			output.accept(line.toString());
			return null;
		}

		@Override
		public Void visitPrintf(Statement.Printf stmt) {
			List<Expression> expressions = stmt.getExpressions();
			String format = evaluateString(expressions.get(0));
			List<AwkValue> arguments = new ArrayList<AwkValue>(expressions.size() - 1);
			for (Expression expression : expressions.subList(1, expressions.size())) {
				arguments.add(evaluate(expression));
			}
			String rendered = AwkFormatter.sprintf(format, arguments);
			output.accept(AwkFormatter.expandTabs(AwkFormatter.stripLineTerminator(rendered)));
			return null;
		}

		@Override
		public Void visitGsub(Statement.Gsub stmt) {
			AwkRegex regex = regexOf(stmt.getPattern());
			String replacement = evaluateString(stmt.getReplacement());
			String record = jrt.getInputLine();
			String replaced = regex.replaceAll(record, replacement);
			if (!replaced.equals(record)) {
				jrt.setInputLine(replaced);
			}
			return null;
		}

		@Override
		public Void visitAssignment(Statement.Assignment stmt) {
			jrt.setVariable(stmt.getIdentifier(), evaluate(stmt.getValue()));
			return null;
		}

		@Override
		public Void visitFieldAssignment(Statement.FieldAssignment stmt) {
			long index = fieldIndex(stmt.getIndex());
			jrt.jrtSetInputField(evaluateString(stmt.getValue()), index);
			return null;
		}

		@Override
		public Void visitAddAssignment(Statement.AddAssignment stmt) {
			double current = JRT.toDouble(jrt.getVariable(stmt.getIdentifier()));
			jrt.setVariable(stmt.getIdentifier(), AwkValue.of(current + evaluateNumber(stmt.getValue())));
			return null;
		}

		@Override
		public Void visitPreIncrement(Statement.PreIncrement stmt) {
			increment(stmt.getIdentifier());
			return null;
		}

		@Override
		public Void visitPostIncrement(Statement.PostIncrement stmt) {
			// the value of the expression is not used, so this is the same as ++x
			increment(stmt.getIdentifier());
			return null;
		}

		private void increment(String identifier) {
			jrt.setVariable(identifier, AwkValue.of(JRT.toDouble(jrt.getVariable(identifier)) + 1));
		}

		@Override
		public Void visitIf(Statement.If stmt) {
			if (condition(stmt.getCondition(), -1)) {
				execute(stmt.getThen());
			} else {
				execute(stmt.getOtherwise());
			}
			return null;
		}

		@Override
		public Void visitWhile(Statement.While stmt) {
			while (!isInterrupted() && condition(stmt.getCondition(), -1)) {
				execute(stmt.getBody());
			}
			return null;
		}

		@Override
		public Void visitFor(Statement.For stmt) {
			execute(stmt.getInit());
			while (!isInterrupted() && (stmt.getCondition() == null || condition(stmt.getCondition(), -1))) {
				execute(stmt.getBody());
				if (isInterrupted()) {
					break;
				}
				execute(stmt.getUpdate());
			}
			return null;
		}

		@Override
		public Void visitBlock(Statement.Block stmt) {
			execute(stmt.getStatements());
			return null;
		}

		@Override
		public Void visitExit(Statement.Exit stmt) {
			exitRequested = true;
			return null;
		}

		@Override
		public Void visitNext(Statement.Next stmt) {
			if (phase == Phase.MAIN) {
				nextRequested = true;
			} else {
				LOG.debug("next ignored in {} block", phase);
			}
			return null;
		}

		@Override
		public Void visitArrayAssignment(Statement.ArrayAssignment stmt) {
			String key = evaluateString(stmt.getIndex());
			jrt.setArrayElement(stmt.getIdentifier(), key, evaluate(stmt.getValue()));
			return null;
		}

		@Override
		public Void visitArrayAddAssignment(Statement.ArrayAddAssignment stmt) {
			String key = evaluateString(stmt.getIndex());
			double current = JRT.toDouble(jrt.getArrayElement(stmt.getIdentifier(), key));
			jrt.setArrayElement(stmt.getIdentifier(), key, AwkValue.of(current + evaluateNumber(stmt.getValue())));
			return null;
		}
	}
}
