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

import java.util.ArrayList;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.metricshub.rawk.frontend.ast.Action;
import org.metricshub.rawk.frontend.ast.Expression;
import org.metricshub.rawk.frontend.ast.ParserException;
import org.metricshub.rawk.frontend.ast.Program;
import org.metricshub.rawk.frontend.ast.Rule;
import org.metricshub.rawk.frontend.ast.Statement;
import org.metricshub.rawk.util.AwkLogger;
import org.metricshub.rawk.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Converts the tokens of an AWK script into a {@link Program}.
 * <p>
 * Statements and rules are parsed by recursive descent. Expressions are
 * parsed by precedence climbing, using the binding powers below (lowest to
 * highest):
 *
 * <pre>
 * ||                       1/2
 * &amp;&amp;                       3/4
 * == != &gt; &gt;= &lt; &lt;= ~ !~      5/6
 * (implicit concatenation) 6/7
 * + -                      7/8
 * * / %                    9/10
 * unary - + !              11
 * ^                        13/12 (right-associative)
 * </pre>
 * <p>
 * Whenever a construct is not supported, a {@link ParserException} is thrown
 * with the offending token and its offset in the script.
 *
 * @author Danny Daglas
 */
public class AwkParser {

	private static final Logger LOG = AwkLogger.getLogger(AwkParser.class);

	/**
	 * Left and right binding powers of the binary operators.
	 */
	private static final Map<TokenKind, int[]> BINDING_POWERS = new EnumMap<TokenKind, int[]>(TokenKind.class);

	static {
		BINDING_POWERS.put(TokenKind.OR, new int[] { 1, 2 });
		BINDING_POWERS.put(TokenKind.AND, new int[] { 3, 4 });
		BINDING_POWERS.put(TokenKind.EQ, new int[] { 5, 6 });
		BINDING_POWERS.put(TokenKind.NE, new int[] { 5, 6 });
		BINDING_POWERS.put(TokenKind.GT, new int[] { 5, 6 });
		BINDING_POWERS.put(TokenKind.GE, new int[] { 5, 6 });
		BINDING_POWERS.put(TokenKind.LT, new int[] { 5, 6 });
		BINDING_POWERS.put(TokenKind.LE, new int[] { 5, 6 });
		BINDING_POWERS.put(TokenKind.MATCHES, new int[] { 5, 6 });
		BINDING_POWERS.put(TokenKind.NOT_MATCHES, new int[] { 5, 6 });
		BINDING_POWERS.put(TokenKind.PLUS, new int[] { 7, 8 });
		BINDING_POWERS.put(TokenKind.MINUS, new int[] { 7, 8 });
		BINDING_POWERS.put(TokenKind.MULT, new int[] { 9, 10 });
		BINDING_POWERS.put(TokenKind.DIVIDE, new int[] { 9, 10 });
		BINDING_POWERS.put(TokenKind.MOD, new int[] { 9, 10 });
		BINDING_POWERS.put(TokenKind.POW, new int[] { 13, 12 });
	}

	private static final int CONCATENATION_LEFT_BP = 6;
	private static final int CONCATENATION_RIGHT_BP = 7;
	private static final int UNARY_BP = 11;

	private final Lexer lexer;
	private final String description;
	private Token token;

	/**
	 * Creates a parser for an inline script.
	 *
	 * @param script text of the AWK script
	 */
	public AwkParser(String script) {
		this(script, ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT);
	}

	/**
	 * @param script text of the AWK script
	 * @param description description of where the script comes from, used in
	 *        error messages
	 */
	public AwkParser(String script, String description) {
		this.lexer = new Lexer(script);
		this.description = description;
	}

	/**
	 * Parses the whole script.
	 *
	 * @return the parsed program
	 * @throws ParserException if the script is invalid or uses an unsupported
	 *         construct
	 */
	public Program parseProgram() throws ParserException {
		if (token != null) {
			throw new IllegalStateException("The script has already been parsed");
		}
		// a script may start with a regular expression pattern
		lexer.setRegexAllowed(true);
		token = lexer.next();
		Program program = SCRIPT();
		LOG.debug(
				"Parsed {}: {} BEGIN, {} main and {} END rules",
				description,
				program.getBeginBlocks().size(),
				program.getRules().size(),
				program.getEndBlocks().size());
		return program;
	}

	/**
	 * Fetches the next token. A slash is read as the start of a regular
	 * expression unless the current token ends an operand.
	 */
	private void advance() {
		lexer.setRegexAllowed(!endsOperand(token.getKind()));
		token = lexer.next();
	}

	private static boolean endsOperand(TokenKind kind) {
		switch (kind) {
		case NUMBER:
		case STRING:
		case REGEX:
		case IDENTIFIER:
		case RIGHT_PAREN:
		case RIGHT_BRACKET:
		case INC:
		case DEC:
		case FUNC_LENGTH:
			return true;
		default:
			return false;
		}
	}

	private void expect(TokenKind kind, String what) throws ParserException {
		if (!token.is(kind)) {
			throw parserException("Expecting " + what + ". Got " + describe(token));
		}
		advance();
	}

	private static String describe(Token t) {
		switch (t.getKind()) {
		case EOF:
			return "end of script";
		case NEWLINE:
			return "newline";
		case ILLEGAL:
			return "illegal character sequence '" + t.getLiteral() + "'";
		default:
			return t.getKind().name() + " '" + t.getLiteral() + "'";
		}
	}

	private ParserException parserException(String msg) {
		return new ParserException(msg, description, token.getOffset(), token);
	}

	// SUPPORTING FUNCTIONS/METHODS
	private void optNewlines() {
		while (token.is(TokenKind.NEWLINE)) {
			advance();
		}
	}

	private void optTerminators() {
		while (token.is(TokenKind.NEWLINE) || token.is(TokenKind.SEMICOLON)) {
			advance();
		}
	}

	private boolean atStatementEnd() {
		switch (token.getKind()) {
		case NEWLINE:
		case SEMICOLON:
		case RIGHT_BRACE:
		case RIGHT_PAREN:
		case EOF:
			return true;
		default:
			return false;
		}
	}

	private void terminator() throws ParserException {
		if (token.is(TokenKind.NEWLINE) || token.is(TokenKind.SEMICOLON)) {
			advance();
		} else if (!token.is(TokenKind.RIGHT_BRACE) && !token.is(TokenKind.EOF)) {
			throw parserException("Expecting statement terminator. Got " + describe(token));
		}
	}

	private static boolean isRedirection(Token t) {
		return t.is(TokenKind.GT) || t.is(TokenKind.APPEND) || t.is(TokenKind.PIPE);
	}

	/**
	 * Maps a compound assignment (or increment) token to the arithmetic
	 * operator it applies.
	 */
	private static Token arithmeticOperator(Token compound) {
		switch (compound.getKind()) {
		case PLUS_EQ:
		case INC:
			return new Token(TokenKind.PLUS, "+", compound.getOffset());
		case MINUS_EQ:
		case DEC:
			return new Token(TokenKind.MINUS, "-", compound.getOffset());
		case MULT_EQ:
			return new Token(TokenKind.MULT, "*", compound.getOffset());
		case DIV_EQ:
			return new Token(TokenKind.DIVIDE, "/", compound.getOffset());
		case MOD_EQ:
			return new Token(TokenKind.MOD, "%", compound.getOffset());
		case POW_EQ:
			return new Token(TokenKind.POW, "^", compound.getOffset());
		default:
			return null;
		}
	}

	private static double parseNumber(String literal) {
		if (literal.startsWith("0x") || literal.startsWith("0X")) {
			return Long.parseLong(literal.substring(2), 16);
		}
		return Double.parseDouble(literal);
	}

	// RECURSIVE DECENT PARSER:
	// CHECKSTYLE.OFF: MethodName
	// SCRIPT : [RULE terminators]* EOF
	Program SCRIPT() throws ParserException {
		Program program = new Program();
		optTerminators();
		while (!token.is(TokenKind.EOF)) {
			program.addRule(RULE());
			optTerminators();
		}
		return program;
	}

	// RULE : BEGIN ACTION | END ACTION | ACTION | EXPRESSION [, EXPRESSION] [ACTION]
	Rule RULE() throws ParserException {
		if (token.is(TokenKind.KW_BEGIN)) {
			advance();
			return new Rule.Begin(ACTION());
		} else if (token.is(TokenKind.KW_END)) {
			advance();
			return new Rule.End(ACTION());
		} else if (token.is(TokenKind.LEFT_BRACE)) {
			return new Rule.Unconditional(ACTION());
		} else if (token.is(TokenKind.KW_FUNCTION)) {
			throw parserException("User-defined functions are not supported");
		}

		Expression pattern = EXPRESSION(0, true);
		// for ranges, like conditionStart, conditionEnd
		if (token.is(TokenKind.COMMA)) {
			Token comma = token;
			advance();
			optNewlines();
			pattern = new Expression.Infix(pattern, comma, EXPRESSION(0, true));
		}

		if (token.is(TokenKind.LEFT_BRACE)) {
			return new Rule.PatternAction(pattern, ACTION());
		}
		if (!token.is(TokenKind.NEWLINE) && !token.is(TokenKind.SEMICOLON) && !token.is(TokenKind.EOF)) {
			throw parserException("Expecting '{' or end of line after pattern. Got " + describe(token));
		}
		return new Rule.PatternAction(pattern, null);
	}

	// ACTION : { STATEMENT_LIST }
	Action ACTION() throws ParserException {
		expect(TokenKind.LEFT_BRACE, "'{'");
		List<Statement> statements = STATEMENT_LIST();
		expect(TokenKind.RIGHT_BRACE, "'}'");
		return new Action(statements);
	}

	// STATEMENT_LIST : [STATEMENT terminators]*
	private List<Statement> STATEMENT_LIST() throws ParserException {
		List<Statement> statements = new ArrayList<Statement>();
		optTerminators();
		while (!token.is(TokenKind.RIGHT_BRACE)) {
			if (token.is(TokenKind.EOF)) {
				throw parserException("Missing '}' at end of script");
			}
			statements.add(STATEMENT());
			optTerminators();
		}
		return statements;
	}

	// STATEMENT : { STATEMENT_LIST } | IF_STATEMENT | WHILE_STATEMENT | FOR_STATEMENT | SIMPLE_STATEMENT terminator
	Statement STATEMENT() throws ParserException {
		switch (token.getKind()) {
		case LEFT_BRACE:
			advance();
			List<Statement> statements = STATEMENT_LIST();
			expect(TokenKind.RIGHT_BRACE, "'}'");
			return new Statement.Block(statements);
		case KW_IF:
			return IF_STATEMENT();
		case KW_WHILE:
			return WHILE_STATEMENT();
		case KW_FOR:
			return FOR_STATEMENT();
		default:
			Statement statement = SIMPLE_STATEMENT();
			terminator();
			return statement;
		}
	}

	// IF_STATEMENT : if ( EXPRESSION ) STATEMENT [else STATEMENT]
	Statement IF_STATEMENT() throws ParserException {
		advance();
		expect(TokenKind.LEFT_PAREN, "'(' after if");
		Expression condition = EXPRESSION(0, true);
		expect(TokenKind.RIGHT_PAREN, "')' after if condition");
		optNewlines();
		Statement then = STATEMENT();

		// else may follow on a later line
		optTerminators();
		Statement otherwise = null;
		if (token.is(TokenKind.KW_ELSE)) {
			advance();
			optNewlines();
			otherwise = STATEMENT();
		}
		return new Statement.If(condition, then, otherwise);
	}

	// WHILE_STATEMENT : while ( EXPRESSION ) STATEMENT
	Statement WHILE_STATEMENT() throws ParserException {
		advance();
		expect(TokenKind.LEFT_PAREN, "'(' after while");
		Expression condition = EXPRESSION(0, true);
		expect(TokenKind.RIGHT_PAREN, "')' after while condition");
		optNewlines();
		return new Statement.While(condition, STATEMENT());
	}

	// FOR_STATEMENT : for ( [SIMPLE_STATEMENT] ; [EXPRESSION] ; [SIMPLE_STATEMENT] ) STATEMENT
	Statement FOR_STATEMENT() throws ParserException {
		advance();
		expect(TokenKind.LEFT_PAREN, "'(' after for");
		Statement init = token.is(TokenKind.SEMICOLON) ? null : SIMPLE_STATEMENT();
		expect(TokenKind.SEMICOLON, "';' after for initialization");
		optNewlines();
		Expression condition = token.is(TokenKind.SEMICOLON) ? null : EXPRESSION(0, true);
		expect(TokenKind.SEMICOLON, "';' after for condition");
		optNewlines();
		Statement update = token.is(TokenKind.RIGHT_PAREN) ? null : SIMPLE_STATEMENT();
		expect(TokenKind.RIGHT_PAREN, "')' after for clauses");
		optNewlines();
		return new Statement.For(init, condition, update, STATEMENT());
	}

	// SIMPLE_STATEMENT : PRINT | PRINTF | GSUB | exit | next | assignments and increments
	Statement SIMPLE_STATEMENT() throws ParserException {
		switch (token.getKind()) {
		case KW_PRINT:
			return PRINT_STATEMENT();
		case KW_PRINTF:
			return PRINTF_STATEMENT();
		case FUNC_GSUB:
			return GSUB_STATEMENT();
		case KW_EXIT:
			advance();
			if (!atStatementEnd()) {
				throw parserException("exit with a status is not supported");
			}
			return new Statement.Exit();
		case KW_NEXT:
			advance();
			return new Statement.Next();
		case IDENTIFIER:
			return IDENTIFIER_STATEMENT();
		case DOLLAR:
			return FIELD_STATEMENT();
		case INC:
		case DEC:
			return PREFIX_STATEMENT();
		case ILLEGAL:
			throw parserException("Unexpected " + describe(token));
		default:
			throw parserException("Unsupported statement starting with " + describe(token));
		}
	}

	// PRINT_STATEMENT : print [PRINT_ARGUMENTS]
	Statement PRINT_STATEMENT() throws ParserException {
		advance();
		List<Expression> arguments;
		if (atStatementEnd() || isRedirection(token)) {
			arguments = new ArrayList<Expression>();
		} else {
			arguments = PRINT_ARGUMENTS();
		}
		if (isRedirection(token)) {
			throw parserException("Output redirection is not supported");
		}

		// commas become references to OFS, so that printing is a plain concatenation
		List<Expression> withSeparators = new ArrayList<Expression>();
		for (Expression argument : arguments) {
			if (!withSeparators.isEmpty()) {
				withSeparators.add(new Expression.Identifier("OFS"));
			}
			withSeparators.add(argument);
		}
		return new Statement.Print(withSeparators);
	}

	// PRINTF_STATEMENT : printf PRINT_ARGUMENTS
	Statement PRINTF_STATEMENT() throws ParserException {
		advance();
		if (atStatementEnd() || isRedirection(token)) {
			throw parserException("printf requires a format argument");
		}
		List<Expression> arguments = PRINT_ARGUMENTS();
		if (isRedirection(token)) {
			throw parserException("Output redirection is not supported");
		}
		return new Statement.Printf(arguments);
	}

	/**
	 * Parses the arguments of print and printf, with or without surrounding
	 * parentheses. Outside parentheses, '&gt;' is not a comparison.
	 */
	private List<Expression> PRINT_ARGUMENTS() throws ParserException {
		List<Expression> arguments = new ArrayList<Expression>();
		if (token.is(TokenKind.LEFT_PAREN)) {
			advance();
			List<Expression> grouped = EXPRESSION_LIST();
			expect(TokenKind.RIGHT_PAREN, "')'");
			if (atStatementEnd() || isRedirection(token)) {
				return grouped;
			}
			if (grouped.size() > 1) {
				throw parserException("Unexpected " + describe(token) + " after parenthesized argument list");
			}
			// the parenthesized expression only starts the first argument, as in print (1+2)*3
			arguments.add(INFIX_TAIL(grouped.get(0), 0, false));
		} else {
			arguments.add(EXPRESSION(0, false));
		}
		while (token.is(TokenKind.COMMA)) {
			advance();
			optNewlines();
			arguments.add(EXPRESSION(0, false));
		}
		return arguments;
	}

	// EXPRESSION_LIST : EXPRESSION [, EXPRESSION]*
	private List<Expression> EXPRESSION_LIST() throws ParserException {
		List<Expression> expressions = new ArrayList<Expression>();
		expressions.add(EXPRESSION(0, true));
		while (token.is(TokenKind.COMMA)) {
			advance();
			optNewlines();
			expressions.add(EXPRESSION(0, true));
		}
		return expressions;
	}

	// GSUB_STATEMENT : gsub ( EXPRESSION , EXPRESSION )
	Statement GSUB_STATEMENT() throws ParserException {
		advance();
		expect(TokenKind.LEFT_PAREN, "'(' after gsub");
		Expression pattern = EXPRESSION(0, true);
		expect(TokenKind.COMMA, "',' between gsub arguments");
		optNewlines();
		Expression replacement = EXPRESSION(0, true);
		if (token.is(TokenKind.COMMA)) {
			throw parserException("gsub with a target argument is not supported");
		}
		expect(TokenKind.RIGHT_PAREN, "')' after gsub arguments");
		return new Statement.Gsub(pattern, replacement);
	}

	// IDENTIFIER_STATEMENT : ID ( = ASSIGNMENT_VALUE | op= EXPRESSION | ++ | -- | [ EXPRESSION ] ARRAY_STATEMENT )
	Statement IDENTIFIER_STATEMENT() throws ParserException {
		Token idToken = token;
		String name = idToken.getLiteral();
		advance();

		switch (token.getKind()) {
		case ASSIGN:
			advance();
			return new Statement.Assignment(name, ASSIGNMENT_VALUE());
		case PLUS_EQ:
			advance();
			return new Statement.AddAssignment(name, EXPRESSION(0, true));
		case MINUS_EQ:
		case MULT_EQ:
		case DIV_EQ:
		case MOD_EQ:
		case POW_EQ: {
			Token operator = arithmeticOperator(token);
			advance();
			Expression value = EXPRESSION(0, true);
			return new Statement.Assignment(name, new Expression.Infix(new Expression.Identifier(name), operator, value));
		}
		case INC:
			advance();
			return new Statement.PostIncrement(name);
		case DEC: {
			Token operator = arithmeticOperator(token);
			advance();
			return new Statement.Assignment(
					name,
					new Expression.Infix(new Expression.Identifier(name), operator, new Expression.NumberLiteral(1)));
		}
		case LEFT_BRACKET:
			return ARRAY_STATEMENT(name);
		case KW_IN:
			// only found at the start of a for (key in array) loop
			throw parserException("for (key in array) loops are not supported");
		case LEFT_PAREN:
			if (token.getOffset() == idToken.getOffset() + name.length()) {
				throw parserException("User-defined function calls are not supported: " + name);
			}
			throw parserException("Unsupported statement starting with identifier '" + name + "'");
		default:
			throw parserException("Unsupported statement starting with identifier '" + name + "'");
		}
	}

	// ASSIGNMENT_VALUE : EXPRESSION | ID = ASSIGNMENT_VALUE
	private Expression ASSIGNMENT_VALUE() throws ParserException {
		Expression value = EXPRESSION(0, true);
		if (token.is(TokenKind.ASSIGN)) {
			if (!(value instanceof Expression.Identifier)) {
				throw parserException("Only variables can be assigned in a chained assignment");
			}
			advance();
			return new Expression.Assignment(((Expression.Identifier) value).getName(), ASSIGNMENT_VALUE());
		}
		return value;
	}

	// ARRAY_STATEMENT : ID [ EXPRESSION ] ( = ASSIGNMENT_VALUE | op= EXPRESSION | ++ | -- )
	private Statement ARRAY_STATEMENT(String name) throws ParserException {
		advance();
		Expression index = EXPRESSION(0, true);
		if (token.is(TokenKind.COMMA)) {
			throw parserException("Multi-dimensional array indices are not supported");
		}
		expect(TokenKind.RIGHT_BRACKET, "']'");
		Expression element = new Expression.ArrayAccess(name, index);

		switch (token.getKind()) {
		case ASSIGN:
			advance();
			return new Statement.ArrayAssignment(name, index, ASSIGNMENT_VALUE());
		case PLUS_EQ:
			advance();
			return new Statement.ArrayAddAssignment(name, index, EXPRESSION(0, true));
		case MINUS_EQ:
		case MULT_EQ:
		case DIV_EQ:
		case MOD_EQ:
		case POW_EQ: {
			Token operator = arithmeticOperator(token);
			advance();
			return new Statement.ArrayAssignment(name, index, new Expression.Infix(element, operator, EXPRESSION(0, true)));
		}
		case INC:
			advance();
			return new Statement.ArrayAddAssignment(name, index, new Expression.NumberLiteral(1));
		case DEC: {
			Token operator = arithmeticOperator(token);
			advance();
			return new Statement.ArrayAssignment(
					name,
					index,
					new Expression.Infix(element, operator, new Expression.NumberLiteral(1)));
		}
		default:
			throw parserException("Unsupported statement on array element '" + name + "'");
		}
	}

	// FIELD_STATEMENT : $ PRIMARY ( = ASSIGNMENT_VALUE | op= EXPRESSION | ++ | -- )
	Statement FIELD_STATEMENT() throws ParserException {
		advance();
		Expression index = PRIMARY();
		Expression field = new Expression.Field(index);

		switch (token.getKind()) {
		case ASSIGN:
			advance();
			return new Statement.FieldAssignment(index, ASSIGNMENT_VALUE());
		case PLUS_EQ:
		case MINUS_EQ:
		case MULT_EQ:
		case DIV_EQ:
		case MOD_EQ:
		case POW_EQ: {
			// $n op= v is $n = $n op v
			Token operator = arithmeticOperator(token);
			advance();
			return new Statement.FieldAssignment(index, new Expression.Infix(field, operator, EXPRESSION(0, true)));
		}
		case INC:
		case DEC: {
			Token operator = arithmeticOperator(token);
			advance();
			return new Statement.FieldAssignment(
					index,
					new Expression.Infix(field, operator, new Expression.NumberLiteral(1)));
		}
		default:
			throw parserException("Unsupported statement starting with field " + field);
		}
	}

	// PREFIX_STATEMENT : ++ ID | -- ID | ++ ID [ EXPRESSION ] | ++ $ PRIMARY | ...
	Statement PREFIX_STATEMENT() throws ParserException {
		Token operatorToken = token;
		Token operator = arithmeticOperator(operatorToken);
		boolean increment = operatorToken.is(TokenKind.INC);
		advance();
		Expression one = new Expression.NumberLiteral(1);

		if (token.is(TokenKind.DOLLAR)) {
			advance();
			Expression index = PRIMARY();
			return new Statement.FieldAssignment(index, new Expression.Infix(new Expression.Field(index), operator, one));
		}
		if (!token.is(TokenKind.IDENTIFIER)) {
			throw parserException("Expecting a variable after " + operatorToken.getLiteral() + ". Got " + describe(token));
		}
		String name = token.getLiteral();
		advance();

		if (token.is(TokenKind.LEFT_BRACKET)) {
			advance();
			Expression index = EXPRESSION(0, true);
			expect(TokenKind.RIGHT_BRACKET, "']'");
			if (increment) {
				return new Statement.ArrayAddAssignment(name, index, one);
			}
			return new Statement.ArrayAssignment(
					name,
					index,
					new Expression.Infix(new Expression.ArrayAccess(name, index), operator, one));
		}
		if (increment) {
			return new Statement.PreIncrement(name);
		}
		return new Statement.Assignment(name, new Expression.Infix(new Expression.Identifier(name), operator, one));
	}

	// EXPRESSION : UNARY_EXPRESSION INFIX_TAIL
	Expression EXPRESSION(int minBindingPower, boolean allowGt) throws ParserException {
		Expression left = UNARY_EXPRESSION(allowGt);
		return INFIX_TAIL(left, minBindingPower, allowGt);
	}

	/**
	 * Precedence climbing: absorbs binary operators (explicit or implicit
	 * concatenation) whose left binding power is at least
	 * {@code minBindingPower}.
	 *
	 * @param left the operand already parsed
	 * @param minBindingPower minimum left binding power of the operators to absorb
	 * @param allowGt whether '&gt;' is a comparison (it is output redirection
	 *        in unparenthesized print arguments)
	 */
	private Expression INFIX_TAIL(Expression left, int minBindingPower, boolean allowGt) throws ParserException {
		while (true) {
			TokenKind kind = token.getKind();
			int[] bindingPower = BINDING_POWERS.get(kind);
			if (bindingPower != null) {
				if (kind == TokenKind.GT && !allowGt) {
					break;
				}
				if (bindingPower[0] < minBindingPower) {
					break;
				}
				Token operator = token;
				advance();
				if (kind == TokenKind.AND || kind == TokenKind.OR) {
					optNewlines();
				}
				Expression right = EXPRESSION(bindingPower[1], allowGt);
				left = new Expression.Infix(left, operator, right);
			} else if (startsConcatenation(kind)) {
				if (CONCATENATION_LEFT_BP < minBindingPower) {
					break;
				}
				Expression right = EXPRESSION(CONCATENATION_RIGHT_BP, allowGt);
				left = new Expression.Concatenation(left, right);
			} else if (kind == TokenKind.QUESTION_MARK) {
				throw parserException("Conditional expressions (?:) are not supported");
			} else if (kind == TokenKind.KW_IN) {
				throw parserException("The 'in' operator is not supported");
			} else {
				break;
			}
		}
		return left;
	}

	private static boolean startsConcatenation(TokenKind kind) {
		switch (kind) {
		case NUMBER:
		case STRING:
		case DOLLAR:
		case LEFT_PAREN:
		case IDENTIFIER:
			return true;
		default:
			return kind.isBuiltinFunction();
		}
	}

	// UNARY_EXPRESSION : [- | + | !] UNARY_EXPRESSION | PRIMARY
	private Expression UNARY_EXPRESSION(boolean allowGt) throws ParserException {
		if (token.is(TokenKind.MINUS) || token.is(TokenKind.PLUS) || token.is(TokenKind.NOT)) {
			Token operator = token;
			advance();
			return new Expression.Unary(operator, EXPRESSION(UNARY_BP, allowGt));
		}
		return PRIMARY();
	}

	// PRIMARY : NUMBER | STRING | REGEX | $ PRIMARY | ( EXPRESSION ) | ID [ [ EXPRESSION ] ] | LENGTH | SUBSTR
	Expression PRIMARY() throws ParserException {
		Token t = token;
		switch (t.getKind()) {
		case NUMBER:
			advance();
			return new Expression.NumberLiteral(parseNumber(t.getLiteral()));
		case STRING:
			advance();
			return new Expression.StringLiteral(t.getLiteral());
		case REGEX:
			advance();
			return new Expression.RegexLiteral(t.getLiteral());
		case DOLLAR:
			advance();
			return new Expression.Field(PRIMARY());
		case LEFT_PAREN: {
			advance();
			Expression grouped = EXPRESSION(0, true);
			if (token.is(TokenKind.COMMA)) {
				throw parserException("Parenthesized expression lists are only supported in print statements");
			}
			expect(TokenKind.RIGHT_PAREN, "')'");
			return grouped;
		}
		case IDENTIFIER:
			advance();
			if (token.is(TokenKind.LEFT_BRACKET)) {
				advance();
				Expression index = EXPRESSION(0, true);
				if (token.is(TokenKind.COMMA)) {
					throw parserException("Multi-dimensional array indices are not supported");
				}
				expect(TokenKind.RIGHT_BRACKET, "']'");
				return new Expression.ArrayAccess(t.getLiteral(), index);
			}
			if (token.is(TokenKind.LEFT_PAREN) && token.getOffset() == t.getOffset() + t.getLiteral().length()) {
				throw parserException("User-defined function calls are not supported: " + t.getLiteral());
			}
			return new Expression.Identifier(t.getLiteral());
		case FUNC_LENGTH:
			return LENGTH();
		case FUNC_SUBSTR:
			return SUBSTR();
		case INC:
		case DEC:
			throw parserException("Increment and decrement are only supported as statements");
		case KW_GETLINE:
			throw parserException("getline is not supported");
		case EOF:
			throw parserException("Unexpected end of script");
		default:
			if (t.getKind().isBuiltinFunction()) {
				throw parserException("Built-in function '" + t.getLiteral() + "' is not supported here");
			}
			throw parserException("Unexpected " + describe(t));
		}
	}

	// LENGTH : length [( [EXPRESSION] )]
	private Expression LENGTH() throws ParserException {
		advance();
		if (!token.is(TokenKind.LEFT_PAREN)) {
			return new Expression.Length(null);
		}
		advance();
		Expression argument = null;
		if (!token.is(TokenKind.RIGHT_PAREN)) {
			argument = EXPRESSION(0, true);
		}
		expect(TokenKind.RIGHT_PAREN, "')' after length argument");
		return new Expression.Length(argument);
	}

	// SUBSTR : substr ( EXPRESSION , EXPRESSION [, EXPRESSION] )
	private Expression SUBSTR() throws ParserException {
		advance();
		expect(TokenKind.LEFT_PAREN, "'(' after substr");
		Expression string = EXPRESSION(0, true);
		expect(TokenKind.COMMA, "',' after substr string");
		Expression start = EXPRESSION(0, true);
		Expression length = null;
		if (token.is(TokenKind.COMMA)) {
			advance();
			length = EXPRESSION(0, true);
		}
		expect(TokenKind.RIGHT_PAREN, "')' after substr arguments");
		return new Expression.Substr(string, start, length);
	}
	// CHECKSTYLE.ON: MethodName
}
