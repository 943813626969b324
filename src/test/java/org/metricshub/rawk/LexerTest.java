package org.metricshub.rawk;

import static org.junit.Assert.*;

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import org.metricshub.rawk.frontend.Lexer;
import org.metricshub.rawk.frontend.Token;
import org.metricshub.rawk.frontend.TokenKind;

public class LexerTest {

	private static List<Token> tokens(String script, boolean regexAllowed) {
		Lexer lexer = new Lexer(script);
		lexer.setRegexAllowed(regexAllowed);
		List<Token> result = new ArrayList<Token>();
		Token token;
		do {
			token = lexer.next();
			result.add(token);
		} while (!token.is(TokenKind.EOF));
		return result;
	}

	private static List<TokenKind> kinds(String script) {
		List<TokenKind> result = new ArrayList<TokenKind>();
		for (Token token : tokens(script, false)) {
			result.add(token.getKind());
		}
		return result;
	}

	@Test
	public void testRule() {
		List<Token> tokens = tokens("$3 > 100 { print $1, NR }", false);
		assertEquals(
				Arrays.asList(
						TokenKind.DOLLAR,
						TokenKind.NUMBER,
						TokenKind.GT,
						TokenKind.NUMBER,
						TokenKind.LEFT_BRACE,
						TokenKind.KW_PRINT,
						TokenKind.DOLLAR,
						TokenKind.NUMBER,
						TokenKind.COMMA,
						TokenKind.IDENTIFIER,
						TokenKind.RIGHT_BRACE,
						TokenKind.EOF),
				kinds("$3 > 100 { print $1, NR }"));
		assertEquals("100", tokens.get(3).getLiteral());
		assertEquals(5, tokens.get(3).getOffset());
		assertEquals("NR", tokens.get(9).getLiteral());
	}

	@Test
	public void testOperators() {
		assertEquals(
				Arrays.asList(
						TokenKind.PLUS_EQ,
						TokenKind.INC,
						TokenKind.MINUS_EQ,
						TokenKind.DEC,
						TokenKind.POW,
						TokenKind.POW_EQ,
						TokenKind.POW,
						TokenKind.MATCHES,
						TokenKind.NOT_MATCHES,
						TokenKind.NE,
						TokenKind.NOT,
						TokenKind.EQ,
						TokenKind.ASSIGN,
						TokenKind.LE,
						TokenKind.GE,
						TokenKind.APPEND,
						TokenKind.AND,
						TokenKind.OR,
						TokenKind.PIPE,
						TokenKind.DIVIDE,
						TokenKind.DIV_EQ,
						TokenKind.MOD,
						TokenKind.EOF),
				kinds("+= ++ -= -- ^ **= ** ~ !~ != ! == = <= >= >> && || | / /= %"));
	}

	@Test
	public void testKeywordsAndBuiltins() {
		assertEquals(
				Arrays.asList(
						TokenKind.KW_BEGIN,
						TokenKind.KW_END,
						TokenKind.KW_FUNCTION,
						TokenKind.KW_GETLINE,
						TokenKind.KW_PRINTF,
						TokenKind.KW_NEXT,
						TokenKind.FUNC_LENGTH,
						TokenKind.FUNC_SUBSTR,
						TokenKind.FUNC_GSUB,
						TokenKind.FUNC_SUB,
						TokenKind.IDENTIFIER,
						TokenKind.EOF),
				kinds("BEGIN END function getline printf next length substr gsub sub begin"));
		assertTrue(TokenKind.FUNC_INDEX.isBuiltinFunction());
		assertFalse(TokenKind.KW_PRINT.isBuiltinFunction());
	}

	@Test
	public void testNumbers() {
		List<Token> tokens = tokens("42 3.14 .5 1e3 2E-2 0x1F 7e", false);
		assertEquals("42", tokens.get(0).getLiteral());
		assertEquals("3.14", tokens.get(1).getLiteral());
		assertEquals(".5", tokens.get(2).getLiteral());
		assertEquals("1e3", tokens.get(3).getLiteral());
		assertEquals("2E-2", tokens.get(4).getLiteral());
		assertEquals("0x1F", tokens.get(5).getLiteral());
		assertEquals(TokenKind.NUMBER, tokens.get(5).getKind());
		assertEquals("an exponent needs digits", "7", tokens.get(6).getLiteral());
		assertEquals(TokenKind.IDENTIFIER, tokens.get(7).getKind());
		assertEquals(TokenKind.ILLEGAL, tokens("0x", false).get(0).getKind());
	}

	@Test
	public void testStrings() {
		List<Token> tokens = tokens("\"a \\\"quoted\\\" word\\n\" \"\"", false);
		assertEquals(TokenKind.STRING, tokens.get(0).getKind());
		assertEquals("escapes are kept as written", "a \\\"quoted\\\" word\\n", tokens.get(0).getLiteral());
		assertEquals("", tokens.get(1).getLiteral());
		assertEquals(TokenKind.STRING, tokens.get(1).getKind());

		assertEquals(TokenKind.ILLEGAL, tokens("\"unfinished", false).get(0).getKind());
		assertEquals(TokenKind.ILLEGAL, tokens("\"unfinished\n\"", false).get(0).getKind());
	}

	@Test
	public void testRegexOrDivision() {
		List<Token> regex = tokens("/a\\/b[0-9]+/", true);
		assertEquals(TokenKind.REGEX, regex.get(0).getKind());
		assertEquals("an escaped slash loses its backslash", "a/b[0-9]+", regex.get(0).getLiteral());

		assertEquals(
				Arrays.asList(TokenKind.NUMBER, TokenKind.DIVIDE, TokenKind.NUMBER, TokenKind.DIVIDE, TokenKind.NUMBER, TokenKind.EOF),
				kinds("6 / 3 / 2"));

		assertEquals(TokenKind.ILLEGAL, tokens("/unfinished", true).get(0).getKind());
	}

	@Test
	public void testNewlinesCommentsAndContinuations() {
		assertEquals(
				Arrays.asList(
						TokenKind.IDENTIFIER,
						TokenKind.NEWLINE,
						TokenKind.IDENTIFIER,
						TokenKind.NEWLINE,
						TokenKind.IDENTIFIER,
						TokenKind.NEWLINE,
						TokenKind.EOF),
				kinds("a # comment\nb \\\nc\r\n"));
	}

	@Test
	public void testIllegalCharacters() {
		assertEquals(Arrays.asList(TokenKind.ILLEGAL, TokenKind.EOF), kinds("&"));
		assertEquals(Arrays.asList(TokenKind.ILLEGAL, TokenKind.EOF), kinds("@"));
		assertEquals(Arrays.asList(TokenKind.ILLEGAL, TokenKind.IDENTIFIER, TokenKind.EOF), kinds("\\ x"));
	}

	@Test
	public void testEofIsSticky() {
		Lexer lexer = new Lexer("x");
		assertEquals(TokenKind.IDENTIFIER, lexer.next().getKind());
		assertEquals(TokenKind.EOF, lexer.next().getKind());
		assertEquals(TokenKind.EOF, lexer.next().getKind());
		assertEquals(1, lexer.getPosition());
	}
}
