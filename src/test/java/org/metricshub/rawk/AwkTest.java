package org.metricshub.rawk;

import static org.junit.Assert.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import org.metricshub.rawk.frontend.ast.ParserException;
import org.metricshub.rawk.util.AwkSettings;

public class AwkTest {

	private static final List<String> NO_INPUT = Collections.emptyList();

	private static List<String> lines(String... lines) {
		return Arrays.asList(lines);
	}

	@Test
	public void testIdentity() throws Exception {
		assertEquals(lines("foo", "bar"), Awk.execute("{ print }", lines("foo", "bar")));
		assertEquals(lines("foo", "bar"), Awk.execute("1", lines("foo", "bar")));
	}

	@Test
	public void testArithmetic() throws Exception {
		assertEquals(lines("3"), Awk.execute("BEGIN { print 1+2 }", NO_INPUT));
		assertEquals(lines("512"), Awk.execute("BEGIN { print 2^3^2 }", NO_INPUT));
		assertEquals(lines("1"), Awk.execute("BEGIN { print 5-3-1 }", NO_INPUT));
		assertEquals(lines("0.333333"), Awk.execute("BEGIN { print 1/3 }", NO_INPUT));
		assertEquals(lines("1"), Awk.execute("BEGIN { print 7 % 3 }", NO_INPUT));
		assertEquals(lines("-4"), Awk.execute("BEGIN { print -2^2 }", NO_INPUT));
		assertEquals(lines("Infinity -Infinity NaN"), Awk.execute("BEGIN { print 1/0, -1/0, 0 % 0 }", NO_INPUT));
	}

	@Test
	public void testFields() throws Exception {
		assertEquals(lines("one three"), Awk.execute("{ print $1, $3 }", lines("one     two three")));
		assertEquals(lines("3 one", "0 "), Awk.execute("{ print NF, $1 }", lines("one two three", "")));
		assertEquals(lines("three two"), Awk.execute("{ print $NF, $(NF-1) }", lines("one two three")));
		assertEquals(lines("[]"), Awk.execute("{ print \"[\" $9 \"]\" }", lines("one two three")));
	}

	@Test
	public void testPrintf() throws Exception {
		assertEquals(
				lines("[      USSR] [275             ]"),
				Awk.execute("{ printf \"[%10s] [%-16d]\\n\", $1, $3 }", lines("USSR 8649 275 Asia")));
		assertEquals(
				"tabs are expanded",
				lines("USSR    8649", "USA 3615"),
				Awk.execute("{ printf \"%s\\t%s\\n\", $1, $2 }", lines("USSR 8649", "USA 3615")));
		assertEquals(
				"each printf is a line",
				lines("a", "b"),
				Awk.execute("BEGIN { printf \"a\"; printf(\"b\\n\") }", NO_INPUT));
	}

	@Test
	public void testRange() throws Exception {
		assertEquals(
				lines("START 1", "x", "END 1", "START 2", "y"),
				Awk.execute(
						"/START/,/END/",
						lines("before", "START 1", "x", "END 1", "between", "END stray", "START 2", "y")));
		assertEquals(
				"start and end on the same record",
				lines("START END", "START", "END"),
				Awk.execute("/START/,/END/", lines("START END", "other", "START", "END")));
	}

	@Test
	public void testRangesAreIndependent() throws Exception {
		assertEquals(
				lines("1:b", "1:c", "2:c", "2:d"),
				Awk.execute("/b/,/c/ { print 1 \":\" $0 }\n/c/,/d/ { print 2 \":\" $0 }", lines("a", "b", "c", "d", "e")));
	}

	@Test
	public void testGsub() throws Exception {
		assertEquals(
				lines("United States 3615 237 North America"),
				Awk.execute("{ gsub(/USA/, \"United States\"); print }", lines("USA 3615 237 North America")));
		assertEquals(lines("x-x-x"), Awk.execute("{ gsub(/a/, \"x\"); print }", lines("a-a-a")));
		assertEquals(
				"fields are split again after gsub",
				lines("2 b"),
				Awk.execute("{ gsub(/:/, \" \"); print NF, $2 }", lines("a:b")));
		assertEquals(
				"the pattern may be a string",
				lines("a#b"),
				Awk.execute("{ p = \"-\"; gsub(p, \"#\"); print }", lines("a-b")));
	}

	@Test
	public void testEmptyInputRunsBeginAndEndOnly() throws Exception {
		assertEquals(
				lines("begin", "end 0"),
				Awk.execute("BEGIN { print \"begin\" }\n{ print \"rule\" }\nEND { print \"end\", NR }", NO_INPUT));
		assertEquals(NO_INPUT, Awk.execute("{ print }", NO_INPUT));
	}

	@Test
	public void testEndSeesNrButNotTheRecord() throws Exception {
		assertEquals(lines("3 []"), Awk.execute("END { print NR, \"[\" $0 \"]\" }", lines("a", "b", "c")));
	}

	@Test
	public void testExit() throws Exception {
		assertEquals(
				lines("1", "2", "end 2"),
				Awk.execute("{ print NR } NR == 2 { exit } END { print \"end\", NR }", lines("a", "b", "c", "d")));
		assertEquals(
				"exit in BEGIN skips the records",
				lines("end 0"),
				Awk.execute("BEGIN { exit } { print } END { print \"end\", NR }", lines("a")));
		assertEquals(
				"exit in END stops the END blocks",
				lines("first"),
				Awk.execute("END { print \"first\"; exit; print \"second\" } END { print \"third\" }", NO_INPUT));
		assertEquals(
				"exit leaves loops",
				lines("1"),
				Awk.execute("BEGIN { while (1) { i++; print i; exit } }", NO_INPUT));
	}

	@Test
	public void testNext() throws Exception {
		assertEquals(
				lines("b", "c"),
				Awk.execute("/a/ { next } { print }", lines("a", "b", "c")));
		assertEquals(
				"next in a loop skips the rest of the rules",
				lines("1", "1"),
				Awk.execute("{ for (i = 1; i < 5; i++) { print i; next } } { print \"never\" }", lines("x", "y")));
		assertEquals(
				"next is ignored in BEGIN",
				lines("after"),
				Awk.execute("BEGIN { next; print \"after\" }", NO_INPUT));
	}

	@Test
	public void testChainedAssignment() throws Exception {
		assertEquals(
				lines("[-][-]", "a-b-c"),
				Awk.execute("BEGIN { FS = OFS = \"-\"; print \"[\" FS \"][\" OFS \"]\" } { $1 = $1; print }", lines("a-b-c")));
	}

	@Test
	public void testFieldAssignment() throws Exception {
		assertEquals(lines("a b x d"), Awk.execute("{ $3 = \"x\"; print }", lines("a b c d")));
		assertEquals(lines("a b c d  z 6"), Awk.execute("{ $6 = \"z\"; print $0, NF }", lines("a b c d")));
		assertEquals(lines("two 1"), Awk.execute("{ $0 = \"two\"; print $1, NF }", lines("one and three")));
		assertEquals(lines("a b"), Awk.execute("{ NF = 2; print }", lines("a b c d")));
		assertEquals(lines("a 3"), Awk.execute("{ $2 += 1; print $1, $2 }", lines("a 2")));
	}

	@Test
	public void testComparisons() throws Exception {
		assertEquals(
				"numeric fields compare as numbers",
				lines("10"),
				Awk.execute("$1 > 9", lines("10", "8")));
		assertEquals(
				"other fields compare as strings",
				lines("b"),
				Awk.execute("$1 > \"a\"", lines("b", "a")));
		assertEquals(lines("1 0 1 1"), Awk.execute("BEGIN { print 1 < 2, 2 < 1, \"a\" != \"b\", x == 0 }", NO_INPUT));
		assertEquals(lines("1 0"), Awk.execute("{ print $0 ~ /ss/, /zz/ }", lines("Russia")));
		assertEquals(lines("USA"), Awk.execute("$1 ~ \"^US\" && !($1 ~ /SR$/)", lines("USA", "USSR", "Canada")));
	}

	@Test
	public void testVariablesAndArrays() throws Exception {
		assertEquals(
				lines("Asia 1021", "Europe 111", "none []"),
				Awk.execute(
						"{ pop[$2] += $3 }\nEND { print \"Asia\", pop[\"Asia\"]; print \"Europe\", pop[\"Europe\"]; print \"none\", \"[\" pop[\"none\"] \"]\" }",
						lines("USSR Asia 275", "China Asia 746", "France Europe 55", "Germany Europe 56")));
		assertEquals(
				lines("x=3 y=2 z=6"),
				Awk.execute("BEGIN { x = 1; x++; ++x; y = x; y--; z = x; z *= 2; print \"x=\" x, \"y=\" y, \"z=\" z }", NO_INPUT));
		assertEquals(lines("2 4"), Awk.execute("BEGIN { a[1] = 1; a[1]++; a[\"k\"] = 2; a[\"k\"] ^= 2; print a[1], a[\"k\"] }", NO_INPUT));
	}

	@Test
	public void testLoops() throws Exception {
		assertEquals(lines("c b a "), Awk.execute("{ for (i = NF; i > 0; i--) s = s $i \" \"; print s }", lines("a b c")));
		assertEquals(lines("6"), Awk.execute("BEGIN { while (i < 3) { i++; n += i } print n }", NO_INPUT));
		assertEquals(
				lines("small", "big"),
				Awk.execute("{ if ($1 < 10) print \"small\"; else print \"big\" }", lines("5", "50")));
	}

	@Test
	public void testBuiltins() throws Exception {
		assertEquals(lines("6 2 4"), Awk.execute("{ print length, length($1), length(1234) }", lines("ab cd ")));
		assertEquals(lines("0"), Awk.execute("END { print length }", lines("abc")));
		assertEquals(lines("Ind"), Awk.execute("{ print substr($1, 1, 3) }", lines("India")));
		assertEquals(lines("dia"), Awk.execute("{ print substr($1, 3) }", lines("India")));
		assertEquals(lines("In"), Awk.execute("{ print substr($1, 0, 3) }", lines("India")));
		assertEquals(lines("[]"), Awk.execute("{ print \"[\" substr($1, 10) \"]\" }", lines("India")));
		assertEquals(lines("nd"), Awk.execute("{ print substr($1, 1.5, 2) }", lines("India")));
	}

	@Test
	public void testStringEscapes() throws Exception {
		assertEquals(lines("a\nb\"c"), Awk.execute("BEGIN { print \"a\\nb\\\"c\" }", NO_INPUT));
	}

	@Test
	public void testNumberOutput() throws Exception {
		assertEquals(lines("0.1 1000000 100 3.14159"), Awk.execute("BEGIN { print 0.1, 1e6, 100.0, 3.14159265 }", NO_INPUT));
		assertEquals(lines("8.649"), Awk.execute("{ $2 = $2 / 1000; print $2 }", lines("USSR 8649")));
	}

	@Test
	public void testCompiledProgramIsReusable() throws Exception {
		Awk awk = new Awk("{ n++ } END { print n }");
		assertEquals(lines("2"), awk.run(lines("a", "b")));
		assertEquals(lines("1"), awk.run(lines("c")));
		assertEquals("1\n", awk.run("only line\n"));
		assertEquals(1, awk.getProgram().getRules().size());
	}

	@Test
	public void testRunText() throws Exception {
		assertEquals("b a\nd c\n", new Awk("{ print $2, $1 }").run("a b\r\nc d"));
	}

	@Test
	public void testInvalidScript() {
		assertThrows(ParserException.class, () -> new Awk("BEGIN {"));
		assertThrows(IllegalArgumentException.class, () -> Awk.compile((String) null));
	}

	@Test
	public void testRedirectionIsRejected() throws Exception {
		AwkTestSupport
				.awkTest("output redirection")
				.script("{ print 1 > \"f\" }")
				.stdin("a\n")
				.expectThrow(ParserException.class)
				.build()
				.runAndAssert();
	}

	@Test
	public void testInvoke() throws Exception {
		AwkTestSupport
				.awkTest("invoke streams records")
				.script("{ print NR \": \" $2 }")
				.stdin("Beth 4.00 0\nDan 3.75 0\n")
				.expectLines("1: 4.00", "2: 3.75")
				.build()
				.runAndAssert();
	}

	@Test
	public void testPreassignedVariables() throws Exception {
		AwkTestSupport
				.awkTest("variables are assigned before BEGIN")
				.script("BEGIN { print greeting, n + 1 }")
				.preassign("greeting", "hello\\tworld")
				.preassign("n", "41")
				.expectLines("hello\tworld 42")
				.build()
				.runAndAssert();
	}

	@Test
	public void testFieldSeparatorSetting() throws Exception {
		AwkTestSupport
				.awkTest("field separator from the settings")
				.script("{ print $2 }")
				.fieldSeparator(":")
				.stdin("root:x:0\n")
				.expectLines("x")
				.build()
				.runAndAssert();
		AwkTestSupport
				.awkTest("escaped tab field separator")
				.script("{ print $2 }")
				.fieldSeparator("\\t")
				.stdin("North America\t3615\n")
				.expectLines("3615")
				.build()
				.runAndAssert();
	}

	@Test
	public void testInvalidUtf8StopsTheInput() throws Exception {
		byte[] input = "Beth 4.00 0\nDan 3.75 0\n_".getBytes(StandardCharsets.UTF_8);
		input[input.length - 1] = (byte) 0xff;
		AwkTestSupport
				.awkTest("records stop at the first invalid line, END still runs")
				.script("{ print $1 } END { print NR }")
				.stdin(input)
				.expectLines("Beth", "Dan", "2")
				.build()
				.runAndAssert();
	}

	@Test
	public void testLineTerminator() throws Exception {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		AwkSettings settings = new AwkSettings();
		settings.setInput(new ByteArrayInputStream("a\nb\n".getBytes(StandardCharsets.UTF_8)));
		settings.setOutputStream(new PrintStream(out, true, StandardCharsets.UTF_8.name()));
		settings.setLineTerminator("\r\n");
		new Awk("{ print }").invoke(settings);
		assertEquals("a\r\nb\r\n", out.toString(StandardCharsets.UTF_8.name()));
	}
}
