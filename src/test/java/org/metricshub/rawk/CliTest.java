package org.metricshub.rawk;

import static org.junit.Assert.*;

import java.io.ByteArrayInputStream;
import java.nio.charset.StandardCharsets;
import org.junit.Test;

public class CliTest {

	private static final String EMP_DATA = AwkTestSupport.resource("emp.data");

	@Test
	public void testParse() {
		Cli cli = new Cli(new ByteArrayInputStream(new byte[0]), System.out, System.err);
		cli.parse(new String[] { "-F", ":", "-v", "n=1", "-f", "prog.awk", "data.txt" });
		assertFalse(cli.isPrintUsage());
		assertEquals("prog.awk", cli.getScriptFile());
		assertNull(cli.getScript());
		assertEquals("data.txt", cli.getInputFile());
		assertEquals(":", cli.getSettings().getFieldSeparator());
		assertEquals("1", cli.getSettings().getVariables().get("n"));

		Cli inline = new Cli(new ByteArrayInputStream(new byte[0]), System.out, System.err);
		inline.parse(new String[] { "{ print }" });
		assertEquals("{ print }", inline.getScript());
		assertNull(inline.getScriptFile());
		assertNull(inline.getInputFile());
	}

	@Test
	public void testNoArgumentsPrintsUsage() throws Exception {
		AwkTestSupport.TestResult result = AwkTestSupport.cliTest("no arguments").build().run();
		assertEquals(0, result.exitCode());
		assertEquals("Usage:", result.lines()[0]);
	}

	@Test
	public void testHelp() throws Exception {
		AwkTestSupport.TestResult result = AwkTestSupport.cliTest("-h").argument("-h").build().run();
		assertEquals(0, result.exitCode());
		assertTrue(result.output().contains("-f filename = Use contents of filename for script."));
		assertEquals("", result.errorOutput());
	}

	/**
	 * <pre>
	 * rawk '$3 &gt; 0 { print $1 }' emp.data
	 * </pre>
	 */
	@Test
	public void testScriptAndInputFile() throws Exception {
		AwkTestSupport
				.cliTest("script with an input file")
				.script("$3 > 0 { print $1 }")
				.file("emp.data", EMP_DATA)
				.operand("{{emp.data}}")
				.expectLines("Kathy", "Mark", "Mary", "Susie")
				.build()
				.runAndAssert();
	}

	/**
	 * <pre>
	 * rawk -f pay.awk emp.data
	 * </pre>
	 */
	@Test
	public void testScriptFile() throws Exception {
		AwkTestSupport
				.cliTest("script file")
				.argument("-f", "{{pay.awk}}")
				.file("pay.awk", AwkTestSupport.resource("pay.awk"))
				.file("emp.data", EMP_DATA)
				.operand("{{emp.data}}")
				.expectLines("Beth 0", "Dan 0", "Kathy 40", "Mark 100", "Mary 121", "Susie 76.5")
				.build()
				.runAndAssert();
	}

	@Test
	public void testFieldSeparatorOption() throws Exception {
		AwkTestSupport
				.cliTest("-F with an escaped tab")
				.argument("-F", "\\t")
				.script("{ print $2 }")
				.stdin("North America\t3615\n")
				.expectLines("3615")
				.build()
				.runAndAssert();
		AwkTestSupport
				.cliTest("-F with a literal separator")
				.argument("-F", ":")
				.script("{ print $1 }")
				.stdin("root:x:0:0\n")
				.expectLines("root")
				.build()
				.runAndAssert();
	}

	@Test
	public void testVariableOption() throws Exception {
		AwkTestSupport
				.cliTest("-v assignments")
				.argument("-v", "rate=2", "-v", "who=Beth")
				.script("$1 == who { print $1, $2 * rate }")
				.file("emp.data", EMP_DATA)
				.operand("{{emp.data}}")
				.expectLines("Beth 8")
				.build()
				.runAndAssert();
	}

	@Test
	public void testFilename() throws Exception {
		AwkTestSupport.TestResult result = AwkTestSupport
				.cliTest("FILENAME is the input file")
				.script("END { print FILENAME, NR }")
				.file("emp.data", EMP_DATA)
				.operand("{{emp.data}}")
				.build()
				.run();
		assertEquals(0, result.exitCode());
		assertTrue(result.output(), result.lines()[0].endsWith("emp.data 6"));
	}

	@Test
	public void testEndOfOptions() throws Exception {
		AwkTestSupport
				.cliTest("-- ends the options")
				.argument("--")
				.script("{ print $2 }")
				.stdin("a b\n")
				.expectLines("b")
				.build()
				.runAndAssert();
	}

	@Test
	public void testMissingInputFile() throws Exception {
		AwkTestSupport.TestResult result = AwkTestSupport
				.cliTest("missing input file")
				.script("{ print }")
				.operand("/nonexistent/rawk/input.txt")
				.build()
				.run();
		assertEquals(Cli.EXIT_ERROR, result.exitCode());
		assertTrue(result.errorOutput(), result.errorOutput().startsWith("rawk: cannot open /nonexistent/rawk/input.txt"));
		assertEquals("", result.output());
	}

	@Test
	public void testMissingScriptFile() throws Exception {
		AwkTestSupport.TestResult result = AwkTestSupport
				.cliTest("missing script file")
				.argument("-f", "/nonexistent/rawk/script.awk")
				.stdin("a\n")
				.build()
				.run();
		assertEquals(Cli.EXIT_ERROR, result.exitCode());
		assertTrue(result.errorOutput(), result.errorOutput().startsWith("rawk: cannot read script"));
	}

	@Test
	public void testSyntaxError() throws Exception {
		AwkTestSupport.TestResult result = AwkTestSupport
				.cliTest("syntax error")
				.script("{ print $1 > \"out.txt\" }")
				.stdin("a\n")
				.build()
				.run();
		assertEquals(Cli.EXIT_ERROR, result.exitCode());
		assertTrue(result.errorOutput(), result.errorOutput().startsWith("rawk: syntax error: Output redirection is not supported"));
		assertEquals("", result.output());
	}

	@Test
	public void testUnsupportedConstructExitCode() throws Exception {
		AwkTestSupport
				.cliTest("user-defined function")
				.script("function f(x) { print x }")
				.stdin("a\n")
				.expectLines()
				.expectExit(Cli.EXIT_ERROR)
				.build()
				.runAndAssert();
	}

	@Test
	public void testSyntaxErrorInScriptFile() throws Exception {
		AwkTestSupport.TestResult result = AwkTestSupport
				.cliTest("syntax error in a script file")
				.argument("-f", "{{bad.awk}}")
				.file("bad.awk", "BEGIN {\n")
				.build()
				.run();
		assertEquals(Cli.EXIT_ERROR, result.exitCode());
		assertTrue(result.errorOutput(), result.errorOutput().contains("bad.awk"));
	}

	@Test
	public void testInvalidArgumentsPrintUsage() throws Exception {
		AwkTestSupport.TestResult unknown = AwkTestSupport
				.cliTest("unknown option")
				.argument("-x")
				.script("{ print }")
				.build()
				.run();
		assertEquals(0, unknown.exitCode());
		assertTrue(unknown.errorOutput().startsWith("Unknown parameter: -x"));
		assertEquals("Usage:", unknown.lines()[0]);

		AwkTestSupport.TestResult missingValue = AwkTestSupport.cliTest("-f without a file").argument("-f").build().run();
		assertEquals(0, missingValue.exitCode());
		assertTrue(missingValue.errorOutput().startsWith("Need additional argument for -f"));

		AwkTestSupport.TestResult badVariable = AwkTestSupport
				.cliTest("-v without a value")
				.argument("-v", "novalue")
				.script("{ print }")
				.build()
				.run();
		assertEquals(0, badVariable.exitCode());
		assertEquals("Usage:", badVariable.lines()[0]);
	}

	@Test
	public void testOnlyOneInputFile() throws Exception {
		AwkTestSupport.TestResult result = AwkTestSupport
				.cliTest("two input files")
				.script("{ print }")
				.operand("a.txt", "b.txt")
				.build()
				.run();
		assertEquals(0, result.exitCode());
		assertTrue(result.errorOutput().startsWith("Only one input file is supported, got: b.txt"));
		assertEquals("Usage:", result.lines()[0]);
	}

	@Test
	public void testInvalidUtf8StopsTheInput() throws Exception {
		byte[] input = "Beth 4.00 0\nDan 3.75 0\n_\nKathy 4.00 10\n".getBytes(StandardCharsets.UTF_8);
		input[23] = (byte) 0xff;
		AwkTestSupport
				.cliTest("invalid UTF-8 on standard input")
				.script("{ print $1 }")
				.stdin(input)
				.expectLines("Beth", "Dan")
				.build()
				.runAndAssert();
	}
}
