package org.metricshub.rawk;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import org.junit.Test;
import org.metricshub.rawk.jrt.AwkFormatter;
import org.metricshub.rawk.jrt.AwkValue;

public class AwkFormatterTest {

	private static String sprintf(String format, AwkValue... arguments) {
		return AwkFormatter.sprintf(format, Arrays.asList(arguments));
	}

	@Test
	public void testWidthAndJustification() {
		assertEquals(
				"[      USSR] [275             ]",
				sprintf("[%10s] [%-16d]", AwkValue.of("USSR"), AwkValue.of("275")));
		assertEquals("[ab]", sprintf("[%1s]", AwkValue.of("ab")));
	}

	@Test
	public void testIntegers() {
		assertEquals("42", sprintf("%d", AwkValue.of(42.9)));
		assertEquals("-42", sprintf("%d", AwkValue.of(-42.9)));
		assertEquals("25", sprintf("%d", AwkValue.of("25fix")));
		assertEquals("00042", sprintf("%05d", AwkValue.of(42)));
		assertEquals("zeroes go after the sign", "-0042", sprintf("%05d", AwkValue.of(-42)));
		assertEquals("- wins over 0", "42   ", sprintf("%-05d", AwkValue.of(42)));
	}

	@Test
	public void testFloats() {
		assertEquals("3.141593", sprintf("%f", AwkValue.of(Math.PI)));
		assertEquals(" 3.14", sprintf("%5.2f", AwkValue.of(Math.PI)));
		assertEquals("03.1", sprintf("%04.1f", AwkValue.of(Math.PI)));
		assertEquals("3", sprintf("%.0f", AwkValue.of(3.2)));
	}

	@Test
	public void testStrings() {
		assertEquals("Asi", sprintf("%.3s", AwkValue.of("Asia")));
		assertEquals("  Asi", sprintf("%5.3s", AwkValue.of("Asia")));
		assertEquals("strings are not zero padded", "  ab", sprintf("%04s", AwkValue.of("ab")));
		assertEquals("numbers print as AWK strings", "0.5", sprintf("%s", AwkValue.of(0.5)));
	}

	@Test
	public void testPercentAndUnsupportedConversions() {
		assertEquals("100%", sprintf("%d%%", AwkValue.of(100)));
		assertEquals("%c and %i are kept as written", "%c %5i", sprintf("%c %5i", AwkValue.of(65), AwkValue.of(1)));
		assertEquals("dangling conversion", "abc %-5", sprintf("abc %-5"));
	}

	@Test
	public void testMissingArguments() {
		assertEquals("[] [0]", AwkFormatter.sprintf("[%s] [%d]", Collections.<AwkValue>emptyList()));
	}

	@Test
	public void testExpandTabs() {
		assertEquals("USSR    8649", AwkFormatter.expandTabs("USSR\t8649"));
		assertEquals("USA 3615", AwkFormatter.expandTabs("USA\t3615"));
		assertEquals("    x", AwkFormatter.expandTabs("\tx"));
		assertEquals("ab  c\nd   e", AwkFormatter.expandTabs("ab\tc\nd\te"));
		assertEquals("no tab", AwkFormatter.expandTabs("no tab"));
	}

	@Test
	public void testStripLineTerminator() {
		assertEquals("line", AwkFormatter.stripLineTerminator("line\n"));
		assertEquals("line", AwkFormatter.stripLineTerminator("line\r\n"));
		assertEquals("line", AwkFormatter.stripLineTerminator("line\r"));
		assertEquals("only one terminator is removed", "line\n", AwkFormatter.stripLineTerminator("line\n\n"));
		assertEquals("line", AwkFormatter.stripLineTerminator("line"));
	}
}
