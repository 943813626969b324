package org.metricshub.rawk;

import static org.junit.Assert.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Test;
import org.metricshub.rawk.frontend.ast.ParserException;
import org.metricshub.rawk.util.ScriptSource;

public class ScriptSourceTest {

	@Test
	public void testFromString() {
		ScriptSource source = ScriptSource.fromString("{ print }");
		assertEquals("{ print }", source.getScript());
		assertEquals(ScriptSource.DESCRIPTION_COMMAND_LINE_SCRIPT, source.getDescription());
		assertThrows(IllegalArgumentException.class, () -> ScriptSource.fromString(null));
	}

	@Test
	public void testFromFile() throws Exception {
		Path file = Files.createTempFile("rawk", ".awk");
		try {
			Files.write(file, "{ print \"héllo\", $1 }\n".getBytes(StandardCharsets.UTF_8));
			ScriptSource source = ScriptSource.fromFile(file.toString());
			assertEquals("{ print \"héllo\", $1 }\n", source.getScript());
			assertEquals(file.toString(), source.getDescription());
			assertEquals("héllo x", new Awk(Awk.compile(source)).run("x\n").trim());
		} finally {
			Files.delete(file);
		}
	}

	@Test
	public void testErrorsNameTheFile() throws Exception {
		Path file = Files.createTempFile("rawk", ".awk");
		try {
			Files.write(file, "BEGIN { print 1 > \"out\" }".getBytes(StandardCharsets.UTF_8));
			ScriptSource source = ScriptSource.fromFile(file.toString());
			ParserException e = assertThrows(ParserException.class, () -> Awk.compile(source));
			assertTrue(e.getMessage(), e.getMessage().contains("(" + file + " at offset "));
		} finally {
			Files.delete(file);
		}
	}

	@Test
	public void testUnreadableFile() throws Exception {
		assertThrows(IOException.class, () -> ScriptSource.fromFile("/nonexistent/rawk/script.awk"));

		Path file = Files.createTempFile("rawk", ".awk");
		try {
			Files.write(file, new byte[] { '{', ' ', (byte) 0xff, ' ', '}' });
			assertThrows("not valid UTF-8", IOException.class, () -> ScriptSource.fromFile(file.toString()));
		} finally {
			Files.delete(file);
		}
	}
}
