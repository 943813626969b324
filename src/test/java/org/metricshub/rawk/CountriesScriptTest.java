package org.metricshub.rawk;

import static org.junit.Assert.assertEquals;

import java.io.File;
import java.io.IOException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Arrays;
import java.util.stream.Collectors;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameter;
import org.junit.runners.Parameterized.Parameters;

/**
 * Test Suite based on the "p" scripts of the One True Awk test directory,
 * restricted to what Rawk supports. Each AWK script in the
 * src/test/resources/countries/scripts directory is executed against the
 * countries input, and its output is compared to the corresponding *.ok file.
 *
 * @see <a href="https://github.com/onetrueawk/awk">One True Awk</a>
 */
@RunWith(Parameterized.class)
public class CountriesScriptTest {

	private static final String COUNTRIES_PATH = "/countries";
	private static Path countriesDirectory;
	private static Path scriptsDirectory;

	/**
	 * @return the list of awk scripts in /src/test/resources/countries/scripts
	 * @throws Exception
	 */
	@Parameters(name = "countries {0}")
	public static Iterable<String> awkList() throws Exception {
		URL countriesUrl = CountriesScriptTest.class.getResource(COUNTRIES_PATH);
		if (countriesUrl == null) {
			throw new IOException("Couldn't find resource " + COUNTRIES_PATH);
		}
		countriesDirectory = Paths.get(countriesUrl.toURI());
		if (!countriesDirectory.toFile().isDirectory()) {
			throw new IOException(COUNTRIES_PATH + " is not a directory");
		}
		scriptsDirectory = countriesDirectory.resolve("scripts");
		if (!scriptsDirectory.toFile().isDirectory()) {
			throw new IOException("scripts is not a directory");
		}

		return Arrays
				.stream(scriptsDirectory.toFile().listFiles())
				.filter(sf -> sf.getName().startsWith("p."))
				.map(File::getName)
				.sorted()
				.collect(Collectors.toList());
	}

	/** Name of the AWK test script to execute */
	@Parameter
	public String awkName;

	/**
	 * Execute the AWK script stored in {@link #awkName} through the command
	 * line
	 *
	 * @throws Exception
	 */
	@Test
	public void test() throws Exception {
		Path awkScriptPath = scriptsDirectory.resolve(awkName);
		Path okFilePath = countriesDirectory.resolve("results/" + awkName + ".ok");
		Path inputFilePath = countriesDirectory.resolve("inputs/countries");

		AwkTestSupport
				.cliTest("countries " + awkName)
				.argument("-f", awkScriptPath.toString())
				.operand(inputFilePath.toString())
				.expectLines(okFilePath)
				.build()
				.runAndAssert();
	}

	/**
	 * Same script, through the list-based API.
	 *
	 * @throws Exception
	 */
	@Test
	public void testListApi() throws Exception {
		Path awkScriptPath = scriptsDirectory.resolve(awkName);
		Path okFilePath = countriesDirectory.resolve("results/" + awkName + ".ok");
		Path inputFilePath = countriesDirectory.resolve("inputs/countries");

		String script = new String(Files.readAllBytes(awkScriptPath), StandardCharsets.UTF_8);
		assertEquals(
				awkName,
				Files.readAllLines(okFilePath, StandardCharsets.UTF_8),
				Awk.execute(script, Files.readAllLines(inputFilePath, StandardCharsets.UTF_8)));
	}
}
