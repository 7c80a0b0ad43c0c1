package org.metricshub.bashfmt;

import static org.junit.Assert.*;

import java.io.IOException;
import java.net.URISyntaxException;
import java.net.URL;
import java.nio.charset.StandardCharsets;
import java.nio.file.DirectoryStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import org.junit.runner.RunWith;
import org.junit.runners.Parameterized;
import org.junit.runners.Parameterized.Parameter;
import org.junit.runners.Parameterized.Parameters;

/**
 * Formats every {@code fixtures/*.sh} script of the test resources and
 * compares the result with the matching {@code .ok} file.
 */
@RunWith(Parameterized.class)
public class FixtureTest {

	private static final String FIXTURES = "/fixtures";

	@Parameter
	public Path script;

	@Parameters(name = "{0}")
	public static Collection<Object[]> fixtures() throws IOException, URISyntaxException {
		URL url = FixtureTest.class.getResource(FIXTURES);
		if (url == null) {
			throw new IOException("Missing test resource directory " + FIXTURES);
		}
		List<Path> scripts = new ArrayList<Path>();
		try (DirectoryStream<Path> stream = Files.newDirectoryStream(Paths.get(url.toURI()), "*.sh")) {
			for (Path path : stream) {
				scripts.add(path);
			}
		}
		Collections.sort(scripts);
		List<Object[]> result = new ArrayList<Object[]>();
		for (Path path : scripts) {
			result.add(new Object[] { path });
		}
		return result;
	}

	private static String read(Path path) throws IOException {
		return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
	}

	@Test
	public void testFormat() throws Exception {
		String name = script.getFileName().toString();
		Path expectedPath = script.resolveSibling(name.substring(0, name.length() - 3) + ".ok");
		String expected = read(expectedPath);

		FormatResult result = new BashFmt().format(read(script), name);
		assertFalse(name + " failed to parse", result.hasError());
		assertEquals(name, expected, result.getFormatted());

		FormatResult again = new BashFmt().format(expected, expectedPath.getFileName().toString());
		assertFalse(expectedPath + " failed to parse", again.hasError());
		assertEquals(expectedPath + " is not stable", expected, again.getFormatted());
	}
}
