package org.metricshub.bashfmt;

import static org.junit.Assert.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.List;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.metricshub.bashfmt.ast.FunctionStyle;

public class CliTest {

	private static final String UNFORMATTED = "if true;then\necho x\nfi\n";
	private static final String FORMATTED = "if true; then\n    echo x\nfi\n";

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private Path dir;
	private ByteArrayOutputStream outBytes;
	private ByteArrayOutputStream errBytes;

	@Before
	public void setUp() {
		dir = folder.getRoot().toPath();
		outBytes = new ByteArrayOutputStream();
		errBytes = new ByteArrayOutputStream();
	}

	private Cli run(String input, String... args) throws Exception {
		PrintStream out = new PrintStream(outBytes, true, "UTF-8");
		PrintStream err = new PrintStream(errBytes, true, "UTF-8");
		ByteArrayInputStream in = new ByteArrayInputStream(input.getBytes(StandardCharsets.UTF_8));
		return Cli.create(args, in, out, err, dir);
	}

	private String out() {
		return new String(outBytes.toByteArray(), StandardCharsets.UTF_8);
	}

	private String err() {
		return new String(errBytes.toByteArray(), StandardCharsets.UTF_8);
	}

	private Path write(String name, String content) throws IOException {
		Path file = dir.resolve(name);
		Files.write(file, content.getBytes(StandardCharsets.UTF_8));
		return file;
	}

	private static String read(Path file) throws IOException {
		return new String(Files.readAllBytes(file), StandardCharsets.UTF_8);
	}

	@Test
	public void testFormatInPlace() throws Exception {
		Path file = write("a.sh", UNFORMATTED);
		run("", "a.sh");
		assertEquals(FORMATTED, read(file));
		assertFalse(Files.exists(dir.resolve("a.sh.bak")));
	}

	@Test
	public void testBackup() throws Exception {
		Path file = write("a.sh", UNFORMATTED);
		run("", "-b", "a.sh");
		assertEquals(FORMATTED, read(file));
		assertEquals(UNFORMATTED, read(dir.resolve("a.sh.bak")));
	}

	@Test
	public void testCheckModeReportsAndKeepsFile() throws Exception {
		Path file = write("a.sh", UNFORMATTED);
		ExitException e = assertThrows("Check mode must fail on unformatted files", ExitException.class, () -> run("", "--check", "a.sh"));
		assertEquals(1, e.getCode());
		assertEquals(UNFORMATTED, read(file));
		assertTrue(out(), out().contains("a.sh: would be reformatted (first difference on line 1)"));
	}

	@Test
	public void testCheckModePrintsUnifiedDiff() throws Exception {
		write("a.sh", UNFORMATTED);
		assertThrows(ExitException.class, () -> run("", "--check", "a.sh"));
		String report = out();
		assertTrue(report, report.contains("a.sh (original)"));
		assertTrue(report, report.contains("a.sh (formatted)"));
		assertTrue(report, report.contains("\n-if true;then\n"));
		assertTrue(report, report.contains("\n+    echo x\n"));
	}

	@Test
	public void testUnifiedDiff() {
		List<String> diff = Cli.unifiedDiff("x.sh", "a\nb\nc\n", "a\nB\nc\n");
		assertEquals("--- x.sh (original)", diff.get(0));
		assertEquals("+++ x.sh (formatted)", diff.get(1));
		assertTrue(diff.toString(), diff.get(2).startsWith("@@ -1,"));
		assertTrue(diff.toString(), diff.contains("-b"));
		assertTrue(diff.toString(), diff.contains("+B"));
		assertTrue(diff.toString(), diff.contains(" a"));
	}

	@Test
	public void testEditorConfigPerFile() throws Exception {
		write(".editorconfig", "root = true\n\n[*.sh]\nindent_size = 2\n\n[*.bash]\nindent_style = tab\n");
		Path two = write("a.sh", UNFORMATTED);
		Path tabs = write("b.bash", UNFORMATTED);
		run("", "a.sh", "b.bash");
		assertEquals("if true; then\n  echo x\nfi\n", read(two));
		assertEquals("if true; then\n\techo x\nfi\n", read(tabs));

		write("a.sh", UNFORMATTED);
		run("", "-i", "3", "a.sh");
		assertEquals("if true; then\n   echo x\nfi\n", read(two));
	}

	@Test
	public void testCheckModeAcceptsFormattedFile() throws Exception {
		write("ok.sh", FORMATTED);
		run("", "-c", "ok.sh");
		assertEquals("", out());
	}

	@Test
	public void testParseErrorLeavesFileUnchanged() throws Exception {
		Path broken = write("broken.sh", "if true; then\necho x\n");
		Path good = write("good.sh", UNFORMATTED);
		assertThrows(ExitException.class, () -> run("", "broken.sh", "good.sh"));
		assertEquals("if true; then\necho x\n", read(broken));
		assertEquals(FORMATTED, read(good));
		assertTrue(err(), err().contains("broken.sh: could not be parsed, left unchanged"));
	}

	@Test
	public void testMissingFile() throws Exception {
		assertThrows(ExitException.class, () -> run("", "missing.sh"));
		assertTrue(err(), err().contains("missing.sh"));
	}

	@Test
	public void testStdin() throws Exception {
		run(UNFORMATTED, "-i", "2", "-");
		assertEquals("if true; then\n  echo x\nfi\n", out());
	}

	@Test
	public void testConfigFileAndOverride() throws Exception {
		write(".bashfmtrc", "indent_size = 2\nforce_function_style = \"fnonly\"\n");
		Cli cli = run(UNFORMATTED, "-");
		assertEquals("if true; then\n  echo x\nfi\n", out());
		assertEquals(FunctionStyle.FNONLY, cli.getSettings().getFunctionStyle());

		outBytes.reset();
		run(UNFORMATTED, "--indent-size", "3", "-");
		assertEquals("if true; then\n   echo x\nfi\n", out());
	}

	@Test
	public void testExplicitConfig() throws Exception {
		write("style.toml", "[bashfmt]\ntab = true\n");
		run(UNFORMATTED, "--config", "style.toml", "-");
		assertEquals("if true; then\n\techo x\nfi\n", out());
	}

	@Test
	public void testDumpSyntax() throws Exception {
		run("echo hi\n", "--dump-syntax", "-");
		assertTrue(out(), out().startsWith("Script"));
		assertTrue(out(), out().contains("SimpleCommand"));
	}

	@Test
	public void testVersion() throws Exception {
		run("", "--version");
		assertTrue(out(), out().startsWith("bashfmt "));
	}

	@Test
	public void testUsage() throws Exception {
		run("", "-h");
		assertTrue(out(), out().startsWith("Usage:"));
	}

	@Test
	public void testInvalidArguments() {
		IllegalArgumentException e = assertThrows(IllegalArgumentException.class, () -> run("", "--bogus", "a.sh"));
		assertEquals("Unknown parameter: --bogus", e.getMessage());
		assertThrows(IllegalArgumentException.class, () -> run("", "-i"));
		assertThrows(IllegalArgumentException.class, () -> run("", "-i", "zero", "a.sh"));
		assertThrows(IllegalArgumentException.class, () -> run("", "-s", "arrow", "a.sh"));
		assertThrows(IllegalArgumentException.class, () -> run("", "-t"));
		assertThrows(IllegalArgumentException.class, () -> run("", "-h", "a.sh"));
	}

	@Test
	public void testFilesAfterDoubleDash() {
		Cli cli = new Cli();
		cli.parse(new String[] { "-t", "--", "-c", "x.sh" });
		assertEquals(2, cli.getFiles().size());
		assertEquals("-c", cli.getFiles().get(0));
	}

	@Test
	public void testFirstDifferentLine() {
		assertEquals(2, Cli.firstDifferentLine("a\nb\n", "a\nc\n"));
		assertEquals(3, Cli.firstDifferentLine("a\nb", "a\nb\n"));
	}
}
