package org.metricshub.bashfmt.util;

import static org.junit.Assert.*;

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.metricshub.bashfmt.ast.FunctionStyle;
import org.metricshub.bashfmt.backend.VariableStyle;

public class ConfigLoaderTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private Path write(String name, String content) throws IOException {
		Path file = folder.getRoot().toPath().resolve(name);
		Files.write(file, content.getBytes(StandardCharsets.UTF_8));
		return file;
	}

	@Test
	public void testDefaults() {
		FormatSettings settings = ConfigLoader.load(folder.getRoot().toPath(), null);
		assertEquals(4, settings.getIndentSize());
		assertFalse(settings.isTab());
		assertNull(settings.getFunctionStyle());
		assertEquals(VariableStyle.NONE, settings.getVariableStyle());
		assertFalse(settings.isBackup());
		assertFalse(settings.isCheck());
	}

	@Test
	public void testPyprojectSection() throws Exception {
		write("pyproject.toml", "[project]\nname = \"x\"\nindent_size = 7\n\n[tool.bashfmt]\nindent_size = 2\ntab = true\n");
		FormatSettings settings = ConfigLoader.load(folder.getRoot().toPath(), null);
		assertEquals(2, settings.getIndentSize());
		assertTrue(settings.isTab());
	}

	@Test
	public void testPrecedence() throws Exception {
		write("pyproject.toml", "[tool.bashfmt]\nindent_size = 2\nbackup = true\n");
		write(".bashfmtrc", "indent_size = 3\nforce_function_style = \"paronly\"\n");
		Path explicit = write("custom.toml", "[bashfmt]\nindent_size = 8\nvariable_style = \"braces\"\n");

		FormatSettings settings = ConfigLoader.load(folder.getRoot().toPath(), null);
		assertEquals(3, settings.getIndentSize());
		assertTrue(settings.isBackup());
		assertEquals(FunctionStyle.PARONLY, settings.getFunctionStyle());

		settings = ConfigLoader.load(folder.getRoot().toPath(), explicit);
		assertEquals(8, settings.getIndentSize());
		assertEquals(VariableStyle.BRACES, settings.getVariableStyle());
		assertEquals(FunctionStyle.PARONLY, settings.getFunctionStyle());
	}

	@Test
	public void testMissingExplicitFile() {
		Path missing = folder.getRoot().toPath().resolve("nope.toml");
		assertThrows(
				"An explicit configuration file must exist",
				IllegalArgumentException.class,
				() -> ConfigLoader.load(folder.getRoot().toPath(), missing));
	}

	@Test
	public void testMalformedFileIsIgnored() throws Exception {
		write(".bashfmtrc", "indent_size = = 3\n");
		FormatSettings settings = ConfigLoader.load(folder.getRoot().toPath(), null);
		assertEquals(FormatSettings.DEFAULT_INDENT_SIZE, settings.getIndentSize());
	}

	@Test
	public void testInvalidValues() throws Exception {
		write(".bashfmtrc", "indent_size = \"wide\"\n");
		assertThrows(IllegalArgumentException.class, () -> ConfigLoader.load(folder.getRoot().toPath(), null));
		write(".bashfmtrc", "tab = \"yes\"\n");
		assertThrows(IllegalArgumentException.class, () -> ConfigLoader.load(folder.getRoot().toPath(), null));
		write(".bashfmtrc", "force_function_style = \"lambda\"\n");
		assertThrows(IllegalArgumentException.class, () -> ConfigLoader.load(folder.getRoot().toPath(), null));
	}

	@Test
	public void testDescription() {
		FormatSettings settings = new FormatSettings();
		settings.setTab(true);
		assertEquals("\t", settings.getIndentUnit());
		settings.setTab(false);
		settings.setIndentSize(2);
		assertEquals("  ", settings.getIndentUnit());
		assertTrue(settings.toDescriptionString(), settings.toDescriptionString().contains("indentSize"));
		assertThrows(IllegalArgumentException.class, () -> settings.setIndentSize(0));
	}

	@Test
	public void testEditorConfig() throws Exception {
		write(".editorconfig", "root = true\n\n[*.sh]\nindent_style = space\nindent_size = 2\n");
		Path root = folder.getRoot().toPath();
		FormatSettings settings = ConfigLoader.load(root, null, root.resolve("a.sh"));
		assertEquals(2, settings.getIndentSize());
		assertFalse(settings.isTab());

		settings = ConfigLoader.load(root, null, root.resolve("notes.txt"));
		assertEquals(4, settings.getIndentSize());

		settings = ConfigLoader.load(root, null);
		assertEquals(4, settings.getIndentSize());
	}

	@Test
	public void testEditorConfigTabs() throws Exception {
		write(".editorconfig", "root = true\n\n[*]\nindent_style = tab\n");
		Path root = folder.getRoot().toPath();
		FormatSettings settings = ConfigLoader.load(root, null, root.resolve("a.sh"));
		assertTrue(settings.isTab());
		assertEquals("\t", settings.getIndentUnit());
	}

	@Test
	public void testEditorConfigHasLowestPrecedence() throws Exception {
		write(".editorconfig", "root = true\n\n[*.sh]\nindent_style = tab\nindent_size = 2\n");
		write("pyproject.toml", "[tool.bashfmt]\ntab = false\n");
		write(".bashfmtrc", "indent_size = 3\n");
		Path root = folder.getRoot().toPath();
		FormatSettings settings = ConfigLoader.load(root, null, root.resolve("a.sh"));
		assertFalse(settings.isTab());
		assertEquals(3, settings.getIndentSize());
	}

	@Test
	public void testEditorConfigInvalidIndentIsIgnored() throws Exception {
		write(".editorconfig", "root = true\n\n[*.sh]\nindent_size = wide\n");
		Path root = folder.getRoot().toPath();
		FormatSettings settings = ConfigLoader.load(root, null, root.resolve("a.sh"));
		assertEquals(4, settings.getIndentSize());
	}
}
