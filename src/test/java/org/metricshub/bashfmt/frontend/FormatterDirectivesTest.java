package org.metricshub.bashfmt.frontend;

import static org.junit.Assert.*;

import org.junit.Test;

public class FormatterDirectivesTest {

	@Test
	public void testRegionReplacedByPlaceholder() {
		FormatterDirectives.Regions regions = FormatterDirectives
				.extract("a\n# @formatter:off\n  b   c\n# @formatter:on\nd\n");
		assertEquals("a\n" + FormatterDirectives.placeholder(0) + "\nd\n", regions.getText());
		assertEquals(1, regions.getRegions().size());
		assertEquals("# @formatter:off\n  b   c\n# @formatter:on", regions.getRegions().get(0));
	}

	@Test
	public void testIndentedDirectives() {
		FormatterDirectives.Regions regions = FormatterDirectives
				.extract("if x; then\n    # @formatter:off\n  y\n    # @formatter:on\nfi\n");
		assertEquals(1, regions.getRegions().size());
		assertEquals("    # @formatter:off\n  y\n    # @formatter:on", regions.getRegions().get(0));
	}

	@Test
	public void testRestoreReplacesWholeLine() {
		FormatterDirectives.Regions regions = FormatterDirectives
				.extract("if x; then\n# @formatter:off\n  y\n# @formatter:on\nfi\n");
		String formatted = "if x; then\n    " + FormatterDirectives.placeholder(0) + "\nfi";
		assertEquals("if x; then\n# @formatter:off\n  y\n# @formatter:on\nfi", regions.restore(formatted));
	}

	@Test
	public void testSeveralRegions() {
		FormatterDirectives.Regions regions = FormatterDirectives
				.extract("# @formatter:off\na\n# @formatter:on\nb\n# @formatter:off\nc\n# @formatter:on\n");
		assertEquals(2, regions.getRegions().size());
		assertEquals(
				FormatterDirectives.placeholder(0) + "\nb\n" + FormatterDirectives.placeholder(1) + "\n",
				regions.getText());
	}

	@Test
	public void testUnterminatedRegionRunsToEnd() {
		FormatterDirectives.Regions regions = FormatterDirectives.extract("a\n# @formatter:off\nb\n");
		assertEquals("a\n" + FormatterDirectives.placeholder(0) + "\n", regions.getText());
		assertEquals("# @formatter:off\nb", regions.getRegions().get(0));
	}

	@Test
	public void testNoDirectives() {
		String source = "echo a\necho b\n";
		FormatterDirectives.Regions regions = FormatterDirectives.extract(source);
		assertEquals(source, regions.getText());
		assertTrue(regions.getRegions().isEmpty());
		assertEquals("x", regions.restore("x"));
	}

	@Test
	public void testPlaceholderInSourceIsRejected() {
		assertThrows(
				"A script holding a placeholder cannot be handled",
				IllegalArgumentException.class,
				() -> FormatterDirectives.extract(FormatterDirectives.placeholder(3) + "\n"));
	}
}
