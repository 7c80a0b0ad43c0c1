package org.metricshub.bashfmt.frontend;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import org.metricshub.bashfmt.ast.HereDoc;
import org.metricshub.bashfmt.ast.SourceLocation;
import org.metricshub.bashfmt.frontend.HeredocPreprocessor.CapturedHeredoc;

public class HeredocPreprocessorTest {

	private final HeredocPreprocessor preprocessor = new HeredocPreprocessor();

	@Test
	public void testBodyIsRemovedFromText() {
		HeredocPreprocessor.Result result = preprocessor.process("cat <<EOF\nbody\nEOF\necho\n");
		assertEquals("cat <<EOF\necho\n", result.getText());
		assertEquals(1, result.getHeredocs().size());
		CapturedHeredoc heredoc = result.getHeredocs().get(0);
		assertEquals("EOF", heredoc.getDelimiter());
		assertEquals("body\n", heredoc.getBody());
		assertEquals("EOF", heredoc.getTerminatorLine());
		assertEquals(0, heredoc.getQuote());
		assertEquals(1, heredoc.getMarkerLine());
	}

	@Test
	public void testLineMapping() {
		HeredocPreprocessor.Result result = preprocessor.process("cat <<EOF\na\nb\nEOF\necho\n");
		assertEquals(1, result.toOriginalLine(1));
		assertEquals(5, result.toOriginalLine(2));
	}

	@Test
	public void testQuotedDelimiters() {
		List<CapturedHeredoc> heredocs = preprocessor
				.process("cat <<'A'\n$x\nA\ncat << \"B\"\n$y\nB\ncat <<\\C\n$z\nC\n")
				.getHeredocs();
		assertEquals(3, heredocs.size());
		assertEquals('\'', heredocs.get(0).getQuote());
		assertEquals('"', heredocs.get(1).getQuote());
		assertEquals("B", heredocs.get(1).getDelimiter());
		assertEquals('\\', heredocs.get(2).getQuote());
		assertEquals("$z\n", heredocs.get(2).getBody());
	}

	@Test
	public void testStripTabsKeepsRawLines() {
		HeredocPreprocessor.Result result = preprocessor.process("\tcat <<-END\n\t\tx\n\tEND\n");
		CapturedHeredoc heredoc = result.getHeredocs().get(0);
		assertTrue(heredoc.isStripTabs());
		assertEquals("\t\tx\n", heredoc.getBody());
		assertEquals("\tEND", heredoc.getTerminatorLine());
		assertEquals("\tcat <<-END\n", result.getText());
	}

	@Test
	public void testTwoMarkersOnOneLine() {
		HeredocPreprocessor.Result result = preprocessor.process("cat <<A <<B\na\nA\nb\nB\n");
		assertEquals("cat <<A <<B\n", result.getText());
		assertEquals(2, result.getHeredocs().size());
		assertEquals("a\n", result.getHeredocs().get(0).getBody());
		assertEquals("b\n", result.getHeredocs().get(1).getBody());
	}

	@Test
	public void testMarkerInsideQuotedCommandSubstitution() {
		HeredocPreprocessor.Result result = preprocessor
				.process("x=\"$(cat <<'EOF'\n$y \"z\"\nEOF\n)\"\necho \"<<A\"\n");
		assertEquals("x=\"$(cat <<'EOF'\n)\"\necho \"<<A\"\n", result.getText());
		assertEquals(1, result.getHeredocs().size());
		CapturedHeredoc heredoc = result.getHeredocs().get(0);
		assertEquals("EOF", heredoc.getDelimiter());
		assertEquals('\'', heredoc.getQuote());
		assertEquals("$y \"z\"\n", heredoc.getBody());
		assertEquals(4, result.toOriginalLine(2));
	}

	@Test
	public void testUnquotedMarkerInsideQuotedCommandSubstitution() {
		HeredocPreprocessor.Result result = preprocessor.process("echo \"$(cat <<EOF\nhi\nEOF\n)\"\n");
		assertEquals("echo \"$(cat <<EOF\n)\"\n", result.getText());
		assertEquals("hi\n", result.getHeredocs().get(0).getBody());
	}

	@Test
	public void testNotMarkers() {
		String[] sources = {
				"echo \"<<EOF\"\nEOF\n",
				"echo '<<EOF'\nEOF\n",
				"x=$(( 1 << 2 ))\n",
				"(( y = x << 3 ))\n",
				"cat <<<\"$x\"\n",
				"# cat <<EOF\n",
				"echo a<<b\n" };
		for (String source : sources) {
			HeredocPreprocessor.Result result = preprocessor.process(source);
			assertTrue(source, result.getHeredocs().isEmpty());
			assertEquals(source, result.getText());
		}
	}

	@Test
	public void testQuoteStateSpansLines() {
		HeredocPreprocessor.Result result = preprocessor.process("echo 'multi\nline <<EOF' done\nEOF\n");
		assertTrue(result.getHeredocs().isEmpty());
	}

	@Test
	public void testUnterminatedBody() {
		CapturedHeredoc heredoc = preprocessor.process("cat <<EOF\nx\n").getHeredocs().get(0);
		assertEquals("x\n", heredoc.getBody());
		assertNull(heredoc.getTerminatorLine());
	}

	@Test
	public void testResolveInOrder() {
		List<CapturedHeredoc> captured = preprocessor.process("cat <<EOF\none\nEOF\ncat <<EOF\ntwo\nEOF\n").getHeredocs();
		HereDoc first = new HereDoc(new SourceLocation(1, 5, 4, 5), "EOF", false, (char) 0);
		HereDoc second = new HereDoc(new SourceLocation(2, 5, 14, 5), "EOF", false, (char) 0);
		HeredocPreprocessor.resolve(Arrays.asList(first, second), captured);
		assertEquals("one\n", first.getBody());
		assertEquals("two\n", second.getBody());
		assertEquals("EOF", second.getTerminatorLine());
	}

	@Test
	public void testResolveMismatch() {
		List<CapturedHeredoc> captured = preprocessor.process("cat <<EOF\none\nEOF\n").getHeredocs();
		HereDoc node = new HereDoc(new SourceLocation(1, 5, 4, 5), "END", false, (char) 0);
		assertThrows(
				"Delimiters must agree",
				HeredocResolutionException.class,
				() -> HeredocPreprocessor.resolve(Collections.singletonList(node), captured));
	}

	@Test
	public void testResolveLeftoverBody() {
		List<CapturedHeredoc> captured = preprocessor.process("cat <<EOF\none\nEOF\n").getHeredocs();
		HeredocResolutionException e = assertThrows(
				"A body without node is an error",
				HeredocResolutionException.class,
				() -> HeredocPreprocessor.resolve(Collections.<HereDoc>emptyList(), captured));
		assertEquals(1, e.getLineNumber());
	}

	@Test
	public void testResolveMissingBody() {
		HereDoc node = new HereDoc(new SourceLocation(1, 5, 4, 5), "EOF", false, (char) 0);
		HeredocPreprocessor.resolve(Collections.singletonList(node), Collections.<CapturedHeredoc>emptyList());
		assertFalse(node.isAttached());
	}
}
