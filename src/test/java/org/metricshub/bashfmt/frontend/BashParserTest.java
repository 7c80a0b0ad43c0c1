package org.metricshub.bashfmt.frontend;

import static org.junit.Assert.*;

import org.junit.Test;
import org.metricshub.bashfmt.frontend.peg.ParseNode;

public class BashParserTest {

	private static ParseNode parse(String source) {
		return new BashParser().parse(new HeredocPreprocessor().process(source), "test.sh");
	}

	private static ParserException fail(String source) {
		return assertThrows(
				"Expected a parse error for " + source,
				ParserException.class,
				() -> new BashParser().parse(new HeredocPreprocessor().process(source), "test.sh"));
	}

	@Test
	public void testAccepted() {
		String[] sources = {
				"",
				"\n\n",
				"#!/bin/bash\n",
				"echo hi",
				"a; b & c\n",
				"x=$(( 1 + 2 )) y=${z:-w}\n",
				"[[ -n $a && $b == \"x\" ]] && echo\n",
				"for (( i = 0; i < 3; i++ )); do echo $i; done\n",
				"select x in a b; do break; done\n",
				"until false; do :; done\n",
				"while read -r l; do :; done < <(ls)\n",
				"echo >&2 2>/dev/null &>log\n",
				"f() ( echo sub )\n",
				"case $x in\n  # note\n  (a) ;;\nesac\n",
				"echo $'a\\'b' $\"loc\" 'q'\n",
				"arr=(a \"b c\" $d)\n",
				"cat <<EOF | grep x\nbody\nEOF\n",
				"if a; then :; elif b; then :; fi\n",
				"echo a \\\n  b\n" };
		for (String source : sources) {
			assertEquals(source, "script", parse(source).getName());
		}
	}

	@Test
	public void testRejected() {
		String[] sources = { "if true; then\n", "echo \"open\n", "done\n", "case x in\n", "echo )\n", "{ echo\n" };
		for (String source : sources) {
			fail(source);
		}
	}

	@Test
	public void testErrorPosition() {
		ParserException e = fail("echo ok\necho )\n");
		assertEquals(2, e.getLineNumber());
		assertEquals(6, e.getColumn());
		assertEquals("test.sh", e.getSourceDescription());
		assertTrue(e.getMessage(), e.getMessage().startsWith("test.sh:2:6: Unexpected ')'"));
	}

	@Test
	public void testKeywordsAreNotCommandNames() {
		ParseNode root = parse("iffy; done_x\n");
		assertEquals("script", root.getName());
	}
}
