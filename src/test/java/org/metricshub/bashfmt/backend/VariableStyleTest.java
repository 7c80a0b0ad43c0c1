package org.metricshub.bashfmt.backend;

import static org.junit.Assert.*;

import org.junit.Test;

public class VariableStyleTest {

	@Test
	public void testNoneKeepsText() {
		assertEquals("$a $b", VariableStyle.NONE.apply("$a $b", false));
		assertFalse(VariableStyle.NONE.bracesFor("HOME"));
	}

	@Test
	public void testBracesForNames() {
		assertTrue(VariableStyle.BRACES.bracesFor("HOME"));
		assertTrue(VariableStyle.BRACES.bracesFor("_x1"));
		assertFalse(VariableStyle.BRACES.bracesFor("1"));
		assertFalse(VariableStyle.BRACES.bracesFor("?"));
		assertFalse(VariableStyle.BRACES.bracesFor(""));
	}

	@Test
	public void testApplyToHeredocText() {
		assertEquals("${a}/${b_2}.txt", VariableStyle.BRACES.apply("$a/$b_2.txt", false));
		assertEquals("\\$a ${b} $1 $@ ${c}", VariableStyle.BRACES.apply("\\$a $b $1 $@ ${c}", false));
		// quotes are plain text in a here-document body
		assertEquals("'${a}'", VariableStyle.BRACES.apply("'$a'", false));
	}

	@Test
	public void testApplyRespectsSingleQuotes() {
		assertEquals("'$a' \"${b} '${c}'\"", VariableStyle.BRACES.apply("'$a' \"$b '$c'\"", true));
		assertEquals(" -n ${x} && ${y} == 'lit$z' ", VariableStyle.BRACES.apply(" -n $x && $y == 'lit$z' ", true));
	}

	@Test
	public void testFromName() {
		assertEquals(VariableStyle.BRACES, VariableStyle.fromName("Braces"));
		assertEquals("none", VariableStyle.NONE.getName());
		assertThrows("Unknown style", IllegalArgumentException.class, () -> VariableStyle.fromName("curly"));
	}
}
