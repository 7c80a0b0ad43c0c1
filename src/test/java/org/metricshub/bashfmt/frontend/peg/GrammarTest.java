package org.metricshub.bashfmt.frontend.peg;

import static org.junit.Assert.*;

import org.junit.Test;

public class GrammarTest {

	/** Comma separated list of numbers or nested lists. */
	private static final class ListGrammar extends Grammar {
		final NamedRule number = rule("number", regex("[0-9]+"));
		final NamedRule list = declare("list");
		final Rule item = choice(number, list);
		final NamedRule keyword = rule("keyword", seq("nil", not(regex("[a-z]"))));

		{
			define(list, seq("[", optional(seq(item, zeroOrMore(seq(",", item)))), "]"));
		}

		final NamedRule top = rule("top", seq(choice(keyword, list), eof()));

		@Override
		public Rule root() {
			return top;
		}
	}

	private static final ListGrammar GRAMMAR = new ListGrammar();

	@Test
	public void testNestedNodes() {
		ParseNode root = GRAMMAR.parse(new ParseContext("[1,[2,3],4]"));
		assertNotNull(root);
		assertEquals("top", root.getName());
		ParseNode list = root.child("list");
		assertEquals("[1,[2,3],4]", list.getText());
		assertEquals(2, list.children("number").size());
		assertEquals("[2,3]", list.child("list").getText());
		assertEquals(3, list.child("list").getStart());
		assertFalse(root.has("keyword"));
	}

	@Test
	public void testNegativeLookahead() {
		assertNotNull(GRAMMAR.parse(new ParseContext("nil")));
		assertNull(GRAMMAR.parse(new ParseContext("nils")));
	}

	@Test
	public void testFarthestFailure() {
		ParseContext ctx = new ParseContext("[1,2,x]");
		assertNull(GRAMMAR.parse(ctx));
		assertEquals(5, ctx.getFarthestFailure());
		assertTrue(ctx.getExpected().toString(), ctx.getExpected().contains("/[0-9]+/"));
	}

	@Test
	public void testEmptyList() {
		assertNotNull(GRAMMAR.parse(new ParseContext("[]")));
		assertNull(GRAMMAR.parse(new ParseContext("[1,]")));
	}
}
