package org.metricshub.bashfmt.frontend.peg;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * BashFmt
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
 * ჻჻჻჻჻჻
 * This program is free software: you can redistribute it and/or modify
 * it under the terms of the GNU Lesser General Public License as
 * published by the Free Software Foundation, either version 3 of the
 * License, or (at your option) any later version.
 *
 * This program is distributed in the hope that it will be useful,
 * but WITHOUT ANY WARRANTY; without even the implied warranty of
 * MERCHANTABILITY or FITNESS FOR A PARTICULAR PURPOSE.  See the
 * GNU General Lesser Public License for more details.
 *
 * You should have received a copy of the GNU General Lesser Public
 * License along with this program.  If not, see
 * <http://www.gnu.org/licenses/lgpl-3.0.html>.
 * ╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱
 */

import java.util.ArrayList;
import java.util.HashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;

/**
 * State of one parse: the input, the packrat memo table and the farthest
 * failure seen so far (used to report meaningful error positions).
 * <p>
 * A context is used for a single parse and must not be shared.
 */
public final class ParseContext {

	/** Memoized outcome of a named rule at a given position. */
	private static final class Memo {
		private final int end;
		private final ParseNode node;

		private Memo(int end, ParseNode node) {
			this.end = end;
			this.node = node;
		}
	}

	private final String text;
	private final Map<Long, Memo> memo = new HashMap<Long, Memo>();
	private int farthestFailure = -1;
	private int lookaheadDepth;
	private final Set<String> expected = new LinkedHashSet<String>();

	/**
	 * @param text the input to parse
	 */
	public ParseContext(String text) {
		this.text = text;
	}

	/**
	 * @return the input being parsed
	 */
	public String getText() {
		return text;
	}

	/**
	 * Match the root rule against the whole input.
	 *
	 * @param root the start rule, usually a named rule
	 * @return the root node, or {@code null} if the input does not match
	 *         entirely
	 */
	public ParseNode parse(Rule root) {
		List<ParseNode> out = new ArrayList<ParseNode>();
		int end = root.match(this, 0, out);
		if (end == text.length() && out.size() == 1) {
			return out.get(0);
		}
		if (end != Rule.FAIL && end < text.length()) {
			fail(end, "end of input");
		}
		return null;
	}

	/**
	 * @return offset of the farthest position where a leaf failed to match
	 */
	public int getFarthestFailure() {
		return farthestFailure;
	}

	/**
	 * @return descriptions of what was expected at the farthest failure
	 */
	public Set<String> getExpected() {
		return expected;
	}

	void fail(int pos, String description) {
		if (lookaheadDepth > 0) {
			return;
		}
		if (pos > farthestFailure) {
			farthestFailure = pos;
			expected.clear();
		}
		if (pos == farthestFailure && expected.size() < 8) {
			expected.add(description);
		}
	}

	void enterLookahead() {
		lookaheadDepth++;
	}

	void exitLookahead() {
		lookaheadDepth--;
	}

	int matchNamed(NamedRule rule, int pos, List<ParseNode> out) {
		long key = ((long) rule.getId() << 32) | pos;
		Memo cached = memo.get(key);
		if (cached == null) {
			List<ParseNode> children = new ArrayList<ParseNode>();
			int end = rule.getExpression().match(this, pos, children);
			ParseNode node = end == Rule.FAIL ? null : new ParseNode(rule.getName(), text, pos, end, children);
			cached = new Memo(end, node);
			memo.put(key, cached);
		}
		if (cached.end != Rule.FAIL) {
			out.add(cached.node);
		}
		return cached.end;
	}
}
