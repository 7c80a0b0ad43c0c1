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

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Node of the generic parse tree produced by a {@link Grammar}.
 * <p>
 * Only named rules produce nodes. Anonymous combinators (sequences,
 * repetitions, optionals) splice the nodes of their operands directly into
 * the nearest named ancestor, so the tree never contains wrapper nodes
 * introduced by the repetition mechanism.
 */
public final class ParseNode {

	private final String name;
	private final String source;
	private final int start;
	private final int end;
	private final List<ParseNode> children;

	ParseNode(String name, String source, int start, int end, List<ParseNode> children) {
		this.name = name;
		this.source = source;
		this.start = start;
		this.end = end;
		this.children = Collections.unmodifiableList(new ArrayList<ParseNode>(children));
	}

	/**
	 * @return the name of the rule that produced this node
	 */
	public String getName() {
		return name;
	}

	/**
	 * @return offset of the first character matched by this node
	 */
	public int getStart() {
		return start;
	}

	/**
	 * @return offset just past the last character matched by this node
	 */
	public int getEnd() {
		return end;
	}

	/**
	 * @return the exact text matched by this node
	 */
	public String getText() {
		return source.substring(start, end);
	}

	/**
	 * @return the whole text this node was parsed from
	 */
	public String getSource() {
		return source;
	}

	/**
	 * @return the named children of this node, in source order
	 */
	public List<ParseNode> getChildren() {
		return children;
	}

	/**
	 * Checks whether this node was produced by the rule with the given name.
	 *
	 * @param ruleName name of a rule
	 * @return {@code true} if this node has the given name
	 */
	public boolean is(String ruleName) {
		return name.equals(ruleName);
	}

	/**
	 * Returns the first direct child produced by the given rule.
	 *
	 * @param ruleName name of a rule
	 * @return the first matching child, or {@code null}
	 */
	public ParseNode child(String ruleName) {
		for (ParseNode child : children) {
			if (child.is(ruleName)) {
				return child;
			}
		}
		return null;
	}

	/**
	 * Returns all direct children produced by the given rule.
	 *
	 * @param ruleName name of a rule
	 * @return the matching children, in source order
	 */
	public List<ParseNode> children(String ruleName) {
		List<ParseNode> result = new ArrayList<ParseNode>();
		for (ParseNode child : children) {
			if (child.is(ruleName)) {
				result.add(child);
			}
		}
		return result;
	}

	/**
	 * @param ruleName name of a rule
	 * @return {@code true} if a direct child was produced by the given rule
	 */
	public boolean has(String ruleName) {
		return child(ruleName) != null;
	}

	/**
	 * Print a textual representation of this tree, one node per line.
	 *
	 * @param ps destination stream
	 */
	public void dump(PrintStream ps) {
		dump(ps, 0);
	}

	private void dump(PrintStream ps, int lvl) {
		StringBuilder spaces = new StringBuilder();
		for (int i = 0; i < lvl; i++) {
			spaces.append(' ');
		}
		ps.println(spaces + toString());
		for (ParseNode child : children) {
			child.dump(ps, lvl + 1);
		}
	}

	@Override
	public String toString() {
		return name + "[" + start + ".." + end + "]";
	}
}
