package org.metricshub.bashfmt.ast;

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
import java.util.List;

/**
 * Base class of all the nodes of the typed syntax tree of a Bash script.
 * <p>
 * Nodes are created by the AST builder and are read-only afterwards, with the
 * single exception of {@link HereDoc} bodies which are attached once the whole
 * tree is built.
 */
public abstract class AstNode {

	private final SourceLocation location;

	protected AstNode(SourceLocation location) {
		this.location = location;
	}

	/**
	 * @return where this node was found in the parsed text, or {@code null}
	 */
	public SourceLocation getLocation() {
		return location;
	}

	/**
	 * @return the direct children of this node, in source order
	 */
	public abstract List<? extends AstNode> getChildren();

	/**
	 * Dump a textual representation of this
	 * abstract syntax tree node to the output (print)
	 * stream, one node per line, children indented below their parent.
	 *
	 * @param ps The print stream to dump the text
	 *        representation.
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
		for (AstNode child : getChildren()) {
			if (child != null) {
				child.dump(ps, lvl + 1);
			}
		}
	}

	@Override
	public String toString() {
		return getClass().getSimpleName();
	}
}
