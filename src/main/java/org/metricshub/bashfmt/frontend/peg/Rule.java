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

import java.util.List;

/**
 * A parsing expression.
 * <p>
 * Rules are immutable once the grammar that declares them is constructed and
 * may therefore be shared by concurrent parses. All per-parse state lives in
 * the {@link ParseContext}.
 */
public abstract class Rule {

	/** Value returned by {@link #match} when the expression does not match. */
	public static final int FAIL = -1;

	/**
	 * Try to match this expression at the given position.
	 * <p>
	 * On success, the nodes produced while matching are appended to
	 * {@code out} and the position just past the match is returned. On
	 * failure, {@link #FAIL} is returned; callers are responsible for
	 * discarding anything appended to {@code out} in the meantime.
	 *
	 * @param ctx state of the current parse
	 * @param pos offset where matching starts
	 * @param out list receiving the produced nodes
	 * @return the end offset, or {@link #FAIL}
	 */
	protected abstract int match(ParseContext ctx, int pos, List<ParseNode> out);

	/**
	 * @return a short description used in error messages
	 */
	protected abstract String describe();

	@Override
	public String toString() {
		return describe();
	}
}
