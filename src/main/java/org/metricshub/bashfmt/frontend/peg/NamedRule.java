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
 * A rule with a name: it produces one {@link ParseNode} per match and its
 * outcome is memoized per position.
 */
public final class NamedRule extends Rule {

	private final String name;
	private final int id;
	private Rule expression;

	NamedRule(String name, int id) {
		this.name = name;
		this.id = id;
	}

	void define(Rule expr) {
		if (expression != null) {
			throw new IllegalStateException("Rule " + name + " is already defined");
		}
		expression = expr;
	}

	/**
	 * @return the name given to the produced nodes
	 */
	public String getName() {
		return name;
	}

	int getId() {
		return id;
	}

	Rule getExpression() {
		if (expression == null) {
			throw new IllegalStateException("Rule " + name + " was declared but never defined");
		}
		return expression;
	}

	@Override
	protected int match(ParseContext ctx, int pos, List<ParseNode> out) {
		return ctx.matchNamed(this, pos, out);
	}

	@Override
	protected String describe() {
		return name;
	}
}
