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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Pipelines chained with {@code &&} and {@code ||}, left to right.
 */
public final class AndOrList extends Statement {

	/** One {@code &&} or {@code ||} link of the chain. */
	public static final class Link {

		private final String operator;
		private final Statement pipeline;

		public Link(String operator, Statement pipeline) {
			if (!"&&".equals(operator) && !"||".equals(operator)) {
				throw new IllegalArgumentException("Not an and-or operator: " + operator);
			}
			this.operator = operator;
			this.pipeline = pipeline;
		}

		public String getOperator() {
			return operator;
		}

		public Statement getPipeline() {
			return pipeline;
		}
	}

	private final Statement first;
	private final List<Link> rest;

	public AndOrList(SourceLocation location, Statement first, List<Link> rest) {
		super(location);
		this.first = first;
		this.rest = Collections.unmodifiableList(rest);
	}

	public Statement getFirst() {
		return first;
	}

	public List<Link> getRest() {
		return rest;
	}

	@Override
	public Kind getKind() {
		return Kind.AND_OR_LIST;
	}

	@Override
	public List<? extends AstNode> getChildren() {
		List<AstNode> children = new ArrayList<AstNode>();
		children.add(first);
		for (Link link : rest) {
			children.add(link.getPipeline());
		}
		return children;
	}
}
