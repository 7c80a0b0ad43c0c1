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

import java.util.Collections;
import java.util.List;

/**
 * {@code $(( expression ))}, kept as raw text.
 */
public final class ArithmeticExpansion extends Word {

	private final String expression;

	public ArithmeticExpansion(SourceLocation location, String expression) {
		super(location);
		this.expression = expression;
	}

	public String getExpression() {
		return expression;
	}

	@Override
	public Kind getKind() {
		return Kind.ARITHMETIC;
	}

	@Override
	public List<? extends AstNode> getChildren() {
		return Collections.emptyList();
	}

	@Override
	public String toString() {
		return "ArithmeticExpansion[" + expression + "]";
	}
}
