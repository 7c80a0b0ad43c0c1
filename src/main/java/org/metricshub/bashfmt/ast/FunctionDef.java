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
 * A function declaration. The style records how the function was declared in
 * the source; the formatter may render it differently.
 */
public final class FunctionDef extends Statement {

	private final String name;
	private final CompoundCommand body;
	private final FunctionStyle style;

	public FunctionDef(SourceLocation location, String name, CompoundCommand body, FunctionStyle style) {
		super(location);
		this.name = name;
		this.body = body;
		this.style = style;
	}

	public String getName() {
		return name;
	}

	/**
	 * @return the body, usually a {@link BraceGroup}, with its redirections
	 */
	public CompoundCommand getBody() {
		return body;
	}

	public FunctionStyle getStyle() {
		return style;
	}

	@Override
	public Kind getKind() {
		return Kind.FUNCTION_DEF;
	}

	@Override
	public List<? extends AstNode> getChildren() {
		return Collections.singletonList(body);
	}

	@Override
	public String toString() {
		return "FunctionDef[" + name + ", " + style.getName() + "]";
	}
}
