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
import java.util.List;

/**
 * {@code for ((init; test; step)); do ...; done}. The header is kept as raw
 * text.
 */
public final class ArithmeticForLoop extends CompoundCommand {

	private final String header;
	private final CompoundList body;

	public ArithmeticForLoop(SourceLocation location, String header, CompoundList body, List<Redirect> redirects) {
		super(location, redirects);
		this.header = header;
		this.body = body;
	}

	/**
	 * @return the text between {@code ((} and {@code ))}
	 */
	public String getHeader() {
		return header;
	}

	public CompoundList getBody() {
		return body;
	}

	@Override
	public Kind getKind() {
		return Kind.ARITHMETIC_FOR;
	}

	@Override
	public List<? extends AstNode> getChildren() {
		List<AstNode> children = new ArrayList<AstNode>();
		children.add(body);
		children.addAll(getRedirects());
		return children;
	}

	@Override
	public String toString() {
		return "ArithmeticForLoop[" + header + "]";
	}
}
