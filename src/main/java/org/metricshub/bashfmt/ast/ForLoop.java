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
 * {@code for name in words; do ...; done}, and its {@code select} twin.
 * <p>
 * The word list is {@code null} when the {@code in} part is omitted (iterate
 * over the positional parameters), and empty for a bare {@code in}.
 */
public final class ForLoop extends CompoundCommand {

	private final boolean select;
	private final String variable;
	private final List<Word> words;
	private final CompoundList body;

	public ForLoop(
			SourceLocation location,
			boolean select,
			String variable,
			List<Word> words,
			CompoundList body,
			List<Redirect> redirects) {
		super(location, redirects);
		this.select = select;
		this.variable = variable;
		this.words = words == null ? null : Collections.unmodifiableList(words);
		this.body = body;
	}

	/**
	 * @return {@code true} for a {@code select} loop
	 */
	public boolean isSelect() {
		return select;
	}

	public String getVariable() {
		return variable;
	}

	public List<Word> getWords() {
		return words;
	}

	public CompoundList getBody() {
		return body;
	}

	@Override
	public Kind getKind() {
		return Kind.FOR;
	}

	@Override
	public List<? extends AstNode> getChildren() {
		List<AstNode> children = new ArrayList<AstNode>();
		if (words != null) {
			children.addAll(words);
		}
		children.add(body);
		children.addAll(getRedirects());
		return children;
	}

	@Override
	public String toString() {
		return (select ? "SelectLoop[" : "ForLoop[") + variable + "]";
	}
}
