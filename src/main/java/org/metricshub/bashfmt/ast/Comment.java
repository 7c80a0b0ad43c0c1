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
 * A comment, {@code #} included. An inline comment trails the statement (or
 * the header line) that precedes it; other comments stand on their own line.
 */
public final class Comment extends Statement {

	private final String text;
	private final boolean inline;

	public Comment(SourceLocation location, String text, boolean inline) {
		super(location);
		this.text = text;
		this.inline = inline;
	}

	public String getText() {
		return text;
	}

	public boolean isInline() {
		return inline;
	}

	@Override
	public Kind getKind() {
		return Kind.COMMENT;
	}

	@Override
	public List<? extends AstNode> getChildren() {
		return Collections.emptyList();
	}

	@Override
	public String toString() {
		return (inline ? "InlineComment[" : "Comment[") + text + "]";
	}
}
