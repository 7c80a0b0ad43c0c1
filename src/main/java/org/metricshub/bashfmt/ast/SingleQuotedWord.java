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
 * {@code 'text'} or, for ANSI-C quoting, {@code $'text'}.
 */
public final class SingleQuotedWord extends Word {

	private final String content;
	private final boolean ansiC;

	/**
	 * @param location position in the source
	 * @param content the text between the quotes
	 * @param ansiC whether the word was written {@code $'...'}
	 */
	public SingleQuotedWord(SourceLocation location, String content, boolean ansiC) {
		super(location);
		this.content = content;
		this.ansiC = ansiC;
	}

	public String getContent() {
		return content;
	}

	public boolean isAnsiC() {
		return ansiC;
	}

	@Override
	public Kind getKind() {
		return Kind.SINGLE_QUOTED;
	}

	@Override
	public List<? extends AstNode> getChildren() {
		return Collections.emptyList();
	}

	@Override
	public String toString() {
		return "SingleQuotedWord[" + content + "]";
	}
}
