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
 * {@code "text $expansions"} or, for locale translation, {@code $"..."}.
 * The parts are literal text and expansions, in order.
 */
public final class DoubleQuotedWord extends Word {

	private final List<Word> parts;
	private final boolean locale;

	public DoubleQuotedWord(SourceLocation location, List<Word> parts, boolean locale) {
		super(location);
		this.parts = Collections.unmodifiableList(parts);
		this.locale = locale;
	}

	public List<Word> getParts() {
		return parts;
	}

	/**
	 * @return whether the word was written {@code $"..."}
	 */
	public boolean isLocale() {
		return locale;
	}

	@Override
	public Kind getKind() {
		return Kind.DOUBLE_QUOTED;
	}

	@Override
	public List<? extends AstNode> getChildren() {
		return parts;
	}
}
