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
 * Two or more parts written next to each other and forming a single word, as
 * in {@code --prefix="$HOME"/bin}.
 */
public final class ConcatenatedWord extends Word {

	private final List<Word> parts;

	public ConcatenatedWord(SourceLocation location, List<Word> parts) {
		super(location);
		if (parts.size() < 2) {
			throw new IllegalArgumentException("A concatenated word has at least two parts");
		}
		this.parts = Collections.unmodifiableList(parts);
	}

	public List<Word> getParts() {
		return parts;
	}

	@Override
	public Kind getKind() {
		return Kind.CONCATENATED;
	}

	@Override
	public List<? extends AstNode> getChildren() {
		return parts;
	}
}
