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

/**
 * Base class of the word nodes: the arguments, names and patterns of the
 * script, with their quoting and expansions.
 */
public abstract class Word extends AstNode implements CommandArgument {

	/** Tag of the word variants. */
	public enum Kind {
		LITERAL,
		SINGLE_QUOTED,
		DOUBLE_QUOTED,
		PARAMETER,
		COMMAND_SUBSTITUTION,
		ARITHMETIC,
		CONCATENATED
	}

	protected Word(SourceLocation location) {
		super(location);
	}

	/**
	 * @return the variant of this word
	 */
	public abstract Kind getKind();
}
