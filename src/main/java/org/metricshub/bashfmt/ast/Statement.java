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
 * Base class of the statement nodes. Each variant reports its
 * {@link Kind}, which consumers switch over.
 */
public abstract class Statement extends AstNode {

	/** Tag of the statement variants. */
	public enum Kind {
		SIMPLE_COMMAND,
		PIPELINE,
		AND_OR_LIST,
		COMPOUND_LIST,
		SUBSHELL,
		BRACE_GROUP,
		IF,
		FOR,
		ARITHMETIC_FOR,
		WHILE,
		UNTIL,
		CASE,
		ARITHMETIC_COMMAND,
		CONDITIONAL_COMMAND,
		FUNCTION_DEF,
		BACKGROUND,
		COMMENT,
		BLANK_LINE
	}

	protected Statement(SourceLocation location) {
		super(location);
	}

	/**
	 * @return the variant of this statement
	 */
	public abstract Kind getKind();
}
