package org.metricshub.bashfmt.frontend;

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

import org.metricshub.bashfmt.BashFmtException;

/**
 * The script could not be matched by the grammar.
 */
public class ParserException extends BashFmtException {

	private static final long serialVersionUID = 1L;

	private final String sourceDescription;
	private final int column;

	/**
	 * @param msg what was expected
	 * @param sourceDescription name of the script, usually its path
	 * @param lineNumber 1-based line of the failure
	 * @param column 1-based column of the failure
	 */
	public ParserException(String msg, String sourceDescription, int lineNumber, int column) {
		super(lineNumber, sourceDescription + ":" + lineNumber + ":" + column + ": " + msg);
		this.sourceDescription = sourceDescription;
		this.column = column;
	}

	public String getSourceDescription() {
		return sourceDescription;
	}

	public int getColumn() {
		return column;
	}
}
