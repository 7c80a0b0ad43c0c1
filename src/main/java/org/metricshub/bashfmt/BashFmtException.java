package org.metricshub.bashfmt;

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
 * An exception thrown by BashFmt. It is provided
 * to conveniently distinguish between formatter
 * failures and other runtime exceptions.
 */
public class BashFmtException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final int lineNumber;

	public BashFmtException(String msg) {
		super(msg);
		this.lineNumber = -1;
	}

	public BashFmtException(String msg, Throwable cause) {
		super(msg, cause);
		this.lineNumber = -1;
	}

	/**
	 * @param lineno line of the script where the problem was found
	 * @param msg description of the problem
	 */
	public BashFmtException(int lineno, String msg) {
		super(msg);
		this.lineNumber = lineno;
	}

	/**
	 * Returns the line number associated with this exception or {@code -1} if
	 * unavailable.
	 *
	 * @return the offending line number or {@code -1}
	 */
	public int getLineNumber() {
		return lineNumber;
	}
}
