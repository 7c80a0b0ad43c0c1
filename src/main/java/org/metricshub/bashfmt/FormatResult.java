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
 * Outcome of {@link BashFmt#format(String, String)}: the formatted text, or
 * the original text when the script could not be formatted.
 */
public final class FormatResult {

	private final String formatted;
	private final boolean error;

	private FormatResult(String formatted, boolean error) {
		this.formatted = formatted;
		this.error = error;
	}

	static FormatResult success(String formatted) {
		return new FormatResult(formatted, false);
	}

	static FormatResult failure(String original) {
		return new FormatResult(original, true);
	}

	/**
	 * @return the formatted script, or the unmodified input if
	 *         {@link #hasError()}
	 */
	public String getFormatted() {
		return formatted;
	}

	/**
	 * @return {@code true} if the script could not be parsed
	 */
	public boolean hasError() {
		return error;
	}

	@Override
	public String toString() {
		return error ? "FormatResult[error]" : "FormatResult[ok]";
	}
}
