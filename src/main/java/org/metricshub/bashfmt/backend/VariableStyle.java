package org.metricshub.bashfmt.backend;

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

import java.util.Locale;

/**
 * How parameter expansions are written.
 */
public enum VariableStyle {

	/** Keep each expansion as written. */
	NONE,

	/** Write <code>$NAME</code> as <code>${NAME}</code>. */
	BRACES;

	/**
	 * @param name {@code none} or {@code braces}, in any case
	 * @return the matching style
	 * @throws IllegalArgumentException for any other name
	 */
	public static VariableStyle fromName(String name) {
		for (VariableStyle style : values()) {
			if (style.name().equalsIgnoreCase(name)) {
				return style;
			}
		}
		throw new IllegalArgumentException("Unknown variable style: " + name + " (expecting none or braces)");
	}

	public String getName() {
		return name().toLowerCase(Locale.ROOT);
	}

	/**
	 * Whether an unbraced {@code $name} should be written with braces.
	 * Special and positional parameters are never braced.
	 *
	 * @param name the parameter name
	 * @return {@code true} in {@link #BRACES} mode for ordinary names
	 */
	boolean bracesFor(String name) {
		return this == BRACES && !name.isEmpty() && isNameStart(name.charAt(0));
	}

	/**
	 * Apply this style to raw text holding expansions, such as an unquoted
	 * here-document body or the inside of {@code [[ ]]}.
	 * <p>
	 * Escaped dollars are left alone. With {@code singleQuotes}, text between
	 * single quotes (outside double quotes) is left alone as well.
	 *
	 * @param raw the text
	 * @param singleQuotes whether single quotes prevent expansion in this text
	 * @return the text with the style applied
	 */
	String apply(String raw, boolean singleQuotes) {
		if (this == NONE || raw.indexOf('$') < 0) {
			return raw;
		}
		StringBuilder result = new StringBuilder(raw.length() + 16);
		boolean inDouble = false;
		int i = 0;
		int n = raw.length();
		while (i < n) {
			char c = raw.charAt(i);
			if (c == '\\' && i + 1 < n) {
				result.append(c).append(raw.charAt(i + 1));
				i += 2;
			} else if (singleQuotes && c == '"') {
				inDouble = !inDouble;
				result.append(c);
				i++;
			} else if (singleQuotes && c == '\'' && !inDouble) {
				int close = raw.indexOf('\'', i + 1);
				int end = close < 0 ? n : close + 1;
				result.append(raw, i, end);
				i = end;
			} else if (c == '$' && i + 1 < n && isNameStart(raw.charAt(i + 1))) {
				int end = i + 2;
				while (end < n && isNamePart(raw.charAt(end))) {
					end++;
				}
				result.append("${").append(raw, i + 1, end).append('}');
				i = end;
			} else {
				result.append(c);
				i++;
			}
		}
		return result.toString();
	}

	private static boolean isNameStart(char c) {
		return c == '_' || c >= 'A' && c <= 'Z' || c >= 'a' && c <= 'z';
	}

	private static boolean isNamePart(char c) {
		return isNameStart(c) || c >= '0' && c <= '9';
	}
}
