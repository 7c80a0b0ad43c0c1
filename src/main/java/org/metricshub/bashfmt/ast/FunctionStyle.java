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

import java.util.Locale;

/**
 * The three ways of declaring a Bash function.
 */
public enum FunctionStyle {

	/** {@code function name() { ... }} */
	FNPAR,

	/** {@code function name { ... }} */
	FNONLY,

	/** {@code name() { ... }} */
	PARONLY;

	/**
	 * Parse a style name as written on the command line or in a configuration
	 * file ({@code fnpar}, {@code fnonly} or {@code paronly}, any case).
	 *
	 * @param name name of the style
	 * @return the corresponding style
	 * @throws IllegalArgumentException if the name is unknown
	 */
	public static FunctionStyle fromName(String name) {
		for (FunctionStyle style : values()) {
			if (style.name().equals(name.trim().toUpperCase(Locale.ROOT))) {
				return style;
			}
		}
		throw new IllegalArgumentException("Unknown function style: " + name + " (expected fnpar, fnonly or paronly)");
	}

	/**
	 * @return the name of this style as accepted by {@link #fromName(String)}
	 */
	public String getName() {
		return name().toLowerCase(Locale.ROOT);
	}
}
