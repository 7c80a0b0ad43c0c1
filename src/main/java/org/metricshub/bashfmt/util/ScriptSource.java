package org.metricshub.bashfmt.util;

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

import java.io.IOException;
import java.io.Reader;

/**
 * Represents one Bash script to format.
 * This is usually either the standard input,
 * given on the command line as "-",
 * or a "*.sh" file, given by its path.
 */
public class ScriptSource {

	/** Constant <code>DESCRIPTION_STDIN="&lt;stdin&gt;"</code> */
	public static final String DESCRIPTION_STDIN = "<stdin>";

	private String description;
	private Reader reader;

	/**
	 * @param description name of the script, used in diagnostics
	 * @param reader a {@link java.io.Reader} serving the script text
	 */
	public ScriptSource(String description, Reader reader) {
		this.description = description;
		this.reader = reader;
	}

	public final String getDescription() {
		return description;
	}

	/**
	 * Obtain the {@link Reader} serving the script contents.
	 *
	 * @return The reader which contains the script contents.
	 * @throws java.io.IOException if any.
	 */
	public Reader getReader() throws IOException {
		return reader;
	}

	/**
	 * Read the whole script.
	 *
	 * @return the script text
	 * @throws java.io.IOException if the script cannot be read
	 */
	public String readAll() throws IOException {
		StringBuilder text = new StringBuilder();
		char[] buffer = new char[8192];
		try (Reader r = getReader()) {
			int count;
			while ((count = r.read(buffer)) >= 0) {
				text.append(buffer, 0, count);
			}
		}
		return text.toString();
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return getDescription();
	}
}
