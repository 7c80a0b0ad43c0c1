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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

/**
 * Handles the regions of a script that must not be formatted:
 *
 * <pre>
 * # @formatter:off
 * ...
 * # @formatter:on
 * </pre>
 *
 * Before parsing, {@link #extract(String)} replaces each region, marker lines
 * included, with a single placeholder comment line. After formatting,
 * {@link Regions#restore(String)} puts the original text back in place of the
 * placeholders, whatever indentation the formatter gave them.
 */
public final class FormatterDirectives {

	static final String OFF = "# @formatter:off";
	static final String ON = "# @formatter:on";

	static final String PLACEHOLDER_PREFIX = "# __BASHFMT_NOFORMAT_";
	static final String PLACEHOLDER_SUFFIX = "__";

	/**
	 * The regions taken out of a script.
	 */
	public static final class Regions {
		private final String text;
		private final List<String> regions;

		Regions(String text, List<String> regions) {
			this.text = text;
			this.regions = Collections.unmodifiableList(regions);
		}

		/**
		 * @return the script with placeholders instead of the regions
		 */
		public String getText() {
			return text;
		}

		/**
		 * @return the original text of each region, without final newline
		 */
		public List<String> getRegions() {
			return regions;
		}

		/**
		 * Put the original regions back into the formatted text.
		 *
		 * @param formatted output of the formatter
		 * @return the text with the regions restored
		 */
		public String restore(String formatted) {
			String result = formatted;
			for (int i = 0; i < regions.size(); i++) {
				Pattern placeholder = Pattern.compile("^[ \\t]*" + Pattern.quote(placeholder(i)) + "$", Pattern.MULTILINE);
				Matcher matcher = placeholder.matcher(result);
				result = matcher.replaceFirst(Matcher.quoteReplacement(regions.get(i)));
			}
			return result;
		}
	}

	/**
	 * Private constructor to prevent instantiation.
	 */
	private FormatterDirectives() {
		// utility class
	}

	/**
	 * Replace the unformatted regions of the script with placeholders.
	 * A region that is not closed runs to the end of the script.
	 *
	 * @param source the script
	 * @return the script with placeholders and the extracted regions
	 * @throws IllegalArgumentException if the script already contains
	 *         placeholder comments
	 */
	public static Regions extract(String source) {
		if (source.contains(PLACEHOLDER_PREFIX)) {
			throw new IllegalArgumentException("Script already contains a " + PLACEHOLDER_PREFIX + " comment");
		}
		String[] lines = source.split("\n", -1);
		List<String> out = new ArrayList<String>();
		List<String> regions = new ArrayList<String>();
		List<String> buffer = null;
		for (String line : lines) {
			if (buffer == null) {
				if (line.trim().equals(OFF)) {
					buffer = new ArrayList<String>();
					buffer.add(line);
				} else {
					out.add(line);
				}
			} else {
				buffer.add(line);
				if (line.trim().equals(ON)) {
					out.add(placeholder(regions.size()));
					regions.add(String.join("\n", buffer));
					buffer = null;
				}
			}
		}
		if (buffer != null) {
			// unterminated: the final newline of the script stays outside
			boolean finalNewline = buffer.size() > 1 && buffer.get(buffer.size() - 1).isEmpty();
			if (finalNewline) {
				buffer.remove(buffer.size() - 1);
			}
			out.add(placeholder(regions.size()));
			regions.add(String.join("\n", buffer));
			if (finalNewline) {
				out.add("");
			}
		}
		return new Regions(String.join("\n", out), regions);
	}

	static String placeholder(int index) {
		return PLACEHOLDER_PREFIX + index + PLACEHOLDER_SUFFIX;
	}
}
