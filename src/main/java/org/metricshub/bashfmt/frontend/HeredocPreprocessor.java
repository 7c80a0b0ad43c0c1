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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.metricshub.bashfmt.ast.HereDoc;
import org.metricshub.bashfmt.util.BashFmtLogger;
import org.slf4j.Logger;

/**
 * Removes here-document bodies from a script before it is parsed.
 * <p>
 * The grammar cannot tell where a body ends: that is decided by a line equal
 * to the delimiter, whatever the syntax around it. This class therefore scans
 * the script line by line, and for every <code>&lt;&lt;DELIM</code> marker it
 * captures the following lines up to the terminator. The marker line stays in
 * the text handed to the grammar, the body and terminator lines are removed.
 * <p>
 * Bodies are kept in the order of their markers. Once the tree is built,
 * {@link #resolve(List, List)} hands them to the {@link HereDoc} nodes in the
 * same order, so that two here-documents sharing a delimiter keep their own
 * body.
 * <p>
 * An instance holds no state and can be shared.
 */
public final class HeredocPreprocessor {

	private static final Logger LOG = BashFmtLogger.getLogger(HeredocPreprocessor.class);

	/** Delimiter after the operator: quoted, escaped or bare. */
	private static final Pattern DELIMITER = Pattern
			.compile(
					"'(" + BashGrammar.NAME_REGEX + ")'|\"(" + BashGrammar.NAME_REGEX + ")\"|\\\\(" + BashGrammar.NAME_REGEX
							+ ")(?=[ \\t;&|()<>]|$)|(" + BashGrammar.NAME_REGEX + ")(?=[ \\t;&|()<>]|$)");

	/**
	 * A here-document body found in the source.
	 */
	public static final class CapturedHeredoc {
		private final String delimiter;
		private final boolean stripTabs;
		private final char quote;
		private final String body;
		private final String terminatorLine;
		private final int markerLine;

		CapturedHeredoc(String delimiter, boolean stripTabs, char quote, String body, String terminatorLine, int markerLine) {
			this.delimiter = delimiter;
			this.stripTabs = stripTabs;
			this.quote = quote;
			this.body = body;
			this.terminatorLine = terminatorLine;
			this.markerLine = markerLine;
		}

		public String getDelimiter() {
			return delimiter;
		}

		public boolean isStripTabs() {
			return stripTabs;
		}

		/**
		 * @return {@code '}, {@code "}, {@code \} or {@code 0}
		 */
		public char getQuote() {
			return quote;
		}

		/**
		 * @return the body lines, each terminated by a newline
		 */
		public String getBody() {
			return body;
		}

		/**
		 * @return the closing line as written, or {@code null} when the body
		 *         runs to the end of the script
		 */
		public String getTerminatorLine() {
			return terminatorLine;
		}

		/**
		 * @return 1-based line of the marker in the original script
		 */
		public int getMarkerLine() {
			return markerLine;
		}
	}

	/**
	 * Outcome of {@link HeredocPreprocessor#process(String)}.
	 */
	public static final class Result {
		private final String text;
		private final List<CapturedHeredoc> heredocs;
		private final int[] lineMap;

		Result(String text, List<CapturedHeredoc> heredocs, int[] lineMap) {
			this.text = text;
			this.heredocs = Collections.unmodifiableList(heredocs);
			this.lineMap = lineMap;
		}

		/**
		 * @return the script without the here-document bodies
		 */
		public String getText() {
			return text;
		}

		/**
		 * @return the captured bodies, in marker order
		 */
		public List<CapturedHeredoc> getHeredocs() {
			return heredocs;
		}

		/**
		 * Translate a line of {@link #getText()} into a line of the original
		 * script.
		 *
		 * @param line 1-based line in the preprocessed text
		 * @return 1-based line in the original script
		 */
		public int toOriginalLine(int line) {
			if (line < 1 || lineMap.length == 0) {
				return line;
			}
			if (line > lineMap.length) {
				return lineMap[lineMap.length - 1] + line - lineMap.length;
			}
			return lineMap[line - 1];
		}
	}

	/** A marker seen on the current line, waiting for its body. */
	private static final class Marker {
		private final String delimiter;
		private final boolean stripTabs;
		private final char quote;

		private Marker(String delimiter, boolean stripTabs, char quote) {
			this.delimiter = delimiter;
			this.stripTabs = stripTabs;
			this.quote = quote;
		}
	}

	/**
	 * Capture the here-document bodies of the specified script.
	 *
	 * @param source the script
	 * @return the text to parse and the captured bodies
	 */
	public Result process(String source) {
		String[] lines = source.split("\n", -1);
		boolean finalNewline = source.endsWith("\n");
		int lineCount = finalNewline ? lines.length - 1 : lines.length;

		List<String> kept = new ArrayList<String>();
		List<Integer> keptNumbers = new ArrayList<Integer>();
		List<CapturedHeredoc> heredocs = new ArrayList<CapturedHeredoc>();
		Deque<Character> contexts = new ArrayDeque<Character>();

		int i = 0;
		while (i < lineCount) {
			String line = lines[i];
			int markerLine = i + 1;
			kept.add(line);
			keptNumbers.add(markerLine);
			i++;
			for (Marker marker : scanLine(line, contexts)) {
				StringBuilder body = new StringBuilder();
				String terminator = null;
				while (i < lineCount) {
					String bodyLine = lines[i++];
					String candidate = marker.stripTabs ? stripLeadingTabs(bodyLine) : bodyLine;
					if (candidate.equals(marker.delimiter)) {
						terminator = bodyLine;
						break;
					}
					body.append(bodyLine).append('\n');
				}
				if (terminator == null) {
					LOG.debug("Here-document {} opened on line {} is not terminated", marker.delimiter, markerLine);
				}
				heredocs
						.add(
								new CapturedHeredoc(
										marker.delimiter,
										marker.stripTabs,
										marker.quote,
										body.toString(),
										terminator,
										markerLine));
			}
		}

		String text = String.join("\n", kept);
		if (finalNewline) {
			text += "\n";
		}
		int[] lineMap = new int[keptNumbers.size()];
		for (int k = 0; k < lineMap.length; k++) {
			lineMap[k] = keptNumbers.get(k);
		}
		return new Result(text, heredocs, lineMap);
	}

	/**
	 * Hand the captured bodies to the here-document nodes, in order.
	 *
	 * @param nodes the nodes, in the order the builder created them
	 * @param captured the bodies, in marker order
	 * @throws HeredocResolutionException when a node and its body disagree,
	 *         or when a body is left over
	 */
	public static void resolve(List<HereDoc> nodes, List<CapturedHeredoc> captured) {
		for (int i = 0; i < nodes.size(); i++) {
			HereDoc node = nodes.get(i);
			int line = node.getLocation() == null ? -1 : node.getLocation().getLine();
			if (i >= captured.size()) {
				LOG.warn("No body found for here-document {} on line {}", node.getDelimiter(), line);
				continue;
			}
			CapturedHeredoc body = captured.get(i);
			if (!body.getDelimiter().equals(node.getDelimiter()) || body.isStripTabs() != node.isStripTabs()) {
				throw new HeredocResolutionException(
						body.getMarkerLine(),
						"Here-document " + node.getDelimiter() + " does not match the body captured for "
								+ body.getDelimiter() + " on line " + body.getMarkerLine());
			}
			node.attachBody(body.getBody(), body.getTerminatorLine());
		}
		if (captured.size() > nodes.size()) {
			CapturedHeredoc extra = captured.get(nodes.size());
			throw new HeredocResolutionException(
					extra.getMarkerLine(),
					"Here-document " + extra.getDelimiter() + " on line " + extra.getMarkerLine()
							+ " was not recognized by the parser");
		}
	}

	/**
	 * Find the here-document markers of one line, left to right.
	 * <p>
	 * The quoting contexts still open at the end of the line are left on
	 * {@code contexts} for the next one. The top entry is {@code '},
	 * {@code "}, {@code `}, {@code $} for <code>$'..'</code>, or {@code (}
	 * for the code of a command substitution or of a subshell nested in one.
	 * An empty stack or a {@code (} on top means unquoted code, where markers
	 * are recognized.
	 *
	 * @param line the line to scan
	 * @param contexts quoting contexts carried from line to line
	 * @return the markers found
	 */
	private static List<Marker> scanLine(String line, Deque<Character> contexts) {
		List<Marker> markers = new ArrayList<Marker>();
		int arithDepth = 0;
		int i = 0;
		int n = line.length();
		while (i < n) {
			char c = line.charAt(i);
			if (arithDepth > 0) {
				if (c == '(') {
					arithDepth++;
				} else if (c == ')') {
					arithDepth--;
				}
				i++;
				continue;
			}
			char q = contexts.isEmpty() ? 0 : contexts.peek().charValue();
			if (q == '"') {
				if (c == '\\') {
					i += 2;
				} else if (c == '"') {
					contexts.pop();
					i++;
				} else if (c == '`') {
					contexts.push('`');
					i++;
				} else if (line.startsWith("$((", i)) {
					arithDepth = 2;
					i += 3;
				} else if (line.startsWith("$(", i)) {
					contexts.push('(');
					i += 2;
				} else {
					i++;
				}
				continue;
			}
			if (q == '\'' || q == '$' || q == '`') {
				if (c == '\\' && q != '\'') {
					i += 2;
					continue;
				}
				if (c == '\'' && q != '`' || c == '`' && q == '`') {
					contexts.pop();
				}
				i++;
				continue;
			}
			switch (c) {
			case '\\':
				i += 2;
				continue;
			case '\'':
			case '"':
			case '`':
				contexts.push(c);
				i++;
				continue;
			case '$':
				if (line.startsWith("$'", i)) {
					contexts.push('$');
					i += 2;
					continue;
				}
				if (line.startsWith("$((", i)) {
					arithDepth = 2;
					i += 3;
					continue;
				}
				if (line.startsWith("$(", i)) {
					contexts.push('(');
					i += 2;
					continue;
				}
				i++;
				continue;
			case '(':
				if (line.startsWith("((", i)) {
					arithDepth = 2;
					i += 2;
					continue;
				}
				if (q == '(') {
					contexts.push('(');
				}
				i++;
				continue;
			case ')':
				if (q == '(') {
					contexts.pop();
				}
				i++;
				continue;
			case '#':
				if (i == 0 || " \t;&|(".indexOf(line.charAt(i - 1)) >= 0) {
					return markers;
				}
				i++;
				continue;
			case '<':
				if (line.startsWith("<<<", i)) {
					i += 3;
					continue;
				}
				if (line.startsWith("<<", i) && (i == 0 || Character.isWhitespace(line.charAt(i - 1))
						|| Character.isDigit(line.charAt(i - 1)))) {
					int end = readMarker(line, i, markers);
					if (end > 0) {
						i = end;
						continue;
					}
				}
				i++;
				continue;
			default:
				i++;
			}
		}
		return markers;
	}

	/**
	 * @return offset past the marker, or -1 if there is no valid delimiter
	 */
	private static int readMarker(String line, int start, List<Marker> markers) {
		int i = start + 2;
		boolean stripTabs = false;
		if (i < line.length() && line.charAt(i) == '-') {
			stripTabs = true;
			i++;
		}
		while (i < line.length() && (line.charAt(i) == ' ' || line.charAt(i) == '\t')) {
			i++;
		}
		Matcher matcher = DELIMITER.matcher(line);
		matcher.region(i, line.length());
		if (!matcher.lookingAt()) {
			return -1;
		}
		String delimiter;
		char quote;
		if (matcher.group(1) != null) {
			delimiter = matcher.group(1);
			quote = '\'';
		} else if (matcher.group(2) != null) {
			delimiter = matcher.group(2);
			quote = '"';
		} else if (matcher.group(3) != null) {
			delimiter = matcher.group(3);
			quote = '\\';
		} else {
			delimiter = matcher.group(4);
			quote = 0;
		}
		markers.add(new Marker(delimiter, stripTabs, quote));
		return matcher.end();
	}

	private static String stripLeadingTabs(String line) {
		int i = 0;
		while (i < line.length() && line.charAt(i) == '\t') {
			i++;
		}
		return line.substring(i);
	}
}
