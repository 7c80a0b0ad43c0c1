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

import org.metricshub.bashfmt.frontend.peg.ParseContext;
import org.metricshub.bashfmt.frontend.peg.ParseNode;
import org.metricshub.bashfmt.util.BashFmtLogger;
import org.slf4j.Logger;

/**
 * Matches a preprocessed script against the {@link BashGrammar}.
 * <p>
 * The grammar is shared by all the parses; every call to
 * {@link #parse(HeredocPreprocessor.Result, String)} uses its own
 * {@link ParseContext}, so a parser may be used by several threads.
 */
public final class BashParser {

	private static final Logger LOG = BashFmtLogger.getLogger(BashParser.class);

	private static final BashGrammar GRAMMAR = new BashGrammar();

	/**
	 * Parse the specified script.
	 *
	 * @param preprocessed the script, without its here-document bodies
	 * @param description name of the script, used in error messages
	 * @return the root {@code script} node
	 * @throws ParserException if the script does not match the grammar
	 */
	public ParseNode parse(HeredocPreprocessor.Result preprocessed, String description) {
		String text = preprocessed.getText();
		ParseContext ctx = new ParseContext(text);
		ParseNode root = GRAMMAR.parse(ctx);
		if (root != null) {
			return root;
		}

		int offset = Math.max(0, ctx.getFarthestFailure());
		int line = 1;
		int lineStart = 0;
		for (int i = 0; i < offset && i < text.length(); i++) {
			if (text.charAt(i) == '\n') {
				line++;
				lineStart = i + 1;
			}
		}
		int column = offset - lineStart + 1;
		String found = offset >= text.length() ? "end of input" : describe(text.charAt(offset));
		String message = "Unexpected " + found + ", expecting " + String.join(" or ", ctx.getExpected());
		LOG.debug("Parse of {} failed at offset {}: {}", description, offset, message);
		throw new ParserException(message, description, preprocessed.toOriginalLine(line), column);
	}

	private static String describe(char c) {
		switch (c) {
		case '\n':
			return "newline";
		case '\t':
			return "tab";
		case ' ':
			return "space";
		default:
			return "'" + c + "'";
		}
	}
}
