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

import java.util.Collections;
import java.util.List;

/**
 * Here-document introduced by {@code <<DELIM} or {@code <<-DELIM}.
 * <p>
 * The body is not part of the grammar: it is captured before parsing and
 * attached with {@link #attachBody(String, String)} once the tree is built.
 * This is the only mutation a node ever undergoes.
 */
public final class HereDoc extends AstNode {

	private final String delimiter;
	private final boolean stripTabs;
	private final char quote;
	private String body;
	private String terminatorLine;
	private boolean attached;

	/**
	 * @param location position in the source
	 * @param delimiter the delimiter, without quotes or backslash
	 * @param stripTabs whether the operator was {@code <<-}
	 * @param quote {@code '}, {@code "} or {@code \} when the delimiter was
	 *        quoted or escaped, {@code 0} otherwise
	 */
	public HereDoc(SourceLocation location, String delimiter, boolean stripTabs, char quote) {
		super(location);
		this.delimiter = delimiter;
		this.stripTabs = stripTabs;
		this.quote = quote;
		this.body = "";
	}

	public String getDelimiter() {
		return delimiter;
	}

	public boolean isStripTabs() {
		return stripTabs;
	}

	/**
	 * @return the quoting character of the delimiter, or {@code 0}
	 */
	public char getQuote() {
		return quote;
	}

	/**
	 * @return {@code true} when the delimiter is quoted or escaped, i.e. when
	 *         the body is not subject to expansions
	 */
	public boolean isQuoted() {
		return quote != 0;
	}

	/**
	 * @return the body lines, each terminated by a newline
	 */
	public String getBody() {
		return body;
	}

	/**
	 * @return the line that closed the body as written in the source, or
	 *         {@code null} if the body ran to the end of the script
	 */
	public String getTerminatorLine() {
		return terminatorLine;
	}

	/**
	 * @return whether a body was attached to this here-document
	 */
	public boolean isAttached() {
		return attached;
	}

	/**
	 * Attach the captured body to this here-document. May be called only once.
	 *
	 * @param bodyText the body lines, each terminated by a newline
	 * @param terminator the closing line, or {@code null} if there was none
	 */
	public void attachBody(String bodyText, String terminator) {
		if (attached) {
			throw new IllegalStateException("Body of here-document " + delimiter + " is already attached");
		}
		this.body = bodyText;
		this.terminatorLine = terminator;
		this.attached = true;
	}

	@Override
	public List<? extends AstNode> getChildren() {
		return Collections.emptyList();
	}

	@Override
	public String toString() {
		return "HereDoc[" + (stripTabs ? "<<-" : "<<") + delimiter + (isQuoted() ? ", quoted]" : "]");
	}
}
