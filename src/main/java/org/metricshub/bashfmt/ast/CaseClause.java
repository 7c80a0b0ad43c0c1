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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * One {@code pattern | pattern) body ;;} item of a {@link CaseStatement}.
 */
public final class CaseClause extends AstNode {

	/** Terminators allowed after a clause body. */
	public static final List<String> TERMINATORS = Collections.unmodifiableList(Arrays.asList(";;", ";&", ";;&"));

	private final List<Comment> leadingComments;
	private final List<Word> patterns;
	private final CompoundList body;
	private final String terminator;

	/**
	 * @param location position in the source
	 * @param leadingComments comment lines written before the patterns
	 * @param patterns the patterns, at least one
	 * @param body the clause body
	 * @param terminator one of {@link #TERMINATORS}
	 */
	public CaseClause(
			SourceLocation location,
			List<Comment> leadingComments,
			List<Word> patterns,
			CompoundList body,
			String terminator) {
		super(location);
		if (patterns.isEmpty()) {
			throw new IllegalArgumentException("A case clause needs at least one pattern");
		}
		if (!TERMINATORS.contains(terminator)) {
			throw new IllegalArgumentException("Not a case terminator: " + terminator);
		}
		this.leadingComments = Collections.unmodifiableList(leadingComments);
		this.patterns = Collections.unmodifiableList(patterns);
		this.body = body;
		this.terminator = terminator;
	}

	public List<Comment> getLeadingComments() {
		return leadingComments;
	}

	public List<Word> getPatterns() {
		return patterns;
	}

	public CompoundList getBody() {
		return body;
	}

	public String getTerminator() {
		return terminator;
	}

	@Override
	public List<? extends AstNode> getChildren() {
		List<AstNode> children = new ArrayList<AstNode>(leadingComments);
		children.addAll(patterns);
		children.add(body);
		return children;
	}

	@Override
	public String toString() {
		return "CaseClause[" + terminator + "]";
	}
}
