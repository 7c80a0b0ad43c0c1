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
import java.util.Collections;
import java.util.List;

/**
 * {@code case word in pattern) ...;; esac}
 */
public final class CaseStatement extends CompoundCommand {

	private final Word word;
	private final List<CaseClause> clauses;
	private final List<Comment> trailingComments;

	/**
	 * @param location position in the source
	 * @param word the word being matched
	 * @param clauses the clauses, in order
	 * @param trailingComments comment lines after the last clause
	 * @param redirects redirections after {@code esac}
	 */
	public CaseStatement(
			SourceLocation location,
			Word word,
			List<CaseClause> clauses,
			List<Comment> trailingComments,
			List<Redirect> redirects) {
		super(location, redirects);
		this.word = word;
		this.clauses = Collections.unmodifiableList(clauses);
		this.trailingComments = Collections.unmodifiableList(trailingComments);
	}

	public Word getWord() {
		return word;
	}

	public List<CaseClause> getClauses() {
		return clauses;
	}

	public List<Comment> getTrailingComments() {
		return trailingComments;
	}

	@Override
	public Kind getKind() {
		return Kind.CASE;
	}

	@Override
	public List<? extends AstNode> getChildren() {
		List<AstNode> children = new ArrayList<AstNode>();
		children.add(word);
		children.addAll(clauses);
		children.addAll(trailingComments);
		children.addAll(getRedirects());
		return children;
	}
}
