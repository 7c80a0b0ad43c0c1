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
 * Sequence of statements forming a body (of a group, a loop, a branch...).
 * Comments and blank lines are kept as statements.
 */
public final class CompoundList extends Statement {

	private final List<Statement> statements;

	public CompoundList(SourceLocation location, List<Statement> statements) {
		super(location);
		this.statements = Collections.unmodifiableList(statements);
	}

	public List<Statement> getStatements() {
		return statements;
	}

	public boolean isEmpty() {
		return statements.isEmpty();
	}

	@Override
	public Kind getKind() {
		return Kind.COMPOUND_LIST;
	}

	@Override
	public List<? extends AstNode> getChildren() {
		return statements;
	}
}
