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
 * {@code if ...; then ...; elif ...; then ...; else ...; fi}
 */
public final class IfStatement extends CompoundCommand {

	private final CompoundList condition;
	private final CompoundList thenBody;
	private final List<ElifClause> elifClauses;
	private final CompoundList elseBody;

	/**
	 * @param location position in the source
	 * @param condition the list after {@code if}
	 * @param thenBody the list after {@code then}
	 * @param elifClauses the {@code elif} branches, in order
	 * @param elseBody the list after {@code else}, or {@code null}
	 * @param redirects redirections after {@code fi}
	 */
	public IfStatement(
			SourceLocation location,
			CompoundList condition,
			CompoundList thenBody,
			List<ElifClause> elifClauses,
			CompoundList elseBody,
			List<Redirect> redirects) {
		super(location, redirects);
		this.condition = condition;
		this.thenBody = thenBody;
		this.elifClauses = Collections.unmodifiableList(elifClauses);
		this.elseBody = elseBody;
	}

	public CompoundList getCondition() {
		return condition;
	}

	public CompoundList getThenBody() {
		return thenBody;
	}

	public List<ElifClause> getElifClauses() {
		return elifClauses;
	}

	public CompoundList getElseBody() {
		return elseBody;
	}

	@Override
	public Kind getKind() {
		return Kind.IF;
	}

	@Override
	public List<? extends AstNode> getChildren() {
		List<AstNode> children = new ArrayList<AstNode>();
		children.add(condition);
		children.add(thenBody);
		children.addAll(elifClauses);
		if (elseBody != null) {
			children.add(elseBody);
		}
		children.addAll(getRedirects());
		return children;
	}
}
