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
 * Commands connected with {@code |} or {@code |&}, optionally negated with
 * {@code !}.
 */
public final class Pipeline extends Statement {

	private final boolean negated;
	private final List<Statement> commands;
	private final List<String> operators;

	/**
	 * @param location position in the source
	 * @param negated whether the pipeline starts with {@code !}
	 * @param commands the commands, left to right
	 * @param operators the operator between each pair of commands, one less
	 *        than the number of commands
	 */
	public Pipeline(SourceLocation location, boolean negated, List<Statement> commands, List<String> operators) {
		super(location);
		if (operators.size() != commands.size() - 1) {
			throw new IllegalArgumentException("A pipeline needs one operator between each pair of commands");
		}
		this.negated = negated;
		this.commands = Collections.unmodifiableList(commands);
		this.operators = Collections.unmodifiableList(operators);
	}

	public boolean isNegated() {
		return negated;
	}

	public List<Statement> getCommands() {
		return commands;
	}

	public List<String> getOperators() {
		return operators;
	}

	@Override
	public Kind getKind() {
		return Kind.PIPELINE;
	}

	@Override
	public List<? extends AstNode> getChildren() {
		return commands;
	}

	@Override
	public String toString() {
		return negated ? "Pipeline[!]" : "Pipeline";
	}
}
