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
 * A command name with its arguments, optionally preceded by variable
 * assignments and accompanied by redirections.
 * <p>
 * The name is {@code null} for assignment-only and redirection-only commands
 * such as {@code FOO=bar} or {@code > file}.
 */
public final class SimpleCommand extends Statement {

	private final List<Assignment> assignments;
	private final Word name;
	private final List<CommandArgument> arguments;
	private final List<Redirect> redirects;

	public SimpleCommand(
			SourceLocation location,
			List<Assignment> assignments,
			Word name,
			List<CommandArgument> arguments,
			List<Redirect> redirects) {
		super(location);
		this.assignments = Collections.unmodifiableList(assignments);
		this.name = name;
		this.arguments = Collections.unmodifiableList(arguments);
		this.redirects = Collections.unmodifiableList(redirects);
	}

	public List<Assignment> getAssignments() {
		return assignments;
	}

	public Word getName() {
		return name;
	}

	public List<CommandArgument> getArguments() {
		return arguments;
	}

	public List<Redirect> getRedirects() {
		return redirects;
	}

	@Override
	public Kind getKind() {
		return Kind.SIMPLE_COMMAND;
	}

	@Override
	public List<? extends AstNode> getChildren() {
		List<AstNode> children = new ArrayList<AstNode>(assignments);
		if (name != null) {
			children.add(name);
		}
		for (CommandArgument argument : arguments) {
			children.add((AstNode) argument);
		}
		children.addAll(redirects);
		return children;
	}
}
