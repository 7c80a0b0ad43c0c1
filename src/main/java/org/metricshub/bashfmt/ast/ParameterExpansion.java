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
 * {@code $NAME}, <code>${NAME}</code> or <code>${NAME op argument}</code>.
 * <p>
 * For braced expansions, {@code prefix} holds a leading {@code #} (length) or
 * {@code !} (indirection), and {@code operator} the operator isolated after
 * the name, such as {@code :-}, {@code ##} or {@code /}. When the inside of
 * the braces cannot be split, the whole text is kept as the name and both
 * are {@code null}.
 */
public final class ParameterExpansion extends Word {

	private final String name;
	private final boolean braced;
	private final String prefix;
	private final String operator;
	private final String argument;

	public ParameterExpansion(
			SourceLocation location,
			String name,
			boolean braced,
			String prefix,
			String operator,
			String argument) {
		super(location);
		this.name = name;
		this.braced = braced;
		this.prefix = prefix;
		this.operator = operator;
		this.argument = argument;
	}

	/**
	 * Shorthand for an unbraced <code>$NAME</code>.
	 *
	 * @param location position in the source
	 * @param name name of the parameter
	 * @return the expansion
	 */
	public static ParameterExpansion simple(SourceLocation location, String name) {
		return new ParameterExpansion(location, name, false, null, null, null);
	}

	public String getName() {
		return name;
	}

	public boolean isBraced() {
		return braced;
	}

	public String getPrefix() {
		return prefix;
	}

	public String getOperator() {
		return operator;
	}

	public String getArgument() {
		return argument;
	}

	/**
	 * @return {@code true} for the special parameters ({@code $?}, {@code $@},
	 *         ...) and the positional ones ({@code $0}, {@code $1}, ...)
	 */
	public boolean isSpecial() {
		if (name.isEmpty()) {
			return false;
		}
		return name.length() == 1 && "?@*#$!-".indexOf(name.charAt(0)) >= 0 || name.chars().allMatch(Character::isDigit);
	}

	@Override
	public Kind getKind() {
		return Kind.PARAMETER;
	}

	@Override
	public List<? extends AstNode> getChildren() {
		return Collections.emptyList();
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder("ParameterExpansion[");
		if (prefix != null) {
			sb.append(prefix);
		}
		sb.append(name);
		if (operator != null) {
			sb.append(' ').append(operator).append(' ').append(argument);
		}
		return sb.append(braced ? ", braced]" : "]").toString();
	}
}
