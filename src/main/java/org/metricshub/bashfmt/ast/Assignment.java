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
 * {@code name=value}, {@code name+=value} or {@code name=(elements)}.
 * The value is {@code null} for an empty assignment such as {@code name=}.
 */
public final class Assignment extends AstNode implements CommandArgument {

	private final String name;
	private final boolean append;
	private final Word value;
	private final ArrayValue arrayValue;

	public Assignment(SourceLocation location, String name, boolean append, Word value, ArrayValue arrayValue) {
		super(location);
		if (value != null && arrayValue != null) {
			throw new IllegalArgumentException("An assignment has either a word or an array value");
		}
		this.name = name;
		this.append = append;
		this.value = value;
		this.arrayValue = arrayValue;
	}

	/**
	 * @return the variable name, subscript included
	 */
	public String getName() {
		return name;
	}

	public boolean isAppend() {
		return append;
	}

	public Word getValue() {
		return value;
	}

	public ArrayValue getArrayValue() {
		return arrayValue;
	}

	@Override
	public List<? extends AstNode> getChildren() {
		if (value != null) {
			return Collections.singletonList(value);
		} else if (arrayValue != null) {
			return Collections.singletonList(arrayValue);
		}
		return Collections.emptyList();
	}

	@Override
	public String toString() {
		return "Assignment[" + name + (append ? "+=" : "=") + "]";
	}
}
