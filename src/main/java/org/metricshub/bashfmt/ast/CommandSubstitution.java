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
 * A command substitution, {@code $(list)} or {@code `text`}, or a process
 * substitution {@code <(list)} / {@code >(list)}.
 * <p>
 * Backtick substitutions keep their content as raw text: their quoting rules
 * differ from the rest of the script and they are reproduced as written.
 */
public final class CommandSubstitution extends Word {

	/** How the substitution is written. */
	public enum Style {
		/** {@code $( )} */
		DOLLAR("$("),
		/** {@code ` `} */
		BACKTICK("`"),
		/** {@code <( )} */
		PROCESS_INPUT("<("),
		/** {@code >( )} */
		PROCESS_OUTPUT(">(");

		private final String opening;

		Style(String opening) {
			this.opening = opening;
		}

		public String getOpening() {
			return opening;
		}
	}

	private final Style style;
	private final CompoundList body;
	private final String rawText;

	private CommandSubstitution(SourceLocation location, Style style, CompoundList body, String rawText) {
		super(location);
		this.style = style;
		this.body = body;
		this.rawText = rawText;
	}

	/**
	 * @param location position in the source
	 * @param style {@link Style#DOLLAR} or a process substitution style
	 * @param body the parsed commands
	 * @return the substitution
	 */
	public static CommandSubstitution parsed(SourceLocation location, Style style, CompoundList body) {
		if (style == Style.BACKTICK) {
			throw new IllegalArgumentException("Backtick substitutions are kept as raw text");
		}
		return new CommandSubstitution(location, style, body, null);
	}

	/**
	 * @param location position in the source
	 * @param rawText the text between the backticks
	 * @return the substitution
	 */
	public static CommandSubstitution backtick(SourceLocation location, String rawText) {
		return new CommandSubstitution(location, Style.BACKTICK, null, rawText);
	}

	public Style getStyle() {
		return style;
	}

	/**
	 * @return the parsed commands, {@code null} for backticks
	 */
	public CompoundList getBody() {
		return body;
	}

	/**
	 * @return the text between backticks, {@code null} for other styles
	 */
	public String getRawText() {
		return rawText;
	}

	@Override
	public Kind getKind() {
		return Kind.COMMAND_SUBSTITUTION;
	}

	@Override
	public List<? extends AstNode> getChildren() {
		return body == null ? Collections.<AstNode>emptyList() : Collections.singletonList(body);
	}

	@Override
	public String toString() {
		return style == Style.BACKTICK ? "CommandSubstitution[`" + rawText + "`]" : "CommandSubstitution[" + style + "]";
	}
}
