package org.metricshub.bashfmt.backend;

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
import java.util.List;

/**
 * Text sink of the {@link FormatterVisitor}.
 * <p>
 * Besides indentation, it keeps the here-document bodies queued by the
 * current line: they are written right after the next line break, which is
 * where Bash reads them.
 */
final class OutputBuilder {

	private final StringBuilder text = new StringBuilder();
	private final String indentUnit;
	private final List<String> pendingBodies = new ArrayList<String>();
	private boolean started;

	/**
	 * @param indentUnit text of one level of indentation
	 */
	OutputBuilder(String indentUnit) {
		this.indentUnit = indentUnit;
	}

	/**
	 * Start a new line at the given depth. The first line of the output does
	 * not need a line break.
	 */
	void startLine(int depth) {
		if (started) {
			newline();
		}
		started = true;
		for (int i = 0; i < depth; i++) {
			text.append(indentUnit);
		}
	}

	/**
	 * @return whether something was written on the current line or before
	 */
	boolean isStarted() {
		return started;
	}

	OutputBuilder append(String s) {
		started = true;
		text.append(s);
		return this;
	}

	/**
	 * Queue a here-document, written after the next line break.
	 *
	 * @param body the body lines, each ending with a newline
	 * @param terminatorLine the closing line, or {@code null} if the body ran
	 *        to the end of the script
	 */
	void queueHeredoc(String body, String terminatorLine) {
		pendingBodies.add(terminatorLine == null ? body : body + terminatorLine + "\n");
	}

	int getPendingCount() {
		return pendingBodies.size();
	}

	/**
	 * @return the whole output, with any here-document still queued
	 */
	String finish() {
		if (!pendingBodies.isEmpty()) {
			newline();
		}
		return text.toString();
	}

	private void newline() {
		text.append('\n');
		for (String body : pendingBodies) {
			text.append(body);
		}
		pendingBodies.clear();
	}
}
