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
 * A redirection: optional file descriptor, operator, and exactly one of a
 * target word, a here-document or a here-string.
 */
public final class Redirect extends AstNode {

	private final String fd;
	private final String operator;
	private final Word target;
	private final HereDoc heredoc;
	private final HereString hereString;

	private Redirect(
			SourceLocation location,
			String fd,
			String operator,
			Word target,
			HereDoc heredoc,
			HereString hereString) {
		super(location);
		this.fd = fd;
		this.operator = operator;
		this.target = target;
		this.heredoc = heredoc;
		this.hereString = hereString;
	}

	/**
	 * @param location position in the source
	 * @param fd file descriptor number, or {@code null}
	 * @param operator {@code >}, {@code >>}, {@code <&}...
	 * @param target the file or descriptor redirected to
	 * @return the redirection
	 */
	public static Redirect toTarget(SourceLocation location, String fd, String operator, Word target) {
		return new Redirect(location, fd, operator, target, null, null);
	}

	public static Redirect toHereDoc(SourceLocation location, String fd, HereDoc heredoc) {
		return new Redirect(location, fd, heredoc.isStripTabs() ? "<<-" : "<<", null, heredoc, null);
	}

	public static Redirect toHereString(SourceLocation location, String fd, HereString hereString) {
		return new Redirect(location, fd, "<<<", null, null, hereString);
	}

	public String getFd() {
		return fd;
	}

	public String getOperator() {
		return operator;
	}

	public Word getTarget() {
		return target;
	}

	public HereDoc getHeredoc() {
		return heredoc;
	}

	public HereString getHereString() {
		return hereString;
	}

	@Override
	public List<? extends AstNode> getChildren() {
		if (target != null) {
			return Collections.singletonList(target);
		} else if (heredoc != null) {
			return Collections.singletonList(heredoc);
		}
		return Collections.singletonList(hereString);
	}

	@Override
	public String toString() {
		return "Redirect[" + (fd == null ? "" : fd) + operator + "]";
	}
}
