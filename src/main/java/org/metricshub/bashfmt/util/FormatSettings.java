package org.metricshub.bashfmt.util;

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

import org.metricshub.bashfmt.ast.FunctionStyle;
import org.metricshub.bashfmt.backend.VariableStyle;

/**
 * A simple container for the parameters of a formatting run.
 * These values have defaults.
 * These defaults may be changed through configuration files, command line
 * arguments, or when invoking BashFmt programmatically, from within Java code.
 */
public class FormatSettings {

	/** Default width of one indentation level. */
	public static final int DEFAULT_INDENT_SIZE = 4;

	/** Default suffix of backup files. */
	public static final String DEFAULT_BACKUP_SUFFIX = ".bak";

	/**
	 * Number of spaces per indentation level;
	 * <code>4</code> by default.
	 */
	private int indentSize = DEFAULT_INDENT_SIZE;

	/**
	 * Whether to indent with one tab per level instead of spaces;
	 * <code>false</code> by default.
	 */
	private boolean tab = false;

	/**
	 * Style forced on every function header.
	 * <code>null</code> keeps the style of each function.
	 */
	private FunctionStyle functionStyle = null;

	/**
	 * Style of parameter expansions;
	 * {@link VariableStyle#NONE} by default.
	 */
	private VariableStyle variableStyle = VariableStyle.NONE;

	/**
	 * Whether to save the original of a rewritten file;
	 * <code>false</code> by default.
	 */
	private boolean backup = false;

	/**
	 * Suffix appended to the name of backup files.
	 */
	private String backupSuffix = DEFAULT_BACKUP_SUFFIX;

	/**
	 * Whether to only report the files that would change;
	 * <code>false</code> by default.
	 */
	private boolean check = false;

	public int getIndentSize() {
		return indentSize;
	}

	/**
	 * @param indentSize number of spaces per level, at least 1
	 */
	public void setIndentSize(int indentSize) {
		if (indentSize < 1) {
			throw new IllegalArgumentException("Indent size must be at least 1: " + indentSize);
		}
		this.indentSize = indentSize;
	}

	public boolean isTab() {
		return tab;
	}

	public void setTab(boolean tab) {
		this.tab = tab;
	}

	public FunctionStyle getFunctionStyle() {
		return functionStyle;
	}

	public void setFunctionStyle(FunctionStyle functionStyle) {
		this.functionStyle = functionStyle;
	}

	public VariableStyle getVariableStyle() {
		return variableStyle;
	}

	public void setVariableStyle(VariableStyle variableStyle) {
		this.variableStyle = variableStyle == null ? VariableStyle.NONE : variableStyle;
	}

	public boolean isBackup() {
		return backup;
	}

	public void setBackup(boolean backup) {
		this.backup = backup;
	}

	public String getBackupSuffix() {
		return backupSuffix;
	}

	public void setBackupSuffix(String backupSuffix) {
		this.backupSuffix = backupSuffix;
	}

	public boolean isCheck() {
		return check;
	}

	public void setCheck(boolean check) {
		this.check = check;
	}

	/**
	 * @return the text of one indentation level: a tab, or
	 *         {@link #getIndentSize()} spaces
	 */
	public String getIndentUnit() {
		if (tab) {
			return "\t";
		}
		StringBuilder unit = new StringBuilder();
		for (int i = 0; i < indentSize; i++) {
			unit.append(' ');
		}
		return unit.toString();
	}

	/**
	 * <p>
	 * toDescriptionString.
	 * </p>
	 *
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("indentSize = ").append(getIndentSize()).append(newLine);
		desc.append("tab = ").append(isTab()).append(newLine);
		desc
				.append("functionStyle = ")
				.append(functionStyle == null ? "preserve" : functionStyle.getName())
				.append(newLine);
		desc.append("variableStyle = ").append(variableStyle.getName()).append(newLine);
		desc.append("backup = ").append(isBackup()).append(newLine);
		desc.append("backupSuffix = ").append(getBackupSuffix()).append(newLine);
		desc.append("check = ").append(isCheck()).append(newLine);

		return desc.toString();
	}
}
