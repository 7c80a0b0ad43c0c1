package org.metricshub.bashfmt;

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

import java.io.IOException;
import java.io.UncheckedIOException;
import java.util.List;
import org.metricshub.bashfmt.ast.HereDoc;
import org.metricshub.bashfmt.ast.Script;
import org.metricshub.bashfmt.backend.FormatterVisitor;
import org.metricshub.bashfmt.frontend.AstBuilder;
import org.metricshub.bashfmt.frontend.BashParser;
import org.metricshub.bashfmt.frontend.FormatterDirectives;
import org.metricshub.bashfmt.frontend.HeredocPreprocessor;
import org.metricshub.bashfmt.frontend.peg.ParseNode;
import org.metricshub.bashfmt.util.BashFmtLogger;
import org.metricshub.bashfmt.util.FormatSettings;
import org.metricshub.bashfmt.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Entry point for formatting Bash scripts from Java code.
 * <p>
 * The processing goes as follows:
 * <ol>
 * <li>the {@code @formatter:off} regions are replaced with placeholders</li>
 * <li>the here-document bodies are taken out of the text</li>
 * <li>the text is parsed and turned into a typed tree</li>
 * <li>the bodies are attached to their here-document nodes</li>
 * <li>the tree is rendered and the regions are put back</li>
 * </ol>
 * If anything goes wrong before the rendering, the script is returned as is,
 * flagged as an error: the formatter never alters a script it does not fully
 * understand.
 * <p>
 * A {@code BashFmt} instance holds no state of its own besides its settings
 * and may be shared between threads, as long as the settings are not
 * modified.
 */
public class BashFmt {

	private static final Logger LOG = BashFmtLogger.getLogger(BashFmt.class);

	private final FormatSettings settings;
	private final HeredocPreprocessor preprocessor = new HeredocPreprocessor();
	private final BashParser parser = new BashParser();

	/**
	 * Create a formatter with the default settings.
	 */
	public BashFmt() {
		this(new FormatSettings());
	}

	/**
	 * @param settings the settings to format with
	 */
	public BashFmt(FormatSettings settings) {
		this.settings = settings;
	}

	/**
	 * Format a script.
	 *
	 * @param source the script
	 * @param path name of the script, for diagnostics
	 * @return the formatted script, or the original one flagged as an error
	 */
	public FormatResult format(String source, String path) {
		boolean crlf = hasCrlfLineEndings(source);
		String text = crlf ? source.replace("\r\n", "\n") : source;
		String formatted;
		try {
			formatted = render(text, path);
		} catch (BashFmtException | IllegalArgumentException | IllegalStateException e) {
			LOG.warn("Leaving {} unformatted: {}", path, e.getMessage());
			return FormatResult.failure(source);
		}
		formatted = matchTrailingNewline(text, formatted);
		return FormatResult.success(crlf ? formatted.replace("\n", "\r\n") : formatted);
	}

	/**
	 * Read and format a script.
	 *
	 * @param source the script to read
	 * @return the formatted script, or the original one flagged as an error
	 * @throws UncheckedIOException if the script cannot be read
	 */
	public FormatResult format(ScriptSource source) {
		String text;
		try {
			text = source.readAll();
		} catch (IOException e) {
			throw new UncheckedIOException("Failed to read " + source.getDescription(), e);
		}
		return format(text, source.getDescription());
	}

	/**
	 * Parse a script into its typed tree, here-document bodies included.
	 * {@code @formatter:off} regions appear as placeholder comments.
	 *
	 * @param source the script
	 * @param path name of the script, for diagnostics
	 * @return the tree
	 * @throws org.metricshub.bashfmt.frontend.ParserException if the script
	 *         does not parse
	 */
	public Script parse(String source, String path) {
		String text = hasCrlfLineEndings(source) ? source.replace("\r\n", "\n") : source;
		return parseText(FormatterDirectives.extract(text).getText(), path);
	}

	public FormatSettings getSettings() {
		return settings;
	}

	private Script parseText(String text, String path) {
		HeredocPreprocessor.Result preprocessed = preprocessor.process(text);
		ParseNode root = parser.parse(preprocessed, path);
		AstBuilder builder = new AstBuilder(preprocessed.getText());
		Script script = builder.build(root);
		List<HereDoc> hereDocs = builder.getHereDocs();
		HeredocPreprocessor.resolve(hereDocs, preprocessed.getHeredocs());
		return script;
	}

	private String render(String source, String path) {
		FormatterDirectives.Regions regions = FormatterDirectives.extract(source);
		Script script = parseText(regions.getText(), path);
		FormatterVisitor visitor = new FormatterVisitor(
				settings.getIndentUnit(),
				settings.getFunctionStyle(),
				settings.getVariableStyle());
		return regions.restore(visitor.format(script));
	}

	/**
	 * Whether every line of the script ends with CR LF. Such scripts are
	 * formatted with LF line endings, which are turned back into CR LF
	 * afterwards. Scripts mixing both are taken as they are.
	 */
	static boolean hasCrlfLineEndings(String source) {
		int crlf = source.indexOf("\r\n");
		if (crlf < 0) {
			return false;
		}
		int lf = source.indexOf('\n');
		while (lf >= 0) {
			if (lf == 0 || source.charAt(lf - 1) != '\r') {
				return false;
			}
			lf = source.indexOf('\n', lf + 1);
		}
		return true;
	}

	/**
	 * The output ends with a newline exactly when the input does.
	 */
	static String matchTrailingNewline(String source, String formatted) {
		boolean wanted = source.endsWith("\n");
		boolean present = formatted.endsWith("\n");
		if (wanted && !present) {
			return formatted + "\n";
		}
		if (!wanted && present) {
			return formatted.substring(0, formatted.length() - 1);
		}
		return formatted;
	}
}
