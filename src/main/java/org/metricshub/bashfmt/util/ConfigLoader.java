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

import com.fasterxml.jackson.databind.JsonNode;
import com.fasterxml.jackson.dataformat.toml.TomlMapper;
import java.io.IOException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import org.metricshub.bashfmt.ast.FunctionStyle;
import org.editorconfig.core.EditorConfig;
import org.editorconfig.core.EditorConfigException;
import org.metricshub.bashfmt.backend.VariableStyle;
import org.slf4j.Logger;

/**
 * Reads the formatting settings from TOML configuration files.
 * <p>
 * The files are applied from the lowest to the highest precedence, each one
 * overriding the keys set by the previous ones:
 * <ol>
 * <li>the {@code indent_style} and {@code indent_size} properties that
 * {@code .editorconfig} files give to the formatted script</li>
 * <li>{@code pyproject.toml}, section {@code [tool.bashfmt]}, in the working
 * directory</li>
 * <li>{@code .bashfmtrc} in the working directory</li>
 * <li>the file given with {@code --config}</li>
 * </ol>
 * In the last two, keys are looked up in {@code [tool.bashfmt]}, then in
 * {@code [bashfmt]}, then at the root of the document.
 * <p>
 * A file that cannot be read or parsed is skipped with a warning. A key
 * with an invalid value is an error.
 */
public final class ConfigLoader {

	private static final Logger LOG = BashFmtLogger.getLogger(ConfigLoader.class);

	/** Project file read for a {@code [tool.bashfmt]} section. */
	public static final String PYPROJECT = "pyproject.toml";

	/** Dedicated configuration file. */
	public static final String RC_FILE = ".bashfmtrc";

	private static final TomlMapper MAPPER = new TomlMapper();

	private static final EditorConfig EDITOR_CONFIG = new EditorConfig();

	/**
	 * Private constructor to prevent instantiation.
	 */
	private ConfigLoader() {
		// utility class
	}

	/**
	 * Build the settings from the configuration files, without looking at
	 * {@code .editorconfig}.
	 *
	 * @param workingDirectory where to look for {@code pyproject.toml} and
	 *        {@code .bashfmtrc}
	 * @param explicitConfig file given on the command line, or {@code null}
	 * @return the settings, with defaults for the keys no file sets
	 * @throws IllegalArgumentException if a key has an invalid value
	 */
	public static FormatSettings load(Path workingDirectory, Path explicitConfig) {
		return load(workingDirectory, explicitConfig, null);
	}

	/**
	 * Build the settings that apply to one script.
	 *
	 * @param workingDirectory where to look for {@code pyproject.toml} and
	 *        {@code .bashfmtrc}
	 * @param explicitConfig file given on the command line, or {@code null}
	 * @param script the script to format, whose {@code .editorconfig}
	 *        properties are applied first, or {@code null}
	 * @return the settings, with defaults for the keys no file sets
	 * @throws IllegalArgumentException if a key has an invalid value
	 */
	public static FormatSettings load(Path workingDirectory, Path explicitConfig, Path script) {
		FormatSettings settings = new FormatSettings();

		if (script != null) {
			applyEditorConfig(script, settings);
		}

		JsonNode pyproject = read(workingDirectory.resolve(PYPROJECT));
		if (pyproject != null) {
			apply(pyproject.path("tool").path("bashfmt"), settings, workingDirectory.resolve(PYPROJECT));
		}

		List<Path> files = new ArrayList<Path>();
		files.add(workingDirectory.resolve(RC_FILE));
		if (explicitConfig != null) {
			if (!Files.isRegularFile(explicitConfig)) {
				throw new IllegalArgumentException("Configuration file not found: " + explicitConfig);
			}
			files.add(explicitConfig);
		}
		for (Path file : files) {
			JsonNode root = read(file);
			if (root != null) {
				apply(section(root), settings, file);
			}
		}
		return settings;
	}

	/**
	 * Apply the indentation properties {@code .editorconfig} files give to
	 * the script. Unusable values are skipped with a warning.
	 */
	static void applyEditorConfig(Path script, FormatSettings settings) {
		List<EditorConfig.OutPair> properties;
		try {
			properties = EDITOR_CONFIG.getProperties(script.toAbsolutePath().toString());
		} catch (EditorConfigException e) {
			LOG.debug("Ignoring .editorconfig for {}: {}", script, e.getMessage());
			return;
		}
		for (EditorConfig.OutPair property : properties) {
			String value = property.getVal();
			if ("indent_style".equals(property.getKey())) {
				if ("tab".equalsIgnoreCase(value)) {
					settings.setTab(true);
				} else if ("space".equalsIgnoreCase(value)) {
					settings.setTab(false);
				}
			} else if ("indent_size".equals(property.getKey()) && !"tab".equalsIgnoreCase(value)) {
				try {
					settings.setIndentSize(Integer.parseInt(value.trim()));
				} catch (IllegalArgumentException e) {
					LOG.warn("Ignoring indent_size = {} from .editorconfig for {}", value, script);
				}
			}
		}
		LOG.debug("Read {} .editorconfig properties for {}", properties.size(), script);
	}

	/**
	 * @return the parsed document, or {@code null} if the file is missing or
	 *         unreadable
	 */
	private static JsonNode read(Path file) {
		if (!Files.isRegularFile(file)) {
			return null;
		}
		try {
			LOG.debug("Reading configuration from {}", file);
			return MAPPER.readTree(file.toFile());
		} catch (IOException e) {
			LOG.warn("Ignoring configuration file {}: {}", file, e.getMessage());
			return null;
		}
	}

	private static JsonNode section(JsonNode root) {
		JsonNode tool = root.path("tool").path("bashfmt");
		if (tool.isObject()) {
			return tool;
		}
		JsonNode own = root.path("bashfmt");
		if (own.isObject()) {
			return own;
		}
		return root;
	}

	/**
	 * Copy the recognized keys of a TOML table into the settings.
	 */
	static void apply(JsonNode table, FormatSettings settings, Path origin) {
		if (!table.isObject()) {
			return;
		}
		JsonNode value = table.get("indent_size");
		if (value != null) {
			if (!value.canConvertToInt()) {
				throw new IllegalArgumentException("indent_size must be an integer in " + origin + ": " + value);
			}
			settings.setIndentSize(value.asInt());
		}
		value = table.get("tab");
		if (value != null) {
			settings.setTab(bool(value, "tab", origin));
		}
		value = table.get("backup");
		if (value != null) {
			settings.setBackup(bool(value, "backup", origin));
		}
		value = table.get("check");
		if (value != null) {
			settings.setCheck(bool(value, "check", origin));
		}
		value = table.get("force_function_style");
		if (value != null) {
			settings.setFunctionStyle(FunctionStyle.fromName(value.asText()));
		}
		value = table.get("variable_style");
		if (value != null) {
			settings.setVariableStyle(VariableStyle.fromName(value.asText()));
		}
	}

	private static boolean bool(JsonNode value, String key, Path origin) {
		if (!value.isBoolean()) {
			throw new IllegalArgumentException(key + " must be true or false in " + origin + ": " + value);
		}
		return value.booleanValue();
	}
}
