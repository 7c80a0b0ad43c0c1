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

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.nio.file.StandardCopyOption;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import org.metricshub.bashfmt.ast.FunctionStyle;
import org.metricshub.bashfmt.ast.Script;
import org.metricshub.bashfmt.backend.VariableStyle;
import org.metricshub.bashfmt.util.BashFmtLogger;
import org.metricshub.bashfmt.util.ConfigLoader;
import org.metricshub.bashfmt.util.FormatSettings;
import org.metricshub.bashfmt.util.ScriptFileSource;
import org.metricshub.bashfmt.util.ScriptSource;
import org.slf4j.Logger;

/**
 * Command-line interface for BashFmt.
 * <p>
 * Files given on the command line are rewritten in place, unless
 * {@code --check} is set. The file name {@code -} stands for the standard
 * input, formatted to the standard output.
 */
public final class Cli {

	private static final Logger LOG = BashFmtLogger.getLogger(Cli.class);

	private static final String JAR_NAME;

	/** Version reported by {@code --version}. */
	public static final String VERSION;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "bashfmt.jar";
		}
		JAR_NAME = myName;
		String version = Cli.class.getPackage().getImplementationVersion();
		VERSION = version == null ? "development" : version;
	}

	private final InputStream in;
	private final PrintStream out;
	private final PrintStream err;
	private final Path workingDirectory;

	private final List<String> files = new ArrayList<String>();

	// options given on the command line, null when not given
	private Integer indentSize;
	private Boolean tab;
	private FunctionStyle functionStyle;
	private VariableStyle variableStyle;
	private Boolean backup;
	private Boolean check;
	private Path configFile;

	private boolean dumpSyntaxTree;
	private boolean printUsage;
	private boolean printVersion;

	private FormatSettings settings;

	/**
	 * Creates a CLI instance wired to the standard streams.
	 */
	public Cli() {
		this(System.in, System.out, System.err);
	}

	/**
	 * Creates a CLI instance using the supplied streams, and the current
	 * directory to look for configuration files.
	 *
	 * @param in stream formatted when the file name is {@code -}
	 * @param out stream where formatted scripts and reports are written
	 * @param err stream where error messages are written
	 */
	public Cli(InputStream in, PrintStream out, PrintStream err) {
		this(in, out, err, Paths.get(""));
	}

	/**
	 * @param in stream formatted when the file name is {@code -}
	 * @param out stream where formatted scripts and reports are written
	 * @param err stream where error messages are written
	 * @param workingDirectory where to look for configuration files
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(InputStream in, PrintStream out, PrintStream err, Path workingDirectory) {
		this.in = in;
		this.out = out;
		this.err = err;
		this.workingDirectory = workingDirectory;
	}

	/**
	 * Returns the settings in effect, once {@link #run()} has merged the
	 * configuration files and the command line. The {@code .editorconfig}
	 * properties of each file come on top of these.
	 *
	 * @return the settings, or {@code null} before {@link #run()}
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public FormatSettings getSettings() {
		return settings;
	}

	/**
	 * @return the files to format, in command line order
	 */
	public List<String> getFiles() {
		return new ArrayList<String>(files);
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 */
	public void parse(String[] args) {

		// Special case: no arguments
		if (args.length == 0) {
			printUsage = true;
			return;
		}

		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.charAt(0) != '-' || arg.equals("-")) {
				files.add(arg);
			} else if (arg.equals("--")) {
				// everything after is a file name
				for (argIdx++; argIdx < args.length; argIdx++) {
					files.add(args[argIdx]);
				}
				break;
			} else if (arg.equals("-i") || arg.equals("--indent-size")) {
				checkParameterHasArgument(args, argIdx);
				String value = args[++argIdx];
				try {
					indentSize = Integer.parseInt(value);
				} catch (NumberFormatException e) {
					throw new IllegalArgumentException("Invalid indent size: " + value, e);
				}
				if (indentSize < 1) {
					throw new IllegalArgumentException("Indent size must be at least 1: " + value);
				}
			} else if (arg.equals("-t") || arg.equals("--tab")) {
				tab = Boolean.TRUE;
			} else if (arg.equals("-s") || arg.equals("--force-function-style")) {
				checkParameterHasArgument(args, argIdx);
				functionStyle = FunctionStyle.fromName(args[++argIdx]);
			} else if (arg.equals("--variable-style")) {
				checkParameterHasArgument(args, argIdx);
				variableStyle = VariableStyle.fromName(args[++argIdx]);
			} else if (arg.equals("-b") || arg.equals("--backup")) {
				backup = Boolean.TRUE;
			} else if (arg.equals("-c") || arg.equals("--check")) {
				check = Boolean.TRUE;
			} else if (arg.equals("--config")) {
				checkParameterHasArgument(args, argIdx);
				configFile = Paths.get(args[++argIdx]);
			} else if (arg.equals("--dump-syntax")) {
				dumpSyntaxTree = true;
			} else if (arg.equals("-v") || arg.equals("--version")) {
				printVersion = true;
			} else if (arg.equals("-h") || arg.equals("--help") || arg.equals("-?")) {
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			}
			++argIdx;
		}

		if (files.isEmpty() && !printVersion) {
			throw new IllegalArgumentException("No file to format.");
		}
	}

	/**
	 * Ensures that the current command-line option is followed by a value.
	 *
	 * @param args full array of arguments
	 * @param argIdx index of the option that requires a value
	 */
	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Need additional argument for " + args[argIdx]);
		}
	}

	/**
	 * Merge the configuration files with the command line options.
	 *
	 * @param script the script the settings are for, whose
	 *        {@code .editorconfig} properties apply, or {@code null}
	 */
	private FormatSettings buildSettings(Path script) {
		Path explicit = configFile == null ? null : workingDirectory.resolve(configFile);
		FormatSettings result = ConfigLoader.load(workingDirectory, explicit, script);
		if (indentSize != null) {
			result.setIndentSize(indentSize);
		}
		if (tab != null) {
			result.setTab(tab);
		}
		if (functionStyle != null) {
			result.setFunctionStyle(functionStyle);
		}
		if (variableStyle != null) {
			result.setVariableStyle(variableStyle);
		}
		if (backup != null) {
			result.setBackup(backup);
		}
		if (check != null) {
			result.setCheck(check);
		}
		LOG.debug("Settings in effect:\n{}", result.toDescriptionString());
		return result;
	}

	/**
	 * Formats the files given on the command line.
	 *
	 * @throws ExitException with code 1 if a file could not be formatted or
	 *         read, or, in check mode, if a file would change
	 */
	public void run() {
		if (printUsage) {
			usage(out);
			return;
		}
		if (printVersion) {
			out.println("bashfmt " + VERSION);
			if (files.isEmpty()) {
				return;
			}
		}

		settings = buildSettings(null);

		int failures = 0;
		for (String file : files) {
			try {
				if (!processFile(file)) {
					failures++;
				}
			} catch (UncheckedIOException e) {
				err.println(file + ": " + e.getCause().getMessage());
				failures++;
			}
		}
		if (failures > 0) {
			throw new ExitException(1, failures + " file(s) not in order");
		}
	}

	/**
	 * @return {@code false} if the file failed to parse or would change in
	 *         check mode
	 */
	private boolean processFile(String file) {
		boolean stdin = file.equals("-");
		FormatSettings fileSettings = stdin ? settings : buildSettings(workingDirectory.resolve(file));
		BashFmt bashFmt = new BashFmt(fileSettings);
		ScriptSource source = stdin
				? new ScriptSource(ScriptSource.DESCRIPTION_STDIN, new InputStreamReader(in, StandardCharsets.UTF_8))
				: new ScriptFileSource(workingDirectory.resolve(file).toString());
		String original;
		try {
			original = source.readAll();
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}

		if (dumpSyntaxTree) {
			Script script = bashFmt.parse(original, source.getDescription());
			script.dump(out);
			return true;
		}

		FormatResult result = bashFmt.format(original, source.getDescription());
		if (result.hasError()) {
			err.println(source.getDescription() + ": could not be parsed, left unchanged");
			if (stdin && !fileSettings.isCheck()) {
				out.print(original);
			}
			return false;
		}
		String formatted = result.getFormatted();

		if (fileSettings.isCheck()) {
			if (formatted.equals(original)) {
				return true;
			}
			out.println(source.getDescription() + ": would be reformatted (first difference on line "
					+ firstDifferentLine(original, formatted) + ")");
			for (String line : unifiedDiff(source.getDescription(), original, formatted)) {
				out.println(line);
			}
			return false;
		}

		if (stdin) {
			out.print(formatted);
			return true;
		}
		if (formatted.equals(original)) {
			return true;
		}
		Path path = workingDirectory.resolve(file);
		try {
			if (fileSettings.isBackup()) {
				Path backupPath = path.resolveSibling(path.getFileName() + fileSettings.getBackupSuffix());
				Files.copy(path, backupPath, StandardCopyOption.REPLACE_EXISTING);
			}
			Files.write(path, formatted.getBytes(StandardCharsets.UTF_8));
		} catch (IOException e) {
			throw new UncheckedIOException(e);
		}
		LOG.debug("Reformatted {}", path);
		return true;
	}

	/**
	 * @return the lines of a unified diff turning {@code original} into
	 *         {@code formatted}, with 3 lines of context
	 */
	static List<String> unifiedDiff(String description, String original, String formatted) {
		List<String> originalLines = Arrays.asList(original.split("\r?\n", -1));
		List<String> formattedLines = Arrays.asList(formatted.split("\r?\n", -1));
		Patch<String> patch = DiffUtils.diff(originalLines, formattedLines);
		return UnifiedDiffUtils
				.generateUnifiedDiff(
						description + " (original)",
						description + " (formatted)",
						originalLines,
						patch,
						3);
	}

	/**
	 * @return 1-based number of the first line that differs
	 */
	static int firstDifferentLine(String a, String b) {
		String[] left = a.split("\n", -1);
		String[] right = b.split("\n", -1);
		int common = Math.min(left.length, right.length);
		for (int i = 0; i < common; i++) {
			if (!left[i].equals(right[i])) {
				return i + 1;
			}
		}
		return common + 1;
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	private static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest
				.println(
						"java -jar " +
								JAR_NAME +
								" [-i|--indent-size N]" +
								" [-t|--tab]" +
								" [-s|--force-function-style fnpar|fnonly|paronly]" +
								" [--variable-style none|braces]" +
								" [-b|--backup]" +
								" [-c|--check]" +
								" [--config file]" +
								" [--dump-syntax]" +
								" file...");
		dest.println();
		dest.println(" -i N, --indent-size N = Indent with N spaces per level (default 4).");
		dest.println(" -t, --tab = Indent with one tab per level.");
		dest.println(" -s STYLE, --force-function-style STYLE = Write every function header in the given style:");
		dest.println("                      fnpar = function name() { }, fnonly = function name { }, paronly = name() { }");
		dest.println(" --variable-style STYLE = braces writes $NAME as ${NAME}; none keeps expansions as written.");
		dest.println(" -b, --backup = Save the original of each rewritten file as file.bak.");
		dest.println(" -c, --check = Do not write anything, print a diff of the files that would change.");
		dest.println(" --config file = Read settings from this TOML file.");
		dest.println("                      .editorconfig, pyproject.toml [tool.bashfmt] and .bashfmtrc are read first.");
		dest.println(" --dump-syntax = Print the syntax tree instead of formatting.");
		dest.println(" -v, --version = Print the version.");
		dest.println();
		dest.println(" A file named - is read from the standard input and formatted to the standard output.");
		dest.println();
		dest.println(" -h or --help = This help screen.");
	}

	/**
	 * Convenience factory that parses arguments, executes the CLI, and returns the
	 * configured instance.
	 *
	 * @param args command-line arguments
	 * @param is input stream formatted for the file name {@code -}
	 * @param os output stream
	 * @param es error stream
	 * @param workingDirectory where relative file names and configuration
	 *        files are looked up
	 * @return configured and executed CLI instance
	 */
	public static Cli create(String[] args, InputStream is, PrintStream os, PrintStream es, Path workingDirectory) {
		Cli cli = new Cli(is, os, es, workingDirectory);
		cli.parse(args);
		cli.run();
		return cli;
	}

	/**
	 * Entry point for the command-line interface.
	 *
	 * @param args command-line arguments
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	public static void main(String[] args) {
		try {
			Cli cli = new Cli();
			cli.parse(args);
			cli.run();
		} catch (ExitException e) {
			System.exit(e.getCode());
		} catch (BashFmtException e) {
			if (e.getLineNumber() >= 0) {
				System.err.printf("%s (line %d): %s\n", e.getClass().getSimpleName(), e.getLineNumber(), e.getMessage());
			} else {
				System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			}
			System.exit(1);
		} catch (IllegalArgumentException e) {
			System.err.println("Failed to parse arguments. Please see the help/usage output (cmd line switch '-h').");
			System.err.println(e.getMessage());
			System.exit(1);
		} catch (Exception e) {
			System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			System.exit(1);
		}
	}
}
