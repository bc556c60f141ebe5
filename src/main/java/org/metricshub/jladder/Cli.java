package org.metricshub.jladder;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jladder
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 MetricsHub
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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.File;
import java.io.PrintStream;
import org.metricshub.jladder.frontend.Token;
import org.metricshub.jladder.util.JladderSettings;
import org.metricshub.jladder.util.ScriptFileSource;

/**
 * Command-line interface for Jladder.
 */
public final class Cli {

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "Jladder.jar";
		}
		JAR_NAME = myName;
	}

	private final JladderSettings settings = new JladderSettings();
	private final PrintStream out;

	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard output stream.
	 */
	public Cli() {
		this(System.out);
	}

	/**
	 * Creates a CLI instance printing usage and token dumps to the supplied
	 * stream.
	 *
	 * @param out stream where usage and token dumps are written
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(PrintStream out) {
		this.out = out;
	}

	/**
	 * Returns the mutable {@link JladderSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public JladderSettings getSettings() {
		return settings;
	}

	public boolean isPrintUsage() {
		return printUsage;
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
			if (arg.equals("-s") || arg.equals("--source-file")) {
				// -s filename : ladder program to translate
				checkParameterHasArgument(args, argIdx);
				settings.setSourceFile(args[++argIdx]);
			} else if (arg.equals("-o") || arg.equals("--out")) {
				// -o filename : where to write the translated program
				checkParameterHasArgument(args, argIdx);
				settings.setOutputFilename(args[++argIdx]);
			} else if (arg.equals("--min-period")) {
				checkParameterHasArgument(args, argIdx);
				settings.setMinimumPeriod(parseInt(arg, args[++argIdx]));
			} else if (arg.equals("--max-tag-length")) {
				checkParameterHasArgument(args, argIdx);
				settings.setMaximumTagNameLength(parseInt(arg, args[++argIdx]));
			} else if (arg.equals("--dump-tokens")) {
				// --dump-tokens : print the token stream and exit
				settings.setDumpTokens(true);
			} else if (arg.equals("-h") || arg.equals("-?")) {
				// -h/-? : display usage information and exit
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

		if (settings.getSourceFile() == null) {
			throw new IllegalArgumentException("Source file not provided.");
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

	private static int parseInt(String option, String value) {
		try {
			return Integer.parseInt(value);
		} catch (NumberFormatException e) {
			throw new IllegalArgumentException(option + " expects an integer, got \"" + value + "\"", e);
		}
	}

	/**
	 * Executes the CLI based on the previously parsed arguments.
	 *
	 * @throws Exception if translation fails
	 */
	public void run() throws Exception {
		if (printUsage) {
			usage(out);
			return;
		}
		Jladder jladder = new Jladder(settings);
		if (settings.isDumpTokens()) {
			for (Token token : jladder.tokenize(new ScriptFileSource(settings.getSourceFile()))) {
				out.println(token);
			}
			return;
		}
		jladder.invoke();
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
								" -s source-filename" +
								" [-o output-filename]" +
								" [--min-period n]" +
								" [--max-tag-length n]" +
								" [--dump-tokens]");
		dest.println();
		dest.println(" -s, --source-file filename = Ladder program to translate.");
		dest.println(" -o, --out filename = Where to write the translated program (default: "
				+ JladderSettings.DEFAULT_OUTPUT_FILENAME + ").");
		dest.println(" --min-period n = Smallest period accepted for a periodic task (default: "
				+ JladderSettings.DEFAULT_MINIMUM_PERIOD + ").");
		dest.println(" --max-tag-length n = Longest tag name accepted (default: "
				+ JladderSettings.DEFAULT_MAXIMUM_TAG_NAME_LENGTH + ").");
		dest.println(" --dump-tokens = Print the tokens of the source file instead of translating it.");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	/**
	 * Parses arguments, executes the CLI, and returns the configured instance.
	 *
	 * @param args command-line arguments
	 * @param os output stream for usage and token dumps
	 * @return configured and executed CLI instance
	 * @throws Exception if execution fails
	 */
	public static Cli create(String[] args, PrintStream os) throws Exception {
		Cli cli = new Cli(os);
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
		} catch (TranslationException e) {
			if (e.getLineNumber() >= 0) {
				System.err.printf("%s (line %d): %s\n", e.getClass().getSimpleName(), e.getLineNumber(), e.getMessage());
			} else {
				System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			}
			System.exit(1);
		} catch (IllegalArgumentException e) {
			System.err.println("Failed to parse arguments. Please see the help/usage output (cmd line switch '-h').");
			e.printStackTrace(System.err);
			System.exit(1);
		} catch (Exception e) {
			System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			System.exit(1);
		}
	}
}
