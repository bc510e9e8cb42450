package org.metricshub.wordlang;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * WordLang
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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import org.metricshub.wordlang.frontend.ast.MalformedAstError;
import org.metricshub.wordlang.frontend.ast.Program;
import org.metricshub.wordlang.jrt.PrintFormat;
import org.metricshub.wordlang.jrt.WordLangRuntimeException;
import org.metricshub.wordlang.util.ScriptFileSource;
import org.metricshub.wordlang.util.WordLangLogger;
import org.metricshub.wordlang.util.WordLangSettings;
import org.slf4j.Logger;

/**
 * Command-line interface for WordLang: runs the script file given as
 * argument and prints its output on the standard output.
 */
public final class Cli {

	private static final Logger LOGGER = WordLangLogger.getLogger(Cli.class);

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "wordlang.jar";
		}
		JAR_NAME = myName;
	}

	/** Line printed between the syntax tree dump and the script output. */
	static final String DUMP_SEPARATOR = "-------------------------";

	private final WordLangSettings settings = new WordLangSettings();
	private final PrintStream out;

	private String scriptFile;
	private boolean dumpSyntaxTree;
	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard output stream.
	 */
	public Cli() {
		this(System.out);
	}

	/**
	 * Creates a CLI instance writing the script output to the supplied stream.
	 *
	 * @param out stream where the script output is written
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(PrintStream out) {
		this.out = out;
		settings.setOutputStream(out);
	}

	/**
	 * Returns the mutable {@link WordLangSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public WordLangSettings getSettings() {
		return settings;
	}

	/**
	 * @return path of the script file to run, or <code>null</code>
	 */
	public String getScriptFile() {
		return scriptFile;
	}

	public boolean isDumpSyntaxTree() {
		return dumpSyntaxTree;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 * @throws IllegalArgumentException when the arguments are not valid
	 */
	public void parse(String[] args) {
		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.charAt(0) != '-') {
				// end of options
				break;
			} else if (arg.equals("--dump-syntax")) {
				// --dump-syntax : print the syntax tree before running
				dumpSyntaxTree = true;
			} else if (arg.equals("--compact")) {
				// --compact : print [a,b] instead of [,a,b ]
				settings.setPrintFormat(PrintFormat.COMPACT);
			} else if (arg.equals("--decode-escapes")) {
				// --decode-escapes : decode backslash escapes in string literals
				settings.setDecodeEscapes(true);
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

		if (argIdx >= args.length) {
			throw new IllegalArgumentException("WordLang script file not provided.");
		}
		if (argIdx + 1 != args.length) {
			throw new IllegalArgumentException("Exactly one script file is expected.");
		}
		scriptFile = args[argIdx];
	}

	/**
	 * Executes the CLI based on the previously parsed arguments.
	 *
	 * @throws IOException if the script cannot be read
	 */
	public void run() throws IOException {
		if (printUsage) {
			usage(out);
			return;
		}
		WordLang wordLang = new WordLang();
		Program program = wordLang.compile(new ScriptFileSource(scriptFile), settings);
		if (dumpSyntaxTree) {
			program.getRoot().dump(out);
			out.println(DUMP_SEPARATOR);
		}
		wordLang.invoke(program, settings);
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest.println("java -jar " + JAR_NAME + " [--dump-syntax] [--compact] [--decode-escapes] script-filename");
		dest.println();
		dest.println(" --dump-syntax = Print the syntax tree before running the script.");
		dest.println(" --compact = Print word sets as [a,b] instead of [,a,b ].");
		dest.println(" --decode-escapes = Decode \\n, \\t, \\r and \\<char> in string literals.");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	/**
	 * Parses the arguments, runs the script, and reports any failure on the
	 * error stream.
	 *
	 * @param args command-line arguments
	 * @param out stream for the script output
	 * @param err stream for error messages
	 * @return the exit status: 0 on success, 1 on any failure
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	public static int execute(String[] args, PrintStream out, PrintStream err) {
		Cli cli = new Cli(out);
		try {
			cli.parse(args);
		} catch (IllegalArgumentException e) {
			err.println(e.getMessage());
			usage(err);
			return 1;
		}
		try {
			cli.run();
			return 0;
		} catch (WordLangRuntimeException e) {
			out.flush();
			err.printf("ERROR (line %d): %s\n", e.getLineNumber(), e.getMessage());
		} catch (IOException | UncheckedIOException e) {
			err.printf("ERROR: %s\n", e.getMessage());
		} catch (MalformedAstError e) {
			LOGGER.error("Malformed syntax tree", e);
			err.printf("INTERNAL ERROR: %s\n", e.getMessage());
		}
		return 1;
	}

	/**
	 * Entry point for the command-line interface.
	 *
	 * @param args command-line arguments
	 */
	public static void main(String[] args) {
		int status = execute(args, System.out, System.err);
		if (status != 0) {
			System.exit(status);
		}
	}
}
