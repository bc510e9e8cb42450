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
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import org.metricshub.wordlang.backend.Interpreter;
import org.metricshub.wordlang.frontend.WordLangParser;
import org.metricshub.wordlang.frontend.ast.AstNode;
import org.metricshub.wordlang.frontend.ast.Program;
import org.metricshub.wordlang.util.ScriptSource;
import org.metricshub.wordlang.util.WordLangLogger;
import org.metricshub.wordlang.util.WordLangSettings;
import org.slf4j.Logger;

/**
 * Entry point into the parsing and execution of a WordLang script,
 * for code that embeds WordLang as a library.
 * <p>
 * A script is first compiled into a {@link Program} (tokenized, parsed,
 * and its variables resolved), then the program is interpreted. Errors in
 * the script are reported as {@link org.metricshub.wordlang.frontend.ast.ParserException}s
 * carrying the offending line; nothing is printed once parsing failed.
 * <p>
 * Instances are not thread-safe.
 */
public class WordLang {

	private static final Logger LOGGER = WordLangLogger.getLogger(WordLang.class);

	/**
	 * The syntax tree of the last compiled script.
	 */
	private AstNode lastAst;

	/**
	 * Returns the syntax tree of the last script compiled by this instance.
	 *
	 * @return the last {@link AstNode}, or {@code null} if no compilation occurred
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public AstNode getLastAst() {
		return lastAst;
	}

	/**
	 * Compiles a script with the default settings.
	 *
	 * @param script the script to compile
	 * @return the compiled program
	 * @throws IOException upon an IO error while reading the script
	 */
	public Program compile(ScriptSource script) throws IOException {
		return compile(script, new WordLangSettings());
	}

	/**
	 * Compiles a script.
	 *
	 * @param script the script to compile
	 * @param settings compilation settings (escape decoding)
	 * @return the compiled program
	 * @throws IOException upon an IO error while reading the script
	 */
	public Program compile(ScriptSource script, WordLangSettings settings) throws IOException {
		WordLangParser parser = new WordLangParser(settings.isDecodeEscapes());
		Program program = parser.parse(script);
		lastAst = program.getRoot();
		LOGGER
				.debug(
						"Compiled {}: {} top-level statements, {} variable slots",
						script.getDescription(),
						program.getRoot().getStatements().size(),
						program.getSlotCount());
		return program;
	}

	/**
	 * Interprets a compiled program.
	 *
	 * @param program the program to run
	 * @param settings runtime settings (output stream, print format...)
	 */
	public void invoke(Program program, WordLangSettings settings) {
		if (program == null) {
			return;
		}
		if (LOGGER.isDebugEnabled()) {
			LOGGER.debug("Invoking {} with settings:\n{}", program.getSourceDescription(), settings.toDescriptionString());
		}
		new Interpreter(settings).interpret(program);
	}

	/**
	 * Compiles and interprets a script.
	 *
	 * @param script the script to run
	 * @param settings compilation and runtime settings
	 * @throws IOException upon an IO error while reading the script
	 */
	public void invoke(ScriptSource script, WordLangSettings settings) throws IOException {
		invoke(compile(script, settings), settings);
	}

	/**
	 * Compiles and interprets a script passed as a string.
	 *
	 * @param script the text of the script
	 * @param settings compilation and runtime settings
	 * @throws IOException upon an IO error
	 */
	public void invoke(String script, WordLangSettings settings) throws IOException {
		invoke(new ScriptSource(ScriptSource.DESCRIPTION_INLINE_SCRIPT, new StringReader(script)), settings);
	}

	/**
	 * Runs a script with the default settings and returns what it printed.
	 *
	 * @param script the text of the script
	 * @return the printed output
	 * @throws IOException upon an IO error
	 */
	public String run(String script) throws IOException {
		return run(script, new WordLangSettings());
	}

	/**
	 * Runs a script and returns what it printed. The output stream of the
	 * specified settings is ignored; the settings are not modified.
	 *
	 * @param script the text of the script
	 * @param settings compilation and runtime settings
	 * @return the printed output
	 * @throws IOException upon an IO error
	 */
	public String run(String script, WordLangSettings settings) throws IOException {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		WordLangSettings runSettings = new WordLangSettings(settings);
		try (PrintStream printStream = new PrintStream(out, true, StandardCharsets.UTF_8.name())) {
			runSettings.setOutputStream(printStream);
			invoke(script, runSettings);
		}
		return out.toString(StandardCharsets.UTF_8.name());
	}
}
