package org.metricshub.wordlang.util;

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
import java.io.PrintStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import org.metricshub.wordlang.jrt.PrintFormat;

/**
 * A simple container for the parameters of a single WordLang invocation.
 * These values have defaults; they are overridden by the command line
 * switches, or set directly by code embedding WordLang.
 */
public class WordLangSettings {

	/**
	 * Output stream;
	 * <code>System.out</code> by default,
	 * which means we will print to stdout by default
	 */
	private PrintStream outputStream = System.out;

	/**
	 * How <code>print</code> renders a word set;
	 * {@link PrintFormat#LEGACY} by default.
	 */
	private PrintFormat printFormat = PrintFormat.LEGACY;

	/**
	 * Whether backslash escapes in string literals are decoded;
	 * <code>false</code> by default (literals are kept verbatim).
	 */
	private boolean decodeEscapes = false;

	/**
	 * Charset of the files read by <code>load</code>.
	 */
	private Charset loadCharset = StandardCharsets.UTF_8;

	/**
	 * Directory against which relative <code>load</code> file names are
	 * resolved. <code>null</code> means the current working directory.
	 */
	private Path baseDirectory = null;

	/**
	 * Creates settings with default values.
	 */
	public WordLangSettings() {}

	/**
	 * Creates a copy of the specified settings.
	 *
	 * @param other settings to copy
	 */
	public WordLangSettings(WordLangSettings other) {
		this.outputStream = other.outputStream;
		this.printFormat = other.printFormat;
		this.decodeEscapes = other.decodeEscapes;
		this.loadCharset = other.loadCharset;
		this.baseDirectory = other.baseDirectory;
	}

	/**
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("printFormat = ").append(getPrintFormat()).append(newLine);
		desc.append("decodeEscapes = ").append(isDecodeEscapes()).append(newLine);
		desc.append("loadCharset = ").append(getLoadCharset()).append(newLine);
		desc.append("baseDirectory = ").append(getBaseDirectory()).append(newLine);

		return desc.toString();
	}

	/**
	 * @return the stream <code>print</code> writes to
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public PrintStream getOutputStream() {
		return outputStream;
	}

	/**
	 * @param pOutputStream the stream <code>print</code> writes to
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public void setOutputStream(PrintStream pOutputStream) {
		this.outputStream = pOutputStream;
	}

	public PrintFormat getPrintFormat() {
		return printFormat;
	}

	public void setPrintFormat(PrintFormat printFormat) {
		if (printFormat == null) {
			throw new IllegalArgumentException("Print format must not be null");
		}
		this.printFormat = printFormat;
	}

	public boolean isDecodeEscapes() {
		return decodeEscapes;
	}

	public void setDecodeEscapes(boolean decodeEscapes) {
		this.decodeEscapes = decodeEscapes;
	}

	public Charset getLoadCharset() {
		return loadCharset;
	}

	public void setLoadCharset(Charset loadCharset) {
		if (loadCharset == null) {
			throw new IllegalArgumentException("Charset must not be null");
		}
		this.loadCharset = loadCharset;
	}

	/**
	 * @return directory used to resolve relative <code>load</code> file
	 *         names, or <code>null</code> for the working directory
	 */
	public Path getBaseDirectory() {
		return baseDirectory;
	}

	public void setBaseDirectory(Path baseDirectory) {
		this.baseDirectory = baseDirectory;
	}
}
