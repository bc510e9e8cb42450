package org.metricshub.wordlang.jrt;

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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.InputStreamReader;
import java.nio.charset.Charset;
import java.nio.file.Files;
import java.nio.file.InvalidPathException;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.Collection;
import java.util.SortedSet;
import java.util.TreeSet;
import java.util.regex.Pattern;
import org.metricshub.wordlang.util.WordLangLogger;
import org.slf4j.Logger;

/**
 * Reads the words of the files named by a <code>load</code> expression.
 * <p>
 * Words are separated by whitespace. Bytes that are not valid in the
 * configured charset are decoded as replacement characters, so every word
 * of a readable file is kept. A file that cannot be opened is skipped and
 * the script goes on; the skip is only reported in the DEBUG log.
 */
public class WordFileReader {

	private static final Logger LOGGER = WordLangLogger.getLogger(WordFileReader.class);

	private static final Pattern WHITESPACE = Pattern.compile("\\s+");

	private final Charset charset;
	private final Path baseDirectory;

	/**
	 * @param charset charset of the word files
	 * @param baseDirectory directory against which relative names are
	 *        resolved, or <code>null</code> for the working directory
	 */
	public WordFileReader(Charset charset, Path baseDirectory) {
		this.charset = charset;
		this.baseDirectory = baseDirectory;
	}

	/**
	 * Reads all the specified files and returns the union of their words.
	 *
	 * @param fileNames names of the files to read
	 * @return the distinct words of all the readable files
	 */
	public SortedSet<String> readWords(Collection<String> fileNames) {
		SortedSet<String> words = new TreeSet<String>();
		for (String fileName : fileNames) {
			readWords(fileName, words);
		}
		return words;
	}

	private void readWords(String fileName, SortedSet<String> words) {
		Path path;
		try {
			path = baseDirectory == null ? Paths.get(fileName) : baseDirectory.resolve(fileName);
		} catch (InvalidPathException e) {
			LOGGER.debug("Skipping '{}': not a valid path ({})", fileName, e.getMessage());
			return;
		}
		int before = words.size();
		// malformed bytes are replaced, not rejected
		try (BufferedReader reader = new BufferedReader(new InputStreamReader(Files.newInputStream(path), charset))) {
			String line;
			while ((line = reader.readLine()) != null) {
				for (String word : WHITESPACE.split(line)) {
					// a leading separator yields an empty first field
					if (!word.isEmpty()) {
						words.add(word);
					}
				}
			}
		} catch (IOException e) {
			LOGGER.debug("Skipping unreadable word file '{}': {}", path, e.toString());
			return;
		}
		LOGGER.debug("Loaded {} new words from '{}'", words.size() - before, path);
	}
}
