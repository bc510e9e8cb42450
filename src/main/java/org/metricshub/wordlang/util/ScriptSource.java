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

import java.io.IOException;
import java.io.Reader;

/**
 * Represents a WordLang script: where it comes from (for error
 * messages) and a {@link Reader} serving its contents.
 */
public class ScriptSource {

	/** Description used for scripts that are passed as a plain string. */
	public static final String DESCRIPTION_INLINE_SCRIPT = "<inline-script>";

	private final String description;
	private final Reader reader;

	/**
	 * Constructor for ScriptSource.
	 *
	 * @param description human readable origin of the script
	 * @param reader reader serving the script contents
	 */
	public ScriptSource(String description, Reader reader) {
		this.description = description;
		this.reader = reader;
	}

	/**
	 * @return the human readable origin of the script
	 */
	public final String getDescription() {
		return description;
	}

	/**
	 * Obtain the {@link Reader} serving the script contents.
	 *
	 * @return The reader which contains the script contents.
	 * @throws java.io.IOException if the script cannot be opened
	 */
	public Reader getReader() throws IOException {
		return reader;
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return getDescription();
	}
}
