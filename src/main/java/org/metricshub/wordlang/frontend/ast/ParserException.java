package org.metricshub.wordlang.frontend.ast;

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

import org.metricshub.wordlang.jrt.WordLangRuntimeException;

/**
 * A syntax or scoping error found while parsing a WordLang script:
 * unexpected token, undeclared variable, redeclared variable...
 * <p>
 * Parsing stops at the first error.
 */
public class ParserException extends WordLangRuntimeException {

	private static final long serialVersionUID = 1L;

	private final String sourceDescription;

	/**
	 * @param message description of the error
	 * @param sourceDescription origin of the script (file name...)
	 * @param lineNumber offending line
	 */
	public ParserException(String message, String sourceDescription, int lineNumber) {
		super(lineNumber, message);
		this.sourceDescription = sourceDescription;
	}

	/**
	 * @return origin of the script that failed to parse
	 */
	public String getSourceDescription() {
		return sourceDescription;
	}
}
