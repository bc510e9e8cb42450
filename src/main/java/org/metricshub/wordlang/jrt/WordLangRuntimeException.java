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

/**
 * A runtime exception thrown by WordLang. It is provided
 * to conveniently distinguish between WordLang errors,
 * which are reported to the user with the offending line,
 * and other runtime exceptions.
 */
public class WordLangRuntimeException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final int lineNumber;

	/**
	 * Constructor for WordLangRuntimeException.
	 *
	 * @param lineno line of the script where the error occurred
	 * @param msg description of the error
	 */
	public WordLangRuntimeException(int lineno, String msg) {
		super(msg);
		this.lineNumber = lineno;
	}

	/**
	 * @return the offending line number
	 */
	public int getLineNumber() {
		return lineNumber;
	}
}
