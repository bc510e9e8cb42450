package org.metricshub.wordlang.frontend;

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
 * A lexeme recognized by the {@link Lexer}: its kind (see {@link TokenKind}),
 * the matched text, and the line on which it starts.
 */
public final class Token {

	private final int kind;
	private final String text;
	private final int line;

	/**
	 * @param kind kind of the token
	 * @param text matched text
	 * @param line line (starting at 1) where the token begins
	 */
	public Token(int kind, String text, int line) {
		this.kind = kind;
		this.text = text;
		this.line = line;
	}

	public int getKind() {
		return kind;
	}

	public String getText() {
		return text;
	}

	public int getLine() {
		return line;
	}

	/**
	 * @param expectedKind a token kind
	 * @return true if this token is of the specified kind
	 */
	public boolean is(int expectedKind) {
		return kind == expectedKind;
	}

	@Override
	public String toString() {
		return TokenKind.name(kind) + " \"" + text + "\" (line " + line + ")";
	}
}
