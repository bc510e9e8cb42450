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
 * Integer tags of the WordLang tokens.
 * <p>
 * A token made of a single punctuation character uses the character
 * code as its kind (<code>';'</code>, <code>'{'</code>, ...). Named kinds
 * are numbered above the <code>char</code> range, so no character code
 * can ever be mistaken for one of them.
 */
public final class TokenKind {

	private static final int NAMED_BASE = Character.MAX_VALUE + 1;

	/** End of input. */
	public static final int EOF = NAMED_BASE;
	/** <code>//</code> comment up to the end of the line. Discarded. */
	public static final int COMMENT = NAMED_BASE + 1;
	/** A single whitespace character. Discarded. */
	public static final int WHITESPACE = NAMED_BASE + 2;
	/** Double-quoted string literal, quotes included. */
	public static final int STRING = NAMED_BASE + 3;
	/** Variable name. */
	public static final int IDENTIFIER = NAMED_BASE + 4;
	public static final int IN = NAMED_BASE + 5;
	public static final int PRINT = NAMED_BASE + 6;
	public static final int FOREACH = NAMED_BASE + 7;
	public static final int FILTER_OUT = NAMED_BASE + 8;
	public static final int FILTER = NAMED_BASE + 9;
	public static final int LOAD = NAMED_BASE + 10;
	/** The <code>List</code> type keyword. */
	public static final int LIST = NAMED_BASE + 11;

	private TokenKind() {}

	/**
	 * @param kind a token kind
	 * @return true if tokens of this kind never reach the parser
	 */
	public static boolean isIgnored(int kind) {
		return kind == EOF || kind == COMMENT || kind == WHITESPACE;
	}

	/**
	 * Returns a readable name for a token kind, used in error messages.
	 *
	 * @param kind a token kind
	 * @return the name of the kind, or the quoted character for
	 *         single-character tokens
	 */
	public static String name(int kind) {
		switch (kind) {
		case EOF:
			return "EOF";
		case COMMENT:
			return "COMMENT";
		case WHITESPACE:
			return "WHITESPACE";
		case STRING:
			return "STRING";
		case IDENTIFIER:
			return "ID";
		case IN:
			return "IN";
		case PRINT:
			return "PRINT";
		case FOREACH:
			return "FOREACH";
		case FILTER_OUT:
			return "FILTER_OUT";
		case FILTER:
			return "FILTER";
		case LOAD:
			return "LOAD";
		case LIST:
			return "TYPE";
		default:
			if (kind >= 0 && kind < NAMED_BASE) {
				return "'" + (char) kind + "'";
			}
			return "UNKNOWN(" + kind + ")";
		}
	}
}
