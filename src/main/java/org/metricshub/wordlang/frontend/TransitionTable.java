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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;
import java.util.function.IntPredicate;

/**
 * Deterministic finite automaton recognizing the WordLang lexemes.
 * <p>
 * The automaton is a table: for each state, one next state per input
 * symbol (or {@link #NO_STATE}), and the token kind accepted in that state
 * (0 when the state does not accept). Symbols are the ASCII codes; every
 * other character shares the {@link #SYMBOL_OTHER} column. Symbols below
 * {@link #SYMBOL_MIN_INPUT} are reserved for the synthetic start-of-line
 * and end-of-line markers, so that patterns can be anchored to line
 * boundaries. The table is computed once, when the class is loaded.
 * <p>
 * Recognized patterns:
 * <ul>
 * <li>COMMENT: <code>//.*</code>
 * <li>WHITESPACE: <code>\s</code>
 * <li>STRING: <code>"([^"\n]|\\.)*"</code>
 * <li>IDENTIFIER: <code>[a-zA-Z_]\w*</code>
 * <li>keywords: <code>List print foreach load filter filter_out in</code>
 * </ul>
 */
public final class TransitionTable {

	/** Marks the absence of a transition. */
	public static final int NO_STATE = -1;

	/** Initial state of every scan. */
	public static final int START_STATE = 0;

	/** Synthetic symbol sent when a scan begins at the start of a line. */
	public static final int SYMBOL_START_OF_LINE = 2;

	/** Synthetic symbol probed when a lexeme reaches the end of a line. */
	public static final int SYMBOL_END_OF_LINE = 3;

	/** Symbols below this value are control symbols. */
	public static final int SYMBOL_MIN_INPUT = 9;

	/** Symbol shared by every character that has no column of its own. */
	public static final int SYMBOL_OTHER = 128;

	static final int NUM_SYMBOLS = SYMBOL_OTHER + 1;

	/** The WordLang automaton. */
	public static final TransitionTable WORDLANG = build();

	private final int[][] table;
	private final int[] stopKinds;

	private TransitionTable(int[][] table, int[] stopKinds) {
		this.table = table;
		this.stopKinds = stopKinds;
	}

	/**
	 * Maps an input character to its symbol (column) in the table.
	 *
	 * @param c input character
	 * @return the symbol of the character
	 */
	public static int symbolOf(char c) {
		if (c < SYMBOL_MIN_INPUT || c >= SYMBOL_OTHER) {
			return SYMBOL_OTHER;
		}
		return c;
	}

	/**
	 * @return the number of states
	 */
	public int size() {
		return table.length;
	}

	/**
	 * Returns the state reached from <code>state</code> on <code>symbol</code>.
	 * A control symbol that has no transition leaves the state unchanged.
	 *
	 * @param state current state, possibly {@link #NO_STATE}
	 * @param symbol input or control symbol
	 * @return the next state, or {@link #NO_STATE}
	 */
	public int next(int state, int symbol) {
		if (state < 0 || symbol < 0 || symbol >= NUM_SYMBOLS) {
			return NO_STATE;
		}
		int nextState = table[state][symbol];
		if (symbol < SYMBOL_MIN_INPUT && nextState == NO_STATE) {
			return state;
		}
		return nextState;
	}

	/**
	 * @param state a state, possibly {@link #NO_STATE}
	 * @return the token kind accepted in that state, or 0
	 */
	public int stopKind(int state) {
		return state >= 0 ? stopKinds[state] : 0;
	}

	/**
	 * Runs a whole string through the automaton, as if it was a line on its
	 * own, and returns the kind it is accepted as.
	 *
	 * @param lexeme text to test
	 * @return the token kind of the whole text, or 0 if it is not a lexeme
	 */
	public int test(String lexeme) {
		int state = next(START_STATE, SYMBOL_START_OF_LINE);
		for (int i = 0; i < lexeme.length(); i++) {
			state = next(state, symbolOf(lexeme.charAt(i)));
		}
		int eolState = next(state, SYMBOL_END_OF_LINE);
		return Math.max(stopKind(state), stopKind(eolState));
	}

	private static TransitionTable build() {
		Builder builder = new Builder();
		int start = builder.newState(0);
		assert start == START_STATE;

		// identifiers, then keywords carved out of them
		int identifier = builder.newState(TokenKind.IDENTIFIER);
		builder.setAll(start, TransitionTable::isIdentifierStart, identifier);
		builder.setAll(identifier, TransitionTable::isWordChar, identifier);
		builder.addKeyword("List", TokenKind.LIST, identifier);
		builder.addKeyword("print", TokenKind.PRINT, identifier);
		builder.addKeyword("foreach", TokenKind.FOREACH, identifier);
		builder.addKeyword("load", TokenKind.LOAD, identifier);
		builder.addKeyword("filter", TokenKind.FILTER, identifier);
		builder.addKeyword("filter_out", TokenKind.FILTER_OUT, identifier);
		builder.addKeyword("in", TokenKind.IN, identifier);

		int whitespace = builder.newState(TokenKind.WHITESPACE);
		builder.setAll(start, TransitionTable::isWhitespace, whitespace);

		int slash = builder.newState(0);
		int comment = builder.newState(TokenKind.COMMENT);
		builder.set(start, '/', slash);
		builder.set(slash, '/', comment);
		builder.setAll(comment, symbol -> symbol != '\n', comment);

		// A backslash may also stand for itself, so after one a quote both
		// closes the literal and continues it.
		int body = builder.newState(0);
		int escape = builder.newState(0);
		int closed = builder.newState(TokenKind.STRING);
		int closedOrBody = builder.newState(TokenKind.STRING);
		builder.set(start, '"', body);
		for (int state : new int[] { body, closedOrBody }) {
			builder.setAll(state, symbol -> symbol != '"' && symbol != '\n' && symbol != '\\', body);
			builder.set(state, '"', closed);
			builder.set(state, '\\', escape);
		}
		builder.setAll(escape, symbol -> symbol != '\n', body);
		builder.set(escape, '"', closedOrBody);
		builder.set(escape, '\\', escape);

		return builder.build();
	}

	private static boolean isIdentifierStart(int symbol) {
		return symbol >= 'a' && symbol <= 'z' || symbol >= 'A' && symbol <= 'Z' || symbol == '_';
	}

	private static boolean isWordChar(int symbol) {
		return isIdentifierStart(symbol) || symbol >= '0' && symbol <= '9';
	}

	private static boolean isWhitespace(int symbol) {
		return symbol == ' ' || symbol >= '\t' && symbol <= '\r';
	}

	/**
	 * Accumulates states and transitions before freezing them into a table.
	 */
	private static final class Builder {

		private final List<int[]> rows = new ArrayList<int[]>();
		private final List<Integer> stops = new ArrayList<Integer>();

		int newState(int stopKind) {
			int[] row = new int[NUM_SYMBOLS];
			Arrays.fill(row, NO_STATE);
			rows.add(row);
			stops.add(stopKind);
			return rows.size() - 1;
		}

		void set(int from, int symbol, int to) {
			rows.get(from)[symbol] = to;
		}

		/**
		 * Adds a transition for every input symbol (control symbols excluded)
		 * accepted by the predicate.
		 */
		void setAll(int from, IntPredicate symbols, int to) {
			for (int symbol = SYMBOL_MIN_INPUT; symbol < NUM_SYMBOLS; symbol++) {
				if (symbols.test(symbol)) {
					set(from, symbol, to);
				}
			}
		}

		/**
		 * Adds a keyword on top of the identifier automaton. Every prefix of the
		 * keyword gets its own state that still accepts an identifier and falls
		 * back to the generic identifier state on any other word character.
		 */
		void addKeyword(String keyword, int kind, int identifier) {
			int state = START_STATE;
			for (int i = 0; i < keyword.length(); i++) {
				int symbol = keyword.charAt(i);
				int next = rows.get(state)[symbol];
				if (next == NO_STATE || next == identifier) {
					next = newState(TokenKind.IDENTIFIER);
					setAll(next, TransitionTable::isWordChar, identifier);
					set(state, symbol, next);
				}
				state = next;
			}
			stops.set(state, kind);
		}

		TransitionTable build() {
			int[][] table = rows.toArray(new int[0][]);
			int[] stopKinds = new int[stops.size()];
			for (int i = 0; i < stopKinds.length; i++) {
				stopKinds[i] = stops.get(i);
			}
			return new TransitionTable(table, stopKinds);
		}
	}
}
