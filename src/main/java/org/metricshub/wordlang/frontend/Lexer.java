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

import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;

/**
 * Splits WordLang source text into {@link Token}s with the
 * {@link TransitionTable} automaton.
 * <p>
 * Each call to {@link #nextToken(CharSequence)} applies the maximal munch
 * rule: the automaton is run as far as it can go from the current position,
 * and the longest prefix that reached an accepting state becomes the token.
 * When no prefix is accepted, the single character at the current position
 * is returned as a token whose kind is the character code, so that the scan
 * always progresses.
 * <p>
 * The lexer keeps the current position and line between calls; it is not
 * thread-safe.
 */
public class Lexer {

	private final TransitionTable table;

	/** Line of the input we are reading. */
	private int currentLine = 1;

	/** Index in the input of the start of the next lexeme. */
	private int startPos = 0;

	/**
	 * Creates a lexer for the WordLang lexemes.
	 */
	public Lexer() {
		this(TransitionTable.WORDLANG);
	}

	Lexer(TransitionTable table) {
		this.table = table;
	}

	/**
	 * Recognizes the token that starts at the current position of the input,
	 * and moves past it.
	 *
	 * @param input the whole source text; must be the same text between calls
	 * @return the next token, or an {@link TokenKind#EOF} token when the input
	 *         is exhausted
	 */
	public Token nextToken(CharSequence input) {
		int length = input.length();
		if (startPos >= length) {
			return new Token(TokenKind.EOF, "", currentLine);
		}

		int curPos = startPos;
		int bestPos = startPos;
		int bestKind = 0;
		int curState = TransitionTable.START_STATE;

		if (startPos == 0 || input.charAt(startPos - 1) == '\n') {
			curState = table.next(curState, TransitionTable.SYMBOL_START_OF_LINE);
		}
		while (curState != TransitionTable.NO_STATE && curPos < length) {
			char nextChar = input.charAt(curPos++);
			curState = table.next(curState, TransitionTable.symbolOf(nextChar));
			int curKind = table.stopKind(curState);
			if (curKind != 0) {
				bestPos = curPos;
				bestKind = curKind;
			}
			// a lexeme anchored at the end of the line may stop right here
			if (curPos == length || input.charAt(curPos) == '\n') {
				int eolKind = table.stopKind(table.next(curState, TransitionTable.SYMBOL_END_OF_LINE));
				if (eolKind != 0) {
					bestPos = curPos;
					bestKind = eolKind;
				}
			}
		}

		if (bestPos == startPos) {
			bestKind = input.charAt(startPos);
			bestPos++;
		}

		String lexeme = input.subSequence(startPos, bestPos).toString();
		startPos = bestPos;

		int tokenLine = currentLine;
		for (int i = 0; i < lexeme.length(); i++) {
			if (lexeme.charAt(i) == '\n') {
				currentLine++;
			}
		}
		return new Token(bestKind, lexeme, tokenLine);
	}

	/**
	 * Converts the whole input into the list of tokens seen by the parser:
	 * comments and whitespace are dropped, and no {@link TokenKind#EOF} token
	 * is appended.
	 *
	 * @param input source text
	 * @return the significant tokens, in order
	 */
	public List<Token> tokenize(CharSequence input) {
		startPos = 0;
		currentLine = 1;
		List<Token> tokens = new ArrayList<Token>();
		while (startPos < input.length()) {
			Token token = nextToken(input);
			if (!TokenKind.isIgnored(token.getKind())) {
				tokens.add(token);
			}
		}
		return tokens;
	}

	/**
	 * Reads the reader to its end, then tokenizes its contents.
	 *
	 * @param reader source text
	 * @return the significant tokens, in order
	 * @throws IOException when the reader fails
	 */
	public List<Token> tokenize(Reader reader) throws IOException {
		StringBuilder text = new StringBuilder();
		char[] buffer = new char[8192];
		int count;
		while ((count = reader.read(buffer)) >= 0) {
			text.append(buffer, 0, count);
		}
		return tokenize(text);
	}

	/**
	 * @return the line on which the next token starts
	 */
	public int getCurrentLine() {
		return currentLine;
	}
}
