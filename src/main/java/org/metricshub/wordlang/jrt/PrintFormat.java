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

import java.util.Collection;

/**
 * Renders a word set on a single line for the <code>print</code> statement.
 * Words are written in the iteration order of the collection, which is
 * sorted for the sets produced by the interpreter.
 */
public enum PrintFormat {

	/**
	 * Every word, the first included, is preceded by a comma and the list
	 * is closed by <code>" ]"</code>: <code>[,cat,dog ]</code>.
	 * This is the format of the historical WordLang interpreter.
	 */
	LEGACY {
		@Override
		public String format(Collection<String> words) {
			StringBuilder line = new StringBuilder("[");
			for (String word : words) {
				line.append(',').append(word);
			}
			return line.append(" ]").toString();
		}
	},

	/**
	 * Comma separated words without the stray leading separator:
	 * <code>[cat,dog]</code>.
	 */
	COMPACT {
		@Override
		public String format(Collection<String> words) {
			return "[" + String.join(",", words) + "]";
		}
	};

	/**
	 * @param words the words to render
	 * @return the rendered line, without line terminator
	 */
	public abstract String format(Collection<String> words);
}
