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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;

/**
 * Common shape of <code>source | filter(filters)</code> and
 * <code>source | filter_out(filters)</code>.
 */
public abstract class AbstractFilterAst extends AstNode {

	private final AstNode source;
	private final AstNode filters;

	protected AbstractFilterAst(int lineNumber, AstNode source, AstNode filters) {
		super(lineNumber);
		this.source = requireChild(source, "source");
		this.filters = requireChild(filters, "filters");
	}

	/**
	 * @return the expression producing the candidate words
	 */
	public final AstNode getSource() {
		return source;
	}

	/**
	 * @return the expression producing the substrings to look for
	 */
	public final AstNode getFilters() {
		return filters;
	}

	@Override
	public final List<AstNode> getChildren() {
		return Collections.unmodifiableList(Arrays.asList(source, filters));
	}
}
