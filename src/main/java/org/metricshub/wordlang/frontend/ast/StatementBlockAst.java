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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Statements executed in order: the whole program, or a <code>{ }</code> block.
 * Empty statements are not part of the block.
 */
public final class StatementBlockAst extends AstNode {

	private final List<AstNode> statements;

	public StatementBlockAst(int lineNumber, List<AstNode> statements) {
		super(lineNumber);
		List<AstNode> copy = new ArrayList<AstNode>(statements.size());
		for (AstNode statement : statements) {
			copy.add(requireChild(statement, "statement #" + (copy.size() + 1)));
		}
		this.statements = Collections.unmodifiableList(copy);
	}

	public List<AstNode> getStatements() {
		return statements;
	}

	@Override
	public List<AstNode> getChildren() {
		return statements;
	}

	@Override
	public <T> T accept(AstVisitor<T> visitor) {
		return visitor.visitStatementBlock(this);
	}
}
