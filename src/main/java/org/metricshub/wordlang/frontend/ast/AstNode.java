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

import java.io.PrintStream;
import java.util.List;

/**
 * A node of the WordLang syntax tree.
 * <p>
 * There is one final subclass per kind of node, holding exactly the
 * operands of that kind. Nodes are immutable once built.
 */
public abstract class AstNode {

	private final int lineNumber;

	protected AstNode(int lineNumber) {
		this.lineNumber = lineNumber;
	}

	/**
	 * @return the line of the script this node was parsed from
	 */
	public final int getLineNumber() {
		return lineNumber;
	}

	/**
	 * @return the child nodes, in evaluation order (never <code>null</code>)
	 */
	public abstract List<AstNode> getChildren();

	/**
	 * Dispatches to the method of the visitor that handles this kind of node.
	 *
	 * @param <T> type of the value produced by the visitor
	 * @param visitor the visitor
	 * @return the value produced by the visitor
	 */
	public abstract <T> T accept(AstVisitor<T> visitor);

	/**
	 * Prints this node and its descendants, one per line, indented by depth.
	 *
	 * @param out destination of the dump
	 */
	public final void dump(PrintStream out) {
		dump(out, "");
	}

	private void dump(PrintStream out, String prefix) {
		out.println(prefix + this);
		for (AstNode child : getChildren()) {
			child.dump(out, prefix + "  ");
		}
	}

	/**
	 * Verifies that a mandatory operand is present.
	 *
	 * @param child the operand
	 * @param role name of the operand, for the error message
	 * @return the operand
	 * @throws MalformedAstError when the operand is missing
	 */
	protected final AstNode requireChild(AstNode child, String role) {
		if (child == null) {
			throw new MalformedAstError(getClass().getSimpleName() + " built without its " + role);
		}
		return child;
	}

	@Override
	public String toString() {
		return getClass().getSimpleName().replaceFirst("Ast$", "");
	}
}
