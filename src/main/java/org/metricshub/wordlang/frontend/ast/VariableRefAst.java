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

import java.util.Collections;
import java.util.List;

/**
 * Reference to a variable, resolved at parse time to its slot.
 */
public final class VariableRefAst extends AstNode {

	private final int slot;
	private final String name;

	public VariableRefAst(int lineNumber, int slot, String name) {
		super(lineNumber);
		if (slot < 0) {
			throw new MalformedAstError("Variable '" + name + "' has no slot");
		}
		this.slot = slot;
		this.name = name;
	}

	/**
	 * @return index of the variable in the slot table
	 */
	public int getSlot() {
		return slot;
	}

	/**
	 * @return name of the variable, as declared
	 */
	public String getName() {
		return name;
	}

	@Override
	public List<AstNode> getChildren() {
		return Collections.emptyList();
	}

	@Override
	public <T> T accept(AstVisitor<T> visitor) {
		return visitor.visitVariableRef(this);
	}

	@Override
	public String toString() {
		return super.toString() + " " + name + " (slot " + slot + ")";
	}
}
