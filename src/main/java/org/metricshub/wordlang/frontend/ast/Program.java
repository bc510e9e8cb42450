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
 * A parsed WordLang script, ready to be interpreted: the syntax tree and
 * the variable slots it refers to.
 */
public final class Program {

	private final String sourceDescription;
	private final StatementBlockAst root;
	private final List<String> slotNames;

	/**
	 * @param sourceDescription origin of the script
	 * @param root top-level statements
	 * @param slotNames declared name of each slot, indexed by slot
	 */
	public Program(String sourceDescription, StatementBlockAst root, List<String> slotNames) {
		if (root == null) {
			throw new MalformedAstError("Program built without its statements");
		}
		this.sourceDescription = sourceDescription;
		this.root = root;
		this.slotNames = Collections.unmodifiableList(new ArrayList<String>(slotNames));
	}

	public String getSourceDescription() {
		return sourceDescription;
	}

	public StatementBlockAst getRoot() {
		return root;
	}

	/**
	 * @return number of variable slots the interpreter must allocate
	 */
	public int getSlotCount() {
		return slotNames.size();
	}

	/**
	 * @param slot a slot index
	 * @return the name the slot was declared with
	 */
	public String getSlotName(int slot) {
		return slotNames.get(slot);
	}
}
