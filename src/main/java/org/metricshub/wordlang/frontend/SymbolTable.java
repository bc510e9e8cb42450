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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashMap;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import org.metricshub.wordlang.frontend.ast.ParserException;

/**
 * Resolves variable names to slots while a script is parsed.
 * <p>
 * Names live in a stack of scopes: a scope is pushed when a block opens and
 * popped when it closes. A name is looked up from the innermost scope
 * outwards. Slots, on the other hand, are allocated once and for all, in
 * declaration order: popping a scope hides its names but the slots stay
 * allocated, so the interpreter only ever deals with slot indices.
 */
public class SymbolTable {

	/** Returned by {@link #lookup(String)} for unknown names. */
	public static final int NO_SLOT = -1;

	private final String sourceDescription;

	/** Declared name and line of each slot, indexed by slot. */
	private final List<String> slotNames = new ArrayList<String>();
	private final List<Integer> slotLines = new ArrayList<Integer>();

	/** Innermost scope first. */
	private final Deque<Map<String, Integer>> scopes = new ArrayDeque<Map<String, Integer>>();

	/**
	 * @param sourceDescription origin of the script, for error messages
	 */
	public SymbolTable(String sourceDescription) {
		this.sourceDescription = sourceDescription;
		scopes.push(new HashMap<String, Integer>());
	}

	/**
	 * Declares a variable in the innermost scope and allocates its slot.
	 * A variable of an enclosing scope with the same name is shadowed.
	 *
	 * @param line line of the declaration
	 * @param name name of the variable
	 * @return the slot of the new variable
	 * @throws ParserException if the name is already declared in the
	 *         innermost scope
	 */
	public int declare(int line, String name) {
		Map<String, Integer> scope = scopes.peek();
		Integer previous = scope.get(name);
		if (previous != null) {
			throw new ParserException(
					"Redeclaration of variable '" + name + "' (first declared on line " + slotLines.get(previous) + ").",
					sourceDescription,
					line);
		}
		int slot = slotNames.size();
		slotNames.add(name);
		slotLines.add(line);
		scope.put(name, slot);
		return slot;
	}

	/**
	 * @param name name of a variable
	 * @return the slot of the visible variable with that name, or
	 *         {@link #NO_SLOT}
	 */
	public int lookup(String name) {
		Iterator<Map<String, Integer>> it = scopes.iterator();
		while (it.hasNext()) {
			Integer slot = it.next().get(name);
			if (slot != null) {
				return slot;
			}
		}
		return NO_SLOT;
	}

	/**
	 * Opens a new innermost scope.
	 */
	public void pushScope() {
		scopes.push(new HashMap<String, Integer>());
	}

	/**
	 * Closes the innermost scope. Its slots remain allocated.
	 *
	 * @throws IllegalStateException when only the outermost scope is left
	 */
	public void popScope() {
		if (scopes.size() <= 1) {
			throw new IllegalStateException("Cannot pop the outermost scope");
		}
		scopes.pop();
	}

	/**
	 * @return number of scopes currently open, the outermost included
	 */
	public int depth() {
		return scopes.size();
	}

	/**
	 * @return number of slots allocated so far
	 */
	public int slotCount() {
		return slotNames.size();
	}

	/**
	 * @param slot a slot index
	 * @return name the slot was declared with
	 */
	public String slotName(int slot) {
		return slotNames.get(slot);
	}

	/**
	 * @return declared name of every slot, indexed by slot
	 */
	public List<String> slotNames() {
		return Collections.unmodifiableList(slotNames);
	}
}
