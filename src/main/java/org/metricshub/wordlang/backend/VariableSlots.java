package org.metricshub.wordlang.backend;

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
import java.util.SortedSet;
import java.util.TreeSet;
import org.metricshub.wordlang.frontend.ast.MalformedAstError;

/**
 * Storage of the variables of a running program: one word set per slot,
 * indexed by the slot numbers the parser assigned. Every slot starts as
 * the empty set and lives until the end of the run.
 */
public class VariableSlots {

	private final List<SortedSet<String>> values;

	/**
	 * @param slotCount number of slots of the program
	 */
	public VariableSlots(int slotCount) {
		values = new ArrayList<SortedSet<String>>(slotCount);
		for (int i = 0; i < slotCount; i++) {
			values.add(Collections.<String>emptySortedSet());
		}
	}

	/**
	 * @param slot a slot
	 * @return the current value of the slot (read-only)
	 */
	public SortedSet<String> load(int slot) {
		checkSlot(slot);
		return values.get(slot);
	}

	/**
	 * Replaces the value of a slot with a copy of the specified words.
	 *
	 * @param slot a slot
	 * @param words the new value
	 * @return the stored value (read-only)
	 */
	public SortedSet<String> store(int slot, SortedSet<String> words) {
		checkSlot(slot);
		SortedSet<String> stored = Collections.unmodifiableSortedSet(new TreeSet<String>(words));
		values.set(slot, stored);
		return stored;
	}

	/**
	 * @return number of slots
	 */
	public int size() {
		return values.size();
	}

	private void checkSlot(int slot) {
		if (slot < 0 || slot >= values.size()) {
			throw new MalformedAstError("Slot " + slot + " is outside of the slot table (size " + values.size() + ")");
		}
	}
}
