package org.metricshub.wordlang.frontend;

import static org.junit.Assert.*;

import java.util.Arrays;
import org.junit.Test;
import org.metricshub.wordlang.frontend.ast.ParserException;

public class SymbolTableTest {

	@Test
	public void testSlotsAreAllocatedInDeclarationOrder() {
		SymbolTable table = new SymbolTable("test");
		assertEquals(0, table.declare(1, "a"));
		assertEquals(1, table.declare(2, "b"));
		assertEquals(0, table.lookup("a"));
		assertEquals(1, table.lookup("b"));
		assertEquals(SymbolTable.NO_SLOT, table.lookup("c"));
		assertEquals(2, table.slotCount());
		assertEquals("b", table.slotName(1));
	}

	@Test
	public void testRedeclarationInSameScope() {
		SymbolTable table = new SymbolTable("test");
		table.declare(1, "a");
		ParserException e = assertThrows(ParserException.class, () -> table.declare(3, "a"));
		assertEquals("Redeclaration of variable 'a' (first declared on line 1).", e.getMessage());
		assertEquals(3, e.getLineNumber());
		assertEquals("test", e.getSourceDescription());
	}

	@Test
	public void testShadowingRevertsWhenScopeCloses() {
		SymbolTable table = new SymbolTable("test");
		table.declare(1, "a");
		table.pushScope();
		assertEquals(2, table.depth());
		assertEquals("outer variable is visible in the inner scope", 0, table.lookup("a"));
		assertEquals(1, table.declare(2, "a"));
		assertEquals(1, table.lookup("a"));
		table.declare(3, "inner");
		table.popScope();
		assertEquals(0, table.lookup("a"));
		assertEquals(SymbolTable.NO_SLOT, table.lookup("inner"));
		assertEquals("slots of closed scopes stay allocated", 3, table.slotCount());
		assertEquals(Arrays.asList("a", "a", "inner"), table.slotNames());
	}

	@Test
	public void testSameNameInSiblingScopes() {
		SymbolTable table = new SymbolTable("test");
		table.pushScope();
		assertEquals(0, table.declare(1, "x"));
		table.popScope();
		table.pushScope();
		assertEquals(1, table.declare(2, "x"));
		table.popScope();
		assertEquals(SymbolTable.NO_SLOT, table.lookup("x"));
	}

	@Test
	public void testOutermostScopeCannotBePopped() {
		SymbolTable table = new SymbolTable("test");
		assertEquals(1, table.depth());
		assertThrows(IllegalStateException.class, table::popScope);
	}
}
