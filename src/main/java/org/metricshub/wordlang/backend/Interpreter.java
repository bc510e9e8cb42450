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

import java.io.PrintStream;
import java.util.Collections;
import java.util.SortedSet;
import java.util.TreeSet;
import org.metricshub.wordlang.frontend.ast.AbstractFilterAst;
import org.metricshub.wordlang.frontend.ast.AssignAst;
import org.metricshub.wordlang.frontend.ast.AstNode;
import org.metricshub.wordlang.frontend.ast.AstVisitor;
import org.metricshub.wordlang.frontend.ast.BinarySetOpAst;
import org.metricshub.wordlang.frontend.ast.FilterAst;
import org.metricshub.wordlang.frontend.ast.FilterOutAst;
import org.metricshub.wordlang.frontend.ast.LiteralAst;
import org.metricshub.wordlang.frontend.ast.LoadAst;
import org.metricshub.wordlang.frontend.ast.PrintAst;
import org.metricshub.wordlang.frontend.ast.Program;
import org.metricshub.wordlang.frontend.ast.StatementBlockAst;
import org.metricshub.wordlang.frontend.ast.VariableRefAst;
import org.metricshub.wordlang.jrt.PrintFormat;
import org.metricshub.wordlang.jrt.WordFileReader;
import org.metricshub.wordlang.util.WordLangLogger;
import org.metricshub.wordlang.util.WordLangSettings;
import org.slf4j.Logger;

/**
 * Executes a {@link Program} by walking its syntax tree.
 * <p>
 * Every node evaluates to a set of words, kept in sorted order. Statements
 * (blocks and <code>print</code>) evaluate to the empty set and are run
 * for their side effects. Sets handed out by this class are never modified
 * afterwards, so they can be shared between slots.
 */
public class Interpreter implements AstVisitor<SortedSet<String>> {

	private static final Logger LOGGER = WordLangLogger.getLogger(Interpreter.class);

	private final PrintStream out;
	private final PrintFormat printFormat;
	private final WordFileReader fileReader;

	private VariableSlots slots;

	/**
	 * @param settings where to print, how to print, and how to read files
	 */
	public Interpreter(WordLangSettings settings) {
		this.out = settings.getOutputStream();
		this.printFormat = settings.getPrintFormat();
		this.fileReader = new WordFileReader(settings.getLoadCharset(), settings.getBaseDirectory());
	}

	/**
	 * Runs the program with fresh variables.
	 *
	 * @param program the program to run
	 */
	public void interpret(Program program) {
		LOGGER.debug("Running {} with {} variable slots", program.getSourceDescription(), program.getSlotCount());
		slots = new VariableSlots(program.getSlotCount());
		try {
			program.getRoot().accept(this);
		} finally {
			out.flush();
		}
	}

	/**
	 * @return the variables of the last run, or <code>null</code> before any run
	 */
	public VariableSlots getSlots() {
		return slots;
	}

	private SortedSet<String> evaluate(AstNode node) {
		return node.accept(this);
	}

	@Override
	public SortedSet<String> visitStatementBlock(StatementBlockAst block) {
		for (AstNode statement : block.getStatements()) {
			evaluate(statement);
		}
		return Collections.emptySortedSet();
	}

	@Override
	public SortedSet<String> visitAssign(AssignAst assign) {
		SortedSet<String> value = evaluate(assign.getValue());
		return slots.store(assign.getTarget().getSlot(), value);
	}

	@Override
	public SortedSet<String> visitBinarySetOp(BinarySetOpAst operation) {
		SortedSet<String> result = new TreeSet<String>(evaluate(operation.getLeft()));
		SortedSet<String> right = evaluate(operation.getRight());
		switch (operation.getOperator()) {
		case UNION:
			result.addAll(right);
			break;
		case DIFFERENCE:
			result.removeAll(right);
			break;
		default:
			throw new IllegalStateException("Unhandled set operator " + operation.getOperator());
		}
		return Collections.unmodifiableSortedSet(result);
	}

	@Override
	public SortedSet<String> visitVariableRef(VariableRefAst variable) {
		return slots.load(variable.getSlot());
	}

	@Override
	public SortedSet<String> visitLiteral(LiteralAst literal) {
		return literal.getWords();
	}

	@Override
	public SortedSet<String> visitLoad(LoadAst load) {
		SortedSet<String> fileNames = evaluate(load.getFileNames());
		return Collections.unmodifiableSortedSet(fileReader.readWords(fileNames));
	}

	@Override
	public SortedSet<String> visitPrint(PrintAst print) {
		for (AstNode argument : print.getArguments()) {
			out.println(printFormat.format(evaluate(argument)));
		}
		return Collections.emptySortedSet();
	}

	@Override
	public SortedSet<String> visitFilter(FilterAst filter) {
		return applyFilter(filter, true);
	}

	@Override
	public SortedSet<String> visitFilterOut(FilterOutAst filterOut) {
		return applyFilter(filterOut, false);
	}

	/**
	 * Keeps the words of the source that contain one of the filters
	 * (<code>keepMatches</code>), or that contain none of them.
	 */
	private SortedSet<String> applyFilter(AbstractFilterAst node, boolean keepMatches) {
		SortedSet<String> words = evaluate(node.getSource());
		SortedSet<String> filters = evaluate(node.getFilters());
		SortedSet<String> result = new TreeSet<String>();
		for (String word : words) {
			if (matchesAny(word, filters) == keepMatches) {
				result.add(word);
			}
		}
		return Collections.unmodifiableSortedSet(result);
	}

	private static boolean matchesAny(String word, SortedSet<String> filters) {
		for (String filter : filters) {
			if (word.contains(filter)) {
				return true;
			}
		}
		return false;
	}
}
