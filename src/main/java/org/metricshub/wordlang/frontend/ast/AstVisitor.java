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

/**
 * Operation over the WordLang syntax tree, one method per kind of node.
 *
 * @param <T> type of the value computed for each node
 */
public interface AstVisitor<T> {

	T visitStatementBlock(StatementBlockAst block);

	T visitAssign(AssignAst assign);

	T visitBinarySetOp(BinarySetOpAst operation);

	T visitVariableRef(VariableRefAst variable);

	T visitLiteral(LiteralAst literal);

	T visitLoad(LoadAst load);

	T visitPrint(PrintAst print);

	T visitFilter(FilterAst filter);

	T visitFilterOut(FilterOutAst filterOut);
}
