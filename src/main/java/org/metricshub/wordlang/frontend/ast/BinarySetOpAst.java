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
 * <code>left + right</code> (union) or <code>left - right</code> (difference).
 */
public final class BinarySetOpAst extends AstNode {

	/**
	 * The set operators, with the character that denotes them.
	 */
	public enum Operator {
		UNION('+'),
		DIFFERENCE('-');

		private final char symbol;

		Operator(char symbol) {
			this.symbol = symbol;
		}

		public char getSymbol() {
			return symbol;
		}

		/**
		 * @param symbol an operator character
		 * @return the operator denoted by the character
		 * @throws MalformedAstError if the character is not a set operator
		 */
		public static Operator fromSymbol(int symbol) {
			for (Operator operator : values()) {
				if (operator.symbol == symbol) {
					return operator;
				}
			}
			throw new MalformedAstError("No set operator for symbol " + symbol);
		}
	}

	private final Operator operator;
	private final AstNode left;
	private final AstNode right;

	public BinarySetOpAst(int lineNumber, Operator operator, AstNode left, AstNode right) {
		super(lineNumber);
		if (operator == null) {
			throw new MalformedAstError("BinarySetOpAst built without its operator");
		}
		this.operator = operator;
		this.left = requireChild(left, "left operand");
		this.right = requireChild(right, "right operand");
	}

	public Operator getOperator() {
		return operator;
	}

	public AstNode getLeft() {
		return left;
	}

	public AstNode getRight() {
		return right;
	}

	@Override
	public List<AstNode> getChildren() {
		return Collections.unmodifiableList(Arrays.asList(left, right));
	}

	@Override
	public <T> T accept(AstVisitor<T> visitor) {
		return visitor.visitBinarySetOp(this);
	}

	@Override
	public String toString() {
		return super.toString() + " '" + operator.getSymbol() + "'";
	}
}
