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
 * <code>variable = value</code>. Evaluates to the assigned set, so that
 * assignments can be chained.
 */
public final class AssignAst extends AstNode {

	private final VariableRefAst target;
	private final AstNode value;

	public AssignAst(int lineNumber, VariableRefAst target, AstNode value) {
		super(lineNumber);
		this.target = (VariableRefAst) requireChild(target, "target variable");
		this.value = requireChild(value, "value");
	}

	public VariableRefAst getTarget() {
		return target;
	}

	public AstNode getValue() {
		return value;
	}

	@Override
	public List<AstNode> getChildren() {
		return Collections.unmodifiableList(Arrays.asList(target, value));
	}

	@Override
	public <T> T accept(AstVisitor<T> visitor) {
		return visitor.visitAssign(this);
	}
}
