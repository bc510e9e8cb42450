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
 * <code>print(a, b, ...)</code>: prints each argument on its own line.
 */
public final class PrintAst extends AstNode {

	private final List<AstNode> arguments;

	public PrintAst(int lineNumber, List<AstNode> arguments) {
		super(lineNumber);
		if (arguments.isEmpty()) {
			throw new MalformedAstError("PrintAst built without arguments");
		}
		List<AstNode> copy = new ArrayList<AstNode>(arguments.size());
		for (AstNode argument : arguments) {
			copy.add(requireChild(argument, "argument #" + (copy.size() + 1)));
		}
		this.arguments = Collections.unmodifiableList(copy);
	}

	public List<AstNode> getArguments() {
		return arguments;
	}

	@Override
	public List<AstNode> getChildren() {
		return arguments;
	}

	@Override
	public <T> T accept(AstVisitor<T> visitor) {
		return visitor.visitPrint(this);
	}
}
