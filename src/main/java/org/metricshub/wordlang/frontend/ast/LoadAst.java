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
 * <code>load(fileNames)</code>: the words of every file named by the operand.
 */
public final class LoadAst extends AstNode {

	private final AstNode fileNames;

	public LoadAst(int lineNumber, AstNode fileNames) {
		super(lineNumber);
		this.fileNames = requireChild(fileNames, "file names");
	}

	public AstNode getFileNames() {
		return fileNames;
	}

	@Override
	public List<AstNode> getChildren() {
		return Collections.singletonList(fileNames);
	}

	@Override
	public <T> T accept(AstVisitor<T> visitor) {
		return visitor.visitLoad(this);
	}
}
