package org.metricshub.transpiler.frontend.ast;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Transpiler
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 MetricsHub
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
import java.util.List;

/**
 * A node of the abstract syntax tree built by the parser.
 * <p>
 * The set of node kinds is closed: the constructor is package-private, so
 * only the classes of this package extend it. Nodes are immutable.
 */
public abstract class AstNode {

	AstNode() {}

	/**
	 * Dispatch to the method of the visitor matching this kind of node.
	 *
	 * @param visitor the visitor
	 * @param <T> type of the value produced by the visitor
	 * @return the value produced by the visitor for this node
	 */
	public abstract <T> T accept(AstVisitor<T> visitor);

	/**
	 * @return the direct children of this node, in source order
	 */
	public List<? extends AstNode> getChildren() {
		return Collections.emptyList();
	}

	/**
	 * Dump a meaningful text representation of this
	 * abstract syntax tree node and of its children
	 * to the output (print) stream, one node per line,
	 * each child indented one more space than its parent.
	 *
	 * @param ps The print stream to dump the text
	 *        representation.
	 */
	public void dump(PrintStream ps) {
		dump(ps, 0);
	}

	private void dump(PrintStream ps, int lvl) {
		StringBuilder spaces = new StringBuilder();
		for (int i = 0; i < lvl; i++) {
			spaces.append(' ');
		}
		ps.println(spaces + toString());
		for (AstNode child : getChildren()) {
			child.dump(ps, lvl + 1);
		}
	}
}
