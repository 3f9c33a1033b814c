package org.metricshub.transpiler.backend;

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

import java.util.List;
import org.metricshub.transpiler.frontend.ast.Argument;
import org.metricshub.transpiler.frontend.ast.AstNode;
import org.metricshub.transpiler.frontend.ast.AstVisitor;
import org.metricshub.transpiler.frontend.ast.Call;
import org.metricshub.transpiler.frontend.ast.FunctionDef;
import org.metricshub.transpiler.frontend.ast.IntegerLiteral;
import org.metricshub.transpiler.frontend.ast.Variable;

/**
 * Renders a syntax tree in the C-like target syntax.
 * <p>
 * The output shape of each node is:
 * <ul>
 * <li>function definition: <code>returnType name(type arg, type arg){\n\texpr;expr;\n}</code>
 * <li>argument: <code>type name</code>
 * <li>call: <code>name(expr,expr)</code>
 * <li>variable: its name
 * <li>integer: its decimal value
 * </ul>
 * The statements of a body are separated by <code>;</code> and the whole body
 * is followed by a single <code>;</code>.
 * <p>
 * Rendering has no side effect: the same tree always renders to the same text.
 */
public class CodeGenerator implements AstVisitor<String> {

	/**
	 * Render the given node and its children.
	 *
	 * @param node the node to render
	 * @return the rendered text
	 * @throws GeneratorException when the node cannot be rendered
	 */
	public String generate(AstNode node) {
		if (node == null) {
			throw new GeneratorException("Unexpected node: null");
		}
		return node.accept(this);
	}

	@Override
	public String visitFunctionDef(FunctionDef node) {
		return node.getReturnType() +
				" " +
				node.getName() +
				"(" +
				join(node.getArgs(), ", ") +
				"){\n\t" +
				join(node.getBody(), ";") +
				";\n}";
	}

	@Override
	public String visitArgument(Argument node) {
		return node.getType() + " " + node.getName();
	}

	@Override
	public String visitCall(Call node) {
		return node.getName() + "(" + join(node.getArgs(), ",") + ")";
	}

	@Override
	public String visitVariable(Variable node) {
		return node.getName();
	}

	@Override
	public String visitIntegerLiteral(IntegerLiteral node) {
		return node.getValue().toString();
	}

	private String join(List<? extends AstNode> nodes, String separator) {
		StringBuilder sb = new StringBuilder();
		boolean first = true;
		for (AstNode node : nodes) {
			if (!first) {
				sb.append(separator);
			}
			sb.append(generate(node));
			first = false;
		}
		return sb.toString();
	}
}
