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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * Root of the syntax tree: the definition of a function with its
 * formal parameters, its return type and the expressions of its body.
 * <p>
 * The body always holds at least one expression.
 */
public final class FunctionDef extends AstNode {

	private final String name;
	private final List<Argument> args;
	private final String returnType;
	private final List<Expression> body;

	/**
	 * @param name name of the function
	 * @param args formal parameters
	 * @param returnType name of the returned type
	 * @param body expressions of the body, at least one
	 */
	public FunctionDef(String name, List<Argument> args, String returnType, List<? extends Expression> body) {
		this.name = Objects.requireNonNull(name, "name");
		this.args = Collections.unmodifiableList(new ArrayList<Argument>(args));
		this.returnType = Objects.requireNonNull(returnType, "returnType");
		if (body.isEmpty()) {
			throw new IllegalArgumentException("The body of function " + name + " must hold at least one expression");
		}
		this.body = Collections.unmodifiableList(new ArrayList<Expression>(body));
	}

	public String getName() {
		return name;
	}

	public List<Argument> getArgs() {
		return args;
	}

	public String getReturnType() {
		return returnType;
	}

	public List<Expression> getBody() {
		return body;
	}

	@Override
	public List<? extends AstNode> getChildren() {
		List<AstNode> children = new ArrayList<AstNode>(args);
		children.addAll(body);
		return children;
	}

	@Override
	public <T> T accept(AstVisitor<T> visitor) {
		return visitor.visitFunctionDef(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof FunctionDef)) {
			return false;
		}
		FunctionDef other = (FunctionDef) o;
		return name.equals(other.name) &&
				args.equals(other.args) &&
				returnType.equals(other.returnType) &&
				body.equals(other.body);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, args, returnType, body);
	}

	@Override
	public String toString() {
		return "FunctionDef(" + name + "): " + returnType;
	}
}
