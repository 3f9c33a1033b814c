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

/** Call of a function by its name, with its argument expressions. */
public final class Call extends Expression {

	private final String name;
	private final List<Expression> args;

	public Call(String name, List<? extends Expression> args) {
		this.name = Objects.requireNonNull(name, "name");
		this.args = Collections.unmodifiableList(new ArrayList<Expression>(args));
	}

	public String getName() {
		return name;
	}

	public List<Expression> getArgs() {
		return args;
	}

	@Override
	public List<? extends AstNode> getChildren() {
		return args;
	}

	@Override
	public <T> T accept(AstVisitor<T> visitor) {
		return visitor.visitCall(this);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Call)) {
			return false;
		}
		Call other = (Call) o;
		return name.equals(other.name) && args.equals(other.args);
	}

	@Override
	public int hashCode() {
		return Objects.hash(name, args);
	}

	@Override
	public String toString() {
		return "Call(" + name + ")";
	}
}
