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

import java.math.BigInteger;
import java.util.Objects;

/**
 * A non-negative integer constant. The value is not bounded, as the
 * language accepts any run of digits.
 */
public final class IntegerLiteral extends Expression {

	private final BigInteger value;

	/**
	 * @param value the value of the constant, must not be negative
	 */
	public IntegerLiteral(BigInteger value) {
		Objects.requireNonNull(value, "value");
		if (value.signum() < 0) {
			throw new IllegalArgumentException("Integer literals cannot be negative: " + value);
		}
		this.value = value;
	}

	public IntegerLiteral(long value) {
		this(BigInteger.valueOf(value));
	}

	public BigInteger getValue() {
		return value;
	}

	@Override
	public <T> T accept(AstVisitor<T> visitor) {
		return visitor.visitIntegerLiteral(this);
	}

	@Override
	public boolean equals(Object o) {
		return o instanceof IntegerLiteral && value.equals(((IntegerLiteral) o).value);
	}

	@Override
	public int hashCode() {
		return value.hashCode();
	}

	@Override
	public String toString() {
		return "IntegerLiteral(" + value + ")";
	}
}
