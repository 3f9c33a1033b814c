package org.metricshub.transpiler.frontend;

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

/** Lexer token kinds. */
public enum TokenKind {
	FUNCTION_KEYWORD("function-keyword"),
	IDENTIFIER("identifier"),
	INTEGER_LITERAL("integer-literal"),
	OPEN_PAREN("open-paren"),
	CLOSE_PAREN("close-paren"),
	OPEN_BRACE("open-brace"),
	CLOSE_BRACE("close-brace"),
	COLON("colon"),
	COMMA("comma"),
	SEMICOLON("semicolon");

	private final String displayName;

	TokenKind(String displayName) {
		this.displayName = displayName;
	}

	/**
	 * @return the name used for this kind in diagnostics, e.g. {@code open-paren}
	 */
	public String getDisplayName() {
		return displayName;
	}

	@Override
	public String toString() {
		return displayName;
	}
}
