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

import java.util.Objects;

/**
 * A classified fragment of the source text, produced by the {@link Lexer}.
 * <p>
 * The text is always the exact substring matched in the source.
 * Instances are immutable.
 */
public final class Token {

	private final TokenKind kind;
	private final String text;
	private final int lineNumber;

	/**
	 * Creates a token.
	 *
	 * @param kind kind of the token
	 * @param text text matched in the source
	 * @param lineNumber 1-based line on which the token starts
	 */
	public Token(TokenKind kind, String text, int lineNumber) {
		this.kind = Objects.requireNonNull(kind, "kind");
		this.text = Objects.requireNonNull(text, "text");
		this.lineNumber = lineNumber;
	}

	public TokenKind getKind() {
		return kind;
	}

	public String getText() {
		return text;
	}

	public int getLineNumber() {
		return lineNumber;
	}

	/**
	 * @param expected kind to compare with
	 * @return {@code true} if this token is of the expected kind
	 */
	public boolean is(TokenKind expected) {
		return kind == expected;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Token)) {
			return false;
		}
		Token other = (Token) o;
		return kind == other.kind && text.equals(other.text) && lineNumber == other.lineNumber;
	}

	@Override
	public int hashCode() {
		return Objects.hash(kind, text, lineNumber);
	}

	@Override
	public String toString() {
		return kind.getDisplayName() + " \"" + text + "\" (line " + lineNumber + ")";
	}
}
