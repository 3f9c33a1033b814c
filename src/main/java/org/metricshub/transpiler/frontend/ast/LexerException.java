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

import org.metricshub.transpiler.TranspilerException;

/**
 * Thrown by the lexer when no token rule matches the source text
 * at the current position.
 */
public class LexerException extends TranspilerException {

	private static final long serialVersionUID = 1L;

	/**
	 * Maximum number of characters of the remainder quoted in the message.
	 */
	private static final int QUOTED_REMAINDER_LENGTH = 40;

	private final String remainder;
	private final String sourceDescription;

	/**
	 * Creates a new lexer exception.
	 *
	 * @param remainder unmatched remaining source text, starting at the offending character
	 * @param sourceDescription description of the source being tokenized
	 * @param lineNumber 1-based line of the offending character
	 */
	public LexerException(String remainder, String sourceDescription, int lineNumber) {
		super(
				lineNumber,
				"Couldn't match token on \"" + quote(remainder) + "\" (" + sourceDescription + ":" + lineNumber + ")");
		this.remainder = remainder;
		this.sourceDescription = sourceDescription;
	}

	private static String quote(String remainder) {
		String shown = remainder.length() > QUOTED_REMAINDER_LENGTH ?
				remainder.substring(0, QUOTED_REMAINDER_LENGTH) + "..." : remainder;
		return shown.replace("\n", "\\n").replace("\t", "\\t").replace("\r", "\\r");
	}

	/**
	 * @return the whole unmatched remainder of the source
	 */
	public String getRemainder() {
		return remainder;
	}

	/**
	 * @return description of the source being tokenized
	 */
	public String getSourceDescription() {
		return sourceDescription;
	}
}
