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

import java.util.Collections;
import java.util.EnumSet;
import java.util.Set;
import java.util.stream.Collectors;
import org.metricshub.transpiler.TranspilerException;
import org.metricshub.transpiler.frontend.Token;
import org.metricshub.transpiler.frontend.TokenKind;

/**
 * Thrown by the parser when the next token is missing or is not of a kind
 * the grammar accepts at that position.
 * <p>
 * An empty set of expected kinds means the end of input was expected,
 * unless the exception was built with a message of its own.
 * A {@code null} actual token means the end of input was reached.
 */
public class ParserException extends TranspilerException {

	private static final long serialVersionUID = 1L;

	private static final String END_OF_INPUT = "end of input";

	private final Set<TokenKind> expected;
	private final TokenKind actual;
	private final String actualText;
	private final String sourceDescription;

	/**
	 * Creates a new parser exception.
	 *
	 * @param expected the token kinds acceptable at this position
	 * @param actual the token found, or {@code null} at the end of input
	 * @param sourceDescription description of the source being parsed
	 * @param lineNumber 1-based line of the offending token, or {@code -1}
	 */
	public ParserException(Set<TokenKind> expected, Token actual, String sourceDescription, int lineNumber) {
		super(lineNumber, buildMessage(expected, actual, sourceDescription, lineNumber));
		this.expected = expected.isEmpty() ?
				Collections.emptySet() : Collections.unmodifiableSet(EnumSet.copyOf(expected));
		this.actual = actual == null ? null : actual.getKind();
		this.actualText = actual == null ? null : actual.getText();
		this.sourceDescription = sourceDescription;
	}

	/**
	 * Creates a new parser exception for a failure that is not about the kind
	 * of the next token.
	 *
	 * @param reason what went wrong
	 * @param actual the token at which parsing stopped
	 * @param sourceDescription description of the source being parsed
	 * @param lineNumber 1-based line of the offending token, or {@code -1}
	 */
	public ParserException(String reason, Token actual, String sourceDescription, int lineNumber) {
		super(lineNumber, reason + ". Found: " + found(actual) + location(sourceDescription, lineNumber));
		this.expected = Collections.emptySet();
		this.actual = actual == null ? null : actual.getKind();
		this.actualText = actual == null ? null : actual.getText();
		this.sourceDescription = sourceDescription;
	}

	private static String buildMessage(Set<TokenKind> expected, Token actual, String sourceDescription, int lineNumber) {
		String expectation = expected.isEmpty() ?
				END_OF_INPUT :
				expected.stream().map(TokenKind::getDisplayName).collect(Collectors.joining(" or "));
		return "Expecting " + expectation + ". Found: " + found(actual) + location(sourceDescription, lineNumber);
	}

	private static String found(Token actual) {
		return actual == null ? END_OF_INPUT : actual.getKind().getDisplayName() + " (" + actual.getText() + ")";
	}

	private static String location(String sourceDescription, int lineNumber) {
		return lineNumber < 0 ? " (" + sourceDescription + ")" : " (" + sourceDescription + ":" + lineNumber + ")";
	}

	/**
	 * @return the token kinds acceptable at the failing position, empty when the end of input was expected
	 */
	public Set<TokenKind> getExpected() {
		return expected;
	}

	/**
	 * @return the kind of the token found, {@code null} when the end of input was reached
	 */
	public TokenKind getActual() {
		return actual;
	}

	/**
	 * @return the text of the token found, {@code null} when the end of input was reached
	 */
	public String getActualText() {
		return actualText;
	}

	/**
	 * @return description of the source being parsed
	 */
	public String getSourceDescription() {
		return sourceDescription;
	}
}
