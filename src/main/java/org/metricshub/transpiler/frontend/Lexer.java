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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.metricshub.transpiler.frontend.ast.LexerException;
import org.metricshub.transpiler.util.SourceText;

/**
 * Converts the source text into the ordered list of tokens consumed
 * by the {@link Parser}.
 * <p>
 * At each position, the rules of {@link #RULES} are tried in order and the
 * first one matching at that position wins. Whitespace between tokens,
 * before the first one and after the last one is skipped.
 */
public class Lexer {

	/**
	 * One lexer rule: the kind of token produced when the pattern
	 * matches at the current position.
	 */
	private static final class Rule {

		private final TokenKind kind;
		private final Pattern pattern;

		private Rule(TokenKind kind, String regex) {
			this.kind = kind;
			this.pattern = Pattern.compile(regex);
		}
	}

	/**
	 * Lexer rules, by priority.
	 * <p>
	 * <strong>Note:</strong> the keyword must stay before the identifier,
	 * as both patterns match <code>function</code>.
	 */
	private static final List<Rule> RULES = Collections
			.unmodifiableList(
					Arrays
							.asList(
									new Rule(TokenKind.FUNCTION_KEYWORD, "\\bfunction\\b"),
									new Rule(TokenKind.IDENTIFIER, "\\b[a-zA-Z]+\\b"),
									new Rule(TokenKind.INTEGER_LITERAL, "\\b[0-9]+\\b"),
									new Rule(TokenKind.OPEN_PAREN, "\\("),
									new Rule(TokenKind.CLOSE_PAREN, "\\)"),
									new Rule(TokenKind.OPEN_BRACE, "\\{"),
									new Rule(TokenKind.CLOSE_BRACE, "\\}"),
									new Rule(TokenKind.COLON, ":"),
									new Rule(TokenKind.COMMA, ","),
									new Rule(TokenKind.SEMICOLON, ";")));

	private String text;
	private String sourceDescription;
	private int position;
	private int lineNumber;

	/**
	 * Tokenize the given text.
	 *
	 * @param source the text to tokenize
	 * @return the tokens, in source order
	 * @throws LexerException when no rule matches at some position
	 */
	public List<Token> tokenize(String source) {
		return tokenize(source, SourceText.DESCRIPTION_INLINE);
	}

	/**
	 * Tokenize the given text.
	 *
	 * @param source the text to tokenize
	 * @param description description of the source, for diagnostics
	 * @return the tokens, in source order
	 * @throws LexerException when no rule matches at some position
	 */
	public List<Token> tokenize(String source, String description) {
		text = source;
		sourceDescription = description;
		position = 0;
		lineNumber = 1;

		List<Token> tokens = new ArrayList<Token>();
		skipWhitespaces();
		while (position < text.length()) {
			tokens.add(nextToken());
			skipWhitespaces();
		}
		return tokens;
	}

	private Token nextToken() {
		for (Rule rule : RULES) {
			// region() keeps the default opaque bounds: \b sees the region start as the start of input
			Matcher matcher = rule.pattern.matcher(text).region(position, text.length());
			if (matcher.lookingAt()) {
				position = matcher.end();
				return new Token(rule.kind, matcher.group(), lineNumber);
			}
		}
		throw new LexerException(text.substring(position), sourceDescription, lineNumber);
	}

	/**
	 * Skip all whitespaces, counting new lines
	 */
	private void skipWhitespaces() {
		while (position < text.length() && Character.isWhitespace(text.charAt(position))) {
			if (text.charAt(position) == '\n') {
				lineNumber++;
			}
			position++;
		}
	}
}
