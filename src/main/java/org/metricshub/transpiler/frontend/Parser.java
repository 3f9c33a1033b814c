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

import java.math.BigInteger;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import org.metricshub.transpiler.frontend.ast.Argument;
import org.metricshub.transpiler.frontend.ast.Call;
import org.metricshub.transpiler.frontend.ast.Expression;
import org.metricshub.transpiler.frontend.ast.FunctionDef;
import org.metricshub.transpiler.frontend.ast.IntegerLiteral;
import org.metricshub.transpiler.frontend.ast.ParserException;
import org.metricshub.transpiler.frontend.ast.Variable;
import org.metricshub.transpiler.util.SourceText;

/**
 * Converts the tokens produced by the {@link Lexer} into a syntax tree,
 * rooted at a {@link FunctionDef}.
 * <p>
 * This is a recursive descent parser: each production of the grammar has
 * its own method. Tokens are read left to right through an index over the
 * token list, which is never modified.
 */
public class Parser {

	/**
	 * Maximum number of calls nested in one another.
	 */
	public static final int MAX_CALL_DEPTH = 1000;

	private List<Token> tokens;
	private String sourceDescription;
	private int position;
	private int callDepth;

	/**
	 * Parse the given tokens.
	 *
	 * @param localTokens the tokens of one function definition
	 * @return The abstract syntax tree of the function definition.
	 * @throws ParserException when a token is missing or out of order
	 */
	public FunctionDef parse(List<Token> localTokens) {
		return parse(localTokens, SourceText.DESCRIPTION_INLINE);
	}

	/**
	 * Parse the given tokens.
	 *
	 * @param localTokens the tokens of one function definition
	 * @param description description of the source, for diagnostics
	 * @return The abstract syntax tree of the function definition.
	 * @throws ParserException when a token is missing or out of order
	 */
	public FunctionDef parse(List<Token> localTokens, String description) {
		this.tokens = Collections.unmodifiableList(new ArrayList<Token>(localTokens));
		this.sourceDescription = description;
		this.position = 0;
		this.callDepth = 0;

		FunctionDef functionDef = FUNCTION_DEF();
		if (position < tokens.size()) {
			// a single function definition per source
			throw parserException(EnumSet.noneOf(TokenKind.class));
		}
		return functionDef;
	}

	// SUPPORTING FUNCTIONS/METHODS

	/**
	 * Consume the next token, which must be of the expected kind.
	 *
	 * @param expected kind of the next token
	 * @return the consumed token
	 */
	private Token consume(TokenKind expected) {
		if (!peek(expected)) {
			throw parserException(EnumSet.of(expected));
		}
		return tokens.get(position++);
	}

	private boolean peek(TokenKind expected) {
		return peek(expected, 0);
	}

	/**
	 * Look at the token <code>offset</code> positions after the next one,
	 * without consuming anything.
	 *
	 * @param expected kind to compare with
	 * @param offset 0 for the next token
	 * @return {@code false} when the token is not of the expected kind,
	 *         or when there is no such token
	 */
	private boolean peek(TokenKind expected, int offset) {
		int index = position + offset;
		return index < tokens.size() && tokens.get(index).is(expected);
	}

	private ParserException parserException(Set<TokenKind> expected) {
		Token actual = position < tokens.size() ? tokens.get(position) : null;
		int lineNumber;
		if (actual != null) {
			lineNumber = actual.getLineNumber();
		} else if (tokens.isEmpty()) {
			lineNumber = -1;
		} else {
			lineNumber = tokens.get(tokens.size() - 1).getLineNumber();
		}
		return new ParserException(expected, actual, sourceDescription, lineNumber);
	}

	// RECURSIVE DECENT PARSER:
	// CHECKSTYLE.OFF: MethodName
	// FUNCTION_DEF : function ID ( [ARGS] ) : ID BLOCK
	FunctionDef FUNCTION_DEF() {
		consume(TokenKind.FUNCTION_KEYWORD);
		String name = consume(TokenKind.IDENTIFIER).getText();
		consume(TokenKind.OPEN_PAREN);
		List<Argument> args;
		if (peek(TokenKind.IDENTIFIER)) {
			args = ARGS();
		} else {
			args = Collections.emptyList();
		}
		consume(TokenKind.CLOSE_PAREN);
		consume(TokenKind.COLON);
		String returnType = consume(TokenKind.IDENTIFIER).getText();
		List<Expression> body = BLOCK();
		return new FunctionDef(name, args, returnType, body);
	}

	// ARGS : ARG [ , ARG ]...
	List<Argument> ARGS() {
		List<Argument> args = new ArrayList<Argument>();
		args.add(ARG());
		while (peek(TokenKind.COMMA)) {
			consume(TokenKind.COMMA);
			args.add(ARG());
		}
		return args;
	}

	// ARG : ID : ID
	Argument ARG() {
		String name = consume(TokenKind.IDENTIFIER).getText();
		consume(TokenKind.COLON);
		String type = consume(TokenKind.IDENTIFIER).getText();
		return new Argument(name, type);
	}

	// BLOCK : { EXPRESSION ; [ EXPRESSION ; ]... }
	List<Expression> BLOCK() {
		List<Expression> expressions = new ArrayList<Expression>();
		consume(TokenKind.OPEN_BRACE);
		expressions.add(EXPRESSION());
		consume(TokenKind.SEMICOLON);
		while (!peek(TokenKind.CLOSE_BRACE)) {
			expressions.add(EXPRESSION());
			consume(TokenKind.SEMICOLON);
		}
		consume(TokenKind.CLOSE_BRACE);
		return expressions;
	}

	// EXPRESSION : INTEGER | CALL | VARIABLE
	Expression EXPRESSION() {
		if (peek(TokenKind.INTEGER_LITERAL)) {
			return INTEGER();
		} else if (peek(TokenKind.IDENTIFIER)) {
			if (peek(TokenKind.OPEN_PAREN, 1)) {
				return CALL();
			} else {
				return VARIABLE();
			}
		} else {
			throw parserException(EnumSet.of(TokenKind.INTEGER_LITERAL, TokenKind.IDENTIFIER));
		}
	}

	// INTEGER : [0-9]+
	IntegerLiteral INTEGER() {
		return new IntegerLiteral(new BigInteger(consume(TokenKind.INTEGER_LITERAL).getText()));
	}

	// CALL : ID ( [ EXPRESSION [ , EXPRESSION ]... ] )
	Call CALL() {
		if (callDepth >= MAX_CALL_DEPTH) {
			Token actual = tokens.get(position);
			throw new ParserException(
					"Calls nested deeper than " + MAX_CALL_DEPTH + " levels",
					actual,
					sourceDescription,
					actual.getLineNumber());
		}
		callDepth++;
		List<Expression> args = new ArrayList<Expression>();
		String name = consume(TokenKind.IDENTIFIER).getText();
		consume(TokenKind.OPEN_PAREN);
		if (!peek(TokenKind.CLOSE_PAREN)) {
			args.add(EXPRESSION());
			while (peek(TokenKind.COMMA)) {
				consume(TokenKind.COMMA);
				args.add(EXPRESSION());
			}
		}
		consume(TokenKind.CLOSE_PAREN);
		callDepth--;
		return new Call(name, args);
	}

	// VARIABLE : ID
	Variable VARIABLE() {
		return new Variable(consume(TokenKind.IDENTIFIER).getText());
	}
	// CHECKSTYLE.ON: MethodName
}
