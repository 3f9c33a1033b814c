package org.metricshub.transpiler;

import static org.junit.Assert.*;

import java.math.BigInteger;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import org.junit.Test;
import org.metricshub.transpiler.frontend.Lexer;
import org.metricshub.transpiler.frontend.Parser;
import org.metricshub.transpiler.frontend.Token;
import org.metricshub.transpiler.frontend.TokenKind;
import org.metricshub.transpiler.frontend.ast.Argument;
import org.metricshub.transpiler.frontend.ast.Call;
import org.metricshub.transpiler.frontend.ast.Expression;
import org.metricshub.transpiler.frontend.ast.FunctionDef;
import org.metricshub.transpiler.frontend.ast.IntegerLiteral;
import org.metricshub.transpiler.frontend.ast.ParserException;
import org.metricshub.transpiler.frontend.ast.Variable;

public class ParserTest {

	private static FunctionDef parse(String source) {
		return new Parser().parse(new Lexer().tokenize(source));
	}

	private static ParserException parseFailure(String source) {
		List<Token> tokens = new Lexer().tokenize(source);
		return assertThrows(ParserException.class, () -> new Parser().parse(tokens, "test.ts"));
	}

	@Test
	public void testCallWithVariables() {
		FunctionDef expected = new FunctionDef(
				"add",
				Arrays.asList(new Argument("x", "int"), new Argument("y", "int")),
				"int",
				Collections.singletonList(new Call("add", Arrays.asList(new Variable("x"), new Variable("y")))));
		assertEquals(expected, parse("function add(x: int, y: int): int { add(x, y); }"));
	}

	@Test
	public void testNoArguments() {
		FunctionDef f = parse("function f(): int { 42; }");
		assertEquals("f", f.getName());
		assertTrue(f.getArgs().isEmpty());
		assertEquals("int", f.getReturnType());
		assertEquals(Collections.singletonList(new IntegerLiteral(42)), f.getBody());
	}

	@Test
	public void testBodyLengthIsNumberOfStatements() {
		assertEquals(1, parse("function f(): int { a; }").getBody().size());
		assertEquals(3, parse("function f(): int { a; 1; g(); }").getBody().size());
		assertEquals(5, parse("function f(): int { a; b; c; d; e; }").getBody().size());
	}

	@Test
	public void testCallVersusVariable() {
		List<Expression> body = parse("function f(): int { g; g(); g(g, g(g(1)), 2); }").getBody();
		assertEquals(new Variable("g"), body.get(0));
		assertEquals(new Call("g", Collections.<Expression>emptyList()), body.get(1));

		Call call = (Call) body.get(2);
		assertEquals(3, call.getArgs().size());
		assertTrue(call.getArgs().get(0) instanceof Variable);
		assertTrue(call.getArgs().get(1) instanceof Call);
		assertTrue(call.getArgs().get(2) instanceof IntegerLiteral);
		Call inner = (Call) ((Call) call.getArgs().get(1)).getArgs().get(0);
		assertEquals("g", inner.getName());
		assertEquals(new IntegerLiteral(1), inner.getArgs().get(0));
	}

	private static String nestedCalls(int depth) {
		StringBuilder source = new StringBuilder("function f(): int { ");
		for (int i = 0; i < depth; i++) {
			source.append("g(");
		}
		source.append("x");
		for (int i = 0; i < depth; i++) {
			source.append(")");
		}
		return source.append("; }").toString();
	}

	@Test
	public void testCallDepthLimit() {
		FunctionDef functionDef = parse(nestedCalls(Parser.MAX_CALL_DEPTH));
		assertTrue(functionDef.getBody().get(0) instanceof Call);

		ParserException e = parseFailure(nestedCalls(Parser.MAX_CALL_DEPTH + 1));
		assertEquals(TokenKind.IDENTIFIER, e.getActual());
		assertEquals("g", e.getActualText());
		assertTrue(e.getExpected().isEmpty());
		assertEquals(
				"Calls nested deeper than " + Parser.MAX_CALL_DEPTH + " levels. Found: identifier (g) (test.ts:1)",
				e.getMessage());
	}

	@Test
	public void testVeryDeepNestingFailsCleanly() {
		StringBuilder source = new StringBuilder("function f(): int { ");
		for (int i = 0; i < 100000; i++) {
			source.append("g(");
		}
		source.append("x; }");
		ParserException e = parseFailure(source.toString());
		assertEquals(1, e.getLineNumber());
	}

	@Test
	public void testDeeplyNestedCalls() {
		StringBuilder source = new StringBuilder("function f(): int { ");
		for (int i = 0; i < 20; i++) {
			source.append("g(");
		}
		source.append("x");
		for (int i = 0; i < 20; i++) {
			source.append(")");
		}
		source.append("; }");

		Expression expression = parse(source.toString()).getBody().get(0);
		for (int i = 0; i < 20; i++) {
			assertTrue(expression instanceof Call);
			expression = ((Call) expression).getArgs().get(0);
		}
		assertEquals(new Variable("x"), expression);
	}

	@Test
	public void testLargeIntegerLiteral() {
		FunctionDef f = parse("function f(): int { 123456789012345678901234567890; 007; }");
		assertEquals(new BigInteger("123456789012345678901234567890"), ((IntegerLiteral) f.getBody().get(0)).getValue());
		assertEquals(new IntegerLiteral(7), f.getBody().get(1));
	}

	@Test
	public void testMissingColon() {
		ParserException e = parseFailure("function f() int { 1; }");
		assertEquals(EnumSet.of(TokenKind.COLON), e.getExpected());
		assertEquals(TokenKind.IDENTIFIER, e.getActual());
		assertEquals("int", e.getActualText());
		assertEquals(1, e.getLineNumber());
		assertEquals("Expecting colon. Found: identifier (int) (test.ts:1)", e.getMessage());
	}

	@Test
	public void testEmptyBody() {
		ParserException e = parseFailure("function f(): int { }");
		assertEquals(EnumSet.of(TokenKind.INTEGER_LITERAL, TokenKind.IDENTIFIER), e.getExpected());
		assertEquals(TokenKind.CLOSE_BRACE, e.getActual());
	}

	@Test
	public void testLastStatementNeedsSemicolon() {
		ParserException e = parseFailure("function f(): int { a; b }");
		assertEquals(EnumSet.of(TokenKind.SEMICOLON), e.getExpected());
		assertEquals(TokenKind.CLOSE_BRACE, e.getActual());
	}

	@Test
	public void testTruncatedInput() {
		ParserException e = parseFailure("function f(): int { a;");
		assertNull(e.getActual());
		assertNull(e.getActualText());
		assertEquals(EnumSet.of(TokenKind.INTEGER_LITERAL, TokenKind.IDENTIFIER), e.getExpected());
		assertTrue(e.getMessage(), e.getMessage().contains("Found: end of input"));

		e = parseFailure("function f(): int { g(1, 2");
		assertNull(e.getActual());
		assertEquals(EnumSet.of(TokenKind.CLOSE_PAREN), e.getExpected());
	}

	@Test
	public void testNoTokens() {
		ParserException e = assertThrows(ParserException.class, () -> new Parser().parse(Collections.<Token>emptyList()));
		assertEquals(EnumSet.of(TokenKind.FUNCTION_KEYWORD), e.getExpected());
		assertNull(e.getActual());
		assertEquals(-1, e.getLineNumber());
		assertEquals("Expecting function-keyword. Found: end of input (<inline-source>)", e.getMessage());
	}

	@Test
	public void testTrailingTokens() {
		ParserException e = parseFailure("function f(): int { 1; } function g(): int { 2; }");
		assertTrue(e.getExpected().isEmpty());
		assertEquals(TokenKind.FUNCTION_KEYWORD, e.getActual());
		assertTrue(e.getMessage(), e.getMessage().startsWith("Expecting end of input."));
	}

	@Test
	public void testTrailingCommaInArguments() {
		ParserException e = parseFailure("function f(x: int,): int { 1; }");
		assertEquals(EnumSet.of(TokenKind.IDENTIFIER), e.getExpected());
		assertEquals(TokenKind.CLOSE_PAREN, e.getActual());
	}

	@Test
	public void testArgumentWithoutType() {
		ParserException e = parseFailure("function f(x): int { 1; }");
		assertEquals(EnumSet.of(TokenKind.COLON), e.getExpected());
		assertEquals(TokenKind.CLOSE_PAREN, e.getActual());
	}

	@Test
	public void testMissingKeyword() {
		ParserException e = parseFailure("f(): int { 1; }");
		assertEquals(EnumSet.of(TokenKind.FUNCTION_KEYWORD), e.getExpected());
		assertEquals(TokenKind.IDENTIFIER, e.getActual());
	}

	@Test
	public void testErrorLineNumber() {
		ParserException e = parseFailure("function f(): int {\n  a;\n  b\n}\n");
		assertEquals(4, e.getLineNumber());
		assertEquals(TokenKind.CLOSE_BRACE, e.getActual());
	}

	@Test
	public void testParserIsReusable() {
		Parser parser = new Parser();
		FunctionDef first = parser.parse(new Lexer().tokenize("function f(): int { 1; }"));
		FunctionDef second = parser.parse(new Lexer().tokenize("function g(a: b): c { a; }"));
		assertEquals("f", first.getName());
		assertEquals("g", second.getName());
		assertEquals(new Argument("a", "b"), second.getArgs().get(0));
	}
}
