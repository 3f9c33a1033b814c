package org.metricshub.transpiler;

import static org.junit.Assert.*;

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.junit.Test;
import org.metricshub.transpiler.backend.CodeGenerator;
import org.metricshub.transpiler.backend.GeneratorException;
import org.metricshub.transpiler.frontend.ast.Argument;
import org.metricshub.transpiler.frontend.ast.Call;
import org.metricshub.transpiler.frontend.ast.Expression;
import org.metricshub.transpiler.frontend.ast.FunctionDef;
import org.metricshub.transpiler.frontend.ast.IntegerLiteral;
import org.metricshub.transpiler.frontend.ast.Variable;

public class CodeGeneratorTest {

	private static final CodeGenerator GENERATOR = new CodeGenerator();

	private static FunctionDef addFunction() {
		return new FunctionDef(
				"add",
				Arrays.asList(new Argument("x", "int"), new Argument("y", "int")),
				"int",
				Collections.singletonList(new Call("add", Arrays.asList(new Variable("x"), new Variable("y")))));
	}

	@Test
	public void testFunctionDef() {
		assertEquals("int add(int x, int y){\n\tadd(x,y);\n}", GENERATOR.generate(addFunction()));
	}

	@Test
	public void testSingleInteger() {
		FunctionDef f = new FunctionDef("f", Collections.<Argument>emptyList(), "int", Collections.singletonList(new IntegerLiteral(42)));
		assertEquals("int f(){\n\t42;\n}", GENERATOR.generate(f));
	}

	@Test
	public void testStatementsShareOneLine() {
		List<Expression> body = Arrays.asList(new Variable("a"), new IntegerLiteral(1), new Call("g", Collections.<Expression>emptyList()));
		FunctionDef f = new FunctionDef("f", Collections.singletonList(new Argument("a", "long")), "void", body);
		assertEquals("void f(long a){\n\ta;1;g();\n}", GENERATOR.generate(f));
	}

	@Test
	public void testEachNodeKind() {
		assertEquals("string name", GENERATOR.generate(new Argument("name", "string")));
		assertEquals("g()", GENERATOR.generate(new Call("g", Collections.<Expression>emptyList())));
		assertEquals(
				"g(1,h(x),y)",
				GENERATOR
						.generate(
								new Call(
										"g",
										Arrays
												.asList(
														new IntegerLiteral(1),
														new Call("h", Collections.singletonList(new Variable("x"))),
														new Variable("y")))));
		assertEquals("counter", GENERATOR.generate(new Variable("counter")));
		assertEquals("0", GENERATOR.generate(new IntegerLiteral(0)));
	}

	@Test
	public void testSeparatorCounts() {
		for (int n = 0; n <= 4; n++) {
			for (int m = 1; m <= 4; m++) {
				Argument[] args = new Argument[n];
				for (int i = 0; i < n; i++) {
					args[i] = new Argument("a", "t");
				}
				Expression[] body = new Expression[m];
				for (int i = 0; i < m; i++) {
					body[i] = new Variable("v");
				}
				String code = GENERATOR.generate(new FunctionDef("f", Arrays.asList(args), "t", Arrays.asList(body)));
				assertEquals(code, 1, count(code, "{"));
				assertEquals(code, 1, count(code, "}"));
				assertEquals(code, Math.max(0, n - 1), count(code, ", "));
				assertEquals(code, m, count(code, ";"));
				assertTrue(code, code.endsWith(";\n}"));
			}
		}
	}

	private static int count(String text, String fragment) {
		int count = 0;
		int index = text.indexOf(fragment);
		while (index >= 0) {
			count++;
			index = text.indexOf(fragment, index + fragment.length());
		}
		return count;
	}

	@Test
	public void testDeterministic() {
		assertEquals(GENERATOR.generate(addFunction()), GENERATOR.generate(addFunction()));
		assertEquals(GENERATOR.generate(addFunction()), new CodeGenerator().generate(addFunction()));
	}

	@Test
	public void testNullNode() {
		assertThrows(GeneratorException.class, () -> GENERATOR.generate(null));
	}

	@Test
	public void testNullNestedNode() {
		FunctionDef f = new FunctionDef(
				"f",
				Collections.<Argument>emptyList(),
				"int",
				Collections.singletonList(new Call("g", Arrays.asList(new Variable("x"), (Expression) null))));
		GeneratorException e = assertThrows(GeneratorException.class, () -> GENERATOR.generate(f));
		assertEquals(-1, e.getLineNumber());
	}
}
