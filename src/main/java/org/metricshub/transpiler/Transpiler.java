package org.metricshub.transpiler;

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

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.metricshub.transpiler.backend.CodeGenerator;
import org.metricshub.transpiler.frontend.Lexer;
import org.metricshub.transpiler.frontend.Parser;
import org.metricshub.transpiler.frontend.Token;
import org.metricshub.transpiler.frontend.ast.AstNode;
import org.metricshub.transpiler.frontend.ast.FunctionDef;
import org.metricshub.transpiler.util.SourceText;
import org.metricshub.transpiler.util.TranspilerLogger;
import org.metricshub.transpiler.util.TranspilerSettings;
import org.slf4j.Logger;

/**
 * Entry point into the tokenizing, parsing, and code generation
 * of a function definition.
 * This entry point is used both when the transpiler is executed as a library
 * and when invoked from the command line.
 * <p>
 * The overall process is as follows:
 * <ul>
 * <li>Tokenize the source text, producing a list of tokens.
 * <li>Parse the tokens, producing an abstract syntax tree.
 * <li>Traverse the abstract syntax tree, producing the target code.
 * </ul>
 * Any {@link TranspilerException} raised by a stage aborts the whole
 * translation: no partial output is produced.
 *
 * @see org.metricshub.transpiler.backend.CodeGenerator
 */
public class Transpiler {

	private static final Logger LOG = TranspilerLogger.getLogger(Transpiler.class);

	private final CodeGenerator generator = new CodeGenerator();

	/**
	 * The last tokens produced by {@link #tokenize(String, String)}.
	 */
	private List<Token> lastTokens;

	/**
	 * The last parsed {@link FunctionDef} produced by {@link #parse(List, String)}.
	 */
	private FunctionDef lastAst;

	/**
	 * Returns the tokens of the most recent translation.
	 *
	 * @return the last tokens or {@code null} if nothing was tokenized
	 */
	public List<Token> getLastTokens() {
		return lastTokens;
	}

	/**
	 * Returns the abstract syntax tree of the most recent translation.
	 *
	 * @return the last syntax tree or {@code null} if nothing was parsed
	 */
	public FunctionDef getLastAst() {
		return lastAst;
	}

	/**
	 * Tokenize the specified source text.
	 *
	 * @param source text of a function definition
	 * @return the tokens, in source order
	 */
	public List<Token> tokenize(String source) {
		return tokenize(source, SourceText.DESCRIPTION_INLINE);
	}

	/**
	 * Tokenize the specified source text.
	 *
	 * @param source text of a function definition
	 * @param description description of the source, for diagnostics
	 * @return the tokens, in source order
	 */
	public List<Token> tokenize(String source, String description) {
		List<Token> tokens = new Lexer().tokenize(source, description);
		LOG.debug("{}: {} tokens", description, tokens.size());
		lastTokens = tokens;
		return tokens;
	}

	/**
	 * Parse the specified tokens.
	 *
	 * @param tokens tokens of a function definition
	 * @return the syntax tree
	 */
	public FunctionDef parse(List<Token> tokens) {
		return parse(tokens, SourceText.DESCRIPTION_INLINE);
	}

	/**
	 * Parse the specified tokens.
	 *
	 * @param tokens tokens of a function definition
	 * @param description description of the source, for diagnostics
	 * @return the syntax tree
	 */
	public FunctionDef parse(List<Token> tokens, String description) {
		FunctionDef ast = new Parser().parse(tokens, description);
		LOG.debug("{}: parsed {} with {} argument(s) and {} expression(s)", description, ast, ast.getArgs().size(), ast.getBody().size());
		lastAst = ast;
		return ast;
	}

	/**
	 * Render the specified syntax tree in the target syntax.
	 *
	 * @param node root of the tree to render
	 * @return the generated code
	 */
	public String generate(AstNode node) {
		String code = generator.generate(node);
		LOG.debug("Generated {} characters", code.length());
		return code;
	}

	/**
	 * Translate the specified source text.
	 *
	 * @param source text of a function definition
	 * @return the generated code
	 */
	public String translate(String source) {
		return translate(source, SourceText.DESCRIPTION_INLINE);
	}

	private String translate(String source, String description) {
		return generate(parse(tokenize(source, description), description));
	}

	/**
	 * Translate the text read from the specified reader.
	 *
	 * @param source reader of a function definition
	 * @return the generated code
	 * @throws IOException upon an IO error
	 */
	public String translate(Reader source) throws IOException {
		return translate(new SourceText(SourceText.DESCRIPTION_INLINE, source));
	}

	/**
	 * Translate the specified source.
	 *
	 * @param source a function definition
	 * @return the generated code
	 * @throws IOException upon an IO error
	 */
	public String translate(SourceText source) throws IOException {
		return translate(read(source), source.getDescription());
	}

	/**
	 * Translate the source specified in the settings and print the
	 * generated code to the output stream of the settings, after the
	 * tokens and the syntax tree when the settings ask for them.
	 * <p>
	 * Nothing is printed unless the whole translation succeeds.
	 *
	 * @param settings This tells us where to read the source and where to print
	 * @throws IOException upon an IO error
	 */
	public void invoke(TranspilerSettings settings) throws IOException {
		String output = render(settings);
		PrintStream out = settings.getOutputStream();
		out.print(output);
		out.flush();
	}

	/**
	 * Translate the source specified in the settings and return what
	 * {@link #invoke(TranspilerSettings)} prints: the tokens and the syntax
	 * tree when the settings ask for them, followed by the generated code.
	 *
	 * @param settings This tells us where to read the source and what to dump
	 * @return the complete output of the translation
	 * @throws IOException upon an IO error
	 */
	public String render(TranspilerSettings settings) throws IOException {
		SourceText source = settings.getSource();
		if (LOG.isDebugEnabled()) {
			LOG.debug("Invoking with settings:\n{}", settings.toDescriptionString());
		}
		String description = source.getDescription();

		ByteArrayOutputStream dumps = new ByteArrayOutputStream();
		try (PrintStream dumpStream = new PrintStream(dumps, false, StandardCharsets.UTF_8.name())) {
			List<Token> tokens = tokenize(read(source), description);
			if (settings.isDumpTokens()) {
				for (Token token : tokens) {
					dumpStream.println(token);
				}
			}
			FunctionDef ast = parse(tokens, description);
			if (settings.isDumpSyntaxTree()) {
				ast.dump(dumpStream);
			}
			String code = generate(ast);
			dumpStream.flush();
			return dumps.toString(StandardCharsets.UTF_8.name()) + code;
		}
	}

	/**
	 * Reads the whole content of the specified source and closes its reader.
	 *
	 * @param source the source to read
	 * @return the text of the source
	 * @throws IOException upon an IO error
	 */
	static String read(SourceText source) throws IOException {
		StringBuilder text = new StringBuilder();
		char[] buffer = new char[4096];
		try (Reader reader = source.getReader()) {
			int count;
			while ((count = reader.read(buffer)) >= 0) {
				text.append(buffer, 0, count);
			}
		}
		return text.toString();
	}
}
