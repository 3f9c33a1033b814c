package org.metricshub.transpiler.util;

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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.PrintStream;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;

/**
 * A simple container for the parameters of a single translation.
 * These values have defaults.
 * These defaults may be changed through command line arguments,
 * or when invoking the transpiler programmatically, from within Java code.
 */
public class TranspilerSettings {

	/**
	 * Path of the source file read when nothing else is specified.
	 */
	public static final String DEFAULT_SOURCE_PATH = "program.ts";

	/**
	 * Path of the source file to translate;
	 * {@value #DEFAULT_SOURCE_PATH} by default.
	 */
	private String sourcePath = DEFAULT_SOURCE_PATH;

	/**
	 * Source to translate, overriding {@link #sourcePath} when set.
	 */
	private SourceText source = null;

	/**
	 * Encoding of the source file; UTF-8 by default.
	 */
	private Charset charset = StandardCharsets.UTF_8;

	/**
	 * Output stream;
	 * <code>System.out</code> by default,
	 * which means we will print to stdout by default
	 */
	private PrintStream outputStream = System.out;

	/**
	 * Whether to print the tokens before the generated code.
	 */
	private boolean dumpTokens = false;

	/**
	 * Whether to print the syntax tree before the generated code.
	 */
	private boolean dumpSyntaxTree = false;

	/**
	 * <p>
	 * toDescriptionString.
	 * </p>
	 *
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("source = ").append(getSource().getDescription()).append(newLine);
		desc.append("charset = ").append(getCharset()).append(newLine);
		desc.append("dumpTokens = ").append(isDumpTokens()).append(newLine);
		desc.append("dumpSyntaxTree = ").append(isDumpSyntaxTree()).append(newLine);

		return desc.toString();
	}

	/**
	 * @return the path of the source file
	 */
	public String getSourcePath() {
		return sourcePath;
	}

	/**
	 * @param sourcePath path of the source file to translate
	 */
	public void setSourcePath(String sourcePath) {
		this.sourcePath = sourcePath;
	}

	/**
	 * Returns the source to translate: the one set with
	 * {@link #setSource(SourceText)} if any, otherwise the file
	 * at {@link #getSourcePath()}.
	 *
	 * @return the source to translate
	 */
	public SourceText getSource() {
		if (source != null) {
			return source;
		}
		return new SourceFile(sourcePath, charset);
	}

	/**
	 * @param source the source to translate, instead of {@link #getSourcePath()}
	 */
	public void setSource(SourceText source) {
		this.source = source;
	}

	/**
	 * @return the encoding of the source file
	 */
	public Charset getCharset() {
		return charset;
	}

	/**
	 * @param charset encoding of the source file
	 */
	public void setCharset(Charset charset) {
		this.charset = charset;
	}

	/**
	 * Output stream;
	 * <code>System.out</code> by default,
	 * which means we will print to stdout by default
	 *
	 * @return the output stream
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP", justification = "OutputStream reference is intentionally shared so callers can control output.")
	public PrintStream getOutputStream() {
		return outputStream;
	}

	/**
	 * Sets the OutputStream to print to (stdout by default)
	 *
	 * @param pOutputStream the new OutputStream
	 */
	@SuppressFBWarnings(value = "EI_EXPOSE_REP2", justification = "Caller-supplied PrintStream must be used directly; no defensive copy possible.")
	public void setOutputStream(PrintStream pOutputStream) {
		outputStream = pOutputStream;
	}

	/**
	 * @return {@code true} to print the tokens
	 */
	public boolean isDumpTokens() {
		return dumpTokens;
	}

	/**
	 * @param dumpTokens whether to print the tokens
	 */
	public void setDumpTokens(boolean dumpTokens) {
		this.dumpTokens = dumpTokens;
	}

	/**
	 * @return {@code true} to print the syntax tree
	 */
	public boolean isDumpSyntaxTree() {
		return dumpSyntaxTree;
	}

	/**
	 * @param dumpSyntaxTree whether to print the syntax tree
	 */
	public void setDumpSyntaxTree(boolean dumpSyntaxTree) {
		this.dumpSyntaxTree = dumpSyntaxTree;
	}
}
