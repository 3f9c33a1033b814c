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

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.Charset;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Paths;

/**
 * Represents one source file. Each call to {@link #getReader()} opens
 * the file again, so the same instance can be read several times.
 */
public class SourceFile extends SourceText {

	private final String filePath;
	private final Charset charset;

	/**
	 * Creates a source reading the given file as UTF-8.
	 *
	 * @param filePath path of the file to read
	 */
	public SourceFile(String filePath) {
		this(filePath, StandardCharsets.UTF_8);
	}

	/**
	 * Creates a source reading the given file with the given charset.
	 *
	 * @param filePath path of the file to read
	 * @param charset encoding of the file
	 */
	public SourceFile(String filePath, Charset charset) {
		super(filePath, null);
		this.filePath = filePath;
		this.charset = charset;
	}

	/**
	 * <p>
	 * Getter for the field <code>filePath</code>.
	 * </p>
	 *
	 * @return a {@link java.lang.String} object
	 */
	public String getFilePath() {
		return filePath;
	}

	/**
	 * @return the charset used to decode the file
	 */
	public Charset getCharset() {
		return charset;
	}

	/**
	 * Opens a new reader on the file. The caller closes it.
	 *
	 * @return a new reader of the file
	 * @throws IOException when the file cannot be opened
	 */
	@Override
	public Reader getReader() throws IOException {
		return Files.newBufferedReader(Paths.get(filePath), charset);
	}
}
