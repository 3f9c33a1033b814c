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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.Charset;
import java.nio.charset.IllegalCharsetNameException;
import java.nio.charset.StandardCharsets;
import java.nio.charset.UnsupportedCharsetException;
import java.nio.file.Files;
import org.metricshub.transpiler.util.TranspilerSettings;

/**
 * Command-line interface for the transpiler.
 * <p>
 * Without any argument, the function definition is read from
 * {@value TranspilerSettings#DEFAULT_SOURCE_PATH} in the current directory
 * and the generated code is printed on the standard output.
 */
public final class Cli {

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "transpiler.jar";
		}
		JAR_NAME = myName;
	}

	private final TranspilerSettings settings = new TranspilerSettings();
	private final PrintStream out;

	private File outputFile;
	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard output stream.
	 */
	public Cli() {
		this(System.out);
	}

	/**
	 * Creates a CLI instance using the supplied stream.
	 *
	 * @param out stream where the generated code is written
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(PrintStream out) {
		this.out = out;
		settings.setOutputStream(out);
	}

	/**
	 * Returns the mutable {@link TranspilerSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public TranspilerSettings getSettings() {
		return settings;
	}

	/**
	 * Returns the file specified with <code>-o</code>, if any.
	 *
	 * @return the output file or {@code null} to print on the output stream
	 */
	public File getOutputFile() {
		return outputFile;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 */
	public void parse(String[] args) {

		String sourcePath = null;

		// Parse the arguments
		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.charAt(0) != '-') {
				// input-filename
				if (sourcePath != null) {
					throw new IllegalArgumentException("Only one input file can be translated: " + arg);
				}
				sourcePath = arg;
			} else if (arg.equals("-f")) {
				// -f filename : read the function definition from file
				checkParameterHasArgument(args, argIdx);
				if (sourcePath != null) {
					throw new IllegalArgumentException("Only one input file can be translated: " + args[argIdx + 1]);
				}
				sourcePath = args[++argIdx];
			} else if (arg.equals("-o")) {
				// -o filename : write the generated code to file
				checkParameterHasArgument(args, argIdx);
				outputFile = new File(args[++argIdx]);
			} else if (arg.equals("--charset")) {
				// --charset name : encoding of the input file
				checkParameterHasArgument(args, argIdx);
				settings.setCharset(toCharset(args[++argIdx]));
			} else if (arg.equals("--dump-tokens")) {
				// --dump-tokens : print the tokens
				settings.setDumpTokens(true);
			} else if (arg.equals("--dump-syntax")) {
				// --dump-syntax : print the syntax tree
				settings.setDumpSyntaxTree(true);
			} else if (arg.equals("-h") || arg.equals("-?")) {
				// -h/-? : display usage information and exit
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			}
			++argIdx;
		}

		if (sourcePath != null) {
			settings.setSourcePath(sourcePath);
		}
	}

	/**
	 * Ensures that the current command-line option is followed by a value.
	 *
	 * @param args full array of arguments
	 * @param argIdx index of the option that requires a value
	 */
	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Need additional argument for " + args[argIdx]);
		}
	}

	private static Charset toCharset(String name) {
		try {
			return Charset.forName(name);
		} catch (IllegalCharsetNameException | UnsupportedCharsetException ex) {
			throw new IllegalArgumentException("Unsupported charset '" + name + "'", ex);
		}
	}

	/**
	 * Executes the CLI based on the previously parsed arguments.
	 *
	 * @throws IOException if the input cannot be read or the output cannot be written
	 */
	public void run() throws IOException {
		if (printUsage) {
			usage(out);
			return;
		}
		Transpiler transpiler = new Transpiler();
		if (outputFile == null) {
			transpiler.invoke(settings);
			return;
		}
		// The file is only created or replaced once the translation succeeded
		String output = transpiler.render(settings);
		Files.write(outputFile.toPath(), output.getBytes(StandardCharsets.UTF_8));
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	private static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest
				.println(
						"java -jar " +
								JAR_NAME +
								" [-f input-filename | input-filename]" +
								" [-o output-filename]" +
								" [--charset name]" +
								" [--dump-tokens]" +
								" [--dump-syntax]");
		dest.println();
		dest.println(" input-filename = Translate the function defined in this file.");
		dest.println(" -f filename = Same as input-filename.");
		dest.println("                      Defaults to " + TranspilerSettings.DEFAULT_SOURCE_PATH + " in the current directory.");
		dest.println(" -o filename = Write the generated code to filename instead of the standard output.");
		dest.println(" --charset name = Encoding of the input file (UTF-8 by default).");
		dest.println(" --dump-tokens = Print the tokens before the generated code.");
		dest.println(" --dump-syntax = Print the syntax tree before the generated code.");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	/**
	 * Parses command-line arguments into a new {@link Cli} instance without
	 * executing it.
	 *
	 * @param args command-line arguments
	 * @return configured CLI instance
	 */
	public static Cli parseCommandLineArguments(String[] args) {
		Cli cli = new Cli();
		cli.parse(args);
		return cli;
	}

	/**
	 * Parses the arguments, executes the CLI, and reports any failure on the
	 * error stream.
	 *
	 * @param args command-line arguments
	 * @param out stream for the generated code
	 * @param err stream for diagnostic messages
	 * @return the exit status: 0 on success, 1 on failure
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	public static int execute(String[] args, PrintStream out, PrintStream err) {
		try {
			Cli cli = new Cli(out);
			cli.parse(args);
			cli.run();
			return 0;
		} catch (TranspilerException e) {
			// lexer and parser messages already end with the source and line
			err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			return 1;
		} catch (IllegalArgumentException e) {
			err.println("Failed to parse arguments. Please see the help/usage output (cmd line switch '-h').");
			e.printStackTrace(err);
			return 1;
		} catch (Exception e) {
			err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			return 1;
		}
	}

	/**
	 * Entry point for the command-line interface.
	 *
	 * @param args command-line arguments
	 */
	public static void main(String[] args) {
		int status = execute(args, System.out, System.err);
		if (status != 0) {
			System.exit(status);
		}
	}
}
