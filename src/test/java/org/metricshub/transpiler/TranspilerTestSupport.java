package org.metricshub.transpiler;

import static org.junit.Assert.assertEquals;

import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

/**
 * Reusable helpers for building and executing transpiler tests. The class
 * exposes a fluent builder ({@link #cliTest(String)}) that lets tests describe
 * the source, the command line, and the expectations declaratively before
 * running the {@link Cli} and asserting the results.
 */
public final class TranspilerTestSupport {

	private static final Path SHARED_TEMP_DIR;

	static {
		try {
			SHARED_TEMP_DIR = Files.createTempDirectory("transpiler-shared");
			SHARED_TEMP_DIR.toFile().deleteOnExit();
		} catch (IOException ex) {
			throw new ExceptionInInitializerError(ex);
		}
	}

	private TranspilerTestSupport() {}

	/**
	 * Creates a builder for a unit test that exercises the {@link Cli} entry
	 * point.
	 *
	 * @param description human readable description used in assertion messages
	 * @return a builder configured with the provided description
	 */
	public static CliTestBuilder cliTest(String description) {
		return new CliTestBuilder(description);
	}

	/**
	 * Reads a test resource located next to this class.
	 *
	 * @param resource name of the resource
	 * @return its content, decoded as UTF-8
	 * @throws IOException if the resource does not exist
	 */
	public static String resource(String resource) throws IOException {
		try (InputStream stream = TranspilerTestSupport.class.getResourceAsStream(resource)) {
			if (stream == null) {
				throw new IOException("Resource not found: " + resource);
			}
			return new String(stream.readAllBytes(), StandardCharsets.UTF_8);
		}
	}

	/**
	 * Writes the specified content in a new file of the shared temporary
	 * directory.
	 *
	 * @param content text of the file
	 * @return the path of the file
	 */
	public static Path writeTempFile(String content) {
		try {
			Path file = Files.createTempFile(SHARED_TEMP_DIR, "source", ".ts");
			file.toFile().deleteOnExit();
			Files.write(file, content.getBytes(StandardCharsets.UTF_8));
			return file;
		} catch (IOException ex) {
			throw new UncheckedIOException(ex);
		}
	}

	/**
	 * Captures the outcome of a CLI execution: exit status, standard output
	 * and standard error, along with the expectations of the builder.
	 */
	public static final class TestResult {

		private final String description;
		private final int exitCode;
		private final String output;
		private final String error;
		private final Integer expectedExitCode;
		private final String expectedOutput;

		private TestResult(
				String description,
				int exitCode,
				String output,
				String error,
				Integer expectedExitCode,
				String expectedOutput) {
			this.description = description;
			this.exitCode = exitCode;
			this.output = output;
			this.error = error;
			this.expectedExitCode = expectedExitCode;
			this.expectedOutput = expectedOutput;
		}

		public int exitCode() {
			return exitCode;
		}

		public String output() {
			return output;
		}

		public String error() {
			return error;
		}

		/**
		 * Asserts the recorded exit status and output against the
		 * expectations of the builder.
		 */
		public void assertExpected() {
			if (expectedExitCode != null) {
				assertEquals(description + " (exit code, stderr: " + error + ")", expectedExitCode.intValue(), exitCode);
			}
			if (expectedOutput != null) {
				assertEquals(description, expectedOutput, output);
			}
		}
	}

	/**
	 * Builder describing one execution of the {@link Cli}.
	 */
	public static final class CliTestBuilder {

		private final String description;
		private final List<String> args = new ArrayList<String>();
		private String source;
		private Integer expectedExitCode = Integer.valueOf(0);
		private String expectedOutput;

		private CliTestBuilder(String description) {
			this.description = description;
		}

		/**
		 * Source written to a temporary file, whose path is appended to the
		 * command line.
		 *
		 * @param sourceText text of the function definition
		 * @return this builder
		 */
		public CliTestBuilder source(String sourceText) {
			this.source = sourceText;
			return this;
		}

		public CliTestBuilder args(String... arguments) {
			args.addAll(Arrays.asList(arguments));
			return this;
		}

		public CliTestBuilder expect(String output) {
			this.expectedOutput = output;
			return this;
		}

		public CliTestBuilder expectExit(int exitCode) {
			this.expectedExitCode = Integer.valueOf(exitCode);
			return this;
		}

		/**
		 * Runs the CLI and captures its result, without asserting it.
		 *
		 * @return the captured result
		 * @throws IOException when the output cannot be decoded
		 */
		public TestResult run() throws IOException {
			List<String> commandLine = new ArrayList<String>(args);
			if (source != null) {
				commandLine.add(writeTempFile(source).toString());
			}
			ByteArrayOutputStream outBytes = new ByteArrayOutputStream();
			ByteArrayOutputStream errBytes = new ByteArrayOutputStream();
			int exitCode;
			try (PrintStream out = new PrintStream(outBytes, true, StandardCharsets.UTF_8.name());
					PrintStream err = new PrintStream(errBytes, true, StandardCharsets.UTF_8.name())) {
				exitCode = Cli.execute(commandLine.toArray(new String[0]), out, err);
			}
			return new TestResult(
					description,
					exitCode,
					outBytes.toString(StandardCharsets.UTF_8.name()),
					errBytes.toString(StandardCharsets.UTF_8.name()),
					expectedExitCode,
					expectedOutput);
		}

		/**
		 * Runs the CLI and asserts the result.
		 *
		 * @return the captured result, for further assertions
		 * @throws IOException when the output cannot be decoded
		 */
		public TestResult runAndAssert() throws IOException {
			TestResult result = run();
			result.assertExpected();
			return result;
		}
	}
}
