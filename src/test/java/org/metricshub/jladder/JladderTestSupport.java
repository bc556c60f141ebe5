package org.metricshub.jladder;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import org.metricshub.jladder.util.JladderSettings;

/**
 * Fluent helpers shared by the translation tests. A test describes a ladder
 * program line by line, then either the exact translated text or the error
 * it must fail with:
 *
 * <pre>
 * JladderTestSupport
 * 		.ladderTest("Period of 20 is accepted")
 * 		.source("TASK&lt;PERIOD=20&gt; t", "ROUTINE Main", "ENDROUTINE", "ENDTASK")
 * 		.expect("TASK PERIOD 20 t", "{", "def Main():", "\tpass", "Main()", "}")
 * 		.build()
 * 		.runAndAssert();
 * </pre>
 */
public final class JladderTestSupport {

	private JladderTestSupport() {}

	/**
	 * Creates a builder for a test that runs {@link Jladder#translate(String)}.
	 *
	 * @param description human readable description used in assertion messages
	 * @return a builder configured with the provided description
	 */
	public static LadderTestBuilder ladderTest(String description) {
		return new LadderTestBuilder(description);
	}

	/**
	 * Joins lines, terminating each one with a newline.
	 *
	 * @param lines the lines
	 * @return the joined text
	 */
	public static String lines(String... lines) {
		StringBuilder text = new StringBuilder();
		for (String line : lines) {
			text.append(line).append('\n');
		}
		return text.toString();
	}

	/**
	 * Wraps rung statements into a continuous task with a single Main
	 * routine and a single anonymous rung.
	 *
	 * @param rungLines the statements of the rung
	 * @return the statements of the complete task
	 */
	public static String[] inMainRung(String... rungLines) {
		String[] result = new String[rungLines.length + 6];
		result[0] = "TASK<CONTINUOUS> task";
		result[1] = "ROUTINE Main";
		result[2] = "RUNG";
		System.arraycopy(rungLines, 0, result, 3, rungLines.length);
		result[rungLines.length + 3] = "ENDRUNG";
		result[rungLines.length + 4] = "ENDROUTINE";
		result[rungLines.length + 5] = "ENDTASK";
		return result;
	}

	/**
	 * Collects the program, settings and expectations of one test.
	 */
	public static final class LadderTestBuilder {
		private final String description;
		private String source = "";
		private String expectedOutput;
		private ErrorKind expectedKind;
		private String expectedMessage;
		private JladderSettings settings = new JladderSettings();

		private LadderTestBuilder(String description) {
			this.description = description;
		}

		public LadderTestBuilder source(String... sourceLines) {
			this.source = lines(sourceLines);
			return this;
		}

		public LadderTestBuilder expect(String... outputLines) {
			this.expectedOutput = lines(outputLines);
			return this;
		}

		/**
		 * @param kind the expected category
		 * @param messageFragment text the error message must contain
		 * @return this builder
		 */
		public LadderTestBuilder expectError(ErrorKind kind, String messageFragment) {
			this.expectedKind = kind;
			this.expectedMessage = messageFragment;
			return this;
		}

		public LadderTestBuilder settings(JladderSettings newSettings) {
			this.settings = newSettings;
			return this;
		}

		public ConfiguredTest build() {
			return new ConfiguredTest(this);
		}
	}

	/**
	 * A fully configured test case.
	 */
	public static final class ConfiguredTest {
		private final String description;
		private final String source;
		private final String expectedOutput;
		private final ErrorKind expectedKind;
		private final String expectedMessage;
		private final JladderSettings settings;

		private ConfiguredTest(LadderTestBuilder builder) {
			this.description = builder.description;
			this.source = builder.source;
			this.expectedOutput = builder.expectedOutput;
			this.expectedKind = builder.expectedKind;
			this.expectedMessage = builder.expectedMessage;
			this.settings = builder.settings;
		}

		/**
		 * Translates the program and returns the result without asserting it.
		 *
		 * @return the translated program
		 * @throws Exception when the translation fails
		 */
		public String run() throws Exception {
			return new Jladder(settings).translate(source);
		}

		/**
		 * Translates the program and checks the configured expectation.
		 *
		 * @throws Exception when the translation fails unexpectedly
		 */
		public void runAndAssert() throws Exception {
			if (expectedKind != null) {
				TranslationException e = assertThrows(description, TranslationException.class, this::run);
				assertEquals(description + ": " + e.getMessage(), expectedKind, e.getKind());
				assertTrue(
						description + ": \"" + e.getMessage() + "\" should contain \"" + expectedMessage + "\"",
						e.getMessage().contains(expectedMessage));
			} else if (expectedOutput != null) {
				assertEquals(description, expectedOutput, run());
			} else {
				run();
			}
		}
	}
}
