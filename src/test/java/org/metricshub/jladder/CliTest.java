package org.metricshub.jladder;

import static org.junit.Assert.*;
import static org.metricshub.jladder.JladderTestSupport.lines;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;

public class CliTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	private File writeProgram(String... programLines) throws IOException {
		File source = folder.newFile("program.ladder");
		Files.write(source.toPath(), lines(programLines).getBytes(StandardCharsets.UTF_8));
		return source;
	}

	private static PrintStream printStream(ByteArrayOutputStream out) throws IOException {
		return new PrintStream(out, true, StandardCharsets.UTF_8.name());
	}

	@Test
	public void testTranslateFile() throws Exception {
		File source = writeProgram("TASK<PERIOD=50> t", "ROUTINE Main", "ENDROUTINE", "ENDTASK");
		File output = new File(folder.getRoot(), "program.out");

		Cli.create(new String[] { "-s", source.getAbsolutePath(), "-o", output.getAbsolutePath() }, System.out);

		assertEquals(
				"TASK PERIOD 50 t\n{\ndef Main():\n\tpass\nMain()\n}\n",
				new String(Files.readAllBytes(output.toPath()), StandardCharsets.UTF_8));
	}

	@Test
	public void testSettingsFromOptions() throws Exception {
		Cli cli = new Cli();
		cli
				.parse(
						new String[] {
								"--source-file",
								"in.ladder",
								"--out",
								"out.txt",
								"--min-period",
								"5",
								"--max-tag-length",
								"12",
								"--dump-tokens" });

		assertEquals("in.ladder", cli.getSettings().getSourceFile());
		assertEquals("out.txt", cli.getSettings().getOutputFilename());
		assertEquals(5, cli.getSettings().getMinimumPeriod());
		assertEquals(12, cli.getSettings().getMaximumTagNameLength());
		assertTrue(cli.getSettings().isDumpTokens());
		assertFalse(cli.isPrintUsage());
	}

	@Test
	public void testDefaults() {
		Cli cli = new Cli();
		cli.parse(new String[] { "-s", "in.ladder" });

		assertEquals("Program.out", cli.getSettings().getOutputFilename());
		assertEquals(20, cli.getSettings().getMinimumPeriod());
		assertEquals(7, cli.getSettings().getMaximumTagNameLength());
		assertFalse(cli.getSettings().isDumpTokens());
	}

	@Test
	public void testDumpTokens() throws Exception {
		File source = writeProgram("TAG a = TRUE");
		ByteArrayOutputStream out = new ByteArrayOutputStream();

		Cli.create(new String[] { "-s", source.getAbsolutePath(), "--dump-tokens" }, printStream(out));

		String[] dumped = out.toString(StandardCharsets.UTF_8.name()).split("\\R");
		assertArrayEquals(
				new String[] { "KW_TAG (TAG)", "IDENTIFIER (a)", "EQ (=)", "KW_TRUE (TRUE)", "NEWLINE", "NEWLINE", "EOF ()" },
				dumped);
	}

	@Test
	public void testUsage() throws Exception {
		ByteArrayOutputStream out = new ByteArrayOutputStream();

		Cli cli = Cli.create(new String[] { "-h" }, printStream(out));

		assertTrue(cli.isPrintUsage());
		assertTrue(out.toString(StandardCharsets.UTF_8.name()).startsWith("Usage:"));
	}

	@Test
	public void testNoArgumentsPrintsUsage() throws Exception {
		ByteArrayOutputStream out = new ByteArrayOutputStream();

		Cli.create(new String[0], printStream(out));

		assertTrue(out.toString(StandardCharsets.UTF_8.name()).contains("--source-file"));
	}

	@Test
	public void testMissingSourceFile() {
		IllegalArgumentException e = assertThrows(
				IllegalArgumentException.class,
				() -> new Cli().parse(new String[] { "-o", "out.txt" }));
		assertEquals("Source file not provided.", e.getMessage());
	}

	@Test
	public void testMissingOptionValue() {
		assertThrows(IllegalArgumentException.class, () -> new Cli().parse(new String[] { "-s" }));
	}

	@Test
	public void testUnknownParameter() {
		IllegalArgumentException e = assertThrows(
				IllegalArgumentException.class,
				() -> new Cli().parse(new String[] { "-s", "in.ladder", "--verbose" }));
		assertEquals("Unknown parameter: --verbose", e.getMessage());
	}

	@Test
	public void testNonNumericLimit() {
		assertThrows(
				IllegalArgumentException.class,
				() -> new Cli().parse(new String[] { "-s", "in.ladder", "--min-period", "fast" }));
	}

	@Test
	public void testInvalidProgramWritesNothing() throws Exception {
		File source = writeProgram("TASK<PERIOD=10> t", "ROUTINE Main", "ENDROUTINE", "ENDTASK");
		File output = new File(folder.getRoot(), "program.out");

		TranslationException e = assertThrows(
				TranslationException.class,
				() -> Cli.create(new String[] { "-s", source.getAbsolutePath(), "-o", output.getAbsolutePath() }, System.out));
		assertEquals(ErrorKind.CONSTRAINT, e.getKind());
		assertEquals(1, e.getLineNumber());
		assertFalse(output.exists());
	}

	@Test
	public void testMissingSourceFileOnDisk() {
		File source = new File(folder.getRoot(), "absent.ladder");

		IOException e = assertThrows(
				IOException.class,
				() -> Cli.create(new String[] { "-s", source.getAbsolutePath() }, System.out));
		assertTrue(e.getMessage().startsWith("Source file doesn't exist"));
	}
}
