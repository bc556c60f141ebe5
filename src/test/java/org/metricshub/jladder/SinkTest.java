package org.metricshub.jladder;

import static org.junit.Assert.*;

import java.io.File;
import java.io.IOException;
import java.io.StringReader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.metricshub.jladder.util.FileSink;
import org.metricshub.jladder.util.ScriptSource;
import org.metricshub.jladder.util.Sink;

public class SinkTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	@Test
	public void testAppend() throws Exception {
		Sink sink = new Sink();
		sink.append("TAG ");
		sink.append("a");
		sink.appendLine(" TRUE");

		assertEquals("TAG a TRUE\n", sink.getText());
		assertFalse(sink.isFlushed());
		sink.flush();
		assertTrue(sink.isFlushed());
	}

	@Test
	public void testFileSinkWritesOnFlushOnly() throws Exception {
		File output = new File(folder.getRoot(), "out.txt");
		FileSink sink = new FileSink(output.getAbsolutePath());
		sink.appendLine("TAG a TRUE");

		assertFalse("Nothing is written before flush", output.exists());
		sink.flush();

		assertTrue(sink.isFlushed());
		assertEquals("TAG a TRUE\n", new String(Files.readAllBytes(output.toPath()), StandardCharsets.UTF_8));
	}

	@Test
	public void testFileSinkUnwritableDestination() {
		File output = new File(new File(folder.getRoot(), "missing-dir"), "out.txt");
		FileSink sink = new FileSink(output.toPath());
		sink.appendLine("x");

		IOException e = assertThrows(IOException.class, sink::flush);
		assertTrue(e.getMessage().startsWith("Couldn't write to "));
		assertFalse(sink.isFlushed());
	}

	@Test
	public void testTranslateIntoFileSink() throws Exception {
		File output = new File(folder.getRoot(), "Program.out");
		FileSink sink = new FileSink(output.toPath());

		new Jladder().translate(new ScriptSource("inline", new StringReader("TAG[3] arr = TRUE\n")), sink);

		assertEquals("TAG_ARRAY 3 arr TRUE\n", new String(Files.readAllBytes(output.toPath()), StandardCharsets.UTF_8));
	}

	@Test
	public void testScriptSourceReadText() throws Exception {
		ScriptSource source = new ScriptSource("inline", new StringReader("RUNG\nENDRUNG\n"));

		assertEquals("inline", source.toString());
		assertEquals("RUNG\nENDRUNG\n", source.readText());
	}
}
