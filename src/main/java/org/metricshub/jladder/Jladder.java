package org.metricshub.jladder;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Jladder
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
import java.io.IOException;
import java.io.Reader;
import java.io.StringReader;
import java.util.List;
import org.metricshub.jladder.frontend.LadderLexer;
import org.metricshub.jladder.frontend.LadderParser;
import org.metricshub.jladder.frontend.Token;
import org.metricshub.jladder.util.FileSink;
import org.metricshub.jladder.util.JladderLogger;
import org.metricshub.jladder.util.JladderSettings;
import org.metricshub.jladder.util.ScriptFileSource;
import org.metricshub.jladder.util.ScriptSource;
import org.metricshub.jladder.util.Sink;
import org.slf4j.Logger;

/**
 * Entry point into the translation of a ladder program.
 * This entry point is used both when Jladder is used as a library and when
 * invoked from the command line.
 * <p>
 * The translation reads the whole source, then parses, checks and renders
 * it in a single pass. The result is written to a {@link Sink} only when
 * the whole program is valid:
 *
 * <pre>
 * String program = new Jladder().translate(source);
 * </pre>
 *
 * @see LadderParser
 */
public class Jladder {

	private static final Logger LOG = JladderLogger.getLogger(Jladder.class);

	private final JladderSettings settings;

	/**
	 * Create a new instance of Jladder with the default settings.
	 */
	public Jladder() {
		this(new JladderSettings());
	}

	/**
	 * @param settings limits and file names to use
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Jladder(JladderSettings settings) {
		this.settings = settings;
	}

	/**
	 * Translates a program held in a string.
	 *
	 * @param source the ladder program
	 * @return the translated program
	 * @throws TranslationException if the program is invalid
	 * @throws IOException never in practice, as nothing is written to storage
	 */
	public String translate(String source) throws IOException {
		return translate(new StringReader(source));
	}

	/**
	 * Translates a program read from a {@link Reader}, which is closed
	 * afterwards.
	 *
	 * @param source the ladder program
	 * @return the translated program
	 * @throws TranslationException if the program is invalid
	 * @throws IOException if the reader fails
	 */
	public String translate(Reader source) throws IOException {
		Sink sink = new Sink();
		translate(new ScriptSource(ScriptSource.DESCRIPTION_IN_MEMORY, source), sink);
		return sink.getText();
	}

	/**
	 * Translates a program into the given sink, which is flushed on success.
	 *
	 * @param source the ladder program
	 * @param sink destination of the translated program
	 * @throws TranslationException if the program is invalid
	 * @throws IOException if the source cannot be read or the sink cannot be flushed
	 */
	public void translate(ScriptSource source, Sink sink) throws IOException {
		LOG.debug("Translating {} into {}", source, sink);
		String sourceCode = source.readText();
		LadderParser parser = new LadderParser(new LadderLexer(sourceCode), sink, settings);
		parser.translate();
		LOG.debug("Translated {} ({} characters)", source, sink.getText().length());
	}

	/**
	 * Translates the source file named in the settings into the configured
	 * output file.
	 *
	 * @throws TranslationException if the program is invalid
	 * @throws IOException if a file cannot be read or written
	 */
	public void invoke() throws IOException {
		if (settings.getSourceFile() == null) {
			throw new IllegalArgumentException("No source file configured");
		}
		if (LOG.isDebugEnabled()) {
			LOG.debug("Settings:\n{}", settings.toDescriptionString());
		}
		translate(new ScriptFileSource(settings.getSourceFile()), new FileSink(settings.getOutputFilename()));
	}

	/**
	 * Splits a program into tokens without parsing it.
	 *
	 * @param source the ladder program
	 * @return every token, ending with the end-of-input token
	 * @throws TranslationException on the first lexical error
	 * @throws IOException if the source cannot be read
	 */
	public List<Token> tokenize(ScriptSource source) throws IOException {
		return new LadderLexer(source.readText()).tokenize();
	}
}
