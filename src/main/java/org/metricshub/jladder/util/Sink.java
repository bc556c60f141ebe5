package org.metricshub.jladder.util;

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

import java.io.IOException;

/**
 * Collects the translated program in memory.
 * <p>
 * Nothing is persisted before {@link #flush()}, which the parser calls
 * exactly once, after the whole program has been checked. This base
 * implementation keeps the text in memory only; see {@link FileSink}
 * for the variant that writes it to storage.
 */
public class Sink {

	private final StringBuilder compiledCode = new StringBuilder();

	private boolean flushed;

	/**
	 * Appends a chunk of text as-is.
	 *
	 * @param chunk text to append
	 */
	public void append(String chunk) {
		compiledCode.append(chunk);
	}

	/**
	 * Appends a chunk of text followed by a line terminator.
	 *
	 * @param chunk text to append
	 */
	public void appendLine(String chunk) {
		compiledCode.append(chunk).append('\n');
	}

	/**
	 * Marks the accumulated text as complete.
	 *
	 * @throws IOException if the text cannot be persisted
	 */
	public void flush() throws IOException {
		flushed = true;
	}

	/**
	 * @return {@code true} once {@link #flush()} has succeeded
	 */
	public boolean isFlushed() {
		return flushed;
	}

	/**
	 * @return everything appended so far
	 */
	public String getText() {
		return compiledCode.toString();
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return "<in-memory>";
	}
}
