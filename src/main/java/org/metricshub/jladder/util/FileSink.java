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
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.slf4j.Logger;

/**
 * A {@link Sink} that writes the translated program to a UTF-8 file
 * when flushed. The file is created, or truncated if it already exists.
 */
public class FileSink extends Sink {

	private static final Logger LOG = JladderLogger.getLogger(FileSink.class);

	private final Path destination;

	/**
	 * @param fileName path of the file to write
	 */
	public FileSink(String fileName) {
		this(Paths.get(fileName));
	}

	/**
	 * @param destination path of the file to write
	 */
	public FileSink(Path destination) {
		this.destination = destination;
	}

	public Path getDestination() {
		return destination;
	}

	@Override
	public void flush() throws IOException {
		try {
			Files.write(destination, getText().getBytes(StandardCharsets.UTF_8));
		} catch (IOException ex) {
			throw new IOException("Couldn't write to " + destination + ": " + ex.getMessage(), ex);
		}
		LOG.debug("Wrote {} characters to {}", getText().length(), destination);
		super.flush();
	}

	@Override
	public String toString() {
		return destination.toString();
	}
}
