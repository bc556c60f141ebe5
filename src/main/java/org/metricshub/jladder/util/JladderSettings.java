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

/**
 * A simple container for the parameters of a single translation.
 * These values have defaults.
 * These defaults may be changed through command line arguments,
 * or when invoking Jladder programmatically, from within Java code.
 */
public class JladderSettings {

	/** Output file name used when none is given. */
	public static final String DEFAULT_OUTPUT_FILENAME = "Program.out";

	/** Smallest period, in milliseconds, accepted for a periodic task. */
	public static final int DEFAULT_MINIMUM_PERIOD = 20;

	/** Longest tag name accepted in a TAG declaration. */
	public static final int DEFAULT_MAXIMUM_TAG_NAME_LENGTH = 7;

	/**
	 * Path of the ladder source file.
	 * <code>null</code> until set; the command line requires it.
	 */
	private String sourceFile = null;

	/**
	 * Where the translated program is written;
	 * <code>Program.out</code> by default.
	 */
	private String outputFilename = DEFAULT_OUTPUT_FILENAME;

	/**
	 * Lower bound for <code>TASK&lt;PERIOD=n&gt;</code>;
	 * <code>20</code> by default.
	 */
	private int minimumPeriod = DEFAULT_MINIMUM_PERIOD;

	/**
	 * Upper bound for the length of a tag name;
	 * <code>7</code> by default.
	 */
	private int maximumTagNameLength = DEFAULT_MAXIMUM_TAG_NAME_LENGTH;

	/**
	 * Whether to print the token stream instead of translating;
	 * <code>false</code> by default.
	 */
	private boolean dumpTokens = false;

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

		desc.append("sourceFile = ").append(getSourceFile()).append(newLine);
		desc.append("outputFilename = ").append(getOutputFilename()).append(newLine);
		desc.append("minimumPeriod = ").append(getMinimumPeriod()).append(newLine);
		desc.append("maximumTagNameLength = ").append(getMaximumTagNameLength()).append(newLine);
		desc.append("dumpTokens = ").append(isDumpTokens()).append(newLine);

		return desc.toString();
	}

	public String getSourceFile() {
		return sourceFile;
	}

	public void setSourceFile(String sourceFile) {
		this.sourceFile = sourceFile;
	}

	public String getOutputFilename() {
		return outputFilename;
	}

	public void setOutputFilename(String outputFilename) {
		this.outputFilename = outputFilename;
	}

	public int getMinimumPeriod() {
		return minimumPeriod;
	}

	/**
	 * @param minimumPeriod the smallest period accepted for a periodic task
	 */
	public void setMinimumPeriod(int minimumPeriod) {
		if (minimumPeriod < 0) {
			throw new IllegalArgumentException("Minimum period must not be negative: " + minimumPeriod);
		}
		this.minimumPeriod = minimumPeriod;
	}

	public int getMaximumTagNameLength() {
		return maximumTagNameLength;
	}

	/**
	 * @param maximumTagNameLength the longest tag name accepted
	 */
	public void setMaximumTagNameLength(int maximumTagNameLength) {
		if (maximumTagNameLength < 1) {
			throw new IllegalArgumentException("Maximum tag name length must be positive: " + maximumTagNameLength);
		}
		this.maximumTagNameLength = maximumTagNameLength;
	}

	public boolean isDumpTokens() {
		return dumpTokens;
	}

	public void setDumpTokens(boolean dumpTokens) {
		this.dumpTokens = dumpTokens;
	}
}
