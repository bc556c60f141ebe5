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

/**
 * The single failure raised while translating a ladder program.
 * Translation stops at the first one; there is no recovery.
 *
 * @see ErrorKind
 */
public class TranslationException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final ErrorKind kind;

	private final int lineNumber;

	/**
	 * Creates an exception that is not tied to a source line.
	 *
	 * @param kind category of the failure
	 * @param msg human readable description
	 */
	public TranslationException(ErrorKind kind, String msg) {
		this(kind, -1, msg);
	}

	/**
	 * <p>
	 * Constructor for TranslationException.
	 * </p>
	 *
	 * @param kind category of the failure
	 * @param lineno 1-based source line, or {@code -1}
	 * @param msg human readable description
	 */
	public TranslationException(ErrorKind kind, int lineno, String msg) {
		super(msg);
		this.kind = kind;
		this.lineNumber = lineno;
	}

	public ErrorKind getKind() {
		return kind;
	}

	/**
	 * Returns the line number associated with this exception or {@code -1} if
	 * unavailable.
	 *
	 * @return the offending line number or {@code -1}
	 */
	public int getLineNumber() {
		return lineNumber;
	}
}
