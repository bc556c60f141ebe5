package org.metricshub.jladder.frontend;

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
 * A token produced by {@link LadderLexer}: its kind and the literal text
 * it was read from.
 */
public final class Token {

	/** Placeholder for the parser's window before the first token is read. */
	static final Token NONE = new Token(TokenKind.EOF, "");

	private final TokenKind kind;
	private final String text;
	private final int lineNumber;

	public Token(TokenKind kind, String text) {
		this(kind, text, -1);
	}

	Token(TokenKind kind, String text, int lineNumber) {
		this.kind = kind;
		this.text = text;
		this.lineNumber = lineNumber;
	}

	public TokenKind getKind() {
		return kind;
	}

	public String getText() {
		return text;
	}

	/**
	 * @return the 1-based line the token was read on, or {@code -1}
	 */
	public int getLineNumber() {
		return lineNumber;
	}

	public boolean is(TokenKind other) {
		return kind == other;
	}

	@Override
	public String toString() {
		if (kind == TokenKind.NEWLINE) {
			return kind.name();
		}
		return kind.name() + " (" + text + ")";
	}
}
