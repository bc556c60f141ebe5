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

import java.util.ArrayList;
import java.util.HashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.jladder.ErrorKind;
import org.metricshub.jladder.TranslationException;

/**
 * Splits ladder source text into {@link Token}s, one at a time, on demand.
 * <p>
 * A newline is appended to the text once, so the last statement is always
 * terminated. Spaces, tabs, carriage returns and <code>#</code> comments are
 * skipped; the newline ending a comment is kept and returned as a
 * {@link TokenKind#NEWLINE} token.
 */
public class LadderLexer {

	/**
	 * Contains a mapping of the ladder keywords to their
	 * token values.
	 * <p>
	 * Keywords are matched exactly, so <code>task</code> is an identifier
	 * while <code>TASK</code> is a keyword.
	 */
	private static final Map<String, TokenKind> KEYWORDS = new HashMap<String, TokenKind>();

	static {
		// declarations and structure
		KEYWORDS.put("TAG", TokenKind.KW_TAG);
		KEYWORDS.put("TASK", TokenKind.KW_TASK);
		KEYWORDS.put("ENDTASK", TokenKind.KW_ENDTASK);
		KEYWORDS.put("PERIOD", TokenKind.KW_PERIOD);
		KEYWORDS.put("EVENT", TokenKind.KW_EVENT);
		KEYWORDS.put("CONTINUOUS", TokenKind.KW_CONTINUOUS);
		KEYWORDS.put("ROUTINE", TokenKind.KW_ROUTINE);
		KEYWORDS.put("ENDROUTINE", TokenKind.KW_ENDROUTINE);
		KEYWORDS.put("RUNG", TokenKind.KW_RUNG);
		KEYWORDS.put("ENDRUNG", TokenKind.KW_ENDRUNG);
		KEYWORDS.put("TRUE", TokenKind.KW_TRUE);
		KEYWORDS.put("FALSE", TokenKind.KW_FALSE);

		// instructions
		KEYWORDS.put("XIC", TokenKind.KW_XIC);
		KEYWORDS.put("XIO", TokenKind.KW_XIO);
		KEYWORDS.put("OTE", TokenKind.KW_OTE);
		KEYWORDS.put("OTL", TokenKind.KW_OTL);
		KEYWORDS.put("OTU", TokenKind.KW_OTU);
		KEYWORDS.put("JSR", TokenKind.KW_JSR);
		KEYWORDS.put("RET", TokenKind.KW_RET);
		KEYWORDS.put("EMIT", TokenKind.KW_EMIT);
	}

	private final String sourceCode;
	private int position;
	private int lineNumber = 1;
	private int c;

	private final StringBuilder text = new StringBuilder();

	/**
	 * @param sourceCode the complete ladder program
	 */
	public LadderLexer(String sourceCode) {
		this.sourceCode = sourceCode + '\n';
		this.position = 0;
		this.c = this.sourceCode.charAt(0);
	}

	/**
	 * @return the 1-based line the lexer is currently on
	 */
	public int getLineNumber() {
		return lineNumber;
	}

	private void read() {
		text.append((char) c);
		if (c == '\n') {
			lineNumber++;
		}
		position++;
		c = position < sourceCode.length() ? sourceCode.charAt(position) : -1;
	}

	private static boolean isDigit(int ch) {
		return ch >= '0' && ch <= '9';
	}

	private TranslationException lexerException(String msg) {
		return new TranslationException(ErrorKind.LEXICAL, lineNumber, msg);
	}

	private Token token(TokenKind kind, int line) {
		return new Token(kind, text.toString(), line);
	}

	/**
	 * Reads the next token. Once the text is exhausted, every call returns
	 * an {@link TokenKind#EOF} token.
	 *
	 * @return the next token
	 * @throws TranslationException on a malformed number or an unknown character
	 */
	public Token nextToken() {
		// clear whitespace
		while (c == ' ' || c == '\t' || c == '\r') {
			read();
		}
		if (c == '#') {
			// kill comment, but not the newline ending it
			while (c >= 0 && c != '\n') {
				read();
			}
		}
		text.setLength(0);
		int line = lineNumber;

		if (c < 0) {
			return token(TokenKind.EOF, line);
		}

		switch (c) {
		case '=':
			read();
			return token(TokenKind.EQ, line);
		case '<':
			read();
			return token(TokenKind.OPEN_ANGLE, line);
		case '>':
			read();
			return token(TokenKind.CLOSE_ANGLE, line);
		case '[':
			read();
			return token(TokenKind.OPEN_BRACKET, line);
		case ']':
			read();
			return token(TokenKind.CLOSE_BRACKET, line);
		case '.':
			read();
			return token(TokenKind.INDEXER, line);
		case '\n':
			read();
			return token(TokenKind.NEWLINE, line);
		default:
			break;
		}

		if (isDigit(c)) {
			read();
			while (isDigit(c)) {
				read();
			}
			if (c == '.') {
				read();
				// at least one digit must follow the decimal point
				if (!isDigit(c)) {
					throw lexerException("Illegal character in number");
				}
				while (isDigit(c)) {
					read();
				}
			}
			return token(TokenKind.NUMBER, line);
		}

		if (Character.isLetter(c)) {
			read();
			while (Character.isLetter(c) || isDigit(c)) {
				read();
			}
			TokenKind kwToken = KEYWORDS.get(text.toString());
			if (kwToken != null) {
				return token(kwToken, line);
			}
			return token(TokenKind.IDENTIFIER, line);
		}

		throw lexerException("Unknown token: " + (char) c);
	}

	/**
	 * Reads every remaining token.
	 *
	 * @return the tokens, the final one being {@link TokenKind#EOF}
	 * @throws TranslationException on the first lexical error
	 */
	public List<Token> tokenize() {
		List<Token> tokens = new ArrayList<Token>();
		Token token;
		do {
			token = nextToken();
			tokens.add(token);
		} while (token.getKind() != TokenKind.EOF);
		return tokens;
	}
}
