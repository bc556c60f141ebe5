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

/** Lexer token values. */
public enum TokenKind {
	EOF,
	NEWLINE,
	NUMBER,
	IDENTIFIER,

	KW_TAG,
	KW_TASK,
	KW_ENDTASK,
	KW_PERIOD,
	KW_EVENT,
	KW_CONTINUOUS,
	KW_ROUTINE,
	KW_ENDROUTINE,
	KW_RUNG,
	KW_ENDRUNG,
	KW_TRUE,
	KW_FALSE,

	KW_XIC,
	KW_XIO,
	KW_OTE,
	KW_OTL,
	KW_OTU,
	KW_JSR,
	KW_RET,
	KW_EMIT,

	EQ,
	OPEN_ANGLE,
	CLOSE_ANGLE,
	OPEN_BRACKET,
	CLOSE_BRACKET,
	INDEXER
}
