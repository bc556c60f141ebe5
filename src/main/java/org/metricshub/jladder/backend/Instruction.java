package org.metricshub.jladder.backend;

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
 * The rung instructions understood by {@link RungTranslator}.
 * <p>
 * Inputs (contacts) narrow the rung condition; outputs run when the rung
 * is evaluated.
 */
public enum Instruction {
	/**
	 * Examine if closed: the rung stays true only if the tag is set.
	 * <p>
	 * Emits: <code>rung &amp;= tag</code>
	 */
	XIC(true),
	/**
	 * Examine if open: the rung stays true only if the tag is not set.
	 * <p>
	 * Emits: <code>rung &amp;= not tag</code>
	 */
	XIO(true),
	/**
	 * Output energize: the tag follows the rung.
	 * <p>
	 * True branch: <code>tag = True</code><br/>
	 * False branch: <code>tag = False</code>
	 */
	OTE(false),
	/**
	 * Output latch: sets the tag when the rung is true.
	 * <p>
	 * True branch: <code>tag = True</code>
	 */
	OTL(false),
	/**
	 * Output unlatch: clears the tag when the rung is true.
	 * <p>
	 * True branch: <code>tag = False</code>
	 */
	OTU(false),
	/**
	 * Jump to subroutine.
	 * <p>
	 * True branch: <code>routine()</code>
	 */
	JSR(false),
	/**
	 * Return from the current routine. Takes no operand.
	 * <p>
	 * True branch: <code>return</code>
	 */
	RET(false),
	/**
	 * Signals an application event.
	 * <p>
	 * True branch: <code>EmitEvent('event')</code>
	 */
	EMIT(false);

	private final boolean input;

	Instruction(boolean input) {
		this.input = input;
	}

	/**
	 * @return {@code true} for contact checks, {@code false} for outputs
	 */
	public boolean isInput() {
		return input;
	}
}
