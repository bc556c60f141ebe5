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

import java.util.ArrayList;
import java.util.List;
import org.metricshub.jladder.ErrorKind;
import org.metricshub.jladder.TranslationException;

/**
 * Renders the routines of one task as target program text.
 * <p>
 * Each routine becomes a <code>def</code> block. Each rung becomes a
 * boolean variable that starts out <code>True</code> and is narrowed by its
 * contact instructions, followed by an <code>if</code> block running the
 * outputs and, when needed, an <code>else</code> block resetting the
 * <code>OTE</code> coils. For example:
 *
 * <pre>
 * def Main():
 * 	rung_0_entry = True
 * 	rung_0_entry &amp;= start
 * 	if rung_0_entry:
 * 		motor = True
 * 	else:
 * 		motor = False
 * Main()
 * </pre>
 * <p>
 * The translator knows nothing about the source grammar: the parser calls
 * it once per routine, rung and instruction, in source order. It is reused
 * from one task to the next; {@link #finish()} resets it.
 */
public class RungTranslator {

	/** Name of the routine every task starts from. */
	public static final String ENTRY_ROUTINE = "Main";

	private static final String INDENT = "\t";

	private StringBuilder currentCodeBlock = new StringBuilder();
	private int indentationLevel;
	private String currentRungName = "";
	private int rungNumber;
	private boolean outputInstructionFlag;

	// statements pending for the current rung, in instruction order
	private final List<String> ifBlockInstructions = new ArrayList<String>();
	private final List<String> elseBlockInstructions = new ArrayList<String>();

	private void addToCodeBlock(String code) {
		for (int i = 0; i < indentationLevel; i++) {
			currentCodeBlock.append(INDENT);
		}
		currentCodeBlock.append(code).append('\n');
	}

	/**
	 * Opens the definition of a routine.
	 *
	 * @param routineName name of the routine
	 */
	public void beginRoutine(String routineName) {
		ifBlockInstructions.clear();
		elseBlockInstructions.clear();
		outputInstructionFlag = false;
		currentRungName = "";
		rungNumber = 0;

		addToCodeBlock("def " + routineName + "():");
		indentationLevel++;
	}

	/**
	 * Closes the current routine. A routine without rungs gets a
	 * <code>pass</code> body.
	 */
	public void endRoutine() {
		if (rungNumber == 0) {
			addToCodeBlock("pass");
		}
		indentationLevel--;
		rungNumber = 0;
	}

	/**
	 * Opens a rung and emits its entry variable.
	 *
	 * @param rungName name of the rung, or {@code null} (or empty) for an
	 *        anonymous rung, which is named after its position in the routine
	 */
	public void beginRung(String rungName) {
		String entryName;
		if (rungName == null || rungName.isEmpty()) {
			entryName = "rung_" + rungNumber + "_entry";
		} else {
			entryName = "rung_" + rungName + "_entry";
		}
		// named rungs take a number too
		rungNumber++;

		addToCodeBlock(entryName + " = True");
		currentRungName = entryName;
		outputInstructionFlag = false;
	}

	/**
	 * Narrows the rung condition with a contact instruction.
	 *
	 * @param instruction {@link Instruction#XIC} or {@link Instruction#XIO}
	 * @param target the tag to examine
	 * @throws TranslationException if an output was already added to this rung
	 * @throws IllegalArgumentException if {@code instruction} is not an input
	 */
	public void addInput(Instruction instruction, String target) {
		if (!instruction.isInput()) {
			throw new IllegalArgumentException(instruction + " is not an input instruction");
		}
		if (outputInstructionFlag) {
			throw new TranslationException(
					ErrorKind.CONSTRAINT,
					"Input instruction " + instruction + " appears after an output instruction");
		}

		if (instruction == Instruction.XIC) {
			addToCodeBlock(currentRungName + " &= " + target);
		} else {
			addToCodeBlock(currentRungName + " &= not " + target);
		}
	}

	/**
	 * Queues an output instruction until the end of the rung.
	 *
	 * @param instruction any non-input {@link Instruction}
	 * @param target the tag, routine or event; ignored for {@link Instruction#RET}
	 * @throws IllegalArgumentException if {@code instruction} is an input
	 */
	public void addOutput(Instruction instruction, String target) {
		switch (instruction) {
		case RET:
			ifBlockInstructions.add("return");
			break;
		case JSR:
			ifBlockInstructions.add(target + "()");
			break;
		case OTL:
			ifBlockInstructions.add(target + " = True");
			break;
		case OTU:
			ifBlockInstructions.add(target + " = False");
			break;
		case OTE:
			ifBlockInstructions.add(target + " = True");
			elseBlockInstructions.add(target + " = False");
			break;
		case EMIT:
			ifBlockInstructions.add("EmitEvent('" + target + "')");
			break;
		default:
			throw new IllegalArgumentException(instruction + " is not an output instruction");
		}
		outputInstructionFlag = true;
	}

	/**
	 * Adds an instruction to the current rung.
	 *
	 * @param instruction the instruction
	 * @param target its operand
	 */
	public void addInstruction(Instruction instruction, String target) {
		if (instruction.isInput()) {
			addInput(instruction, target);
		} else {
			addOutput(instruction, target);
		}
	}

	/**
	 * Closes the current rung, emitting the queued outputs.
	 */
	public void endRung() {
		if (!ifBlockInstructions.isEmpty()) {
			addToCodeBlock("if " + currentRungName + ":");
			indentationLevel++;
			for (String instruction : ifBlockInstructions) {
				addToCodeBlock(instruction);
			}
			ifBlockInstructions.clear();
			indentationLevel--;
		}

		if (!elseBlockInstructions.isEmpty()) {
			addToCodeBlock("else:");
			indentationLevel++;
			for (String instruction : elseBlockInstructions) {
				addToCodeBlock(instruction);
			}
			elseBlockInstructions.clear();
			indentationLevel--;
		}

		outputInstructionFlag = false;
	}

	/**
	 * Appends the call to the entry routine and hands over everything
	 * rendered since the last call. The translator is then ready for the
	 * next task.
	 *
	 * @return the task's program text, without a trailing newline
	 */
	public String finish() {
		addToCodeBlock(ENTRY_ROUTINE + "()");

		String codeBlock = currentCodeBlock.substring(0, currentCodeBlock.length() - 1);
		currentCodeBlock = new StringBuilder();
		indentationLevel = 0;
		currentRungName = "";
		rungNumber = 0;
		outputInstructionFlag = false;
		ifBlockInstructions.clear();
		elseBlockInstructions.clear();
		return codeBlock;
	}
}
