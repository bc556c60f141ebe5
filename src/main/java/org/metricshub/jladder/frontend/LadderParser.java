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

import java.io.IOException;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.EnumMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Map;
import java.util.Set;
import org.metricshub.jladder.ErrorKind;
import org.metricshub.jladder.TranslationException;
import org.metricshub.jladder.backend.Instruction;
import org.metricshub.jladder.backend.RungTranslator;
import org.metricshub.jladder.util.JladderLogger;
import org.metricshub.jladder.util.JladderSettings;
import org.metricshub.jladder.util.Sink;
import org.slf4j.Logger;

/**
 * Parses a ladder program and translates it in the same pass.
 * <p>
 * The parser pulls tokens from a {@link LadderLexer} through a three-token
 * window (previous, current, peek), checks every statement as soon as it is
 * read, and drives a {@link RungTranslator} instruction by instruction.
 * Task headers and tag declarations go straight to the {@link Sink}; the
 * routines of a task follow when the task is closed.
 * <p>
 * <code>JSR</code> and <code>EMIT</code> may name routines and events that
 * are declared further down, so those references are only verified once the
 * whole program has been read. The sink is flushed after that, and only if
 * every check passed.
 * <p>
 * A parser translates a single program; create a new one for each.
 */
public class LadderParser {

	private static final Logger LOG = JladderLogger.getLogger(LadderParser.class);

	private static final Map<TokenKind, Instruction> INSTRUCTIONS = new EnumMap<TokenKind, Instruction>(TokenKind.class);

	static {
		INSTRUCTIONS.put(TokenKind.KW_XIC, Instruction.XIC);
		INSTRUCTIONS.put(TokenKind.KW_XIO, Instruction.XIO);
		INSTRUCTIONS.put(TokenKind.KW_OTE, Instruction.OTE);
		INSTRUCTIONS.put(TokenKind.KW_OTL, Instruction.OTL);
		INSTRUCTIONS.put(TokenKind.KW_OTU, Instruction.OTU);
		INSTRUCTIONS.put(TokenKind.KW_JSR, Instruction.JSR);
		INSTRUCTIONS.put(TokenKind.KW_RET, Instruction.RET);
		INSTRUCTIONS.put(TokenKind.KW_EMIT, Instruction.EMIT);
	}

	private final LadderLexer lexer;
	private final Sink sink;
	private final RungTranslator translator = new RungTranslator();
	private final int minimumPeriod;
	private final int maximumTagNameLength;

	/**
	 * Tags are global to the program. A name declared twice gets two
	 * entries; lookups stop at the first one.
	 */
	private final List<TagDescriptor> tags = new ArrayList<TagDescriptor>();
	private final Set<String> routines = new LinkedHashSet<String>();
	private final Set<String> events = new LinkedHashSet<String>();
	private final List<String> jumps = new ArrayList<String>();
	private final List<String> emittedEvents = new ArrayList<String>();
	private final Deque<Scope> stack = new ArrayDeque<Scope>();
	private boolean mainFlag;
	private String currentTaskName;
	private int routinesInTask;

	private Token previousToken = Token.NONE;
	private Token currentToken = Token.NONE;
	private Token peekToken = Token.NONE;

	/**
	 * Creates a parser using the default limits.
	 *
	 * @param lexer the token source
	 * @param sink where the translated program goes
	 */
	public LadderParser(LadderLexer lexer, Sink sink) {
		this(lexer, sink, new JladderSettings());
	}

	/**
	 * <p>
	 * Constructor for LadderParser.
	 * </p>
	 *
	 * @param lexer the token source
	 * @param sink where the translated program goes
	 * @param settings limits applied by the semantic checks
	 */
	public LadderParser(LadderLexer lexer, Sink sink, JladderSettings settings) {
		this.lexer = lexer;
		this.sink = sink;
		this.minimumPeriod = settings.getMinimumPeriod();
		this.maximumTagNameLength = settings.getMaximumTagNameLength();

		// fill current and peek
		nextToken();
		nextToken();
	}

	private void nextToken() {
		previousToken = currentToken;
		currentToken = peekToken;
		peekToken = lexer.nextToken();
	}

	private boolean checkToken(TokenKind kind) {
		return currentToken.is(kind);
	}

	private void matchToken(TokenKind kind) {
		if (!checkToken(kind)) {
			throw parserException(ErrorKind.SYNTAX, "Expected " + kind.name() + ", but found " + currentToken);
		}
		nextToken();
	}

	private TranslationException parserException(ErrorKind kind, String msg) {
		return new TranslationException(kind, currentToken.getLineNumber(), msg);
	}

	/**
	 * Translates the whole program, verifies the forward references and
	 * flushes the sink.
	 *
	 * @throws TranslationException on the first error found
	 * @throws IOException if the sink cannot be flushed
	 */
	public void translate() throws IOException {
		PROGRAM();
		sink.flush();
	}

	// RECURSIVE DESCENT PARSER:
	// CHECKSTYLE.OFF: MethodName
	// PROGRAM : [NEWLINE...] STATEMENT... EOF
	private void PROGRAM() {
		// blank and comment-only lines before the first statement
		while (checkToken(TokenKind.NEWLINE)) {
			nextToken();
		}
		while (!checkToken(TokenKind.EOF)) {
			STATEMENT();
		}

		if (!stack.isEmpty()) {
			throw parserException(ErrorKind.SCOPE, "Missing END" + stack.peek() + " at end of program");
		}

		LOG.debug("Verifying {} emitted event(s) and {} jump(s)", emittedEvents.size(), jumps.size());
		for (String event : emittedEvents) {
			if (!events.contains(event)) {
				throw new TranslationException(ErrorKind.SYMBOL, "Emitted event " + event + " does not correspond to a task");
			}
		}
		for (String jump : jumps) {
			if (!routines.contains(jump)) {
				throw new TranslationException(ErrorKind.SYMBOL, "Routine " + jump + " does not exist");
			}
		}
	}

	// STATEMENT : ( TASK | ROUTINE | RUNG | INSTRUCTION | END_RUNG | END_ROUTINE | END_TASK | TAG ) NEWLINE...
	private void STATEMENT() {
		switch (currentToken.getKind()) {
		case KW_TASK:
			nextToken();
			TASK();
			break;
		case KW_ROUTINE:
			nextToken();
			ROUTINE();
			break;
		case KW_RUNG:
			nextToken();
			RUNG();
			break;
		case KW_XIC:
		case KW_XIO:
		case KW_OTE:
		case KW_OTL:
		case KW_OTU:
		case KW_JSR:
		case KW_RET:
		case KW_EMIT:
			nextToken();
			INSTRUCTION();
			break;
		case KW_ENDRUNG:
			nextToken();
			END_RUNG();
			break;
		case KW_ENDROUTINE:
			nextToken();
			END_ROUTINE();
			break;
		case KW_ENDTASK:
			nextToken();
			END_TASK();
			break;
		case KW_TAG:
			nextToken();
			TAG();
			break;
		default:
			throw parserException(ErrorKind.SYNTAX, "Invalid statement at " + currentToken);
		}

		// every statement ends with at least one newline
		matchToken(TokenKind.NEWLINE);
		while (checkToken(TokenKind.NEWLINE)) {
			nextToken();
		}
	}

	// TASK : TASK < TASK_TYPE > IDENTIFIER
	private void TASK() {
		if (!stack.isEmpty()) {
			throw parserException(ErrorKind.SCOPE, "Tasks may not be inside of other structures");
		}
		stack.push(Scope.TASK);
		sink.append("TASK ");

		TASK_TYPE();
		matchToken(TokenKind.IDENTIFIER);
		currentTaskName = previousToken.getText();
		routinesInTask = 0;
		sink.append(" ");
		sink.appendLine(currentTaskName);
		sink.appendLine("{");
	}

	// TASK_TYPE : PERIOD = NUMBER | EVENT = IDENTIFIER | CONTINUOUS
	private void TASK_TYPE() {
		matchToken(TokenKind.OPEN_ANGLE);

		if (checkToken(TokenKind.KW_PERIOD)) {
			PERIOD_TYPE();
		} else if (checkToken(TokenKind.KW_EVENT)) {
			EVENT_TYPE();
		} else if (checkToken(TokenKind.KW_CONTINUOUS)) {
			matchToken(TokenKind.KW_CONTINUOUS);
		} else {
			throw parserException(ErrorKind.SYNTAX, "Invalid task type " + currentToken.getText());
		}

		matchToken(TokenKind.CLOSE_ANGLE);
	}

	private void PERIOD_TYPE() {
		matchToken(TokenKind.KW_PERIOD);
		sink.append("PERIOD ");
		matchToken(TokenKind.EQ);
		matchToken(TokenKind.NUMBER);
		String period = previousToken.getText();
		sink.append(period);

		if (new BigDecimal(period).compareTo(BigDecimal.valueOf(minimumPeriod)) < 0) {
			throw parserException(ErrorKind.CONSTRAINT, "Period " + period + " below allowable limit " + minimumPeriod);
		}
	}

	private void EVENT_TYPE() {
		matchToken(TokenKind.KW_EVENT);
		sink.append("EVENT ");
		matchToken(TokenKind.EQ);
		matchToken(TokenKind.IDENTIFIER);
		String event = previousToken.getText();
		sink.append(event);

		events.add(event);
	}

	// ROUTINE : ROUTINE IDENTIFIER
	private void ROUTINE() {
		if (stack.peek() != Scope.TASK) {
			throw parserException(ErrorKind.SCOPE, "Routines must be defined inside of a TASK");
		}
		stack.push(Scope.ROUTINE);

		matchToken(TokenKind.IDENTIFIER);
		String routineName = previousToken.getText();

		if (RungTranslator.ENTRY_ROUTINE.equals(routineName)) {
			if (mainFlag) {
				throw parserException(
						ErrorKind.SYMBOL,
						"There can only be one " + RungTranslator.ENTRY_ROUTINE + " routine in task " + currentTaskName);
			}
			mainFlag = true;
		}

		routines.add(routineName);
		routinesInTask++;
		translator.beginRoutine(routineName);
	}

	// RUNG : RUNG [IDENTIFIER]
	private void RUNG() {
		if (stack.peek() != Scope.ROUTINE) {
			throw parserException(ErrorKind.SCOPE, "Rungs must be defined inside of a ROUTINE");
		}
		stack.push(Scope.RUNG);

		if (checkToken(TokenKind.IDENTIFIER)) {
			nextToken();
			translator.beginRung(previousToken.getText());
		} else {
			translator.beginRung(null);
		}
	}

	// INSTRUCTION : RET | ( XIC | XIO | OTE | OTL | OTU ) TAG_REFERENCE | ( JSR | EMIT ) IDENTIFIER
	private void INSTRUCTION() {
		Instruction instruction = INSTRUCTIONS.get(previousToken.getKind());
		if (stack.peek() != Scope.RUNG) {
			throw parserException(ErrorKind.SCOPE, "Instruction " + instruction + " must be inside of a RUNG");
		}

		if (instruction == Instruction.RET) {
			translator.addInstruction(instruction, "");
			return;
		}

		matchToken(TokenKind.IDENTIFIER);
		String target = previousToken.getText();

		switch (instruction) {
		case JSR:
			// checked once every routine is known
			jumps.add(target);
			break;
		case EMIT:
			// checked once every event is known
			emittedEvents.add(target);
			break;
		default:
			target = TAG_REFERENCE(target);
			break;
		}

		translator.addInstruction(instruction, target);
	}

	// TAG_REFERENCE : IDENTIFIER [ . NUMBER ]
	private String TAG_REFERENCE(String name) {
		TagDescriptor tag = findTag(name);
		if (tag == null) {
			throw parserException(ErrorKind.SYMBOL, "Referencing tag " + name + " before assignment");
		}
		if (!tag.isArray()) {
			return name;
		}

		// arrays require an index
		matchToken(TokenKind.INDEXER);
		matchToken(TokenKind.NUMBER);
		String index = previousToken.getText();
		if (index.indexOf('.') >= 0) {
			throw parserException(ErrorKind.SYNTAX, "Index " + index + " of tag array " + name + " must be a whole number");
		}
		if (new BigInteger(index).compareTo(BigInteger.valueOf(tag.getLength())) >= 0) {
			throw parserException(
					ErrorKind.SYMBOL,
					"Index " + index + " is out of bounds for tag array of length " + tag.getLength());
		}
		return name + "." + index;
	}

	private TagDescriptor findTag(String name) {
		for (TagDescriptor tag : tags) {
			if (tag.getName().equals(name)) {
				return tag;
			}
		}
		return null;
	}

	private void END_RUNG() {
		Scope scope = stack.poll();
		if (scope != Scope.RUNG) {
			throw parserException(ErrorKind.SCOPE, "ENDRUNG is missing a matching RUNG");
		}
		translator.endRung();
	}

	private void END_ROUTINE() {
		Scope scope = stack.poll();
		if (scope == Scope.RUNG) {
			throw parserException(ErrorKind.SCOPE, "Missing ENDRUNG before ENDROUTINE");
		} else if (scope != Scope.ROUTINE) {
			throw parserException(ErrorKind.SCOPE, "ENDROUTINE is missing a matching ROUTINE");
		}
		translator.endRoutine();
	}

	private void END_TASK() {
		if (stack.isEmpty()) {
			throw parserException(ErrorKind.SCOPE, "Too many end statements");
		}
		Scope scope = stack.pop();
		if (scope != Scope.TASK) {
			throw parserException(ErrorKind.SCOPE, "Missing END" + scope + " before ENDTASK");
		}

		if (!mainFlag) {
			throw parserException(
					ErrorKind.SYMBOL,
					"Task " + currentTaskName + " must contain a single " + RungTranslator.ENTRY_ROUTINE + " routine");
		}
		mainFlag = false;

		sink.appendLine(translator.finish());
		sink.appendLine("}");
		LOG.debug("Translated task {} with {} routine(s)", currentTaskName, routinesInTask);
	}

	// TAG : TAG [ [ NUMBER ] ] IDENTIFIER = ( TRUE | FALSE )
	private void TAG() {
		int length = 0;
		if (checkToken(TokenKind.OPEN_BRACKET)) {
			length = TAG_ARRAY();
		} else {
			sink.append("TAG ");
		}

		matchToken(TokenKind.IDENTIFIER);
		String name = previousToken.getText();
		if (name.length() > maximumTagNameLength) {
			throw parserException(
					ErrorKind.SYMBOL,
					"Tag name " + name + " too long. The limit is " + maximumTagNameLength + " characters");
		}
		sink.append(name);
		tags.add(new TagDescriptor(name, length));

		matchToken(TokenKind.EQ);
		if (checkToken(TokenKind.KW_TRUE)) {
			nextToken();
			sink.appendLine(" TRUE");
		} else {
			matchToken(TokenKind.KW_FALSE);
			sink.appendLine(" FALSE");
		}
	}

	private int TAG_ARRAY() {
		matchToken(TokenKind.OPEN_BRACKET);
		matchToken(TokenKind.NUMBER);
		String lengthText = previousToken.getText();

		if (lengthText.indexOf('.') >= 0) {
			throw parserException(ErrorKind.SYNTAX, "Length of tag array must be a whole number, got " + lengthText);
		}
		BigInteger length = new BigInteger(lengthText);
		if (length.signum() == 0) {
			throw parserException(ErrorKind.SYMBOL, "Length of tag array must be greater than zero");
		}
		if (length.compareTo(BigInteger.valueOf(Integer.MAX_VALUE)) > 0) {
			throw parserException(ErrorKind.SYMBOL, "Length of tag array " + lengthText + " is too large");
		}

		sink.append("TAG_ARRAY ");
		sink.append(lengthText);
		sink.append(" ");

		matchToken(TokenKind.CLOSE_BRACKET);
		return length.intValue();
	}
	// CHECKSTYLE.ON: MethodName
}
