package org.metricshub.jladder;

import static org.junit.Assert.*;

import org.junit.Test;
import org.metricshub.jladder.backend.Instruction;
import org.metricshub.jladder.backend.RungTranslator;

public class RungTranslatorTest {

	@Test
	public void testReferenceProgram() {
		RungTranslator translator = new RungTranslator();

		translator.beginRoutine("Main");
		translator.beginRung("firstRung");
		translator.addInstruction(Instruction.XIO, "MyTag1");
		translator.addInstruction(Instruction.XIC, "MyTag2");
		translator.addInstruction(Instruction.OTL, "MyTag3");
		translator.addInstruction(Instruction.OTU, "MyTag4");
		translator.addInstruction(Instruction.OTE, "MyTag5");
		translator.addInstruction(Instruction.JSR, "otherRoutine");
		translator.endRung();
		translator.endRoutine();

		translator.beginRoutine("otherRoutine");
		translator.beginRung(null);
		translator.addInstruction(Instruction.RET, "");
		translator.endRung();
		translator.endRoutine();

		String expected = "def Main():\n"
				+ "\trung_firstRung_entry = True\n"
				+ "\trung_firstRung_entry &= not MyTag1\n"
				+ "\trung_firstRung_entry &= MyTag2\n"
				+ "\tif rung_firstRung_entry:\n"
				+ "\t\tMyTag3 = True\n"
				+ "\t\tMyTag4 = False\n"
				+ "\t\tMyTag5 = True\n"
				+ "\t\totherRoutine()\n"
				+ "\telse:\n"
				+ "\t\tMyTag5 = False\n"
				+ "def otherRoutine():\n"
				+ "\trung_0_entry = True\n"
				+ "\tif rung_0_entry:\n"
				+ "\t\treturn\n"
				+ "Main()";
		assertEquals(expected, translator.finish());
	}

	@Test
	public void testEmptyRoutine() {
		RungTranslator translator = new RungTranslator();

		translator.beginRoutine("Main");
		translator.endRoutine();

		assertEquals("def Main():\n\tpass\nMain()", translator.finish());
	}

	@Test
	public void testInputAfterOutput() {
		RungTranslator translator = new RungTranslator();

		translator.beginRoutine("Main");
		translator.beginRung("firstRung");
		translator.addInput(Instruction.XIC, "MyTag");
		translator.addOutput(Instruction.OTE, "MyTag");

		TranslationException e = assertThrows(
				"XIC after OTE must throw",
				TranslationException.class,
				() -> translator.addInput(Instruction.XIC, "MyTag"));
		assertEquals(ErrorKind.CONSTRAINT, e.getKind());
		assertEquals("Input instruction XIC appears after an output instruction", e.getMessage());
	}

	@Test
	public void testInputAllowedAgainInNextRung() {
		RungTranslator translator = new RungTranslator();

		translator.beginRoutine("Main");
		translator.beginRung(null);
		translator.addOutput(Instruction.OTL, "a");
		translator.endRung();
		translator.beginRung(null);
		translator.addInput(Instruction.XIO, "a");
		translator.endRung();
		translator.endRoutine();

		assertEquals(
				"def Main():\n"
						+ "\trung_0_entry = True\n"
						+ "\tif rung_0_entry:\n"
						+ "\t\ta = True\n"
						+ "\trung_1_entry = True\n"
						+ "\trung_1_entry &= not a\n"
						+ "Main()",
				translator.finish());
	}

	@Test
	public void testRungWithoutOutputs() {
		RungTranslator translator = new RungTranslator();

		translator.beginRoutine("Main");
		translator.beginRung("check");
		translator.addInput(Instruction.XIC, "a");
		translator.addInput(Instruction.XIC, "b");
		translator.addInput(Instruction.XIO, "c");
		translator.endRung();
		translator.endRoutine();

		String text = translator.finish();
		assertEquals(
				"def Main():\n"
						+ "\trung_check_entry = True\n"
						+ "\trung_check_entry &= a\n"
						+ "\trung_check_entry &= b\n"
						+ "\trung_check_entry &= not c\n"
						+ "Main()",
				text);
		assertFalse("No conditional block without outputs", text.contains("if "));
	}

	@Test
	public void testLatchesHaveNoElseBranch() {
		RungTranslator translator = new RungTranslator();

		translator.beginRoutine("Main");
		translator.beginRung(null);
		translator.addOutput(Instruction.OTL, "a");
		translator.addOutput(Instruction.OTU, "b");
		translator.addOutput(Instruction.EMIT, "done");
		translator.endRung();
		translator.endRoutine();

		String text = translator.finish();
		assertFalse(text.contains("else:"));
		assertTrue(text.contains("\t\tEmitEvent('done')\n"));
	}

	@Test
	public void testElseBranchKeepsOrder() {
		RungTranslator translator = new RungTranslator();

		translator.beginRoutine("Main");
		translator.beginRung(null);
		translator.addOutput(Instruction.OTE, "a");
		translator.addOutput(Instruction.OTE, "b");
		translator.addOutput(Instruction.OTE, "c");
		translator.endRung();
		translator.endRoutine();

		assertTrue(translator.finish().endsWith(
				"\telse:\n"
						+ "\t\ta = False\n"
						+ "\t\tb = False\n"
						+ "\t\tc = False\n"
						+ "Main()"));
	}

	@Test
	public void testNamedRungsAdvanceCounter() {
		RungTranslator translator = new RungTranslator();

		translator.beginRoutine("Main");
		translator.beginRung("first");
		translator.endRung();
		translator.beginRung(null);
		translator.endRung();
		translator.endRoutine();
		translator.beginRoutine("second");
		translator.beginRung(null);
		translator.endRung();
		translator.endRoutine();

		String text = translator.finish();
		assertTrue(text.contains("\trung_first_entry = True\n\trung_1_entry = True\n"));
		assertTrue("Counter restarts in each routine", text.contains("def second():\n\trung_0_entry = True\n"));
	}

	@Test
	public void testFinishResets() {
		RungTranslator translator = new RungTranslator();

		translator.beginRoutine("Main");
		translator.endRoutine();
		translator.finish();

		translator.beginRoutine("Main");
		translator.beginRung(null);
		translator.endRung();
		translator.endRoutine();
		assertEquals("def Main():\n\trung_0_entry = True\nMain()", translator.finish());
	}

	@Test
	public void testWrongInstructionCategory() {
		RungTranslator translator = new RungTranslator();
		translator.beginRoutine("Main");
		translator.beginRung(null);

		assertThrows(IllegalArgumentException.class, () -> translator.addInput(Instruction.OTE, "a"));
		assertThrows(IllegalArgumentException.class, () -> translator.addOutput(Instruction.XIC, "a"));
	}
}
