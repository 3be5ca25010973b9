package org.metricshub.stackflow;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;
import static org.metricshub.stackflow.CommandTreeSupport.assertBalanced;
import static org.metricshub.stackflow.CommandTreeSupport.assertExactlyBalanced;
import static org.metricshub.stackflow.CommandTreeSupport.assertOrdered;

import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import org.metricshub.stackflow.backend.Command;
import org.metricshub.stackflow.backend.CommandExtractor;
import org.metricshub.stackflow.backend.ExtractedCommand;
import org.metricshub.stackflow.intermediate.Address;
import org.metricshub.stackflow.intermediate.Instruction;
import org.metricshub.stackflow.intermediate.InstructionList;
import org.metricshub.stackflow.intermediate.Opcode;
import org.metricshub.stackflow.intermediate.Operation;
import org.metricshub.stackflow.util.ReconstructSettings;

public class CommandExtractorTest {

	private static final CommandExtractor EXTRACTOR = new CommandExtractor();

	private static Instruction insn(String name, Integer raw, int offset) {
		return new Instruction(name, raw, raw, offset, null, false);
	}

	private static ExtractedCommand extractLast(List<Instruction> instructions) {
		return EXTRACTOR.extractCommand(instructions, instructions.size());
	}

	@Test
	public void buildsSimpleExpressionTree() {
		List<Instruction> instructions = new InstructionList()
				.add(Opcode.LOAD_CONST, 0, 1)
				.add(Opcode.LOAD_CONST, 1, 2)
				.add(Opcode.BINARY_ADD)
				.build();

		ExtractedCommand extracted = extractLast(instructions);
		Command add = extracted.getCommand();

		assertEquals("the whole stream is consumed", 0, extracted.getCursor());
		assertEquals("BINARY_ADD", add.getOperation().getName());
		assertEquals(4, add.getByteOffset());
		assertEquals(2, add.getArguments().size());
		assertEquals(Integer.valueOf(1), add.getArguments().get(0).getOperation().getArgument());
		assertEquals(Integer.valueOf(2), add.getArguments().get(1).getOperation().getArgument());
		assertTrue(add.getArguments().get(0).getArguments().isEmpty());
		assertEquals(1, add.getOperation().getProduceCount());
		assertEquals("one value left on the stack", 1, add.getProduceCount() - add.getConsumeCount());
		assertEquals(2, add.getConsumeCount());
		assertEquals(3, add.getProduceCount());
		assertExactlyBalanced(add);
	}

	@Test
	public void absorbsBlockBetweenOpenerAndCloser() {
		InstructionList list = new InstructionList();
		Address end = list.createAddress("loop_end");
		list.jump(Opcode.SETUP_LOOP, end);
		list.add(Opcode.LOAD_CONST, 0, "a");
		list.add(Opcode.LOAD_CONST, 1, "b");
		list.address(end).add(Opcode.POP_BLOCK);
		List<Instruction> instructions = list.build();

		ExtractedCommand extracted = extractLast(instructions);
		Command block = extracted.getCommand();

		assertEquals("the opener is consumed too", 0, extracted.getCursor());
		assertEquals("POP_BLOCK", block.getOperation().getName());
		assertEquals(2, block.getArguments().size());
		assertEquals("a", block.getArguments().get(0).getOperation().getArgument());
		assertEquals("b", block.getArguments().get(1).getOperation().getArgument());
		assertOrdered(block);
	}

	@Test
	public void nestedBlocksCloseIndependently() {
		InstructionList list = new InstructionList();
		Address outer = list.createAddress("outer");
		Address inner = list.createAddress("inner");
		list.jump(Opcode.SETUP_LOOP, outer);
		list.jump(Opcode.SETUP_EXCEPT, inner);
		list.add(Opcode.LOAD_NAME, 0, "a");
		list.add(Opcode.POP_TOP);
		list.add(Opcode.POP_BLOCK);
		list.address(inner).add(Opcode.LOAD_NAME, 1, "b");
		list.add(Opcode.POP_TOP);
		list.address(outer).add(Opcode.POP_BLOCK);
		List<Instruction> instructions = list.build();

		ExtractedCommand extracted = extractLast(instructions);
		Command outerBlock = extracted.getCommand();

		assertEquals(0, extracted.getCursor());
		assertEquals(2, outerBlock.getArguments().size());
		Command innerBlock = outerBlock.getArguments().get(0);
		assertEquals("POP_BLOCK", innerBlock.getOperation().getName());
		assertEquals(1, innerBlock.getArguments().size());
		assertEquals("POP_TOP", innerBlock.getArguments().get(0).getOperation().getName());
		assertEquals("a", innerBlock.getArguments().get(0).getArguments().get(0).getOperation().getArgument());
		Command popB = outerBlock.getArguments().get(1);
		assertEquals("b", popB.getArguments().get(0).getOperation().getArgument());
		assertOrdered(outerBlock);
		assertBalanced(outerBlock);
	}

	@Test
	public void mergesExtendedArgumentIntoOneCommand() {
		List<Instruction> instructions = Arrays
				.asList(insn("EXTENDED_ARG", 1, 0), insn("LOAD_CONST", 44, 2), insn("RETURN_VALUE", null, 4));

		ExtractedCommand extracted = extractLast(instructions);
		Command ret = extracted.getCommand();

		assertEquals(0, extracted.getCursor());
		assertEquals(1, ret.getArguments().size());
		Command load = ret.getArguments().get(0);
		assertEquals(Integer.valueOf(300), load.getOperation().getArgument());
		assertEquals("offset of the instruction itself, not of its prefix", 2, load.getByteOffset());
		assertTrue(load.getArguments().isEmpty());
	}

	@Test
	public void extendedArgumentKeepsResolvedConstant() {
		List<Instruction> plain = Arrays
				.asList(new Instruction("LOAD_CONST", 44, 42, 0, null, false), insn("RETURN_VALUE", null, 2));
		List<Instruction> extended = Arrays
				.asList(
						new Instruction("EXTENDED_ARG", 1, 1, 0, null, false),
						new Instruction("LOAD_CONST", 44, 42, 2, null, false),
						insn("RETURN_VALUE", null, 4));

		Command plainLoad = extractLast(plain).getCommand().getArguments().get(0);
		Command extendedLoad = extractLast(extended).getCommand().getArguments().get(0);

		assertEquals(Integer.valueOf(42), plainLoad.getOperation().getArgument());
		assertEquals("the constant, not its index in the constant table", Integer.valueOf(42), extendedLoad.getOperation().getArgument());
	}

	@Test
	public void extendedArgumentUsesMergedCountForStackEffect() {
		List<Instruction> instructions = Arrays
				.asList(
						new Instruction("EXTENDED_ARG", 1, 1, 0, null, false),
						new Instruction("BUILD_TUPLE", 4, "(a, b)", 2, null, false));

		Operation tuple = Operation.of(Opcode.BUILD_TUPLE, instructions, 1, ReconstructSettings.DEFAULT_EXTENDED_ARG_SHIFT);

		assertEquals("(a, b)", tuple.getArgument());
		assertEquals(260, tuple.getConsumeCount());
	}

	@Test
	public void rejectsExtendedArgumentOverflow() {
		List<Instruction> instructions = Arrays.asList(insn("EXTENDED_ARG", 16777216, 0), insn("LOAD_CONST", 44, 2));

		ReconstructionException e = assertThrows(
				ReconstructionException.class,
				() -> EXTRACTOR.extractCommand(instructions, 2));

		assertEquals(2, e.getByteOffset());
		assertEquals("LOAD_CONST", e.getOpcodeName());
	}

	@Test
	public void extendedArgumentShiftIsConfigurable() {
		ReconstructSettings settings = new ReconstructSettings();
		settings.setExtendedArgShift(16);
		List<Instruction> instructions = Arrays.asList(insn("EXTENDED_ARG", 1, 0), insn("LOAD_CONST", 44, 4));

		Command load = new CommandExtractor(settings).extractCommand(instructions, 2).getCommand();

		assertEquals(Integer.valueOf(65580), load.getOperation().getArgument());
	}

	@Test
	public void variableArityUsesResolvedCount() {
		List<Instruction> instructions = new InstructionList()
				.add(Opcode.LOAD_CONST, 0, 1)
				.add(Opcode.LOAD_CONST, 1, 2)
				.add(Opcode.BINARY_ADD)
				.add(Opcode.LOAD_CONST, 2, 3)
				.add(Opcode.LOAD_CONST, 3, 4)
				.add(Opcode.BUILD_LIST, 3)
				.build();

		Command list = extractLast(instructions).getCommand();

		assertEquals(3, list.getOperation().getConsumeCount());
		assertEquals(3, list.getArguments().size());
		assertEquals("BINARY_ADD", list.getArguments().get(0).getOperation().getName());
		assertEquals(2, list.getArguments().get(0).getArguments().size());
		assertEquals(Integer.valueOf(3), list.getArguments().get(1).getOperation().getArgument());
		assertEquals(Integer.valueOf(4), list.getArguments().get(2).getOperation().getArgument());
		assertOrdered(list);
		assertExactlyBalanced(list);
	}

	@Test
	public void callGathersCallableAndArguments() {
		List<Instruction> instructions = new InstructionList()
				.add(Opcode.LOAD_GLOBAL, 0, "max")
				.add(Opcode.LOAD_FAST, 0, "a")
				.add(Opcode.LOAD_ATTR, 1, "size")
				.add(Opcode.LOAD_CONST, 0, 10)
				.add(Opcode.CALL_FUNCTION, 2)
				.add(Opcode.RETURN_VALUE)
				.build();

		ExtractedCommand extracted = extractLast(instructions);
		Command call = extracted.getCommand().getArguments().get(0);

		assertEquals(0, extracted.getCursor());
		assertEquals("CALL_FUNCTION", call.getOperation().getName());
		assertEquals(3, call.getArguments().size());
		assertEquals("max", call.getArguments().get(0).getOperation().getArgument());
		assertEquals("LOAD_ATTR", call.getArguments().get(1).getOperation().getName());
		assertEquals("a", call.getArguments().get(1).getArguments().get(0).getOperation().getArgument());
		assertExactlyBalanced(extracted.getCommand());
	}

	@Test
	public void surplusOfMultiValueProducerFlowsToConsumer() {
		// a = b = 1
		List<Instruction> instructions = new InstructionList()
				.add(Opcode.LOAD_CONST, 0, 1)
				.add(Opcode.DUP_TOP)
				.add(Opcode.STORE_NAME, 0, "a")
				.add(Opcode.STORE_NAME, 1, "b")
				.build();

		ExtractedCommand extracted = extractLast(instructions);
		Command storeB = extracted.getCommand();

		assertEquals(0, extracted.getCursor());
		assertEquals(1, storeB.getArguments().size());
		Command storeA = storeB.getArguments().get(0);
		assertEquals("a", storeA.getOperation().getArgument());
		assertEquals("DUP_TOP", storeA.getArguments().get(0).getOperation().getName());
		assertBalanced(storeB);
	}

	@Test
	public void leafCommandHasNoArguments() {
		List<Instruction> instructions = new InstructionList().add(Opcode.LOAD_CONST, 0, "x").build();

		ExtractedCommand extracted = extractLast(instructions);

		assertEquals(0, extracted.getCursor());
		assertTrue(extracted.getCommand().getArguments().isEmpty());
		assertEquals(0, extracted.getCommand().getConsumeCount());
		assertEquals(1, extracted.getCommand().getProduceCount());
	}

	@Test
	public void stopsAtTheStartOfTheCommand() {
		List<Instruction> instructions = new InstructionList()
				.add(Opcode.LOAD_CONST, 0, 1)
				.add(Opcode.PRINT_EXPR)
				.add(Opcode.LOAD_CONST, 1, 2)
				.add(Opcode.PRINT_EXPR)
				.build();

		ExtractedCommand last = EXTRACTOR.extractCommand(instructions, 4);
		ExtractedCommand first = EXTRACTOR.extractCommand(instructions, last.getCursor());

		assertEquals(2, last.getCursor());
		assertEquals(Integer.valueOf(2), last.getCommand().getArguments().get(0).getOperation().getArgument());
		assertEquals(0, first.getCursor());
		assertEquals(Integer.valueOf(1), first.getCommand().getArguments().get(0).getOperation().getArgument());
	}

	@Test
	public void blockOpenerReturnsImmediately() {
		List<Instruction> instructions = Arrays.asList(insn("LOAD_CONST", 0, 0), insn("SETUP_LOOP", 4, 2));

		ExtractedCommand extracted = extractLast(instructions);

		assertEquals(1, extracted.getCursor());
		assertEquals("SETUP_LOOP", extracted.getCommand().getOperation().getName());
		assertTrue(extracted.getCommand().getArguments().isEmpty());
	}

	@Test
	public void rejectsUnknownOpcode() {
		List<Instruction> instructions = Arrays.asList(insn("LOAD_CONST", 0, 0), insn("FROBNICATE", null, 2));

		UnsupportedOpcodeException e = assertThrows(UnsupportedOpcodeException.class, () -> extractLast(instructions));

		assertEquals(2, e.getByteOffset());
		assertEquals("FROBNICATE", e.getOpcodeName());
	}

	@Test
	public void rejectsUnknownOpcodeAmongOperands() {
		List<Instruction> instructions = Arrays.asList(insn("FROBNICATE", null, 0), insn("RETURN_VALUE", null, 2));

		UnsupportedOpcodeException e = assertThrows(UnsupportedOpcodeException.class, () -> extractLast(instructions));

		assertEquals(0, e.getByteOffset());
	}

	@Test
	public void underflowWhenOperandsAreMissing() {
		List<Instruction> instructions = Arrays.asList(insn("BINARY_ADD", null, 0));

		StructuralUnderflowException e = assertThrows(StructuralUnderflowException.class, () -> extractLast(instructions));

		assertEquals(0, e.getByteOffset());
		assertEquals("BINARY_ADD", e.getOpcodeName());
	}

	@Test
	public void underflowWhenOnlySomeOperandsExist() {
		List<Instruction> instructions = Arrays.asList(insn("LOAD_CONST", 0, 0), insn("BINARY_ADD", null, 2));

		StructuralUnderflowException e = assertThrows(StructuralUnderflowException.class, () -> extractLast(instructions));

		assertEquals(2, e.getByteOffset());
	}

	@Test
	public void underflowWhenBlockHasNoOpener() {
		List<Instruction> instructions = Arrays.asList(insn("LOAD_CONST", 0, 0), insn("POP_BLOCK", null, 2));

		StructuralUnderflowException e = assertThrows(StructuralUnderflowException.class, () -> extractLast(instructions));

		assertEquals("POP_BLOCK", e.getOpcodeName());
	}

	@Test
	public void rejectsCursorOutsideTheInstructions() {
		List<Instruction> instructions = Arrays.asList(insn("LOAD_CONST", 0, 0));

		assertThrows(IllegalArgumentException.class, () -> EXTRACTOR.extractCommand(instructions, 0));
		assertThrows(IllegalArgumentException.class, () -> EXTRACTOR.extractCommand(instructions, 2));
	}

	@Test
	public void argumentsAreImmutable() {
		List<Instruction> instructions = new InstructionList()
				.add(Opcode.LOAD_CONST, 0, 1)
				.add(Opcode.RETURN_VALUE)
				.build();

		Command ret = extractLast(instructions).getCommand();

		assertThrows(UnsupportedOperationException.class, () -> ret.getArguments().clear());
	}
}
