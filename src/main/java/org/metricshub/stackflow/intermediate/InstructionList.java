package org.metricshub.stackflow.intermediate;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * Stackflow
 * ჻჻჻჻჻჻
 * Copyright (C) 2006 - 2025 MetricsHub
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

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;

/**
 * Assembles the instructions of one code unit, the way a compiler emits them.
 * <p>
 * Instructions are added in execution order. Jumps and block setups refer to
 * an {@link Address} which is placed later with {@link #address(Address)};
 * {@link #build()} then lays out the byte offsets (two bytes per instruction),
 * encodes jump arguments, prefixes arguments that do not fit in one byte with
 * an <code>EXTENDED_ARG</code> instruction and flags the jump targets.
 *
 * @see Instruction
 */
public class InstructionList {

	/** Largest argument held by a single instruction. */
	static final int MAX_SHORT_ARGUMENT = 0xff;

	/** Largest argument that one <code>EXTENDED_ARG</code> prefix can extend. */
	static final int MAX_ARGUMENT = 0xffff;

	private static final int INSTRUCTION_SIZE = 2;

	/** Jumps whose argument is a distance from the next instruction. */
	private static final Set<Opcode> RELATIVE_JUMPS = EnumSet
			.of(
					Opcode.JUMP_FORWARD,
					Opcode.FOR_ITER,
					Opcode.SETUP_LOOP,
					Opcode.SETUP_EXCEPT,
					Opcode.SETUP_FINALLY,
					Opcode.SETUP_WITH,
					Opcode.SETUP_ASYNC_WITH);

	/** Jumps whose argument is the offset of the target. */
	private static final Set<Opcode> ABSOLUTE_JUMPS = EnumSet
			.of(
					Opcode.JUMP_ABSOLUTE,
					Opcode.POP_JUMP_IF_FALSE,
					Opcode.POP_JUMP_IF_TRUE,
					Opcode.JUMP_IF_FALSE_OR_POP,
					Opcode.JUMP_IF_TRUE_OR_POP,
					Opcode.CONTINUE_LOOP);

	/** One instruction as requested by the caller, before layout. */
	private static final class Entry {
		private final Opcode opcode;
		private final int argument;
		private final Object resolved;
		private final Address target;
		private final Integer line;

		private Entry(Opcode opcode, int argument, Object resolved, Address target, Integer line) {
			this.opcode = opcode;
			this.argument = argument;
			this.resolved = resolved;
			this.target = target;
			this.line = line;
		}
	}

	private final AddressManager addressManager = new AddressManager();

	private final List<Entry> entries = new ArrayList<Entry>();

	private Integer pendingLine;

	/**
	 * Sets the source line started by the next added instruction.
	 *
	 * @param lineNumber the source line number
	 * @return this list
	 */
	public InstructionList line(int lineNumber) {
		pendingLine = lineNumber;
		return this;
	}

	/**
	 * Adds an instruction without argument.
	 *
	 * @param opcode the opcode
	 * @return this list
	 */
	public InstructionList add(Opcode opcode) {
		if (opcode.hasArgument()) {
			throw new IllegalArgumentException(opcode + " requires an argument");
		}
		return addEntry(new Entry(opcode, -1, null, null, takeLine()));
	}

	/**
	 * Adds an instruction whose resolved argument is the raw argument itself.
	 *
	 * @param opcode the opcode
	 * @param argument the argument
	 * @return this list
	 */
	public InstructionList add(Opcode opcode, int argument) {
		return add(opcode, argument, null);
	}

	/**
	 * Adds an instruction with a raw argument and its resolved value.
	 *
	 * @param opcode the opcode
	 * @param argument the raw argument, e.g. an index into the constant table
	 * @param resolved the resolved argument, e.g. the constant itself
	 * @return this list
	 */
	public InstructionList add(Opcode opcode, int argument, Object resolved) {
		if (!opcode.hasArgument()) {
			throw new IllegalArgumentException(opcode + " does not take an argument");
		}
		if (argument < 0 || argument > MAX_ARGUMENT) {
			throw new IllegalArgumentException("Argument of " + opcode + " out of range: " + argument);
		}
		return addEntry(new Entry(opcode, argument, resolved, null, takeLine()));
	}

	/**
	 * Adds a jump or block setup instruction branching to <code>target</code>.
	 *
	 * @param opcode a jump or <code>SETUP_*</code> opcode
	 * @param target where the instruction branches to
	 * @return this list
	 */
	public InstructionList jump(Opcode opcode, Address target) {
		if (!RELATIVE_JUMPS.contains(opcode) && !ABSOLUTE_JUMPS.contains(opcode)) {
			throw new IllegalArgumentException(opcode + " is not a jump");
		}
		return addEntry(new Entry(opcode, -1, null, target, takeLine()));
	}

	/**
	 * Creates an address; its position is set later by {@link #address(Address)}.
	 *
	 * @param label a meaningful label, numbered to make it unique
	 * @return the new address
	 */
	public Address createAddress(String label) {
		return addressManager.createAddress(label);
	}

	/**
	 * Places <code>address</code> at the next added instruction.
	 *
	 * @param address an address created by this list
	 * @return this list
	 */
	public InstructionList address(Address address) {
		addressManager.resolveAddress(address, entries.size());
		return this;
	}

	/**
	 * @return the number of instructions added so far, <code>EXTENDED_ARG</code>
	 *         prefixes excluded
	 */
	public int size() {
		return entries.size();
	}

	private InstructionList addEntry(Entry entry) {
		entries.add(entry);
		return this;
	}

	private Integer takeLine() {
		Integer line = pendingLine;
		pendingLine = null;
		return line;
	}

	/**
	 * Lays out the instructions added so far.
	 *
	 * @return the instructions, in offset order
	 * @throws IllegalStateException if an address was never placed or points past the last instruction
	 */
	public List<Instruction> build() {
		if (addressManager.hasUnresolvedAddresses()) {
			throw new IllegalStateException("Unresolved addresses: " + addressManager.getUnresolvedAddresses());
		}
		int count = entries.size();
		boolean[] extended = new boolean[count];
		int[] starts = new int[count];
		int[] arguments = new int[count];
		boolean[] targeted = new boolean[count];

		for (int i = 0; i < count; i++) {
			Entry entry = entries.get(i);
			extended[i] = entry.argument > MAX_SHORT_ARGUMENT;
			if (entry.target != null) {
				if (entry.target.index() >= count) {
					throw new IllegalStateException("address " + entry.target + " doesn't resolve to an actual instruction");
				}
				targeted[entry.target.index()] = true;
			}
		}

		// a prefix shifts the offsets that follow, which may push another jump argument over one byte
		boolean changed = true;
		while (changed) {
			changed = false;
			int offset = 0;
			for (int i = 0; i < count; i++) {
				starts[i] = offset;
				offset += extended[i] ? 2 * INSTRUCTION_SIZE : INSTRUCTION_SIZE;
			}
			for (int i = 0; i < count; i++) {
				arguments[i] = encodeArgument(entries.get(i), starts, extended[i], i);
				if (arguments[i] > MAX_SHORT_ARGUMENT && !extended[i]) {
					extended[i] = true;
					changed = true;
				}
			}
		}

		List<Instruction> instructions = new ArrayList<Instruction>(count + 8);
		for (int i = 0; i < count; i++) {
			Entry entry = entries.get(i);
			int offset = starts[i];
			Integer line = entry.line;
			boolean jumpTarget = targeted[i];
			if (extended[i]) {
				int high = arguments[i] >> 8;
				instructions.add(new Instruction(Opcode.EXTENDED_ARG.name(), high, high, offset, line, jumpTarget));
				offset += INSTRUCTION_SIZE;
				line = null;
				jumpTarget = false;
			}
			if (entry.argument < 0 && entry.target == null) {
				instructions.add(new Instruction(entry.opcode.name(), null, null, offset, line, jumpTarget));
			} else {
				int raw = arguments[i] & MAX_SHORT_ARGUMENT;
				instructions.add(new Instruction(entry.opcode.name(), raw, resolvedArgument(entry, arguments[i], starts), offset, line, jumpTarget));
			}
		}
		return Collections.unmodifiableList(instructions);
	}

	private static int encodeArgument(Entry entry, int[] starts, boolean extended, int index) {
		if (entry.target == null) {
			return Math.max(entry.argument, 0);
		}
		int targetOffset = starts[entry.target.index()];
		if (ABSOLUTE_JUMPS.contains(entry.opcode)) {
			return targetOffset;
		}
		int next = starts[index] + (extended ? 2 * INSTRUCTION_SIZE : INSTRUCTION_SIZE);
		if (targetOffset < next) {
			throw new IllegalStateException(entry.opcode + " cannot branch backward to " + entry.target);
		}
		return targetOffset - next;
	}

	private static Object resolvedArgument(Entry entry, int argument, int[] starts) {
		if (entry.target != null) {
			return RELATIVE_JUMPS.contains(entry.opcode) ? "to " + starts[entry.target.index()] : Integer.valueOf(argument);
		}
		return entry.resolved != null ? entry.resolved : Integer.valueOf(argument);
	}

	/**
	 * Prints the instructions laid out by {@link #build()}.
	 *
	 * @param ps where to print
	 */
	public void dump(PrintStream ps) {
		dump(build(), ps);
	}

	/**
	 * Prints instructions in the layout of CPython's <code>dis</code> module,
	 * which {@link org.metricshub.stackflow.frontend.DisassemblyReader} reads back.
	 *
	 * @param instructions the instructions to print
	 * @param ps where to print
	 */
	public static void dump(List<Instruction> instructions, PrintStream ps) {
		for (Instruction instruction : instructions) {
			StringBuilder sb = new StringBuilder();
			Integer line = instruction.getSourceLine();
			sb.append(String.format("%4s", line == null ? "" : line.toString()));
			sb.append(instruction.isJumpTarget() ? "  >> " : "     ");
			sb.append(String.format("%6d %-26s", instruction.getByteOffset(), instruction.getOpcodeName()));
			if (instruction.getRawArgument() != null) {
				sb.append(String.format("%3d", instruction.getRawArgument()));
				Object resolved = instruction.getResolvedArgument();
				if (resolved != null && !resolved.equals(instruction.getRawArgument())) {
					sb.append(" (").append(resolved).append(')');
				}
			}
			ps.println(sb.toString().replaceAll("\\s+$", ""));
		}
	}
}
