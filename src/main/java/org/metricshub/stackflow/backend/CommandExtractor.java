package org.metricshub.stackflow.backend;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.stackflow.StructuralUnderflowException;
import org.metricshub.stackflow.UnsupportedOpcodeException;
import org.metricshub.stackflow.intermediate.Instruction;
import org.metricshub.stackflow.intermediate.Opcode;
import org.metricshub.stackflow.intermediate.Operation;
import org.metricshub.stackflow.util.ReconstructSettings;
import org.metricshub.stackflow.util.StackflowLogger;
import org.slf4j.Logger;

/**
 * Extracts single commands from an instruction list, working backwards.
 * <p>
 * Each command is essentially working towards a final result, so the
 * extraction starts at the <em>last</em> instruction of the command and pulls
 * the preceding commands that supply its operands, until the stack balance
 * of the operation is met. Only stack depth is tracked, never values.
 * <p>
 * An extractor holds no mutable state: one instance may serve several
 * threads, each rebuilding its own code unit.
 */
public class CommandExtractor {

	private static final Logger LOG = StackflowLogger.getLogger(CommandExtractor.class);

	private final int extendedArgShift;

	public CommandExtractor() {
		this(new ReconstructSettings());
	}

	/**
	 * @param settings settings providing the <code>EXTENDED_ARG</code> shift
	 */
	public CommandExtractor(ReconstructSettings settings) {
		this.extendedArgShift = settings.getExtendedArgShift();
	}

	/**
	 * Extracts the command ending with the instruction at <code>cursor - 1</code>.
	 *
	 * @param instructions the instructions of one code unit
	 * @param cursor position one past the last instruction of the command
	 * @return the command and the position one past the instruction preceding it
	 * @throws UnsupportedOpcodeException if an instruction names an unknown opcode
	 * @throws StructuralUnderflowException if the start of the instructions is
	 *         reached before the command is complete
	 */
	public ExtractedCommand extractCommand(List<Instruction> instructions, int cursor) {
		if (cursor <= 0 || cursor > instructions.size()) {
			throw new IllegalArgumentException("cursor must be between 1 and " + instructions.size() + ", got " + cursor);
		}
		return extract(instructions, cursor);
	}

	private ExtractedCommand extract(List<Instruction> instructions, int cursor) {
		int i = cursor - 1;
		Instruction instruction = instructions.get(i);
		Operation operation = Operation.of(lookup(instruction), instructions, i, extendedArgShift);

		// the EXTENDED_ARG has been merged into the operation
		if (Operation.hasExtendedArg(instructions, i)) {
			i = i - 1;
		}

		List<Command> arguments = new ArrayList<Command>();

		if (operation.closesBlock()) {
			// everything back to the block opener belongs to this command
			boolean foundStart = false;
			while (!foundStart) {
				if (i <= 0) {
					throw new StructuralUnderflowException(
							instruction.getByteOffset(),
							instruction.getOpcodeName(),
							"No block opener for " + instruction.getOpcodeName() + " at offset " + instruction.getByteOffset());
				}
				ExtractedCommand extracted = extract(instructions, i);
				i = extracted.getCursor();
				Command argument = extracted.getCommand();
				if (argument.getOperation().opensBlock()) {
					foundStart = true;
				} else {
					arguments.add(argument);
				}
			}
		} else if (operation.opensBlock()) {
			// the block-closing command waiting for this opener recognizes it
			return new ExtractedCommand(i, newCommand(operation, arguments, instruction));
		} else {
			// pull commands until the stack is back to an empty state
			int pending = operation.getConsumeCount();
			while (pending > 0) {
				if (i <= 0) {
					throw new StructuralUnderflowException(
							instruction.getByteOffset(),
							instruction.getOpcodeName(),
							instruction.getOpcodeName()
									+ " at offset "
									+ instruction.getByteOffset()
									+ " is missing "
									+ pending
									+ " stack operand(s)");
				}
				ExtractedCommand extracted = extract(instructions, i);
				i = extracted.getCursor();
				Command argument = extracted.getCommand();
				arguments.add(argument);
				pending = pending + argument.getConsumeCount() - argument.getProduceCount();
			}
		}

		// arguments were gathered backwards
		Collections.reverse(arguments);
		return new ExtractedCommand(i, newCommand(operation, arguments, instruction));
	}

	private static Command newCommand(Operation operation, List<Command> arguments, Instruction instruction) {
		Command command = new Command(
				operation,
				arguments,
				instruction.getByteOffset(),
				instruction.getSourceLine(),
				instruction.isJumpTarget());
		if (LOG.isTraceEnabled()) {
			LOG.trace("{} at offset {} with {} argument(s)", operation, instruction.getByteOffset(), arguments.size());
		}
		return command;
	}

	private static Opcode lookup(Instruction instruction) {
		try {
			return Opcode.fromName(instruction.getOpcodeName());
		} catch (IllegalArgumentException e) {
			throw new UnsupportedOpcodeException(instruction.getByteOffset(), instruction.getOpcodeName(), e);
		}
	}
}
