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

import java.util.List;
import java.util.Objects;
import org.metricshub.stackflow.ReconstructionException;

/**
 * The semantic descriptor attached to one instruction: its opcode, its fully
 * resolved argument and the resulting stack effect.
 * <p>
 * An operation is built from exactly one instruction. When that instruction
 * is preceded by an <code>EXTENDED_ARG</code>, the two are merged: the
 * <code>EXTENDED_ARG</code> value supplies the high bits of the argument and
 * does not give an operation of its own.
 */
public final class Operation {

	private final Opcode opcode;
	private final Object argument;
	private final int consumeCount;
	private final int produceCount;

	/**
	 * @param opcode the opcode
	 * @param argument the resolved argument, {@code null} when absent
	 * @param intArgument the merged integer argument driving the stack effect
	 */
	public Operation(Opcode opcode, Object argument, int intArgument) {
		this.opcode = Objects.requireNonNull(opcode, "opcode");
		this.argument = argument;
		this.consumeCount = opcode.consumeCount(intArgument);
		this.produceCount = opcode.produceCount(intArgument);
	}

	/**
	 * Builds the operation of the instruction at <code>index</code>, merging
	 * the preceding <code>EXTENDED_ARG</code> instruction if there is one.
	 * Only one instruction back is inspected.
	 *
	 * @param opcode the opcode of the instruction at <code>index</code>
	 * @param instructions the instructions of the code unit
	 * @param index position of the instruction
	 * @param shift number of bits the <code>EXTENDED_ARG</code> value is shifted by
	 * @return the operation
	 * @throws ReconstructionException if the merged argument does not fit in an int
	 */
	public static Operation of(Opcode opcode, List<Instruction> instructions, int index, int shift) {
		Instruction instruction = instructions.get(index);
		Integer raw = instruction.getRawArgument();
		Object resolved = instruction.getResolvedArgument();

		if (hasExtendedArg(instructions, index)) {
			Integer high = instructions.get(index - 1).getRawArgument();
			long merged = ((long) (high == null ? 0 : high.intValue()) << shift) | (raw == null ? 0 : raw.intValue());
			if (merged < 0 || merged > Integer.MAX_VALUE) {
				throw new ReconstructionException(
						instruction.getByteOffset(),
						instruction.getOpcodeName(),
						"Extended argument " + high + " << " + shift + " | " + raw + " does not fit in an int");
			}
			// an unresolved argument is only the low bits of the merged one
			Object argument = resolved == null || resolved.equals(raw) ? Integer.valueOf((int) merged) : resolved;
			return new Operation(opcode, argument, (int) merged);
		}

		if (!opcode.hasArgument() && raw == null) {
			return new Operation(opcode, null, 0);
		}
		return new Operation(opcode, resolved != null ? resolved : raw, raw == null ? 0 : raw.intValue());
	}

	/**
	 * @param instructions the instructions of the code unit
	 * @param index position of an instruction
	 * @return whether the instruction at <code>index</code> is preceded by an
	 *         <code>EXTENDED_ARG</code> instruction
	 */
	public static boolean hasExtendedArg(List<Instruction> instructions, int index) {
		return index > 0 && instructions.get(index - 1).isExtendedArg();
	}

	public Opcode getOpcode() {
		return opcode;
	}

	public String getName() {
		return opcode.name();
	}

	public Object getArgument() {
		return argument;
	}

	public int getConsumeCount() {
		return consumeCount;
	}

	public int getProduceCount() {
		return produceCount;
	}

	public boolean opensBlock() {
		return opcode.opensBlock();
	}

	public boolean closesBlock() {
		return opcode.closesBlock();
	}

	@Override
	public String toString() {
		if (argument == null) {
			return opcode.name();
		}
		return opcode.name() + " " + argument;
	}
}
