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

import java.io.Serializable;
import java.util.Objects;

/**
 * Represents a single decoded instruction of a code unit. While
 * {@link InstructionList} assembles a sequence of instructions, this class
 * models one instruction, its operand and its position in the original stream.
 * <p>
 * The opcode is kept as a plain name: it is only checked against the
 * {@link Opcode} registry when commands are rebuilt, so that an unknown opcode
 * is reported together with its offset.
 *
 * @see InstructionList
 */
public final class Instruction implements Serializable {

	private static final long serialVersionUID = 1L;

	private final String opcodeName;
	private final Integer rawArgument;
	private final Object resolvedArgument;
	private final int byteOffset;
	private final Integer sourceLine;
	private final boolean jumpTarget;

	/**
	 * @param opcodeName identifier of the operation
	 * @param rawArgument operand as encoded in the stream, {@code null} when absent
	 * @param resolvedArgument operand after symbol/constant table resolution, {@code null} when absent
	 * @param byteOffset position in the original stream
	 * @param sourceLine line this instruction starts, {@code null} when it continues the previous line
	 * @param jumpTarget whether any instruction branches to this offset
	 */
	public Instruction(
			String opcodeName,
			Integer rawArgument,
			Object resolvedArgument,
			int byteOffset,
			Integer sourceLine,
			boolean jumpTarget) {
		this.opcodeName = Objects.requireNonNull(opcodeName, "opcodeName");
		this.rawArgument = rawArgument;
		this.resolvedArgument = resolvedArgument;
		this.byteOffset = byteOffset;
		this.sourceLine = sourceLine;
		this.jumpTarget = jumpTarget;
	}

	public String getOpcodeName() {
		return opcodeName;
	}

	public Integer getRawArgument() {
		return rawArgument;
	}

	public Object getResolvedArgument() {
		return resolvedArgument;
	}

	public int getByteOffset() {
		return byteOffset;
	}

	public Integer getSourceLine() {
		return sourceLine;
	}

	public boolean isJumpTarget() {
		return jumpTarget;
	}

	/**
	 * @return whether this instruction only supplies the high bits of the
	 *         argument of the next instruction
	 */
	public boolean isExtendedArg() {
		return Opcode.EXTENDED_ARG.name().equals(opcodeName);
	}

	@Override
	public String toString() {
		StringBuilder sb = new StringBuilder();
		sb.append(byteOffset).append(' ').append(opcodeName);
		if (rawArgument != null) {
			sb.append(' ').append(rawArgument);
		}
		if (resolvedArgument != null && !resolvedArgument.equals(rawArgument)) {
			sb.append(" (").append(resolvedArgument).append(')');
		}
		return sb.toString();
	}
}
