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

import java.io.PrintStream;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import org.metricshub.stackflow.intermediate.Operation;

/**
 * A command is a sequence of instructions producing a distinct result.
 * <p>
 * The {@code operation} is the final instruction that yields a result.
 * The commands listed as {@code arguments} supply the stack slots consumed
 * by {@code operation}, in the order they were originally executed. Leaf
 * commands have no arguments.
 * <p>
 * The stack counts of a command reflect the effect of the operation itself,
 * plus <em>all</em> the arguments, recursively.
 * <p>
 * A command built from a block-closing operation encompasses the whole
 * block: its arguments are the commands found between the block opener
 * and the closing operation.
 * <p>
 * Commands are immutable.
 */
public final class Command {

	private static final String INDENT = "    ";

	private final Operation operation;
	private final List<Command> arguments;
	private final int byteOffset;
	private final Integer sourceLine;
	private final boolean jumpTarget;
	private final int consumeCount;
	private final int produceCount;

	/**
	 * @param operation the operation yielding the result of this command
	 * @param arguments the commands supplying the operands, in execution order
	 * @param byteOffset offset of the instruction of <code>operation</code>
	 * @param sourceLine line started by that instruction, or {@code null}
	 * @param jumpTarget whether that instruction is a jump target
	 */
	public Command(Operation operation, List<Command> arguments, int byteOffset, Integer sourceLine, boolean jumpTarget) {
		this.operation = Objects.requireNonNull(operation, "operation");
		this.arguments = Collections.unmodifiableList(new ArrayList<Command>(arguments));
		this.byteOffset = byteOffset;
		this.sourceLine = sourceLine;
		this.jumpTarget = jumpTarget;

		int consumed = operation.getConsumeCount();
		int produced = operation.getProduceCount();
		for (Command argument : this.arguments) {
			consumed += argument.consumeCount;
			produced += argument.produceCount;
		}
		this.consumeCount = consumed;
		this.produceCount = produced;
	}

	public Operation getOperation() {
		return operation;
	}

	/**
	 * @return the argument commands in execution order, unmodifiable
	 */
	public List<Command> getArguments() {
		return arguments;
	}

	public int getByteOffset() {
		return byteOffset;
	}

	/**
	 * @return the line started by this command's instruction, or {@code null}
	 *         if the instruction continues the previous line
	 */
	public Integer getSourceLine() {
		return sourceLine;
	}

	public boolean isJumpTarget() {
		return jumpTarget;
	}

	/**
	 * @return the stack slots popped by the operation and all its arguments
	 */
	public int getConsumeCount() {
		return consumeCount;
	}

	/**
	 * @return the stack slots pushed by the operation and all its arguments
	 */
	public int getProduceCount() {
		return produceCount;
	}

	/**
	 * Prints this command tree, arguments first, one line per command:
	 * a <code>&gt;</code> for jump targets, the source line, the offset,
	 * then the operation indented by its depth.
	 *
	 * @param ps where to print
	 */
	public void dump(PrintStream ps) {
		dump(ps, 0);
	}

	private void dump(PrintStream ps, int depth) {
		for (Command argument : arguments) {
			argument.dump(ps, depth + 1);
		}
		StringBuilder sb = new StringBuilder();
		sb.append(jumpTarget ? '>' : ' ');
		sb.append(sourceLine == null ? INDENT : String.format("%4d", sourceLine));
		sb.append(':').append(byteOffset).append(' ');
		for (int i = 0; i < depth; i++) {
			sb.append(INDENT);
		}
		sb.append(operation);
		ps.println(sb.toString());
	}

	@Override
	public String toString() {
		return "<Command " + operation.getName() + " (" + arguments.size() + " args)>";
	}
}
