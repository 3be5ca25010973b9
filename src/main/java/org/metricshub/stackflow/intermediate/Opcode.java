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

import java.util.HashMap;
import java.util.Map;
import java.util.function.IntUnaryOperator;

/**
 * The instruction set of the CPython 3.6 virtual machine, as seen by the
 * command reconstruction.
 * <p>
 * Each opcode knows how many operand stack slots it pops and pushes,
 * possibly as a function of its (merged) integer argument, and whether it
 * opens or closes a block. Block bookkeeping that the virtual machine performs
 * implicitly (the block stack, the exception state pushed on handler entry)
 * is not modelled: block openers and exception handling opcodes are
 * stack-neutral here.
 */
public enum Opcode {
	/**
	 * Pops an item off the operand stack.
	 * <p>
	 * Stack before: x ...<br/>
	 * Stack after: ...
	 */
	POP_TOP(1, 0),
	/**
	 * Swaps the two top-most stack items.
	 */
	ROT_TWO(2, 2),
	/**
	 * Lifts the second and third stack items one position up, moves the
	 * top down to position three.
	 */
	ROT_THREE(3, 3),
	/**
	 * Duplicates the top-of-stack.
	 * <p>
	 * Stack before: x ...<br/>
	 * Stack after: x x ...
	 */
	DUP_TOP(1, 2),
	/**
	 * Duplicates the two top-most stack items.
	 * <p>
	 * Stack before: x y ...<br/>
	 * Stack after: x y x y ...
	 */
	DUP_TOP_TWO(2, 4),
	/**
	 * A no-operation. The operand stack contents are
	 * unaffected.
	 */
	NOP(0, 0),
	UNARY_POSITIVE(1, 1),
	UNARY_NEGATIVE(1, 1),
	UNARY_NOT(1, 1),
	UNARY_INVERT(1, 1),
	BINARY_MATRIX_MULTIPLY(2, 1),
	INPLACE_MATRIX_MULTIPLY(2, 1),
	BINARY_POWER(2, 1),
	BINARY_MULTIPLY(2, 1),
	BINARY_MODULO(2, 1),
	/**
	 * Pops two items and pushes their sum.
	 * <p>
	 * Stack before: y x ...<br/>
	 * Stack after: x+y ...
	 */
	BINARY_ADD(2, 1),
	BINARY_SUBTRACT(2, 1),
	BINARY_SUBSCR(2, 1),
	BINARY_FLOOR_DIVIDE(2, 1),
	BINARY_TRUE_DIVIDE(2, 1),
	INPLACE_FLOOR_DIVIDE(2, 1),
	INPLACE_TRUE_DIVIDE(2, 1),
	GET_AITER(1, 1),
	GET_ANEXT(1, 2),
	BEFORE_ASYNC_WITH(1, 2),
	INPLACE_ADD(2, 1),
	INPLACE_SUBTRACT(2, 1),
	INPLACE_MULTIPLY(2, 1),
	INPLACE_MODULO(2, 1),
	/**
	 * Implements <code>TOS1[TOS] = TOS2</code>.
	 * <p>
	 * Stack before: index container value ...<br/>
	 * Stack after: ...
	 */
	STORE_SUBSCR(3, 0),
	DELETE_SUBSCR(2, 0),
	BINARY_LSHIFT(2, 1),
	BINARY_RSHIFT(2, 1),
	BINARY_AND(2, 1),
	BINARY_XOR(2, 1),
	BINARY_OR(2, 1),
	INPLACE_POWER(2, 1),
	GET_ITER(1, 1),
	GET_YIELD_FROM_ITER(1, 1),
	PRINT_EXPR(1, 0),
	LOAD_BUILD_CLASS(0, 1),
	YIELD_FROM(2, 1),
	GET_AWAITABLE(1, 1),
	INPLACE_LSHIFT(2, 1),
	INPLACE_RSHIFT(2, 1),
	INPLACE_AND(2, 1),
	INPLACE_XOR(2, 1),
	INPLACE_OR(2, 1),
	BREAK_LOOP(0, 0),
	WITH_CLEANUP_START(0, 1),
	WITH_CLEANUP_FINISH(1, 0),
	RETURN_VALUE(1, 0),
	IMPORT_STAR(1, 0),
	SETUP_ANNOTATIONS(0, 0),
	YIELD_VALUE(1, 1),
	/**
	 * Removes one block from the block stack. Closes the block opened by
	 * the matching <code>SETUP_*</code> instruction.
	 */
	POP_BLOCK(Block.CLOSE, false),
	END_FINALLY(0, 0),
	POP_EXCEPT(0, 0),
	STORE_NAME(1, 0, true),
	DELETE_NAME(0, 0, true),
	/**
	 * Unpacks the top-of-stack into N individual values.
	 * <p>
	 * Argument: # of items (N)
	 * <p>
	 * Stack before: x ...<br/>
	 * Stack after: x1 x2 .. xN ...
	 */
	UNPACK_SEQUENCE(n -> 1, n -> n),
	/**
	 * Pushes the next value of the iterator on top of the stack, keeping the
	 * iterator below it.
	 */
	FOR_ITER(1, 2, true),
	/**
	 * Unpacks with a starred target. The low byte of the argument is the
	 * number of values before the starred target, the high byte the number of
	 * values after it.
	 */
	UNPACK_EX(n -> 1, n -> (n & 0xff) + (n >> 8) + 1),
	STORE_ATTR(2, 0, true),
	DELETE_ATTR(1, 0, true),
	STORE_GLOBAL(1, 0, true),
	DELETE_GLOBAL(0, 0, true),
	/**
	 * Pushes a constant onto the operand stack.
	 * <p>
	 * Argument: index into the constant table
	 * <p>
	 * Stack before: ...<br/>
	 * Stack after: x ...
	 */
	LOAD_CONST(0, 1, true),
	LOAD_NAME(0, 1, true),
	/**
	 * Pops N items and pushes a tuple made of them.
	 * <p>
	 * Argument: # of items (N)
	 * <p>
	 * Stack before: x1 x2 .. xN ...<br/>
	 * Stack after: (x1, x2, .., xN) ...
	 */
	BUILD_TUPLE(n -> n, n -> 1),
	BUILD_LIST(n -> n, n -> 1),
	BUILD_SET(n -> n, n -> 1),
	/**
	 * Pops N key/value pairs and pushes a dictionary made of them.
	 * <p>
	 * Argument: # of pairs (N)
	 */
	BUILD_MAP(n -> 2 * n, n -> 1),
	LOAD_ATTR(1, 1, true),
	COMPARE_OP(2, 1, true),
	IMPORT_NAME(2, 1, true),
	IMPORT_FROM(1, 2, true),
	JUMP_FORWARD(0, 0, true),
	JUMP_IF_FALSE_OR_POP(1, 0, true),
	JUMP_IF_TRUE_OR_POP(1, 0, true),
	JUMP_ABSOLUTE(0, 0, true),
	POP_JUMP_IF_FALSE(1, 0, true),
	POP_JUMP_IF_TRUE(1, 0, true),
	LOAD_GLOBAL(0, 1, true),
	CONTINUE_LOOP(0, 0, true),
	/**
	 * Opens a loop block, closed by <code>POP_BLOCK</code>.
	 * <p>
	 * Argument: relative offset of the first instruction after the loop
	 */
	SETUP_LOOP(Block.OPEN, true),
	SETUP_EXCEPT(Block.OPEN, true),
	SETUP_FINALLY(Block.OPEN, true),
	LOAD_FAST(0, 1, true),
	STORE_FAST(1, 0, true),
	DELETE_FAST(0, 0, true),
	STORE_ANNOTATION(1, 0, true),
	RAISE_VARARGS(n -> n, n -> 0),
	/**
	 * Calls a callable with N positional arguments.
	 * <p>
	 * Argument: # of positional arguments (N)
	 * <p>
	 * Stack before: xN .. x2 x1 callable ...<br/>
	 * Stack after: result ...
	 */
	CALL_FUNCTION(n -> n + 1, n -> 1),
	/**
	 * Pushes a new function object. Each of the four low bits of the
	 * argument adds one item to pop: positional defaults, keyword-only
	 * defaults, annotations and closure cells.
	 */
	MAKE_FUNCTION(n -> 2 + Integer.bitCount(n & 0x0f), n -> 1),
	BUILD_SLICE(n -> n, n -> 1),
	LOAD_CLOSURE(0, 1, true),
	LOAD_DEREF(0, 1, true),
	STORE_DEREF(1, 0, true),
	DELETE_DEREF(0, 0, true),
	CALL_FUNCTION_KW(n -> n + 2, n -> 1),
	CALL_FUNCTION_EX(n -> 2 + (n & 0x01), n -> 1),
	SETUP_WITH(Block.OPEN, true),
	/**
	 * Supplies the high bits of the argument of the following instruction.
	 * It never stands on its own: it is merged into the next instruction.
	 */
	EXTENDED_ARG(0, 0, true),
	LIST_APPEND(1, 0, true),
	SET_ADD(1, 0, true),
	MAP_ADD(2, 0, true),
	LOAD_CLASSDEREF(0, 1, true),
	BUILD_LIST_UNPACK(n -> n, n -> 1),
	BUILD_MAP_UNPACK(n -> n, n -> 1),
	BUILD_MAP_UNPACK_WITH_CALL(n -> n, n -> 1),
	BUILD_TUPLE_UNPACK(n -> n, n -> 1),
	BUILD_SET_UNPACK(n -> n, n -> 1),
	SETUP_ASYNC_WITH(Block.OPEN, true),
	/**
	 * Formats a value for an f-string. Bit 0x04 of the argument tells
	 * whether a format specification sits on top of the value.
	 */
	FORMAT_VALUE(n -> 1 + ((n & 0x04) != 0 ? 1 : 0), n -> 1),
	BUILD_CONST_KEY_MAP(n -> n + 1, n -> 1),
	BUILD_STRING(n -> n, n -> 1),
	BUILD_TUPLE_UNPACK_WITH_CALL(n -> n, n -> 1),
	LOAD_METHOD(1, 2, true),
	CALL_METHOD(n -> n + 2, n -> 1);

	/**
	 * Structural role of an opcode.
	 */
	public enum Block {
		NONE,
		OPEN,
		CLOSE
	}

	private static final Map<String, Opcode> BY_NAME = new HashMap<String, Opcode>();

	static {
		for (Opcode opcode : values()) {
			BY_NAME.put(opcode.name(), opcode);
		}
	}

	private final IntUnaryOperator consume;
	private final IntUnaryOperator produce;
	private final boolean hasArgument;
	private final Block block;

	Opcode(int consume, int produce) {
		this(consume, produce, false);
	}

	Opcode(int consume, int produce, boolean hasArgument) {
		this(n -> consume, n -> produce, hasArgument, Block.NONE);
	}

	Opcode(IntUnaryOperator consume, IntUnaryOperator produce) {
		this(consume, produce, true, Block.NONE);
	}

	Opcode(Block block, boolean hasArgument) {
		this(n -> 0, n -> 0, hasArgument, block);
	}

	Opcode(IntUnaryOperator consume, IntUnaryOperator produce, boolean hasArgument, Block block) {
		this.consume = consume;
		this.produce = produce;
		this.hasArgument = hasArgument;
		this.block = block;
	}

	/**
	 * @param argument the merged integer argument, {@code 0} when absent
	 * @return the number of stack slots popped by this opcode
	 */
	public int consumeCount(int argument) {
		return consume.applyAsInt(argument);
	}

	/**
	 * @param argument the merged integer argument, {@code 0} when absent
	 * @return the number of stack slots pushed by this opcode
	 */
	public int produceCount(int argument) {
		return produce.applyAsInt(argument);
	}

	/**
	 * @return whether instructions of this opcode carry an argument
	 */
	public boolean hasArgument() {
		return hasArgument;
	}

	public boolean opensBlock() {
		return block == Block.OPEN;
	}

	public boolean closesBlock() {
		return block == Block.CLOSE;
	}

	public Block block() {
		return block;
	}

	/**
	 * Looks up an opcode by its name.
	 *
	 * @param name the opcode name, e.g. <code>LOAD_CONST</code>
	 * @return the matching opcode
	 * @throws IllegalArgumentException if no opcode has this name
	 */
	public static Opcode fromName(String name) {
		Opcode opcode = name == null ? null : BY_NAME.get(name);
		if (opcode == null) {
			throw new IllegalArgumentException("Unknown opcode: " + name);
		}
		return opcode;
	}

	/**
	 * @param name an opcode name
	 * @return whether {@link #fromName(String)} would succeed for this name
	 */
	public static boolean isKnown(String name) {
		return name != null && BY_NAME.containsKey(name);
	}
}
