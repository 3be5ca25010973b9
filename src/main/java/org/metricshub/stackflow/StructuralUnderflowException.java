package org.metricshub.stackflow;

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

/**
 * Exception thrown when the start of the instruction stream is reached
 * while an operation still waits for operands, or while a block-closing
 * operation has not found its block opener yet.
 * <p>
 * It points either at a malformed instruction stream or at a registry
 * whose stack effects do not match the instructions.
 */
public class StructuralUnderflowException extends ReconstructionException {

	private static final long serialVersionUID = 1L;

	/**
	 * Creates a new exception for the operation whose operands ran out.
	 *
	 * @param byteOffset offset of the operation still waiting for operands
	 * @param opcodeName name of that operation
	 * @param message description of the missing operands
	 */
	public StructuralUnderflowException(int byteOffset, String opcodeName, String message) {
		super(byteOffset, opcodeName, message);
	}
}
