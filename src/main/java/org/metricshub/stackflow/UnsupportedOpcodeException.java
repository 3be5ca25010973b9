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
 * Exception thrown when an instruction names an opcode that has no
 * entry in the opcode registry.
 */
public class UnsupportedOpcodeException extends ReconstructionException {

	private static final long serialVersionUID = 1L;

	/**
	 * Creates a new exception for the provided instruction.
	 *
	 * @param byteOffset offset of the instruction carrying the unknown opcode
	 * @param opcodeName the unknown opcode name
	 * @param cause the registry lookup failure
	 */
	public UnsupportedOpcodeException(int byteOffset, String opcodeName, Throwable cause) {
		super(byteOffset, opcodeName, "Unsupported opcode " + opcodeName + " at offset " + byteOffset, cause);
	}
}
