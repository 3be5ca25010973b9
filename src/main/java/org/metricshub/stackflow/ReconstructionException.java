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
 * A runtime exception thrown by Stackflow while rebuilding commands
 * from an instruction stream. It is provided to conveniently distinguish
 * between reconstruction failures and other runtime exceptions.
 * <p>
 * Failures always abort the reconstruction of the whole code unit;
 * no partial tree is ever returned.
 */
public class ReconstructionException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	private final int byteOffset;

	private final String opcodeName;

	private String codeUnitName;

	/**
	 * <p>
	 * Constructor for ReconstructionException.
	 * </p>
	 *
	 * @param msg a {@link java.lang.String} object
	 */
	public ReconstructionException(String msg) {
		super(msg);
		this.byteOffset = -1;
		this.opcodeName = null;
	}

	public ReconstructionException(String msg, Throwable cause) {
		super(msg, cause);
		this.byteOffset = -1;
		this.opcodeName = null;
	}

	/**
	 * <p>
	 * Constructor for ReconstructionException.
	 * </p>
	 *
	 * @param byteOffset offset of the offending instruction
	 * @param opcodeName name of the offending opcode
	 * @param msg a {@link java.lang.String} object
	 */
	public ReconstructionException(int byteOffset, String opcodeName, String msg) {
		super(msg);
		this.byteOffset = byteOffset;
		this.opcodeName = opcodeName;
	}

	public ReconstructionException(int byteOffset, String opcodeName, String msg, Throwable cause) {
		super(msg, cause);
		this.byteOffset = byteOffset;
		this.opcodeName = opcodeName;
	}

	/**
	 * Returns the byte offset associated with this exception or {@code -1} if
	 * unavailable.
	 *
	 * @return the offending byte offset or {@code -1}
	 */
	public int getByteOffset() {
		return byteOffset;
	}

	/**
	 * @return the offending opcode name, or {@code null} if unavailable
	 */
	public String getOpcodeName() {
		return opcodeName;
	}

	/**
	 * @return name of the code unit being rebuilt when the failure occurred,
	 *         or {@code null} if the instructions were rebuilt without a code unit
	 */
	public String getCodeUnitName() {
		return codeUnitName;
	}

	/**
	 * Records the code unit in which this failure occurred. The first name set
	 * is kept.
	 *
	 * @param codeUnitName name of the code unit
	 */
	public void setCodeUnitName(String codeUnitName) {
		if (this.codeUnitName == null) {
			this.codeUnitName = codeUnitName;
		}
	}
}
