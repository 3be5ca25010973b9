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
 * Exception thrown in strict block matching mode when a block-opening
 * operation shows up as a top-level command, i.e. no block-closing
 * operation of the same code unit claims it.
 *
 * @see org.metricshub.stackflow.util.ReconstructSettings#isStrictBlockMatching()
 */
public class DanglingBlockOpenerException extends ReconstructionException {

	private static final long serialVersionUID = 1L;

	/**
	 * @param byteOffset offset of the unmatched block opener
	 * @param opcodeName name of the unmatched block opener
	 */
	public DanglingBlockOpenerException(int byteOffset, String opcodeName) {
		super(byteOffset, opcodeName, "Block opened by " + opcodeName + " at offset " + byteOffset + " is never closed");
	}
}
