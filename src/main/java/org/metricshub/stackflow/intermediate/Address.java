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

/**
 * A label in an {@link InstructionList}, i.e. the position of the instruction
 * that a jump or a block setup refers to. The position is unknown when the
 * label is created, and is set by {@link InstructionList#address(Address)}
 * when the labelled instruction is about to be added.
 */
public class Address {

	private final String label;
	private int index = -1;

	Address(String label) {
		this.label = label;
	}

	/**
	 * @return the unique label of this address, e.g. <code>loop_end_0</code>
	 */
	public String label() {
		return label;
	}

	void assignIndex(int index) {
		this.index = index;
	}

	/**
	 * @return the position of the labelled instruction in the list, not
	 *         counting <code>EXTENDED_ARG</code> prefixes; {@code -1} until resolved
	 */
	public int index() {
		return index;
	}

	@Override
	public String toString() {
		return index < 0 ? label : label + "@" + index;
	}
}
