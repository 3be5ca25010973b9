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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;

/**
 * One independently compiled block of instructions, e.g. a module body or a
 * function body, with a name used in diagnostics.
 */
public final class CodeUnit {

	private final String name;
	private final List<Instruction> instructions;

	/**
	 * @param name name of the code unit, e.g. <code>&lt;module&gt;</code>
	 * @param instructions the instructions, in offset order
	 */
	public CodeUnit(String name, List<Instruction> instructions) {
		this.name = Objects.requireNonNull(name, "name");
		this.instructions = Collections.unmodifiableList(new ArrayList<Instruction>(instructions));
	}

	public String getName() {
		return name;
	}

	/**
	 * @return the instructions, unmodifiable
	 */
	public List<Instruction> getInstructions() {
		return instructions;
	}

	@Override
	public String toString() {
		return name + " (" + instructions.size() + " instructions)";
	}
}
