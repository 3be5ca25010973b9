package org.metricshub.stackflow.util;

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
 * A simple container for the parameters of a reconstruction run.
 * These values have defaults.
 * These defaults may be changed through command line arguments,
 * or when invoking Stackflow programmatically, from within Java code.
 */
public class ReconstructSettings {

	/** Default number of low bits carried by a single instruction argument. */
	public static final int DEFAULT_EXTENDED_ARG_SHIFT = 8;

	/**
	 * Number of bits an <code>EXTENDED_ARG</code> value is shifted left
	 * before it is merged with the argument of the following instruction.
	 */
	private int extendedArgShift = DEFAULT_EXTENDED_ARG_SHIFT;

	/**
	 * Whether a block-opening operation found at the top level
	 * (never matched by a block-closing operation) is an error;
	 * <code>false</code> by default.
	 */
	private boolean strictBlockMatching = false;

	/**
	 * Whether the CLI prints the decoded instructions before
	 * the reconstructed commands;
	 * <code>false</code> by default.
	 */
	private boolean dumpInstructions = false;

	/**
	 * <p>
	 * toDescriptionString.
	 * </p>
	 *
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("extendedArgShift = ").append(getExtendedArgShift()).append(newLine);
		desc.append("strictBlockMatching = ").append(isStrictBlockMatching()).append(newLine);
		desc.append("dumpInstructions = ").append(isDumpInstructions()).append(newLine);

		return desc.toString();
	}

	/**
	 * @return the number of bits an <code>EXTENDED_ARG</code> value is shifted by
	 */
	public int getExtendedArgShift() {
		return extendedArgShift;
	}

	/**
	 * @param extendedArgShift the number of bits an <code>EXTENDED_ARG</code>
	 *        value is shifted by; must be between 1 and 31
	 */
	public void setExtendedArgShift(int extendedArgShift) {
		if (extendedArgShift < 1 || extendedArgShift > 31) {
			throw new IllegalArgumentException("extendedArgShift must be between 1 and 31, got " + extendedArgShift);
		}
		this.extendedArgShift = extendedArgShift;
	}

	/**
	 * @return whether an unmatched block opener aborts the reconstruction
	 */
	public boolean isStrictBlockMatching() {
		return strictBlockMatching;
	}

	/**
	 * @param strictBlockMatching whether an unmatched block opener aborts the reconstruction
	 */
	public void setStrictBlockMatching(boolean strictBlockMatching) {
		this.strictBlockMatching = strictBlockMatching;
	}

	/**
	 * @return whether the decoded instructions are printed
	 */
	public boolean isDumpInstructions() {
		return dumpInstructions;
	}

	/**
	 * @param dumpInstructions whether the decoded instructions are printed
	 */
	public void setDumpInstructions(boolean dumpInstructions) {
		this.dumpInstructions = dumpInstructions;
	}
}
