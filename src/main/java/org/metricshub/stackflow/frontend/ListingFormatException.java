package org.metricshub.stackflow.frontend;

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

import org.metricshub.stackflow.ReconstructionException;

/**
 * Exception thrown when a disassembly listing line cannot be read
 * as an instruction.
 */
public class ListingFormatException extends ReconstructionException {

	private static final long serialVersionUID = 1L;

	private final int listingLine;

	/**
	 * @param source description of the listing
	 * @param listingLine line number within the listing, starting at 1
	 * @param msg a {@link java.lang.String} object
	 */
	public ListingFormatException(String source, int listingLine, String msg) {
		super(source + " (line " + listingLine + "): " + msg);
		this.listingLine = listingLine;
	}

	/**
	 * @return the offending line number within the listing, starting at 1
	 */
	public int getListingLine() {
		return listingLine;
	}
}
