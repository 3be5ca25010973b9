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

import java.io.Closeable;
import java.io.IOException;
import java.io.Reader;

/**
 * A <code>dis</code> listing to read, with the name it is reported under.
 * The listing is read once: {@link DisassemblyReader} closes the source when
 * it is done with it.
 */
public class ListingSource implements Closeable {

	/** Description of a listing piped to the standard input. */
	public static final String DESCRIPTION_STANDARD_INPUT = "<stdin>";

	private final String description;
	private final Reader reader;

	/**
	 * @param description name of the listing in error messages, e.g. its path
	 * @param reader the listing text
	 */
	public ListingSource(String description, Reader reader) {
		this.description = description;
		this.reader = reader;
	}

	/**
	 * @return name of the listing in error messages
	 */
	public final String getDescription() {
		return description;
	}

	/**
	 * @return the reader positioned at the start of the listing
	 * @throws IOException if the listing cannot be opened
	 */
	public Reader getReader() throws IOException {
		return reader;
	}

	/** {@inheritDoc} */
	@Override
	public void close() throws IOException {
		if (reader != null) {
			reader.close();
		}
	}

	/** {@inheritDoc} */
	@Override
	public String toString() {
		return getDescription();
	}
}
