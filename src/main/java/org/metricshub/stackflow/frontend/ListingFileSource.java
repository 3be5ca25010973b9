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

import java.io.IOException;
import java.io.Reader;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;

/**
 * A listing stored in a UTF-8 file. The file is opened on the first call to
 * {@link #getReader()}, so that a source can be created while parsing the
 * command line without touching the file system.
 */
public class ListingFileSource extends ListingSource {

	private final Path path;
	private Reader fileReader;

	/**
	 * @param filePath path of the listing file, also used as its description
	 */
	public ListingFileSource(String filePath) {
		super(filePath, null);
		this.path = Paths.get(filePath);
	}

	/**
	 * @return path of the listing file
	 */
	public Path getPath() {
		return path;
	}

	/** {@inheritDoc} */
	@Override
	public Reader getReader() throws IOException {
		if (fileReader == null) {
			fileReader = Files.newBufferedReader(path, StandardCharsets.UTF_8);
		}
		return fileReader;
	}

	/** {@inheritDoc} */
	@Override
	public void close() throws IOException {
		if (fileReader != null) {
			fileReader.close();
			fileReader = null;
		}
	}
}
