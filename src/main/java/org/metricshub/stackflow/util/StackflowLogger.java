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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Entry point for the SLF4J loggers of Stackflow.
 * <p>
 * SLF4J reports its own provider lookup on the console unless told
 * otherwise, which pollutes the CLI output: its internal verbosity is lowered
 * to WARN, unless the <code>slf4j.internal.verbosity</code> system property
 * was already set.
 */
public final class StackflowLogger {

	private static final String SLF4J_VERBOSITY_PROPERTY = "slf4j.internal.verbosity";

	static {
		if (System.getProperty(SLF4J_VERBOSITY_PROPERTY) == null) {
			System.setProperty(SLF4J_VERBOSITY_PROPERTY, "WARN");
		}
	}

	private StackflowLogger() {
		// utility class
	}

	/**
	 * @param clazz the class that logs
	 * @return the SLF4J logger named after <code>clazz</code>
	 */
	public static Logger getLogger(Class<?> clazz) {
		return LoggerFactory.getLogger(clazz);
	}
}
