package org.metricshub.stackflow.backend;

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
 * Result of {@link CommandExtractor#extractCommand(java.util.List, int)}:
 * the command built, and the cursor to continue from.
 */
public final class ExtractedCommand {

	private final int cursor;
	private final Command command;

	ExtractedCommand(int cursor, Command command) {
		this.cursor = cursor;
		this.command = command;
	}

	/**
	 * @return the position one past the next instruction to process;
	 *         {@code 0} once the start of the code unit is reached
	 */
	public int getCursor() {
		return cursor;
	}

	public Command getCommand() {
		return command;
	}
}
