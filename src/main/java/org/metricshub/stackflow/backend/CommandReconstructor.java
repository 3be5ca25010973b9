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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.stackflow.DanglingBlockOpenerException;
import org.metricshub.stackflow.ReconstructionException;
import org.metricshub.stackflow.intermediate.CodeUnit;
import org.metricshub.stackflow.intermediate.Instruction;
import org.metricshub.stackflow.util.ReconstructSettings;
import org.metricshub.stackflow.util.StackflowLogger;
import org.slf4j.Logger;

/**
 * Rebuilds all the top-level commands of a code unit, by extracting
 * commands from the end of the instruction list until its start is reached.
 * <p>
 * A block opener that no block-closing command claims ends up as a top-level
 * command. This is allowed and logged, unless
 * {@link ReconstructSettings#isStrictBlockMatching()} is set.
 */
public class CommandReconstructor {

	private static final Logger LOG = StackflowLogger.getLogger(CommandReconstructor.class);

	private final CommandExtractor extractor;

	private final boolean strictBlockMatching;

	public CommandReconstructor() {
		this(new ReconstructSettings());
	}

	/**
	 * @param settings the reconstruction settings
	 */
	public CommandReconstructor(ReconstructSettings settings) {
		this.extractor = new CommandExtractor(settings);
		this.strictBlockMatching = settings.isStrictBlockMatching();
		if (LOG.isDebugEnabled()) {
			LOG.debug("Reconstruct settings:\n{}", settings.toDescriptionString());
		}
	}

	/**
	 * Rebuilds the commands of one code unit.
	 *
	 * @param instructions the instructions of the code unit, in offset order
	 * @return the top-level commands in program order, unmodifiable
	 * @throws org.metricshub.stackflow.ReconstructionException if the
	 *         instructions cannot be rebuilt; no partial result is returned
	 */
	public List<Command> reconstruct(List<Instruction> instructions) {
		List<Command> commands = new ArrayList<Command>();
		int cursor = instructions.size();
		while (cursor > 0) {
			ExtractedCommand extracted = extractor.extractCommand(instructions, cursor);
			cursor = extracted.getCursor();
			Command command = extracted.getCommand();
			if (command.getOperation().opensBlock()) {
				if (strictBlockMatching) {
					throw new DanglingBlockOpenerException(command.getByteOffset(), command.getOperation().getName());
				}
				LOG.warn("Block opened by {} at offset {} is never closed", command.getOperation().getName(), command.getByteOffset());
			}
			commands.add(command);
		}
		Collections.reverse(commands);
		return Collections.unmodifiableList(commands);
	}

	/**
	 * Rebuilds the commands of a named code unit.
	 *
	 * @param unit the code unit
	 * @return the top-level commands in program order, unmodifiable
	 * @throws ReconstructionException if the instructions cannot be rebuilt;
	 *         the exception carries the name of the code unit
	 */
	public List<Command> reconstruct(CodeUnit unit) {
		LOG.debug("Rebuilding {}", unit);
		List<Command> commands;
		try {
			commands = reconstruct(unit.getInstructions());
		} catch (ReconstructionException e) {
			e.setCodeUnitName(unit.getName());
			LOG.warn("Failed to rebuild {}: {}", unit.getName(), e.getMessage());
			throw e;
		}
		LOG.debug("Rebuilt {} top-level command(s) for {}", commands.size(), unit.getName());
		return commands;
	}
}
