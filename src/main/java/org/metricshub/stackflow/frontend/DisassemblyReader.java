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

import java.io.BufferedReader;
import java.io.IOException;
import java.io.Reader;
import java.util.ArrayList;
import java.util.List;
import java.util.regex.Matcher;
import java.util.regex.Pattern;
import org.metricshub.stackflow.intermediate.CodeUnit;
import org.metricshub.stackflow.intermediate.Instruction;
import org.metricshub.stackflow.util.StackflowLogger;
import org.slf4j.Logger;

/**
 * Reads the text listing printed by CPython's <code>dis</code> module into
 * code units.
 * <p>
 * Each instruction line holds, in this order: an optional source line number,
 * an optional <code>&gt;&gt;</code> jump-target marker, the offset, the opcode
 * name, an optional raw argument and an optional resolved argument between
 * parentheses. A <code>Disassembly of ...:</code> header starts a new code
 * unit. Blank lines and lines starting with <code>#</code> are skipped.
 * <p>
 * Opcode names are not checked here; unknown ones are reported when the
 * commands are rebuilt.
 */
public class DisassemblyReader {

	private static final Logger LOG = StackflowLogger.getLogger(DisassemblyReader.class);

	/** Name of the code unit found before any header. */
	public static final String TOP_LEVEL_UNIT = "<module>";

	private static final Pattern INSTRUCTION_PATTERN = Pattern
			.compile(
					"^\\s*(?:(\\d+)\\s+)?(?:-->\\s+)?(?:(>>)\\s+)?(\\d+)\\s+([A-Za-z_][A-Za-z0-9_]*)"
							+ "(?:\\s+(\\d+))?(?:\\s+\\((.*)\\))?\\s*$");

	private static final Pattern HEADER_PATTERN = Pattern.compile("^Disassembly of (.*):\\s*$");

	private static final Pattern CODE_OBJECT_PATTERN = Pattern.compile("^<code object (\\S+) at .*>$");

	private static final Pattern INTEGER_PATTERN = Pattern.compile("^-?\\d+$");

	/**
	 * Reads all the code units of a listing, then closes it.
	 *
	 * @param source the listing
	 * @return the code units, in listing order; units without instructions are dropped
	 * @throws IOException if the listing cannot be read
	 * @throws ListingFormatException if a line is not an instruction
	 */
	public List<CodeUnit> read(ListingSource source) throws IOException {
		List<CodeUnit> units = new ArrayList<CodeUnit>();
		String unitName = TOP_LEVEL_UNIT;
		List<Instruction> instructions = new ArrayList<Instruction>();
		int lineNumber = 0;

		try (ListingSource listing = source) {
			BufferedReader reader = toBufferedReader(listing.getReader());
			String line;
			while ((line = reader.readLine()) != null) {
				++lineNumber;
				String trimmed = line.trim();
				if (trimmed.isEmpty() || trimmed.startsWith("#")) {
					continue;
				}
				Matcher header = HEADER_PATTERN.matcher(trimmed);
				if (header.matches()) {
					addUnit(units, unitName, instructions);
					unitName = unitName(header.group(1));
					instructions = new ArrayList<Instruction>();
					continue;
				}
				Instruction instruction = parseInstruction(source, lineNumber, line);
				if (!instructions.isEmpty()) {
					int previous = instructions.get(instructions.size() - 1).getByteOffset();
					if (instruction.getByteOffset() <= previous) {
						throw new ListingFormatException(
								source.getDescription(),
								lineNumber,
								"offset " + instruction.getByteOffset() + " does not follow offset " + previous);
					}
				}
				instructions.add(instruction);
			}
			addUnit(units, unitName, instructions);
		}

		LOG.debug("Read {} code unit(s) from {}", units.size(), source);
		return units;
	}

	/**
	 * Reads the instructions of a listing holding a single code unit.
	 *
	 * @param source the listing
	 * @return the instructions of the first code unit, empty if there is none
	 * @throws IOException if the listing cannot be read
	 */
	public List<Instruction> readInstructions(ListingSource source) throws IOException {
		List<CodeUnit> units = read(source);
		if (units.isEmpty()) {
			return new ArrayList<Instruction>();
		}
		if (units.size() > 1) {
			LOG.warn("{} holds {} code units, only {} is read", source, units.size(), units.get(0).getName());
		}
		return units.get(0).getInstructions();
	}

	private static Instruction parseInstruction(ListingSource source, int lineNumber, String line) {
		Matcher m = INSTRUCTION_PATTERN.matcher(line);
		if (!m.matches()) {
			throw new ListingFormatException(source.getDescription(), lineNumber, "not an instruction: " + line.trim());
		}
		try {
			Integer sourceLine = m.group(1) == null ? null : Integer.valueOf(m.group(1));
			boolean jumpTarget = m.group(2) != null;
			int offset = Integer.parseInt(m.group(3));
			String opcodeName = m.group(4);
			Integer raw = m.group(5) == null ? null : Integer.valueOf(m.group(5));
			Object resolved = m.group(6) == null ? raw : resolvedValue(m.group(6));
			return new Instruction(opcodeName, raw, resolved, offset, sourceLine, jumpTarget);
		} catch (NumberFormatException e) {
			throw new ListingFormatException(source.getDescription(), lineNumber, "number out of range: " + e.getMessage());
		}
	}

	private static Object resolvedValue(String text) {
		if (INTEGER_PATTERN.matcher(text).matches()) {
			try {
				return Integer.valueOf(text);
			} catch (NumberFormatException e) {
				// too large for an int, keep the text
				return text;
			}
		}
		return text;
	}

	private static String unitName(String description) {
		Matcher m = CODE_OBJECT_PATTERN.matcher(description);
		return m.matches() ? m.group(1) : description;
	}

	private static void addUnit(List<CodeUnit> units, String name, List<Instruction> instructions) {
		if (!instructions.isEmpty()) {
			units.add(new CodeUnit(name, instructions));
		}
	}

	private static BufferedReader toBufferedReader(Reader reader) {
		return reader instanceof BufferedReader ? (BufferedReader) reader : new BufferedReader(reader);
	}
}
