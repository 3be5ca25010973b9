package org.metricshub.stackflow;

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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.InputStreamReader;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.List;
import org.metricshub.stackflow.backend.Command;
import org.metricshub.stackflow.backend.CommandReconstructor;
import org.metricshub.stackflow.frontend.DisassemblyReader;
import org.metricshub.stackflow.frontend.ListingFileSource;
import org.metricshub.stackflow.frontend.ListingSource;
import org.metricshub.stackflow.intermediate.CodeUnit;
import org.metricshub.stackflow.intermediate.InstructionList;
import org.metricshub.stackflow.util.ReconstructSettings;

/**
 * Command-line interface for Stackflow: reads a <code>dis</code> listing and
 * prints the commands rebuilt for each of its code units.
 */
public final class Cli {

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "stackflow.jar";
		}
		JAR_NAME = myName;
	}

	private final ReconstructSettings settings = new ReconstructSettings();
	private final InputStream in;
	private final PrintStream out;
	private final PrintStream err;

	private ListingSource listingSource;
	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard input and output streams.
	 */
	public Cli() {
		this(System.in, System.out, System.err);
	}

	/**
	 * @param in stream from which the listing is read when no file is given
	 * @param out stream where commands are written
	 * @param err stream where failures are reported by {@link #execute(String[])}
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(InputStream in, PrintStream out, PrintStream err) {
		this.in = in;
		this.out = out;
		this.err = err;
	}

	/**
	 * Returns the mutable {@link ReconstructSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public ReconstructSettings getSettings() {
		return settings;
	}

	/**
	 * @return the listing to read, or {@code null} before parsing or when only usage is printed
	 */
	public ListingSource getListingSource() {
		return listingSource;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 */
	public void parse(String[] args) {

		// Special case: no arguments
		if (args.length == 0) {
			printUsage = true;
			return;
		}

		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.charAt(0) != '-' || arg.equals("-")) {
				// end of options: the listing to read
				break;
			} else if (arg.equals("-f")) {
				// -f filename : read listing from file
				checkParameterHasArgument(args, argIdx);
				listingSource = new ListingFileSource(args[++argIdx]);
			} else if (arg.equals("--shift")) {
				// --shift n : bits carried by one instruction argument
				checkParameterHasArgument(args, argIdx);
				String value = args[++argIdx];
				try {
					settings.setExtendedArgShift(Integer.parseInt(value));
				} catch (NumberFormatException e) {
					throw new IllegalArgumentException("--shift expects a number, got '" + value + "'", e);
				}
			} else if (arg.equals("--strict")) {
				// --strict : reject block openers that are never closed
				settings.setStrictBlockMatching(true);
			} else if (arg.equals("--dump-instructions")) {
				// --dump-instructions : print instructions before the commands
				settings.setDumpInstructions(true);
			} else if (arg.equals("-h") || arg.equals("-?")) {
				// -h/-? : display usage information and exit
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			}
			++argIdx;
		}

		if (listingSource == null) {
			if (argIdx >= args.length) {
				throw new IllegalArgumentException("Listing not provided.");
			}
			String name = args[argIdx++];
			if (name.equals("-")) {
				listingSource = new ListingSource(
						ListingSource.DESCRIPTION_STANDARD_INPUT,
						new InputStreamReader(in, StandardCharsets.UTF_8));
			} else {
				listingSource = new ListingFileSource(name);
			}
		}

		if (argIdx < args.length) {
			throw new IllegalArgumentException("Unexpected argument: " + args[argIdx]);
		}
	}

	/**
	 * Ensures that the current command-line option is followed by a value.
	 *
	 * @param args full array of arguments
	 * @param argIdx index of the option that requires a value
	 */
	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Need additional argument for " + args[argIdx]);
		}
	}

	/**
	 * Executes the CLI based on the previously parsed arguments.
	 *
	 * @throws IOException if the listing cannot be read
	 * @throws ReconstructionException if the listing cannot be rebuilt
	 */
	public void run() throws IOException {
		if (printUsage) {
			usage(out);
			return;
		}

		List<CodeUnit> units = new DisassemblyReader().read(listingSource);
		CommandReconstructor reconstructor = new CommandReconstructor(settings);
		boolean first = true;
		for (CodeUnit unit : units) {
			// rebuild before printing anything of this unit
			List<Command> commands = reconstructor.reconstruct(unit);
			if (!first) {
				out.println();
			}
			first = false;
			out.println("Commands of " + unit.getName() + ":");
			if (settings.isDumpInstructions()) {
				InstructionList.dump(unit.getInstructions(), out);
				out.println();
			}
			for (Command command : commands) {
				command.dump(out);
			}
		}
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	private static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest
				.println(
						"java -jar " +
								JAR_NAME +
								" [--shift n]" +
								" [--strict]" +
								" [--dump-instructions]" +
								" [-f listing-filename | listing-filename | -]");
		dest.println();
		dest.println(" -f filename = Read the dis listing from filename.");
		dest.println(" - = Read the dis listing from the standard input.");
		dest.println(" --shift n = Number of bits carried by one instruction argument (default 8).");
		dest.println(" --strict = Fail on block openers that are never closed.");
		dest.println(" --dump-instructions = Print the instructions before the commands.");
		dest.println();
		dest.println(" -h or -? = This help screen.");
	}

	/**
	 * Convenience factory that parses arguments, executes the CLI, and returns the
	 * configured instance.
	 *
	 * @param args command-line arguments
	 * @param is input stream for the listing
	 * @param os output stream for the commands
	 * @param es error stream for diagnostic messages
	 * @return configured and executed CLI instance
	 * @throws IOException if the listing cannot be read
	 */
	public static Cli create(String[] args, InputStream is, PrintStream os, PrintStream es) throws IOException {
		Cli cli = new Cli(is, os, es);
		cli.parse(args);
		cli.run();
		return cli;
	}

	/**
	 * Parses the arguments and runs, reporting failures on the error stream
	 * instead of throwing.
	 *
	 * @param args command-line arguments
	 * @return the process exit status: 0 on success, 1 on failure
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	public int execute(String[] args) {
		try {
			parse(args);
			run();
			return 0;
		} catch (ReconstructionException e) {
			StringBuilder where = new StringBuilder(e.getClass().getSimpleName());
			if (e.getCodeUnitName() != null) {
				where.append(" in ").append(e.getCodeUnitName());
			}
			if (e.getByteOffset() >= 0) {
				where.append(" (offset ").append(e.getByteOffset()).append(')');
			}
			err.printf("%s: %s\n", where, e.getMessage());
		} catch (IllegalArgumentException e) {
			err.println("Failed to parse arguments. Please see the help/usage output (cmd line switch '-h').");
			err.println(e.getMessage());
		} catch (IOException e) {
			err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
		}
		return 1;
	}

	/**
	 * Entry point for the command-line interface.
	 *
	 * @param args command-line arguments
	 */
	public static void main(String[] args) {
		int status = new Cli().execute(args);
		if (status != 0) {
			System.exit(status);
		}
	}
}
