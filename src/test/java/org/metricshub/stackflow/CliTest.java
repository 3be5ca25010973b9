package org.metricshub.stackflow;

import static org.junit.Assert.assertEquals;
import static org.junit.Assert.assertFalse;
import static org.junit.Assert.assertNull;
import static org.junit.Assert.assertThrows;
import static org.junit.Assert.assertTrue;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.util.Arrays;
import java.util.List;
import org.junit.Test;
import org.metricshub.stackflow.frontend.ListingFileSource;
import org.metricshub.stackflow.frontend.ListingSource;
import org.metricshub.stackflow.util.ReconstructSettings;

public class CliTest {

	private static List<String> run(InputStream in, String... args) throws IOException {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		ByteArrayOutputStream err = new ByteArrayOutputStream();
		Cli
				.create(
						args,
						in,
						new PrintStream(out, true, StandardCharsets.UTF_8),
						new PrintStream(err, true, StandardCharsets.UTF_8));
		return Arrays.asList(out.toString(StandardCharsets.UTF_8).split("\\R"));
	}

	private static InputStream listing() {
		InputStream stream = CliTest.class.getResourceAsStream("/listings/module.dis");
		if (stream == null) {
			throw new IllegalStateException("Missing test listing");
		}
		return stream;
	}

	private static Cli parse(String... args) {
		Cli cli = new Cli(new ByteArrayInputStream(new byte[0]), System.out, System.err);
		cli.parse(args);
		return cli;
	}

	@Test
	public void printsCommandsOfEveryCodeUnit() throws Exception {
		List<String> lines = run(listing(), "-");

		assertEquals("Commands of <module>:", lines.get(0));
		assertEquals("   1:0         LOAD_NAME y", lines.get(1));
		assertTrue(lines.contains(">    :32 POP_BLOCK"));
		assertTrue(lines.contains(">   4:34         LOAD_CONST <code object f at 0x7f3a2c1e5930, file \"module.py\", line 4>"));
		int function = lines.indexOf("Commands of f:");
		assertTrue(function > 0);
		assertEquals("units are separated by a blank line", "", lines.get(function - 1));
		assertEquals("   5:0         LOAD_FAST a", lines.get(function + 1));
		assertEquals("     :6 RETURN_VALUE", lines.get(lines.size() - 1));
	}

	@Test
	public void dumpsInstructionsOnRequest() throws Exception {
		List<String> lines = run(listing(), "--dump-instructions", "-");

		assertEquals("Commands of <module>:", lines.get(0));
		assertTrue(lines.get(1), lines.get(1).matches("^\\s+1\\s+0 LOAD_NAME\\s+0 \\(y\\)$"));
		assertTrue(lines.contains(""));
		assertTrue(lines.contains("   1:0         LOAD_NAME y"));
	}

	@Test
	public void strictModeFailsOnUnclosedBlock() {
		byte[] listing = "0 SETUP_EXCEPT 4 (to 6)\n2 LOAD_CONST 0 (1)\n4 POP_TOP\n".getBytes(StandardCharsets.UTF_8);

		DanglingBlockOpenerException e = assertThrows(
				DanglingBlockOpenerException.class,
				() -> run(new ByteArrayInputStream(listing), "--strict", "-"));

		assertEquals(0, e.getByteOffset());
	}

	@Test
	public void reportsFailuresWithTheirOffset() {
		byte[] listing = "0 LOAD_CONST 0 (1)\n2 FROBNICATE\n".getBytes(StandardCharsets.UTF_8);
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		ByteArrayOutputStream err = new ByteArrayOutputStream();
		Cli cli = new Cli(
				new ByteArrayInputStream(listing),
				new PrintStream(out, true, StandardCharsets.UTF_8),
				new PrintStream(err, true, StandardCharsets.UTF_8));

		assertEquals(1, cli.execute(new String[] { "-" }));
		String message = err.toString(StandardCharsets.UTF_8);
		assertTrue(message, message.startsWith("UnsupportedOpcodeException in <module> (offset 2): "));
		assertEquals("nothing is printed for a failed code unit", "", out.toString(StandardCharsets.UTF_8));
	}

	@Test
	public void namesTheFailingCodeUnit() {
		String listing = "0 LOAD_CONST 0 (None)\n2 RETURN_VALUE\n\n"
				+ "Disassembly of <code object broken at 0x7f00, file \"m.py\", line 3>:\n"
				+ "0 LOAD_FAST 0 (a)\n2 FROBNICATE\n";
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		ByteArrayOutputStream err = new ByteArrayOutputStream();
		Cli cli = new Cli(
				new ByteArrayInputStream(listing.getBytes(StandardCharsets.UTF_8)),
				new PrintStream(out, true, StandardCharsets.UTF_8),
				new PrintStream(err, true, StandardCharsets.UTF_8));

		assertEquals(1, cli.execute(new String[] { "-" }));
		String message = err.toString(StandardCharsets.UTF_8);
		assertTrue(message, message.startsWith("UnsupportedOpcodeException in broken (offset 2): "));
		String output = out.toString(StandardCharsets.UTF_8);
		assertTrue(output, output.startsWith("Commands of <module>:"));
		assertFalse(output, output.contains("Commands of broken:"));
	}

	@Test
	public void reportsMissingListingFile() {
		ByteArrayOutputStream err = new ByteArrayOutputStream();
		Cli cli = new Cli(
				new ByteArrayInputStream(new byte[0]),
				new PrintStream(new ByteArrayOutputStream(), true, StandardCharsets.UTF_8),
				new PrintStream(err, true, StandardCharsets.UTF_8));

		assertEquals(1, cli.execute(new String[] { "-f", "no/such/listing.dis" }));
		assertTrue(err.toString(StandardCharsets.UTF_8).contains("no/such/listing.dis"));
	}

	@Test
	public void executeSucceeds() {
		ByteArrayOutputStream out = new ByteArrayOutputStream();
		Cli cli = new Cli(listing(), new PrintStream(out, true, StandardCharsets.UTF_8), System.err);

		assertEquals(0, cli.execute(new String[] { "-" }));
		assertTrue(out.toString(StandardCharsets.UTF_8).startsWith("Commands of <module>:"));
	}

	@Test
	public void printsUsage() throws Exception {
		List<String> lines = run(new ByteArrayInputStream(new byte[0]), "-h");

		assertEquals("Usage:", lines.get(0));
		assertTrue(lines.contains(" -h or -? = This help screen."));
	}

	@Test
	public void parsesSettings() {
		Cli cli = parse("--shift", "16", "--strict", "--dump-instructions", "-");

		ReconstructSettings settings = cli.getSettings();
		assertEquals(16, settings.getExtendedArgShift());
		assertTrue(settings.isStrictBlockMatching());
		assertTrue(settings.isDumpInstructions());
		assertEquals(ListingSource.DESCRIPTION_STANDARD_INPUT, cli.getListingSource().getDescription());
		assertEquals(
				"extendedArgShift = 16\nstrictBlockMatching = true\ndumpInstructions = true\n",
				settings.toDescriptionString());
	}

	@Test
	public void defaultsToPlainReconstruction() {
		Cli cli = parse("-f", "program.dis");

		assertEquals(ReconstructSettings.DEFAULT_EXTENDED_ARG_SHIFT, cli.getSettings().getExtendedArgShift());
		assertFalse(cli.getSettings().isStrictBlockMatching());
		assertTrue(cli.getListingSource() instanceof ListingFileSource);
		assertEquals("program.dis", cli.getListingSource().getDescription());
	}

	@Test
	public void usageTakesNoListing() {
		assertNull(parse().getListingSource());
		assertThrows(IllegalArgumentException.class, () -> parse("-h", "-"));
	}

	@Test
	public void rejectsBadArguments() {
		assertThrows(IllegalArgumentException.class, () -> parse("--frobnicate", "-"));
		assertThrows(IllegalArgumentException.class, () -> parse("--shift", "eight", "-"));
		assertThrows(IllegalArgumentException.class, () -> parse("--shift", "0", "-"));
		assertThrows(IllegalArgumentException.class, () -> parse("--shift"));
		assertThrows(IllegalArgumentException.class, () -> parse("--strict"));
		assertThrows(IllegalArgumentException.class, () -> parse("a.dis", "b.dis"));
	}
}
