package org.metricshub.cmdprove;

import static org.junit.Assert.*;

import java.io.ByteArrayInputStream;
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.Arrays;
import java.util.Collections;
import org.junit.Assume;
import org.junit.Before;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.metricshub.cmdprove.util.ProveSettings;

public class CliTest {

	private static final boolean IS_WINDOWS = System.getProperty("os.name").contains("Windows");

	@Rule
	public TemporaryFolder tmp = new TemporaryFolder();

	private ByteArrayOutputStream out;
	private ByteArrayOutputStream err;
	private boolean inputClosed;
	private Cli cli;

	@Before
	public void setUp() {
		out = new ByteArrayOutputStream();
		err = new ByteArrayOutputStream();
		ByteArrayInputStream in = new ByteArrayInputStream(new byte[0]) {
			@Override
			public void close() throws IOException {
				inputClosed = true;
				super.close();
			}
		};
		cli = new Cli(new ProveSettings(), in, new PrintStream(out, true), new PrintStream(err, true));
	}

	@Test
	public void testOptions() {
		Path dir = tmp.getRoot().toPath().resolve("captures");
		cli.parse(new String[] { "-d", "-o", dir.toString(), "-n", "smoke", "-p", "check_*", "a.Script", "b.Script" });
		ProveSettings settings = cli.getSettings();
		assertTrue(settings.isDebug());
		assertEquals(dir, settings.getOutputDirectory());
		assertEquals("smoke", settings.getTestName());
		assertEquals("check_*", settings.getFunctionPattern());
		assertEquals(Arrays.asList("a.Script", "b.Script"), cli.getScripts());
		assertFalse(cli.isPrintUsage());
	}

	@Test
	public void testFilterAddsItsScripts() {
		cli.parse(new String[] { "-t", "b.Script:test_x", "-t", "c.Script:test_y", "a.Script", "b.Script" });
		assertEquals(Arrays.asList("a.Script", "b.Script", "c.Script"), cli.getScripts());
		assertEquals(Collections.singletonList("test_x"), cli.getFilter().functionsFor("b.Script"));
	}

	@Test
	public void testFilterSameFunctionInTwoScripts() {
		cli.parse(new String[] { "-t", "a.Script:test_x", "-t", "b.Script:test_x" });
		assertEquals(Arrays.asList("a.Script", "b.Script"), cli.getScripts());
		assertEquals(Collections.singletonList("test_x"), cli.getFilter().functionsFor("a.Script"));
		assertEquals(Collections.singletonList("test_x"), cli.getFilter().functionsFor("b.Script"));
	}

	@Test
	public void testUsage() throws Exception {
		cli.parse(new String[] { "-h" });
		assertTrue(cli.isPrintUsage());
		cli.run();
		assertTrue(out.toString("UTF-8").startsWith("Usage:"));
		assertFalse(inputClosed);
	}

	@Test
	public void testCreate() throws Exception {
		Cli created = Cli.create(
				new String[] { "-?" },
				new ProveSettings(),
				new ByteArrayInputStream(new byte[0]),
				new PrintStream(out, true),
				new PrintStream(err, true));
		assertTrue(created.isPrintUsage());
		assertTrue(out.toString("UTF-8").contains(" -t script:function = Only run this test function."));
	}

	@Test
	public void testNoScripts() throws Exception {
		cli.parse(new String[] { "-d" });
		try {
			cli.run();
			fail("Running without scripts must fail");
		} catch (ExitException e) {
			assertEquals(ExitException.EXIT_USAGE, e.getCode());
		}
		assertEquals("ERROR: No tests given. Pass '-h' to see usage." + System.lineSeparator(), err.toString("UTF-8"));
	}

	@Test
	public void testInvalidArguments() {
		String[][] invalid = {
				{ "-x", "a.Script" },
				{ "-o" },
				{ "-n", "a/b", "a.Script" },
				{ "-t", "noFunction", "a.Script" },
				{ "-d", "-h" },
				{ "", "a.Script" } };
		for (String[] args : invalid) {
			try {
				new Cli(new ProveSettings(), new ByteArrayInputStream(new byte[0]), new PrintStream(out), new PrintStream(err))
						.parse(args);
				fail(Arrays.toString(args) + " must be rejected");
			} catch (IllegalArgumentException e) {
				assertNotNull(e.getMessage());
			}
		}
	}

	@Test
	public void testRun() throws Exception {
		Assume.assumeFalse(IS_WINDOWS);
		Path dir = tmp.getRoot().toPath().resolve("new").resolve("dir");
		cli.setLauncher(script -> Arrays.asList("sh", "-c", "exit " + (script.equals("bad.Script") ? 1 : 0)));

		cli.parse(new String[] { "-o", dir.toString(), "good.Script" });
		cli.run();
		assertTrue(Files.isDirectory(dir));
		assertTrue(inputClosed);
		assertTrue(out.toString("UTF-8").contains("All tests passed in: 'good.Script'"));

		cli.parse(new String[] { "bad.Script" });
		try {
			cli.run();
			fail("A failed script must give exit code 1");
		} catch (ExitException e) {
			assertEquals(ExitException.EXIT_FAILURES, e.getCode());
		}
	}
}
