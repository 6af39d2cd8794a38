package org.metricshub.cmdprove.assertion;

import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.File;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import org.junit.Assume;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.metricshub.cmdprove.TestUsageException;
import org.metricshub.cmdprove.capture.CaptureStore;
import org.metricshub.cmdprove.report.ReportWriter;
import org.metricshub.cmdprove.report.TestAccounting;
import org.metricshub.cmdprove.util.ProveSettings;

/**
 * Runs real commands, so POSIX only.
 */
public class CommandAssertionTest {

	private static final boolean IS_WINDOWS = System.getProperty("os.name").contains("Windows");

	@Rule
	public TemporaryFolder tmp = new TemporaryFolder();

	private ProveSettings settings;
	private ByteArrayOutputStream report;
	private ByteArrayOutputStream errors;
	private TestAccounting accounting;
	private CommandAssertion commandAssertion;

	@BeforeClass
	public static void posixOnly() {
		Assume.assumeFalse(IS_WINDOWS);
	}

	@Before
	public void setUp() {
		settings = new ProveSettings();
		settings.setOutputDirectory(tmp.getRoot().toPath());
		report = new ByteArrayOutputStream();
		errors = new ByteArrayOutputStream();
		accounting = new TestAccounting(new ReportWriter(new PrintStream(report, true)));
		commandAssertion = new CommandAssertion(
				settings,
				new CaptureStore(settings.getOutputDirectory()),
				accounting,
				new PrintStream(errors, true));
	}

	private AssertionResult run(String... args) {
		return commandAssertion.run(AssertRequest.parse(args, settings), null);
	}

	private String report() throws Exception {
		return report.toString("UTF-8");
	}

	private String errors() throws Exception {
		return errors.toString("UTF-8");
	}

	private static String read(Path path) throws Exception {
		return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
	}

	@Test
	public void testPassingCommand() throws Exception {
		AssertionResult result = run("echo works", "-o", "hello", "--", "echo", "hello");
		assertTrue(result.isPassed());
		assertEquals(0, result.getExitStatus());
		assertEquals("ok 1 - echo works\n", report());
		assertEquals("", errors());

		// captured and chomped
		assertEquals("test00", result.getCaptureFiles().getBaseName());
		assertEquals("hello", read(result.getCaptureFiles().getOut()));
		assertEquals("", read(result.getCaptureFiles().getErr()));
		assertEquals("0\n", read(result.getCaptureFiles().getRet()));
		assertEquals(1, accounting.getRoot().getPassCount());
	}

	@Test
	public void testFailingStdout() throws Exception {
		AssertionResult result = run("echo mismatch", "-o", "world", "--", "echo", "hello");
		assertFalse(result.isPassed());
		assertEquals(1, result.getFailureCount());
		assertTrue(result.getFailures().containsKey(Channel.OUT));

		String report = report();
		assertTrue(report, report.startsWith("not ok 1 - echo mismatch\n"));
		assertTrue(report, report.contains("# Unexpected stdout:\n"));
		assertTrue(report, report.contains("#   -world\n"));
		assertTrue(report, report.contains("#   +hello\n"));
		assertTrue(report, report.contains("#   [See: '" + result.getCaptureFiles().getOut() + "']"));
		// nothing on stderr, nothing worth pointing at
		assertEquals("", errors());
		assertEquals(1, accounting.getRoot().getFailCount());
	}

	@Test
	public void testTrailingNewlineHandling() throws Exception {
		assertTrue(run("default", "-o", "foo", "--", "printf", "foo\\n").isPassed());
		assertFalse(run("preserved", "-p", "-o", "foo", "--", "printf", "foo\\n").isPassed());
		assertTrue(run("preserved with newline", "-p", "-o", "foo\n", "--", "printf", "foo\\n").isPassed());
	}

	@Test
	public void testInnerBlankLinesAreKept() throws Exception {
		AssertionResult result = run("blank lines", "-o", "a\n\nb", "--", "printf", "a\\n\\nb\\n\\n\\n");
		assertTrue(result.isPassed());
		assertEquals("a\n\nb", read(result.getCaptureFiles().getOut()));
	}

	@Test
	public void testExitStatus() throws Exception {
		assertTrue(run("exits 3", "-r", "3", "--", "sh", "-c", "exit 3").isPassed());

		AssertionResult result = run("unexpected status", "--", "sh", "-c", "exit 3");
		assertFalse(result.isPassed());
		assertEquals("Got exit status '3', expected '0'.", result.getFailures().get(Channel.RET));
		assertEquals("3\n", read(result.getCaptureFiles().getRet()));

		assertTrue(run("status pattern", "-rp", "[1-5]", "--", "sh", "-c", "exit 4").isPassed());
	}

	@Test
	public void testStderrAndDetailsLine() throws Exception {
		assertTrue(run("expected error", "-e", "oops", "--", "sh", "-c", "echo oops >&2").isPassed());
		assertEquals("", errors());

		AssertionResult result = run("unexpected error", "--", "sh", "-c", "echo oops >&2");
		assertFalse(result.isPassed());
		assertEquals(
				CommandAssertion.DETAILS_PREFIX + result.getCaptureFiles().getErr() + System.lineSeparator(),
				errors());
		assertTrue(report(), report().contains("# Unexpected stderr:"));
	}

	@Test
	public void testPattern() {
		assertTrue(run("digits", "-op", "+([0-9])", "--", "echo", "12345").isPassed());
		AssertionResult result = run("not digits", "-op", "+([0-9])", "--", "echo", "12a45");
		assertEquals("Pattern not matched: '+([0-9])'.\nOutput was: '12a45'.", result.getFailures().get(Channel.OUT));
	}

	@Test(expected = TestUsageException.class)
	public void testInvalidPattern() {
		run("bad pattern", "-op", "@(oops", "--", "echo", "oops");
	}

	@Test
	public void testIgnoredChannels() throws Exception {
		assertTrue(run("noisy", "-oi", "-ri", "--", "sh", "-c", "echo noise; exit 2").isPassed());
		String report = report();
		assertTrue(report, report.contains("# Ignored stdout (5 characters): '"));
		assertTrue(report, report.contains("# Ignored exit status: 2"));
	}

	@Test
	public void testIgnoredByDefault() {
		settings.ignoreByDefault(Channel.OUT);
		assertTrue(run("noise", "--", "echo", "noise").isPassed());
		assertFalse(run("explicit", "-o", "silence", "--", "echo", "noise").isPassed());
	}

	@Test
	public void testInput() throws Exception {
		AssertRequest request = AssertRequest.parse(new String[] { "reads input", "-o", "abc", "--", "cat" }, settings);
		assertTrue(commandAssertion.run(request, "abc\n".getBytes(StandardCharsets.UTF_8)).isPassed());
	}

	@Test
	public void testExpectationFile() throws Exception {
		File expected = tmp.newFile("expected.out");
		Files.write(expected.toPath(), "hello\n".getBytes(StandardCharsets.UTF_8));
		assertTrue(run("from file", "-O", expected.getPath(), "--", "echo", "hello").isPassed());
	}

	@Test
	public void testUnreadableExpectationFileAllocatesNothing() {
		try {
			run("missing file", "-O", new File(tmp.getRoot(), "nope").getPath(), "--", "echo", "hello");
			fail("Expected a usage error");
		} catch (TestUsageException e) {
			assertFalse(Files.exists(tmp.getRoot().toPath().resolve("test00.out")));
		}
	}

	@Test
	public void testCommandNotFound() throws Exception {
		AssertionResult result = run("not found", "--", "/nonexistent/command");
		assertFalse(result.isPassed());
		assertEquals(CommandAssertion.EXIT_NOT_FOUND, result.getExitStatus());
		assertTrue(read(result.getCaptureFiles().getErr()).contains("/nonexistent/command"));

		assertTrue(run("expected not found", "-r", "127", "-ei", "--", "/nonexistent/command").isPassed());
	}

	@Test
	public void testSuccessiveCapturesDoNotOverwrite() {
		AssertionResult first = run("first", "-o", "1", "--", "echo", "1");
		AssertionResult second = run("second", "-o", "2", "--", "echo", "2");
		assertEquals("test00", first.getCaptureFiles().getBaseName());
		assertEquals("test01", second.getCaptureFiles().getBaseName());
	}
}
