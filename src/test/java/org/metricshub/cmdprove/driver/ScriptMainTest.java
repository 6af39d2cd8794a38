package org.metricshub.cmdprove.driver;

import static org.junit.Assert.*;

import java.io.ByteArrayOutputStream;
import java.io.PrintStream;
import org.junit.Assume;
import org.junit.Before;
import org.junit.BeforeClass;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.metricshub.cmdprove.ExitException;
import org.metricshub.cmdprove.scripts.AbortingScript;
import org.metricshub.cmdprove.scripts.CrashingScript;
import org.metricshub.cmdprove.scripts.FailingScript;
import org.metricshub.cmdprove.scripts.PassingScript;
import org.metricshub.cmdprove.util.ProveSettings;

public class ScriptMainTest {

	private static final boolean IS_WINDOWS = System.getProperty("os.name").contains("Windows");

	@Rule
	public TemporaryFolder tmp = new TemporaryFolder();

	private ProveSettings settings;
	private ByteArrayOutputStream out;
	private ByteArrayOutputStream err;

	@BeforeClass
	public static void posixOnly() {
		Assume.assumeFalse(IS_WINDOWS);
	}

	@Before
	public void setUp() {
		settings = new ProveSettings();
		settings.setOutputDirectory(tmp.getRoot().toPath());
		out = new ByteArrayOutputStream();
		err = new ByteArrayOutputStream();
	}

	private int invoke(Class<?> script) {
		return ScriptMain.invoke(script.getName(), settings, new PrintStream(out, true), new PrintStream(err, true));
	}

	@Test
	public void testFailures() {
		assertEquals(ExitException.EXIT_FAILURES, invoke(FailingScript.class));
	}

	@Test
	public void testUsageError() throws Exception {
		assertEquals(ExitException.EXIT_ABORTED, invoke(AbortingScript.class));
		assertEquals(
				"TEST ERROR: At least two arguments must be provided (description, command)." + System.lineSeparator(),
				err.toString("UTF-8"));
	}

	@Test
	public void testIncludedFunctionNotFound() throws Exception {
		settings.addIncludedFunction("test_nope");
		assertEquals(ExitException.EXIT_ABORTED, invoke(PassingScript.class));
		assertEquals(
				"TEST ERROR: 'test_nope': Subtest in inclusion list not found in script: '"
						+ PassingScript.class.getName() + "'" + System.lineSeparator(),
				err.toString("UTF-8"));
	}

	@Test
	public void testUnknownScript() throws Exception {
		assertEquals(ExitException.EXIT_ABORTED, ScriptMain.invoke("no.such.Script", settings, new PrintStream(out, true), new PrintStream(err, true)));
		assertTrue(err.toString("UTF-8").startsWith("TEST ERROR: Test file not found: 'no.such.Script'"));
	}

	@Test
	public void testCrashPointsAtLastStderr() throws Exception {
		assertEquals(ExitException.EXIT_ABORTED, invoke(CrashingScript.class));
		String err = this.err.toString("UTF-8");
		assertTrue(err, err.startsWith("ERROR: Test script execution failed."));
		assertTrue(err, err.contains("simulated crash"));
		assertTrue(err, err.endsWith("For details, see: " + tmp.getRoot().toPath().resolve("test00.err") + System.lineSeparator()));
	}
}
