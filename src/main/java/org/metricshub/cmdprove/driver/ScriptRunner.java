package org.metricshub.cmdprove.driver;

/*-
 * ╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲╱╲
 * cmdprove
 * ჻჻჻჻჻჻
 * Copyright (C) 2025 MetricsHub
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
import java.io.IOException;
import java.io.PrintStream;
import java.lang.reflect.InvocationTargetException;
import java.nio.file.Files;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import org.metricshub.cmdprove.ExitException;
import org.metricshub.cmdprove.HarnessException;
import org.metricshub.cmdprove.TestContext;
import org.metricshub.cmdprove.TestEntry;
import org.metricshub.cmdprove.TestRegistry;
import org.metricshub.cmdprove.TestScript;
import org.metricshub.cmdprove.TestUsageException;
import org.metricshub.cmdprove.assertion.CommandAssertion;
import org.metricshub.cmdprove.capture.CaptureStore;
import org.metricshub.cmdprove.compare.GlobPattern;
import org.metricshub.cmdprove.compare.GlobSyntaxException;
import org.metricshub.cmdprove.report.ReportWriter;
import org.metricshub.cmdprove.report.TestAccounting;
import org.metricshub.cmdprove.util.ProveLogger;
import org.metricshub.cmdprove.util.ProveSettings;
import org.slf4j.Logger;

/**
 * Runs the test functions of one script, inside the script process.
 * <p>
 * The functions owned by the script whose name matches the test-function
 * pattern are run in registration order, each in its own level. When the
 * settings list functions to include, only those run. An included function
 * that the script does not have is a harness error: the run still completes,
 * but the script ends as aborted.
 */
public class ScriptRunner {

	private static final Logger LOGGER = ProveLogger.getLogger(ScriptRunner.class);

	private final ProveSettings settings;
	private final PrintStream out;
	private final PrintStream err;
	private TestContext lastContext;

	/**
	 * @param settings settings of the run; the output directory must be set
	 * @param out stream receiving the test report
	 * @param err stream receiving errors and <code>For details</code> lines
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public ScriptRunner(ProveSettings settings, PrintStream out, PrintStream err) {
		this.settings = settings;
		this.out = out;
		this.err = err;
	}

	/**
	 * Instantiates the script class and runs it.
	 *
	 * @param scriptClassName fully qualified name of a {@link TestScript}
	 * @return the exit code of the script, as {@link #run(TestScript)}
	 * @throws HarnessException if the script cannot be loaded, or aborts
	 */
	public int run(String scriptClassName) {
		return run(instantiate(scriptClassName));
	}

	/**
	 * Runs a script.
	 *
	 * @param script the script
	 * @return {@link ExitException#EXIT_SUCCESS} when every test passed,
	 *         {@link ExitException#EXIT_FAILURES} when some failed, and
	 *         {@link ExitException#EXIT_ABORTED} when an included function was
	 *         not found in the script
	 * @throws HarnessException if the script aborts
	 */
	public int run(TestScript script) {
		String scriptName = script.getClass().getName();
		if (settings.getSourcePath() == null) {
			settings.setSourcePath(scriptName);
		}
		if (settings.getOutputDirectory() == null) {
			try {
				settings.setOutputDirectory(Files.createTempDirectory("command-verify."));
			} catch (IOException e) {
				throw new HarnessException("Failed to create temp dir: " + e.getMessage(), e);
			}
		}
		GlobPattern pattern;
		try {
			pattern = GlobPattern.compile(settings.getFunctionPattern());
		} catch (GlobSyntaxException e) {
			throw new TestUsageException("Invalid test function pattern: " + e.getMessage(), e);
		}

		TestRegistry registry = TestRegistry.load(script);
		List<TestEntry> functions = registry.discover(scriptName, pattern);
		LOGGER.debug("Test functions of {}: {}", scriptName, functions);

		TestAccounting accounting = new TestAccounting(new ReportWriter(out));
		CommandAssertion commandAssertion = new CommandAssertion(
				settings,
				new CaptureStore(settings.getOutputDirectory()),
				accounting,
				err);
		TestContext context = new TestContext(settings, accounting, commandAssertion, registry);
		lastContext = context;

		// name => executed
		Map<String, Boolean> included = new LinkedHashMap<String, Boolean>();
		for (String name : settings.getIncludedFunctions()) {
			included.put(name, Boolean.FALSE);
		}
		boolean filter = !included.isEmpty();

		int failureCount = 0;
		for (TestEntry entry : functions) {
			if (filter) {
				if (!included.containsKey(entry.getName())) {
					continue;
				}
				included.put(entry.getName(), Boolean.TRUE);
			}
			if (!context.subtest(entry.getName(), entry.getFunction())) {
				failureCount++;
			}
		}

		int missing = 0;
		for (Map.Entry<String, Boolean> inclusion : included.entrySet()) {
			if (!inclusion.getValue().booleanValue()) {
				err.println(
						"TEST ERROR: '" + inclusion.getKey() + "': Subtest in inclusion list not found in script: '"
								+ scriptName + "'");
				err.flush();
				missing++;
			}
		}

		LOGGER.debug("{}: {} failure(s), {} included function(s) not found", scriptName, failureCount, missing);
		if (missing > 0) {
			return ExitException.EXIT_ABORTED;
		}
		return failureCount == 0 ? ExitException.EXIT_SUCCESS : ExitException.EXIT_FAILURES;
	}

	/**
	 * @return the context of the latest run, or <code>null</code> before any run
	 */
	public TestContext getLastContext() {
		return lastContext;
	}

	private static TestScript instantiate(String scriptClassName) {
		try {
			Class<?> clazz = Class.forName(scriptClassName);
			if (!TestScript.class.isAssignableFrom(clazz)) {
				throw new HarnessException(
						"Test script " + scriptClassName + " does not implement " + TestScript.class.getName());
			}
			return clazz.asSubclass(TestScript.class).getDeclaredConstructor().newInstance();
		} catch (ClassNotFoundException e) {
			throw new HarnessException("Test file not found: '" + scriptClassName + "'", e);
		} catch (InstantiationException | IllegalAccessException | NoSuchMethodException e) {
			throw new HarnessException("Cannot instantiate test script " + scriptClassName, e);
		} catch (InvocationTargetException e) {
			Throwable cause = e.getCause();
			if (cause instanceof RuntimeException) {
				throw (RuntimeException) cause;
			}
			throw new HarnessException("Cannot instantiate test script " + scriptClassName, cause);
		}
	}
}
