package org.metricshub.cmdprove;

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

import java.nio.charset.StandardCharsets;
import java.nio.file.Path;
import org.metricshub.cmdprove.assertion.AssertRequest;
import org.metricshub.cmdprove.assertion.AssertionResult;
import org.metricshub.cmdprove.assertion.CommandAssertion;
import org.metricshub.cmdprove.report.TestAccounting;
import org.metricshub.cmdprove.util.ProveLogger;
import org.metricshub.cmdprove.util.ProveSettings;
import org.slf4j.Logger;

/**
 * The API available to test functions.
 * <p>
 * One context is shared by all the functions of a script run, one at a time.
 */
public class TestContext {

	private static final Logger LOGGER = ProveLogger.getLogger(TestContext.class);

	private final ProveSettings settings;
	private final TestAccounting accounting;
	private final CommandAssertion commandAssertion;
	private final TestRegistry registry;
	private Path lastStderrFile;

	/**
	 * @param settings settings of the run
	 * @param accounting where results are recorded
	 * @param commandAssertion executes assertions
	 * @param registry functions of the script, for {@link #call(String)}
	 */
	public TestContext(
			ProveSettings settings,
			TestAccounting accounting,
			CommandAssertion commandAssertion,
			TestRegistry registry) {
		this.settings = settings;
		this.accounting = accounting;
		this.commandAssertion = commandAssertion;
		this.registry = registry;
	}

	/**
	 * Runs a command and checks its outputs. See {@link AssertRequest} for the
	 * arguments. The command inherits the standard input of the script
	 * process, which the driver closes.
	 *
	 * @param args description, options, <code>--</code> and the command
	 * @return 0, or the number of failed channels when <code>-f</code> is given
	 * @throws TestUsageException if the arguments are malformed
	 */
	public int assertCommand(String... args) {
		return doAssert(null, args);
	}

	/**
	 * Same as {@link #assertCommand(String...)}, feeding <code>input</code> to
	 * the standard input of the command.
	 *
	 * @param input data for the command's standard input (UTF-8)
	 * @param args description, options, <code>--</code> and the command
	 * @return 0, or the number of failed channels when <code>-f</code> is given
	 */
	public int assertCommandWithInput(String input, String... args) {
		return doAssert(input.getBytes(StandardCharsets.UTF_8), args);
	}

	private int doAssert(byte[] input, String[] args) {
		AssertRequest request = AssertRequest.parse(args, settings);
		AssertionResult result = commandAssertion.run(request, input);
		lastStderrFile = result.getCaptureFiles().getErr();
		return request.isFailOnError() ? result.getFailureCount() : 0;
	}

	/**
	 * Writes a comment in the test output.
	 *
	 * @param message the comment, possibly multi-line
	 */
	public void note(String message) {
		accounting.note(0, message);
	}

	/**
	 * Writes a comment, indented by two spaces per level after the
	 * <code>#</code>.
	 *
	 * @param level indentation level
	 * @param message the comment
	 */
	public void note(int level, String message) {
		accounting.note(level, message);
	}

	/**
	 * Describes the current test in the output.
	 *
	 * @param description the description
	 */
	public void describe(String description) {
		note(description);
	}

	/**
	 * Runs <code>body</code> in a nested level named <code>name</code>. If the
	 * body throws, a failure is recorded in the level, which is closed in any
	 * case. Harness errors and JVM failures other than a stack overflow are
	 * propagated after closing.
	 *
	 * @param name name of the level
	 * @param body the grouped tests
	 * @return whether nothing failed in the level
	 */
	public boolean subtest(String name, TestFunction body) {
		TestAccounting.Scope scope = accounting.enter(name);
		try {
			body.run(this);
		} catch (HarnessException e) {
			throw e;
		} catch (Throwable e) {
			// a stack overflow only ends the test function, other JVM failures end the script
			if (e instanceof VirtualMachineError && !(e instanceof StackOverflowError)) {
				throw (VirtualMachineError) e;
			}
			LOGGER.error("Test function '{}' terminated abnormally", name, e);
			accounting.record("Abnormal return from test function: '" + name + "' (" + e + ")", false);
		} finally {
			scope.close();
		}
		return scope.isPassed();
	}

	/**
	 * Calls a registered function, from the script or from an included
	 * library, without opening a level.
	 *
	 * @param name name of the function
	 * @throws Exception whatever the function throws
	 * @throws TestUsageException if no such function is registered
	 */
	public void call(String name) throws Exception {
		TestEntry entry = registry.get(name);
		if (entry == null) {
			throw new TestUsageException("Unknown function: '" + name + "'");
		}
		entry.getFunction().run(this);
	}

	public ProveSettings getSettings() {
		return settings;
	}

	/**
	 * @return the directory holding the capture files
	 */
	public Path getOutputDirectory() {
		return settings.getOutputDirectory();
	}

	/**
	 * @return the script being run
	 */
	public String getSourcePath() {
		return settings.getSourcePath();
	}

	/**
	 * @return the stderr capture file of the latest assertion, or <code>null</code>
	 */
	public Path getLastStderrFile() {
		return lastStderrFile;
	}

	public TestAccounting getAccounting() {
		return accounting;
	}
}
