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
import java.io.PrintStream;
import java.nio.file.Path;
import org.metricshub.cmdprove.ExitException;
import org.metricshub.cmdprove.HarnessException;
import org.metricshub.cmdprove.TestContext;
import org.metricshub.cmdprove.assertion.CommandAssertion;
import org.metricshub.cmdprove.util.ProveLogger;
import org.metricshub.cmdprove.util.ProveSettings;

/**
 * Entry point of the process running one test script.
 * <p>
 * The settings come from the environment prepared by {@link TestDriver},
 * the script class name from the only argument. The exit code of the
 * process tells the driver how the script went:
 * {@link ExitException#EXIT_SUCCESS}, {@link ExitException#EXIT_FAILURES}, or
 * {@link ExitException#EXIT_ABORTED} when the script could not complete.
 */
public final class ScriptMain {

	private ScriptMain() {}

	/**
	 * Runs a script and returns the exit code of the process, reporting
	 * aborted runs on <code>err</code>.
	 *
	 * @param script class name of the script
	 * @param settings settings of the run
	 * @param out stream receiving the test report
	 * @param err stream receiving the errors
	 * @return the exit code
	 */
	public static int invoke(String script, ProveSettings settings, PrintStream out, PrintStream err) {
		if (settings.isDebug()) {
			ProveLogger.enableDebug();
		}
		ScriptRunner runner = new ScriptRunner(settings, out, err);
		try {
			return runner.run(script);
		} catch (HarnessException e) {
			out.flush();
			err.println("TEST ERROR: " + e.getMessage());
			err.flush();
			return ExitException.EXIT_ABORTED;
		} catch (RuntimeException | Error e) {
			out.flush();
			err.println("ERROR: Test script execution failed.");
			e.printStackTrace(err);
			TestContext context = runner.getLastContext();
			Path lastStderrFile = context == null ? null : context.getLastStderrFile();
			if (lastStderrFile != null) {
				err.println(CommandAssertion.DETAILS_PREFIX + lastStderrFile);
			}
			err.flush();
			return ExitException.EXIT_ABORTED;
		} finally {
			out.flush();
		}
	}

	/**
	 * @param args class name of the script to run
	 */
	@SuppressFBWarnings(value = "DM_EXIT", justification = "the exit code is the result of the process")
	public static void main(String[] args) {
		if (args.length != 1) {
			System.err.println("Usage: " + ScriptMain.class.getName() + " script-class");
			System.exit(ExitException.EXIT_USAGE);
		}
		ProveSettings settings = ProveSettings.fromEnvironment(System.getenv());
		System.exit(invoke(args[0], settings, System.out, System.err));
	}
}
