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
import java.io.ByteArrayOutputStream;
import java.io.IOException;
import java.io.PrintStream;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Map;
import org.metricshub.cmdprove.ExitException;
import org.metricshub.cmdprove.HarnessException;
import org.metricshub.cmdprove.capture.DataPump;
import org.metricshub.cmdprove.report.ReportWriter;
import org.metricshub.cmdprove.util.ProveLogger;
import org.metricshub.cmdprove.util.ProveSettings;
import org.slf4j.Logger;

/**
 * Runs test scripts one after the other, each in its own process.
 * <p>
 * The standard output and standard error of a script process are both
 * relayed live to the output of the driver. The standard error is also
 * kept aside: when the script does not succeed, the files named by its
 * <code>For details, see: &lt;file&gt;</code> lines are printed after the
 * status line of the script.
 */
public class TestDriver {

	private static final Logger LOGGER = ProveLogger.getLogger(TestDriver.class);

	private final ProveSettings settings;
	private final ScriptLauncher launcher;
	private final PrintStream out;
	private final ReportWriter writer;
	private final List<ScriptOutcome> outcomes = new ArrayList<ScriptOutcome>();

	/**
	 * Runs scripts in new JVMs and writes to the standard output.
	 *
	 * @param settings settings handed to the scripts
	 */
	public TestDriver(ProveSettings settings) {
		this(settings, new JvmScriptLauncher(), System.out);
	}

	/**
	 * @param settings settings handed to the scripts
	 * @param launcher builds the command line of the script processes
	 * @param out stream receiving the combined output of the scripts
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public TestDriver(ProveSettings settings, ScriptLauncher launcher, PrintStream out) {
		this.settings = settings;
		this.launcher = launcher;
		this.out = out;
		this.writer = new ReportWriter(out);
	}

	/**
	 * Runs all the scripts, the functions listed in <code>filter</code> only
	 * when it is not empty. Scripts never get any input: the standard input of
	 * each script process is closed as soon as it starts.
	 *
	 * @param scripts the scripts, in order
	 * @param filter functions to run, per script
	 * @return {@link ExitException#EXIT_SUCCESS} if every script passed,
	 *         {@link ExitException#EXIT_FAILURES} otherwise
	 */
	public int runAll(List<String> scripts, InclusionFilter filter) {
		if (settings.getOutputDirectory() == null) {
			try {
				settings.setOutputDirectory(Files.createTempDirectory("command-verify."));
			} catch (IOException e) {
				throw new HarnessException("Failed to create temp dir: " + e.getMessage(), e);
			}
		}
		LOGGER.debug("Settings:\n{}", settings.toDescriptionString());

		int failedScripts = 0;
		for (String script : scripts) {
			if (runScript(script, filter) != ExitException.EXIT_SUCCESS) {
				failedScripts++;
			}
		}
		LOGGER.debug("{} script(s) run, {} failed", scripts.size(), failedScripts);
		return failedScripts == 0 ? ExitException.EXIT_SUCCESS : ExitException.EXIT_FAILURES;
	}

	/**
	 * Runs one script in a new process.
	 *
	 * @param script the script
	 * @param filter functions to run; only the entries of this script apply
	 * @return the exit code of the script process
	 */
	public int runScript(String script, InclusionFilter filter) {
		ProveSettings scriptSettings = settings.copy();
		scriptSettings.setSourcePath(script);
		scriptSettings.clearIncludedFunctions();
		for (String function : filter.functionsFor(script)) {
			scriptSettings.addIncludedFunction(function);
		}

		writer.note(0, 0, "[RUNNING: " + script + "]");
		out.flush();

		ScriptOutcome outcome = execute(script, scriptSettings);
		outcomes.add(outcome);

		out.println(outcome.getStatusMessage());
		if (!outcome.isPassed()) {
			printDetails(outcome);
		}
		out.flush();
		return outcome.getExitCode();
	}

	private ScriptOutcome execute(String script, ProveSettings scriptSettings) {
		List<String> command = launcher.buildCommand(script);
		LOGGER.debug("Executing {}", command);

		ProcessBuilder pb = new ProcessBuilder(command);
		Map<String, String> env = pb.environment();
		// only exported when set
		env.remove(ProveSettings.ENV_DEBUG);
		env.remove(ProveSettings.ENV_INCLUDE_SUBTESTS);
		env.putAll(scriptSettings.toEnvironment());

		Process p;
		try {
			p = pb.start();
		} catch (IOException e) {
			throw new HarnessException("Cannot run test script '" + script + "': " + e.getMessage(), e);
		}
		try {
			p.getOutputStream().close();
		} catch (IOException e) {
			LOGGER.debug("Cannot close the input of {}: {}", script, e.getMessage());
		}

		ByteArrayOutputStream stderr = new ByteArrayOutputStream();
		DataPump outPump = DataPump.dump(script + "-stdout", p.getInputStream(), out);
		DataPump errPump = DataPump.dump(script + "-stderr", p.getErrorStream(), out, stderr);
		int exitCode;
		try {
			exitCode = p.waitFor();
			outPump.await();
			errPump.await();
		} catch (InterruptedException e) {
			p.destroyForcibly();
			Thread.currentThread().interrupt();
			throw new HarnessException("Interrupted while running test script '" + script + "'", e);
		}
		LOGGER.debug("Test script {} exited with {}", script, exitCode);
		return new ScriptOutcome(script, exitCode, new String(stderr.toByteArray(), StandardCharsets.UTF_8));
	}

	private void printDetails(ScriptOutcome outcome) {
		for (String file : outcome.getDetailFiles()) {
			Path path = Paths.get(file);
			if (!Files.isReadable(path)) {
				LOGGER.error("Error file not found or not readable: '{}'", file);
				continue;
			}
			try {
				byte[] content = Files.readAllBytes(path);
				out.println("-----[" + file + "]");
				out.write(content, 0, content.length);
				out.println();
				out.println("-----");
			} catch (IOException e) {
				LOGGER.error("Cannot read error file '{}': {}", file, e.getMessage());
			}
		}
	}

	/**
	 * @return the outcome of every script run so far, in order
	 */
	public List<ScriptOutcome> getOutcomes() {
		return Collections.unmodifiableList(outcomes);
	}
}
