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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import org.metricshub.cmdprove.ExitException;
import org.metricshub.cmdprove.assertion.CommandAssertion;

/**
 * Result of the process that ran one test script: its exit code and what
 * it wrote to its standard error.
 */
public final class ScriptOutcome {

	private final String script;
	private final int exitCode;
	private final String stderr;

	/**
	 * @param script the script
	 * @param exitCode exit code of the script process
	 * @param stderr everything the process wrote to its standard error
	 */
	public ScriptOutcome(String script, int exitCode, String stderr) {
		this.script = script;
		this.exitCode = exitCode;
		this.stderr = stderr;
	}

	public String getScript() {
		return script;
	}

	public int getExitCode() {
		return exitCode;
	}

	public String getStderr() {
		return stderr;
	}

	public boolean isPassed() {
		return exitCode == ExitException.EXIT_SUCCESS;
	}

	/**
	 * @return the one-line status printed once the script is done
	 */
	public String getStatusMessage() {
		switch (exitCode) {
		case ExitException.EXIT_SUCCESS:
			return "All tests passed in: '" + script + "'";
		case ExitException.EXIT_FAILURES:
			return "Some tests failed in: '" + script + "'";
		case ExitException.EXIT_ABORTED:
			return "Test script did not finish gracefully.";
		default:
			return "Unknown error when executing test script (retcode: " + exitCode + ").";
		}
	}

	/**
	 * Files pointed at by the <code>For details, see: </code> lines of the
	 * standard error, in order of appearance.
	 *
	 * @return the file names, possibly empty
	 */
	public List<String> getDetailFiles() {
		List<String> files = new ArrayList<String>();
		for (String line : stderr.split("\r?\n")) {
			if (line.startsWith(CommandAssertion.DETAILS_PREFIX)) {
				files.add(line.substring(CommandAssertion.DETAILS_PREFIX.length()));
			}
		}
		return Collections.unmodifiableList(files);
	}

	@Override
	public String toString() {
		return script + " (" + exitCode + ")";
	}
}
