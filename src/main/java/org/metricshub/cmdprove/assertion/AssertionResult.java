package org.metricshub.cmdprove.assertion;

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

import java.util.Collections;
import java.util.EnumMap;
import java.util.Map;
import org.metricshub.cmdprove.capture.CaptureFiles;

/**
 * Verdict of one assertion, with the differences found per channel.
 */
public final class AssertionResult {

	private final String description;
	private final CaptureFiles captureFiles;
	private final int exitStatus;
	private final Map<Channel, String> failures;

	AssertionResult(String description, CaptureFiles captureFiles, int exitStatus, Map<Channel, String> failures) {
		this.description = description;
		this.captureFiles = captureFiles;
		this.exitStatus = exitStatus;
		Map<Channel, String> copy = new EnumMap<Channel, String>(Channel.class);
		copy.putAll(failures);
		this.failures = Collections.unmodifiableMap(copy);
	}

	public String getDescription() {
		return description;
	}

	/**
	 * @return the files holding the captured outputs
	 */
	public CaptureFiles getCaptureFiles() {
		return captureFiles;
	}

	/**
	 * @return the exit status of the command under test
	 */
	public int getExitStatus() {
		return exitStatus;
	}

	/**
	 * @return the description of the difference, per failed channel
	 */
	public Map<Channel, String> getFailures() {
		return failures;
	}

	/**
	 * @return whether all channels matched their expectation
	 */
	public boolean isPassed() {
		return failures.isEmpty();
	}

	/**
	 * @return the number of failed channels
	 */
	public int getFailureCount() {
		return failures.size();
	}

	@Override
	public String toString() {
		return (isPassed() ? "PASS " : "FAIL ") + description + " " + failures.keySet();
	}
}
