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

/**
 * The three observable outputs of a command under test.
 */
public enum Channel {

	/** Standard output */
	OUT("stdout", ".out", "OUT"),

	/** Standard error */
	ERR("stderr", ".err", "ERR"),

	/** Exit status */
	RET("exit status", ".ret", "RET");

	private final String label;
	private final String extension;
	private final String envSuffix;

	Channel(String label, String extension, String envSuffix) {
		this.label = label;
		this.extension = extension;
		this.envSuffix = envSuffix;
	}

	/**
	 * @return human readable name, used in the test report
	 */
	public String getLabel() {
		return label;
	}

	/**
	 * @return extension of the capture file, including the dot
	 */
	public String getExtension() {
		return extension;
	}

	/**
	 * @return suffix of the <code>TEST_IGNORE_*</code> environment variable
	 */
	public String getEnvSuffix() {
		return envSuffix;
	}
}
