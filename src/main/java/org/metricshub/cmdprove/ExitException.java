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

/**
 * Carries a process exit code up to the <code>main</code> method, which is
 * the only place allowed to call {@link System#exit(int)}.
 */
public class ExitException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	/** All tests passed */
	public static final int EXIT_SUCCESS = 0;

	/** One or more tests failed */
	public static final int EXIT_FAILURES = 1;

	/** Invalid command line, or the harness could not start */
	public static final int EXIT_USAGE = 2;

	/** A test script was aborted by a harness error or crashed */
	public static final int EXIT_ABORTED = 3;

	private final int code;

	/**
	 * @param code the exit code
	 * @param msg description of the reason
	 */
	public ExitException(int code, String msg) {
		super(msg);
		this.code = code;
	}

	/**
	 * @return the exit code
	 */
	public int getCode() {
		return code;
	}
}
