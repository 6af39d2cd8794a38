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
 * Error of the test harness itself, as opposed to a failed assertion.
 * <p>
 * A harness exception aborts the test script being run: the script process
 * reports it as a <code>TEST ERROR</code> and exits with
 * {@link ExitException#EXIT_ABORTED}.
 */
public class HarnessException extends RuntimeException {

	private static final long serialVersionUID = 1L;

	/**
	 * @param msg description of the error
	 */
	public HarnessException(String msg) {
		super(msg);
	}

	/**
	 * @param msg description of the error
	 * @param cause underlying exception
	 */
	public HarnessException(String msg, Throwable cause) {
		super(msg, cause);
	}
}
