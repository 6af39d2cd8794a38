package org.metricshub.cmdprove.util;

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

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

/**
 * Utility class to handle SLF4J logging and prevent any stupid behavior,
 * like logging its own initialization, which we don't want in most cases.
 * <p>
 * When the {@code TEST_DEBUG} environment variable is set (or
 * {@link #enableDebug()} is called before the first logger is obtained),
 * the simple binding is switched to the {@code debug} level.
 */
public final class ProveLogger {

	private static final String SIMPLE_LOGGER_LEVEL = "org.slf4j.simpleLogger.defaultLogLevel";

	static {
		System.setProperty("slf4j.internal.verbosity", "WARN");
		String debug = System.getenv(ProveSettings.ENV_DEBUG);
		if (debug != null && !debug.isEmpty()) {
			enableDebug();
		}
	}

	/**
	 * Private constructor to prevent instantiation.
	 */
	private ProveLogger() {
		// utility class
	}

	/**
	 * Lowers the default level of the SLF4J simple binding to {@code debug}.
	 * Only loggers created after this call are affected.
	 */
	public static void enableDebug() {
		if (System.getProperty(SIMPLE_LOGGER_LEVEL) == null) {
			System.setProperty(SIMPLE_LOGGER_LEVEL, "debug");
		}
	}

	/**
	 * @param clazz Class for which the logger will be used
	 * @return an SLF4J Logger instance
	 */
	public static Logger getLogger(Class<?> clazz) {
		return LoggerFactory.getLogger(clazz);
	}
}
