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

import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.Collections;
import java.util.EnumSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import org.metricshub.cmdprove.assertion.Channel;

/**
 * A simple container for the parameters of a test run.
 * These values have defaults.
 * These defaults may be changed through command line arguments,
 * through the environment of the process running a test script,
 * or when invoking the harness programmatically, from within Java code.
 * <p>
 * The driver hands its settings to each test-script process through
 * {@link #toEnvironment()}; the script process reads them back with
 * {@link #fromEnvironment(Map)}.
 */
public class ProveSettings {

	/** Non-empty value enables debug logging */
	public static final String ENV_DEBUG = "TEST_DEBUG";

	/** Directory where the captured outputs are written */
	public static final String ENV_OUT_DIR = "TEST_OUT_DIR";

	/** Base name of the capture files */
	public static final String ENV_TEST_NAME = "TEST_NAME";

	/** Glob pattern selecting the test functions of a script */
	public static final String ENV_FUNC_PATTERN = "TEST_FUNC_PATTERN";

	/** Space-separated list of the only test functions to run */
	public static final String ENV_INCLUDE_SUBTESTS = "TEST_INCLUDE_SUBTESTS";

	/** Test script being executed by the current process */
	public static final String ENV_SOURCE_PATH = "TEST_SOURCE_PATH";

	/** Prefix of the per-channel ignore defaults, e.g. {@code TEST_IGNORE_OUT} */
	public static final String ENV_IGNORE_PREFIX = "TEST_IGNORE_";

	/** Default base name of the capture files */
	public static final String DEFAULT_TEST_NAME = "test";

	/** Default glob pattern for test functions */
	public static final String DEFAULT_FUNC_PATTERN = "test_*";

	private boolean debug;

	/**
	 * Directory where capture files are allocated.
	 * <code>null</code> means a temporary directory is created on demand.
	 */
	private Path outputDirectory;

	private String testName = DEFAULT_TEST_NAME;

	private String functionPattern = DEFAULT_FUNC_PATTERN;

	/**
	 * Channels whose comparison is skipped unless an assertion sets an
	 * expectation for them explicitly.
	 */
	private final Set<Channel> ignoredChannels = EnumSet.noneOf(Channel.class);

	/**
	 * Names of the only test functions to run in the current script.
	 * Empty means all of them.
	 */
	private final List<String> includedFunctions = new ArrayList<String>();

	private String sourcePath;

	/**
	 * Reads the settings from environment variables, as set by
	 * {@link #toEnvironment()}.
	 *
	 * @param env the environment, usually {@link System#getenv()}
	 * @return a new settings instance
	 */
	public static ProveSettings fromEnvironment(Map<String, String> env) {
		ProveSettings settings = new ProveSettings();
		settings.setDebug(!isEmpty(env.get(ENV_DEBUG)));
		String outDir = env.get(ENV_OUT_DIR);
		if (!isEmpty(outDir)) {
			settings.setOutputDirectory(Paths.get(outDir));
		}
		String name = env.get(ENV_TEST_NAME);
		if (!isEmpty(name)) {
			settings.setTestName(name);
		}
		String pattern = env.get(ENV_FUNC_PATTERN);
		if (!isEmpty(pattern)) {
			settings.setFunctionPattern(pattern);
		}
		for (Channel channel : Channel.values()) {
			if (isTrue(env.get(ENV_IGNORE_PREFIX + channel.getEnvSuffix()))) {
				settings.ignoreByDefault(channel);
			}
		}
		String include = env.get(ENV_INCLUDE_SUBTESTS);
		if (!isEmpty(include)) {
			for (String function : include.trim().split("\\s+")) {
				settings.addIncludedFunction(function);
			}
		}
		settings.setSourcePath(env.get(ENV_SOURCE_PATH));
		return settings;
	}

	/**
	 * Exports these settings as environment variables for a test-script
	 * process. Only values that differ from "unset" are exported.
	 *
	 * @return an ordered map of variable names to values
	 */
	public Map<String, String> toEnvironment() {
		Map<String, String> env = new LinkedHashMap<String, String>();
		if (debug) {
			env.put(ENV_DEBUG, "1");
		}
		if (outputDirectory != null) {
			env.put(ENV_OUT_DIR, outputDirectory.toString());
		}
		env.put(ENV_TEST_NAME, testName);
		env.put(ENV_FUNC_PATTERN, functionPattern);
		for (Channel channel : ignoredChannels) {
			env.put(ENV_IGNORE_PREFIX + channel.getEnvSuffix(), "1");
		}
		if (!includedFunctions.isEmpty()) {
			env.put(ENV_INCLUDE_SUBTESTS, String.join(" ", includedFunctions));
		}
		if (sourcePath != null) {
			env.put(ENV_SOURCE_PATH, sourcePath);
		}
		return env;
	}

	private static boolean isEmpty(String value) {
		return value == null || value.isEmpty();
	}

	private static boolean isTrue(String value) {
		if (isEmpty(value)) {
			return false;
		}
		String v = value.trim().toLowerCase(Locale.ROOT);
		return v.equals("1") || v.equals("true") || v.equals("yes");
	}

	/**
	 * <p>
	 * toDescriptionString.
	 * </p>
	 *
	 * @return a human readable representation of the parameters values.
	 */
	public String toDescriptionString() {
		StringBuilder desc = new StringBuilder();

		final char newLine = '\n';

		desc.append("debug = ").append(isDebug()).append(newLine);
		desc.append("outputDirectory = ").append(getOutputDirectory()).append(newLine);
		desc.append("testName = ").append(getTestName()).append(newLine);
		desc.append("functionPattern = ").append(getFunctionPattern()).append(newLine);
		desc.append("ignoredChannels = ").append(ignoredChannels).append(newLine);
		desc.append("includedFunctions = ").append(includedFunctions).append(newLine);

		return desc.toString();
	}

	public boolean isDebug() {
		return debug;
	}

	public void setDebug(boolean debug) {
		this.debug = debug;
	}

	/**
	 * Directory where capture files are allocated.
	 *
	 * @return the directory, or <code>null</code> when not configured yet
	 */
	public Path getOutputDirectory() {
		return outputDirectory;
	}

	public void setOutputDirectory(Path outputDirectory) {
		this.outputDirectory = outputDirectory;
	}

	/**
	 * Base name of the capture files, <code>test</code> by default.
	 *
	 * @return the base name
	 */
	public String getTestName() {
		return testName;
	}

	/**
	 * @param testName base name of the capture files
	 * @throws IllegalArgumentException if the name is empty or contains a path separator
	 */
	public void setTestName(String testName) {
		if (isEmpty(testName) || testName.indexOf('/') >= 0 || testName.indexOf('\\') >= 0) {
			throw new IllegalArgumentException("Invalid test name: '" + testName + "'");
		}
		this.testName = testName;
	}

	public String getFunctionPattern() {
		return functionPattern;
	}

	public void setFunctionPattern(String functionPattern) {
		if (isEmpty(functionPattern)) {
			throw new IllegalArgumentException("Test function pattern must not be empty");
		}
		this.functionPattern = functionPattern;
	}

	/**
	 * Whether the comparison of the given channel is skipped unless an
	 * assertion sets an explicit expectation for it.
	 *
	 * @param channel the channel
	 * @return <code>true</code> if ignored by default
	 */
	public boolean isIgnoredByDefault(Channel channel) {
		return ignoredChannels.contains(channel);
	}

	public void ignoreByDefault(Channel channel) {
		ignoredChannels.add(channel);
	}

	public List<String> getIncludedFunctions() {
		return Collections.unmodifiableList(includedFunctions);
	}

	public void addIncludedFunction(String functionName) {
		if (!includedFunctions.contains(functionName)) {
			includedFunctions.add(functionName);
		}
	}

	public void clearIncludedFunctions() {
		includedFunctions.clear();
	}

	/**
	 * Test script run by the current process, as given by the driver.
	 *
	 * @return the script name, or <code>null</code> outside of a script process
	 */
	public String getSourcePath() {
		return sourcePath;
	}

	public void setSourcePath(String sourcePath) {
		this.sourcePath = sourcePath;
	}

	/**
	 * Creates an independent copy of these settings.
	 *
	 * @return the copy
	 */
	public ProveSettings copy() {
		ProveSettings copy = new ProveSettings();
		copy.debug = debug;
		copy.outputDirectory = outputDirectory;
		copy.testName = testName;
		copy.functionPattern = functionPattern;
		copy.ignoredChannels.addAll(ignoredChannels);
		copy.includedFunctions.addAll(includedFunctions);
		copy.sourcePath = sourcePath;
		return copy;
	}
}
