package org.metricshub.cmdprove.compare;

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
 * Compares an expected value with the actual output of a command, according
 * to a {@link ComparisonMode}.
 * <p>
 * All methods return <code>null</code> on a match, or a human readable
 * description of the difference otherwise.
 */
public final class OutputComparator {

	/** Label of the expected side in diffs */
	public static final String EXPECTED_LABEL = "expected";

	/** Label of the actual side in diffs */
	public static final String ACTUAL_LABEL = "actual";

	private OutputComparator() {}

	/**
	 * Compares the values as they are, trailing newlines included.
	 *
	 * @param mode comparison mode
	 * @param expected expected value, or pattern in {@link ComparisonMode#PATTERN} mode
	 * @param actual actual output
	 * @return <code>null</code> when matching, the difference otherwise
	 * @throws GlobSyntaxException if the pattern is malformed
	 */
	public static String compare(ComparisonMode mode, String expected, String actual) {
		switch (mode) {
		case IGNORE:
			return null;
		case PATTERN:
			return comparePattern(expected, actual);
		case EXACT:
		default:
			return compareExact(expected, actual);
		}
	}

	/**
	 * Compares the values, removing their trailing newlines first unless
	 * <code>preserveNewlines</code> is set.
	 *
	 * @param mode comparison mode
	 * @param expected expected value or pattern
	 * @param actual actual output
	 * @param preserveNewlines whether trailing newlines are significant
	 * @return <code>null</code> when matching, the difference otherwise
	 */
	public static String compare(ComparisonMode mode, String expected, String actual, boolean preserveNewlines) {
		if (preserveNewlines) {
			return compare(mode, expected, actual);
		}
		return compare(mode, chomp(expected), chomp(actual));
	}

	private static String compareExact(String expected, String actual) {
		if (expected.equals(actual)) {
			return null;
		}
		return TextDiff.unifiedDiff(expected, actual, EXPECTED_LABEL, ACTUAL_LABEL);
	}

	private static String comparePattern(String pattern, String actual) {
		if (GlobPattern.compile(pattern).matches(actual)) {
			return null;
		}
		return "Pattern not matched: '" + pattern + "'.\nOutput was: '" + actual + "'.";
	}

	/**
	 * Removes all the trailing newline characters of a value, like a shell
	 * command substitution does.
	 *
	 * @param value the value
	 * @return the value without trailing newlines
	 */
	public static String chomp(String value) {
		int end = value.length();
		while (end > 0 && value.charAt(end - 1) == '\n') {
			end--;
		}
		return value.substring(0, end);
	}
}
