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

import com.github.difflib.DiffUtils;
import com.github.difflib.UnifiedDiffUtils;
import com.github.difflib.patch.Patch;
import java.util.Arrays;
import java.util.List;
import org.metricshub.cmdprove.util.ProveLogger;
import org.slf4j.Logger;

/**
 * Unified diffs between an expected and an actual text, computed with
 * java-diff-utils.
 */
public final class TextDiff {

	private static final Logger LOGGER = ProveLogger.getLogger(TextDiff.class);

	/** Number of unchanged lines shown around each change */
	public static final int CONTEXT_LINES = 3;

	private TextDiff() {}

	/**
	 * Computes the unified diff turning <code>expected</code> into
	 * <code>actual</code>. A final newline is significant: it shows up as an
	 * extra empty line.
	 *
	 * @param expected the expected text
	 * @param actual the actual text
	 * @param expectedName label of the "from" side
	 * @param actualName label of the "to" side
	 * @return the diff, or an empty string when both texts are line-wise equal
	 */
	public static String unifiedDiff(String expected, String actual, String expectedName, String actualName) {
		List<String> expectedLines = toLines(expected);
		List<String> actualLines = toLines(actual);

		Patch<String> patch = DiffUtils.diff(expectedLines, actualLines);
		if (patch.getDeltas().isEmpty()) {
			return "";
		}
		if (LOGGER.isTraceEnabled()) {
			LOGGER
					.trace(
							"unifiedDiff: {} -> {} | deltas={} (expectedLines={}, actualLines={})",
							expectedName,
							actualName,
							patch.getDeltas().size(),
							expectedLines.size(),
							actualLines.size());
		}
		List<String> diffLines = UnifiedDiffUtils
				.generateUnifiedDiff(expectedName, actualName, expectedLines, patch, CONTEXT_LINES);
		return String.join("\n", diffLines);
	}

	private static List<String> toLines(String content) {
		// Keep trailing empty strings: they stand for final newlines
		return Arrays.asList(content.split("\n", -1));
	}
}
