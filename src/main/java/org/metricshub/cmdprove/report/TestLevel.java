package org.metricshub.cmdprove.report;

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
 * One nesting level of the test accounting: a test function, an explicit
 * sub-grouping or a single assertion group, with its running counters.
 */
public final class TestLevel {

	private final int ordinal;
	private final String name;
	private int index;
	private int passCount;
	private int failCount;

	TestLevel(int ordinal, String name) {
		this.ordinal = ordinal;
		this.name = name;
	}

	void record(boolean passed) {
		index++;
		if (passed) {
			passCount++;
		} else {
			failCount++;
		}
	}

	/**
	 * @return 1-based position of this level within its parent, 0 for the root
	 */
	public int getOrdinal() {
		return ordinal;
	}

	/**
	 * @return name of the level, <code>null</code> for the root
	 */
	public String getName() {
		return name;
	}

	/**
	 * @return number of results recorded so far in this level
	 */
	public int getIndex() {
		return index;
	}

	public int getPassCount() {
		return passCount;
	}

	public int getFailCount() {
		return failCount;
	}

	/**
	 * @return whether nothing failed in this level
	 */
	public boolean isPassed() {
		return failCount == 0;
	}

	@Override
	public String toString() {
		return "TestLevel[" + ordinal + " - " + name + ": " + passCount + " PASSED, " + failCount + " FAILED]";
	}
}
