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

import java.util.ArrayDeque;
import java.util.Deque;
import org.metricshub.cmdprove.util.ProveLogger;
import org.slf4j.Logger;

/**
 * Keeps track of passed and failed tests across nested levels, and prints
 * the corresponding report lines.
 * <p>
 * The report looks like TAP, indented by nesting depth:
 *
 * <pre>
 * # Subtest 1 - test_echo
 *   ok 1 - prints hello
 *   not ok 2 - prints world
 *   # 1 PASSED, 1 FAILED
 * not ok 1 - test_echo
 * </pre>
 *
 * Levels are opened with {@link #enter(String)} and must be closed in
 * reverse order, preferably through the returned {@link Scope} in a
 * try-with-resources block. Closing a level records its verdict (failed if
 * anything failed inside) in the parent level. Results recorded while no
 * level is open go to the root counters, which hold the overall result.
 * <p>
 * Not thread-safe: a script runs its tests one at a time.
 */
public class TestAccounting {

	private static final Logger LOGGER = ProveLogger.getLogger(TestAccounting.class);

	private final ReportWriter writer;
	private final TestLevel root = new TestLevel(0, null);
	private final Deque<TestLevel> stack = new ArrayDeque<TestLevel>();

	/**
	 * @param writer where report lines are printed
	 */
	public TestAccounting(ReportWriter writer) {
		this.writer = writer;
	}

	/**
	 * Opens a nested level and prints its banner.
	 *
	 * @param name name of the level
	 * @return a handle closing the level
	 */
	public Scope enter(String name) {
		TestLevel parent = current();
		int ordinal = parent.getIndex() + 1;
		note(0, "Subtest " + ordinal + label(name));
		TestLevel level = new TestLevel(ordinal, name);
		stack.push(level);
		LOGGER.debug("Entered level {} at depth {}", level, stack.size());
		return new Scope(level);
	}

	/**
	 * Records one result in the current level and prints it.
	 *
	 * @param name description of the result
	 * @param passed whether it passed
	 */
	public void record(String name, boolean passed) {
		TestLevel level = current();
		level.record(passed);
		writer.printIndented(getDepth(), (passed ? "ok " : "not ok ") + level.getIndex() + label(name));
	}

	/**
	 * Closes the current level: prints its summary, then records its verdict
	 * in the parent level.
	 *
	 * @return whether nothing failed in the closed level
	 * @throws AccountingException if no level is open
	 */
	public boolean exit() {
		if (stack.isEmpty()) {
			LOGGER.error("Subtest stack underflow");
			throw new AccountingException("Subtest stack underflow");
		}
		TestLevel level = stack.peek();
		note(0, level.getPassCount() + " PASSED, " + level.getFailCount() + " FAILED");
		stack.pop();
		LOGGER.debug("Exited level {}", level);
		record(level.getName(), level.isPassed());
		writer.printIndented(getDepth(), "");
		return level.isPassed();
	}

	/**
	 * Prints a comment at the current depth.
	 *
	 * @param level extra indentation inside the comment
	 * @param text the comment, possibly multi-line
	 */
	public void note(int level, String text) {
		writer.note(getDepth(), level, text);
	}

	/**
	 * @return the innermost open level, or the root when none is open
	 */
	public TestLevel current() {
		TestLevel top = stack.peek();
		return top == null ? root : top;
	}

	/**
	 * @return the root counters, holding the overall result
	 */
	public TestLevel getRoot() {
		return root;
	}

	/**
	 * @return the number of open levels
	 */
	public int getDepth() {
		return stack.size();
	}

	public ReportWriter getWriter() {
		return writer;
	}

	private static String label(String name) {
		return name == null || name.isEmpty() ? "" : " - " + name;
	}

	/**
	 * Handle on an open level. Closing it closes the level exactly once.
	 */
	public final class Scope implements AutoCloseable {

		private final TestLevel level;
		private boolean closed;
		private boolean passed;

		private Scope(TestLevel level) {
			this.level = level;
		}

		/**
		 * Closes the level, unless already done.
		 *
		 * @throws AccountingException if an inner level is still open
		 */
		@Override
		public void close() {
			if (closed) {
				return;
			}
			if (stack.peek() != level) {
				throw new AccountingException("Subtest '" + level.getName() + "' closed out of order");
			}
			closed = true;
			passed = exit();
		}

		public TestLevel getLevel() {
			return level;
		}

		/**
		 * @return the verdict of the level; meaningful once closed
		 */
		public boolean isPassed() {
			return passed;
		}

		public boolean isClosed() {
			return closed;
		}
	}
}
