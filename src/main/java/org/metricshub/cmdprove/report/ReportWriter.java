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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.PrintStream;

/**
 * Writes the lines of the test report, indented two spaces per nesting
 * level.
 */
public class ReportWriter {

	private static final String INDENT = "  ";

	/** Prefix of comment lines */
	public static final String NOTE_PREFIX = "# ";

	private final PrintStream out;

	/**
	 * @param out stream receiving the report
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public ReportWriter(PrintStream out) {
		this.out = out;
	}

	/**
	 * Prints each line of <code>text</code> indented for the specified depth.
	 * An empty text prints an empty line.
	 *
	 * @param depth nesting depth
	 * @param text one or more lines
	 */
	public void printIndented(int depth, String text) {
		String prefix = repeat(INDENT, depth);
		for (String line : splitLines(text)) {
			String indented = prefix + line;
			out.println(indented.trim().isEmpty() ? "" : indented);
		}
		out.flush();
	}

	/**
	 * Prints a comment: every line of <code>text</code> gets the
	 * <code>"# "</code> prefix followed by two spaces per extra level.
	 *
	 * @param depth nesting depth
	 * @param level extra indentation inside the comment
	 * @param text one or more lines
	 */
	public void note(int depth, int level, String text) {
		String prefix = NOTE_PREFIX + repeat(INDENT, level);
		StringBuilder prefixed = new StringBuilder();
		for (String line : splitLines(text)) {
			if (prefixed.length() > 0) {
				prefixed.append('\n');
			}
			prefixed.append(prefix).append(line);
		}
		printIndented(depth, prefixed.toString());
	}

	/**
	 * @return the underlying stream
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public PrintStream getOut() {
		return out;
	}

	private static String[] splitLines(String text) {
		if (text == null || text.isEmpty()) {
			return new String[] { "" };
		}
		String normalized = text.endsWith("\n") ? text.substring(0, text.length() - 1) : text;
		return normalized.split("\n", -1);
	}

	static String repeat(String s, int count) {
		StringBuilder sb = new StringBuilder();
		for (int i = 0; i < count; i++) {
			sb.append(s);
		}
		return sb.toString();
	}
}
