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
 * Thrown when a glob pattern cannot be parsed, for instance when an
 * extended group like <code>+(a|b</code> is never closed.
 */
public class GlobSyntaxException extends IllegalArgumentException {

	private static final long serialVersionUID = 1L;

	private final String pattern;
	private final int index;

	/**
	 * @param pattern the offending pattern
	 * @param index position of the error in the pattern
	 * @param msg description of the error
	 */
	public GlobSyntaxException(String pattern, int index, String msg) {
		super(msg + " at index " + index + " in pattern '" + pattern + "'");
		this.pattern = pattern;
		this.index = index;
	}

	public String getPattern() {
		return pattern;
	}

	public int getIndex() {
		return index;
	}
}
