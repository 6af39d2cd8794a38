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
 * A function registered by a test script.
 */
public final class TestEntry {

	private final String name;
	private final String owner;
	private final int position;
	private final TestFunction function;

	TestEntry(String name, String owner, int position, TestFunction function) {
		this.name = name;
		this.owner = owner;
		this.position = position;
		this.function = function;
	}

	public String getName() {
		return name;
	}

	/**
	 * @return class name of the script or library that registered the function
	 */
	public String getOwner() {
		return owner;
	}

	/**
	 * @return 0-based registration position, across all owners
	 */
	public int getPosition() {
		return position;
	}

	public TestFunction getFunction() {
		return function;
	}

	@Override
	public String toString() {
		return owner + "#" + name + "@" + position;
	}
}
