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
 * A test script: a class registering test functions.
 * <p>
 * Implementations must have a public no-argument constructor, since the
 * driver instantiates them by class name in a separate process.
 *
 * <pre>
 * public class EchoTests implements TestScript {
 * 	&#64;Override
 * 	public void register(TestRegistry registry) {
 * 		registry.add("test_echo", t -&gt; t.assertCommand("echo works", "-o", "hello", "--", "echo", "hello"));
 * 	}
 * }
 * </pre>
 */
public interface TestScript {

	/**
	 * Registers the functions of this script. Functions whose name matches the
	 * test-function pattern (<code>test_*</code> by default) are run as tests,
	 * in registration order; the others are helpers.
	 *
	 * @param registry the registry to populate
	 */
	void register(TestRegistry registry);
}
