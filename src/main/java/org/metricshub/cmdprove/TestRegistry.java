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

import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Deque;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import org.metricshub.cmdprove.compare.GlobPattern;

/**
 * Functions registered by a test script and by the libraries it includes.
 * <p>
 * Every entry remembers its owner, the class that registered it, and its
 * registration position. Only the entries owned by the script itself are
 * candidates for {@link #discover(String, GlobPattern)}: functions pulled in
 * from a library with {@link #include(TestScript)} stay available as
 * helpers but are never run as the script's own tests.
 */
public final class TestRegistry {

	private final Map<String, TestEntry> entries = new LinkedHashMap<String, TestEntry>();
	private final Deque<String> owners = new ArrayDeque<String>();
	private final Set<String> included = new HashSet<String>();

	/**
	 * Creates a registry whose entries are owned by <code>owner</code> until a
	 * library is included.
	 *
	 * @param owner name of the script populating the registry
	 */
	public TestRegistry(String owner) {
		owners.push(Objects.requireNonNull(owner, "Owner must not be null"));
	}

	/**
	 * Creates the registry of a script and lets the script populate it.
	 *
	 * @param script the script
	 * @return the populated registry, owned by the script's class name
	 */
	public static TestRegistry load(TestScript script) {
		TestRegistry registry = new TestRegistry(script.getClass().getName());
		registry.included.add(script.getClass().getName());
		script.register(registry);
		return registry;
	}

	/**
	 * Registers a function.
	 *
	 * @param name name of the function
	 * @param function its body
	 * @return this registry, for chaining
	 * @throws TestUsageException if the name is empty or already registered
	 */
	public TestRegistry add(String name, TestFunction function) {
		if (name == null || name.isEmpty()) {
			throw new TestUsageException("Test function name must not be empty");
		}
		Objects.requireNonNull(function, "Test function must not be null");
		TestEntry existing = entries.get(name);
		if (existing != null) {
			throw new TestUsageException(
					"Function '" + name + "' is already registered by " + existing.getOwner());
		}
		entries.put(name, new TestEntry(name, owners.peek(), entries.size(), function));
		return this;
	}

	/**
	 * Registers the functions of a library script. They are owned by the
	 * library. Including the same library class twice has no effect.
	 *
	 * @param library the library
	 * @return this registry, for chaining
	 */
	public TestRegistry include(TestScript library) {
		String name = library.getClass().getName();
		if (!included.add(name)) {
			return this;
		}
		owners.push(name);
		try {
			library.register(this);
		} finally {
			owners.pop();
		}
		return this;
	}

	/**
	 * Lists the test functions of a script.
	 *
	 * @param owner the script's class name
	 * @param pattern glob selecting test function names
	 * @return the functions registered by <code>owner</code> whose name
	 *         matches, in registration order
	 */
	public List<TestEntry> discover(String owner, GlobPattern pattern) {
		List<TestEntry> result = new ArrayList<TestEntry>();
		for (TestEntry entry : entries.values()) {
			if (entry.getOwner().equals(owner) && pattern.matches(entry.getName())) {
				result.add(entry);
			}
		}
		// LinkedHashMap iteration already follows registration order
		return Collections.unmodifiableList(result);
	}

	/**
	 * @param name a function name
	 * @return the entry, or <code>null</code> if not registered
	 */
	public TestEntry get(String name) {
		return entries.get(name);
	}

	/**
	 * @return all entries in registration order
	 */
	public List<TestEntry> getEntries() {
		return Collections.unmodifiableList(new ArrayList<TestEntry>(entries.values()));
	}
}
