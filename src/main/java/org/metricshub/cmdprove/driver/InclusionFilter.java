package org.metricshub.cmdprove.driver;

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

import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

/**
 * Explicit list of the only test functions to run, grouped by the script
 * that must contain them. An empty filter runs everything.
 */
public final class InclusionFilter {

	// script => functions, both in insertion order
	private final Map<String, List<String>> scriptFunctions = new LinkedHashMap<String, List<String>>();

	/**
	 * Adds a function to the filter. Adding the same pair twice has no effect.
	 *
	 * @param function name of the test function
	 * @param script script that must contain it
	 */
	public void add(String function, String script) {
		List<String> functions = scriptFunctions.get(script);
		if (functions == null) {
			functions = new ArrayList<String>();
			scriptFunctions.put(script, functions);
		}
		if (!functions.contains(function)) {
			functions.add(function);
		}
	}

	/**
	 * Adds an entry given as <code>script:function</code>.
	 *
	 * @param spec the entry
	 * @throws IllegalArgumentException if the entry is malformed
	 */
	public void addSpec(String spec) {
		int colon = spec.lastIndexOf(':');
		if (colon <= 0 || colon == spec.length() - 1) {
			throw new IllegalArgumentException("Test filter \"" + spec + "\" must be of the form \"script:function\"");
		}
		add(spec.substring(colon + 1), spec.substring(0, colon));
	}

	/**
	 * @param script a script
	 * @return the functions to run in that script, empty when there is no
	 *         restriction for it
	 */
	public List<String> functionsFor(String script) {
		List<String> functions = scriptFunctions.get(script);
		if (functions == null) {
			return Collections.emptyList();
		}
		return Collections.unmodifiableList(new ArrayList<String>(functions));
	}

	public boolean isEmpty() {
		return scriptFunctions.isEmpty();
	}

	/**
	 * @return the scripts named by the filter, in insertion order
	 */
	public List<String> getScripts() {
		return new ArrayList<String>(scriptFunctions.keySet());
	}

	@Override
	public String toString() {
		return scriptFunctions.toString();
	}
}
