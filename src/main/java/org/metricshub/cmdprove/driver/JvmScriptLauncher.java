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

import java.io.File;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

/**
 * Runs test scripts in a new JVM, using {@link ScriptMain} as entry point.
 * <p>
 * By default the new JVM is the one running the driver, with the same class
 * path, so scripts only need to be on the driver's class path.
 */
public class JvmScriptLauncher implements ScriptLauncher {

	private final String javaExecutable;
	private final String classPath;
	private final List<String> jvmOptions;

	/**
	 * Uses the current JVM and class path.
	 */
	public JvmScriptLauncher() {
		this(
				System.getProperty("java.home") + File.separator + "bin" + File.separator + "java",
				System.getProperty("java.class.path"),
				Collections.<String>emptyList());
	}

	/**
	 * @param javaExecutable path of the <code>java</code> program
	 * @param classPath class path of the scripts and of this harness
	 * @param jvmOptions extra options for the JVM
	 */
	public JvmScriptLauncher(String javaExecutable, String classPath, List<String> jvmOptions) {
		this.javaExecutable = javaExecutable;
		this.classPath = classPath;
		this.jvmOptions = new ArrayList<String>(jvmOptions);
	}

	@Override
	public List<String> buildCommand(String script) {
		List<String> command = new ArrayList<String>();
		command.add(javaExecutable);
		command.addAll(jvmOptions);
		command.add("-cp");
		command.add(classPath);
		command.add(ScriptMain.class.getName());
		command.add(script);
		return command;
	}
}
