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

import edu.umd.cs.findbugs.annotations.SuppressFBWarnings;
import java.io.File;
import java.io.IOException;
import java.io.InputStream;
import java.io.PrintStream;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.util.ArrayList;
import java.util.List;
import org.metricshub.cmdprove.driver.InclusionFilter;
import org.metricshub.cmdprove.driver.JvmScriptLauncher;
import org.metricshub.cmdprove.driver.ScriptLauncher;
import org.metricshub.cmdprove.driver.TestDriver;
import org.metricshub.cmdprove.util.ProveLogger;
import org.metricshub.cmdprove.util.ProveSettings;

/**
 * Command-line interface for cmdprove.
 */
public final class Cli {

	private static final String JAR_NAME;

	static {
		String myName;
		try {
			File me = new File(Cli.class.getProtectionDomain().getCodeSource().getLocation().toURI().getPath());
			myName = me.getName();
		} catch (Exception e) {
			myName = "cmdprove.jar";
		}
		JAR_NAME = myName;
	}

	private final ProveSettings settings;
	private final InputStream in;
	private final PrintStream out;
	private final PrintStream err;
	private ScriptLauncher launcher = new JvmScriptLauncher();

	private final List<String> scripts = new ArrayList<String>();
	private final InclusionFilter filter = new InclusionFilter();
	private boolean printUsage;

	/**
	 * Creates a CLI instance wired to the standard streams, with defaults read
	 * from the environment.
	 */
	public Cli() {
		this(ProveSettings.fromEnvironment(System.getenv()), System.in, System.out, System.err);
	}

	/**
	 * Creates a CLI instance using the supplied settings and streams.
	 *
	 * @param settings default settings, changed by the command-line options
	 * @param in standard input of the harness, closed before any script runs
	 * @param out stream receiving the test report
	 * @param err stream receiving usage errors
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public Cli(ProveSettings settings, InputStream in, PrintStream out, PrintStream err) {
		this.settings = settings;
		this.in = in;
		this.out = out;
		this.err = err;
	}

	/**
	 * Returns the mutable {@link ProveSettings} configured from the command line.
	 *
	 * @return the settings object populated during argument parsing
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP")
	public ProveSettings getSettings() {
		return settings;
	}

	/**
	 * @return the scripts to run, in order
	 */
	public List<String> getScripts() {
		return new ArrayList<String>(scripts);
	}

	@SuppressFBWarnings("EI_EXPOSE_REP")
	public InclusionFilter getFilter() {
		return filter;
	}

	public boolean isPrintUsage() {
		return printUsage;
	}

	/**
	 * Replaces the way script processes are started.
	 *
	 * @param launcher the launcher
	 */
	public void setLauncher(ScriptLauncher launcher) {
		this.launcher = launcher;
	}

	/**
	 * Parses the supplied command-line arguments and configures this instance
	 * accordingly.
	 *
	 * @param args command-line arguments
	 * @throws IllegalArgumentException if the arguments are invalid
	 */
	public void parse(String[] args) {
		settings.clearIncludedFunctions();

		int argIdx = 0;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.length() == 0) {
				throw new IllegalArgumentException("zero-length argument at position " + (argIdx + 1));
			}
			if (arg.charAt(0) != '-') {
				// end of options: remaining args are scripts
				break;
			} else if (arg.equals("--")) {
				++argIdx;
				break;
			} else if (arg.equals("-d")) {
				// -d : debug logging, here and in the scripts
				settings.setDebug(true);
			} else if (arg.equals("-o")) {
				// -o dir : directory of the capture files
				checkParameterHasArgument(args, argIdx);
				settings.setOutputDirectory(Paths.get(args[++argIdx]));
			} else if (arg.equals("-n")) {
				// -n name : base name of the capture files
				checkParameterHasArgument(args, argIdx);
				settings.setTestName(args[++argIdx]);
			} else if (arg.equals("-p")) {
				// -p pattern : glob selecting the test functions
				checkParameterHasArgument(args, argIdx);
				settings.setFunctionPattern(args[++argIdx]);
			} else if (arg.equals("-t")) {
				// -t script:function : only run this function
				checkParameterHasArgument(args, argIdx);
				filter.addSpec(args[++argIdx]);
			} else if (arg.equals("-h") || arg.equals("-?")) {
				if (argIdx != 0 || args.length != 1) {
					throw new IllegalArgumentException("When printing help/usage output, we do not accept other arguments.");
				}
				printUsage = true;
				return;
			} else {
				throw new IllegalArgumentException("Unknown parameter: " + arg);
			}
			++argIdx;
		}

		while (argIdx < args.length) {
			addScript(args[argIdx++]);
		}
		// a function named with -t runs even if its script is not listed
		for (String script : filter.getScripts()) {
			addScript(script);
		}
	}

	private void addScript(String script) {
		if (!scripts.contains(script)) {
			scripts.add(script);
		}
	}

	/**
	 * Ensures that the current command-line option is followed by a value.
	 *
	 * @param args full array of arguments
	 * @param argIdx index of the option that requires a value
	 */
	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new IllegalArgumentException("Need additional argument for " + args[argIdx]);
		}
	}

	/**
	 * Executes the CLI based on the previously parsed arguments.
	 *
	 * @throws ExitException with the exit code of the run, unless it is 0
	 */
	public void run() {
		if (printUsage) {
			usage(out);
			return;
		}
		if (scripts.isEmpty()) {
			err.println("ERROR: No tests given. Pass '-h' to see usage.");
			throw new ExitException(ExitException.EXIT_USAGE, "No tests given");
		}
		if (settings.isDebug()) {
			ProveLogger.enableDebug();
		}
		Path outputDirectory = settings.getOutputDirectory();
		if (outputDirectory != null) {
			try {
				Files.createDirectories(outputDirectory);
			} catch (IOException e) {
				throw new IllegalArgumentException(
						"Cannot create output directory '" + outputDirectory + "': " + e.getMessage(),
						e);
			}
		}

		// Scripts must not rely on inherited input
		try {
			in.close();
		} catch (IOException e) {
			throw new HarnessException("Cannot close standard input: " + e.getMessage(), e);
		}

		TestDriver driver = new TestDriver(settings, launcher, out);
		int code = driver.runAll(scripts, filter);
		if (code != ExitException.EXIT_SUCCESS) {
			throw new ExitException(code, "Some test scripts failed");
		}
	}

	/**
	 * Prints usage/help information to the provided destination stream.
	 *
	 * @param dest stream to write usage information to
	 */
	private static void usage(PrintStream dest) {
		dest.println("Usage:");
		dest
				.println(
						"java -jar " +
								JAR_NAME +
								" [-d]" +
								" [-o output-directory]" +
								" [-n test-name]" +
								" [-p function-pattern]" +
								" [-t script:function]..." +
								" script-class...");
		dest.println();
		dest.println(" -d = Print debug messages.");
		dest.println(" -o dir = Write the captured outputs to dir (a new temporary directory by default).");
		dest.println(" -n name = Base name of the captured output files (default: " + ProveSettings.DEFAULT_TEST_NAME + ").");
		dest.println(" -p pattern = Glob selecting the test functions (default: " + ProveSettings.DEFAULT_FUNC_PATTERN + ").");
		dest.println(" -t script:function = Only run this test function. Can be repeated.");
		dest.println();
		dest.println(" -h or -? = This help screen.");
		dest.println();
		dest.println("Exit status: 0 if all tests passed, 1 if some failed, 2 or 3 if the harness failed.");
	}

	/**
	 * Parses arguments and executes the CLI.
	 *
	 * @param args command-line arguments
	 * @param settings default settings
	 * @param is standard input to close
	 * @param os stream for the test report
	 * @param es stream for usage errors
	 * @return configured and executed CLI instance
	 * @throws ExitException if the run did not succeed
	 */
	public static Cli create(String[] args, ProveSettings settings, InputStream is, PrintStream os, PrintStream es) {
		Cli cli = new Cli(settings, is, os, es);
		cli.parse(args);
		cli.run();
		return cli;
	}

	/**
	 * Entry point for the command-line interface.
	 *
	 * @param args command-line arguments
	 */
	@SuppressFBWarnings(value = "VA_FORMAT_STRING_USES_NEWLINE", justification = "let PrintStream decide line separator")
	public static void main(String[] args) {
		try {
			Cli cli = new Cli();
			cli.parse(args);
			cli.run();
		} catch (ExitException e) {
			System.exit(e.getCode());
		} catch (IllegalArgumentException e) {
			System.err.println("Failed to parse arguments. Please see the help/usage output (cmd line switch '-h').");
			System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			System.exit(ExitException.EXIT_USAGE);
		} catch (Exception e) {
			System.err.printf("%s: %s\n", e.getClass().getSimpleName(), e.getMessage());
			System.exit(ExitException.EXIT_ABORTED);
		}
	}
}
