package org.metricshub.cmdprove.assertion;

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
import java.io.ByteArrayInputStream;
import java.io.IOException;
import java.io.OutputStream;
import java.io.PrintStream;
import java.lang.ProcessBuilder.Redirect;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.EnumMap;
import java.util.Map;
import org.metricshub.cmdprove.HarnessException;
import org.metricshub.cmdprove.TestUsageException;
import org.metricshub.cmdprove.capture.CaptureFiles;
import org.metricshub.cmdprove.capture.CaptureStore;
import org.metricshub.cmdprove.capture.ChompingOutputStream;
import org.metricshub.cmdprove.capture.DataPump;
import org.metricshub.cmdprove.compare.ComparisonMode;
import org.metricshub.cmdprove.compare.GlobSyntaxException;
import org.metricshub.cmdprove.compare.OutputComparator;
import org.metricshub.cmdprove.report.TestAccounting;
import org.metricshub.cmdprove.util.ProveLogger;
import org.metricshub.cmdprove.util.ProveSettings;
import org.slf4j.Logger;

/**
 * Runs a command, captures its stdout, stderr and exit status in files, and
 * checks them against the expectations of an {@link AssertRequest}.
 * <p>
 * The verdict is recorded in the {@link TestAccounting} under the
 * description of the request. On failure, a note block shows the
 * difference of each failed channel along with the path of its capture
 * file, and a <code>For details, see: &lt;file&gt;</code> line pointing at
 * the captured stderr is written to the error stream, where the driver
 * picks it up.
 */
public class CommandAssertion {

	private static final Logger LOGGER = ProveLogger.getLogger(CommandAssertion.class);

	/** Prefix of the lines pointing at a file worth reading after a failure */
	public static final String DETAILS_PREFIX = "For details, see: ";

	/** Exit status reported when the command cannot be started, as a shell does */
	public static final int EXIT_NOT_FOUND = 127;

	private static final String SEPARATOR = "----------";

	private final ProveSettings settings;
	private final CaptureStore captureStore;
	private final TestAccounting accounting;
	private final PrintStream err;

	/**
	 * @param settings provide the capture base name
	 * @param captureStore where outputs are captured
	 * @param accounting where verdicts are recorded
	 * @param err stream receiving the <code>For details</code> lines
	 */
	@SuppressFBWarnings("EI_EXPOSE_REP2")
	public CommandAssertion(ProveSettings settings, CaptureStore captureStore, TestAccounting accounting, PrintStream err) {
		this.settings = settings;
		this.captureStore = captureStore;
		this.accounting = accounting;
		this.err = err;
	}

	/**
	 * Executes the assertion.
	 *
	 * @param request the parsed assertion
	 * @param input data for the standard input of the command, or
	 *        <code>null</code> to let it inherit the standard input of this process
	 * @return the verdict
	 * @throws TestUsageException if an expectation cannot be read or a pattern is invalid
	 * @throws HarnessException if the outputs cannot be captured
	 */
	public AssertionResult run(AssertRequest request, byte[] input) {
		LOGGER.debug("Assert: {}", request);
		boolean preserve = request.isPreserveNewlines();

		// Resolve the expectations before running anything: a bad file is a usage error
		Map<Channel, String> expectedValues = new EnumMap<Channel, String>(Channel.class);
		for (Channel channel : Channel.values()) {
			expectedValues.put(channel, request.getExpected(channel).resolve(preserve));
		}

		CaptureFiles files = captureStore.allocate(settings.getTestName());
		LOGGER.debug("stdout will be saved to: '{}'", files.getOut());
		LOGGER.debug("stderr will be saved to: '{}'", files.getErr());
		LOGGER.debug("exit status will be saved to: '{}'", files.getRet());

		int exitStatus = execute(request, input, files);
		writeCapture(files.getRet(), exitStatus + "\n");
		LOGGER.debug("Command {} exited with status {}", request.getCommand(), exitStatus);

		Map<Channel, String> failures = new EnumMap<Channel, String>(Channel.class);
		for (Channel channel : Channel.values()) {
			String difference = check(request.getExpected(channel), expectedValues.get(channel), files, exitStatus, preserve);
			if (difference != null) {
				failures.put(channel, difference);
			}
		}

		AssertionResult result = new AssertionResult(request.getDescription(), files, exitStatus, failures);
		accounting.record(request.getDescription(), result.isPassed());
		if (!result.isPassed()) {
			reportFailures(result);
		}
		return result;
	}

	/**
	 * Runs the command with its outputs redirected to the capture files.
	 *
	 * @return the exit status
	 */
	private int execute(AssertRequest request, byte[] input, CaptureFiles files) {
		boolean preserve = request.isPreserveNewlines();
		ProcessBuilder pb = new ProcessBuilder(request.getCommand());
		pb.redirectInput(input == null ? Redirect.INHERIT : Redirect.PIPE);
		if (preserve) {
			pb.redirectOutput(files.getOut().toFile());
			pb.redirectError(files.getErr().toFile());
		}

		Process p;
		try {
			p = pb.start();
		} catch (IOException e) {
			LOGGER.debug("Cannot start {}", request.getCommand(), e);
			writeCapture(files.getErr(), "cmdprove: " + request.getCommand().get(0) + ": " + e.getMessage() + "\n");
			return EXIT_NOT_FOUND;
		}

		DataPump outPump = null;
		DataPump errPump = null;
		DataPump inPump = null;
		try {
			if (!preserve) {
				outPump = DataPump.dumpAndClose("stdout", p.getInputStream(), chomping(files.getOut()));
				errPump = DataPump.dumpAndClose("stderr", p.getErrorStream(), chomping(files.getErr()));
			}
			if (input != null) {
				inPump = DataPump.dumpAndClose("stdin", new ByteArrayInputStream(input), p.getOutputStream());
			}
			int exitStatus = p.waitFor();
			if (outPump != null) {
				outPump.await();
				errPump.await();
			}
			if (inPump != null) {
				inPump.await();
			}
			checkPump(outPump, files.getOut());
			checkPump(errPump, files.getErr());
			return exitStatus;
		} catch (InterruptedException e) {
			p.destroyForcibly();
			Thread.currentThread().interrupt();
			throw new HarnessException("Interrupted while waiting for " + request.getCommand(), e);
		}
	}

	private static OutputStream chomping(Path path) {
		try {
			return new ChompingOutputStream(Files.newOutputStream(path));
		} catch (IOException e) {
			throw new HarnessException("Cannot write capture file '" + path + "': " + e.getMessage(), e);
		}
	}

	private static void checkPump(DataPump pump, Path path) {
		if (pump != null && pump.getError() != null) {
			throw new HarnessException("Cannot write capture file '" + path + "': " + pump.getError().getMessage(), pump.getError());
		}
	}

	private static void writeCapture(Path path, String content) {
		try {
			Files.write(path, content.getBytes(StandardCharsets.UTF_8));
		} catch (IOException e) {
			throw new HarnessException("Cannot write capture file '" + path + "': " + e.getMessage(), e);
		}
	}

	private static String readCapture(Path path) {
		try {
			return new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
		} catch (IOException e) {
			throw new HarnessException("Cannot read capture file '" + path + "': " + e.getMessage(), e);
		}
	}

	/**
	 * Compares one channel.
	 *
	 * @return <code>null</code> on a match, the difference otherwise
	 */
	private String check(ExpectedValue expectation, String expected, CaptureFiles files, int exitStatus, boolean preserve) {
		Channel channel = expectation.getChannel();
		ComparisonMode mode = expectation.getMode();

		if (channel == Channel.RET) {
			if (mode == ComparisonMode.IGNORE) {
				if (exitStatus != 0) {
					accounting.note(0, "Ignored " + channel.getLabel() + ": " + exitStatus);
				}
				return null;
			}
			if (mode == ComparisonMode.EXACT) {
				// direct numeric check, a diff would only add noise
				if (String.valueOf(exitStatus).equals(expected.trim())) {
					return null;
				}
				return "Got " + channel.getLabel() + " '" + exitStatus + "', expected '" + expected.trim() + "'.";
			}
			return compare(channel, mode, expected, String.valueOf(exitStatus), true);
		}

		String actual = readCapture(files.get(channel));
		if (mode == ComparisonMode.IGNORE) {
			if (!actual.isEmpty()) {
				accounting
						.note(
								0,
								"Ignored " + channel.getLabel() + " (" + actual.length() + " characters): '"
										+ files.get(channel) + "'");
			}
			return null;
		}
		return compare(channel, mode, expected, actual, preserve);
	}

	private static String compare(Channel channel, ComparisonMode mode, String expected, String actual, boolean preserve) {
		try {
			return OutputComparator.compare(mode, expected, actual, preserve);
		} catch (GlobSyntaxException e) {
			throw new TestUsageException("Invalid pattern for " + channel.getLabel() + ": " + e.getMessage(), e);
		}
	}

	private void reportFailures(AssertionResult result) {
		CaptureFiles files = result.getCaptureFiles();
		for (Map.Entry<Channel, String> failure : result.getFailures().entrySet()) {
			Channel channel = failure.getKey();
			accounting.note(0, "");
			accounting.note(0, "Unexpected " + channel.getLabel() + ":");
			accounting.note(1, SEPARATOR);
			accounting.note(1, failure.getValue());
			accounting.note(1, SEPARATOR);
			accounting.note(1, "[See: '" + files.get(channel) + "']");
			accounting.note(0, "");
		}
		if (hasContent(files.getErr())) {
			err.println(DETAILS_PREFIX + files.getErr());
			err.flush();
		}
	}

	private static boolean hasContent(Path path) {
		try {
			return Files.size(path) > 0;
		} catch (IOException e) {
			LOGGER.debug("Cannot read size of {}: {}", path, e.getMessage());
			return false;
		}
	}
}
