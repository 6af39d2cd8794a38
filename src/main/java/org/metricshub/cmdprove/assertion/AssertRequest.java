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

import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.EnumMap;
import java.util.List;
import java.util.Map;
import org.metricshub.cmdprove.TestUsageException;
import org.metricshub.cmdprove.compare.ComparisonMode;
import org.metricshub.cmdprove.util.ProveSettings;

/**
 * A parsed assertion call:
 *
 * <pre>
 * [-d] {description} [options] -- {command...}
 *   -o|-op|-O {value}   stdout: literal | pattern | file
 *   -e|-ep|-E {value}   stderr: literal | pattern | file
 *   -r|-rp|-R {value}   exit status: literal | pattern | file
 *   -oi -ei -ri         ignore stdout / stderr / exit status
 *   -p                  preserve trailing newlines
 *   -f                  return the number of failed channels
 * </pre>
 *
 * The description is either the first argument, when it does not start with
 * a dash, or the value of <code>-d</code>. Everything after <code>--</code>
 * is the command. When the same channel is set several times, the last
 * option wins.
 */
public final class AssertRequest {

	/** Separator between the options and the command */
	public static final String COMMAND_SEPARATOR = "--";

	private String description;
	private final Map<Channel, ExpectedValue> expected = new EnumMap<Channel, ExpectedValue>(Channel.class);
	private boolean preserveNewlines;
	private boolean failOnError;
	private List<String> command = Collections.emptyList();

	private AssertRequest() {}

	/**
	 * Parses the arguments of an assertion call.
	 *
	 * @param args the arguments
	 * @param settings provide the per-channel ignore defaults
	 * @return the parsed request
	 * @throws TestUsageException if the arguments are malformed
	 */
	public static AssertRequest parse(String[] args, ProveSettings settings) {
		if (args == null || args.length < 2) {
			throw new TestUsageException("At least two arguments must be provided (description, command).");
		}
		AssertRequest request = new AssertRequest();
		for (Channel channel : Channel.values()) {
			request.expected.put(channel, ExpectedValue.defaultFor(channel, settings.isIgnoredByDefault(channel)));
		}

		int argIdx = 0;
		if (!args[0].startsWith("-")) {
			request.description = args[0];
			argIdx = 1;
		}
		boolean commandFound = false;
		while (argIdx < args.length) {
			String arg = args[argIdx];
			if (arg.equals(COMMAND_SEPARATOR)) {
				request.command = Collections.unmodifiableList(new ArrayList<String>(
						Arrays.asList(args).subList(argIdx + 1, args.length)));
				commandFound = true;
				break;
			} else if (arg.equals("-p")) {
				request.preserveNewlines = true;
			} else if (arg.equals("-f")) {
				request.failOnError = true;
			} else if (arg.equals("-oi")) {
				request.ignore(Channel.OUT);
			} else if (arg.equals("-ei")) {
				request.ignore(Channel.ERR);
			} else if (arg.equals("-ri")) {
				request.ignore(Channel.RET);
			} else if (arg.startsWith("-")) {
				checkParameterHasArgument(args, argIdx);
				request.applyOption(arg, args[++argIdx]);
			} else {
				throw new TestUsageException(
						"Invalid command-line argument given to the assert function: '" + arg + "' (arg index: "
								+ (argIdx + 1) + "). Command-line was: " + String.join(" ", args));
			}
			++argIdx;
		}

		if (!commandFound || request.command.isEmpty()) {
			throw new TestUsageException("Please specify a command to test.");
		}
		if (request.description == null || request.description.isEmpty()) {
			throw new TestUsageException("Please specify a description for the test case.");
		}
		return request;
	}

	private static void checkParameterHasArgument(String[] args, int argIdx) {
		if (argIdx + 1 >= args.length) {
			throw new TestUsageException("Missing value for option: '" + args[argIdx] + "'");
		}
	}

	private void applyOption(String option, String value) {
		switch (option) {
		case "-d":
			description = value;
			break;
		case "-o":
			expect(Channel.OUT, ComparisonMode.EXACT, ExpectedValue.Source.LITERAL, value);
			break;
		case "-op":
			expect(Channel.OUT, ComparisonMode.PATTERN, ExpectedValue.Source.LITERAL, value);
			break;
		case "-O":
			expect(Channel.OUT, ComparisonMode.EXACT, ExpectedValue.Source.FILE, value);
			break;
		case "-e":
			expect(Channel.ERR, ComparisonMode.EXACT, ExpectedValue.Source.LITERAL, value);
			break;
		case "-ep":
			expect(Channel.ERR, ComparisonMode.PATTERN, ExpectedValue.Source.LITERAL, value);
			break;
		case "-E":
			expect(Channel.ERR, ComparisonMode.EXACT, ExpectedValue.Source.FILE, value);
			break;
		case "-r":
			expect(Channel.RET, ComparisonMode.EXACT, ExpectedValue.Source.LITERAL, value);
			break;
		case "-rp":
			expect(Channel.RET, ComparisonMode.PATTERN, ExpectedValue.Source.LITERAL, value);
			break;
		case "-R":
			expect(Channel.RET, ComparisonMode.EXACT, ExpectedValue.Source.FILE, value);
			break;
		default:
			throw new TestUsageException("Invalid option for 'assert': '" + option + "'");
		}
	}

	private void expect(Channel channel, ComparisonMode mode, ExpectedValue.Source source, String value) {
		expected.put(channel, new ExpectedValue(channel, mode, source, value));
	}

	private void ignore(Channel channel) {
		expected.put(channel, new ExpectedValue(channel, ComparisonMode.IGNORE, ExpectedValue.Source.DEFAULT, ""));
	}

	public String getDescription() {
		return description;
	}

	/**
	 * @param channel a channel
	 * @return the expectation for that channel, never <code>null</code>
	 */
	public ExpectedValue getExpected(Channel channel) {
		return expected.get(channel);
	}

	public boolean isPreserveNewlines() {
		return preserveNewlines;
	}

	public boolean isFailOnError() {
		return failOnError;
	}

	/**
	 * @return the command under test and its arguments
	 */
	public List<String> getCommand() {
		return command;
	}

	@Override
	public String toString() {
		return "AssertRequest[" + description + ", " + expected.values() + ", preserve=" + preserveNewlines + ", fail="
				+ failOnError + ", command=" + command + "]";
	}
}
