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

import java.io.IOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import org.metricshub.cmdprove.TestUsageException;
import org.metricshub.cmdprove.compare.ComparisonMode;
import org.metricshub.cmdprove.compare.OutputComparator;

/**
 * What a channel of the command under test is expected to produce.
 */
public final class ExpectedValue {

	/**
	 * Where the expected value comes from.
	 */
	public enum Source {
		/** Not given by the assertion: empty output, exit status 0 */
		DEFAULT,
		/** Given inline */
		LITERAL,
		/** Contents of a file */
		FILE
	}

	private final Channel channel;
	private final ComparisonMode mode;
	private final Source source;
	private final String argument;

	/**
	 * @param channel the channel
	 * @param mode how the value is compared
	 * @param source where the value comes from
	 * @param argument the literal value, pattern or file path
	 */
	public ExpectedValue(Channel channel, ComparisonMode mode, Source source, String argument) {
		this.channel = channel;
		this.mode = mode;
		this.source = source;
		this.argument = argument;
	}

	/**
	 * The expectation used when an assertion says nothing about a channel.
	 *
	 * @param channel the channel
	 * @param ignored whether the channel is ignored by default
	 * @return exact match of the empty string, or of 0 for the exit status
	 */
	public static ExpectedValue defaultFor(Channel channel, boolean ignored) {
		String value = channel == Channel.RET ? "0" : "";
		return new ExpectedValue(channel, ignored ? ComparisonMode.IGNORE : ComparisonMode.EXACT, Source.DEFAULT, value);
	}

	/**
	 * Reads the expected value.
	 *
	 * @param preserveNewlines when <code>false</code>, trailing newlines are removed
	 * @return the value to compare with
	 * @throws TestUsageException if the expectation file cannot be read
	 */
	public String resolve(boolean preserveNewlines) {
		String value;
		if (source == Source.FILE) {
			Path path = Paths.get(argument);
			try {
				value = new String(Files.readAllBytes(path), StandardCharsets.UTF_8);
			} catch (IOException e) {
				throw new TestUsageException(
						"Failed to read masterfile (type " + channel.getLabel() + ") '" + argument + "': " + e,
						e);
			}
		} else {
			value = argument;
		}
		return preserveNewlines ? value : OutputComparator.chomp(value);
	}

	public Channel getChannel() {
		return channel;
	}

	public ComparisonMode getMode() {
		return mode;
	}

	public Source getSource() {
		return source;
	}

	public String getArgument() {
		return argument;
	}

	@Override
	public String toString() {
		return channel + ":" + mode + ":" + source + "='" + argument + "'";
	}
}
