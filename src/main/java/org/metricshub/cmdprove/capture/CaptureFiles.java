package org.metricshub.cmdprove.capture;

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

import java.nio.file.Path;
import org.metricshub.cmdprove.assertion.Channel;

/**
 * The three files receiving the captured stdout, stderr and exit status of
 * one command invocation.
 */
public final class CaptureFiles {

	private final String baseName;
	private final Path out;
	private final Path err;
	private final Path ret;

	CaptureFiles(String baseName, Path out, Path err, Path ret) {
		this.baseName = baseName;
		this.out = out;
		this.err = err;
		this.ret = ret;
	}

	/**
	 * @return the disambiguated base name, e.g. <code>test03</code>
	 */
	public String getBaseName() {
		return baseName;
	}

	public Path getOut() {
		return out;
	}

	public Path getErr() {
		return err;
	}

	public Path getRet() {
		return ret;
	}

	/**
	 * @param channel a channel
	 * @return the capture file of that channel
	 */
	public Path get(Channel channel) {
		switch (channel) {
		case OUT:
			return out;
		case ERR:
			return err;
		case RET:
		default:
			return ret;
		}
	}

	@Override
	public String toString() {
		return baseName + "{" + out + ", " + err + ", " + ret + "}";
	}
}
