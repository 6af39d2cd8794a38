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

import java.io.FilterOutputStream;
import java.io.IOException;
import java.io.OutputStream;

/**
 * Output stream filter that drops the newline characters found at the very
 * end of the stream.
 * <p>
 * Newlines are held back until a non-newline byte arrives, in which case
 * they are written out unchanged, so blank lines in the middle of the output
 * are kept. Newlines still pending when the stream is closed are discarded.
 */
public class ChompingOutputStream extends FilterOutputStream {

	private long pendingNewlines;

	/**
	 * @param out the stream receiving the filtered output
	 */
	public ChompingOutputStream(OutputStream out) {
		super(out);
	}

	@Override
	public void write(int b) throws IOException {
		if (b == '\n') {
			pendingNewlines++;
			return;
		}
		flushPending();
		out.write(b);
	}

	@Override
	public void write(byte[] b, int off, int len) throws IOException {
		int end = off + len;
		int start = off;
		for (int i = off; i < end; i++) {
			if (b[i] == '\n') {
				if (i > start) {
					flushPending();
					out.write(b, start, i - start);
				}
				pendingNewlines++;
				start = i + 1;
			}
		}
		if (start < end) {
			flushPending();
			out.write(b, start, end - start);
		}
	}

	private void flushPending() throws IOException {
		for (; pendingNewlines > 0; pendingNewlines--) {
			out.write('\n');
		}
	}

	/**
	 * @return number of newline characters currently held back
	 */
	public long getPendingNewlines() {
		return pendingNewlines;
	}
}
