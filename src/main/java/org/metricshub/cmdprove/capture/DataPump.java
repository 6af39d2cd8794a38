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

import java.io.IOException;
import java.io.InputStream;
import java.io.OutputStream;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import org.metricshub.cmdprove.util.ProveLogger;
import org.slf4j.Logger;

/**
 * Relays data from an input stream to one or more output streams, in a
 * separate thread.
 * <p>
 * Each chunk read is written to every sink, in order, before the next
 * chunk is read, so all sinks see the same bytes in the same order. Sinks
 * shared with other pumps must be synchronized by the caller (a
 * {@link java.io.PrintStream} is).
 * <p>
 * Write errors on one sink are logged and that sink is dropped (a command
 * that exits without reading its input breaks the stdin pipe, for
 * instance); the pump keeps draining the input so the producing process
 * never blocks on a full pipe.
 */
public final class DataPump implements Runnable {

	private static final Logger LOGGER = ProveLogger.getLogger(DataPump.class);

	private static final int BUFFER_SIZE = 8192;

	private final String description;
	private final InputStream in;
	private final List<OutputStream> sinks;
	private final List<OutputStream> sinksToClose;
	private final Thread thread;
	private volatile IOException error;

	private DataPump(String description, InputStream in, List<OutputStream> sinks, List<OutputStream> sinksToClose) {
		this.description = description;
		this.in = in;
		this.sinks = new ArrayList<OutputStream>(sinks);
		this.sinksToClose = sinksToClose;
		this.thread = new Thread(this, "DataPump-" + description);
		this.thread.setDaemon(true);
	}

	/**
	 * Starts relaying <code>in</code> to the specified sinks. The sinks are
	 * flushed, but not closed, at the end of the input.
	 *
	 * @param description name of the data, used for the thread name and logging
	 * @param in the source
	 * @param sinks the destinations
	 * @return the started pump
	 */
	public static DataPump dump(String description, InputStream in, OutputStream... sinks) {
		DataPump pump = new DataPump(description, in, Arrays.asList(sinks), Collections.<OutputStream>emptyList());
		pump.thread.start();
		return pump;
	}

	/**
	 * Starts relaying <code>in</code> to a single sink that is closed at the
	 * end of the input.
	 *
	 * @param description name of the data
	 * @param in the source
	 * @param sink the destination, owned by the pump
	 * @return the started pump
	 */
	public static DataPump dumpAndClose(String description, InputStream in, OutputStream sink) {
		DataPump pump = new DataPump(description, in, Collections.singletonList(sink), Collections.singletonList(sink));
		pump.thread.start();
		return pump;
	}

	@Override
	public void run() {
		byte[] buffer = new byte[BUFFER_SIZE];
		try {
			int len;
			while ((len = in.read(buffer)) >= 0) {
				if (len == 0) {
					continue;
				}
				for (int i = 0; i < sinks.size(); i++) {
					OutputStream sink = sinks.get(i);
					try {
						sink.write(buffer, 0, len);
						sink.flush();
					} catch (IOException e) {
						LOGGER.debug("{}: dropping output sink after write error: {}", description, e.getMessage());
						sinks.remove(i--);
						recordError(e);
					}
				}
			}
		} catch (IOException e) {
			LOGGER.debug("{}: read interrupted: {}", description, e.getMessage());
			recordError(e);
		} finally {
			for (OutputStream sink : sinksToClose) {
				try {
					sink.close();
				} catch (IOException e) {
					recordError(e);
				}
			}
			try {
				in.close();
			} catch (IOException e) {
				LOGGER.debug("{}: cannot close input: {}", description, e.getMessage());
			}
		}
	}

	private void recordError(IOException e) {
		if (error == null) {
			error = e;
		}
	}

	/**
	 * Waits until the whole input has been relayed.
	 *
	 * @throws InterruptedException if interrupted while waiting
	 */
	public void await() throws InterruptedException {
		thread.join();
	}

	/**
	 * @return the first I/O error met while relaying, or <code>null</code>
	 */
	public IOException getError() {
		return error;
	}
}
