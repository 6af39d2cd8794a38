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
import java.nio.file.FileAlreadyExistsException;
import java.nio.file.Files;
import java.nio.file.Path;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import org.metricshub.cmdprove.HarnessException;
import org.metricshub.cmdprove.assertion.Channel;
import org.metricshub.cmdprove.util.ProveLogger;
import org.slf4j.Logger;

/**
 * Allocates uniquely named capture files in an output directory.
 * <p>
 * For a base name <code>N</code>, candidates <code>N00</code> to
 * <code>N99</code> are tried in increasing order; the first one for which
 * none of <code>N??.out</code>, <code>N??.err</code> and
 * <code>N??.ret</code> exists is reserved by creating the three (empty)
 * files. Reserving makes two allocations in a row return different names
 * even before anything is written.
 */
public class CaptureStore {

	private static final Logger LOGGER = ProveLogger.getLogger(CaptureStore.class);

	/** Number of candidate names tried before giving up */
	public static final int MAX_FILES = 100;

	private final Path directory;

	/**
	 * @param directory directory where capture files are created; created
	 *        on first allocation if missing
	 */
	public CaptureStore(Path directory) {
		this.directory = directory;
	}

	public Path getDirectory() {
		return directory;
	}

	/**
	 * Allocates the capture files of a new command invocation.
	 *
	 * @param baseName base name, usually the run-scoped test name
	 * @return the reserved files
	 * @throws HarnessException if the directory cannot be written, or if all
	 *         {@value #MAX_FILES} candidate names are taken
	 */
	public CaptureFiles allocate(String baseName) {
		try {
			Files.createDirectories(directory);
		} catch (IOException e) {
			throw new HarnessException("Cannot create output directory '" + directory + "': " + e.getMessage(), e);
		}
		for (int i = 0; i < MAX_FILES; i++) {
			String candidate = String.format(Locale.ROOT, "%s%02d", baseName, i);
			List<Path> reserved = reserve(candidate);
			if (reserved != null) {
				CaptureFiles files = new CaptureFiles(candidate, reserved.get(0), reserved.get(1), reserved.get(2));
				LOGGER.debug("Allocated capture files {}", files);
				return files;
			}
		}
		throw new HarnessException(
				"Could not determine a unique file name after " + MAX_FILES + " attempts (" + directory.resolve(baseName)
						+ ")");
	}

	/**
	 * Creates the three files of a candidate name.
	 *
	 * @return the created files in channel order, or <code>null</code> if one of
	 *         them already exists (any file created meanwhile is removed)
	 */
	private List<Path> reserve(String candidate) {
		List<Path> created = new ArrayList<Path>(3);
		try {
			for (Channel channel : Channel.values()) {
				created.add(Files.createFile(directory.resolve(candidate + channel.getExtension())));
			}
			return created;
		} catch (FileAlreadyExistsException e) {
			for (Path path : created) {
				try {
					Files.deleteIfExists(path);
				} catch (IOException deleteError) {
					LOGGER.warn("Cannot remove partially reserved capture file {}: {}", path, deleteError.getMessage());
				}
			}
			return null;
		} catch (IOException e) {
			throw new HarnessException("Cannot create capture file for '" + candidate + "': " + e.getMessage(), e);
		}
	}
}
