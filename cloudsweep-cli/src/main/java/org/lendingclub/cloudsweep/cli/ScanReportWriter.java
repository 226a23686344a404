/**
 * Copyright 2017-2018 LendingClub, Inc.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 *     http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */
package org.lendingclub.cloudsweep.cli;

import java.io.IOException;
import java.io.UncheckedIOException;
import java.nio.charset.StandardCharsets;
import java.nio.file.Files;
import java.nio.file.Path;
import java.nio.file.Paths;
import java.time.Clock;
import java.util.Optional;

import org.lendingclub.cloudsweep.aws.ScanOutcome;
import org.lendingclub.cloudsweep.core.JsonUtil;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;

/**
 * Writes a scan outcome as pretty-printed JSON. Runs that found nothing produce no file.
 */
public class ScanReportWriter {

	private static final Logger logger = LoggerFactory.getLogger(ScanReportWriter.class);

	private final Clock clock;

	public ScanReportWriter() {
		this(Clock.systemUTC());
	}

	public ScanReportWriter(Clock clock) {
		Preconditions.checkNotNull(clock);
		this.clock = clock;
	}

	public Path defaultReportPath() {
		return Paths.get("cloudsweep-report-" + clock.instant().getEpochSecond() + ".json");
	}

	/**
	 * @return the file written, or empty if there was nothing to report
	 */
	public Optional<Path> write(ScanOutcome outcome, Path target) {
		Preconditions.checkNotNull(outcome);
		if (!outcome.hasFindings()) {
			logger.info("no unused resources found, skipping report");
			return Optional.empty();
		}
		Path path = target != null ? target : defaultReportPath();
		try {
			Path parent = path.toAbsolutePath().getParent();
			if (parent != null) {
				Files.createDirectories(parent);
			}
			Files.write(path, JsonUtil.prettyFormat(outcome).getBytes(StandardCharsets.UTF_8));
		} catch (IOException e) {
			throw new UncheckedIOException("could not write report to " + path, e);
		}
		logger.info("wrote report to {}", path.toAbsolutePath());
		return Optional.of(path);
	}
}
