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
package org.lendingclub.cloudsweep.core;

import java.math.BigDecimal;
import java.math.RoundingMode;
import java.time.Duration;
import java.time.Instant;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * Timing and throughput for one run. Computed once, after every dispatched task has returned.
 */
@JsonPropertyOrder({ "startTime", "endTime", "totalTasks", "totalScans", "failedScans", "totalRunTime",
		"avgScansPerSecond" })
public final class ScanMetrics {

	private final Instant startTime;
	private final Instant endTime;
	private final int totalTasks;
	private final int totalScans;
	private final int failedScans;

	private ScanMetrics(Instant startTime, Instant endTime, int totalTasks, int totalScans, int failedScans) {
		this.startTime = startTime;
		this.endTime = endTime;
		this.totalTasks = totalTasks;
		this.totalScans = totalScans;
		this.failedScans = failedScans;
	}

	public static ScanMetrics compute(Instant startTime, Instant endTime, int totalTasks, int totalScans,
			int failedScans) {
		Preconditions.checkNotNull(startTime, "startTime cannot be null");
		Preconditions.checkNotNull(endTime, "endTime cannot be null");
		return new ScanMetrics(startTime, endTime, totalTasks, totalScans, failedScans);
	}

	public Instant getStartTime() {
		return startTime;
	}

	public Instant getEndTime() {
		return endTime;
	}

	/**
	 * Number of tasks dispatched.
	 */
	public int getTotalTasks() {
		return totalTasks;
	}

	/**
	 * Number of tasks that returned a result.
	 */
	public int getTotalScans() {
		return totalScans;
	}

	public int getFailedScans() {
		return failedScans;
	}

	/**
	 * Seconds between start and end. A wall clock stepped backwards mid-run reads as zero.
	 */
	@JsonProperty("totalRunTime")
	public double getElapsedSeconds() {
		Duration elapsed = Duration.between(startTime, endTime);
		return elapsed.isNegative() ? 0d : elapsed.toNanos() / 1_000_000_000d;
	}

	@JsonIgnore
	public double getScansPerSecond() {
		double elapsed = getElapsedSeconds();
		return elapsed > 0 ? totalScans / elapsed : 0d;
	}

	@JsonProperty("avgScansPerSecond")
	double getRoundedScansPerSecond() {
		return BigDecimal.valueOf(getScansPerSecond()).setScale(2, RoundingMode.HALF_UP).doubleValue();
	}

	@Override
	public String toString() {
		return MoreObjects.toStringHelper(this).add("totalTasks", totalTasks).add("totalScans", totalScans)
				.add("failedScans", failedScans).add("elapsedSeconds", getElapsedSeconds())
				.add("scansPerSecond", getScansPerSecond()).toString();
	}
}
