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

import java.time.Clock;
import java.util.concurrent.TimeUnit;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * Values handed to scanner plugins when they are constructed. The orchestration code never interprets them.
 */
public class ScannerSettings {

	public static final int DEFAULT_DAYS_THRESHOLD = 90;

	private final int daysThreshold;
	private final Clock clock;
	private final int retryMaxTries;
	private final long retryInitialDelayMillis;

	public ScannerSettings(int daysThreshold, Clock clock) {
		this(daysThreshold, clock, BackoffRetry.DEFAULT_MAX_TRIES, BackoffRetry.DEFAULT_INITIAL_DELAY_MILLIS);
	}

	private ScannerSettings(int daysThreshold, Clock clock, int retryMaxTries, long retryInitialDelayMillis) {
		Preconditions.checkArgument(daysThreshold >= 0, "daysThreshold must be >= 0");
		Preconditions.checkNotNull(clock, "clock cannot be null");
		Preconditions.checkArgument(retryInitialDelayMillis >= 0, "retryInitialDelayMillis must be >= 0");
		this.daysThreshold = daysThreshold;
		this.clock = clock;
		this.retryMaxTries = retryMaxTries;
		this.retryInitialDelayMillis = retryInitialDelayMillis;
	}

	public ScannerSettings(int daysThreshold) {
		this(daysThreshold, Clock.systemUTC());
	}

	public static ScannerSettings defaults() {
		return new ScannerSettings(DEFAULT_DAYS_THRESHOLD);
	}

	public int getDaysThreshold() {
		return daysThreshold;
	}

	public Clock getClock() {
		return clock;
	}

	/**
	 * Copy of these settings with a different throttling retry policy.
	 */
	public ScannerSettings withRetry(int maxTries, long initialDelayMillis) {
		return new ScannerSettings(daysThreshold, clock, maxTries, initialDelayMillis);
	}

	public int getRetryMaxTries() {
		return retryMaxTries;
	}

	public long getRetryInitialDelayMillis() {
		return retryInitialDelayMillis;
	}

	/**
	 * A fresh retry policy for one outbound call. {@link BackoffRetry} is stateful, so it is never shared.
	 */
	public BackoffRetry newRetry() {
		return new BackoffRetry().withMaxTries(retryMaxTries)
				.withInitialDelay(retryInitialDelayMillis, TimeUnit.MILLISECONDS).withJitter(true);
	}

	@Override
	public String toString() {
		return MoreObjects.toStringHelper(this).add("daysThreshold", daysThreshold)
				.add("retryMaxTries", retryMaxTries).add("retryInitialDelayMillis", retryInitialDelayMillis)
				.toString();
	}
}
