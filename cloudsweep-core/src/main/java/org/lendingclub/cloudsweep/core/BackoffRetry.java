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

import java.util.Random;
import java.util.concurrent.TimeUnit;
import java.util.function.Supplier;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;

/**
 * Bounded retry with exponential backoff. The action reports success by returning true; a false return schedules
 * another attempt until either the attempt limit or the overall timeout is reached.
 */
public class BackoffRetry {
	private static final Random rand = new Random();
	private static final Logger logger = LoggerFactory.getLogger(BackoffRetry.class);

	public static final int DEFAULT_MAX_TRIES = 4;
	public static final long DEFAULT_INITIAL_DELAY_MILLIS = TimeUnit.SECONDS.toMillis(1);

	private long initialDelay;
	private long maxDelay;
	private long timeout;
	private int maxTries;
	private double multiplier;
	private boolean jitter;

	public BackoffRetry() {
		withTimeout(5, TimeUnit.MINUTES).withInitialDelay(DEFAULT_INITIAL_DELAY_MILLIS, TimeUnit.MILLISECONDS)
				.withMaxDelay(1, TimeUnit.MINUTES).withMaxTries(DEFAULT_MAX_TRIES).withMultiplier(2.0d);
	}

	public BackoffRetry withTimeout(long t, TimeUnit u) {
		this.timeout = u.toMillis(t);
		return this;
	}

	public BackoffRetry withInitialDelay(long t, TimeUnit u) {
		Preconditions.checkArgument(t >= 0, "initial delay must be >= 0");
		this.initialDelay = u.toMillis(t);
		return this;
	}

	public BackoffRetry withMaxDelay(long t, TimeUnit u) {
		this.maxDelay = u.toMillis(t);
		return this;
	}

	/**
	 * Total number of attempts, including the first. Zero or less means attempts are bounded only by the timeout.
	 */
	public BackoffRetry withMaxTries(int maxTries) {
		this.maxTries = maxTries;
		return this;
	}

	public BackoffRetry withMultiplier(double multiplier) {
		Preconditions.checkArgument(multiplier >= 1.0d, "multiplier must be >= 1");
		this.multiplier = multiplier;
		return this;
	}

	public BackoffRetry withJitter(boolean jitter) {
		this.jitter = jitter;
		return this;
	}

	/**
	 * @return true if the action eventually succeeded
	 */
	public boolean execute(Supplier<Boolean> action) {
		long t0 = System.currentTimeMillis();
		long delay = initialDelay;
		int attempt = 1;
		while (true) {
			if (action.get()) {
				return true;
			}
			if (maxTries > 0 && attempt >= maxTries) {
				return false;
			}
			if (System.currentTimeMillis() - t0 >= timeout) {
				return false;
			}
			long t = (jitter && delay > 0) ? delay / 2 + rand.nextInt((int) Math.max(1, delay / 2)) : delay;
			logger.info("delaying {} millis before attempt #{}", t, attempt + 1);
			try {
				sleep(t);
			} catch (InterruptedException e) {
				Thread.currentThread().interrupt();
				return false;
			}
			attempt++;
			delay = Math.min(maxDelay, (long) (delay * multiplier));
		}
	}

	protected void sleep(long delay) throws InterruptedException {
		if (delay > 0) {
			Thread.sleep(delay);
		}
	}

	@Override
	public String toString() {
		return MoreObjects.toStringHelper(this).add("maxTries", maxTries).add("initialDelay", initialDelay)
				.add("multiplier", multiplier).add("timeout", timeout).toString();
	}
}
