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

import java.util.ArrayList;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicInteger;

import org.assertj.core.api.Assertions;
import org.junit.Test;

public class BackoffRetryTest {

	static class RecordingRetry extends BackoffRetry {
		List<Long> delays = new ArrayList<>();

		@Override
		protected void sleep(long delay) {
			delays.add(delay);
		}
	}

	@Test
	public void testImmediateSuccess() {
		RecordingRetry retry = new RecordingRetry();
		Assertions.assertThat(retry.execute(() -> true)).isTrue();
		Assertions.assertThat(retry.delays).isEmpty();
	}

	@Test
	public void testExponentialDelays() {
		RecordingRetry retry = new RecordingRetry();
		retry.withInitialDelay(100, TimeUnit.MILLISECONDS).withMaxTries(4).withMultiplier(2.0);
		AtomicInteger calls = new AtomicInteger();
		Assertions.assertThat(retry.execute(() -> calls.incrementAndGet() < 0)).isFalse();
		Assertions.assertThat(calls.get()).isEqualTo(4);
		Assertions.assertThat(retry.delays).containsExactly(100L, 200L, 400L);
	}

	@Test
	public void testSucceedsAfterFailures() {
		RecordingRetry retry = new RecordingRetry();
		retry.withInitialDelay(10, TimeUnit.MILLISECONDS).withMaxTries(5);
		AtomicInteger calls = new AtomicInteger();
		Assertions.assertThat(retry.execute(() -> calls.incrementAndGet() == 3)).isTrue();
		Assertions.assertThat(calls.get()).isEqualTo(3);
		Assertions.assertThat(retry.delays).hasSize(2);
	}

	@Test
	public void testMaxDelayCaps() {
		RecordingRetry retry = new RecordingRetry();
		retry.withInitialDelay(100, TimeUnit.MILLISECONDS).withMaxDelay(150, TimeUnit.MILLISECONDS)
				.withMaxTries(4);
		retry.execute(() -> false);
		Assertions.assertThat(retry.delays).containsExactly(100L, 150L, 150L);
	}

	@Test
	public void testJitterStaysWithinBounds() {
		RecordingRetry retry = new RecordingRetry();
		retry.withInitialDelay(1000, TimeUnit.MILLISECONDS).withMaxTries(2).withJitter(true);
		retry.execute(() -> false);
		Assertions.assertThat(retry.delays).hasSize(1);
		Assertions.assertThat(retry.delays.get(0)).isBetween(500L, 1000L);
	}

	@Test
	public void testInvalidMultiplier() {
		Assertions.assertThatThrownBy(() -> new BackoffRetry().withMultiplier(0.5))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
