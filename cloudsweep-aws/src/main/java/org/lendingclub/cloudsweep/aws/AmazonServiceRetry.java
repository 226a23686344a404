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
package org.lendingclub.cloudsweep.aws;

import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Predicate;
import java.util.function.Supplier;

import org.lendingclub.cloudsweep.core.BackoffRetry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazonaws.AmazonServiceException;
import com.amazonaws.SdkBaseException;
import com.amazonaws.retry.RetryUtils;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableSet;

/**
 * Wraps one AWS call in a {@link BackoffRetry}. Only throttling errors are retried; any other service error is
 * rethrown on the first occurrence.
 */
public class AmazonServiceRetry {
	private static final Logger logger = LoggerFactory.getLogger(AmazonServiceRetry.class);

	private static final ImmutableSet<String> EXTRA_THROTTLING_CODES = ImmutableSet.of("LimitExceededException",
			"RequestLimitExceeded", "TooManyRequestsException");

	public static final Predicate<AmazonServiceException> THROTTLING = e -> RetryUtils.isThrottlingException((SdkBaseException) e)
			|| EXTRA_THROTTLING_CODES.contains(e.getErrorCode());

	private final BackoffRetry retry;

	public AmazonServiceRetry(BackoffRetry retry) {
		this.retry = Preconditions.checkNotNull(retry, "retry cannot be null");
	}

	public static <T> T execute(BackoffRetry retry, Supplier<T> action) {
		return new AmazonServiceRetry(retry).call(action);
	}

	public <T> T call(Supplier<T> action) {
		AtomicReference<T> result = new AtomicReference<>();
		AtomicReference<AmazonServiceException> lastError = new AtomicReference<>();
		boolean success = retry.execute(() -> {
			try {
				result.set(action.get());
				lastError.set(null);
				return true;
			} catch (AmazonServiceException e) {
				if (!THROTTLING.test(e)) {
					throw e;
				}
				logger.warn("throttled: {}", e.getMessage());
				lastError.set(e);
				return false;
			}
		});
		if (success) {
			return result.get();
		}
		if (lastError.get() != null) {
			throw lastError.get();
		}
		throw new AmazonServiceException("operation failed after retries");
	}
}
