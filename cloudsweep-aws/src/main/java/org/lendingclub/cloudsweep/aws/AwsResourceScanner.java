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

import java.time.Duration;
import java.util.Date;
import java.util.List;
import java.util.concurrent.TimeUnit;
import java.util.function.Function;
import java.util.function.Supplier;

import org.lendingclub.cloudsweep.core.Finding;
import org.lendingclub.cloudsweep.core.ResourceScanner;
import org.lendingclub.cloudsweep.core.ScannerSettings;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;
import com.google.common.base.Stopwatch;

/**
 * Base class for scanners that run against one region of one account.
 * <p>
 * A fresh client is created for every invocation from the context it is handed, so a scanner instance holds no
 * per-account state and can be shared between worker threads.
 *
 * @param <T> the AWS client type the scanner talks to
 */
public abstract class AwsResourceScanner<T> implements ResourceScanner<AwsCredentialContext> {

	protected final Logger logger = LoggerFactory.getLogger(getClass());

	private final ScannerSettings settings;
	private final String alias;
	private final String label;
	private Function<AwsCredentialContext, T> clientSupplier = this::createClient;

	protected AwsResourceScanner(ScannerSettings settings, String alias, String label) {
		Preconditions.checkNotNull(settings, "settings cannot be null");
		Preconditions.checkArgument(!Strings.isNullOrEmpty(alias), "alias cannot be empty");
		Preconditions.checkArgument(!Strings.isNullOrEmpty(label), "label cannot be empty");
		this.settings = settings;
		this.alias = alias;
		this.label = label;
	}

	@Override
	public String getAlias() {
		return alias;
	}

	@Override
	public String getLabel() {
		return label;
	}

	public ScannerSettings getSettings() {
		return settings;
	}

	protected int getDaysThreshold() {
		return settings.getDaysThreshold();
	}

	/**
	 * Replaces client construction, so tests can hand in a mock.
	 */
	@VisibleForTesting
	public AwsResourceScanner<T> withClientFactory(Function<AwsCredentialContext, T> clientSupplier) {
		Preconditions.checkNotNull(clientSupplier);
		this.clientSupplier = clientSupplier;
		return this;
	}

	protected abstract T createClient(AwsCredentialContext context);

	protected void closeClient(T client) {
		// nothing to release by default
	}

	@Override
	public final List<Finding> scan(AwsCredentialContext context) {
		Preconditions.checkNotNull(context, "context cannot be null");
		Stopwatch sw = Stopwatch.createStarted();
		T client = clientSupplier.apply(context);
		try {
			List<Finding> findings = doScan(context, client);
			logger.info("found {} unused {} in account={} region={} ({} ms)", findings.size(), label,
					context.getAccountId(), context.getRegion(), sw.elapsed(TimeUnit.MILLISECONDS));
			return findings;
		} finally {
			closeClient(client);
		}
	}

	protected abstract List<Finding> doScan(AwsCredentialContext context, T client);

	/**
	 * Runs one API call, backing off when throttled as the settings' retry policy allows.
	 */
	protected <R> R call(Supplier<R> action) {
		return AmazonServiceRetry.execute(settings.newRetry(), action);
	}

	protected boolean tokenHasNext(String token) {
		return (!Strings.isNullOrEmpty(token)) && (!token.equals("null"));
	}

	/**
	 * Whole days between the given date and now.
	 */
	protected long daysSince(Date date) {
		Preconditions.checkNotNull(date);
		return Duration.between(date.toInstant(), settings.getClock().instant()).toDays();
	}

	@Override
	public String toString() {
		return MoreObjects.toStringHelper(this).add("alias", alias).add("settings", settings).toString();
	}
}
