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

import java.util.Collection;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.TimeUnit;

import org.lendingclub.cloudsweep.core.AccountScanResult;
import org.lendingclub.cloudsweep.core.Finding;
import org.lendingclub.cloudsweep.core.ScannerDescriptor;
import org.lendingclub.cloudsweep.core.ScannerNotFoundException;
import org.lendingclub.cloudsweep.core.ScannerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;

/**
 * Runs a set of scanners against a set of regions in one account.
 * <p>
 * Every failure is contained at the smallest scope: a region whose context cannot be derived is not scanned, and a
 * scanner that cannot be resolved or that throws leaves an empty cell behind while its siblings carry on. Either
 * way every requested cell is present in the result.
 */
public class AccountScanner {

	private static final Logger logger = LoggerFactory.getLogger(AccountScanner.class);

	private final CredentialBroker broker;
	private final ScannerRegistry<AwsCredentialContext> registry;

	public AccountScanner(CredentialBroker broker, ScannerRegistry<AwsCredentialContext> registry) {
		Preconditions.checkNotNull(broker, "broker cannot be null");
		Preconditions.checkNotNull(registry, "registry cannot be null");
		this.broker = broker;
		this.registry = registry;
	}

	public AccountScanResult scanResources(AwsCredentialContext context, String accountId, String accountName,
			Collection<String> regions, Collection<String> scannerAliases) {
		logger.debug("scanning account {} ({}) regions={} scanners={}", accountId, accountName, regions,
				scannerAliases);
		AccountScanResult result = new AccountScanResult(accountId, accountName);

		for (String region : regions) {
			result.addRegion(region);
			AwsCredentialContext regional;
			try {
				regional = broker.withRegion(context, region);
			} catch (RuntimeException e) {
				logger.warn("skipping region {} in account {}: {}", region, accountId, e.toString());
				scannerAliases.forEach(alias -> result.put(region, alias, Collections.emptyList()));
				continue;
			}
			for (String alias : scannerAliases) {
				result.put(region, alias, scan(regional, accountId, region, alias));
			}
		}
		return result;
	}

	private List<Finding> scan(AwsCredentialContext context, String accountId, String region, String alias) {
		ScannerDescriptor<AwsCredentialContext> descriptor;
		try {
			descriptor = registry.resolve(alias);
		} catch (ScannerNotFoundException e) {
			logger.warn("no scanner registered for '{}'", alias);
			return Collections.emptyList();
		}
		Stopwatch sw = Stopwatch.createStarted();
		try {
			List<Finding> findings = descriptor.getScanner().scan(context);
			if (findings == null) {
				findings = Collections.emptyList();
			}
			logger.debug("{} found {} resources in account={} region={} ({} ms)", alias, findings.size(), accountId,
					region, sw.elapsed(TimeUnit.MILLISECONDS));
			return findings;
		} catch (RuntimeException e) {
			logger.warn("scanner {} failed in account={} region={}", alias, accountId, region, e);
			return Collections.emptyList();
		}
	}
}
