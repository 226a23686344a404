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

import java.time.Clock;
import java.time.Instant;
import java.util.ArrayList;
import java.util.Collections;
import java.util.HashMap;
import java.util.HashSet;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;
import java.util.concurrent.CompletionService;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorCompletionService;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.stream.Collectors;

import org.lendingclub.cloudsweep.core.AccountScanResult;
import org.lendingclub.cloudsweep.core.CloudsweepException;
import org.lendingclub.cloudsweep.core.JsonUtil;
import org.lendingclub.cloudsweep.core.ScanMetrics;
import org.lendingclub.cloudsweep.core.ScanResult;
import org.lendingclub.cloudsweep.core.ScanTask;
import org.lendingclub.cloudsweep.core.ScannerDescriptor;
import org.lendingclub.cloudsweep.core.ScannerRegistry;
import org.lendingclub.cloudsweep.core.WorkerPools;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.annotations.VisibleForTesting;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;

/**
 * Drives one run across the whole organization.
 * <p>
 * The run is a single pass: validate the requested scanners, obtain a runner session per account, expand the
 * account x region x scanner matrix into tasks, execute the tasks on a bounded pool, and merge results as they
 * complete. A failing account or task is logged and dropped; only configuration and lookup errors escape.
 */
public class ScanOrchestrator {

	private static final Logger logger = LoggerFactory.getLogger(ScanOrchestrator.class);

	private final CredentialBroker broker;
	private final ScannerRegistry<AwsCredentialContext> registry;
	private final AccountScanner accountScanner;
	private final CloudsweepConfig config;
	private Clock clock = Clock.systemUTC();

	/**
	 * One account ready to be scanned: its runner session, display name, and resolved regions.
	 */
	static final class ScanTarget {
		final AwsCredentialContext session;
		final String accountName;
		final List<String> regions;

		ScanTarget(AwsCredentialContext session, String accountName, List<String> regions) {
			this.session = session;
			this.accountName = accountName;
			this.regions = ImmutableList.copyOf(regions);
		}

		String getAccountId() {
			return session.getAccountId();
		}

		@Override
		public String toString() {
			return MoreObjects.toStringHelper(this).add("account", getAccountId()).add("name", accountName)
					.add("regions", regions).toString();
		}
	}

	/**
	 * Task counts for one dispatch.
	 */
	static final class DispatchCounts {
		int completed;
		int failed;

		@Override
		public String toString() {
			return MoreObjects.toStringHelper(this).add("completed", completed).add("failed", failed).toString();
		}
	}

	public ScanOrchestrator(CredentialBroker broker, ScannerRegistry<AwsCredentialContext> registry) {
		this(broker, registry, new AccountScanner(broker, registry));
	}

	public ScanOrchestrator(CredentialBroker broker, ScannerRegistry<AwsCredentialContext> registry,
			AccountScanner accountScanner) {
		Preconditions.checkNotNull(broker, "broker cannot be null");
		Preconditions.checkNotNull(registry, "registry cannot be null");
		Preconditions.checkNotNull(accountScanner, "accountScanner cannot be null");
		Preconditions.checkState(registry.isSealed(), "registry must be sealed before scanning");
		this.broker = broker;
		this.registry = registry;
		this.accountScanner = accountScanner;
		this.config = broker.getConfig();
	}

	@VisibleForTesting
	ScanOrchestrator withClock(Clock clock) {
		this.clock = clock;
		return this;
	}

	/**
	 * Resolves the requested scanner identifiers, or every registered scanner when none were requested.
	 *
	 * @throws org.lendingclub.cloudsweep.core.ScannerNotFoundException for the first identifier that does not
	 *                                                                  resolve
	 */
	public List<ScannerDescriptor<AwsCredentialContext>> resolveScanners() {
		if (config.getScanners().isEmpty()) {
			return registry.getDescriptors();
		}
		return registry.resolveAll(config.getScanners());
	}

	public ScanOutcome execute() {
		List<ScannerDescriptor<AwsCredentialContext>> scanners = resolveScanners();
		logger.info("starting scan with scanners {}",
				scanners.stream().map(ScannerDescriptor::getAlias).collect(Collectors.toList()));

		Instant start = clock.instant();

		List<AwsCredentialContext> sessions = filterAllowedAccounts(broker.assumeRunnerRoleInAllAccounts());
		logger.info("retrieved {} sessions for scanning", sessions.size());

		List<ScanTarget> targets = resolveTargets(sessions);
		List<ScanTask> tasks = buildTasks(targets, scanners);
		JsonUtil.logDebug(logger, "task matrix", tasks);

		Map<String, AwsCredentialContext> sessionsByAccount = new HashMap<>();
		targets.forEach(t -> sessionsByAccount.put(t.getAccountId(), t.session));

		ScanResult aggregate = new ScanResult();
		DispatchCounts counts = dispatch(tasks, sessionsByAccount, aggregate);

		ScanMetrics metrics = ScanMetrics.compute(start, clock.instant(), tasks.size(), counts.completed,
				counts.failed);
		logger.info("scan completed: {}", metrics);
		return new ScanOutcome(aggregate.getAccounts(), metrics);
	}

	List<AwsCredentialContext> filterAllowedAccounts(List<AwsCredentialContext> sessions) {
		if (config.getAccounts().isEmpty()) {
			return sessions;
		}
		Set<String> allowed = new HashSet<>(config.getAccounts());
		List<AwsCredentialContext> result = new ArrayList<>();
		for (AwsCredentialContext session : sessions) {
			if (allowed.contains(session.getAccountId())) {
				result.add(session);
			} else {
				logger.info("account {} is not in the requested account list, skipping", session.getAccountId());
			}
		}
		return result;
	}

	List<ScanTarget> resolveTargets(List<AwsCredentialContext> sessions) {
		Map<String, String> names = new HashMap<>();
		broker.organizationAccounts().forEach(a -> names.put(a.getId(), a.getName()));

		List<ScanTarget> targets = new ArrayList<>();
		for (AwsCredentialContext session : sessions) {
			try {
				targets.add(new ScanTarget(session, names.get(session.getAccountId()), resolveRegions(session)));
			} catch (RuntimeException e) {
				logger.warn("could not list regions for account {}, skipping it: {}", session.getAccountId(),
						e.toString());
			}
		}
		return targets;
	}

	/**
	 * The account's enabled regions, narrowed to the requested ones when a region list was given.
	 */
	List<String> resolveRegions(AwsCredentialContext session) {
		List<String> available = broker.availableRegions(session);
		if (config.getRegions().isEmpty()) {
			return available;
		}
		Set<String> requested = new HashSet<>(config.getRegions());
		return available.stream().filter(requested::contains).collect(Collectors.toList());
	}

	/**
	 * Account-scoped scanners produce one task per account in the "Global" region; all other scanners produce one
	 * task per account and region.
	 */
	@VisibleForTesting
	static List<ScanTask> buildTasks(List<ScanTarget> targets,
			List<? extends ScannerDescriptor<?>> scanners) {
		List<ScanTask> tasks = new ArrayList<>();
		for (ScanTarget target : targets) {
			for (ScannerDescriptor<?> scanner : scanners) {
				if (scanner.isAccountScoped()) {
					tasks.add(new ScanTask(target.getAccountId(), target.accountName, ScanTask.GLOBAL_REGION,
							scanner.getAlias()));
				} else {
					for (String region : target.regions) {
						tasks.add(new ScanTask(target.getAccountId(), target.accountName, region, scanner.getAlias()));
					}
				}
			}
		}
		return tasks;
	}

	/**
	 * Runs every task and merges results on the calling thread.
	 *
	 * @return completed and failed task counts
	 */
	private DispatchCounts dispatch(List<ScanTask> tasks, Map<String, AwsCredentialContext> sessionsByAccount,
			ScanResult aggregate) {
		DispatchCounts counts = new DispatchCounts();
		if (tasks.isEmpty()) {
			return counts;
		}
		ExecutorService pool = WorkerPools.newBoundedPool(config.getMaxWorkers(), "cloudsweep-scan-%d");
		try {
			CompletionService<AccountScanResult> completionService = new ExecutorCompletionService<>(pool);
			Map<Future<AccountScanResult>, ScanTask> pending = new LinkedHashMap<>();
			for (ScanTask task : tasks) {
				AwsCredentialContext session = sessionsByAccount.get(task.getAccountId());
				pending.put(completionService.submit(() -> runTask(session, task)), task);
			}
			logger.info("submitted {} scanning tasks to {} workers", tasks.size(), config.getMaxWorkers());

			for (int i = 0; i < tasks.size(); i++) {
				Future<AccountScanResult> future = completionService.take();
				ScanTask task = pending.get(future);
				try {
					aggregate.merge(future.get());
					counts.completed++;
				} catch (ExecutionException e) {
					counts.failed++;
					logger.warn("task {} failed", task, e.getCause());
					aggregate.merge(new AccountScanResult(task.getAccountId(), task.getAccountName())
							.put(task.getRegion(), task.getScannerAlias(), Collections.emptyList()));
				}
			}
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new CloudsweepException("interrupted while waiting for scanning tasks", e);
		} finally {
			pool.shutdownNow();
		}
		logger.info("dispatch finished: {}", counts);
		return counts;
	}

	private AccountScanResult runTask(AwsCredentialContext session, ScanTask task) {
		return accountScanner.scanResources(session, task.getAccountId(), task.getAccountName(),
				Collections.singletonList(task.getRegion()), Collections.singletonList(task.getScannerAlias()));
	}
}
