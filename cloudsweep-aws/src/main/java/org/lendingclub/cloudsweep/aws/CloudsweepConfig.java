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

import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.lendingclub.cloudsweep.core.BackoffRetry;
import org.lendingclub.cloudsweep.core.ConfigurationException;
import org.lendingclub.cloudsweep.core.ScannerSettings;
import org.lendingclub.cloudsweep.core.WorkerPools;

import com.google.common.base.MoreObjects;
import com.google.common.base.Splitter;
import com.google.common.base.Strings;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;

/**
 * Settings for one run. Values come from defaults, then a property map, then environment variables, then explicit
 * builder calls, with later sources winning.
 */
public final class CloudsweepConfig {

	public static final String ALL = "all";
	public static final String DEFAULT_REGION = "us-east-1";

	public static final String PROFILE = "profile";
	public static final String REGION = "region";
	public static final String ORGANIZATION_ROLE = "organizationRole";
	public static final String RUNNER_ROLE = "runnerRole";
	public static final String ACCOUNTS = "accounts";
	public static final String REGIONS = "regions";
	public static final String SCANNERS = "scanners";
	public static final String MAX_WORKERS = "maxWorkers";
	public static final String DAYS_THRESHOLD = "daysThreshold";
	public static final String RETRY_MAX_TRIES = "retryMaxTries";
	public static final String RETRY_INITIAL_DELAY_MILLIS = "retryInitialDelayMillis";

	static final Map<String, String> ENVIRONMENT_KEYS = ImmutableMap.<String, String>builder()
			.put("AWS_PROFILE", PROFILE).put("AWS_REGION", REGION)
			.put("CLOUDSWEEP_ORGANIZATION_ROLE", ORGANIZATION_ROLE).put("CLOUDSWEEP_RUNNER_ROLE", RUNNER_ROLE)
			.put("CLOUDSWEEP_ACCOUNTS", ACCOUNTS).put("CLOUDSWEEP_REGIONS", REGIONS)
			.put("CLOUDSWEEP_SCANNERS", SCANNERS).put("CLOUDSWEEP_MAX_WORKERS", MAX_WORKERS)
			.put("DAYS_THRESHOLD", DAYS_THRESHOLD).build();

	private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

	private final String profile;
	private final String region;
	private final String organizationRole;
	private final String runnerRole;
	private final List<String> accounts;
	private final List<String> regions;
	private final List<String> scanners;
	private final int maxWorkers;
	private final int daysThreshold;
	private final int retryMaxTries;
	private final long retryInitialDelayMillis;

	private CloudsweepConfig(Builder b) {
		this.profile = Strings.emptyToNull(b.profile);
		this.region = Strings.isNullOrEmpty(b.region) ? DEFAULT_REGION : b.region;
		this.organizationRole = Strings.emptyToNull(b.organizationRole);
		this.runnerRole = Strings.emptyToNull(b.runnerRole);
		this.accounts = b.accounts;
		this.regions = b.regions;
		this.scanners = b.scanners;
		this.maxWorkers = b.maxWorkers;
		this.daysThreshold = b.daysThreshold;
		this.retryMaxTries = b.retryMaxTries;
		this.retryInitialDelayMillis = b.retryInitialDelayMillis;
	}

	public static Builder builder() {
		return new Builder();
	}

	public Optional<String> getProfile() {
		return Optional.ofNullable(profile);
	}

	public String getRegion() {
		return region;
	}

	public Optional<String> getOrganizationRole() {
		return Optional.ofNullable(organizationRole);
	}

	public Optional<String> getRunnerRole() {
		return Optional.ofNullable(runnerRole);
	}

	/**
	 * Account allow-list. Empty means every active account in the organization.
	 */
	public List<String> getAccounts() {
		return accounts;
	}

	/**
	 * Regions to scan. Empty means every region enabled for the account.
	 */
	public List<String> getRegions() {
		return regions;
	}

	/**
	 * Scanner identifiers to run. Empty means every registered scanner.
	 */
	public List<String> getScanners() {
		return scanners;
	}

	public int getMaxWorkers() {
		return maxWorkers;
	}

	public int getDaysThreshold() {
		return daysThreshold;
	}

	public int getRetryMaxTries() {
		return retryMaxTries;
	}

	public long getRetryInitialDelayMillis() {
		return retryInitialDelayMillis;
	}

	public ScannerSettings toScannerSettings() {
		return new ScannerSettings(daysThreshold).withRetry(retryMaxTries, retryInitialDelayMillis);
	}

	@Override
	public String toString() {
		return MoreObjects.toStringHelper(this).omitNullValues().add(PROFILE, profile).add(REGION, region)
				.add(ORGANIZATION_ROLE, organizationRole).add(RUNNER_ROLE, runnerRole)
				.add(ACCOUNTS, accounts.isEmpty() ? ALL : accounts).add(REGIONS, regions.isEmpty() ? ALL : regions)
				.add(SCANNERS, scanners.isEmpty() ? ALL : scanners).add(MAX_WORKERS, maxWorkers)
				.add(DAYS_THRESHOLD, daysThreshold).toString();
	}

	static List<String> parseList(String value) {
		if (Strings.isNullOrEmpty(value) || ALL.equalsIgnoreCase(value.trim())) {
			return Collections.emptyList();
		}
		return ImmutableList.copyOf(LIST_SPLITTER.split(value));
	}

	static int parseInt(String key, String value) {
		try {
			return Integer.parseInt(value.trim());
		} catch (NumberFormatException e) {
			throw new ConfigurationException("invalid value for " + key + ": '" + value + "'", e);
		}
	}

	public static class Builder {
		private String profile;
		private String region;
		private String organizationRole;
		private String runnerRole;
		private List<String> accounts = Collections.emptyList();
		private List<String> regions = Collections.emptyList();
		private List<String> scanners = Collections.emptyList();
		private int maxWorkers = WorkerPools.defaultParallelism();
		private int daysThreshold = ScannerSettings.DEFAULT_DAYS_THRESHOLD;
		private int retryMaxTries = BackoffRetry.DEFAULT_MAX_TRIES;
		private long retryInitialDelayMillis = BackoffRetry.DEFAULT_INITIAL_DELAY_MILLIS;

		Builder() {
		}

		/**
		 * Applies every recognized key in the map. Unrecognized keys are ignored.
		 */
		public Builder withProperties(Map<String, String> properties) {
			properties.forEach((k, v) -> {
				if (v != null) {
					withProperty(k, v);
				}
			});
			return this;
		}

		/**
		 * Applies the environment variables listed in {@link CloudsweepConfig#ENVIRONMENT_KEYS}.
		 */
		public Builder withEnvironment(Map<String, String> env) {
			ENVIRONMENT_KEYS.forEach((envKey, propertyKey) -> {
				String v = env.get(envKey);
				if (!Strings.isNullOrEmpty(v)) {
					withProperty(propertyKey, v);
				}
			});
			return this;
		}

		public Builder withEnvironment() {
			return withEnvironment(System.getenv());
		}

		public Builder withProperty(String key, String value) {
			switch (key) {
			case PROFILE:
				return withProfile(value);
			case REGION:
				return withRegion(value);
			case ORGANIZATION_ROLE:
				return withOrganizationRole(value);
			case RUNNER_ROLE:
				return withRunnerRole(value);
			case ACCOUNTS:
				this.accounts = parseList(value);
				return this;
			case REGIONS:
				this.regions = parseList(value);
				return this;
			case SCANNERS:
				this.scanners = parseList(value);
				return this;
			case MAX_WORKERS:
				return withMaxWorkers(parseInt(key, value));
			case DAYS_THRESHOLD:
				return withDaysThreshold(parseInt(key, value));
			case RETRY_MAX_TRIES:
				this.retryMaxTries = parseInt(key, value);
				return this;
			case RETRY_INITIAL_DELAY_MILLIS:
				this.retryInitialDelayMillis = parseInt(key, value);
				return this;
			default:
				return this;
			}
		}

		public Builder withProfile(String profile) {
			this.profile = profile;
			return this;
		}

		public Builder withRegion(String region) {
			this.region = region;
			return this;
		}

		public Builder withOrganizationRole(String role) {
			this.organizationRole = role;
			return this;
		}

		public Builder withRunnerRole(String role) {
			this.runnerRole = role;
			return this;
		}

		public Builder withAccounts(List<String> accounts) {
			this.accounts = accounts == null ? Collections.emptyList() : ImmutableList.copyOf(accounts);
			return this;
		}

		public Builder withRegions(List<String> regions) {
			this.regions = regions == null ? Collections.emptyList() : ImmutableList.copyOf(regions);
			return this;
		}

		public Builder withScanners(List<String> scanners) {
			this.scanners = scanners == null ? Collections.emptyList() : ImmutableList.copyOf(scanners);
			return this;
		}

		public Builder withMaxWorkers(int maxWorkers) {
			if (maxWorkers < 1) {
				throw new ConfigurationException("maxWorkers must be at least 1 (was " + maxWorkers + ")");
			}
			this.maxWorkers = maxWorkers;
			return this;
		}

		public Builder withDaysThreshold(int days) {
			if (days < 0) {
				throw new ConfigurationException("daysThreshold cannot be negative (was " + days + ")");
			}
			this.daysThreshold = days;
			return this;
		}

		public Builder withRetry(int maxTries, long initialDelayMillis) {
			this.retryMaxTries = maxTries;
			this.retryInitialDelayMillis = initialDelayMillis;
			return this;
		}

		public CloudsweepConfig build() {
			if (retryInitialDelayMillis < 0) {
				throw new ConfigurationException("retryInitialDelayMillis cannot be negative");
			}
			return new CloudsweepConfig(this);
		}
	}
}
