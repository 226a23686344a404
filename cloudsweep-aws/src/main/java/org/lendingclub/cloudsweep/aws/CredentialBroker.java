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

import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.ExecutionException;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Future;
import java.util.concurrent.TimeUnit;
import java.util.stream.Collectors;

import org.lendingclub.cloudsweep.core.BackoffRetry;
import org.lendingclub.cloudsweep.core.CloudsweepException;
import org.lendingclub.cloudsweep.core.ConfigurationException;
import org.lendingclub.cloudsweep.core.RoleAssumptionException;
import org.lendingclub.cloudsweep.core.WorkerPools;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.amazonaws.SdkClientException;
import com.amazonaws.auth.AWSCredentials;
import com.amazonaws.auth.AWSCredentialsProvider;
import com.amazonaws.auth.AWSSessionCredentials;
import com.amazonaws.auth.DefaultAWSCredentialsProviderChain;
import com.amazonaws.auth.profile.ProfileCredentialsProvider;
import com.amazonaws.services.ec2.AmazonEC2;
import com.amazonaws.services.ec2.model.DescribeRegionsRequest;
import com.amazonaws.services.organizations.AWSOrganizations;
import com.amazonaws.services.organizations.model.Account;
import com.amazonaws.services.organizations.model.ListAccountsRequest;
import com.amazonaws.services.organizations.model.ListAccountsResult;
import com.amazonaws.services.securitytoken.AWSSecurityTokenService;
import com.amazonaws.services.securitytoken.model.AssumeRoleRequest;
import com.amazonaws.services.securitytoken.model.Credentials;
import com.amazonaws.services.securitytoken.model.GetCallerIdentityRequest;
import com.google.common.base.Preconditions;
import com.google.common.base.Stopwatch;
import com.google.common.base.Strings;
import com.google.common.base.Supplier;
import com.google.common.base.Suppliers;
import com.google.common.collect.ImmutableList;

/**
 * Owns the root identity of a run and derives every other credential context from it.
 * <p>
 * The derivation chain is root, then the organization role in the root account, then the runner role in each member
 * account (assumed through the organization session), then region-scoped copies. Root, organization session and the
 * account listing are resolved lazily and cached for the lifetime of the broker.
 */
public class CredentialBroker {

	private static final Logger logger = LoggerFactory.getLogger(CredentialBroker.class);

	public static final String ORGANIZATION_SESSION_NAME = "cloudsweep-organization";
	public static final String RUNNER_SESSION_NAME = "cloudsweep-runner";

	private final CloudsweepConfig config;
	private final AwsClientFactory clientFactory;
	private final AWSCredentialsProvider credentialsProvider;

	private final Supplier<AwsCredentialContext> rootSession = Suppliers.memoize(this::createRootSession);
	private final Supplier<AwsCredentialContext> organizationSession = Suppliers
			.memoize(this::createOrganizationSession);
	private final Supplier<List<AccountDescriptor>> organizationAccounts = Suppliers
			.memoize(this::listOrganizationAccounts);

	public CredentialBroker(CloudsweepConfig config) {
		this(config, new DefaultAwsClientFactory(), defaultCredentialsProvider(config));
	}

	public CredentialBroker(CloudsweepConfig config, AwsClientFactory clientFactory,
			AWSCredentialsProvider credentialsProvider) {
		Preconditions.checkNotNull(config, "config cannot be null");
		Preconditions.checkNotNull(clientFactory, "clientFactory cannot be null");
		Preconditions.checkNotNull(credentialsProvider, "credentialsProvider cannot be null");
		this.config = config;
		this.clientFactory = clientFactory;
		this.credentialsProvider = credentialsProvider;
	}

	static AWSCredentialsProvider defaultCredentialsProvider(CloudsweepConfig config) {
		if (config.getProfile().isPresent()) {
			return new ProfileCredentialsProvider(config.getProfile().get());
		}
		return new DefaultAWSCredentialsProviderChain();
	}

	public CloudsweepConfig getConfig() {
		return config;
	}

	/**
	 * The context for the configured identity, with its owning account resolved.
	 *
	 * @throws ConfigurationException if no usable identity is configured
	 */
	public AwsCredentialContext rootSession() {
		return rootSession.get();
	}

	private AwsCredentialContext createRootSession() {
		AWSCredentials credentials;
		try {
			credentials = credentialsProvider.getCredentials();
		} catch (SdkClientException | IllegalArgumentException e) {
			throw new ConfigurationException("no usable AWS identity is configured"
					+ config.getProfile().map(p -> " (profile=" + p + ")").orElse(""), e);
		}
		if (credentials == null || Strings.isNullOrEmpty(credentials.getAWSAccessKeyId())
				|| Strings.isNullOrEmpty(credentials.getAWSSecretKey())) {
			throw new ConfigurationException("no usable AWS identity is configured");
		}
		String sessionToken = credentials instanceof AWSSessionCredentials
				? ((AWSSessionCredentials) credentials).getSessionToken()
				: null;
		AwsCredentialContext unresolved = new AwsCredentialContext(credentials.getAWSAccessKeyId(),
				credentials.getAWSSecretKey(), sessionToken, config.getRegion(), null, null);

		AWSSecurityTokenService sts = clientFactory.newSecurityTokenService(unresolved);
		try {
			String accountId = AmazonServiceRetry
					.execute(newRetry(), () -> sts.getCallerIdentity(new GetCallerIdentityRequest())).getAccount();
			logger.info("running as account {}", accountId);
			return unresolved.withAccountId(accountId);
		} catch (SdkClientException e) {
			throw new ConfigurationException("could not resolve the caller identity", e);
		} finally {
			sts.shutdown();
		}
	}

	public String resolveRoleArn(String roleName, String accountId) {
		Preconditions.checkArgument(!Strings.isNullOrEmpty(roleName), "roleName cannot be empty");
		Preconditions.checkArgument(!Strings.isNullOrEmpty(accountId), "accountId cannot be empty");
		return "arn:aws:iam::" + accountId + ":role/" + roleName;
	}

	/**
	 * Assumes a role from the root identity.
	 */
	public AwsCredentialContext assumeRole(String roleName, String accountId) {
		return assumeRole(rootSession(), roleName, accountId, RUNNER_SESSION_NAME);
	}

	/**
	 * Exchanges the source context for temporary credentials of the given role. The source is not modified.
	 *
	 * @throws RoleAssumptionException if the role could not be assumed
	 */
	public AwsCredentialContext assumeRole(AwsCredentialContext source, String roleName, String accountId,
			String sessionName) {
		String roleArn = resolveRoleArn(roleName, accountId);
		logger.debug("assuming {} from {}", roleArn, source);
		AWSSecurityTokenService sts = clientFactory.newSecurityTokenService(source);
		try {
			AssumeRoleRequest request = new AssumeRoleRequest().withRoleArn(roleArn).withRoleSessionName(sessionName);
			Credentials c = AmazonServiceRetry.execute(newRetry(), () -> sts.assumeRole(request)).getCredentials();
			return new AwsCredentialContext(c.getAccessKeyId(), c.getSecretAccessKey(), c.getSessionToken(),
					source.getRegion(), accountId, c.getExpiration() == null ? null : c.getExpiration().toInstant());
		} catch (SdkClientException e) {
			throw new RoleAssumptionException(accountId, roleArn, e);
		} finally {
			sts.shutdown();
		}
	}

	/**
	 * The organization role assumed in the root account.
	 *
	 * @throws ConfigurationException if no organization role is configured, or it cannot be assumed
	 */
	public AwsCredentialContext organizationSession() {
		return organizationSession.get();
	}

	private AwsCredentialContext createOrganizationSession() {
		String role = config.getOrganizationRole().orElseThrow(() -> new ConfigurationException(
				"an organization role is required to list organization accounts but none was configured"));
		AwsCredentialContext root = rootSession();
		try {
			return assumeRole(root, role, root.getAccountId(), ORGANIZATION_SESSION_NAME);
		} catch (RoleAssumptionException e) {
			throw new ConfigurationException("could not assume organization role " + e.getRoleArn(), e);
		}
	}

	/**
	 * Every ACTIVE account in the organization. The listing is performed once and cached.
	 */
	public List<AccountDescriptor> organizationAccounts() {
		return organizationAccounts.get();
	}

	private List<AccountDescriptor> listOrganizationAccounts() {
		AWSOrganizations organizations = clientFactory.newOrganizations(organizationSession());
		try {
			List<AccountDescriptor> all = new ArrayList<>();
			String token = null;
			do {
				ListAccountsRequest request = new ListAccountsRequest().withNextToken(token);
				ListAccountsResult page = AmazonServiceRetry.execute(newRetry(),
						() -> organizations.listAccounts(request));
				for (Account account : page.getAccounts()) {
					all.add(AccountDescriptor.from(account));
				}
				token = page.getNextToken();
			} while (!Strings.isNullOrEmpty(token));

			List<AccountDescriptor> active = all.stream().filter(AccountDescriptor::isActive)
					.collect(Collectors.toList());
			logger.info("organization has {} accounts ({} active)", all.size(), active.size());
			return ImmutableList.copyOf(active);
		} catch (SdkClientException e) {
			throw new ConfigurationException("could not list organization accounts", e);
		} finally {
			organizations.shutdown();
		}
	}

	/**
	 * Assumes the runner role in every active organization account concurrently. Accounts where the role cannot be
	 * assumed are logged and left out; the result holds whatever succeeded, in organization listing order.
	 *
	 * @throws ConfigurationException if the runner or organization role is not configured
	 */
	public List<AwsCredentialContext> assumeRunnerRoleInAllAccounts() {
		String runnerRole = config.getRunnerRole().orElseThrow(() -> new ConfigurationException(
				"a runner role is required to scan organization accounts but none was configured"));
		List<AccountDescriptor> accounts = organizationAccounts();
		if (accounts.isEmpty()) {
			return Collections.emptyList();
		}
		AwsCredentialContext source = organizationSession();

		Stopwatch sw = Stopwatch.createStarted();
		ExecutorService pool = WorkerPools.newBoundedPool(Math.min(config.getMaxWorkers(), accounts.size()),
				"cloudsweep-assume-role-%d");
		try {
			List<Future<AwsCredentialContext>> futures = new ArrayList<>();
			for (AccountDescriptor account : accounts) {
				futures.add(pool.submit(() -> assumeRole(source, runnerRole, account.getId(), RUNNER_SESSION_NAME)));
			}
			List<AwsCredentialContext> sessions = new ArrayList<>();
			for (int i = 0; i < futures.size(); i++) {
				try {
					sessions.add(futures.get(i).get());
				} catch (ExecutionException e) {
					logger.warn("skipping account {} ({}): {}", accounts.get(i).getId(), accounts.get(i).getName(),
							e.getCause().toString());
				}
			}
			logger.info("assumed {} in {} of {} accounts in {} ms", runnerRole, sessions.size(), accounts.size(),
					sw.elapsed(TimeUnit.MILLISECONDS));
			return sessions;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			throw new CloudsweepException("interrupted while assuming roles", e);
		} finally {
			pool.shutdownNow();
		}
	}

	/**
	 * A copy of the context bound to another region. The input is never modified.
	 */
	public AwsCredentialContext withRegion(AwsCredentialContext context, String region) {
		Preconditions.checkNotNull(context, "context cannot be null");
		return context.withRegion(region);
	}

	/**
	 * Regions enabled for the account that owns the context, in alphabetical order.
	 */
	public List<String> availableRegions(AwsCredentialContext context) {
		AmazonEC2 ec2 = clientFactory.newEC2(context);
		try {
			return AmazonServiceRetry.execute(newRetry(), () -> ec2.describeRegions(new DescribeRegionsRequest()))
					.getRegions().stream().map(r -> r.getRegionName()).sorted().collect(Collectors.toList());
		} finally {
			ec2.shutdown();
		}
	}

	BackoffRetry newRetry() {
		return config.toScannerSettings().newRetry();
	}
}
