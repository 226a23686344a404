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

import java.time.Instant;
import java.util.Optional;

import org.lendingclub.cloudsweep.core.ScanTask;

import com.amazonaws.auth.AWSCredentials;
import com.amazonaws.auth.AWSCredentialsProvider;
import com.amazonaws.auth.AWSStaticCredentialsProvider;
import com.amazonaws.auth.BasicAWSCredentials;
import com.amazonaws.auth.BasicSessionCredentials;
import com.amazonaws.client.builder.AwsClientBuilder;
import com.amazonaws.regions.Regions;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

/**
 * Immutable bundle of credential material bound to one region and one owning account.
 * <p>
 * Contexts form a tree: root, organization-scoped, runner-scoped per member account, and region-scoped copies of
 * those. Deriving a child never touches the parent, so a single context can be shared freely between worker threads.
 */
public final class AwsCredentialContext {

	/**
	 * IAM and other global services are signed against this region when a context is bound to
	 * {@link ScanTask#GLOBAL_REGION}.
	 */
	public static final String GLOBAL_SIGNING_REGION = Regions.US_EAST_1.getName();

	private final String accessKeyId;
	private final String secretKey;
	private final String sessionToken;
	private final String region;
	private final String accountId;
	private final Instant expiration;

	public AwsCredentialContext(String accessKeyId, String secretKey, String sessionToken, String region,
			String accountId, Instant expiration) {
		Preconditions.checkArgument(!Strings.isNullOrEmpty(accessKeyId), "accessKeyId cannot be empty");
		Preconditions.checkArgument(!Strings.isNullOrEmpty(secretKey), "secretKey cannot be empty");
		Preconditions.checkArgument(!Strings.isNullOrEmpty(region), "region cannot be empty");
		this.accessKeyId = accessKeyId;
		this.secretKey = secretKey;
		this.sessionToken = Strings.emptyToNull(sessionToken);
		this.region = region;
		this.accountId = accountId;
		this.expiration = expiration;
	}

	public String getAccessKeyId() {
		return accessKeyId;
	}

	public String getSecretKey() {
		return secretKey;
	}

	public Optional<String> getSessionToken() {
		return Optional.ofNullable(sessionToken);
	}

	public String getRegion() {
		return region;
	}

	public String getAccountId() {
		return accountId;
	}

	public Optional<Instant> getExpiration() {
		return Optional.ofNullable(expiration);
	}

	public boolean isGlobal() {
		return ScanTask.GLOBAL_REGION.equals(region);
	}

	/**
	 * The region API calls are actually signed for.
	 */
	public String getSigningRegion() {
		return isGlobal() ? GLOBAL_SIGNING_REGION : region;
	}

	/**
	 * Same credentials, different region binding.
	 */
	public AwsCredentialContext withRegion(String newRegion) {
		Preconditions.checkArgument(!Strings.isNullOrEmpty(newRegion), "region cannot be empty");
		return new AwsCredentialContext(accessKeyId, secretKey, sessionToken, newRegion, accountId, expiration);
	}

	/**
	 * Same credentials and region, with the owning account filled in.
	 */
	public AwsCredentialContext withAccountId(String newAccountId) {
		return new AwsCredentialContext(accessKeyId, secretKey, sessionToken, region, newAccountId, expiration);
	}

	public AWSCredentials getCredentials() {
		if (sessionToken != null) {
			return new BasicSessionCredentials(accessKeyId, secretKey, sessionToken);
		}
		return new BasicAWSCredentials(accessKeyId, secretKey);
	}

	public AWSCredentialsProvider getCredentialsProvider() {
		return new AWSStaticCredentialsProvider(getCredentials());
	}

	/**
	 * Points an SDK client builder at this context's credentials and signing region.
	 */
	public <B extends AwsClientBuilder<B, ?>> B configure(B builder) {
		return builder.withRegion(getSigningRegion()).withCredentials(getCredentialsProvider());
	}

	@Override
	public String toString() {
		String maskedKey = accessKeyId.length() > 4 ? "****" + accessKeyId.substring(accessKeyId.length() - 4)
				: "****";
		return MoreObjects.toStringHelper(this).omitNullValues().add("account", accountId).add("region", region)
				.add("accessKeyId", maskedKey).add("expiration", expiration).toString();
	}
}
