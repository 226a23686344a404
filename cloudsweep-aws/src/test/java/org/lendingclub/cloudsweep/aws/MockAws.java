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
import java.util.Arrays;
import java.util.Date;
import java.util.HashSet;
import java.util.Set;

import org.mockito.Mockito;

import com.amazonaws.AmazonServiceException;
import com.amazonaws.auth.AWSStaticCredentialsProvider;
import com.amazonaws.auth.BasicAWSCredentials;
import com.amazonaws.services.ec2.AmazonEC2;
import com.amazonaws.services.ec2.model.DescribeRegionsRequest;
import com.amazonaws.services.ec2.model.DescribeRegionsResult;
import com.amazonaws.services.ec2.model.Region;
import com.amazonaws.services.organizations.AWSOrganizations;
import com.amazonaws.services.organizations.model.Account;
import com.amazonaws.services.organizations.model.ListAccountsRequest;
import com.amazonaws.services.organizations.model.ListAccountsResult;
import com.amazonaws.services.securitytoken.AWSSecurityTokenService;
import com.amazonaws.services.securitytoken.model.AssumeRoleRequest;
import com.amazonaws.services.securitytoken.model.AssumeRoleResult;
import com.amazonaws.services.securitytoken.model.Credentials;
import com.amazonaws.services.securitytoken.model.GetCallerIdentityRequest;
import com.amazonaws.services.securitytoken.model.GetCallerIdentityResult;

/**
 * An in-memory organization: STS, Organizations and EC2 are Mockito mocks wired to a fixed set of accounts.
 */
class MockAws implements AwsClientFactory {

	static final String ROOT_ACCOUNT = "000000000000";

	final AWSSecurityTokenService sts = Mockito.mock(AWSSecurityTokenService.class);
	final AWSOrganizations organizations = Mockito.mock(AWSOrganizations.class);
	final AmazonEC2 ec2 = Mockito.mock(AmazonEC2.class);

	final Set<String> deniedAccounts = new HashSet<>();

	MockAws() {
		Mockito.when(sts.getCallerIdentity(Mockito.any(GetCallerIdentityRequest.class)))
				.thenReturn(new GetCallerIdentityResult().withAccount(ROOT_ACCOUNT).withArn("arn:aws:iam::"
						+ ROOT_ACCOUNT + ":user/auditor"));
		Mockito.when(sts.assumeRole(Mockito.any(AssumeRoleRequest.class))).thenAnswer(invocation -> {
			AssumeRoleRequest request = invocation.getArgument(0);
			String accountId = request.getRoleArn().split(":")[4];
			if (deniedAccounts.contains(accountId)) {
				AmazonServiceException e = new AmazonServiceException("not authorized to perform sts:AssumeRole");
				e.setErrorCode("AccessDenied");
				e.setStatusCode(403);
				throw e;
			}
			return new AssumeRoleResult().withCredentials(new Credentials().withAccessKeyId("ASIA" + accountId)
					.withSecretAccessKey("secret-" + accountId).withSessionToken("token-" + accountId)
					.withExpiration(Date.from(Instant.parse("2030-01-01T00:00:00Z"))));
		});
		withRegions("us-west-2", "us-east-1");
	}

	MockAws withAccounts(Account... accounts) {
		Mockito.when(organizations.listAccounts(Mockito.any(ListAccountsRequest.class)))
				.thenReturn(new ListAccountsResult().withAccounts(accounts));
		return this;
	}

	MockAws withRegions(String... regions) {
		Mockito.when(ec2.describeRegions(Mockito.any(DescribeRegionsRequest.class)))
				.thenReturn(new DescribeRegionsResult().withRegions(Arrays.stream(regions)
						.map(r -> new Region().withRegionName(r)).toArray(Region[]::new)));
		return this;
	}

	MockAws denyAccount(String accountId) {
		deniedAccounts.add(accountId);
		return this;
	}

	static Account account(String id, String name) {
		return new Account().withId(id).withName(name).withStatus("ACTIVE");
	}

	static CloudsweepConfig.Builder config() {
		return CloudsweepConfig.builder().withOrganizationRole("OrganizationAccountAccessRole")
				.withRunnerRole("CloudsweepRunner").withMaxWorkers(4).withRetry(2, 0);
	}

	CredentialBroker newBroker(CloudsweepConfig config) {
		return new CredentialBroker(config, this,
				new AWSStaticCredentialsProvider(new BasicAWSCredentials("AKIAROOTKEY", "root-secret")));
	}

	static AwsCredentialContext context(String accountId, String region) {
		return new AwsCredentialContext("ASIA" + accountId, "secret", "token", region, accountId, null);
	}

	@Override
	public AWSSecurityTokenService newSecurityTokenService(AwsCredentialContext context) {
		return sts;
	}

	@Override
	public AWSOrganizations newOrganizations(AwsCredentialContext context) {
		return organizations;
	}

	@Override
	public AmazonEC2 newEC2(AwsCredentialContext context) {
		return ec2;
	}
}
