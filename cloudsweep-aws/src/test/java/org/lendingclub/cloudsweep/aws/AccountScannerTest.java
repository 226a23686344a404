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

import java.util.Arrays;
import java.util.Collections;
import java.util.List;
import java.util.concurrent.CopyOnWriteArrayList;

import org.assertj.core.api.Assertions;
import org.junit.Before;
import org.junit.Test;
import org.lendingclub.cloudsweep.core.AccountScanResult;
import org.lendingclub.cloudsweep.core.Finding;
import org.lendingclub.cloudsweep.core.ResourceScanner;
import org.lendingclub.cloudsweep.core.ScannerRegistry;
import org.mockito.Mockito;

import com.amazonaws.AmazonServiceException;

public class AccountScannerTest {

	static class StubScanner implements ResourceScanner<AwsCredentialContext> {
		final String alias;
		final boolean global;
		final List<AwsCredentialContext> seen = new CopyOnWriteArrayList<>();

		StubScanner(String alias, boolean global) {
			this.alias = alias;
			this.global = global;
		}

		@Override
		public String getAlias() {
			return alias;
		}

		@Override
		public String getLabel() {
			return alias.toUpperCase();
		}

		@Override
		public boolean isAccountScoped() {
			return global;
		}

		@Override
		public List<Finding> scan(AwsCredentialContext context) {
			seen.add(context);
			return Arrays.asList(Finding.builder(alias + "-" + context.getRegion()).withReason("idle").build());
		}
	}

	static class FailingScanner extends StubScanner {
		FailingScanner(String alias) {
			super(alias, false);
		}

		@Override
		public List<Finding> scan(AwsCredentialContext context) {
			throw new AmazonServiceException("UnauthorizedOperation");
		}
	}

	static class NullScanner extends StubScanner {
		NullScanner(String alias) {
			super(alias, false);
		}

		@Override
		public List<Finding> scan(AwsCredentialContext context) {
			return null;
		}
	}

	StubScanner volumes = new StubScanner("ebs-volumes", false);
	StubScanner roles = new StubScanner("iam-roles", true);
	ScannerRegistry<AwsCredentialContext> registry;
	CredentialBroker broker;
	AwsCredentialContext session = MockAws.context("111111111111", "us-east-1");

	@Before
	public void setup() {
		registry = new ScannerRegistry<AwsCredentialContext>().register(volumes).register(roles)
				.register(new FailingScanner("elastic-ips")).register(new NullScanner("ebs-snapshots")).seal();
		broker = new MockAws().newBroker(MockAws.config().build());
	}

	@Test
	public void testScanRegions() {
		AccountScanResult result = new AccountScanner(broker, registry).scanResources(session, "111111111111", "prod",
				Arrays.asList("us-east-1", "us-west-2"), Arrays.asList("ebs-volumes"));

		Assertions.assertThat(result.getAccountId()).isEqualTo("111111111111");
		Assertions.assertThat(result.getAccountName()).isEqualTo("prod");
		Assertions.assertThat(result.getRegions()).containsExactly("us-east-1", "us-west-2");
		Assertions.assertThat(result.getFindings("us-west-2", "ebs-volumes")).extracting(Finding::getResourceId)
				.containsExactly("ebs-volumes-us-west-2");
		Assertions.assertThat(volumes.seen).extracting(AwsCredentialContext::getRegion)
				.containsExactlyInAnyOrder("us-east-1", "us-west-2");
		Assertions.assertThat(session.getRegion()).isEqualTo("us-east-1");
	}

	@Test
	public void testGlobalRegion() {
		AccountScanResult result = new AccountScanner(broker, registry).scanResources(session, "111111111111", "prod",
				Collections.singletonList("Global"), Collections.singletonList("iam-roles"));

		Assertions.assertThat(result.getFindings("Global", "iam-roles")).hasSize(1);
		Assertions.assertThat(roles.seen.get(0).isGlobal()).isTrue();
		Assertions.assertThat(roles.seen.get(0).getSigningRegion()).isEqualTo("us-east-1");
	}

	@Test
	public void testFailingScannerLeavesEmptyCell() {
		AccountScanResult result = new AccountScanner(broker, registry).scanResources(session, "111111111111", "prod",
				Collections.singletonList("us-east-1"), Arrays.asList("elastic-ips", "ebs-volumes", "ebs-snapshots"));

		Assertions.assertThat(result.hasCell("us-east-1", "elastic-ips")).isTrue();
		Assertions.assertThat(result.getFindings("us-east-1", "elastic-ips")).isEmpty();
		Assertions.assertThat(result.getFindings("us-east-1", "ebs-snapshots")).isEmpty();
		Assertions.assertThat(result.getFindings("us-east-1", "ebs-volumes")).hasSize(1);
	}

	@Test
	public void testUnknownAliasLeavesEmptyCell() {
		AccountScanResult result = new AccountScanner(broker, registry).scanResources(session, "111111111111", "prod",
				Collections.singletonList("us-east-1"), Arrays.asList("rds-instances", "ebs-volumes"));

		Assertions.assertThat(result.hasCell("us-east-1", "rds-instances")).isTrue();
		Assertions.assertThat(result.getFindings("us-east-1", "rds-instances")).isEmpty();
		Assertions.assertThat(result.getFindings("us-east-1", "ebs-volumes")).hasSize(1);
	}

	@Test
	public void testRegionDerivationFailureSkipsRegion() {
		CredentialBroker failing = Mockito.mock(CredentialBroker.class);
		Mockito.when(failing.withRegion(Mockito.any(AwsCredentialContext.class), Mockito.anyString()))
				.thenAnswer(invocation -> {
					String region = invocation.getArgument(1);
					if (region.equals("ap-east-1")) {
						throw new IllegalStateException("region is not enabled");
					}
					AwsCredentialContext ctx = invocation.getArgument(0);
					return ctx.withRegion(region);
				});

		AccountScanResult result = new AccountScanner(failing, registry).scanResources(session, "111111111111",
				"prod", Arrays.asList("ap-east-1", "us-east-1"), Collections.singletonList("ebs-volumes"));

		Assertions.assertThat(result.getRegions()).containsExactly("ap-east-1", "us-east-1");
		Assertions.assertThat(result.hasCell("ap-east-1", "ebs-volumes")).isTrue();
		Assertions.assertThat(result.getFindings("ap-east-1", "ebs-volumes")).isEmpty();
		Assertions.assertThat(result.getFindings("us-east-1", "ebs-volumes")).hasSize(1);
	}
}
