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

import org.assertj.core.api.Assertions;
import org.junit.Test;
import org.lendingclub.cloudsweep.core.ConfigurationException;

import com.google.common.collect.ImmutableMap;

public class CloudsweepConfigTest {

	@Test
	public void testDefaults() {
		CloudsweepConfig config = CloudsweepConfig.builder().build();

		Assertions.assertThat(config.getRegion()).isEqualTo("us-east-1");
		Assertions.assertThat(config.getProfile()).isEmpty();
		Assertions.assertThat(config.getOrganizationRole()).isEmpty();
		Assertions.assertThat(config.getAccounts()).isEmpty();
		Assertions.assertThat(config.getRegions()).isEmpty();
		Assertions.assertThat(config.getScanners()).isEmpty();
		Assertions.assertThat(config.getMaxWorkers()).isGreaterThanOrEqualTo(1);
		Assertions.assertThat(config.getDaysThreshold()).isEqualTo(90);
		Assertions.assertThat(config.getRetryMaxTries()).isEqualTo(4);
		Assertions.assertThat(config.getRetryInitialDelayMillis()).isEqualTo(1000L);
	}

	@Test
	public void testEnvironment() {
		CloudsweepConfig config = CloudsweepConfig.builder()
				.withEnvironment(ImmutableMap.<String, String>builder().put("AWS_PROFILE", "audit")
						.put("AWS_REGION", "eu-west-1").put("CLOUDSWEEP_ORGANIZATION_ROLE", "OrgReader")
						.put("CLOUDSWEEP_RUNNER_ROLE", "Runner").put("CLOUDSWEEP_ACCOUNTS", "111111111111, 222222222222")
						.put("CLOUDSWEEP_REGIONS", "all").put("CLOUDSWEEP_SCANNERS", "ebs-volumes,iam-roles")
						.put("CLOUDSWEEP_MAX_WORKERS", "8").put("DAYS_THRESHOLD", "30").put("HOME", "/root").build())
				.build();

		Assertions.assertThat(config.getProfile()).contains("audit");
		Assertions.assertThat(config.getRegion()).isEqualTo("eu-west-1");
		Assertions.assertThat(config.getOrganizationRole()).contains("OrgReader");
		Assertions.assertThat(config.getRunnerRole()).contains("Runner");
		Assertions.assertThat(config.getAccounts()).containsExactly("111111111111", "222222222222");
		Assertions.assertThat(config.getRegions()).isEmpty();
		Assertions.assertThat(config.getScanners()).containsExactly("ebs-volumes", "iam-roles");
		Assertions.assertThat(config.getMaxWorkers()).isEqualTo(8);
		Assertions.assertThat(config.getDaysThreshold()).isEqualTo(30);
		Assertions.assertThat(config.toScannerSettings().getDaysThreshold()).isEqualTo(30);
	}

	@Test
	public void testScannerSettingsCarryRetryPolicy() {
		CloudsweepConfig config = CloudsweepConfig.builder().withDaysThreshold(45).withRetry(2, 250).build();

		Assertions.assertThat(config.toScannerSettings().getDaysThreshold()).isEqualTo(45);
		Assertions.assertThat(config.toScannerSettings().getRetryMaxTries()).isEqualTo(2);
		Assertions.assertThat(config.toScannerSettings().getRetryInitialDelayMillis()).isEqualTo(250L);
	}

	@Test
	public void testExplicitValuesOverrideEnvironment() {
		CloudsweepConfig config = CloudsweepConfig.builder()
				.withEnvironment(ImmutableMap.of("CLOUDSWEEP_MAX_WORKERS", "8"))
				.withProperties(ImmutableMap.of(CloudsweepConfig.MAX_WORKERS, "2", "unknown", "x")).build();

		Assertions.assertThat(config.getMaxWorkers()).isEqualTo(2);
	}

	@Test
	public void testInvalidValues() {
		Assertions.assertThatThrownBy(() -> CloudsweepConfig.builder().withProperty(CloudsweepConfig.MAX_WORKERS, "lots"))
				.isInstanceOf(ConfigurationException.class).hasMessageContaining("maxWorkers");
		Assertions.assertThatThrownBy(() -> CloudsweepConfig.builder().withMaxWorkers(0))
				.isInstanceOf(ConfigurationException.class);
		Assertions.assertThatThrownBy(() -> CloudsweepConfig.builder().withDaysThreshold(-1))
				.isInstanceOf(ConfigurationException.class);
	}

	@Test
	public void testParseList() {
		Assertions.assertThat(CloudsweepConfig.parseList("ALL")).isEmpty();
		Assertions.assertThat(CloudsweepConfig.parseList("")).isEmpty();
		Assertions.assertThat(CloudsweepConfig.parseList(" a, ,b ")).containsExactly("a", "b");
	}
}
