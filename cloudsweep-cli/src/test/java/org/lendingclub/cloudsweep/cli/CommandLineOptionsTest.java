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
package org.lendingclub.cloudsweep.cli;

import org.assertj.core.api.Assertions;
import org.junit.Test;
import org.lendingclub.cloudsweep.aws.CloudsweepConfig;
import org.lendingclub.cloudsweep.core.ConfigurationException;

import com.google.common.collect.ImmutableMap;

public class CommandLineOptionsTest {

	@Test
	public void testAllOptions() {
		CommandLineOptions options = CommandLineOptions.parse("--profile", "audit", "--organization-role", "OrgReader",
				"--runner-role", "Runner", "--accounts", "111111111111,222222222222", "--regions", "us-east-1",
				"--scanners", "ebs-volumes, IAM Roles", "--max-workers", "3", "--days-threshold", "45", "--output",
				"out/report.json");

		CloudsweepConfig config = options.applyTo(CloudsweepConfig.builder()).build();

		Assertions.assertThat(config.getProfile()).contains("audit");
		Assertions.assertThat(config.getOrganizationRole()).contains("OrgReader");
		Assertions.assertThat(config.getRunnerRole()).contains("Runner");
		Assertions.assertThat(config.getAccounts()).containsExactly("111111111111", "222222222222");
		Assertions.assertThat(config.getRegions()).containsExactly("us-east-1");
		Assertions.assertThat(config.getScanners()).containsExactly("ebs-volumes", "IAM Roles");
		Assertions.assertThat(config.getMaxWorkers()).isEqualTo(3);
		Assertions.assertThat(config.getDaysThreshold()).isEqualTo(45);
		Assertions.assertThat(options.getOutput()).contains("out/report.json");
		Assertions.assertThat(options.isListScanners()).isFalse();
	}

	@Test
	public void testAllFlagsOverrideEnvironment() {
		CloudsweepConfig.Builder builder = CloudsweepConfig.builder().withEnvironment(
				ImmutableMap.of("CLOUDSWEEP_REGIONS", "us-west-2", "CLOUDSWEEP_SCANNERS", "iam-users"));

		CloudsweepConfig config = CommandLineOptions.parse("--all-regions", "--all-scanners").applyTo(builder)
				.build();

		Assertions.assertThat(config.getRegions()).isEmpty();
		Assertions.assertThat(config.getScanners()).isEmpty();
	}

	@Test
	public void testUnsetOptionsKeepEnvironment() {
		CloudsweepConfig.Builder builder = CloudsweepConfig.builder()
				.withEnvironment(ImmutableMap.of("CLOUDSWEEP_RUNNER_ROLE", "FromEnv"));

		CloudsweepConfig config = CommandLineOptions.parse("--list-scanners").applyTo(builder).build();

		Assertions.assertThat(config.getRunnerRole()).contains("FromEnv");
	}

	@Test
	public void testErrors() {
		Assertions.assertThatThrownBy(() -> CommandLineOptions.parse("--bogus"))
				.isInstanceOf(ConfigurationException.class).hasMessageContaining("--bogus");
		Assertions.assertThatThrownBy(() -> CommandLineOptions.parse("--profile"))
				.isInstanceOf(ConfigurationException.class).hasMessageContaining("requires a value");
		Assertions.assertThatThrownBy(() -> CommandLineOptions.parse("--regions", "--all-scanners"))
				.isInstanceOf(ConfigurationException.class);
		Assertions.assertThatThrownBy(() -> CommandLineOptions.parse("--max-workers", "many"))
				.isInstanceOf(ConfigurationException.class);
	}
}
