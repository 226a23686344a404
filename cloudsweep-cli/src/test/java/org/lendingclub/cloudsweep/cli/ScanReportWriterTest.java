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

import java.io.File;
import java.nio.file.Path;
import java.time.Clock;
import java.time.Instant;
import java.time.ZoneOffset;
import java.util.Arrays;
import java.util.Collections;
import java.util.Optional;

import org.assertj.core.api.Assertions;
import org.junit.Rule;
import org.junit.Test;
import org.junit.rules.TemporaryFolder;
import org.lendingclub.cloudsweep.aws.ScanOutcome;
import org.lendingclub.cloudsweep.core.AccountScanResult;
import org.lendingclub.cloudsweep.core.Finding;
import org.lendingclub.cloudsweep.core.JsonUtil;
import org.lendingclub.cloudsweep.core.ScanMetrics;

import com.fasterxml.jackson.databind.JsonNode;

public class ScanReportWriterTest {

	@Rule
	public TemporaryFolder folder = new TemporaryFolder();

	static final Instant START = Instant.parse("2024-06-01T12:00:00Z");

	ScanMetrics metrics = ScanMetrics.compute(START, START.plusSeconds(4), 2, 2, 0);

	@Test
	public void testWritesReport() throws Exception {
		AccountScanResult prod = new AccountScanResult("111111111111", "prod")
				.put("us-east-1", "ebs-volumes",
						Arrays.asList(Finding.builder("vol-1").withName("scratch").withReason("unattached").build()))
				.put("Global", "iam-roles", Collections.emptyList());
		File target = new File(folder.getRoot(), "reports/out.json");

		Optional<Path> written = new ScanReportWriter().write(new ScanOutcome(Arrays.asList(prod), metrics),
				target.toPath());

		Assertions.assertThat(written).contains(target.toPath());
		JsonNode n = JsonUtil.getObjectMapper().readTree(target);
		Assertions.assertThat(n.path("metrics").path("totalScans").asInt()).isEqualTo(2);
		Assertions.assertThat(n.path("metrics").path("avgScansPerSecond").asDouble()).isEqualTo(0.5d);
		JsonNode account = n.path("results").get(0);
		Assertions.assertThat(account.path("accountId").asText()).isEqualTo("111111111111");
		Assertions.assertThat(account.path("scanResults").path("us-east-1").path("ebs-volumes").get(0)
				.path("resourceId").asText()).isEqualTo("vol-1");
		Assertions.assertThat(account.path("scanResults").path("Global").path("iam-roles").size()).isEqualTo(0);
	}

	@Test
	public void testNothingFound() {
		AccountScanResult prod = new AccountScanResult("111111111111", "prod").put("us-east-1", "ebs-volumes",
				Collections.emptyList());
		File target = new File(folder.getRoot(), "empty.json");

		Optional<Path> written = new ScanReportWriter().write(new ScanOutcome(Arrays.asList(prod), metrics),
				target.toPath());

		Assertions.assertThat(written).isEmpty();
		Assertions.assertThat(target).doesNotExist();
	}

	@Test
	public void testDefaultReportPath() {
		ScanReportWriter writer = new ScanReportWriter(Clock.fixed(START, ZoneOffset.UTC));
		Assertions.assertThat(writer.defaultReportPath().toString())
				.isEqualTo("cloudsweep-report-" + START.getEpochSecond() + ".json");
	}
}
