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

import java.util.List;

import org.lendingclub.cloudsweep.core.AccountScanResult;
import org.lendingclub.cloudsweep.core.ScanMetrics;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.MoreObjects;
import com.google.common.collect.ImmutableList;

/**
 * What {@link ScanOrchestrator#execute()} hands to report generation: one record per scanned account and the run
 * metrics.
 */
@JsonPropertyOrder({ "metrics", "results" })
public final class ScanOutcome {

	private final List<AccountScanResult> results;
	private final ScanMetrics metrics;

	public ScanOutcome(List<AccountScanResult> results, ScanMetrics metrics) {
		this.results = ImmutableList.copyOf(results);
		this.metrics = metrics;
	}

	public List<AccountScanResult> getResults() {
		return results;
	}

	public ScanMetrics getMetrics() {
		return metrics;
	}

	@JsonIgnore
	public boolean hasFindings() {
		return results.stream().anyMatch(r -> r.getFindingCount() > 0);
	}

	@Override
	public String toString() {
		return MoreObjects.toStringHelper(this).add("accounts", results.size()).add("metrics", metrics).toString();
	}
}
