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
package org.lendingclub.cloudsweep.core;

import java.util.ArrayList;
import java.util.List;
import java.util.Map;
import java.util.TreeMap;

/**
 * Aggregate of every per-task result of one run, keyed by account id. Not thread safe: the orchestrator merges
 * results from the single thread that drains the completion queue.
 */
public class ScanResult {

	private final Map<String, AccountScanResult> accounts = new TreeMap<>();

	public ScanResult merge(AccountScanResult result) {
		accounts.computeIfAbsent(result.getAccountId(),
				id -> new AccountScanResult(id, result.getAccountName())).merge(result);
		return this;
	}

	public List<AccountScanResult> getAccounts() {
		return new ArrayList<>(accounts.values());
	}

	public int getFindingCount() {
		return accounts.values().stream().mapToInt(AccountScanResult::getFindingCount).sum();
	}

	public boolean hasFindings() {
		return getFindingCount() > 0;
	}
}
