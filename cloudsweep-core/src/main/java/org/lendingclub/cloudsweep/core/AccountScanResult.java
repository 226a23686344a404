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
import java.util.Collections;
import java.util.List;
import java.util.Map;
import java.util.SortedMap;
import java.util.SortedSet;
import java.util.TreeMap;
import java.util.TreeSet;

import com.fasterxml.jackson.annotation.JsonIgnore;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

/**
 * Findings for one account, keyed by region and then by scanner alias.
 * <p>
 * A (region, alias) cell is present whenever that scanner was attempted in that region, even if it found nothing or
 * failed. A missing cell means the scanner never ran there. Instances are not thread safe; each task builds its own
 * and a single collector merges them.
 */
@JsonPropertyOrder({ "accountId", "accountName", "regions", "scanResults" })
public class AccountScanResult {

	private final String accountId;
	private String accountName;
	private final SortedSet<String> regions = new TreeSet<>();
	private final SortedMap<String, SortedMap<String, List<Finding>>> scanResults = new TreeMap<>();

	public AccountScanResult(String accountId, String accountName) {
		Preconditions.checkArgument(!Strings.isNullOrEmpty(accountId), "accountId cannot be empty");
		this.accountId = accountId;
		this.accountName = accountName;
	}

	public String getAccountId() {
		return accountId;
	}

	public String getAccountName() {
		return accountName;
	}

	public List<String> getRegions() {
		return Collections.unmodifiableList(new ArrayList<>(regions));
	}

	public Map<String, SortedMap<String, List<Finding>>> getScanResults() {
		return Collections.unmodifiableMap(scanResults);
	}

	/**
	 * Records that a region was requested for this account, whether or not any scanner managed to run there.
	 */
	public AccountScanResult addRegion(String region) {
		regions.add(region);
		return this;
	}

	/**
	 * Records the outcome of one cell. Findings for an existing cell are appended.
	 */
	public AccountScanResult put(String region, String scannerAlias, List<Finding> findings) {
		regions.add(region);
		List<Finding> cell = scanResults.computeIfAbsent(region, r -> new TreeMap<>()).computeIfAbsent(scannerAlias,
				a -> new ArrayList<>());
		if (findings != null) {
			cell.addAll(findings);
		}
		return this;
	}

	public boolean hasCell(String region, String scannerAlias) {
		Map<String, List<Finding>> byAlias = scanResults.get(region);
		return byAlias != null && byAlias.containsKey(scannerAlias);
	}

	public List<Finding> getFindings(String region, String scannerAlias) {
		Map<String, List<Finding>> byAlias = scanResults.get(region);
		if (byAlias == null || !byAlias.containsKey(scannerAlias)) {
			return Collections.emptyList();
		}
		return Collections.unmodifiableList(byAlias.get(scannerAlias));
	}

	@JsonIgnore
	public int getFindingCount() {
		int count = 0;
		for (Map<String, List<Finding>> byAlias : scanResults.values()) {
			for (List<Finding> findings : byAlias.values()) {
				count += findings.size();
			}
		}
		return count;
	}

	@JsonIgnore
	public int getCellCount() {
		int count = 0;
		for (Map<String, List<Finding>> byAlias : scanResults.values()) {
			count += byAlias.size();
		}
		return count;
	}

	public AccountScanResult merge(AccountScanResult other) {
		Preconditions.checkArgument(accountId.equals(other.accountId), "cannot merge results for %s into %s",
				other.accountId, accountId);
		if (Strings.isNullOrEmpty(accountName)) {
			accountName = other.accountName;
		}
		regions.addAll(other.regions);
		other.scanResults.forEach((region, byAlias) -> {
			byAlias.forEach((alias, findings) -> put(region, alias, findings));
		});
		return this;
	}

	@Override
	public String toString() {
		return MoreObjects.toStringHelper(this).add("accountId", accountId).add("accountName", accountName)
				.add("regions", regions).add("cells", getCellCount()).add("findings", getFindingCount())
				.toString();
	}
}
