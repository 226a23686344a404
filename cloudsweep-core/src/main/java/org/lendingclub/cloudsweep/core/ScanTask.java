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

import java.util.Objects;

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

/**
 * One cell of the account x region x scanner matrix.
 */
public final class ScanTask {

	/**
	 * Region used for scanners that run once per account.
	 */
	public static final String GLOBAL_REGION = "Global";

	private final String accountId;
	private final String accountName;
	private final String region;
	private final String scannerAlias;

	public ScanTask(String accountId, String accountName, String region, String scannerAlias) {
		Preconditions.checkArgument(!Strings.isNullOrEmpty(accountId), "accountId cannot be empty");
		Preconditions.checkArgument(!Strings.isNullOrEmpty(region), "region cannot be empty");
		Preconditions.checkArgument(!Strings.isNullOrEmpty(scannerAlias), "scannerAlias cannot be empty");
		this.accountId = accountId;
		this.accountName = accountName;
		this.region = region;
		this.scannerAlias = scannerAlias;
	}

	public String getAccountId() {
		return accountId;
	}

	public String getAccountName() {
		return accountName;
	}

	public String getRegion() {
		return region;
	}

	public String getScannerAlias() {
		return scannerAlias;
	}

	public boolean isGlobal() {
		return GLOBAL_REGION.equals(region);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof ScanTask)) {
			return false;
		}
		ScanTask other = (ScanTask) o;
		return accountId.equals(other.accountId) && region.equals(other.region)
				&& scannerAlias.equals(other.scannerAlias) && Objects.equals(accountName, other.accountName);
	}

	@Override
	public int hashCode() {
		return Objects.hash(accountId, accountName, region, scannerAlias);
	}

	@Override
	public String toString() {
		return MoreObjects.toStringHelper(this).add("account", accountId).add("region", region)
				.add("scanner", scannerAlias).toString();
	}
}
