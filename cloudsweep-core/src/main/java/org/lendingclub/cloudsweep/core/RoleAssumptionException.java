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

/**
 * Raised when a role could not be assumed in one account. Fatal to that account only.
 */
public class RoleAssumptionException extends CloudsweepException {

	private static final long serialVersionUID = 1L;

	private final String accountId;
	private final String roleArn;

	public RoleAssumptionException(String accountId, String roleArn, Throwable cause) {
		super("could not assume " + roleArn + " in account " + accountId, cause);
		this.accountId = accountId;
		this.roleArn = roleArn;
	}

	public String getAccountId() {
		return accountId;
	}

	public String getRoleArn() {
		return roleArn;
	}
}
