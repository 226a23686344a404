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

import java.util.Objects;

import com.amazonaws.services.organizations.model.Account;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

/**
 * A member account as reported by the organization directory.
 */
public final class AccountDescriptor {

	public static final String ACTIVE = "ACTIVE";

	private final String id;
	private final String name;
	private final String status;

	public AccountDescriptor(String id, String name, String status) {
		Preconditions.checkArgument(!Strings.isNullOrEmpty(id), "id cannot be empty");
		this.id = id;
		this.name = name;
		this.status = status;
	}

	public static AccountDescriptor from(Account account) {
		return new AccountDescriptor(account.getId(), account.getName(), account.getStatus());
	}

	public String getId() {
		return id;
	}

	public String getName() {
		return name;
	}

	public String getStatus() {
		return status;
	}

	public boolean isActive() {
		return ACTIVE.equals(status);
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof AccountDescriptor)) {
			return false;
		}
		AccountDescriptor other = (AccountDescriptor) o;
		return id.equals(other.id) && Objects.equals(name, other.name) && Objects.equals(status, other.status);
	}

	@Override
	public int hashCode() {
		return Objects.hash(id, name, status);
	}

	@Override
	public String toString() {
		return MoreObjects.toStringHelper(this).add("id", id).add("name", name).add("status", status).toString();
	}
}
