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

import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

/**
 * Registry entry for one scanner plugin.
 */
public class ScannerDescriptor<C> {

	private final String alias;
	private final String label;
	private final boolean accountScoped;
	private final ResourceScanner<C> scanner;

	public ScannerDescriptor(String alias, String label, boolean accountScoped, ResourceScanner<C> scanner) {
		Preconditions.checkArgument(!Strings.isNullOrEmpty(alias), "alias cannot be empty");
		Preconditions.checkNotNull(scanner, "scanner cannot be null");
		this.alias = alias;
		this.label = Strings.isNullOrEmpty(label) ? alias : label;
		this.accountScoped = accountScoped;
		this.scanner = scanner;
	}

	public static <C> ScannerDescriptor<C> of(ResourceScanner<C> scanner) {
		Preconditions.checkNotNull(scanner, "scanner cannot be null");
		return new ScannerDescriptor<>(scanner.getAlias(), scanner.getLabel(), scanner.isAccountScoped(), scanner);
	}

	public String getAlias() {
		return alias;
	}

	public String getLabel() {
		return label;
	}

	public boolean isAccountScoped() {
		return accountScoped;
	}

	public ResourceScanner<C> getScanner() {
		return scanner;
	}

	public String getTypeName() {
		return scanner.getClass().getSimpleName();
	}

	@Override
	public String toString() {
		return MoreObjects.toStringHelper(this).add("alias", alias).add("label", label)
				.add("accountScoped", accountScoped).add("type", getTypeName()).toString();
	}
}
