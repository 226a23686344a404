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

import org.lendingclub.cloudsweep.core.ScannerRegistry;
import org.lendingclub.cloudsweep.core.ScannerSettings;

import com.google.common.collect.ImmutableList;

/**
 * The built-in scanners. Adding a scanner means adding its type here.
 */
public final class AwsScannerCatalog {

	public static final List<Class<?>> SCANNER_TYPES = ImmutableList.of(
			EbsVolumeScanner.class, EbsSnapshotScanner.class, ElasticIpScanner.class, IAMRoleScanner.class,
			IAMUserScanner.class);

	private AwsScannerCatalog() {
	}

	/**
	 * A sealed registry holding every built-in scanner, each constructed with the given settings.
	 */
	public static ScannerRegistry<AwsCredentialContext> newRegistry(ScannerSettings settings) {
		ScannerRegistry<AwsCredentialContext> registry = new ScannerRegistry<>(settings);
		for (Class<?> type : SCANNER_TYPES) {
			registry.register(type);
		}
		return registry.seal();
	}
}
