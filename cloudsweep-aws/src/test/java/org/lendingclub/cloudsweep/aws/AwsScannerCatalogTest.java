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

import org.assertj.core.api.Assertions;
import org.junit.Test;
import org.lendingclub.cloudsweep.core.RegistrationException;
import org.lendingclub.cloudsweep.core.ScannerRegistry;
import org.lendingclub.cloudsweep.core.ScannerSettings;

public class AwsScannerCatalogTest {

	@Test
	public void testBuiltInScanners() {
		ScannerRegistry<AwsCredentialContext> registry = AwsScannerCatalog.newRegistry(new ScannerSettings(30));

		Assertions.assertThat(registry.isSealed()).isTrue();
		Assertions.assertThat(registry.list()).containsExactly("ebs-snapshots", "ebs-volumes", "elastic-ips",
				"iam-roles", "iam-users");
		Assertions.assertThat(registry.resolve("IAM Users").isAccountScoped()).isTrue();
		Assertions.assertThat(registry.resolve("EbsVolumeScanner").getAlias()).isEqualTo("ebs-volumes");

		AwsResourceScanner<?> scanner = (AwsResourceScanner<?>) registry.resolve("elastic-ips").getScanner();
		Assertions.assertThat(scanner.getSettings().getDaysThreshold()).isEqualTo(30);
	}

	@Test
	public void testRegistryIsClosed() {
		ScannerRegistry<AwsCredentialContext> registry = AwsScannerCatalog.newRegistry(ScannerSettings.defaults());

		Assertions.assertThatThrownBy(() -> registry.register(EbsVolumeScanner.class))
				.isInstanceOf(RegistrationException.class);
	}
}
