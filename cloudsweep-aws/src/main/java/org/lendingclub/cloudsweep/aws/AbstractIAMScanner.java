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

import org.lendingclub.cloudsweep.core.ScannerSettings;

import com.amazonaws.services.identitymanagement.AmazonIdentityManagement;
import com.amazonaws.services.identitymanagement.AmazonIdentityManagementClientBuilder;

public abstract class AbstractIAMScanner extends GlobalAwsResourceScanner<AmazonIdentityManagement> {

	public static final String NEVER = "Never";

	protected AbstractIAMScanner(ScannerSettings settings, String alias, String label) {
		super(settings, alias, label);
	}

	@Override
	protected AmazonIdentityManagement createClient(AwsCredentialContext context) {
		return context.configure(AmazonIdentityManagementClientBuilder.standard()).build();
	}

	@Override
	protected void closeClient(AmazonIdentityManagement client) {
		client.shutdown();
	}

	protected static String lastUsedLabel(long days) {
		return days < 0 ? NEVER : days + " days ago";
	}
}
