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

import com.amazonaws.services.ec2.AmazonEC2;
import com.amazonaws.services.ec2.AmazonEC2ClientBuilder;
import com.amazonaws.services.organizations.AWSOrganizations;
import com.amazonaws.services.organizations.AWSOrganizationsClientBuilder;
import com.amazonaws.services.securitytoken.AWSSecurityTokenService;
import com.amazonaws.services.securitytoken.AWSSecurityTokenServiceClientBuilder;

public class DefaultAwsClientFactory implements AwsClientFactory {

	@Override
	public AWSSecurityTokenService newSecurityTokenService(AwsCredentialContext context) {
		return context.configure(AWSSecurityTokenServiceClientBuilder.standard()).build();
	}

	@Override
	public AWSOrganizations newOrganizations(AwsCredentialContext context) {
		// the organizations API is only served from us-east-1
		return AWSOrganizationsClientBuilder.standard().withRegion(AwsCredentialContext.GLOBAL_SIGNING_REGION)
				.withCredentials(context.getCredentialsProvider()).build();
	}

	@Override
	public AmazonEC2 newEC2(AwsCredentialContext context) {
		return context.configure(AmazonEC2ClientBuilder.standard()).build();
	}
}
