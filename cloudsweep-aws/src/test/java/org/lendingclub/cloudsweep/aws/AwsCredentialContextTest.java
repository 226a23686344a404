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

import java.time.Instant;

import org.assertj.core.api.Assertions;
import org.junit.Test;

import com.amazonaws.auth.AWSSessionCredentials;
import com.amazonaws.services.ec2.AmazonEC2ClientBuilder;

public class AwsCredentialContextTest {

	AwsCredentialContext context = new AwsCredentialContext("ASIAEXAMPLEKEY1234", "secret", "token", "us-west-2",
			"111111111111", Instant.parse("2030-01-01T00:00:00Z"));

	@Test
	public void testDerivedCopies() {
		AwsCredentialContext global = context.withRegion("Global");

		Assertions.assertThat(global).isNotSameAs(context);
		Assertions.assertThat(global.getAccountId()).isEqualTo("111111111111");
		Assertions.assertThat(global.isGlobal()).isTrue();
		Assertions.assertThat(global.getSigningRegion()).isEqualTo("us-east-1");
		Assertions.assertThat(context.getSigningRegion()).isEqualTo("us-west-2");
		Assertions.assertThat(context.withAccountId("222222222222").getRegion()).isEqualTo("us-west-2");
	}

	@Test
	public void testCredentials() {
		Assertions.assertThat(context.getCredentials()).isInstanceOf(AWSSessionCredentials.class);
		Assertions.assertThat(new AwsCredentialContext("AKIA", "secret", "", "us-east-1", null, null).getCredentials())
				.isNotInstanceOf(AWSSessionCredentials.class);
	}

	@Test
	public void testConfigureBuilder() {
		AmazonEC2ClientBuilder builder = context.withRegion("Global").configure(AmazonEC2ClientBuilder.standard());

		Assertions.assertThat(builder.getRegion()).isEqualTo("us-east-1");
		Assertions.assertThat(builder.getCredentials().getCredentials().getAWSAccessKeyId())
				.isEqualTo("ASIAEXAMPLEKEY1234");
	}

	@Test
	public void testToStringMasksSecrets() {
		Assertions.assertThat(context.toString()).contains("****1234").doesNotContain("ASIAEXAMPLEKEY")
				.doesNotContain("secret").doesNotContain("token");
	}

	@Test
	public void testRegionRequired() {
		Assertions.assertThatThrownBy(() -> context.withRegion(""))
				.isInstanceOf(IllegalArgumentException.class);
	}
}
