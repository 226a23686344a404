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

import org.lendingclub.cloudsweep.core.ScannerSettings;

import com.amazonaws.services.ec2.AmazonEC2;
import com.amazonaws.services.ec2.AmazonEC2ClientBuilder;
import com.amazonaws.services.ec2.model.Tag;

public abstract class AbstractEC2Scanner extends AwsResourceScanner<AmazonEC2> {

	public static final String NAME_TAG = "Name";
	public static final String UNNAMED = "Unnamed";

	protected AbstractEC2Scanner(ScannerSettings settings, String alias, String label) {
		super(settings, alias, label);
	}

	@Override
	protected AmazonEC2 createClient(AwsCredentialContext context) {
		return context.configure(AmazonEC2ClientBuilder.standard()).build();
	}

	@Override
	protected void closeClient(AmazonEC2 client) {
		client.shutdown();
	}

	protected static String tagValue(List<Tag> tags, String key, String defaultValue) {
		if (tags == null) {
			return defaultValue;
		}
		for (Tag tag : tags) {
			if (key.equals(tag.getKey())) {
				return tag.getValue();
			}
		}
		return defaultValue;
	}
}
