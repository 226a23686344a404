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

import java.util.ArrayList;
import java.util.List;

import org.lendingclub.cloudsweep.core.Finding;
import org.lendingclub.cloudsweep.core.ScannerSettings;

import com.amazonaws.services.ec2.AmazonEC2;
import com.amazonaws.services.ec2.model.DescribeVolumesRequest;
import com.amazonaws.services.ec2.model.DescribeVolumesResult;
import com.amazonaws.services.ec2.model.Volume;

/**
 * Reports volumes with no attachments that were created at least the configured number of days ago.
 */
public class EbsVolumeScanner extends AbstractEC2Scanner {

	public static final String ALIAS = "ebs-volumes";
	public static final String LABEL = "EBS Volumes";

	public EbsVolumeScanner(ScannerSettings settings) {
		super(settings, ALIAS, LABEL);
	}

	@Override
	protected List<Finding> doScan(AwsCredentialContext context, AmazonEC2 ec2) {
		List<Finding> findings = new ArrayList<>();
		DescribeVolumesRequest request = new DescribeVolumesRequest();
		do {
			DescribeVolumesResult result = call(() -> ec2.describeVolumes(request));
			for (Volume volume : result.getVolumes()) {
				logger.debug("checking volume {}", volume.getVolumeId());
				if (volume.getAttachments() != null && !volume.getAttachments().isEmpty()) {
					continue;
				}
				long age = daysSince(volume.getCreateTime());
				if (age >= getDaysThreshold()) {
					findings.add(Finding.builder(volume.getVolumeId())
							.withName(tagValue(volume.getTags(), NAME_TAG, UNNAMED))
							.withReason("Volume has been unattached for " + age + " days, exceeding the threshold of "
									+ getDaysThreshold() + " days")
							.withAttribute("State", volume.getState()).withAttribute("Size", volume.getSize())
							.withAttribute("VolumeType", volume.getVolumeType())
							.withAttribute("CreateTime", volume.getCreateTime().toInstant())
							.withAttribute("AccountId", context.getAccountId()).build());
				}
			}
			request.setNextToken(result.getNextToken());
		} while (tokenHasNext(request.getNextToken()));
		return findings;
	}
}
