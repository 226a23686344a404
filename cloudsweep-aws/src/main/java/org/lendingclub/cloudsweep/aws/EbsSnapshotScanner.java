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

import java.time.Duration;
import java.util.ArrayList;
import java.util.List;

import org.lendingclub.cloudsweep.core.Finding;
import org.lendingclub.cloudsweep.core.ScannerSettings;

import com.amazonaws.services.ec2.AmazonEC2;
import com.amazonaws.services.ec2.model.DescribeSnapshotsRequest;
import com.amazonaws.services.ec2.model.DescribeSnapshotsResult;
import com.amazonaws.services.ec2.model.Snapshot;
import com.google.common.base.Joiner;
import com.google.common.base.Strings;

/**
 * Reports snapshots owned by the account that are older than the configured number of days.
 */
public class EbsSnapshotScanner extends AbstractEC2Scanner {

	public static final String ALIAS = "ebs-snapshots";
	public static final String LABEL = "EBS Snapshots";

	public EbsSnapshotScanner(ScannerSettings settings) {
		super(settings, ALIAS, LABEL);
	}

	@Override
	protected List<Finding> doScan(AwsCredentialContext context, AmazonEC2 ec2) {
		List<Finding> findings = new ArrayList<>();
		DescribeSnapshotsRequest request = new DescribeSnapshotsRequest().withOwnerIds("self");
		do {
			DescribeSnapshotsResult result = call(() -> ec2.describeSnapshots(request));
			for (Snapshot snapshot : result.getSnapshots()) {
				long age = daysSince(snapshot.getStartTime());
				if (age < getDaysThreshold()) {
					continue;
				}
				String name = tagValue(snapshot.getTags(), NAME_TAG, null);
				if (Strings.isNullOrEmpty(name)) {
					name = Strings.isNullOrEmpty(snapshot.getDescription()) ? UNNAMED : snapshot.getDescription();
				}
				Duration elapsed = Duration.between(snapshot.getStartTime().toInstant(),
						getSettings().getClock().instant());
				findings.add(Finding.builder(snapshot.getSnapshotId()).withName(name)
						.withReason("Snapshot is " + formatAge(elapsed) + " old, exceeding the threshold of "
								+ getDaysThreshold() + " days")
						.withAttribute("Size", snapshot.getVolumeSize())
						.withAttribute("VolumeId", snapshot.getVolumeId())
						.withAttribute("CreateTime", snapshot.getStartTime().toInstant())
						.withAttribute("Tags", snapshot.getTags() == null || snapshot.getTags().isEmpty() ? null
								: snapshot.getTags())
						.withAttribute("AccountId", context.getAccountId()).build());
			}
			request.setNextToken(result.getNextToken());
		} while (tokenHasNext(request.getNextToken()));
		return findings;
	}

	/**
	 * Renders an age like "1 year, 2 months, 3 days". Years are 365 days and months 30.
	 */
	static String formatAge(Duration age) {
		long days = age.toDays();
		long hours = age.minusDays(days).toHours();
		List<String> parts = new ArrayList<>();
		appendUnit(parts, days / 365, "year");
		days %= 365;
		appendUnit(parts, days / 30, "month");
		days %= 30;
		appendUnit(parts, days / 7, "week");
		appendUnit(parts, days % 7, "day");
		appendUnit(parts, hours, "hour");
		return parts.isEmpty() ? "less than an hour" : Joiner.on(", ").join(parts);
	}

	private static void appendUnit(List<String> parts, long value, String unit) {
		if (value > 0) {
			parts.add(value + " " + unit + (value > 1 ? "s" : ""));
		}
	}
}
