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
import java.util.Date;
import java.util.List;

import org.lendingclub.cloudsweep.core.Finding;
import org.lendingclub.cloudsweep.core.ScannerSettings;

import com.amazonaws.services.identitymanagement.AmazonIdentityManagement;
import com.amazonaws.services.identitymanagement.model.AccessKeyLastUsed;
import com.amazonaws.services.identitymanagement.model.AccessKeyMetadata;
import com.amazonaws.services.identitymanagement.model.GetAccessKeyLastUsedRequest;
import com.amazonaws.services.identitymanagement.model.ListAccessKeysRequest;
import com.amazonaws.services.identitymanagement.model.ListUsersRequest;
import com.amazonaws.services.identitymanagement.model.ListUsersResult;
import com.amazonaws.services.identitymanagement.model.User;
import com.google.common.base.Joiner;

/**
 * Reports users who have neither signed in to the console nor used an access key within the threshold. A user with
 * several keys is judged by the most recently used one.
 */
public class IAMUserScanner extends AbstractIAMScanner {

	public static final String ALIAS = "iam-users";
	public static final String LABEL = "IAM Users";

	public IAMUserScanner(ScannerSettings settings) {
		super(settings, ALIAS, LABEL);
	}

	@Override
	protected List<Finding> doScan(AwsCredentialContext context, AmazonIdentityManagement iam) {
		List<Finding> findings = new ArrayList<>();
		ListUsersRequest request = new ListUsersRequest();
		while (true) {
			ListUsersResult result = call(() -> iam.listUsers(request));
			for (User user : result.getUsers()) {
				Finding finding = inspect(context, iam, user);
				if (finding != null) {
					findings.add(finding);
				}
			}
			if (Boolean.TRUE.equals(result.isTruncated()) && tokenHasNext(result.getMarker())) {
				request.setMarker(result.getMarker());
			} else {
				break;
			}
		}
		return findings;
	}

	private Finding inspect(AwsCredentialContext context, AmazonIdentityManagement iam, User user) {
		long loginDays = user.getPasswordLastUsed() == null ? -1 : daysSince(user.getPasswordLastUsed());
		long keyDays = latestKeyUsageDays(iam, user.getUserName());

		List<String> reasons = new ArrayList<>();
		if (loginDays < 0 && keyDays < 0) {
			reasons.add("User has never logged in or used access keys.");
		} else if (isStale(loginDays) && isStale(keyDays)) {
			reasons.add("UI login last used " + lastUsedLabel(loginDays) + ".");
			reasons.add("Access keys last used " + lastUsedLabel(keyDays) + ".");
		}
		if (reasons.isEmpty()) {
			return null;
		}
		return Finding.builder(user.getArn()).withName(user.getUserName()).withReason(Joiner.on("\n").join(reasons))
				.withAttribute("LastLogin", lastUsedLabel(loginDays))
				.withAttribute("LastKeyUsage", lastUsedLabel(keyDays))
				.withAttribute("AccountId", context.getAccountId()).build();
	}

	// never counts as stale
	private boolean isStale(long days) {
		return days < 0 || days >= getDaysThreshold();
	}

	/**
	 * Days since the most recent use of any of the user's access keys, or -1 if none was ever used.
	 */
	long latestKeyUsageDays(AmazonIdentityManagement iam, String userName) {
		long latest = -1;
		List<AccessKeyMetadata> keys = call(() -> iam.listAccessKeys(new ListAccessKeysRequest().withUserName(userName)))
				.getAccessKeyMetadata();
		for (AccessKeyMetadata key : keys) {
			AccessKeyLastUsed lastUsed = call(() -> iam
					.getAccessKeyLastUsed(new GetAccessKeyLastUsedRequest().withAccessKeyId(key.getAccessKeyId())))
							.getAccessKeyLastUsed();
			Date date = lastUsed == null ? null : lastUsed.getLastUsedDate();
			if (date != null) {
				long days = daysSince(date);
				latest = latest < 0 ? days : Math.min(latest, days);
			}
		}
		return latest;
	}
}
