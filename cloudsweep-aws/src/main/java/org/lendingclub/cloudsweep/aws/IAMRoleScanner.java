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
import com.amazonaws.services.identitymanagement.model.GetRoleRequest;
import com.amazonaws.services.identitymanagement.model.ListAttachedRolePoliciesRequest;
import com.amazonaws.services.identitymanagement.model.ListInstanceProfilesForRoleRequest;
import com.amazonaws.services.identitymanagement.model.ListRolePoliciesRequest;
import com.amazonaws.services.identitymanagement.model.ListRolesRequest;
import com.amazonaws.services.identitymanagement.model.ListRolesResult;
import com.amazonaws.services.identitymanagement.model.Role;
import com.amazonaws.services.identitymanagement.model.RoleLastUsed;
import com.google.common.base.Joiner;

/**
 * Reports roles that were never used, have not been used within the threshold, or have nothing attached to them.
 * Service-linked and AWS reserved roles are never reported.
 */
public class IAMRoleScanner extends AbstractIAMScanner {

	public static final String ALIAS = "iam-roles";
	public static final String LABEL = "IAM Roles";

	public IAMRoleScanner(ScannerSettings settings) {
		super(settings, ALIAS, LABEL);
	}

	static boolean isReserved(String arn) {
		return arn != null && (arn.contains("service-role") || arn.contains("aws-reserved"));
	}

	@Override
	protected List<Finding> doScan(AwsCredentialContext context, AmazonIdentityManagement iam) {
		List<Finding> findings = new ArrayList<>();
		ListRolesRequest request = new ListRolesRequest();
		while (true) {
			ListRolesResult result = call(() -> iam.listRoles(request));
			for (Role role : result.getRoles()) {
				if (isReserved(role.getArn())) {
					logger.debug("skipping reserved role {}", role.getRoleName());
					continue;
				}
				Finding finding = inspect(context, iam, role);
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

	private Finding inspect(AwsCredentialContext context, AmazonIdentityManagement iam, Role role) {
		String name = role.getRoleName();
		RoleLastUsed lastUsed = call(() -> iam.getRole(new GetRoleRequest().withRoleName(name))).getRole()
				.getRoleLastUsed();
		Date lastUsedDate = lastUsed == null ? null : lastUsed.getLastUsedDate();
		long days = lastUsedDate == null ? -1 : daysSince(lastUsedDate);

		int attached = call(
				() -> iam.listAttachedRolePolicies(new ListAttachedRolePoliciesRequest().withRoleName(name)))
						.getAttachedPolicies().size();
		int inline = call(() -> iam.listRolePolicies(new ListRolePoliciesRequest().withRoleName(name)))
				.getPolicyNames().size();
		int profiles = call(
				() -> iam.listInstanceProfilesForRole(new ListInstanceProfilesForRoleRequest().withRoleName(name)))
						.getInstanceProfiles().size();

		List<String> reasons = new ArrayList<>();
		if (days < 0) {
			reasons.add("Role has never been used.");
		} else if (days > getDaysThreshold()) {
			reasons.add("Role has not been used in the last " + getDaysThreshold() + " days (" + days + " days ago).");
		}
		if (attached == 0 && inline == 0 && profiles == 0) {
			reasons.add("No attached policies or instance profiles.");
		}
		if (reasons.isEmpty()) {
			return null;
		}
		return Finding.builder(role.getArn()).withName(name).withReason(Joiner.on("\n").join(reasons))
				.withAttribute("LastUsed", lastUsedLabel(days)).withAttribute("InstanceProfiles", profiles)
				.withAttribute("PoliciesAttached", attached + inline)
				.withAttribute("AccountId", context.getAccountId()).build();
	}
}
