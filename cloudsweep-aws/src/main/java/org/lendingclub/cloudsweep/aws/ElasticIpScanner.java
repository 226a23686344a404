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
import java.util.HashSet;
import java.util.List;
import java.util.Set;

import org.lendingclub.cloudsweep.core.Finding;
import org.lendingclub.cloudsweep.core.ScannerSettings;

import com.amazonaws.services.ec2.AmazonEC2;
import com.amazonaws.services.ec2.model.Address;
import com.amazonaws.services.ec2.model.DescribeAddressesRequest;
import com.amazonaws.services.ec2.model.DescribeNatGatewaysRequest;
import com.amazonaws.services.ec2.model.DescribeNatGatewaysResult;
import com.amazonaws.services.ec2.model.NatGateway;
import com.amazonaws.services.ec2.model.NatGatewayAddress;
import com.google.common.base.Strings;

/**
 * Reports addresses that are not associated with an instance, a network interface or a NAT gateway.
 */
public class ElasticIpScanner extends AbstractEC2Scanner {

	public static final String ALIAS = "elastic-ips";
	public static final String LABEL = "Elastic IPs";

	public ElasticIpScanner(ScannerSettings settings) {
		super(settings, ALIAS, LABEL);
	}

	@Override
	protected List<Finding> doScan(AwsCredentialContext context, AmazonEC2 ec2) {
		List<Address> candidates = new ArrayList<>();
		for (Address address : call(() -> ec2.describeAddresses(new DescribeAddressesRequest())).getAddresses()) {
			if (Strings.isNullOrEmpty(address.getInstanceId())
					&& Strings.isNullOrEmpty(address.getNetworkInterfaceId())) {
				candidates.add(address);
			}
		}
		if (candidates.isEmpty()) {
			return new ArrayList<>();
		}

		Set<String> natAllocations = natGatewayAllocationIds(ec2);
		List<Finding> findings = new ArrayList<>();
		for (Address address : candidates) {
			if (address.getAllocationId() != null && natAllocations.contains(address.getAllocationId())) {
				logger.debug("{} is held by a NAT gateway", address.getPublicIp());
				continue;
			}
			String id = Strings.isNullOrEmpty(address.getAllocationId()) ? address.getPublicIp()
					: address.getAllocationId();
			findings.add(Finding.builder(id).withName(address.getPublicIp())
					.withReason("Not associated with any resource (EC2 Instance, Network Interface, or NAT Gateway).")
					.withAttribute("PublicIp", address.getPublicIp()).withAttribute("Domain", address.getDomain())
					.withAttribute("AccountId", context.getAccountId()).build());
		}
		return findings;
	}

	Set<String> natGatewayAllocationIds(AmazonEC2 ec2) {
		Set<String> ids = new HashSet<>();
		DescribeNatGatewaysRequest request = new DescribeNatGatewaysRequest();
		do {
			DescribeNatGatewaysResult result = call(() -> ec2.describeNatGateways(request));
			for (NatGateway gateway : result.getNatGateways()) {
				for (NatGatewayAddress address : gateway.getNatGatewayAddresses()) {
					if (address.getAllocationId() != null) {
						ids.add(address.getAllocationId());
					}
				}
			}
			request.setNextToken(result.getNextToken());
		} while (tokenHasNext(request.getNextToken()));
		return ids;
	}
}
