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
package org.lendingclub.cloudsweep.cli;

import java.util.Collections;
import java.util.List;
import java.util.Optional;

import org.lendingclub.cloudsweep.aws.CloudsweepConfig;
import org.lendingclub.cloudsweep.core.ConfigurationException;

import com.google.common.base.MoreObjects;
import com.google.common.base.Splitter;

/**
 * Parsed command line. Options that were not given leave the environment-derived configuration alone.
 */
public class CommandLineOptions {

	static final String USAGE = String.join("\n", "usage: cloudsweep [options]",
			"  --profile <name>             AWS profile for the root identity",
			"  --organization-role <name>   role assumed in the root account to list accounts",
			"  --runner-role <name>         role assumed in every member account",
			"  --accounts <id,id,...>       only scan these accounts",
			"  --regions <r,r,...>          only scan these regions",
			"  --all-regions                scan every enabled region (default)",
			"  --scanners <s,s,...>         scanners to run, by alias or label",
			"  --all-scanners               run every scanner (default)",
			"  --list-scanners              print the available scanners and exit",
			"  --max-workers <n>            size of the worker pools",
			"  --days-threshold <n>         age in days after which a resource counts as unused",
			"  --output <file>              where to write the JSON report",
			"  --help                       print this message");

	private static final Splitter LIST_SPLITTER = Splitter.on(',').trimResults().omitEmptyStrings();

	private String profile;
	private String organizationRole;
	private String runnerRole;
	private List<String> accounts;
	private List<String> regions;
	private List<String> scanners;
	private Integer maxWorkers;
	private Integer daysThreshold;
	private String output;
	private boolean listScanners;
	private boolean help;

	public static CommandLineOptions parse(String... args) {
		CommandLineOptions options = new CommandLineOptions();
		for (int i = 0; i < args.length; i++) {
			String arg = args[i];
			switch (arg) {
			case "--profile":
				options.profile = value(args, ++i, arg);
				break;
			case "--organization-role":
				options.organizationRole = value(args, ++i, arg);
				break;
			case "--runner-role":
				options.runnerRole = value(args, ++i, arg);
				break;
			case "--accounts":
				options.accounts = list(value(args, ++i, arg));
				break;
			case "--regions":
				options.regions = list(value(args, ++i, arg));
				break;
			case "--all-regions":
				options.regions = Collections.emptyList();
				break;
			case "--scanners":
				options.scanners = list(value(args, ++i, arg));
				break;
			case "--all-scanners":
				options.scanners = Collections.emptyList();
				break;
			case "--list-scanners":
				options.listScanners = true;
				break;
			case "--max-workers":
				options.maxWorkers = number(value(args, ++i, arg), arg);
				break;
			case "--days-threshold":
				options.daysThreshold = number(value(args, ++i, arg), arg);
				break;
			case "--output":
				options.output = value(args, ++i, arg);
				break;
			case "-h":
			case "--help":
				options.help = true;
				break;
			default:
				throw new ConfigurationException("unknown option: " + arg);
			}
		}
		return options;
	}

	private static String value(String[] args, int i, String option) {
		if (i >= args.length || args[i].startsWith("--")) {
			throw new ConfigurationException(option + " requires a value");
		}
		return args[i];
	}

	private static List<String> list(String value) {
		if (CloudsweepConfig.ALL.equalsIgnoreCase(value.trim())) {
			return Collections.emptyList();
		}
		return LIST_SPLITTER.splitToList(value);
	}

	private static int number(String value, String option) {
		try {
			return Integer.parseInt(value.trim());
		} catch (NumberFormatException e) {
			throw new ConfigurationException(option + " expects a number but got '" + value + "'", e);
		}
	}

	/**
	 * Layers the options given on the command line over the builder's current values.
	 */
	public CloudsweepConfig.Builder applyTo(CloudsweepConfig.Builder builder) {
		if (profile != null) {
			builder.withProfile(profile);
		}
		if (organizationRole != null) {
			builder.withOrganizationRole(organizationRole);
		}
		if (runnerRole != null) {
			builder.withRunnerRole(runnerRole);
		}
		if (accounts != null) {
			builder.withAccounts(accounts);
		}
		if (regions != null) {
			builder.withRegions(regions);
		}
		if (scanners != null) {
			builder.withScanners(scanners);
		}
		if (maxWorkers != null) {
			builder.withMaxWorkers(maxWorkers);
		}
		if (daysThreshold != null) {
			builder.withDaysThreshold(daysThreshold);
		}
		return builder;
	}

	public boolean isListScanners() {
		return listScanners;
	}

	public boolean isHelp() {
		return help;
	}

	public Optional<String> getOutput() {
		return Optional.ofNullable(output);
	}

	@Override
	public String toString() {
		return MoreObjects.toStringHelper(this).omitNullValues().add("profile", profile)
				.add("organizationRole", organizationRole).add("runnerRole", runnerRole).add("accounts", accounts)
				.add("regions", regions).add("scanners", scanners).add("maxWorkers", maxWorkers)
				.add("daysThreshold", daysThreshold).add("output", output).toString();
	}
}
