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

import java.io.PrintStream;
import java.io.UncheckedIOException;
import java.nio.file.Paths;

import org.lendingclub.cloudsweep.aws.AwsCredentialContext;
import org.lendingclub.cloudsweep.aws.AwsScannerCatalog;
import org.lendingclub.cloudsweep.aws.CloudsweepConfig;
import org.lendingclub.cloudsweep.aws.CredentialBroker;
import org.lendingclub.cloudsweep.aws.ScanOrchestrator;
import org.lendingclub.cloudsweep.aws.ScanOutcome;
import org.lendingclub.cloudsweep.core.CloudsweepException;
import org.lendingclub.cloudsweep.core.ConfigurationException;
import org.lendingclub.cloudsweep.core.ScannerNotFoundException;
import org.lendingclub.cloudsweep.core.ScannerRegistry;
import org.slf4j.Logger;
import org.slf4j.LoggerFactory;
import org.slf4j.bridge.SLF4JBridgeHandler;

import com.google.common.annotations.VisibleForTesting;

public class Main {

	static final int OK = 0;
	static final int FAILED = 1;

	private static final Logger logger = LoggerFactory.getLogger(Main.class);

	public static void main(String[] args) {
		SLF4JBridgeHandler.removeHandlersForRootLogger();
		SLF4JBridgeHandler.install();

		System.exit(new Main().run(args, CloudsweepConfig.builder().withEnvironment(), System.out));
	}

	@VisibleForTesting
	int run(String[] args, CloudsweepConfig.Builder configBuilder, PrintStream out) {
		CommandLineOptions options;
		CloudsweepConfig config;
		try {
			options = CommandLineOptions.parse(args);
			if (options.isHelp()) {
				out.println(CommandLineOptions.USAGE);
				return OK;
			}
			config = options.applyTo(configBuilder).build();
		} catch (ConfigurationException e) {
			out.println(e.getMessage());
			out.println(CommandLineOptions.USAGE);
			return FAILED;
		}

		ScannerRegistry<AwsCredentialContext> registry = AwsScannerCatalog.newRegistry(config.toScannerSettings());
		if (options.isListScanners()) {
			registry.list().forEach(out::println);
			return OK;
		}

		logger.info("starting cloudsweep with {}", config);
		try {
			ScanOutcome outcome = new ScanOrchestrator(newBroker(config), registry).execute();
			new ScanReportWriter().write(outcome, options.getOutput().map(Paths::get).orElse(null));
			return OK;
		} catch (ScannerNotFoundException e) {
			out.println(e.getMessage());
			out.println("available scanners: " + String.join(", ", registry.list()));
			return FAILED;
		} catch (ConfigurationException e) {
			logger.error("configuration problem: {}", e.getMessage(), e);
			return FAILED;
		} catch (CloudsweepException | UncheckedIOException e) {
			logger.error("scan failed", e);
			return FAILED;
		}
	}

	@VisibleForTesting
	CredentialBroker newBroker(CloudsweepConfig config) {
		return new CredentialBroker(config);
	}
}
