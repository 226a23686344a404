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
package org.lendingclub.cloudsweep.core;

import java.util.List;

/**
 * A stateless check that inspects one resource type using the given credential context and reports the resources
 * that look unused.
 *
 * @param <C> the credential context type the scanner runs against
 */
public interface ResourceScanner<C> {

	/**
	 * Short form used on the command line, e.g. <code>ebs-volumes</code>. Unique within a registry.
	 */
	String getAlias();

	/**
	 * Human readable form used in reports, e.g. <code>EBS Volumes</code>.
	 */
	String getLabel();

	/**
	 * Account-scoped scanners run once per account against the sentinel "Global" region rather than once per region.
	 */
	default boolean isAccountScoped() {
		return false;
	}

	List<Finding> scan(C context);
}
