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

import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;

import com.fasterxml.jackson.annotation.JsonCreator;
import com.fasterxml.jackson.annotation.JsonInclude;
import com.fasterxml.jackson.annotation.JsonProperty;
import com.fasterxml.jackson.annotation.JsonPropertyOrder;
import com.google.common.base.MoreObjects;
import com.google.common.base.Preconditions;
import com.google.common.base.Strings;

/**
 * One resource a scanner considers unused, with the reason. Scanners may attach arbitrary extra attributes (size,
 * creation time, last use) and an optional cost breakdown. The orchestration code passes findings through untouched.
 */
@JsonInclude(JsonInclude.Include.NON_EMPTY)
@JsonPropertyOrder({ "resourceId", "resourceName", "reason", "attributes", "cost" })
public class Finding {

	private final String resourceId;
	private final String resourceName;
	private final String reason;
	private final Map<String, Object> attributes;
	private final Map<String, Object> cost;

	@JsonCreator
	Finding(@JsonProperty("resourceId") String resourceId, @JsonProperty("resourceName") String resourceName,
			@JsonProperty("reason") String reason, @JsonProperty("attributes") Map<String, Object> attributes,
			@JsonProperty("cost") Map<String, Object> cost) {
		this.resourceId = resourceId;
		this.resourceName = resourceName;
		this.reason = reason;
		this.attributes = attributes == null ? Collections.emptyMap()
				: Collections.unmodifiableMap(new LinkedHashMap<>(attributes));
		this.cost = cost == null ? Collections.emptyMap() : Collections.unmodifiableMap(new LinkedHashMap<>(cost));
	}

	public static Builder builder(String resourceId) {
		return new Builder(resourceId);
	}

	public String getResourceId() {
		return resourceId;
	}

	public String getResourceName() {
		return resourceName;
	}

	public String getReason() {
		return reason;
	}

	public Map<String, Object> getAttributes() {
		return attributes;
	}

	public Map<String, Object> getCost() {
		return cost;
	}

	@Override
	public boolean equals(Object o) {
		if (this == o) {
			return true;
		}
		if (!(o instanceof Finding)) {
			return false;
		}
		Finding other = (Finding) o;
		return Objects.equals(resourceId, other.resourceId) && Objects.equals(resourceName, other.resourceName)
				&& Objects.equals(reason, other.reason) && attributes.equals(other.attributes)
				&& cost.equals(other.cost);
	}

	@Override
	public int hashCode() {
		return Objects.hash(resourceId, resourceName, reason, attributes, cost);
	}

	@Override
	public String toString() {
		return MoreObjects.toStringHelper(this).omitNullValues().add("resourceId", resourceId)
				.add("resourceName", resourceName).add("reason", reason).toString();
	}

	public static class Builder {
		private final String resourceId;
		private String resourceName;
		private String reason;
		private final Map<String, Object> attributes = new LinkedHashMap<>();
		private final Map<String, Object> cost = new LinkedHashMap<>();

		Builder(String resourceId) {
			Preconditions.checkArgument(!Strings.isNullOrEmpty(resourceId), "resourceId cannot be empty");
			this.resourceId = resourceId;
		}

		public Builder withName(String name) {
			this.resourceName = name;
			return this;
		}

		public Builder withReason(String reason) {
			this.reason = reason;
			return this;
		}

		public Builder withAttribute(String key, Object value) {
			if (value != null) {
				attributes.put(key, value);
			}
			return this;
		}

		public Builder withCost(String key, Object value) {
			if (value != null) {
				cost.put(key, value);
			}
			return this;
		}

		public Finding build() {
			return new Finding(resourceId, resourceName, reason, attributes, cost);
		}
	}
}
