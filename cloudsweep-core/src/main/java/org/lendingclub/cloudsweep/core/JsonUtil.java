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

import org.slf4j.Logger;

import com.fasterxml.jackson.core.JsonProcessingException;
import com.fasterxml.jackson.databind.ObjectMapper;
import com.fasterxml.jackson.databind.ObjectWriter;
import com.fasterxml.jackson.databind.SerializationFeature;
import com.fasterxml.jackson.datatype.jsr310.JavaTimeModule;

/**
 * Shared Jackson mapper for reports and log output. Instants are written as ISO-8601 strings.
 */
public class JsonUtil {

	private static final ObjectMapper mapper = new ObjectMapper().registerModule(new JavaTimeModule())
			.disable(SerializationFeature.WRITE_DATES_AS_TIMESTAMPS);
	private static final ObjectWriter prettyWriter = mapper.writerWithDefaultPrettyPrinter();

	public static ObjectMapper getObjectMapper() {
		return mapper;
	}

	/**
	 * @throws CloudsweepException if the value cannot be serialized
	 */
	public static String prettyFormat(Object value) {
		try {
			return prettyWriter.writeValueAsString(value);
		} catch (JsonProcessingException e) {
			throw new CloudsweepException("could not serialize " + value.getClass().getSimpleName(), e);
		}
	}

	/**
	 * Logs the value as indented JSON at debug level. Serialization is skipped unless debug is enabled.
	 */
	public static void logDebug(Logger log, String message, Object value) {
		if (log == null || !log.isDebugEnabled()) {
			return;
		}
		try {
			log.debug("{} - \n{}", message, prettyFormat(value));
		} catch (CloudsweepException e) {
			log.warn("could not log {}: {}", message, e.toString());
		}
	}
}
