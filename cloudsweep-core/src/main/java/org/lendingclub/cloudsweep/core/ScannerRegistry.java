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

import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Modifier;
import java.util.ArrayList;
import java.util.Collection;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;

import org.slf4j.Logger;
import org.slf4j.LoggerFactory;

import com.google.common.base.Preconditions;
import com.google.common.collect.ImmutableList;
import com.google.common.collect.ImmutableMap;
import com.google.common.collect.Ordering;

/**
 * Catalog of scanner plugins keyed by alias.
 * <p>
 * The registry is filled once at startup and then sealed. After {@link #seal()} the backing map is immutable, so
 * the registry can be read from any number of worker threads without locking. Lookups accept the alias, the label
 * or the simple type name of the plugin, tried in that order.
 */
public class ScannerRegistry<C> {

	private static final Logger logger = LoggerFactory.getLogger(ScannerRegistry.class);

	private final ScannerSettings settings;
	private volatile Map<String, ScannerDescriptor<C>> descriptors = new LinkedHashMap<>();
	private volatile boolean sealed = false;

	public ScannerRegistry() {
		this(ScannerSettings.defaults());
	}

	public ScannerRegistry(ScannerSettings settings) {
		Preconditions.checkNotNull(settings, "settings cannot be null");
		this.settings = settings;
	}

	public ScannerSettings getSettings() {
		return settings;
	}

	public synchronized ScannerRegistry<C> register(ScannerDescriptor<C> descriptor) {
		Preconditions.checkNotNull(descriptor, "descriptor cannot be null");
		if (sealed) {
			throw new RegistrationException(
					"registry is sealed; cannot register '" + descriptor.getAlias() + "' after startup");
		}
		if (descriptors.containsKey(descriptor.getAlias())) {
			throw new RegistrationException("scanner alias '" + descriptor.getAlias() + "' is already registered to "
					+ descriptors.get(descriptor.getAlias()).getTypeName());
		}
		descriptors.put(descriptor.getAlias(), descriptor);
		logger.debug("registered {}", descriptor);
		return this;
	}

	public ScannerRegistry<C> register(ResourceScanner<C> scanner) {
		return register(ScannerDescriptor.of(scanner));
	}

	/**
	 * Registers a scanner by type. The type must implement {@link ResourceScanner} and have a public constructor that
	 * takes either {@link ScannerSettings} or no arguments.
	 */
	@SuppressWarnings("unchecked")
	public ScannerRegistry<C> register(Class<?> type) {
		Preconditions.checkNotNull(type, "type cannot be null");
		if (!ResourceScanner.class.isAssignableFrom(type) || type.isInterface()
				|| Modifier.isAbstract(type.getModifiers())) {
			throw new RegistrationException(type.getName() + " is not a recognized scanner");
		}
		return register((ResourceScanner<C>) instantiate(type));
	}

	private Object instantiate(Class<?> type) {
		try {
			Optional<Constructor<?>> withSettings = findConstructor(type, ScannerSettings.class);
			if (withSettings.isPresent()) {
				return withSettings.get().newInstance(settings);
			}
			Optional<Constructor<?>> noArgs = findConstructor(type);
			if (noArgs.isPresent()) {
				return noArgs.get().newInstance();
			}
		} catch (InstantiationException | IllegalAccessException | InvocationTargetException e) {
			throw new RegistrationException("could not construct scanner " + type.getName(), e);
		}
		throw new RegistrationException(type.getName()
				+ " is not a recognized scanner: no public constructor taking ScannerSettings or no arguments");
	}

	private Optional<Constructor<?>> findConstructor(Class<?> type, Class<?>... parameterTypes) {
		try {
			return Optional.of(type.getConstructor(parameterTypes));
		} catch (NoSuchMethodException e) {
			return Optional.empty();
		}
	}

	/**
	 * Makes the registry read-only. Calling it more than once has no further effect.
	 */
	public synchronized ScannerRegistry<C> seal() {
		if (!sealed) {
			descriptors = ImmutableMap.copyOf(descriptors);
			sealed = true;
			logger.info("scanner registry sealed with {} scanners: {}", descriptors.size(), list());
		}
		return this;
	}

	public boolean isSealed() {
		return sealed;
	}

	public ScannerDescriptor<C> resolve(String identifier) {
		if (identifier == null) {
			throw new ScannerNotFoundException(null);
		}
		String id = identifier.trim();
		Map<String, ScannerDescriptor<C>> snapshot = descriptors;

		ScannerDescriptor<C> descriptor = snapshot.get(id);
		if (descriptor != null) {
			return descriptor;
		}
		for (ScannerDescriptor<C> d : snapshot.values()) {
			if (d.getAlias().equalsIgnoreCase(id)) {
				return d;
			}
		}
		for (ScannerDescriptor<C> d : snapshot.values()) {
			if (d.getLabel().equalsIgnoreCase(id)) {
				logger.debug("resolved '{}' by label to {}", id, d.getAlias());
				return d;
			}
		}
		for (ScannerDescriptor<C> d : snapshot.values()) {
			if (d.getTypeName().equalsIgnoreCase(id)) {
				logger.debug("resolved '{}' by type name to {}", id, d.getAlias());
				return d;
			}
		}
		throw new ScannerNotFoundException(id);
	}

	/**
	 * Resolves every identifier up front. Duplicates (including the same scanner named two different ways) are
	 * collapsed; request order is preserved.
	 */
	public List<ScannerDescriptor<C>> resolveAll(Collection<String> identifiers) {
		Map<String, ScannerDescriptor<C>> resolved = new LinkedHashMap<>();
		for (String identifier : identifiers) {
			ScannerDescriptor<C> d = resolve(identifier);
			resolved.putIfAbsent(d.getAlias(), d);
		}
		return ImmutableList.copyOf(resolved.values());
	}

	/**
	 * Registered aliases in alphabetical order.
	 */
	public List<String> list() {
		return Ordering.natural().immutableSortedCopy(descriptors.keySet());
	}

	public List<ScannerDescriptor<C>> getDescriptors() {
		List<ScannerDescriptor<C>> result = new ArrayList<>();
		for (String alias : list()) {
			result.add(descriptors.get(alias));
		}
		return result;
	}

	public int size() {
		return descriptors.size();
	}
}
