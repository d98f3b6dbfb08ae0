/*
 * Copyright 2022-2026 Revetware LLC.
 *
 * Licensed under the Apache License, Version 2.0 (the "License");
 * you may not use this file except in compliance with the License.
 * You may obtain a copy of the License at
 *
 * http://www.apache.org/licenses/LICENSE-2.0
 *
 * Unless required by applicable law or agreed to in writing, software
 * distributed under the License is distributed on an "AS IS" BASIS,
 * WITHOUT WARRANTIES OR CONDITIONS OF ANY KIND, either express or implied.
 * See the License for the specific language governing permissions and
 * limitations under the License.
 */

package com.restroute;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Ordered, name-keyed collection of derived {@link Route}s.
 * <p>
 * Names are unique: adding a route under a name that is already taken fails instead of overwriting.
 * <p>
 * Instances can be acquired via the {@link #create()} factory method.
 * This class is intended for use by a single thread, typically for the duration of one controller scan.
 */
@NotThreadSafe
public final class RouteCollection {
	@NonNull
	private final Map<String, Route> routesByName;
	@Nullable
	private String singularName;

	/**
	 * Vends a new, empty route collection.
	 *
	 * @return an empty route collection
	 */
	@NonNull
	public static RouteCollection create() {
		return new RouteCollection();
	}

	private RouteCollection() {
		this.routesByName = new LinkedHashMap<>();
	}

	/**
	 * Registers {@code route} under {@code name}.
	 *
	 * @param name  the unique route name
	 * @param route the route to register
	 * @throws IllegalStateException if a route is already registered under {@code name}
	 */
	public void add(@NonNull String name,
									@NonNull Route route) {
		requireNonNull(name);
		requireNonNull(route);

		Route existingRoute = this.routesByName.get(name);

		if (existingRoute != null)
			throw new IllegalStateException(format("A route named '%s' is already registered. Existing route: %s. Rejected route: %s",
					name, existingRoute, route));

		this.routesByName.put(name, route);
	}

	/**
	 * The route registered under {@code name}, if any.
	 *
	 * @param name the route name
	 * @return the route, or {@link Optional#empty()} if no route has that name
	 */
	@NonNull
	public Optional<Route> get(@NonNull String name) {
		requireNonNull(name);
		return Optional.ofNullable(this.routesByName.get(name));
	}

	/**
	 * Records the singular resource name of the controller whose routes this collection holds,
	 * detected when an action addresses exactly one resource by one identifier (e.g. {@code getCommentAction(id)}).
	 *
	 * @param singularName the singular resource name
	 */
	public void setSingularName(@NonNull String singularName) {
		requireNonNull(singularName);
		this.singularName = singularName;
	}

	@NonNull
	public Optional<String> getSingularName() {
		return Optional.ofNullable(this.singularName);
	}

	/**
	 * All registered routes keyed by name, in registration order.
	 *
	 * @return an unmodifiable view of the registered routes
	 */
	@NonNull
	public Map<String, Route> getRoutes() {
		return Collections.unmodifiableMap(this.routesByName);
	}

	@NonNull
	public Integer size() {
		return this.routesByName.size();
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{singularName=%s, routes=%s}", getClass().getSimpleName(), getSingularName().orElse(null), getRoutes());
	}
}
