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

import java.lang.reflect.Method;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Contract for deriving named HTTP routes from controller action methods.
 * <p>
 * An action is a public method named {@code <verb><Resource>*Action}, for example {@code getCommentAction(id)}.
 * The verb picks the HTTP method, the PascalCase fragments after it name nested resources and the routable parameters
 * become path placeholders, so {@code getCommentAction(post, id)} on a controller nested under a {@code post} parent
 * becomes {@code GET post/{post}/comment/{id}}. Route annotations such as {@link com.restroute.annotation.GET}
 * refine or replace the convention-derived route.
 * <p>
 * A standard threadsafe implementation can be acquired via the {@link #withConfig(RouteDeriverConfig)} factory method.
 */
public interface ActionRouteDeriver {
	/**
	 * Scans every action of {@code controllerClass} into a new collection.
	 *
	 * @param controllerClass the controller to scan
	 * @return the derived routes
	 * @throws IllegalArgumentException if a configured parent resource name is blank or ends with {@code /},
	 *                                  or if the controller's resource name cannot be determined
	 * @throws IllegalStateException    if two actions derive the same route name
	 */
	@NonNull
	default RouteCollection deriveRoutes(@NonNull Class<?> controllerClass) {
		requireNonNull(controllerClass);

		RouteCollection routeCollection = RouteCollection.create();
		deriveRoutes(controllerClass, routeCollection);
		return routeCollection;
	}

	/**
	 * Scans every action of {@code controllerClass} into {@code routeCollection}.
	 * <p>
	 * Seed resources come from {@link com.restroute.annotation.RouteResource} or, for a {@link ClassResource}, from the class name.
	 * Methods are read in a stable order and unprefixed collection aliases are registered after every other route of the scan.
	 * <p>
	 * If derivation fails partway, routes already written stay in {@code routeCollection}.
	 *
	 * @param controllerClass the controller to scan
	 * @param routeCollection the collection to write into
	 * @throws IllegalArgumentException if a configured parent resource name is blank or ends with {@code /},
	 *                                  or if the controller's resource name cannot be determined
	 * @throws IllegalStateException    if a derived route name is already registered
	 */
	void deriveRoutes(@NonNull Class<?> controllerClass,
										@NonNull RouteCollection routeCollection);

	/**
	 * Derives the routes for a single action and writes them into {@code routeCollection}.
	 *
	 * @param method          the action
	 * @param seedResources   resources contributed by the controller, outermost first
	 * @param routeCollection the collection to write into
	 * @throws IllegalArgumentException if a configured parent resource name is blank or ends with {@code /}
	 * @throws IllegalStateException    if a derived route name is already registered
	 */
	void deriveRoutes(@NonNull Method method,
										@NonNull List<@NonNull String> seedResources,
										@NonNull RouteCollection routeCollection);

	/**
	 * The configuration this deriver was created with.
	 *
	 * @return the configuration
	 */
	@NonNull
	RouteDeriverConfig getRouteDeriverConfig();

	/**
	 * Acquires a threadsafe {@link ActionRouteDeriver} for {@code routeDeriverConfig}.
	 *
	 * @param routeDeriverConfig the configuration to derive with
	 * @return an {@code ActionRouteDeriver} for the configuration
	 */
	@NonNull
	static ActionRouteDeriver withConfig(@NonNull RouteDeriverConfig routeDeriverConfig) {
		requireNonNull(routeDeriverConfig);
		return new DefaultActionRouteDeriver(routeDeriverConfig);
	}
}
