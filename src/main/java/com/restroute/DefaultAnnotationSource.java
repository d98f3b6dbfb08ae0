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

import com.restroute.annotation.DELETE;
import com.restroute.annotation.GET;
import com.restroute.annotation.HEAD;
import com.restroute.annotation.LINK;
import com.restroute.annotation.NoRoute;
import com.restroute.annotation.OPTIONS;
import com.restroute.annotation.PATCH;
import com.restroute.annotation.POST;
import com.restroute.annotation.PUT;
import com.restroute.annotation.Route;
import com.restroute.annotation.UNLINK;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.lang.reflect.AnnotatedElement;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;

import static com.restroute.Utilities.trimAggressively;
import static com.restroute.Utilities.trimAggressivelyToNull;
import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Reads route declarations from the Java annotations in {@link com.restroute.annotation}.
 * <p>
 * Repeated annotations (e.g. two {@link GET}s on one method) are unwrapped from their containers.
 */
@ThreadSafe
final class DefaultAnnotationSource implements AnnotationSource {
	@NonNull
	private static final DefaultAnnotationSource DEFAULT_INSTANCE;

	static {
		DEFAULT_INSTANCE = new DefaultAnnotationSource();
	}

	@NonNull
	public static DefaultAnnotationSource defaultInstance() {
		return DEFAULT_INSTANCE;
	}

	private DefaultAnnotationSource() {
		// Only one instance needed
	}

	@NonNull
	@Override
	public List<@NonNull RouteDeclaration> getClassDeclarations(@NonNull Class<?> type) {
		requireNonNull(type);

		if (type.isAnnotationPresent(NoRoute.class))
			return List.of(RouteDeclaration.withType(RouteDeclarationType.NO_ROUTE).build());

		return List.of();
	}

	@NonNull
	@Override
	public List<@NonNull RouteDeclaration> getMethodDeclarations(@NonNull Method method) {
		requireNonNull(method);

		List<RouteDeclaration> routeDeclarations = new ArrayList<>();

		for (Route route : method.getAnnotationsByType(Route.class))
			routeDeclarations.add(RouteDeclaration.withType(RouteDeclarationType.GENERIC)
					.path(trimAggressivelyToNull(route.value()))
					.name(trimAggressivelyToNull(route.name()))
					.methods(Arrays.asList(route.methods()))
					.requirements(parseEntries(route.requirements(), "requirements", method))
					.options(parseEntries(route.options(), "options", method))
					.defaults(parseEntries(route.defaults(), "defaults", method))
					.host(trimAggressivelyToNull(route.host()))
					.schemes(Arrays.asList(route.schemes()))
					.condition(trimAggressivelyToNull(route.condition()))
					.build());

		for (GET get : method.getAnnotationsByType(GET.class))
			routeDeclarations.add(verbDeclaration(RouteDeclarationType.GET, method, get.value(), get.name(), get.requirements(),
					get.options(), get.defaults(), get.host(), get.schemes(), get.condition()));

		for (POST post : method.getAnnotationsByType(POST.class))
			routeDeclarations.add(verbDeclaration(RouteDeclarationType.POST, method, post.value(), post.name(), post.requirements(),
					post.options(), post.defaults(), post.host(), post.schemes(), post.condition()));

		for (PUT put : method.getAnnotationsByType(PUT.class))
			routeDeclarations.add(verbDeclaration(RouteDeclarationType.PUT, method, put.value(), put.name(), put.requirements(),
					put.options(), put.defaults(), put.host(), put.schemes(), put.condition()));

		for (PATCH patch : method.getAnnotationsByType(PATCH.class))
			routeDeclarations.add(verbDeclaration(RouteDeclarationType.PATCH, method, patch.value(), patch.name(), patch.requirements(),
					patch.options(), patch.defaults(), patch.host(), patch.schemes(), patch.condition()));

		for (DELETE delete : method.getAnnotationsByType(DELETE.class))
			routeDeclarations.add(verbDeclaration(RouteDeclarationType.DELETE, method, delete.value(), delete.name(), delete.requirements(),
					delete.options(), delete.defaults(), delete.host(), delete.schemes(), delete.condition()));

		for (LINK link : method.getAnnotationsByType(LINK.class))
			routeDeclarations.add(verbDeclaration(RouteDeclarationType.LINK, method, link.value(), link.name(), link.requirements(),
					link.options(), link.defaults(), link.host(), link.schemes(), link.condition()));

		for (UNLINK unlink : method.getAnnotationsByType(UNLINK.class))
			routeDeclarations.add(verbDeclaration(RouteDeclarationType.UNLINK, method, unlink.value(), unlink.name(), unlink.requirements(),
					unlink.options(), unlink.defaults(), unlink.host(), unlink.schemes(), unlink.condition()));

		for (HEAD head : method.getAnnotationsByType(HEAD.class))
			routeDeclarations.add(verbDeclaration(RouteDeclarationType.HEAD, method, head.value(), head.name(), head.requirements(),
					head.options(), head.defaults(), head.host(), head.schemes(), head.condition()));

		for (OPTIONS options : method.getAnnotationsByType(OPTIONS.class))
			routeDeclarations.add(verbDeclaration(RouteDeclarationType.OPTIONS, method, options.value(), options.name(), options.requirements(),
					options.options(), options.defaults(), options.host(), options.schemes(), options.condition()));

		if (method.isAnnotationPresent(NoRoute.class))
			routeDeclarations.add(RouteDeclaration.withType(RouteDeclarationType.NO_ROUTE).build());

		return Collections.unmodifiableList(routeDeclarations);
	}

	@NonNull
	private RouteDeclaration verbDeclaration(@NonNull RouteDeclarationType type,
																					 @NonNull Method method,
																					 @NonNull String path,
																					 @NonNull String name,
																					 @NonNull String[] requirements,
																					 @NonNull String[] options,
																					 @NonNull String[] defaults,
																					 @NonNull String host,
																					 @NonNull String[] schemes,
																					 @NonNull String condition) {
		return RouteDeclaration.withType(type)
				.path(trimAggressivelyToNull(path))
				.name(trimAggressivelyToNull(name))
				.requirements(parseEntries(requirements, "requirements", method))
				.options(parseEntries(options, "options", method))
				.defaults(parseEntries(defaults, "defaults", method))
				.host(trimAggressivelyToNull(host))
				.schemes(Arrays.asList(schemes))
				.condition(trimAggressivelyToNull(condition))
				.build();
	}

	/**
	 * Turns {@code name=value} annotation entries into an ordered map, splitting each entry at its first {@code =}.
	 */
	@NonNull
	static Map<String, String> parseEntries(@Nullable String[] entries,
																					@NonNull String attributeName,
																					@NonNull AnnotatedElement annotatedElement) {
		requireNonNull(attributeName);
		requireNonNull(annotatedElement);

		if (entries == null || entries.length == 0)
			return Map.of();

		Map<String, String> parsedEntries = new LinkedHashMap<>(entries.length);

		for (String entry : entries) {
			int separatorIndex = entry == null ? -1 : entry.indexOf('=');
			String name = separatorIndex < 0 ? null : trimAggressivelyToNull(entry.substring(0, separatorIndex));

			if (name == null)
				throw new IllegalArgumentException(format("Illegal entry '%s' in '%s' of %s. Entries must have the form name=value",
						entry, attributeName, annotatedElement));

			parsedEntries.put(name, trimAggressively(entry.substring(separatorIndex + 1)));
		}

		return Collections.unmodifiableMap(parsedEntries);
	}
}
