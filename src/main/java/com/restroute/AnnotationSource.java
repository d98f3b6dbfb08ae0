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
import java.util.Optional;

import static java.util.Objects.requireNonNull;

/**
 * Contract for supplying the {@link RouteDeclaration}s attached to controller classes and actions.
 * <p>
 * A standard threadsafe implementation which reads the Java annotations in {@link com.restroute.annotation}
 * can be acquired via the {@link #defaultInstance()} factory method.
 */
public interface AnnotationSource {
	/**
	 * All class-level declarations on {@code type}.
	 *
	 * @param type the controller class
	 * @return the class-level declarations, or the empty list if there are none
	 */
	@NonNull
	List<@NonNull RouteDeclaration> getClassDeclarations(@NonNull Class<?> type);

	/**
	 * All method-level declarations on {@code method}, in declaration order within each {@link RouteDeclarationType}.
	 *
	 * @param method the controller action
	 * @return the method-level declarations, or the empty list if there are none
	 */
	@NonNull
	List<@NonNull RouteDeclaration> getMethodDeclarations(@NonNull Method method);

	/**
	 * The first class-level declaration of the given type on {@code type}, if any.
	 */
	@NonNull
	default Optional<RouteDeclaration> getClassDeclaration(@NonNull Class<?> type,
																												 @NonNull RouteDeclarationType declarationType) {
		requireNonNull(type);
		requireNonNull(declarationType);

		return getClassDeclarations(type).stream()
				.filter(routeDeclaration -> routeDeclaration.getType() == declarationType)
				.findFirst();
	}

	/**
	 * The first method-level declaration of the given type on {@code method}, if any.
	 */
	@NonNull
	default Optional<RouteDeclaration> getMethodDeclaration(@NonNull Method method,
																													@NonNull RouteDeclarationType declarationType) {
		requireNonNull(method);
		requireNonNull(declarationType);

		return getMethodDeclarations(method).stream()
				.filter(routeDeclaration -> routeDeclaration.getType() == declarationType)
				.findFirst();
	}

	/**
	 * Acquires a threadsafe {@link AnnotationSource} which reads {@link com.restroute.annotation.Route},
	 * the verb annotations ({@link com.restroute.annotation.GET} etc.) and {@link com.restroute.annotation.NoRoute} via reflection.
	 *
	 * @return an {@code AnnotationSource} backed by Java annotations
	 */
	@NonNull
	static AnnotationSource defaultInstance() {
		return DefaultAnnotationSource.defaultInstance();
	}
}
