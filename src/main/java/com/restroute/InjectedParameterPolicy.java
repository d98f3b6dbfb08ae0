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

import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * Decides whether a controller action parameter type is supplied by the surrounding framework
 * (the current request, a validation-errors holder, a query-parameter fetcher...) rather than by the URL.
 * <p>
 * Parameters of such types are not routable: they never become path placeholders.
 */
@FunctionalInterface
public interface InjectedParameterPolicy {
	/**
	 * Is a parameter of type {@code parameterType} injected by the framework?
	 *
	 * @param parameterType the declared parameter type
	 * @return {@code true} if the parameter is framework-injected and therefore not routable
	 */
	@NonNull
	Boolean isFrameworkInjected(@NonNull Class<?> parameterType);

	/**
	 * Acquires a policy under which every parameter is routable.
	 *
	 * @return a policy that injects nothing
	 */
	@NonNull
	static InjectedParameterPolicy injectingNothing() {
		return parameterType -> false;
	}

	/**
	 * Acquires a policy which treats a parameter as injected if its type is, or derives from, any of {@code injectedTypes}.
	 *
	 * @param injectedTypes the framework-injected types
	 * @return a policy backed by {@code injectedTypes}
	 */
	@NonNull
	static InjectedParameterPolicy forTypes(@NonNull Set<@NonNull Class<?>> injectedTypes) {
		requireNonNull(injectedTypes);

		Set<Class<?>> injectedTypesCopy = Set.copyOf(injectedTypes);

		return parameterType -> {
			requireNonNull(parameterType);

			for (Class<?> injectedType : injectedTypesCopy)
				if (injectedType.isAssignableFrom(parameterType))
					return true;

			return false;
		};
	}
}
