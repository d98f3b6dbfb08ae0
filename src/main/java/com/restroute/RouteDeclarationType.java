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

import java.util.Optional;

/**
 * Kinds of {@link RouteDeclaration}.
 * <p>
 * Declaration order is significant: when an action carries several declarations, routes are materialized
 * type by type in the order listed here.
 */
public enum RouteDeclarationType {
	/**
	 * A generic route declaration whose HTTP methods, if any, are listed explicitly.
	 */
	GENERIC(null),
	GET(HttpMethod.GET),
	POST(HttpMethod.POST),
	PUT(HttpMethod.PUT),
	PATCH(HttpMethod.PATCH),
	DELETE(HttpMethod.DELETE),
	LINK(HttpMethod.LINK),
	UNLINK(HttpMethod.UNLINK),
	HEAD(HttpMethod.HEAD),
	OPTIONS(HttpMethod.OPTIONS),
	/**
	 * Excludes an action (or a whole controller) from route derivation. Never materialized into a route.
	 */
	NO_ROUTE(null);

	private final HttpMethod httpMethod;

	RouteDeclarationType(HttpMethod httpMethod) {
		this.httpMethod = httpMethod;
	}

	/**
	 * The HTTP method implied by this declaration type.
	 *
	 * @return the implied HTTP method, or {@link Optional#empty()} for {@link #GENERIC} and {@link #NO_ROUTE}
	 */
	@NonNull
	public Optional<HttpMethod> getHttpMethod() {
		return Optional.ofNullable(this.httpMethod);
	}

	/**
	 * Does this declaration type produce a route?
	 *
	 * @return {@code true} for every type except {@link #NO_ROUTE}
	 */
	@NonNull
	public Boolean isRouteProducing() {
		return this != NO_ROUTE;
	}
}
