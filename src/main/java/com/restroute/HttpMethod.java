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

import java.util.Arrays;
import java.util.Collections;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.function.Function;
import java.util.stream.Collectors;

/**
 * The HTTP request methods recognized by action-name parsing.
 * <p>
 * An action verb that does not map to one of these values (for example {@code lock} in {@code lockUserAction})
 * is treated as a <em>custom verb</em> and becomes a trailing literal path segment.
 */
public enum HttpMethod {
	/**
	 * The HTTP <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Methods/GET">{@code GET}</a> request method.
	 */
	GET,
	/**
	 * The HTTP <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Methods/POST">{@code POST}</a> request method.
	 */
	POST,
	/**
	 * The HTTP <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Methods/PUT">{@code PUT}</a> request method.
	 */
	PUT,
	/**
	 * The HTTP <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Methods/PATCH">{@code PATCH}</a> request method.
	 */
	PATCH,
	/**
	 * The HTTP <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Methods/DELETE">{@code DELETE}</a> request method.
	 */
	DELETE,
	/**
	 * The {@code LINK} request method from <a href="https://datatracker.ietf.org/doc/html/draft-snell-link-method">draft-snell-link-method</a>.
	 */
	LINK,
	/**
	 * The {@code UNLINK} request method from <a href="https://datatracker.ietf.org/doc/html/draft-snell-link-method">draft-snell-link-method</a>.
	 */
	UNLINK,
	/**
	 * The HTTP <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Methods/HEAD">{@code HEAD}</a> request method.
	 */
	HEAD,
	/**
	 * The HTTP <a href="https://developer.mozilla.org/en-US/docs/Web/HTTP/Methods/OPTIONS">{@code OPTIONS}</a> request method.
	 */
	OPTIONS;

	@NonNull
	private static final Set<HttpMethod> VALUES_AS_SET;
	@NonNull
	private static final Map<String, HttpMethod> VALUES_BY_TOKEN;

	static {
		VALUES_AS_SET = Arrays.stream(HttpMethod.values()).collect(Collectors.toUnmodifiableSet());
		VALUES_BY_TOKEN = Collections.unmodifiableMap(Arrays.stream(HttpMethod.values())
				.collect(Collectors.toMap(HttpMethod::getToken, Function.identity())));
	}

	/**
	 * Exposes {@link HttpMethod#values()} as a {@link Set} for convenience.
	 *
	 * @return a {@link Set} representation of this enum's values
	 */
	@NonNull
	public static Set<HttpMethod> valuesAsSet() {
		return VALUES_AS_SET;
	}

	/**
	 * Looks up the HTTP method whose lowercase token is exactly {@code token}, e.g. {@code "get"} for {@link #GET}.
	 * <p>
	 * Matching is case-sensitive: action verbs are lowercased before lookup.
	 *
	 * @param token the lowercase verb token
	 * @return the matching HTTP method, or {@link Optional#empty()} if {@code token} is a custom verb
	 */
	@NonNull
	public static Optional<HttpMethod> fromToken(@Nullable String token) {
		if (token == null)
			return Optional.empty();

		return Optional.ofNullable(VALUES_BY_TOKEN.get(token));
	}

	/**
	 * The lowercase token for this HTTP method as it appears in action names, e.g. {@code "get"}.
	 *
	 * @return the lowercase token
	 */
	@NonNull
	public String getToken() {
		return name().toLowerCase(Locale.ROOT);
	}
}
