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

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;
import java.util.Optional;
import java.util.Set;
import java.util.stream.Collectors;

import static java.util.Objects.requireNonNull;

/**
 * Explicit lexer for action method names of the form {@code <verb><Fragment>*Action}.
 * <p>
 * The verb is a lowercase run of at least two characters from {@code [a-z0-9_]} starting with a letter.
 * Each fragment starts with an uppercase ASCII letter and runs until the next one.
 */
@ThreadSafe
final class ActionNameParser {
	@NonNull
	static final String ACTION_SUFFIX;
	@NonNull
	static final String COLLECTION_MARKER;
	@NonNull
	private static final Set<String> COLLECTION_VERBS;

	static {
		ACTION_SUFFIX = "Action";
		COLLECTION_MARKER = "c";
		COLLECTION_VERBS = HttpMethod.valuesAsSet().stream()
				.map(HttpMethod::getToken)
				.collect(Collectors.toUnmodifiableSet());
	}

	private ActionNameParser() {
		// Non-instantiable
	}

	/**
	 * Splits {@code methodName} into verb and fragments.
	 *
	 * @param methodName the Java method name
	 * @return the parsed name, or {@link Optional#empty()} if the name does not follow the action convention
	 */
	@NonNull
	static Optional<ActionName> parse(@Nullable String methodName) {
		if (methodName == null || !methodName.endsWith(ACTION_SUFFIX))
			return Optional.empty();

		String stem = methodName.substring(0, methodName.length() - ACTION_SUFFIX.length());

		if (stem.length() < 2 || !Utilities.isAsciiLowercase(stem.charAt(0)))
			return Optional.empty();

		int verbEnd = 1;

		while (verbEnd < stem.length() && isVerbCharacter(stem.charAt(verbEnd)))
			++verbEnd;

		if (verbEnd < 2)
			return Optional.empty();

		String remainder = stem.substring(verbEnd);

		if (remainder.length() > 0 && !Utilities.isAsciiUppercase(remainder.charAt(0)))
			return Optional.empty();

		return Optional.of(new ActionName(stem.substring(0, verbEnd), Utilities.splitAtUppercase(remainder)));
	}

	/**
	 * Resolves collection semantics and the full resource list for a lexed action name.
	 *
	 * @param actionName    the lexed name
	 * @param seedResources resources contributed by the controller, outermost first
	 * @param pluralization whether the terminal seed resource of a collection action is pluralized
	 * @param inflector     the pluralizer
	 * @return the parsed action; resources are seed followed by name fragments. A collection action is inflectable
	 * unless pluralizing its terminal seed resource left the name unchanged
	 */
	@NonNull
	static ParsedAction parseAction(@NonNull ActionName actionName,
																	@NonNull List<@NonNull String> seedResources,
																	@NonNull Pluralization pluralization,
																	@NonNull Inflector inflector) {
		requireNonNull(actionName);
		requireNonNull(seedResources);
		requireNonNull(pluralization);
		requireNonNull(inflector);

		String httpMethod = actionName.verb().toLowerCase(Locale.ROOT);
		boolean collection = false;
		boolean inflectable = true;

		if (httpMethod.startsWith(COLLECTION_MARKER) && COLLECTION_VERBS.contains(httpMethod.substring(COLLECTION_MARKER.length()))) {
			collection = true;
			httpMethod = httpMethod.substring(COLLECTION_MARKER.length());
		} else if (httpMethod.equals("options")) {
			collection = true;
		}

		List<String> resources = new ArrayList<>(seedResources);

		if (collection && resources.size() > 0) {
			int lastIndex = resources.size() - 1;
			String resource = resources.get(lastIndex);
			String pluralResource = pluralization == Pluralization.NEVER ? resource : inflector.pluralize(resource);

			inflectable = !pluralResource.equals(resource);
			resources.set(lastIndex, pluralResource);
		}

		resources.addAll(actionName.fragments());

		return new ParsedAction(httpMethod, resources, collection, inflectable);
	}

	private static boolean isVerbCharacter(char c) {
		return Utilities.isAsciiLowercase(c) || (c >= '0' && c <= '9') || c == '_';
	}
}
