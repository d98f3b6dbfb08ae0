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

import javax.annotation.concurrent.ThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Verb and resource list parsed from an action name plus the controller's seed resources.
 * <p>
 * {@code resources} holds the seed resources followed by the name fragments and excludes configured parents.
 */
@ThreadSafe
record ParsedAction(
		@NonNull
		String httpMethod,
		@NonNull
		List<@NonNull String> resources,
		@NonNull
		Boolean collection,
		@NonNull
		Boolean inflectable
) {
	ParsedAction {
		requireNonNull(httpMethod);
		requireNonNull(resources);
		requireNonNull(collection);
		requireNonNull(inflectable);

		resources = Collections.unmodifiableList(new ArrayList<>(resources));
	}
}
