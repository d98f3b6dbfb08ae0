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
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Convention-derived route for one action, before declarations and format suffixes are applied.
 */
@ThreadSafe
record RouteDraft(
		@NonNull
		String path,
		@NonNull
		String httpMethod,
		@NonNull
		Map<@NonNull String, @NonNull String> defaults
) {
	RouteDraft {
		requireNonNull(path);
		requireNonNull(httpMethod);
		requireNonNull(defaults);

		defaults = Collections.unmodifiableMap(new LinkedHashMap<>(defaults));
	}
}
