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
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * Lexical decomposition of an action method name, e.g. {@code getUserCommentsAction} into verb {@code get} and fragments {@code [User, Comments]}.
 */
@ThreadSafe
record ActionName(
		@NonNull
		String verb,
		@NonNull
		List<@NonNull String> fragments
) {
	ActionName {
		requireNonNull(verb);
		requireNonNull(fragments);

		fragments = List.copyOf(fragments);
	}
}
