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

/**
 * Contract for turning a singular resource name into its plural form, e.g. {@code comment} into {@code comments}.
 * <p>
 * Implementations must return the input unchanged for nouns whose plural is spelled like the singular
 * (e.g. {@code sheep}); route derivation uses that to detect non-inflectable collections.
 * <p>
 * A standard threadsafe English implementation can be acquired via the {@link #defaultInstance()} factory method.
 */
@FunctionalInterface
public interface Inflector {
	/**
	 * Pluralizes {@code word}.
	 *
	 * @param word the singular word
	 * @return the plural form of {@code word}
	 */
	@NonNull
	String pluralize(@NonNull String word);

	/**
	 * Acquires a threadsafe English {@link Inflector}.
	 *
	 * @return the default {@code Inflector}
	 */
	@NonNull
	static Inflector defaultInstance() {
		return DefaultInflector.defaultInstance();
	}
}
