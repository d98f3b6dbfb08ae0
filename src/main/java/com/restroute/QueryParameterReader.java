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
import java.util.Set;

/**
 * Contract for discovering which controller action parameters are bound from the query string.
 * <p>
 * Parameters named in the returned set never become path placeholders.
 * <p>
 * A standard threadsafe implementation which honors {@link com.restroute.annotation.QueryParameter} can be acquired
 * via the {@link #defaultInstance()} factory method.
 */
@FunctionalInterface
public interface QueryParameterReader {
	/**
	 * The Java parameter names of {@code method} that are consumed by query-string binding.
	 *
	 * @param method the controller action
	 * @return names of query-bound parameters, or the empty set if there are none
	 */
	@NonNull
	Set<@NonNull String> getParamsFromMethod(@NonNull Method method);

	/**
	 * Acquires a threadsafe {@link QueryParameterReader} which reports parameters annotated with {@link com.restroute.annotation.QueryParameter}.
	 *
	 * @return the default {@code QueryParameterReader}
	 */
	@NonNull
	static QueryParameterReader defaultInstance() {
		return DefaultQueryParameterReader.defaultInstance();
	}
}
