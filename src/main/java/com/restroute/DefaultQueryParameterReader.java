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

import com.restroute.annotation.QueryParameter;
import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import static java.util.Objects.requireNonNull;

/**
 * @see QueryParameterReader#defaultInstance()
 */
@ThreadSafe
final class DefaultQueryParameterReader implements QueryParameterReader {
	@NonNull
	private static final DefaultQueryParameterReader DEFAULT_INSTANCE;

	static {
		DEFAULT_INSTANCE = new DefaultQueryParameterReader();
	}

	@NonNull
	public static DefaultQueryParameterReader defaultInstance() {
		return DEFAULT_INSTANCE;
	}

	private DefaultQueryParameterReader() {
		// Only one instance needed
	}

	@NonNull
	@Override
	public Set<@NonNull String> getParamsFromMethod(@NonNull Method method) {
		requireNonNull(method);

		Set<String> parameterNames = new LinkedHashSet<>();

		// The Java name is what matters here, not the query-string name the annotation may declare
		for (Parameter parameter : method.getParameters())
			if (parameter.isAnnotationPresent(QueryParameter.class))
				parameterNames.add(parameter.getName());

		return Collections.unmodifiableSet(parameterNames);
	}
}
