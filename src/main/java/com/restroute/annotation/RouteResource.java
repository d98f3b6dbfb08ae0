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

package com.restroute.annotation;

import com.restroute.Pluralization;
import org.jspecify.annotations.NonNull;

import java.lang.annotation.ElementType;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Names the resource a controller exposes, seeding every action's resource list during a controller scan.
 * <p>
 * Nested resources are separated with {@code _}: {@code @RouteResource("user_post")} seeds {@code [user, post]}.
 */
@Target(ElementType.TYPE)
@Retention(RetentionPolicy.RUNTIME)
public @interface RouteResource {
	/**
	 * @return the singular resource name, with {@code _} separating nested resources
	 */
	@NonNull
	String value();

	/**
	 * @return how collection actions of this controller pluralize the resource name
	 */
	@NonNull
	Pluralization pluralize() default Pluralization.INFLECTOR_DEFAULT;
}
