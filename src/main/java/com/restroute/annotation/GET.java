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

import org.jspecify.annotations.NonNull;

import java.lang.annotation.ElementType;
import java.lang.annotation.Repeatable;
import java.lang.annotation.Retention;
import java.lang.annotation.RetentionPolicy;
import java.lang.annotation.Target;

/**
 * Apply to controller actions to declare an HTTP {@code GET} route, overriding the verb derived from the action name.
 * <p>
 * Attributes left at their defaults fall back to the route derived by naming convention.
 * See {@link Route} for the meaning of each attribute.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Repeatable(value = GETs.class)
public @interface GET {
	/**
	 * @return the explicit path, or blank to keep the derived path
	 */
	@NonNull
	String value() default "";

	/**
	 * @return the route name suffix (or full name, see {@link Route#name()}), or blank to keep the derived name
	 */
	@NonNull
	String name() default "";

	/**
	 * @return placeholder requirements as {@code name=regex} entries
	 */
	@NonNull
	String[] requirements() default {};

	/**
	 * @return route options as {@code name=value} entries
	 */
	@NonNull
	String[] options() default {};

	/**
	 * @return route defaults as {@code name=value} entries
	 */
	@NonNull
	String[] defaults() default {};

	/**
	 * @return the host pattern, or blank for any host
	 */
	@NonNull
	String host() default "";

	/**
	 * @return the accepted URI schemes, or empty for any scheme
	 */
	@NonNull
	String[] schemes() default {};

	/**
	 * @return the route condition expression, or blank for none
	 */
	@NonNull
	String condition() default "";
}
