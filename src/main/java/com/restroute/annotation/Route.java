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
 * Apply to controller actions to customize the route derived from the action name.
 * <p>
 * Each annotation instance produces one route, so an action may be exposed under several paths or verbs by repeating it.
 * Blank strings and empty arrays mean "not set": the value derived by naming convention is kept.
 * <p>
 * Map-valued attributes ({@link #requirements()}, {@link #options()}, {@link #defaults()}) are written as
 * {@code name=value} entries, split at the first {@code =}. For example:
 * <pre>
 * &#64;Route(value = "/posts/{slug}", methods = {"GET", "HEAD"}, requirements = {"slug=[a-z0-9-]+"})
 * public Post getPostAction(String slug) { ... }
 * </pre>
 * Placing {@code method_prefix=false} in {@link #options()} makes {@link #name()} replace the derived route name instead
 * of being appended to it.
 */
@Target(ElementType.METHOD)
@Retention(RetentionPolicy.RUNTIME)
@Repeatable(value = Routes.class)
public @interface Route {
	/**
	 * The explicit path for this route, e.g. {@code /posts/{slug}}.
	 * <p>
	 * When set, it fully replaces the derived path and is prefixed with the configured route prefix.
	 *
	 * @return the explicit path, or blank to keep the derived path
	 */
	@NonNull
	String value() default "";

	/**
	 * The route name.
	 * <p>
	 * By default this is appended to the derived name; with option {@code method_prefix=false} it replaces it.
	 *
	 * @return the route name, or blank to keep the derived name
	 */
	@NonNull
	String name() default "";

	/**
	 * @return the accepted HTTP methods, or empty to keep the derived verb
	 */
	@NonNull
	String[] methods() default {};

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
	 * @return route defaults as {@code name=value} entries, layered over the derived defaults
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
	 * The route condition expression, e.g. {@code request.headers.get('X-Client') == 'mobile'}.
	 * <p>
	 * When an API version is configured, the version check is combined with this condition.
	 *
	 * @return the route condition expression, or blank for none
	 */
	@NonNull
	String condition() default "";
}
