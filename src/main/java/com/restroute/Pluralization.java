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

/**
 * Whether collection actions pluralize their terminal resource name.
 */
public enum Pluralization {
	/**
	 * Always run the resource name through the {@link Inflector}.
	 */
	ALWAYS,
	/**
	 * Never pluralize; collection routes use the resource name as written.
	 */
	NEVER,
	/**
	 * Defer to the {@link Inflector}. Behaves like {@link #ALWAYS}, but may be overridden per controller.
	 */
	INFLECTOR_DEFAULT
}
