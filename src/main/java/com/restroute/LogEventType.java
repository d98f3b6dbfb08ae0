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
 * Kinds of {@link LogEvent} instances that route derivation can produce.
 */
public enum LogEventType {
	/**
	 * Indicates that the unprefixed fallback name of a non-inflectable collection route was already taken by a route
	 * with the same path and methods, so the fallback registration was skipped.
	 */
	FALLBACK_ROUTE_SKIPPED,
	/**
	 * Indicates that the unprefixed fallback name of a non-inflectable collection route was already taken by a route
	 * with a different path or methods. The fallback registration was skipped; the existing route may not be the one callers expect.
	 */
	FALLBACK_ROUTE_CONFLICT,
	/**
	 * Indicates that a controller action's parameter names were not compiled into its class file (missing {@code -parameters}
	 * compiler option), so path placeholders fall back to synthetic names such as {@code arg0}.
	 */
	PARAMETER_NAMES_UNAVAILABLE
}
