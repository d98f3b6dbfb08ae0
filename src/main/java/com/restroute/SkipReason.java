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
 * Why a controller method produced no route.
 */
public enum SkipReason {
	/**
	 * The method name starts with {@code _}.
	 */
	INTERNAL_NAME,
	/**
	 * The method, or its class without a method-level override, is marked {@link com.restroute.annotation.NoRoute}.
	 */
	NO_ROUTE_DECLARED,
	/**
	 * The method name does not follow the {@code <verb>[Resource...]Action} convention.
	 */
	UNRECOGNIZED_NAME
}
