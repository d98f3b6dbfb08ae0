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
import java.util.logging.Level;
import java.util.logging.Logger;

/**
 * Read-only hook methods for observing route derivation.
 * <p>
 * All hooks are "fail-fast": exceptions thrown by an implementation bubble out and stop the current controller scan.
 * <p>
 * A standard threadsafe implementation can be acquired via the {@link #defaultInstance()} factory method.
 */
public interface RouteDerivationObserver {
	/**
	 * Called when a controller method produces no route.
	 */
	default void didSkipMethod(@NonNull Method method,
														 @NonNull SkipReason skipReason) {
		// No-op by default
	}

	/**
	 * Called after a route is registered in a {@link RouteCollection}.
	 */
	default void didRegisterRoute(@NonNull Method method,
																@NonNull String routeName,
																@NonNull Route route) {
		// No-op by default
	}

	/**
	 * Called when route derivation emits a log event.
	 * <p>
	 * The default implementation writes to the {@code com.restroute} {@link Logger}: {@link LogEventType#FALLBACK_ROUTE_SKIPPED} at {@link Level#FINE}, everything else at {@link Level#WARNING}.
	 */
	default void didReceiveLogEvent(@NonNull LogEvent logEvent) {
		Logger logger = Logger.getLogger(RouteDerivationObserver.class.getPackageName());
		Level level = logEvent.getLogEventType() == LogEventType.FALLBACK_ROUTE_SKIPPED ? Level.FINE : Level.WARNING;

		if (!logger.isLoggable(level))
			return;

		logger.log(level, String.format("%s::didReceiveLogEvent [%s]: %s", RouteDerivationObserver.class.getSimpleName(),
				logEvent.getLogEventType().name(), logEvent.getMessage()));
	}

	/**
	 * Acquires a threadsafe {@link RouteDerivationObserver} instance with sensible defaults.
	 *
	 * @return a {@code RouteDerivationObserver} with default settings
	 */
	@NonNull
	static RouteDerivationObserver defaultInstance() {
		return DefaultRouteDerivationObserver.defaultInstance();
	}
}
