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
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.lang.reflect.Method;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A diagnostic raised while deriving routes, for example an alias route that could not be registered.
 * <p>
 * Delivered to {@link RouteDerivationObserver#didReceiveLogEvent(LogEvent)}.
 */
@ThreadSafe
public final class LogEvent {
	@NonNull
	private final LogEventType logEventType;
	@NonNull
	private final String message;
	@Nullable
	private final Method method;
	@Nullable
	private final String routeName;

	/**
	 * Acquires a builder for {@link LogEvent} instances.
	 *
	 * @param logEventType what kind of diagnostic this is
	 * @param message      human-readable description
	 * @return the builder
	 */
	@NonNull
	public static Builder with(@NonNull LogEventType logEventType,
														 @NonNull String message) {
		requireNonNull(logEventType);
		requireNonNull(message);

		return new Builder(logEventType, message);
	}

	private LogEvent(@NonNull Builder builder) {
		requireNonNull(builder);

		this.logEventType = builder.logEventType;
		this.message = builder.message;
		this.method = builder.method;
		this.routeName = builder.routeName;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{logEventType=%s, routeName=%s, method=%s, message=%s}", getClass().getSimpleName(),
				getLogEventType(), getRouteName().orElse(null), getMethod().map(Method::getName).orElse(null), getMessage());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof LogEvent logEvent))
			return false;

		return Objects.equals(getLogEventType(), logEvent.getLogEventType())
				&& Objects.equals(getMessage(), logEvent.getMessage())
				&& Objects.equals(getMethod(), logEvent.getMethod())
				&& Objects.equals(getRouteName(), logEvent.getRouteName());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getLogEventType(), getMessage(), getMethod(), getRouteName());
	}

	@NonNull
	public LogEventType getLogEventType() {
		return this.logEventType;
	}

	@NonNull
	public String getMessage() {
		return this.message;
	}

	/**
	 * The controller action that was being derived.
	 *
	 * @return the action, or {@link Optional#empty()} if the event is not tied to one
	 */
	@NonNull
	public Optional<Method> getMethod() {
		return Optional.ofNullable(this.method);
	}

	/**
	 * The route name the event concerns, e.g. the alias that was not registered.
	 *
	 * @return the route name, or {@link Optional#empty()} if the event is not tied to one
	 */
	@NonNull
	public Optional<String> getRouteName() {
		return Optional.ofNullable(this.routeName);
	}

	/**
	 * Builder used to construct instances of {@link LogEvent} via {@link LogEvent#with(LogEventType, String)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final LogEventType logEventType;
		@NonNull
		private final String message;
		@Nullable
		private Method method;
		@Nullable
		private String routeName;

		private Builder(@NonNull LogEventType logEventType,
										@NonNull String message) {
			this.logEventType = logEventType;
			this.message = message;
		}

		@NonNull
		public Builder method(@Nullable Method method) {
			this.method = method;
			return this;
		}

		@NonNull
		public Builder routeName(@Nullable String routeName) {
			this.routeName = routeName;
			return this;
		}

		@NonNull
		public LogEvent build() {
			return new LogEvent(this);
		}
	}
}
