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
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A declarative route override attached to a controller action, independent of how it was declared
 * (Java annotation, external mapping file, test fixture...).
 * <p>
 * The {@link RouteDeclarationType} tags the declaration; the remaining fields are the shared payload.
 * Absent values ({@link Optional#empty()}, empty collections) mean "keep what naming convention derived".
 * <p>
 * Instances can be acquired via the {@link #withType(RouteDeclarationType)} builder factory method.
 */
@ThreadSafe
public final class RouteDeclaration {
	@NonNull
	private final RouteDeclarationType type;
	@Nullable
	private final String path;
	@Nullable
	private final String name;
	@NonNull
	private final List<String> methods;
	@NonNull
	private final Map<String, String> requirements;
	@NonNull
	private final Map<String, String> options;
	@NonNull
	private final Map<String, String> defaults;
	@Nullable
	private final String host;
	@NonNull
	private final List<String> schemes;
	@Nullable
	private final String condition;

	/**
	 * Acquires a builder for {@link RouteDeclaration} instances.
	 *
	 * @param type the kind of declaration
	 * @return the builder
	 */
	@NonNull
	public static Builder withType(@NonNull RouteDeclarationType type) {
		requireNonNull(type);
		return new Builder(type);
	}

	protected RouteDeclaration(@NonNull Builder builder) {
		requireNonNull(builder);

		List<String> methods = new ArrayList<>(builder.methods.size());

		for (String method : builder.methods)
			methods.add(method.toUpperCase(Locale.ROOT));

		// Verb-specific declarations always carry their own verb
		if (methods.isEmpty() && builder.type.getHttpMethod().isPresent())
			methods.add(builder.type.getHttpMethod().get().name());

		this.type = builder.type;
		this.path = builder.path;
		this.name = builder.name;
		this.methods = Collections.unmodifiableList(methods);
		this.requirements = Collections.unmodifiableMap(new LinkedHashMap<>(builder.requirements));
		this.options = Collections.unmodifiableMap(new LinkedHashMap<>(builder.options));
		this.defaults = Collections.unmodifiableMap(new LinkedHashMap<>(builder.defaults));
		this.host = builder.host;
		this.schemes = Collections.unmodifiableList(new ArrayList<>(builder.schemes));
		this.condition = builder.condition;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{type=%s, path=%s, name=%s, methods=%s}", getClass().getSimpleName(),
				getType(), getPath().orElse(null), getName().orElse(null), getMethods());
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof RouteDeclaration routeDeclaration))
			return false;

		return Objects.equals(getType(), routeDeclaration.getType())
				&& Objects.equals(getPath(), routeDeclaration.getPath())
				&& Objects.equals(getName(), routeDeclaration.getName())
				&& Objects.equals(getMethods(), routeDeclaration.getMethods())
				&& Objects.equals(getRequirements(), routeDeclaration.getRequirements())
				&& Objects.equals(getOptions(), routeDeclaration.getOptions())
				&& Objects.equals(getDefaults(), routeDeclaration.getDefaults())
				&& Objects.equals(getHost(), routeDeclaration.getHost())
				&& Objects.equals(getSchemes(), routeDeclaration.getSchemes())
				&& Objects.equals(getCondition(), routeDeclaration.getCondition());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getType(), getPath(), getName(), getMethods(), getRequirements(), getOptions(),
				getDefaults(), getHost(), getSchemes(), getCondition());
	}

	@NonNull
	public RouteDeclarationType getType() {
		return this.type;
	}

	/**
	 * The explicit path, which replaces the derived path when present.
	 *
	 * @return the explicit path, or {@link Optional#empty()} if the derived path should be used
	 */
	@NonNull
	public Optional<String> getPath() {
		return Optional.ofNullable(this.path);
	}

	@NonNull
	public Optional<String> getName() {
		return Optional.ofNullable(this.name);
	}

	/**
	 * Uppercase HTTP methods accepted by this declaration.
	 * <p>
	 * Verb-specific declarations such as {@link RouteDeclarationType#GET} always report their own verb when no methods were supplied.
	 *
	 * @return the accepted HTTP methods, or the empty list if the derived verb should be used
	 */
	@NonNull
	public List<String> getMethods() {
		return this.methods;
	}

	@NonNull
	public Map<String, String> getRequirements() {
		return this.requirements;
	}

	@NonNull
	public Map<String, String> getOptions() {
		return this.options;
	}

	@NonNull
	public Map<String, String> getDefaults() {
		return this.defaults;
	}

	@NonNull
	public Optional<String> getHost() {
		return Optional.ofNullable(this.host);
	}

	@NonNull
	public List<String> getSchemes() {
		return this.schemes;
	}

	@NonNull
	public Optional<String> getCondition() {
		return Optional.ofNullable(this.condition);
	}

	/**
	 * Builder used to construct instances of {@link RouteDeclaration} via {@link RouteDeclaration#withType(RouteDeclarationType)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private final RouteDeclarationType type;
		@Nullable
		private String path;
		@Nullable
		private String name;
		@NonNull
		private List<String> methods;
		@NonNull
		private Map<String, String> requirements;
		@NonNull
		private Map<String, String> options;
		@NonNull
		private Map<String, String> defaults;
		@Nullable
		private String host;
		@NonNull
		private List<String> schemes;
		@Nullable
		private String condition;

		protected Builder(@NonNull RouteDeclarationType type) {
			requireNonNull(type);

			this.type = type;
			this.methods = List.of();
			this.requirements = Map.of();
			this.options = Map.of();
			this.defaults = Map.of();
			this.schemes = List.of();
		}

		@NonNull
		public Builder path(@Nullable String path) {
			this.path = path;
			return this;
		}

		@NonNull
		public Builder name(@Nullable String name) {
			this.name = name;
			return this;
		}

		@NonNull
		public Builder methods(@Nullable List<String> methods) {
			this.methods = methods == null ? List.of() : methods;
			return this;
		}

		@NonNull
		public Builder requirements(@Nullable Map<String, String> requirements) {
			this.requirements = requirements == null ? Map.of() : requirements;
			return this;
		}

		@NonNull
		public Builder options(@Nullable Map<String, String> options) {
			this.options = options == null ? Map.of() : options;
			return this;
		}

		@NonNull
		public Builder defaults(@Nullable Map<String, String> defaults) {
			this.defaults = defaults == null ? Map.of() : defaults;
			return this;
		}

		@NonNull
		public Builder host(@Nullable String host) {
			this.host = host;
			return this;
		}

		@NonNull
		public Builder schemes(@Nullable List<String> schemes) {
			this.schemes = schemes == null ? List.of() : schemes;
			return this;
		}

		@NonNull
		public Builder condition(@Nullable String condition) {
			this.condition = condition;
			return this;
		}

		@NonNull
		public RouteDeclaration build() {
			return new RouteDeclaration(this);
		}
	}
}
