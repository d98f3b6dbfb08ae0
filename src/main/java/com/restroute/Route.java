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
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.regex.Matcher;
import java.util.regex.Pattern;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A fully materialized route: a path template plus everything a dispatcher needs to match and invoke it.
 * <p>
 * Path templates use single-mustache placeholders and are not forced to start with {@code /}, e.g. {@code post/{id}/comments}.
 * <p>
 * Instances can be acquired via the {@link #withPath(String)} builder factory method.
 */
@ThreadSafe
public final class Route {
	@NonNull
	private static final Pattern PLACEHOLDER_PATTERN;

	static {
		PLACEHOLDER_PATTERN = Pattern.compile("\\{([^{}/]+)\\}");
	}

	@NonNull
	private final String path;
	@NonNull
	private final List<String> methods;
	@NonNull
	private final Map<String, String> defaults;
	@NonNull
	private final Map<String, String> requirements;
	@NonNull
	private final Map<String, String> options;
	@Nullable
	private final String host;
	@NonNull
	private final List<String> schemes;
	@Nullable
	private final String condition;

	/**
	 * Acquires a builder for {@link Route} instances.
	 *
	 * @param path the path template, e.g. {@code post/{id}}
	 * @return the builder
	 */
	@NonNull
	public static Builder withPath(@NonNull String path) {
		requireNonNull(path);
		return new Builder(path);
	}

	protected Route(@NonNull Builder builder) {
		requireNonNull(builder);

		this.path = builder.path;
		this.methods = Collections.unmodifiableList(new ArrayList<>(builder.methods));
		this.defaults = Collections.unmodifiableMap(new LinkedHashMap<>(builder.defaults));
		this.requirements = Collections.unmodifiableMap(new LinkedHashMap<>(builder.requirements));
		this.options = Collections.unmodifiableMap(new LinkedHashMap<>(builder.options));
		this.host = builder.host;
		this.schemes = Collections.unmodifiableList(new ArrayList<>(builder.schemes));
		this.condition = builder.condition;
	}

	/**
	 * Vends a mutable copier seeded with this instance's data, suitable for building new instances.
	 *
	 * @return a copier for this instance
	 */
	@NonNull
	public Copier copy() {
		return new Copier(this);
	}

	/**
	 * Placeholder names in this route's path template, left to right.
	 * <p>
	 * For example, {@code post/{postId}/comments/{id}.{_format}} yields {@code [postId, id, _format]}.
	 *
	 * @return the placeholder names, or the empty list if the path is entirely literal
	 */
	@NonNull
	public List<String> getPlaceholderNames() {
		List<String> placeholderNames = new ArrayList<>();
		Matcher matcher = PLACEHOLDER_PATTERN.matcher(getPath());

		while (matcher.find())
			placeholderNames.add(matcher.group(1));

		return Collections.unmodifiableList(placeholderNames);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{path=%s, methods=%s, defaults=%s, requirements=%s, condition=%s}", getClass().getSimpleName(),
				getPath(), getMethods(), getDefaults(), getRequirements(), getCondition().orElse(null));
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof Route route))
			return false;

		return Objects.equals(getPath(), route.getPath())
				&& Objects.equals(getMethods(), route.getMethods())
				&& Objects.equals(getDefaults(), route.getDefaults())
				&& Objects.equals(getRequirements(), route.getRequirements())
				&& Objects.equals(getOptions(), route.getOptions())
				&& Objects.equals(getHost(), route.getHost())
				&& Objects.equals(getSchemes(), route.getSchemes())
				&& Objects.equals(getCondition(), route.getCondition());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getPath(), getMethods(), getDefaults(), getRequirements(), getOptions(), getHost(), getSchemes(), getCondition());
	}

	@NonNull
	public String getPath() {
		return this.path;
	}

	/**
	 * Uppercase HTTP methods this route accepts, e.g. {@code [GET, HEAD]}.
	 *
	 * @return the accepted HTTP methods
	 */
	@NonNull
	public List<String> getMethods() {
		return this.methods;
	}

	/**
	 * Default values for the route's parameters. Always contains {@code _controller}, the dispatch target.
	 *
	 * @return the route defaults
	 */
	@NonNull
	public Map<String, String> getDefaults() {
		return this.defaults;
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
	public Optional<String> getHost() {
		return Optional.ofNullable(this.host);
	}

	@NonNull
	public List<String> getSchemes() {
		return this.schemes;
	}

	/**
	 * The boolean expression a request must satisfy in addition to path and method matching.
	 *
	 * @return the condition expression, or {@link Optional#empty()} if unconditional
	 */
	@NonNull
	public Optional<String> getCondition() {
		return Optional.ofNullable(this.condition);
	}

	/**
	 * Builder used to construct instances of {@link Route} via {@link Route#withPath(String)}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static final class Builder {
		@NonNull
		private String path;
		@NonNull
		private List<String> methods;
		@NonNull
		private Map<String, String> defaults;
		@NonNull
		private Map<String, String> requirements;
		@NonNull
		private Map<String, String> options;
		@Nullable
		private String host;
		@NonNull
		private List<String> schemes;
		@Nullable
		private String condition;

		protected Builder(@NonNull String path) {
			requireNonNull(path);

			this.path = path;
			this.methods = List.of();
			this.defaults = Map.of();
			this.requirements = Map.of();
			this.options = Map.of();
			this.schemes = List.of();
		}

		@NonNull
		public Builder path(@NonNull String path) {
			requireNonNull(path);
			this.path = path;
			return this;
		}

		@NonNull
		public Builder methods(@Nullable List<String> methods) {
			this.methods = methods == null ? List.of() : methods;
			return this;
		}

		@NonNull
		public Builder defaults(@Nullable Map<String, String> defaults) {
			this.defaults = defaults == null ? Map.of() : defaults;
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
		public Route build() {
			return new Route(this);
		}
	}

	/**
	 * Builder used to copy instances of {@link Route} via {@link Route#copy()}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static final class Copier {
		@NonNull
		private final Builder builder;

		Copier(@NonNull Route route) {
			requireNonNull(route);

			this.builder = new Builder(route.getPath())
					.methods(route.getMethods())
					.defaults(route.getDefaults())
					.requirements(route.getRequirements())
					.options(route.getOptions())
					.host(route.getHost().orElse(null))
					.schemes(route.getSchemes())
					.condition(route.getCondition().orElse(null));
		}

		@NonNull
		public Copier path(@NonNull String path) {
			requireNonNull(path);
			this.builder.path(path);
			return this;
		}

		@NonNull
		public Copier methods(@Nullable List<String> methods) {
			this.builder.methods(methods);
			return this;
		}

		@NonNull
		public Copier defaults(@Nullable Map<String, String> defaults) {
			this.builder.defaults(defaults);
			return this;
		}

		@NonNull
		public Copier requirements(@Nullable Map<String, String> requirements) {
			this.builder.requirements(requirements);
			return this;
		}

		@NonNull
		public Copier condition(@Nullable String condition) {
			this.builder.condition(condition);
			return this;
		}

		@NonNull
		public Route finish() {
			return this.builder.build();
		}
	}
}
