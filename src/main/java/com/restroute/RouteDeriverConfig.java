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
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Defines how route derivation is configured for one controller scan.
 * <p>
 * Threadsafe instances can be acquired via the {@link #withDefaults()} builder factory method.
 * Use {@link #copy()} to derive a modified configuration, e.g. per controller.
 */
@ThreadSafe
public final class RouteDeriverConfig {
	@Nullable
	private final String routePrefix;
	@Nullable
	private final String namePrefix;
	@Nullable
	private final String version;
	@NonNull
	private final Pluralization pluralization;
	@NonNull
	private final List<String> parents;
	@NonNull
	private final Boolean includeFormat;
	@NonNull
	private final Map<String, String> formats;
	@NonNull
	private final Inflector inflector;
	@NonNull
	private final AnnotationSource annotationSource;
	@NonNull
	private final QueryParameterReader queryParameterReader;
	@NonNull
	private final InjectedParameterPolicy injectedParameterPolicy;
	@NonNull
	private final RouteDerivationObserver routeDerivationObserver;

	/**
	 * Vends a configuration builder with no prefixes, no version, no parents, format suffixes disabled and default collaborators.
	 *
	 * @return a builder for {@link RouteDeriverConfig} instances
	 */
	@NonNull
	public static Builder withDefaults() {
		return new Builder();
	}

	protected RouteDeriverConfig(@NonNull Builder builder) {
		requireNonNull(builder);

		this.routePrefix = builder.routePrefix;
		this.namePrefix = builder.namePrefix;
		this.version = builder.version;
		this.pluralization = builder.pluralization != null ? builder.pluralization : Pluralization.INFLECTOR_DEFAULT;
		this.parents = Collections.unmodifiableList(builder.parents == null ? List.of() : new ArrayList<>(builder.parents));
		this.includeFormat = builder.includeFormat != null ? builder.includeFormat : false;
		this.formats = Collections.unmodifiableMap(builder.formats == null ? Map.of() : new LinkedHashMap<>(builder.formats));
		this.inflector = builder.inflector != null ? builder.inflector : Inflector.defaultInstance();
		this.annotationSource = builder.annotationSource != null ? builder.annotationSource : AnnotationSource.defaultInstance();
		this.queryParameterReader = builder.queryParameterReader != null ? builder.queryParameterReader : QueryParameterReader.defaultInstance();
		this.injectedParameterPolicy = builder.injectedParameterPolicy != null ? builder.injectedParameterPolicy : InjectedParameterPolicy.injectingNothing();
		this.routeDerivationObserver = builder.routeDerivationObserver != null ? builder.routeDerivationObserver : RouteDerivationObserver.defaultInstance();
	}

	/**
	 * Vends a mutable copy of this instance's configuration, suitable for building new instances.
	 *
	 * @return a mutable copy of this instance's configuration
	 */
	@NonNull
	public Copier copy() {
		return new Copier(this);
	}

	/**
	 * The path segment inserted after the parent resources, e.g. {@code api} in {@code post/{postId}/api/comments}.
	 * Also prepended verbatim to explicitly declared paths.
	 *
	 * @return the route path prefix, or {@link Optional#empty()} if none
	 */
	@NonNull
	public Optional<String> getRoutePrefix() {
		return Optional.ofNullable(this.routePrefix);
	}

	/**
	 * Prepended verbatim to every route name, e.g. {@code api_} in {@code api_get_posts}.
	 *
	 * @return the route name prefix, or {@link Optional#empty()} if none
	 */
	@NonNull
	public Optional<String> getNamePrefix() {
		return Optional.ofNullable(this.namePrefix);
	}

	/**
	 * The API version that declared routes are conditioned on, e.g. {@code v2}.
	 *
	 * @return the API version, or {@link Optional#empty()} if routes are unversioned
	 */
	@NonNull
	public Optional<String> getVersion() {
		return Optional.ofNullable(this.version);
	}

	@NonNull
	public Pluralization getPluralization() {
		return this.pluralization;
	}

	/**
	 * Singular names of the resources enclosing this controller's resource, outermost first.
	 *
	 * @return the parent resource names, or the empty list for a top-level controller
	 */
	@NonNull
	public List<String> getParents() {
		return this.parents;
	}

	/**
	 * Should every route path end with a {@code .{_format}} placeholder?
	 *
	 * @return {@code true} if format suffixes are appended
	 */
	@NonNull
	public Boolean getIncludeFormat() {
		return this.includeFormat;
	}

	/**
	 * Known response formats keyed by format name, e.g. {@code json -> application/json}. Key order is preserved.
	 *
	 * @return the known formats, or the empty map if unconstrained
	 */
	@NonNull
	public Map<String, String> getFormats() {
		return this.formats;
	}

	@NonNull
	public Inflector getInflector() {
		return this.inflector;
	}

	@NonNull
	public AnnotationSource getAnnotationSource() {
		return this.annotationSource;
	}

	@NonNull
	public QueryParameterReader getQueryParameterReader() {
		return this.queryParameterReader;
	}

	@NonNull
	public InjectedParameterPolicy getInjectedParameterPolicy() {
		return this.injectedParameterPolicy;
	}

	@NonNull
	public RouteDerivationObserver getRouteDerivationObserver() {
		return this.routeDerivationObserver;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{routePrefix=%s, namePrefix=%s, version=%s, pluralization=%s, parents=%s, includeFormat=%s, formats=%s}",
				getClass().getSimpleName(), getRoutePrefix().orElse(null), getNamePrefix().orElse(null), getVersion().orElse(null),
				getPluralization(), getParents(), getIncludeFormat(), getFormats().keySet());
	}

	/**
	 * Builder used to construct instances of {@link RouteDeriverConfig}.
	 * <p>
	 * Instances are created by invoking {@link RouteDeriverConfig#withDefaults()}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static final class Builder {
		@Nullable
		private String routePrefix;
		@Nullable
		private String namePrefix;
		@Nullable
		private String version;
		@Nullable
		private Pluralization pluralization;
		@Nullable
		private List<String> parents;
		@Nullable
		private Boolean includeFormat;
		@Nullable
		private Map<String, String> formats;
		@Nullable
		private Inflector inflector;
		@Nullable
		private AnnotationSource annotationSource;
		@Nullable
		private QueryParameterReader queryParameterReader;
		@Nullable
		private InjectedParameterPolicy injectedParameterPolicy;
		@Nullable
		private RouteDerivationObserver routeDerivationObserver;

		Builder() {
			// Package-private
		}

		@NonNull
		public Builder routePrefix(@Nullable String routePrefix) {
			this.routePrefix = routePrefix;
			return this;
		}

		@NonNull
		public Builder namePrefix(@Nullable String namePrefix) {
			this.namePrefix = namePrefix;
			return this;
		}

		@NonNull
		public Builder version(@Nullable String version) {
			this.version = version;
			return this;
		}

		@NonNull
		public Builder pluralization(@Nullable Pluralization pluralization) {
			this.pluralization = pluralization;
			return this;
		}

		@NonNull
		public Builder parents(@Nullable List<String> parents) {
			this.parents = parents;
			return this;
		}

		@NonNull
		public Builder includeFormat(@Nullable Boolean includeFormat) {
			this.includeFormat = includeFormat;
			return this;
		}

		@NonNull
		public Builder formats(@Nullable Map<String, String> formats) {
			this.formats = formats;
			return this;
		}

		@NonNull
		public Builder inflector(@Nullable Inflector inflector) {
			this.inflector = inflector;
			return this;
		}

		@NonNull
		public Builder annotationSource(@Nullable AnnotationSource annotationSource) {
			this.annotationSource = annotationSource;
			return this;
		}

		@NonNull
		public Builder queryParameterReader(@Nullable QueryParameterReader queryParameterReader) {
			this.queryParameterReader = queryParameterReader;
			return this;
		}

		@NonNull
		public Builder injectedParameterPolicy(@Nullable InjectedParameterPolicy injectedParameterPolicy) {
			this.injectedParameterPolicy = injectedParameterPolicy;
			return this;
		}

		@NonNull
		public Builder routeDerivationObserver(@Nullable RouteDerivationObserver routeDerivationObserver) {
			this.routeDerivationObserver = routeDerivationObserver;
			return this;
		}

		@NonNull
		public RouteDeriverConfig build() {
			return new RouteDeriverConfig(this);
		}
	}

	/**
	 * Builder used to copy instances of {@link RouteDeriverConfig}.
	 * <p>
	 * Instances are created by invoking {@link RouteDeriverConfig#copy()}.
	 * <p>
	 * This class is intended for use by a single thread.
	 */
	@NotThreadSafe
	public static final class Copier {
		@NonNull
		private final Builder builder;

		Copier(@NonNull RouteDeriverConfig routeDeriverConfig) {
			requireNonNull(routeDeriverConfig);

			this.builder = new Builder()
					.routePrefix(routeDeriverConfig.routePrefix)
					.namePrefix(routeDeriverConfig.namePrefix)
					.version(routeDeriverConfig.version)
					.pluralization(routeDeriverConfig.pluralization)
					.parents(routeDeriverConfig.parents)
					.includeFormat(routeDeriverConfig.includeFormat)
					.formats(routeDeriverConfig.formats)
					.inflector(routeDeriverConfig.inflector)
					.annotationSource(routeDeriverConfig.annotationSource)
					.queryParameterReader(routeDeriverConfig.queryParameterReader)
					.injectedParameterPolicy(routeDeriverConfig.injectedParameterPolicy)
					.routeDerivationObserver(routeDeriverConfig.routeDerivationObserver);
		}

		@NonNull
		public Copier routePrefix(@Nullable String routePrefix) {
			this.builder.routePrefix(routePrefix);
			return this;
		}

		@NonNull
		public Copier namePrefix(@Nullable String namePrefix) {
			this.builder.namePrefix(namePrefix);
			return this;
		}

		@NonNull
		public Copier version(@Nullable String version) {
			this.builder.version(version);
			return this;
		}

		@NonNull
		public Copier pluralization(@Nullable Pluralization pluralization) {
			this.builder.pluralization(pluralization);
			return this;
		}

		@NonNull
		public Copier parents(@Nullable List<String> parents) {
			this.builder.parents(parents);
			return this;
		}

		@NonNull
		public Copier includeFormat(@Nullable Boolean includeFormat) {
			this.builder.includeFormat(includeFormat);
			return this;
		}

		@NonNull
		public Copier formats(@Nullable Map<String, String> formats) {
			this.builder.formats(formats);
			return this;
		}

		@NonNull
		public Copier routeDerivationObserver(@Nullable RouteDerivationObserver routeDerivationObserver) {
			this.builder.routeDerivationObserver(routeDerivationObserver);
			return this;
		}

		@NonNull
		public RouteDeriverConfig finish() {
			return this.builder.build();
		}
	}
}
