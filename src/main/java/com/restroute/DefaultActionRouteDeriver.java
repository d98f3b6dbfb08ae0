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

import com.restroute.annotation.RouteResource;
import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Comparator;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.logging.Level;
import java.util.logging.Logger;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * @see ActionRouteDeriver#withConfig(RouteDeriverConfig)
 */
@ThreadSafe
final class DefaultActionRouteDeriver implements ActionRouteDeriver {
	@NonNull
	private static final Logger logger = Logger.getLogger(DefaultActionRouteDeriver.class.getName());

	@NonNull
	private static final String CONTROLLER_DEFAULT_NAME;
	@NonNull
	private static final String FORMAT_PLACEHOLDER_NAME;
	@NonNull
	private static final String METHOD_PREFIX_OPTION_NAME;
	@NonNull
	private static final String CONTROLLER_CLASS_SUFFIX;
	@NonNull
	private static final Set<String> HTTP_METHOD_TOKENS;
	@NonNull
	private static final Set<String> CONVENTIONAL_ACTION_VERBS;
	@NonNull
	private static final Set<String> PLURAL_PATH_VERBS;
	@NonNull
	private static final Comparator<Method> METHOD_ORDER;

	static {
		CONTROLLER_DEFAULT_NAME = "_controller";
		FORMAT_PLACEHOLDER_NAME = "_format";
		METHOD_PREFIX_OPTION_NAME = "method_prefix";
		CONTROLLER_CLASS_SUFFIX = "Controller";

		HTTP_METHOD_TOKENS = HttpMethod.valuesAsSet().stream()
				.map(HttpMethod::getToken)
				.collect(Collectors.toUnmodifiableSet());

		// Hypermedia helpers that render a form or confirmation page
		CONVENTIONAL_ACTION_VERBS = Set.of("new", "edit", "remove");
		PLURAL_PATH_VERBS = Set.of("new", "post");

		METHOD_ORDER = Comparator.comparing(Method::getName)
				.thenComparing(method -> Arrays.stream(method.getParameterTypes())
						.map(Class::getName)
						.collect(Collectors.joining(",")));
	}

	@NonNull
	private final RouteDeriverConfig routeDeriverConfig;

	DefaultActionRouteDeriver(@NonNull RouteDeriverConfig routeDeriverConfig) {
		requireNonNull(routeDeriverConfig);
		this.routeDeriverConfig = routeDeriverConfig;
	}

	@Override
	public void deriveRoutes(@NonNull Class<?> controllerClass,
													 @NonNull RouteCollection routeCollection) {
		requireNonNull(controllerClass);
		requireNonNull(routeCollection);

		validateParents();

		RouteDeriverConfig scanConfig = getRouteDeriverConfig();
		List<String> seedResources = List.of();
		RouteResource routeResource = controllerClass.getAnnotation(RouteResource.class);

		if (routeResource != null) {
			seedResources = seedResourcesFromRouteResource(controllerClass, routeResource);

			if (routeResource.pluralize() != Pluralization.INFLECTOR_DEFAULT)
				scanConfig = scanConfig.copy().pluralization(routeResource.pluralize()).finish();
		} else if (ClassResource.class.isAssignableFrom(controllerClass)) {
			seedResources = seedResourcesFromClassName(controllerClass);
		}

		DefaultActionRouteDeriver scanDeriver = scanConfig == getRouteDeriverConfig() ? this : new DefaultActionRouteDeriver(scanConfig);
		List<FallbackRoute> fallbackRoutes = new ArrayList<>();

		if (logger.isLoggable(Level.FINER))
			logger.finer(format("Scanning %s with seed resources %s", controllerClass.getName(), seedResources));

		for (Method method : actionCandidates(controllerClass))
			scanDeriver.deriveRoute(method, seedResources, routeCollection, fallbackRoutes);

		// Aliases only take names that no action claimed
		for (FallbackRoute fallbackRoute : fallbackRoutes)
			scanDeriver.addFallbackRoute(fallbackRoute, routeCollection);
	}

	@Override
	public void deriveRoutes(@NonNull Method method,
													 @NonNull List<@NonNull String> seedResources,
													 @NonNull RouteCollection routeCollection) {
		requireNonNull(method);
		requireNonNull(seedResources);
		requireNonNull(routeCollection);

		validateParents();
		deriveRoute(method, seedResources, routeCollection, null);
	}

	protected void deriveRoute(@NonNull Method method,
														 @NonNull List<@NonNull String> seedResources,
														 @NonNull RouteCollection routeCollection,
														 @Nullable List<@NonNull FallbackRoute> deferredFallbackRoutes) {
		requireNonNull(method);
		requireNonNull(seedResources);
		requireNonNull(routeCollection);

		RouteDeriverConfig routeDeriverConfig = getRouteDeriverConfig();
		RouteDerivationObserver routeDerivationObserver = routeDeriverConfig.getRouteDerivationObserver();
		Optional<SkipReason> skipReason = skipReasonFor(method);

		if (skipReason.isPresent()) {
			routeDerivationObserver.didSkipMethod(method, skipReason.get());
			return;
		}

		Optional<ActionName> actionName = ActionNameParser.parse(method.getName());

		if (actionName.isEmpty()) {
			routeDerivationObserver.didSkipMethod(method, SkipReason.UNRECOGNIZED_NAME);
			return;
		}

		ParsedAction parsedAction = ActionNameParser.parseAction(actionName.get(), seedResources,
				routeDeriverConfig.getPluralization(), routeDeriverConfig.getInflector());

		List<Parameter> arguments = routableParameters(method);
		List<String> parents = routeDeriverConfig.getParents();
		List<String> resources = new ArrayList<>(parsedAction.resources());

		// One resource addressed by exactly one argument of its own is a member action
		if (resources.size() == 1 && arguments.size() - parents.size() == 1)
			routeCollection.setSingularName(resources.get(0));

		resources = mergeResources(parents, resources);

		String httpMethod = parsedAction.httpMethod();
		String routeName = routeNameFor(httpMethod, resources);
		List<String> pathComponents = pathComponentsFor(resources, arguments, httpMethod);

		if (!HTTP_METHOD_TOKENS.contains(httpMethod)) {
			pathComponents.add(httpMethod);
			httpMethod = resolveCustomHttpMethod(httpMethod, resources, arguments);
		}

		Map<String, String> defaults = new LinkedHashMap<>();
		defaults.put(CONTROLLER_DEFAULT_NAME, format("%s::%s", method.getDeclaringClass().getName(), method.getName()));

		RouteDraft routeDraft = new RouteDraft(String.join("/", pathComponents), httpMethod, defaults);

		if (logger.isLoggable(Level.FINER))
			logger.finer(format("Derived %s for %s", routeDraft, method));

		List<RouteDeclaration> routeDeclarations = routeDeriverConfig.getAnnotationSource().getMethodDeclarations(method).stream()
				.filter(routeDeclaration -> routeDeclaration.getType().isRouteProducing())
				.collect(Collectors.toList());

		if (routeDeclarations.isEmpty()) {
			writeRoute(method, routeName, materializeRoute(routeDraft, null), parsedAction, null, routeCollection, deferredFallbackRoutes);
		} else {
			for (RouteDeclaration routeDeclaration : routeDeclarations)
				writeRoute(method, routeName, materializeRoute(routeDraft, routeDeclaration), parsedAction, routeDeclaration,
						routeCollection, deferredFallbackRoutes);
		}
	}

	/**
	 * Why {@code method} produces no route, if it doesn't.
	 * <p>
	 * A class-level {@link RouteDeclarationType#NO_ROUTE} is overridden by any route-producing declaration on the method itself.
	 */
	@NonNull
	protected Optional<SkipReason> skipReasonFor(@NonNull Method method) {
		requireNonNull(method);

		if (method.getName().startsWith("_"))
			return Optional.of(SkipReason.INTERNAL_NAME);

		AnnotationSource annotationSource = getRouteDeriverConfig().getAnnotationSource();
		List<RouteDeclaration> methodDeclarations = annotationSource.getMethodDeclarations(method);

		boolean noRouteOnMethod = methodDeclarations.stream()
				.anyMatch(routeDeclaration -> routeDeclaration.getType() == RouteDeclarationType.NO_ROUTE);

		if (noRouteOnMethod)
			return Optional.of(SkipReason.NO_ROUTE_DECLARED);

		boolean noRouteOnClass = annotationSource.getClassDeclaration(method.getDeclaringClass(), RouteDeclarationType.NO_ROUTE).isPresent();
		boolean routeOnMethod = methodDeclarations.stream()
				.anyMatch(routeDeclaration -> routeDeclaration.getType().isRouteProducing());

		if (noRouteOnClass && !routeOnMethod)
			return Optional.of(SkipReason.NO_ROUTE_DECLARED);

		return Optional.empty();
	}

	@NonNull
	protected Boolean isEligible(@NonNull Method method) {
		return skipReasonFor(method).isEmpty();
	}

	/**
	 * Parameters that map to path placeholders: everything except query parameters and framework-injected types.
	 */
	@NonNull
	protected List<@NonNull Parameter> routableParameters(@NonNull Method method) {
		requireNonNull(method);

		RouteDeriverConfig routeDeriverConfig = getRouteDeriverConfig();
		Set<String> queryParameterNames = routeDeriverConfig.getQueryParameterReader().getParamsFromMethod(method);
		InjectedParameterPolicy injectedParameterPolicy = routeDeriverConfig.getInjectedParameterPolicy();
		List<Parameter> routableParameters = new ArrayList<>();

		for (Parameter parameter : method.getParameters()) {
			if (queryParameterNames.contains(parameter.getName()))
				continue;

			if (injectedParameterPolicy.isFrameworkInjected(parameter.getType()))
				continue;

			routableParameters.add(parameter);
		}

		boolean parameterNamesUnavailable = routableParameters.stream()
				.anyMatch(parameter -> !parameter.isNamePresent());

		if (parameterNamesUnavailable)
			routeDeriverConfig.getRouteDerivationObserver().didReceiveLogEvent(LogEvent.with(LogEventType.PARAMETER_NAMES_UNAVAILABLE,
							format("Parameter names of %s were not retained by the compiler, so its path placeholders are named arg0, arg1, ... " +
									"Compile with 'javac -parameters' to use the declared names.", method))
					.method(method)
					.build());

		return routableParameters;
	}

	@NonNull
	protected List<@Nullable String> mergeResources(@NonNull List<@NonNull String> parents,
																									@NonNull List<@Nullable String> resources) {
		requireNonNull(parents);
		requireNonNull(resources);

		List<String> mergedResources = new ArrayList<>(parents.size() + resources.size());
		mergedResources.addAll(parents);
		mergedResources.addAll(resources);

		// Root actions still get one anonymous segment so a lone argument becomes a placeholder
		if (mergedResources.isEmpty())
			mergedResources.add(null);

		return mergedResources;
	}

	/**
	 * Verb plus {@code _<basename>} of each named resource, lowercased, e.g. {@code get_post_comment}.
	 */
	@NonNull
	protected String routeNameFor(@NonNull String httpMethod,
																@NonNull List<@Nullable String> resources) {
		requireNonNull(httpMethod);
		requireNonNull(resources);

		StringBuilder routeName = new StringBuilder(httpMethod);

		for (String resource : resources)
			if (resource != null)
				routeName.append('_').append(Utilities.basename(resource));

		return routeName.toString().toLowerCase(Locale.ROOT);
	}

	/**
	 * Path components for {@code resources}, pairing the resource at index {@code i} with the argument at index {@code i}.
	 * The configured route prefix is inserted right after the parent resources.
	 */
	@NonNull
	protected List<@NonNull String> pathComponentsFor(@NonNull List<@Nullable String> resources,
																										@NonNull List<@NonNull Parameter> arguments,
																										@NonNull String httpMethod) {
		requireNonNull(resources);
		requireNonNull(arguments);
		requireNonNull(httpMethod);

		RouteDeriverConfig routeDeriverConfig = getRouteDeriverConfig();
		String routePrefix = routeDeriverConfig.getRoutePrefix().orElse("");
		int parentCount = routeDeriverConfig.getParents().size();
		boolean customVerb = !HTTP_METHOD_TOKENS.contains(httpMethod);
		List<String> pathComponents = new ArrayList<>();

		for (int i = 0; i < resources.size(); ++i) {
			if (i == parentCount && routePrefix.length() > 0)
				pathComponents.add(routePrefix);

			String resource = resources.get(i);

			if (i < arguments.size()) {
				String placeholder = format("{%s}", arguments.get(i).getName());
				pathComponents.add(resource == null ? placeholder : format("%s/%s", resource.toLowerCase(Locale.ROOT), placeholder));
			} else if (resource != null) {
				if ((arguments.isEmpty() && customVerb) || PLURAL_PATH_VERBS.contains(httpMethod))
					pathComponents.add(pluralizedResourceName(resource.toLowerCase(Locale.ROOT)));
				else
					pathComponents.add(resource.toLowerCase(Locale.ROOT));
			}
		}

		return pathComponents;
	}

	/**
	 * HTTP method for a verb that isn't one: form/confirmation helpers and collection actions are {@code get}, member actions {@code patch}.
	 */
	@NonNull
	protected String resolveCustomHttpMethod(@NonNull String customVerb,
																					 @NonNull List<@Nullable String> resources,
																					 @NonNull List<@NonNull Parameter> arguments) {
		requireNonNull(customVerb);
		requireNonNull(resources);
		requireNonNull(arguments);

		if (CONVENTIONAL_ACTION_VERBS.contains(customVerb))
			return HttpMethod.GET.getToken();

		if (arguments.size() < resources.size())
			return HttpMethod.GET.getToken();

		return HttpMethod.PATCH.getToken();
	}

	/**
	 * Builds the route for {@code routeDraft} as refined by {@code routeDeclaration}.
	 * <p>
	 * Every call returns a new {@link Route}; neither argument is modified.
	 *
	 * @param routeDraft       the convention-derived draft
	 * @param routeDeclaration the declaration to apply, or {@code null} for a purely conventional route
	 * @return the materialized route
	 */
	@NonNull
	protected Route materializeRoute(@NonNull RouteDraft routeDraft,
																	 @Nullable RouteDeclaration routeDeclaration) {
		requireNonNull(routeDraft);

		RouteDeriverConfig routeDeriverConfig = getRouteDeriverConfig();
		String path = routeDraft.path();
		List<String> methods = Arrays.asList(routeDraft.httpMethod().toUpperCase(Locale.ROOT).split("\\|"));
		Map<String, String> defaults = new LinkedHashMap<>(routeDraft.defaults());
		Map<String, String> requirements = new LinkedHashMap<>();
		Map<String, String> options = Map.of();
		String host = null;
		List<String> schemes = List.of();
		String condition = null;

		if (routeDeclaration != null) {
			if (routeDeclaration.getMethods().size() > 0)
				methods = routeDeclaration.getMethods();

			if (routeDeclaration.getPath().isPresent())
				path = routeDeriverConfig.getRoutePrefix().orElse("") + routeDeclaration.getPath().get();

			requirements.putAll(routeDeclaration.getRequirements());
			options = routeDeclaration.getOptions();
			defaults.putAll(routeDeclaration.getDefaults());
			host = routeDeclaration.getHost().orElse(null);
			schemes = routeDeclaration.getSchemes();
			condition = conditionFor(routeDeclaration).orElse(null);
		}

		if (routeDeriverConfig.getIncludeFormat()) {
			path = format("%s.{%s}", path, FORMAT_PLACEHOLDER_NAME);

			if (!requirements.containsKey(FORMAT_PLACEHOLDER_NAME) && routeDeriverConfig.getFormats().size() > 0)
				requirements.put(FORMAT_PLACEHOLDER_NAME, String.join("|", routeDeriverConfig.getFormats().keySet()));
		}

		return Route.withPath(path)
				.methods(methods)
				.defaults(defaults)
				.requirements(requirements)
				.options(options)
				.host(host)
				.schemes(schemes)
				.condition(condition)
				.build();
	}

	/**
	 * The declaration's condition, restricted to the configured API version if there is one.
	 */
	@NonNull
	protected Optional<String> conditionFor(@NonNull RouteDeclaration routeDeclaration) {
		requireNonNull(routeDeclaration);

		String condition = routeDeclaration.getCondition().orElse(null);
		String version = getRouteDeriverConfig().getVersion().orElse(null);

		if (version == null)
			return Optional.ofNullable(condition);

		String versionCondition = format("request.attributes.get('version') == '%s'", version);
		return Optional.of(condition == null ? versionCondition : format("(%s) and %s", condition, versionCondition));
	}

	protected void writeRoute(@NonNull Method method,
														@NonNull String routeName,
														@NonNull Route route,
														@NonNull ParsedAction parsedAction,
														@Nullable RouteDeclaration routeDeclaration,
														@NonNull RouteCollection routeCollection,
														@Nullable List<@NonNull FallbackRoute> deferredFallbackRoutes) {
		requireNonNull(method);
		requireNonNull(routeName);
		requireNonNull(route);
		requireNonNull(parsedAction);
		requireNonNull(routeCollection);

		String name = routeName;

		if (routeDeclaration != null && routeDeclaration.getName().isPresent()) {
			String declaredName = routeDeclaration.getName().get();
			boolean methodPrefix = !"false".equals(routeDeclaration.getOptions().get(METHOD_PREFIX_OPTION_NAME));
			name = methodPrefix ? name + declaredName : declaredName;
		}

		String namePrefix = getRouteDeriverConfig().getNamePrefix().orElse("");
		String fullRouteName = namePrefix + name;

		// A collection whose name can't be told apart from its member gets an explicit "c" name plus a plain alias
		if (parsedAction.collection() && !parsedAction.inflectable()) {
			addRoute(method, namePrefix + ActionNameParser.COLLECTION_MARKER + name, route, routeCollection);

			FallbackRoute fallbackRoute = new FallbackRoute(method, fullRouteName, route.copy().finish());

			if (deferredFallbackRoutes == null)
				addFallbackRoute(fallbackRoute, routeCollection);
			else
				deferredFallbackRoutes.add(fallbackRoute);
		} else {
			addRoute(method, fullRouteName, route, routeCollection);
		}
	}

	protected void addFallbackRoute(@NonNull FallbackRoute fallbackRoute,
																	@NonNull RouteCollection routeCollection) {
		requireNonNull(fallbackRoute);
		requireNonNull(routeCollection);

		Route existingRoute = routeCollection.get(fallbackRoute.routeName()).orElse(null);

		if (existingRoute == null) {
			addRoute(fallbackRoute.method(), fallbackRoute.routeName(), fallbackRoute.route(), routeCollection);
			return;
		}

		Route route = fallbackRoute.route();
		boolean equivalent = existingRoute.getPath().equals(route.getPath()) && existingRoute.getMethods().equals(route.getMethods());

		LogEvent logEvent = LogEvent.with(equivalent ? LogEventType.FALLBACK_ROUTE_SKIPPED : LogEventType.FALLBACK_ROUTE_CONFLICT,
						equivalent
								? format("Did not register alias '%s' for %s because an equivalent route already has that name", fallbackRoute.routeName(), fallbackRoute.method())
								: format("Did not register alias '%s' for %s because a different route already has that name. Existing route: %s. Skipped route: %s",
								fallbackRoute.routeName(), fallbackRoute.method(), existingRoute, route))
				.method(fallbackRoute.method())
				.routeName(fallbackRoute.routeName())
				.build();

		getRouteDeriverConfig().getRouteDerivationObserver().didReceiveLogEvent(logEvent);
	}

	protected void addRoute(@NonNull Method method,
													@NonNull String routeName,
													@NonNull Route route,
													@NonNull RouteCollection routeCollection) {
		requireNonNull(method);
		requireNonNull(routeName);
		requireNonNull(route);
		requireNonNull(routeCollection);

		routeCollection.add(routeName, route);
		getRouteDeriverConfig().getRouteDerivationObserver().didRegisterRoute(method, routeName, route);
	}

	@NonNull
	protected String pluralizedResourceName(@NonNull String resource) {
		requireNonNull(resource);

		RouteDeriverConfig routeDeriverConfig = getRouteDeriverConfig();

		if (routeDeriverConfig.getPluralization() == Pluralization.NEVER)
			return resource;

		return routeDeriverConfig.getInflector().pluralize(resource);
	}

	protected void validateParents() {
		for (String parent : getRouteDeriverConfig().getParents())
			if (parent == null || Utilities.trimAggressively(parent).length() == 0 || parent.endsWith("/"))
				throw new IllegalArgumentException(format("Illegal parent resource name '%s'. Every parent controller must have a " +
						"get{SINGULAR}Action(id) method, where {SINGULAR} is the singular name of the resource it exposes", parent));
	}

	@NonNull
	protected List<@NonNull String> seedResourcesFromRouteResource(@NonNull Class<?> controllerClass,
																																 @NonNull RouteResource routeResource) {
		requireNonNull(controllerClass);
		requireNonNull(routeResource);

		String value = Utilities.trimAggressivelyToNull(routeResource.value());

		if (value == null)
			throw new IllegalArgumentException(format("@%s on %s must name a resource", RouteResource.class.getSimpleName(), controllerClass.getName()));

		return Arrays.stream(value.split("_"))
				.filter(resource -> resource.length() > 0)
				.collect(Collectors.toUnmodifiableList());
	}

	@NonNull
	protected List<@NonNull String> seedResourcesFromClassName(@NonNull Class<?> controllerClass) {
		requireNonNull(controllerClass);

		String simpleName = controllerClass.getSimpleName();

		if (simpleName.endsWith(CONTROLLER_CLASS_SUFFIX))
			simpleName = simpleName.substring(0, simpleName.length() - CONTROLLER_CLASS_SUFFIX.length());

		List<String> seedResources = Utilities.splitIntoWords(simpleName);

		if (seedResources.isEmpty())
			throw new IllegalArgumentException(format("Unable to derive a resource name from %s. Name the class <Resource>%s " +
					"or annotate it with @%s", controllerClass.getName(), CONTROLLER_CLASS_SUFFIX, RouteResource.class.getSimpleName()));

		return seedResources;
	}

	/**
	 * Public instance methods of {@code controllerClass}, including inherited ones, sorted by name and then parameter types.
	 */
	@NonNull
	protected List<@NonNull Method> actionCandidates(@NonNull Class<?> controllerClass) {
		requireNonNull(controllerClass);

		return Arrays.stream(controllerClass.getMethods())
				.filter(method -> method.getDeclaringClass() != Object.class)
				.filter(method -> !Modifier.isStatic(method.getModifiers()))
				.filter(method -> !method.isBridge() && !method.isSynthetic())
				.sorted(METHOD_ORDER)
				.collect(Collectors.toList());
	}

	@NonNull
	@Override
	public RouteDeriverConfig getRouteDeriverConfig() {
		return this.routeDeriverConfig;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{routeDeriverConfig=%s}", getClass().getSimpleName(), getRouteDeriverConfig());
	}

	/**
	 * Unprefixed alias of a collection route, registered only if its name is still free.
	 */
	@ThreadSafe
	record FallbackRoute(
			@NonNull
			Method method,
			@NonNull
			String routeName,
			@NonNull
			Route route
	) {
		FallbackRoute {
			requireNonNull(method);
			requireNonNull(routeName);
			requireNonNull(route);
		}
	}
}
