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

import com.restroute.annotation.GET;
import com.restroute.annotation.NoRoute;
import com.restroute.annotation.PATCH;
import com.restroute.annotation.POST;
import com.restroute.annotation.QueryParameter;
import org.jspecify.annotations.NonNull;
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.lang.reflect.Method;
import java.lang.reflect.Parameter;
import java.util.ArrayList;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ThreadSafe
public class ActionRouteDeriverTests {
	@Test
	public void memberActionOfSeedResource() {
		RouteCollection routeCollection = derive(RouteDeriverConfig.withDefaults().build(), PostActions.class, "getAction", "post");

		assertEquals(Set.of("get_post"), routeCollection.getRoutes().keySet());

		Route route = routeCollection.get("get_post").orElseThrow();
		assertEquals("post", route.getPath());
		assertEquals(List.of("GET"), route.getMethods());
		assertEquals(Map.of("_controller", PostActions.class.getName() + "::getAction"), route.getDefaults());
		assertTrue(route.getRequirements().isEmpty());
		assertTrue(route.getCondition().isEmpty());
		assertTrue(route.getHost().isEmpty());
	}

	@Test
	public void newActionPluralizesPathAndResolvesToGet() {
		RouteCollection routeCollection = derive(RouteDeriverConfig.withDefaults().build(), CommentActions.class, "newCommentAction");

		Route route = routeCollection.get("new_comment").orElseThrow();
		assertEquals("comments/new", route.getPath());
		assertEquals(List.of("GET"), route.getMethods());
	}

	@Test
	public void collectionActionUsesPluralResource() {
		RouteCollection routeCollection = derive(RouteDeriverConfig.withDefaults().build(), PostActions.class, "cgetAction", "post");

		assertEquals(Set.of("get_posts"), routeCollection.getRoutes().keySet(), "An inflectable collection registers once");
		assertEquals("posts", routeCollection.get("get_posts").orElseThrow().getPath());
	}

	@Test
	public void nestedResourceUnderParent() {
		RouteDeriverConfig routeDeriverConfig = RouteDeriverConfig.withDefaults()
				.parents(List.of("post"))
				.build();

		RouteCollection routeCollection = derive(routeDeriverConfig, CommentActions.class, "putCommentAction");

		Route route = routeCollection.get("put_post_comment").orElseThrow();
		assertEquals("post/{id}/comment", route.getPath(), "Arguments pair with resources left to right");
		assertEquals(List.of("PUT"), route.getMethods());
		assertTrue(routeCollection.getSingularName().isEmpty());
	}

	@Test
	public void nestedResourceWithArgumentPerResource() {
		RouteDeriverConfig routeDeriverConfig = RouteDeriverConfig.withDefaults()
				.parents(List.of("post"))
				.build();

		RouteCollection routeCollection = derive(routeDeriverConfig, CommentActions.class, "getCommentAction");

		Route route = routeCollection.get("get_post_comment").orElseThrow();
		assertEquals("post/{post}/comment/{id}", route.getPath());
		assertEquals(List.of("post", "id"), route.getPlaceholderNames());
		assertEquals("Comment", routeCollection.getSingularName().orElse(null));
	}

	@Test
	public void formatSuffix() {
		Map<String, String> formats = new LinkedHashMap<>();
		formats.put("json", "application/json");
		formats.put("xml", "text/xml");

		RouteDeriverConfig routeDeriverConfig = RouteDeriverConfig.withDefaults()
				.includeFormat(true)
				.formats(formats)
				.build();

		Route conventional = derive(routeDeriverConfig, PostActions.class, "getAction", "post").get("get_post").orElseThrow();

		assertEquals("post.{_format}", conventional.getPath());
		assertEquals(Map.of("_format", "json|xml"), conventional.getRequirements());

		Route declared = derive(routeDeriverConfig, PostActions.class, "getFeedAction", "post").get("get_post_feed").orElseThrow();

		assertEquals("post/feed.{_format}", declared.getPath());
		assertEquals(Map.of("_format", "json"), declared.getRequirements(), "A declared format requirement wins");
	}

	@Test
	public void formatSuffixWithoutKnownFormats() {
		RouteDeriverConfig routeDeriverConfig = RouteDeriverConfig.withDefaults()
				.includeFormat(true)
				.build();

		Route route = derive(routeDeriverConfig, PostActions.class, "getAction", "post").get("get_post").orElseThrow();

		assertEquals("post.{_format}", route.getPath());
		assertTrue(route.getRequirements().isEmpty());
	}

	@Test
	public void versionConditionIsCombinedWithDeclaredCondition() {
		RouteDeriverConfig routeDeriverConfig = RouteDeriverConfig.withDefaults()
				.version("v2")
				.build();

		Route conditional = derive(routeDeriverConfig, PostActions.class, "getFeedAction", "post").get("get_post_feed").orElseThrow();

		assertEquals("(request.headers.get('X') == 'y') and request.attributes.get('version') == 'v2'", conditional.getCondition().orElse(null));

		Route declared = derive(routeDeriverConfig, PostActions.class, "patchAction", "post").get("patch_post").orElseThrow();

		assertEquals("request.attributes.get('version') == 'v2'", declared.getCondition().orElse(null));

		Route conventional = derive(routeDeriverConfig, PostActions.class, "getAction", "post").get("get_post").orElseThrow();

		assertTrue(conventional.getCondition().isEmpty(), "Undeclared routes are not version-conditioned");
	}

	@Test
	public void declarationsRefineConventionalRoute() {
		RouteCollection routeCollection = derive(RouteDeriverConfig.withDefaults().build(), PostActions.class, "getFeedAction", "post");

		Route route = routeCollection.get("get_post_feed").orElseThrow();
		assertEquals("post/feed", route.getPath());
		assertEquals(List.of("GET"), route.getMethods());
		assertEquals("feeds.example.com", route.getHost().orElse(null));
		assertEquals(List.of("https"), route.getSchemes());
		assertEquals(Map.of("cache", "true"), route.getOptions());
		assertEquals(PostActions.class.getName() + "::getFeedAction", route.getDefaults().get("_controller"));
		assertEquals("atom", route.getDefaults().get("flavor"));
	}

	@Test
	public void declaredPathIsPrefixed() {
		RouteDeriverConfig routeDeriverConfig = RouteDeriverConfig.withDefaults()
				.routePrefix("api/")
				.build();

		Route route = derive(routeDeriverConfig, PostActions.class, "patchAction", "post").get("patch_post").orElseThrow();

		assertEquals("api/posts/{slug}/touch", route.getPath());
		assertEquals(List.of("PATCH"), route.getMethods());
	}

	@Test
	public void routePrefixFollowsParents() {
		RouteDeriverConfig routeDeriverConfig = RouteDeriverConfig.withDefaults()
				.parents(List.of("post"))
				.routePrefix("api")
				.build();

		Route route = derive(routeDeriverConfig, CommentActions.class, "getCommentAction").get("get_post_comment").orElseThrow();

		assertEquals("post/{post}/api/comment/{id}", route.getPath());
	}

	@Test
	public void namePrefix() {
		RouteDeriverConfig routeDeriverConfig = RouteDeriverConfig.withDefaults()
				.namePrefix("api_")
				.build();

		RouteCollection routeCollection = derive(routeDeriverConfig, PostActions.class, "getAction", "post");

		assertEquals(Set.of("api_get_post"), routeCollection.getRoutes().keySet());
	}

	@Test
	public void declaredNamesAreAppendedUnlessMethodPrefixIsOff() {
		RouteCollection routeCollection = derive(RouteDeriverConfig.withDefaults().build(), PostActions.class, "lockAction", "post");

		assertEquals(Set.of("lock_post_now", "freeze_post"), routeCollection.getRoutes().keySet());
		assertEquals(List.of("POST"), routeCollection.get("lock_post_now").orElseThrow().getMethods());
		assertEquals(List.of("PATCH"), routeCollection.get("freeze_post").orElseThrow().getMethods());
		assertEquals("post/{slug}/lock", routeCollection.get("freeze_post").orElseThrow().getPath());
	}

	@Test
	public void genericDeclarationKeepsConventionalMethodsUnlessGiven() {
		RouteCollection routeCollection = derive(RouteDeriverConfig.withDefaults().build(), PostActions.class, "headAction", "post");

		assertEquals(List.of("HEAD"), routeCollection.get("head_post").orElseThrow().getMethods());
		assertEquals(List.of("GET", "HEAD"), routeCollection.get("head_post_probe").orElseThrow().getMethods());
	}

	@Test
	public void unnamedDuplicateDeclarationsCollide() {
		assertThrows(IllegalStateException.class, () ->
				derive(RouteDeriverConfig.withDefaults().build(), CollidingActions.class, "deleteAction", "post"));
	}

	@Test
	public void invariantNounRegistersCollectionAndAlias() {
		RouteCollection routeCollection = derive(RouteDeriverConfig.withDefaults().build(), SheepActions.class, "cgetAction", "sheep");

		assertEquals(List.of("cget_sheep", "get_sheep"), new ArrayList<>(routeCollection.getRoutes().keySet()));

		Route collectionRoute = routeCollection.get("cget_sheep").orElseThrow();
		Route aliasRoute = routeCollection.get("get_sheep").orElseThrow();

		assertEquals(collectionRoute, aliasRoute);
		assertFalse(collectionRoute == aliasRoute, "The alias must be a separate route instance");
		assertEquals("sheep", aliasRoute.getPath());
	}

	@Test
	public void aliasIsSkippedWhenNameIsTaken() {
		RecordingObserver recordingObserver = new RecordingObserver();
		RouteDeriverConfig routeDeriverConfig = RouteDeriverConfig.withDefaults()
				.routeDerivationObserver(recordingObserver)
				.build();

		Route occupant = Route.withPath("flock/{id}").methods(List.of("GET")).build();
		RouteCollection routeCollection = RouteCollection.create();
		routeCollection.add("get_sheep", occupant);

		ActionRouteDeriver.withConfig(routeDeriverConfig).deriveRoutes(method(SheepActions.class, "cgetAction"), List.of("sheep"), routeCollection);

		assertEquals(2, routeCollection.size());
		assertTrue(routeCollection.get("cget_sheep").isPresent());
		assertEquals(occupant, routeCollection.get("get_sheep").orElseThrow());
		assertEquals(Set.of("cget_sheep"), recordingObserver.getRegisteredRoutes().keySet());
		assertEquals(1, recordingObserver.getLogEvents().size());
		assertEquals(LogEventType.FALLBACK_ROUTE_CONFLICT, recordingObserver.getLogEvents().get(0).getLogEventType());
		assertEquals("get_sheep", recordingObserver.getLogEvents().get(0).getRouteName().orElse(null));
	}

	@Test
	public void equivalentOccupantIsReportedAsSkip() {
		RecordingObserver recordingObserver = new RecordingObserver();
		RouteDeriverConfig routeDeriverConfig = RouteDeriverConfig.withDefaults()
				.routeDerivationObserver(recordingObserver)
				.build();

		RouteCollection routeCollection = RouteCollection.create();
		routeCollection.add("get_sheep", Route.withPath("sheep").methods(List.of("GET")).build());

		ActionRouteDeriver.withConfig(routeDeriverConfig).deriveRoutes(method(SheepActions.class, "cgetAction"), List.of("sheep"), routeCollection);

		assertEquals(LogEventType.FALLBACK_ROUTE_SKIPPED, recordingObserver.getLogEvents().get(0).getLogEventType());
	}

	@Test
	public void neverPluralizeRegistersAlias() {
		RouteDeriverConfig routeDeriverConfig = RouteDeriverConfig.withDefaults()
				.pluralization(Pluralization.NEVER)
				.build();

		RouteCollection routeCollection = derive(routeDeriverConfig, PostActions.class, "cgetAction", "post");

		assertEquals(Set.of("cget_post", "get_post"), routeCollection.getRoutes().keySet());
		assertEquals("post", routeCollection.get("cget_post").orElseThrow().getPath());
	}

	@Test
	public void invalidParentsAbortDerivation() {
		for (String parent : List.of("", " ", "post/")) {
			RouteDeriverConfig routeDeriverConfig = RouteDeriverConfig.withDefaults()
					.parents(List.of("user", parent))
					.build();

			IllegalArgumentException exception = assertThrows(IllegalArgumentException.class, () ->
					derive(routeDeriverConfig, CommentActions.class, "getCommentAction"));

			assertTrue(exception.getMessage().contains("get{SINGULAR}Action"), "Expected a hint on how to fix the parent");
		}
	}

	@Test
	public void customVerbs() {
		RouteDeriverConfig routeDeriverConfig = RouteDeriverConfig.withDefaults().build();

		Route lock = derive(routeDeriverConfig, UserActions.class, "lockUserAction").get("lock_user").orElseThrow();
		assertEquals("user/{id}/lock", lock.getPath());
		assertEquals(List.of("PATCH"), lock.getMethods(), "A custom verb on an identified member is a PATCH");

		Route archive = derive(routeDeriverConfig, UserActions.class, "archiveUsersAction").get("archive_users").orElseThrow();
		assertEquals("users/archive", archive.getPath());
		assertEquals(List.of("GET"), archive.getMethods(), "A custom verb on a collection is a GET");

		Route edit = derive(routeDeriverConfig, UserActions.class, "editUserAction").get("edit_user").orElseThrow();
		assertEquals("user/{id}/edit", edit.getPath());
		assertEquals(List.of("GET"), edit.getMethods());

		Route remove = derive(routeDeriverConfig, UserActions.class, "removeUserAction").get("remove_user").orElseThrow();
		assertEquals("user/{id}/remove", remove.getPath());
		assertEquals(List.of("GET"), remove.getMethods());
	}

	@Test
	public void postActionPluralizesPath() {
		Route route = derive(RouteDeriverConfig.withDefaults().build(), CommentActions.class, "postCommentAction").get("post_comment").orElseThrow();

		assertEquals("comments", route.getPath());
		assertEquals(List.of("POST"), route.getMethods());
	}

	@Test
	public void rootActionWithArgument() {
		Route route = derive(RouteDeriverConfig.withDefaults().build(), RootActions.class, "getAction").get("get").orElseThrow();

		assertEquals("{id}", route.getPath());
	}

	@Test
	public void queryAndInjectedParametersAreNotPlaceholders() {
		RouteDeriverConfig routeDeriverConfig = RouteDeriverConfig.withDefaults()
				.injectedParameterPolicy(InjectedParameterPolicy.forTypes(Set.of(RequestContext.class)))
				.build();

		Route route = derive(routeDeriverConfig, UserActions.class, "getUserPostsAction").get("get_user_posts").orElseThrow();

		assertEquals("user/{userId}/posts", route.getPath());
		assertEquals(List.of("userId"), route.getPlaceholderNames());
	}

	@Test
	public void placeholdersFollowRoutableArguments() {
		RouteDeriverConfig routeDeriverConfig = RouteDeriverConfig.withDefaults()
				.injectedParameterPolicy(InjectedParameterPolicy.forTypes(Set.of(RequestContext.class)))
				.build();

		for (String methodName : List.of("getUserCommentAction", "getUserPostsAction", "lockUserAction", "editUserAction")) {
			Method method = method(UserActions.class, methodName);
			RouteCollection routeCollection = RouteCollection.create();

			ActionRouteDeriver.withConfig(routeDeriverConfig).deriveRoutes(method, List.of(), routeCollection);

			List<String> expectedPlaceholderNames = new ArrayList<>();

			for (Parameter parameter : method.getParameters())
				if (!parameter.isAnnotationPresent(QueryParameter.class) && parameter.getType() != RequestContext.class)
					expectedPlaceholderNames.add(parameter.getName());

			for (Route route : routeCollection.getRoutes().values())
				assertEquals(expectedPlaceholderNames, route.getPlaceholderNames(), String.format("Wrong placeholders for %s", methodName));
		}
	}

	@Test
	public void noRouteDeclarations() {
		RecordingObserver recordingObserver = new RecordingObserver();
		RouteDeriverConfig routeDeriverConfig = RouteDeriverConfig.withDefaults()
				.routeDerivationObserver(recordingObserver)
				.build();

		assertEquals(0, derive(routeDeriverConfig, PostActions.class, "hiddenAction", "post").size());
		assertEquals(0, derive(routeDeriverConfig, PostActions.class, "_internalAction", "post").size());
		assertEquals(0, derive(routeDeriverConfig, PostActions.class, "helper", "post").size());
		assertEquals(0, derive(routeDeriverConfig, HiddenActions.class, "getAction", "secret").size());
		assertEquals(1, derive(routeDeriverConfig, HiddenActions.class, "getVisibleAction", "secret").size(),
				"A method-level route overrides a class-level exclusion");

		assertEquals(List.of(SkipReason.NO_ROUTE_DECLARED, SkipReason.INTERNAL_NAME, SkipReason.UNRECOGNIZED_NAME, SkipReason.NO_ROUTE_DECLARED),
				recordingObserver.getSkipReasons());

		DefaultActionRouteDeriver actionRouteDeriver = new DefaultActionRouteDeriver(routeDeriverConfig);

		assertFalse(actionRouteDeriver.isEligible(method(PostActions.class, "hiddenAction")));
		assertFalse(actionRouteDeriver.isEligible(method(PostActions.class, "_internalAction")));
		assertFalse(actionRouteDeriver.isEligible(method(HiddenActions.class, "getAction")));
		assertTrue(actionRouteDeriver.isEligible(method(HiddenActions.class, "getVisibleAction")));
		assertTrue(actionRouteDeriver.isEligible(method(PostActions.class, "helper")), "Naming is checked after eligibility");
	}

	@Test
	public void derivationIsRepeatable() {
		RouteDeriverConfig routeDeriverConfig = RouteDeriverConfig.withDefaults()
				.parents(List.of("post"))
				.version("v1")
				.includeFormat(true)
				.build();

		RouteCollection first = ActionRouteDeriver.withConfig(routeDeriverConfig).deriveRoutes(CommentActions.class);
		RouteCollection second = ActionRouteDeriver.withConfig(routeDeriverConfig).deriveRoutes(CommentActions.class);

		assertEquals(4, first.size());
		assertEquals(first.getRoutes(), second.getRoutes());
		assertEquals(new ArrayList<>(first.getRoutes().keySet()), new ArrayList<>(second.getRoutes().keySet()));
	}

	@NonNull
	private RouteCollection derive(@NonNull RouteDeriverConfig routeDeriverConfig,
																 @NonNull Class<?> controllerClass,
																 @NonNull String methodName,
																 @NonNull String... seedResources) {
		RouteCollection routeCollection = RouteCollection.create();
		ActionRouteDeriver.withConfig(routeDeriverConfig).deriveRoutes(method(controllerClass, methodName), List.of(seedResources), routeCollection);
		return routeCollection;
	}

	@NonNull
	static Method method(@NonNull Class<?> type,
											 @NonNull String methodName) {
		for (Method method : type.getMethods())
			if (method.getName().equals(methodName))
				return method;

		throw new IllegalArgumentException(String.format("No method named %s on %s", methodName, type.getName()));
	}

	@ThreadSafe
	static class RecordingObserver implements RouteDerivationObserver {
		private final List<SkipReason> skipReasons = new ArrayList<>();
		private final List<LogEvent> logEvents = new ArrayList<>();
		private final Map<String, Route> registeredRoutes = new LinkedHashMap<>();

		@Override
		public synchronized void didSkipMethod(@NonNull Method method,
																					 @NonNull SkipReason skipReason) {
			this.skipReasons.add(skipReason);
		}

		@Override
		public synchronized void didRegisterRoute(@NonNull Method method,
																							@NonNull String routeName,
																							@NonNull Route route) {
			this.registeredRoutes.put(routeName, route);
		}

		@Override
		public synchronized void didReceiveLogEvent(@NonNull LogEvent logEvent) {
			this.logEvents.add(logEvent);
		}

		synchronized List<SkipReason> getSkipReasons() {
			return new ArrayList<>(this.skipReasons);
		}

		synchronized List<LogEvent> getLogEvents() {
			return new ArrayList<>(this.logEvents);
		}

		synchronized Map<String, Route> getRegisteredRoutes() {
			return new LinkedHashMap<>(this.registeredRoutes);
		}
	}
}

class RequestContext {
	// Stands in for a framework-supplied request object
}

class PostActions {
	public String getAction() {
		return "post";
	}

	public String cgetAction() {
		return "posts";
	}

	@GET(value = "post/feed", requirements = "_format=json", defaults = "flavor=atom", options = "cache=true",
			host = "feeds.example.com", schemes = "https", condition = "request.headers.get('X') == 'y'")
	public String getFeedAction() {
		return "feed";
	}

	@PATCH("posts/{slug}/touch")
	public String patchAction(String slug) {
		return slug;
	}

	@POST(name = "_now")
	@PATCH(name = "freeze_post", options = "method_prefix=false")
	public String lockAction(String slug) {
		return slug;
	}

	@com.restroute.annotation.Route
	@com.restroute.annotation.Route(name = "_probe", methods = {"get", "head"})
	public String headAction() {
		return "head";
	}

	@NoRoute
	public String hiddenAction() {
		return "hidden";
	}

	public String _internalAction() {
		return "internal";
	}

	public String helper() {
		return "helper";
	}
}

class CommentActions {
	public String newCommentAction() {
		return "form";
	}

	public String putCommentAction(String id) {
		return id;
	}

	public String getCommentAction(String post, String id) {
		return id;
	}

	public String postCommentAction() {
		return "created";
	}
}

class UserActions {
	public String lockUserAction(String id) {
		return id;
	}

	public String archiveUsersAction() {
		return "archived";
	}

	public String editUserAction(String id) {
		return id;
	}

	public String removeUserAction(String id) {
		return id;
	}

	public String getUserPostsAction(String userId, @QueryParameter Integer page, RequestContext requestContext) {
		return userId;
	}

	public String getUserCommentAction(String userId, String id) {
		return id;
	}
}

class CollidingActions {
	@GET
	@GET
	public String deleteAction(String slug) {
		return slug;
	}
}

class SheepActions {
	public String cgetAction() {
		return "flock";
	}
}

class RootActions {
	public String getAction(String id) {
		return id;
	}
}

@NoRoute
class HiddenActions {
	public String getAction() {
		return "hidden";
	}

	@GET
	public String getVisibleAction() {
		return "visible";
	}
}
