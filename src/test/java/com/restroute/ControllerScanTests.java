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
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ThreadSafe
public class ControllerScanTests {
	@Test
	public void routeResourceSeedsNestedResources() {
		RouteCollection routeCollection = ActionRouteDeriver.withConfig(RouteDeriverConfig.withDefaults().build())
				.deriveRoutes(UserPostController.class);

		assertEquals(Set.of("get_user_post", "get_user_posts"), routeCollection.getRoutes().keySet());
		assertEquals("user/{user}/post/{id}", routeCollection.get("get_user_post").orElseThrow().getPath());
		assertEquals("user/{user}/posts", routeCollection.get("get_user_posts").orElseThrow().getPath());
	}

	@Test
	public void routeResourceCanDisablePluralization() {
		RouteCollection routeCollection = ActionRouteDeriver.withConfig(RouteDeriverConfig.withDefaults().build())
				.deriveRoutes(SingularPostController.class);

		assertEquals(Set.of("cget_post", "get_post"), routeCollection.getRoutes().keySet());
	}

	@Test
	public void classResourceSeedsFromClassName() {
		RouteCollection routeCollection = ActionRouteDeriver.withConfig(RouteDeriverConfig.withDefaults().build())
				.deriveRoutes(UserCommentController.class);

		Route route = routeCollection.get("get_user_comment").orElseThrow();
		assertEquals("user/{user}/comment/{id}", route.getPath());
		assertEquals(UserCommentController.class.getName() + "::getAction", route.getDefaults().get("_controller"));
	}

	@Test
	public void classResourceNeedsResourceName() {
		IllegalArgumentException exception = assertThrows(IllegalArgumentException.class, () ->
				ActionRouteDeriver.withConfig(RouteDeriverConfig.withDefaults().build()).deriveRoutes(Controller.class));

		assertTrue(exception.getMessage().contains(Controller.class.getName()));
	}

	@Test
	public void classResourceKeepsLowercaseLeadingWord() {
		RouteCollection routeCollection = ActionRouteDeriver.withConfig(RouteDeriverConfig.withDefaults().build())
				.deriveRoutes(apiUserController.class);

		assertEquals("api/{api}/user/{id}", routeCollection.get("get_api_user").orElseThrow().getPath());
	}

	@Test
	public void memberRouteWinsOverCollectionAlias() {
		ScanObserver scanObserver = new ScanObserver();
		RouteDeriverConfig routeDeriverConfig = RouteDeriverConfig.withDefaults()
				.routeDerivationObserver(scanObserver)
				.build();

		RouteCollection routeCollection = ActionRouteDeriver.withConfig(routeDeriverConfig).deriveRoutes(SheepController.class);

		assertEquals(List.of("cget_sheep", "get_sheep"), new ArrayList<>(routeCollection.getRoutes().keySet()));
		assertEquals("sheep", routeCollection.get("cget_sheep").orElseThrow().getPath());
		assertEquals("sheep/{id}", routeCollection.get("get_sheep").orElseThrow().getPath());
		assertEquals(List.of(LogEventType.FALLBACK_ROUTE_CONFLICT), scanObserver.getLogEventTypes());
	}

	@Test
	public void onlyPublicInstanceActionsAreRead() {
		ScanObserver scanObserver = new ScanObserver();
		RouteDeriverConfig routeDeriverConfig = RouteDeriverConfig.withDefaults()
				.routeDerivationObserver(scanObserver)
				.build();

		RouteCollection routeCollection = ActionRouteDeriver.withConfig(routeDeriverConfig).deriveRoutes(UserPostController.class);

		assertEquals(List.of("describe"), scanObserver.getSkippedMethodNames(), "Object methods and static methods are not candidates");
		assertEquals(List.of("get_user_posts", "get_user_post"), scanObserver.getRegisteredRouteNames(), "Methods are read in name order");
		assertEquals(2, routeCollection.size());
	}

	@Test
	public void inheritedActionsAreRead() {
		RouteCollection routeCollection = ActionRouteDeriver.withConfig(RouteDeriverConfig.withDefaults().build())
				.deriveRoutes(ArchivingUserCommentController.class);

		assertEquals(Set.of("get_user_comment", "archive_user_comment"), routeCollection.getRoutes().keySet());
		assertEquals(List.of("GET"), routeCollection.get("archive_user_comment").orElseThrow().getMethods());
		assertEquals("user/{user}/comment/archive", routeCollection.get("archive_user_comment").orElseThrow().getPath());
		assertEquals(CommentActionsBase.class.getName() + "::getAction",
				routeCollection.get("get_user_comment").orElseThrow().getDefaults().get("_controller"));
	}

	@Test
	public void parentsAreValidatedBeforeScanning() {
		ScanObserver scanObserver = new ScanObserver();
		RouteDeriverConfig routeDeriverConfig = RouteDeriverConfig.withDefaults()
				.parents(List.of("blog/"))
				.routeDerivationObserver(scanObserver)
				.build();

		RouteCollection routeCollection = RouteCollection.create();

		assertThrows(IllegalArgumentException.class, () ->
				ActionRouteDeriver.withConfig(routeDeriverConfig).deriveRoutes(UserPostController.class, routeCollection));

		assertEquals(0, routeCollection.size());
		assertTrue(scanObserver.getRegisteredRouteNames().isEmpty());
	}

	@Test
	public void scanHonorsParentsAndPrefixes() {
		RouteDeriverConfig routeDeriverConfig = RouteDeriverConfig.withDefaults()
				.parents(List.of("blog"))
				.routePrefix("api")
				.namePrefix("v1_")
				.build();

		RouteCollection routeCollection = ActionRouteDeriver.withConfig(routeDeriverConfig).deriveRoutes(UserPostController.class);

		assertEquals(Set.of("v1_get_blog_user_post", "v1_get_blog_user_posts"), routeCollection.getRoutes().keySet());
		assertEquals("blog/{user}/api/user/{id}/post", routeCollection.get("v1_get_blog_user_post").orElseThrow().getPath());
	}

	@ThreadSafe
	static class ScanObserver implements RouteDerivationObserver {
		private final List<String> skippedMethodNames = new ArrayList<>();
		private final List<String> registeredRouteNames = new ArrayList<>();
		private final List<LogEventType> logEventTypes = new ArrayList<>();

		@Override
		public synchronized void didSkipMethod(@NonNull Method method,
																					 @NonNull SkipReason skipReason) {
			this.skippedMethodNames.add(method.getName());
		}

		@Override
		public synchronized void didRegisterRoute(@NonNull Method method,
																							@NonNull String routeName,
																							@NonNull Route route) {
			this.registeredRouteNames.add(routeName);
		}

		@Override
		public synchronized void didReceiveLogEvent(@NonNull LogEvent logEvent) {
			this.logEventTypes.add(logEvent.getLogEventType());
		}

		synchronized List<String> getSkippedMethodNames() {
			return new ArrayList<>(this.skippedMethodNames);
		}

		synchronized List<String> getRegisteredRouteNames() {
			return new ArrayList<>(this.registeredRouteNames);
		}

		synchronized List<LogEventType> getLogEventTypes() {
			return new ArrayList<>(this.logEventTypes);
		}
	}
}

@RouteResource("user_post")
class UserPostController {
	public String getAction(String user, String id) {
		return id;
	}

	public List<String> cgetAction(String user) {
		return List.of(user);
	}

	public String describe() {
		return "posts by user";
	}

	public static String getStaticAction() {
		return "static";
	}
}

@RouteResource(value = "post", pluralize = Pluralization.NEVER)
class SingularPostController {
	public List<String> cgetAction() {
		return List.of();
	}
}

@RouteResource("sheep")
class SheepController {
	public List<String> cgetAction() {
		return List.of();
	}

	public String getAction(String id) {
		return id;
	}
}

class UserCommentController implements ClassResource {
	public String getAction(String user, String id) {
		return id;
	}
}

class CommentActionsBase {
	public String getAction(String user, String id) {
		return id;
	}
}

@RouteResource("user_comment")
class ArchivingUserCommentController extends CommentActionsBase {
	public List<String> archiveAction(String user) {
		return List.of(user);
	}
}

class apiUserController implements ClassResource {
	public String getAction(String api, String id) {
		return id;
	}
}

class Controller implements ClassResource {
	public String getAction(String id) {
		return id;
	}
}
