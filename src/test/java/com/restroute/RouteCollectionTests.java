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

import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.util.List;
import java.util.Map;

import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ThreadSafe
public class RouteCollectionTests {
	@Test
	public void duplicateNamesAreRejected() {
		RouteCollection routeCollection = RouteCollection.create();
		Route original = Route.withPath("posts").methods(List.of("GET")).build();

		routeCollection.add("get_posts", original);

		IllegalStateException exception = assertThrows(IllegalStateException.class, () ->
				routeCollection.add("get_posts", Route.withPath("articles").build()));

		assertTrue(exception.getMessage().contains("get_posts"));
		assertEquals(original, routeCollection.get("get_posts").orElseThrow(), "The existing route must not be overwritten");
	}

	@Test
	public void routesKeepRegistrationOrder() {
		RouteCollection routeCollection = RouteCollection.create();
		routeCollection.add("b", Route.withPath("b").build());
		routeCollection.add("a", Route.withPath("a").build());

		assertEquals(List.of("b", "a"), List.copyOf(routeCollection.getRoutes().keySet()));
		assertThrows(UnsupportedOperationException.class, () -> routeCollection.getRoutes().clear());
	}

	@Test
	public void placeholderNames() {
		Route route = Route.withPath("post/{postId}/comments/{id}.{_format}").build();

		assertEquals(List.of("postId", "id", "_format"), route.getPlaceholderNames());
		assertTrue(Route.withPath("posts").build().getPlaceholderNames().isEmpty());
	}

	@Test
	public void copiesAreIndependent() {
		Route route = Route.withPath("sheep")
				.methods(List.of("GET"))
				.defaults(Map.of("_controller", "SheepController::cgetAction"))
				.build();

		Route copy = route.copy().finish();
		Route modified = route.copy().path("flock").finish();

		assertEquals(route, copy);
		assertEquals("sheep", route.getPath());
		assertEquals("flock", modified.getPath());
		assertEquals(route.getDefaults(), modified.getDefaults());
	}

	@Test
	public void singularName() {
		RouteCollection routeCollection = RouteCollection.create();

		assertTrue(routeCollection.getSingularName().isEmpty());

		routeCollection.setSingularName("comment");
		assertEquals("comment", routeCollection.getSingularName().orElse(null));
	}
}
