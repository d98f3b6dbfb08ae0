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
import org.junit.jupiter.api.Test;

import javax.annotation.concurrent.ThreadSafe;
import java.lang.reflect.Method;
import java.util.ArrayList;
import java.util.List;
import java.util.Set;

import static com.restroute.ActionRouteDeriverTests.method;
import static org.junit.jupiter.api.Assertions.assertEquals;
import static org.junit.jupiter.api.Assertions.assertFalse;
import static org.junit.jupiter.api.Assertions.assertSame;
import static org.junit.jupiter.api.Assertions.assertThrows;
import static org.junit.jupiter.api.Assertions.assertTrue;

@ThreadSafe
public class RouteDeriverConfigTests {
	@Test
	public void defaults() {
		RouteDeriverConfig routeDeriverConfig = RouteDeriverConfig.withDefaults().build();

		assertTrue(routeDeriverConfig.getRoutePrefix().isEmpty());
		assertTrue(routeDeriverConfig.getNamePrefix().isEmpty());
		assertTrue(routeDeriverConfig.getVersion().isEmpty());
		assertEquals(Pluralization.INFLECTOR_DEFAULT, routeDeriverConfig.getPluralization());
		assertTrue(routeDeriverConfig.getParents().isEmpty());
		assertFalse(routeDeriverConfig.getIncludeFormat());
		assertTrue(routeDeriverConfig.getFormats().isEmpty());
		assertSame(Inflector.defaultInstance(), routeDeriverConfig.getInflector());
		assertSame(AnnotationSource.defaultInstance(), routeDeriverConfig.getAnnotationSource());
	}

	@Test
	public void copyLeavesOriginalUntouched() {
		List<String> parents = new ArrayList<>(List.of("blog"));
		RouteDeriverConfig original = RouteDeriverConfig.withDefaults()
				.parents(parents)
				.version("v1")
				.build();

		parents.add("post");

		RouteDeriverConfig copy = original.copy()
				.version("v2")
				.pluralization(Pluralization.NEVER)
				.finish();

		assertEquals(List.of("blog"), original.getParents(), "Parents are copied on build");
		assertEquals("v1", original.getVersion().orElse(null));
		assertEquals(Pluralization.INFLECTOR_DEFAULT, original.getPluralization());
		assertEquals(List.of("blog"), copy.getParents());
		assertEquals("v2", copy.getVersion().orElse(null));
		assertEquals(Pluralization.NEVER, copy.getPluralization());
		assertThrows(UnsupportedOperationException.class, () -> original.getParents().add("post"));
	}

	@Test
	public void collaboratorsArePluggable() {
		AnnotationSource annotationSource = new AnnotationSource() {
			@NonNull
			@Override
			public List<RouteDeclaration> getClassDeclarations(@NonNull Class<?> type) {
				return List.of();
			}

			@NonNull
			@Override
			public List<RouteDeclaration> getMethodDeclarations(@NonNull Method method) {
				return List.of(RouteDeclaration.withType(RouteDeclarationType.GENERIC).methods(List.of("get", "post")).build());
			}
		};

		RouteDeriverConfig routeDeriverConfig = RouteDeriverConfig.withDefaults()
				.annotationSource(annotationSource)
				.queryParameterReader(method -> Set.of("id"))
				.inflector(word -> word + "-list")
				.build();

		RouteCollection routeCollection = RouteCollection.create();
		ActionRouteDeriver.withConfig(routeDeriverConfig).deriveRoutes(method(PluggableActions.class, "cgetAction"), List.of("book"), routeCollection);

		Route route = routeCollection.get("get_book-list").orElseThrow();
		assertEquals("book-list", route.getPath(), "The id parameter is a query parameter");
		assertEquals(List.of("GET", "POST"), route.getMethods());
	}
}

class PluggableActions {
	public List<String> cgetAction(String id) {
		return List.of(id);
	}
}
