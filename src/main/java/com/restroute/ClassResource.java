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

/**
 * Marks a controller whose resource name is derived from its simple class name.
 * <p>
 * {@code UserCommentController implements ClassResource} seeds every action with {@code [User, Comment]},
 * so {@code getAction(id)} maps to {@code user/{...}/comment/{id}}-style paths without a {@link com.restroute.annotation.RouteResource}.
 */
public interface ClassResource {
	// Marker
}
