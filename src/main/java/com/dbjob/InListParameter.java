/*
 * Copyright 2015-2022 Transmogrify LLC, 2022-2026 Revetware LLC.
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

package com.dbjob;

import org.jspecify.annotations.NonNull;

import javax.annotation.concurrent.ThreadSafe;
import java.util.List;

/**
 * A parameter value that expands into a parenthesized SQL {@code IN} list, one {@code ?} per element.
 * <p>
 * Standard instances are created via {@link Parameters#inList(java.util.Collection)} and its array overloads. Plain
 * {@link java.util.Collection} values are expanded the same way.
 *
 * @since 1.0.0
 */
@ThreadSafe
public interface InListParameter {
	/**
	 * Gets the elements to be expanded into {@code ?} placeholders.
	 *
	 * @return the elements for the {@code IN} list
	 */
	@NonNull
	List<Object> getElements();
}
