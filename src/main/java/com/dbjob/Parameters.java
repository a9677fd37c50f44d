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
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Collection;
import java.util.Collections;
import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Fluent interface for acquiring instances of specialized parameter types.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class Parameters {
	private Parameters() {
		// Non-instantiable
	}

	/**
	 * Acquires a parameter for SQL {@code IN} list expansion using a {@link Collection}.
	 *
	 * @param elements the elements to expand into {@code ?} placeholders
	 * @param <E>      the element type
	 * @return an IN-list parameter for the given elements
	 */
	@NonNull
	public static <E> InListParameter inList(@NonNull Collection<E> elements) {
		requireNonNull(elements);
		return new DefaultInListParameter(new ArrayList<>(elements));
	}

	@NonNull
	public static <E> InListParameter inList(@NonNull E[] elements) {
		requireNonNull(elements);
		return new DefaultInListParameter(Arrays.asList(elements.clone()));
	}

	@NonNull
	public static InListParameter inList(@NonNull int[] elements) {
		requireNonNull(elements);
		List<Object> boxed = new ArrayList<>(elements.length);

		for (int element : elements)
			boxed.add(element);

		return new DefaultInListParameter(boxed);
	}

	@NonNull
	public static InListParameter inList(@NonNull long[] elements) {
		requireNonNull(elements);
		List<Object> boxed = new ArrayList<>(elements.length);

		for (long element : elements)
			boxed.add(element);

		return new DefaultInListParameter(boxed);
	}

	/**
	 * Default package-private implementation of {@link InListParameter}.
	 *
	 * @since 1.0.0
	 */
	@ThreadSafe
	static class DefaultInListParameter implements InListParameter {
		@NonNull
		private final List<Object> elements;

		DefaultInListParameter(@NonNull List<Object> elements) {
			requireNonNull(elements);
			this.elements = Collections.unmodifiableList(elements);
		}

		@NonNull
		@Override
		public List<Object> getElements() {
			return this.elements;
		}

		@Override
		@NonNull
		public String toString() {
			return format("%s%s", InListParameter.class.getSimpleName(), this.elements);
		}
	}
}
