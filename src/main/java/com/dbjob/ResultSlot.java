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

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A typed position in a multi-segment read.
 * <p>
 * Segment {@code k} of the command's result is mapped to the {@code k}th slot passed to
 * {@link DbConnector#readMultiple(String, Object, java.util.List)}. A required slot fails with
 * {@link EmptyResultException} if the command produced no segment for it; an optional slot yields an empty list.
 *
 * @param <T> the element type of the slot
 * @since 1.0.0
 */
@ThreadSafe
public final class ResultSlot<T> {
	@NonNull
	private final Class<T> elementType;
	@NonNull
	private final Boolean required;

	private ResultSlot(@NonNull Class<T> elementType,
										 @NonNull Boolean required) {
		this.elementType = requireNonNull(elementType);
		this.required = requireNonNull(required);
	}

	@NonNull
	public static <T> ResultSlot<T> of(@NonNull Class<T> elementType) {
		return new ResultSlot<>(elementType, false);
	}

	@NonNull
	public static <T> ResultSlot<T> required(@NonNull Class<T> elementType) {
		return new ResultSlot<>(elementType, true);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{elementType=%s, required=%s}", getClass().getSimpleName(), getElementType().getName(), isRequired());
	}

	@NonNull
	public Class<T> getElementType() {
		return this.elementType;
	}

	@NonNull
	public Boolean isRequired() {
		return this.required;
	}
}
