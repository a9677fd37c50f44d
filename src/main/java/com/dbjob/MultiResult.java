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
import java.util.Collections;
import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Buffered outcome of a multi-segment read: one list per {@link ResultSlot}, in slot order.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class MultiResult {
	@NonNull
	private final List<@NonNull ResultSlot<?>> slots;
	@NonNull
	private final List<@NonNull List<?>> values;

	MultiResult(@NonNull List<@NonNull ResultSlot<?>> slots,
							@NonNull List<@NonNull List<?>> values) {
		requireNonNull(slots);
		requireNonNull(values);

		if (slots.size() != values.size())
			throw new IllegalArgumentException(format("%d slots but %d value lists", slots.size(), values.size()));

		List<List<?>> unmodifiableValues = new ArrayList<>(values.size());

		for (List<?> slotValues : values)
			unmodifiableValues.add(Collections.unmodifiableList(new ArrayList<>(slotValues)));

		this.slots = List.copyOf(slots);
		this.values = Collections.unmodifiableList(unmodifiableValues);
	}

	/**
	 * The rows mapped into {@code slot}.
	 *
	 * @param slot one of the slots this result was read with
	 * @return the slot's rows, empty if its segment was missing
	 * @throws IllegalArgumentException if {@code slot} was not part of the read
	 */
	@NonNull
	@SuppressWarnings("unchecked")
	public <T> List<T> get(@NonNull ResultSlot<T> slot) {
		requireNonNull(slot);

		for (int i = 0; i < this.slots.size(); ++i)
			if (this.slots.get(i) == slot)
				return (List<T>) this.values.get(i);

		throw new IllegalArgumentException(format("%s is not part of this result", slot));
	}

	/**
	 * The rows mapped into the slot at {@code index}.
	 *
	 * @param index       0-based slot index
	 * @param elementType the slot's element type
	 * @return the slot's rows
	 * @throws IllegalArgumentException if the slot at {@code index} has a different element type
	 */
	@NonNull
	@SuppressWarnings("unchecked")
	public <T> List<T> get(int index,
												 @NonNull Class<T> elementType) {
		requireNonNull(elementType);

		ResultSlot<?> slot = this.slots.get(index);

		if (!slot.getElementType().equals(elementType))
			throw new IllegalArgumentException(format("Slot %d holds %s, not %s", index, slot.getElementType().getName(), elementType.getName()));

		return (List<T>) this.values.get(index);
	}

	@NonNull
	public Integer size() {
		return this.slots.size();
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{slots=%s, values=%s}", getClass().getSimpleName(), this.slots, this.values);
	}
}
