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
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.GuardedBy;
import javax.annotation.concurrent.ThreadSafe;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Function;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A bounded, thread-safe least-recently-used cache.
 * <p>
 * Values are computed outside the lock, so two threads missing on the same key may both compute it. The first value
 * stored wins.
 *
 * @param <K> key type
 * @param <V> value type
 * @since 1.0.0
 */
@ThreadSafe
final class PlanCache<K, V> {
	@NonNull
	private final Integer capacity;
	@NonNull
	private final ReentrantLock lock;
	@NonNull
	@GuardedBy("lock")
	private final LinkedHashMap<K, V> entries;

	PlanCache(@NonNull Integer capacity) {
		requireNonNull(capacity);

		if (capacity < 1)
			throw new DatabaseException(ErrorKind.CONFIGURATION, JobComponent.ROW_MAPPER,
					format("Plan cache capacity must be at least 1, was %d", capacity));

		this.capacity = capacity;
		this.lock = new ReentrantLock();
		this.entries = new LinkedHashMap<>(Math.min(capacity, 64), 0.75f, true) {
			@Override
			protected boolean removeEldestEntry(Map.Entry<K, V> eldest) {
				return size() > PlanCache.this.capacity;
			}
		};
	}

	@NonNull
	V computeIfAbsent(@NonNull K key,
										@NonNull Function<? super K, ? extends V> mappingFunction) {
		requireNonNull(key);
		requireNonNull(mappingFunction);

		V existing = get(key);

		if (existing != null)
			return existing;

		V computed = requireNonNull(mappingFunction.apply(key));

		this.lock.lock();

		try {
			V raced = this.entries.get(key);

			if (raced != null)
				return raced;

			this.entries.put(key, computed);
			return computed;
		} finally {
			this.lock.unlock();
		}
	}

	@Nullable
	V get(@NonNull K key) {
		requireNonNull(key);

		this.lock.lock();

		try {
			return this.entries.get(key);
		} finally {
			this.lock.unlock();
		}
	}

	@NonNull
	Integer size() {
		this.lock.lock();

		try {
			return this.entries.size();
		} finally {
			this.lock.unlock();
		}
	}

	@NonNull
	Integer getCapacity() {
		return this.capacity;
	}
}
