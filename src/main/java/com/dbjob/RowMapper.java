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

import javax.annotation.concurrent.NotThreadSafe;
import java.util.ArrayList;
import java.util.List;
import java.util.Locale;

import static java.util.Objects.requireNonNull;

/**
 * Contract for building {@link MappingPlan}s that turn cursor rows into typed values.
 * <p>
 * A production-ready concrete implementation is available via the following static methods:
 * <ul>
 *   <li>{@link #withDefaultConfiguration()}</li>
 *   <li>{@link #withPlanCacheCapacity(Integer)} (builder)</li>
 *   <li>{@link #withColumnConverters(List)} (builder)</li>
 * </ul>
 * How to acquire an instance:
 * <pre>{@code  // With out-of-the-box defaults
 * RowMapper default = RowMapper.withDefaultConfiguration();
 *
 * // Customized
 * RowMapper custom = RowMapper.withPlanCacheCapacity(256)
 *   .columnConverters(List.of(moneyConverter))
 *   .build();}</pre>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface RowMapper {
	/**
	 * Provides a plan for mapping rows of the given schema to {@code targetType}.
	 * <p>
	 * Implementations are expected to be pure: the same inputs always yield an equivalent plan, so plans may be cached.
	 *
	 * @param columns    the segment's column schema
	 * @param targetType the type each row maps to
	 * @param columnMap  per-job renames and converters
	 * @param <T>        the target type
	 * @return the mapping plan
	 * @throws DatabaseException of kind {@link ErrorKind#MAPPING} if {@code targetType} cannot be mapped to
	 */
	@NonNull
	<T> MappingPlan<T> planFor(@NonNull List<@NonNull DbColumn> columns,
														 @NonNull Class<T> targetType,
														 @NonNull ColumnMap columnMap);

	/**
	 * Acquires a concrete implementation of this interface with out-of-the-box defaults.
	 * <p>
	 * The returned instance is thread-safe.
	 *
	 * @return a concrete implementation of this interface with out-of-the-box defaults
	 */
	@NonNull
	static RowMapper withDefaultConfiguration() {
		return new Builder().build();
	}

	@NonNull
	static Builder withPlanCacheCapacity(@NonNull Integer planCacheCapacity) {
		requireNonNull(planCacheCapacity);
		return new Builder().planCacheCapacity(planCacheCapacity);
	}

	@NonNull
	static Builder withColumnConverters(@NonNull List<@NonNull ColumnConverter> columnConverters) {
		requireNonNull(columnConverters);
		return new Builder().columnConverters(columnConverters);
	}

	/**
	 * Builder used to construct a standard implementation of {@link RowMapper}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	class Builder {
		@NonNull
		static final Integer DEFAULT_PLAN_CACHE_CAPACITY = 1024;

		@NonNull
		Integer planCacheCapacity;
		@NonNull
		List<@NonNull ColumnConverter> columnConverters;
		@NonNull
		Locale normalizationLocale;

		private Builder() {
			this.planCacheCapacity = DEFAULT_PLAN_CACHE_CAPACITY;
			this.columnConverters = List.of();
			this.normalizationLocale = Locale.ROOT;
		}

		@NonNull
		public Builder planCacheCapacity(@NonNull Integer planCacheCapacity) {
			this.planCacheCapacity = requireNonNull(planCacheCapacity);
			return this;
		}

		/**
		 * Converters consulted in order, before the built-in coercions.
		 *
		 * @param columnConverters the converters
		 * @return this builder
		 */
		@NonNull
		public Builder columnConverters(@NonNull List<@NonNull ColumnConverter> columnConverters) {
			this.columnConverters = List.copyOf(new ArrayList<>(requireNonNull(columnConverters)));
			return this;
		}

		@NonNull
		public Builder normalizationLocale(@Nullable Locale normalizationLocale) {
			this.normalizationLocale = normalizationLocale == null ? Locale.ROOT : normalizationLocale;
			return this;
		}

		@NonNull
		public RowMapper build() {
			return new DefaultRowMapper(this);
		}
	}
}
