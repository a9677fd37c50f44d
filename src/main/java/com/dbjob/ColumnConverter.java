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

import javax.annotation.concurrent.ThreadSafe;
import java.util.Optional;

/**
 * Enables per-target-type custom column conversion, consulted before the built-in coercions.
 * <p>
 * Example: <pre>{@code  ColumnConverter moneyConverter = new ColumnConverter() {
 *   public Boolean appliesTo(Class<?> targetType) { return Money.class.equals(targetType); }
 *
 *   public ConversionResult convert(JobContext jobContext, DbColumn column, Object value, Class<?> targetType) {
 *     return ConversionResult.of(Money.ofMinor((Long) value));
 *   }
 * };}</pre>
 *
 * @since 1.0.0
 */
@ThreadSafe
public interface ColumnConverter {
	/**
	 * Converts a non-null column value.
	 *
	 * @param jobContext current job context
	 * @param column     the column being read
	 * @param value      the non-null value as read from the cursor
	 * @param targetType the field or result type
	 * @return the converted value, or {@link ConversionResult#fallback()} to defer to the next converter
	 * @throws Exception if conversion fails, reported as a {@link ColumnTypeMismatchException}
	 */
	@NonNull
	ConversionResult convert(@NonNull JobContext jobContext,
													 @NonNull DbColumn column,
													 @NonNull Object value,
													 @NonNull Class<?> targetType) throws Exception;

	/**
	 * @param targetType the field or result type
	 * @return {@code true} if this converter should be consulted for {@code targetType}
	 */
	@NonNull
	Boolean appliesTo(@NonNull Class<?> targetType);

	/**
	 * Result of a custom column conversion attempt.
	 *
	 * @since 1.0.0
	 */
	@ThreadSafe
	final class ConversionResult {
		@NonNull
		private static final ConversionResult FALLBACK;

		static {
			FALLBACK = new ConversionResult(null, false);
		}

		@Nullable
		private final Object value;
		@NonNull
		private final Boolean converted;

		private ConversionResult(@Nullable Object value,
														 @NonNull Boolean converted) {
			this.value = value;
			this.converted = converted;
		}

		@NonNull
		public static ConversionResult of(@Nullable Object value) {
			return new ConversionResult(value, true);
		}

		@NonNull
		public static ConversionResult fallback() {
			return FALLBACK;
		}

		@NonNull
		public Boolean isConverted() {
			return this.converted;
		}

		@NonNull
		public Optional<Object> getValue() {
			return Optional.ofNullable(this.value);
		}
	}
}
