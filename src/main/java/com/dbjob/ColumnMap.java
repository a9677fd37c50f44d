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

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.Map;
import java.util.Objects;
import java.util.Optional;
import java.util.function.Function;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Per-job overrides for row mapping: column-to-field renames and per-column value converters.
 * <p>
 * Column names are matched ignoring case. Renames take precedence over {@link DatabaseColumn} aliases and name
 * matching. A column converter receives the non-null raw value and its result is then coerced to the field type.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class ColumnMap {
	@NonNull
	private static final ColumnMap EMPTY;

	static {
		EMPTY = new Builder().build();
	}

	@NonNull
	private final Map<@NonNull String, @NonNull String> fieldNamesByColumnName;
	@NonNull
	private final Map<@NonNull String, @NonNull Function<Object, Object>> convertersByColumnName;

	private ColumnMap(@NonNull Builder builder) {
		requireNonNull(builder);

		this.fieldNamesByColumnName = Collections.unmodifiableMap(new LinkedHashMap<>(builder.fieldNamesByColumnName));
		this.convertersByColumnName = Collections.unmodifiableMap(new LinkedHashMap<>(builder.convertersByColumnName));
	}

	@NonNull
	public static ColumnMap empty() {
		return EMPTY;
	}

	@NonNull
	public static Builder builder() {
		return new Builder();
	}

	@NonNull
	public Optional<String> fieldNameFor(@NonNull String columnName) {
		requireNonNull(columnName);
		return Optional.ofNullable(this.fieldNamesByColumnName.get(JobParameters.normalizeName(columnName)));
	}

	@NonNull
	public Optional<Function<Object, Object>> converterFor(@NonNull String columnName) {
		requireNonNull(columnName);
		return Optional.ofNullable(this.convertersByColumnName.get(JobParameters.normalizeName(columnName)));
	}

	@NonNull
	public Boolean isEmpty() {
		return this.fieldNamesByColumnName.isEmpty() && this.convertersByColumnName.isEmpty();
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof ColumnMap columnMap))
			return false;

		return Objects.equals(this.fieldNamesByColumnName, columnMap.fieldNamesByColumnName)
				&& Objects.equals(this.convertersByColumnName, columnMap.convertersByColumnName);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.fieldNamesByColumnName, this.convertersByColumnName);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{renames=%s, convertedColumns=%s}", getClass().getSimpleName(), this.fieldNamesByColumnName,
				this.convertersByColumnName.keySet());
	}

	/**
	 * Builder used to construct instances of {@link ColumnMap}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final Map<@NonNull String, @NonNull String> fieldNamesByColumnName;
		@NonNull
		private final Map<@NonNull String, @NonNull Function<Object, Object>> convertersByColumnName;

		private Builder() {
			this.fieldNamesByColumnName = new LinkedHashMap<>();
			this.convertersByColumnName = new LinkedHashMap<>();
		}

		@NonNull
		public Builder rename(@NonNull String columnName,
													@NonNull String fieldName) {
			requireNonNull(columnName);
			requireNonNull(fieldName);

			this.fieldNamesByColumnName.put(JobParameters.normalizeName(columnName), fieldName);
			return this;
		}

		@NonNull
		public Builder convert(@NonNull String columnName,
													 @NonNull Function<Object, Object> converter) {
			requireNonNull(columnName);
			requireNonNull(converter);

			this.convertersByColumnName.put(JobParameters.normalizeName(columnName), converter);
			return this;
		}

		@NonNull
		public ColumnMap build() {
			return new ColumnMap(this);
		}
	}
}
