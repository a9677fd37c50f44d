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
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A generic row: ordered columns paired with tagged values.
 * <p>
 * Duplicate column names are kept. Lookup by name is case-insensitive and returns the first matching column.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class DbRow {
	@NonNull
	private final List<@NonNull DbColumn> columns;
	@NonNull
	private final List<@NonNull DbValue> values;

	public DbRow(@NonNull List<@NonNull DbColumn> columns,
							 @NonNull List<@NonNull DbValue> values) {
		requireNonNull(columns);
		requireNonNull(values);

		if (columns.size() != values.size())
			throw new IllegalArgumentException(format("Row has %d columns but %d values", columns.size(), values.size()));

		this.columns = List.copyOf(columns);
		this.values = Collections.unmodifiableList(new ArrayList<>(values));
	}

	@NonNull
	public List<@NonNull DbColumn> getColumns() {
		return this.columns;
	}

	@NonNull
	public List<@NonNull DbValue> getValues() {
		return this.values;
	}

	@NonNull
	public Integer size() {
		return this.values.size();
	}

	/**
	 * @param columnIndex 0-based column index
	 * @return the value at that position
	 */
	@NonNull
	public DbValue get(int columnIndex) {
		return this.values.get(columnIndex);
	}

	/**
	 * @param columnName a column name, matched ignoring case
	 * @return the value of the first column with that name, or empty if there is none
	 */
	@NonNull
	public Optional<DbValue> get(@NonNull String columnName) {
		requireNonNull(columnName);

		for (int i = 0; i < this.columns.size(); ++i)
			if (this.columns.get(i).getName().equalsIgnoreCase(columnName))
				return Optional.of(this.values.get(i));

		return Optional.empty();
	}

	/**
	 * Shorthand for {@code get(columnName).map(DbValue::asObject)}.
	 *
	 * @param columnName a column name, matched ignoring case
	 * @return the untagged value, or empty if the column is absent or {@code NULL}
	 */
	@NonNull
	public Optional<Object> getObject(@NonNull String columnName) {
		return get(columnName).map(DbValue::asObject);
	}

	@Override
	public boolean equals(@Nullable Object object) {
		if (this == object)
			return true;

		if (!(object instanceof DbRow dbRow))
			return false;

		return Objects.equals(this.columns, dbRow.columns) && Objects.equals(this.values, dbRow.values);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.columns, this.values);
	}

	@Override
	@NonNull
	public String toString() {
		List<String> components = new ArrayList<>(this.columns.size());

		for (int i = 0; i < this.columns.size(); ++i)
			components.add(format("%s=%s", this.columns.get(i).getName(), this.values.get(i)));

		return format("%s{%s}", getClass().getSimpleName(), String.join(", ", components));
	}
}
