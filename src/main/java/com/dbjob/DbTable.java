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
import java.util.Objects;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * One materialized result segment: its column schema in order, duplicates included, and all of its rows.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class DbTable {
	@NonNull
	private final List<@NonNull DbColumn> columns;
	@NonNull
	private final List<@NonNull DbRow> rows;

	public DbTable(@NonNull List<@NonNull DbColumn> columns,
								 @NonNull List<@NonNull DbRow> rows) {
		requireNonNull(columns);
		requireNonNull(rows);

		this.columns = List.copyOf(columns);
		this.rows = List.copyOf(rows);
	}

	@NonNull
	public List<@NonNull DbColumn> getColumns() {
		return this.columns;
	}

	@NonNull
	public List<@NonNull DbRow> getRows() {
		return this.rows;
	}

	@NonNull
	public Integer getRowCount() {
		return this.rows.size();
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof DbTable dbTable))
			return false;

		return Objects.equals(this.columns, dbTable.columns) && Objects.equals(this.rows, dbTable.rows);
	}

	@Override
	public int hashCode() {
		return Objects.hash(this.columns, this.rows);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{columns=%s, rowCount=%d}", getClass().getSimpleName(), this.columns, this.rows.size());
	}
}
