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
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Describes one column of a result segment.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class DbColumn {
	@NonNull
	private final Integer index;
	@NonNull
	private final String name;
	@NonNull
	private final Integer jdbcType;
	@Nullable
	private final String typeName;
	@Nullable
	private final String className;

	/**
	 * @param index     0-based position of the column within its segment
	 * @param name      the column label
	 * @param jdbcType  a {@link java.sql.Types} constant
	 * @param typeName  the database-specific type name, if known
	 * @param className the fully-qualified Java class the driver produces for this column, if known
	 */
	public DbColumn(@NonNull Integer index,
									@NonNull String name,
									@NonNull Integer jdbcType,
									@Nullable String typeName,
									@Nullable String className) {
		requireNonNull(index);
		requireNonNull(name);
		requireNonNull(jdbcType);

		this.index = index;
		this.name = name;
		this.jdbcType = jdbcType;
		this.typeName = typeName;
		this.className = className;
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof DbColumn dbColumn))
			return false;

		return Objects.equals(getIndex(), dbColumn.getIndex())
				&& Objects.equals(getName(), dbColumn.getName())
				&& Objects.equals(getJdbcType(), dbColumn.getJdbcType())
				&& Objects.equals(this.typeName, dbColumn.typeName)
				&& Objects.equals(this.className, dbColumn.className);
	}

	@Override
	public int hashCode() {
		return Objects.hash(getIndex(), getName(), getJdbcType(), this.typeName, this.className);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{index=%s, name=%s, jdbcType=%s, typeName=%s}", getClass().getSimpleName(), getIndex(), getName(),
				getJdbcType(), this.typeName);
	}

	@NonNull
	public Integer getIndex() {
		return this.index;
	}

	@NonNull
	public String getName() {
		return this.name;
	}

	@NonNull
	public Integer getJdbcType() {
		return this.jdbcType;
	}

	@NonNull
	public Optional<String> getTypeName() {
		return Optional.ofNullable(this.typeName);
	}

	@NonNull
	public Optional<String> getClassName() {
		return Optional.ofNullable(this.className);
	}
}
