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

import static java.util.Objects.requireNonNull;

/**
 * Thrown when a column value cannot be converted to the declared type of the field it is mapped to.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class ColumnTypeMismatchException extends DatabaseException {
	@NonNull
	private final String columnLabel;
	@NonNull
	private final String fieldName;
	@NonNull
	private final Class<?> fieldType;

	public ColumnTypeMismatchException(@NonNull String columnLabel,
																		 @NonNull String fieldName,
																		 @NonNull Class<?> fieldType,
																		 @NonNull String message,
																		 @Nullable Throwable cause) {
		super(ErrorKind.MAPPING, JobComponent.ROW_MAPPER, message, cause);

		this.columnLabel = requireNonNull(columnLabel);
		this.fieldName = requireNonNull(fieldName);
		this.fieldType = requireNonNull(fieldType);
	}

	/**
	 * @return label of the column whose value could not be converted
	 */
	@NonNull
	public String getColumnLabel() {
		return this.columnLabel;
	}

	/**
	 * @return name of the target field
	 */
	@NonNull
	public String getFieldName() {
		return this.fieldName;
	}

	@NonNull
	public Class<?> getFieldType() {
		return this.fieldType;
	}
}
