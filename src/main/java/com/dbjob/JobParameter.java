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

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A named command parameter.
 * <p>
 * Output, input/output and return-value parameters have their value replaced after a stored procedure call completes.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class JobParameter {
	@NonNull
	private final String name;
	@NonNull
	private final ParameterDirection direction;
	@Nullable
	private final Integer sqlType;
	@Nullable
	private final JobParameter origin;
	@Nullable
	private volatile Object value;

	private JobParameter(@NonNull String name,
											 @NonNull ParameterDirection direction,
											 @Nullable Integer sqlType,
											 @Nullable Object value) {
		this(name, direction, sqlType, value, null);
	}

	private JobParameter(@NonNull String name,
											 @NonNull ParameterDirection direction,
											 @Nullable Integer sqlType,
											 @Nullable Object value,
											 @Nullable JobParameter origin) {
		requireNonNull(name);
		requireNonNull(direction);

		if (name.trim().isEmpty())
			throw new DatabaseException(ErrorKind.PARAMETER_BINDING, JobComponent.PARAMETER_BINDER, "Parameter name must not be blank");

		if (direction.isOutput() && sqlType == null)
			throw new DatabaseException(ErrorKind.PARAMETER_BINDING, JobComponent.PARAMETER_BINDER,
					format("Parameter '%s' has direction %s and requires a SQL type (see java.sql.Types)", name, direction.name()));

		this.name = name;
		this.direction = direction;
		this.sqlType = sqlType;
		this.value = value;
		this.origin = origin;
	}

	@NonNull
	public static JobParameter input(@NonNull String name,
																	 @Nullable Object value) {
		return new JobParameter(name, ParameterDirection.INPUT, null, value);
	}

	/**
	 * An input parameter with an explicit {@link java.sql.Types} hint, useful for binding {@code null}.
	 *
	 * @param name    parameter name
	 * @param value   parameter value
	 * @param sqlType a {@link java.sql.Types} constant
	 * @return the parameter
	 */
	@NonNull
	public static JobParameter input(@NonNull String name,
																	 @Nullable Object value,
																	 @NonNull Integer sqlType) {
		requireNonNull(sqlType);
		return new JobParameter(name, ParameterDirection.INPUT, sqlType, value);
	}

	@NonNull
	public static JobParameter output(@NonNull String name,
																		@NonNull Integer sqlType) {
		requireNonNull(sqlType);
		return new JobParameter(name, ParameterDirection.OUTPUT, sqlType, null);
	}

	@NonNull
	public static JobParameter inputOutput(@NonNull String name,
																				 @Nullable Object value,
																				 @NonNull Integer sqlType) {
		requireNonNull(sqlType);
		return new JobParameter(name, ParameterDirection.INPUT_OUTPUT, sqlType, value);
	}

	@NonNull
	public static JobParameter returnValue(@NonNull String name,
																				 @NonNull Integer sqlType) {
		requireNonNull(sqlType);
		return new JobParameter(name, ParameterDirection.RETURN_VALUE, sqlType, null);
	}

	/**
	 * A copy bound under another name. Values written back to the copy are also written to this parameter.
	 */
	@NonNull
	JobParameter renamed(@NonNull String name) {
		requireNonNull(name);
		return new JobParameter(name, getDirection(), this.sqlType, this.value, this);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{name=%s, direction=%s, sqlType=%s, value=%s}", getClass().getSimpleName(),
				getName(), getDirection().name(), this.sqlType, this.value);
	}

	@NonNull
	public String getName() {
		return this.name;
	}

	@NonNull
	public ParameterDirection getDirection() {
		return this.direction;
	}

	@NonNull
	public Optional<Integer> getSqlType() {
		return Optional.ofNullable(this.sqlType);
	}

	@NonNull
	public Optional<Object> getValue() {
		return Optional.ofNullable(this.value);
	}

	@Nullable
	Object getRawValue() {
		return this.value;
	}

	void setValue(@Nullable Object value) {
		this.value = value;

		if (this.origin != null)
			this.origin.setValue(value);
	}
}
