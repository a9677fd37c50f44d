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
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Thrown when an error occurs while building, running or materializing a {@link DbJob}.
 * <p>
 * Every instance carries an {@link ErrorKind} and the {@link JobComponent} it originated in.
 * <p>
 * If a {@link SQLException} is present in the cause chain, the {@link #getErrorCode()} and {@link #getSqlState()}
 * accessors are shorthand for retrieving the corresponding {@link SQLException} values.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class DatabaseException extends RuntimeException {
	@NonNull
	private final ErrorKind errorKind;
	@NonNull
	private final JobComponent component;
	@Nullable
	private final Integer errorCode;
	@Nullable
	private final String sqlState;

	/**
	 * Creates a {@code DatabaseException} with the given {@code message}.
	 *
	 * @param errorKind the failure classification
	 * @param component the component in which the failure originated
	 * @param message   a message describing this exception
	 */
	public DatabaseException(@NonNull ErrorKind errorKind,
													 @NonNull JobComponent component,
													 @Nullable String message) {
		this(errorKind, component, message, null);
	}

	/**
	 * Creates a {@code DatabaseException} which wraps the given {@code cause}.
	 *
	 * @param errorKind the failure classification
	 * @param component the component in which the failure originated
	 * @param message   a message describing this exception
	 * @param cause     the cause of this exception
	 */
	public DatabaseException(@NonNull ErrorKind errorKind,
													 @NonNull JobComponent component,
													 @Nullable String message,
													 @Nullable Throwable cause) {
		super(message, cause);

		requireNonNull(errorKind);
		requireNonNull(component);

		this.errorKind = errorKind;
		this.component = component;

		Integer errorCode = null;
		String sqlState = null;
		Throwable current = cause;

		while (current != null) {
			if (current instanceof SQLException sqlException) {
				errorCode = sqlException.getErrorCode();
				sqlState = sqlException.getSQLState();
				break;
			}

			current = current.getCause();
		}

		this.errorCode = errorCode;
		this.sqlState = sqlState;
	}

	/**
	 * Wraps a driver failure, classifying it as {@link ErrorKind#TRANSIENT_CONNECTION} or
	 * {@link ErrorKind#COMMAND_EXECUTION} depending on {@link RetryPolicy#isTransientFailure(SQLException)}.
	 *
	 * @param component    the component in which the failure originated
	 * @param message      a message describing the failure
	 * @param sqlException the driver failure
	 * @return the wrapping exception
	 */
	@NonNull
	public static DatabaseException forSqlException(@NonNull JobComponent component,
																									@NonNull String message,
																									@NonNull SQLException sqlException) {
		requireNonNull(component);
		requireNonNull(message);
		requireNonNull(sqlException);

		ErrorKind errorKind = RetryPolicy.isTransientFailure(sqlException) ? ErrorKind.TRANSIENT_CONNECTION : ErrorKind.COMMAND_EXECUTION;
		return new DatabaseException(errorKind, component, format("%s: %s", message, sqlException.getMessage()), sqlException);
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(5);

		if (getMessage() != null && getMessage().trim().length() > 0)
			components.add(format("message=%s", getMessage()));

		components.add(format("errorKind=%s", getErrorKind().name()));
		components.add(format("component=%s", getComponent().name()));

		if (getErrorCode().isPresent())
			components.add(format("errorCode=%s", getErrorCode().get()));
		if (getSqlState().isPresent())
			components.add(format("sqlState=%s", getSqlState().get()));

		return format("%s: %s", getClass().getName(), components.stream().collect(Collectors.joining(", ")));
	}

	/**
	 * @return the classification of this failure
	 */
	@NonNull
	public ErrorKind getErrorKind() {
		return this.errorKind;
	}

	/**
	 * @return the component in which this failure originated
	 */
	@NonNull
	public JobComponent getComponent() {
		return this.component;
	}

	/**
	 * Shorthand for {@link SQLException#getErrorCode()} if this exception was caused by a {@link SQLException}.
	 *
	 * @return the value of {@link SQLException#getErrorCode()}, or empty if not available
	 */
	@NonNull
	public Optional<Integer> getErrorCode() {
		return Optional.ofNullable(this.errorCode);
	}

	/**
	 * Shorthand for {@link SQLException#getSQLState()} if this exception was caused by a {@link SQLException}.
	 *
	 * @return the value of {@link SQLException#getSQLState()}, or empty if not available
	 */
	@NonNull
	public Optional<String> getSqlState() {
		return Optional.ofNullable(this.sqlState);
	}
}
