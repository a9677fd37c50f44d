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
import javax.annotation.concurrent.ThreadSafe;
import java.sql.SQLException;
import java.sql.SQLRecoverableException;
import java.sql.SQLTransientConnectionException;
import java.time.Duration;
import java.util.function.Predicate;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Decides how many times a job run may be attempted and which failures justify another attempt.
 * <p>
 * By default only {@link ErrorKind#TRANSIENT_CONNECTION} failures are retried. Between attempts the run's connection
 * and transaction are fully torn down and reacquired.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class RetryPolicy {
	@NonNull
	private static final RetryPolicy NO_RETRY;

	static {
		NO_RETRY = withMaxAttempts(1).build();
	}

	@NonNull
	private final Integer maxAttempts;
	@NonNull
	private final Duration backoff;
	@NonNull
	private final Predicate<DatabaseException> retryableFailurePredicate;

	private RetryPolicy(@NonNull Builder builder) {
		requireNonNull(builder);

		this.maxAttempts = builder.maxAttempts;
		this.backoff = builder.backoff == null ? Duration.ZERO : builder.backoff;
		this.retryableFailurePredicate = builder.retryableFailurePredicate == null
				? (databaseException) -> databaseException.getErrorKind().isRetryable()
				: builder.retryableFailurePredicate;
	}

	/**
	 * A policy that makes exactly one attempt.
	 *
	 * @return the single-attempt policy
	 */
	@NonNull
	public static RetryPolicy none() {
		return NO_RETRY;
	}

	/**
	 * Provides a {@link RetryPolicy} builder which allows at most {@code maxAttempts} attempts, the first included.
	 *
	 * @param maxAttempts total number of attempts, at least 1
	 * @return a {@link RetryPolicy} builder
	 */
	@NonNull
	public static Builder withMaxAttempts(@NonNull Integer maxAttempts) {
		requireNonNull(maxAttempts);
		return new Builder(maxAttempts);
	}

	/**
	 * Is the given driver failure a connection-level fault?
	 * <p>
	 * Recognizes {@link SQLTransientConnectionException}, {@link SQLRecoverableException} and any SQLState in the
	 * {@code 08} (connection exception) class, anywhere in the cause chain.
	 *
	 * @param sqlException the failure to classify
	 * @return {@code true} if the failure is transient
	 */
	@NonNull
	public static Boolean isTransientFailure(@NonNull SQLException sqlException) {
		requireNonNull(sqlException);

		Throwable current = sqlException;

		while (current != null) {
			if (current instanceof SQLTransientConnectionException || current instanceof SQLRecoverableException)
				return true;

			if (current instanceof SQLException currentSqlException) {
				String sqlState = currentSqlException.getSQLState();

				if (sqlState != null && sqlState.startsWith("08"))
					return true;
			}

			current = current.getCause();
		}

		return false;
	}

	/**
	 * Should another attempt be made after {@code failure} ended attempt number {@code attempt}?
	 *
	 * @param failure the failure that ended the attempt
	 * @param attempt the 1-based number of the attempt that failed
	 * @return {@code true} if the run should be attempted again
	 */
	@NonNull
	public Boolean shouldRetry(@NonNull DatabaseException failure,
														 @NonNull Integer attempt) {
		requireNonNull(failure);
		requireNonNull(attempt);

		return attempt < getMaxAttempts() && getRetryableFailurePredicate().test(failure);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{maxAttempts=%s, backoff=%s}", getClass().getSimpleName(), getMaxAttempts(), getBackoff());
	}

	@NonNull
	public Integer getMaxAttempts() {
		return this.maxAttempts;
	}

	@NonNull
	public Duration getBackoff() {
		return this.backoff;
	}

	@NonNull
	Predicate<DatabaseException> getRetryableFailurePredicate() {
		return this.retryableFailurePredicate;
	}

	/**
	 * Builder used to construct instances of {@link RetryPolicy}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final Integer maxAttempts;
		@Nullable
		private Duration backoff;
		@Nullable
		private Predicate<DatabaseException> retryableFailurePredicate;

		private Builder(@NonNull Integer maxAttempts) {
			requireNonNull(maxAttempts);

			if (maxAttempts < 1)
				throw new DatabaseException(ErrorKind.CONFIGURATION, JobComponent.JOB_HANDLE,
						format("Maximum attempts must be at least 1, was %d", maxAttempts));

			this.maxAttempts = maxAttempts;
		}

		/**
		 * Pause between a failed attempt and the next one.
		 *
		 * @param backoff delay before the next attempt
		 * @return this builder
		 */
		@NonNull
		public Builder backoff(@Nullable Duration backoff) {
			if (backoff != null && backoff.isNegative())
				throw new DatabaseException(ErrorKind.CONFIGURATION, JobComponent.JOB_HANDLE, "Backoff must not be negative");

			this.backoff = backoff;
			return this;
		}

		/**
		 * Replaces the default classification, which retries only {@link ErrorKind#TRANSIENT_CONNECTION} failures.
		 *
		 * @param retryableFailurePredicate returns {@code true} for failures that should be retried
		 * @return this builder
		 */
		@NonNull
		public Builder retryIf(@Nullable Predicate<DatabaseException> retryableFailurePredicate) {
			this.retryableFailurePredicate = retryableFailurePredicate;
			return this;
		}

		@NonNull
		public RetryPolicy build() {
			return new RetryPolicy(this);
		}
	}
}
