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
 * The outcome of a job run.
 * <p>
 * A run that failed but was rescued by the job's fallback is {@link JobState#SUCCEEDED} with the fallback value and
 * still exposes the original failure through {@link #getError()}.
 *
 * @param <T> the job's value type
 * @since 1.0.0
 */
@ThreadSafe
public final class JobResult<T> {
	@NonNull
	private final JobState jobState;
	@Nullable
	private final T value;
	@Nullable
	private final DatabaseException error;
	@NonNull
	private final Integer attempts;

	private JobResult(@NonNull JobState jobState,
										@Nullable T value,
										@Nullable DatabaseException error,
										@NonNull Integer attempts) {
		this.jobState = requireNonNull(jobState);
		this.value = value;
		this.error = error;
		this.attempts = requireNonNull(attempts);
	}

	@NonNull
	static <T> JobResult<T> succeeded(@Nullable T value,
																		@Nullable DatabaseException error,
																		@NonNull Integer attempts) {
		return new JobResult<>(JobState.SUCCEEDED, value, error, attempts);
	}

	@NonNull
	static <T> JobResult<T> failed(@NonNull DatabaseException error,
																 @NonNull Integer attempts) {
		requireNonNull(error);
		return new JobResult<>(JobState.FAILED, null, error, attempts);
	}

	@NonNull
	static <T> JobResult<T> canceled(@Nullable T value,
																	 @NonNull Integer attempts) {
		return new JobResult<>(JobState.CANCELED, value, null, attempts);
	}

	/**
	 * The run's value, or its failure.
	 *
	 * @return the value, possibly {@code null}
	 * @throws DatabaseException if the run {@link JobState#FAILED}
	 */
	@Nullable
	public T orElseThrow() {
		if (getJobState() == JobState.FAILED)
			throw this.error;

		return this.value;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{jobState=%s, value=%s, error=%s, attempts=%s}", getClass().getSimpleName(),
				getJobState(), this.value, this.error, getAttempts());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof JobResult<?> jobResult))
			return false;

		return Objects.equals(getJobState(), jobResult.getJobState())
				&& Objects.equals(this.value, jobResult.value)
				&& Objects.equals(this.error, jobResult.error)
				&& Objects.equals(getAttempts(), jobResult.getAttempts());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getJobState(), this.value, this.error, getAttempts());
	}

	@NonNull
	public JobState getJobState() {
		return this.jobState;
	}

	/**
	 * The value produced by the run.
	 * <p>
	 * A canceled run only has a value if the job kept partial results.
	 *
	 * @return the value, if any
	 */
	@NonNull
	public Optional<T> getValue() {
		return Optional.ofNullable(this.value);
	}

	/**
	 * The failure of the last attempt, also present when a fallback produced the value.
	 *
	 * @return the failure, if any
	 */
	@NonNull
	public Optional<DatabaseException> getError() {
		return Optional.ofNullable(this.error);
	}

	/**
	 * How many attempts were made.
	 *
	 * @return the attempt count, {@code 0} if the run was canceled before it started
	 */
	@NonNull
	public Integer getAttempts() {
		return this.attempts;
	}
}
