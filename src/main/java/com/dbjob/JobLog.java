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
import java.time.Duration;
import java.util.ArrayList;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A log of one attempt of a job run.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class JobLog {
	@NonNull
	private final Long jobId;
	@NonNull
	private final Integer attempt;
	@Nullable
	private final JobContext jobContext;
	@NonNull
	private final RunStage runStage;
	@NonNull
	private final JobState jobState;
	@NonNull
	private final Duration totalDuration;
	@Nullable
	private final Duration connectionAcquisitionDuration;
	@Nullable
	private final Duration preparationDuration;
	@Nullable
	private final Duration executionDuration;
	@Nullable
	private final Duration materializationDuration;
	@Nullable
	private final DatabaseException exception;

	private JobLog(@NonNull Builder builder) {
		requireNonNull(builder);

		this.jobId = requireNonNull(builder.jobId);
		this.attempt = requireNonNull(builder.attempt);
		this.jobContext = builder.jobContext;
		this.runStage = builder.runStage == null ? RunStage.CONFIGURED : builder.runStage;
		this.jobState = requireNonNull(builder.jobState);
		this.connectionAcquisitionDuration = builder.connectionAcquisitionDuration;
		this.preparationDuration = builder.preparationDuration;
		this.executionDuration = builder.executionDuration;
		this.materializationDuration = builder.materializationDuration;
		this.exception = builder.exception;

		Duration totalDuration = Duration.ZERO;

		if (this.connectionAcquisitionDuration != null)
			totalDuration = totalDuration.plus(this.connectionAcquisitionDuration);

		if (this.preparationDuration != null)
			totalDuration = totalDuration.plus(this.preparationDuration);

		if (this.executionDuration != null)
			totalDuration = totalDuration.plus(this.executionDuration);

		if (this.materializationDuration != null)
			totalDuration = totalDuration.plus(this.materializationDuration);

		this.totalDuration = totalDuration;
	}

	/**
	 * Creates a {@link JobLog} builder for the given attempt of job {@code jobId}.
	 *
	 * @param jobId   the job's identifier
	 * @param attempt 1-based attempt number
	 * @return a {@link JobLog} builder
	 */
	@NonNull
	public static Builder withJobId(@NonNull Long jobId,
																	@NonNull Integer attempt) {
		requireNonNull(jobId);
		requireNonNull(attempt);
		return new Builder(jobId, attempt);
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(10);

		components.add(format("jobId=%s", getJobId()));
		components.add(format("attempt=%s", getAttempt()));
		getJobContext().ifPresent(jobContext -> components.add(format("jobContext=%s", jobContext)));
		components.add(format("runStage=%s", getRunStage()));
		components.add(format("jobState=%s", getJobState()));
		components.add(format("totalDuration=%s", getTotalDuration()));
		getConnectionAcquisitionDuration().ifPresent(duration -> components.add(format("connectionAcquisitionDuration=%s", duration)));
		getPreparationDuration().ifPresent(duration -> components.add(format("preparationDuration=%s", duration)));
		getExecutionDuration().ifPresent(duration -> components.add(format("executionDuration=%s", duration)));
		getMaterializationDuration().ifPresent(duration -> components.add(format("materializationDuration=%s", duration)));
		getException().ifPresent(exception -> components.add(format("exception=%s", exception)));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(Collectors.joining(", ")));
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof JobLog jobLog))
			return false;

		return Objects.equals(getJobId(), jobLog.getJobId())
				&& Objects.equals(getAttempt(), jobLog.getAttempt())
				&& Objects.equals(getJobContext(), jobLog.getJobContext())
				&& Objects.equals(getRunStage(), jobLog.getRunStage())
				&& Objects.equals(getJobState(), jobLog.getJobState())
				&& Objects.equals(getConnectionAcquisitionDuration(), jobLog.getConnectionAcquisitionDuration())
				&& Objects.equals(getPreparationDuration(), jobLog.getPreparationDuration())
				&& Objects.equals(getExecutionDuration(), jobLog.getExecutionDuration())
				&& Objects.equals(getMaterializationDuration(), jobLog.getMaterializationDuration())
				&& Objects.equals(getException(), jobLog.getException());
	}

	@Override
	public int hashCode() {
		return Objects.hash(getJobId(), getAttempt(), getJobContext(), getRunStage(), getJobState(),
				getConnectionAcquisitionDuration(), getPreparationDuration(), getExecutionDuration(), getMaterializationDuration(), getException());
	}

	@NonNull
	public Long getJobId() {
		return this.jobId;
	}

	@NonNull
	public Integer getAttempt() {
		return this.attempt;
	}

	/**
	 * The command that was run.
	 *
	 * @return the job context, absent if the attempt failed before its command was built
	 */
	@NonNull
	public Optional<JobContext> getJobContext() {
		return Optional.ofNullable(this.jobContext);
	}

	/**
	 * The last stage the attempt reached.
	 *
	 * @return the stage, {@link RunStage#COMPLETING} for attempts that finished normally
	 */
	@NonNull
	public RunStage getRunStage() {
		return this.runStage;
	}

	@NonNull
	public JobState getJobState() {
		return this.jobState;
	}

	/**
	 * How long did it take to acquire a {@link java.sql.Connection}?
	 *
	 * @return how long it took to acquire a connection, if one was acquired by this attempt
	 */
	@NonNull
	public Optional<Duration> getConnectionAcquisitionDuration() {
		return Optional.ofNullable(this.connectionAcquisitionDuration);
	}

	/**
	 * How long did it take to prepare and bind the command?
	 *
	 * @return the preparation duration, if available
	 */
	@NonNull
	public Optional<Duration> getPreparationDuration() {
		return Optional.ofNullable(this.preparationDuration);
	}

	@NonNull
	public Optional<Duration> getExecutionDuration() {
		return Optional.ofNullable(this.executionDuration);
	}

	/**
	 * How long did it take to map rows into the requested result shape?
	 * <p>
	 * For unbuffered reads this includes the time the caller spent between rows.
	 *
	 * @return the materialization duration, if available
	 */
	@NonNull
	public Optional<Duration> getMaterializationDuration() {
		return Optional.ofNullable(this.materializationDuration);
	}

	/**
	 * The sum of every measured duration.
	 *
	 * @return how long the attempt took in total
	 */
	@NonNull
	public Duration getTotalDuration() {
		return this.totalDuration;
	}

	@NonNull
	public Optional<DatabaseException> getException() {
		return Optional.ofNullable(this.exception);
	}

	/**
	 * Builder used to construct instances of {@link JobLog}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final Long jobId;
		@NonNull
		private final Integer attempt;
		@Nullable
		private JobContext jobContext;
		@Nullable
		private RunStage runStage;
		@Nullable
		private JobState jobState;
		@Nullable
		private Duration connectionAcquisitionDuration;
		@Nullable
		private Duration preparationDuration;
		@Nullable
		private Duration executionDuration;
		@Nullable
		private Duration materializationDuration;
		@Nullable
		private DatabaseException exception;

		private Builder(@NonNull Long jobId,
										@NonNull Integer attempt) {
			this.jobId = requireNonNull(jobId);
			this.attempt = requireNonNull(attempt);
		}

		@NonNull
		public Builder jobContext(@Nullable JobContext jobContext) {
			this.jobContext = jobContext;
			return this;
		}

		@NonNull
		public Builder runStage(@Nullable RunStage runStage) {
			this.runStage = runStage;
			return this;
		}

		@NonNull
		public Builder jobState(@NonNull JobState jobState) {
			this.jobState = requireNonNull(jobState);
			return this;
		}

		@NonNull
		public Builder connectionAcquisitionDuration(@Nullable Duration connectionAcquisitionDuration) {
			this.connectionAcquisitionDuration = connectionAcquisitionDuration;
			return this;
		}

		@NonNull
		public Builder preparationDuration(@Nullable Duration preparationDuration) {
			this.preparationDuration = preparationDuration;
			return this;
		}

		@NonNull
		public Builder executionDuration(@Nullable Duration executionDuration) {
			this.executionDuration = executionDuration;
			return this;
		}

		@NonNull
		public Builder materializationDuration(@Nullable Duration materializationDuration) {
			this.materializationDuration = materializationDuration;
			return this;
		}

		@NonNull
		public Builder exception(@Nullable DatabaseException exception) {
			this.exception = exception;
			return this;
		}

		@NonNull
		public JobLog build() {
			return new JobLog(this);
		}
	}
}
