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
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Objects;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Data that describes one attempt of a job run: the command text actually sent to the driver, its positional
 * parameter values and the requested result type.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class JobContext {
	@NonNull
	private final Long jobId;
	@NonNull
	private final Integer attempt;
	@NonNull
	private final String sql;
	@NonNull
	private final List<Object> parameters;
	@Nullable
	private final Class<?> resultType;
	@NonNull
	private final ZoneId timeZone;

	private JobContext(@NonNull Builder builder) {
		requireNonNull(builder);

		this.jobId = builder.jobId;
		this.attempt = builder.attempt;
		this.sql = builder.sql;
		this.parameters = builder.parameters == null ? List.of() : Collections.unmodifiableList(new ArrayList<>(builder.parameters));
		this.resultType = builder.resultType;
		this.timeZone = builder.timeZone;
	}

	@NonNull
	public static Builder with(@NonNull Long jobId,
														 @NonNull String sql,
														 @NonNull ZoneId timeZone) {
		return new Builder(jobId, sql, timeZone);
	}

	@NonNull
	Builder copy() {
		return new Builder(getJobId(), getSql(), getTimeZone())
				.attempt(getAttempt())
				.parameters(getParameters())
				.resultType(getResultType().orElse(null));
	}

	@Override
	public int hashCode() {
		return Objects.hash(getJobId(), getAttempt(), getSql(), getParameters(), getResultType(), getTimeZone());
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof JobContext jobContext))
			return false;

		return Objects.equals(jobContext.getJobId(), getJobId())
				&& Objects.equals(jobContext.getAttempt(), getAttempt())
				&& Objects.equals(jobContext.getSql(), getSql())
				&& Objects.equals(jobContext.getParameters(), getParameters())
				&& Objects.equals(jobContext.getResultType(), getResultType())
				&& Objects.equals(jobContext.getTimeZone(), getTimeZone());
	}

	@Override
	public String toString() {
		List<String> components = new ArrayList<>(6);

		components.add(format("jobId=%s", getJobId()));
		components.add(format("attempt=%s", getAttempt()));
		components.add(format("sql=%s", getSql()));

		if (getParameters().size() > 0)
			components.add(format("parameters=%s", getParameters()));

		Class<?> resultType = getResultType().orElse(null);

		if (resultType != null)
			components.add(format("resultType=%s", resultType));

		components.add(format("timeZone=%s", getTimeZone().getId()));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(Collectors.joining(", ")));
	}

	@NonNull
	public Long getJobId() {
		return this.jobId;
	}

	/**
	 * @return the 1-based attempt number
	 */
	@NonNull
	public Integer getAttempt() {
		return this.attempt;
	}

	@NonNull
	public String getSql() {
		return this.sql;
	}

	@NonNull
	public List<Object> getParameters() {
		return this.parameters;
	}

	@NonNull
	public Optional<Class<?>> getResultType() {
		return Optional.ofNullable(this.resultType);
	}

	@NonNull
	public ZoneId getTimeZone() {
		return this.timeZone;
	}

	/**
	 * Builder used to construct instances of {@link JobContext}.
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
		private final String sql;
		@NonNull
		private final ZoneId timeZone;
		@NonNull
		private Integer attempt;
		@Nullable
		private List<Object> parameters;
		@Nullable
		private Class<?> resultType;

		private Builder(@NonNull Long jobId,
										@NonNull String sql,
										@NonNull ZoneId timeZone) {
			requireNonNull(jobId);
			requireNonNull(sql);
			requireNonNull(timeZone);

			this.jobId = jobId;
			this.sql = sql;
			this.timeZone = timeZone;
			this.attempt = 1;
		}

		@NonNull
		public Builder attempt(@NonNull Integer attempt) {
			this.attempt = requireNonNull(attempt);
			return this;
		}

		@NonNull
		public Builder parameters(@Nullable List<Object> parameters) {
			this.parameters = parameters;
			return this;
		}

		@NonNull
		public Builder resultType(@Nullable Class<?> resultType) {
			this.resultType = resultType;
			return this;
		}

		@NonNull
		public JobContext build() {
			return new JobContext(this);
		}
	}
}
