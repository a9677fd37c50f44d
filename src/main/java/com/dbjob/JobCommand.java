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

import javax.annotation.concurrent.NotThreadSafe;
import java.sql.CallableStatement;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A prepared and bound statement for one attempt of a job run.
 * <p>
 * Commands are created by {@link CommandBuilder}, registered with the run's disposal stack and never reused.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public final class JobCommand implements AutoCloseable {
	@NonNull
	private final PreparedStatement preparedStatement;
	@NonNull
	private final JobContext jobContext;
	@NonNull
	private final List<@NonNull OutputBinding> outputBindings;

	JobCommand(@NonNull PreparedStatement preparedStatement,
						 @NonNull JobContext jobContext) {
		requireNonNull(preparedStatement);
		requireNonNull(jobContext);

		this.preparedStatement = preparedStatement;
		this.jobContext = jobContext;
		this.outputBindings = new ArrayList<>();
	}

	/**
	 * Executes the command and exposes its results as a cursor.
	 *
	 * @return a cursor positioned on the first result segment
	 * @throws SQLException if execution fails
	 */
	@NonNull
	RowCursor executeQuery() throws SQLException {
		boolean firstResultIsResultSet = this.preparedStatement.execute();
		return new JdbcRowCursor(this.preparedStatement, firstResultIsResultSet, getJobContext().getTimeZone());
	}

	/**
	 * Executes the command and reports the number of affected rows.
	 *
	 * @return the first update count, or {@code -1} if the command produced a result set first
	 * @throws SQLException if execution fails
	 */
	@NonNull
	Long executeNonQuery() throws SQLException {
		boolean firstResultIsResultSet = this.preparedStatement.execute();
		return firstResultIsResultSet ? -1L : (long) this.preparedStatement.getUpdateCount();
	}

	/**
	 * Copies output, input/output and return values of a stored procedure call into their {@link JobParameter}s.
	 *
	 * @throws SQLException if a value cannot be read
	 */
	void readOutputParameters() throws SQLException {
		if (this.outputBindings.isEmpty())
			return;

		CallableStatement callableStatement = (CallableStatement) this.preparedStatement;

		for (OutputBinding outputBinding : this.outputBindings)
			outputBinding.getParameter().setValue(callableStatement.getObject(outputBinding.getParameterIndex()));
	}

	void addOutputBinding(@NonNull Integer parameterIndex,
												@NonNull JobParameter parameter) throws SQLException {
		requireNonNull(parameterIndex);
		requireNonNull(parameter);

		((CallableStatement) this.preparedStatement).registerOutParameter(parameterIndex, parameter.getSqlType().get());
		this.outputBindings.add(new OutputBinding(parameterIndex, parameter));
	}

	@NonNull
	Boolean hasOutputParameters() {
		return !this.outputBindings.isEmpty();
	}

	@Override
	public void close() throws SQLException {
		this.preparedStatement.close();
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{jobContext=%s, outputParameters=%s}", getClass().getSimpleName(), getJobContext(), this.outputBindings.size());
	}

	@NonNull
	public JobContext getJobContext() {
		return this.jobContext;
	}

	@NonNull
	PreparedStatement getPreparedStatement() {
		return this.preparedStatement;
	}

	/**
	 * A registered out parameter and its 1-based position in the call.
	 */
	@NotThreadSafe
	static final class OutputBinding {
		@NonNull
		private final Integer parameterIndex;
		@NonNull
		private final JobParameter parameter;

		OutputBinding(@NonNull Integer parameterIndex,
									@NonNull JobParameter parameter) {
			this.parameterIndex = requireNonNull(parameterIndex);
			this.parameter = requireNonNull(parameter);
		}

		@NonNull
		Integer getParameterIndex() {
			return this.parameterIndex;
		}

		@NonNull
		JobParameter getParameter() {
			return this.parameter;
		}
	}
}
