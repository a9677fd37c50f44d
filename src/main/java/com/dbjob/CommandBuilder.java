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
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayList;
import java.util.EnumSet;
import java.util.List;
import java.util.Set;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Turns a {@link CommandDefinition} and its bound {@link JobParameters} into a {@link JobCommand} on the run's
 * connection.
 * <p>
 * Building never executes anything. Binding errors surface as {@link ErrorKind#PARAMETER_BINDING} and driver
 * failures during preparation as {@link ErrorKind#COMMAND_EXECUTION}.
 *
 * @since 1.0.0
 */
@ThreadSafe
final class CommandBuilder {
	@NonNull
	private final StatementBinder statementBinder;

	CommandBuilder(@NonNull StatementBinder statementBinder) {
		this.statementBinder = requireNonNull(statementBinder);
	}

	/**
	 * Decomposes the definition's parameter source.
	 * <p>
	 * For text commands the placeholder names are known, so a single flat value can be bound to a lone placeholder.
	 *
	 * @param commandDefinition the command
	 * @return the bound parameters
	 */
	@NonNull
	JobParameters bindParameters(@NonNull CommandDefinition commandDefinition) {
		requireNonNull(commandDefinition);

		List<String> placeholderNames = commandDefinition.getCommandType() == CommandType.TEXT
				? NamedParameterSql.parse(commandDefinition.getText()).getDistinctParameterNames()
				: List.of();

		return ParameterBinder.bind(commandDefinition.getParameters().orElse(null), commandDefinition.getBindingRestrictions(), placeholderNames);
	}

	/**
	 * Prepares and binds the command on the run's connection and registers it for disposal.
	 *
	 * @param runContext        the current run
	 * @param commandDefinition the command to build
	 * @param parameters        the bound parameters
	 * @param shapeBehaviors    behaviors implied by the requested result shape
	 * @return the prepared command
	 */
	@NonNull
	JobCommand build(@NonNull RunContext runContext,
									 @NonNull CommandDefinition commandDefinition,
									 @NonNull JobParameters parameters,
									 @NonNull Set<@NonNull CommandBehavior> shapeBehaviors) {
		requireNonNull(runContext);
		requireNonNull(commandDefinition);
		requireNonNull(parameters);
		requireNonNull(shapeBehaviors);

		Set<CommandBehavior> behaviors = EnumSet.noneOf(CommandBehavior.class);
		behaviors.addAll(commandDefinition.getBehaviors());
		behaviors.addAll(shapeBehaviors);

		String sql;
		List<BoundValue> boundValues = new ArrayList<>();

		if (commandDefinition.getCommandType() == CommandType.TEXT) {
			NamedParameterSql.Expansion expansion = NamedParameterSql.parse(commandDefinition.getText()).expand(parameters);
			sql = expansion.getSql();

			for (NamedParameterSql.PositionalValue positionalValue : expansion.getValues())
				boundValues.add(new BoundValue(positionalValue.getValue(), positionalValue.getSqlType(), null));
		} else if (commandDefinition.getCommandType() == CommandType.STORED_PROCEDURE) {
			sql = buildProcedureCall(commandDefinition.getText(), parameters, boundValues);
		} else {
			sql = format("SELECT * FROM %s", commandDefinition.getText());
		}

		List<Object> loggableValues = boundValues.stream()
				.map(boundValue -> boundValue.parameter != null && !boundValue.parameter.getDirection().isInput() ? "<out>" : boundValue.value)
				.collect(Collectors.toList());

		JobContext jobContext = runContext.newJobContext(sql, loggableValues);
		runContext.setJobContext(jobContext);

		Connection connection = runContext.getConnection();
		PreparedStatement preparedStatement;

		try {
			preparedStatement = commandDefinition.getCommandType() == CommandType.STORED_PROCEDURE
					? connection.prepareCall(sql)
					: connection.prepareStatement(sql);
		} catch (SQLException e) {
			throw DatabaseException.forSqlException(JobComponent.COMMAND_BUILDER, "Unable to prepare command", e);
		}

		JobCommand jobCommand = new JobCommand(preparedStatement, jobContext);
		runContext.register(jobCommand);

		try {
			for (int i = 0; i < boundValues.size(); ++i) {
				BoundValue boundValue = boundValues.get(i);
				Integer parameterIndex = i + 1;

				if (boundValue.parameter == null || boundValue.parameter.getDirection().isInput())
					this.statementBinder.bindParameter(jobContext, preparedStatement, parameterIndex, boundValue.value, boundValue.sqlType);

				if (boundValue.parameter != null && boundValue.parameter.getDirection().isOutput())
					jobCommand.addOutputBinding(parameterIndex, boundValue.parameter);
			}

			Duration timeout = commandDefinition.getTimeout().orElse(runContext.getDefaultCommandTimeout().orElse(null));

			if (timeout != null)
				preparedStatement.setQueryTimeout(timeoutInSeconds(timeout));

			if (behaviors.contains(CommandBehavior.SINGLE_ROW))
				preparedStatement.setMaxRows(1);
		} catch (SQLException e) {
			throw DatabaseException.forSqlException(JobComponent.COMMAND_BUILDER, "Unable to bind command parameters", e);
		}

		return jobCommand;
	}

	@NonNull
	private String buildProcedureCall(@NonNull String procedureName,
																		@NonNull JobParameters parameters,
																		@NonNull List<BoundValue> boundValues) {
		JobParameter returnValueParameter = null;
		List<JobParameter> callParameters = new ArrayList<>(parameters.size());

		for (JobParameter parameter : parameters.asList()) {
			if (parameter.getDirection() == ParameterDirection.RETURN_VALUE) {
				if (returnValueParameter != null)
					throw new DatabaseException(ErrorKind.PARAMETER_BINDING, JobComponent.COMMAND_BUILDER,
							format("Stored procedure '%s' has more than one return value parameter", procedureName));

				returnValueParameter = parameter;
			} else {
				callParameters.add(parameter);
			}
		}

		StringBuilder sql = new StringBuilder("{");

		if (returnValueParameter != null) {
			sql.append("? = ");
			boundValues.add(new BoundValue(null, returnValueParameter.getSqlType().orElse(null), returnValueParameter));
		}

		sql.append("call ").append(procedureName).append('(');

		for (int i = 0; i < callParameters.size(); ++i) {
			JobParameter parameter = callParameters.get(i);

			if (i > 0)
				sql.append(", ");

			sql.append('?');

			Object value = NamedParameterSql.unwrapOptionalValue(parameter.getRawValue());

			if (ParameterBinder.isSequence(value) || value instanceof InListParameter)
				throw new DatabaseException(ErrorKind.PARAMETER_BINDING, JobComponent.COMMAND_BUILDER,
						format("Stored procedure parameter '%s' cannot be a collection", parameter.getName()));

			boundValues.add(new BoundValue(value, parameter.getSqlType().orElse(null), parameter));
		}

		return sql.append(")}").toString();
	}

	@NonNull
	static Integer timeoutInSeconds(@NonNull Duration timeout) {
		requireNonNull(timeout);

		long seconds = timeout.getSeconds() + (timeout.getNano() > 0 ? 1 : 0);
		return (int) Math.max(1, Math.min(Integer.MAX_VALUE, seconds));
	}

	private static final class BoundValue {
		@Nullable
		private final Object value;
		@Nullable
		private final Integer sqlType;
		@Nullable
		private final JobParameter parameter;

		private BoundValue(@Nullable Object value,
											 @Nullable Integer sqlType,
											 @Nullable JobParameter parameter) {
			this.value = value;
			this.sqlType = sqlType;
			this.parameter = parameter;
		}
	}
}
