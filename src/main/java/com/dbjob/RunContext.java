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
import java.sql.Connection;
import java.sql.SQLException;
import java.time.Duration;
import java.util.ArrayDeque;
import java.util.ArrayList;
import java.util.Deque;
import java.util.List;
import java.util.Optional;
import java.util.Set;
import java.util.function.Supplier;

import static java.lang.String.format;
import static java.lang.System.nanoTime;
import static java.util.Objects.requireNonNull;

/**
 * Everything one attempt of a job owns: its connection, its transaction, its command and cursor.
 * <p>
 * Resources are registered as they are acquired and released in reverse order by {@link #dispose()}. A retry builds a
 * fresh context.
 *
 * @since 1.0.0
 */
@NotThreadSafe
final class RunContext {
	@NonNull
	private final DbConnector dbConnector;
	@NonNull
	private final Long jobId;
	@NonNull
	private final Integer attempt;
	@NonNull
	private final JobConfiguration<?> jobConfiguration;
	@NonNull
	private final Supplier<CommandDefinition> commandDefinitionSupplier;
	@NonNull
	private final Class<?> resultType;
	@Nullable
	private final Transaction sharedTransaction;
	@NonNull
	private final CancellationToken cancellationToken;
	@NonNull
	private final Deque<AutoCloseable> disposables;
	@NonNull
	private final List<JobCommand> jobCommands;

	@Nullable
	private Transaction ownedTransaction;
	@NonNull
	private TransactionResult transactionResult;
	@Nullable
	private Connection connection;
	@Nullable
	private JobContext jobContext;
	@NonNull
	private RunStage runStage;
	@Nullable
	private Duration connectionAcquisitionDuration;
	@Nullable
	private Duration preparationDuration;
	@Nullable
	private Duration executionDuration;
	@Nullable
	private Duration materializationDuration;
	@Nullable
	private Long materializationStartedAt;
	@Nullable
	private RunCompletion deferredCompletion;
	private boolean completionDeferred;

	RunContext(@NonNull DbConnector dbConnector,
						 @NonNull Long jobId,
						 @NonNull Integer attempt,
						 @NonNull JobConfiguration<?> jobConfiguration,
						 @NonNull Supplier<CommandDefinition> commandDefinitionSupplier,
						 @NonNull Class<?> resultType,
						 @Nullable Transaction sharedTransaction,
						 @NonNull CancellationToken cancellationToken) {
		this.dbConnector = requireNonNull(dbConnector);
		this.jobId = requireNonNull(jobId);
		this.attempt = requireNonNull(attempt);
		this.jobConfiguration = requireNonNull(jobConfiguration);
		this.commandDefinitionSupplier = requireNonNull(commandDefinitionSupplier);
		this.resultType = requireNonNull(resultType);
		this.sharedTransaction = sharedTransaction;
		this.cancellationToken = requireNonNull(cancellationToken);
		this.disposables = new ArrayDeque<>();
		this.jobCommands = new ArrayList<>(1);
		this.transactionResult = TransactionResult.ROLLED_BACK;
		this.runStage = RunStage.CONFIGURED;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{jobId=%s, attempt=%s, runStage=%s, sharedTransaction=%s, ownedTransaction=%s}", getClass().getSimpleName(),
				getJobId(), getAttempt(), getRunStage(), this.sharedTransaction, this.ownedTransaction);
	}

	/**
	 * Opens a transaction owned by this attempt. Its connection is acquired lazily and it is released last.
	 *
	 * @param transactionIsolation the isolation to run with
	 */
	void beginTransaction(@NonNull TransactionIsolation transactionIsolation) {
		requireNonNull(transactionIsolation);

		if (this.sharedTransaction != null || this.ownedTransaction != null)
			throw new IllegalStateException("A transaction is already associated with this run");

		Transaction transaction = new Transaction(getDbConnector().getDataSource(), transactionIsolation);
		this.ownedTransaction = transaction;

		register(() -> {
			Throwable releaseFailure = transaction.release(this.transactionResult);

			if (releaseFailure instanceof Exception exception)
				throw exception;
			if (releaseFailure instanceof Error error)
				throw error;
		});
	}

	/**
	 * The attempt's connection, acquiring it on first use.
	 *
	 * @return the connection of the shared or owned transaction, or a connection owned by this attempt
	 * @throws DatabaseException of kind {@link ErrorKind#TRANSIENT_CONNECTION} if no connection could be acquired
	 */
	@NonNull
	Connection getConnection() {
		if (this.connection != null)
			return this.connection;

		long startTime = nanoTime();
		Transaction transaction = getTransaction().orElse(null);

		if (transaction != null) {
			this.connection = transaction.getConnection();
		} else {
			try {
				this.connection = getDbConnector().getDataSource().getConnection();
			} catch (SQLException e) {
				throw new DatabaseException(ErrorKind.TRANSIENT_CONNECTION, JobComponent.PIPELINE,
						format("Unable to acquire database connection: %s", e.getMessage()), e);
			}

			register(this.connection);
		}

		this.connectionAcquisitionDuration = Duration.ofNanos(nanoTime() - startTime);
		this.runStage = transaction == null ? RunStage.CONNECTION_ACQUIRED : RunStage.TRANSACTION_OPEN;

		return this.connection;
	}

	/**
	 * Builds the command from a fresh {@link CommandDefinition} and executes it as a query.
	 *
	 * @param shapeBehaviors behaviors implied by the result shape
	 * @return a cursor over the command's results, registered for disposal
	 */
	@NonNull
	RowCursor executeQuery(@NonNull Set<@NonNull CommandBehavior> shapeBehaviors) {
		requireNonNull(shapeBehaviors);

		JobCommand jobCommand = prepare(shapeBehaviors);
		long startTime = nanoTime();

		try {
			RowCursor rowCursor = jobCommand.executeQuery();
			register(rowCursor);
			return rowCursor;
		} catch (SQLException e) {
			throw DatabaseException.forSqlException(JobComponent.PIPELINE, "Unable to execute command", e);
		} finally {
			this.executionDuration = Duration.ofNanos(nanoTime() - startTime);
			this.runStage = RunStage.MATERIALIZING;
			this.materializationStartedAt = nanoTime();
		}
	}

	/**
	 * Builds the command from a fresh {@link CommandDefinition} and executes it. Output parameters are read back once
	 * the job's execution returns.
	 *
	 * @return the affected row count, or {@code -1} if the command produced rows instead
	 */
	@NonNull
	Long executeNonQuery() {
		JobCommand jobCommand = prepare(Set.of());
		long startTime = nanoTime();

		try {
			return jobCommand.executeNonQuery();
		} catch (SQLException e) {
			throw DatabaseException.forSqlException(JobComponent.PIPELINE, "Unable to execute command", e);
		} finally {
			this.executionDuration = Duration.ofNanos(nanoTime() - startTime);
		}
	}

	@NonNull
	private JobCommand prepare(@NonNull Set<@NonNull CommandBehavior> shapeBehaviors) {
		CommandBuilder commandBuilder = getDbConnector().getCommandBuilder();
		CommandDefinition commandDefinition = this.commandDefinitionSupplier.get();

		if (commandDefinition == null)
			throw new DatabaseException(ErrorKind.CONFIGURATION, JobComponent.COMMAND_BUILDER, "The command definition callback produced no command");

		// Binding failures surface before a connection is taken
		JobParameters parameters = commandBuilder.bindParameters(commandDefinition);
		getConnection();

		long startTime = nanoTime();

		try {
			JobCommand jobCommand = commandBuilder.build(this, commandDefinition, parameters, shapeBehaviors);
			this.jobCommands.add(jobCommand);
			this.runStage = RunStage.EXECUTING;
			return jobCommand;
		} finally {
			this.preparationDuration = Duration.ofNanos(nanoTime() - startTime);
		}
	}

	/**
	 * Copies output parameter values of every executed stored procedure call back into their parameters.
	 */
	void readOutputParameters() {
		for (JobCommand jobCommand : this.jobCommands) {
			if (!jobCommand.hasOutputParameters())
				continue;

			try {
				jobCommand.readOutputParameters();
			} catch (SQLException e) {
				throw DatabaseException.forSqlException(JobComponent.PIPELINE, "Unable to read output parameters", e);
			}
		}
	}

	@NonNull
	JobContext newJobContext(@NonNull String sql,
													 @NonNull List<Object> parameters) {
		requireNonNull(sql);
		requireNonNull(parameters);

		return JobContext.with(getJobId(), sql, getDbConnector().getTimeZone())
				.attempt(getAttempt())
				.parameters(parameters)
				.resultType(this.resultType)
				.build();
	}

	void setJobContext(@NonNull JobContext jobContext) {
		this.jobContext = requireNonNull(jobContext);
	}

	@NonNull
	Optional<JobContext> getJobContext() {
		return Optional.ofNullable(this.jobContext);
	}

	/**
	 * The job context of the executed command.
	 *
	 * @return the job context
	 * @throws IllegalStateException if no command has been built yet
	 */
	@NonNull
	JobContext requireJobContext() {
		if (this.jobContext == null)
			throw new IllegalStateException("No command has been built for this run");

		return this.jobContext;
	}

	void register(@NonNull AutoCloseable disposable) {
		requireNonNull(disposable);
		this.disposables.push(disposable);
	}

	/**
	 * Hands completion of this attempt to the consumer of its results.
	 *
	 * @return the completion the consumer must invoke exactly once
	 */
	@NonNull
	RunCompletion deferCompletion() {
		if (this.deferredCompletion == null)
			throw new IllegalStateException("This run does not support deferred completion");

		this.completionDeferred = true;
		return this.deferredCompletion;
	}

	void setDeferredCompletion(@NonNull RunCompletion deferredCompletion) {
		this.deferredCompletion = requireNonNull(deferredCompletion);
	}

	@NonNull
	Boolean isCompletionDeferred() {
		return this.completionDeferred;
	}

	void markCompleting() {
		markMaterialized();
		this.runStage = RunStage.COMPLETING;
	}

	void markMaterialized() {
		if (this.materializationStartedAt != null && this.materializationDuration == null)
			this.materializationDuration = Duration.ofNanos(nanoTime() - this.materializationStartedAt);
	}

	/**
	 * Releases every registered resource, most recently acquired first.
	 * <p>
	 * Every resource is closed even if an earlier one fails.
	 *
	 * @return the first cleanup failure with later ones suppressed, or {@code null}
	 */
	@Nullable
	Throwable dispose() {
		Throwable cleanupFailure = null;

		while (!this.disposables.isEmpty()) {
			AutoCloseable disposable = this.disposables.pop();

			try {
				disposable.close();
			} catch (Throwable cleanupException) {
				cleanupFailure = Transaction.addCleanupFailure(cleanupFailure, cleanupException);
			}
		}

		this.connection = null;
		return cleanupFailure;
	}

	@NonNull
	Optional<Duration> getDefaultCommandTimeout() {
		Optional<Duration> timeout = getJobConfiguration().getTimeout();
		return timeout.isPresent() ? timeout : getDbConnector().getDefaultCommandTimeout();
	}

	@NonNull
	Optional<Transaction> getTransaction() {
		return Optional.ofNullable(this.sharedTransaction != null ? this.sharedTransaction : this.ownedTransaction);
	}

	@NonNull
	Optional<Transaction> getSharedTransaction() {
		return Optional.ofNullable(this.sharedTransaction);
	}

	@NonNull
	Optional<Transaction> getOwnedTransaction() {
		return Optional.ofNullable(this.ownedTransaction);
	}

	void setTransactionResult(@NonNull TransactionResult transactionResult) {
		this.transactionResult = requireNonNull(transactionResult);
	}

	@NonNull
	DbConnector getDbConnector() {
		return this.dbConnector;
	}

	@NonNull
	Long getJobId() {
		return this.jobId;
	}

	@NonNull
	Integer getAttempt() {
		return this.attempt;
	}

	@NonNull
	JobConfiguration<?> getJobConfiguration() {
		return this.jobConfiguration;
	}

	@NonNull
	CancellationToken getCancellationToken() {
		return this.cancellationToken;
	}

	@NonNull
	RunStage getRunStage() {
		return this.runStage;
	}

	@NonNull
	Optional<Duration> getConnectionAcquisitionDuration() {
		return Optional.ofNullable(this.connectionAcquisitionDuration);
	}

	@NonNull
	Optional<Duration> getPreparationDuration() {
		return Optional.ofNullable(this.preparationDuration);
	}

	@NonNull
	Optional<Duration> getExecutionDuration() {
		return Optional.ofNullable(this.executionDuration);
	}

	@NonNull
	Optional<Duration> getMaterializationDuration() {
		return Optional.ofNullable(this.materializationDuration);
	}
}
