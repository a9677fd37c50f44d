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
import java.time.Duration;
import java.util.function.Function;
import java.util.function.Supplier;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.FINE;
import static java.util.logging.Level.WARNING;

/**
 * Runs a job to completion: acquires a connection, opens a transaction if one is needed, executes, materializes,
 * then commits or rolls back, releases resources and logs the attempt.
 * <p>
 * Transient failures are retried according to the job's {@link RetryPolicy}, each attempt in a fresh
 * {@link RunContext}. Jobs running inside a shared transaction are never retried; they mark the transaction
 * rollback-only on failure and leave committing to its owner.
 *
 * @since 1.0.0
 */
@ThreadSafe
final class JobPipeline<T> {
	@NonNull
	private static final Logger logger = Logger.getLogger(JobPipeline.class.getName());

	@NonNull
	private final DbConnector dbConnector;
	@NonNull
	private final Long jobId;
	@NonNull
	private final JobConfiguration<T> jobConfiguration;
	@NonNull
	private final Supplier<CommandDefinition> commandDefinitionSupplier;
	@NonNull
	private final Class<?> resultType;
	@NonNull
	private final JobExecution<T> jobExecution;

	JobPipeline(@NonNull DbConnector dbConnector,
							@NonNull Long jobId,
							@NonNull JobConfiguration<T> jobConfiguration,
							@NonNull Supplier<CommandDefinition> commandDefinitionSupplier,
							@NonNull Class<?> resultType,
							@NonNull JobExecution<T> jobExecution) {
		this.dbConnector = requireNonNull(dbConnector);
		this.jobId = requireNonNull(jobId);
		this.jobConfiguration = requireNonNull(jobConfiguration);
		this.commandDefinitionSupplier = requireNonNull(commandDefinitionSupplier);
		this.resultType = requireNonNull(resultType);
		this.jobExecution = requireNonNull(jobExecution);
	}

	/**
	 * Runs the job.
	 *
	 * @param cancellationToken  signals cancellation
	 * @param sharedTransaction the transaction the job participates in, if any
	 * @return the outcome, never {@code null}
	 */
	@NonNull
	JobResult<T> run(@NonNull CancellationToken cancellationToken,
									 @Nullable Transaction sharedTransaction) {
		requireNonNull(cancellationToken);

		RetryPolicy retryPolicy = getJobConfiguration().getRetryPolicy();
		int attempt = 0;

		while (true) {
			if (cancellationToken.isCancellationRequested())
				return JobResult.canceled(null, attempt);

			++attempt;

			RunContext runContext = new RunContext(getDbConnector(), getJobId(), attempt, getJobConfiguration(),
					getCommandDefinitionSupplier(), getResultType(), sharedTransaction, cancellationToken);
			AttemptOutcome<T> attemptOutcome = runAttempt(runContext);
			DatabaseException failure = attemptOutcome.failure;

			if (failure == null) {
				if (attemptOutcome.canceled)
					return JobResult.canceled(getJobConfiguration().getKeepPartialResultsOnCancel() ? attemptOutcome.value : null, attempt);

				return JobResult.succeeded(attemptOutcome.value, null, attempt);
			}

			boolean retry = sharedTransaction == null
					&& !cancellationToken.isCancellationRequested()
					&& retryPolicy.shouldRetry(failure, attempt);

			if (retry) {
				logger.log(FINE, format("Attempt %d of job %d failed with a retryable error, retrying", attempt, getJobId()), failure);

				if (backoff(retryPolicy.getBackoff()))
					continue;
			}

			Function<DatabaseException, T> fallback = getJobConfiguration().getFallback().orElse(null);

			if (fallback != null)
				return JobResult.succeeded(fallback.apply(failure), failure, attempt);

			return JobResult.failed(failure, attempt);
		}
	}

	@NonNull
	private AttemptOutcome<T> runAttempt(@NonNull RunContext runContext) {
		requireNonNull(runContext);

		CancellationToken cancellationToken = runContext.getCancellationToken();
		ResultMaterializer resultMaterializer = new ResultMaterializer(getDbConnector().getRowMapper(),
				getDbConnector().getInstanceProvider(), getJobConfiguration().getColumnMap(), cancellationToken);

		runContext.setDeferredCompletion(failure -> completeDeferred(runContext, failure));

		T value = null;
		DatabaseException failure = null;

		try {
			TransactionIsolation transactionIsolation = getJobConfiguration().getTransactionIsolation().orElse(null);

			if (transactionIsolation != null && runContext.getSharedTransaction().isEmpty())
				runContext.beginTransaction(transactionIsolation);

			value = getJobExecution().execute(runContext, resultMaterializer);

			if (!runContext.isCompletionDeferred())
				runContext.readOutputParameters();
		} catch (DatabaseException e) {
			failure = e;
		} catch (RuntimeException e) {
			failure = new DatabaseException(ErrorKind.COMMAND_EXECUTION, JobComponent.PIPELINE,
					format("Job %d failed: %s", getJobId(), e.getMessage()), e);
		}

		// Results still stream from the open cursor; the consumer completes the attempt
		if (failure == null && runContext.isCompletionDeferred())
			return new AttemptOutcome<>(value, null, false);

		boolean canceled = failure == null && cancellationToken.isCancellationRequested();
		DatabaseException completionFailure = complete(runContext, failure, canceled);

		return new AttemptOutcome<>(completionFailure == null ? value : null, completionFailure, canceled && completionFailure == null);
	}

	private void completeDeferred(@NonNull RunContext runContext,
																@Nullable DatabaseException failure) {
		boolean canceled = failure == null && runContext.getCancellationToken().isCancellationRequested();
		DatabaseException completionFailure = complete(runContext, failure, canceled);

		if (failure == null && completionFailure != null)
			throw completionFailure;
	}

	/**
	 * Ends an attempt: commits, rolls back or marks the shared transaction rollback-only, releases resources and logs.
	 *
	 * @return the attempt's failure, with cleanup failures suppressed onto it, or {@code null} if it succeeded
	 */
	@Nullable
	private DatabaseException complete(@NonNull RunContext runContext,
																		 @Nullable DatabaseException failure,
																		 boolean canceled) {
		DatabaseException primaryFailure = failure;

		if (primaryFailure == null)
			runContext.markCompleting();
		else
			runContext.markMaterialized();

		boolean commit = primaryFailure == null && (!canceled || getJobConfiguration().getKeepPartialResultsOnCancel());
		Transaction sharedTransaction = runContext.getSharedTransaction().orElse(null);
		Transaction ownedTransaction = runContext.getOwnedTransaction().orElse(null);

		if (sharedTransaction != null) {
			if (!commit)
				sharedTransaction.setRollbackOnly(true);
		} else if (ownedTransaction != null) {
			if (commit) {
				try {
					ownedTransaction.commit();
					runContext.setTransactionResult(TransactionResult.COMMITTED);
				} catch (DatabaseException e) {
					primaryFailure = e;
					rollback(ownedTransaction, primaryFailure);
				}
			} else {
				rollback(ownedTransaction, primaryFailure);
			}
		}

		Throwable cleanupFailure = runContext.dispose();

		if (cleanupFailure != null) {
			if (primaryFailure != null)
				primaryFailure.addSuppressed(cleanupFailure);
			else
				primaryFailure = new DatabaseException(ErrorKind.COMMAND_EXECUTION, JobComponent.PIPELINE,
						format("Unable to release resources of job %d", getJobId()), cleanupFailure);
		}

		if (primaryFailure != null)
			restoreInterruptIfNeeded(primaryFailure);

		JobState jobState = primaryFailure != null ? JobState.FAILED : canceled ? JobState.CANCELED : JobState.SUCCEEDED;
		JobLog jobLog = JobLog.withJobId(getJobId(), runContext.getAttempt())
				.jobContext(runContext.getJobContext().orElse(null))
				.runStage(runContext.getRunStage())
				.jobState(jobState)
				.connectionAcquisitionDuration(runContext.getConnectionAcquisitionDuration().orElse(null))
				.preparationDuration(runContext.getPreparationDuration().orElse(null))
				.executionDuration(runContext.getExecutionDuration().orElse(null))
				.materializationDuration(runContext.getMaterializationDuration().orElse(null))
				.exception(primaryFailure)
				.build();

		try {
			getDbConnector().getJobLogger().log(jobLog);
		} catch (RuntimeException e) {
			if (primaryFailure == null)
				throw e;

			primaryFailure.addSuppressed(e);
		}

		return primaryFailure;
	}

	private void rollback(@NonNull Transaction transaction,
												@Nullable DatabaseException primaryFailure) {
		try {
			transaction.rollback();
		} catch (DatabaseException rollbackException) {
			logger.log(WARNING, "Unable to roll back transaction", rollbackException);

			if (primaryFailure != null)
				primaryFailure.addSuppressed(rollbackException);
		}
	}

	/**
	 * Waits before the next attempt.
	 *
	 * @return {@code false} if the wait was interrupted, in which case no further attempt should be made
	 */
	private boolean backoff(@NonNull Duration backoff) {
		if (backoff.isZero())
			return true;

		try {
			Thread.sleep(backoff.toMillis());
			return true;
		} catch (InterruptedException e) {
			Thread.currentThread().interrupt();
			return false;
		}
	}

	private static void restoreInterruptIfNeeded(@NonNull Throwable throwable) {
		requireNonNull(throwable);

		Throwable current = throwable;

		while (current != null) {
			if (current instanceof InterruptedException) {
				Thread.currentThread().interrupt();
				return;
			}

			current = current.getCause();
		}
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
	JobConfiguration<T> getJobConfiguration() {
		return this.jobConfiguration;
	}

	@NonNull
	Supplier<CommandDefinition> getCommandDefinitionSupplier() {
		return this.commandDefinitionSupplier;
	}

	@NonNull
	Class<?> getResultType() {
		return this.resultType;
	}

	@NonNull
	JobExecution<T> getJobExecution() {
		return this.jobExecution;
	}

	private static final class AttemptOutcome<T> {
		@Nullable
		private final T value;
		@Nullable
		private final DatabaseException failure;
		private final boolean canceled;

		private AttemptOutcome(@Nullable T value,
													 @Nullable DatabaseException failure,
													 boolean canceled) {
			this.value = value;
			this.failure = failure;
			this.canceled = canceled;
		}
	}
}
