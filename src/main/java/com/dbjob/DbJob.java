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
import java.util.concurrent.CompletableFuture;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.function.Function;
import java.util.function.Supplier;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A configured, runnable unit of database work that produces a value of type {@code T}.
 * <p>
 * Jobs are created by {@link DbConnector} factory methods and can be adjusted with the {@code with...} methods until
 * they first run. At that point their configuration is frozen: later adjustments fail with a
 * {@link ErrorKind#CONFIGURATION} error. A job can be run any number of times, each run independent of the others.
 * <p>
 * A job started on a thread that is inside {@link DbConnector#transaction(TransactionalOperation)} participates in
 * that transaction. {@link #runAsync()} runs on the connector's executor and therefore outside of it.
 *
 * @param <T> the type of value the job produces
 * @since 1.0.0
 */
@ThreadSafe
public final class DbJob<T> {
	@NonNull
	private final DbConnector dbConnector;
	@NonNull
	private final Supplier<CommandDefinition> commandDefinitionSupplier;
	@NonNull
	private final Class<?> resultType;
	@NonNull
	private final JobExecution<T> jobExecution;
	@NonNull
	private final ReentrantLock lock;

	@Nullable
	private TransactionIsolation transactionIsolation;
	@Nullable
	private Duration timeout;
	@NonNull
	private RetryPolicy retryPolicy;
	@NonNull
	private Boolean buffered;
	@Nullable
	private Function<DatabaseException, T> fallback;
	@NonNull
	private ColumnMap columnMap;
	@NonNull
	private Boolean keepPartialResultsOnCancel;
	@Nullable
	private Consumer<T> completionHandler;
	@Nullable
	private JobConfiguration<T> jobConfiguration;

	DbJob(@NonNull DbConnector dbConnector,
				@NonNull Supplier<CommandDefinition> commandDefinitionSupplier,
				@NonNull Class<?> resultType,
				@NonNull JobExecution<T> jobExecution) {
		this.dbConnector = requireNonNull(dbConnector);
		this.commandDefinitionSupplier = requireNonNull(commandDefinitionSupplier);
		this.resultType = requireNonNull(resultType);
		this.jobExecution = requireNonNull(jobExecution);
		this.lock = new ReentrantLock();
		this.retryPolicy = dbConnector.getDefaultRetryPolicy();
		this.buffered = dbConnector.getDefaultBuffered();
		this.columnMap = ColumnMap.empty();
		this.keepPartialResultsOnCancel = false;
	}

	/**
	 * Runs the job on the calling thread.
	 *
	 * @return the job's value, possibly {@code null}
	 * @throws DatabaseException if the run failed and no fallback applied
	 */
	@Nullable
	public T run() {
		return run(CancellationToken.none());
	}

	/**
	 * Runs the job on the calling thread.
	 * <p>
	 * A canceled run returns {@code null}, or whatever was read before cancellation if
	 * {@link #keepPartialResultsOnCancel(Boolean)} is set.
	 *
	 * @param cancellationToken signals cancellation
	 * @return the job's value, possibly {@code null}
	 * @throws DatabaseException if the run failed and no fallback applied
	 */
	@Nullable
	public T run(@NonNull CancellationToken cancellationToken) {
		requireNonNull(cancellationToken);
		return execute(cancellationToken).orElseThrow();
	}

	/**
	 * Runs the job on the calling thread and reports its outcome instead of throwing.
	 *
	 * @return the outcome of the run
	 */
	@NonNull
	public JobResult<T> execute() {
		return execute(CancellationToken.none());
	}

	@NonNull
	public JobResult<T> execute(@NonNull CancellationToken cancellationToken) {
		requireNonNull(cancellationToken);

		JobConfiguration<T> jobConfiguration = freeze();
		Transaction sharedTransaction = getDbConnector().currentTransaction().orElse(null);

		JobPipeline<T> jobPipeline = new JobPipeline<>(getDbConnector(), getDbConnector().nextJobId(), jobConfiguration,
				this.commandDefinitionSupplier, this.resultType, this.jobExecution);

		JobResult<T> jobResult = jobPipeline.run(cancellationToken, sharedTransaction);

		if (jobResult.getJobState() == JobState.SUCCEEDED)
			jobConfiguration.getCompletionHandler().ifPresent(completionHandler -> completionHandler.accept(jobResult.getValue().orElse(null)));

		return jobResult;
	}

	/**
	 * Runs the job on the connector's executor.
	 * <p>
	 * Cancelling the returned future signals the run's cancellation token.
	 *
	 * @return a future completed with the job's value or its failure
	 */
	@NonNull
	public CompletableFuture<T> runAsync() {
		return runAsync(CancellationToken.create());
	}

	/**
	 * Runs the job on the connector's executor with the given token.
	 *
	 * @param cancellationToken signals cancellation; a fresh token is used instead of {@link CancellationToken#none()}
	 * @return a future completed with the job's value or its failure
	 */
	@NonNull
	public CompletableFuture<T> runAsync(@NonNull CancellationToken cancellationToken) {
		requireNonNull(cancellationToken);

		CancellationToken runCancellationToken = cancellationToken == CancellationToken.none() ? CancellationToken.create() : cancellationToken;
		freeze();

		CompletableFuture<T> future = new CompletableFuture<>() {
			@Override
			public boolean cancel(boolean mayInterruptIfRunning) {
				runCancellationToken.cancel();
				return super.cancel(mayInterruptIfRunning);
			}
		};

		getDbConnector().getExecutor().execute(() -> {
			if (future.isDone())
				return;

			try {
				future.complete(run(runCancellationToken));
			} catch (Throwable t) {
				future.completeExceptionally(t);
			}
		});

		return future;
	}

	/**
	 * Runs the job in its own transaction with the given isolation.
	 * <p>
	 * Inside a shared transaction the shared transaction's settings apply instead.
	 */
	@NonNull
	public DbJob<T> withIsolation(@Nullable TransactionIsolation transactionIsolation) {
		return configure(() -> this.transactionIsolation = transactionIsolation);
	}

	/**
	 * Command timeout, overriding the connector's default. A timeout set on the command definition takes precedence.
	 */
	@NonNull
	public DbJob<T> withTimeout(@Nullable Duration timeout) {
		if (timeout != null && (timeout.isZero() || timeout.isNegative()))
			throw new DatabaseException(ErrorKind.CONFIGURATION, JobComponent.JOB_HANDLE, format("Timeout must be positive, was %s", timeout));

		return configure(() -> this.timeout = timeout);
	}

	@NonNull
	public DbJob<T> withRetryPolicy(@NonNull RetryPolicy retryPolicy) {
		requireNonNull(retryPolicy);
		return configure(() -> this.retryPolicy = retryPolicy);
	}

	/**
	 * Adjusts the number of attempts, keeping the current policy's backoff and retry classification.
	 */
	@NonNull
	public DbJob<T> withMaxAttempts(@NonNull Integer maxAttempts) {
		requireNonNull(maxAttempts);

		return configure(() -> this.retryPolicy = RetryPolicy.withMaxAttempts(maxAttempts)
				.backoff(this.retryPolicy.getBackoff())
				.retryIf(this.retryPolicy.getRetryableFailurePredicate())
				.build());
	}

	/**
	 * Reads every row before the run completes. Only affects jobs producing a {@link RowSequence}.
	 */
	@NonNull
	public DbJob<T> buffered() {
		return configure(() -> this.buffered = true);
	}

	/**
	 * Streams rows from the open cursor. Only affects jobs producing a {@link RowSequence}.
	 */
	@NonNull
	public DbJob<T> unbuffered() {
		return configure(() -> this.buffered = false);
	}

	/**
	 * Produces a value in place of a failure. Transient failures are retried before the fallback applies.
	 */
	@NonNull
	public DbJob<T> withFallback(@NonNull Function<DatabaseException, T> fallback) {
		requireNonNull(fallback);
		return configure(() -> this.fallback = fallback);
	}

	@NonNull
	public DbJob<T> withFallbackValue(@Nullable T fallbackValue) {
		return withFallback(ignored -> fallbackValue);
	}

	/**
	 * Removes any fallback, including the empty-collection fallback collection reads start with, so failures surface.
	 */
	@NonNull
	public DbJob<T> withoutFallback() {
		return configure(() -> this.fallback = null);
	}

	@NonNull
	public DbJob<T> withColumnMap(@NonNull ColumnMap columnMap) {
		requireNonNull(columnMap);
		return configure(() -> this.columnMap = columnMap);
	}

	/**
	 * On cancellation, commit the job's own transaction and keep the rows read so far as the run's value.
	 */
	@NonNull
	public DbJob<T> keepPartialResultsOnCancel(@NonNull Boolean keepPartialResultsOnCancel) {
		requireNonNull(keepPartialResultsOnCancel);
		return configure(() -> this.keepPartialResultsOnCancel = keepPartialResultsOnCancel);
	}

	/**
	 * Invoked with the value of every successful run, on the thread that ran it.
	 */
	@NonNull
	public DbJob<T> onCompleted(@NonNull Consumer<T> completionHandler) {
		requireNonNull(completionHandler);
		return configure(() -> this.completionHandler = completionHandler);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{resultType=%s, frozen=%s}", getClass().getSimpleName(), this.resultType.getSimpleName(), isFrozen());
	}

	@NonNull
	Boolean isFrozen() {
		this.lock.lock();

		try {
			return this.jobConfiguration != null;
		} finally {
			this.lock.unlock();
		}
	}

	@NonNull
	private DbJob<T> configure(@NonNull Runnable configurer) {
		this.lock.lock();

		try {
			if (this.jobConfiguration != null)
				throw new DatabaseException(ErrorKind.CONFIGURATION, JobComponent.JOB_HANDLE, "A job cannot be reconfigured after it has run");

			configurer.run();
			return this;
		} finally {
			this.lock.unlock();
		}
	}

	@NonNull
	private JobConfiguration<T> freeze() {
		this.lock.lock();

		try {
			if (this.jobConfiguration == null)
				this.jobConfiguration = new JobConfiguration<>(this.transactionIsolation, this.timeout, this.retryPolicy, this.buffered,
						this.fallback, this.columnMap, this.keepPartialResultsOnCancel, this.completionHandler);

			return this.jobConfiguration;
		} finally {
			this.lock.unlock();
		}
	}

	@NonNull
	private DbConnector getDbConnector() {
		return this.dbConnector;
	}
}
