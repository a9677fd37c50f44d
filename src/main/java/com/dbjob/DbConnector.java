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
import javax.sql.DataSource;
import java.time.Duration;
import java.time.ZoneId;
import java.util.ArrayDeque;
import java.util.Deque;
import java.util.EnumSet;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.Set;
import java.util.concurrent.Executor;
import java.util.concurrent.ExecutorService;
import java.util.concurrent.Executors;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.concurrent.atomic.AtomicLong;
import java.util.function.Consumer;
import java.util.function.Supplier;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;
import static java.util.logging.Level.WARNING;

/**
 * Main entry point: creates {@link DbJob}s against a {@link DataSource} and scopes shared transactions.
 * <p>
 * Every factory method comes in two forms. The first takes SQL text with {@code :name} placeholders and a parameter
 * source (a map, record, bean, {@link JobParameters}, a single value for a single placeholder, or {@code null}).
 * The second takes a callback that fills in a {@link CommandDefinition.Builder}; it is invoked again on every
 * attempt, so it can produce stored procedure calls, per-command timeouts and binding restrictions.
 * <p>
 * {@code read}, {@code readRows}, {@code readToList} and {@code readToMaps} jobs fall back to an empty result when
 * they fail; the failure is still reported by {@link JobResult#getError()}. Call {@link DbJob#withoutFallback()} to
 * have them fail instead.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class DbConnector {
	@NonNull
	private static final ThreadLocal<Deque<Transaction>> TRANSACTION_STACK_HOLDER;
	@NonNull
	private static final Set<CommandBehavior> FIRST_ROW_BEHAVIORS;
	@NonNull
	private static final Set<CommandBehavior> SINGLE_ROW_BEHAVIORS;

	static {
		TRANSACTION_STACK_HOLDER = ThreadLocal.withInitial(() -> new ArrayDeque<>());
		FIRST_ROW_BEHAVIORS = Set.copyOf(EnumSet.of(CommandBehavior.SINGLE_ROW, CommandBehavior.SINGLE_RESULT));
		SINGLE_ROW_BEHAVIORS = Set.of(CommandBehavior.SINGLE_RESULT);
	}

	@NonNull
	private final DataSource dataSource;
	@NonNull
	private final ZoneId timeZone;
	@NonNull
	private final InstanceProvider instanceProvider;
	@NonNull
	private final RowMapper rowMapper;
	@NonNull
	private final CommandBuilder commandBuilder;
	@NonNull
	private final JobLogger jobLogger;
	@NonNull
	private final Executor executor;
	@Nullable
	private final Duration defaultCommandTimeout;
	@NonNull
	private final RetryPolicy defaultRetryPolicy;
	@NonNull
	private final Boolean defaultBuffered;
	@NonNull
	private final AtomicLong jobIdGenerator;
	@NonNull
	private final Logger logger;

	protected DbConnector(@NonNull Builder builder) {
		requireNonNull(builder);

		this.dataSource = requireNonNull(builder.dataSource);
		this.timeZone = builder.timeZone == null ? ZoneId.systemDefault() : builder.timeZone;
		this.instanceProvider = builder.instanceProvider == null ? new InstanceProvider() {} : builder.instanceProvider;
		this.rowMapper = builder.rowMapper == null ? RowMapper.withDefaultConfiguration() : builder.rowMapper;
		this.commandBuilder = new CommandBuilder(builder.statementBinder == null ? StatementBinder.withDefaultConfiguration() : builder.statementBinder);
		this.jobLogger = builder.jobLogger == null ? new DefaultJobLogger() : builder.jobLogger;
		this.executor = builder.executor == null ? defaultExecutor() : builder.executor;
		this.defaultCommandTimeout = builder.defaultCommandTimeout;
		this.defaultRetryPolicy = builder.defaultRetryPolicy == null ? RetryPolicy.none() : builder.defaultRetryPolicy;
		this.defaultBuffered = builder.defaultBuffered == null ? true : builder.defaultBuffered;
		this.jobIdGenerator = new AtomicLong();
		this.logger = Logger.getLogger(getClass().getName());
	}

	/**
	 * Provides a {@link DbConnector} builder for the given {@link DataSource}.
	 *
	 * @param dataSource data source used to create the {@link DbConnector} builder
	 * @return a {@link DbConnector} builder
	 */
	@NonNull
	public static Builder withDataSource(@NonNull DataSource dataSource) {
		requireNonNull(dataSource);
		return new Builder(dataSource);
	}

	/**
	 * Gets a reference to the current transaction, if any.
	 *
	 * @return the innermost transaction opened on this thread
	 */
	@NonNull
	public Optional<Transaction> currentTransaction() {
		Deque<Transaction> transactionStack = TRANSACTION_STACK_HOLDER.get();
		return Optional.ofNullable(transactionStack.isEmpty() ? null : transactionStack.peek());
	}

	/**
	 * Performs an operation transactionally.
	 * <p>
	 * The transaction will be automatically rolled back if an exception bubbles out of {@code transactionalOperation}
	 * or if a job run inside it fails.
	 *
	 * @param transactionalOperation the operation to perform transactionally
	 * @return the result of the transactional operation
	 */
	@NonNull
	public <T> Optional<T> transaction(@NonNull TransactionalOperation<T> transactionalOperation) {
		requireNonNull(transactionalOperation);
		return transaction(TransactionIsolation.DEFAULT, transactionalOperation);
	}

	/**
	 * Performs an operation transactionally with the given isolation level.
	 * <p>
	 * Every {@link DbJob} run on this thread inside {@code transactionalOperation} shares the transaction's
	 * connection. Such jobs are never retried and never commit; a failing job marks the transaction rollback-only.
	 *
	 * @param transactionIsolation   the desired database transaction isolation level
	 * @param transactionalOperation the operation to perform transactionally
	 * @return the result of the transactional operation
	 */
	@NonNull
	public <T> Optional<T> transaction(@NonNull TransactionIsolation transactionIsolation,
																		 @NonNull TransactionalOperation<T> transactionalOperation) {
		requireNonNull(transactionIsolation);
		requireNonNull(transactionalOperation);

		Transaction transaction = new Transaction(getDataSource(), transactionIsolation);
		TRANSACTION_STACK_HOLDER.get().push(transaction);
		boolean committed = false;
		Throwable thrown = null;

		try {
			T returnValue = transactionalOperation.perform(transaction);

			if (transaction.isRollbackOnly()) {
				transaction.rollback();
			} else {
				transaction.commit();
				committed = true;
			}

			return Optional.ofNullable(returnValue);
		} catch (RuntimeException | Error e) {
			thrown = e;
			rollbackQuietly(transaction);
			restoreInterruptIfNeeded(e);
			throw e;
		} catch (Exception e) {
			rollbackQuietly(transaction);
			restoreInterruptIfNeeded(e);
			DatabaseException wrapped = new DatabaseException(ErrorKind.COMMAND_EXECUTION, JobComponent.PIPELINE,
					format("Transactional operation failed: %s", e.getMessage()), e);
			thrown = wrapped;
			throw wrapped;
		} finally {
			Deque<Transaction> transactionStack = TRANSACTION_STACK_HOLDER.get();

			transactionStack.pop();

			// Ensure transaction stack is fully cleaned up
			if (transactionStack.isEmpty())
				TRANSACTION_STACK_HOLDER.remove();

			Throwable cleanupFailure = transaction.release(committed ? TransactionResult.COMMITTED : TransactionResult.ROLLED_BACK);

			if (cleanupFailure != null) {
				if (thrown != null)
					thrown.addSuppressed(cleanupFailure);
				else if (cleanupFailure instanceof RuntimeException runtimeException)
					throw runtimeException;
				else if (cleanupFailure instanceof Error error)
					throw error;
				else
					throw new DatabaseException(ErrorKind.COMMAND_EXECUTION, JobComponent.PIPELINE, "Unable to release transaction", cleanupFailure);
			}
		}
	}

	// Streaming reads

	/**
	 * Reads the rows of the first result segment as a {@link RowSequence}.
	 * <p>
	 * Buffered by default; call {@link DbJob#unbuffered()} to stream rows from the open cursor.
	 */
	@NonNull
	public <T> DbJob<RowSequence<T>> read(@NonNull String sql,
																				@Nullable Object parameters,
																				@NonNull Class<T> type) {
		return read(textCommand(sql, parameters), type);
	}

	@NonNull
	public <T> DbJob<RowSequence<T>> read(@NonNull Consumer<CommandDefinition.Builder> command,
																				@NonNull Class<T> type) {
		return read(callbackCommand(command), type);
	}

	@NonNull
	public DbJob<RowSequence<DbRow>> readRows(@NonNull String sql,
																						@Nullable Object parameters) {
		return read(textCommand(sql, parameters), DbRow.class);
	}

	@NonNull
	public DbJob<RowSequence<DbRow>> readRows(@NonNull Consumer<CommandDefinition.Builder> command) {
		return read(callbackCommand(command), DbRow.class);
	}

	// Single-row reads

	/**
	 * The first row of the first segment; fails with {@link EmptyResultException} if there is none.
	 */
	@NonNull
	public <T> DbJob<T> readFirst(@NonNull String sql,
																@Nullable Object parameters,
																@NonNull Class<T> type) {
		return readFirst(textCommand(sql, parameters), type);
	}

	@NonNull
	public <T> DbJob<T> readFirst(@NonNull Consumer<CommandDefinition.Builder> command,
																@NonNull Class<T> type) {
		return readFirst(callbackCommand(command), type);
	}

	@NonNull
	public <T> DbJob<Optional<T>> readFirstOrDefault(@NonNull String sql,
																									 @Nullable Object parameters,
																									 @NonNull Class<T> type) {
		return readFirstOrDefault(textCommand(sql, parameters), type);
	}

	@NonNull
	public <T> DbJob<Optional<T>> readFirstOrDefault(@NonNull Consumer<CommandDefinition.Builder> command,
																									 @NonNull Class<T> type) {
		return readFirstOrDefault(callbackCommand(command), type);
	}

	/**
	 * The only row of the first segment; fails with {@link EmptyResultException} if there is none and
	 * {@link MultipleRowsFoundException} if there are more.
	 */
	@NonNull
	public <T> DbJob<T> readSingle(@NonNull String sql,
																 @Nullable Object parameters,
																 @NonNull Class<T> type) {
		return readSingle(textCommand(sql, parameters), type);
	}

	@NonNull
	public <T> DbJob<T> readSingle(@NonNull Consumer<CommandDefinition.Builder> command,
																 @NonNull Class<T> type) {
		return readSingle(callbackCommand(command), type);
	}

	@NonNull
	public <T> DbJob<Optional<T>> readSingleOrDefault(@NonNull String sql,
																										@Nullable Object parameters,
																										@NonNull Class<T> type) {
		return readSingleOrDefault(textCommand(sql, parameters), type);
	}

	@NonNull
	public <T> DbJob<Optional<T>> readSingleOrDefault(@NonNull Consumer<CommandDefinition.Builder> command,
																										@NonNull Class<T> type) {
		return readSingleOrDefault(callbackCommand(command), type);
	}

	/**
	 * The first column of the first row, ignoring everything else.
	 *
	 * @throws DatabaseException of kind {@link ErrorKind#CONFIGURATION} if {@code type} is not a scalar type
	 */
	@NonNull
	public <T> DbJob<Optional<T>> scalar(@NonNull String sql,
																			 @Nullable Object parameters,
																			 @NonNull Class<T> type) {
		return scalar(textCommand(sql, parameters), type);
	}

	@NonNull
	public <T> DbJob<Optional<T>> scalar(@NonNull Consumer<CommandDefinition.Builder> command,
																			 @NonNull Class<T> type) {
		return scalar(callbackCommand(command), type);
	}

	// Buffered reads

	@NonNull
	public <T> DbJob<List<T>> readToList(@NonNull String sql,
																			 @Nullable Object parameters,
																			 @NonNull Class<T> type) {
		return readToList(textCommand(sql, parameters), type);
	}

	@NonNull
	public <T> DbJob<List<T>> readToList(@NonNull Consumer<CommandDefinition.Builder> command,
																			 @NonNull Class<T> type) {
		return readToList(callbackCommand(command), type);
	}

	/**
	 * Rows of the first segment as column name to value maps. For duplicate column names the last column wins.
	 */
	@NonNull
	public DbJob<List<Map<String, Object>>> readToMaps(@NonNull String sql,
																										 @Nullable Object parameters) {
		return readToMaps(textCommand(sql, parameters));
	}

	@NonNull
	public DbJob<List<Map<String, Object>>> readToMaps(@NonNull Consumer<CommandDefinition.Builder> command) {
		return readToMaps(callbackCommand(command));
	}

	/**
	 * Schema and rows of the first segment, with column order and duplicate names preserved.
	 */
	@NonNull
	public DbJob<DbTable> readToTable(@NonNull String sql,
																		@Nullable Object parameters) {
		return readToTable(textCommand(sql, parameters));
	}

	@NonNull
	public DbJob<DbTable> readToTable(@NonNull Consumer<CommandDefinition.Builder> command) {
		return readToTable(callbackCommand(command));
	}

	@NonNull
	public DbJob<DbTableSet> readToTableSet(@NonNull String sql,
																					@Nullable Object parameters) {
		return readToTableSet(textCommand(sql, parameters));
	}

	@NonNull
	public DbJob<DbTableSet> readToTableSet(@NonNull Consumer<CommandDefinition.Builder> command) {
		return readToTableSet(callbackCommand(command));
	}

	/**
	 * Maps result segment {@code k} into {@code slots.get(k)}. Always buffered.
	 *
	 * @throws DatabaseException of kind {@link ErrorKind#CONFIGURATION} unless there are between 1 and 8 slots
	 */
	@NonNull
	public DbJob<MultiResult> readMultiple(@NonNull String sql,
																				 @Nullable Object parameters,
																				 @NonNull List<@NonNull ResultSlot<?>> slots) {
		return readMultiple(textCommand(sql, parameters), slots);
	}

	@NonNull
	public DbJob<MultiResult> readMultiple(@NonNull Consumer<CommandDefinition.Builder> command,
																				 @NonNull List<@NonNull ResultSlot<?>> slots) {
		return readMultiple(callbackCommand(command), slots);
	}

	// Commands

	/**
	 * Executes a command that produces no rows, such as DML, DDL or a stored procedure call.
	 * <p>
	 * The job runs in a {@link TransactionIsolation#READ_COMMITTED} transaction and falls back to {@code null} on
	 * failure; the failure stays available from {@link DbJob#execute()}. Output parameters of stored procedure calls
	 * are written back into the {@link JobParameters} passed in.
	 *
	 * @return a job producing the affected row count
	 */
	@NonNull
	public DbJob<Long> nonQuery(@NonNull String sql,
															@Nullable Object parameters) {
		return nonQuery(textCommand(sql, parameters));
	}

	@NonNull
	public DbJob<Long> nonQuery(@NonNull Consumer<CommandDefinition.Builder> command) {
		return nonQuery(callbackCommand(command));
	}

	@NonNull
	private <T> DbJob<RowSequence<T>> read(@NonNull Supplier<CommandDefinition> command,
																				 @NonNull Class<T> type) {
		requireNonNull(type);

		return new DbJob<RowSequence<T>>(this, command, type, (runContext, resultMaterializer) -> {
			RowCursor rowCursor = runContext.executeQuery(Set.of());
			JobContext jobContext = runContext.requireJobContext();

			if (runContext.getJobConfiguration().isBuffered())
				return new BufferedRowSequence<>(resultMaterializer.list(rowCursor, jobContext, type));

			return resultMaterializer.lazy(rowCursor, jobContext, type, runContext.deferCompletion());
		}).withFallback(ignored -> new BufferedRowSequence<>(List.of()));
	}

	@NonNull
	private <T> DbJob<T> readFirst(@NonNull Supplier<CommandDefinition> command,
																 @NonNull Class<T> type) {
		requireNonNull(type);

		return new DbJob<>(this, command, type, (runContext, resultMaterializer) ->
				resultMaterializer.first(runContext.executeQuery(FIRST_ROW_BEHAVIORS), runContext.requireJobContext(), type));
	}

	@NonNull
	private <T> DbJob<Optional<T>> readFirstOrDefault(@NonNull Supplier<CommandDefinition> command,
																										@NonNull Class<T> type) {
		requireNonNull(type);

		return new DbJob<>(this, command, type, (runContext, resultMaterializer) ->
				resultMaterializer.firstOrDefault(runContext.executeQuery(FIRST_ROW_BEHAVIORS), runContext.requireJobContext(), type));
	}

	@NonNull
	private <T> DbJob<T> readSingle(@NonNull Supplier<CommandDefinition> command,
																	@NonNull Class<T> type) {
		requireNonNull(type);

		return new DbJob<>(this, command, type, (runContext, resultMaterializer) ->
				resultMaterializer.single(runContext.executeQuery(SINGLE_ROW_BEHAVIORS), runContext.requireJobContext(), type));
	}

	@NonNull
	private <T> DbJob<Optional<T>> readSingleOrDefault(@NonNull Supplier<CommandDefinition> command,
																										 @NonNull Class<T> type) {
		requireNonNull(type);

		return new DbJob<>(this, command, type, (runContext, resultMaterializer) ->
				resultMaterializer.singleOrDefault(runContext.executeQuery(SINGLE_ROW_BEHAVIORS), runContext.requireJobContext(), type));
	}

	@NonNull
	private <T> DbJob<Optional<T>> scalar(@NonNull Supplier<CommandDefinition> command,
																				@NonNull Class<T> type) {
		ResultMaterializer.requireScalarType(type);

		return new DbJob<>(this, command, type, (runContext, resultMaterializer) ->
				resultMaterializer.scalar(runContext.executeQuery(FIRST_ROW_BEHAVIORS), runContext.requireJobContext(), type));
	}

	@NonNull
	private <T> DbJob<List<T>> readToList(@NonNull Supplier<CommandDefinition> command,
																				@NonNull Class<T> type) {
		requireNonNull(type);

		return new DbJob<List<T>>(this, command, type, (runContext, resultMaterializer) ->
				resultMaterializer.list(runContext.executeQuery(Set.of()), runContext.requireJobContext(), type))
				.withFallback(ignored -> List.of());
	}

	@NonNull
	@SuppressWarnings({"unchecked", "rawtypes"})
	private DbJob<List<Map<String, Object>>> readToMaps(@NonNull Supplier<CommandDefinition> command) {
		return new DbJob<List<Map<String, Object>>>(this, command, Map.class, (runContext, resultMaterializer) ->
				(List) resultMaterializer.list(runContext.executeQuery(Set.of()), runContext.requireJobContext(), Map.class))
				.withFallback(ignored -> List.of());
	}

	@NonNull
	private DbJob<DbTable> readToTable(@NonNull Supplier<CommandDefinition> command) {
		return new DbJob<>(this, command, DbTable.class, (runContext, resultMaterializer) ->
				resultMaterializer.table(runContext.executeQuery(Set.of()), runContext.requireJobContext()));
	}

	@NonNull
	private DbJob<DbTableSet> readToTableSet(@NonNull Supplier<CommandDefinition> command) {
		return new DbJob<>(this, command, DbTableSet.class, (runContext, resultMaterializer) ->
				resultMaterializer.tableSet(runContext.executeQuery(Set.of()), runContext.requireJobContext()));
	}

	@NonNull
	private DbJob<MultiResult> readMultiple(@NonNull Supplier<CommandDefinition> command,
																					@NonNull List<@NonNull ResultSlot<?>> slots) {
		ResultMaterializer.requireSlotCount(slots);
		List<ResultSlot<?>> slotsCopy = List.copyOf(slots);

		return new DbJob<>(this, command, MultiResult.class, (runContext, resultMaterializer) ->
				resultMaterializer.multiple(runContext.executeQuery(Set.of()), runContext.requireJobContext(), slotsCopy));
	}

	@NonNull
	private DbJob<Long> nonQuery(@NonNull Supplier<CommandDefinition> command) {
		return new DbJob<Long>(this, command, Long.class, (runContext, resultMaterializer) -> runContext.executeNonQuery())
				.withIsolation(TransactionIsolation.READ_COMMITTED)
				.withFallbackValue(null);
	}

	@NonNull
	private Supplier<CommandDefinition> textCommand(@NonNull String sql,
																									@Nullable Object parameters) {
		requireNonNull(sql);

		// Validated once, up front
		CommandDefinition commandDefinition = CommandDefinition.withText(sql).parameters(parameters).build();
		NamedParameterSql.parse(commandDefinition.getText());

		return () -> commandDefinition;
	}

	@NonNull
	private Supplier<CommandDefinition> callbackCommand(@NonNull Consumer<CommandDefinition.Builder> command) {
		requireNonNull(command);

		return () -> {
			CommandDefinition.Builder builder = CommandDefinition.builder();
			command.accept(builder);
			return builder.build();
		};
	}

	@NonNull
	Long nextJobId() {
		return this.jobIdGenerator.incrementAndGet();
	}

	private void rollbackQuietly(@NonNull Transaction transaction) {
		try {
			transaction.rollback();
		} catch (Exception rollbackException) {
			logger.log(WARNING, "Unable to roll back transaction", rollbackException);
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
	private static ExecutorService defaultExecutor() {
		AtomicInteger threadNumber = new AtomicInteger();

		return Executors.newCachedThreadPool(runnable -> {
			Thread thread = new Thread(runnable, format("dbjob-worker-%d", threadNumber.incrementAndGet()));
			thread.setDaemon(true);
			return thread;
		});
	}

	@NonNull
	DataSource getDataSource() {
		return this.dataSource;
	}

	@NonNull
	ZoneId getTimeZone() {
		return this.timeZone;
	}

	@NonNull
	InstanceProvider getInstanceProvider() {
		return this.instanceProvider;
	}

	@NonNull
	RowMapper getRowMapper() {
		return this.rowMapper;
	}

	@NonNull
	CommandBuilder getCommandBuilder() {
		return this.commandBuilder;
	}

	@NonNull
	JobLogger getJobLogger() {
		return this.jobLogger;
	}

	@NonNull
	Executor getExecutor() {
		return this.executor;
	}

	@NonNull
	Optional<Duration> getDefaultCommandTimeout() {
		return Optional.ofNullable(this.defaultCommandTimeout);
	}

	@NonNull
	RetryPolicy getDefaultRetryPolicy() {
		return this.defaultRetryPolicy;
	}

	@NonNull
	Boolean getDefaultBuffered() {
		return this.defaultBuffered;
	}

	/**
	 * Builder used to construct instances of {@link DbConnector}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final DataSource dataSource;
		@Nullable
		private ZoneId timeZone;
		@Nullable
		private InstanceProvider instanceProvider;
		@Nullable
		private RowMapper rowMapper;
		@Nullable
		private StatementBinder statementBinder;
		@Nullable
		private JobLogger jobLogger;
		@Nullable
		private Executor executor;
		@Nullable
		private Duration defaultCommandTimeout;
		@Nullable
		private RetryPolicy defaultRetryPolicy;
		@Nullable
		private Boolean defaultBuffered;

		private Builder(@NonNull DataSource dataSource) {
			this.dataSource = requireNonNull(dataSource);
		}

		/**
		 * Zone used to interpret temporal values that carry no zone of their own.
		 * <p>
		 * Defaults to {@link ZoneId#systemDefault()}.
		 */
		@NonNull
		public Builder timeZone(@Nullable ZoneId timeZone) {
			this.timeZone = timeZone;
			return this;
		}

		@NonNull
		public Builder instanceProvider(@Nullable InstanceProvider instanceProvider) {
			this.instanceProvider = instanceProvider;
			return this;
		}

		@NonNull
		public Builder rowMapper(@Nullable RowMapper rowMapper) {
			this.rowMapper = rowMapper;
			return this;
		}

		@NonNull
		public Builder statementBinder(@Nullable StatementBinder statementBinder) {
			this.statementBinder = statementBinder;
			return this;
		}

		/**
		 * Receives one {@link JobLog} per attempt. Defaults to {@link DefaultJobLogger}.
		 */
		@NonNull
		public Builder jobLogger(@Nullable JobLogger jobLogger) {
			this.jobLogger = jobLogger;
			return this;
		}

		/**
		 * Runs {@link DbJob#runAsync()} work. Defaults to a cached pool of daemon threads.
		 */
		@NonNull
		public Builder executor(@Nullable Executor executor) {
			this.executor = executor;
			return this;
		}

		@NonNull
		public Builder defaultCommandTimeout(@Nullable Duration defaultCommandTimeout) {
			if (defaultCommandTimeout != null && (defaultCommandTimeout.isZero() || defaultCommandTimeout.isNegative()))
				throw new DatabaseException(ErrorKind.CONFIGURATION, JobComponent.JOB_HANDLE,
						format("Default command timeout must be positive, was %s", defaultCommandTimeout));

			this.defaultCommandTimeout = defaultCommandTimeout;
			return this;
		}

		/**
		 * Retry policy of new jobs. Defaults to {@link RetryPolicy#none()}.
		 */
		@NonNull
		public Builder defaultRetryPolicy(@Nullable RetryPolicy defaultRetryPolicy) {
			this.defaultRetryPolicy = defaultRetryPolicy;
			return this;
		}

		/**
		 * Whether new {@link RowSequence} jobs read every row before completing. Defaults to {@code true}.
		 */
		@NonNull
		public Builder defaultBuffered(@Nullable Boolean defaultBuffered) {
			this.defaultBuffered = defaultBuffered;
			return this;
		}

		@NonNull
		public DbConnector build() {
			return new DbConnector(this);
		}
	}
}
