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
import javax.sql.DataSource;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.Savepoint;
import java.util.Collections;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicBoolean;
import java.util.concurrent.atomic.AtomicLong;
import java.util.concurrent.locks.ReentrantLock;
import java.util.function.Consumer;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A database transaction bound to one lazily-acquired connection.
 * <p>
 * Transactions are created either by a shared scope ({@link DbConnector#transaction(TransactionalOperation)}), in
 * which case every job run inside the scope participates, or privately by a job run that requested an isolation
 * level. Commit and rollback are controlled by the engine.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class Transaction {
	@NonNull
	private static final AtomicLong ID_GENERATOR;

	static {
		ID_GENERATOR = new AtomicLong(0);
	}

	@NonNull
	private final Long id;
	@NonNull
	private final DataSource dataSource;
	@NonNull
	private final TransactionIsolation transactionIsolation;
	@NonNull
	private final List<@NonNull Consumer<TransactionResult>> postTransactionOperations;
	@NonNull
	private final ReentrantLock connectionLock;
	@NonNull
	private final AtomicBoolean rollbackOnly;
	@NonNull
	private final AtomicBoolean transactionIsolationWasChanged;
	@NonNull
	private final Logger logger;

	@Nullable
	private Connection connection;
	@Nullable
	private volatile Boolean initialAutoCommit;
	@Nullable
	private volatile Integer initialTransactionIsolationJdbcLevel;

	Transaction(@NonNull DataSource dataSource,
							@NonNull TransactionIsolation transactionIsolation) {
		requireNonNull(dataSource);
		requireNonNull(transactionIsolation);

		this.id = ID_GENERATOR.incrementAndGet();
		this.dataSource = dataSource;
		this.transactionIsolation = transactionIsolation;
		this.postTransactionOperations = new CopyOnWriteArrayList<>();
		this.connectionLock = new ReentrantLock();
		this.rollbackOnly = new AtomicBoolean(false);
		this.transactionIsolationWasChanged = new AtomicBoolean(false);
		this.logger = Logger.getLogger(Transaction.class.getName());
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{id=%s, transactionIsolation=%s, hasConnection=%s, isRollbackOnly=%s}",
				getClass().getSimpleName(), getId(), getTransactionIsolation(), hasConnection(), isRollbackOnly());
	}

	/**
	 * Creates a transaction savepoint that can be rolled back to via {@link #rollback(Savepoint)}.
	 *
	 * @return a transaction savepoint
	 */
	@NonNull
	public Savepoint createSavepoint() {
		try {
			return getConnection().setSavepoint();
		} catch (SQLException e) {
			throw DatabaseException.forSqlException(JobComponent.PIPELINE, "Unable to create savepoint", e);
		}
	}

	/**
	 * Rolls back to the provided transaction savepoint.
	 *
	 * @param savepoint the savepoint to roll back to
	 */
	public void rollback(@NonNull Savepoint savepoint) {
		requireNonNull(savepoint);

		try {
			getConnection().rollback(savepoint);
		} catch (SQLException e) {
			throw DatabaseException.forSqlException(JobComponent.PIPELINE, "Unable to roll back to savepoint", e);
		}
	}

	/**
	 * Should this transaction be rolled back upon completion?
	 * <p>
	 * Jobs that fail while participating in this transaction set this flag.
	 *
	 * @return {@code true} if this transaction will be rolled back, {@code false} otherwise
	 */
	@NonNull
	public Boolean isRollbackOnly() {
		return this.rollbackOnly.get();
	}

	public void setRollbackOnly(@NonNull Boolean rollbackOnly) {
		requireNonNull(rollbackOnly);
		this.rollbackOnly.set(rollbackOnly);
	}

	/**
	 * Adds an operation to be executed once the transaction has committed or rolled back.
	 *
	 * @param postTransactionOperation the post-transaction operation to add
	 */
	public void addPostTransactionOperation(@NonNull Consumer<TransactionResult> postTransactionOperation) {
		requireNonNull(postTransactionOperation);
		this.postTransactionOperations.add(postTransactionOperation);
	}

	@NonNull
	public List<@NonNull Consumer<TransactionResult>> getPostTransactionOperations() {
		return Collections.unmodifiableList(this.postTransactionOperations);
	}

	@NonNull
	public TransactionIsolation getTransactionIsolation() {
		return this.transactionIsolation;
	}

	@NonNull
	public Long getId() {
		return this.id;
	}

	@NonNull
	Boolean hasConnection() {
		getConnectionLock().lock();

		try {
			return this.connection != null;
		} finally {
			getConnectionLock().unlock();
		}
	}

	void commit() {
		getConnectionLock().lock();

		try {
			if (this.connection == null) {
				logger.finer("Transaction has no connection, so nothing to commit");
				return;
			}

			logger.finer("Committing transaction...");

			try {
				this.connection.commit();
				logger.finer("Transaction committed.");
			} catch (SQLException e) {
				throw DatabaseException.forSqlException(JobComponent.PIPELINE, "Unable to commit transaction", e);
			}
		} finally {
			getConnectionLock().unlock();
		}
	}

	void rollback() {
		getConnectionLock().lock();

		try {
			if (this.connection == null) {
				logger.finer("Transaction has no connection, so nothing to roll back");
				return;
			}

			logger.finer("Rolling back transaction...");

			try {
				this.connection.rollback();
				logger.finer("Transaction rolled back.");
			} catch (SQLException e) {
				throw DatabaseException.forSqlException(JobComponent.PIPELINE, "Unable to roll back transaction", e);
			}
		} finally {
			getConnectionLock().unlock();
		}
	}

	/**
	 * The connection associated with this transaction.
	 * <p>
	 * If no connection is associated yet, one is acquired from the {@link DataSource}, autocommit is switched off and
	 * the requested isolation level is applied.
	 *
	 * @return the connection associated with this transaction
	 * @throws DatabaseException of kind {@link ErrorKind#TRANSIENT_CONNECTION} if no connection could be acquired
	 */
	@NonNull
	Connection getConnection() {
		getConnectionLock().lock();

		try {
			if (this.connection != null)
				return this.connection;

			try {
				this.connection = getDataSource().getConnection();
			} catch (SQLException e) {
				throw new DatabaseException(ErrorKind.TRANSIENT_CONNECTION, JobComponent.PIPELINE,
						format("Unable to acquire database connection: %s", e.getMessage()), e);
			}

			try {
				this.initialAutoCommit = this.connection.getAutoCommit();
				this.initialTransactionIsolationJdbcLevel = this.connection.getTransactionIsolation();

				// Restored to true by release() if it started out that way
				if (this.initialAutoCommit)
					this.connection.setAutoCommit(false);

				TransactionIsolation desiredTransactionIsolation = getTransactionIsolation();

				if (desiredTransactionIsolation != TransactionIsolation.DEFAULT) {
					int desiredJdbcLevel = desiredTransactionIsolation.getJdbcLevel().get();

					if (this.initialTransactionIsolationJdbcLevel == null || this.initialTransactionIsolationJdbcLevel != desiredJdbcLevel) {
						this.connection.setTransactionIsolation(desiredJdbcLevel);
						this.transactionIsolationWasChanged.set(true);
					}
				}
			} catch (SQLException e) {
				Connection failedConnection = this.connection;
				this.connection = null;

				try {
					failedConnection.close();
				} catch (SQLException closeException) {
					e.addSuppressed(closeException);
				}

				throw DatabaseException.forSqlException(JobComponent.PIPELINE,
						format("Unable to prepare connection for %s transaction", getTransactionIsolation().name()), e);
			}

			return this.connection;
		} finally {
			getConnectionLock().unlock();
		}
	}

	/**
	 * Restores the connection's original isolation and autocommit settings, closes it and runs post-transaction
	 * operations.
	 * <p>
	 * Every step is attempted even if an earlier one fails. The first failure is returned with later ones suppressed.
	 *
	 * @param transactionResult how the transaction ended
	 * @return the first cleanup failure, if any
	 */
	@Nullable
	Throwable release(@NonNull TransactionResult transactionResult) {
		requireNonNull(transactionResult);

		Throwable cleanupFailure = null;

		getConnectionLock().lock();

		try {
			if (this.connection != null) {
				try {
					Integer initialLevel = this.initialTransactionIsolationJdbcLevel;

					if (this.transactionIsolationWasChanged.getAndSet(false) && initialLevel != null)
						this.connection.setTransactionIsolation(initialLevel);

					if (Boolean.TRUE.equals(this.initialAutoCommit))
						this.connection.setAutoCommit(true);
				} catch (Throwable cleanupException) {
					cleanupFailure = cleanupException;
				} finally {
					try {
						this.connection.close();
					} catch (Throwable cleanupException) {
						cleanupFailure = addCleanupFailure(cleanupFailure, cleanupException);
					}

					this.connection = null;
				}
			}
		} finally {
			getConnectionLock().unlock();
		}

		for (Consumer<TransactionResult> postTransactionOperation : getPostTransactionOperations()) {
			try {
				postTransactionOperation.accept(transactionResult);
			} catch (Throwable cleanupException) {
				cleanupFailure = addCleanupFailure(cleanupFailure, cleanupException);
			}
		}

		return cleanupFailure;
	}

	@NonNull
	static Throwable addCleanupFailure(@Nullable Throwable existing,
																		 @NonNull Throwable additional) {
		requireNonNull(additional);

		if (existing == null)
			return additional;

		existing.addSuppressed(additional);
		return existing;
	}

	@NonNull
	DataSource getDataSource() {
		return this.dataSource;
	}

	@NonNull
	ReentrantLock getConnectionLock() {
		return this.connectionLock;
	}
}
