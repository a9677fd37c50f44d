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

import org.hsqldb.jdbc.JDBCDataSource;
import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.ThreadSafe;
import javax.sql.DataSource;
import java.io.PrintWriter;
import java.sql.Connection;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.SQLTransientConnectionException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.atomic.AtomicInteger;
import java.util.logging.Logger;

import static java.lang.String.format;

@ThreadSafe
public class RetryTests {
	public record Car(Long id, String name) {}

	@Test
	public void testTransientFailureIsRetried() {
		FlakyDataSource dataSource = createFlakyDataSource("retry_once");
		List<JobLog> jobLogs = new CopyOnWriteArrayList<>();
		DbConnector dbConnector = DbConnector.withDataSource(dataSource).jobLogger(jobLogs::add).build();

		dataSource.failNextConnections(1);

		JobResult<List<Car>> jobResult = dbConnector.readToList("SELECT * FROM car", null, Car.class)
				.withRetryPolicy(RetryPolicy.withMaxAttempts(3).backoff(Duration.ofMillis(1)).build())
				.execute();

		Assertions.assertEquals(JobState.SUCCEEDED, jobResult.getJobState());
		Assertions.assertEquals(2, jobResult.getAttempts(), "Expected exactly one retry");
		Assertions.assertEquals(2, jobResult.getValue().get().size());

		Assertions.assertEquals(2, jobLogs.size(), "Every attempt should be logged");
		Assertions.assertEquals(JobState.FAILED, jobLogs.get(0).getJobState());
		Assertions.assertEquals(ErrorKind.TRANSIENT_CONNECTION, jobLogs.get(0).getException().get().getErrorKind());
		Assertions.assertEquals(JobState.SUCCEEDED, jobLogs.get(1).getJobState());
	}

	@Test
	public void testRetriesAreExhausted() {
		FlakyDataSource dataSource = createFlakyDataSource("retry_exhausted");
		DbConnector dbConnector = DbConnector.withDataSource(dataSource)
				.defaultRetryPolicy(RetryPolicy.withMaxAttempts(3).build())
				.build();

		dataSource.failNextConnections(10);

		JobResult<List<Car>> jobResult = dbConnector.readToList("SELECT * FROM car", null, Car.class)
				.withoutFallback()
				.execute();

		Assertions.assertEquals(JobState.FAILED, jobResult.getJobState());
		Assertions.assertEquals(3, jobResult.getAttempts());
		Assertions.assertEquals(ErrorKind.TRANSIENT_CONNECTION, jobResult.getError().get().getErrorKind());
		Assertions.assertEquals(7, dataSource.getRemainingFailures());

		DatabaseException e = Assertions.assertThrows(DatabaseException.class, jobResult::orElseThrow);
		Assertions.assertSame(jobResult.getError().get(), e);
	}

	@Test
	public void testNonTransientFailureIsNotRetried() {
		FlakyDataSource dataSource = createFlakyDataSource("retry_non_transient");
		DbConnector dbConnector = DbConnector.withDataSource(dataSource).build();

		JobResult<List<Car>> jobResult = dbConnector.readToList("SELECT * FROM no_such_table", null, Car.class)
				.withMaxAttempts(5)
				.withoutFallback()
				.execute();

		Assertions.assertEquals(JobState.FAILED, jobResult.getJobState());
		Assertions.assertEquals(1, jobResult.getAttempts(), "Command errors are not retryable by default");
		Assertions.assertEquals(ErrorKind.COMMAND_EXECUTION, jobResult.getError().get().getErrorKind());
	}

	@Test
	public void testCustomRetryPredicate() {
		FlakyDataSource dataSource = createFlakyDataSource("retry_custom");
		DbConnector dbConnector = DbConnector.withDataSource(dataSource).build();
		AtomicInteger predicateCalls = new AtomicInteger();

		JobResult<List<Car>> jobResult = dbConnector.readToList("SELECT * FROM no_such_table", null, Car.class)
				.withRetryPolicy(RetryPolicy.withMaxAttempts(2).retryIf(failure -> {
					predicateCalls.incrementAndGet();
					return failure.getErrorKind() == ErrorKind.COMMAND_EXECUTION;
				}).build())
				.execute();

		Assertions.assertEquals(2, jobResult.getAttempts());
		Assertions.assertEquals(1, predicateCalls.get(), "Predicate is not consulted once attempts are used up");
	}

	@Test
	public void testFallbackAfterExhaustion() {
		FlakyDataSource dataSource = createFlakyDataSource("retry_fallback");
		DbConnector dbConnector = DbConnector.withDataSource(dataSource).build();

		dataSource.failNextConnections(2);

		List<Car> fallbackCars = List.of(new Car(0L, "Fallback"));
		JobResult<List<Car>> jobResult = dbConnector.readToList("SELECT * FROM car", null, Car.class)
				.withMaxAttempts(2)
				.withFallbackValue(fallbackCars)
				.execute();

		Assertions.assertEquals(JobState.SUCCEEDED, jobResult.getJobState());
		Assertions.assertEquals(Optional.of(fallbackCars), jobResult.getValue());
		Assertions.assertEquals(ErrorKind.TRANSIENT_CONNECTION, jobResult.getError().get().getErrorKind(),
				"The failure that triggered the fallback should be reported");
		Assertions.assertEquals(2, jobResult.getAttempts());
	}

	@Test
	public void testNoRetryInsideSharedTransaction() {
		FlakyDataSource dataSource = createFlakyDataSource("retry_shared_transaction");
		DbConnector dbConnector = DbConnector.withDataSource(dataSource)
				.defaultRetryPolicy(RetryPolicy.withMaxAttempts(3).build())
				.build();

		dataSource.failNextConnections(1);

		Optional<JobResult<List<Car>>> jobResult = dbConnector.transaction(transaction -> {
			JobResult<List<Car>> result = dbConnector.readToList("SELECT * FROM car", null, Car.class).withoutFallback().execute();
			Assertions.assertTrue(transaction.isRollbackOnly(), "Failed job should mark the transaction rollback-only");
			return result;
		});

		Assertions.assertEquals(JobState.FAILED, jobResult.get().getJobState());
		Assertions.assertEquals(1, jobResult.get().getAttempts(), "Jobs in a shared transaction are never retried");
	}

	@Test
	public void testTransientClassification() {
		Assertions.assertTrue(RetryPolicy.isTransientFailure(new SQLTransientConnectionException("gone")));
		Assertions.assertTrue(RetryPolicy.isTransientFailure(new SQLException("link failure", "08S01")));
		Assertions.assertFalse(RetryPolicy.isTransientFailure(new SQLException("syntax error", "42000")));

		DatabaseException e = Assertions.assertThrows(DatabaseException.class, () -> RetryPolicy.withMaxAttempts(0));
		Assertions.assertEquals(ErrorKind.CONFIGURATION, e.getErrorKind());
	}

	@Nonnull
	protected FlakyDataSource createFlakyDataSource(@Nonnull String databaseName) {
		JDBCDataSource dataSource = new JDBCDataSource();
		dataSource.setUrl(format("jdbc:hsqldb:mem:%s", databaseName));
		dataSource.setUser("sa");
		dataSource.setPassword("");

		DbConnector setupConnector = DbConnector.withDataSource(dataSource).build();
		setupConnector.nonQuery("CREATE TABLE car (id INT PRIMARY KEY, name VARCHAR(64))", null).run();
		setupConnector.nonQuery("INSERT INTO car (id, name) VALUES (1, 'Beetle')", null).run();
		setupConnector.nonQuery("INSERT INTO car (id, name) VALUES (2, 'Mini')", null).run();

		return new FlakyDataSource(dataSource);
	}

	/**
	 * Fails a configurable number of connection requests before delegating.
	 */
	@ThreadSafe
	protected static class FlakyDataSource implements DataSource {
		@Nonnull
		private final DataSource dataSource;
		@Nonnull
		private final AtomicInteger remainingFailures;

		public FlakyDataSource(@Nonnull DataSource dataSource) {
			this.dataSource = dataSource;
			this.remainingFailures = new AtomicInteger();
		}

		public void failNextConnections(int failures) {
			this.remainingFailures.set(failures);
		}

		public int getRemainingFailures() {
			return this.remainingFailures.get();
		}

		@Override
		public Connection getConnection() throws SQLException {
			if (this.remainingFailures.getAndUpdate(remaining -> Math.max(0, remaining - 1)) > 0)
				throw new SQLTransientConnectionException("Connection refused");

			return this.dataSource.getConnection();
		}

		@Override
		public Connection getConnection(@Nullable String username,
																		@Nullable String password) throws SQLException {
			return getConnection();
		}

		@Override
		public PrintWriter getLogWriter() throws SQLException {
			return this.dataSource.getLogWriter();
		}

		@Override
		public void setLogWriter(@Nullable PrintWriter out) throws SQLException {
			this.dataSource.setLogWriter(out);
		}

		@Override
		public void setLoginTimeout(int seconds) throws SQLException {
			this.dataSource.setLoginTimeout(seconds);
		}

		@Override
		public int getLoginTimeout() throws SQLException {
			return this.dataSource.getLoginTimeout();
		}

		@Override
		public Logger getParentLogger() throws SQLFeatureNotSupportedException {
			throw new SQLFeatureNotSupportedException();
		}

		@Override
		public <T> T unwrap(@Nonnull Class<T> iface) throws SQLException {
			return this.dataSource.unwrap(iface);
		}

		@Override
		public boolean isWrapperFor(@Nonnull Class<?> iface) throws SQLException {
			return this.dataSource.isWrapperFor(iface);
		}
	}
}
