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
import javax.annotation.concurrent.ThreadSafe;
import javax.sql.DataSource;
import java.util.Arrays;
import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

@ThreadSafe
public class ExceptionSuppressionTests {
	@Test
	public void testJobLoggerExceptionSuppressedWhenJobFails() {
		RuntimeException loggerFailure = new RuntimeException("logger failed");
		JobLogger jobLogger = (jobLog) -> {
			if (jobLog.getJobState() == JobState.FAILED)
				throw loggerFailure;
		};

		DbConnector dbConnector = DbConnector.withDataSource(createInMemoryDataSource("logger_suppressed"))
				.jobLogger(jobLogger)
				.build();

		DatabaseException e = Assertions.assertThrows(DatabaseException.class,
				() -> dbConnector.readToList("SELECT * FROM missing_table", null, String.class).withoutFallback().run());

		Assertions.assertTrue(
				Arrays.stream(e.getSuppressed()).anyMatch(suppressed -> "logger failed".equals(suppressed.getMessage())),
				"Expected job logger failure to be suppressed");
	}

	@Test
	public void testJobLoggerExceptionPropagatesWhenJobSucceeds() {
		RuntimeException loggerFailure = new RuntimeException("logger failed");
		DbConnector dbConnector = DbConnector.withDataSource(createInMemoryDataSource("logger_propagates"))
				.jobLogger(jobLog -> {
					throw loggerFailure;
				})
				.build();

		RuntimeException e = Assertions.assertThrows(RuntimeException.class,
				() -> dbConnector.readToList("SELECT 1 FROM (VALUES(0))", null, Integer.class).run());

		Assertions.assertSame(loggerFailure, e);
	}

	@Test
	public void testPostTransactionOperationExceptionSuppressedWhenOperationFails() {
		DbConnector dbConnector = DbConnector.withDataSource(createInMemoryDataSource("transaction_suppressed")).build();
		RuntimeException boom = new RuntimeException("boom");
		RuntimeException postFailure = new RuntimeException("post");

		RuntimeException e = Assertions.assertThrows(RuntimeException.class, () -> {
			dbConnector.transaction(transaction -> {
				dbConnector.currentTransaction().orElseThrow()
						.addPostTransactionOperation(result -> {
							throw postFailure;
						});
				throw boom;
			});
		});

		Assertions.assertSame(boom, e, "Expected original exception to be thrown");
		Assertions.assertTrue(
				Arrays.stream(e.getSuppressed()).anyMatch(suppressed -> "post".equals(suppressed.getMessage())),
				"Expected post-transaction failure to be suppressed");
	}

	@Test
	public void testCheckedExceptionIsWrapped() {
		DbConnector dbConnector = DbConnector.withDataSource(createInMemoryDataSource("transaction_checked")).build();

		DatabaseException e = Assertions.assertThrows(DatabaseException.class, () -> dbConnector.transaction(transaction -> {
			throw new Exception("checked");
		}));

		Assertions.assertEquals("checked", e.getCause().getMessage());
		Assertions.assertEquals(List.of(), List.of(e.getSuppressed()));
	}

	@Nonnull
	private DataSource createInMemoryDataSource(@Nonnull String databaseName) {
		requireNonNull(databaseName);

		JDBCDataSource dataSource = new JDBCDataSource();
		dataSource.setUrl(format("jdbc:hsqldb:mem:%s", databaseName));
		dataSource.setUser("sa");
		dataSource.setPassword("");

		return dataSource;
	}
}
