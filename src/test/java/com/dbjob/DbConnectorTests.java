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
import java.sql.Savepoint;
import java.sql.Types;
import java.time.Duration;
import java.time.ZoneId;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.concurrent.TimeUnit;
import java.util.concurrent.atomic.AtomicReference;

import static java.lang.String.format;

@ThreadSafe
public class DbConnectorTests {
	public record Car(Long id, String name, String color) {}

	public record CarSummary(String name, Integer nameLength) {}

	@Test
	public void testReadToListAndFirst() {
		DbConnector dbConnector = createDbConnector("cars_read");

		List<Car> cars = dbConnector.readToList("SELECT * FROM car ORDER BY id", null, Car.class).run();

		Assertions.assertEquals(3, cars.size(), "Wrong number of cars");
		Assertions.assertEquals(new Car(1L, "Beetle", "yellow"), cars.get(0));

		Car first = dbConnector.readFirst("SELECT * FROM car ORDER BY id", null, Car.class).run();
		Assertions.assertEquals(cars.get(0), first, "readFirst and readToList disagree");

		Car byId = dbConnector.readFirst("SELECT * FROM car WHERE id = :id", 2, Car.class).run();
		Assertions.assertEquals("Mini", byId.name(), "Flat value should bind to the only placeholder");

		List<Car> byIds = dbConnector.readToList("SELECT * FROM car WHERE id IN (:ids) ORDER BY id",
				Map.of("ids", Parameters.inList(List.of(1, 3))), Car.class).run();
		Assertions.assertEquals(List.of(1L, 3L), byIds.stream().map(Car::id).toList());
	}

	@Test
	public void testCardinality() {
		DbConnector dbConnector = createDbConnector("cars_cardinality");

		Assertions.assertThrows(EmptyResultException.class,
				() -> dbConnector.readFirst("SELECT * FROM car WHERE id = :id", 99, Car.class).run());
		Assertions.assertEquals(Optional.empty(),
				dbConnector.readFirstOrDefault("SELECT * FROM car WHERE id = :id", 99, Car.class).run());

		Assertions.assertThrows(MultipleRowsFoundException.class,
				() -> dbConnector.readSingle("SELECT * FROM car", null, Car.class).run());
		Assertions.assertEquals("Beetle",
				dbConnector.readSingle("SELECT * FROM car WHERE id = :id", 1, Car.class).run().name());
		Assertions.assertTrue(dbConnector.readSingleOrDefault("SELECT * FROM car WHERE id = :id", 99, Car.class).run().isEmpty());
	}

	@Test
	public void testScalar() {
		DbConnector dbConnector = createDbConnector("cars_scalar");

		Assertions.assertEquals(Optional.of(3L), dbConnector.scalar("SELECT COUNT(*) FROM car", null, Long.class).run());
		Assertions.assertEquals(Optional.empty(), dbConnector.scalar("SELECT name FROM car WHERE id = :id", 99, String.class).run());

		DatabaseException e = Assertions.assertThrows(DatabaseException.class,
				() -> dbConnector.scalar("SELECT * FROM car", null, Car.class));
		Assertions.assertEquals(ErrorKind.CONFIGURATION, e.getErrorKind(), "Non-scalar types should be rejected before running");
	}

	@Test
	public void testColumnMap() {
		DbConnector dbConnector = createDbConnector("cars_column_map");

		CarSummary carSummary = dbConnector.readFirst("SELECT name, CHAR_LENGTH(name) AS len FROM car WHERE id = :id", 1, CarSummary.class)
				.withColumnMap(ColumnMap.builder().rename("len", "nameLength").build())
				.run();

		Assertions.assertEquals(new CarSummary("Beetle", 6), carSummary);
	}

	@Test
	public void testPositionalParametersAreRejectedUpFront() {
		DbConnector dbConnector = createDbConnector("cars_positional");

		DatabaseException e = Assertions.assertThrows(DatabaseException.class,
				() -> dbConnector.readToList("SELECT * FROM car WHERE id = ?", null, Car.class));

		Assertions.assertEquals(ErrorKind.CONFIGURATION, e.getErrorKind());
	}

	@Test
	public void testNonQuery() {
		DbConnector dbConnector = createDbConnector("cars_non_query");

		Long updated = dbConnector.nonQuery("UPDATE car SET color = :color WHERE id <> :id", Map.of("color", "red", "id", 1)).run();
		Assertions.assertEquals(2L, updated, "Wrong affected row count");

		JobResult<Long> jobResult = dbConnector.nonQuery("INSERT INTO car (id, name, color) VALUES (:id, :name, :color)",
				new Car(1L, "Duplicate", "blue")).execute();

		Assertions.assertEquals(JobState.SUCCEEDED, jobResult.getJobState(), "Non-queries fall back instead of failing");
		Assertions.assertTrue(jobResult.getValue().isEmpty());
		Assertions.assertEquals(ErrorKind.COMMAND_EXECUTION, jobResult.getError().get().getErrorKind());
		Assertions.assertEquals(Optional.of(3L), dbConnector.scalar("SELECT COUNT(*) FROM car", null, Long.class).run());
	}

	@Test
	public void testStoredProcedureOutputParameters() {
		DbConnector dbConnector = createDbConnector("cars_procedure");

		dbConnector.nonQuery("CREATE PROCEDURE double_it(IN a INT, OUT b INT) BEGIN ATOMIC SET b = a * 2; END", null).run();

		JobParameters jobParameters = new JobParameters()
				.add("a", 21)
				.addOutput("b", Types.INTEGER);

		JobResult<Long> jobResult = dbConnector.nonQuery(command -> command
				.text("double_it")
				.commandType(CommandType.STORED_PROCEDURE)
				.parameters(jobParameters)).execute();

		Assertions.assertTrue(jobResult.getError().isEmpty(), () -> format("Procedure call failed: %s", jobResult.getError()));
		Assertions.assertEquals(Optional.of(42), jobParameters.getValue("b"), "Output value was not written back");
	}

	@Test
	public void testCollectionReadsFallBackToEmpty() {
		DbConnector dbConnector = createDbConnector("cars_read_fallback");

		JobResult<List<Car>> listResult = dbConnector.readToList("SELECT * FROM no_such_table", null, Car.class).execute();

		Assertions.assertEquals(JobState.SUCCEEDED, listResult.getJobState());
		Assertions.assertEquals(Optional.of(List.of()), listResult.getValue());
		Assertions.assertEquals(ErrorKind.COMMAND_EXECUTION, listResult.getError().get().getErrorKind(),
				"The failure behind the empty result should still be reported");

		JobResult<RowSequence<DbRow>> rowsResult = dbConnector.readRows("SELECT * FROM no_such_table", null).execute();

		Assertions.assertTrue(rowsResult.getValue().get().toList().isEmpty());
		Assertions.assertTrue(rowsResult.getError().isPresent());

		JobResult<List<Map<String, Object>>> mapsResult = dbConnector.readToMaps("SELECT * FROM no_such_table", null).execute();

		Assertions.assertEquals(Optional.of(List.of()), mapsResult.getValue());
		Assertions.assertTrue(mapsResult.getError().isPresent());

		JobResult<List<Car>> strictResult = dbConnector.readToList("SELECT * FROM no_such_table", null, Car.class)
				.withoutFallback()
				.execute();

		Assertions.assertEquals(JobState.FAILED, strictResult.getJobState());
	}

	@Test
	public void testCancelDuringRunRollsBackOwnedTransaction() {
		DbConnector dbConnector = createDbConnector("cars_cancel_rollback");
		CancellationToken cancellationToken = CancellationToken.create();

		// The command callback runs inside the attempt, after the owned transaction has begun
		JobResult<Long> jobResult = dbConnector.nonQuery(command -> {
			cancellationToken.cancel();
			command.text("INSERT INTO car (id, name, color) VALUES (4, 'Cooper', 'green')");
		}).execute(cancellationToken);

		Assertions.assertEquals(JobState.CANCELED, jobResult.getJobState());
		Assertions.assertTrue(jobResult.getValue().isEmpty(), "Partial results are discarded by default");
		Assertions.assertEquals(Optional.of(3L), dbConnector.scalar("SELECT COUNT(*) FROM car", null, Long.class).run(),
				"Canceled work should have been rolled back");
	}

	@Test
	public void testCancelDuringRunKeepsPartialResults() {
		DbConnector dbConnector = createDbConnector("cars_cancel_keep");
		CancellationToken cancellationToken = CancellationToken.create();

		JobResult<Long> jobResult = dbConnector.nonQuery(command -> {
			cancellationToken.cancel();
			command.text("INSERT INTO car (id, name, color) VALUES (4, 'Cooper', 'green')");
		}).keepPartialResultsOnCancel(true).execute(cancellationToken);

		Assertions.assertEquals(JobState.CANCELED, jobResult.getJobState());
		Assertions.assertEquals(Optional.of(1L), jobResult.getValue());
		Assertions.assertEquals(Optional.of(4L), dbConnector.scalar("SELECT COUNT(*) FROM car", null, Long.class).run(),
				"Kept partial results should have been committed");
	}

	@Test
	public void testSavepointRollback() {
		DbConnector dbConnector = createDbConnector("cars_savepoint");

		dbConnector.transaction(transaction -> {
			dbConnector.nonQuery("INSERT INTO car (id, name, color) VALUES (:id, :name, :color)", new Car(4L, "Cooper", "green")).run();
			Savepoint savepoint = transaction.createSavepoint();
			dbConnector.nonQuery("INSERT INTO car (id, name, color) VALUES (:id, :name, :color)", new Car(5L, "Fiesta", "white")).run();
			transaction.rollback(savepoint);
			return null;
		});

		Assertions.assertEquals(List.of(1L, 2L, 3L, 4L), dbConnector.readToList("SELECT id FROM car ORDER BY id", null, Long.class).run(),
				"Only work after the savepoint should have been rolled back");
	}

	@Test
	public void testTransactionCommitAndRollback() {
		DbConnector dbConnector = createDbConnector("cars_transactions");

		dbConnector.transaction(transaction -> {
			dbConnector.nonQuery("INSERT INTO car (id, name, color) VALUES (:id, :name, :color)", new Car(4L, "Cooper", "green")).run();
			return null;
		});

		Assertions.assertEquals(Optional.of(4L), dbConnector.scalar("SELECT COUNT(*) FROM car", null, Long.class).run());

		Assertions.assertThrows(IllegalStateException.class, () -> dbConnector.transaction(transaction -> {
			dbConnector.nonQuery("INSERT INTO car (id, name, color) VALUES (:id, :name, :color)", new Car(5L, "Fiesta", "white")).run();
			throw new IllegalStateException("Abort");
		}));

		Assertions.assertEquals(Optional.of(4L), dbConnector.scalar("SELECT COUNT(*) FROM car", null, Long.class).run(),
				"Insert should have been rolled back");

		Optional<Long> countInside = dbConnector.transaction(transaction -> {
			dbConnector.nonQuery("INSERT INTO car (id, name, color) VALUES (:id, :name, :color)", new Car(6L, "Golf", "black")).run();
			transaction.setRollbackOnly(true);
			return dbConnector.scalar("SELECT COUNT(*) FROM car", null, Long.class).run().orElse(null);
		});

		Assertions.assertEquals(Optional.of(5L), countInside, "Jobs in a transaction should see its uncommitted work");
		Assertions.assertEquals(Optional.of(4L), dbConnector.scalar("SELECT COUNT(*) FROM car", null, Long.class).run(),
				"Rollback-only transaction should not commit");
	}

	@Test
	public void testFailingJobMarksSharedTransactionRollbackOnly() {
		DbConnector dbConnector = createDbConnector("cars_rollback_only");
		AtomicReference<TransactionResult> transactionResult = new AtomicReference<>();

		dbConnector.transaction(transaction -> {
			transaction.addPostTransactionOperation(transactionResult::set);
			dbConnector.nonQuery("DELETE FROM car", null).run();

			Assertions.assertEquals(Optional.of(transaction), dbConnector.currentTransaction());
			Assertions.assertThrows(EmptyResultException.class, () -> dbConnector.readFirst("SELECT * FROM car", null, Car.class).run());
			Assertions.assertTrue(transaction.isRollbackOnly());
			return null;
		});

		Assertions.assertEquals(TransactionResult.ROLLED_BACK, transactionResult.get());
		Assertions.assertTrue(dbConnector.currentTransaction().isEmpty());
		Assertions.assertEquals(Optional.of(3L), dbConnector.scalar("SELECT COUNT(*) FROM car", null, Long.class).run());
	}

	@Test
	public void testUnbufferedRead() {
		DbConnector dbConnector = createDbConnector("cars_unbuffered");

		RowSequence<Car> rowSequence = dbConnector.read("SELECT * FROM car ORDER BY id", null, Car.class)
				.unbuffered()
				.run();

		Assertions.assertTrue(rowSequence.isLazy());
		Assertions.assertEquals(3, rowSequence.toList().size());

		RowSequence<Car> buffered = dbConnector.read("SELECT * FROM car ORDER BY id", null, Car.class).run();

		Assertions.assertFalse(buffered.isLazy(), "Reads are buffered by default");
		Assertions.assertEquals(3, buffered.toList().size());
	}

	@Test
	public void testTablesAndMaps() {
		DbConnector dbConnector = createDbConnector("cars_tables");

		DbTable table = dbConnector.readToTable("SELECT id, name, name FROM car ORDER BY id", null).run();

		Assertions.assertEquals(3, table.getColumns().size(), "Duplicate columns must be kept");
		Assertions.assertEquals(3, table.getRowCount());
		Assertions.assertEquals(Optional.of(new DbValue.TextValue("Beetle")), table.getRows().get(0).get("name"));

		DbTableSet tableSet = dbConnector.readToTableSet("SELECT * FROM car", null).run();
		Assertions.assertEquals(1, tableSet.size());

		List<Map<String, Object>> rows = dbConnector.readToMaps("SELECT id, color FROM car WHERE id = :id", 1).run();
		Assertions.assertEquals(1, rows.size());
		Assertions.assertEquals("yellow", rows.get(0).get("COLOR"));
	}

	@Test
	public void testReadMultipleWithMissingSegment() {
		DbConnector dbConnector = createDbConnector("cars_multiple");

		ResultSlot<Car> cars = ResultSlot.of(Car.class);
		ResultSlot<Car> moreCars = ResultSlot.of(Car.class);

		MultiResult multiResult = dbConnector.readMultiple("SELECT * FROM car", null, List.of(cars, moreCars)).run();

		Assertions.assertEquals(3, multiResult.get(cars).size());
		Assertions.assertEquals(List.of(), multiResult.get(moreCars));
	}

	@Test
	public void testJobCannotBeReconfiguredAfterRun() {
		DbConnector dbConnector = createDbConnector("cars_reconfigure");
		DbJob<List<Car>> job = dbConnector.readToList("SELECT * FROM car", null, Car.class).withTimeout(Duration.ofSeconds(5));

		Assertions.assertEquals(3, job.run().size());
		Assertions.assertEquals(3, job.run().size(), "Jobs can be run again");

		DatabaseException e = Assertions.assertThrows(DatabaseException.class, () -> job.withMaxAttempts(3));
		Assertions.assertEquals(ErrorKind.CONFIGURATION, e.getErrorKind());
		Assertions.assertEquals(JobComponent.JOB_HANDLE, e.getComponent());
	}

	@Test
	public void testCanceledBeforeRun() {
		DbConnector dbConnector = createDbConnector("cars_canceled");
		CancellationToken cancellationToken = CancellationToken.create();
		cancellationToken.cancel();

		JobResult<List<Car>> jobResult = dbConnector.readToList("SELECT * FROM car", null, Car.class).execute(cancellationToken);

		Assertions.assertEquals(JobState.CANCELED, jobResult.getJobState());
		Assertions.assertTrue(jobResult.getValue().isEmpty());
		Assertions.assertNull(jobResult.orElseThrow(), "Canceled runs do not throw");
	}

	@Test
	public void testRunAsyncAndCompletionHandler() throws Exception {
		DbConnector dbConnector = createDbConnector("cars_async");
		AtomicReference<List<Car>> completed = new AtomicReference<>();

		List<Car> cars = dbConnector.readToList("SELECT * FROM car", null, Car.class)
				.onCompleted(completed::set)
				.runAsync()
				.get(10, TimeUnit.SECONDS);

		Assertions.assertEquals(3, cars.size());
		Assertions.assertSame(cars, completed.get(), "Completion handler should receive the result");
	}

	@Test
	public void testJobLoggerIsInvoked() {
		List<JobLog> jobLogs = new CopyOnWriteArrayList<>();
		DbConnector dbConnector = createDbConnector("cars_logging", DbConnector.withDataSource(createInMemoryDataSource("cars_logging"))
				.jobLogger(jobLogs::add));

		dbConnector.readToList("SELECT * FROM car WHERE color = :color", Map.of("color", "yellow"), Car.class).run();

		JobLog jobLog = jobLogs.get(jobLogs.size() - 1);

		Assertions.assertEquals(JobState.SUCCEEDED, jobLog.getJobState());
		Assertions.assertEquals(1, jobLog.getAttempt());
		Assertions.assertEquals("SELECT * FROM car WHERE color = ?", jobLog.getJobContext().get().getSql());
		Assertions.assertEquals(List.of("yellow"), jobLog.getJobContext().get().getParameters());
		Assertions.assertTrue(jobLog.getExecutionDuration().isPresent());
		Assertions.assertTrue(jobLog.getException().isEmpty());

		Assertions.assertThrows(DatabaseException.class, () -> dbConnector.readToList("SELECT * FROM no_such_table", null, Car.class)
				.withoutFallback()
				.run());

		JobLog failedJobLog = jobLogs.get(jobLogs.size() - 1);

		Assertions.assertEquals(JobState.FAILED, failedJobLog.getJobState());
		Assertions.assertEquals(ErrorKind.COMMAND_EXECUTION, failedJobLog.getException().get().getErrorKind());
	}

	@Nonnull
	protected DbConnector createDbConnector(@Nonnull String databaseName) {
		return createDbConnector(databaseName, DbConnector.withDataSource(createInMemoryDataSource(databaseName)));
	}

	@Nonnull
	protected DbConnector createDbConnector(@Nonnull String databaseName,
																					@Nonnull DbConnector.Builder builder) {
		DbConnector dbConnector = builder.timeZone(ZoneId.of("UTC")).build();

		dbConnector.nonQuery("CREATE TABLE car (id INT PRIMARY KEY, name VARCHAR(64) NOT NULL, color VARCHAR(32))", null).run();
		dbConnector.nonQuery("INSERT INTO car (id, name, color) VALUES (1, 'Beetle', 'yellow')", null).run();
		dbConnector.nonQuery("INSERT INTO car (id, name, color) VALUES (2, 'Mini', 'green')", null).run();
		dbConnector.nonQuery("INSERT INTO car (id, name, color) VALUES (3, 'Panda', NULL)", null).run();

		return dbConnector;
	}

	@Nonnull
	protected DataSource createInMemoryDataSource(@Nonnull String databaseName) {
		JDBCDataSource dataSource = new JDBCDataSource();
		dataSource.setUrl(format("jdbc:hsqldb:mem:%s", databaseName));
		dataSource.setUser("sa");
		dataSource.setPassword("");

		return dataSource;
	}
}
