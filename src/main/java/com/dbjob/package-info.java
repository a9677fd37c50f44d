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

/**
 * A data-access job engine for JDBC.
 * <p>
 * Each data access is a {@link com.dbjob.DbJob}: a command, a result shape and a run configuration (isolation,
 * timeout, retry, fallback). Running a job acquires a connection, executes the command, materializes its rows and
 * then commits or rolls back and releases everything it acquired.
 *
 * <pre>
 * // Minimal setup, uses defaults
 * DataSource dataSource = ...
 * DbConnector dbConnector = DbConnector.withDataSource(dataSource).build();
 *
 * // Reads
 * Car car = dbConnector.readFirst("SELECT * FROM car WHERE id = :id", 123, Car.class).run();
 * List&lt;Car&gt; blueCars = dbConnector.readToList("SELECT * FROM car WHERE color = :color", Map.of("color", "blue"), Car.class).run();
 * Optional&lt;Long&gt; count = dbConnector.scalar("SELECT COUNT(*) FROM car", null, Long.class).run();
 *
 * // Retries and fallbacks
 * List&lt;Car&gt; cars = dbConnector.readToList("SELECT * FROM car", null, Car.class)
 *   .withMaxAttempts(3)
 *   .withFallbackValue(List.of())
 *   .run();
 *
 * // Commands
 * Long updateCount = dbConnector.nonQuery("UPDATE car SET color = :color", Map.of("color", "red")).run();
 *
 * // Transactions
 * dbConnector.transaction(transaction -&gt; {
 *   BigDecimal balance1 = dbConnector.scalar("SELECT balance FROM account WHERE id = 1", null, BigDecimal.class).run().get();
 *   BigDecimal balance2 = dbConnector.scalar("SELECT balance FROM account WHERE id = 2", null, BigDecimal.class).run().get();
 *
 *   dbConnector.nonQuery("UPDATE account SET balance = :balance WHERE id = 1", balance1.subtract(amount)).run();
 *   dbConnector.nonQuery("UPDATE account SET balance = :balance WHERE id = 2", balance2.add(amount)).run();
 *   return null;
 * });</pre>
 *
 * @since 1.0.0
 */
package com.dbjob;
