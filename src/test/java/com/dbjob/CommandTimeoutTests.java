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
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Proxy;
import java.sql.CallableStatement;
import java.sql.Connection;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.time.Duration;
import java.util.List;
import java.util.Optional;
import java.util.concurrent.CopyOnWriteArrayList;
import java.util.logging.Logger;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

@ThreadSafe
public class CommandTimeoutTests {
	private static final String SQL = "SELECT 1 FROM (VALUES(0))";

	@Test
	public void testConnectorDefaultApplies() {
		TimeoutRecordingDataSource dataSource = createTimeoutRecordingDataSource("timeout_connector");
		DbConnector dbConnector = DbConnector.withDataSource(dataSource)
				.defaultCommandTimeout(Duration.ofSeconds(30))
				.build();

		Assertions.assertEquals(Optional.of(1), dbConnector.scalar(SQL, null, Integer.class).run());
		Assertions.assertEquals(List.of(30), dataSource.getQueryTimeouts());
	}

	@Test
	public void testJobTimeoutOverridesConnectorDefault() {
		TimeoutRecordingDataSource dataSource = createTimeoutRecordingDataSource("timeout_job");
		DbConnector dbConnector = DbConnector.withDataSource(dataSource)
				.defaultCommandTimeout(Duration.ofSeconds(30))
				.build();

		dbConnector.scalar(SQL, null, Integer.class).withTimeout(Duration.ofSeconds(20)).run();

		Assertions.assertEquals(List.of(20), dataSource.getQueryTimeouts());
	}

	@Test
	public void testCommandTimeoutOverridesJobAndConnector() {
		TimeoutRecordingDataSource dataSource = createTimeoutRecordingDataSource("timeout_command");
		DbConnector dbConnector = DbConnector.withDataSource(dataSource)
				.defaultCommandTimeout(Duration.ofSeconds(30))
				.build();

		dbConnector.scalar(command -> command.text(SQL).timeout(Duration.ofSeconds(10)), Integer.class)
				.withTimeout(Duration.ofSeconds(20))
				.run();

		Assertions.assertEquals(List.of(10), dataSource.getQueryTimeouts());
	}

	@Test
	public void testPartialSecondsRoundUp() {
		TimeoutRecordingDataSource dataSource = createTimeoutRecordingDataSource("timeout_rounding");
		DbConnector dbConnector = DbConnector.withDataSource(dataSource).build();

		dbConnector.scalar(SQL, null, Integer.class).withTimeout(Duration.ofMillis(1500)).run();
		dbConnector.scalar(SQL, null, Integer.class).withTimeout(Duration.ofMillis(10)).run();

		Assertions.assertEquals(List.of(2, 1), dataSource.getQueryTimeouts());
	}

	@Test
	public void testNoTimeoutLeavesDriverDefault() {
		TimeoutRecordingDataSource dataSource = createTimeoutRecordingDataSource("timeout_none");
		DbConnector dbConnector = DbConnector.withDataSource(dataSource).build();

		dbConnector.scalar(SQL, null, Integer.class).run();

		Assertions.assertTrue(dataSource.getQueryTimeouts().isEmpty(), "No timeout should be set when none is configured");
	}

	@Nonnull
	protected TimeoutRecordingDataSource createTimeoutRecordingDataSource(@Nonnull String databaseName) {
		JDBCDataSource dataSource = new JDBCDataSource();
		dataSource.setUrl(format("jdbc:hsqldb:mem:%s", databaseName));
		dataSource.setUser("sa");
		dataSource.setPassword("");

		return new TimeoutRecordingDataSource(dataSource);
	}

	/**
	 * Records every {@link PreparedStatement#setQueryTimeout(int)} call made on its statements.
	 */
	@ThreadSafe
	protected static class TimeoutRecordingDataSource implements DataSource {
		@Nonnull
		private final DataSource dataSource;
		@Nonnull
		private final List<Integer> queryTimeouts;

		public TimeoutRecordingDataSource(@Nonnull DataSource dataSource) {
			this.dataSource = requireNonNull(dataSource);
			this.queryTimeouts = new CopyOnWriteArrayList<>();
		}

		@Nonnull
		public List<Integer> getQueryTimeouts() {
			return List.copyOf(this.queryTimeouts);
		}

		@Override
		public Connection getConnection() throws SQLException {
			return wrapConnection(this.dataSource.getConnection());
		}

		@Override
		public Connection getConnection(@Nullable String username,
																		@Nullable String password) throws SQLException {
			return wrapConnection(this.dataSource.getConnection(username, password));
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

		@Nonnull
		private Connection wrapConnection(@Nonnull Connection connection) {
			requireNonNull(connection);

			return (Connection) Proxy.newProxyInstance(
					Connection.class.getClassLoader(),
					new Class<?>[]{Connection.class},
					(proxy, method, args) -> {
						Object result = invoke(method, connection, args);

						if (result instanceof CallableStatement callableStatement)
							return wrapStatement(callableStatement, CallableStatement.class);
						if (result instanceof PreparedStatement preparedStatement)
							return wrapStatement(preparedStatement, PreparedStatement.class);

						return result;
					});
		}

		@Nonnull
		private Object wrapStatement(@Nonnull PreparedStatement preparedStatement,
																 @Nonnull Class<? extends PreparedStatement> statementType) {
			requireNonNull(preparedStatement);
			requireNonNull(statementType);

			return Proxy.newProxyInstance(
					statementType.getClassLoader(),
					new Class<?>[]{statementType},
					(proxy, method, args) -> {
						if ("setQueryTimeout".equals(method.getName()))
							this.queryTimeouts.add((Integer) args[0]);

						return invoke(method, preparedStatement, args);
					});
		}

		@Nullable
		private Object invoke(@Nonnull Method method,
													@Nonnull Object target,
													@Nullable Object[] args) throws Throwable {
			requireNonNull(method);
			requireNonNull(target);

			try {
				return method.invoke(target, args);
			} catch (InvocationTargetException e) {
				throw e.getCause();
			}
		}
	}
}
