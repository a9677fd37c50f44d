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
import java.sql.ResultSet;
import java.sql.ResultSetMetaData;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Statement;
import java.sql.Timestamp;
import java.sql.Types;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.ZoneId;
import java.util.ArrayList;
import java.util.Collections;
import java.util.List;
import java.util.Locale;

import static java.util.Objects.requireNonNull;

/**
 * {@link RowCursor} over the results of an executed JDBC {@link Statement}.
 * <p>
 * Each {@link ResultSet} the statement produces is one segment. Update counts interleaved with result sets are skipped.
 * Temporal columns are read as {@code java.time} values.
 *
 * @since 1.0.0
 */
@NotThreadSafe
final class JdbcRowCursor implements RowCursor {
	@NonNull
	private final Statement statement;
	@NonNull
	private final ZoneId timeZone;
	@Nullable
	private ResultSet resultSet;
	@Nullable
	private List<@NonNull DbColumn> columns;
	@NonNull
	private Integer segmentIndex;
	@NonNull
	private Boolean closed;

	/**
	 * @param statement             a statement that has just been executed
	 * @param firstResultIsResultSet the value returned by {@link Statement#execute()}
	 * @param timeZone              zone used to interpret zone-less temporal values
	 */
	JdbcRowCursor(@NonNull Statement statement,
								@NonNull Boolean firstResultIsResultSet,
								@NonNull ZoneId timeZone) throws SQLException {
		requireNonNull(statement);
		requireNonNull(firstResultIsResultSet);
		requireNonNull(timeZone);

		this.statement = statement;
		this.timeZone = timeZone;
		this.segmentIndex = 0;
		this.closed = false;
		this.resultSet = positionOnResultSet(firstResultIsResultSet);
	}

	@NonNull
	@Override
	public Boolean hasSegment() {
		return this.resultSet != null;
	}

	@NonNull
	@Override
	public Integer getSegmentIndex() {
		return this.segmentIndex;
	}

	@NonNull
	@Override
	public List<@NonNull DbColumn> getColumns() throws SQLException {
		if (this.resultSet == null)
			return List.of();

		if (this.columns == null) {
			ResultSetMetaData resultSetMetaData = this.resultSet.getMetaData();
			int columnCount = resultSetMetaData.getColumnCount();
			List<DbColumn> columns = new ArrayList<>(columnCount);

			for (int i = 1; i <= columnCount; ++i)
				columns.add(new DbColumn(i - 1, resultSetMetaData.getColumnLabel(i), resultSetMetaData.getColumnType(i),
						resultSetMetaData.getColumnTypeName(i), resultSetMetaData.getColumnClassName(i)));

			this.columns = Collections.unmodifiableList(columns);
		}

		return this.columns;
	}

	@NonNull
	@Override
	public Boolean advanceRow() throws SQLException {
		ensureOpen();
		return this.resultSet != null && this.resultSet.next();
	}

	@NonNull
	@Override
	public Boolean advanceSegment() throws SQLException {
		ensureOpen();

		if (this.resultSet == null)
			return false;

		this.columns = null;
		this.resultSet.close();
		this.resultSet = positionOnResultSet(this.statement.getMoreResults());

		if (this.resultSet == null)
			return false;

		++this.segmentIndex;
		return true;
	}

	@Nullable
	@Override
	public Object read(int columnIndex) throws SQLException {
		ensureOpen();

		if (this.resultSet == null)
			throw new SQLException("Cursor is not positioned on a segment");

		int jdbcColumnIndex = columnIndex + 1;
		DbColumn column = getColumns().get(columnIndex);
		int jdbcType = column.getJdbcType();
		String typeName = column.getTypeName().orElse("").toUpperCase(Locale.ROOT);

		if (jdbcType == Types.TIMESTAMP_WITH_TIMEZONE || typeName.contains("TIMESTAMP WITH TIME ZONE") || typeName.contains("TIMESTAMPTZ"))
			return readOffsetDateTime(jdbcColumnIndex);
		if (jdbcType == Types.TIMESTAMP)
			return readLocalDateTime(jdbcColumnIndex);
		if (jdbcType == Types.DATE)
			return readLocalDate(jdbcColumnIndex);
		if (jdbcType == Types.TIME_WITH_TIMEZONE || typeName.contains("TIME WITH TIME ZONE"))
			return tryGet(jdbcColumnIndex, OffsetTime.class);
		if (jdbcType == Types.TIME)
			return readLocalTime(jdbcColumnIndex);

		// Non-temporal or unknown: take the driver's native object
		return this.resultSet.getObject(jdbcColumnIndex);
	}

	@Override
	public void close() throws SQLException {
		if (this.closed)
			return;

		this.closed = true;
		this.columns = null;

		ResultSet resultSet = this.resultSet;
		this.resultSet = null;

		if (resultSet != null)
			resultSet.close();
	}

	@Nullable
	private ResultSet positionOnResultSet(boolean isResultSet) throws SQLException {
		// Skip update counts until a result set appears or the results run out
		while (!isResultSet) {
			if (this.statement.getUpdateCount() == -1)
				return null;

			isResultSet = this.statement.getMoreResults();
		}

		return this.statement.getResultSet();
	}

	private void ensureOpen() throws SQLException {
		if (this.closed)
			throw new SQLException("Cursor is closed");
	}

	@Nullable
	private <T> T tryGet(int jdbcColumnIndex,
											 @NonNull Class<T> type) throws SQLException {
		try {
			return this.resultSet.getObject(jdbcColumnIndex, type);
		} catch (SQLFeatureNotSupportedException | AbstractMethodError e) {
			return null;
		}
	}

	@Nullable
	private OffsetDateTime readOffsetDateTime(int jdbcColumnIndex) throws SQLException {
		OffsetDateTime offsetDateTime = tryGet(jdbcColumnIndex, OffsetDateTime.class);

		if (offsetDateTime != null)
			return offsetDateTime;

		Timestamp timestamp = this.resultSet.getTimestamp(jdbcColumnIndex);
		return timestamp == null ? null : timestamp.toInstant().atZone(this.timeZone).toOffsetDateTime();
	}

	@Nullable
	private LocalDateTime readLocalDateTime(int jdbcColumnIndex) throws SQLException {
		LocalDateTime localDateTime = tryGet(jdbcColumnIndex, LocalDateTime.class);

		if (localDateTime != null)
			return localDateTime;

		Timestamp timestamp = this.resultSet.getTimestamp(jdbcColumnIndex);
		return timestamp == null ? null : timestamp.toLocalDateTime();
	}

	@Nullable
	private LocalDate readLocalDate(int jdbcColumnIndex) throws SQLException {
		LocalDate localDate = tryGet(jdbcColumnIndex, LocalDate.class);

		if (localDate != null)
			return localDate;

		java.sql.Date date = this.resultSet.getDate(jdbcColumnIndex);
		return date == null ? null : date.toLocalDate();
	}

	@Nullable
	private LocalTime readLocalTime(int jdbcColumnIndex) throws SQLException {
		LocalTime localTime = tryGet(jdbcColumnIndex, LocalTime.class);

		if (localTime != null)
			return localTime;

		java.sql.Time time = this.resultSet.getTime(jdbcColumnIndex);
		return time == null ? null : time.toLocalTime();
	}
}
