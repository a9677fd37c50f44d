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

import javax.annotation.Nonnull;
import javax.annotation.Nullable;
import javax.annotation.concurrent.NotThreadSafe;
import java.sql.SQLException;
import java.sql.Types;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.List;

import static java.util.Objects.requireNonNull;

/**
 * {@link RowCursor} over canned segments, for exercising materialization without a driver.
 */
@NotThreadSafe
public class InMemoryRowCursor implements RowCursor {
	@Nonnull
	private final List<Segment> segments;
	private int segmentIndex;
	private int rowIndex;
	private int rowsAdvanced;
	@Nullable
	private CancellationToken cancellationToken;
	private int cancelAfterRows;
	private boolean closed;

	public InMemoryRowCursor(@Nonnull Segment... segments) {
		requireNonNull(segments);
		this.segments = List.of(segments);
		this.rowIndex = -1;
		this.cancelAfterRows = -1;
	}

	@Nonnull
	public static Segment segment(@Nonnull List<String> columnNames,
																@Nonnull Object[]... rows) {
		List<DbColumn> columns = new ArrayList<>(columnNames.size());

		for (int i = 0; i < columnNames.size(); ++i)
			columns.add(new DbColumn(i, columnNames.get(i), Types.OTHER, null, null));

		List<List<Object>> rowValues = new ArrayList<>(rows.length);

		for (Object[] row : rows)
			rowValues.add(Arrays.asList(row));

		return new Segment(columns, rowValues);
	}

	/**
	 * Signals {@code cancellationToken} once {@code rowCount} rows have been advanced onto.
	 */
	@Nonnull
	public InMemoryRowCursor cancelAfterRows(@Nonnull CancellationToken cancellationToken,
																					 int rowCount) {
		this.cancellationToken = requireNonNull(cancellationToken);
		this.cancelAfterRows = rowCount;
		return this;
	}

	@Nonnull
	@Override
	public Boolean hasSegment() {
		return this.segmentIndex < this.segments.size();
	}

	@Nonnull
	@Override
	public Integer getSegmentIndex() {
		return this.segmentIndex;
	}

	@Nonnull
	@Override
	public List<DbColumn> getColumns() throws SQLException {
		return hasSegment() ? this.segments.get(this.segmentIndex).columns : List.of();
	}

	@Nonnull
	@Override
	public Boolean advanceRow() throws SQLException {
		ensureOpen();

		if (!hasSegment())
			return false;

		if (this.rowIndex + 1 >= this.segments.get(this.segmentIndex).rows.size())
			return false;

		++this.rowIndex;
		++this.rowsAdvanced;

		if (this.cancellationToken != null && this.rowsAdvanced == this.cancelAfterRows)
			this.cancellationToken.cancel();

		return true;
	}

	@Nonnull
	@Override
	public Boolean advanceSegment() throws SQLException {
		ensureOpen();

		if (!hasSegment())
			return false;

		++this.segmentIndex;
		this.rowIndex = -1;
		return hasSegment();
	}

	@Nullable
	@Override
	public Object read(int columnIndex) throws SQLException {
		ensureOpen();
		return this.segments.get(this.segmentIndex).rows.get(this.rowIndex).get(columnIndex);
	}

	@Override
	public void close() {
		this.closed = true;
	}

	public boolean isClosed() {
		return this.closed;
	}

	private void ensureOpen() throws SQLException {
		if (this.closed)
			throw new SQLException("Cursor is closed");
	}

	public static class Segment {
		@Nonnull
		private final List<DbColumn> columns;
		@Nonnull
		private final List<List<Object>> rows;

		public Segment(@Nonnull List<DbColumn> columns,
									 @Nonnull List<List<Object>> rows) {
			this.columns = requireNonNull(columns);
			this.rows = requireNonNull(rows);
		}
	}
}
