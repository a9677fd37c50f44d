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

import java.sql.SQLException;
import java.util.List;

/**
 * Forward-only, single-pass access to the rows of a command's result, grouped into segments.
 * <p>
 * A fresh cursor is positioned on the first segment, before its first row. A segment boundary is only discovered by
 * advancing past the last row: {@link #advanceRow()} returns {@code false} and {@link #advanceSegment()} moves to the
 * next segment, if any.
 * <p>
 * Implementations are not thread-safe.
 *
 * @since 1.0.0
 */
public interface RowCursor extends AutoCloseable {
	/**
	 * Is the cursor positioned on a segment?
	 *
	 * @return {@code false} once every segment has been consumed, or if the command produced none
	 */
	@NonNull
	Boolean hasSegment();

	/**
	 * @return 0-based index of the current segment
	 */
	@NonNull
	Integer getSegmentIndex();

	/**
	 * The column schema of the current segment.
	 *
	 * @return the columns, or an empty list if there is no current segment
	 * @throws SQLException if the driver fails
	 */
	@NonNull
	List<@NonNull DbColumn> getColumns() throws SQLException;

	/**
	 * Moves to the next row of the current segment.
	 *
	 * @return {@code true} if positioned on a row, {@code false} if the segment has no more rows
	 * @throws SQLException if the driver fails
	 */
	@NonNull
	Boolean advanceRow() throws SQLException;

	/**
	 * Discards any remaining rows of the current segment and moves to the next one.
	 *
	 * @return {@code true} if positioned on a new segment
	 * @throws SQLException if the driver fails
	 */
	@NonNull
	Boolean advanceSegment() throws SQLException;

	/**
	 * Reads a value of the current row.
	 *
	 * @param columnIndex 0-based column index
	 * @return the value, or {@code null} for SQL {@code NULL}
	 * @throws SQLException if the driver fails
	 */
	@Nullable
	Object read(int columnIndex) throws SQLException;

	@Override
	void close() throws SQLException;
}
