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
import java.sql.SQLException;
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Drives a {@link RowCursor} to produce one of the supported result shapes.
 * <p>
 * Cancellation is checked before every row and every segment advance. Once it is signaled the materializer stops
 * reading and returns whatever it has: rows already mapped, completed slots, or nothing. It never throws because of
 * cancellation.
 *
 * @since 1.0.0
 */
@ThreadSafe
final class ResultMaterializer {
	/**
	 * Maximum number of slots in a multi-segment read.
	 */
	static final int MAXIMUM_SLOT_COUNT = 8;

	@NonNull
	private final RowMapper rowMapper;
	@NonNull
	private final InstanceProvider instanceProvider;
	@NonNull
	private final ColumnMap columnMap;
	@NonNull
	private final CancellationToken cancellationToken;

	ResultMaterializer(@NonNull RowMapper rowMapper,
										 @NonNull InstanceProvider instanceProvider,
										 @NonNull ColumnMap columnMap,
										 @NonNull CancellationToken cancellationToken) {
		this.rowMapper = requireNonNull(rowMapper);
		this.instanceProvider = requireNonNull(instanceProvider);
		this.columnMap = requireNonNull(columnMap);
		this.cancellationToken = requireNonNull(cancellationToken);
	}

	/**
	 * The first row of the first segment.
	 *
	 * @return the mapped row, or {@code null} if canceled before it was read
	 * @throws EmptyResultException if the first segment is missing or empty
	 */
	@Nullable
	<T> T first(@NonNull RowCursor rowCursor,
							@NonNull JobContext jobContext,
							@NonNull Class<T> type) {
		Head<T> head = readHead(rowCursor, jobContext, type, false);

		if (!head.found && !head.canceled)
			throw new EmptyResultException(format("Expected at least one %s row but the result was empty", type.getSimpleName()));

		return head.value;
	}

	@NonNull
	<T> Optional<T> firstOrDefault(@NonNull RowCursor rowCursor,
																 @NonNull JobContext jobContext,
																 @NonNull Class<T> type) {
		return Optional.ofNullable(readHead(rowCursor, jobContext, type, false).value);
	}

	/**
	 * The only row of the first segment.
	 *
	 * @throws EmptyResultException       if the first segment is missing or empty
	 * @throws MultipleRowsFoundException if the first segment has more than one row
	 */
	@Nullable
	<T> T single(@NonNull RowCursor rowCursor,
							 @NonNull JobContext jobContext,
							 @NonNull Class<T> type) {
		Head<T> head = readHead(rowCursor, jobContext, type, true);

		if (!head.found && !head.canceled)
			throw new EmptyResultException(format("Expected exactly one %s row but the result was empty", type.getSimpleName()));

		return head.value;
	}

	/**
	 * The only row of the first segment, if there is one.
	 *
	 * @throws MultipleRowsFoundException if the first segment has more than one row
	 */
	@NonNull
	<T> Optional<T> singleOrDefault(@NonNull RowCursor rowCursor,
																	@NonNull JobContext jobContext,
																	@NonNull Class<T> type) {
		return Optional.ofNullable(readHead(rowCursor, jobContext, type, true).value);
	}

	/**
	 * The first column of the first row.
	 *
	 * @throws DatabaseException of kind {@link ErrorKind#CONFIGURATION} if {@code type} is not a scalar type
	 */
	@NonNull
	<T> Optional<T> scalar(@NonNull RowCursor rowCursor,
												 @NonNull JobContext jobContext,
												 @NonNull Class<T> type) {
		requireScalarType(type);
		return firstOrDefault(rowCursor, jobContext, type);
	}

	/**
	 * Every row of the first segment.
	 */
	@NonNull
	<T> List<T> list(@NonNull RowCursor rowCursor,
									 @NonNull JobContext jobContext,
									 @NonNull Class<T> type) {
		requireNonNull(rowCursor);
		requireNonNull(jobContext);
		requireNonNull(type);

		CursorWalk cursorWalk = new CursorWalk(rowCursor);

		try {
			if (isCanceled() || !cursorWalk.nextSegment())
				return new ArrayList<>();

			return readSegment(cursorWalk, jobContext, type);
		} catch (SQLException e) {
			throw DatabaseException.forSqlException(JobComponent.RESULT_MATERIALIZER, "Unable to read rows", e);
		}
	}

	/**
	 * Streams the rows of the first segment.
	 *
	 * @param runCompletion invoked exactly once, when the sequence is exhausted, closed or fails
	 */
	@NonNull
	<T> RowSequence<T> lazy(@NonNull RowCursor rowCursor,
													@NonNull JobContext jobContext,
													@NonNull Class<T> type,
													@NonNull RunCompletion runCompletion) {
		requireNonNull(rowCursor);
		requireNonNull(jobContext);
		requireNonNull(type);
		requireNonNull(runCompletion);

		return new LazyRowSequence<>(this, new CursorWalk(rowCursor), jobContext, type, runCompletion);
	}

	/**
	 * Maps segment {@code k} into slot {@code k}.
	 * <p>
	 * Segments beyond the last slot are ignored. A missing segment yields an empty list, or
	 * {@link EmptyResultException} if its slot is required.
	 */
	@NonNull
	MultiResult multiple(@NonNull RowCursor rowCursor,
											 @NonNull JobContext jobContext,
											 @NonNull List<@NonNull ResultSlot<?>> slots) {
		requireNonNull(rowCursor);
		requireNonNull(jobContext);
		requireSlotCount(slots);

		CursorWalk cursorWalk = new CursorWalk(rowCursor);
		List<List<?>> values = new ArrayList<>(slots.size());

		try {
			boolean hasSegment = true;

			for (int slotIndex = 0; slotIndex < slots.size(); ++slotIndex) {
				ResultSlot<?> slot = slots.get(slotIndex);

				if (isCanceled()) {
					values.add(List.of());
					continue;
				}

				hasSegment = hasSegment && cursorWalk.nextSegment();

				if (!hasSegment) {
					if (slot.isRequired())
						throw new EmptyResultException(format("Expected a result segment for required slot %d (%s) but the command produced only %d",
								slotIndex, slot.getElementType().getSimpleName(), slotIndex));

					values.add(List.of());
					continue;
				}

				values.add(readSegment(cursorWalk, jobContext, slot.getElementType()));
			}
		} catch (SQLException e) {
			throw DatabaseException.forSqlException(JobComponent.RESULT_MATERIALIZER, "Unable to read result segments", e);
		}

		return new MultiResult(slots, values);
	}

	/**
	 * The schema and rows of the first segment.
	 */
	@NonNull
	DbTable table(@NonNull RowCursor rowCursor,
								@NonNull JobContext jobContext) {
		requireNonNull(rowCursor);
		requireNonNull(jobContext);

		CursorWalk cursorWalk = new CursorWalk(rowCursor);

		try {
			if (isCanceled() || !cursorWalk.nextSegment())
				return new DbTable(List.of(), List.of());

			return readTable(cursorWalk, jobContext);
		} catch (SQLException e) {
			throw DatabaseException.forSqlException(JobComponent.RESULT_MATERIALIZER, "Unable to read table", e);
		}
	}

	/**
	 * The schema and rows of every segment.
	 */
	@NonNull
	DbTableSet tableSet(@NonNull RowCursor rowCursor,
											@NonNull JobContext jobContext) {
		requireNonNull(rowCursor);
		requireNonNull(jobContext);

		CursorWalk cursorWalk = new CursorWalk(rowCursor);
		List<DbTable> tables = new ArrayList<>();

		try {
			while (!isCanceled() && cursorWalk.nextSegment())
				tables.add(readTable(cursorWalk, jobContext));
		} catch (SQLException e) {
			throw DatabaseException.forSqlException(JobComponent.RESULT_MATERIALIZER, "Unable to read tables", e);
		}

		return new DbTableSet(tables);
	}

	static void requireScalarType(@NonNull Class<?> type) {
		requireNonNull(type);

		if (!StandardTypes.isStandardType(type) || Object.class.equals(type))
			throw new DatabaseException(ErrorKind.CONFIGURATION, JobComponent.RESULT_MATERIALIZER,
					format("%s is not a scalar type", type.getName()));
	}

	static void requireSlotCount(@NonNull List<@NonNull ResultSlot<?>> slots) {
		requireNonNull(slots);

		if (slots.isEmpty() || slots.size() > MAXIMUM_SLOT_COUNT)
			throw new DatabaseException(ErrorKind.CONFIGURATION, JobComponent.RESULT_MATERIALIZER,
					format("A multi-segment read needs between 1 and %d slots, got %d", MAXIMUM_SLOT_COUNT, slots.size()));
	}

	@NonNull
	private <T> Head<T> readHead(@NonNull RowCursor rowCursor,
															 @NonNull JobContext jobContext,
															 @NonNull Class<T> type,
															 boolean requireSingle) {
		requireNonNull(rowCursor);
		requireNonNull(jobContext);
		requireNonNull(type);

		CursorWalk cursorWalk = new CursorWalk(rowCursor);

		try {
			if (isCanceled())
				return Head.canceled();

			if (!cursorWalk.nextSegment())
				return Head.notFound();

			if (isCanceled())
				return Head.canceled();

			if (!cursorWalk.nextRow())
				return Head.notFound();

			T value = mapRow(cursorWalk, jobContext, type, null).value;

			if (requireSingle && !isCanceled() && cursorWalk.nextRow())
				throw new MultipleRowsFoundException(format("Expected exactly one %s row but the result had more", type.getSimpleName()));

			return Head.found(value);
		} catch (SQLException e) {
			throw DatabaseException.forSqlException(JobComponent.RESULT_MATERIALIZER, "Unable to read row", e);
		}
	}

	@NonNull
	private <T> List<T> readSegment(@NonNull CursorWalk cursorWalk,
																	@NonNull JobContext jobContext,
																	@NonNull Class<T> type) throws SQLException {
		List<T> rows = new ArrayList<>();
		MappingPlan<T> mappingPlan = null;

		while (!isCanceled() && cursorWalk.nextRow()) {
			MappedRow<T> mappedRow = mapRow(cursorWalk, jobContext, type, mappingPlan);
			mappingPlan = mappedRow.mappingPlan;
			rows.add(mappedRow.value);
		}

		return rows;
	}

	@NonNull
	private DbTable readTable(@NonNull CursorWalk cursorWalk,
														@NonNull JobContext jobContext) throws SQLException {
		List<DbColumn> columns = cursorWalk.getRowCursor().getColumns();
		return new DbTable(columns, readSegment(cursorWalk, jobContext, DbRow.class));
	}

	@NonNull
	<T> MappedRow<T> mapRow(@NonNull CursorWalk cursorWalk,
													@NonNull JobContext jobContext,
													@NonNull Class<T> type,
													@Nullable MappingPlan<T> mappingPlan) throws SQLException {
		if (mappingPlan == null)
			mappingPlan = getRowMapper().planFor(cursorWalk.getRowCursor().getColumns(), type, getColumnMap());

		return new MappedRow<>(mappingPlan, mappingPlan.map(cursorWalk.getRowCursor(), jobContext, getInstanceProvider()));
	}

	@NonNull
	Boolean isCanceled() {
		return getCancellationToken().isCancellationRequested();
	}

	@NonNull
	RowMapper getRowMapper() {
		return this.rowMapper;
	}

	@NonNull
	InstanceProvider getInstanceProvider() {
		return this.instanceProvider;
	}

	@NonNull
	ColumnMap getColumnMap() {
		return this.columnMap;
	}

	@NonNull
	CancellationToken getCancellationToken() {
		return this.cancellationToken;
	}

	static final class MappedRow<T> {
		@NonNull
		final MappingPlan<T> mappingPlan;
		@Nullable
		final T value;

		MappedRow(@NonNull MappingPlan<T> mappingPlan,
							@Nullable T value) {
			this.mappingPlan = mappingPlan;
			this.value = value;
		}
	}

	private static final class Head<T> {
		private final boolean found;
		private final boolean canceled;
		@Nullable
		private final T value;

		private Head(boolean found,
								 boolean canceled,
								 @Nullable T value) {
			this.found = found;
			this.canceled = canceled;
			this.value = value;
		}

		static <T> Head<T> found(@Nullable T value) {
			return new Head<>(true, false, value);
		}

		static <T> Head<T> notFound() {
			return new Head<>(false, false, null);
		}

		static <T> Head<T> canceled() {
			return new Head<>(false, true, null);
		}
	}

	/**
	 * Tracks where a walk over a {@link RowCursor} is, so rows are only requested inside a segment and segments are
	 * never skipped or revisited.
	 */
	@NotThreadSafe
	static final class CursorWalk {
		@NonNull
		private final RowCursor rowCursor;
		@NonNull
		private CursorState cursorState;
		private int segmentIndex;

		CursorWalk(@NonNull RowCursor rowCursor) {
			this.rowCursor = requireNonNull(rowCursor);
			this.cursorState = CursorState.BEFORE_FIRST_SEGMENT;
			this.segmentIndex = -1;
		}

		/**
		 * Enters the first segment, or moves past the rest of the current segment to the next one.
		 */
		@NonNull
		Boolean nextSegment() throws SQLException {
			if (this.cursorState == CursorState.EXHAUSTED)
				return false;

			boolean positioned = this.cursorState == CursorState.BEFORE_FIRST_SEGMENT
					? this.rowCursor.hasSegment()
					: this.rowCursor.advanceSegment();

			if (positioned) {
				this.cursorState = CursorState.IN_SEGMENT;
				++this.segmentIndex;
			} else {
				this.cursorState = CursorState.EXHAUSTED;
			}

			return positioned;
		}

		@NonNull
		Boolean nextRow() throws SQLException {
			if (this.cursorState != CursorState.IN_SEGMENT)
				return false;

			if (this.rowCursor.advanceRow())
				return true;

			this.cursorState = CursorState.AFTER_SEGMENT;
			return false;
		}

		@NonNull
		RowCursor getRowCursor() {
			return this.rowCursor;
		}

		@NonNull
		CursorState getCursorState() {
			return this.cursorState;
		}

		int getSegmentIndex() {
			return this.segmentIndex;
		}
	}
}
