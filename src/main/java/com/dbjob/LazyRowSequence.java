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
import java.sql.SQLException;
import java.util.Iterator;
import java.util.NoSuchElementException;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A {@link RowSequence} that maps rows from an open cursor as they are requested.
 * <p>
 * The job's run completes when the rows run out, when mapping fails or when the sequence is closed.
 *
 * @since 1.0.0
 */
@NotThreadSafe
final class LazyRowSequence<T> implements RowSequence<T> {
	@NonNull
	private final ResultMaterializer resultMaterializer;
	private final ResultMaterializer.@NonNull CursorWalk cursorWalk;
	@NonNull
	private final JobContext jobContext;
	@NonNull
	private final Class<T> type;
	@NonNull
	private final RunCompletion runCompletion;

	@Nullable
	private MappingPlan<T> mappingPlan;
	@Nullable
	private T nextRow;
	private boolean nextRowReady;
	private boolean iteratorCreated;
	private boolean exhausted;
	private boolean closed;

	LazyRowSequence(@NonNull ResultMaterializer resultMaterializer,
									ResultMaterializer.@NonNull CursorWalk cursorWalk,
									@NonNull JobContext jobContext,
									@NonNull Class<T> type,
									@NonNull RunCompletion runCompletion) {
		this.resultMaterializer = requireNonNull(resultMaterializer);
		this.cursorWalk = requireNonNull(cursorWalk);
		this.jobContext = requireNonNull(jobContext);
		this.type = requireNonNull(type);
		this.runCompletion = requireNonNull(runCompletion);
	}

	@Override
	@NonNull
	public Iterator<T> iterator() {
		if (this.iteratorCreated)
			throw new IllegalStateException("An unbuffered row sequence can only be iterated once");

		this.iteratorCreated = true;

		return new Iterator<>() {
			@Override
			public boolean hasNext() {
				return advance();
			}

			@Override
			public T next() {
				if (!advance())
					throw new NoSuchElementException();

				T row = LazyRowSequence.this.nextRow;
				LazyRowSequence.this.nextRow = null;
				LazyRowSequence.this.nextRowReady = false;
				return row;
			}
		};
	}

	private boolean advance() {
		if (this.nextRowReady)
			return true;

		if (this.exhausted)
			return false;

		if (this.closed)
			throw new CursorDisposedException(format("Rows of job %d can no longer be read, the sequence was closed", this.jobContext.getJobId()));

		try {
			if (this.cursorWalk.getCursorState() == CursorState.BEFORE_FIRST_SEGMENT && !this.cursorWalk.nextSegment()) {
				finish(null);
				return false;
			}

			// Cancellation ends the sequence early without failing it
			if (this.resultMaterializer.isCanceled() || !this.cursorWalk.nextRow()) {
				finish(null);
				return false;
			}

			ResultMaterializer.MappedRow<T> mappedRow = this.resultMaterializer.mapRow(this.cursorWalk, this.jobContext, this.type, this.mappingPlan);
			this.mappingPlan = mappedRow.mappingPlan;
			this.nextRow = mappedRow.value;
			this.nextRowReady = true;
			return true;
		} catch (SQLException e) {
			DatabaseException failure = DatabaseException.forSqlException(JobComponent.RESULT_MATERIALIZER, "Unable to read rows", e);
			finish(failure);
			throw failure;
		} catch (DatabaseException e) {
			finish(e);
			throw e;
		}
	}

	private void finish(@Nullable DatabaseException failure) {
		if (this.closed)
			return;

		this.exhausted = true;
		this.closed = true;
		this.runCompletion.complete(failure);
	}

	@Override
	@NonNull
	public Boolean isLazy() {
		return true;
	}

	@Override
	public void close() {
		if (this.closed)
			return;

		this.closed = true;
		this.runCompletion.complete(null);
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{jobId=%s, type=%s, closed=%s}", getClass().getSimpleName(), this.jobContext.getJobId(), this.type.getSimpleName(), this.closed);
	}
}
