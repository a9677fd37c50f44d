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

import java.util.ArrayList;
import java.util.List;

/**
 * Rows of a read, iterated once.
 * <p>
 * An unbuffered sequence streams rows from an open cursor and keeps the job's connection, command and transaction
 * alive until it is exhausted or {@link #close()}d, whichever happens first; the job completes at that point.
 * Iterating an unbuffered sequence after it has been closed fails with {@link CursorDisposedException}.
 * <p>
 * A buffered sequence holds rows that were read before the job completed. Closing it has no effect.
 * <p>
 * Implementations are not thread-safe.
 *
 * @param <T> the row type
 * @since 1.0.0
 */
public interface RowSequence<T> extends Iterable<T>, AutoCloseable {
	/**
	 * Is this sequence backed by an open cursor?
	 *
	 * @return {@code true} for an unbuffered sequence
	 */
	@NonNull
	Boolean isLazy();

	/**
	 * Drains the remaining rows into a list and closes this sequence.
	 *
	 * @return the remaining rows
	 */
	@NonNull
	default List<T> toList() {
		try {
			List<T> rows = new ArrayList<>();

			for (T row : this)
				rows.add(row);

			return rows;
		} finally {
			close();
		}
	}

	@Override
	void close();
}
