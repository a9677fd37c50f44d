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

import javax.annotation.concurrent.NotThreadSafe;
import java.util.ArrayList;
import java.util.Collections;
import java.util.Iterator;
import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A {@link RowSequence} over rows that were fully read before the job completed.
 *
 * @since 1.0.0
 */
@NotThreadSafe
final class BufferedRowSequence<T> implements RowSequence<T> {
	@NonNull
	private final List<T> rows;

	BufferedRowSequence(@NonNull List<T> rows) {
		requireNonNull(rows);
		this.rows = Collections.unmodifiableList(new ArrayList<>(rows));
	}

	@Override
	@NonNull
	public Iterator<T> iterator() {
		return this.rows.iterator();
	}

	@Override
	@NonNull
	public Boolean isLazy() {
		return false;
	}

	@Override
	@NonNull
	public List<T> toList() {
		return new ArrayList<>(this.rows);
	}

	@Override
	public void close() {
		// Nothing to release
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{rows=%s}", getClass().getSimpleName(), this.rows.size());
	}
}
