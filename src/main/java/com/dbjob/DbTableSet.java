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

import javax.annotation.concurrent.ThreadSafe;
import java.util.List;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Every result segment of a command, in order, each as a {@link DbTable}.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class DbTableSet {
	@NonNull
	private final List<@NonNull DbTable> tables;

	public DbTableSet(@NonNull List<@NonNull DbTable> tables) {
		requireNonNull(tables);
		this.tables = List.copyOf(tables);
	}

	@NonNull
	public List<@NonNull DbTable> getTables() {
		return this.tables;
	}

	@NonNull
	public DbTable getTable(int index) {
		return this.tables.get(index);
	}

	@NonNull
	public Integer size() {
		return this.tables.size();
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s%s", getClass().getSimpleName(), this.tables);
	}
}
