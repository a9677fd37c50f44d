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

import javax.annotation.concurrent.ThreadSafe;
import java.sql.SQLException;
import java.util.List;

/**
 * An immutable, reusable binding from one segment's columns to a target type.
 * <p>
 * Plans are built by a {@link RowMapper} once per (target type, column schema, column map) and applied to every row
 * of matching segments.
 *
 * @param <T> the target type
 * @since 1.0.0
 */
@ThreadSafe
public interface MappingPlan<T> {
	/**
	 * Maps the cursor's current row.
	 *
	 * @param rowCursor        a cursor positioned on a row
	 * @param jobContext       current job context
	 * @param instanceProvider creates target instances
	 * @return the mapped row, {@code null} only for a scalar {@code NULL}
	 * @throws SQLException if the driver fails while reading
	 */
	@Nullable
	T map(@NonNull RowCursor rowCursor,
				@NonNull JobContext jobContext,
				@NonNull InstanceProvider instanceProvider) throws SQLException;

	@NonNull
	Class<T> getTargetType();

	@NonNull
	List<@NonNull DbColumn> getColumns();
}
