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

import java.util.List;

/**
 * Capability interface for types that populate themselves from a row without reflection.
 * <p>
 * Implementations need a no-argument constructor reachable through {@link InstanceProvider#provide(JobContext, Class)}.
 * Column values are converted to {@link #fieldType(String)} before {@link #setField(String, Object)} is called.
 *
 * @since 1.0.0
 */
public interface Mappable {
	/**
	 * @return the names of the fields that can be populated, matched against columns like property names
	 */
	@NonNull
	List<@NonNull String> fieldNames();

	/**
	 * @param fieldName one of {@link #fieldNames()}
	 * @return the Java type the field expects
	 */
	@NonNull
	Class<?> fieldType(@NonNull String fieldName);

	/**
	 * @param fieldName one of {@link #fieldNames()}
	 * @param value     the converted column value, may be {@code null}
	 */
	void setField(@NonNull String fieldName,
								@Nullable Object value);
}
