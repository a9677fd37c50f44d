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

/**
 * The shape-specific part of a job: executes the command through the run context and materializes its results.
 *
 * @param <T> the job's value type
 * @since 1.0.0
 */
@FunctionalInterface
interface JobExecution<T> {
	@Nullable
	T execute(@NonNull RunContext runContext,
						@NonNull ResultMaterializer resultMaterializer);
}
