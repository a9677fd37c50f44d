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

import org.jspecify.annotations.Nullable;

/**
 * Finishes a run whose completion was deferred to the consumer of its results.
 *
 * @since 1.0.0
 */
@FunctionalInterface
interface RunCompletion {
	/**
	 * Commits or rolls back, releases the run's resources and logs the run.
	 *
	 * @param failure the failure that ended consumption, or {@code null} if the results were consumed successfully
	 * @throws DatabaseException if completing without a failure fails, for example on commit
	 */
	void complete(@Nullable DatabaseException failure);
}
