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

/**
 * How a job run ended.
 *
 * @since 1.0.0
 */
public enum JobState {
	/**
	 * The run produced a value, either from the database or from the job's fallback.
	 */
	SUCCEEDED,
	/**
	 * The run failed and no fallback applied.
	 */
	FAILED,
	/**
	 * The run's {@link CancellationToken} was signaled before it finished.
	 */
	CANCELED
}
