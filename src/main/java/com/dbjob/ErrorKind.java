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

/**
 * Classifies every failure surfaced by a {@link DbJob}.
 *
 * @since 1.0.0
 */
public enum ErrorKind {
	/**
	 * Invalid or incomplete job setup. Never retried.
	 */
	CONFIGURATION,
	/**
	 * Parameter source could not be turned into parameter descriptors, or a placeholder had no value.
	 */
	PARAMETER_BINDING,
	/**
	 * Connection-level fault (network, pool exhaustion, broken connection). Retried according to the job's
	 * {@link RetryPolicy}.
	 */
	TRANSIENT_CONNECTION,
	/**
	 * The driver rejected or failed the command. Never retried.
	 */
	COMMAND_EXECUTION,
	/**
	 * A column value could not be mapped to its target field.
	 */
	MAPPING,
	/**
	 * The result violated the requested shape's cardinality contract.
	 */
	CARDINALITY,
	/**
	 * Work stopped because cancellation was requested.
	 */
	CANCELED;

	@NonNull
	public Boolean isRetryable() {
		return this == TRANSIENT_CONNECTION;
	}
}
