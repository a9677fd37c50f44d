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
 * Stages a single attempt of a job passes through, in order.
 * <p>
 * {@link #TRANSACTION_OPEN} is only reached by jobs that run with an isolation level or inside a shared transaction.
 *
 * @since 1.0.0
 */
public enum RunStage {
	CONFIGURED,
	CONNECTION_ACQUIRED,
	TRANSACTION_OPEN,
	EXECUTING,
	MATERIALIZING,
	COMPLETING
}
