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
 * Work performed inside a shared transaction scope opened by {@link DbConnector#transaction(TransactionalOperation)}.
 * <p>
 * Every {@link DbJob} run on the calling thread while the operation executes participates in {@code transaction}
 * and reuses its connection.
 *
 * @param <T> the type of value produced by the operation
 * @since 1.0.0
 */
@FunctionalInterface
public interface TransactionalOperation<T> {
	/**
	 * Executes the operation.
	 *
	 * @param transaction the shared transaction
	 * @return the operation's result, possibly {@code null}
	 * @throws Exception if an error occurs, which rolls back the transaction
	 */
	@Nullable
	T perform(@NonNull Transaction transaction) throws Exception;
}
