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
import java.time.Duration;
import java.util.Optional;
import java.util.function.Consumer;
import java.util.function.Function;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Settings of a {@link DbJob}, frozen when the job first runs.
 *
 * @since 1.0.0
 */
@ThreadSafe
final class JobConfiguration<T> {
	@Nullable
	private final TransactionIsolation transactionIsolation;
	@Nullable
	private final Duration timeout;
	@NonNull
	private final RetryPolicy retryPolicy;
	@NonNull
	private final Boolean buffered;
	@Nullable
	private final Function<DatabaseException, T> fallback;
	@NonNull
	private final ColumnMap columnMap;
	@NonNull
	private final Boolean keepPartialResultsOnCancel;
	@Nullable
	private final Consumer<T> completionHandler;

	JobConfiguration(@Nullable TransactionIsolation transactionIsolation,
									 @Nullable Duration timeout,
									 @NonNull RetryPolicy retryPolicy,
									 @NonNull Boolean buffered,
									 @Nullable Function<DatabaseException, T> fallback,
									 @NonNull ColumnMap columnMap,
									 @NonNull Boolean keepPartialResultsOnCancel,
									 @Nullable Consumer<T> completionHandler) {
		this.transactionIsolation = transactionIsolation;
		this.timeout = timeout;
		this.retryPolicy = requireNonNull(retryPolicy);
		this.buffered = requireNonNull(buffered);
		this.fallback = fallback;
		this.columnMap = requireNonNull(columnMap);
		this.keepPartialResultsOnCancel = requireNonNull(keepPartialResultsOnCancel);
		this.completionHandler = completionHandler;
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{transactionIsolation=%s, timeout=%s, retryPolicy=%s, buffered=%s, hasFallback=%s, columnMap=%s, keepPartialResultsOnCancel=%s}",
				getClass().getSimpleName(), this.transactionIsolation, this.timeout, getRetryPolicy(), isBuffered(),
				this.fallback != null, getColumnMap(), getKeepPartialResultsOnCancel());
	}

	@NonNull
	Optional<TransactionIsolation> getTransactionIsolation() {
		return Optional.ofNullable(this.transactionIsolation);
	}

	@NonNull
	Optional<Duration> getTimeout() {
		return Optional.ofNullable(this.timeout);
	}

	@NonNull
	RetryPolicy getRetryPolicy() {
		return this.retryPolicy;
	}

	@NonNull
	Boolean isBuffered() {
		return this.buffered;
	}

	@NonNull
	Optional<Function<DatabaseException, T>> getFallback() {
		return Optional.ofNullable(this.fallback);
	}

	@NonNull
	ColumnMap getColumnMap() {
		return this.columnMap;
	}

	@NonNull
	Boolean getKeepPartialResultsOnCancel() {
		return this.keepPartialResultsOnCancel;
	}

	@NonNull
	Optional<Consumer<T>> getCompletionHandler() {
		return Optional.ofNullable(this.completionHandler);
	}
}
