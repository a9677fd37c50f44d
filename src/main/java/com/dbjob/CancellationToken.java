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
import java.util.concurrent.atomic.AtomicBoolean;

import static java.lang.String.format;

/**
 * Cooperative cancellation signal shared by the pipeline, command builder and result materializer of one job run.
 * <p>
 * Signaling is one-way and idempotent. Work already in progress on the current row is allowed to finish; no further
 * rows or result segments are requested afterwards.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class CancellationToken {
	@NonNull
	private static final CancellationToken NONE;

	static {
		NONE = new CancellationToken(false);
	}

	@NonNull
	private final AtomicBoolean cancellationRequested;
	@NonNull
	private final Boolean cancelable;

	private CancellationToken(@NonNull Boolean cancelable) {
		this.cancellationRequested = new AtomicBoolean(false);
		this.cancelable = cancelable;
	}

	/**
	 * Creates a new token that can be signaled via {@link #cancel()}.
	 *
	 * @return a new token
	 */
	@NonNull
	public static CancellationToken create() {
		return new CancellationToken(true);
	}

	/**
	 * A token that is never signaled.
	 *
	 * @return the shared non-cancelable token
	 */
	@NonNull
	public static CancellationToken none() {
		return NONE;
	}

	/**
	 * Requests cancellation.
	 *
	 * @throws IllegalStateException if this is the {@link #none()} token
	 */
	public void cancel() {
		if (!this.cancelable)
			throw new IllegalStateException(format("The shared %s.none() token cannot be canceled", getClass().getSimpleName()));

		this.cancellationRequested.set(true);
	}

	@NonNull
	public Boolean isCancellationRequested() {
		return this.cancellationRequested.get();
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{cancelable=%s, cancellationRequested=%s}", getClass().getSimpleName(), this.cancelable, isCancellationRequested());
	}
}
