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

import javax.annotation.concurrent.NotThreadSafe;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Thrown when two parameter sources contribute a parameter with the same (case-insensitive) name.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class DuplicateParameterNameException extends DatabaseException {
	@NonNull
	private final String parameterName;

	public DuplicateParameterNameException(@NonNull String parameterName) {
		super(ErrorKind.PARAMETER_BINDING, JobComponent.PARAMETER_BINDER,
				format("Parameter '%s' was already added", requireNonNull(parameterName)));
		this.parameterName = parameterName;
	}

	@NonNull
	public String getParameterName() {
		return this.parameterName;
	}
}
