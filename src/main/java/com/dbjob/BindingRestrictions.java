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

import javax.annotation.concurrent.NotThreadSafe;
import javax.annotation.concurrent.ThreadSafe;
import java.util.Collections;
import java.util.LinkedHashSet;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Filters and decorates the parameter names {@link ParameterBinder} generates from a composite source.
 * <p>
 * Exclusions and inclusions match the undecorated name, ignoring case. The prefix and suffix are then added to every
 * name that survives.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class BindingRestrictions {
	@NonNull
	private static final BindingRestrictions NONE;

	static {
		NONE = new Builder().build();
	}

	@NonNull
	private final Set<@NonNull String> excludedNames;
	@NonNull
	private final Set<@NonNull String> includedNames;
	@NonNull
	private final String prefix;
	@NonNull
	private final String suffix;

	private BindingRestrictions(@NonNull Builder builder) {
		requireNonNull(builder);

		this.excludedNames = Collections.unmodifiableSet(new LinkedHashSet<>(builder.excludedNames));
		this.includedNames = Collections.unmodifiableSet(new LinkedHashSet<>(builder.includedNames));
		this.prefix = builder.prefix == null ? "" : builder.prefix;
		this.suffix = builder.suffix == null ? "" : builder.suffix;
	}

	@NonNull
	public static BindingRestrictions none() {
		return NONE;
	}

	@NonNull
	public static Builder builder() {
		return new Builder();
	}

	/**
	 * Applies these restrictions to a generated name.
	 *
	 * @param name the undecorated name
	 * @return the decorated name, or {@code null} if the name is filtered out
	 */
	@Nullable
	String apply(@NonNull String name) {
		requireNonNull(name);

		String normalizedName = JobParameters.normalizeName(name);

		if (this.excludedNames.contains(normalizedName))
			return null;

		if (!this.includedNames.isEmpty() && !this.includedNames.contains(normalizedName))
			return null;

		return this.prefix + name + this.suffix;
	}

	@NonNull
	Boolean isUnrestricted() {
		return this.excludedNames.isEmpty() && this.includedNames.isEmpty() && this.prefix.isEmpty() && this.suffix.isEmpty();
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{excludedNames=%s, includedNames=%s, prefix=%s, suffix=%s}", getClass().getSimpleName(),
				this.excludedNames, this.includedNames, this.prefix, this.suffix);
	}

	/**
	 * Builder used to construct instances of {@link BindingRestrictions}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@NonNull
		private final Set<@NonNull String> excludedNames;
		@NonNull
		private final Set<@NonNull String> includedNames;
		@Nullable
		private String prefix;
		@Nullable
		private String suffix;

		private Builder() {
			this.excludedNames = new LinkedHashSet<>();
			this.includedNames = new LinkedHashSet<>();
		}

		@NonNull
		public Builder exclude(@NonNull String... names) {
			requireNonNull(names);

			for (String name : names)
				this.excludedNames.add(JobParameters.normalizeName(requireNonNull(name)));

			return this;
		}

		@NonNull
		public Builder includeOnly(@NonNull String... names) {
			requireNonNull(names);

			for (String name : names)
				this.includedNames.add(JobParameters.normalizeName(requireNonNull(name)));

			return this;
		}

		@NonNull
		public Builder prefix(@Nullable String prefix) {
			this.prefix = prefix;
			return this;
		}

		@NonNull
		public Builder suffix(@Nullable String suffix) {
			this.suffix = suffix;
			return this;
		}

		@NonNull
		public BindingRestrictions build() {
			return new BindingRestrictions(this);
		}
	}
}
