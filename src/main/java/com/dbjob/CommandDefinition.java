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
import java.time.Duration;
import java.util.Collections;
import java.util.EnumSet;
import java.util.Optional;
import java.util.Set;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Declarative description of a single database command: its text and type, parameter source, binding restrictions,
 * timeout and behavior flags.
 * <p>
 * Example: <pre>{@code  connector.readToList(Employee.class, command -> command
 *   .text("employees_by_department")
 *   .commandType(CommandType.STORED_PROCEDURE)
 *   .parameters(Map.of("departmentId", 7))
 *   .timeout(Duration.ofSeconds(5)));}</pre>
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class CommandDefinition {
	@NonNull
	private final String text;
	@NonNull
	private final CommandType commandType;
	@Nullable
	private final Object parameters;
	@NonNull
	private final BindingRestrictions bindingRestrictions;
	@Nullable
	private final Duration timeout;
	@NonNull
	private final Set<@NonNull CommandBehavior> behaviors;

	private CommandDefinition(@NonNull Builder builder) {
		requireNonNull(builder);

		if (builder.text == null || builder.text.trim().isEmpty())
			throw new DatabaseException(ErrorKind.CONFIGURATION, JobComponent.COMMAND_BUILDER, "Command text must be provided");

		if (builder.timeout != null && (builder.timeout.isNegative() || builder.timeout.isZero()))
			throw new DatabaseException(ErrorKind.CONFIGURATION, JobComponent.COMMAND_BUILDER,
					format("Command timeout must be positive, was %s", builder.timeout));

		this.text = builder.text;
		this.commandType = builder.commandType;
		this.parameters = builder.parameters;
		this.bindingRestrictions = builder.bindingRestrictions;
		this.timeout = builder.timeout;
		this.behaviors = Collections.unmodifiableSet(builder.behaviors.isEmpty()
				? EnumSet.noneOf(CommandBehavior.class) : EnumSet.copyOf(builder.behaviors));
	}

	@NonNull
	public static Builder withText(@NonNull String text) {
		requireNonNull(text);
		return new Builder().text(text);
	}

	@NonNull
	static Builder builder() {
		return new Builder();
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s{text=%s, commandType=%s, timeout=%s, behaviors=%s}", getClass().getSimpleName(), getText(),
				getCommandType().name(), this.timeout, getBehaviors());
	}

	@NonNull
	public String getText() {
		return this.text;
	}

	@NonNull
	public CommandType getCommandType() {
		return this.commandType;
	}

	@NonNull
	public Optional<Object> getParameters() {
		return Optional.ofNullable(this.parameters);
	}

	@NonNull
	public BindingRestrictions getBindingRestrictions() {
		return this.bindingRestrictions;
	}

	@NonNull
	public Optional<Duration> getTimeout() {
		return Optional.ofNullable(this.timeout);
	}

	@NonNull
	public Set<@NonNull CommandBehavior> getBehaviors() {
		return this.behaviors;
	}

	/**
	 * Builder used to construct instances of {@link CommandDefinition}.
	 * <p>
	 * This class is intended for use by a single thread.
	 *
	 * @since 1.0.0
	 */
	@NotThreadSafe
	public static class Builder {
		@Nullable
		private String text;
		@NonNull
		private CommandType commandType;
		@Nullable
		private Object parameters;
		@NonNull
		private BindingRestrictions bindingRestrictions;
		@Nullable
		private Duration timeout;
		@NonNull
		private final Set<@NonNull CommandBehavior> behaviors;

		private Builder() {
			this.commandType = CommandType.TEXT;
			this.bindingRestrictions = BindingRestrictions.none();
			this.behaviors = EnumSet.noneOf(CommandBehavior.class);
		}

		@NonNull
		public Builder text(@NonNull String text) {
			this.text = requireNonNull(text);
			return this;
		}

		@NonNull
		public Builder commandType(@NonNull CommandType commandType) {
			this.commandType = requireNonNull(commandType);
			return this;
		}

		/**
		 * The parameter source: a {@link JobParameters}, map, record, bean or single flat value.
		 *
		 * @param parameters the parameter source, may be {@code null}
		 * @return this builder
		 */
		@NonNull
		public Builder parameters(@Nullable Object parameters) {
			this.parameters = parameters;
			return this;
		}

		@NonNull
		public Builder bindingRestrictions(@NonNull BindingRestrictions bindingRestrictions) {
			this.bindingRestrictions = requireNonNull(bindingRestrictions);
			return this;
		}

		@NonNull
		public Builder timeout(@Nullable Duration timeout) {
			this.timeout = timeout;
			return this;
		}

		@NonNull
		public Builder behaviors(@NonNull CommandBehavior... behaviors) {
			requireNonNull(behaviors);

			for (CommandBehavior behavior : behaviors)
				this.behaviors.add(requireNonNull(behavior));

			return this;
		}

		@NonNull
		public CommandDefinition build() {
			return new CommandDefinition(this);
		}
	}
}
