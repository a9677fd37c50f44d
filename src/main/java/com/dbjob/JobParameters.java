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
import java.util.ArrayList;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * An ordered collection of {@link JobParameter}s whose names are unique, ignoring case.
 * <p>
 * Instances passed to a job keep receiving output values after each stored procedure call, so callers can read them
 * back once the job completes.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public final class JobParameters {
	@NonNull
	private final Map<@NonNull String, @NonNull JobParameter> parametersByNormalizedName;

	public JobParameters() {
		this.parametersByNormalizedName = new LinkedHashMap<>();
	}

	@NonNull
	public static JobParameters of(@NonNull Map<@NonNull String, ?> values) {
		requireNonNull(values);

		JobParameters parameters = new JobParameters();

		for (Map.Entry<String, ?> entry : values.entrySet())
			parameters.add(entry.getKey(), entry.getValue());

		return parameters;
	}

	@NonNull
	public JobParameters add(@NonNull String name,
													 @Nullable Object value) {
		return add(JobParameter.input(name, value));
	}

	/**
	 * Adds a parameter.
	 *
	 * @param parameter the parameter to add
	 * @return this collection
	 * @throws DuplicateParameterNameException if a parameter with the same name (ignoring case) is already present
	 */
	@NonNull
	public JobParameters add(@NonNull JobParameter parameter) {
		requireNonNull(parameter);

		String normalizedName = normalizeName(parameter.getName());

		if (this.parametersByNormalizedName.containsKey(normalizedName))
			throw new DuplicateParameterNameException(parameter.getName());

		this.parametersByNormalizedName.put(normalizedName, parameter);
		return this;
	}

	@NonNull
	public JobParameters addOutput(@NonNull String name,
																 @NonNull Integer sqlType) {
		return add(JobParameter.output(name, sqlType));
	}

	@NonNull
	public JobParameters addInputOutput(@NonNull String name,
																			@Nullable Object value,
																			@NonNull Integer sqlType) {
		return add(JobParameter.inputOutput(name, value, sqlType));
	}

	@NonNull
	public JobParameters addReturnValue(@NonNull String name,
																			@NonNull Integer sqlType) {
		return add(JobParameter.returnValue(name, sqlType));
	}

	@NonNull
	public JobParameters addFor(@Nullable Object source) {
		return addFor(source, BindingRestrictions.none());
	}

	/**
	 * Decomposes {@code source} with {@link ParameterBinder} and merges the result into this collection.
	 *
	 * @param source       a map, record, bean or other {@link JobParameters}
	 * @param restrictions name filtering and decoration to apply
	 * @return this collection
	 * @throws DuplicateParameterNameException         if a generated name collides with an existing one
	 * @throws UnsupportedParameterShapeException if {@code source} cannot be decomposed
	 */
	@NonNull
	public JobParameters addFor(@Nullable Object source,
															@NonNull BindingRestrictions restrictions) {
		requireNonNull(restrictions);

		for (JobParameter parameter : ParameterBinder.bind(source, restrictions).asList())
			add(parameter);

		return this;
	}

	@NonNull
	public Optional<JobParameter> get(@NonNull String name) {
		requireNonNull(name);
		return Optional.ofNullable(this.parametersByNormalizedName.get(normalizeName(name)));
	}

	/**
	 * The current value of the named parameter, including values written back by a stored procedure.
	 *
	 * @param name the parameter name, matched ignoring case
	 * @return the value, or empty if the parameter is absent or its value is {@code null}
	 */
	@NonNull
	public Optional<Object> getValue(@NonNull String name) {
		return get(name).flatMap(JobParameter::getValue);
	}

	@NonNull
	public Boolean contains(@NonNull String name) {
		return get(name).isPresent();
	}

	@NonNull
	public List<@NonNull JobParameter> asList() {
		return Collections.unmodifiableList(new ArrayList<>(this.parametersByNormalizedName.values()));
	}

	@NonNull
	public Integer size() {
		return this.parametersByNormalizedName.size();
	}

	@NonNull
	public Boolean isEmpty() {
		return this.parametersByNormalizedName.isEmpty();
	}

	@Override
	@NonNull
	public String toString() {
		return format("%s%s", getClass().getSimpleName(), asList());
	}

	@NonNull
	static String normalizeName(@NonNull String name) {
		return name.toLowerCase(Locale.ROOT);
	}
}
