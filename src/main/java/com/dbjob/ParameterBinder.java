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
import java.beans.BeanInfo;
import java.beans.IntrospectionException;
import java.beans.Introspector;
import java.beans.PropertyDescriptor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.RecordComponent;
import java.util.Arrays;
import java.util.Collection;
import java.util.Iterator;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.stream.BaseStream;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Turns an arbitrary caller-supplied parameter source into an ordered {@link JobParameters} collection.
 * <p>
 * Accepted sources are {@code null}, another {@link JobParameters}, a {@link Map} with {@link String} keys, a record,
 * a JavaBean, or a single flat value such as a number or string. A flat value binds to the lone distinct placeholder
 * of the command. Sequences ({@link Collection}, arrays other than {@code byte[]}, {@link Iterable},
 * {@link Iterator} and {@link java.util.stream.Stream}) are rejected as sources. They are valid as <em>values</em>,
 * where they expand into {@code IN} lists.
 * <p>
 * Binding has no side effects and never touches a connection.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class ParameterBinder {
	private ParameterBinder() {
		// Non-instantiable
	}

	/**
	 * Binds a composite source.
	 *
	 * @param source       the parameter source, may be {@code null}
	 * @param restrictions name filtering and decoration to apply
	 * @return the bound parameters
	 * @throws UnsupportedParameterShapeException if the source is a sequence or a flat value
	 */
	@NonNull
	public static JobParameters bind(@Nullable Object source,
																	 @NonNull BindingRestrictions restrictions) {
		return bind(source, restrictions, List.of());
	}

	/**
	 * Binds a source in the context of a command whose distinct placeholder names are known.
	 *
	 * @param source           the parameter source, may be {@code null}
	 * @param restrictions     name filtering and decoration to apply
	 * @param placeholderNames the command's distinct placeholder names, in order of first appearance
	 * @return the bound parameters
	 * @throws UnsupportedParameterShapeException if the source is a sequence, or a flat value and the command does not
	 *                                            have exactly one distinct placeholder
	 * @throws DuplicateParameterNameException    if two generated names collide
	 */
	@NonNull
	public static JobParameters bind(@Nullable Object source,
																	 @NonNull BindingRestrictions restrictions,
																	 @NonNull List<@NonNull String> placeholderNames) {
		requireNonNull(restrictions);
		requireNonNull(placeholderNames);

		JobParameters parameters = new JobParameters();

		if (source == null)
			return parameters;

		if (source instanceof Optional<?> optional)
			return bind(optional.orElse(null), restrictions, placeholderNames);

		Class<?> sourceType = source.getClass();

		if (source instanceof JobParameters jobParameters) {
			for (JobParameter parameter : jobParameters.asList()) {
				String name = restrictions.apply(parameter.getName());

				if (name == null)
					continue;

				// Renamed copies forward output values to the caller's instance
				parameters.add(name.equals(parameter.getName()) ? parameter : parameter.renamed(name));
			}

			return parameters;
		}

		if (isSequence(source))
			throw new UnsupportedParameterShapeException(sourceType,
					format("A %s cannot be used as a parameter source. Pass a map, record or bean, or wrap it with Parameters.inList(...) "
							+ "and bind it as a named value", sourceType.getName()));

		if (source instanceof Map<?, ?> map) {
			for (Map.Entry<?, ?> entry : map.entrySet()) {
				if (!(entry.getKey() instanceof String key))
					throw new UnsupportedParameterShapeException(sourceType,
							format("Map parameter sources must have String keys, found key %s", entry.getKey()));

				addRestricted(parameters, key, entry.getValue(), restrictions);
			}

			return parameters;
		}

		if (StandardTypes.isStandardType(sourceType) || source instanceof InListParameter) {
			if (placeholderNames.size() != 1)
				throw new UnsupportedParameterShapeException(sourceType,
						format("A single %s value can only be bound to a command with exactly one distinct placeholder, but the command has %d (%s)",
								sourceType.getSimpleName(), placeholderNames.size(), placeholderNames));

			parameters.add(placeholderNames.get(0), source);
			return parameters;
		}

		if (sourceType.isRecord()) {
			for (RecordComponent recordComponent : sourceType.getRecordComponents())
				addRestricted(parameters, recordComponent.getName(), readValue(source, recordComponent.getAccessor(), recordComponent.getName()), restrictions);

			return parameters;
		}

		List<PropertyDescriptor> readableProperties = readablePropertiesFor(sourceType);

		if (readableProperties.isEmpty())
			throw new UnsupportedParameterShapeException(sourceType,
					format("%s exposes no readable properties and cannot be used as a parameter source", sourceType.getName()));

		for (PropertyDescriptor propertyDescriptor : readableProperties)
			addRestricted(parameters, propertyDescriptor.getName(), readValue(source, propertyDescriptor.getReadMethod(), propertyDescriptor.getName()), restrictions);

		return parameters;
	}

	/**
	 * Is {@code value} something that expands into an {@code IN} list when bound?
	 */
	@NonNull
	static Boolean isSequence(@Nullable Object value) {
		if (value == null)
			return false;

		if (value instanceof byte[])
			return false;

		return value instanceof Collection<?>
				|| value.getClass().isArray()
				|| value instanceof Iterable<?>
				|| value instanceof Iterator<?>
				|| value instanceof BaseStream<?, ?>;
	}

	private static void addRestricted(@NonNull JobParameters parameters,
																		@NonNull String name,
																		@Nullable Object value,
																		@NonNull BindingRestrictions restrictions) {
		String restrictedName = restrictions.apply(name);

		if (restrictedName != null)
			parameters.add(restrictedName, value instanceof Optional<?> optional ? optional.orElse(null) : value);
	}

	@NonNull
	private static List<@NonNull PropertyDescriptor> readablePropertiesFor(@NonNull Class<?> type) {
		BeanInfo beanInfo;

		try {
			beanInfo = Introspector.getBeanInfo(type, Object.class);
		} catch (IntrospectionException e) {
			throw new DatabaseException(ErrorKind.PARAMETER_BINDING, JobComponent.PARAMETER_BINDER,
					format("Unable to introspect %s", type.getName()), e);
		}

		return Arrays.stream(beanInfo.getPropertyDescriptors())
				.filter(propertyDescriptor -> propertyDescriptor.getReadMethod() != null)
				.toList();
	}

	@Nullable
	private static Object readValue(@NonNull Object source,
																	@NonNull Method readMethod,
																	@NonNull String name) {
		try {
			readMethod.setAccessible(true);
			return readMethod.invoke(source);
		} catch (InvocationTargetException e) {
			throw new DatabaseException(ErrorKind.PARAMETER_BINDING, JobComponent.PARAMETER_BINDER,
					format("Unable to read property '%s' of %s", name, source.getClass().getName()), e.getCause());
		} catch (ReflectiveOperationException | RuntimeException e) {
			throw new DatabaseException(ErrorKind.PARAMETER_BINDING, JobComponent.PARAMETER_BINDER,
					format("Unable to read property '%s' of %s", name, source.getClass().getName()), e);
		}
	}
}
