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
import java.lang.reflect.Constructor;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.RecordComponent;
import java.util.Arrays;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Contract for creating instances of mapping targets.
 * <p>
 * Useful for integrating with dependency injection frameworks. The default methods use reflection.
 *
 * @since 1.0.0
 */
@ThreadSafe
public interface InstanceProvider {
	/**
	 * Provides an instance of the given {@code instanceType}.
	 * <p>
	 * Whether the instance is new every time or shared/reused is implementation-dependent, but the row mapper populates
	 * the returned instance so sharing is rarely appropriate.
	 *
	 * @param jobContext   current job context
	 * @param instanceType the type of instance to create
	 * @param <T>          instance type token
	 * @return an instance of the given {@code instanceType}
	 */
	@NonNull
	default <T> T provide(@NonNull JobContext jobContext,
												@NonNull Class<T> instanceType) {
		requireNonNull(jobContext);
		requireNonNull(instanceType);

		try {
			Constructor<T> constructor = instanceType.getDeclaredConstructor();
			constructor.setAccessible(true);
			return constructor.newInstance();
		} catch (Exception e) {
			throw new DatabaseException(ErrorKind.MAPPING, JobComponent.ROW_MAPPER, format(
					"Unable to create an instance of %s. Please verify that %s has a no-argument constructor",
					instanceType, instanceType.getSimpleName()), e);
		}
	}

	/**
	 * Provides an instance of the given {@code recordType} via its canonical constructor.
	 *
	 * @param jobContext current job context
	 * @param recordType the type of instance to create (must be a record)
	 * @param initargs   values used to construct the record instance
	 * @param <T>        instance type token
	 * @return an instance of the given {@code recordType}
	 */
	@NonNull
	default <T> T provideRecord(@NonNull JobContext jobContext,
															@NonNull Class<T> recordType,
															Object @Nullable ... initargs) {
		requireNonNull(jobContext);
		requireNonNull(recordType);

		try {
			Class<?>[] componentTypes = Arrays.stream(recordType.getRecordComponents())
					.map(RecordComponent::getType)
					.toArray(Class<?>[]::new);

			Constructor<T> constructor = recordType.getDeclaredConstructor(componentTypes);
			constructor.setAccessible(true);
			return constructor.newInstance(initargs);
		} catch (InvocationTargetException e) {
			throw new DatabaseException(ErrorKind.MAPPING, JobComponent.ROW_MAPPER, format("Unable to instantiate record type %s with args %s",
					recordType, initargs == null ? "[none]" : Arrays.asList(initargs)), e.getCause());
		} catch (ReflectiveOperationException | IllegalArgumentException e) {
			throw new DatabaseException(ErrorKind.MAPPING, JobComponent.ROW_MAPPER, format("Unable to instantiate record type %s with args %s",
					recordType, initargs == null ? "[none]" : Arrays.asList(initargs)), e);
		}
	}
}
