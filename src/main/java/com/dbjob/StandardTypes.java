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
import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Currency;
import java.util.Date;
import java.util.Locale;
import java.util.Map;
import java.util.Set;
import java.util.TimeZone;
import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * The JDK value types the engine binds directly and reads from a single column.
 *
 * @since 1.0.0
 */
@ThreadSafe
final class StandardTypes {
	@NonNull
	private static final Set<@NonNull Class<?>> STANDARD_TYPES;
	@NonNull
	private static final Map<@NonNull Class<?>, @NonNull Class<?>> BOXED_TYPES_BY_PRIMITIVE_TYPE;

	static {
		BOXED_TYPES_BY_PRIMITIVE_TYPE = Map.of(
				boolean.class, Boolean.class,
				byte.class, Byte.class,
				short.class, Short.class,
				int.class, Integer.class,
				long.class, Long.class,
				float.class, Float.class,
				double.class, Double.class,
				char.class, Character.class
		);

		STANDARD_TYPES = Set.of(
				Object.class, String.class, Boolean.class, Byte.class, Short.class, Integer.class, Long.class, Float.class,
				Double.class, Character.class, BigDecimal.class, BigInteger.class, byte[].class, UUID.class, Date.class,
				java.sql.Date.class, java.sql.Time.class, java.sql.Timestamp.class, Instant.class, LocalDate.class,
				LocalTime.class, LocalDateTime.class, OffsetTime.class, OffsetDateTime.class, ZonedDateTime.class,
				Locale.class, Currency.class
		);
	}

	private StandardTypes() {
		// Non-instantiable
	}

	@NonNull
	static Boolean isStandardType(@NonNull Class<?> type) {
		requireNonNull(type);

		Class<?> boxedType = box(type);

		return STANDARD_TYPES.contains(boxedType)
				|| boxedType.isEnum()
				|| Number.class.isAssignableFrom(boxedType)
				|| CharSequence.class.isAssignableFrom(boxedType)
				|| ZoneId.class.isAssignableFrom(boxedType)
				|| TimeZone.class.isAssignableFrom(boxedType);
	}

	@NonNull
	static Class<?> box(@NonNull Class<?> type) {
		requireNonNull(type);
		return type.isPrimitive() ? BOXED_TYPES_BY_PRIMITIVE_TYPE.get(type) : type;
	}
}
