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

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.temporal.Temporal;
import java.util.Arrays;
import java.util.Date;

import static java.util.Objects.requireNonNull;

/**
 * A column value in a generic row, tagged with its broad kind.
 * <p>
 * Integral numbers are widened to {@code long}, {@link BigInteger}s to {@link BigDecimal}, floating-point numbers to
 * {@code double} and legacy {@link Date}s to {@link java.time.Instant}. Values of any other type are kept as
 * {@link OtherValue}.
 *
 * @since 1.0.0
 */
public sealed interface DbValue permits DbValue.NullValue, DbValue.IntegerValue, DbValue.DecimalValue,
		DbValue.FloatValue, DbValue.TextValue, DbValue.BinaryValue, DbValue.BooleanValue, DbValue.TemporalValue,
		DbValue.OtherValue {
	/**
	 * The shared SQL {@code NULL} value.
	 */
	@NonNull
	NullValue NULL = new NullValue();

	/**
	 * Tags a raw value read from a cursor.
	 *
	 * @param value the raw value, may be {@code null}
	 * @return the tagged value
	 */
	@NonNull
	static DbValue of(@Nullable Object value) {
		if (value == null)
			return NULL;
		if (value instanceof DbValue dbValue)
			return dbValue;
		if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte)
			return new IntegerValue(((Number) value).longValue());
		if (value instanceof BigDecimal bigDecimal)
			return new DecimalValue(bigDecimal);
		if (value instanceof BigInteger bigInteger)
			return new DecimalValue(new BigDecimal(bigInteger));
		if (value instanceof Double || value instanceof Float)
			return new FloatValue(((Number) value).doubleValue());
		if (value instanceof CharSequence || value instanceof Character)
			return new TextValue(value.toString());
		if (value instanceof byte[] bytes)
			return new BinaryValue(bytes);
		if (value instanceof Boolean bool)
			return new BooleanValue(bool);
		if (value instanceof Temporal temporal)
			return new TemporalValue(temporal);
		if (value instanceof Date date)
			return new TemporalValue(date.toInstant());

		return new OtherValue(value);
	}

	/**
	 * @return the untagged value, or {@code null} for {@link NullValue}
	 */
	@Nullable
	Object asObject();

	default boolean isNull() {
		return this instanceof NullValue;
	}

	record NullValue() implements DbValue {
		@Override
		@Nullable
		public Object asObject() {
			return null;
		}
	}

	record IntegerValue(long value) implements DbValue {
		@Override
		@NonNull
		public Object asObject() {
			return this.value;
		}
	}

	record DecimalValue(@NonNull BigDecimal value) implements DbValue {
		public DecimalValue {
			requireNonNull(value);
		}

		@Override
		@NonNull
		public Object asObject() {
			return this.value;
		}
	}

	record FloatValue(double value) implements DbValue {
		@Override
		@NonNull
		public Object asObject() {
			return this.value;
		}
	}

	record TextValue(@NonNull String value) implements DbValue {
		public TextValue {
			requireNonNull(value);
		}

		@Override
		@NonNull
		public Object asObject() {
			return this.value;
		}
	}

	record BinaryValue(byte @NonNull [] value) implements DbValue {
		public BinaryValue {
			requireNonNull(value);
			value = value.clone();
		}

		@Override
		public byte @NonNull [] value() {
			return this.value.clone();
		}

		@Override
		@NonNull
		public Object asObject() {
			return value();
		}

		@Override
		public boolean equals(Object object) {
			return object instanceof BinaryValue binaryValue && Arrays.equals(this.value, binaryValue.value);
		}

		@Override
		public int hashCode() {
			return Arrays.hashCode(this.value);
		}

		@Override
		@NonNull
		public String toString() {
			return "BinaryValue[length=" + this.value.length + "]";
		}
	}

	record BooleanValue(boolean value) implements DbValue {
		@Override
		@NonNull
		public Object asObject() {
			return this.value;
		}
	}

	record TemporalValue(@NonNull Temporal value) implements DbValue {
		public TemporalValue {
			requireNonNull(value);
		}

		@Override
		@NonNull
		public Object asObject() {
			return this.value;
		}
	}

	record OtherValue(@NonNull Object value) implements DbValue {
		public OtherValue {
			requireNonNull(value);
		}

		@Override
		@NonNull
		public Object asObject() {
			return this.value;
		}
	}
}
