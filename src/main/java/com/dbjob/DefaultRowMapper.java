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
import java.lang.reflect.Field;
import java.lang.reflect.InvocationTargetException;
import java.lang.reflect.Method;
import java.lang.reflect.Modifier;
import java.lang.reflect.RecordComponent;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.Blob;
import java.sql.Clob;
import java.sql.SQLException;
import java.sql.Timestamp;
import java.time.DateTimeException;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.OffsetTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.ArrayList;
import java.util.Arrays;
import java.util.Currency;
import java.util.Date;
import java.util.HashMap;
import java.util.IllformedLocaleException;
import java.util.LinkedHashMap;
import java.util.LinkedHashSet;
import java.util.List;
import java.util.Locale;
import java.util.Map;
import java.util.Objects;
import java.util.Set;
import java.util.TimeZone;
import java.util.UUID;
import java.util.concurrent.atomic.AtomicReference;
import java.util.function.Function;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link RowMapper}.
 * <p>
 * Columns are matched to fields in this order: a {@link ColumnMap} rename, a {@link DatabaseColumn} alias, an exact
 * case-insensitive name match, then the snake-case form of the field name ({@code firstName} matches
 * {@code first_name}, {@code address1} matches {@code address_1}). When several columns match a field the first one
 * wins. Unmatched fields keep their default value and unmatched columns are ignored.
 * <p>
 * Plans are cached in a bounded LRU keyed by target type, column schema and column map.
 *
 * @since 1.0.0
 */
@ThreadSafe
class DefaultRowMapper implements RowMapper {
	@NonNull
	private final PlanCache<PlanKey, MappingPlan<?>> planCache;
	@NonNull
	private final List<@NonNull ColumnConverter> columnConverters;
	@NonNull
	private final Locale normalizationLocale;

	DefaultRowMapper(@NonNull Builder builder) {
		requireNonNull(builder);

		this.planCache = new PlanCache<>(builder.planCacheCapacity);
		this.columnConverters = builder.columnConverters;
		this.normalizationLocale = builder.normalizationLocale;
	}

	@Override
	@NonNull
	@SuppressWarnings("unchecked")
	public <T> MappingPlan<T> planFor(@NonNull List<@NonNull DbColumn> columns,
																		@NonNull Class<T> targetType,
																		@NonNull ColumnMap columnMap) {
		requireNonNull(columns);
		requireNonNull(targetType);
		requireNonNull(columnMap);

		PlanKey planKey = new PlanKey(targetType, schemaSignature(columns), columnMap);
		return (MappingPlan<T>) getPlanCache().computeIfAbsent(planKey, ignored -> createPlan(columns, targetType, columnMap));
	}

	@NonNull
	protected <T> MappingPlan<T> createPlan(@NonNull List<@NonNull DbColumn> columns,
																					@NonNull Class<T> targetType,
																					@NonNull ColumnMap columnMap) {
		requireNonNull(columns);
		requireNonNull(targetType);
		requireNonNull(columnMap);

		if (DbRow.class.equals(targetType))
			return new DbRowPlan<>(targetType, columns, columnMap);

		if (Map.class.isAssignableFrom(targetType)) {
			if (!targetType.isAssignableFrom(LinkedHashMap.class))
				throw new DatabaseException(ErrorKind.MAPPING, JobComponent.ROW_MAPPER,
						format("Unsupported map type %s, use Map or LinkedHashMap", targetType.getName()));

			return new MapPlan<>(targetType, columns, columnMap);
		}

		if (StandardTypes.isStandardType(targetType)) {
			if (columns.isEmpty())
				throw new DatabaseException(ErrorKind.MAPPING, JobComponent.ROW_MAPPER,
						format("Unable to map a row without columns to %s", targetType.getName()));

			return new ScalarPlan<>(targetType, columns, columnMap);
		}

		if (Mappable.class.isAssignableFrom(targetType))
			return new MappablePlan<>(targetType, columns, columnMap);

		if (targetType.isRecord())
			return new RecordPlan<>(targetType, columns, columnMap);

		if (targetType.isInterface() || targetType.isArray() || Modifier.isAbstract(targetType.getModifiers()))
			throw new DatabaseException(ErrorKind.MAPPING, JobComponent.ROW_MAPPER,
					format("Unable to map rows to %s, it is not a concrete class", targetType.getName()));

		return new BeanPlan<>(targetType, columns, columnMap);
	}

	/**
	 * For each target field, the index of the column that populates it, or {@code -1}.
	 */
	@NonNull
	protected int[] resolveColumnIndexes(@NonNull List<@NonNull DbColumn> columns,
																			 @NonNull List<@NonNull FieldTarget> fieldTargets,
																			 @NonNull ColumnMap columnMap) {
		requireNonNull(columns);
		requireNonNull(fieldTargets);
		requireNonNull(columnMap);

		int[] columnIndexes = new int[fieldTargets.size()];
		Arrays.fill(columnIndexes, -1);

		Map<String, Integer> fieldIndexesByNormalizedName = new HashMap<>(fieldTargets.size());

		for (int i = 0; i < fieldTargets.size(); ++i)
			fieldIndexesByNormalizedName.putIfAbsent(normalize(fieldTargets.get(i).getName()), i);

		boolean[] renamedColumns = new boolean[columns.size()];

		// Renames first. A renamed column is not considered for any other field.
		for (int columnIndex = 0; columnIndex < columns.size(); ++columnIndex) {
			String fieldName = columnMap.fieldNameFor(columns.get(columnIndex).getName()).orElse(null);

			if (fieldName == null)
				continue;

			renamedColumns[columnIndex] = true;
			Integer fieldIndex = fieldIndexesByNormalizedName.get(normalize(fieldName));

			if (fieldIndex != null && columnIndexes[fieldIndex] == -1)
				columnIndexes[fieldIndex] = columnIndex;
		}

		for (int fieldIndex = 0; fieldIndex < fieldTargets.size(); ++fieldIndex) {
			if (columnIndexes[fieldIndex] != -1)
				continue;

			FieldTarget fieldTarget = fieldTargets.get(fieldIndex);
			List<Set<String>> candidateNameTiers = List.of(fieldTarget.getAliases(), Set.of(normalize(fieldTarget.getName())),
					databaseColumnNamesForPropertyName(fieldTarget.getName()));

			for (Set<String> candidateNames : candidateNameTiers) {
				int columnIndex = firstMatchingColumnIndex(columns, renamedColumns, candidateNames);

				if (columnIndex != -1) {
					columnIndexes[fieldIndex] = columnIndex;
					break;
				}
			}
		}

		return columnIndexes;
	}

	private int firstMatchingColumnIndex(@NonNull List<@NonNull DbColumn> columns,
																			 @NonNull boolean[] renamedColumns,
																			 @NonNull Set<String> candidateNames) {
		if (candidateNames.isEmpty())
			return -1;

		for (int columnIndex = 0; columnIndex < columns.size(); ++columnIndex)
			if (!renamedColumns[columnIndex] && candidateNames.contains(normalizeColumnLabel(columns.get(columnIndex).getName())))
				return columnIndex;

		return -1;
	}

	/**
	 * Converts a raw column value to {@code targetType}, applying the column map converter, then registered
	 * {@link ColumnConverter}s, then built-in coercions.
	 *
	 * @throws ColumnTypeMismatchException if the value cannot be represented as {@code targetType}
	 */
	@Nullable
	protected Object convertColumnValue(@NonNull JobContext jobContext,
																			@NonNull DbColumn column,
																			@Nullable Object value,
																			@NonNull Class<?> targetType,
																			@NonNull String fieldName,
																			@NonNull ColumnMap columnMap) {
		requireNonNull(jobContext);
		requireNonNull(column);
		requireNonNull(targetType);
		requireNonNull(fieldName);
		requireNonNull(columnMap);

		try {
			Function<Object, Object> columnMapConverter = columnMap.converterFor(column.getName()).orElse(null);

			if (value != null && columnMapConverter != null)
				value = columnMapConverter.apply(value);

			if (value == null) {
				if (targetType.isPrimitive())
					throw new ColumnTypeMismatchException(column.getName(), fieldName, targetType,
							format("Column '%s' is NULL but field '%s' has primitive type %s", column.getName(), fieldName, targetType.getName()), null);

				return null;
			}

			for (ColumnConverter columnConverter : getColumnConverters()) {
				if (!columnConverter.appliesTo(targetType))
					continue;

				ColumnConverter.ConversionResult conversionResult = columnConverter.convert(jobContext, column, value, targetType);

				if (conversionResult.isConverted())
					return ensureAssignable(conversionResult.getValue().orElse(null), targetType);
			}

			return ensureAssignable(coerce(jobContext, value, targetType), targetType);
		} catch (ColumnTypeMismatchException e) {
			throw e;
		} catch (Exception e) {
			throw new ColumnTypeMismatchException(column.getName(), fieldName, targetType,
					format("Unable to map column '%s' value of type %s to field '%s' of type %s: %s", column.getName(),
							value == null ? "null" : value.getClass().getName(), fieldName, targetType.getName(), e.getMessage()), e);
		}
	}

	@Nullable
	private Object ensureAssignable(@Nullable Object value,
																	@NonNull Class<?> targetType) {
		if (value != null && !StandardTypes.box(targetType).isInstance(value))
			throw new IllegalArgumentException(format("%s is not assignable to %s", value.getClass().getName(), targetType.getName()));

		return value;
	}

	/**
	 * Built-in coercions between driver values and field types.
	 *
	 * @param jobContext current job context, for its time zone
	 * @param value      the non-null value to coerce
	 * @param type       the field type
	 * @return the coerced value, possibly not assignable to {@code type} if no coercion applied
	 * @throws Exception if a coercion applies but fails
	 */
	@Nullable
	protected Object coerce(@NonNull JobContext jobContext,
													@NonNull Object value,
													@NonNull Class<?> type) throws Exception {
		requireNonNull(jobContext);
		requireNonNull(value);
		requireNonNull(type);

		Class<?> targetType = StandardTypes.box(type);
		ZoneId timeZone = jobContext.getTimeZone();

		if (Object.class.equals(targetType))
			return value;

		if (value instanceof Clob clob)
			value = clob.getSubString(1, (int) clob.length());
		else if (value instanceof Blob blob)
			value = blob.getBytes(1, (int) blob.length());

		if (targetType.isInstance(value))
			return value;

		// Numbers
		if (value instanceof Number number && Number.class.isAssignableFrom(targetType))
			return coerceNumber(number, targetType);

		if (value instanceof String string && Number.class.isAssignableFrom(targetType))
			return coerceNumber(new BigDecimal(string.trim()), targetType);

		if (Boolean.class.equals(targetType)) {
			if (value instanceof Number number)
				return number.intValue() != 0;

			if (value instanceof String string)
				return parseBoolean(string);
		}

		if (Character.class.equals(targetType)) {
			if (value instanceof String string) {
				if (string.length() == 1)
					return string.charAt(0);

				throw new IllegalArgumentException(format("Cannot map String value '%s' to char, expected length 1", string));
			}

			if (value instanceof Number number) {
				int code = number.intValue();

				if (code >= Character.MIN_VALUE && code <= Character.MAX_VALUE)
					return (char) code;

				throw new IllegalArgumentException(format("Numeric value %d is outside valid char range", code));
			}
		}

		// Legacy java.sql values coming from drivers
		if (value instanceof Timestamp timestamp)
			value = timestamp.toLocalDateTime();
		else if (value instanceof java.sql.Date date)
			value = date.toLocalDate();
		else if (value instanceof java.sql.Time time)
			value = time.toLocalTime();
		else if (value instanceof Date date)
			value = date.toInstant();
		else if (value instanceof ZonedDateTime zonedDateTime)
			value = zonedDateTime.toOffsetDateTime();

		if (targetType.isInstance(value))
			return value;

		Object temporal = coerceTemporal(value, targetType, timeZone);

		if (temporal != null)
			return temporal;

		if (UUID.class.equals(targetType)) {
			if (value instanceof byte[] bytes && bytes.length == 16) {
				long mostSignificantBits = 0;
				long leastSignificantBits = 0;

				for (int i = 0; i < 8; ++i)
					mostSignificantBits = (mostSignificantBits << 8) | (bytes[i] & 0xff);
				for (int i = 8; i < 16; ++i)
					leastSignificantBits = (leastSignificantBits << 8) | (bytes[i] & 0xff);

				return new UUID(mostSignificantBits, leastSignificantBits);
			}

			return UUID.fromString(value.toString());
		}

		if (ZoneId.class.isAssignableFrom(targetType))
			return ZoneId.of(value.toString());
		if (TimeZone.class.isAssignableFrom(targetType))
			return timeZoneFromId(value.toString());
		if (Locale.class.equals(targetType))
			return localeFromLanguageTag(value.toString());
		if (Currency.class.equals(targetType))
			return Currency.getInstance(value.toString());
		if (targetType.isEnum())
			return extractEnumValue(targetType, value);

		if (String.class.equals(targetType) && !(value instanceof byte[]))
			return value.toString();

		return value;
	}

	@NonNull
	private Object coerceNumber(@NonNull Number number,
															@NonNull Class<?> targetType) {
		if (Float.class.equals(targetType))
			return number.floatValue();
		if (Double.class.equals(targetType))
			return number.doubleValue();

		// Integral targets are range-checked; ArithmeticException surfaces as a column type mismatch
		if (Byte.class.equals(targetType))
			return toBigDecimal(number).byteValueExact();
		if (Short.class.equals(targetType))
			return toBigDecimal(number).shortValueExact();
		if (Integer.class.equals(targetType))
			return toBigDecimal(number).intValueExact();
		if (Long.class.equals(targetType))
			return toBigDecimal(number).longValueExact();
		if (BigDecimal.class.equals(targetType))
			return toBigDecimal(number);
		if (BigInteger.class.equals(targetType))
			return toBigDecimal(number).toBigIntegerExact();

		return number;
	}

	@NonNull
	private BigDecimal toBigDecimal(@NonNull Number number) {
		if (number instanceof BigDecimal)
			return (BigDecimal) number;
		if (number instanceof BigInteger)
			return new BigDecimal((BigInteger) number);
		if (number instanceof Byte || number instanceof Short || number instanceof Integer || number instanceof Long)
			return BigDecimal.valueOf(number.longValue());

		// NaN and infinities have no BigDecimal form
		if ((number instanceof Double || number instanceof Float) && !Double.isFinite(number.doubleValue()))
			throw new ArithmeticException(format("%s cannot be represented as an exact number", number));

		return new BigDecimal(number.toString());
	}

	@NonNull
	private Boolean parseBoolean(@NonNull String string) {
		String normalized = string.trim().toLowerCase(Locale.ROOT);

		if (Set.of("true", "t", "yes", "y", "1").contains(normalized))
			return true;
		if (Set.of("false", "f", "no", "n", "0").contains(normalized))
			return false;

		throw new IllegalArgumentException(format("Cannot map value '%s' to boolean", string));
	}

	@Nullable
	private Object coerceTemporal(@NonNull Object value,
																@NonNull Class<?> targetType,
																@NonNull ZoneId timeZone) {
		if (value instanceof Instant instant) {
			if (LocalDateTime.class.equals(targetType))
				return instant.atZone(timeZone).toLocalDateTime();
			if (LocalDate.class.equals(targetType))
				return instant.atZone(timeZone).toLocalDate();
			if (OffsetDateTime.class.equals(targetType))
				return instant.atZone(timeZone).toOffsetDateTime();
			if (ZonedDateTime.class.equals(targetType))
				return instant.atZone(timeZone);
			return coerceToLegacy(instant, instant.atZone(timeZone).toLocalDateTime(), targetType);
		}

		if (value instanceof LocalDateTime localDateTime) {
			Instant instant = localDateTime.atZone(timeZone).toInstant();

			if (Instant.class.equals(targetType))
				return instant;
			if (LocalDate.class.equals(targetType))
				return localDateTime.toLocalDate();
			if (LocalTime.class.equals(targetType))
				return localDateTime.toLocalTime();
			if (OffsetDateTime.class.equals(targetType))
				return localDateTime.atZone(timeZone).toOffsetDateTime();
			if (ZonedDateTime.class.equals(targetType))
				return localDateTime.atZone(timeZone);
			return coerceToLegacy(instant, localDateTime, targetType);
		}

		if (value instanceof OffsetDateTime offsetDateTime) {
			if (Instant.class.equals(targetType))
				return offsetDateTime.toInstant();
			if (LocalDateTime.class.equals(targetType))
				return offsetDateTime.atZoneSameInstant(timeZone).toLocalDateTime();
			if (LocalDate.class.equals(targetType))
				return offsetDateTime.atZoneSameInstant(timeZone).toLocalDate();
			if (ZonedDateTime.class.equals(targetType))
				return offsetDateTime.atZoneSameInstant(timeZone);
			return coerceToLegacy(offsetDateTime.toInstant(), offsetDateTime.atZoneSameInstant(timeZone).toLocalDateTime(), targetType);
		}

		if (value instanceof LocalDate localDate) {
			if (LocalDateTime.class.equals(targetType))
				return localDate.atStartOfDay();
			if (Instant.class.equals(targetType))
				return localDate.atStartOfDay(timeZone).toInstant();
			if (java.sql.Date.class.equals(targetType))
				return java.sql.Date.valueOf(localDate);
			return coerceToLegacy(localDate.atStartOfDay(timeZone).toInstant(), localDate.atStartOfDay(), targetType);
		}

		if (value instanceof LocalTime localTime) {
			if (OffsetTime.class.equals(targetType))
				return localTime.atOffset(timeZone.getRules().getOffset(Instant.EPOCH));
			if (java.sql.Time.class.equals(targetType))
				return java.sql.Time.valueOf(localTime);
		}

		if (value instanceof OffsetTime offsetTime) {
			if (LocalTime.class.equals(targetType))
				return offsetTime.toLocalTime();
			if (java.sql.Time.class.equals(targetType))
				return java.sql.Time.valueOf(offsetTime.toLocalTime());
		}

		if (value instanceof String string) {
			if (LocalDate.class.equals(targetType))
				return LocalDate.parse(string.trim());
			if (LocalDateTime.class.equals(targetType))
				return LocalDateTime.parse(string.trim());
			if (LocalTime.class.equals(targetType))
				return LocalTime.parse(string.trim());
			if (OffsetDateTime.class.equals(targetType))
				return OffsetDateTime.parse(string.trim());
			if (Instant.class.equals(targetType))
				return Instant.parse(string.trim());
		}

		return null;
	}

	@Nullable
	private Object coerceToLegacy(@NonNull Instant instant,
																@NonNull LocalDateTime localDateTime,
																@NonNull Class<?> targetType) {
		if (Timestamp.class.equals(targetType))
			return Timestamp.valueOf(localDateTime);
		if (java.sql.Date.class.equals(targetType))
			return java.sql.Date.valueOf(localDateTime.toLocalDate());
		if (Date.class.equals(targetType))
			return Date.from(instant);

		return null;
	}

	/**
	 * Attempts to convert {@code object} to a corresponding value for enum type {@code enumClass}.
	 * <p>
	 * The {@code toString()} value of {@code object} must match an enum constant name exactly.
	 */
	@SuppressWarnings({"unchecked", "rawtypes"})
	@NonNull
	protected Enum<?> extractEnumValue(@NonNull Class<?> enumClass,
																		 @NonNull Object object) {
		requireNonNull(enumClass);
		requireNonNull(object);

		String objectAsString = object.toString();

		try {
			return Enum.valueOf((Class<? extends Enum>) enumClass, objectAsString);
		} catch (IllegalArgumentException e) {
			throw new IllegalArgumentException(format("The value '%s' is not present in enum %s", objectAsString, enumClass.getName()), e);
		}
	}

	@NonNull
	private static TimeZone timeZoneFromId(@NonNull String zoneId) {
		String trimmed = zoneId.trim();
		TimeZone timeZone = TimeZone.getTimeZone(trimmed);

		// TimeZone silently falls back to GMT for unknown IDs
		if ("GMT".equals(timeZone.getID())) {
			String upper = trimmed.toUpperCase(Locale.ROOT);

			if (!upper.equals("GMT") && !upper.equals("UTC") && !upper.equals("UT")) {
				if (upper.startsWith("GMT") || upper.startsWith("UTC") || upper.startsWith("UT"))
					ZoneId.of(upper);
				else
					throw new DateTimeException(format("Unknown time zone '%s'", zoneId));
			}
		}

		return timeZone;
	}

	@NonNull
	private static Locale localeFromLanguageTag(@NonNull String languageTag) {
		String trimmed = languageTag.trim();

		if (trimmed.isEmpty())
			return Locale.ROOT;

		try {
			return new Locale.Builder().setLanguageTag(trimmed).build();
		} catch (IllformedLocaleException e) {
			throw new IllegalArgumentException(format("Unable to convert value '%s' to Locale", languageTag), e);
		}
	}

	@NonNull
	protected String normalizeColumnLabel(@NonNull String columnLabel) {
		requireNonNull(columnLabel);
		return columnLabel.toLowerCase(getNormalizationLocale());
	}

	@NonNull
	private String normalize(@NonNull String name) {
		return name.toLowerCase(getNormalizationLocale());
	}

	/**
	 * Massages a field name to match standard database column names ({@code camelCase} to {@code camel_case}).
	 * <p>
	 * There may be multiple names, for example field {@code address1} maps to both {@code address1} and
	 * {@code address_1}.
	 *
	 * @param propertyName the field name to massage
	 * @return the column names that match the field name
	 */
	@NonNull
	protected Set<String> databaseColumnNamesForPropertyName(@NonNull String propertyName) {
		requireNonNull(propertyName);

		Set<String> normalizedPropertyNames = new LinkedHashSet<>(2);

		// Converts camelCase to camel_case
		String camelCaseRegex = "([a-z])([A-Z]+)";
		String replacement = "$1_$2";

		String normalizedPropertyName = propertyName.replaceAll(camelCaseRegex, replacement).toLowerCase(getNormalizationLocale());
		normalizedPropertyNames.add(normalizedPropertyName);

		// Converts address1 to address_1
		String letterFollowedByNumberRegex = "(\\D)(\\d)";
		normalizedPropertyNames.add(normalizedPropertyName.replaceAll(letterFollowedByNumberRegex, replacement));

		return normalizedPropertyNames;
	}

	@NonNull
	private Set<String> aliasesFor(@Nullable DatabaseColumn databaseColumn) {
		if (databaseColumn == null || databaseColumn.value() == null)
			return Set.of();

		Set<String> aliases = new LinkedHashSet<>();

		for (String alias : databaseColumn.value())
			if (alias != null)
				aliases.add(normalize(alias));

		return aliases;
	}

	@Nullable
	private static Field findField(@NonNull Class<?> type,
																 @NonNull String name) {
		for (Class<?> current = type; current != null && current != Object.class; current = current.getSuperclass()) {
			try {
				return current.getDeclaredField(name);
			} catch (NoSuchFieldException ignored) {
				// Keep walking up the hierarchy
			}
		}

		return null;
	}

	@Nullable
	private static Object defaultValueFor(@NonNull Class<?> type) {
		if (!type.isPrimitive())
			return null;
		if (boolean.class.equals(type))
			return false;
		if (char.class.equals(type))
			return '\0';
		if (byte.class.equals(type))
			return (byte) 0;
		if (short.class.equals(type))
			return (short) 0;
		if (int.class.equals(type))
			return 0;
		if (long.class.equals(type))
			return 0L;
		if (float.class.equals(type))
			return 0F;

		return 0D;
	}

	@NonNull
	private static List<String> schemaSignature(@NonNull List<@NonNull DbColumn> columns) {
		List<String> signature = new ArrayList<>(columns.size());

		for (DbColumn column : columns)
			signature.add(format("%s:%s", column.getName(), column.getJdbcType()));

		return signature;
	}

	@NonNull
	protected PlanCache<PlanKey, MappingPlan<?>> getPlanCache() {
		return this.planCache;
	}

	@NonNull
	protected List<@NonNull ColumnConverter> getColumnConverters() {
		return this.columnConverters;
	}

	@NonNull
	protected Locale getNormalizationLocale() {
		return this.normalizationLocale;
	}

	/**
	 * A named, typed slot on a mapping target.
	 */
	@ThreadSafe
	protected static final class FieldTarget {
		@NonNull
		private final String name;
		@NonNull
		private final Class<?> type;
		@NonNull
		private final Set<@NonNull String> aliases;

		FieldTarget(@NonNull String name,
								@NonNull Class<?> type,
								@NonNull Set<@NonNull String> aliases) {
			this.name = requireNonNull(name);
			this.type = requireNonNull(type);
			this.aliases = Set.copyOf(requireNonNull(aliases));
		}

		@NonNull
		String getName() {
			return this.name;
		}

		@NonNull
		Class<?> getType() {
			return this.type;
		}

		@NonNull
		Set<@NonNull String> getAliases() {
			return this.aliases;
		}
	}

	@ThreadSafe
	protected static final class PlanKey {
		@NonNull
		private final Class<?> targetType;
		@NonNull
		private final List<String> schemaSignature;
		@NonNull
		private final ColumnMap columnMap;

		PlanKey(@NonNull Class<?> targetType,
						@NonNull List<String> schemaSignature,
						@NonNull ColumnMap columnMap) {
			this.targetType = requireNonNull(targetType);
			this.schemaSignature = requireNonNull(schemaSignature);
			this.columnMap = requireNonNull(columnMap);
		}

		@Override
		public boolean equals(Object object) {
			if (this == object)
				return true;

			if (!(object instanceof PlanKey planKey))
				return false;

			return this.targetType.equals(planKey.targetType)
					&& this.schemaSignature.equals(planKey.schemaSignature)
					&& this.columnMap.equals(planKey.columnMap);
		}

		@Override
		public int hashCode() {
			return Objects.hash(this.targetType, this.schemaSignature, this.columnMap);
		}
	}

	private abstract static class AbstractPlan<T> implements MappingPlan<T> {
		@NonNull
		private final Class<T> targetType;
		@NonNull
		private final List<@NonNull DbColumn> columns;
		@NonNull
		private final ColumnMap columnMap;

		AbstractPlan(@NonNull Class<T> targetType,
								 @NonNull List<@NonNull DbColumn> columns,
								 @NonNull ColumnMap columnMap) {
			this.targetType = requireNonNull(targetType);
			this.columns = List.copyOf(requireNonNull(columns));
			this.columnMap = requireNonNull(columnMap);
		}

		@NonNull
		@Override
		public Class<T> getTargetType() {
			return this.targetType;
		}

		@NonNull
		@Override
		public List<@NonNull DbColumn> getColumns() {
			return this.columns;
		}

		@NonNull
		ColumnMap getColumnMap() {
			return this.columnMap;
		}

		@Nullable
		Object readConverted(@NonNull RowCursor rowCursor,
												 int columnIndex) throws SQLException {
			Object value = rowCursor.read(columnIndex);
			Function<Object, Object> converter = getColumnMap().converterFor(getColumns().get(columnIndex).getName()).orElse(null);
			return value == null || converter == null ? value : converter.apply(value);
		}
	}

	@ThreadSafe
	private static final class DbRowPlan<T> extends AbstractPlan<T> {
		DbRowPlan(@NonNull Class<T> targetType,
							@NonNull List<@NonNull DbColumn> columns,
							@NonNull ColumnMap columnMap) {
			super(targetType, columns, columnMap);
		}

		@NonNull
		@Override
		public T map(@NonNull RowCursor rowCursor,
								 @NonNull JobContext jobContext,
								 @NonNull InstanceProvider instanceProvider) throws SQLException {
			List<DbValue> values = new ArrayList<>(getColumns().size());

			for (int i = 0; i < getColumns().size(); ++i)
				values.add(DbValue.of(readConverted(rowCursor, i)));

			return getTargetType().cast(new DbRow(getColumns(), values));
		}
	}

	@ThreadSafe
	private static final class MapPlan<T> extends AbstractPlan<T> {
		MapPlan(@NonNull Class<T> targetType,
						@NonNull List<@NonNull DbColumn> columns,
						@NonNull ColumnMap columnMap) {
			super(targetType, columns, columnMap);
		}

		@NonNull
		@Override
		public T map(@NonNull RowCursor rowCursor,
								 @NonNull JobContext jobContext,
								 @NonNull InstanceProvider instanceProvider) throws SQLException {
			Map<String, Object> row = new LinkedHashMap<>(getColumns().size());

			// Last duplicate wins
			for (int i = 0; i < getColumns().size(); ++i)
				row.put(getColumns().get(i).getName(), readConverted(rowCursor, i));

			return getTargetType().cast(row);
		}
	}

	@ThreadSafe
	private final class ScalarPlan<T> extends AbstractPlan<T> {
		ScalarPlan(@NonNull Class<T> targetType,
							 @NonNull List<@NonNull DbColumn> columns,
							 @NonNull ColumnMap columnMap) {
			super(targetType, columns, columnMap);
		}

		@Nullable
		@Override
		@SuppressWarnings("unchecked")
		public T map(@NonNull RowCursor rowCursor,
								 @NonNull JobContext jobContext,
								 @NonNull InstanceProvider instanceProvider) throws SQLException {
			DbColumn column = getColumns().get(0);
			return (T) convertColumnValue(jobContext, column, rowCursor.read(0), getTargetType(), column.getName(), getColumnMap());
		}
	}

	@ThreadSafe
	private final class RecordPlan<T> extends AbstractPlan<T> {
		@NonNull
		private final List<@NonNull FieldTarget> fieldTargets;
		@NonNull
		private final int[] columnIndexes;

		RecordPlan(@NonNull Class<T> targetType,
							 @NonNull List<@NonNull DbColumn> columns,
							 @NonNull ColumnMap columnMap) {
			super(targetType, columns, columnMap);

			List<FieldTarget> fieldTargets = new ArrayList<>();

			for (RecordComponent recordComponent : targetType.getRecordComponents())
				fieldTargets.add(new FieldTarget(recordComponent.getName(), recordComponent.getType(),
						aliasesFor(recordComponent.getAnnotation(DatabaseColumn.class))));

			this.fieldTargets = List.copyOf(fieldTargets);
			this.columnIndexes = resolveColumnIndexes(columns, this.fieldTargets, columnMap);
		}

		@NonNull
		@Override
		public T map(@NonNull RowCursor rowCursor,
								 @NonNull JobContext jobContext,
								 @NonNull InstanceProvider instanceProvider) throws SQLException {
			Object[] args = new Object[this.fieldTargets.size()];

			for (int i = 0; i < this.fieldTargets.size(); ++i) {
				FieldTarget fieldTarget = this.fieldTargets.get(i);
				int columnIndex = this.columnIndexes[i];

				args[i] = columnIndex == -1
						? defaultValueFor(fieldTarget.getType())
						: convertColumnValue(jobContext, getColumns().get(columnIndex), rowCursor.read(columnIndex), fieldTarget.getType(),
						fieldTarget.getName(), getColumnMap());
			}

			return instanceProvider.provideRecord(jobContext, getTargetType(), args);
		}
	}

	@ThreadSafe
	private final class BeanPlan<T> extends AbstractPlan<T> {
		@NonNull
		private final List<@NonNull FieldTarget> fieldTargets;
		@NonNull
		private final List<@NonNull Method> writeMethods;
		@NonNull
		private final int[] columnIndexes;

		BeanPlan(@NonNull Class<T> targetType,
						 @NonNull List<@NonNull DbColumn> columns,
						 @NonNull ColumnMap columnMap) {
			super(targetType, columns, columnMap);

			BeanInfo beanInfo;

			try {
				beanInfo = Introspector.getBeanInfo(targetType);
			} catch (IntrospectionException e) {
				throw new DatabaseException(ErrorKind.MAPPING, JobComponent.ROW_MAPPER, format("Unable to introspect %s", targetType.getName()), e);
			}

			List<FieldTarget> fieldTargets = new ArrayList<>();
			List<Method> writeMethods = new ArrayList<>();

			for (PropertyDescriptor propertyDescriptor : beanInfo.getPropertyDescriptors()) {
				Method writeMethod = propertyDescriptor.getWriteMethod();

				if (writeMethod == null)
					continue;

				Field field = findField(targetType, propertyDescriptor.getName());
				DatabaseColumn databaseColumn = field == null ? null : field.getAnnotation(DatabaseColumn.class);

				fieldTargets.add(new FieldTarget(propertyDescriptor.getName(), propertyDescriptor.getPropertyType(), aliasesFor(databaseColumn)));
				writeMethods.add(writeMethod);
			}

			this.fieldTargets = List.copyOf(fieldTargets);
			this.writeMethods = List.copyOf(writeMethods);
			this.columnIndexes = resolveColumnIndexes(columns, this.fieldTargets, columnMap);
		}

		@NonNull
		@Override
		public T map(@NonNull RowCursor rowCursor,
								 @NonNull JobContext jobContext,
								 @NonNull InstanceProvider instanceProvider) throws SQLException {
			T instance = instanceProvider.provide(jobContext, getTargetType());

			for (int i = 0; i < this.fieldTargets.size(); ++i) {
				int columnIndex = this.columnIndexes[i];

				if (columnIndex == -1)
					continue;

				FieldTarget fieldTarget = this.fieldTargets.get(i);
				Object value = convertColumnValue(jobContext, getColumns().get(columnIndex), rowCursor.read(columnIndex),
						fieldTarget.getType(), fieldTarget.getName(), getColumnMap());

				try {
					Method writeMethod = this.writeMethods.get(i);
					writeMethod.setAccessible(true);
					writeMethod.invoke(instance, value);
				} catch (InvocationTargetException e) {
					throw new DatabaseException(ErrorKind.MAPPING, JobComponent.ROW_MAPPER,
							format("Unable to set property '%s' of %s", fieldTarget.getName(), getTargetType().getName()), e.getCause());
				} catch (ReflectiveOperationException | RuntimeException e) {
					throw new DatabaseException(ErrorKind.MAPPING, JobComponent.ROW_MAPPER,
							format("Unable to set property '%s' of %s", fieldTarget.getName(), getTargetType().getName()), e);
				}
			}

			return instance;
		}
	}

	@ThreadSafe
	private final class MappablePlan<T> extends AbstractPlan<T> {
		// Field names are only known once an instance exists, so resolution happens on the first row
		@NonNull
		private final AtomicReference<ResolvedFields> resolvedFields;

		MappablePlan(@NonNull Class<T> targetType,
								 @NonNull List<@NonNull DbColumn> columns,
								 @NonNull ColumnMap columnMap) {
			super(targetType, columns, columnMap);
			this.resolvedFields = new AtomicReference<>();
		}

		@NonNull
		@Override
		public T map(@NonNull RowCursor rowCursor,
								 @NonNull JobContext jobContext,
								 @NonNull InstanceProvider instanceProvider) throws SQLException {
			T instance = instanceProvider.provide(jobContext, getTargetType());
			Mappable mappable = (Mappable) instance;
			ResolvedFields resolvedFields = this.resolvedFields.get();

			if (resolvedFields == null) {
				List<FieldTarget> fieldTargets = new ArrayList<>();

				for (String fieldName : mappable.fieldNames())
					fieldTargets.add(new FieldTarget(fieldName, mappable.fieldType(fieldName), Set.of()));

				resolvedFields = new ResolvedFields(fieldTargets, resolveColumnIndexes(getColumns(), fieldTargets, getColumnMap()));
				this.resolvedFields.compareAndSet(null, resolvedFields);
			}

			for (int i = 0; i < resolvedFields.fieldTargets.size(); ++i) {
				int columnIndex = resolvedFields.columnIndexes[i];

				if (columnIndex == -1)
					continue;

				FieldTarget fieldTarget = resolvedFields.fieldTargets.get(i);
				mappable.setField(fieldTarget.getName(), convertColumnValue(jobContext, getColumns().get(columnIndex),
						rowCursor.read(columnIndex), fieldTarget.getType(), fieldTarget.getName(), getColumnMap()));
			}

			return instance;
		}
	}

	private static final class ResolvedFields {
		@NonNull
		private final List<@NonNull FieldTarget> fieldTargets;
		@NonNull
		private final int[] columnIndexes;

		private ResolvedFields(@NonNull List<@NonNull FieldTarget> fieldTargets,
													 @NonNull int[] columnIndexes) {
			this.fieldTargets = List.copyOf(fieldTargets);
			this.columnIndexes = columnIndexes;
		}
	}
}
