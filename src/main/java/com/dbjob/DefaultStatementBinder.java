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
import java.sql.ParameterMetaData;
import java.sql.PreparedStatement;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Types;
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
import java.util.Optional;
import java.util.TimeZone;

import static java.util.Objects.requireNonNull;

/**
 * Default implementation of {@link StatementBinder}.
 * <p>
 * Legacy {@code java.sql}/{@code java.util} temporal values are coerced to {@code java.time} and bound with JDBC 4.2
 * {@code setObject}, falling back to the legacy setters for drivers that lack support. Locales, currencies, enums and
 * time zones are bound as their string identifiers.
 *
 * @since 1.0.0
 */
@ThreadSafe
class DefaultStatementBinder implements StatementBinder {
	@Override
	public void bindParameter(@NonNull JobContext jobContext,
														@NonNull PreparedStatement preparedStatement,
														@NonNull Integer parameterIndex,
														@Nullable Object parameter,
														@Nullable Integer sqlType) throws SQLException {
		requireNonNull(jobContext);
		requireNonNull(preparedStatement);
		requireNonNull(parameterIndex);

		if (parameter == null) {
			Integer nullSqlType = sqlType != null ? sqlType : determineParameterSqlType(preparedStatement, parameterIndex).orElse(Types.NULL);
			preparedStatement.setNull(parameterIndex, nullSqlType);
			return;
		}

		Object normalizedParameter = normalizeParameter(parameter);

		if (sqlType != null) {
			preparedStatement.setObject(parameterIndex, normalizedParameter, sqlType);
			return;
		}

		if (normalizedParameter instanceof LocalDate localDate) {
			if (!trySetObject(preparedStatement, parameterIndex, localDate, Types.DATE))
				preparedStatement.setDate(parameterIndex, java.sql.Date.valueOf(localDate));

			return;
		}

		if (normalizedParameter instanceof LocalTime localTime) {
			// Some drivers offset LocalTime, a zone-free string is safest
			preparedStatement.setString(parameterIndex, localTime.toString());
			return;
		}

		if (normalizedParameter instanceof LocalDateTime localDateTime) {
			if (!trySetObject(preparedStatement, parameterIndex, localDateTime, Types.TIMESTAMP))
				preparedStatement.setTimestamp(parameterIndex, java.sql.Timestamp.valueOf(localDateTime));

			return;
		}

		if (normalizedParameter instanceof OffsetDateTime offsetDateTime) {
			if (!trySetObject(preparedStatement, parameterIndex, offsetDateTime, Types.TIMESTAMP_WITH_TIMEZONE))
				preparedStatement.setTimestamp(parameterIndex, java.sql.Timestamp.from(offsetDateTime.toInstant()));

			return;
		}

		if (normalizedParameter instanceof Instant instant) {
			Integer targetSqlType = determineParameterSqlType(preparedStatement, parameterIndex).orElse(Types.OTHER);

			if (targetSqlType == Types.TIMESTAMP) {
				LocalDateTime localDateTime = LocalDateTime.ofInstant(instant, jobContext.getTimeZone());

				if (!trySetObject(preparedStatement, parameterIndex, localDateTime, Types.TIMESTAMP))
					preparedStatement.setTimestamp(parameterIndex, java.sql.Timestamp.valueOf(localDateTime));

				return;
			}

			OffsetDateTime offsetDateTime = instant.atZone(jobContext.getTimeZone()).toOffsetDateTime();

			if (!trySetObject(preparedStatement, parameterIndex, offsetDateTime, Types.TIMESTAMP_WITH_TIMEZONE))
				preparedStatement.setTimestamp(parameterIndex, java.sql.Timestamp.from(instant));

			return;
		}

		if (normalizedParameter instanceof OffsetTime offsetTime) {
			if (!trySetObject(preparedStatement, parameterIndex, offsetTime, Types.TIME_WITH_TIMEZONE))
				preparedStatement.setString(parameterIndex, offsetTime.toString());

			return;
		}

		preparedStatement.setObject(parameterIndex, normalizedParameter);
	}

	protected boolean trySetObject(@NonNull PreparedStatement preparedStatement,
																 @NonNull Integer parameterIndex,
																 @Nullable Object parameter,
																 @NonNull Integer sqlType) throws SQLException {
		requireNonNull(preparedStatement);
		requireNonNull(parameterIndex);
		requireNonNull(sqlType);

		try {
			preparedStatement.setObject(parameterIndex, parameter, sqlType);
			return true;
		} catch (SQLFeatureNotSupportedException | AbstractMethodError e) {
			return false;
		}
	}

	@NonNull
	protected Optional<Integer> determineParameterSqlType(@NonNull PreparedStatement preparedStatement,
																												@NonNull Integer parameterIndex) throws SQLException {
		requireNonNull(preparedStatement);
		requireNonNull(parameterIndex);

		try {
			ParameterMetaData parameterMetaData = preparedStatement.getParameterMetaData();

			if (parameterMetaData == null)
				return Optional.empty();

			return Optional.of(parameterMetaData.getParameterType(parameterIndex));
		} catch (SQLFeatureNotSupportedException | AbstractMethodError e) {
			return Optional.empty();
		}
	}

	/**
	 * Massages a parameter into a form the driver binds reliably.
	 *
	 * @param parameter the parameter to (possibly) massage
	 * @return the result of the massaging process
	 */
	@NonNull
	protected Object normalizeParameter(@NonNull Object parameter) {
		requireNonNull(parameter);

		// Coerce to java.time whenever possible
		if (parameter instanceof java.sql.Timestamp timestamp)
			return timestamp.toLocalDateTime();
		if (parameter instanceof java.sql.Date date)
			return date.toLocalDate();
		if (parameter instanceof java.sql.Time time)
			return time.toLocalTime();
		if (parameter instanceof Date date)
			return Instant.ofEpochMilli(date.getTime());
		if (parameter instanceof ZonedDateTime zonedDateTime)
			return zonedDateTime.toOffsetDateTime();
		if (parameter instanceof Locale locale)
			return locale.toLanguageTag();
		if (parameter instanceof Currency currency)
			return currency.getCurrencyCode();
		if (parameter instanceof Enum<?> enumValue)
			return enumValue.name();
		if (parameter instanceof ZoneId zoneId)
			return zoneId.getId();
		if (parameter instanceof TimeZone timeZone)
			return timeZone.getID();

		return parameter;
	}
}
