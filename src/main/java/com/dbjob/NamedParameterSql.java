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
import java.lang.reflect.Array;
import java.util.ArrayList;
import java.util.Collection;
import java.util.Collections;
import java.util.LinkedHashMap;
import java.util.List;
import java.util.Map;
import java.util.Optional;
import java.util.OptionalDouble;
import java.util.OptionalInt;
import java.util.OptionalLong;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * SQL text with {@code :name} placeholders, split into literal fragments and parameter references.
 * <p>
 * The parser skips quoted strings and identifiers ({@code '...'}, {@code E'...'}, {@code U&'...'}, {@code "..."},
 * backticks and brackets), line and block comments and dollar-quoted bodies. {@code ::} is treated as a cast, not a
 * placeholder. Positional {@code ?} placeholders are rejected.
 *
 * @since 1.0.0
 */
@ThreadSafe
final class NamedParameterSql {
	@NonNull
	private final String originalSql;
	@NonNull
	private final List<@NonNull String> sqlFragments;
	@NonNull
	private final List<@NonNull String> parameterNames;
	@NonNull
	private final List<@NonNull String> distinctParameterNames;

	private NamedParameterSql(@NonNull String originalSql,
														@NonNull List<@NonNull String> sqlFragments,
														@NonNull List<@NonNull String> parameterNames) {
		requireNonNull(originalSql);
		requireNonNull(sqlFragments);
		requireNonNull(parameterNames);

		Map<String, String> distinctParameterNamesByNormalizedName = new LinkedHashMap<>();

		for (String parameterName : parameterNames)
			distinctParameterNamesByNormalizedName.putIfAbsent(JobParameters.normalizeName(parameterName), parameterName);

		this.originalSql = originalSql;
		this.sqlFragments = List.copyOf(sqlFragments);
		this.parameterNames = List.copyOf(parameterNames);
		this.distinctParameterNames = List.copyOf(distinctParameterNamesByNormalizedName.values());
	}

	@NonNull
	static NamedParameterSql parse(@NonNull String sql) {
		requireNonNull(sql);

		List<String> sqlFragments = new ArrayList<>();
		StringBuilder sqlFragment = new StringBuilder(sql.length());
		List<String> parameterNames = new ArrayList<>();

		boolean inSingleQuote = false;
		boolean inSingleQuoteEscapesBackslash = false;
		boolean inDoubleQuote = false;
		boolean inBacktickQuote = false;
		boolean inBracketQuote = false;
		boolean inLineComment = false;
		boolean inBlockComment = false;
		String dollarQuoteDelimiter = null;

		for (int i = 0; i < sql.length(); ) {
			if (dollarQuoteDelimiter != null) {
				if (sql.startsWith(dollarQuoteDelimiter, i)) {
					sqlFragment.append(dollarQuoteDelimiter);
					i += dollarQuoteDelimiter.length();
					dollarQuoteDelimiter = null;
				} else {
					sqlFragment.append(sql.charAt(i));
					++i;
				}

				continue;
			}

			char c = sql.charAt(i);

			if (inLineComment) {
				sqlFragment.append(c);
				++i;

				if (c == '\n' || c == '\r')
					inLineComment = false;

				continue;
			}

			if (inBlockComment) {
				sqlFragment.append(c);

				if (c == '*' && i + 1 < sql.length() && sql.charAt(i + 1) == '/') {
					sqlFragment.append('/');
					i += 2;
					inBlockComment = false;
				} else {
					++i;
				}

				continue;
			}

			if (inSingleQuote) {
				sqlFragment.append(c);

				if (inSingleQuoteEscapesBackslash && c == '\\' && i + 1 < sql.length()) {
					sqlFragment.append(sql.charAt(i + 1));
					i += 2;
					continue;
				}

				if (c == '\'') {
					// Escaped quote: ''
					if (i + 1 < sql.length() && sql.charAt(i + 1) == '\'') {
						sqlFragment.append('\'');
						i += 2;
						continue;
					}

					inSingleQuote = false;
					inSingleQuoteEscapesBackslash = false;
				}

				++i;
				continue;
			}

			if (inDoubleQuote) {
				sqlFragment.append(c);

				if (c == '"') {
					if (i + 1 < sql.length() && sql.charAt(i + 1) == '"') {
						sqlFragment.append('"');
						i += 2;
						continue;
					}

					inDoubleQuote = false;
				}

				++i;
				continue;
			}

			if (inBacktickQuote || inBracketQuote) {
				sqlFragment.append(c);

				if (inBacktickQuote && c == '`')
					inBacktickQuote = false;
				else if (inBracketQuote && c == ']')
					inBracketQuote = false;

				++i;
				continue;
			}

			if (c == '-' && i + 1 < sql.length() && sql.charAt(i + 1) == '-') {
				sqlFragment.append("--");
				i += 2;
				inLineComment = true;
				continue;
			}

			if (c == '/' && i + 1 < sql.length() && sql.charAt(i + 1) == '*') {
				sqlFragment.append("/*");
				i += 2;
				inBlockComment = true;
				continue;
			}

			if ((c == 'U' || c == 'u') && i + 2 < sql.length() && sql.charAt(i + 1) == '&' && sql.charAt(i + 2) == '\'') {
				inSingleQuote = true;
				inSingleQuoteEscapesBackslash = true;
				sqlFragment.append(c).append("&'");
				i += 3;
				continue;
			}

			if ((c == 'E' || c == 'e') && i + 1 < sql.length() && sql.charAt(i + 1) == '\''
					&& (i == 0 || !Character.isJavaIdentifierPart(sql.charAt(i - 1)))) {
				inSingleQuote = true;
				inSingleQuoteEscapesBackslash = true;
				sqlFragment.append(c).append('\'');
				i += 2;
				continue;
			}

			if (c == '\'') {
				inSingleQuote = true;
				inSingleQuoteEscapesBackslash = false;
				sqlFragment.append(c);
				++i;
				continue;
			}

			if (c == '"') {
				inDoubleQuote = true;
				sqlFragment.append(c);
				++i;
				continue;
			}

			if (c == '`') {
				inBacktickQuote = true;
				sqlFragment.append(c);
				++i;
				continue;
			}

			if (c == '[') {
				inBracketQuote = true;
				sqlFragment.append(c);
				++i;
				continue;
			}

			if (c == '$') {
				String delimiter = parseDollarQuoteDelimiter(sql, i);

				if (delimiter != null) {
					sqlFragment.append(delimiter);
					i += delimiter.length();
					dollarQuoteDelimiter = delimiter;
					continue;
				}
			}

			if (c == '?')
				throw new DatabaseException(ErrorKind.CONFIGURATION, JobComponent.COMMAND_BUILDER,
						format("Positional parameters ('?') are not supported, use named parameters (e.g. ':id') instead. SQL: %s", sql));

			if (c == ':' && i + 1 < sql.length() && sql.charAt(i + 1) == ':') {
				// Cast operator
				sqlFragment.append("::");
				i += 2;
				continue;
			}

			if (c == ':' && i + 1 < sql.length() && Character.isJavaIdentifierStart(sql.charAt(i + 1))) {
				int nameStartIndex = i + 1;
				int nameEndIndex = nameStartIndex + 1;

				while (nameEndIndex < sql.length() && Character.isJavaIdentifierPart(sql.charAt(nameEndIndex)))
					++nameEndIndex;

				parameterNames.add(sql.substring(nameStartIndex, nameEndIndex));
				sqlFragments.add(sqlFragment.toString());
				sqlFragment.setLength(0);
				i = nameEndIndex;
				continue;
			}

			sqlFragment.append(c);
			++i;
		}

		sqlFragments.add(sqlFragment.toString());

		return new NamedParameterSql(sql, sqlFragments, parameterNames);
	}

	@Nullable
	private static String parseDollarQuoteDelimiter(@NonNull String sql,
																									int startIndex) {
		requireNonNull(sql);

		int i = startIndex + 1;

		while (i < sql.length()) {
			char c = sql.charAt(i);

			if (c == '$')
				return sql.substring(startIndex, i + 1);

			if (!Character.isJavaIdentifierPart(c))
				return null;

			++i;
		}

		return null;
	}

	/**
	 * Replaces each placeholder with {@code ?}, or with a {@code ?, ?, ...} run for collection values, and collects the
	 * values in positional order.
	 *
	 * @param parameters the bound parameters
	 * @return JDBC-ready SQL and its positional values
	 * @throws DatabaseException of kind {@link ErrorKind#PARAMETER_BINDING} if a placeholder has no parameter, an
	 *                           {@code IN} list is empty, or an output parameter is referenced
	 */
	@NonNull
	Expansion expand(@NonNull JobParameters parameters) {
		requireNonNull(parameters);

		if (this.parameterNames.isEmpty())
			return new Expansion(this.originalSql, List.of());

		StringBuilder sql = new StringBuilder(this.originalSql.length() + this.parameterNames.size() * 2);
		List<String> missingParameterNames = new ArrayList<>();
		List<PositionalValue> values = new ArrayList<>(this.parameterNames.size());

		for (int i = 0; i < this.parameterNames.size(); ++i) {
			String parameterName = this.parameterNames.get(i);
			sql.append(this.sqlFragments.get(i));

			JobParameter parameter = parameters.get(parameterName).orElse(null);

			if (parameter == null) {
				missingParameterNames.add(parameterName);
				sql.append('?');
				continue;
			}

			if (parameter.getDirection() != ParameterDirection.INPUT)
				throw new DatabaseException(ErrorKind.PARAMETER_BINDING, JobComponent.COMMAND_BUILDER,
						format("Parameter '%s' has direction %s, which is only supported for stored procedure commands", parameterName,
								parameter.getDirection().name()));

			Object value = unwrapOptionalValue(parameter.getRawValue());
			List<Object> elements = inListElements(value);

			if (elements == null) {
				sql.append('?');
				values.add(new PositionalValue(parameterName, value, parameter.getSqlType().orElse(null)));
				continue;
			}

			if (elements.isEmpty())
				throw new DatabaseException(ErrorKind.PARAMETER_BINDING, JobComponent.COMMAND_BUILDER,
						format("IN-list parameter '%s' is empty. SQL: %s", parameterName, this.originalSql));

			for (int j = 0; j < elements.size(); ++j) {
				if (j > 0)
					sql.append(", ");

				sql.append('?');
				values.add(new PositionalValue(parameterName, unwrapOptionalValue(elements.get(j)), null));
			}
		}

		sql.append(this.sqlFragments.get(this.sqlFragments.size() - 1));

		if (!missingParameterNames.isEmpty())
			throw new DatabaseException(ErrorKind.PARAMETER_BINDING, JobComponent.COMMAND_BUILDER,
					format("Missing required named parameters %s for SQL: %s", missingParameterNames, this.originalSql));

		return new Expansion(sql.toString(), values);
	}

	@Nullable
	private static List<Object> inListElements(@Nullable Object value) {
		if (value instanceof InListParameter inListParameter)
			return inListParameter.getElements();

		if (value instanceof Collection<?> collection)
			return new ArrayList<>(collection);

		if (value != null && value.getClass().isArray() && !(value instanceof byte[])) {
			int length = Array.getLength(value);
			List<Object> elements = new ArrayList<>(length);

			for (int i = 0; i < length; ++i)
				elements.add(Array.get(value, i));

			return elements;
		}

		return null;
	}

	@Nullable
	static Object unwrapOptionalValue(@Nullable Object value) {
		if (value == null)
			return null;

		if (value instanceof Optional<?> optional)
			return optional.orElse(null);
		if (value instanceof OptionalInt optionalInt)
			return optionalInt.isPresent() ? optionalInt.getAsInt() : null;
		if (value instanceof OptionalLong optionalLong)
			return optionalLong.isPresent() ? optionalLong.getAsLong() : null;
		if (value instanceof OptionalDouble optionalDouble)
			return optionalDouble.isPresent() ? optionalDouble.getAsDouble() : null;

		return value;
	}

	@NonNull
	String getOriginalSql() {
		return this.originalSql;
	}

	@NonNull
	List<@NonNull String> getParameterNames() {
		return this.parameterNames;
	}

	/**
	 * Placeholder names in order of first appearance, deduplicated ignoring case.
	 */
	@NonNull
	List<@NonNull String> getDistinctParameterNames() {
		return this.distinctParameterNames;
	}

	/**
	 * JDBC-ready SQL plus its positional values.
	 */
	@ThreadSafe
	static final class Expansion {
		@NonNull
		private final String sql;
		@NonNull
		private final List<@NonNull PositionalValue> values;

		Expansion(@NonNull String sql,
							@NonNull List<@NonNull PositionalValue> values) {
			this.sql = requireNonNull(sql);
			this.values = Collections.unmodifiableList(requireNonNull(values));
		}

		@NonNull
		String getSql() {
			return this.sql;
		}

		@NonNull
		List<@NonNull PositionalValue> getValues() {
			return this.values;
		}
	}

	/**
	 * One {@code ?} worth of value, remembering which named parameter it came from.
	 */
	@ThreadSafe
	static final class PositionalValue {
		@NonNull
		private final String parameterName;
		@Nullable
		private final Object value;
		@Nullable
		private final Integer sqlType;

		PositionalValue(@NonNull String parameterName,
										@Nullable Object value,
										@Nullable Integer sqlType) {
			this.parameterName = requireNonNull(parameterName);
			this.value = value;
			this.sqlType = sqlType;
		}

		@NonNull
		String getParameterName() {
			return this.parameterName;
		}

		@Nullable
		Object getValue() {
			return this.value;
		}

		@Nullable
		Integer getSqlType() {
			return this.sqlType;
		}
	}
}
