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

package com.sprocket;

import org.jspecify.annotations.NonNull;
import org.jspecify.annotations.Nullable;

import javax.annotation.concurrent.ThreadSafe;
import java.math.BigDecimal;
import java.math.BigInteger;
import java.sql.CallableStatement;
import java.sql.ParameterMetaData;
import java.sql.SQLException;
import java.sql.SQLFeatureNotSupportedException;
import java.sql.Types;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZoneId;
import java.time.ZonedDateTime;
import java.util.Currency;
import java.util.Date;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.TimeZone;

import static java.util.Objects.requireNonNull;

/**
 * Basic implementation of {@link ParameterBinder}.
 *
 * @since 1.0.0
 */
@ThreadSafe
class DefaultParameterBinder implements ParameterBinder {
	@NonNull
	private static final Map<Class<?>, Integer> SQL_TYPES_BY_VALUE_CLASS;

	static {
		SQL_TYPES_BY_VALUE_CLASS = Map.ofEntries(
				Map.entry(String.class, Types.VARCHAR),
				Map.entry(Boolean.class, Types.BOOLEAN),
				Map.entry(Byte.class, Types.TINYINT),
				Map.entry(Short.class, Types.SMALLINT),
				Map.entry(Integer.class, Types.INTEGER),
				Map.entry(Long.class, Types.BIGINT),
				Map.entry(Float.class, Types.REAL),
				Map.entry(Double.class, Types.DOUBLE),
				Map.entry(BigDecimal.class, Types.DECIMAL),
				Map.entry(BigInteger.class, Types.NUMERIC),
				Map.entry(byte[].class, Types.VARBINARY),
				Map.entry(LocalDate.class, Types.DATE),
				Map.entry(LocalTime.class, Types.TIME),
				Map.entry(LocalDateTime.class, Types.TIMESTAMP),
				Map.entry(OffsetDateTime.class, Types.TIMESTAMP_WITH_TIMEZONE),
				Map.entry(Instant.class, Types.TIMESTAMP_WITH_TIMEZONE)
		);
	}

	DefaultParameterBinder() {
		// Nothing to configure
	}

	@Override
	public void bindParameter(@NonNull CallContext callContext,
														@NonNull CallableStatement callableStatement,
														int parameterIndex,
														@NonNull ProcedureParameter parameter) throws SQLException {
		requireNonNull(callContext);
		requireNonNull(callableStatement);
		requireNonNull(parameter);

		Object value = parameter.getValue().orElse(null);

		// A DbValue carries its own payload, e.g. one read back from an earlier call
		if (value instanceof DbValue dbValue)
			value = dbValue.getValue().orElse(null);

		if (parameter.getDirection().isOutput())
			callableStatement.registerOutParameter(parameterIndex, determineOutputSqlType(callableStatement, parameterIndex, parameter, value));

		if (parameter.getDirection().isInput())
			bindInputValue(callableStatement, parameterIndex, value);
	}

	protected void bindInputValue(@NonNull CallableStatement callableStatement,
																int parameterIndex,
																@Nullable Object value) throws SQLException {
		requireNonNull(callableStatement);

		if (value == null) {
			Optional<Integer> sqlType = determineParameterSqlType(callableStatement, parameterIndex);
			callableStatement.setNull(parameterIndex, sqlType.orElse(Types.NULL));
			return;
		}

		Object normalizedValue = normalizeParameter(value);

		if (normalizedValue instanceof LocalDate localDate) {
			if (!trySetObject(callableStatement, parameterIndex, localDate, Types.DATE))
				callableStatement.setDate(parameterIndex, java.sql.Date.valueOf(localDate));

			return;
		}

		if (normalizedValue instanceof LocalTime localTime) {
			if (!trySetObject(callableStatement, parameterIndex, localTime, Types.TIME))
				callableStatement.setTime(parameterIndex, java.sql.Time.valueOf(localTime));

			return;
		}

		if (normalizedValue instanceof LocalDateTime localDateTime) {
			if (!trySetObject(callableStatement, parameterIndex, localDateTime, Types.TIMESTAMP))
				callableStatement.setTimestamp(parameterIndex, java.sql.Timestamp.valueOf(localDateTime));

			return;
		}

		if (normalizedValue instanceof OffsetDateTime offsetDateTime) {
			if (!trySetObject(callableStatement, parameterIndex, offsetDateTime, Types.TIMESTAMP_WITH_TIMEZONE))
				callableStatement.setTimestamp(parameterIndex, java.sql.Timestamp.from(offsetDateTime.toInstant()));

			return;
		}

		if (normalizedValue instanceof Instant instant) {
			if (!trySetObject(callableStatement, parameterIndex, instant, Types.TIMESTAMP_WITH_TIMEZONE))
				callableStatement.setTimestamp(parameterIndex, java.sql.Timestamp.from(instant));

			return;
		}

		// Everything else
		callableStatement.setObject(parameterIndex, normalizedValue);
	}

	/**
	 * The type an out parameter is registered with: explicit type, then driver metadata, then the type implied by the
	 * input value, then {@link Types#OTHER}.
	 */
	protected int determineOutputSqlType(@NonNull CallableStatement callableStatement,
																			 int parameterIndex,
																			 @NonNull ProcedureParameter parameter,
																			 @Nullable Object value) throws SQLException {
		requireNonNull(callableStatement);
		requireNonNull(parameter);

		if (parameter.getSqlType().isPresent())
			return parameter.getSqlType().get();

		Optional<Integer> metadataSqlType = determineParameterSqlType(callableStatement, parameterIndex);

		if (metadataSqlType.isPresent() && metadataSqlType.get() != Types.NULL)
			return metadataSqlType.get();

		if (value != null) {
			Integer valueSqlType = SQL_TYPES_BY_VALUE_CLASS.get(normalizeParameter(value).getClass());

			if (valueSqlType != null)
				return valueSqlType;
		}

		return Types.OTHER;
	}

	protected boolean trySetObject(@NonNull CallableStatement callableStatement,
																 int parameterIndex,
																 @Nullable Object parameter,
																 int sqlType) throws SQLException {
		requireNonNull(callableStatement);

		try {
			callableStatement.setObject(parameterIndex, parameter, sqlType);
			return true;
		} catch (SQLFeatureNotSupportedException | AbstractMethodError e) {
			return false;
		}
	}

	@NonNull
	protected Optional<Integer> determineParameterSqlType(@NonNull CallableStatement callableStatement,
																												int parameterIndex) throws SQLException {
		requireNonNull(callableStatement);

		try {
			ParameterMetaData parameterMetaData = callableStatement.getParameterMetaData();

			if (parameterMetaData == null)
				return Optional.empty();

			return Optional.of(parameterMetaData.getParameterType(parameterIndex));
		} catch (SQLFeatureNotSupportedException | AbstractMethodError e) {
			return Optional.empty();
		}
	}

	/**
	 * Massages a parameter into a JDBC-friendly format if needed.
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

		if (parameter instanceof Character character)
			return character.toString();
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
