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
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.util.Arrays;
import java.util.Objects;
import java.util.Optional;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A single column or output-parameter value read from the database, tagged with its {@link Kind}.
 * <p>
 * The payload type is fixed per kind:
 * <ul>
 *   <li>{@link Kind#NULL} - no payload</li>
 *   <li>{@link Kind#INTEGER} - {@link Long}, or {@link BigInteger} when the value does not fit in a {@code long}</li>
 *   <li>{@link Kind#DECIMAL} - {@link BigDecimal}</li>
 *   <li>{@link Kind#FLOAT} - {@link Double}</li>
 *   <li>{@link Kind#TEXT} - {@link String}</li>
 *   <li>{@link Kind#BYTES} - {@code byte[]} (defensively copied)</li>
 *   <li>{@link Kind#DATE} - {@link LocalDate}</li>
 *   <li>{@link Kind#TIME} - {@link LocalTime}</li>
 *   <li>{@link Kind#TIMESTAMP} - {@link LocalDateTime}</li>
 *   <li>{@link Kind#TIMESTAMP_WITH_OFFSET} - {@link OffsetDateTime}</li>
 *   <li>{@link Kind#BOOLEAN} - {@link Boolean}</li>
 *   <li>{@link Kind#OTHER} - whatever the driver returned (UUIDs, arrays, vendor types)</li>
 * </ul>
 * Use {@link ValueConverter} to turn a value into a specific Java type.
 *
 * @since 1.0.0
 */
@ThreadSafe
public final class DbValue {
	@NonNull
	private static final DbValue NULL_VALUE;

	static {
		NULL_VALUE = new DbValue(Kind.NULL, null);
	}

	@NonNull
	private final Kind kind;
	@Nullable
	private final Object payload;

	private DbValue(@NonNull Kind kind,
									@Nullable Object payload) {
		requireNonNull(kind);

		this.kind = kind;
		this.payload = payload;
	}

	/**
	 * The kinds of value a {@link DbValue} can hold.
	 */
	public enum Kind {
		NULL,
		INTEGER,
		DECIMAL,
		FLOAT,
		TEXT,
		BYTES,
		DATE,
		TIME,
		TIMESTAMP,
		TIMESTAMP_WITH_OFFSET,
		BOOLEAN,
		OTHER
	}

	@NonNull
	public static DbValue nullValue() {
		return NULL_VALUE;
	}

	@NonNull
	public static DbValue ofInteger(long value) {
		return new DbValue(Kind.INTEGER, value);
	}

	@NonNull
	public static DbValue ofInteger(@NonNull BigInteger value) {
		requireNonNull(value);

		if (value.bitLength() < Long.SIZE)
			return ofInteger(value.longValue());

		return new DbValue(Kind.INTEGER, value);
	}

	@NonNull
	public static DbValue ofDecimal(@NonNull BigDecimal value) {
		requireNonNull(value);
		return new DbValue(Kind.DECIMAL, value);
	}

	@NonNull
	public static DbValue ofFloat(double value) {
		return new DbValue(Kind.FLOAT, value);
	}

	@NonNull
	public static DbValue ofText(@NonNull String value) {
		requireNonNull(value);
		return new DbValue(Kind.TEXT, value);
	}

	@NonNull
	public static DbValue ofBytes(byte @NonNull [] value) {
		requireNonNull(value);
		return new DbValue(Kind.BYTES, value.clone());
	}

	@NonNull
	public static DbValue ofDate(@NonNull LocalDate value) {
		requireNonNull(value);
		return new DbValue(Kind.DATE, value);
	}

	@NonNull
	public static DbValue ofTime(@NonNull LocalTime value) {
		requireNonNull(value);
		return new DbValue(Kind.TIME, value);
	}

	@NonNull
	public static DbValue ofTimestamp(@NonNull LocalDateTime value) {
		requireNonNull(value);
		return new DbValue(Kind.TIMESTAMP, value);
	}

	@NonNull
	public static DbValue ofTimestampWithOffset(@NonNull OffsetDateTime value) {
		requireNonNull(value);
		return new DbValue(Kind.TIMESTAMP_WITH_OFFSET, value);
	}

	@NonNull
	public static DbValue ofBoolean(boolean value) {
		return new DbValue(Kind.BOOLEAN, value);
	}

	/**
	 * Wraps a value of a type with no dedicated {@link Kind}.
	 *
	 * @param value the driver-supplied value
	 * @return a value of kind {@link Kind#OTHER}
	 */
	@NonNull
	public static DbValue ofOther(@NonNull Object value) {
		requireNonNull(value);
		return new DbValue(Kind.OTHER, value);
	}

	/**
	 * Classifies an arbitrary Java object, as returned by {@link java.sql.ResultSet#getObject(int)} or
	 * {@link java.sql.CallableStatement#getObject(int)}.
	 *
	 * @param value the object to classify, may be {@code null}
	 * @return the tagged value
	 */
	@NonNull
	public static DbValue of(@Nullable Object value) {
		if (value == null)
			return nullValue();

		if (value instanceof DbValue dbValue)
			return dbValue;
		if (value instanceof Long || value instanceof Integer || value instanceof Short || value instanceof Byte)
			return ofInteger(((Number) value).longValue());
		if (value instanceof BigInteger bigInteger)
			return ofInteger(bigInteger);
		if (value instanceof BigDecimal bigDecimal)
			return ofDecimal(bigDecimal);
		if (value instanceof Double || value instanceof Float)
			return ofFloat(((Number) value).doubleValue());
		if (value instanceof String string)
			return ofText(string);
		if (value instanceof Character character)
			return ofText(character.toString());
		if (value instanceof byte[] bytes)
			return ofBytes(bytes);
		if (value instanceof Boolean b)
			return ofBoolean(b);

		// java.sql.* temporal types extend java.util.Date, so check them before anything else temporal
		if (value instanceof java.sql.Timestamp timestamp)
			return ofTimestamp(timestamp.toLocalDateTime());
		if (value instanceof java.sql.Date date)
			return ofDate(date.toLocalDate());
		if (value instanceof java.sql.Time time)
			return ofTime(time.toLocalTime());

		if (value instanceof LocalDate localDate)
			return ofDate(localDate);
		if (value instanceof LocalTime localTime)
			return ofTime(localTime);
		if (value instanceof LocalDateTime localDateTime)
			return ofTimestamp(localDateTime);
		if (value instanceof OffsetDateTime offsetDateTime)
			return ofTimestampWithOffset(offsetDateTime);

		return ofOther(value);
	}

	@Override
	public boolean equals(Object object) {
		if (this == object)
			return true;

		if (!(object instanceof DbValue))
			return false;

		DbValue dbValue = (DbValue) object;

		if (getKind() != dbValue.getKind())
			return false;

		if (this.payload instanceof byte[] bytes && dbValue.payload instanceof byte[] otherBytes)
			return Arrays.equals(bytes, otherBytes);

		return Objects.equals(this.payload, dbValue.payload);
	}

	@Override
	public int hashCode() {
		if (this.payload instanceof byte[] bytes)
			return Objects.hash(getKind(), Arrays.hashCode(bytes));

		return Objects.hash(getKind(), this.payload);
	}

	@Override
	@NonNull
	public String toString() {
		if (isNull())
			return "NULL";

		if (this.payload instanceof byte[] bytes)
			return format("%s[%d bytes]", getKind().name(), bytes.length);

		return format("%s(%s)", getKind().name(), this.payload);
	}

	@NonNull
	public Kind getKind() {
		return this.kind;
	}

	public boolean isNull() {
		return this.kind == Kind.NULL;
	}

	/**
	 * The payload of this value; for {@link Kind#BYTES} a copy of the bytes.
	 *
	 * @return the payload, or empty for {@link Kind#NULL}
	 */
	@NonNull
	public Optional<Object> getValue() {
		if (this.payload instanceof byte[] bytes)
			return Optional.of(bytes.clone());

		return Optional.ofNullable(this.payload);
	}
}
