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
import java.nio.ByteBuffer;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.LocalTime;
import java.time.OffsetDateTime;
import java.time.ZonedDateTime;
import java.util.Locale;
import java.util.Map;
import java.util.Optional;
import java.util.UUID;

import static java.util.Objects.requireNonNull;

/**
 * Package-private standard implementation of {@link ValueConverter}.
 * <p>
 * Numeric coercions are lossless: narrowing succeeds only when the value fits the target type, and a fractional value
 * never silently becomes an integer.
 *
 * @since 1.0.0
 */
@ThreadSafe
class DefaultValueConverter implements ValueConverter {
	@NonNull
	private static final DefaultValueConverter DEFAULT_INSTANCE;
	@NonNull
	private static final Map<Class<?>, Class<?>> WRAPPER_CLASSES_BY_PRIMITIVE_CLASS;

	static {
		DEFAULT_INSTANCE = new DefaultValueConverter();
		WRAPPER_CLASSES_BY_PRIMITIVE_CLASS = Map.of(
				boolean.class, Boolean.class,
				byte.class, Byte.class,
				short.class, Short.class,
				int.class, Integer.class,
				long.class, Long.class,
				float.class, Float.class,
				double.class, Double.class,
				char.class, Character.class
		);
	}

	@NonNull
	static DefaultValueConverter defaultInstance() {
		return DEFAULT_INSTANCE;
	}

	@NonNull
	static Class<?> boxedClass(@NonNull Class<?> type) {
		requireNonNull(type);
		Class<?> wrapperClass = WRAPPER_CLASSES_BY_PRIMITIVE_CLASS.get(type);
		return wrapperClass == null ? type : wrapperClass;
	}

	@NonNull
	@Override
	@SuppressWarnings("unchecked")
	public <T> Optional<T> convert(@NonNull DbValue value,
																 @NonNull Class<T> targetType) {
		requireNonNull(value);
		requireNonNull(targetType);

		if (targetType == DbValue.class)
			return Optional.of((T) value);

		if (value.isNull())
			return Optional.empty();

		Class<?> boxedTargetType = boxedClass(targetType);
		Object converted;

		try {
			converted = convertPayload(value, boxedTargetType);
		} catch (ArithmeticException | IllegalArgumentException e) {
			throw new TypeMismatchException(value, targetType, e);
		}

		if (converted == null)
			throw new TypeMismatchException(value, targetType, null);

		return Optional.of((T) converted);
	}

	/**
	 * @return the converted value, or {@code null} if there is no conversion from {@code value}'s kind to {@code targetType}
	 */
	@Nullable
	protected Object convertPayload(@NonNull DbValue value,
																	@NonNull Class<?> targetType) {
		requireNonNull(value);
		requireNonNull(targetType);

		Object payload = value.getValue().orElseThrow();

		if (targetType.isInstance(payload))
			return payload;

		switch (value.getKind()) {
			case INTEGER:
			case DECIMAL:
			case FLOAT:
				return convertNumber(payload, targetType);
			case BOOLEAN:
				return null;
			case TEXT:
				return convertText((String) payload, targetType);
			case BYTES:
				if (UUID.class.equals(targetType) && ((byte[]) payload).length == 16) {
					ByteBuffer byteBuffer = ByteBuffer.wrap((byte[]) payload);
					return new UUID(byteBuffer.getLong(), byteBuffer.getLong());
				}

				return null;
			case DATE:
				return convertDate((LocalDate) payload, targetType);
			case TIME:
				return java.sql.Time.class.equals(targetType) ? java.sql.Time.valueOf((LocalTime) payload) : null;
			case TIMESTAMP:
				return convertTimestamp((LocalDateTime) payload, targetType);
			case TIMESTAMP_WITH_OFFSET:
				return convertTimestampWithOffset((OffsetDateTime) payload, targetType);
			case OTHER:
				if (String.class.equals(targetType))
					return payload.toString();

				if (UUID.class.equals(targetType))
					return UUID.fromString(payload.toString());

				return null;
			default:
				return null;
		}
	}

	@Nullable
	protected Object convertNumber(@NonNull Object number,
																 @NonNull Class<?> targetType) {
		requireNonNull(number);
		requireNonNull(targetType);

		if (Boolean.class.equals(targetType)) {
			// Numeric truthiness (0=false, nonzero=true), e.g. MySQL TINYINT(1) and Oracle NUMBER(1) flags
			if (number instanceof Long || number instanceof BigInteger)
				return toBigDecimal(number).signum() != 0;

			return null;
		}

		if (Double.class.equals(targetType))
			return ((Number) number).doubleValue();
		if (Float.class.equals(targetType))
			return ((Number) number).floatValue();

		BigDecimal bigDecimal = toBigDecimal(number);

		if (Long.class.equals(targetType))
			return bigDecimal.longValueExact();
		if (Integer.class.equals(targetType))
			return bigDecimal.intValueExact();
		if (Short.class.equals(targetType))
			return bigDecimal.shortValueExact();
		if (Byte.class.equals(targetType))
			return bigDecimal.byteValueExact();
		if (BigInteger.class.equals(targetType))
			return bigDecimal.toBigIntegerExact();
		if (BigDecimal.class.equals(targetType))
			return bigDecimal;

		return null;
	}

	@Nullable
	protected Object convertText(@NonNull String text,
															 @NonNull Class<?> targetType) {
		requireNonNull(text);
		requireNonNull(targetType);

		if (Character.class.equals(targetType))
			return text.length() == 1 ? text.charAt(0) : null;

		if (Boolean.class.equals(targetType)) {
			String normalizedText = text.trim().toLowerCase(Locale.ROOT);

			if ("true".equals(normalizedText))
				return true;
			if ("false".equals(normalizedText))
				return false;

			return null;
		}

		if (UUID.class.equals(targetType))
			return UUID.fromString(text.trim());

		if (targetType.isEnum())
			return extractEnumValue(targetType, text);

		return null;
	}

	@Nullable
	protected Object convertDate(@NonNull LocalDate localDate,
															 @NonNull Class<?> targetType) {
		requireNonNull(localDate);
		requireNonNull(targetType);

		if (LocalDateTime.class.equals(targetType))
			return localDate.atStartOfDay();
		if (java.sql.Date.class.equals(targetType))
			return java.sql.Date.valueOf(localDate);

		return null;
	}

	@Nullable
	protected Object convertTimestamp(@NonNull LocalDateTime localDateTime,
																		@NonNull Class<?> targetType) {
		requireNonNull(localDateTime);
		requireNonNull(targetType);

		if (LocalDate.class.equals(targetType))
			return localDateTime.toLocalDate();
		if (java.sql.Timestamp.class.equals(targetType))
			return java.sql.Timestamp.valueOf(localDateTime);

		return null;
	}

	@Nullable
	protected Object convertTimestampWithOffset(@NonNull OffsetDateTime offsetDateTime,
																							@NonNull Class<?> targetType) {
		requireNonNull(offsetDateTime);
		requireNonNull(targetType);

		if (Instant.class.equals(targetType))
			return offsetDateTime.toInstant();
		if (ZonedDateTime.class.equals(targetType))
			return offsetDateTime.toZonedDateTime();
		if (java.sql.Timestamp.class.equals(targetType))
			return java.sql.Timestamp.from(offsetDateTime.toInstant());

		return null;
	}

	@SuppressWarnings({"unchecked", "rawtypes"})
	@NonNull
	protected Enum<?> extractEnumValue(@NonNull Class<?> enumClass,
																		 @NonNull String name) {
		requireNonNull(enumClass);
		requireNonNull(name);

		// Throws IllegalArgumentException for unknown names, reported as a type mismatch by the caller
		return Enum.valueOf((Class<? extends Enum>) enumClass, name);
	}

	@NonNull
	private static BigDecimal toBigDecimal(@NonNull Object number) {
		requireNonNull(number);

		if (number instanceof BigDecimal bigDecimal)
			return bigDecimal;
		if (number instanceof BigInteger bigInteger)
			return new BigDecimal(bigInteger);
		if (number instanceof Long || number instanceof Integer || number instanceof Short || number instanceof Byte)
			return BigDecimal.valueOf(((Number) number).longValue());

		// Double/Float: NaN and infinities throw NumberFormatException, an IllegalArgumentException
		return new BigDecimal(number.toString());
	}
}
