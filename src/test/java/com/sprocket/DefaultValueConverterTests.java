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

import org.junit.jupiter.api.Assertions;
import org.junit.jupiter.api.Test;

import java.math.BigDecimal;
import java.math.BigInteger;
import java.time.Instant;
import java.time.LocalDate;
import java.time.LocalDateTime;
import java.time.OffsetDateTime;
import java.time.ZoneOffset;
import java.util.Optional;
import java.util.UUID;

/**
 * @since 1.0.0
 */
public class DefaultValueConverterTests {
	enum Color {
		RED,
		GREEN
	}

	private final ValueConverter valueConverter = ValueConverter.withDefaultConfiguration();

	@Test
	public void testNullIsEmpty() {
		Assertions.assertTrue(this.valueConverter.convert(DbValue.nullValue(), Integer.class).isEmpty(), "NULL should be empty");
		Assertions.assertTrue(this.valueConverter.convert(DbValue.nullValue(), int.class).isEmpty(), "NULL should be empty for primitives too");
	}

	@Test
	public void testLosslessNumericConversions() {
		Assertions.assertEquals(Optional.of(42), this.valueConverter.convert(DbValue.ofInteger(42), int.class), "Wrong int");
		Assertions.assertEquals(Optional.of((short) 42), this.valueConverter.convert(DbValue.ofInteger(42), Short.class), "Wrong short");
		Assertions.assertEquals(Optional.of(3L), this.valueConverter.convert(DbValue.ofDecimal(new BigDecimal("3.00")), Long.class),
				"Integral decimal should convert");
		Assertions.assertEquals(Optional.of(new BigDecimal("1.5")), this.valueConverter.convert(DbValue.ofFloat(1.5), BigDecimal.class),
				"Wrong BigDecimal");
		Assertions.assertEquals(Optional.of(2.5D), this.valueConverter.convert(DbValue.ofDecimal(new BigDecimal("2.5")), double.class),
				"Wrong double");
		Assertions.assertEquals(Optional.of(BigInteger.TEN), this.valueConverter.convert(DbValue.ofInteger(10), BigInteger.class),
				"Wrong BigInteger");
	}

	@Test
	public void testLossyNumericConversionsFail() {
		TypeMismatchException overflow = Assertions.assertThrows(TypeMismatchException.class,
				() -> this.valueConverter.convert(DbValue.ofInteger(Long.MAX_VALUE), Integer.class));
		Assertions.assertEquals(DbValue.Kind.INTEGER, overflow.getSourceKind(), "Wrong source kind");
		Assertions.assertEquals(Integer.class, overflow.getTargetType(), "Wrong target type");

		Assertions.assertThrows(TypeMismatchException.class,
				() -> this.valueConverter.convert(DbValue.ofDecimal(new BigDecimal("3.25")), Long.class));
		Assertions.assertThrows(TypeMismatchException.class, () -> this.valueConverter.convert(DbValue.ofInteger(300), byte.class));
	}

	@Test
	public void testBooleans() {
		Assertions.assertEquals(Optional.of(true), this.valueConverter.convert(DbValue.ofInteger(1), Boolean.class), "1 should be true");
		Assertions.assertEquals(Optional.of(false), this.valueConverter.convert(DbValue.ofInteger(0), boolean.class), "0 should be false");
		Assertions.assertEquals(Optional.of(true), this.valueConverter.convert(DbValue.ofText("TRUE"), Boolean.class), "Wrong text boolean");
		Assertions.assertThrows(TypeMismatchException.class, () -> this.valueConverter.convert(DbValue.ofText("yes"), Boolean.class));
	}

	@Test
	public void testText() {
		Assertions.assertEquals(Optional.of('x'), this.valueConverter.convert(DbValue.ofText("x"), char.class), "Wrong char");
		Assertions.assertEquals(Optional.of(Color.GREEN), this.valueConverter.convert(DbValue.ofText("GREEN"), Color.class), "Wrong enum");
		Assertions.assertThrows(TypeMismatchException.class, () -> this.valueConverter.convert(DbValue.ofText("BLUE"), Color.class));
		Assertions.assertThrows(TypeMismatchException.class, () -> this.valueConverter.convert(DbValue.ofText("abc"), Integer.class));

		UUID uuid = UUID.fromString("123e4567-e89b-12d3-a456-426614174000");
		Assertions.assertEquals(Optional.of(uuid), this.valueConverter.convert(DbValue.ofText(uuid.toString()), UUID.class), "Wrong UUID");
	}

	@Test
	public void testTemporal() {
		LocalDate localDate = LocalDate.of(2024, 2, 29);
		OffsetDateTime offsetDateTime = OffsetDateTime.of(2024, 2, 29, 12, 30, 0, 0, ZoneOffset.ofHours(2));

		Assertions.assertEquals(Optional.of(localDate), this.valueConverter.convert(DbValue.ofDate(localDate), LocalDate.class),
				"Wrong LocalDate");
		Assertions.assertEquals(Optional.of(localDate.atStartOfDay()), this.valueConverter.convert(DbValue.ofDate(localDate), LocalDateTime.class),
				"Wrong LocalDateTime");
		Assertions.assertEquals(Optional.of(Instant.parse("2024-02-29T10:30:00Z")),
				this.valueConverter.convert(DbValue.ofTimestampWithOffset(offsetDateTime), Instant.class), "Wrong Instant");
		Assertions.assertThrows(TypeMismatchException.class, () -> this.valueConverter.convert(DbValue.ofDate(localDate), Instant.class));
	}

	@Test
	public void testPassThrough() {
		DbValue value = DbValue.ofText("hello");

		Assertions.assertEquals(Optional.of(value), this.valueConverter.convert(value, DbValue.class), "DbValue should pass through");
		Assertions.assertEquals(Optional.of("hello"), this.valueConverter.convert(value, Object.class), "Object should pass through");
		Assertions.assertArrayEquals(new byte[]{1, 2}, this.valueConverter.convert(DbValue.ofBytes(new byte[]{1, 2}), byte[].class).orElseThrow(),
				"Wrong bytes");
	}

	@Test
	public void testTypeDefaults() {
		Assertions.assertEquals(0, DefaultValues.defaultValueFor(int.class), "Wrong int default");
		Assertions.assertEquals(0L, DefaultValues.defaultValueFor(Long.class), "Wrong Long default");
		Assertions.assertEquals(false, DefaultValues.defaultValueFor(boolean.class), "Wrong boolean default");
		Assertions.assertEquals('\0', DefaultValues.defaultValueFor(char.class), "Wrong char default");
		Assertions.assertNull(DefaultValues.defaultValueFor(String.class), "Wrong String default");
		Assertions.assertNull(DefaultValues.defaultValueFor(BigDecimal.class), "Wrong BigDecimal default");
	}
}
