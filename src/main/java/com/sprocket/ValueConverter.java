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

import javax.annotation.concurrent.ThreadSafe;
import java.util.Optional;

/**
 * Contract for coercing a {@link DbValue} to a caller-requested Java type.
 * <p>
 * Used for scalar results, for {@link RecordMapping} fields and for output parameters.  A production-ready
 * implementation is available via {@link #withDefaultConfiguration()}; supply your own to {@link Database.Builder} for
 * application-specific types:
 * <pre>{@code  ValueConverter fallback = ValueConverter.withDefaultConfiguration();
 * ValueConverter moneyAware = new ValueConverter() {
 *   @Override
 *   public <T> Optional<T> convert(@NonNull DbValue value, @NonNull Class<T> targetType) {
 *     if (targetType == Money.class && value.getKind() == DbValue.Kind.DECIMAL)
 *       return Optional.of(targetType.cast(Money.of((BigDecimal) value.getValue().get())));
 *
 *     return fallback.convert(value, targetType);
 *   }
 * };}</pre>
 * Implementations must be thread-safe.
 *
 * @since 1.0.0
 */
@ThreadSafe
@FunctionalInterface
public interface ValueConverter {
	/**
	 * Coerces {@code value} to {@code targetType}.
	 * <p>
	 * Primitive target types such as {@code int.class} are treated as their wrapper types.
	 *
	 * @param value      the value to coerce
	 * @param targetType the desired type
	 * @param <T>        the desired type
	 * @return the coerced value, or {@link Optional#empty()} if {@code value} is SQL {@code NULL}
	 * @throws TypeMismatchException if {@code value} cannot be represented as {@code targetType}
	 */
	@NonNull
	<T> Optional<T> convert(@NonNull DbValue value,
													@NonNull Class<T> targetType);

	/**
	 * Acquires a concrete implementation of this interface with out-of-the-box defaults.
	 * <p>
	 * The returned instance is thread-safe.
	 *
	 * @return a concrete implementation of this interface with out-of-the-box defaults
	 */
	@NonNull
	static ValueConverter withDefaultConfiguration() {
		return DefaultValueConverter.defaultInstance();
	}
}
