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
import java.util.Map;

import static java.util.Objects.requireNonNull;

/**
 * Default values used when a scalar call produces no value: zero for numeric types, {@code false}, {@code '\0'} and
 * {@code null} for everything else.
 *
 * @since 1.0.0
 */
@ThreadSafe
final class DefaultValues {
	@NonNull
	private static final Map<Class<?>, Object> DEFAULT_VALUES_BY_BOXED_CLASS;

	static {
		DEFAULT_VALUES_BY_BOXED_CLASS = Map.of(
				Boolean.class, false,
				Byte.class, (byte) 0,
				Short.class, (short) 0,
				Integer.class, 0,
				Long.class, 0L,
				Float.class, 0F,
				Double.class, 0D,
				Character.class, '\0'
		);
	}

	private DefaultValues() {
		// Non-instantiable
	}

	@Nullable
	@SuppressWarnings("unchecked")
	static <T> T defaultValueFor(@NonNull Class<T> type) {
		requireNonNull(type);
		return (T) DEFAULT_VALUES_BY_BOXED_CLASS.get(DefaultValueConverter.boxedClass(type));
	}
}
