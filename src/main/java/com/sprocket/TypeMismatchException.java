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

import javax.annotation.concurrent.NotThreadSafe;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * Thrown when a database value cannot be coerced to the Java type a caller asked for.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public class TypeMismatchException extends DatabaseException {
	private final DbValue.@NonNull Kind sourceKind;
	@NonNull
	private final Class<?> targetType;

	/**
	 * Creates a {@code TypeMismatchException}.
	 *
	 * @param value      the value that could not be coerced
	 * @param targetType the type it should have been coerced to
	 * @param cause      the underlying failure, if any (e.g. an {@link ArithmeticException} on overflow)
	 */
	public TypeMismatchException(@NonNull DbValue value,
															 @NonNull Class<?> targetType,
															 @Nullable Throwable cause) {
		super(format("Cannot convert %s to %s", requireNonNull(value), requireNonNull(targetType).getName()), cause);

		this.sourceKind = value.getKind();
		this.targetType = targetType;
	}

	public DbValue.@NonNull Kind getSourceKind() {
		return this.sourceKind;
	}

	@NonNull
	public Class<?> getTargetType() {
		return this.targetType;
	}
}
