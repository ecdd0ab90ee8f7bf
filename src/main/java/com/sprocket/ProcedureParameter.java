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
import java.util.ArrayList;
import java.util.List;
import java.util.Optional;
import java.util.stream.Collectors;

import static java.lang.String.format;
import static java.util.Objects.requireNonNull;

/**
 * A named stored procedure parameter.
 * <p>
 * Names are matched, case-insensitively, to the procedure's declared parameters when the driver can describe them, so
 * parameters may be supplied in any order; otherwise they are bound positionally, in the order they are handed to
 * {@link Database}.  Names also label parameters in logs.  No validation is performed on the name.
 * <p>
 * After a call completes, {@link ParameterDirection#OUTPUT} and {@link ParameterDirection#INPUT_OUTPUT} parameters hold
 * the value the database wrote, available via {@link #getOutputValue()}.  Because of this, a parameter instance should
 * not participate in more than one call at a time.
 *
 * @since 1.0.0
 */
@NotThreadSafe
public final class ProcedureParameter {
	@NonNull
	private final String name;
	@NonNull
	private final ParameterDirection direction;
	@Nullable
	private final Object value;
	@Nullable
	private final Integer sqlType;
	@Nullable
	private volatile DbValue outputValue;

	private ProcedureParameter(@NonNull String name,
														 @NonNull ParameterDirection direction,
														 @Nullable Object value,
														 @Nullable Integer sqlType) {
		requireNonNull(name);
		requireNonNull(direction);

		this.name = name;
		this.direction = direction;
		this.value = value;
		this.sqlType = sqlType;
	}

	/**
	 * Creates an {@link ParameterDirection#INPUT} parameter.
	 *
	 * @param name  the parameter name
	 * @param value the parameter value, passed through as-is
	 * @return an input parameter
	 */
	@NonNull
	public static ProcedureParameter input(@NonNull String name,
																				 @Nullable Object value) {
		requireNonNull(name);
		return new ProcedureParameter(name, ParameterDirection.INPUT, value, null);
	}

	/**
	 * Creates an {@link ParameterDirection#INPUT_OUTPUT} parameter.
	 * <p>
	 * The JDBC type used to register the parameter is inferred from {@code value}.
	 *
	 * @param name  the parameter name
	 * @param value the initial parameter value
	 * @return an input/output parameter
	 */
	@NonNull
	public static ProcedureParameter inputOutput(@NonNull String name,
																							 @Nullable Object value) {
		requireNonNull(name);
		return new ProcedureParameter(name, ParameterDirection.INPUT_OUTPUT, value, null);
	}

	/**
	 * Creates an {@link ParameterDirection#INPUT_OUTPUT} parameter registered with an explicit JDBC type.
	 *
	 * @param name    the parameter name
	 * @param value   the initial parameter value
	 * @param sqlType a {@link java.sql.Types} constant
	 * @return an input/output parameter
	 */
	@NonNull
	public static ProcedureParameter inputOutput(@NonNull String name,
																							 @Nullable Object value,
																							 int sqlType) {
		requireNonNull(name);
		return new ProcedureParameter(name, ParameterDirection.INPUT_OUTPUT, value, sqlType);
	}

	/**
	 * Creates an {@link ParameterDirection#OUTPUT} parameter whose value starts out as {@code null}.
	 *
	 * @param name the parameter name
	 * @return an output parameter
	 */
	@NonNull
	public static ProcedureParameter output(@NonNull String name) {
		requireNonNull(name);
		return new ProcedureParameter(name, ParameterDirection.OUTPUT, null, null);
	}

	/**
	 * Creates an {@link ParameterDirection#OUTPUT} parameter registered with an explicit JDBC type.
	 *
	 * @param name    the parameter name
	 * @param sqlType a {@link java.sql.Types} constant
	 * @return an output parameter
	 */
	@NonNull
	public static ProcedureParameter output(@NonNull String name,
																					int sqlType) {
		requireNonNull(name);
		return new ProcedureParameter(name, ParameterDirection.OUTPUT, null, sqlType);
	}

	@Override
	@NonNull
	public String toString() {
		List<String> components = new ArrayList<>(4);

		components.add(format("name=%s", getName()));
		components.add(format("direction=%s", getDirection().name()));

		if (getDirection().isInput())
			components.add(format("value=%s", getValue().orElse(null)));

		DbValue outputValue = getOutputValue().orElse(null);

		if (outputValue != null)
			components.add(format("outputValue=%s", outputValue));

		return format("%s{%s}", getClass().getSimpleName(), components.stream().collect(Collectors.joining(", ")));
	}

	@NonNull
	public String getName() {
		return this.name;
	}

	@NonNull
	public ParameterDirection getDirection() {
		return this.direction;
	}

	/**
	 * The value sent to the database, if any.
	 *
	 * @return the input value, or empty for {@code null} and for output-only parameters
	 */
	@NonNull
	public Optional<Object> getValue() {
		return Optional.ofNullable(this.value);
	}

	/**
	 * The explicit {@link java.sql.Types} code used to register this parameter for output, if one was given.
	 *
	 * @return the explicit JDBC type, if any
	 */
	@NonNull
	public Optional<Integer> getSqlType() {
		return Optional.ofNullable(this.sqlType);
	}

	/**
	 * The value written by the database during the most recent call, for output parameters.
	 * <p>
	 * A SQL {@code NULL} output is reported as {@link DbValue#nullValue()}; empty means the parameter has not been
	 * through a call yet (or is input-only).
	 *
	 * @return the output value, if available
	 */
	@NonNull
	public Optional<DbValue> getOutputValue() {
		return Optional.ofNullable(this.outputValue);
	}

	/**
	 * The value written by the database during the most recent call, coerced to {@code type}.
	 *
	 * @param type the desired type
	 * @param <T>  the desired type
	 * @return the coerced output value, or empty if there is none or it is SQL {@code NULL}
	 * @throws TypeMismatchException if the output value cannot be coerced to {@code type}
	 */
	@NonNull
	public <T> Optional<T> getOutputValue(@NonNull Class<T> type) {
		requireNonNull(type);

		DbValue outputValue = this.outputValue;

		if (outputValue == null)
			return Optional.empty();

		return ValueConverter.withDefaultConfiguration().convert(outputValue, type);
	}

	void setOutputValue(@NonNull DbValue outputValue) {
		requireNonNull(outputValue);
		this.outputValue = outputValue;
	}
}
