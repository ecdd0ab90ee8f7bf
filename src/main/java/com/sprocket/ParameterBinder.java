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

import java.sql.CallableStatement;
import java.sql.SQLException;

/**
 * Contract for binding {@link ProcedureParameter}s to a {@link CallableStatement} and reading output values back.
 * <p>
 * A production-ready concrete implementation is available via {@link #withDefaultConfiguration()}.
 * Or, implement your own: <pre>{@code  ParameterBinder myImpl = (callContext, callableStatement, parameterIndex, parameter) -> {
 *   if (parameter.getDirection().isOutput())
 *     callableStatement.registerOutParameter(parameterIndex, parameter.getSqlType().orElse(Types.VARCHAR));
 *
 *   if (parameter.getDirection().isInput())
 *     callableStatement.setObject(parameterIndex, parameter.getValue().orElse(null));
 * };}</pre>
 *
 * @since 1.0.0
 */
@FunctionalInterface
public interface ParameterBinder {
	/**
	 * Binds a single parameter to a stored procedure call.
	 * <p>
	 * Input values are bound; {@link ParameterDirection#OUTPUT} and {@link ParameterDirection#INPUT_OUTPUT} parameters are
	 * registered as out parameters.
	 *
	 * @param callContext       current call context
	 * @param callableStatement the statement to bind to
	 * @param parameterIndex    1-based index of the parameter
	 * @param parameter         the parameter to bind
	 * @throws SQLException if an error occurs during binding
	 */
	void bindParameter(@NonNull CallContext callContext,
										 @NonNull CallableStatement callableStatement,
										 int parameterIndex,
										 @NonNull ProcedureParameter parameter) throws SQLException;

	/**
	 * Reads the value the database wrote into an out parameter once the call has completed.
	 *
	 * @param callContext       current call context
	 * @param callableStatement the executed statement
	 * @param parameterIndex    1-based index of the parameter
	 * @param parameter         the out parameter
	 * @return the value, {@link DbValue#nullValue()} for SQL {@code NULL}
	 * @throws SQLException if the value cannot be read
	 */
	@NonNull
	default DbValue readOutputParameter(@NonNull CallContext callContext,
																			@NonNull CallableStatement callableStatement,
																			int parameterIndex,
																			@NonNull ProcedureParameter parameter) throws SQLException {
		return DbValue.of(callableStatement.getObject(parameterIndex));
	}

	/**
	 * Acquires a concrete implementation of this interface with out-of-the-box defaults.
	 *
	 * @return a concrete implementation of this interface with out-of-the-box defaults
	 */
	@NonNull
	static ParameterBinder withDefaultConfiguration() {
		return new DefaultParameterBinder();
	}
}
